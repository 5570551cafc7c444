/*
Copyright (c) 2018 James Ahlborn

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package com.healthmarketscience.formlogic;

import java.util.Objects;

import com.healthmarketscience.formlogic.type.BuiltinFunctions;
import com.healthmarketscience.formlogic.type.DefaultFieldTypes;
import com.healthmarketscience.formlogic.type.FieldTypeLookup;
import com.healthmarketscience.formlogic.type.FunctionLookup;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Options controlling logic validation.  The setters return this instance
 * so that they can be chained.
 *
 * @author James Ahlborn
 */
public class ValidationOptions
{
  private static final Log LOG = LogFactory.getLog(ValidationOptions.class);

  /** system property which can be used to set the default for whether all
      issues are collected or validation stops at the first one */
  public static final String COLLECT_ALL_ERRORS_PROPERTY =
    "com.healthmarketscience.formlogic.collectAllErrors";

  /** system property which can be used to set the default maximum fieldset
      nesting depth */
  public static final String MAX_FIELD_DEPTH_PROPERTY =
    "com.healthmarketscience.formlogic.maxFieldDepth";

  /** default maximum fieldset nesting depth */
  public static final int DEFAULT_MAX_FIELD_DEPTH = 32;

  private boolean _collectAllErrors = getDefaultCollectAllErrors();
  private int _maxFieldDepth = getDefaultMaxFieldDepth();
  private FunctionLookup _functionLookup = BuiltinFunctions.INSTANCE;
  private FieldTypeLookup _fieldTypeLookup = DefaultFieldTypes.INSTANCE;

  public ValidationOptions() {}

  public boolean isCollectAllErrors() {
    return _collectAllErrors;
  }

  /**
   * If {@code false}, validation stops after the first issue found.
   */
  public ValidationOptions setCollectAllErrors(boolean collectAllErrors) {
    _collectAllErrors = collectAllErrors;
    return this;
  }

  public int getMaxFieldDepth() {
    return _maxFieldDepth;
  }

  public ValidationOptions setMaxFieldDepth(int maxFieldDepth) {
    if(maxFieldDepth < 1) {
      throw new IllegalArgumentException(
          "Invalid max field depth " + maxFieldDepth);
    }
    _maxFieldDepth = maxFieldDepth;
    return this;
  }

  public FunctionLookup getFunctionLookup() {
    return _functionLookup;
  }

  public ValidationOptions setFunctionLookup(FunctionLookup functionLookup) {
    _functionLookup = Objects.requireNonNull(functionLookup, "functionLookup");
    return this;
  }

  public FieldTypeLookup getFieldTypeLookup() {
    return _fieldTypeLookup;
  }

  public ValidationOptions setFieldTypeLookup(FieldTypeLookup fieldTypeLookup) {
    _fieldTypeLookup = Objects.requireNonNull(
        fieldTypeLookup, "fieldTypeLookup");
    return this;
  }

  /**
   * Returns the default collect all errors policy.  This defaults to
   * {@code true}, but can be overridden using the system property
   * {@value #COLLECT_ALL_ERRORS_PROPERTY}.
   */
  public static boolean getDefaultCollectAllErrors()
  {
    String prop = System.getProperty(COLLECT_ALL_ERRORS_PROPERTY);
    if(prop != null) {
      return Boolean.TRUE.toString().equalsIgnoreCase(prop.trim());
    }
    return true;
  }

  /**
   * Returns the default maximum fieldset nesting depth.  This defaults to
   * {@link #DEFAULT_MAX_FIELD_DEPTH}, but can be overridden using the system
   * property {@value #MAX_FIELD_DEPTH_PROPERTY}.
   */
  public static int getDefaultMaxFieldDepth()
  {
    String prop = System.getProperty(MAX_FIELD_DEPTH_PROPERTY);
    if(prop != null) {
      prop = prop.trim();
      if(prop.length() > 0) {
        try {
          int depth = Integer.parseInt(prop);
          if(depth > 0) {
            return depth;
          }
        } catch(NumberFormatException e) {
          // fall through to warning
        }
        LOG.warn("Ignoring invalid " + MAX_FIELD_DEPTH_PROPERTY + " value '" +
                 prop + "'");
      }
    }
    return DEFAULT_MAX_FIELD_DEPTH;
  }
}
