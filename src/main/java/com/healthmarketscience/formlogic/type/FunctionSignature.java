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

package com.healthmarketscience.formlogic.type;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Static description of a function callable from a logic expression.  Only
 * the return type participates in type inference, the parameter types are
 * descriptive.
 *
 * @author James Ahlborn
 */
public class FunctionSignature
{
  private final String _name;
  private final List<InferredType> _paramTypes;
  private final boolean _varArgs;
  private final InferredType _returnType;

  public FunctionSignature(String name, InferredType returnType,
                           InferredType... paramTypes) {
    this(name, returnType, false, paramTypes);
  }

  public FunctionSignature(String name, InferredType returnType,
                           boolean varArgs, InferredType... paramTypes) {
    _name = name;
    _returnType = returnType;
    _varArgs = varArgs;
    _paramTypes = Collections.unmodifiableList(Arrays.asList(paramTypes));
  }

  public String getName() {
    return _name;
  }

  public List<InferredType> getParamTypes() {
    return _paramTypes;
  }

  /**
   * @return {@code true} if the last parameter may be repeated
   */
  public boolean isVarArgs() {
    return _varArgs;
  }

  public InferredType getReturnType() {
    return _returnType;
  }

  @Override
  public String toString() {
    return _name + "(" + StringUtils.join(_paramTypes, ", ") +
      (_varArgs ? "..." : "") + "): " + _returnType;
  }
}
