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

package com.healthmarketscience.formlogic.impl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.healthmarketscience.formlogic.Annex;
import com.healthmarketscience.formlogic.Artifact;
import com.healthmarketscience.formlogic.Bundle;
import com.healthmarketscience.formlogic.BundleContentItem;
import com.healthmarketscience.formlogic.CondExpr;
import com.healthmarketscience.formlogic.Field;
import com.healthmarketscience.formlogic.FieldType;
import com.healthmarketscience.formlogic.Form;
import com.healthmarketscience.formlogic.LogicKey;
import com.healthmarketscience.formlogic.LogicKeyOrder;
import com.healthmarketscience.formlogic.LogicSection;
import com.healthmarketscience.formlogic.LogicType;
import com.healthmarketscience.formlogic.ValidationIssue;
import com.healthmarketscience.formlogic.ValidationOptions;
import com.healthmarketscience.formlogic.expr.Expr;
import com.healthmarketscience.formlogic.expr.ParseResult;
import com.healthmarketscience.formlogic.impl.expr.Expressionator;
import com.healthmarketscience.formlogic.type.InferredType;
import com.healthmarketscience.formlogic.type.TypeConfidence;
import com.healthmarketscience.formlogic.type.TypeEnvironment;
import com.healthmarketscience.formlogic.type.TypeInference;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Validates all the expressions of an artifact.  An instance collects the
 * issues of a single validation call and must not be reused.
 *
 * @author James Ahlborn
 */
public class LogicValidatorImpl
{
  private static final Log LOG = LogFactory.getLog(LogicValidatorImpl.class);

  static final String LOGIC = "logic";
  static final String VALUE = "value";
  static final String FIELDS = "fields";
  static final String ANNEXES = "annexes";
  static final String CONTENTS = "contents";
  static final String ARTIFACT = "artifact";
  static final String INCLUDE = "include";
  static final String REQUIRED = "required";
  static final String VISIBLE = "visible";
  static final String DISABLED = "disabled";

  private final ValidationOptions _options;
  private final TypeEnvironmentBuilder _envBuilder;
  private final List<ValidationIssue> _issues = new ArrayList<ValidationIssue>();
  private boolean _stopped;

  public LogicValidatorImpl(ValidationOptions options) {
    _options = options;
    _envBuilder = new TypeEnvironmentBuilder(options);
  }

  /**
   * @return all the issues found in the given artifact (only the first if
   *         not collecting all errors), empty if its logic is valid
   */
  public List<ValidationIssue> validate(Artifact artifact) {
    validateArtifact(artifact, Collections.emptyList());
    return _issues;
  }

  private void validateArtifact(Artifact artifact, List<Object> prefix) {
    if(artifact instanceof Form) {
      validateForm((Form)artifact, prefix);
    } else if(artifact instanceof Bundle) {
      validateBundle((Bundle)artifact, prefix);
    } else {
      throw new IllegalArgumentException(
          "Can only validate forms and bundles, not " +
          ((artifact != null) ? artifact.getClass().getName() : null));
    }
  }

  private void validateForm(Form form, List<Object> prefix) {
    int startIssues = _issues.size();
    TypeEnvironmentImpl env = _envBuilder.buildForm(form);

    checkCycles(env.getLogicKeyOrder(), prefix);
    checkLogic(form.getLogic(), env, prefix);
    checkFields(form.getFields(), path(prefix, FIELDS), env);
    checkAnnexes(form.getAnnexes(), prefix, env);

    logResult(form, startIssues);
  }

  private void validateBundle(Bundle bundle, List<Object> prefix) {
    int startIssues = _issues.size();
    TypeEnvironmentImpl env = _envBuilder.buildBundle(bundle);

    checkCycles(env.getLogicKeyOrder(), prefix);
    checkLogic(bundle.getLogic(), env, prefix);

    List<BundleContentItem> contents = bundle.getContents();
    for(int i = 0; (i < contents.size()) && !_stopped; ++i) {
      BundleContentItem item = contents.get(i);
      boolean inline = (item.getType() == BundleContentItem.Type.INLINE);
      // the paths of a referenced artifact are not known here, so only the
      // syntax and result type of its include condition can be checked
      checkCondition(item.getInclude(), path(prefix, CONTENTS, i, INCLUDE),
                     env, inline);

      if(!_stopped && inline) {
        validateArtifact(item.getArtifact(),
                         path(prefix, CONTENTS, i, ARTIFACT));
      }
    }

    logResult(bundle, startIssues);
  }

  private void checkCycles(LogicKeyOrder order, List<Object> prefix) {
    for(String name : order.getCyclicKeys()) {
      if(_stopped) {
        return;
      }
      LOG.warn("Logic key '" + name + "' is part of a dependency cycle");
      addIssue(ValidationIssue.circularDependency(
                   path(prefix, LOGIC, name), name));
    }
  }

  private void checkLogic(LogicSection logic, TypeEnvironmentImpl env,
                          List<Object> prefix) {
    LogicKeyOrder order = env.getLogicKeyOrder();

    for(LogicKey key : logic) {
      if(_stopped) {
        return;
      }

      String name = key.getName();
      if(key.getType().isObject()) {
        for(Map.Entry<String,String> e : key.getProperties().entrySet()) {
          if(e.getValue() != null) {
            checkExpression(e.getValue(),
                            path(prefix, LOGIC, name, VALUE, e.getKey()),
                            env, false, true);
          }
        }
        continue;
      }

      String exprStr = key.getExpression();
      if(exprStr == null) {
        continue;
      }

      List<Object> path = path(prefix, LOGIC, name, VALUE);
      Expr expr = checkExpression(exprStr, path, env, false, true);
      if((expr != null) && !_stopped && !order.isCyclic(name)) {
        checkDeclaredType(key, expr, exprStr, path, env);
      }
    }
  }

  private void checkDeclaredType(LogicKey key, Expr expr, String exprStr,
                                 List<Object> path, TypeEnvironment env) {
    TypeInference type = TypeInferrer.infer(expr, env);
    if(type.isKnown() && !isCompatible(key.getType(), type.getType())) {
      addIssue(ValidationIssue.declaredTypeMismatch(
                   path, exprStr, key.getName(),
                   key.getType().getValueType(), type.getType()));
    }
  }

  private void checkFields(Map<String,Field> fields, List<Object> basePath,
                           TypeEnvironment env) {
    for(Map.Entry<String,Field> e : fields.entrySet()) {
      if(_stopped) {
        return;
      }

      List<Object> fieldPath = path(basePath, e.getKey());
      Field field = e.getValue();

      checkCondition(field.getRequired(), path(fieldPath, REQUIRED), env);
      checkCondition(field.getVisible(), path(fieldPath, VISIBLE), env);
      checkCondition(field.getDisabled(), path(fieldPath, DISABLED), env);

      if(field.getType() == FieldType.FIELDSET) {
        checkFields(field.getFields(), path(fieldPath, FIELDS), env);
      }
    }
  }

  private void checkAnnexes(List<Annex> annexes, List<Object> prefix,
                            TypeEnvironment env) {
    for(int i = 0; i < annexes.size(); ++i) {
      Annex annex = annexes.get(i);
      checkCondition(annex.getRequired(), path(prefix, ANNEXES, i, REQUIRED),
                     env);
      checkCondition(annex.getVisible(), path(prefix, ANNEXES, i, VISIBLE),
                     env);
    }
  }

  /**
   * Checks an expression used where a boolean is required.  Constant
   * booleans and unset conditions are always valid.
   */
  private void checkCondition(CondExpr cond, List<Object> path,
                              TypeEnvironment env) {
    checkCondition(cond, path, env, true);
  }

  private void checkCondition(CondExpr cond, List<Object> path,
                              TypeEnvironment env, boolean checkVariables) {
    if((cond == null) || cond.isLiteral() || _stopped) {
      return;
    }
    checkExpression(cond.getExpression(), path, env, true, checkVariables);
  }

  /**
   * Checks the syntax of the given expression and, optionally, that all the
   * variables it references exist and that it results in a boolean.
   *
   * @return the parsed expression, {@code null} if it failed to parse
   */
  private Expr checkExpression(String exprStr, List<Object> path,
                               TypeEnvironment env, boolean booleanContext,
                               boolean checkVariables) {
    if(_stopped) {
      return null;
    }

    ParseResult result = Expressionator.parseExpression(exprStr);
    if(!result.isSuccess()) {
      addIssue(ValidationIssue.syntaxError(path, exprStr, result.getError()));
      return null;
    }

    for(String var : result.getVariables()) {
      if(checkVariables && !env.hasVariable(var)) {
        addIssue(ValidationIssue.unknownVariable(path, exprStr, var));
        if(_stopped) {
          return result.getExpr();
        }
      }
    }

    if(booleanContext) {
      TypeInference type = TypeInferrer.infer(result.getExpr(), env);
      if((type.getConfidence() != TypeConfidence.UNKNOWN) &&
         type.getType().isKnown() &&
         (type.getType() != InferredType.BOOLEAN)) {
        addIssue(ValidationIssue.booleanContext(path, exprStr,
                                                type.getType()));
      }
    }

    return result.getExpr();
  }

  private void addIssue(ValidationIssue issue) {
    _issues.add(issue);
    if(!_options.isCollectAllErrors()) {
      _stopped = true;
    }
  }

  private void logResult(Artifact artifact, int startIssues) {
    if(LOG.isDebugEnabled()) {
      LOG.debug("Validated logic of " +
                artifact.getClass().getSimpleName().toLowerCase() + " '" +
                artifact.getName() + "': " + (_issues.size() - startIssues) +
                " issue(s)");
    }
  }

  /**
   * @return {@code true} if an expression of the given type may be used as
   *         the value of a logic key of the given declared type
   */
  static boolean isCompatible(LogicType declared, InferredType actual) {
    if(!actual.isKnown() || (actual == InferredType.NULL)) {
      return true;
    }
    InferredType expected = declared.getValueType();
    if(expected.isNumeric()) {
      return actual.isNumeric();
    }
    if(expected.isTemporal()) {
      // temporal values are commonly written as ISO strings
      return ((actual == expected) || (actual == InferredType.STRING));
    }
    return (actual == expected);
  }

  private static List<Object> path(List<Object> prefix, Object... elements) {
    List<Object> path = new ArrayList<Object>(prefix.size() + elements.length);
    path.addAll(prefix);
    path.addAll(Arrays.asList(elements));
    return path;
  }
}
