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

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.healthmarketscience.formlogic.expr.Expr;
import com.healthmarketscience.formlogic.expr.ParseResult;
import com.healthmarketscience.formlogic.impl.FieldPaths;
import com.healthmarketscience.formlogic.impl.LogicKeySorter;
import com.healthmarketscience.formlogic.impl.LogicValidatorImpl;
import com.healthmarketscience.formlogic.impl.TypeEnvironmentBuilder;
import com.healthmarketscience.formlogic.impl.TypeInferrer;
import com.healthmarketscience.formlogic.impl.expr.Expressionator;
import com.healthmarketscience.formlogic.type.TypeEnvironment;
import com.healthmarketscience.formlogic.type.TypeInference;

/**
 * Entry points for parsing, type checking and validating the logic
 * expressions of form and bundle definitions.
 * <p>
 * The typical use is a single call to {@link #validateLogic}:
 * <pre>
 *   Form form = new Form("intake")
 *     .addField("age", new Field(FieldType.NUMBER))
 *     .addField("consent", new Field(FieldType.BOOLEAN)
 *               .setVisible("isAdult"))
 *     .addLogicKey(new LogicKey("isAdult", LogicType.BOOLEAN)
 *                  .setExpression("fields.age.value &gt;= 18"));
 *
 *   ValidationResult&lt;Artifact&gt; result = LogicValidator.validateLogic(form);
 *   for(ValidationIssue issue : result.getIssues()) {
 *     System.out.println(issue.getPathString() + ": " + issue.getMessage());
 *   }
 * </pre>
 * All methods are side effect free and may be called concurrently.
 *
 * @author James Ahlborn
 */
public class LogicValidator
{
  private LogicValidator() {}

  /**
   * Parses the given expression text.  Never throws, a syntax error is
   * reported in the result.
   */
  public static ParseResult parseExpression(String exprStr) {
    return Expressionator.parseExpression(exprStr);
  }

  /**
   * @return all the variable paths under which the values of the given
   *         fields may be referenced, e.g. {@code fields.age.value}
   */
  public static Set<String> collectFieldPaths(Map<String,Field> fields) {
    return collectFieldPaths(fields, FieldPaths.FIELDS_PREFIX);
  }

  public static Set<String> collectFieldPaths(Map<String,Field> fields,
                                              String prefix) {
    return newFieldPaths(new ValidationOptions())
      .collectFieldPaths(fields, prefix);
  }

  /**
   * @return the dotted ids of the given fields and all nested fields
   */
  public static Set<String> collectFieldIds(Map<String,Field> fields) {
    return collectFieldIds(fields, "");
  }

  public static Set<String> collectFieldIds(Map<String,Field> fields,
                                            String prefix) {
    return newFieldPaths(new ValidationOptions())
      .collectFieldIds(fields, prefix);
  }

  /**
   * @return the evaluation order of the given logic keys
   */
  public static LogicKeyOrder topologicalSortLogicKeys(LogicSection logic) {
    return LogicKeySorter.sort(logic);
  }

  public static TypeEnvironment buildTypeEnvironment(Artifact artifact) {
    return buildTypeEnvironment(artifact, new ValidationOptions());
  }

  public static TypeEnvironment buildTypeEnvironment(
      Artifact artifact, ValidationOptions options) {
    return new TypeEnvironmentBuilder(options).build(artifact);
  }

  public static TypeEnvironment buildTypeEnvironment(
      Map<String,Field> fields, LogicSection logic) {
    return new TypeEnvironmentBuilder(new ValidationOptions())
      .build(fields, logic);
  }

  public static TypeInference inferExpressionType(Expr expr,
                                                  TypeEnvironment env) {
    return TypeInferrer.infer(expr, env);
  }

  /**
   * Infers the type of the given expression text, unknown if it does not
   * parse.
   */
  public static TypeInference inferExpressionType(String exprStr,
                                                  TypeEnvironment env) {
    return TypeInferrer.infer(exprStr, env);
  }

  public static ValidationResult<Artifact> validateLogic(Artifact artifact) {
    return validateLogic(artifact, new ValidationOptions());
  }

  /**
   * Validates all the logic expressions of the given form or bundle (and,
   * for a bundle, of all its inline artifacts).
   *
   * @return the artifact if no issues were found, otherwise the issues
   * @throws IllegalArgumentException if the artifact is not a form or bundle
   *         or its fieldsets are nested too deeply
   */
  public static ValidationResult<Artifact> validateLogic(
      Artifact artifact, ValidationOptions options) {
    List<ValidationIssue> issues = new LogicValidatorImpl(options)
      .validate(artifact);
    return ValidationResult.of(artifact, issues);
  }

  private static FieldPaths newFieldPaths(ValidationOptions options) {
    return new FieldPaths(options.getFieldTypeLookup(),
                          options.getMaxFieldDepth());
  }
}
