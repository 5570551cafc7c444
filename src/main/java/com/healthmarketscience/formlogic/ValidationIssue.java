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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.healthmarketscience.formlogic.impl.CustomToStringStyle;
import com.healthmarketscience.formlogic.type.InferredType;
import org.apache.commons.lang3.StringUtils;

/**
 * A problem found while validating the logic of an artifact.  The path
 * locates the offending value within the artifact, as a list of property
 * names (Strings) and list indexes (Integers), e.g.
 * {@code [fields, age, visible]} or {@code [annexes, 0, required]}.
 *
 * @author James Ahlborn
 */
public final class ValidationIssue
{
  public enum Kind {
    SYNTAX_ERROR, UNKNOWN_VARIABLE, CIRCULAR_DEPENDENCY, BOOLEAN_CONTEXT,
    DECLARED_TYPE_MISMATCH;
  }

  public enum Severity {
    ERROR, WARNING;
  }

  private final Kind _kind;
  private final Severity _severity;
  private final String _message;
  private final List<Object> _path;
  private final String _expression;
  private final String _variable;
  private final InferredType _expectedType;
  private final InferredType _actualType;

  private ValidationIssue(Kind kind, Severity severity, String message,
                          List<Object> path, String expression,
                          String variable, InferredType expectedType,
                          InferredType actualType) {
    _kind = kind;
    _severity = severity;
    _message = message;
    _path = Collections.unmodifiableList(new ArrayList<Object>(path));
    _expression = expression;
    _variable = variable;
    _expectedType = expectedType;
    _actualType = actualType;
  }

  public static ValidationIssue syntaxError(
      List<Object> path, String expression, String error) {
    return new ValidationIssue(Kind.SYNTAX_ERROR, Severity.ERROR,
                               "Syntax error: " + error, path, expression,
                               null, null, null);
  }

  public static ValidationIssue unknownVariable(
      List<Object> path, String expression, String variable) {
    return new ValidationIssue(Kind.UNKNOWN_VARIABLE, Severity.ERROR,
                               "Unknown variable: \"" + variable + "\"",
                               path, expression, variable, null, null);
  }

  public static ValidationIssue circularDependency(
      List<Object> path, String logicKey) {
    return new ValidationIssue(
        Kind.CIRCULAR_DEPENDENCY, Severity.WARNING,
        "Circular dependency detected: logic key \"" + logicKey +
        "\" is involved in a dependency cycle", path, null, logicKey, null,
        null);
  }

  public static ValidationIssue booleanContext(
      List<Object> path, String expression, InferredType actualType) {
    return new ValidationIssue(
        Kind.BOOLEAN_CONTEXT, Severity.ERROR,
        "Expression must return boolean, but returns " + actualType, path,
        expression, null, InferredType.BOOLEAN, actualType);
  }

  public static ValidationIssue declaredTypeMismatch(
      List<Object> path, String expression, String logicKey,
      InferredType declaredType, InferredType actualType) {
    return new ValidationIssue(
        Kind.DECLARED_TYPE_MISMATCH, Severity.ERROR,
        "Logic key \"" + logicKey + "\" is declared as " + declaredType +
        ", but its expression returns " + actualType, path, expression,
        logicKey, declaredType, actualType);
  }

  public static List<Object> path(Object... elements) {
    return Arrays.asList(elements);
  }

  public Kind getKind() {
    return _kind;
  }

  public Severity getSeverity() {
    return _severity;
  }

  public String getMessage() {
    return _message;
  }

  public List<Object> getPath() {
    return _path;
  }

  /**
   * @return the path rendered with dots, e.g. {@code fields.age.visible}
   */
  public String getPathString() {
    return StringUtils.join(_path, '.');
  }

  /**
   * @return the offending expression text, if any
   */
  public String getExpression() {
    return _expression;
  }

  /**
   * @return the unknown variable or the cyclic logic key, if any
   */
  public String getVariable() {
    return _variable;
  }

  public InferredType getExpectedType() {
    return _expectedType;
  }

  public InferredType getActualType() {
    return _actualType;
  }

  /**
   * @return a copy of this issue whose path is the given prefix followed by
   *         the path of this issue
   */
  public ValidationIssue withPathPrefix(List<Object> prefix) {
    List<Object> path = new ArrayList<Object>(prefix);
    path.addAll(_path);
    return new ValidationIssue(_kind, _severity, _message, path, _expression,
                               _variable, _expectedType, _actualType);
  }

  @Override
  public String toString() {
    return CustomToStringStyle.valueBuilder(this)
      .append("kind", _kind)
      .append("severity", _severity)
      .append("path", getPathString())
      .append("message", _message)
      .toString();
  }
}
