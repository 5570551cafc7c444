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

/**
 * A conditional property value (e.g. a field's "required" flag), either a
 * constant boolean or an expression which must evaluate to a boolean.
 *
 * @author James Ahlborn
 */
public final class CondExpr
{
  public static final CondExpr TRUE = new CondExpr(Boolean.TRUE, null);
  public static final CondExpr FALSE = new CondExpr(Boolean.FALSE, null);

  private final Boolean _literal;
  private final String _expression;

  private CondExpr(Boolean literal, String expression) {
    _literal = literal;
    _expression = expression;
  }

  public static CondExpr of(boolean literal) {
    return (literal ? TRUE : FALSE);
  }

  public static CondExpr of(String expression) {
    return new CondExpr(null, Objects.requireNonNull(expression, "expression"));
  }

  /**
   * @return {@code true} if this is a constant boolean (which needs no
   *         checking), {@code false} if it is an expression
   */
  public boolean isLiteral() {
    return (_literal != null);
  }

  /**
   * @return the constant value, only valid if {@link #isLiteral}
   */
  public boolean getLiteral() {
    if(_literal == null) {
      throw new IllegalStateException("Not a literal: " + _expression);
    }
    return _literal;
  }

  /**
   * @return the expression text, {@code null} if {@link #isLiteral}
   */
  public String getExpression() {
    return _expression;
  }

  @Override
  public int hashCode() {
    return (isLiteral() ? _literal.hashCode() : _expression.hashCode());
  }

  @Override
  public boolean equals(Object o) {
    if(!(o instanceof CondExpr)) {
      return false;
    }
    CondExpr oc = (CondExpr)o;
    return (Objects.equals(_literal, oc._literal) &&
            Objects.equals(_expression, oc._expression));
  }

  @Override
  public String toString() {
    return (isLiteral() ? _literal.toString() : _expression);
  }
}
