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

package com.healthmarketscience.formlogic.expr;

import java.util.Collections;
import java.util.Set;

/**
 * Outcome of parsing an expression string.  A successful result holds the
 * parsed {@link Expr} and the ordered set of variable paths it references, a
 * failed result holds the error message and character offset.
 *
 * @author James Ahlborn
 */
public final class ParseResult
{
  private final Expr _expr;
  private final Set<String> _variables;
  private final String _error;
  private final int _errorOffset;

  private ParseResult(Expr expr, Set<String> variables, String error,
                      int errorOffset) {
    _expr = expr;
    _variables = variables;
    _error = error;
    _errorOffset = errorOffset;
  }

  public static ParseResult success(Expr expr) {
    return new ParseResult(expr, Collections.unmodifiableSet(
                               expr.getVariables()), null, -1);
  }

  public static ParseResult failure(ParseException pe) {
    return new ParseResult(null, Collections.<String>emptySet(),
                           pe.getMessage(), pe.getOffset());
  }

  public boolean isSuccess() {
    return (_expr != null);
  }

  /**
   * @return the parsed expression, {@code null} on failure
   */
  public Expr getExpr() {
    return _expr;
  }

  /**
   * @return the de-duplicated variable paths in order of first appearance,
   *         empty on failure
   */
  public Set<String> getVariables() {
    return _variables;
  }

  public String getError() {
    return _error;
  }

  public int getErrorOffset() {
    return _errorOffset;
  }

  @Override
  public String toString() {
    if(isSuccess()) {
      return "ParseResult[" + _expr.toCleanString() + "]";
    }
    return "ParseResult[error: " + _error + "]";
  }
}
