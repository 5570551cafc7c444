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

/**
 * Visitor over the node types of an {@link Expr}.
 *
 * @author James Ahlborn
 */
public interface ExprVisitor<T>
{
  public T visitLiteral(Expr.Literal expr);

  public T visitVariable(Expr.Variable expr);

  public T visitParen(Expr.Paren expr);

  public T visitFuncCall(Expr.FuncCall expr);

  public T visitUnary(Expr.Unary expr);

  public T visitBinary(Expr.Binary expr);

  public T visitComparison(Expr.Comparison expr);

  public T visitLogical(Expr.Logical expr);

  public T visitConditional(Expr.Conditional expr);
}
