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

import com.healthmarketscience.formlogic.expr.Expr;
import com.healthmarketscience.formlogic.expr.ExprVisitor;
import com.healthmarketscience.formlogic.expr.ParseResult;
import com.healthmarketscience.formlogic.impl.expr.Expressionator;
import com.healthmarketscience.formlogic.type.FunctionSignature;
import com.healthmarketscience.formlogic.type.InferredType;
import com.healthmarketscience.formlogic.type.TypeConfidence;
import com.healthmarketscience.formlogic.type.TypeEnvironment;
import com.healthmarketscience.formlogic.type.TypeInference;

/**
 * Infers the result type of an expression without evaluating it.  The
 * inference is conservative: whenever the type cannot be determined the
 * result is unknown rather than a guess.
 *
 * @author James Ahlborn
 */
public class TypeInferrer implements ExprVisitor<TypeInference>
{
  private final TypeEnvironment _env;

  private TypeInferrer(TypeEnvironment env) {
    _env = env;
  }

  public static TypeInference infer(Expr expr, TypeEnvironment env) {
    return expr.accept(new TypeInferrer(env));
  }

  /**
   * Parses and infers the given expression text.  Text which fails to parse
   * has an unknown type.
   */
  public static TypeInference infer(String exprStr, TypeEnvironment env) {
    ParseResult result = Expressionator.parseExpression(exprStr);
    if(!result.isSuccess()) {
      return TypeInference.unknown("parse error: " + result.getError());
    }
    return infer(result.getExpr(), env);
  }

  @Override
  public TypeInference visitLiteral(Expr.Literal expr) {
    switch(expr.getKind()) {
    case NUMBER:
      return TypeInference.certain(InferredType.NUMBER);
    case STRING:
      return TypeInference.certain(InferredType.STRING);
    case BOOLEAN:
      return TypeInference.certain(InferredType.BOOLEAN);
    case NULL:
      return TypeInference.certain(InferredType.NULL);
    default:
      throw new IllegalStateException("unknown literal kind " + expr.getKind());
    }
  }

  @Override
  public TypeInference visitVariable(Expr.Variable expr) {
    String path = expr.getPath();
    if(!_env.hasVariable(path)) {
      return TypeInference.unknown("undefined variable " + path);
    }
    return _env.getVariableType(path);
  }

  @Override
  public TypeInference visitParen(Expr.Paren expr) {
    return expr.getExpr().accept(this);
  }

  @Override
  public TypeInference visitFuncCall(Expr.FuncCall expr) {
    FunctionSignature func = _env.getFunction(expr.getName());
    if(func == null) {
      return TypeInference.unknown("unknown function " + expr.getName());
    }
    InferredType returnType = func.getReturnType();
    if(!returnType.isKnown()) {
      return TypeInference.unknown(expr.getName() + " has no fixed type");
    }
    return new TypeInference(returnType, TypeConfidence.CERTAIN,
                             "returned by " + expr.getName());
  }

  @Override
  public TypeInference visitUnary(Expr.Unary expr) {
    TypeInference operand = expr.getExpr().accept(this);

    if(expr.getOp() == Expr.UnaryOp.NOT) {
      return new TypeInference(InferredType.BOOLEAN, operand.getConfidence());
    }

    // arithmetic sign
    if(operand.getType().isNumeric()) {
      return operand;
    }
    return TypeInference.unknown("sign applied to " + operand.getType());
  }

  @Override
  public TypeInference visitBinary(Expr.Binary expr) {
    TypeInference left = expr.getLeft().accept(this);
    TypeInference right = expr.getRight().accept(this);
    TypeConfidence conf = TypeConfidence.weakest(
        left.getConfidence(), right.getConfidence());

    if(left.getType().isNumeric() && right.getType().isNumeric()) {
      return new TypeInference(InferredType.NUMBER, conf);
    }

    if((expr.getOp() == Expr.BinaryOp.PLUS) &&
       (left.getType() == InferredType.STRING) &&
       (right.getType() == InferredType.STRING)) {
      return new TypeInference(InferredType.STRING, conf);
    }

    return TypeInference.unknown(
        left.getType() + " " + expr.getOp() + " " + right.getType());
  }

  @Override
  public TypeInference visitComparison(Expr.Comparison expr) {
    // operands are not checked against each other
    return TypeInference.certain(InferredType.BOOLEAN);
  }

  @Override
  public TypeInference visitLogical(Expr.Logical expr) {
    TypeInference left = expr.getLeft().accept(this);
    TypeInference right = expr.getRight().accept(this);
    return new TypeInference(
        InferredType.BOOLEAN, TypeConfidence.weakest(
            left.getConfidence(), right.getConfidence()));
  }

  @Override
  public TypeInference visitConditional(Expr.Conditional expr) {
    TypeInference thenType = expr.getThenExpr().accept(this);
    TypeInference elseType = expr.getElseExpr().accept(this);

    if(thenType.getType() == InferredType.NULL) {
      return elseType;
    }
    if(elseType.getType() == InferredType.NULL) {
      return thenType;
    }
    if(thenType.isKnown() && (thenType.getType() == elseType.getType())) {
      return new TypeInference(thenType.getType(), TypeConfidence.weakest(
                                   thenType.getConfidence(),
                                   elseType.getConfidence()));
    }
    return TypeInference.unknown("branches differ");
  }
}
