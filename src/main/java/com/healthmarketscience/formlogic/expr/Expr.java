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

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A node of a parsed logic expression.  Expressions are immutable trees,
 * consumers either walk them with an {@link ExprVisitor} or inspect the
 * concrete node classes nested in this class.
 * <p>
 * Every expression can be rendered back to a normalized ("clean") string
 * via {@link #toCleanString} or to a structural string showing each node
 * type via {@link #toDebugString}, e.g. {@code <Binary>{<Literal>{1} +
 * <Literal>{2}}}.
 *
 * @author James Ahlborn
 */
public abstract class Expr
{
  public enum UnaryOp {
    NEG("-", false), POS("+", false), NOT("not", true);

    private final String _str;
    private final boolean _needSpace;

    private UnaryOp(String str, boolean needSpace) {
      _str = str;
      _needSpace = needSpace;
    }

    public boolean needsSpace() {
      return _needSpace;
    }

    @Override
    public String toString() {
      return _str;
    }
  }

  public enum BinaryOp {
    PLUS("+"), MINUS("-"), MULT("*"), DIV("/"), MOD("%");

    private final String _str;

    private BinaryOp(String str) {
      _str = str;
    }

    @Override
    public String toString() {
      return _str;
    }
  }

  public enum CompOp {
    EQ("=="), NE("!="), LT("<"), LTE("<="), GT(">"), GTE(">=");

    private final String _str;

    private CompOp(String str) {
      _str = str;
    }

    @Override
    public String toString() {
      return _str;
    }
  }

  public enum LogOp {
    AND("and"), OR("or");

    private final String _str;

    private LogOp(String str) {
      _str = str;
    }

    @Override
    public String toString() {
      return _str;
    }
  }

  protected Expr() {}

  public String toCleanString() {
    return toString(new StringBuilder(), false).toString();
  }

  public String toDebugString() {
    return toString(new StringBuilder(), true).toString();
  }

  protected StringBuilder toString(StringBuilder sb, boolean isDebug) {
    if(isDebug) {
      sb.append("<").append(getClass().getSimpleName()).append(">{");
    }
    toExprString(sb, isDebug);
    if(isDebug) {
      sb.append("}");
    }
    return sb;
  }

  /**
   * @return the paths of all the variables referenced in this expression,
   *         de-duplicated, in order of first appearance (function names are
   *         not included)
   */
  public Set<String> getVariables() {
    Set<Identifier> identifiers = new LinkedHashSet<Identifier>();
    collectIdentifiers(identifiers);
    Set<String> vars = new LinkedHashSet<String>();
    for(Identifier identifier : identifiers) {
      vars.add(identifier.getPath());
    }
    return vars;
  }

  public abstract <T> T accept(ExprVisitor<T> visitor);

  public abstract void collectIdentifiers(Collection<Identifier> identifiers);

  protected abstract void toExprString(StringBuilder sb, boolean isDebug);

  @Override
  public String toString() {
    return toCleanString();
  }

  private static void exprListToString(
      List<Expr> exprs, String sep, StringBuilder sb, boolean isDebug) {
    Iterator<Expr> iter = exprs.iterator();
    iter.next().toString(sb, isDebug);
    while(iter.hasNext()) {
      sb.append(sep);
      iter.next().toString(sb, isDebug);
    }
  }

  private static void literalStrToString(String str, StringBuilder sb) {
    sb.append("\"");
    for(int i = 0; i < str.length(); ++i) {
      char c = str.charAt(i);
      switch(c) {
      case '"':
        sb.append("\\\"");
        break;
      case '\\':
        sb.append("\\\\");
        break;
      case '\n':
        sb.append("\\n");
        break;
      case '\t':
        sb.append("\\t");
        break;
      default:
        sb.append(c);
      }
    }
    sb.append("\"");
  }


  public static final class Literal extends Expr
  {
    public enum Kind {
      NUMBER, STRING, BOOLEAN, NULL;
    }

    private final Kind _kind;
    private final Object _val;
    private final String _str;

    public Literal(Kind kind, Object val, String str) {
      _kind = kind;
      _val = val;
      _str = str;
    }

    public static Literal ofBoolean(boolean val) {
      return new Literal(Kind.BOOLEAN, val, String.valueOf(val));
    }

    public static Literal ofNull() {
      return new Literal(Kind.NULL, null, "null");
    }

    public static Literal ofString(String val) {
      return new Literal(Kind.STRING, val, val);
    }

    public static Literal ofNumber(Number val, String str) {
      return new Literal(Kind.NUMBER, val, str);
    }

    public Kind getKind() {
      return _kind;
    }

    /**
     * @return the literal value, a Number, String, Boolean or {@code null}
     */
    public Object getValue() {
      return _val;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitLiteral(this);
    }

    @Override
    public void collectIdentifiers(Collection<Identifier> identifiers) {
      // none
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      if(_kind == Kind.STRING) {
        literalStrToString((String)_val, sb);
      } else {
        sb.append(_str);
      }
    }
  }

  public static final class Variable extends Expr
  {
    private final Identifier _identifier;

    public Variable(Identifier identifier) {
      _identifier = identifier;
    }

    public Identifier getIdentifier() {
      return _identifier;
    }

    public String getPath() {
      return _identifier.getPath();
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitVariable(this);
    }

    @Override
    public void collectIdentifiers(Collection<Identifier> identifiers) {
      identifiers.add(_identifier);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(_identifier);
    }
  }

  public static final class Paren extends Expr
  {
    private final Expr _expr;

    public Paren(Expr expr) {
      _expr = expr;
    }

    public Expr getExpr() {
      return _expr;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitParen(this);
    }

    @Override
    public void collectIdentifiers(Collection<Identifier> identifiers) {
      _expr.collectIdentifiers(identifiers);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append("(");
      _expr.toString(sb, isDebug);
      sb.append(")");
    }
  }

  public static final class FuncCall extends Expr
  {
    private final String _name;
    private final List<Expr> _params;

    public FuncCall(String name, List<Expr> params) {
      _name = name;
      _params = Collections.unmodifiableList(params);
    }

    public String getName() {
      return _name;
    }

    public List<Expr> getParams() {
      return _params;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitFuncCall(this);
    }

    @Override
    public void collectIdentifiers(Collection<Identifier> identifiers) {
      for(Expr param : _params) {
        param.collectIdentifiers(identifiers);
      }
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(_name).append("(");

      if(!_params.isEmpty()) {
        exprListToString(_params, ",", sb, isDebug);
      }

      sb.append(")");
    }
  }

  public static final class Unary extends Expr
  {
    private final UnaryOp _op;
    private final Expr _expr;

    public Unary(UnaryOp op, Expr expr) {
      _op = op;
      _expr = expr;
    }

    public UnaryOp getOp() {
      return _op;
    }

    public Expr getExpr() {
      return _expr;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitUnary(this);
    }

    @Override
    public void collectIdentifiers(Collection<Identifier> identifiers) {
      _expr.collectIdentifiers(identifiers);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(_op);
      if(isDebug || _op.needsSpace()) {
        sb.append(" ");
      }
      _expr.toString(sb, isDebug);
    }
  }

  /**
   * Base class for the operators with a left and right operand.
   */
  public static abstract class BaseBinary<O extends Enum<O>> extends Expr
  {
    protected final O _op;
    protected final Expr _left;
    protected final Expr _right;

    protected BaseBinary(O op, Expr left, Expr right) {
      _op = op;
      _left = left;
      _right = right;
    }

    public O getOp() {
      return _op;
    }

    public Expr getLeft() {
      return _left;
    }

    public Expr getRight() {
      return _right;
    }

    @Override
    public void collectIdentifiers(Collection<Identifier> identifiers) {
      _left.collectIdentifiers(identifiers);
      _right.collectIdentifiers(identifiers);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      _left.toString(sb, isDebug);
      sb.append(" ").append(_op).append(" ");
      _right.toString(sb, isDebug);
    }
  }

  public static final class Binary extends BaseBinary<BinaryOp>
  {
    public Binary(BinaryOp op, Expr left, Expr right) {
      super(op, left, right);
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitBinary(this);
    }
  }

  public static final class Comparison extends BaseBinary<CompOp>
  {
    public Comparison(CompOp op, Expr left, Expr right) {
      super(op, left, right);
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitComparison(this);
    }
  }

  public static final class Logical extends BaseBinary<LogOp>
  {
    public Logical(LogOp op, Expr left, Expr right) {
      super(op, left, right);
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitLogical(this);
    }
  }

  /**
   * The {@code cond ? a : b} expression.
   */
  public static final class Conditional extends Expr
  {
    private final Expr _cond;
    private final Expr _thenExpr;
    private final Expr _elseExpr;

    public Conditional(Expr cond, Expr thenExpr, Expr elseExpr) {
      _cond = cond;
      _thenExpr = thenExpr;
      _elseExpr = elseExpr;
    }

    public Expr getCondition() {
      return _cond;
    }

    public Expr getThenExpr() {
      return _thenExpr;
    }

    public Expr getElseExpr() {
      return _elseExpr;
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
      return visitor.visitConditional(this);
    }

    @Override
    public void collectIdentifiers(Collection<Identifier> identifiers) {
      _cond.collectIdentifiers(identifiers);
      _thenExpr.collectIdentifiers(identifiers);
      _elseExpr.collectIdentifiers(identifiers);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      _cond.toString(sb, isDebug);
      sb.append(" ? ");
      _thenExpr.toString(sb, isDebug);
      sb.append(" : ");
      _elseExpr.toString(sb, isDebug);
    }
  }
}
