/*
Copyright (c) 2016 James Ahlborn

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

package com.healthmarketscience.formlogic.impl.expr;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.healthmarketscience.formlogic.expr.Expr;
import com.healthmarketscience.formlogic.expr.Identifier;
import com.healthmarketscience.formlogic.expr.ParseException;
import com.healthmarketscience.formlogic.expr.ParseResult;
import com.healthmarketscience.formlogic.impl.expr.ExpressionTokenizer.Token;
import com.healthmarketscience.formlogic.impl.expr.ExpressionTokenizer.TokenType;
import org.apache.commons.lang3.StringUtils;


/**
 * Parser for logic expressions.  Precedence, lowest to highest: conditional
 * ({@code ?:}), {@code or}, {@code and}, {@code not}, comparison, additive,
 * multiplicative, unary sign, primary.
 *
 * @author James Ahlborn
 */
public class Expressionator
{
  private enum WordType {
    LOG_OP, NOT, CONST;
  }

  private static final String FUNC_START_DELIM = "(";
  private static final String OPEN_PAREN = "(";
  private static final String CLOSE_PAREN = ")";
  private static final String FUNC_PARAM_SEP = ",";
  private static final String MEMBER_SEP = ".";
  private static final String COND_DELIM = "?";
  private static final String COND_ELSE_DELIM = ":";

  private static final String TRUE_STR = "true";
  private static final String FALSE_STR = "false";
  private static final String NULL_STR = "null";

  /** maximum depth of the parsed expression tree, bounds the recursion of
      the parser and of the expression walkers */
  public static final int MAX_NESTING_DEPTH = 500;

  private static final Map<String,WordType> WORD_TYPES =
    new HashMap<String,WordType>();

  static {
    setWordType(WordType.LOG_OP, "and", "or");
    setWordType(WordType.NOT, "not");
    setWordType(WordType.CONST, TRUE_STR, FALSE_STR, NULL_STR);
  }

  private static final Map<String,Expr.LogOp> LOG_OPS =
    new HashMap<String,Expr.LogOp>();
  private static final Map<String,Expr.CompOp> COMP_OPS =
    new HashMap<String,Expr.CompOp>();
  private static final Map<String,Expr.BinaryOp> ADD_OPS =
    new HashMap<String,Expr.BinaryOp>();
  private static final Map<String,Expr.BinaryOp> MULT_OPS =
    new HashMap<String,Expr.BinaryOp>();
  private static final Map<String,Expr.UnaryOp> SIGN_OPS =
    new HashMap<String,Expr.UnaryOp>();

  static {
    LOG_OPS.put("and", Expr.LogOp.AND);
    LOG_OPS.put("&&", Expr.LogOp.AND);
    LOG_OPS.put("or", Expr.LogOp.OR);
    LOG_OPS.put("||", Expr.LogOp.OR);

    for(Expr.CompOp op : Expr.CompOp.values()) {
      COMP_OPS.put(op.toString(), op);
    }

    ADD_OPS.put("+", Expr.BinaryOp.PLUS);
    ADD_OPS.put("-", Expr.BinaryOp.MINUS);
    MULT_OPS.put("*", Expr.BinaryOp.MULT);
    MULT_OPS.put("/", Expr.BinaryOp.DIV);
    MULT_OPS.put("%", Expr.BinaryOp.MOD);

    SIGN_OPS.put("-", Expr.UnaryOp.NEG);
    SIGN_OPS.put("+", Expr.UnaryOp.POS);
  }

  private Expressionator() {}

  /**
   * Parses the given expression, returning either the expression and the
   * variables it references or the parse error.  Never throws.
   */
  public static ParseResult parseExpression(String exprStr) {
    try {
      return ParseResult.success(parse(exprStr));
    } catch(ParseException pe) {
      return ParseResult.failure(pe);
    }
  }

  /**
   * Parses the given expression.
   *
   * @throws ParseException if the expression is not valid
   */
  public static Expr parse(String exprStr) {

    if(StringUtils.isBlank(exprStr)) {
      throw new ParseException("Empty expression", 0);
    }

    List<Token> tokens = ExpressionTokenizer.tokenize(exprStr);

    TokBuf buf = new TokBuf(tokens, exprStr.length());
    Expr expr = parseConditional(buf);

    if(buf.hasNext()) {
      throw buf.unexpected(buf.next());
    }

    return expr;
  }

  private static Expr parseConditional(TokBuf buf) {
    int depth = buf.enter();
    Expr cond = parseOr(buf);

    if(!buf.nextIs(TokenType.DELIM, COND_DELIM)) {
      buf.restore(depth);
      return cond;
    }
    buf.next();

    Expr thenExpr = parseConditional(buf);
    buf.expect(TokenType.DELIM, COND_ELSE_DELIM);
    Expr elseExpr = parseConditional(buf);

    buf.restore(depth);
    return new Expr.Conditional(cond, thenExpr, elseExpr);
  }

  private static Expr parseOr(TokBuf buf) {
    int depth = buf.getDepth();
    Expr left = parseAnd(buf);
    while(buf.nextIsLogOp(Expr.LogOp.OR)) {
      buf.next();
      buf.enter();
      left = new Expr.Logical(Expr.LogOp.OR, left, parseAnd(buf));
    }
    buf.restore(depth);
    return left;
  }

  private static Expr parseAnd(TokBuf buf) {
    int depth = buf.getDepth();
    Expr left = parseNot(buf);
    while(buf.nextIsLogOp(Expr.LogOp.AND)) {
      buf.next();
      buf.enter();
      left = new Expr.Logical(Expr.LogOp.AND, left, parseNot(buf));
    }
    buf.restore(depth);
    return left;
  }

  private static Expr parseNot(TokBuf buf) {
    Token t = buf.peekNext();
    if((t != null) &&
       ((getWordType(t) == WordType.NOT) || t.is(TokenType.OP, "!"))) {
      buf.next();
      int depth = buf.enter();
      Expr operand = parseNot(buf);
      buf.restore(depth);
      return new Expr.Unary(Expr.UnaryOp.NOT, operand);
    }
    return parseComparison(buf);
  }

  private static Expr parseComparison(TokBuf buf) {
    int depth = buf.getDepth();
    Expr left = parseAdditive(buf);
    Expr.CompOp op = null;
    while((op = buf.nextOp(COMP_OPS)) != null) {
      buf.next();
      buf.enter();
      left = new Expr.Comparison(op, left, parseAdditive(buf));
    }
    buf.restore(depth);
    return left;
  }

  private static Expr parseAdditive(TokBuf buf) {
    int depth = buf.getDepth();
    Expr left = parseMultiplicative(buf);
    Expr.BinaryOp op = null;
    while((op = buf.nextOp(ADD_OPS)) != null) {
      buf.next();
      buf.enter();
      left = new Expr.Binary(op, left, parseMultiplicative(buf));
    }
    buf.restore(depth);
    return left;
  }

  private static Expr parseMultiplicative(TokBuf buf) {
    int depth = buf.getDepth();
    Expr left = parseUnary(buf);
    Expr.BinaryOp op = null;
    while((op = buf.nextOp(MULT_OPS)) != null) {
      buf.next();
      buf.enter();
      left = new Expr.Binary(op, left, parseUnary(buf));
    }
    buf.restore(depth);
    return left;
  }

  private static Expr parseUnary(TokBuf buf) {
    Expr.UnaryOp op = buf.nextOp(SIGN_OPS);
    if(op != null) {
      buf.next();
      int depth = buf.enter();
      Expr operand = parseUnary(buf);
      buf.restore(depth);
      return new Expr.Unary(op, operand);
    }
    return parsePrimary(buf);
  }

  private static Expr parsePrimary(TokBuf buf) {
    Token t = buf.next();

    switch(t.getType()) {
    case LITERAL:
      if(t.isStringLiteral()) {
        return Expr.Literal.ofString((String)t.getValue());
      }
      return Expr.Literal.ofNumber((Number)t.getValue(), t.getValueStr());

    case DELIM:
      if(OPEN_PAREN.equals(t.getValueStr())) {
        Expr expr = parseConditional(buf);
        buf.expect(TokenType.DELIM, CLOSE_PAREN);
        return new Expr.Paren(expr);
      }
      throw buf.unexpected(t);

    case STRING:
      return parseWord(t, buf);

    default:
      throw buf.unexpected(t);
    }
  }

  private static Expr parseWord(Token t, TokBuf buf) {
    WordType wordType = getWordType(t);
    if(wordType == WordType.CONST) {
      String str = t.getValueStr();
      if(NULL_STR.equals(str)) {
        return Expr.Literal.ofNull();
      }
      return Expr.Literal.ofBoolean(TRUE_STR.equals(str));
    }
    if(wordType != null) {
      // operator keyword where an operand belongs
      throw buf.unexpected(t);
    }

    if(buf.nextIs(TokenType.DELIM, FUNC_START_DELIM)) {
      return parseFunc(t.getValueStr(), buf);
    }

    List<String> segments = new ArrayList<String>();
    segments.add(t.getValueStr());
    while(buf.nextIs(TokenType.DELIM, MEMBER_SEP)) {
      buf.next();
      Token member = buf.next();
      if(member.getType() != TokenType.STRING) {
        // any bare word (even a keyword) is a valid member name
        throw buf.unexpected(member);
      }
      segments.add(member.getValueStr());
    }

    if(buf.nextIs(TokenType.DELIM, FUNC_START_DELIM)) {
      Token paren = buf.peekNext();
      throw new ParseException(
          "Unexpected '(' at position " + paren.getPos() +
          ", only plain function names may be called", paren.getPos());
    }

    return new Expr.Variable(new Identifier(segments));
  }

  private static Expr parseFunc(String funcName, TokBuf buf) {
    // consume the '('
    buf.next();

    List<Expr> params = new ArrayList<Expr>();
    if(buf.nextIs(TokenType.DELIM, CLOSE_PAREN)) {
      buf.next();
      return new Expr.FuncCall(funcName, params);
    }

    while(true) {
      params.add(parseConditional(buf));

      Token t = buf.next();
      if(t.is(TokenType.DELIM, CLOSE_PAREN)) {
        break;
      }
      if(!t.is(TokenType.DELIM, FUNC_PARAM_SEP)) {
        throw new ParseException(
            "Expected ',' or ')' at position " + t.getPos() + " in call to " +
            funcName, t.getPos());
      }
    }

    return new Expr.FuncCall(funcName, params);
  }

  private static WordType getWordType(Token t) {
    if(t.getType() != TokenType.STRING) {
      return null;
    }
    return WORD_TYPES.get(t.getValueStr());
  }

  private static void setWordType(WordType type, String... words) {
    for(String w : words) {
      WORD_TYPES.put(w, type);
    }
  }

  private static final class TokBuf
  {
    private final List<Token> _tokens;
    private final int _exprLen;
    private int _pos;
    private int _depth;

    private TokBuf(List<Token> tokens, int exprLen) {
      _tokens = tokens;
      _exprLen = exprLen;
    }

    public boolean hasNext() {
      return (_pos < _tokens.size());
    }

    public Token peekNext() {
      if(!hasNext()) {
        return null;
      }
      return _tokens.get(_pos);
    }

    public Token next() {
      if(!hasNext()) {
        throw new ParseException(
            "Unexpected end of expression", _exprLen);
      }
      return _tokens.get(_pos++);
    }

    public boolean nextIs(TokenType type, String valStr) {
      Token t = peekNext();
      return ((t != null) && t.is(type, valStr));
    }

    public boolean nextIsLogOp(Expr.LogOp op) {
      Token t = peekNext();
      if((t == null) || ((t.getType() != TokenType.OP) &&
                         (getWordType(t) != WordType.LOG_OP))) {
        return false;
      }
      return (LOG_OPS.get(t.getValueStr()) == op);
    }

    public <O> O nextOp(Map<String,O> ops) {
      Token t = peekNext();
      if((t == null) || (t.getType() != TokenType.OP)) {
        return null;
      }
      return ops.get(t.getValueStr());
    }

    public void expect(TokenType type, String valStr) {
      if(!hasNext()) {
        throw new ParseException(
            "Expected '" + valStr + "' but reached end of expression",
            _exprLen);
      }
      Token t = next();
      if(!t.is(type, valStr)) {
        throw new ParseException(
            "Expected '" + valStr + "' at position " + t.getPos() +
            " but found '" + t.getValueStr() + "'", t.getPos());
      }
    }

    public int getDepth() {
      return _depth;
    }

    /**
     * Moves one level deeper into the expression tree.
     * @return the depth before entering
     */
    public int enter() {
      if(_depth >= MAX_NESTING_DEPTH) {
        Token t = peekNext();
        int pos = ((t != null) ? t.getPos() : _exprLen);
        throw new ParseException(
            "Expression nested too deeply at position " + pos, pos);
      }
      return _depth++;
    }

    public void restore(int depth) {
      _depth = depth;
    }

    public ParseException unexpected(Token t) {
      return new ParseException(
          "Unexpected token '" + t.getValueStr() + "' at position " +
          t.getPos(), t.getPos());
    }

    @Override
    public String toString() {
      return "[token " + _pos + "] " + _tokens;
    }
  }
}
