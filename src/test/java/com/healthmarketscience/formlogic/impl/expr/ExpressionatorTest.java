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

package com.healthmarketscience.formlogic.impl.expr;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import com.healthmarketscience.formlogic.expr.Expr;
import com.healthmarketscience.formlogic.expr.ParseException;
import com.healthmarketscience.formlogic.expr.ParseResult;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author James Ahlborn
 */
public class ExpressionatorTest
{

  @Test
  public void testParseSimpleExprs() throws Exception
  {
    validateExpr("\"A\"", "<Literal>{\"A\"}");

    validateExpr("'A'", "<Literal>{\"A\"}", "\"A\"");

    validateExpr("13", "<Literal>{13}");

    validateExpr("-42", "<Unary>{- <Literal>{42}}");

    validateExpr("(+37)", "<Paren>{(<Unary>{+ <Literal>{37}})}");

    doTestSimpleBinOp("Binary", "+", "-", "*", "/", "%");
    doTestSimpleBinOp("Comparison", "<", "<=", ">", ">=", "==", "!=");
    doTestSimpleBinOp("Logical", "and", "or");

    for(String constStr : new String[]{"true", "false", "null"}) {
      validateExpr(constStr, "<Literal>{" + constStr + "}");
    }

    validateExpr("isAdult", "<Variable>{isAdult}");

    validateExpr("fields.age.value", "<Variable>{fields.age.value}");

    validateExpr("not flag", "<Unary>{not <Variable>{flag}}");

    validateExpr("!flag", "<Unary>{not <Variable>{flag}}", "not flag");

    validateExpr("-fields.age.value",
                 "<Unary>{- <Variable>{fields.age.value}}");

    validateExpr("a && b", "<Logical>{<Variable>{a} and <Variable>{b}}",
                 "a and b");

    validateExpr("a || b", "<Logical>{<Variable>{a} or <Variable>{b}}",
                 "a or b");

    validateExpr("flag ? 1 : 2",
                 "<Conditional>{<Variable>{flag} ? <Literal>{1} : <Literal>{2}}");

    validateExpr("upper()", "<FuncCall>{upper()}");

    validateExpr("contains(fields.name.value, \"x\")",
                 "<FuncCall>{contains(<Variable>{fields.name.value},<Literal>{\"x\"})}",
                 "contains(fields.name.value,\"x\")");

    validateExpr("' \"A\" '", "<Literal>{\" \\\"A\\\" \"}",
                 "\" \\\"A\\\" \"");

    // member names may be keywords
    validateExpr("fields.not.value", "<Variable>{fields.not.value}");
  }

  private static void doTestSimpleBinOp(String opName, String... ops)
    throws Exception
  {
    for(String op : ops) {
      validateExpr("\"A\" " + op + " \"B\"",
                   "<" + opName + ">{<Literal>{\"A\"} " + op +
                   " <Literal>{\"B\"}}");
    }
  }

  @Test
  public void testOrderOfOperations() throws Exception
  {
    validateExpr("1 + 2 * 3",
                 "<Binary>{<Literal>{1} + <Binary>{<Literal>{2} * <Literal>{3}}}");

    validateExpr("1 - 2 - 3",
                 "<Binary>{<Binary>{<Literal>{1} - <Literal>{2}} - <Literal>{3}}");

    validateExpr("(1 + 2) * 3",
                 "<Binary>{<Paren>{(<Binary>{<Literal>{1} + <Literal>{2}})} * <Literal>{3}}");

    validateExpr("-a * b",
                 "<Binary>{<Unary>{- <Variable>{a}} * <Variable>{b}}");

    validateExpr("a + 1 > b",
                 "<Comparison>{<Binary>{<Variable>{a} + <Literal>{1}} > <Variable>{b}}");

    validateExpr("a or b and c",
                 "<Logical>{<Variable>{a} or <Logical>{<Variable>{b} and <Variable>{c}}}");

    validateExpr("a and b or c",
                 "<Logical>{<Logical>{<Variable>{a} and <Variable>{b}} or <Variable>{c}}");

    validateExpr("not a and b",
                 "<Logical>{<Unary>{not <Variable>{a}} and <Variable>{b}}");

    validateExpr("not a == b",
                 "<Unary>{not <Comparison>{<Variable>{a} == <Variable>{b}}}");

    validateExpr("a > 1 and b < 2",
                 "<Logical>{<Comparison>{<Variable>{a} > <Literal>{1}} and <Comparison>{<Variable>{b} < <Literal>{2}}}");

    validateExpr("a ? b : c ? d : e",
                 "<Conditional>{<Variable>{a} ? <Variable>{b} : <Conditional>{<Variable>{c} ? <Variable>{d} : <Variable>{e}}}");

    validateExpr("a or b ? 1 : 2",
                 "<Conditional>{<Logical>{<Variable>{a} or <Variable>{b}} ? <Literal>{1} : <Literal>{2}}");
  }

  @Test
  public void testNumbers() throws Exception
  {
    assertEquals(Integer.valueOf(42), literalValue("42"));
    assertEquals(new BigDecimal("1.5"), literalValue("1.5"));
    assertEquals(new BigDecimal("3000000000"), literalValue("3000000000"));
    assertEquals(new BigDecimal("1e3"), literalValue("1e3"));
    assertEquals(new BigDecimal("2.5E-2"), literalValue("2.5E-2"));

    assertEquals("1.50", Expressionator.parse("1.50").toCleanString());
  }

  @Test
  public void testVariables() throws Exception
  {
    ParseResult result = Expressionator.parseExpression(
        "fields.age.value >= 18 and isAdult or fields.age.value < 5");
    assertTrue(result.isSuccess());
    assertEquals(set("fields.age.value", "isAdult"), result.getVariables());

    result = Expressionator.parseExpression("contains(name, 'x') ? a : b");
    assertEquals(set("name", "a", "b"), result.getVariables());

    result = Expressionator.parseExpression("1 + 2");
    assertEquals(Collections.emptySet(), result.getVariables());

    result = Expressionator.parseExpression("1 +");
    assertFalse(result.isSuccess());
    assertNull(result.getExpr());
    assertEquals(Collections.emptySet(), result.getVariables());
  }

  @Test
  public void testInvalidExprs() throws Exception
  {
    validateError("", "Empty expression", 0);
    validateError("   ", "Empty expression", 0);
    validateError(null, "Empty expression", 0);
    validateError("1 +", "Unexpected end of expression", 3);
    validateError("a and", "Unexpected end of expression", 5);
    validateError("(1 + 2", "Expected ')' but reached end of expression", 6);
    validateError("(1 + 2 3", "Expected ')' at position 7 but found '3'", 7);
    validateError("a ? b", "Expected ':' but reached end of expression", 5);
    validateError("a = 1", "Unexpected '=' at position 2, use '==' for equality",
                  2);
    validateError("a & b", "Unexpected character '&' at position 2", 2);
    validateError("a # b", "Unexpected character '#' at position 2", 2);
    validateError("'abc", "Unterminated string starting at position 0", 0);
    validateError("x == \"abc", "Unterminated string starting at position 5",
                  5);
    validateError("1 2", "Unexpected token '2' at position 2", 2);
    validateError("and a", "Unexpected token 'and' at position 0", 0);
    validateError("12abc", "Invalid number literal at position 0", 0);
    validateError("a.1", "Unexpected token '1' at position 2", 2);
    validateError("f(1 2)", "Expected ',' or ')' at position 4 in call to f",
                  4);
    validateError("a.b(1)", "Unexpected '(' at position 3, only plain " +
                  "function names may be called", 3);
    validateError("()", "Unexpected token ')' at position 1", 1);

    ParseException pe = assertThrows(ParseException.class,
                                     () -> Expressionator.parse("1 +"));
    assertEquals(3, pe.getOffset());
  }

  @Test
  public void testNestingDepth() throws Exception
  {
    int max = Expressionator.MAX_NESTING_DEPTH;

    String deep = StringUtils.repeat("(", 20000) + "1" +
      StringUtils.repeat(")", 20000);
    validateError(deep, "Expression nested too deeply at position " + max,
                  max);

    int notPos = max * "not ".length();
    validateError(StringUtils.repeat("not ", 20000) + "true",
                  "Expression nested too deeply at position " + notPos,
                  notPos);

    int orPos = max * "a or ".length();
    validateError(StringUtils.repeat("a or ", 20000) + "a",
                  "Expression nested too deeply at position " + orPos, orPos);

    ParseResult result = Expressionator.parseExpression(
        StringUtils.repeat("(", 20000) + "1");
    assertFalse(result.isSuccess());

    // reasonable nesting is still fine
    Expr expr = Expressionator.parse(
        StringUtils.repeat("(", max - 100) + "n" +
        StringUtils.repeat(")", max - 100));
    assertEquals(set("n"), expr.getVariables());
    expr = Expressionator.parse(StringUtils.repeat("1 + ", max - 100) + "n");
    assertEquals(set("n"), expr.getVariables());
  }

  private static Object literalValue(String exprStr) {
    Expr expr = Expressionator.parse(exprStr);
    assertTrue(expr instanceof Expr.Literal);
    assertEquals(Expr.Literal.Kind.NUMBER, ((Expr.Literal)expr).getKind());
    return ((Expr.Literal)expr).getValue();
  }

  private static void validateExpr(String exprStr, String debugStr) {
    validateExpr(exprStr, debugStr, exprStr);
  }

  private static void validateExpr(String exprStr, String debugStr,
                                   String cleanStr) {
    Expr expr = Expressionator.parse(exprStr);
    assertEquals(debugStr, expr.toDebugString());
    assertEquals(cleanStr, expr.toCleanString());

    // the clean string parses back to the same expression
    assertEquals(debugStr, Expressionator.parse(cleanStr).toDebugString());
  }

  private static void validateError(String exprStr, String msg, int offset) {
    ParseResult result = Expressionator.parseExpression(exprStr);
    assertFalse(result.isSuccess(), "expected failure for " + exprStr);
    assertEquals(msg, result.getError());
    assertEquals(offset, result.getErrorOffset());
  }

  private static Set<String> set(String... vals) {
    return new LinkedHashSet<String>(Arrays.asList(vals));
  }
}
