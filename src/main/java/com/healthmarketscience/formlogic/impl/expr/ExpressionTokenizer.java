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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.healthmarketscience.formlogic.expr.ParseException;


/**
 *
 * @author James Ahlborn
 */
class ExpressionTokenizer
{
  private static final int EOF = -1;
  private static final char QUOTED_STR_CHAR = '"';
  private static final char SINGLE_QUOTED_STR_CHAR = '\'';
  private static final char ESCAPE_CHAR = '\\';
  private static final char MEMBER_CHAR = '.';

  private static final byte IS_OP_FLAG =     0x01;
  private static final byte IS_COMP_FLAG =   0x02;
  private static final byte IS_DELIM_FLAG =  0x04;
  private static final byte IS_SPACE_FLAG =  0x08;
  private static final byte IS_QUOTE_FLAG =  0x10;
  private static final byte IS_LOGIC_FLAG =  0x20;

  enum TokenType {
    LITERAL, OP, DELIM, STRING;
  }

  private static final byte[] CHAR_FLAGS = new byte[128];
  private static final Set<String> TWO_CHAR_COMP_OPS = new HashSet<String>(
      Arrays.asList("<=", ">=", "==", "!="));

  static {
    setCharFlag(IS_OP_FLAG, '+', '-', '*', '/', '%');
    setCharFlag(IS_COMP_FLAG, '<', '>', '=', '!');
    setCharFlag(IS_LOGIC_FLAG, '&', '|');
    setCharFlag(IS_DELIM_FLAG, '.', ',', '(', ')', '?', ':');
    setCharFlag(IS_SPACE_FLAG, ' ', '\n', '\r', '\t');
    setCharFlag(IS_QUOTE_FLAG, '"', '\'');
  }

  private ExpressionTokenizer() {}

  /**
   * Tokenizes an expression string.  Whitespace is dropped, every token
   * remembers the offset where it started.
   */
  static List<Token> tokenize(String exprStr) {

    List<Token> tokens = new ArrayList<Token>();

    if(exprStr == null) {
      return tokens;
    }

    ExprBuf buf = new ExprBuf(exprStr);

    while(buf.hasNext()) {
      int startPos = buf.curPos();
      char c = buf.next();

      byte charFlag = getCharFlag(c);
      if(charFlag != 0) {

        // what could it be?
        switch(charFlag) {
        case IS_OP_FLAG:

          // all simple operator chars are single character operators
          tokens.add(new Token(TokenType.OP, String.valueOf(c), startPos));
          break;

        case IS_COMP_FLAG:
          tokens.add(new Token(TokenType.OP, parseCompOp(c, buf), startPos));
          break;

        case IS_LOGIC_FLAG:
          tokens.add(new Token(TokenType.OP, parseLogicOp(c, buf), startPos));
          break;

        case IS_DELIM_FLAG:

          // all delimiter chars are single character symbols
          tokens.add(new Token(TokenType.DELIM, String.valueOf(c), startPos));
          break;

        case IS_SPACE_FLAG:
          consumeWhitespace(buf);
          break;

        case IS_QUOTE_FLAG:
          String str = parseQuotedString(buf, c);
          tokens.add(new Token(TokenType.LITERAL, str,
                               exprStr.substring(startPos, buf.curPos()),
                               startPos));
          break;

        default:
          throw new IllegalStateException("unknown char flag " + charFlag);
        }

      } else {

        if(isDigit(c)) {
          tokens.add(parseNumberLiteral(c, buf));
          continue;
        }

        if(!Character.isJavaIdentifierStart(c)) {
          throw new ParseException(
              "Unexpected character '" + c + "' at position " + startPos,
              startPos);
        }

        // standalone word of some sort
        tokens.add(new Token(TokenType.STRING, parseBareString(c, buf),
                             startPos));
      }

    }

    return tokens;
  }

  private static byte getCharFlag(char c) {
    return ((c < 128) ? CHAR_FLAGS[c] : 0);
  }

  private static String parseCompOp(char firstChar, ExprBuf buf) {
    String opStr = String.valueOf(firstChar);

    int c = buf.peekNext();
    if((c != EOF) && hasFlag(getCharFlag((char)c), IS_COMP_FLAG)) {

      // is the combo a valid comparison operator?
      String tmpStr = opStr + (char)c;
      if(TWO_CHAR_COMP_OPS.contains(tmpStr)) {
        opStr = tmpStr;
        buf.next();
      }
    }

    if("=".equals(opStr)) {
      throw new ParseException(
          "Unexpected '=' at position " + buf.prevPos() +
          ", use '==' for equality", buf.prevPos());
    }

    return opStr;
  }

  private static String parseLogicOp(char firstChar, ExprBuf buf) {
    int startPos = buf.prevPos();
    if(buf.peekNext() != firstChar) {
      throw new ParseException(
          "Unexpected character '" + firstChar + "' at position " + startPos,
          startPos);
    }
    buf.next();
    return new String(new char[]{firstChar, firstChar});
  }

  private static void consumeWhitespace(ExprBuf buf) {
    int c = EOF;
    while(((c = buf.peekNext()) != EOF) &&
          hasFlag(getCharFlag((char)c), IS_SPACE_FLAG)) {
        buf.next();
    }
  }

  private static String parseBareString(char firstChar, ExprBuf buf) {
    StringBuilder sb = buf.getScratchBuffer().append(firstChar);

    int c = EOF;
    while(((c = buf.peekNext()) != EOF) &&
          Character.isJavaIdentifierPart((char)c)) {
      sb.append(buf.next());
    }

    return sb.toString();
  }

  private static String parseQuotedString(ExprBuf buf, char quoteChar) {
    int startPos = buf.prevPos();
    StringBuilder sb = buf.getScratchBuffer();
    boolean complete = false;
    while(buf.hasNext()) {
      char c = buf.next();
      if(c == quoteChar) {
        complete = true;
        break;
      }
      if(c == ESCAPE_CHAR) {
        if(!buf.hasNext()) {
          break;
        }
        c = unescape(buf.next());
      }
      sb.append(c);
    }

    if(!complete) {
      throw new ParseException("Unterminated string starting at position " +
                               startPos, startPos);
    }

    return sb.toString();
  }

  private static char unescape(char c) {
    switch(c) {
    case 'n':
      return '\n';
    case 't':
      return '\t';
    case 'r':
      return '\r';
    default:
      // quotes, backslash and anything else stand for themselves
      return c;
    }
  }

  private static Token parseNumberLiteral(char firstChar, ExprBuf buf) {
    int startPos = buf.prevPos();
    StringBuilder sb = buf.getScratchBuffer().append(firstChar);
    boolean isFp = false;
    int expPos = -1;

    int c = EOF;
    while((c = buf.peekNext()) != EOF) {
      if(isDigit(c)) {
        sb.append((char)c);
        buf.next();
      } else if((c == MEMBER_CHAR) && !isFp && (expPos < 0) &&
                isDigit(buf.peekNext(1))) {
        isFp = true;
        sb.append((char)c);
        buf.next();
      } else if((expPos < 0) && ((c == 'e') || (c == 'E'))) {
        isFp = true;
        sb.append((char)c);
        expPos = sb.length();
        buf.next();
      } else if((expPos == sb.length()) && ((c == '-') || (c == '+'))) {
        sb.append((char)c);
        buf.next();
      } else if(Character.isJavaIdentifierPart((char)c)) {
        // digits run straight into a word
        throw new ParseException("Invalid number literal at position " +
                                 startPos, startPos);
      } else {
        break;
      }
    }

    String numStr = sb.toString();
    try {
      Number num = null;

      if(!isFp) {
        try {
          // try to parse as int.  if that fails, fall back to BigDecimal
          // (this will handle the case of int overflow)
          num = Integer.valueOf(numStr);
        } catch(NumberFormatException ne) {
          // fallback to decimal
        }
      }

      if(num == null) {
        num = new BigDecimal(numStr);
      }

      return new Token(TokenType.LITERAL, num, numStr, startPos);
    } catch(NumberFormatException ne) {
      throw new ParseException(
          "Invalid number literal " + numStr + " at position " + startPos,
          startPos, ne);
    }
  }

  private static boolean hasFlag(byte charFlag, byte flag) {
    return ((charFlag & flag) != 0);
  }

  private static void setCharFlag(byte flag, char... chars) {
    for(char c : chars) {
      CHAR_FLAGS[c] |= flag;
    }
  }

  private static boolean isDigit(int c) {
    return ((c >= '0') && (c <= '9'));
  }

  static final class ExprBuf
  {
    private final String _str;
    private int _pos;
    private final StringBuilder _scratch = new StringBuilder();

    ExprBuf(String str) {
      _str = str;
    }

    private int len() {
      return _str.length();
    }

    public int curPos() {
      return _pos;
    }

    public int prevPos() {
      return _pos - 1;
    }

    public boolean hasNext() {
      return _pos < len();
    }

    public char next() {
      return _str.charAt(_pos++);
    }

    public int peekNext() {
      return peekNext(0);
    }

    public int peekNext(int ahead) {
      int pos = _pos + ahead;
      if(pos >= len()) {
        return EOF;
      }
      return _str.charAt(pos);
    }

    public StringBuilder getScratchBuffer() {
      _scratch.setLength(0);
      return _scratch;
    }

    @Override
    public String toString() {
      return "[char " + _pos + "] '" + _str + "'";
    }
  }


  static final class Token
  {
    private final TokenType _type;
    private final Object _val;
    private final String _valStr;
    private final int _pos;

    private Token(TokenType type, String val, int pos) {
      this(type, val, val, pos);
    }

    private Token(TokenType type, Object val, String valStr, int pos) {
      _type = type;
      _val = ((val != null) ? val : valStr);
      _valStr = valStr;
      _pos = pos;
    }

    public TokenType getType() {
      return _type;
    }

    public Object getValue() {
      return _val;
    }

    public String getValueStr() {
      return _valStr;
    }

    /**
     * @return the character offset of the start of this token
     */
    public int getPos() {
      return _pos;
    }

    public boolean isStringLiteral() {
      return ((_type == TokenType.LITERAL) && (_val instanceof String));
    }

    public boolean is(TokenType type, String valStr) {
      return ((_type == type) && valStr.equals(_valStr));
    }

    @Override
    public String toString() {
      return "[" + _type + "] '" + _val + "'";
    }
  }

}
