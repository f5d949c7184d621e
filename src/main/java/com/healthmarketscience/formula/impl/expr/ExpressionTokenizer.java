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

package com.healthmarketscience.formula.impl.expr;

import java.util.ArrayList;
import java.util.List;

import com.healthmarketscience.formula.expr.EvalException;
import com.healthmarketscience.formula.expr.ParseException;
import org.apache.commons.lang3.StringUtils;
import com.healthmarketscience.formula.impl.expr.Formulator.ParseContext;


/**
 * Splits expression text into an ordered list of unlinked {@link Node}s.
 *
 * @author James Ahlborn
 */
class ExpressionTokenizer
{
  private static final int EOF = -1;
  static final char QUOTED_STR_CHAR = '"';
  static final char VAR_START_CHAR = '[';
  static final char VAR_END_CHAR = ']';
  static final char GROUP_START_CHAR = '(';
  static final char GROUP_END_CHAR = ')';
  private static final char DECIMAL_POINT_CHAR = '.';
  private static final char UNDERSCORE_CHAR = '_';

  private ExpressionTokenizer() {}

  /**
   * Tokenizes an expression string.  Functions are resolved using the
   * FunctionLookup from the given context.
   *
   * @throws ParseException if the expression is malformed or contains an
   *         unknown operator, comparator or function
   */
  static List<Node> tokenize(String exprStr, ParseContext context) {

    List<Node> tokens = new ArrayList<Node>();

    if(exprStr == null) {
      return tokens;
    }

    ExprBuf buf = new ExprBuf(exprStr);

    while(buf.hasNext()) {
      char c = buf.next();

      if(Character.isWhitespace(c)) {
        continue;
      }

      switch(c) {
      case QUOTED_STR_CHAR:
        tokens.add(new StringNode(parseQuotedString(buf)));
        continue;
      case VAR_START_CHAR:
        tokens.add(new VariableNode(parseVariableName(buf)));
        continue;
      case GROUP_START_CHAR:
        parseGroup(buf, tokens);
        continue;
      case GROUP_END_CHAR:
      case VAR_END_CHAR:
        throw new ParseException(EvalException.ErrorType.SYNTAX,
                                 "Unmatched '" + c + "' " + buf);
      default:
        // keep looking
      }

      String compStr = maybeParseComparator(buf, buf.prevPos());
      if(compStr != null) {
        buf.reset(buf.prevPos() + compStr.length());
        tokens.add(new ComparatorNode(compStr));
        continue;
      }

      if(isIdentifierStart(c)) {
        String name = parseIdentifier(c, buf);
        if(buf.peekNext() == GROUP_START_CHAR) {
          tokens.add(new FunctionNode(name, context.getFunctionLookup()));
        } else {
          tokens.add(new ConstantNode(name));
        }
        continue;
      }

      if(isNumberStart(c, buf)) {
        tokens.add(new NumberNode(parseNumber(c, buf)));
        continue;
      }

      buf.popPrev();
      parseOperators(buf, tokens);
    }

    return tokens;
  }

  private static String parseQuotedString(ExprBuf buf) {
    StringBuilder sb = buf.getScratchBuffer().append(QUOTED_STR_CHAR);
    boolean complete = false;
    while(buf.hasNext()) {
      char c = buf.next();
      sb.append(c);
      if(c == QUOTED_STR_CHAR) {
        if(buf.peekNext() == QUOTED_STR_CHAR) {
          // doubled quote is an escaped quote
          sb.append(buf.next());
        } else {
          complete = true;
          break;
        }
      }
    }

    if(!complete) {
      throw new ParseException(EvalException.ErrorType.SYNTAX,
                               "Missing closing '" + QUOTED_STR_CHAR +
                               "' for quoted string " + buf);
    }

    return sb.toString();
  }

  private static String parseVariableName(ExprBuf buf) {
    StringBuilder sb = buf.getScratchBuffer();
    boolean complete = false;
    while(buf.hasNext()) {
      char c = buf.next();
      if(c == VAR_END_CHAR) {
        complete = true;
        break;
      } else if(c == VAR_START_CHAR) {
        break;
      }
      sb.append(c);
    }

    if(!complete) {
      throw new ParseException(EvalException.ErrorType.SYNTAX,
                               "Missing closing '" + VAR_END_CHAR +
                               "' for variable name " + buf);
    }

    String name = sb.toString().trim();
    if(name.isEmpty()) {
      throw new ParseException(EvalException.ErrorType.SYNTAX,
                               "Empty variable name " + buf);
    }
    return name;
  }

  private static void parseGroup(ExprBuf buf, List<Node> tokens) {
    StringBuilder sb = buf.getScratchBuffer();
    int depth = 1;
    boolean inString = false;
    while(buf.hasNext()) {
      char c = buf.next();
      if(c == QUOTED_STR_CHAR) {
        inString = !inString;
      } else if(!inString) {
        if(c == GROUP_START_CHAR) {
          ++depth;
        } else if((c == GROUP_END_CHAR) && (--depth == 0)) {
          break;
        }
      }
      sb.append(c);
    }

    if(depth > 0) {
      throw new ParseException(EvalException.ErrorType.SYNTAX,
                               "Missing closing '" + GROUP_END_CHAR +
                               "' for group " + buf);
    }

    String text = sb.toString();
    if(StringUtils.isBlank(text)) {
      // an empty group is dropped, but marks a preceding function call as
      // having no arguments
      Node prev = (tokens.isEmpty() ? null : tokens.get(tokens.size() - 1));
      if((prev instanceof FunctionNode) &&
         ((FunctionNode)prev).isAwaitingArguments()) {
        ((FunctionNode)prev).setNoArguments();
      }
      return;
    }

    tokens.add(new GroupNode(text.trim()));
  }

  /**
   * @return the comparator symbol starting at the given position, if any.
   *         does not consume any characters.
   */
  private static String maybeParseComparator(ExprBuf buf, int pos) {
    int c = buf.charAt(pos);
    if((c == EOF) || !ComparatorType.isComparatorChar((char)c)) {
      return null;
    }

    int c2 = buf.charAt(pos + 1);
    if(c2 != EOF) {
      String compStr = new String(new char[]{(char)c, (char)c2});
      if(ComparatorType.fromSymbol(compStr) != null) {
        return compStr;
      }
    }

    String compStr = String.valueOf((char)c);
    return ((ComparatorType.fromSymbol(compStr) != null) ? compStr : null);
  }

  private static String parseIdentifier(char firstChar, ExprBuf buf) {
    StringBuilder sb = buf.getScratchBuffer().append(firstChar);
    while(buf.hasNext()) {
      char c = (char)buf.peekNext();
      if(!isIdentifierPart(c)) {
        break;
      }
      sb.append(buf.next());
    }
    return sb.toString();
  }

  private static String parseNumber(char firstChar, ExprBuf buf) {
    StringBuilder sb = buf.getScratchBuffer().append(firstChar);
    boolean foundDecimal = (firstChar == DECIMAL_POINT_CHAR);
    while(buf.hasNext()) {
      char c = (char)buf.peekNext();
      if(c == DECIMAL_POINT_CHAR) {
        if(foundDecimal) {
          break;
        }
        foundDecimal = true;
      } else if(!isDigit(c)) {
        break;
      }
      sb.append(buf.next());
    }
    return sb.toString();
  }

  /**
   * Consumes a run of operator characters, splitting it into the longest
   * known operator symbols.  The run ends at the first character which
   * cannot be part of an operator, or where a comparator starts.
   */
  private static void parseOperators(ExprBuf buf, List<Node> tokens) {
    int start = buf.curPos();
    while(buf.hasNext()) {
      int pos = buf.curPos();
      char c = (char)buf.peekNext();
      if(pos > start) {
        if(!isOperatorChar(c) || (maybeParseComparator(buf, pos) != null) ||
           isNumberStart(c, buf.charAt(pos + 1))) {
          break;
        }
      } else if(!isOperatorChar(c)) {
        throw invalidOperator(String.valueOf(c), buf);
      }

      String opStr = null;
      for(int len = OperatorType.MAX_SYMBOL_LEN; len > 0; --len) {
        String tmpStr = buf.substring(pos, pos + len);
        if((tmpStr != null) && (OperatorType.fromSymbol(tmpStr) != null)) {
          opStr = tmpStr;
          break;
        }
      }

      if(opStr == null) {
        // unknown operator, consume the rest of the run for the error
        int end = pos + 1;
        while((end < buf.len()) && isOperatorChar((char)buf.charAt(end))) {
          ++end;
        }
        buf.reset(end);
        throw invalidOperator(buf.substring(pos, end), buf);
      }

      buf.reset(pos + opStr.length());
      tokens.add(new OperatorNode(opStr));
    }
  }

  private static ParseException invalidOperator(String opStr, ExprBuf buf) {
    return new ParseException(EvalException.ErrorType.INVALID_OPERATOR,
                              "Invalid operator '" + opStr + "' " + buf);
  }

  private static boolean isIdentifierStart(char c) {
    return (Character.isLetter(c) || (c == UNDERSCORE_CHAR));
  }

  private static boolean isIdentifierPart(char c) {
    return (Character.isLetterOrDigit(c) || (c == UNDERSCORE_CHAR));
  }

  private static boolean isDigit(int c) {
    return ((c >= '0') && (c <= '9'));
  }

  private static boolean isNumberStart(char c, ExprBuf buf) {
    return isNumberStart(c, buf.peekNext());
  }

  private static boolean isNumberStart(char c, int next) {
    return (isDigit(c) || ((c == DECIMAL_POINT_CHAR) && isDigit(next)));
  }

  private static boolean isOperatorChar(char c) {
    if(Character.isWhitespace(c) || isIdentifierPart(c)) {
      return false;
    }
    switch(c) {
    case QUOTED_STR_CHAR:
    case VAR_START_CHAR:
    case VAR_END_CHAR:
    case GROUP_START_CHAR:
    case GROUP_END_CHAR:
      return false;
    default:
      return true;
    }
  }

  static final class ExprBuf
  {
    private final String _str;
    private int _pos;
    private final StringBuilder _scratch = new StringBuilder();

    ExprBuf(String str) {
      _str = str;
    }

    int len() {
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

    public void popPrev() {
      --_pos;
    }

    public int peekNext() {
      return charAt(_pos);
    }

    public int charAt(int pos) {
      if((pos < 0) || (pos >= len())) {
        return EOF;
      }
      return _str.charAt(pos);
    }

    /**
     * @return the given substring, or {@code null} if it extends past the
     *         end of the buffer
     */
    public String substring(int start, int end) {
      if(end > len()) {
        return null;
      }
      return _str.substring(start, end);
    }

    public void reset(int pos) {
      _pos = pos;
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
}
