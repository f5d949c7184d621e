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
import java.util.Arrays;
import java.util.List;

import com.healthmarketscience.formula.expr.EvalException;
import com.healthmarketscience.formula.expr.ParseException;
import com.healthmarketscience.formula.expr.Value;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;
import static com.healthmarketscience.formula.impl.expr.Node.NodeType.*;

/**
 *
 * @author James Ahlborn
 */
public class ExpressionTokenizerTest
{
  private static final DefaultEvalConfig CONFIG = new DefaultEvalConfig();

  @Test
  public void testTokenTypes() throws Exception
  {
    List<Node> tokens = tokenize(
        "sum([x], 2.5) >= \"a\"\"b\" & pi");
    assertTypes(tokens, FUNCTION, GROUP, COMPARATOR, STRING, COMPARATOR,
                CONSTANT);
    assertTexts(tokens, "sum", "[x], 2.5", ">=", "\"a\"\"b\"", "&", "pi");
    assertEquals("a\"b", tokens.get(3).eval(null).getAsString());

    tokens = tokenize("[ my var ]+.5");
    assertTypes(tokens, VARIABLE, OPERATOR, NUMBER);
    assertTexts(tokens, "my var", "+", ".5");

    tokens = tokenize("1<=2<3!=4==5>6>=7");
    assertTexts(tokens, "1", "<=", "2", "<", "3", "!=", "4", "==", "5", ">",
                "6", ">=", "7");

    tokens = tokenize("a||b|c&&d");
    assertTypes(tokens, CONSTANT, COMPARATOR, CONSTANT, COMPARATOR, CONSTANT,
                COMPARATOR, CONSTANT);
    assertTexts(tokens, "a", "||", "b", "|", "c", "&&", "d");
  }

  @Test
  public void testOperatorRuns() throws Exception
  {
    assertTexts(tokenize("+-5"), "+", "-", "5");
    assertTexts(tokenize("5*-3"), "5", "*", "-", "3");
    assertTexts(tokenize("7//2"), "7", "//", "2");
    assertTexts(tokenize("7///2"), "7", "//", "/", "2");
    assertTexts(tokenize("5!!"), "5", "!", "!");
    assertTexts(tokenize("5!=3"), "5", "!=", "3");
    assertTexts(tokenize("5!<3"), "5", "!", "<", "3");
    assertTexts(tokenize("2-.5"), "2", "-", ".5");
    assertTexts(tokenize("1.5.5"), "1.5", ".5");

    for(Node token : tokenize("1+2-3*4/5%6//7^8!")) {
      if(token.getType() == OPERATOR) {
        assertNotNull(((OperatorNode)token).getOperator());
      }
    }
  }

  @Test
  public void testGroups() throws Exception
  {
    List<Node> tokens = tokenize("(1 + (2 * 3)) * (\")(\")");
    assertTypes(tokens, GROUP, OPERATOR, GROUP);
    assertTexts(tokens, "1 + (2 * 3)", "*", "\")(\"");

    tokens = tokenize("((((((1 + 2)))))) * 2");
    assertTypes(tokens, GROUP, OPERATOR, NUMBER);
    assertTexts(tokens, "(((((1 + 2)))))", "*", "2");

    tokens = tokenize("sum(1, (2 * (3 + (4 - (5 ^ (\")\"))))))");
    assertTypes(tokens, FUNCTION, GROUP);
    assertTexts(tokens, "sum", "1, (2 * (3 + (4 - (5 ^ (\")\")))))");

    tokens = tokenize("today()");
    assertTypes(tokens, FUNCTION);
    assertFalse(((FunctionNode)tokens.get(0)).isAwaitingArguments());
    assertTrue(((FunctionNode)tokens.get(0)).getArguments().isEmpty());

    tokens = tokenize("TODAY(  )+( )");
    assertTypes(tokens, FUNCTION, OPERATOR);

    tokens = tokenize("sum(1)");
    assertTrue(((FunctionNode)tokens.get(0)).isAwaitingArguments());
  }

  @Test
  public void testLiterals() throws Exception
  {
    assertEquals("", tokenize("\"\"").get(0).eval(null).getAsString());
    assertEquals(" x ", tokenize("\" x \"").get(0).eval(null).getAsString());

    Value val = tokenize("42").get(0).eval(null);
    assertEquals(Value.Type.NUMBER, val.getType());
    assertEquals(42d, val.getAsDouble());
  }

  @Test
  public void testTokenizeFailures() throws Exception
  {
    tokenizeFail("\"abc", EvalException.ErrorType.SYNTAX);
    tokenizeFail("[abc", EvalException.ErrorType.SYNTAX);
    tokenizeFail("[a[b]", EvalException.ErrorType.SYNTAX);
    tokenizeFail("[  ]", EvalException.ErrorType.SYNTAX);
    tokenizeFail("(1 + 2", EvalException.ErrorType.SYNTAX);
    tokenizeFail("((((((1 + 2))))) * 2", EvalException.ErrorType.SYNTAX);
    tokenizeFail("1 + 2)", EvalException.ErrorType.SYNTAX);
    tokenizeFail("1 ] 2", EvalException.ErrorType.SYNTAX);
    tokenizeFail("2 $ 3", EvalException.ErrorType.INVALID_OPERATOR);
    tokenizeFail("2 +$ 3", EvalException.ErrorType.INVALID_OPERATOR);
    tokenizeFail("2 ~ 3", EvalException.ErrorType.INVALID_OPERATOR);
    tokenizeFail("bogus(1)", EvalException.ErrorType.INVALID_FUNCTION);
  }

  private static List<Node> tokenize(String exprStr) {
    return ExpressionTokenizer.tokenize(exprStr, CONFIG);
  }

  private static void tokenizeFail(String exprStr,
                                   EvalException.ErrorType errorType) {
    ParseException e = assertThrows(ParseException.class,
                                    () -> tokenize(exprStr));
    assertEquals(errorType, e.getErrorType(), e.getMessage());
  }

  private static void assertTypes(List<Node> tokens, Node.NodeType... types) {
    List<Node.NodeType> found = new ArrayList<Node.NodeType>();
    for(Node token : tokens) {
      found.add(token.getType());
    }
    assertEquals(Arrays.asList(types), found);
  }

  private static void assertTexts(List<Node> tokens, String... texts) {
    List<String> found = new ArrayList<String>();
    for(Node token : tokens) {
      found.add(token.getText());
    }
    assertEquals(Arrays.asList(texts), found);
  }
}
