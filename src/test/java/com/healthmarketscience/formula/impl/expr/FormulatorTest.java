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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.healthmarketscience.formula.expr.EvalException;
import com.healthmarketscience.formula.expr.Expression;
import com.healthmarketscience.formula.expr.ParseException;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author James Ahlborn
 */
public class FormulatorTest
{

  @Test
  public void testParseSimpleExprs() throws Exception
  {
    validateExpr("\"A\"", "<STRING>{\"A\"}");

    validateExpr("13", "<NUMBER>{13}");

    validateExpr("-42", "<OPERATOR>{-<NUMBER>{42}}");

    validateExpr("5!", "<OPERATOR>{<NUMBER>{5}!}");

    validateExpr("(+37)", "<GROUP>{(<OPERATOR>{+<NUMBER>{37}})}");

    validateExpr("[Field1]", "<VARIABLE>{[Field1]}");

    validateExpr("pi", "<CONSTANT>{pi}");

    for(String op : new String[]{"+", "-", "*", "/", "%", "//", "^"}) {
      validateExpr("\"A\" " + op + " \"B\"",
                   "<OPERATOR>{<STRING>{\"A\"} " + op + " <STRING>{\"B\"}}");
    }

    for(String comp : new String[]{"==", "!=", "<", "<=", ">", ">=", "&", "&&",
                                   "|", "||"}) {
      validateExpr("\"A\" " + comp + " \"B\"",
                   "<COMPARATOR>{<STRING>{\"A\"} " + comp +
                   " <STRING>{\"B\"}}");
    }

    validateExpr("sum(1, [y])",
                 "<FUNCTION>{sum(<NUMBER>{1}, <VARIABLE>{[y]})}");

    validateExpr("today()", "<FUNCTION>{today()}");

    validateExpr("\"a \"\"b\"\"\"", "<STRING>{\"a \"\"b\"\"\"}");

    validateExpr("2*-3", "<OPERATOR>{<NUMBER>{2} * <OPERATOR>{-<NUMBER>{3}}}",
                 "2 * -3");

    validateExpr("sum( 1 ,2 )", "<FUNCTION>{sum(<NUMBER>{1}, <NUMBER>{2})}",
                 "sum(1, 2)");
  }

  @Test
  public void testOrderOfOperations() throws Exception
  {
    validateExpr("2 + 3 * 4",
                 "<OPERATOR>{<NUMBER>{2} + <OPERATOR>{<NUMBER>{3} * <NUMBER>{4}}}");

    validateExpr("(2 + 3) * 4",
                 "<OPERATOR>{<GROUP>{(<OPERATOR>{<NUMBER>{2} + <NUMBER>{3}})} * <NUMBER>{4}}");

    validateExpr("2 ^ 3 ^ 2",
                 "<OPERATOR>{<OPERATOR>{<NUMBER>{2} ^ <NUMBER>{3}} ^ <NUMBER>{2}}");

    validateExpr("2 - 3 * 4 + 1",
                 "<OPERATOR>{<OPERATOR>{<NUMBER>{2} - <OPERATOR>{<NUMBER>{3} * <NUMBER>{4}}} + <NUMBER>{1}}");

    validateExpr("2 + 3 * 4 ^ 2",
                 "<OPERATOR>{<NUMBER>{2} + <OPERATOR>{<NUMBER>{3} * <OPERATOR>{<NUMBER>{4} ^ <NUMBER>{2}}}}");

    validateExpr("1 + 2 * 3 > 5",
                 "<COMPARATOR>{<OPERATOR>{<NUMBER>{1} + <OPERATOR>{<NUMBER>{2} * <NUMBER>{3}}} > <NUMBER>{5}}");

    validateExpr("1 < 2 == true",
                 "<COMPARATOR>{<COMPARATOR>{<NUMBER>{1} < <NUMBER>{2}} == <CONSTANT>{true}}");

    validateExpr("1 < 2 | 3 > 4 & pi",
                 "<COMPARATOR>{<COMPARATOR>{<NUMBER>{1} < <NUMBER>{2}} | <COMPARATOR>{<COMPARATOR>{<NUMBER>{3} > <NUMBER>{4}} & <CONSTANT>{pi}}}");

    validateExpr("[a] && [b] || [c]",
                 "<COMPARATOR>{<COMPARATOR>{<VARIABLE>{[a]} && <VARIABLE>{[b]}} || <VARIABLE>{[c]}}");

    validateExpr("1 + sum(1, 2) * 3",
                 "<OPERATOR>{<NUMBER>{1} + <OPERATOR>{<FUNCTION>{sum(<NUMBER>{1}, <NUMBER>{2})} * <NUMBER>{3}}}");

    assertEquals(14d, eval("2 + 3 * 4"));
    assertEquals(20d, eval("(2 + 3) * 4"));
    assertEquals(64d, eval("2 ^ 3 ^ 2"));
    assertEquals(-9d, eval("2 - 3 * 4 + 1"));
    assertEquals(50d, eval("2 + 3 * 4 ^ 2"));
    assertEquals(-4d, eval("-2 ^ 2"));
    assertEquals(4d, eval("(-2) ^ 2"));
    assertEquals(1.5d, eval("2 ^ -1 * 3"));
    assertEquals(-2d, eval("8 / -2 ^ 1 / 2"));
    assertEquals(-2d, eval("-5 + 3"));
    assertEquals(2d, eval("10 - 4 - 4"));
    assertEquals(1d, eval("12 / 3 / 4"));
    assertEquals(13d, eval("1 + 2 * 3!"));
    assertEquals(36d, eval("(1 + 2) * (3 + 4 + 5)"));
    assertEquals(10d, eval("((1 + 1) * (2 + 3))"));
    assertEquals(6d, eval("((((((1 + 2)))))) * 2"));
    assertEquals(5d, eval("sum(1, (2 * (3 + (4 - (5 ^ (1))))))"));
    assertEquals(-1d, eval("((((((-1))))))"));
  }

  @Test
  public void testUnaryOps() throws Exception
  {
    assertEquals(-5d, eval("-5"));
    assertEquals(5d, eval("+-5"));
    assertEquals(5d, eval("+5"));
    assertEquals(5d, eval("--5"));
    assertEquals(-6d, eval("2 * -3"));
    assertEquals(-15d, eval("5*-3"));
    assertEquals(5d, eval("2 + + 3"));
    assertEquals(-1d, eval("2 - -(-3)"));
    assertEquals(120d, eval("5!"));
    assertEquals(720d, eval("(5 - 2)! * 5!"));
    assertEquals(1d, eval("0!"));
    assertEquals(720d, eval("(3!)!"));
    assertEquals(-4d, eval("[x] * -1", Collections.singletonMap("x", 4)));
  }

  @Test
  public void testEvalVariables() throws Exception
  {
    Map<String,Object> vars = new HashMap<String,Object>();
    vars.put("x", 4);
    vars.put("name", "bob");
    vars.put("flag", Boolean.TRUE);
    vars.put("nothing", null);

    assertEquals(5d, eval("[x] + 1", vars));
    assertEquals("bob smith", eval("[name] + \" smith\"", vars));
    assertEquals(2d, eval("[flag] + 1", vars));
    assertEquals(5d, eval("[ x ] + 1", vars));
    assertNull(eval("[missing]", vars));
    assertNull(eval("[nothing]", vars));

    evalFail("[missing] + 1", EvalException.ErrorType.INVALID_CONVERSION);
    evalFail("[x] + \"a\"", vars, EvalException.ErrorType.INVALID_CONVERSION);
  }

  @Test
  public void testEvalConstants() throws Exception
  {
    assertEquals(Math.PI, eval("pi"));
    assertEquals(Math.PI * 2, eval("PI * 2"));
    assertEquals(Math.E, eval("e"));
    assertEquals(Boolean.TRUE, eval("true"));
    assertEquals(Boolean.FALSE, eval("False"));
    assertNull(eval("null"));

    evalFail("foo", EvalException.ErrorType.UNDEFINED_CONSTANT);
    evalFail("1 + foo_bar", EvalException.ErrorType.UNDEFINED_CONSTANT);
  }

  @Test
  public void testEvalComparators() throws Exception
  {
    assertEquals(Boolean.TRUE, eval("1 < 2 == true"));
    assertEquals(Boolean.TRUE, eval("1 != 2"));
    assertEquals(Boolean.FALSE, eval("1 != 1.0"));
    assertEquals(Boolean.TRUE, eval("\"abc\" < \"abd\""));
    assertEquals(Boolean.TRUE, eval("3 >= 3"));
    assertEquals(Boolean.FALSE, eval("3 > 3"));
    assertEquals(Boolean.TRUE, eval("3 <= 4"));
    assertEquals(Boolean.FALSE, eval("\"1\" == 1"));
    assertEquals(Boolean.TRUE, eval("null == [missing]"));
    assertEquals(Boolean.TRUE, eval("true == 1"));

    // loose operators return one of the operands
    assertEquals("x", eval("0 | \"x\""));
    assertEquals(3d, eval("3 | 1 / 0"));
    assertEquals(0d, eval("0 & 1 / 0"));
    assertEquals(2d, eval("1 & 2"));
    assertNull(eval("\"\" | null"));

    assertEquals(Boolean.TRUE, eval("3 || 1 / 0"));
    assertEquals(Boolean.FALSE, eval("\"\" && 1 / 0"));
    assertEquals(Boolean.TRUE, eval("1 < 2 && 3 < 4"));
    assertEquals(Boolean.TRUE, eval("1 > 2 || 3 < 4"));
    assertEquals(Boolean.FALSE, eval("1 > 2 | 3 > 4 && 5"));

    evalFail("1 < \"a\"", EvalException.ErrorType.INVALID_CONVERSION);
    evalFail("null < 1", EvalException.ErrorType.INVALID_CONVERSION);
    evalFail("1 <", EvalException.ErrorType.MISSING_OPERAND);
    evalFail("< 1", EvalException.ErrorType.MISSING_OPERAND);
  }

  @Test
  public void testEvalArithmetic() throws Exception
  {
    assertEquals(2d, eval("-7 % 3"));
    assertEquals(-2d, eval("7 % -3"));
    assertEquals(-4d, eval("-7 // 2"));
    assertEquals(3d, eval("7 // 2"));
    assertEquals(3d, eval("7.5 // 2"));
    assertEquals(-4d, eval("(-7.5) // 2"));
    assertEquals(9d, eval("1 // 0.1"));
    assertEquals(-10d, eval("(-1) // 0.1"));
    assertEquals(0.09999999999999995d, eval("1 % 0.1"));
    assertEquals(1d, (Double)eval("(1 // 0.1) * 0.1 + 1 % 0.1"), 1e-15);
    assertEquals("", eval("\"ab\" * 0"));
    assertEquals(2.5d, eval("5 / 2"));
    assertEquals(0.5d, eval(".5"));
    assertEquals("ababab", eval("\"ab\" * 3"));
    assertEquals("ababab", eval("3 * \"ab\""));

    assertThrows(ArithmeticException.class, () -> eval("1 / 0"));
    assertThrows(ArithmeticException.class, () -> eval("1 % 0"));
    assertThrows(ArithmeticException.class, () -> eval("1 // 0"));
    assertThrows(ArithmeticException.class, () -> eval("(-8) ^ 0.5"));
    assertThrows(ArithmeticException.class, () -> eval("(-1)!"));
    assertThrows(ArithmeticException.class, () -> eval("2.5!"));

    evalFail("\"a\" - \"b\"", EvalException.ErrorType.INVALID_CONVERSION);
    evalFail("\"ab\" * 1.5", EvalException.ErrorType.INVALID_CONVERSION);
    evalFail("\"ab\" * 1500000000", EvalException.ErrorType.INVALID_ARGUMENT);
    evalFail("-\"a\"", EvalException.ErrorType.INVALID_CONVERSION);
  }

  @Test
  public void testParseFailures() throws Exception
  {
    parseFail("", EvalException.ErrorType.SYNTAX);
    parseFail("   ", EvalException.ErrorType.SYNTAX);
    parseFail(null, EvalException.ErrorType.SYNTAX);
    parseFail("5!!", EvalException.ErrorType.SYNTAX);
    parseFail("2 3", EvalException.ErrorType.SYNTAX);
    parseFail("2 (3)", EvalException.ErrorType.SYNTAX);
    parseFail("sum(1,,2)", EvalException.ErrorType.SYNTAX);
    parseFail("sum(1, 2,)", EvalException.ErrorType.SYNTAX);
    parseFail("(1 + 2", EvalException.ErrorType.SYNTAX);
    parseFail("1 + 2)", EvalException.ErrorType.SYNTAX);
    parseFail("\"abc", EvalException.ErrorType.SYNTAX);
    parseFail("[abc", EvalException.ErrorType.SYNTAX);
    parseFail("2 $ 3", EvalException.ErrorType.INVALID_OPERATOR);
    parseFail("2 = 3", EvalException.ErrorType.INVALID_OPERATOR);
    parseFail("foo(1)", EvalException.ErrorType.INVALID_FUNCTION);
    parseFail("1 + (2 * bar(3))", EvalException.ErrorType.INVALID_FUNCTION);
  }

  @Test
  public void testEvalFailures() throws Exception
  {
    evalFail("5 ! 3", EvalException.ErrorType.EXTRA_OPERAND);
    evalFail("2 +", EvalException.ErrorType.MISSING_OPERAND);
    evalFail("* 2", EvalException.ErrorType.MISSING_OPERAND);
    evalFail("2 * ", EvalException.ErrorType.MISSING_OPERAND);
    evalFail("()", EvalException.ErrorType.MISSING_OPERAND);
    evalFail("sum()", EvalException.ErrorType.MISSING_ARGUMENT);
  }

  @Test
  public void testReuseExpression() throws Exception
  {
    DefaultEvalConfig config = new DefaultEvalConfig();
    Expression expr = Formulator.parse("([x] + 1) * 2", config);

    assertEquals(10d, expr.eval(new MapEvalContext(
                                    Collections.singletonMap("x", 4), config)));
    assertEquals(10d, expr.eval(new MapEvalContext(
                                    Collections.singletonMap("x", 4), config)));
    assertEquals(4d, expr.eval(new MapEvalContext(
                                   Collections.singletonMap("x", 1), config)));

    assertEquals("([x] + 1) * 2", expr.toRawString());
    assertEquals("([x] + 1) * 2", expr.toString());
    assertEquals("([x] + 1) * 2", expr.toCleanString());

    // clean strings parse to equivalent expressions
    for(String exprStr : new String[]{"2*-3+4", "sum( 1 ,[a] )^2",
                                      "(+-5)!", "[a]<=\"b\"\"c\""}) {
      String cleanStr = Formulator.parse(exprStr, config).toCleanString();
      assertEquals(cleanStr,
                   Formulator.parse(cleanStr, config).toCleanString());
    }
  }

  @Test
  public void testCollectVariables() throws Exception
  {
    Expression expr = Formulator.parse(
        "[a] + sum([b], ([c] * 2)) > pi | isNull([a])",
        new DefaultEvalConfig());
    List<String> vars = new ArrayList<String>();
    expr.collectVariables(vars);
    assertEquals(Arrays.asList("a", "b", "c", "a"), vars);
  }

  private static void validateExpr(String exprStr, String debugStr) {
    validateExpr(exprStr, debugStr, exprStr);
  }

  private static void validateExpr(String exprStr, String debugStr,
                                   String cleanStr) {
    Expression expr = Formulator.parse(exprStr, new DefaultEvalConfig());
    assertEquals(debugStr, expr.toDebugString());
    assertEquals(cleanStr, expr.toCleanString());
    assertEquals(exprStr, expr.toRawString());
  }

  static Object eval(String exprStr) {
    return eval(exprStr, Collections.<String,Object>emptyMap());
  }

  static Object eval(String exprStr, Map<String,?> vars) {
    DefaultEvalConfig config = new DefaultEvalConfig();
    Expression expr = Formulator.parse(exprStr, config);
    return expr.eval(new MapEvalContext(vars, config));
  }

  static EvalException evalFail(String exprStr,
                                EvalException.ErrorType errorType) {
    return evalFail(exprStr, Collections.<String,Object>emptyMap(), errorType);
  }

  static EvalException evalFail(String exprStr, Map<String,?> vars,
                                EvalException.ErrorType errorType) {
    EvalException e = assertThrows(EvalException.class,
                                   () -> eval(exprStr, vars));
    assertEquals(errorType, e.getErrorType(), e.getMessage());
    return e;
  }

  private static void parseFail(String exprStr,
                                EvalException.ErrorType errorType) {
    ParseException e = assertThrows(
        ParseException.class,
        () -> Formulator.parse(exprStr, new DefaultEvalConfig()));
    assertEquals(errorType, e.getErrorType(), e.getMessage());
  }
}
