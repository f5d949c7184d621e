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

package com.healthmarketscience.formula;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import com.healthmarketscience.formula.expr.EvalConfig;
import com.healthmarketscience.formula.expr.EvalContext;
import com.healthmarketscience.formula.expr.EvalException;
import com.healthmarketscience.formula.expr.Expression;
import com.healthmarketscience.formula.expr.Function;
import com.healthmarketscience.formula.expr.FunctionLookup;
import com.healthmarketscience.formula.expr.ParseException;
import com.healthmarketscience.formula.expr.TemporalConfig;
import com.healthmarketscience.formula.expr.Value;
import com.healthmarketscience.formula.impl.expr.DefaultFunctions;
import com.healthmarketscience.formula.impl.expr.FunctionSupport;
import com.healthmarketscience.formula.impl.expr.ValueSupport;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author James Ahlborn
 */
public class FormulasTest
{

  @Test
  public void testEvaluate() throws Exception
  {
    assertEquals(14d, Formulas.evaluate("2 + 3 * 4", null));
    assertEquals(9d, Formulas.evaluate("[x] * 2 + 1",
                                       Collections.singletonMap("x", 4)));
    assertNull(Formulas.evaluate("[x]", Collections.<String,Object>emptyMap()));
    assertEquals("ab", Formulas.evaluate("[a] + [b]", vars("a", "a", "b", "b")));
    assertEquals(LocalDateTime.of(1995, 4, 14, 0, 0),
                 Formulas.evaluate(
                     "asDate(\"1995-02-14\",\"%Y-%m-%d\") + months(2)", null));
    assertEquals(LocalDateTime.of(2020, 2, 4, 0, 0),
                 Formulas.evaluate("[d] + days(1)",
                                   vars("d", LocalDate.of(2020, 2, 3))));
    assertEquals(Duration.ofHours(3),
                 Formulas.evaluate("[d] + hours(1)",
                                   vars("d", Duration.ofHours(2))));
    assertEquals(Boolean.TRUE, Formulas.evaluate("[v] == 2.5",
                                                 vars("v", 2.5f)));

    EvalException e = assertThrows(
        EvalException.class,
        () -> Formulas.evaluate("[x] + 1", vars("x", new Object())));
    assertEquals(EvalException.ErrorType.INVALID_CONVERSION, e.getErrorType());

    ParseException pe = assertThrows(
        ParseException.class, () -> Formulas.evaluate("2 $ 3", null));
    assertEquals(EvalException.ErrorType.INVALID_OPERATOR, pe.getErrorType());

    assertThrows(ArithmeticException.class,
                 () -> Formulas.evaluate("[x] / 0", vars("x", 1)));
  }

  @Test
  public void testParseAndReuse() throws Exception
  {
    Expression expr = Formulas.parse("isNull([name]) | nchar([name]) > 3");

    assertEquals(Boolean.TRUE, expr.eval(Formulas.newEvalContext(
                                             vars("name", "frank"))));
    assertEquals(Boolean.FALSE, expr.eval(Formulas.newEvalContext(
                                              vars("name", "bob"))));
    assertEquals(Boolean.TRUE, expr.eval(Formulas.newEvalContext(
                                             vars("name", ""))));
    assertEquals(Boolean.TRUE, expr.eval(Formulas.newEvalContext(null)));
  }

  @Test
  public void testEvalConfig() throws Exception
  {
    EvalConfig config = Formulas.newEvalConfig();
    config.setClock(Clock.fixed(Instant.parse("2021-06-01T00:00:00Z"),
                                ZoneOffset.UTC));
    config.setTemporalConfig(new TemporalConfig("%d.%m.%Y", Locale.GERMANY));

    assertEquals(LocalDateTime.of(2021, 6, 1, 0, 0),
                 Formulas.evaluate("today()", null, config));
    assertEquals(LocalDateTime.of(2021, 3, 4, 0, 0),
                 Formulas.evaluate("asDate(\"4.3.2021\")", null, config));
    assertEquals(Duration.ofDays(89),
                 Formulas.evaluate("today() - asDate(\"4.3.2021\")", null,
                                   config));
  }

  @Test
  public void testCustomFunctions() throws Exception
  {
    final Function twice = new FunctionSupport.Func1("twice") {
      @Override
      protected Value eval1(EvalContext ctx, Value param) {
        return ValueSupport.toValue(param.getAsDouble() * 2);
      }
    };
    FunctionLookup lookup = new FunctionLookup() {
      public Function getFunction(String name) {
        if("twice".equalsIgnoreCase(name)) {
          return twice;
        }
        return DefaultFunctions.LOOKUP.getFunction(name);
      }
    };

    EvalConfig config = Formulas.newEvalConfig();
    config.setFunctionLookup(lookup);

    assertEquals(12d, Formulas.evaluate("twice(sum(1, 2)) * 2", null, config));
    assertEquals(8d, Formulas.evaluate("TWICE([x])", vars("x", 4), config));

    ParseException e = assertThrows(ParseException.class,
                                    () -> Formulas.evaluate("twice(1)", null));
    assertEquals(EvalException.ErrorType.INVALID_FUNCTION, e.getErrorType());

    // a config which is not one of ours is adapted for parsing
    EvalConfig wrapped = new WrappedEvalConfig(config);
    assertEquals(6d, Formulas.evaluate("twice(3)", null, wrapped));
    assertEquals(6d, Formulas.parse("twice(3)", wrapped)
                 .eval(Formulas.newEvalContext(null, wrapped)));
  }

  private static Map<String,Object> vars(Object... keyVals) {
    Map<String,Object> vars = new HashMap<String,Object>();
    for(int i = 0; i < keyVals.length; i += 2) {
      vars.put((String)keyVals[i], keyVals[i + 1]);
    }
    return vars;
  }

  private static final class WrappedEvalConfig implements EvalConfig
  {
    private final EvalConfig _delegate;

    private WrappedEvalConfig(EvalConfig delegate) {
      _delegate = delegate;
    }

    public TemporalConfig getTemporalConfig() {
      return _delegate.getTemporalConfig();
    }

    public void setTemporalConfig(TemporalConfig temporal) {
      _delegate.setTemporalConfig(temporal);
    }

    public FunctionLookup getFunctionLookup() {
      return _delegate.getFunctionLookup();
    }

    public void setFunctionLookup(FunctionLookup lookup) {
      _delegate.setFunctionLookup(lookup);
    }

    public Clock getClock() {
      return _delegate.getClock();
    }

    public void setClock(Clock clock) {
      _delegate.setClock(clock);
    }
  }
}
