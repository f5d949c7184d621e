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

import java.util.Map;

import com.healthmarketscience.formula.expr.EvalConfig;
import com.healthmarketscience.formula.expr.EvalContext;
import com.healthmarketscience.formula.expr.EvalException;
import com.healthmarketscience.formula.expr.Expression;
import com.healthmarketscience.formula.expr.FunctionLookup;
import com.healthmarketscience.formula.expr.ParseException;
import com.healthmarketscience.formula.impl.expr.DefaultEvalConfig;
import com.healthmarketscience.formula.impl.expr.Formulator;
import com.healthmarketscience.formula.impl.expr.MapEvalContext;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Entry point for parsing and evaluating formulas.
 * <p/>
 * Simple usage:
 * <pre>
 *   Object result = Formulas.evaluate("[x] * 2 + 1",
 *                                     Collections.singletonMap("x", 4));
 * </pre>
 * A parsed {@link Expression} may be evaluated any number of times:
 * <pre>
 *   Expression expr = Formulas.parse("asDate([start], \"%Y-%m-%d\") + days(1)");
 *   Object tomorrow = expr.eval(Formulas.newEvalContext(vars));
 * </pre>
 *
 * @author James Ahlborn
 */
public class Formulas
{
  private static final Log LOG = LogFactory.getLog(Formulas.class);

  /** system property which can be used to set the default time zone used
      by the {@code today()} function. */
  public static final String TIMEZONE_PROPERTY =
    "com.healthmarketscience.formula.timeZone";

  /** system property which can be used to set the default date format used
      by the {@code asDate()} function (a strptime style format). */
  public static final String DATE_FORMAT_PROPERTY =
    "com.healthmarketscience.formula.dateFormat";

  private Formulas() {}

  /**
   * @return a new EvalConfig initialized with the default settings
   */
  public static EvalConfig newEvalConfig() {
    return new DefaultEvalConfig();
  }

  /**
   * Parses the given expression using the default configuration.
   *
   * @throws ParseException if the expression is malformed
   */
  public static Expression parse(String exprStr) {
    return parse(exprStr, null);
  }

  /**
   * Parses the given expression using the given configuration (may be
   * {@code null} for the default configuration).
   *
   * @throws ParseException if the expression is malformed
   */
  public static Expression parse(String exprStr, EvalConfig config) {
    return Formulator.parse(exprStr, toParseContext(config));
  }

  /**
   * @return a new EvalContext for the given variables using the default
   *         configuration
   */
  public static EvalContext newEvalContext(Map<String,?> vars) {
    return newEvalContext(vars, null);
  }

  /**
   * @return a new EvalContext for the given variables using the given
   *         configuration (may be {@code null} for the default
   *         configuration)
   */
  public static EvalContext newEvalContext(Map<String,?> vars,
                                           EvalConfig config) {
    return new MapEvalContext(vars, ((config != null) ? config :
                                     newEvalConfig()));
  }

  /**
   * Parses and evaluates the given expression with the given variables.
   *
   * @return the result as a native java value ({@code Double},
   *         {@code String}, {@code Boolean}, {@code LocalDateTime},
   *         {@code Duration}, {@code Period} or {@code null})
   * @throws EvalException if parsing or evaluation fails
   * @throws ArithmeticException for arithmetic failures (e.g. division by
   *         zero)
   */
  public static Object evaluate(String exprStr, Map<String,?> vars) {
    return evaluate(exprStr, vars, null);
  }

  public static Object evaluate(String exprStr, Map<String,?> vars,
                                EvalConfig config) {
    if(config == null) {
      config = newEvalConfig();
    }
    Expression expr = parse(exprStr, config);
    try {
      return expr.eval(newEvalContext(vars, config));
    } catch(RuntimeException e) {
      if(LOG.isDebugEnabled()) {
        LOG.debug("Failed evaluating " + expr.toDebugString(), e);
      }
      throw e;
    }
  }

  private static Formulator.ParseContext toParseContext(
      final EvalConfig config) {
    if(config instanceof Formulator.ParseContext) {
      return (Formulator.ParseContext)config;
    }
    final EvalConfig parseConfig = ((config != null) ? config :
                                    newEvalConfig());
    return new Formulator.ParseContext() {
      @Override
      public FunctionLookup getFunctionLookup() {
        return parseConfig.getFunctionLookup();
      }
    };
  }
}
