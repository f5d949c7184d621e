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

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.Period;
import java.util.concurrent.TimeUnit;

import com.healthmarketscience.formula.expr.EvalContext;
import com.healthmarketscience.formula.expr.EvalException;
import com.healthmarketscience.formula.expr.Function;
import com.healthmarketscience.formula.expr.Value;
import static com.healthmarketscience.formula.impl.expr.DefaultFunctions.*;
import static com.healthmarketscience.formula.impl.expr.FunctionSupport.*;

/**
 *
 * @author James Ahlborn
 */
public class DefaultDateFunctions
{
  private static final long SECONDS_PER_WEEK = TimeUnit.DAYS.toSeconds(7);

  private DefaultDateFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  public static final Function TODAY = registerFunc(new Func0("today") {
    @Override
    protected Value eval0(EvalContext ctx) {
      return ValueSupport.toValue(LocalDateTime.now(ctx.getClock()));
    }
  });

  public static final Function AS_DATE = registerFunc(new FuncVar("asDate", 1, 2) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      String fmtStr = ((params.length > 1) ? params[1].getAsString() :
                       ctx.getTemporalConfig().getDateFormat());
      return ValueSupport.toValue(FormatUtil.parseDateTime(
          params[0].getAsString(), fmtStr,
          ctx.getTemporalConfig().getLocale()));
    }
  });

  public static final Function SECONDS = registerFunc(
      new DurationFunc("seconds", 1L));
  public static final Function MINUTES = registerFunc(
      new DurationFunc("minutes", TimeUnit.MINUTES.toSeconds(1)));
  public static final Function HOURS = registerFunc(
      new DurationFunc("hours", TimeUnit.HOURS.toSeconds(1)));
  public static final Function DAYS = registerFunc(
      new DurationFunc("days", TimeUnit.DAYS.toSeconds(1)));
  public static final Function WEEKS = registerFunc(
      new DurationFunc("weeks", SECONDS_PER_WEEK));

  public static final Function MONTHS = registerFunc(new Func1("months") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(Period.ofMonths(getIntegral(this, param1)));
    }
  });

  public static final Function YEARS = registerFunc(new Func1("years") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(Period.ofYears(getIntegral(this, param1)));
    }
  });

  private static int getIntegral(Function func, Value param) {
    double d = param.getAsDouble();
    if(!ValueSupport.isIntegral(d) ||
       (d > Integer.MAX_VALUE) || (d < Integer.MIN_VALUE)) {
      throw new EvalException(
          EvalException.ErrorType.INVALID_ARGUMENT,
          "Function " + func.getName() + " requires an integral value, got " +
          param);
    }
    return (int)d;
  }

  /**
   * Creates a fixed length of time from a (possibly fractional) number of
   * units.
   */
  private static final class DurationFunc extends Func1
  {
    private final BigDecimal _unitSeconds;

    private DurationFunc(String name, long unitSeconds) {
      super(name);
      _unitSeconds = BigDecimal.valueOf(unitSeconds);
    }

    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      BigDecimal units = BuiltinOperators.toDecimal(param1.getAsDouble());
      return ValueSupport.toValue(
          BuiltinOperators.toDuration(units.multiply(_unitSeconds)));
    }
  }
}
