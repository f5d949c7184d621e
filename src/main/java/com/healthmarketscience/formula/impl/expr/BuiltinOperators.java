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
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.Period;
import java.time.temporal.TemporalAmount;

import com.healthmarketscience.formula.expr.EvalException;
import com.healthmarketscience.formula.expr.Value;
import org.apache.commons.lang3.StringUtils;
import static com.healthmarketscience.formula.impl.expr.ValueSupport.*;


/**
 * Implementations of the operators and comparators supported by the
 * expression engine.  A "Null" operand is never silently propagated, it
 * results in an {@link EvalException.ErrorType#INVALID_CONVERSION} failure.
 *
 * @author James Ahlborn
 */
public class BuiltinOperators
{
  static final String DIV_BY_ZERO = "/ by zero";
  static final String MATH_DOMAIN = "math domain error";

  private static final int NANOS_SCALE = 9;

  private BuiltinOperators() {}

  public static Value abs(Value param1) {
    Value.Type type = param1.getType();

    if(type.isNumeric()) {
      return toValue(Math.abs(param1.getAsDouble()));
    }

    switch(type) {
    case DURATION:
      return toValue(param1.getAsDuration().abs());
    case PERIOD:
      Period p = param1.getAsPeriod();
      return toValue(p.isNegative() ? p.negated() : p);
    default:
      throw unsupported("+", param1);
    }
  }

  public static Value negate(Value param1) {
    Value.Type type = param1.getType();

    if(type.isNumeric()) {
      return toValue(-param1.getAsDouble());
    }

    switch(type) {
    case DURATION:
      return toValue(param1.getAsDuration().negated());
    case PERIOD:
      return toValue(param1.getAsPeriod().negated());
    default:
      throw unsupported("-", param1);
    }
  }

  public static Value add(Value param1, Value param2) {
    Value.Type type1 = param1.getType();
    Value.Type type2 = param2.getType();

    if(type1.isNumeric() && type2.isNumeric()) {
      return toValue(param1.getAsDouble() + param2.getAsDouble());
    }

    if((type1 == Value.Type.STRING) && (type2 == Value.Type.STRING)) {
      return toValue(param1.getAsString() + param2.getAsString());
    }

    if((type1 == Value.Type.DATE_TIME) && type2.isTemporalAmount()) {
      return plus(param1.getAsLocalDateTime(), (TemporalAmount)param2.get());
    }
    if(type1.isTemporalAmount() && (type2 == Value.Type.DATE_TIME)) {
      return plus(param2.getAsLocalDateTime(), (TemporalAmount)param1.get());
    }

    if((type1 == Value.Type.DURATION) && (type2 == Value.Type.DURATION)) {
      return toValue(param1.getAsDuration().plus(param2.getAsDuration()));
    }
    if((type1 == Value.Type.PERIOD) && (type2 == Value.Type.PERIOD)) {
      return toValue(param1.getAsPeriod().plus(param2.getAsPeriod()));
    }

    throw unsupported("+", param1, param2);
  }

  public static Value subtract(Value param1, Value param2) {
    Value.Type type1 = param1.getType();
    Value.Type type2 = param2.getType();

    if(type1.isNumeric() && type2.isNumeric()) {
      return toValue(param1.getAsDouble() - param2.getAsDouble());
    }

    if(type1 == Value.Type.DATE_TIME) {
      if(type2 == Value.Type.DATE_TIME) {
        return toValue(Duration.between(param2.getAsLocalDateTime(),
                                        param1.getAsLocalDateTime()));
      }
      if(type2.isTemporalAmount()) {
        return minus(param1.getAsLocalDateTime(), (TemporalAmount)param2.get());
      }
    }

    if((type1 == Value.Type.DURATION) && (type2 == Value.Type.DURATION)) {
      return toValue(param1.getAsDuration().minus(param2.getAsDuration()));
    }
    if((type1 == Value.Type.PERIOD) && (type2 == Value.Type.PERIOD)) {
      return toValue(param1.getAsPeriod().minus(param2.getAsPeriod()));
    }

    throw unsupported("-", param1, param2);
  }

  public static Value multiply(Value param1, Value param2) {
    Value.Type type1 = param1.getType();
    Value.Type type2 = param2.getType();

    if(type1.isNumeric() && type2.isNumeric()) {
      return toValue(param1.getAsDouble() * param2.getAsDouble());
    }

    // the remaining supported forms are commutative, so normalize the
    // numeric operand to the right
    if(type1.isNumeric()) {
      Value tmp = param1;
      param1 = param2;
      param2 = tmp;
      type1 = param1.getType();
      type2 = param2.getType();
    }

    if(!type2.isNumeric()) {
      throw unsupported("*", param1, param2);
    }

    switch(type1) {
    case STRING:
      return repeat(param1, param2);
    case DURATION:
      return toValue(scale(param1.getAsDuration(),
                           toDecimal(param2.getAsDouble())));
    case PERIOD:
      return toValue(param1.getAsPeriod().multipliedBy(
                         toCount("*", param1, param2)));
    default:
      throw unsupported("*", param1, param2);
    }
  }

  public static Value divide(Value param1, Value param2) {
    Value.Type type1 = param1.getType();
    Value.Type type2 = param2.getType();

    if(type1.isNumeric() && type2.isNumeric()) {
      double d2 = param2.getAsDouble();
      if(d2 == 0.0d) {
        throw new ArithmeticException(DIV_BY_ZERO);
      }
      return toValue(param1.getAsDouble() / d2);
    }

    if(type1 == Value.Type.DURATION) {
      if(type2.isNumeric()) {
        BigDecimal divisor = toDecimal(param2.getAsDouble());
        if(divisor.signum() == 0) {
          throw new ArithmeticException(DIV_BY_ZERO);
        }
        return toValue(toDuration(toSeconds(param1.getAsDuration()).divide(
                                      divisor, NANOS_SCALE,
                                      RoundingMode.HALF_EVEN)));
      }
      if(type2 == Value.Type.DURATION) {
        Duration d2 = param2.getAsDuration();
        if(d2.isZero()) {
          throw new ArithmeticException(DIV_BY_ZERO);
        }
        return toValue(toSeconds(param1.getAsDuration()).doubleValue() /
                       toSeconds(d2).doubleValue());
      }
    }

    throw unsupported("/", param1, param2);
  }

  public static Value intDivide(Value param1, Value param2) {
    double d2 = getNumericOperand("//", param1, param2, param2);
    double d1 = getNumericOperand("//", param1, param2, param1);
    if(d2 == 0.0d) {
      throw new ArithmeticException(DIV_BY_ZERO);
    }
    // computed from the floored remainder so that
    // (d1 // d2) * d2 + (d1 % d2) == d1
    double mod = d1 % d2;
    double div = (d1 - mod) / d2;
    if((mod != 0.0d) && ((mod < 0.0d) != (d2 < 0.0d))) {
      div -= 1.0d;
    }
    if(div == 0.0d) {
      return toValue(Math.copySign(0.0d, d1 / d2));
    }
    double floorDiv = Math.floor(div);
    if((div - floorDiv) > 0.5d) {
      floorDiv += 1.0d;
    }
    return toValue(floorDiv);
  }

  public static Value mod(Value param1, Value param2) {
    double d2 = getNumericOperand("%", param1, param2, param2);
    double d1 = getNumericOperand("%", param1, param2, param1);
    if(d2 == 0.0d) {
      throw new ArithmeticException(DIV_BY_ZERO);
    }
    // result takes the sign of the divisor
    double result = d1 % d2;
    if((result != 0.0d) && ((result < 0.0d) != (d2 < 0.0d))) {
      result += d2;
    }
    return toValue(result);
  }

  public static Value exp(Value param1, Value param2) {
    double d1 = getNumericOperand("^", param1, param2, param1);
    double d2 = getNumericOperand("^", param1, param2, param2);
    return toValue(checkDomain(Math.pow(d1, d2)));
  }

  public static Value factorial(Value param1) {
    if(!param1.getType().isNumeric()) {
      throw unsupported("!", param1);
    }
    double d = param1.getAsDouble();
    if((d < 0.0d) || !isIntegral(d)) {
      throw new ArithmeticException(
          "factorial() only accepts non-negative integral values");
    }
    double result = 1.0d;
    for(long i = 2; i <= (long)d; ++i) {
      result *= i;
      if(Double.isInfinite(result)) {
        break;
      }
    }
    return toValue(checkDomain(result));
  }

  public static Value equals(Value param1, Value param2) {
    return toValue(areEqual(param1, param2));
  }

  public static Value notEquals(Value param1, Value param2) {
    return toValue(!areEqual(param1, param2));
  }

  public static Value lessThan(Value param1, Value param2) {
    return toValue(compare(param1, param2) < 0);
  }

  public static Value lessThanEq(Value param1, Value param2) {
    return toValue(compare(param1, param2) <= 0);
  }

  public static Value greaterThan(Value param1, Value param2) {
    return toValue(compare(param1, param2) > 0);
  }

  public static Value greaterThanEq(Value param1, Value param2) {
    return toValue(compare(param1, param2) >= 0);
  }

  /**
   * Returns the first operand if it is "truthy", otherwise the second.
   * The second operand is only evaluated if necessary.
   */
  public static Value or(Value param1, Value param2) {
    return (param1.getAsBoolean() ? param1 : param2);
  }

  /**
   * Returns the first operand if it is not "truthy", otherwise the second.
   * The second operand is only evaluated if necessary.
   */
  public static Value and(Value param1, Value param2) {
    return (!param1.getAsBoolean() ? param1 : param2);
  }

  public static Value strictOr(Value param1, Value param2) {
    return toValue(param1.getAsBoolean() || param2.getAsBoolean());
  }

  public static Value strictAnd(Value param1, Value param2) {
    return toValue(param1.getAsBoolean() && param2.getAsBoolean());
  }

  static boolean areEqual(Value param1, Value param2) {
    if(param1.isNull() || param2.isNull()) {
      return (param1.isNull() && param2.isNull());
    }

    Value.Type type1 = param1.getType();
    Value.Type type2 = param2.getType();

    if(type1.isNumeric() && type2.isNumeric()) {
      return (param1.getAsDouble().doubleValue() ==
              param2.getAsDouble().doubleValue());
    }

    return ((type1 == type2) && param1.get().equals(param2.get()));
  }

  @SuppressWarnings("unchecked")
  static int compare(Value param1, Value param2) {
    Value.Type type1 = param1.getType();
    Value.Type type2 = param2.getType();

    if(type1.isNumeric() && type2.isNumeric()) {
      return Double.compare(param1.getAsDouble(), param2.getAsDouble());
    }

    if(type1 == type2) {
      switch(type1) {
      case STRING:
      case DATE_TIME:
      case DURATION:
        return ((Comparable<Object>)param1.get()).compareTo(param2.get());
      default:
        // fall through
      }
    }

    throw new EvalException(
        EvalException.ErrorType.INVALID_CONVERSION,
        "Cannot compare " + param1 + " and " + param2);
  }

  static double checkDomain(double result) {
    if(Double.isNaN(result) || Double.isInfinite(result)) {
      throw new ArithmeticException(MATH_DOMAIN);
    }
    return result;
  }

  /**
   * Converts the given (possibly fractional) number of seconds to a
   * Duration with nanosecond precision.
   */
  static Duration toDuration(BigDecimal secs) {
    BigDecimal whole = secs.setScale(0, RoundingMode.FLOOR);
    long nanos = secs.subtract(whole).movePointRight(NANOS_SCALE)
      .setScale(0, RoundingMode.HALF_EVEN).longValueExact();
    return Duration.ofSeconds(whole.longValueExact(), nanos);
  }

  static BigDecimal toDecimal(double d) {
    return BigDecimal.valueOf(checkDomain(d));
  }

  private static BigDecimal toSeconds(Duration d) {
    return BigDecimal.valueOf(d.getSeconds()).add(
        BigDecimal.valueOf(d.getNano(), NANOS_SCALE));
  }

  private static Duration scale(Duration d, BigDecimal factor) {
    return toDuration(toSeconds(d).multiply(factor));
  }

  private static Value repeat(Value param1, Value param2) {
    String str = param1.getAsString();
    int count = toCount("*", param1, param2);
    if(((long)str.length() * count) > Integer.MAX_VALUE) {
      throw new EvalException(
          EvalException.ErrorType.INVALID_ARGUMENT,
          "Repeated string would be too long: " + param1 + " * " + count);
    }
    return toValue(StringUtils.repeat(str, count));
  }

  private static Value plus(LocalDateTime ldt, TemporalAmount amt) {
    try {
      return toValue(ldt.plus(amt));
    } catch(DateTimeException e) {
      throw dateOutOfRange(ldt, amt, e);
    }
  }

  private static Value minus(LocalDateTime ldt, TemporalAmount amt) {
    try {
      return toValue(ldt.minus(amt));
    } catch(DateTimeException e) {
      throw dateOutOfRange(ldt, amt, e);
    }
  }

  private static ArithmeticException dateOutOfRange(
      LocalDateTime ldt, TemporalAmount amt, DateTimeException e) {
    ArithmeticException ae = new ArithmeticException(
        "date value out of range: " + ldt + " and " + amt);
    ae.initCause(e);
    return ae;
  }

  private static int toCount(String op, Value param1, Value param2) {
    double d = param2.getAsDouble();
    if(!isIntegral(d) || (d > Integer.MAX_VALUE) || (d < Integer.MIN_VALUE)) {
      throw unsupported(op, param1, param2);
    }
    return (int)d;
  }

  private static double getNumericOperand(String op, Value param1,
                                          Value param2, Value operand) {
    if(!operand.getType().isNumeric()) {
      throw unsupported(op, param1, param2);
    }
    return operand.getAsDouble();
  }

  private static EvalException unsupported(String op, Value param1) {
    return new EvalException(
        EvalException.ErrorType.INVALID_CONVERSION,
        "Unsupported operand type for '" + op + "': " + param1);
  }

  private static EvalException unsupported(String op, Value param1,
                                           Value param2) {
    return new EvalException(
        EvalException.ErrorType.INVALID_CONVERSION,
        "Unsupported operand types for '" + op + "': " + param1 + " and " +
        param2);
  }
}
