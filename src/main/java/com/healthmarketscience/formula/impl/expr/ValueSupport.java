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

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Period;

import com.healthmarketscience.formula.expr.EvalException;
import com.healthmarketscience.formula.expr.Value;

/**
 *
 * @author James Ahlborn
 */
public class ValueSupport
{
  public static final Value NULL_VAL = new BaseValue() {
    @Override public boolean isNull() {
      return true;
    }
    @Override public boolean getAsBoolean() {
      return false;
    }
    public Type getType() {
      return Type.NULL;
    }
    public Object get() {
      return null;
    }
  };
  public static final Value TRUE_VAL = new BooleanValue(Boolean.TRUE);
  public static final Value FALSE_VAL = new BooleanValue(Boolean.FALSE);
  public static final Value EMPTY_STR_VAL = new StringValue("");

  private ValueSupport() {}

  public static Value toValue(boolean b) {
    return (b ? TRUE_VAL : FALSE_VAL);
  }

  public static Value toValue(String s) {
    return ((s != null) ? new StringValue(s) : NULL_VAL);
  }

  public static Value toValue(double d) {
    return new NumberValue(d);
  }

  public static Value toValue(Double d) {
    return ((d != null) ? new NumberValue(d) : NULL_VAL);
  }

  public static Value toValue(LocalDateTime ldt) {
    return ((ldt != null) ? new DateTimeValue(ldt) : NULL_VAL);
  }

  public static Value toValue(Duration d) {
    return ((d != null) ? new DurationValue(d) : NULL_VAL);
  }

  public static Value toValue(Period p) {
    return ((p != null) ? new PeriodValue(p) : NULL_VAL);
  }

  /**
   * Converts a caller supplied environment value into a Value.
   *
   * @throws EvalException if the given object is not of a supported type
   */
  public static Value toValue(Object obj) {
    if(obj == null) {
      return NULL_VAL;
    }
    if(obj instanceof Value) {
      return (Value)obj;
    }
    if(obj instanceof String) {
      return toValue((String)obj);
    }
    if(obj instanceof Boolean) {
      return toValue(((Boolean)obj).booleanValue());
    }
    if(obj instanceof Number) {
      return toValue(((Number)obj).doubleValue());
    }
    if(obj instanceof LocalDateTime) {
      return toValue((LocalDateTime)obj);
    }
    if(obj instanceof LocalDate) {
      return toValue(((LocalDate)obj).atStartOfDay());
    }
    if(obj instanceof Duration) {
      return toValue((Duration)obj);
    }
    if(obj instanceof Period) {
      return toValue((Period)obj);
    }
    throw new EvalException(
        EvalException.ErrorType.INVALID_CONVERSION,
        "Unsupported value type " + obj.getClass().getName());
  }

  static boolean isIntegral(double d) {
    return ((d == Math.rint(d)) && !Double.isInfinite(d));
  }
}
