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
import java.time.LocalDateTime;
import java.time.Period;

import com.healthmarketscience.formula.expr.EvalException;
import com.healthmarketscience.formula.expr.Value;

/**
 *
 * @author James Ahlborn
 */
public abstract class BaseValue implements Value
{
  @Override
  public boolean isNull() {
    return(getType() == Type.NULL);
  }

  @Override
  public boolean getAsBoolean() {
    return true;
  }

  @Override
  public String getAsString() {
    throw invalidConversion(Type.STRING);
  }

  @Override
  public Double getAsDouble() {
    throw invalidConversion(Type.NUMBER);
  }

  @Override
  public LocalDateTime getAsLocalDateTime() {
    throw invalidConversion(Type.DATE_TIME);
  }

  @Override
  public Duration getAsDuration() {
    throw invalidConversion(Type.DURATION);
  }

  @Override
  public Period getAsPeriod() {
    throw invalidConversion(Type.PERIOD);
  }

  protected EvalException invalidConversion(Type newType) {
    return new EvalException(
        EvalException.ErrorType.INVALID_CONVERSION,
        this + " cannot be converted to " + newType);
  }

  @Override
  public String toString() {
    return "Value[" + getType() + "] '" + get() + "'";
  }
}
