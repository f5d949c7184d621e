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

import com.healthmarketscience.formula.expr.Value;

/**
 * A Value which is not computed until it is first used.
 *
 * @author James Ahlborn
 */
public abstract class BaseDelayedValue implements Value
{
  private Value _val;

  protected BaseDelayedValue() {
  }

  Value getDelegate() {
    if(_val == null) {
      _val = eval();
    }
    return _val;
  }

  @Override
  public boolean isNull() {
    return(getType() == Type.NULL);
  }

  @Override
  public Value.Type getType() {
    return getDelegate().getType();
  }

  @Override
  public Object get() {
    return getDelegate().get();
  }

  @Override
  public boolean getAsBoolean() {
    return getDelegate().getAsBoolean();
  }

  @Override
  public String getAsString() {
    return getDelegate().getAsString();
  }

  @Override
  public Double getAsDouble() {
    return getDelegate().getAsDouble();
  }

  @Override
  public LocalDateTime getAsLocalDateTime() {
    return getDelegate().getAsLocalDateTime();
  }

  @Override
  public Duration getAsDuration() {
    return getDelegate().getAsDuration();
  }

  @Override
  public Period getAsPeriod() {
    return getDelegate().getAsPeriod();
  }

  @Override
  public String toString() {
    return getDelegate().toString();
  }

  /**
   * Unwraps the given value if it is a delayed value.
   */
  static Value unwrap(Value val) {
    return ((val instanceof BaseDelayedValue) ?
            ((BaseDelayedValue)val).getDelegate() : val);
  }

  protected abstract Value eval();
}
