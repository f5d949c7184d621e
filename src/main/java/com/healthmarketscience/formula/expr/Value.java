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

package com.healthmarketscience.formula.expr;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.Period;

/**
 * Wrapper for a typed primitive value used within the expression evaluation
 * engine.  Note that the "Null" value is represented by an actual Value
 * instance with the type of {@link Type#NULL}.  Also note that all the
 * conversion methods will throw an {@link EvalException} if the conversion is
 * not supported for the current value.
 *
 * @author James Ahlborn
 */
public interface Value
{
  /** the types supported within the expression evaluation engine */
  public enum Type
  {
    NULL, STRING, BOOLEAN, NUMBER, DATE_TIME, DURATION, PERIOD;

    /**
     * @return {@code true} if values of this type can take part in numeric
     *         arithmetic (booleans count as 1 and 0)
     */
    public boolean isNumeric() {
      return inRange(BOOLEAN, NUMBER);
    }

    /**
     * @return {@code true} if this type is an amount of time which can be
     *         added to a date/time
     */
    public boolean isTemporalAmount() {
      return inRange(DURATION, PERIOD);
    }

    private boolean inRange(Type start, Type end) {
      return ((start.ordinal() <= ordinal()) && (ordinal() <= end.ordinal()));
    }
  }

  /**
   * @return the type of this value
   */
  public Type getType();

  /**
   * @return the raw primitive value
   */
  public Object get();

  /**
   * @return {@code true} if this value represents a "Null" value,
   *         {@code false} otherwise.
   */
  public boolean isNull();

  /**
   * @return the "truthiness" of this value.  Null, empty strings, zero and
   *         zero length amounts of time are {@code false}, everything else
   *         is {@code true}.
   */
  public boolean getAsBoolean();

  /**
   * @return this primitive value converted to a String
   */
  public String getAsString();

  /**
   * @return this primitive value converted to a double
   */
  public Double getAsDouble();

  /**
   * @return this primitive value converted to a date/time
   */
  public LocalDateTime getAsLocalDateTime();

  /**
   * @return this primitive value converted to a fixed length of time
   */
  public Duration getAsDuration();

  /**
   * @return this primitive value converted to a calendar offset
   */
  public Period getAsPeriod();
}
