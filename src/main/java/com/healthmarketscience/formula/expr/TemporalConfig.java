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

import java.util.Locale;

/**
 * A TemporalConfig encapsulates date/time parsing options for expression
 * evaluation.  The default {@link #DEFAULT} instance provides US specific
 * locale configuration and the {@code "%m/%d/%Y"} default date format.
 * <p/>
 * Date formats use the strptime style directives documented in
 * {@link com.healthmarketscience.formula.expr the package docs}.
 *
 * @author James Ahlborn
 */
public class TemporalConfig
{
  public static final String US_DATE_FORMAT = "%m/%d/%Y";

  /** default implementation which is configured for the US locale */
  public static final TemporalConfig DEFAULT =
    new TemporalConfig(US_DATE_FORMAT, Locale.US);

  private final String _dateFormat;
  private final Locale _locale;

  /**
   * Instantiates a new TemporalConfig with the given configuration.
   *
   * @param dateFormat the format used by {@code asDate} when no explicit
   *                   format is given
   * @param locale the locale used for month and day names and the am/pm
   *               markers
   */
  public TemporalConfig(String dateFormat, Locale locale)
  {
    if((dateFormat == null) || (locale == null)) {
      throw new IllegalArgumentException(
          "date format and locale must be non-null");
    }
    _dateFormat = dateFormat;
    _locale = locale;
  }

  public String getDateFormat() {
    return _dateFormat;
  }

  public Locale getLocale() {
    return _locale;
  }

  /**
   * @return a copy of this config which uses the given default date format
   */
  public TemporalConfig withDateFormat(String dateFormat) {
    return new TemporalConfig(dateFormat, _locale);
  }

  @Override
  public String toString() {
    return "TemporalConfig[" + _dateFormat + ", " + _locale + "]";
  }
}
