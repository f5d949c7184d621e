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

import java.time.LocalDateTime;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.time.format.TextStyle;
import java.time.temporal.ChronoField;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import com.healthmarketscience.formula.expr.EvalException;

/**
 * Support for strptime style date/time formats, e.g. {@code "%Y-%m-%d"}.
 *
 * @author James Ahlborn
 */
public class FormatUtil
{
  private static final char DIRECTIVE_CHAR = '%';
  private static final char SPACE_CHAR = ' ';
  private static final Pattern WHITESPACE_PAT = Pattern.compile("\\s+");

  /** fields which are not part of a format default to 1900-01-01 00:00:00 */
  private static final int DEFAULT_YEAR = 1900;
  /** two digit years are interpreted in the range 1969-2068 */
  private static final int TWO_DIGIT_YEAR_BASE = 1969;

  private FormatUtil() {}

  /**
   * Parses the given text using the given strptime style format.  Any run
   * of whitespace in the format matches any (non-empty) run of whitespace in
   * the text.
   *
   * @throws EvalException if the format is invalid or the text does not
   *         match the format
   */
  public static LocalDateTime parseDateTime(String text, String fmtStr,
                                            Locale locale) {
    DateTimeFormatter fmt = createFormatter(fmtStr, locale);
    try {
      return LocalDateTime.parse(collapseWhitespace(text), fmt);
    } catch(DateTimeParseException e) {
      throw new EvalException(
          EvalException.ErrorType.INVALID_ARGUMENT,
          "Date '" + text + "' does not match format '" + fmtStr + "'", e);
    }
  }

  /**
   * Converts the given strptime style format to a DateTimeFormatter.
   *
   * @throws EvalException if the format contains an unsupported directive
   */
  public static DateTimeFormatter createFormatter(String fmtStr,
                                                  Locale locale) {
    DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder()
      .parseCaseInsensitive();
    Set<ChronoField> fields = EnumSet.noneOf(ChronoField.class);

    String fmt = collapseWhitespace(fmtStr);
    int len = fmt.length();
    for(int i = 0; i < len; ++i) {
      char c = fmt.charAt(i);
      if(c != DIRECTIVE_CHAR) {
        builder.appendLiteral(c);
        continue;
      }

      if(++i >= len) {
        throw invalidFormat(fmtStr, "stray '" + DIRECTIVE_CHAR + "'");
      }

      char d = fmt.charAt(i);
      switch(d) {
      case 'Y':
        builder.appendValue(ChronoField.YEAR, 4);
        fields.add(ChronoField.YEAR);
        break;
      case 'y':
        builder.appendValueReduced(ChronoField.YEAR, 2, 2, TWO_DIGIT_YEAR_BASE);
        fields.add(ChronoField.YEAR);
        break;
      case 'm':
        appendNumber(builder, ChronoField.MONTH_OF_YEAR, 2, fields);
        break;
      case 'b':
        appendText(builder, ChronoField.MONTH_OF_YEAR, TextStyle.SHORT, fields);
        break;
      case 'B':
        appendText(builder, ChronoField.MONTH_OF_YEAR, TextStyle.FULL, fields);
        break;
      case 'd':
        appendNumber(builder, ChronoField.DAY_OF_MONTH, 2, fields);
        break;
      case 'j':
        appendNumber(builder, ChronoField.DAY_OF_YEAR, 3, fields);
        break;
      case 'a':
        appendText(builder, ChronoField.DAY_OF_WEEK, TextStyle.SHORT, fields);
        break;
      case 'A':
        appendText(builder, ChronoField.DAY_OF_WEEK, TextStyle.FULL, fields);
        break;
      case 'H':
        appendNumber(builder, ChronoField.HOUR_OF_DAY, 2, fields);
        break;
      case 'I':
        appendNumber(builder, ChronoField.CLOCK_HOUR_OF_AMPM, 2, fields);
        break;
      case 'p':
        appendText(builder, ChronoField.AMPM_OF_DAY, TextStyle.SHORT, fields);
        break;
      case 'M':
        appendNumber(builder, ChronoField.MINUTE_OF_HOUR, 2, fields);
        break;
      case 'S':
        appendNumber(builder, ChronoField.SECOND_OF_MINUTE, 2, fields);
        break;
      case 'f':
        // fractional digits, e.g. "5" is half a second
        builder.appendFraction(ChronoField.NANO_OF_SECOND, 1, 6, false);
        fields.add(ChronoField.NANO_OF_SECOND);
        break;
      case DIRECTIVE_CHAR:
        builder.appendLiteral(DIRECTIVE_CHAR);
        break;
      default:
        throw invalidFormat(fmtStr, "unsupported directive '" +
                            DIRECTIVE_CHAR + d + "'");
      }
    }

    addDefaults(builder, fields);

    return builder.toFormatter(locale)
      .withChronology(IsoChronology.INSTANCE)
      .withResolverStyle(ResolverStyle.STRICT);
  }

  private static String collapseWhitespace(String str) {
    return WHITESPACE_PAT.matcher(str).replaceAll(String.valueOf(SPACE_CHAR));
  }

  private static void addDefaults(DateTimeFormatterBuilder builder,
                                  Set<ChronoField> fields) {
    if(!fields.contains(ChronoField.YEAR)) {
      builder.parseDefaulting(ChronoField.YEAR, DEFAULT_YEAR);
    }
    if(!fields.contains(ChronoField.DAY_OF_YEAR)) {
      if(!fields.contains(ChronoField.MONTH_OF_YEAR)) {
        builder.parseDefaulting(ChronoField.MONTH_OF_YEAR, 1);
      }
      if(!fields.contains(ChronoField.DAY_OF_MONTH)) {
        builder.parseDefaulting(ChronoField.DAY_OF_MONTH, 1);
      }
    }

    if(fields.contains(ChronoField.CLOCK_HOUR_OF_AMPM)) {
      if(!fields.contains(ChronoField.AMPM_OF_DAY)) {
        // 12 hour clock without a marker is the morning
        builder.parseDefaulting(ChronoField.AMPM_OF_DAY, 0);
      }
    } else if(!fields.contains(ChronoField.HOUR_OF_DAY)) {
      builder.parseDefaulting(ChronoField.HOUR_OF_DAY, 0);
    }
    if(!fields.contains(ChronoField.MINUTE_OF_HOUR)) {
      builder.parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0);
    }
    if(!fields.contains(ChronoField.SECOND_OF_MINUTE)) {
      builder.parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0);
    }
    if(!fields.contains(ChronoField.NANO_OF_SECOND)) {
      builder.parseDefaulting(ChronoField.NANO_OF_SECOND, 0);
    }
  }

  private static void appendNumber(DateTimeFormatterBuilder builder,
                                   ChronoField field, int maxWidth,
                                   Set<ChronoField> fields) {
    builder.appendValue(field, 1, maxWidth, SignStyle.NOT_NEGATIVE);
    fields.add(field);
  }

  private static void appendText(DateTimeFormatterBuilder builder,
                                 ChronoField field, TextStyle style,
                                 Set<ChronoField> fields) {
    builder.appendText(field, style);
    fields.add(field);
  }

  private static EvalException invalidFormat(String fmtStr, String msg) {
    return new EvalException(EvalException.ErrorType.INVALID_ARGUMENT,
                             "Invalid date format '" + fmtStr + "': " + msg);
  }
}
