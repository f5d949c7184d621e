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

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;

import com.healthmarketscience.formula.Formulas;
import com.healthmarketscience.formula.expr.EvalConfig;
import com.healthmarketscience.formula.expr.EvalException;
import com.healthmarketscience.formula.expr.FunctionLookup;
import com.healthmarketscience.formula.expr.TemporalConfig;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Default, mutable EvalConfig.  Initial values are taken from the
 * {@link Formulas#TIMEZONE_PROPERTY} and {@link Formulas#DATE_FORMAT_PROPERTY}
 * system properties (if set).
 *
 * @author James Ahlborn
 */
public class DefaultEvalConfig implements EvalConfig, Formulator.ParseContext
{
  private static final Log LOG = LogFactory.getLog(DefaultEvalConfig.class);

  private TemporalConfig _temporal;
  private FunctionLookup _funcs;
  private Clock _clock;

  public DefaultEvalConfig() {
    setTemporalConfig(null);
    setFunctionLookup(null);
    setClock(null);
  }

  @Override
  public TemporalConfig getTemporalConfig() {
    return _temporal;
  }

  @Override
  public void setTemporalConfig(TemporalConfig temporal) {
    if(temporal == null) {
      temporal = getDefaultTemporalConfig();
    }
    _temporal = temporal;
  }

  @Override
  public FunctionLookup getFunctionLookup() {
    return _funcs;
  }

  @Override
  public void setFunctionLookup(FunctionLookup lookup) {
    if(lookup == null) {
      lookup = DefaultFunctions.LOOKUP;
    }
    _funcs = lookup;
  }

  @Override
  public Clock getClock() {
    return _clock;
  }

  @Override
  public void setClock(Clock clock) {
    if(clock == null) {
      clock = Clock.system(getDefaultZoneId());
    }
    _clock = clock;
  }

  /**
   * @return the default TemporalConfig, using the date format from the
   *         {@value com.healthmarketscience.formula.Formulas#DATE_FORMAT_PROPERTY}
   *         system property, if set
   */
  public static TemporalConfig getDefaultTemporalConfig() {
    String fmtProp = getProperty(Formulas.DATE_FORMAT_PROPERTY);
    if(fmtProp != null) {
      try {
        FormatUtil.createFormatter(fmtProp, TemporalConfig.DEFAULT.getLocale());
        return TemporalConfig.DEFAULT.withDateFormat(fmtProp);
      } catch(EvalException e) {
        LOG.warn("Ignoring invalid date format property '" + fmtProp + "'",
                 e);
      }
    }
    return TemporalConfig.DEFAULT;
  }

  /**
   * @return the default ZoneId, using the
   *         {@value com.healthmarketscience.formula.Formulas#TIMEZONE_PROPERTY}
   *         system property, if set
   */
  public static ZoneId getDefaultZoneId() {
    String tzProp = getProperty(Formulas.TIMEZONE_PROPERTY);
    if(tzProp != null) {
      try {
        return ZoneId.of(tzProp);
      } catch(DateTimeException e) {
        LOG.warn("Ignoring invalid time zone property '" + tzProp + "'", e);
      }
    }

    // use system default
    return ZoneId.systemDefault();
  }

  private static String getProperty(String name) {
    String prop = System.getProperty(name);
    if(prop != null) {
      prop = prop.trim();
      if(prop.length() > 0) {
        return prop;
      }
    }
    return null;
  }
}
