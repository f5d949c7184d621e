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
import java.util.Collections;
import java.util.Map;

import com.healthmarketscience.formula.expr.EvalConfig;
import com.healthmarketscience.formula.expr.EvalContext;
import com.healthmarketscience.formula.expr.TemporalConfig;
import com.healthmarketscience.formula.expr.Value;

/**
 * EvalContext which looks up variable values in a Map.  Map values are
 * converted using {@link ValueSupport#toValue(Object)}.
 *
 * @author James Ahlborn
 */
public class MapEvalContext implements EvalContext
{
  private final Map<String,?> _vars;
  private final TemporalConfig _temporal;
  private final Clock _clock;

  public MapEvalContext(Map<String,?> vars, EvalConfig config) {
    _vars = ((vars != null) ? vars : Collections.<String,Object>emptyMap());
    _temporal = config.getTemporalConfig();
    _clock = config.getClock();
  }

  @Override
  public TemporalConfig getTemporalConfig() {
    return _temporal;
  }

  @Override
  public Clock getClock() {
    return _clock;
  }

  @Override
  public Value getVariableValue(String name) {
    // an unbound variable is Null
    return ValueSupport.toValue(_vars.get(name));
  }
}
