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

import java.time.Clock;

/**
 * EvalContext encapsulates all the state needed for a single expression
 * evaluation.  It provides a bridge between the expression execution engine
 * and the caller's variable environment.
 *
 * @author James Ahlborn
 */
public interface EvalContext
{
  /**
   * @return the currently configured TemporalConfig (from the
   *         {@link EvalConfig})
   */
  public TemporalConfig getTemporalConfig();

  /**
   * @return the clock used by functions which read the current date/time
   */
  public Clock getClock();

  /**
   * @return the value of the variable with the given name, or the "Null"
   *         value if the variable is not bound.  Never {@code null}.
   */
  public Value getVariableValue(String name);
}
