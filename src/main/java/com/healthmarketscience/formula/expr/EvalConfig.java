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
 * The EvalConfig allows for customization of expression parsing and
 * evaluation.
 *
 * @see com.healthmarketscience.formula.expr expression package docs
 *
 * @author James Ahlborn
 */
public interface EvalConfig
{
  /**
   * @return the currently configured TemporalConfig
   */
  public TemporalConfig getTemporalConfig();

  /**
   * Sets the TemporalConfig for use when evaluating expressions.
   */
  public void setTemporalConfig(TemporalConfig temporal);

  /**
   * @return the currently configured FunctionLookup
   */
  public FunctionLookup getFunctionLookup();

  /**
   * Sets the {@link Function} provider to use when parsing expressions.  The
   * Functions supported by the default FunctionLookup are documented in
   * {@link com.healthmarketscience.formula.expr}.  Custom Functions can be
   * provided to the expression engine by installing a custom FunctionLookup
   * instance (which would presumably wrap and delegate to the default
   * FunctionLookup instance for any default implementations).
   */
  public void setFunctionLookup(FunctionLookup lookup);

  /**
   * @return the currently configured Clock
   */
  public Clock getClock();

  /**
   * Sets the Clock used by functions which read the current date/time.
   */
  public void setClock(Clock clock);
}
