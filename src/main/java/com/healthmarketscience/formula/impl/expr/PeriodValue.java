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

import java.time.Period;

/**
 * A calendar offset (months and years), which has no fixed length.
 *
 * @author James Ahlborn
 */
public class PeriodValue extends BaseValue
{
  private final Period _val;

  public PeriodValue(Period val)
  {
    _val = val;
  }

  public Type getType() {
    return Type.PERIOD;
  }

  public Object get() {
    return _val;
  }

  @Override
  public boolean getAsBoolean() {
    return !_val.isZero();
  }

  @Override
  public Period getAsPeriod() {
    return _val;
  }
}
