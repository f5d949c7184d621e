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

import java.util.Locale;

import com.healthmarketscience.formula.expr.EvalContext;
import com.healthmarketscience.formula.expr.EvalException;
import com.healthmarketscience.formula.expr.Value;

/**
 * A bare, named constant.  The name is resolved (case insensitively) when
 * evaluated.
 *
 * @author James Ahlborn
 */
public class ConstantNode extends Node
{
  private static final Value PI_VAL = ValueSupport.toValue(Math.PI);
  private static final Value E_VAL = ValueSupport.toValue(Math.E);

  public ConstantNode(String name) {
    super(name);
  }

  @Override
  public NodeType getType() {
    return NodeType.CONSTANT;
  }

  @Override
  public Value eval(EvalContext ctx) {
    switch(getText().toLowerCase(Locale.ROOT)) {
    case "pi":
      return PI_VAL;
    case "e":
      return E_VAL;
    case "true":
      return ValueSupport.TRUE_VAL;
    case "false":
      return ValueSupport.FALSE_VAL;
    case "null":
      return ValueSupport.NULL_VAL;
    default:
      throw new EvalException(EvalException.ErrorType.UNDEFINED_CONSTANT,
                              "'" + getText() + "' is not a defined constant");
    }
  }

  @Override
  protected void toExprString(StringBuilder sb, boolean isDebug) {
    sb.append(getText());
  }
}
