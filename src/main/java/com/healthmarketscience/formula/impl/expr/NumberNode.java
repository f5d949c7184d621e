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

import com.healthmarketscience.formula.expr.EvalContext;
import com.healthmarketscience.formula.expr.EvalException;
import com.healthmarketscience.formula.expr.Value;

/**
 * Numeric literal.  The literal text is parsed when evaluated.
 *
 * @author James Ahlborn
 */
public class NumberNode extends Node
{
  public NumberNode(String literal) {
    super(literal);
  }

  @Override
  public NodeType getType() {
    return NodeType.NUMBER;
  }

  @Override
  public Value eval(EvalContext ctx) {
    try {
      return ValueSupport.toValue(Double.parseDouble(getText()));
    } catch(NumberFormatException e) {
      throw new EvalException(EvalException.ErrorType.INVALID_CONVERSION,
                              "Invalid number '" + getText() + "'", e);
    }
  }

  @Override
  protected void toExprString(StringBuilder sb, boolean isDebug) {
    sb.append(getText());
  }
}
