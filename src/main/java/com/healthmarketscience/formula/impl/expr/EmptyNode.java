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
 * Placeholder for a missing operand (the start of a tree, or the left side
 * of a prefix operator).
 *
 * @author James Ahlborn
 */
public class EmptyNode extends Node
{
  public EmptyNode() {
    super("");
  }

  @Override
  public NodeType getType() {
    return NodeType.EMPTY;
  }

  @Override
  public boolean isEmpty() {
    return true;
  }

  @Override
  public Value eval(EvalContext ctx) {
    throw new EvalException(EvalException.ErrorType.MISSING_OPERAND,
                            "Missing operand");
  }

  @Override
  protected void toExprString(StringBuilder sb, boolean isDebug) {
    // nothing to render
  }
}
