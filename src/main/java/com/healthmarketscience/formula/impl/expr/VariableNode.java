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

import java.util.Collection;

import com.healthmarketscience.formula.expr.EvalContext;
import com.healthmarketscience.formula.expr.Value;

/**
 * Reference to a caller supplied variable, e.g. {@code [name]}.
 *
 * @author James Ahlborn
 */
public class VariableNode extends Node
{
  public VariableNode(String name) {
    super(name);
  }

  @Override
  public NodeType getType() {
    return NodeType.VARIABLE;
  }

  @Override
  public Value eval(EvalContext ctx) {
    return ctx.getVariableValue(getText());
  }

  @Override
  public void collectVariables(Collection<String> variables) {
    variables.add(getText());
  }

  @Override
  protected void toExprString(StringBuilder sb, boolean isDebug) {
    sb.append("[").append(getText()).append("]");
  }
}
