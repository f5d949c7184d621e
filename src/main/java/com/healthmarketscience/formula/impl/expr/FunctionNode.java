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
import java.util.Collections;
import java.util.List;

import com.healthmarketscience.formula.expr.EvalContext;
import com.healthmarketscience.formula.expr.EvalException;
import com.healthmarketscience.formula.expr.Function;
import com.healthmarketscience.formula.expr.FunctionLookup;
import com.healthmarketscience.formula.expr.ParseException;
import com.healthmarketscience.formula.expr.Value;

/**
 * A call to a {@link Function}.  The function is resolved when the node is
 * created, the arguments are attached by the {@link Formulator} when it
 * reaches the following group.
 *
 * @author James Ahlborn
 */
public class FunctionNode extends Node
{
  private final Function _func;
  private List<Node> _args;

  public FunctionNode(String name, FunctionLookup lookup) {
    super(name);
    _func = lookup.getFunction(name);
    if(_func == null) {
      throw new ParseException(EvalException.ErrorType.INVALID_FUNCTION,
                               "Invalid function '" + name + "'");
    }
  }

  @Override
  public NodeType getType() {
    return NodeType.FUNCTION;
  }

  public Function getFunction() {
    return _func;
  }

  public List<Node> getArguments() {
    return ((_args != null) ? _args : Collections.<Node>emptyList());
  }

  /**
   * @return {@code true} if the argument list of this function has not yet
   *         been attached
   */
  public boolean isAwaitingArguments() {
    return (_args == null);
  }

  public void setArguments(List<Node> args) {
    if(_args != null) {
      throw new ParseException(
          EvalException.ErrorType.SYNTAX,
          "Arguments for function '" + getText() + "' are already set");
    }
    _args = Collections.unmodifiableList(args);
  }

  /**
   * Marks this function as called with an empty argument list.
   */
  void setNoArguments() {
    setArguments(Collections.<Node>emptyList());
  }

  @Override
  public Value eval(EvalContext ctx) {
    List<Node> args = getArguments();
    Value[] params = new Value[args.size()];
    for(int i = 0; i < params.length; ++i) {
      params[i] = args.get(i).eval(ctx);
    }
    return _func.eval(ctx, params);
  }

  @Override
  public void collectVariables(Collection<String> variables) {
    for(Node arg : getArguments()) {
      arg.collectVariables(variables);
    }
  }

  @Override
  protected void toExprString(StringBuilder sb, boolean isDebug) {
    sb.append(getText()).append("(");
    boolean first = true;
    for(Node arg : getArguments()) {
      if(!first) {
        sb.append(", ");
      }
      arg.toString(sb, isDebug);
      first = false;
    }
    sb.append(")");
  }
}
