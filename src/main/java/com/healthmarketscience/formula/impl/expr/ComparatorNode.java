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
import com.healthmarketscience.formula.expr.ParseException;
import com.healthmarketscience.formula.expr.Value;

/**
 * A comparison or boolean operator.  Both operands are always required.
 *
 * @author James Ahlborn
 */
public class ComparatorNode extends BinaryNode
{
  private final ComparatorType _comp;

  public ComparatorNode(String symbol) {
    super(symbol);
    _comp = ComparatorType.fromSymbol(symbol);
    if(_comp == null) {
      throw new ParseException(EvalException.ErrorType.INVALID_COMPARATOR,
                               "Invalid comparator '" + symbol + "'");
    }
  }

  @Override
  public NodeType getType() {
    return NodeType.COMPARATOR;
  }

  public ComparatorType getComparator() {
    return _comp;
  }

  @Override
  public int getWeight() {
    return _comp.getWeight();
  }

  @Override
  protected String getSymbol() {
    return _comp.getSymbol();
  }

  @Override
  public Value eval(EvalContext ctx) {
    Node left = getLeft();
    Node right = getRight();

    if(isAbsent(left) || isAbsent(right)) {
      throw new EvalException(EvalException.ErrorType.MISSING_OPERAND,
                              "Comparator '" + _comp + "' requires two " +
                              "operands");
    }

    if(_comp.isShortCircuit()) {
      // boolean operations do short circuit evaluation, so we need to delay
      // computing results until necessary
      return BaseDelayedValue.unwrap(
          _comp.eval(new DelayedValue(left, ctx), new DelayedValue(right, ctx)));
    }

    return _comp.eval(left.eval(ctx), right.eval(ctx));
  }

  private static final class DelayedValue extends BaseDelayedValue
  {
    private final Node _node;
    private final EvalContext _ctx;

    private DelayedValue(Node node, EvalContext ctx) {
      _node = node;
      _ctx = ctx;
    }

    @Override
    protected Value eval() {
      return _node.eval(_ctx);
    }
  }
}
