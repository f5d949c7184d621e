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
 * An arithmetic operator.  The "+" and "-" operators may also be used with
 * only a right operand, "!" is only used with a left operand.
 *
 * @author James Ahlborn
 */
public class OperatorNode extends BinaryNode
{
  private final OperatorType _op;

  public OperatorNode(String symbol) {
    super(symbol);
    _op = OperatorType.fromSymbol(symbol);
    if(_op == null) {
      throw new ParseException(EvalException.ErrorType.INVALID_OPERATOR,
                               "Invalid operator '" + symbol + "'");
    }
  }

  @Override
  public NodeType getType() {
    return NodeType.OPERATOR;
  }

  public OperatorType getOperator() {
    return _op;
  }

  @Override
  public int getWeight() {
    return _op.getWeight();
  }

  @Override
  protected String getSymbol() {
    return _op.getSymbol();
  }

  @Override
  protected boolean isPostfix() {
    return _op.isPostfix();
  }

  @Override
  public Value eval(EvalContext ctx) {
    Node left = getLeft();
    Node right = getRight();

    if(isAbsent(left) && isAbsent(right)) {
      throw missingOperand("Missing both operands");
    }

    if(_op.isPostfix()) {
      if(!isAbsent(right)) {
        throw new EvalException(EvalException.ErrorType.EXTRA_OPERAND,
                                "Operator '" + _op + "' does not accept a " +
                                "right operand");
      }
      return _op.eval(left.eval(ctx), null);
    }

    if(isAbsent(right)) {
      throw missingOperand("Missing right operand");
    }

    if(isAbsent(left)) {
      return _op.evalPrefix(right.eval(ctx));
    }

    return _op.eval(left.eval(ctx), right.eval(ctx));
  }

  private EvalException missingOperand(String msg) {
    return new EvalException(EvalException.ErrorType.MISSING_OPERAND,
                             msg + " for '" + _op + "'");
  }
}
