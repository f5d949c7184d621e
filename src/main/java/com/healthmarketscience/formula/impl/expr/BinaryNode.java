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

import com.healthmarketscience.formula.expr.EvalException;
import com.healthmarketscience.formula.expr.ParseException;

/**
 * Base class for nodes which have a left and a right operand.  Each operand
 * slot may only be assigned once during normal attachment.
 *
 * @author James Ahlborn
 */
public abstract class BinaryNode extends Node
{
  private Node _left;
  private Node _right;

  protected BinaryNode(String text) {
    super(text);
  }

  public Node getLeft() {
    return _left;
  }

  public Node getRight() {
    return _right;
  }

  public boolean hasLeft() {
    return (_left != null);
  }

  public boolean hasRight() {
    return (_right != null);
  }

  public void setLeft(Node left) {
    if(_left != null) {
      throw slotFilled("left");
    }
    _left = left;
  }

  public void setRight(Node right) {
    if(_right != null) {
      throw slotFilled("right");
    }
    _right = right;
  }

  /**
   * Replaces the current right operand.  Only used when re-arranging the
   * tree for operator precedence.
   */
  void replaceRight(Node right) {
    _right = right;
  }

  /**
   * @return the precedence weight of this node, higher binds tighter
   */
  public abstract int getWeight();

  protected abstract String getSymbol();

  protected boolean isPostfix() {
    return false;
  }

  @Override
  public void collectVariables(Collection<String> variables) {
    if(_left != null) {
      _left.collectVariables(variables);
    }
    if(_right != null) {
      _right.collectVariables(variables);
    }
  }

  @Override
  protected void toExprString(StringBuilder sb, boolean isDebug) {
    boolean hasLeftExpr = !isAbsent(_left);
    if(hasLeftExpr) {
      _left.toString(sb, isDebug);
      if(!isPostfix()) {
        sb.append(" ");
      }
    }
    sb.append(getSymbol());
    if(!isAbsent(_right)) {
      if(hasLeftExpr || isPostfix()) {
        sb.append(" ");
      }
      _right.toString(sb, isDebug);
    }
  }

  private ParseException slotFilled(String slot) {
    return new ParseException(
        EvalException.ErrorType.SYNTAX,
        "The " + slot + " operand of '" + getSymbol() + "' is already set");
  }
}
