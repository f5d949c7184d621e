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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

import com.healthmarketscience.formula.expr.EvalContext;
import com.healthmarketscience.formula.expr.EvalException;
import com.healthmarketscience.formula.expr.Expression;
import com.healthmarketscience.formula.expr.FunctionLookup;
import com.healthmarketscience.formula.expr.ParseException;
import com.healthmarketscience.formula.expr.Value;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Builds expression trees from the tokens produced by the
 * {@link ExpressionTokenizer}.
 * <p/>
 * Tokens are consumed strictly left to right.  The builder keeps a "current
 * tree" which each new token is grafted onto.  A new operator which binds
 * more tightly than the operator at the root of the current tree captures
 * that operator's right operand (and continues to grow from there until it
 * reaches an operator which does not bind more tightly).  Otherwise the new
 * operator becomes the root of the tree.  Operators of equal weight are
 * therefore grouped from the left.
 *
 * @author James Ahlborn
 */
public class Formulator
{
  private static final Log LOG = LogFactory.getLog(Formulator.class);

  /** weight below that of any operator or comparator */
  private static final int MIN_WEIGHT = Integer.MIN_VALUE;

  /**
   * Provides the parse time configuration.
   */
  public interface ParseContext
  {
    public FunctionLookup getFunctionLookup();
  }

  private Formulator() {}

  /**
   * Parses the given expression string.
   *
   * @throws ParseException if the expression is blank or malformed, or
   *         references an unknown operator, comparator or function
   */
  public static Expression parse(String exprStr, ParseContext context) {

    if(StringUtils.isBlank(exprStr)) {
      throw new ParseException(EvalException.ErrorType.SYNTAX,
                               "null/empty expression");
    }

    Node root = parseNode(exprStr, context);

    if(LOG.isDebugEnabled()) {
      LOG.debug("Parsed '" + exprStr + "' as " + root.toDebugString());
    }

    return new ExprWrapper(exprStr, root);
  }

  static Node parseNode(String exprStr, ParseContext context) {
    Deque<Node> tokens = new ArrayDeque<Node>(
        ExpressionTokenizer.tokenize(exprStr, context));
    return buildTree(new EmptyNode(), tokens, MIN_WEIGHT, context);
  }

  /**
   * Grafts tokens onto the given tree until the tokens are exhausted or an
   * operator/comparator which does not bind more tightly than the given
   * weight is reached (that token is left for the caller).
   */
  static Node buildTree(Node base, Deque<Node> tokens, int minWeight,
                        ParseContext context) {

    while(!tokens.isEmpty()) {

      Node node = tokens.peekFirst();

      switch(node.getType()) {
      case OPERATOR:

        OperatorNode op = (OperatorNode)node;

        if(isAwaitingRightOperand(base)) {
          // an operator in place of an operand is a prefix operator
          tokens.removeFirst();
          BinaryNode baseOp = (BinaryNode)base;
          op.setLeft(new EmptyNode());
          baseOp.setRight(buildTree(op, tokens,
                                    Math.max(minWeight, baseOp.getWeight()),
                                    context));
          break;
        }

        if(op.getWeight() <= minWeight) {
          return base;
        }
        tokens.removeFirst();

        if(op.getOperator().isPostfix() && isPostfixOperator(base)) {
          throw new ParseException(
              EvalException.ErrorType.SYNTAX,
              "Operator '" + op.getText() + "' cannot be applied to '" +
              base.toCleanString() + "'");
        }

        if((base.getType() == Node.NodeType.OPERATOR) &&
           (op.getWeight() > ((OperatorNode)base).getWeight())) {
          // rotate the tighter binding operator under the current root
          OperatorNode baseOp = (OperatorNode)base;
          op.setLeft(baseOp.getRight());
          baseOp.replaceRight(buildTree(
                                  op, tokens,
                                  Math.max(minWeight, baseOp.getWeight()),
                                  context));
        } else {
          op.setLeft(base);
          base = op;
        }
        break;

      case COMPARATOR:

        ComparatorNode comp = (ComparatorNode)node;
        if(comp.getWeight() <= minWeight) {
          return base;
        }
        tokens.removeFirst();

        comp.setLeft(base);
        comp.setRight(buildTree(new EmptyNode(), tokens, comp.getWeight(),
                                context));
        base = comp;
        break;

      case GROUP:

        tokens.removeFirst();
        base = attachGroup(base, (GroupNode)node, context);
        break;

      default:

        tokens.removeFirst();
        base = attachOperand(base, node);
      }
    }

    return base;
  }

  private static Node attachGroup(Node base, GroupNode group,
                                  ParseContext context) {

    FunctionNode func = findAwaitingFunction(base);
    if(func != null) {
      List<Node> args = new ArrayList<Node>();
      for(GroupNode arg : group.split()) {
        args.add(parseNode(arg.getText(), context));
      }
      func.setArguments(args);
      return base;
    }

    // the group is parsed once and the sub-tree cached
    group.setExpression(parseNode(group.getText(), context));

    return attachOperand(base, group);
  }

  private static Node attachOperand(Node base, Node node) {

    if(base.isEmpty()) {
      return node;
    }

    if(base instanceof BinaryNode) {
      BinaryNode baseOp = (BinaryNode)base;
      if(!baseOp.hasLeft()) {
        baseOp.setLeft(node);
        return base;
      }
      if(!baseOp.hasRight()) {
        baseOp.setRight(node);
        return base;
      }
    }

    throw new ParseException(
        EvalException.ErrorType.SYNTAX,
        "No place to attach '" + node.toCleanString() + "' to '" +
        base.toCleanString() + "'");
  }

  private static FunctionNode findAwaitingFunction(Node base) {
    if(base instanceof BinaryNode) {
      BinaryNode baseOp = (BinaryNode)base;
      if(isAwaitingFunction(baseOp.getRight())) {
        return (FunctionNode)baseOp.getRight();
      }
      if(isAwaitingFunction(baseOp.getLeft())) {
        return (FunctionNode)baseOp.getLeft();
      }
    }
    return (isAwaitingFunction(base) ? (FunctionNode)base : null);
  }

  private static boolean isAwaitingFunction(Node node) {
    return ((node instanceof FunctionNode) &&
            ((FunctionNode)node).isAwaitingArguments());
  }

  private static boolean isAwaitingRightOperand(Node node) {
    return ((node.getType() == Node.NodeType.OPERATOR) &&
            !((OperatorNode)node).getOperator().isPostfix() &&
            !((OperatorNode)node).hasRight());
  }

  private static boolean isPostfixOperator(Node node) {
    return ((node.getType() == Node.NodeType.OPERATOR) &&
            ((OperatorNode)node).getOperator().isPostfix() &&
            !((OperatorNode)node).hasRight());
  }

  /**
   * Expression wrapper for a parsed tree.
   */
  private static final class ExprWrapper implements Expression
  {
    private final String _rawExprStr;
    private final Node _root;

    private ExprWrapper(String rawExprStr, Node root) {
      _rawExprStr = rawExprStr;
      _root = root;
    }

    @Override
    public Object eval(EvalContext ctx) {
      Value val = _root.eval(ctx);
      return (val.isNull() ? null : val.get());
    }

    @Override
    public String toDebugString() {
      return _root.toDebugString();
    }

    @Override
    public String toCleanString() {
      return _root.toCleanString();
    }

    @Override
    public String toRawString() {
      return _rawExprStr;
    }

    @Override
    public void collectVariables(Collection<String> variables) {
      _root.collectVariables(variables);
    }

    @Override
    public String toString() {
      return toRawString();
    }
  }
}
