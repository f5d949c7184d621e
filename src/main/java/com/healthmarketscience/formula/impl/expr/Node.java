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
 * Base class for all nodes of a parsed expression tree.  Nodes are created
 * unlinked by the {@link ExpressionTokenizer} and linked into a tree by the
 * {@link Formulator}.  Once parsing completes, a tree is never modified.
 *
 * @author James Ahlborn
 */
public abstract class Node
{
  public enum NodeType {
    STRING, NUMBER, VARIABLE, CONSTANT, OPERATOR, COMPARATOR, FUNCTION, GROUP,
    EMPTY;
  }

  private final String _text;

  protected Node(String text) {
    _text = text;
  }

  /**
   * @return the original text of this node
   */
  public String getText() {
    return _text;
  }

  public abstract NodeType getType();

  /**
   * @return {@code true} if this node is a placeholder which has no value
   */
  public boolean isEmpty() {
    return false;
  }

  public abstract Value eval(EvalContext ctx);

  public void collectVariables(Collection<String> variables) {
    // most nodes have no variables
  }

  public String toCleanString() {
    return toString(new StringBuilder(), false).toString();
  }

  public String toDebugString() {
    return toString(new StringBuilder(), true).toString();
  }

  protected StringBuilder toString(StringBuilder sb, boolean isDebug) {
    if(isDebug) {
      sb.append("<").append(getType()).append(">{");
    }
    toExprString(sb, isDebug);
    if(isDebug) {
      sb.append("}");
    }
    return sb;
  }

  protected abstract void toExprString(StringBuilder sb, boolean isDebug);

  @Override
  public String toString() {
    return toCleanString();
  }

  static boolean isAbsent(Node node) {
    return ((node == null) || node.isEmpty());
  }
}
