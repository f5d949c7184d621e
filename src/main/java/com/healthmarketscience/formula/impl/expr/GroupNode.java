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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import com.healthmarketscience.formula.expr.EvalContext;
import com.healthmarketscience.formula.expr.EvalException;
import com.healthmarketscience.formula.expr.ParseException;
import com.healthmarketscience.formula.expr.Value;

/**
 * A parenthesized sub-expression.  The group holds the raw text between the
 * parentheses, which is parsed once when the group is attached to a tree.
 *
 * @author James Ahlborn
 */
public class GroupNode extends Node
{
  private static final char ARG_SEP_CHAR = ',';

  private Node _expr;

  public GroupNode(String text) {
    super(text);
  }

  @Override
  public NodeType getType() {
    return NodeType.GROUP;
  }

  public Node getExpression() {
    return _expr;
  }

  void setExpression(Node expr) {
    _expr = expr;
  }

  /**
   * Splits the text of this group on the commas which are not within nested
   * parentheses or string literals.
   *
   * @return one group per comma separated piece, never empty
   * @throws ParseException if any piece is blank
   */
  public List<GroupNode> split() {
    List<GroupNode> groups = new ArrayList<GroupNode>();
    String text = getText();
    int depth = 0;
    boolean inString = false;
    int start = 0;
    for(int i = 0; i < text.length(); ++i) {
      char c = text.charAt(i);
      if(c == ExpressionTokenizer.QUOTED_STR_CHAR) {
        // a doubled quote just toggles twice
        inString = !inString;
      } else if(inString) {
        continue;
      } else if(c == ExpressionTokenizer.GROUP_START_CHAR) {
        ++depth;
      } else if(c == ExpressionTokenizer.GROUP_END_CHAR) {
        --depth;
      } else if((c == ARG_SEP_CHAR) && (depth == 0)) {
        groups.add(newArgGroup(text.substring(start, i)));
        start = i + 1;
      }
    }
    groups.add(newArgGroup(text.substring(start)));
    return groups;
  }

  private GroupNode newArgGroup(String text) {
    text = text.trim();
    if(text.isEmpty()) {
      throw new ParseException(EvalException.ErrorType.SYNTAX,
                               "Empty argument in '(" + getText() + ")'");
    }
    return new GroupNode(text);
  }

  @Override
  public Value eval(EvalContext ctx) {
    if(_expr == null) {
      throw new EvalException(EvalException.ErrorType.SYNTAX,
                              "Group '(" + getText() + ")' was never parsed");
    }
    return _expr.eval(ctx);
  }

  @Override
  public void collectVariables(Collection<String> variables) {
    if(_expr != null) {
      _expr.collectVariables(variables);
    }
  }

  @Override
  protected void toExprString(StringBuilder sb, boolean isDebug) {
    sb.append("(");
    if(_expr != null) {
      _expr.toString(sb, isDebug);
    } else {
      sb.append(getText());
    }
    sb.append(")");
  }
}
