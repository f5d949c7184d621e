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
import com.healthmarketscience.formula.expr.Value;
import org.apache.commons.lang3.StringUtils;

/**
 *
 * @author James Ahlborn
 */
public class StringNode extends Node
{
  private static final String QUOTE = String.valueOf(
      ExpressionTokenizer.QUOTED_STR_CHAR);
  private static final String ESCAPED_QUOTE = QUOTE + QUOTE;

  private final Value _val;

  /**
   * @param literal the quoted string literal, one leading and one trailing
   *                quote are stripped
   */
  public StringNode(String literal) {
    super(literal);
    String str = StringUtils.removeEnd(
        StringUtils.removeStart(literal, QUOTE), QUOTE);
    _val = ValueSupport.toValue(str.replace(ESCAPED_QUOTE, QUOTE));
  }

  @Override
  public NodeType getType() {
    return NodeType.STRING;
  }

  @Override
  public Value eval(EvalContext ctx) {
    return _val;
  }

  @Override
  protected void toExprString(StringBuilder sb, boolean isDebug) {
    sb.append(QUOTE)
      .append(_val.getAsString().replace(QUOTE, ESCAPED_QUOTE))
      .append(QUOTE);
  }
}
