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

package com.healthmarketscience.formula.expr;

import java.util.Collection;

/**
 * An Expression is an executable handle to a parsed formula.  The parsed
 * tree is never modified after parsing, so a single Expression may be
 * evaluated any number of times (and concurrently) with different
 * contexts.
 *
 * @author James Ahlborn
 */
public interface Expression
{

  /**
   * Evaluates the expression and returns the result as a "native" java
   * value ({@code Double}, {@code String}, {@code Boolean},
   * {@code LocalDateTime}, {@code Duration}, {@code Period} or
   * {@code null}).
   *
   * @param ctx the context within which to evaluate the expression
   *
   * @return the result of the expression evaluation
   */
  public Object eval(EvalContext ctx);

  /**
   * @return a detailed string which indicates how the expression was
   *         interpreted by the expression evaluation engine.
   */
  public String toDebugString();

  /**
   * @return a parsed and re-formated version of the expression.  This may
   *         look slightly different than the original, raw string, although
   *         it should be an equivalent expression.
   */
  public String toCleanString();

  /**
   * @return the original, unparsed expression string.  This is the same as
   *         the value which will be returned by {@link Object#toString}.
   */
  public String toRawString();

  /**
   * Adds the names of any variables referenced by this expression to the
   * given collection.
   */
  public void collectVariables(Collection<String> variables);
}
