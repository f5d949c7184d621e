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

/**
 * The formula library evaluates small, single line expressions such as
 * {@code asDate([start], "%Y-%m-%d") + days(2)} or {@code 2 * (3 + [x])}
 * against a map of variable values.  The easiest entry point is
 * {@link com.healthmarketscience.formula.Formulas}.
 * <p/>
 * <h2>Supporting Classes</h2>
 * <p/>
 * <h3>General Use Classes</h3>
 * <p/>
 * <ul>
 * <li>{@link com.healthmarketscience.formula.expr.EvalConfig} allows for customization of expression
 *     parsing and evaluation.</li>
 * <li>{@link com.healthmarketscience.formula.expr.TemporalConfig} encapsulates date/time parsing options for
 *     expression evaluation.</li>
 * <li>{@link com.healthmarketscience.formula.expr.FunctionLookup} provides a source for {@link com.healthmarketscience.formula.expr.Function} instances
 *     used during expression parsing.</li>
 * <li>{@link com.healthmarketscience.formula.expr.EvalException} wrapper exception thrown for failures which occur
 *     during expression evaluation.</li>
 * <li>{@link com.healthmarketscience.formula.expr.ParseException} wrapper exception thrown for failures which
 *     occur during expression parsing.</li>
 * </ul>
 * <p/>
 * <h3>Advanced Use Classes</h3>
 * <p/>
 * <ul>
 * <li>{@link com.healthmarketscience.formula.expr.EvalContext} supplies variable values and the clock for a
 *     single evaluation.</li>
 * <li>{@link com.healthmarketscience.formula.expr.Expression} provides an executable handle to a parsed
 *     expression.</li>
 * <li>{@link com.healthmarketscience.formula.expr.Function} provides an invokable handle to external functionality
 *     to an expression.</li>
 * <li>{@link com.healthmarketscience.formula.expr.Value} represents a typed primitive value.</li>
 * </ul>
 * <p/>
 * <h2>Syntax</h2>
 * <p/>
 * <ul>
 * <li>String literals are double quoted, a doubled quote ({@code ""}) is an
 *     escaped quote.</li>
 * <li>Variables are bracketed, e.g. {@code [name]}.  An unbound variable
 *     evaluates to Null.</li>
 * <li>Named constants: {@code pi}, {@code e}, {@code true}, {@code false},
 *     {@code null}.</li>
 * <li>Operators, tightest binding first: {@code !} (postfix factorial),
 *     {@code ^}, then {@code * / % //}, then {@code + -}.  Operators of
 *     equal precedence group from the left.  {@code +} and {@code -} may
 *     also be used as prefix operators (absolute value and negation).</li>
 * <li>Comparators bind looser than any operator: {@code == != < <= > >=},
 *     then {@code & &&}, then {@code | ||}.  The single character forms
 *     return one of their operands, the doubled forms return a
 *     boolean.</li>
 * </ul>
 * <p/>
 * <h2>Function Support</h2>
 * <p/>
 * Function names are case insensitive.
 *
 * <h3>Date/Time</h3>
 *
 * <table border="1" width="25%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th><th>Args</th></tr>
 * <tr class="TableRowColor"><td>today</td><td>0</td></tr>
 * <tr class="TableRowColor"><td>asDate</td><td>1-2</td></tr>
 * <tr class="TableRowColor"><td>seconds</td><td>1</td></tr>
 * <tr class="TableRowColor"><td>minutes</td><td>1</td></tr>
 * <tr class="TableRowColor"><td>hours</td><td>1</td></tr>
 * <tr class="TableRowColor"><td>days</td><td>1</td></tr>
 * <tr class="TableRowColor"><td>weeks</td><td>1</td></tr>
 * <tr class="TableRowColor"><td>months</td><td>1</td></tr>
 * <tr class="TableRowColor"><td>years</td><td>1</td></tr>
 * </table>
 *
 * <h3>Math</h3>
 *
 * <table border="1" width="25%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th><th>Args</th></tr>
 * <tr class="TableRowColor"><td>sum</td><td>1+</td></tr>
 * <tr class="TableRowColor"><td>avg</td><td>1+</td></tr>
 * <tr class="TableRowColor"><td>log10</td><td>1</td></tr>
 * <tr class="TableRowColor"><td>ln</td><td>1</td></tr>
 * <tr class="TableRowColor"><td>log</td><td>1-2</td></tr>
 * <tr class="TableRowColor"><td>sqrt</td><td>1</td></tr>
 * </table>
 *
 * <h3>Text/Inspection</h3>
 *
 * <table border="1" width="25%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th><th>Args</th></tr>
 * <tr class="TableRowColor"><td>nchar</td><td>1</td></tr>
 * <tr class="TableRowColor"><td>isNull</td><td>1</td></tr>
 * <tr class="TableRowColor"><td>in</td><td>1+</td></tr>
 * </table>
 *
 * <h3>asDate format directives</h3>
 *
 * {@code %Y %y %m %d %H %I %M %S %f %p %b %B %a %A %j %%}.  Fields which are
 * not part of the format default to 1900-01-01 00:00:00.
 */
package com.healthmarketscience.formula.expr;
