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


/**
 * Base class for exceptions thrown during expression evaluation.  The
 * {@link ErrorType} indicates the general category of the failure.
 *
 * @author James Ahlborn
 */
public class EvalException extends IllegalStateException
{
  private static final long serialVersionUID = 20180330L;

  /** the categories of failure reported by the expression engine */
  public enum ErrorType {
    /** unknown operator symbol */
    INVALID_OPERATOR,
    /** unknown comparator symbol */
    INVALID_COMPARATOR,
    /** unknown function name */
    INVALID_FUNCTION,
    /** malformed expression text or tree */
    SYNTAX,
    /** a required operand was not given */
    MISSING_OPERAND,
    /** an operand was given where none is allowed */
    EXTRA_OPERAND,
    /** a function was called with too few arguments */
    MISSING_ARGUMENT,
    /** a function was called with too many arguments */
    EXTRA_ARGUMENT,
    /** unknown named constant */
    UNDEFINED_CONSTANT,
    /** a value could not be used as the required type */
    INVALID_CONVERSION,
    /** a function argument had the right type but an unusable value */
    INVALID_ARGUMENT;
  }

  private final ErrorType _errorType;

  public EvalException(ErrorType errorType, String message) {
    super(message);
    _errorType = errorType;
  }

  public EvalException(ErrorType errorType, String message, Throwable cause) {
    super(message, cause);
    _errorType = errorType;
  }

  /**
   * @return the category of this failure
   */
  public ErrorType getErrorType() {
    return _errorType;
  }
}
