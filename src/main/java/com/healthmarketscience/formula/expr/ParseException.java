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
 * Exception thrown for failures which occur while tokenizing or building
 * an expression (before any evaluation happens).
 *
 * @author James Ahlborn
 */
public class ParseException extends EvalException
{
  private static final long serialVersionUID = 20180330L;

  public ParseException(ErrorType errorType, String message) {
    super(errorType, message);
  }

  public ParseException(ErrorType errorType, String message, Throwable cause) {
    super(errorType, message, cause);
  }
}
