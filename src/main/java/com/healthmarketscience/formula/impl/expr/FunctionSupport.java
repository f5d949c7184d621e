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

import java.util.Arrays;

import com.healthmarketscience.formula.expr.EvalContext;
import com.healthmarketscience.formula.expr.EvalException;
import com.healthmarketscience.formula.expr.Function;
import com.healthmarketscience.formula.expr.Value;

/**
 *
 * @author James Ahlborn
 */
public class FunctionSupport
{
  private FunctionSupport() {}

  public static abstract class BaseFunction implements Function
  {
    private final String _name;
    private final int _minParams;
    private final int _maxParams;

    protected BaseFunction(String name, int minParams, int maxParams)
    {
      _name = name;
      _minParams = minParams;
      _maxParams = maxParams;
    }

    public String getName() {
      return _name;
    }

    protected void validateNumParams(Value[] params) {
      int num = params.length;
      if(num < _minParams) {
        throw new EvalException(
            EvalException.ErrorType.MISSING_ARGUMENT,
            "Function " + _name + " requires at least " + _minParams +
            " parameters, got " + num);
      }
      if(num > _maxParams) {
        throw new EvalException(
            EvalException.ErrorType.EXTRA_ARGUMENT,
            "Function " + _name + " accepts at most " + _maxParams +
            " parameters, got " + num);
      }
    }

    /**
     * Engine failures and arithmetic failures are passed through unchanged,
     * anything else is wrapped as an invalid argument failure.
     */
    protected RuntimeException invalidFunctionCall(
        RuntimeException e, Value[] params)
    {
      if((e instanceof EvalException) || (e instanceof ArithmeticException)) {
        return e;
      }
      String paramStr = Arrays.toString(params);
      String msg = "Invalid function call {" + _name + "(" +
        paramStr.substring(1, paramStr.length() - 1) + ")}";
      return new EvalException(EvalException.ErrorType.INVALID_ARGUMENT,
                               msg, e);
    }

    @Override
    public String toString() {
      return getName() + "()";
    }
  }

  public static abstract class Func0 extends BaseFunction
  {
    protected Func0(String name) {
      super(name, 0, 0);
    }

    public final Value eval(EvalContext ctx, Value... params) {
      try {
        validateNumParams(params);
        return eval0(ctx);
      } catch(RuntimeException e) {
        throw invalidFunctionCall(e, params);
      }
    }

    protected abstract Value eval0(EvalContext ctx);
  }

  public static abstract class Func1 extends BaseFunction
  {
    protected Func1(String name) {
      super(name, 1, 1);
    }

    public final Value eval(EvalContext ctx, Value... params) {
      try {
        validateNumParams(params);
        return eval1(ctx, params[0]);
      } catch(RuntimeException e) {
        throw invalidFunctionCall(e, params);
      }
    }

    protected abstract Value eval1(EvalContext ctx, Value param);
  }

  public static abstract class FuncVar extends BaseFunction
  {
    protected FuncVar(String name) {
      super(name, 0, Integer.MAX_VALUE);
    }

    protected FuncVar(String name, int minParams, int maxParams) {
      super(name, minParams, maxParams);
    }

    public final Value eval(EvalContext ctx, Value... params) {
      try {
        validateNumParams(params);
        return evalVar(ctx, params);
      } catch(RuntimeException e) {
        throw invalidFunctionCall(e, params);
      }
    }

    protected abstract Value evalVar(EvalContext ctx, Value[] params);
  }
}
