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
import com.healthmarketscience.formula.expr.Function;
import com.healthmarketscience.formula.expr.Value;
import static com.healthmarketscience.formula.impl.expr.DefaultFunctions.*;
import static com.healthmarketscience.formula.impl.expr.FunctionSupport.*;

/**
 *
 * @author James Ahlborn
 */
public class DefaultNumberFunctions
{
  private static final double DEFAULT_LOG_BASE = 10d;

  private DefaultNumberFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  public static final Function SUM = registerFunc(new FuncVar("sum", 1, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      return ValueSupport.toValue(sum(params));
    }
  });

  public static final Function AVG = registerFunc(new FuncVar("avg", 1, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      return ValueSupport.toValue(sum(params) / params.length);
    }
  });

  public static final Function LOG10 = registerFunc(new Func1("log10") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(
          BuiltinOperators.checkDomain(Math.log10(param1.getAsDouble())));
    }
  });

  public static final Function LN = registerFunc(new Func1("ln") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(
          BuiltinOperators.checkDomain(Math.log(param1.getAsDouble())));
    }
  });

  public static final Function LOG = registerFunc(new FuncVar("log", 1, 2) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      double base = ((params.length > 1) ? params[1].getAsDouble() :
                     DEFAULT_LOG_BASE);
      return ValueSupport.toValue(BuiltinOperators.checkDomain(
          Math.log(params[0].getAsDouble()) / Math.log(base)));
    }
  });

  public static final Function SQRT = registerFunc(new Func1("sqrt") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(
          BuiltinOperators.checkDomain(Math.sqrt(param1.getAsDouble())));
    }
  });

  private static double sum(Value[] params) {
    double result = 0d;
    for(Value param : params) {
      result += param.getAsDouble();
    }
    return result;
  }
}
