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
public class DefaultTextFunctions
{

  private DefaultTextFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  public static final Function NCHAR = registerFunc(new Func1("nchar") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      String str = param1.getAsString();
      return ValueSupport.toValue((double)str.codePointCount(0, str.length()));
    }
  });

  public static final Function IS_NULL = registerFunc(new Func1("isNull") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(
          param1.isNull() ||
          ((param1.getType() == Value.Type.STRING) &&
           param1.getAsString().isEmpty()));
    }
  });

  public static final Function IN = registerFunc(new FuncVar("in", 1, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      Value param1 = params[0];
      for(int i = 1; i < params.length; ++i) {
        if(BuiltinOperators.areEqual(param1, params[i])) {
          return ValueSupport.TRUE_VAL;
        }
      }
      return ValueSupport.FALSE_VAL;
    }
  });
}
