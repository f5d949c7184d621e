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

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import com.healthmarketscience.formula.expr.Function;
import com.healthmarketscience.formula.expr.FunctionLookup;

/**
 * Registry of the built-in functions.  The registry is populated once, when
 * this class is loaded, and never modified afterwards.
 *
 * @author James Ahlborn
 */
public class DefaultFunctions
{
  private static final Map<String,Function> FUNCS =
    new HashMap<String,Function>();

  static {
    // load all default functions
    DefaultTextFunctions.init();
    DefaultNumberFunctions.init();
    DefaultDateFunctions.init();
  }

  public static final FunctionLookup LOOKUP = new FunctionLookup() {
    public Function getFunction(String name) {
      return FUNCS.get(toLookupName(name));
    }
  };

  private DefaultFunctions() {}

  static Function registerFunc(Function func) {
    String lookupFname = toLookupName(func.getName());
    if(FUNCS.containsKey(lookupFname)) {
      throw new IllegalStateException("Duplicate function " + func.getName());
    }
    FUNCS.put(lookupFname, func);
    return func;
  }

  private static String toLookupName(String name) {
    return ((name != null) ? name.toLowerCase(Locale.ROOT) : null);
  }
}
