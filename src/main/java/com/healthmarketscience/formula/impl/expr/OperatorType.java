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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import com.healthmarketscience.formula.expr.EvalException;
import com.healthmarketscience.formula.expr.Value;

/**
 * The arithmetic operators supported by the expression engine.  The weight
 * determines precedence, a higher weight binds more tightly.
 *
 * @author James Ahlborn
 */
public enum OperatorType
{
  ADD("+", 0) {
    @Override public Value eval(Value param1, Value param2) {
      return BuiltinOperators.add(param1, param2);
    }
    @Override public boolean isPrefix() {
      return true;
    }
    @Override public Value evalPrefix(Value param) {
      return BuiltinOperators.abs(param);
    }
  },
  SUBTRACT("-", 0) {
    @Override public Value eval(Value param1, Value param2) {
      return BuiltinOperators.subtract(param1, param2);
    }
    @Override public boolean isPrefix() {
      return true;
    }
    @Override public Value evalPrefix(Value param) {
      return BuiltinOperators.negate(param);
    }
  },
  MULTIPLY("*", 1) {
    @Override public Value eval(Value param1, Value param2) {
      return BuiltinOperators.multiply(param1, param2);
    }
  },
  DIVIDE("/", 1) {
    @Override public Value eval(Value param1, Value param2) {
      return BuiltinOperators.divide(param1, param2);
    }
  },
  MODULUS("%", 1) {
    @Override public Value eval(Value param1, Value param2) {
      return BuiltinOperators.mod(param1, param2);
    }
  },
  INT_DIVIDE("//", 1) {
    @Override public Value eval(Value param1, Value param2) {
      return BuiltinOperators.intDivide(param1, param2);
    }
  },
  EXPONENTIAL("^", 2) {
    @Override public Value eval(Value param1, Value param2) {
      return BuiltinOperators.exp(param1, param2);
    }
  },
  FACTORIAL("!", 3) {
    @Override public Value eval(Value param1, Value param2) {
      return BuiltinOperators.factorial(param1);
    }
    @Override public boolean isPostfix() {
      return true;
    }
  };

  private static final Map<String,OperatorType> SYMBOLS;
  static {
    Map<String,OperatorType> symbols = new HashMap<String,OperatorType>();
    for(OperatorType op : values()) {
      symbols.put(op._symbol, op);
    }
    SYMBOLS = Collections.unmodifiableMap(symbols);
  }

  /** length of the longest operator symbol */
  static final int MAX_SYMBOL_LEN = 2;

  private final String _symbol;
  private final int _weight;

  private OperatorType(String symbol, int weight) {
    _symbol = symbol;
    _weight = weight;
  }

  public String getSymbol() {
    return _symbol;
  }

  public int getWeight() {
    return _weight;
  }

  /**
   * @return {@code true} if this operator may be applied to a single right
   *         operand
   */
  public boolean isPrefix() {
    return false;
  }

  /**
   * @return {@code true} if this operator applies to a single left operand
   */
  public boolean isPostfix() {
    return false;
  }

  @Override
  public String toString() {
    return _symbol;
  }

  /**
   * Evaluates this operator.  For postfix operators, the second parameter
   * is always {@code null}.
   */
  public abstract Value eval(Value param1, Value param2);

  public Value evalPrefix(Value param) {
    throw new EvalException(EvalException.ErrorType.MISSING_OPERAND,
                            "Missing left operand for '" + _symbol + "'");
  }

  /**
   * @return the operator with the given symbol, or {@code null} if there is
   *         none
   */
  public static OperatorType fromSymbol(String symbol) {
    return SYMBOLS.get(symbol);
  }
}
