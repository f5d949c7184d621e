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

import com.healthmarketscience.formula.expr.Value;

/**
 * The comparison and boolean operators supported by the expression engine.
 * Comparators always bind more loosely than any {@link OperatorType}.  They
 * are split into three tiers: relational comparisons bind tightest, then the
 * "and" family, then the "or" family.
 *
 * @author James Ahlborn
 */
public enum ComparatorType
{
  EQUAL("==", Tier.RELATIONAL) {
    @Override public Value eval(Value param1, Value param2) {
      return BuiltinOperators.equals(param1, param2);
    }
  },
  NOT_EQUAL("!=", Tier.RELATIONAL) {
    @Override public Value eval(Value param1, Value param2) {
      return BuiltinOperators.notEquals(param1, param2);
    }
  },
  LT("<", Tier.RELATIONAL) {
    @Override public Value eval(Value param1, Value param2) {
      return BuiltinOperators.lessThan(param1, param2);
    }
  },
  LTE("<=", Tier.RELATIONAL) {
    @Override public Value eval(Value param1, Value param2) {
      return BuiltinOperators.lessThanEq(param1, param2);
    }
  },
  GT(">", Tier.RELATIONAL) {
    @Override public Value eval(Value param1, Value param2) {
      return BuiltinOperators.greaterThan(param1, param2);
    }
  },
  GTE(">=", Tier.RELATIONAL) {
    @Override public Value eval(Value param1, Value param2) {
      return BuiltinOperators.greaterThanEq(param1, param2);
    }
  },
  AND("&", Tier.AND) {
    @Override public Value eval(Value param1, Value param2) {
      return BuiltinOperators.and(param1, param2);
    }
  },
  STRICT_AND("&&", Tier.AND) {
    @Override public Value eval(Value param1, Value param2) {
      return BuiltinOperators.strictAnd(param1, param2);
    }
  },
  OR("|", Tier.OR) {
    @Override public Value eval(Value param1, Value param2) {
      return BuiltinOperators.or(param1, param2);
    }
  },
  STRICT_OR("||", Tier.OR) {
    @Override public Value eval(Value param1, Value param2) {
      return BuiltinOperators.strictOr(param1, param2);
    }
  };

  private enum Tier {
    RELATIONAL(-1), AND(-2), OR(-3);

    private final int _weight;

    private Tier(int weight) {
      _weight = weight;
    }
  }

  private static final Map<String,ComparatorType> SYMBOLS;
  static {
    Map<String,ComparatorType> symbols = new HashMap<String,ComparatorType>();
    for(ComparatorType comp : values()) {
      symbols.put(comp._symbol, comp);
    }
    SYMBOLS = Collections.unmodifiableMap(symbols);
  }

  private final String _symbol;
  private final Tier _tier;

  private ComparatorType(String symbol, Tier tier) {
    _symbol = symbol;
    _tier = tier;
  }

  public String getSymbol() {
    return _symbol;
  }

  /**
   * @return the precedence weight of this comparator, which is always lower
   *         than the weight of any operator
   */
  public int getWeight() {
    return _tier._weight;
  }

  /**
   * @return {@code true} if the right operand of this comparator should only
   *         be evaluated when needed
   */
  public boolean isShortCircuit() {
    return (_tier != Tier.RELATIONAL);
  }

  @Override
  public String toString() {
    return _symbol;
  }

  public abstract Value eval(Value param1, Value param2);

  /**
   * @return the comparator with the given symbol, or {@code null} if there
   *         is none
   */
  public static ComparatorType fromSymbol(String symbol) {
    return SYMBOLS.get(symbol);
  }

  /**
   * @return {@code true} if the given character can start a comparator
   */
  static boolean isComparatorChar(char c) {
    switch(c) {
    case '=':
    case '!':
    case '<':
    case '>':
    case '|':
    case '&':
      return true;
    default:
      return false;
    }
  }
}
