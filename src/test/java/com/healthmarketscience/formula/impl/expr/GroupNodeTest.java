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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.healthmarketscience.formula.expr.EvalException;
import com.healthmarketscience.formula.expr.ParseException;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author James Ahlborn
 */
public class GroupNodeTest
{

  @Test
  public void testSplit() throws Exception
  {
    assertSplit("a, g(b,c), d", "a", "g(b,c)", "d");
    assertSplit("42", "42");
    assertSplit("\"x,y\", (1, 2)", "\"x,y\"", "(1, 2)");
    assertSplit("\"a\"\",\"\"b\" ,c", "\"a\"\",\"\"b\"", "c");
    assertSplit("f(g(1, 2), 3), 4", "f(g(1, 2), 3)", "4");
    assertSplit("1, (2 * (3 + (4 - (5 ^ (1, 2))))), 6", "1",
                "(2 * (3 + (4 - (5 ^ (1, 2)))))", "6");

    splitFail("1,,2");
    splitFail("1, ");
    splitFail(", 1");
  }

  @Test
  public void testEvalUnparsed() throws Exception
  {
    EvalException e = assertThrows(EvalException.class,
                                   () -> new GroupNode("1 + 2").eval(null));
    assertEquals(EvalException.ErrorType.SYNTAX, e.getErrorType());
    assertEquals("(1 + 2)", new GroupNode("1 + 2").toCleanString());
  }

  private static void assertSplit(String text, String... expected) {
    List<String> found = new ArrayList<String>();
    for(GroupNode group : new GroupNode(text).split()) {
      assertEquals(Node.NodeType.GROUP, group.getType());
      found.add(group.getText());
    }
    assertEquals(Arrays.asList(expected), found);
  }

  private static void splitFail(String text) {
    ParseException e = assertThrows(ParseException.class,
                                    () -> new GroupNode(text).split());
    assertEquals(EvalException.ErrorType.SYNTAX, e.getErrorType());
  }
}
