/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.vgen.vhdl.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.apache.commons.lang3.StringUtils;
import org.junit.Test;

public class ExpressionTest {

  @Test
  public void testVarRef() {
    assertEquals("clk_enable", new VarRef("clk_enable").toString());
  }

  @Test
  public void testConstString() {
    assertEquals("\"Hello, world!\"", new ConstString("Hello, world!").toString());
    assertEquals("\"\"", new ConstString("").toString());
  }

  @Test
  public void testConstStringEscapesQuotes() {
    assertEquals("\"say \"\"hi\"\"\"", new ConstString("say \"hi\"").toString());
  }

  @Test
  public void testExprCommentNotWritten() {
    VarRef v = new VarRef("x");
    v.setComment("not here");
    assertEquals("x", v.toString());
  }

  @Test
  public void testEmptyExprList() {
    ExprList l = new ExprList();
    assertTrue(l.isEmpty());
    assertEquals("", l.toString());
  }

  @Test
  public void testExprListOrderAndSeparators() {
    ExprList l = new ExprList();
    l.addExpr(new VarRef("a"));
    l.addExpr(new ConstString("b"));
    l.addExpr(new VarRef("c"));
    String s = l.toString();
    assertEquals("a, \"b\", c", s);
    assertEquals(l.size() - 1, StringUtils.countMatches(s, ", "));
  }

  @Test
  public void testSingleExpr() {
    ExprList l = new ExprList();
    l.addExpr(new VarRef("only"));
    assertEquals("only", l.toString());
  }
}
