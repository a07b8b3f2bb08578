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
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;

import java.io.IOException;

import org.junit.Test;

public class StatementTest {

  @Test
  public void testWait() {
    assertEquals("wait;\n", new WaitStmt().toString());
  }

  @Test
  public void testWaitIndented() throws IOException {
    StringBuilder sb = new StringBuilder();
    new WaitStmt().emit(sb, 2);
    assertEquals("    wait;\n", sb.toString());
  }

  @Test
  public void testPCallNoArgs() {
    assertEquals("flush();\n", new PCallStmt("flush").toString());
  }

  @Test
  public void testPCallArgs() {
    PCallStmt call = new PCallStmt("write");
    call.addExpr(new VarRef("output"));
    call.addExpr(new ConstString("done"));
    assertEquals("write(output, \"done\");\n", call.toString());
    assertEquals(2, call.getExprs().size());
  }

  @Test
  public void testEndOfLineComment() {
    WaitStmt w = new WaitStmt();
    w.setComment("forever");
    assertEquals("wait;  -- forever\n", w.toString());
  }

  @Test
  public void testMultiLineEndOfLineComment() {
    WaitStmt w = new WaitStmt();
    w.setComment("line one\nline two");
    assertEquals("wait;  -- line one line two\n", w.toString());
  }

  @Test
  public void testCarriageReturnDroppedAtEndOfLine() {
    PCallStmt call = new PCallStmt("tick");
    call.setComment("a\r\nb");
    assertEquals("tick();  -- a b\n", call.toString());
  }

  @Test
  public void testVarDecl() {
    VarDecl d = new VarDecl("count", ScalarType.integer());
    assertEquals("count", d.getName());
    assertEquals("variable count : integer;\n", d.toString());
  }

  @Test
  public void testCompInst() {
    CompInst inst = new CompInst("u0", "counter");
    assertNull(inst.getParent());
    assertEquals("u0: counter;\n", inst.toString());
  }

  @Test
  public void testComponentDeclNamedAfterEntity() {
    Entity ent = new Entity("counter", "top.c0", new Architecture("counter"));
    ComponentDecl c = ComponentDecl.componentDeclFor(ent);
    assertEquals(ent.getName(), c.getName());
    assertEquals("component counter is\nend component;\n", c.toString());
  }

  @Test
  public void testScalarTypeFactoriesAreFresh() {
    ScalarType a = ScalarType.stdLogic();
    ScalarType b = ScalarType.stdLogic();
    assertEquals("std_logic", a.getName());
    assertEquals(a.toString(), b.toString());
    assertNotSame(a, b);
  }
}
