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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import java.io.IOException;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.vgen.common.exceptions.DuplicateDeclarationException;

public class DesignFileTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testFindEntity() {
    DesignFile file = new DesignFile();
    Entity sub = new Entity("sub", "top.s0", new Architecture("sub"));
    file.addEntity(sub);
    assertSame(sub, file.findEntity("top.s0"));
    assertNull(file.findEntity("top.s1"));
    assertNull(file.findEntity(null));
  }

  @Test
  public void testDuplicateEntityRejected() {
    DesignFile file = new DesignFile();
    file.addEntity(new Entity("sub", "top.s0", new Architecture("sub")));
    exception.expect(DuplicateDeclarationException.class);
    file.addEntity(new Entity("sub", "top.s1", new Architecture("sub")));
  }

  @Test
  public void testHierarchy() throws IOException {
    DesignFile file = new DesignFile();
    file.setComment("Generated VHDL");

    Entity sub = new Entity("sub", "top.s0", new Architecture("sub"));
    file.addEntity(sub);

    Architecture topArch = new Architecture("top");
    if (!topArch.haveDeclaredComponent(sub.getName()))
      topArch.addDecl(ComponentDecl.componentDeclFor(sub));
    topArch.addStmt(new CompInst("s0", sub.getName()));
    file.addEntity(new Entity("top", "top", topArch));

    StringBuilder sb = new StringBuilder();
    file.emit(sb);
    assertEquals("-- Generated VHDL\n" +
                 "\n" +
                 "entity sub is\n" +
                 "end entity;\n" +
                 "\n" +
                 "architecture Behavioural of sub is\n" +
                 "begin\n" +
                 "end architecture;\n" +
                 "\n" +
                 "entity top is\n" +
                 "end entity;\n" +
                 "\n" +
                 "architecture Behavioural of top is\n" +
                 "  component sub is\n" +
                 "  end component;\n" +
                 "begin\n" +
                 "  s0: sub;\n" +
                 "end architecture;\n", sb.toString());
    assertEquals(sb.toString(), file.toString());
  }
}
