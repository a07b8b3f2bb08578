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

import java.io.IOException;

/**
 * A forward declaration of a component.  Components are only ever
 * declared for entities produced by this code generator, so the
 * only way to make one is componentDeclFor().
 * */
public class ComponentDecl extends Decl
{
  private ComponentDecl(String name)
  {
    super(name);
  }

  public static ComponentDecl componentDeclFor(Entity ent)
  {
    assert(ent != null);
    return new ComponentDecl(ent.getName());
  }

  // TODO: port list, once Entity has ports to copy from
  @Override
  public void emit(Appendable out, int level) throws IOException
  {
    emitComment(out, level, false);
    indent(out, level);
    out.append("component ");
    out.append(getName());
    out.append(" is\n");
    indent(out, level);
    out.append("end component;\n");
  }
}
