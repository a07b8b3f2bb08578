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
 * A variable declaration inside a process (although this isn't
 * enforced here)
 */
public class VarDecl extends Decl
{
  private final VhdlType type;

  public VarDecl(String name, VhdlType type)
  {
    super(name);
    assert(type != null);
    this.type = type;
  }

  public VhdlType getType() {
    return type;
  }

  @Override
  public void emit(Appendable out, int level) throws IOException
  {
    indent(out, level);
    out.append("variable ");
    out.append(getName());
    out.append(" : ");
    type.emit(out, level);
    out.append(';');
    endLine(out, level);
  }
}
