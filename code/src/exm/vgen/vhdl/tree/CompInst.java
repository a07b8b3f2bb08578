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
 * Instantiation of a component.  No port map yet.  Whether the
 * component was declared is for the caller to check with
 * Architecture.haveDeclaredComponent().
 * */
public class CompInst extends ConcStmt
{
  private final String instName;
  private final String compName;

  public CompInst(String instName, String compName)
  {
    this.instName = instName;
    this.compName = compName;
  }

  public String getInstName() {
    return instName;
  }

  public String getCompName() {
    return compName;
  }

  @Override
  public void emit(Appendable out, int level) throws IOException
  {
    indent(out, level);
    out.append(instName);
    out.append(": ");
    out.append(compName);
    out.append(';');
    endLine(out, level);
  }
}
