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

import exm.vgen.common.exceptions.VGenRuntimeError;

/**
 * A concurrent statement appears in architecture bodies but not
 * processes.  Only Architecture.addStmt() sets the parent.
 * */
public abstract class ConcStmt extends VhdlElement
{
  private Architecture parent = null;

  /**
   * @return the architecture this was added to, or null if not yet added
   */
  public Architecture getParent() {
    return parent;
  }

  void setParent(Architecture arch)
  {
    assert(arch != null);
    if (parent != null)
      throw new VGenRuntimeError("Concurrent statement already belongs " +
                      "to architecture " + parent.getName() + " of " +
                      parent.getEntityName());
    parent = arch;
  }
}
