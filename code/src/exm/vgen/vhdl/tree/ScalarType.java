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
 * A type that is just a name.  Verilog's type system is much
 * simpler than VHDL's, so this should not need to get much more
 * complex.
 *
 * The factories return a new instance on each call, since each
 * declaration owns its type.
 * */
public class ScalarType extends VhdlType
{
  private final String name;

  public ScalarType(String name)
  {
    assert(name != null && name.length() > 0);
    this.name = name;
  }

  public static ScalarType stdLogic() {
    return new ScalarType("std_logic");
  }

  public static ScalarType integer() {
    return new ScalarType("integer");
  }

  public static ScalarType booleanType() {
    return new ScalarType("boolean");
  }

  public static ScalarType string() {
    return new ScalarType("string");
  }

  public static ScalarType time() {
    return new ScalarType("time");
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public void emit(Appendable out, int level) throws IOException
  {
    out.append(name);
  }
}
