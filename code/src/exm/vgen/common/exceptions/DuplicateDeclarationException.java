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

package exm.vgen.common.exceptions;

/**
 * A name was declared twice in the same VHDL scope.  Translators
 * should query the scope (e.g. haveDeclaredVar) before inserting.
 */
public class DuplicateDeclarationException extends VGenRuntimeError
{
  private final String name;
  private final String scope;

  public DuplicateDeclarationException(String name, String scope)
  {
    super("Duplicate declaration of " + name + " in " + scope);
    this.name = name;
    this.scope = scope;
  }

  public String getName() {
    return name;
  }

  public String getScope() {
    return scope;
  }

  private static final long serialVersionUID = 1L;
}
