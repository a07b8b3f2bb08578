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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import exm.vgen.common.Logging;
import exm.vgen.common.exceptions.DuplicateDeclarationException;

/**
 * Container for sequential statements
 */
public class Process extends ConcStmt
{
  private static final Logger logger = Logging.getVGenLogger();

  private final String name;
  private final List<Decl> decls = new ArrayList<Decl>();
  private final List<SeqStmt> stmts = new ArrayList<SeqStmt>();

  public Process(String name)
  {
    this.name = (name == null) ? "" : name;
  }

  /**
   * An unlabelled process
   */
  public Process()
  {
    this("");
  }

  public String getName() {
    return name;
  }

  public void addStmt(SeqStmt stmt)
  {
    assert(stmt != null);
    logger.trace("add " + stmt.getClass().getSimpleName() + " to " +
                 describe());
    stmts.add(stmt);
  }

  /**
   * @throws DuplicateDeclarationException if the name is already
   *        declared in this process
   */
  public void addDecl(Decl decl)
  {
    assert(decl != null);
    for (Decl d: decls) {
      if (d.getName().equals(decl.getName()))
        throw new DuplicateDeclarationException(decl.getName(),
                                                describe());
    }
    logger.trace("declare " + decl.getName() + " in " + describe());
    decls.add(decl);
  }

  public boolean haveDeclaredVar(String varName)
  {
    for (Decl d: decls) {
      if (d instanceof VarDecl && d.getName().equals(varName))
        return true;
    }
    return false;
  }

  public List<Decl> getDecls() {
    return Collections.unmodifiableList(decls);
  }

  public List<SeqStmt> getStmts() {
    return Collections.unmodifiableList(stmts);
  }

  private String describe() {
    return name.length() == 0 ? "unnamed process" : "process " + name;
  }

  @Override
  public void emit(Appendable out, int level) throws IOException
  {
    emitComment(out, level, false);
    indent(out, level);
    if (name.length() > 0) {
      out.append(name);
      out.append(": ");
    }
    out.append("process is\n");
    for (Decl decl: decls)
      decl.emit(out, level + 1);
    indent(out, level);
    out.append("begin\n");
    for (SeqStmt stmt: stmts)
      stmt.emit(out, level + 1);
    indent(out, level);
    out.append("end process;\n");
  }
}
