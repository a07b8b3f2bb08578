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
import exm.vgen.common.Settings;
import exm.vgen.common.exceptions.DuplicateDeclarationException;
import exm.vgen.common.exceptions.VGenRuntimeError;

/**
 * An architecture which implements an entity.  Only the Entity
 * constructor sets the parent.
 */
public class Architecture extends VhdlElement
{
  private static final Logger logger = Logging.getVGenLogger();

  private final String name;
  private final String entityName;
  private final List<Decl> decls = new ArrayList<Decl>();
  private final List<ConcStmt> stmts = new ArrayList<ConcStmt>();
  private Entity parent = null;

  public Architecture(String entityName, String name)
  {
    assert(entityName != null && name != null);
    this.entityName = entityName;
    this.name = name;
  }

  /**
   * Architecture with the configured default name
   */
  public Architecture(String entityName)
  {
    this(entityName, Settings.get(Settings.ARCH_DEFAULT_NAME));
  }

  public String getName() {
    return name;
  }

  public String getEntityName() {
    return entityName;
  }

  /**
   * @return owning entity, or null before one has taken this
   */
  public Entity getParent() {
    return parent;
  }

  void setParent(Entity ent)
  {
    assert(ent != null);
    if (parent != null)
      throw new VGenRuntimeError("Architecture " + name + " of " +
                    entityName + " already belongs to entity " +
                    parent.getName());
    parent = ent;
  }

  /**
   * Take ownership of the statement
   */
  public void addStmt(ConcStmt stmt)
  {
    assert(stmt != null);
    stmt.setParent(this);
    logger.trace("add " + stmt.getClass().getSimpleName() +
                 " to architecture of " + entityName);
    stmts.add(stmt);
  }

  /**
   * @throws DuplicateDeclarationException if the name is already
   *        declared in this architecture
   */
  public void addDecl(Decl decl)
  {
    assert(decl != null);
    for (Decl d: decls) {
      if (d.getName().equals(decl.getName()))
        throw new DuplicateDeclarationException(decl.getName(),
                  "architecture " + name + " of " + entityName);
    }
    logger.trace("declare " + decl.getName() + " in architecture of " +
                 entityName);
    decls.add(decl);
  }

  public boolean haveDeclaredComponent(String compName)
  {
    for (Decl d: decls) {
      if (d instanceof ComponentDecl && d.getName().equals(compName))
        return true;
    }
    return false;
  }

  public List<Decl> getDecls() {
    return Collections.unmodifiableList(decls);
  }

  public List<ConcStmt> getStmts() {
    return Collections.unmodifiableList(stmts);
  }

  @Override
  public void emit(Appendable out, int level) throws IOException
  {
    emitComment(out, level, false);
    indent(out, level);
    out.append("architecture ");
    out.append(name);
    out.append(" of ");
    out.append(entityName);
    out.append(" is\n");
    for (Decl decl: decls)
      decl.emit(out, level + 1);
    indent(out, level);
    out.append("begin\n");
    for (ConcStmt stmt: stmts)
      stmt.emit(out, level + 1);
    indent(out, level);
    out.append("end architecture;\n");
  }
}
