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

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.vgen.common.Logging;
import exm.vgen.common.exceptions.DuplicateDeclarationException;

/**
 * All the entities generated in one run, written out in the order
 * they were added.  The comment, if set, heads the file.
 */
public class DesignFile extends VhdlElement
{
  private static final Logger logger = Logging.getVGenLogger();

  private final List<Entity> entities = new ArrayList<Entity>();

  /**
   * @throws DuplicateDeclarationException if an entity of that
   *        name was already added
   */
  public void addEntity(Entity ent)
  {
    assert(ent != null);
    for (Entity e: entities) {
      if (e.getName().equals(ent.getName()))
        throw new DuplicateDeclarationException(ent.getName(),
                                                "design file");
    }
    entities.add(ent);
  }

  /**
   * @return the entity generated for the given source scope,
   *        or null if there is none yet
   */
  public Entity findEntity(String derivedFrom)
  {
    for (Entity e: entities) {
      if (StringUtils.equals(derivedFrom, e.getDerivedFrom()))
        return e;
    }
    return null;
  }

  public List<Entity> getEntities() {
    return Collections.unmodifiableList(entities);
  }

  public void emit(Appendable out) throws IOException
  {
    emit(out, 0);
  }

  @Override
  public void emit(Appendable out, int level) throws IOException
  {
    logger.debug("emitting " + entities.size() + " entities");
    if (hasComment()) {
      emitComment(out, level, false);
      out.append('\n');
    }
    boolean first = true;
    for (Entity ent: entities) {
      if (first)
        first = false;
      else
        out.append('\n');
      ent.emit(out, level);
    }
  }
}
