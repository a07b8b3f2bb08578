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
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import exm.vgen.common.Logging;
import exm.vgen.common.exceptions.VGenRuntimeError;

/**
 * An entity defines the ports, parameters, etc. of a module.  Each
 * entity has exactly one architecture.  Entities are derived from
 * instantiations of Verilog module scopes in the hierarchy; the
 * derived-from label records which one, and is not written out.
 * */
public class Entity extends VhdlElement
{
  private static final Logger logger = Logging.getVGenLogger();

  /** Libraries visible without a library clause */
  private static final Set<String> IMPLICIT_LIBRARIES =
      ImmutableSet.of("work", "std");

  private final String name;
  private final String derivedFrom;
  private final Architecture arch;

  /** lowercased qualified name => qualified name as first given */
  private final Map<String, String> uses = Maps.newLinkedHashMap();

  public Entity(String name, String derivedFrom, Architecture arch)
  {
    assert(name != null && arch != null);
    assert(derivedFrom != null);
    this.name = name;
    this.derivedFrom = derivedFrom;
    this.arch = arch;
    arch.setParent(this);
  }

  public String getName() {
    return name;
  }

  public String getDerivedFrom() {
    return derivedFrom;
  }

  public Architecture getArch() {
    return arch;
  }

  /**
   * Record that the entity needs a package, e.g. ieee.std_logic_1164.
   * A package with no library prefix is taken to be in work.
   * Requiring the same package again, in any letter case, has no
   * effect.
   * @throws VGenRuntimeError if the name is not [library.]package
   */
  public void requiresPackage(String pkgName)
  {
    assert(pkgName != null);
    String[] parts = StringUtils.splitPreserveAllTokens(pkgName, '.');
    if (parts == null || parts.length == 0 || parts.length > 2)
      throw new VGenRuntimeError("Bad package name for entity " + name +
                                 ": '" + pkgName + "'");
    for (String part: parts) {
      if (StringUtils.isBlank(part))
        throw new VGenRuntimeError("Bad package name for entity " + name +
                                   ": '" + pkgName + "'");
    }

    String qualified;
    if (parts.length == 1) {
      Logging.uniqueWarn("Package " + pkgName + " has no library, " +
                         "assuming work");
      qualified = "work." + pkgName;
    } else {
      qualified = pkgName;
    }
    String key = qualified.toLowerCase();
    if (uses.containsKey(key)) {
      logger.debug("entity " + name + " already requires " + qualified);
    } else {
      uses.put(key, qualified);
    }
  }

  /**
   * @return qualified package names, in the order first required
   */
  public List<String> getRequiredPackages() {
    return ImmutableList.copyOf(uses.values());
  }

  private static String libraryOf(String qualified) {
    return qualified.substring(0, qualified.indexOf('.'));
  }

  @Override
  public void emit(Appendable out, int level) throws IOException
  {
    logger.debug("emitting entity " + name + " (from " + derivedFrom + ")");
    Set<String> seenLibraries = Sets.newHashSet(IMPLICIT_LIBRARIES);
    for (String pkg: uses.values()) {
      String library = libraryOf(pkg);
      if (seenLibraries.add(library.toLowerCase())) {
        indent(out, level);
        out.append("library ");
        out.append(library);
        out.append(";\n");
      }
      indent(out, level);
      out.append("use ");
      out.append(pkg);
      out.append(".all;\n");
    }
    if (!uses.isEmpty())
      out.append('\n');

    emitComment(out, level, false);
    indent(out, level);
    out.append("entity ");
    out.append(name);
    out.append(" is\n");
    // No ports yet
    indent(out, level);
    out.append("end entity;\n");
    out.append('\n');
    arch.emit(out, level);
  }
}
