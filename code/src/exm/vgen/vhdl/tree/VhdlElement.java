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

import org.apache.commons.lang3.StringUtils;

import exm.vgen.common.Settings;
import exm.vgen.common.exceptions.VGenRuntimeError;

/**
 * The VhdlElement class hierarchy represents the VHDL constructs
 * produced by the code generator.
 *
 * VhdlElement is the most abstract VHDL syntax element.  Any element
 * may carry a comment.  Emitting never changes the tree: the
 * indentation level is passed down rather than stored.
 * */
public abstract class VhdlElement
{
  private String comment = null;

  /**
   * Write this element to the sink.
   * @param out sink; its IOExceptions are passed through unchanged
   * @param level nesting level, at least 0
   */
  public abstract void emit(Appendable out, int level) throws IOException;

  public void setComment(String comment)
  {
    this.comment = comment;
  }

  public String getComment()
  {
    return comment;
  }

  public boolean hasComment()
  {
    return !StringUtils.isEmpty(comment);
  }

  /**
   * Write the comment, if any.
   * @param endOfLine if true, append to the current line of output,
   *        otherwise write whole lines at the given level, before
   *        the element itself
   */
  protected void emitComment(Appendable out, int level, boolean endOfLine)
      throws IOException
  {
    if (!hasComment())
      return;

    String[] lines = StringUtils.split(comment, "\r\n");
    if (endOfLine) {
      out.append("  -- ");
      out.append(StringUtils.join(lines, ' '));
    } else {
      for (String line: lines) {
        indent(out, level);
        out.append("-- ");
        out.append(line);
        out.append('\n');
      }
    }
  }

  /**
   * End a line, with the comment at the end of it
   */
  protected void endLine(Appendable out, int level) throws IOException
  {
    emitComment(out, level, true);
    out.append('\n');
  }

  public static void indent(Appendable out, int level) throws IOException
  {
    if (level < 0)
      throw new VGenRuntimeError("Negative indentation level: " + level);
    out.append(StringUtils.repeat(' ', level * Settings.indentWidth()));
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder(2048);
    try {
      emit(sb, 0);
    } catch (IOException e) {
      throw new VGenRuntimeError("StringBuilder write failed", e);
    }
    return sb.toString();
  }
}
