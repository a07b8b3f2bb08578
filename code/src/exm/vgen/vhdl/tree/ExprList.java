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
import java.util.Iterator;
import java.util.List;

/**
 * Comma-separated list of expressions, e.g. procedure call
 * arguments.  The list owns its members.
 * */
public class ExprList extends VhdlElement
{
  private final List<Expression> exprs = new ArrayList<Expression>();

  public void addExpr(Expression e)
  {
    assert(e != null);
    exprs.add(e);
  }

  public List<Expression> getExprs() {
    return Collections.unmodifiableList(exprs);
  }

  public int size() {
    return exprs.size();
  }

  public boolean isEmpty() {
    return exprs.isEmpty();
  }

  @Override
  public void emit(Appendable out, int level) throws IOException
  {
    Iterator<Expression> it = exprs.iterator();
    while (it.hasNext())
    {
      it.next().emit(out, level);
      if (it.hasNext())
        out.append(", ");
    }
  }
}
