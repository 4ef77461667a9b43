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
package exm.ppl.emit.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Line after line sequence of code
 * */
public class Sequence extends CodeTree
{
  List<CodeTree> members = new ArrayList<CodeTree>();

  public void add(CodeTree tree)
  {
    members.add(tree);
  }

  public void add(CodeTree[] trees)
  {
    for (CodeTree tree : trees)
      add(tree);
  }

  /**
   * Append at end of current sequence
   * @param seq
   */
  public void append(Sequence seq)
  {
    members.addAll(seq.members);
  }

  public boolean isEmpty()
  {
    return members.isEmpty();
  }

  public int size()
  {
    return members.size();
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    for (CodeTree member : members)
    {
      member.inheritFrom(this);
      member.appendTo(sb);
    }
  }
}
