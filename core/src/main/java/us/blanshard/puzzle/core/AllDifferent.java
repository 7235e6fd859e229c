/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.puzzle.core;

import com.google.common.collect.ImmutableList;

import javax.annotation.concurrent.Immutable;

/**
 * Requires the variables in scope to hold pairwise different values, like the
 * rows, columns and blocks of a Sudoku.
 *
 * <p> Propagation removes each fixed variable's value from its peers, fails
 * when fewer values remain than there are variables, and when the values
 * exactly cover the variables forces any value with a single possible home.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class AllDifferent extends Constraint {

  AllDifferent(String id, int index, ImmutableList<Variable> scope) {
    super(Type.ALL_DIFFERENT, id, index, scope);
  }

  @Override public Satisfaction check(Assignment assignment) {
    long seen = 0;
    boolean complete = true;
    for (Variable v : scope) {
      if (!assignment.isAssigned(v)) {
        complete = false;
        continue;
      }
      long bit = ValueSet.bit(assignment.get(v));
      if ((seen & bit) != 0) return Satisfaction.VIOLATED;
      seen |= bit;
    }
    return complete ? Satisfaction.SATISFIED : Satisfaction.UNDETERMINED;
  }

  @Override public boolean propagate(Domains.Builder domains) {
    for (Variable v : scope) {
      ValueSet candidates = domains.get(v);
      if (candidates.isEmpty()) return false;
      if (!candidates.isSingleton()) continue;
      int value = candidates.min();
      for (Variable peer : scope) {
        if (peer != v && !domains.eliminate(peer, value))
          return false;
      }
    }

    long union = 0;
    for (Variable v : scope)
      union |= domains.get(v).bits;
    int available = Long.bitCount(union);
    if (available < scope.size()) return false;  // Pigeonhole
    if (available > scope.size()) return true;

    // Every value must be used, so a value with one possible home goes there.
    for (long rest = union; rest != 0; rest &= rest - 1) {
      int value = Long.numberOfTrailingZeros(rest);
      Variable home = null;
      int count = 0;
      for (Variable v : scope) {
        if (domains.get(v).contains(value)) {
          home = v;
          ++count;
        }
      }
      if (count == 0) return false;  // An earlier forcing took its last home
      if (count == 1 && !domains.assign(home, value))
        return false;
    }
    return true;
  }
}
