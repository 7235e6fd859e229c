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
 * Requires the values of the variables in scope to add up to a fixed total,
 * like a Kakuro run or a killer Sudoku cage.  Propagation works on bounds.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Sum extends Constraint {
  private final int total;

  Sum(String id, int index, ImmutableList<Variable> scope, int total) {
    super(Type.SUM, id, index, scope);
    this.total = total;
  }

  public int getTotal() {
    return total;
  }

  @Override public Integer getParameter() {
    return total;
  }

  @Override public Satisfaction check(Assignment assignment) {
    int sum = 0;
    boolean complete = true;
    for (Variable v : scope) {
      if (assignment.isAssigned(v)) sum += assignment.get(v);
      else complete = false;
    }
    if (complete) return sum == total ? Satisfaction.SATISFIED : Satisfaction.VIOLATED;
    // Values are never negative, so an overshoot can't be repaired.
    return sum > total ? Satisfaction.VIOLATED : Satisfaction.UNDETERMINED;
  }

  @Override public boolean propagate(Domains.Builder domains) {
    int minSum = 0;
    int maxSum = 0;
    for (Variable v : scope) {
      ValueSet candidates = domains.get(v);
      if (candidates.isEmpty()) return false;
      minSum += candidates.min();
      maxSum += candidates.max();
    }
    if (minSum > total || maxSum < total) return false;

    for (Variable v : scope) {
      ValueSet candidates = domains.get(v);
      int othersMin = minSum - candidates.min();
      int othersMax = maxSum - candidates.max();
      if (!domains.restrict(v, ValueSet.range(total - othersMax, total - othersMin)))
        return false;
    }
    return true;
  }
}
