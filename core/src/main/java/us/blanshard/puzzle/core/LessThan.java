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
 * Requires the first variable's value to be less than the second's, like the
 * inequality signs between Futoshiki cells.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class LessThan extends Constraint {

  LessThan(String id, int index, ImmutableList<Variable> scope) {
    super(Type.LESS_THAN, id, index, scope);
  }

  public Variable getLesser() {
    return scope.get(0);
  }

  public Variable getGreater() {
    return scope.get(1);
  }

  @Override public Satisfaction check(Assignment assignment) {
    Variable lesser = getLesser();
    Variable greater = getGreater();
    if (!assignment.isAssigned(lesser) || !assignment.isAssigned(greater))
      return Satisfaction.UNDETERMINED;
    return assignment.get(lesser) < assignment.get(greater)
        ? Satisfaction.SATISFIED : Satisfaction.VIOLATED;
  }

  @Override public boolean propagate(Domains.Builder domains) {
    Variable lesser = getLesser();
    Variable greater = getGreater();
    ValueSet low = domains.get(lesser);
    ValueSet high = domains.get(greater);
    if (low.isEmpty() || high.isEmpty()) return false;
    return domains.restrict(lesser, ValueSet.range(0, high.max() - 1))
        && domains.restrict(greater, ValueSet.range(low.min() + 1, ValueSet.MAX_VALUE));
  }
}
