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
 * Requires two variables' values to lie a fixed distance apart, like the
 * consecutive-pair marks between neighboring cells.  A distance of zero
 * makes the two equal.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Difference extends Constraint {
  private final int distance;

  Difference(String id, int index, ImmutableList<Variable> scope, int distance) {
    super(Type.DIFFERENCE, id, index, scope);
    this.distance = distance;
  }

  public int getDistance() {
    return distance;
  }

  @Override public Integer getParameter() {
    return distance;
  }

  @Override public Satisfaction check(Assignment assignment) {
    Variable first = scope.get(0);
    Variable second = scope.get(1);
    if (!assignment.isAssigned(first) || !assignment.isAssigned(second))
      return Satisfaction.UNDETERMINED;
    return Math.abs(assignment.get(first) - assignment.get(second)) == distance
        ? Satisfaction.SATISFIED : Satisfaction.VIOLATED;
  }

  @Override public boolean propagate(Domains.Builder domains) {
    Variable first = scope.get(0);
    Variable second = scope.get(1);
    return domains.restrict(first, supported(domains.get(second)))
        && domains.restrict(second, supported(domains.get(first)));
  }

  /** Returns the values that sit at our distance from some value in the given set. */
  private ValueSet supported(ValueSet other) {
    return ValueSet.ofBits((other.bits << distance) | (other.bits >>> distance));
  }
}
