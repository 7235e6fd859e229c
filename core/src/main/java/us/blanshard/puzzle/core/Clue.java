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
 * Fixes a single variable to a given value: a clue printed in the grid.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Clue extends Constraint {
  private final int value;

  Clue(String id, int index, ImmutableList<Variable> scope, int value) {
    super(Type.CLUE, id, index, scope);
    this.value = value;
  }

  public Variable getVariable() {
    return scope.get(0);
  }

  public int getValue() {
    return value;
  }

  @Override public Integer getParameter() {
    return value;
  }

  @Override public Satisfaction check(Assignment assignment) {
    Variable variable = getVariable();
    if (!assignment.isAssigned(variable)) return Satisfaction.UNDETERMINED;
    return assignment.get(variable) == value ? Satisfaction.SATISFIED : Satisfaction.VIOLATED;
  }

  @Override public boolean propagate(Domains.Builder domains) {
    return domains.assign(getVariable(), value);
  }
}
