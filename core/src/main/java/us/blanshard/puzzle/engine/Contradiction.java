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
package us.blanshard.puzzle.engine;

import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.puzzle.core.Constraint;
import us.blanshard.puzzle.core.Variable;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableSet;

import javax.annotation.concurrent.Immutable;

/**
 * Describes a dead end reached by propagation: the constraints whose
 * propagation failed, and the variables left without candidates.  This is an
 * ordinary outcome of a user's mistake, not an error.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Contradiction {
  private final ImmutableSet<Constraint> constraints;
  private final ImmutableSet<Variable> variables;

  public Contradiction(ImmutableSet<Constraint> constraints, ImmutableSet<Variable> variables) {
    this.constraints = checkNotNull(constraints);
    this.variables = checkNotNull(variables);
  }

  /**
   * The constraints implicated.  Empty when a value was committed that was
   * never in its variable's starting domain.
   */
  public ImmutableSet<Constraint> getConstraints() {
    return constraints;
  }

  /** The variables implicated: those emptied, or the failing rule's scope. */
  public ImmutableSet<Variable> getVariables() {
    return variables;
  }

  public ImmutableSet<String> getConstraintIds() {
    ImmutableSet.Builder<String> ids = ImmutableSet.builder();
    for (Constraint c : constraints)
      ids.add(c.id);
    return ids.build();
  }

  public ImmutableSet<String> getVariableIds() {
    ImmutableSet.Builder<String> ids = ImmutableSet.builder();
    for (Variable v : variables)
      ids.add(v.id);
    return ids.build();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (o == null || o.getClass() != getClass()) return false;
    Contradiction that = (Contradiction) o;
    return this.constraints.equals(that.constraints)
        && this.variables.equals(that.variables);
  }

  @Override public int hashCode() {
    return Objects.hashCode(constraints, variables);
  }

  @Override public String toString() {
    return "Contradiction" + getConstraintIds() + getVariableIds();
  }
}
