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
package us.blanshard.puzzle.game;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.puzzle.core.Assignment;
import us.blanshard.puzzle.core.ValueSet;
import us.blanshard.puzzle.core.Variable;

import com.google.common.base.Objects;

import javax.annotation.concurrent.Immutable;

/**
 * A single edit made in a {@link ValidationSession}.  Has nested classes for
 * all defined edits.
 *
 * @author Luke Blanshard
 */
@Immutable
public abstract class Edit {

  /** The identifier of the variable edited. */
  public final String variableId;

  Edit(String variableId) {
    this.variableId = checkNotNull(variableId);
  }

  /** Performs this edit on the given session's committed values. */
  abstract void apply(ValidationSession session, Variable variable);

  /**
   * Tells whether, given the variable's previous value, this edit only adds a
   * commitment, so that the session can narrow its current domains instead
   * of starting over.
   */
  abstract boolean extendsAssignment(int previous);

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (o == null || o.getClass() != getClass()) return false;
    return variableId.equals(((Edit) o).variableId);
  }

  @Override public int hashCode() {
    return Objects.hashCode(getClass(), variableId);
  }

  /** Commits a value to a variable. */
  @Immutable
  public static final class Set extends Edit {
    public final int value;

    public Set(String variableId, int value) {
      super(variableId);
      checkArgument(ValueSet.isValidValue(value), "Value out of range: %s", value);
      this.value = value;
    }

    @Override void apply(ValidationSession session, Variable variable) {
      session.commitValue(variable, value);
    }

    @Override boolean extendsAssignment(int previous) {
      return previous == Assignment.UNSET || previous == value;
    }

    @Override public boolean equals(Object o) {
      return super.equals(o) && value == ((Set) o).value;
    }

    @Override public int hashCode() {
      return 31 * super.hashCode() + value;
    }

    @Override public String toString() {
      return variableId + " := " + value;
    }
  }

  /** Removes a variable's committed value. */
  @Immutable
  public static final class Clear extends Edit {
    public Clear(String variableId) {
      super(variableId);
    }

    @Override void apply(ValidationSession session, Variable variable) {
      session.clearValue(variable);
    }

    @Override boolean extendsAssignment(int previous) {
      return false;
    }

    @Override public String toString() {
      return variableId + " := _";
    }
  }

  /** Puts a variable back the way it was before its most recent edit. */
  @Immutable
  public static final class Undo extends Edit {
    public Undo(String variableId) {
      super(variableId);
    }

    @Override void apply(ValidationSession session, Variable variable) {
      session.undoValue(variable);
    }

    @Override boolean extendsAssignment(int previous) {
      return false;
    }

    @Override public String toString() {
      return "undo " + variableId;
    }
  }
}
