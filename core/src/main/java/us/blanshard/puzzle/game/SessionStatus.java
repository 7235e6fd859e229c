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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableSet;

import javax.annotation.concurrent.Immutable;

/**
 * What a {@link ValidationSession} has to say about the puzzle after an edit.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class SessionStatus {

  public enum State {
    /** Nothing is wrong, and the puzzle can still be finished. */
    IN_PROGRESS,
    /** The entries already break a rule. */
    VIOLATED,
    /** Nothing is broken yet, but no completion exists. */
    INFEASIBLE,
    /** Every variable is filled and every rule holds. */
    SOLVED;
  }

  public final State state;

  /** The identifiers of the variables involved in a violation. */
  public final ImmutableSet<String> implicatedVariables;

  /** The identifiers of the constraints involved in a violation or infeasibility. */
  public final ImmutableSet<String> implicatedConstraints;

  /**
   * True when feasibility could not be settled: the search gave up at its node
   * ceiling, or is still running in the background.  The state then reflects
   * propagation alone.
   */
  public final boolean caveat;

  /** The session generation this status describes. */
  public final long generation;

  SessionStatus(State state, ImmutableSet<String> implicatedVariables,
      ImmutableSet<String> implicatedConstraints, boolean caveat, long generation) {
    this.state = checkNotNull(state);
    this.implicatedVariables = checkNotNull(implicatedVariables);
    this.implicatedConstraints = checkNotNull(implicatedConstraints);
    this.caveat = caveat;
    this.generation = generation;
  }

  static SessionStatus inProgress(long generation, boolean caveat) {
    return new SessionStatus(State.IN_PROGRESS, ImmutableSet.<String>of(),
        ImmutableSet.<String>of(), caveat, generation);
  }

  static SessionStatus violated(long generation, ImmutableSet<String> variables,
      ImmutableSet<String> constraints) {
    return new SessionStatus(State.VIOLATED, variables, constraints, false, generation);
  }

  static SessionStatus infeasible(long generation, ImmutableSet<String> constraints) {
    return new SessionStatus(State.INFEASIBLE, ImmutableSet.<String>of(), constraints, false,
        generation);
  }

  static SessionStatus solved(long generation) {
    return new SessionStatus(State.SOLVED, ImmutableSet.<String>of(),
        ImmutableSet.<String>of(), false, generation);
  }

  /** Returns this status, moved to the given generation. */
  SessionStatus withGeneration(long generation) {
    return new SessionStatus(state, implicatedVariables, implicatedConstraints, caveat,
        generation);
  }

  /** Tells whether this status says the same thing as another, ignoring generations. */
  public boolean sameVerdict(SessionStatus that) {
    return this.state == that.state
        && this.caveat == that.caveat
        && this.implicatedVariables.equals(that.implicatedVariables)
        && this.implicatedConstraints.equals(that.implicatedConstraints);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof SessionStatus)) return false;
    SessionStatus that = (SessionStatus) o;
    return sameVerdict(that) && this.generation == that.generation;
  }

  @Override public int hashCode() {
    return Objects.hashCode(state, implicatedVariables, implicatedConstraints, caveat, generation);
  }

  @Override public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("state", state)
        .add("variables", implicatedVariables)
        .add("constraints", implicatedConstraints)
        .add("caveat", caveat)
        .add("generation", generation)
        .toString();
  }
}
