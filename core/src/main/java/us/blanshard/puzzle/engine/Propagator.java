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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.puzzle.core.Assignment;
import us.blanshard.puzzle.core.Constraint;
import us.blanshard.puzzle.core.Domains;
import us.blanshard.puzzle.core.Puzzle;
import us.blanshard.puzzle.core.Variable;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.List;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * Runs a puzzle's constraints over a domain table until nothing more can be
 * deduced, or until some constraint finds a contradiction.
 *
 * <p> Works from a queue of dirty variables.  Each variable taken off the queue
 * has every constraint in which it takes part run against the table; every
 * variable whose domain shrinks as a result goes back on the queue, so the
 * constraints it shares with other variables run again.  Domains only shrink,
 * so this stops.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Propagator {
  private final Puzzle puzzle;

  public Propagator(Puzzle puzzle) {
    this.puzzle = checkNotNull(puzzle);
  }

  public Puzzle getPuzzle() {
    return puzzle;
  }

  /**
   * Propagates from the given dirty variables to a fixed point.  Returns null
   * if the builder's domains are consistent as far as propagation can tell,
   * otherwise the contradiction found.  The builder is left as it was when
   * propagation stopped.
   */
  @Nullable public Contradiction propagate(Domains.Builder builder, Iterable<Variable> dirty) {
    checkArgument(builder.size() == puzzle.size());
    builder.drainShrunk();

    ArrayDeque<Variable> queue = new ArrayDeque<Variable>();
    BitSet queued = new BitSet(puzzle.size());
    for (Variable v : dirty)
      enqueue(v, queue, queued);

    while (!queue.isEmpty()) {
      Variable v = queue.removeFirst();
      queued.clear(v.index);
      for (Constraint c : puzzle.getConstraints(v)) {
        if (!c.propagate(builder))
          return contradiction(c, builder);
        BitSet shrunk = builder.drainShrunk();
        for (int i = shrunk.nextSetBit(0); i >= 0; i = shrunk.nextSetBit(i + 1))
          enqueue(puzzle.getVariable(i), queue, queued);
      }
    }
    return null;
  }

  /** Propagates with every variable dirty. */
  @Nullable public Contradiction propagateAll(Domains.Builder builder) {
    return propagate(builder, puzzle.getVariables());
  }

  /**
   * Commits the given value to the given variable by narrowing its domain to
   * that single value, then propagates from it.
   */
  @Nullable public Contradiction assign(Domains.Builder builder, Variable variable, int value) {
    if (!builder.assign(variable, value))
      return unsupported(variable);
    return propagate(builder, ImmutableSet.of(variable));
  }

  /**
   * Commits every value in the given assignment, in variable order, then
   * propagates from all the committed variables together.
   */
  @Nullable public Contradiction assignAll(Domains.Builder builder, Assignment assignment) {
    List<Variable> dirty = Lists.newArrayList();
    for (Variable v : puzzle.getVariables()) {
      if (!assignment.isAssigned(v)) continue;
      if (!builder.assign(v, assignment.get(v)))
        return unsupported(v);
      dirty.add(v);
    }
    return propagate(builder, dirty);
  }

  private static void enqueue(Variable v, ArrayDeque<Variable> queue, BitSet queued) {
    if (!queued.get(v.index)) {
      queued.set(v.index);
      queue.addLast(v);
    }
  }

  private Contradiction contradiction(Constraint constraint, Domains.Builder builder) {
    BitSet emptied = builder.getEmptied();
    ImmutableSet<Variable> variables;
    if (emptied.isEmpty()) {
      variables = ImmutableSet.copyOf(constraint.scope);
    } else {
      ImmutableSet.Builder<Variable> vars = ImmutableSet.builder();
      for (int i = emptied.nextSetBit(0); i >= 0; i = emptied.nextSetBit(i + 1))
        vars.add(puzzle.getVariable(i));
      variables = vars.build();
    }
    return new Contradiction(ImmutableSet.of(constraint), variables);
  }

  private static Contradiction unsupported(Variable variable) {
    return new Contradiction(ImmutableSet.<Constraint>of(), ImmutableSet.of(variable));
  }
}
