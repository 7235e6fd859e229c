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
import us.blanshard.puzzle.core.Satisfaction;
import us.blanshard.puzzle.core.Variable;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.SortedSet;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * A depth-first, worklist-based search that tells whether a domain table can
 * still be completed, without saying how.  Never modifies the table it's
 * given: each branch works on a copy-on-write builder of its parent's
 * snapshot.
 *
 * <p> Branches on the variable with the fewest candidates (ties going to the
 * lower identifier), trying values in ascending order, and propagates after
 * every tentative assignment.  The number of nodes visited is capped; a search
 * that reaches the cap reports {@link Feasibility#INCONCLUSIVE}.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class FeasibilityChecker {
  private static final Logger logger = Logger.getLogger(FeasibilityChecker.class.getName());

  /** The node ceiling used when none is given. */
  public static final long DEFAULT_NODE_CEILING = 200000;

  private final Puzzle puzzle;
  private final Propagator propagator;
  private final long nodeCeiling;

  public FeasibilityChecker(Puzzle puzzle) {
    this(puzzle, DEFAULT_NODE_CEILING);
  }

  public FeasibilityChecker(Puzzle puzzle, long nodeCeiling) {
    checkArgument(nodeCeiling > 0, "Node ceiling must be positive: %s", nodeCeiling);
    this.puzzle = checkNotNull(puzzle);
    this.propagator = new Propagator(puzzle);
    this.nodeCeiling = nodeCeiling;
  }

  public Puzzle getPuzzle() {
    return puzzle;
  }

  public long getNodeCeiling() {
    return nodeCeiling;
  }

  /**
   * A summary of a search.
   */
  @Immutable
  public static final class Result {
    public final Feasibility feasibility;
    /** The number of search nodes visited. */
    public final long nodes;
    /** How long the search took. */
    public final long elapsedMicros;
    /**
     * For an infeasible result, the constraints that cut off branches of the
     * search, in definition order.  Empty otherwise.
     */
    public final ImmutableSet<Constraint> implicated;

    Result(Feasibility feasibility, long nodes, long elapsedMicros,
        ImmutableSet<Constraint> implicated) {
      this.feasibility = feasibility;
      this.nodes = nodes;
      this.elapsedMicros = elapsedMicros;
      this.implicated = implicated;
    }

    public ImmutableSet<String> getImplicatedIds() {
      ImmutableSet.Builder<String> ids = ImmutableSet.builder();
      for (Constraint c : implicated)
        ids.add(c.id);
      return ids.build();
    }

    @Override public String toString() {
      return feasibility + " after " + nodes + " nodes in " + elapsedMicros + "us";
    }
  }

  /**
   * Searches for a completion of the given domains.
   */
  public Result check(Domains domains) {
    checkArgument(domains.size() == puzzle.size());
    Stopwatch stopwatch = Stopwatch.createStarted();
    Search search = new Search();
    Feasibility feasibility;
    try {
      feasibility = search.run(domains) ? Feasibility.FEASIBLE : Feasibility.INFEASIBLE;
    } catch (SearchCeilingExceeded e) {
      feasibility = Feasibility.INCONCLUSIVE;
    }
    Result result = new Result(
        feasibility, search.nodes, stopwatch.elapsed(TimeUnit.MICROSECONDS),
        feasibility == Feasibility.INFEASIBLE
            ? ImmutableSet.copyOf(search.implicated) : ImmutableSet.<Constraint>of());
    if (logger.isLoggable(Level.FINE))
      logger.fine("Feasibility search: " + result);
    return result;
  }

  /** Thrown inside a search when it visits too many nodes. */
  private static class SearchCeilingExceeded extends RuntimeException {
    private static final long serialVersionUID = 1L;
  }

  private static final Comparator<Constraint> DEFINITION_ORDER = new Comparator<Constraint>() {
    @Override public int compare(Constraint a, Constraint b) {
      return a.index - b.index;
    }
  };

  /**
   * The state of a single search.
   */
  private final class Search {
    private final ArrayDeque<WorkItem> worklist = new ArrayDeque<WorkItem>();
    private final SortedSet<Constraint> implicated = Sets.newTreeSet(DEFINITION_ORDER);
    private long nodes;

    boolean run(Domains start) {
      if (start.hasEmpty()) return false;
      Domains.Builder root = start.toBuilder();
      if (!consistent(propagator.propagateAll(root)))
        return false;
      Domains rootDomains = root.build();
      if (!pushNextItems(rootDomains))
        return isSolution(rootDomains);

      while (!worklist.isEmpty()) {
        if (++nodes > nodeCeiling)
          throw new SearchCeilingExceeded();
        WorkItem item = worklist.removeFirst();
        Domains.Builder builder = item.domains.toBuilder();
        if (!consistent(propagator.assign(builder, item.variable, item.value)))
          continue;
        Domains domains = builder.build();
        if (!pushNextItems(domains) && isSolution(domains))
          return true;
      }
      return false;
    }

    private boolean consistent(@Nullable Contradiction contradiction) {
      if (contradiction == null) return true;
      implicated.addAll(contradiction.getConstraints());
      return false;
    }

    /** Verifies a table whose every domain is a single value. */
    private boolean isSolution(Domains domains) {
      Assignment assignment = domains.toAssignment();
      for (Constraint c : puzzle.getConstraints()) {
        if (c.check(assignment) != Satisfaction.SATISFIED) {
          implicated.add(c);
          return false;
        }
      }
      return true;
    }

    /**
     * Pushes the alternatives for the most constrained open variable onto the
     * worklist, smallest value first.  Returns false if there are no open
     * variables left.
     */
    private boolean pushNextItems(Domains domains) {
      Variable chosen = null;
      int size = Integer.MAX_VALUE;
      for (Variable v : puzzle.getVariables()) {
        int candidates = domains.get(v).size();
        if (candidates > 1 && candidates < size) {
          chosen = v;
          size = candidates;
          if (size == 2) break;  // Can't do better
        }
      }
      if (chosen == null) return false;

      List<Integer> values = Lists.newArrayList(domains.get(chosen));
      Collections.reverse(values);
      for (int value : values)
        worklist.addFirst(new WorkItem(domains, chosen, value));
      return true;
    }
  }

  @Immutable
  private static final class WorkItem {
    final Domains domains;
    final Variable variable;
    final int value;

    WorkItem(Domains domains, Variable variable, int value) {
      this.domains = domains;
      this.variable = variable;
      this.value = value;
    }
  }
}
