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
import static com.google.common.base.Preconditions.checkState;

import us.blanshard.puzzle.core.Assignment;
import us.blanshard.puzzle.core.Constraint;
import us.blanshard.puzzle.core.Domains;
import us.blanshard.puzzle.core.Puzzle;
import us.blanshard.puzzle.core.Satisfaction;
import us.blanshard.puzzle.core.ValueSet;
import us.blanshard.puzzle.core.Variable;
import us.blanshard.puzzle.engine.Contradiction;
import us.blanshard.puzzle.engine.FeasibilityChecker;
import us.blanshard.puzzle.engine.Propagator;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.MoreExecutors;

import java.io.Closeable;
import java.util.ArrayDeque;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * One player's attempt at a puzzle.  Keeps the values the player has
 * committed, and after every edit works out whether those values break a
 * rule, whether the puzzle can still be finished from here, or whether it is
 * done.
 *
 * <p> Sessions share their {@link Puzzle} but nothing else.  Every public
 * method is synchronized, so a feasibility result coming back from the
 * background can be applied while the player keeps editing.
 *
 * <p> Like a game's move history, the edit history and the per-variable undo
 * stacks are unbounded: they grow by one entry per edit for the life of the
 * session.
 *
 * @author Luke Blanshard
 */
@ThreadSafe
public final class ValidationSession implements Closeable {
  private static final Logger logger = Logger.getLogger(ValidationSession.class.getName());

  /**
   * Settings for a session.
   */
  @Immutable
  public static final class Options {
    /** The most search nodes a feasibility check may visit. */
    public final long nodeCeiling;
    /**
     * When true, feasibility checks run on a worker thread and edits return
     * right away with the caveat set.
     */
    public final boolean background;

    public static final Options DEFAULT =
        new Options(FeasibilityChecker.DEFAULT_NODE_CEILING, false);

    public Options(long nodeCeiling, boolean background) {
      checkArgument(nodeCeiling > 0, "Node ceiling must be positive: %s", nodeCeiling);
      this.nodeCeiling = nodeCeiling;
      this.background = background;
    }

    public Options withNodeCeiling(long nodeCeiling) {
      return new Options(nodeCeiling, background);
    }

    public Options withBackground(boolean background) {
      return new Options(nodeCeiling, background);
    }
  }

  /**
   * A callback interface for parties interested in a session's status.
   */
  public interface Listener {
    /**
     * Called when the session's status changes, either because of an edit or
     * because a background feasibility check finished.
     */
    void statusChanged(ValidationSession session, SessionStatus status);
  }

  private final Puzzle puzzle;
  private final Options options;
  private final Propagator propagator;
  private final FeasibilityChecker checker;
  @Nullable private final FeasibilityWorker worker;
  private final FeasibilityWorker.Callback workerCallback;

  @GuardedBy("this") private final List<Listener> listeners = new LinkedList<Listener>();
  @GuardedBy("this") private final List<ArrayDeque<Integer>> undoStacks;
  @GuardedBy("this") private final List<Edit> history = Lists.newArrayList();
  @GuardedBy("this") private Assignment assignment;
  @GuardedBy("this") private Domains domains;
  @GuardedBy("this") @Nullable private Contradiction contradiction;
  @GuardedBy("this") private SessionStatus status;
  @GuardedBy("this") private long generation;
  @GuardedBy("this") private boolean closed;

  /** Opens a session with default options. */
  public static ValidationSession open(Puzzle puzzle) {
    return open(puzzle, Options.DEFAULT);
  }

  public static ValidationSession open(Puzzle puzzle, Options options) {
    return open(puzzle, options, MoreExecutors.directExecutor());
  }

  /**
   * Opens a session whose background feasibility results, if any, are
   * applied on the given executor.
   */
  public static ValidationSession open(Puzzle puzzle, Options options, Executor callbackExecutor) {
    ValidationSession session = new ValidationSession(puzzle, options, callbackExecutor);
    logger.info("Opened session on a puzzle of " + puzzle.size() + " variables and "
        + puzzle.getConstraints().size() + " constraints");
    return session;
  }

  /**
   * Opens a session and replays the given edit history into it, then
   * evaluates the result once.
   *
   * @throws IllegalArgumentException if the history names a variable the
   *     puzzle doesn't have
   */
  public static ValidationSession restore(Puzzle puzzle, List<Edit> history, Options options) {
    ValidationSession session = open(puzzle, options);
    try {
      synchronized (session) {
        for (Edit edit : history) {
          Variable variable = session.variable(edit.variableId);
          edit.apply(session, variable);
          session.history.add(edit);
        }
        session.evaluate();
      }
    } catch (RuntimeException e) {
      session.close();
      throw e;
    }
    logger.info("Restored " + history.size() + " edits");
    return session;
  }

  private ValidationSession(Puzzle puzzle, Options options, Executor callbackExecutor) {
    this.puzzle = checkNotNull(puzzle);
    this.options = checkNotNull(options);
    this.propagator = new Propagator(puzzle);
    this.checker = new FeasibilityChecker(puzzle, options.nodeCeiling);
    this.worker = options.background ? new FeasibilityWorker(checker, callbackExecutor) : null;
    this.workerCallback = new FeasibilityWorker.Callback() {
      @Override public void onResult(long generation, FeasibilityChecker.Result result) {
        backgroundResult(generation, result);
      }
      @Override public void onFailure(long generation, Throwable t) {
        backgroundFailure(generation, t);
      }
    };
    this.undoStacks = Lists.newArrayListWithCapacity(puzzle.size());
    for (int i = 0; i < puzzle.size(); ++i)
      undoStacks.add(new ArrayDeque<Integer>());
    this.assignment = Assignment.empty(puzzle);
    this.domains = puzzle.getStartingDomains();
    this.status = SessionStatus.inProgress(0, false);
  }

  public Puzzle getPuzzle() {
    return puzzle;
  }

  public Options getOptions() {
    return options;
  }

  public synchronized SessionStatus getStatus() {
    return status;
  }

  public synchronized long getGeneration() {
    return generation;
  }

  /** Returns the committed values. */
  public synchronized Assignment getAssignment() {
    return assignment;
  }

  /** Returns the current candidate domains, as of the last evaluation. */
  public synchronized Domains getDomains() {
    return domains;
  }

  /** Returns the edits made so far, oldest first. */
  public synchronized ImmutableList<Edit> getHistory() {
    return ImmutableList.copyOf(history);
  }

  /** Returns the value committed to the given variable, or null. */
  @Nullable public synchronized Integer getValue(String variableId) {
    Variable variable = variable(variableId);
    return assignment.isAssigned(variable) ? assignment.get(variable) : null;
  }

  /** Returns the given variable's current candidate values. */
  public synchronized ValueSet getCandidates(String variableId) {
    return domains.get(variable(variableId));
  }

  public synchronized void addListener(Listener listener) {
    listeners.add(checkNotNull(listener));
  }

  public synchronized void removeListener(Listener listener) {
    listeners.remove(listener);
  }

  /**
   * Commits a value to the given variable, or clears it if the value is null.
   *
   * @throws IllegalArgumentException if the variable is unknown or the value
   *     is outside the representable range
   */
  public synchronized SessionStatus edit(String variableId, @Nullable Integer value) {
    return perform(value == null ? new Edit.Clear(variableId) : new Edit.Set(variableId, value));
  }

  /** Removes the value committed to the given variable. */
  public synchronized SessionStatus clear(String variableId) {
    return perform(new Edit.Clear(variableId));
  }

  /**
   * Puts the given variable back the way it was before its most recent edit.
   * Always legal: undoing a variable with no edits left clears it.
   */
  public synchronized SessionStatus undo(String variableId) {
    return perform(new Edit.Undo(variableId));
  }

  /** Evaluates the committed values from scratch. */
  public synchronized SessionStatus evaluate() {
    checkState(!closed, "Session is closed");
    ++generation;
    reevaluate(null);
    return status;
  }

  @Override public synchronized void close() {
    if (closed) return;
    closed = true;
    if (worker != null) worker.close();
    logger.info("Closed session after " + history.size() + " edits");
  }

  @GuardedBy("this")
  private SessionStatus perform(Edit edit) {
    checkState(!closed, "Session is closed");
    Variable variable = variable(edit.variableId);
    boolean extending = edit.extendsAssignment(assignment.getOrUnset(variable));
    edit.apply(this, variable);
    history.add(edit);
    ++generation;
    if (logger.isLoggable(Level.FINE))
      logger.fine("Edit " + edit + " at generation " + generation);
    reevaluate(extending ? variable : null);
    return status;
  }

  private Variable variable(String variableId) {
    Variable variable = puzzle.getVariable(checkNotNull(variableId));
    checkArgument(variable != null, "Unknown variable: %s", variableId);
    return variable;
  }

  @GuardedBy("this")
  void commitValue(Variable variable, int value) {
    undoStacks.get(variable.index).push(assignment.getOrUnset(variable));
    assignment = assignment.with(variable, value);
  }

  @GuardedBy("this")
  void clearValue(Variable variable) {
    undoStacks.get(variable.index).push(assignment.getOrUnset(variable));
    assignment = assignment.without(variable);
  }

  @GuardedBy("this")
  void undoValue(Variable variable) {
    ArrayDeque<Integer> stack = undoStacks.get(variable.index);
    int prior = stack.isEmpty() ? Assignment.UNSET : stack.pop();
    assignment = prior == Assignment.UNSET
        ? assignment.without(variable) : assignment.with(variable, prior);
  }

  /**
   * Brings the domains and status up to date with the committed values.  When
   * {@code extended} is non-null, the last edit only added that variable's
   * commitment, and the current domains can be narrowed in place.
   */
  @GuardedBy("this")
  private void reevaluate(@Nullable Variable extended) {
    SessionStatus prior = status;

    Domains.Builder builder;
    Contradiction found;
    if (extended != null && contradiction == null
        && domains.get(extended).contains(assignment.get(extended))) {
      builder = domains.toBuilder();
      found = propagator.assign(builder, extended, assignment.get(extended));
    } else {
      builder = puzzle.getStartingDomains().toBuilder();
      found = propagator.assignAll(builder, assignment);
    }
    domains = builder.build();
    contradiction = found;

    if (found != null) {
      status = SessionStatus.violated(generation, found.getVariableIds(),
          found.getConstraintIds());
    } else if (assignment.isComplete()) {
      status = checkComplete();
    } else if (extended != null && prior.state == SessionStatus.State.INFEASIBLE) {
      status = prior.withGeneration(generation);
    } else if (worker != null) {
      worker.submit(domains, generation, workerCallback);
      status = SessionStatus.inProgress(generation, true);
    } else {
      status = fromResult(generation, checker.check(domains));
    }

    if (logger.isLoggable(Level.FINE))
      logger.fine("Status: " + status);
    if (!status.sameVerdict(prior))
      notifyListeners();
  }

  @GuardedBy("this")
  private SessionStatus checkComplete() {
    ImmutableSet.Builder<String> variables = ImmutableSet.builder();
    ImmutableSet.Builder<String> constraints = ImmutableSet.builder();
    boolean violated = false;
    for (Constraint c : puzzle.getConstraints()) {
      if (c.check(assignment) == Satisfaction.VIOLATED) {
        violated = true;
        constraints.add(c.id);
        for (Variable v : c.scope)
          variables.add(v.id);
      }
    }
    return violated
        ? SessionStatus.violated(generation, variables.build(), constraints.build())
        : SessionStatus.solved(generation);
  }

  private static SessionStatus fromResult(long generation, FeasibilityChecker.Result result) {
    switch (result.feasibility) {
      case FEASIBLE:
        return SessionStatus.inProgress(generation, false);
      case INFEASIBLE:
        return SessionStatus.infeasible(generation, result.getImplicatedIds());
      case INCONCLUSIVE:
        return SessionStatus.inProgress(generation, true);
      default:
        throw new AssertionError(result.feasibility);
    }
  }

  /** Applies a background result, unless the session has moved on since. */
  synchronized void backgroundResult(long generation, FeasibilityChecker.Result result) {
    if (closed || generation != this.generation) {
      logger.fine("Discarding stale result for generation " + generation);
      return;
    }
    SessionStatus prior = status;
    status = fromResult(generation, result);
    if (logger.isLoggable(Level.FINE))
      logger.fine("Background status: " + status);
    if (!status.sameVerdict(prior))
      notifyListeners();
  }

  synchronized void backgroundFailure(long generation, Throwable t) {
    logger.log(Level.WARNING, "Feasibility search failed for generation " + generation, t);
  }

  @GuardedBy("this")
  private void notifyListeners() {
    for (Listener listener : Lists.newArrayList(listeners))
      listener.statusChanged(this, status);
  }
}
