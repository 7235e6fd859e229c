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

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.puzzle.core.PuzzleDefinition.ConstraintSpec;
import us.blanshard.puzzle.core.PuzzleDefinition.VariableSpec;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.google.common.primitives.Ints;

import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * An immutable puzzle instance: its variables, their starting domains, and the
 * constraints over them.  Safe to share among any number of sessions.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Puzzle {

  private final ImmutableList<Variable> variables;
  private final ImmutableMap<String, Variable> variablesById;
  private final ImmutableList<Constraint> constraints;
  private final ImmutableMap<String, Constraint> constraintsById;
  private final ImmutableListMultimap<Variable, Constraint> constraintsByVariable;
  private final Domains startingDomains;

  private Puzzle(ImmutableList<Variable> variables, ImmutableList<Constraint> constraints) {
    this.variables = variables;
    this.constraints = constraints;

    ImmutableMap.Builder<String, Variable> variablesById = ImmutableMap.builder();
    for (Variable v : variables)
      variablesById.put(v.id, v);
    this.variablesById = variablesById.build();

    ImmutableMap.Builder<String, Constraint> constraintsById = ImmutableMap.builder();
    ImmutableListMultimap.Builder<Variable, Constraint> byVariable = ImmutableListMultimap.builder();
    for (Constraint c : constraints) {
      constraintsById.put(c.id, c);
      for (Variable v : c.scope)
        byVariable.put(v, c);
    }
    this.constraintsById = constraintsById.build();
    this.constraintsByVariable = byVariable.build();
    this.startingDomains = Domains.starting(variables, variables.size());
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Checks the given definition and makes a puzzle out of it.
   *
   * @throws MalformedPuzzleException if a constraint names an unknown
   *     variable, a variable has an empty starting domain, or the definition
   *     is otherwise inconsistent
   */
  public static Puzzle load(PuzzleDefinition definition) throws MalformedPuzzleException {
    if (definition == null || definition.variables == null)
      throw new MalformedPuzzleException("No variables defined");

    List<VariableSpec> specs = Lists.newArrayList();
    Set<String> ids = Sets.newHashSet();
    for (VariableSpec spec : definition.variables) {
      if (spec == null || Strings.isNullOrEmpty(spec.id))
        throw new MalformedPuzzleException("Variable without an id");
      if (!ids.add(spec.id))
        throw new MalformedPuzzleException("Duplicate variable id " + spec.id);
      specs.add(spec);
    }
    Collections.sort(specs, new Comparator<VariableSpec>() {
      @Override public int compare(VariableSpec a, VariableSpec b) {
        return a.id.compareTo(b.id);
      }
    });

    ImmutableList.Builder<Variable> variables = ImmutableList.builder();
    Map<String, Variable> byId = Maps.newHashMap();
    for (VariableSpec spec : specs) {
      Variable v = new Variable(spec.id, byId.size(), toDomain(spec));
      variables.add(v);
      byId.put(v.id, v);
    }

    ImmutableList.Builder<Constraint> constraints = ImmutableList.builder();
    Set<String> constraintIds = Sets.newHashSet();
    if (definition.constraints != null) {
      for (ConstraintSpec spec : definition.constraints) {
        if (spec == null || Strings.isNullOrEmpty(spec.id))
          throw new MalformedPuzzleException("Constraint without an id");
        if (!constraintIds.add(spec.id))
          throw new MalformedPuzzleException("Duplicate constraint id " + spec.id);
        constraints.add(toConstraint(spec, constraintIds.size() - 1, byId));
      }
    }

    return new Puzzle(variables.build(), constraints.build());
  }

  private static ValueSet toDomain(VariableSpec spec) throws MalformedPuzzleException {
    if (spec.domain == null || spec.domain.isEmpty())
      throw new MalformedPuzzleException("Variable " + spec.id + " has an empty domain");
    long bits = 0;
    for (Integer value : spec.domain) {
      if (value == null || !ValueSet.isValidValue(value))
        throw new MalformedPuzzleException(
            "Variable " + spec.id + " has out-of-range value " + value);
      bits |= ValueSet.bit(value);
    }
    return ValueSet.ofBits(bits);
  }

  private static Constraint toConstraint(ConstraintSpec spec, int index, Map<String, Variable> byId)
      throws MalformedPuzzleException {
    Constraint.Type type = Constraint.Type.fromKind(spec.kind);
    if (type == null)
      throw new MalformedPuzzleException("Constraint " + spec.id + " has unknown kind " + spec.kind);
    if (spec.scope == null || spec.scope.isEmpty())
      throw new MalformedPuzzleException("Constraint " + spec.id + " has an empty scope");

    ImmutableList.Builder<Variable> builder = ImmutableList.builder();
    Set<Variable> seen = Sets.newHashSet();
    for (String variableId : spec.scope) {
      Variable v = variableId == null ? null : byId.get(variableId);
      if (v == null)
        throw new MalformedPuzzleException(
            "Constraint " + spec.id + " references unknown variable " + variableId);
      if (!seen.add(v))
        throw new MalformedPuzzleException(
            "Constraint " + spec.id + " names variable " + variableId + " twice");
      builder.add(v);
    }
    ImmutableList<Variable> scope = builder.build();

    switch (type) {
      case ALL_DIFFERENT:
        return new AllDifferent(spec.id, index, scope);

      case SUM:
        checkParameter(spec, 0, Integer.MAX_VALUE);
        return new Sum(spec.id, index, scope, spec.value);

      case LESS_THAN:
        checkArity(spec, 2);
        return new LessThan(spec.id, index, scope);

      case DIFFERENCE:
        checkArity(spec, 2);
        checkParameter(spec, 0, ValueSet.MAX_VALUE);
        return new Difference(spec.id, index, scope, spec.value);

      case CLUE:
        checkArity(spec, 1);
        checkParameter(spec, 0, ValueSet.MAX_VALUE);
        return new Clue(spec.id, index, scope, spec.value);

      default:
        throw new AssertionError(type);
    }
  }

  private static void checkArity(ConstraintSpec spec, int arity) throws MalformedPuzzleException {
    if (spec.scope.size() != arity)
      throw new MalformedPuzzleException(
          "Constraint " + spec.id + " needs " + arity + " variables, has " + spec.scope.size());
  }

  private static void checkParameter(ConstraintSpec spec, int min, int max)
      throws MalformedPuzzleException {
    if (spec.value == null || spec.value < min || spec.value > max)
      throw new MalformedPuzzleException(
          "Constraint " + spec.id + " has bad " + spec.kind + " value " + spec.value);
  }

  /** The number of variables. */
  public int size() {
    return variables.size();
  }

  /** All variables, in identifier order. */
  public ImmutableList<Variable> getVariables() {
    return variables;
  }

  public Variable getVariable(int index) {
    checkElementIndex(index, variables.size());
    return variables.get(index);
  }

  /** Returns the variable with the given identifier, or null. */
  @Nullable public Variable getVariable(String id) {
    return variablesById.get(checkNotNull(id));
  }

  /** All constraints, in definition order. */
  public ImmutableList<Constraint> getConstraints() {
    return constraints;
  }

  /** Returns the constraint with the given identifier, or null. */
  @Nullable public Constraint getConstraint(String id) {
    return constraintsById.get(checkNotNull(id));
  }

  /** Returns the constraints whose scope includes the given variable, in definition order. */
  public ImmutableList<Constraint> getConstraints(Variable variable) {
    return constraintsByVariable.get(variable);
  }

  /** The domains every session starts from. */
  public Domains getStartingDomains() {
    return startingDomains;
  }

  /** Reverses {@link #load}. */
  public PuzzleDefinition toDefinition() {
    PuzzleDefinition definition = new PuzzleDefinition();
    for (Variable v : variables)
      definition.variables.add(new VariableSpec(v.id, Lists.newArrayList(v.domain)));
    for (Constraint c : constraints) {
      List<String> scope = Lists.newArrayList();
      for (Variable v : c.scope)
        scope.add(v.id);
      definition.constraints.add(new ConstraintSpec(c.id, c.type.kind(), scope, c.getParameter()));
    }
    return definition;
  }

  /**
   * Assembles a puzzle definition piece by piece, then loads it.
   */
  @NotThreadSafe
  public static final class Builder {
    private final PuzzleDefinition definition = new PuzzleDefinition();

    private Builder() {}

    public Builder variable(String id, int... domain) {
      definition.variables.add(new VariableSpec(id, Ints.asList(domain)));
      return this;
    }

    public Builder variable(String id, ValueSet domain) {
      definition.variables.add(new VariableSpec(id, Lists.newArrayList(domain)));
      return this;
    }

    public Builder allDifferent(String id, String... scope) {
      return constraint(id, Constraint.Type.ALL_DIFFERENT, null, scope);
    }

    public Builder sum(String id, int total, String... scope) {
      return constraint(id, Constraint.Type.SUM, total, scope);
    }

    public Builder lessThan(String id, String lesser, String greater) {
      return constraint(id, Constraint.Type.LESS_THAN, null, lesser, greater);
    }

    public Builder difference(String id, int distance, String first, String second) {
      return constraint(id, Constraint.Type.DIFFERENCE, distance, first, second);
    }

    public Builder clue(String id, String variable, int value) {
      return constraint(id, Constraint.Type.CLUE, value, variable);
    }

    private Builder constraint(String id, Constraint.Type type, Integer value, String... scope) {
      definition.constraints.add(
          new ConstraintSpec(id, type.kind(), Lists.newArrayList(Arrays.asList(scope)), value));
      return this;
    }

    public PuzzleDefinition toDefinition() {
      return definition;
    }

    public Puzzle build() throws MalformedPuzzleException {
      return load(definition);
    }
  }
}
