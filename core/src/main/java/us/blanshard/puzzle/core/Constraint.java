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

import java.util.Locale;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * A rule over a fixed set of a puzzle's variables, its scope.  The kinds of
 * rule are a closed set: each {@link Type} has exactly one subclass in this
 * package, and nothing outside the package can add more.
 *
 * <p> Every constraint can judge an assignment and can narrow candidate
 * domains; the engine needs nothing else from it.
 *
 * @author Luke Blanshard
 */
@Immutable
public abstract class Constraint {

  /**
   * All the kinds of rule we recognize.
   */
  public enum Type {
    /** No two variables in scope share a value: rows, columns, regions. */
    ALL_DIFFERENT,
    /** The scope's values add up to a fixed total: cages, runs. */
    SUM,
    /** The first variable's value is below the second's: inequality signs. */
    LESS_THAN,
    /** The two variables' values are a fixed distance apart: adjacency marks. */
    DIFFERENCE,
    /** The single variable has a fixed value: a clue printed in the cell. */
    CLUE;

    /** The name used for this type in puzzle definitions. */
    public String kind() {
      return name().toLowerCase(Locale.US);
    }

    /** Returns the type with the given definition name, or null. */
    @Nullable public static Type fromKind(@Nullable String kind) {
      if (kind == null) return null;
      for (Type type : values())
        if (type.kind().equals(kind)) return type;
      return null;
    }
  }

  public final Type type;

  /** The loader's identifier for this constraint. */
  public final String id;

  /** This constraint's position within its puzzle. */
  public final int index;

  /** The variables this constraint restricts. */
  public final ImmutableList<Variable> scope;

  Constraint(Type type, String id, int index, ImmutableList<Variable> scope) {
    this.type = type;
    this.id = id;
    this.index = index;
    this.scope = scope;
  }

  /**
   * Judges the given assignment, which may leave some or all of this
   * constraint's scope unassigned.
   */
  public abstract Satisfaction check(Assignment assignment);

  /**
   * Removes candidates that this rule shows cannot take part in any solution.
   * Returns false if it finds a contradiction, normally because some
   * variable's domain has emptied.  Never enlarges a domain.
   */
  public abstract boolean propagate(Domains.Builder domains);

  /**
   * The numeric parameter of this rule: the total of a sum, the distance of a
   * difference, the value of a clue.  Null for rules without one.
   */
  @Nullable public Integer getParameter() {
    return null;
  }

  /** Tells whether the given variable is in this constraint's scope. */
  public boolean involves(Variable variable) {
    return scope.contains(variable);
  }

  @Override public String toString() {
    Integer parameter = getParameter();
    return id + ": " + type.kind() + (parameter == null ? "" : "(" + parameter + ")") + scope;
  }
}
