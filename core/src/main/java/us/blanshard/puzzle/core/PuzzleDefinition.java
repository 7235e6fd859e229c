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

import com.google.common.collect.Lists;

import java.util.List;

/**
 * The raw material a loader hands over to build a {@link Puzzle}: variables
 * with their starting domains, and constraints with their scopes.  Nothing is
 * checked until {@link Puzzle#load}.  The field names are also the puzzle's
 * json form, see {@link PuzzleJson}.
 */
public class PuzzleDefinition {
  public List<VariableSpec> variables = Lists.newArrayList();
  public List<ConstraintSpec> constraints = Lists.newArrayList();

  public static class VariableSpec {
    /** The variable's identifier, unique within the puzzle. */
    public String id;
    /** The values legal at the start, each in [0, 63]. */
    public List<Integer> domain;

    public VariableSpec() {}

    public VariableSpec(String id, List<Integer> domain) {
      this.id = id;
      this.domain = domain;
    }
  }

  public static class ConstraintSpec {
    /** The constraint's identifier, unique within the puzzle. */
    public String id;
    /** One of the {@link Constraint.Type#kind} names. */
    public String kind;
    /** The identifiers of the variables in scope, in order. */
    public List<String> scope;
    /** The rule's parameter; see {@link Constraint#getParameter}. */
    public Integer value;

    public ConstraintSpec() {}

    public ConstraintSpec(String id, String kind, List<String> scope, Integer value) {
      this.id = id;
      this.kind = kind;
      this.scope = scope;
      this.value = value;
    }
  }
}
