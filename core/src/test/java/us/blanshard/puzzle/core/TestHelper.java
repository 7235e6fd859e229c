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

/**
 * Terse factories for tests.
 */
public class TestHelper {
  public static ValueSet vs(int... values) { return ValueSet.of(values); }
  public static Puzzle.Builder pb() { return Puzzle.builder(); }

  /** Builds a puzzle that is known to be well formed. */
  public static Puzzle p(Puzzle.Builder builder) {
    try {
      return builder.build();
    } catch (MalformedPuzzleException e) {
      throw new AssertionError(e);
    }
  }

  /** Four variables with domain {1, 2} that must all differ. */
  public static Puzzle quad() {
    return p(pb().variable("x1", 1, 2).variable("x2", 1, 2).variable("x3", 1, 2)
        .variable("x4", 1, 2).allDifferent("row", "x1", "x2", "x3", "x4"));
  }

  /** Two variables with the given domain that must differ. */
  public static Puzzle pair(int... domain) {
    return p(pb().variable("a", domain).variable("b", domain).allDifferent("row", "a", "b"));
  }

  /**
   * Three pairwise-different variables with two values to share, plus a free
   * variable.  Propagation sees nothing wrong, but there is no solution.
   */
  public static Puzzle triangle() {
    return p(pb().variable("a", 1, 2).variable("b", 1, 2).variable("c", 1, 2)
        .variable("d", 1, 2, 3)
        .allDifferent("ab", "a", "b").allDifferent("bc", "b", "c")
        .allDifferent("ac", "a", "c"));
  }

  /** One variable, domain {5}, no constraints. */
  public static Puzzle single() {
    return p(pb().variable("x", 5));
  }

  public static Variable v(Puzzle puzzle, String id) {
    Variable variable = puzzle.getVariable(id);
    if (variable == null) throw new IllegalArgumentException(id);
    return variable;
  }
}
