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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static us.blanshard.puzzle.core.TestHelper.p;
import static us.blanshard.puzzle.core.TestHelper.pb;

import us.blanshard.puzzle.core.Assignment;
import us.blanshard.puzzle.core.Constraint;
import us.blanshard.puzzle.core.Puzzle;
import us.blanshard.puzzle.core.Satisfaction;
import us.blanshard.puzzle.core.Variable;

import com.google.common.collect.Lists;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Compares the checker's verdicts with exhaustive enumeration over small
 * random puzzles.
 */
@RunWith(Parameterized.class)
public class FeasibilityCheckerTest {

  @Parameters(name = "seed {0}")
  public static Collection<Object[]> seeds() {
    List<Object[]> seeds = Lists.newArrayList();
    for (long seed = 1; seed <= 60; ++seed)
      seeds.add(new Object[] {seed});
    return seeds;
  }

  private final Puzzle puzzle;

  public FeasibilityCheckerTest(long seed) {
    this.puzzle = randomPuzzle(new Random(seed));
  }

  public static Puzzle randomPuzzle(Random random) {
    Puzzle.Builder builder = pb();
    int size = 3 + random.nextInt(3);
    List<String> ids = Lists.newArrayList();
    for (int i = 0; i < size; ++i) {
      String id = "v" + i;
      ids.add(id);
      List<Integer> domain = Lists.newArrayList();
      for (int value = 0; value < 5; ++value)
        if (random.nextInt(3) > 0) domain.add(value);
      if (domain.isEmpty()) domain.add(random.nextInt(5));
      int[] values = new int[domain.size()];
      for (int j = 0; j < values.length; ++j)
        values[j] = domain.get(j);
      builder.variable(id, values);
    }
    int count = 1 + random.nextInt(4);
    for (int i = 0; i < count; ++i) {
      Collections.shuffle(ids, random);
      String cid = "c" + i;
      switch (random.nextInt(5)) {
        case 0:
          builder.allDifferent(cid, ids.subList(0, 2 + random.nextInt(2)).toArray(new String[0]));
          break;
        case 1:
          builder.sum(cid, random.nextInt(9), ids.get(0), ids.get(1));
          break;
        case 2:
          builder.lessThan(cid, ids.get(0), ids.get(1));
          break;
        case 3:
          builder.difference(cid, random.nextInt(4), ids.get(0), ids.get(1));
          break;
        default:
          builder.clue(cid, ids.get(0), random.nextInt(5));
          break;
      }
    }
    return p(builder);
  }

  /** Tells whether any full assignment satisfies every constraint. */
  public static boolean bruteForce(Puzzle puzzle) {
    return bruteForce(puzzle, Assignment.empty(puzzle));
  }

  /**
   * Tells whether the given partial assignment, with every committed value
   * inside its variable's domain, extends to one that satisfies every
   * constraint.
   */
  public static boolean bruteForce(Puzzle puzzle, Assignment partial) {
    for (Variable v : puzzle.getVariables())
      if (partial.isAssigned(v) && !v.domain.contains(partial.get(v))) return false;
    return bruteForce(puzzle, partial, 0);
  }

  private static boolean bruteForce(Puzzle puzzle, Assignment assignment, int index) {
    if (index == puzzle.size()) {
      for (Constraint c : puzzle.getConstraints())
        if (c.check(assignment) != Satisfaction.SATISFIED) return false;
      return true;
    }
    Variable v = puzzle.getVariable(index);
    if (assignment.isAssigned(v))
      return bruteForce(puzzle, assignment, index + 1);
    for (int value : v.domain)
      if (bruteForce(puzzle, assignment.with(v, value), index + 1)) return true;
    return false;
  }

  @Test public void agreesWithEnumeration() {
    FeasibilityChecker.Result result = new FeasibilityChecker(puzzle).check(
        puzzle.getStartingDomains());
    boolean solvable = bruteForce(puzzle);
    assertEquals(solvable ? Feasibility.FEASIBLE : Feasibility.INFEASIBLE, result.feasibility);
    if (solvable)
      assertThat(result.implicated).isEmpty();
    else
      assertThat(result.implicated).isNotEmpty();
    assertTrue(result.elapsedMicros >= 0);
  }
}
