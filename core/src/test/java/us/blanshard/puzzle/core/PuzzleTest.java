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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;
import static us.blanshard.puzzle.core.TestHelper.p;
import static us.blanshard.puzzle.core.TestHelper.pb;
import static us.blanshard.puzzle.core.TestHelper.v;
import static us.blanshard.puzzle.core.TestHelper.vs;

import us.blanshard.puzzle.core.PuzzleDefinition.ConstraintSpec;
import us.blanshard.puzzle.core.PuzzleDefinition.VariableSpec;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.junit.Test;

public class PuzzleTest {

  private static void assertMalformed(Puzzle.Builder builder, String fragment) {
    try {
      builder.build();
      fail("Expected a malformed puzzle");
    } catch (MalformedPuzzleException e) {
      assertThat(e.getMessage()).contains(fragment);
    }
  }

  @Test public void variablesSortedById() {
    Puzzle puzzle = p(pb().variable("c", 1).variable("a", 2, 3).variable("b", 4)
        .lessThan("lt", "c", "a"));
    assertEquals(3, puzzle.size());
    assertEquals("a", puzzle.getVariable(0).id);
    assertEquals("b", puzzle.getVariable(1).id);
    assertEquals("c", puzzle.getVariable(2).id);
    assertEquals(2, v(puzzle, "c").index);
    assertEquals(vs(2, 3), v(puzzle, "a").domain);
    assertNull(puzzle.getVariable("zz"));
  }

  @Test public void constraintsIndexed() {
    Puzzle puzzle = p(pb().variable("a", 1, 2).variable("b", 1, 2).variable("c", 1, 2, 3)
        .allDifferent("row", "a", "b", "c")
        .sum("cage", 3, "a", "b")
        .clue("given", "c", 3));
    Constraint cage = puzzle.getConstraint("cage");
    assertEquals(Constraint.Type.SUM, cage.type);
    assertEquals(1, cage.index);
    assertEquals(Integer.valueOf(3), cage.getParameter());
    assertEquals(3, ((Sum) cage).getTotal());
    assertThat(puzzle.getConstraints(v(puzzle, "c")))
        .containsExactly(puzzle.getConstraint("row"), puzzle.getConstraint("given")).inOrder();
    assertThat(puzzle.getConstraints(v(puzzle, "a")))
        .containsExactly(puzzle.getConstraint("row"), cage).inOrder();
    assertNull(puzzle.getConstraint("nope"));
  }

  @Test public void startingDomains() {
    Puzzle puzzle = p(pb().variable("a", 1, 2).variable("b", 7));
    Domains domains = puzzle.getStartingDomains();
    assertEquals(vs(1, 2), domains.get(v(puzzle, "a")));
    assertEquals(vs(7), domains.get(v(puzzle, "b")));
  }

  @Test public void definitionRoundTrip() throws Exception {
    Puzzle puzzle = p(pb().variable("a", 1, 2).variable("b", 1, 2)
        .difference("adj", 1, "a", "b").lessThan("lt", "a", "b"));
    Puzzle again = Puzzle.load(puzzle.toDefinition());
    assertEquals(puzzle.getVariables().size(), again.getVariables().size());
    assertEquals(Constraint.Type.DIFFERENCE, again.getConstraint("adj").type);
    assertEquals(Integer.valueOf(1), again.getConstraint("adj").getParameter());
    assertEquals(v(puzzle, "b").domain, v(again, "b").domain);
  }

  @Test public void unknownVariable() {
    assertMalformed(pb().variable("a", 1).allDifferent("row", "a", "q"),
        "references unknown variable q");
  }

  @Test public void emptyDomain() {
    assertMalformed(pb().variable("a"), "empty domain");
  }

  @Test public void outOfRangeDomain() {
    PuzzleDefinition definition = new PuzzleDefinition();
    definition.variables.add(new VariableSpec("a", Lists.newArrayList(1, 64)));
    try {
      Puzzle.load(definition);
      fail();
    } catch (MalformedPuzzleException e) {
      assertThat(e.getMessage()).contains("out-of-range");
    }
  }

  @Test public void duplicates() {
    assertMalformed(pb().variable("a", 1).variable("a", 2), "Duplicate variable");
    assertMalformed(pb().variable("a", 1).clue("c", "a", 1).clue("c", "a", 1),
        "Duplicate constraint");
    assertMalformed(pb().variable("a", 1, 2).allDifferent("row", "a", "a"), "twice");
  }

  @Test public void unknownKind() throws Exception {
    PuzzleDefinition definition = pb().variable("a", 1).toDefinition();
    definition.constraints.add(new ConstraintSpec("k", "knight", ImmutableList.of("a"), null));
    try {
      Puzzle.load(definition);
      fail();
    } catch (MalformedPuzzleException e) {
      assertThat(e.getMessage()).contains("unknown kind");
    }
  }

  @Test public void arityAndParameters() {
    assertMalformed(pb().variable("a", 1).variable("b", 2).variable("c", 3)
        .lessThan("lt", "a", "b").allDifferent("x").clue("c1", "c", 3), "empty scope");
    assertMalformed(pb().variable("a", 1).sum("s", -1, "a"), "bad sum value");
    assertMalformed(pb().variable("a", 1).variable("b", 1).difference("d", 64, "a", "b"),
        "bad difference value");
    assertMalformed(pb().variable("a", 1).clue("c", "a", 99), "bad clue value");
  }

  @Test public void noDefinition() {
    try {
      Puzzle.load(null);
      fail();
    } catch (MalformedPuzzleException e) {
      assertThat(e.getMessage()).contains("No variables");
    }
  }
}
