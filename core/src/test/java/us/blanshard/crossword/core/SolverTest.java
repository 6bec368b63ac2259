/*
Copyright 2014 Luke Blanshard

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
package us.blanshard.crossword.core;

import static java.util.Arrays.asList;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static us.blanshard.crossword.core.SamplePuzzles.SOLUTION0;
import static us.blanshard.crossword.core.SamplePuzzles.SQUARE;
import static us.blanshard.crossword.core.SamplePuzzles.SQUARE_WORDS;
import static us.blanshard.crossword.core.SamplePuzzles.STRUCTURE0;
import static us.blanshard.crossword.core.SamplePuzzles.WORDS0;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.TimeUnit;

@RunWith(Parameterized.class)
public class SolverTest {
  private static final Slot A = Slot.across(0, 0, 3);
  private static final Slot B = Slot.down(0, 1, 3);
  private static final Crossword CROSS = Crossword.of(A, B);

  private final Solver.Strategy strategy;

  @Parameters public static Collection<Object[]> getParams() {
    List<Object[]> params = Lists.newArrayList();
    for (Solver.Strategy strategy : Solver.Strategy.values())
      params.add(new Object[]{ strategy });
    return params;
  }

  public SolverTest(Solver.Strategy strategy) {
    this.strategy = strategy;
  }

  @Test public void uniqueSolution() {
    Solver.Result result = Solver.solve(STRUCTURE0, WORDS0, strategy);
    assertEquals(Solver.Status.SOLVED, result.status);
    assertEquals(true, result.isSolved());
    assertEquals(SOLUTION0, result.solution);
  }

  @Test public void searchRunsDry() {
    // Pruning leaves NINE as the only word for two slots.
    List<String> words = Lists.newArrayList(WORDS0);
    words.remove("FIVE");
    Solver.Result result = Solver.solve(STRUCTURE0, words, strategy);
    assertEquals(Solver.Status.UNSATISFIABLE, result.status);
    assertNull(result.solution);
    assertTrue(result.numSteps > 0);
  }

  @Test public void pruningFindsNoSolution() {
    Solver.Result result = Solver.solve(CROSS, asList("CAT", "TOM"), strategy);
    assertEquals(Solver.Status.UNSATISFIABLE, result.status);
    assertNull(result.solution);
    assertEquals(0, result.numSteps);
  }

  @Test public void noWordFits() {
    Crossword crossword = Crossword.of(Slot.across(0, 0, 6));
    Solver.Result result = Solver.solve(crossword, WORDS0, strategy);
    assertEquals(Solver.Status.UNSATISFIABLE, result.status);
    assertEquals(0, result.numSteps);
  }

  @Test public void crossingPair() {
    Solver.Result result = Solver.solve(CROSS, asList("CAT", "APE"), strategy);
    assertEquals(ImmutableMap.of(A, "CAT", B, "APE"), result.solution);
  }

  @Test public void singleSlot() {
    Crossword crossword = Crossword.of(A);
    Solver.Result result = Solver.solve(crossword, asList("DOG", "CAT"), strategy);
    assertEquals(ImmutableMap.of(A, "CAT"), result.solution);
  }

  @Test public void noSlots() {
    Solver.Result result = Solver.solve(Crossword.fromString("#_#\n"), WORDS0, strategy);
    assertEquals(Solver.Status.SOLVED, result.status);
    assertEquals(0, result.solution.size());
  }

  @Test public void solutionsAreSound() {
    Solver.Result result = Solver.solve(SQUARE, SQUARE_WORDS, strategy);
    assertEquals(Solver.Status.SOLVED, result.status);
    assertEquals(true, result.solution.isComplete(SQUARE));
    assertEquals(true, result.solution.isConsistent(SQUARE));
    for (Slot slot : SQUARE.slots())
      assertTrue(SQUARE_WORDS.contains(result.solution.get(slot)));
  }

  @Test public void deterministic() {
    Solver.Result first = Solver.solve(SQUARE, SQUARE_WORDS, strategy);
    Solver.Result second = Solver.solve(SQUARE, SQUARE_WORDS, strategy);
    assertEquals(first.solution, second.solution);
    assertEquals(first.numSteps, second.numSteps);
    assertEquals(first.numBacktracks, second.numBacktracks);
  }

  @Test public void timesOut() {
    Domains domains = Domains.of(STRUCTURE0, WORDS0);
    Solver.Result result = Solver.solve(STRUCTURE0, domains, strategy, 1, TimeUnit.NANOSECONDS);
    assertEquals(Solver.Status.TIMED_OUT, result.status);
    assertNull(result.solution);
  }

  @Test public void noTimeout() {
    Domains domains = Domains.of(STRUCTURE0, WORDS0);
    Solver.Result result = Solver.solve(STRUCTURE0, domains, strategy, 0, TimeUnit.SECONDS);
    assertEquals(SOLUTION0, result.solution);
  }

  @Test(expected = IllegalStateException.class)
  public void singleUse() {
    Solver solver = new Solver(STRUCTURE0, Domains.of(STRUCTURE0, WORDS0), strategy, 0);
    solver.result();
    solver.result();
  }
}
