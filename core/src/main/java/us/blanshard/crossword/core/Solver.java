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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static java.util.concurrent.TimeUnit.MICROSECONDS;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

import com.google.common.base.Functions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Ordering;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A depth-first, backtracking crossword filler.  Prunes the domains with node
 * and arc consistency first, then searches, choosing the slot with the fewest
 * remaining words next and trying its least constraining words first.
 *
 * <p> A solver is good for a single solve; the static {@code solve} methods
 * are the usual way in.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Solver {
  private static final Logger logger = Logger.getLogger(Solver.class.getName());

  /**
   * Solves the given crossword with the given words, returns a summary of the
   * result.
   */
  public static Result solve(Crossword crossword, Collection<String> words) {
    return solve(crossword, words, Strategy.DEFAULT);
  }

  /**
   * Solves the given crossword with the given words using the given strategy,
   * returns a summary of the result.
   */
  public static Result solve(Crossword crossword, Collection<String> words, Strategy strategy) {
    return solve(crossword, Domains.of(crossword, words), strategy, 0, MILLISECONDS);
  }

  /**
   * Solves the given crossword starting from the given domains, which are
   * pruned in place.  Gives up once the timeout passes; a timeout that isn't
   * positive means no limit.
   */
  public static Result solve(
      Crossword crossword, Domains domains, Strategy strategy, long timeout, TimeUnit unit) {
    return new Solver(crossword, domains, strategy, unit.toNanos(timeout)).result();
  }

  /** How a solve ended. */
  public enum Status {
    SOLVED,
    UNSATISFIABLE,  // Pruning emptied a domain, or the search ran dry.
    TIMED_OUT;
  }

  /**
   * This enumeration provides strategies for solving a crossword.  They differ
   * in how ties between equally constrained slots are broken, and in whether
   * arc consistency is maintained during the search.  Whatever's left tied
   * goes to the earliest slot, so every strategy is deterministic.
   */
  public enum Strategy {
    /** Fewest remaining words, nothing more. */
    SIMPLE(false, false),

    /** Fewest remaining words, then most unassigned neighbors. */
    DEGREE(true, false),

    /** Like DEGREE, and reruns AC-3 on a copy of the domains at every step. */
    PROPAGATING(true, true);

    public static final Strategy DEFAULT = DEGREE;

    final boolean breaksTiesByDegree;
    final boolean maintainsArcConsistency;

    private Strategy(boolean breaksTiesByDegree, boolean maintainsArcConsistency) {
      this.breaksTiesByDegree = breaksTiesByDegree;
      this.maintainsArcConsistency = maintainsArcConsistency;
    }
  }

  /**
   * A summary of a solver's work.
   */
  @Immutable
  public static final class Result {
    public final Status status;
    @Nullable public final Assignment solution;  // Not null when status is SOLVED
    public final int numSteps;  // The number of words tried in slots
    public final int numBacktracks;
    public final long elapsedMicros;

    Result(Status status, @Nullable Assignment solution, int numSteps, int numBacktracks,
           long elapsedMicros) {
      this.status = status;
      this.solution = solution;
      this.numSteps = numSteps;
      this.numBacktracks = numBacktracks;
      this.elapsedMicros = elapsedMicros;
    }

    public boolean isSolved() {
      return status == Status.SOLVED;
    }

    @Override public String toString() {
      return String.format("%s after %d steps, %d backtracks, %d\u00b5s",
          status, numSteps, numBacktracks, elapsedMicros);
    }
  }

  private final Crossword crossword;
  private final Domains domains;
  private final Strategy strategy;
  private final long timeoutNanos;
  private final Stopwatch stopwatch = Stopwatch.createUnstarted();
  private int numSteps;
  private int numBacktracks;
  private boolean timedOut;
  private boolean used;

  Solver(Crossword crossword, Domains domains, Strategy strategy, long timeoutNanos) {
    this.crossword = checkNotNull(crossword);
    this.domains = checkNotNull(domains);
    this.strategy = checkNotNull(strategy);
    this.timeoutNanos = timeoutNanos;
  }

  Result result() {
    checkState(!used, "A solver can only be used once");
    used = true;
    stopwatch.start();

    int removed = Consistency.enforceNodeConsistency(crossword, domains);
    logger.fine("Node consistency removed " + removed + " words");

    Status status;
    Assignment solution = null;
    if (domains.anyEmpty()) {
      logger.fine("No words fit some slot");
      status = Status.UNSATISFIABLE;
    } else if (!Consistency.ac3(crossword, domains)) {
      logger.fine("Arc consistency emptied a domain");
      status = Status.UNSATISFIABLE;
    } else {
      solution = backtrack(Assignment.EMPTY, domains);
      if (solution != null) status = Status.SOLVED;
      else status = timedOut ? Status.TIMED_OUT : Status.UNSATISFIABLE;
    }

    stopwatch.stop();
    Result result = new Result(
        status, solution, numSteps, numBacktracks, stopwatch.elapsed(MICROSECONDS));
    logger.fine(strategy + ": " + result);
    return result;
  }

  /**
   * Extends the given consistent assignment to a complete one, or returns
   * null if that can't be done (or time ran out).
   */
  @Nullable private Assignment backtrack(Assignment assignment, Domains domains) {
    if (assignment.isComplete(crossword)) return assignment;
    if (timeoutNanos > 0 && stopwatch.elapsed(NANOSECONDS) >= timeoutNanos) {
      timedOut = true;
      return null;
    }

    Slot slot = selectUnassignedSlot(assignment, domains);
    for (String word : orderDomainValues(slot, assignment, domains)) {
      ++numSteps;
      Assignment extended = assignment.with(slot, word);
      if (!extended.isConsistent(crossword)) {
        ++numBacktracks;
        continue;
      }

      Domains branchDomains = domains;
      if (strategy.maintainsArcConsistency) {
        branchDomains = domains.copy();
        branchDomains.restrict(slot, word);
        if (!Consistency.ac3(crossword, branchDomains, Arc.into(crossword, slot))) {
          ++numBacktracks;
          continue;
        }
      }

      Assignment result = backtrack(extended, branchDomains);
      if (result != null) return result;
      if (timedOut) return null;
      ++numBacktracks;
    }
    return null;
  }

  /**
   * Chooses the unassigned slot with the fewest words left in its domain.
   * Ties go to the slot with the most unassigned neighbors if the strategy
   * says so, and otherwise to the earliest slot.
   */
  Slot selectUnassignedSlot(Assignment assignment, Domains domains) {
    Slot best = null;
    int bestSize = 0;
    int bestDegree = 0;
    for (Slot slot : crossword.slots()) {
      if (assignment.containsKey(slot)) continue;
      int size = domains.size(slot);
      int degree = strategy.breaksTiesByDegree ? unassignedDegree(slot, assignment) : 0;
      if (best == null || size < bestSize || (size == bestSize && degree > bestDegree)) {
        best = slot;
        bestSize = size;
        bestDegree = degree;
      }
    }
    checkState(best != null, "Every slot is assigned");
    return best;
  }

  private int unassignedDegree(Slot slot, Assignment assignment) {
    int count = 0;
    for (Slot neighbor : crossword.neighbors(slot))
      if (!assignment.containsKey(neighbor)) ++count;
    return count;
  }

  /**
   * Returns the words of the slot's domain, those that rule out the fewest
   * words of the unassigned neighbors first.  Ties are in word order.
   */
  List<String> orderDomainValues(Slot slot, Assignment assignment, Domains domains) {
    Map<String, Integer> ruledOut = Maps.newHashMap();
    for (String word : domains.snapshot(slot)) {
      int count = 0;
      for (Slot neighbor : crossword.neighbors(slot)) {
        if (assignment.containsKey(neighbor)) continue;
        Overlap overlap = crossword.overlap(slot, neighbor);
        for (String other : domains.get(neighbor))
          if (!overlap.agrees(word, other)) ++count;
      }
      ruledOut.put(word, count);
    }

    List<String> ordered = Lists.newArrayList(ruledOut.keySet());
    Ordering<String> order = Ordering.<Integer>natural()
        .onResultOf(Functions.forMap(ruledOut))
        .compound(Ordering.<String>natural());
    Collections.sort(ordered, order);
    return ordered;
  }
}
