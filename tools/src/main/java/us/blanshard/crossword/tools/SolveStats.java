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
package us.blanshard.crossword.tools;

import us.blanshard.crossword.core.Crossword;
import us.blanshard.crossword.core.Solver;
import us.blanshard.crossword.format.PuzzleFiles;

import com.google.common.collect.Maps;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Solves a crossword repeatedly with each solver strategy, and spits out
 * statistics about how long they take.
 *
 * @author Luke Blanshard
 */
public class SolveStats {
  public static void main(String[] args) {
    if (args.length != 3) exitWithUsage();
    int count;
    try {
      count = Integer.decode(args[2]);
    } catch (NumberFormatException e) {
      exitWithUsage();
      return;  // Convince the compiler.
    }

    ToolLogging.configure();
    Crossword crossword;
    Set<String> words;
    try {
      crossword = PuzzleFiles.readCrossword(new File(args[0]));
      words = PuzzleFiles.readWords(new File(args[1]));
    } catch (IOException e) {
      throw new RuntimeException("Problem reading puzzle inputs", e);
    }

    PrintStream out = Generate.utf8(System.out);
    out.printf("Solving %s with %d words, %d times per strategy%n",
        args[0], words.size(), count);

    // Start with a couple of rounds with no printing, to get all the machinery
    // warmed up.
    measure(crossword, words, 2);

    out.println("Strategy\tStatus\tMean Micros\tStdDev\tMean Steps\tStdDev");
    for (Map.Entry<Solver.Strategy, Measurement> entry
             : measure(crossword, words, count).entrySet()) {
      Measurement m = entry.getValue();
      out.printf("%s\t%s\t%.1f\t%.1f\t%.1f\t%.1f%n", entry.getKey(), m.status,
          m.micros.getMean(), m.micros.getStandardDeviation(),
          m.steps.getMean(), m.steps.getStandardDeviation());
    }
  }

  private static void exitWithUsage() {
    System.err.println("Usage: SolveStats <structure> <words> <count>");
    System.exit(1);
  }

  /** The statistics gathered for one strategy. */
  static class Measurement {
    final SummaryStatistics micros = new SummaryStatistics();
    final SummaryStatistics steps = new SummaryStatistics();
    Solver.Status status;

    void add(Solver.Result result) {
      micros.addValue(result.elapsedMicros);
      steps.addValue(result.numSteps);
      status = result.status;
    }
  }

  /**
   * Solves the crossword {@code count} times with each strategy, fresh
   * domains every time.
   */
  static Map<Solver.Strategy, Measurement> measure(
      Crossword crossword, Collection<String> words, int count) {
    Map<Solver.Strategy, Measurement> answer = Maps.newEnumMap(Solver.Strategy.class);
    for (Solver.Strategy strategy : Solver.Strategy.values()) {
      Measurement measurement = new Measurement();
      for (int i = 0; i < count; ++i)
        measurement.add(Solver.solve(crossword, words, strategy));
      answer.put(strategy, measurement);
    }
    return answer;
  }
}
