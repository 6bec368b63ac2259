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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.logging.Level.SEVERE;

import us.blanshard.crossword.core.Crossword;
import us.blanshard.crossword.core.Domains;
import us.blanshard.crossword.core.Solver;
import us.blanshard.crossword.format.CrosswordJson;
import us.blanshard.crossword.format.LetterGrid;
import us.blanshard.crossword.format.PuzzleFiles;

import com.google.common.collect.Lists;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Fills a crossword structure with words from a word list, prints the result,
 * and optionally saves it as a PNG image or as json.
 *
 * @author Luke Blanshard
 */
public class Generate {
  private static final Logger logger = Logger.getLogger(Generate.class.getName());

  static final int EXIT_SOLVED = 0;
  static final int EXIT_ERROR = 1;
  static final int EXIT_NO_SOLUTION = 2;

  public static void main(String[] args) {
    ToolLogging.configure();
    System.exit(run(args, utf8(System.out), utf8(System.err)));
  }

  /**
   * Wraps the given stream in one that encodes as UTF-8, whatever the
   * platform's default charset, so the grid's block characters survive.
   */
  static PrintStream utf8(OutputStream out) {
    return new PrintStream(out, true, UTF_8);
  }

  /**
   * Does the work of {@link #main}, returns the exit status.
   */
  static int run(String[] args, PrintStream out, PrintStream err) {
    Solver.Strategy strategy = Solver.Strategy.DEFAULT;
    long timeoutMillis = 0;
    List<String> files = Lists.newArrayList();
    for (String arg : args) {
      try {
        if (arg.startsWith("--strategy=")) {
          strategy = Solver.Strategy.valueOf(
              arg.substring("--strategy=".length()).toUpperCase(Locale.ROOT));
        } else if (arg.startsWith("--timeout=")) {
          timeoutMillis = Long.decode(arg.substring("--timeout=".length()));
        } else if (arg.equals("--verbose")) {
          ToolLogging.setVerbose();
        } else if (arg.startsWith("--")) {
          return usage(err);
        } else {
          files.add(arg);
        }
      } catch (IllegalArgumentException e) {  // Includes NumberFormatException
        return usage(err);
      }
    }
    if (files.size() < 2 || files.size() > 3) return usage(err);

    Crossword crossword;
    Set<String> words;
    try {
      crossword = PuzzleFiles.readCrossword(new File(files.get(0)));
      words = PuzzleFiles.readWords(new File(files.get(1)));
    } catch (IOException e) {
      logger.log(SEVERE, "Problem reading puzzle inputs", e);
      err.println("Unable to read inputs: " + e.getMessage());
      return EXIT_ERROR;
    }

    logger.info("Filling " + crossword.slots().size() + " slots from " + words.size()
        + " words using " + strategy);
    Solver.Result result = Solver.solve(
        crossword, Domains.of(crossword, words), strategy, timeoutMillis, MILLISECONDS);
    logger.info(result.toString());

    if (!result.isSolved()) {
      out.println(result.status == Solver.Status.TIMED_OUT
          ? "No solution found in time." : "No solution.");
      return EXIT_NO_SOLUTION;
    }

    LetterGrid letters = LetterGrid.of(crossword, result.solution);
    out.print(letters);

    if (files.size() == 3) {
      File output = new File(files.get(2));
      try {
        if (output.getName().toLowerCase(Locale.ROOT).endsWith(".json"))
          CrosswordJson.write(crossword, result.solution, output);
        else
          letters.writePng(output);
        logger.info("Saved " + output);
      } catch (IOException e) {
        logger.log(SEVERE, "Problem saving " + output, e);
        err.println("Unable to save " + output + ": " + e.getMessage());
        return EXIT_ERROR;
      }
    }
    return EXIT_SOLVED;
  }

  private static int usage(PrintStream err) {
    err.println("Usage: Generate [--strategy=SIMPLE|DEGREE|PROPAGATING] [--timeout=<millis>]"
        + " [--verbose] <structure> <words> [<output>]");
    return EXIT_ERROR;
  }
}
