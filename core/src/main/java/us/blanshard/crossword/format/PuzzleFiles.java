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
package us.blanshard.crossword.format;

import static java.nio.charset.StandardCharsets.UTF_8;

import us.blanshard.crossword.core.Crossword;

import com.google.common.collect.ImmutableSet;
import com.google.common.io.Files;

import java.io.File;
import java.io.IOException;
import java.util.Locale;

/**
 * Reads the two inputs of a crossword: its structure, and the words that may
 * fill it.
 *
 * @author Luke Blanshard
 */
public class PuzzleFiles {

  /**
   * Reads a structure file: one line per grid row, underscores for open
   * cells.  See {@link Crossword#fromStructure}.
   */
  public static Crossword readCrossword(File file) throws IOException {
    return Crossword.fromString(Files.asCharSource(file, UTF_8).read());
  }

  /**
   * Reads a word list, one word per line.
   */
  public static ImmutableSet<String> readWords(File file) throws IOException {
    return parseWords(Files.asCharSource(file, UTF_8).readLines());
  }

  /**
   * Trims and upper-cases the given lines, skipping the blank ones.  The
   * result holds each word once, in order of first appearance.
   */
  public static ImmutableSet<String> parseWords(Iterable<String> lines) {
    ImmutableSet.Builder<String> builder = ImmutableSet.builder();
    for (String line : lines) {
      String word = line.trim();
      if (!word.isEmpty())
        builder.add(word.toUpperCase(Locale.ROOT));
    }
    return builder.build();
  }
}
