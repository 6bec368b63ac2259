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
import static java.util.Arrays.asList;
import static org.junit.Assert.assertEquals;
import static us.blanshard.crossword.core.SamplePuzzles.STRUCTURE0;
import static us.blanshard.crossword.core.SamplePuzzles.WORDS0;
import static us.blanshard.crossword.core.SamplePuzzles.resource;

import us.blanshard.crossword.core.Crossword;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;

public class PuzzleFilesTest {
  @Rule public TemporaryFolder folder = new TemporaryFolder();

  @Test public void readCrossword() throws IOException {
    File file = write("structure0.txt", resource("structure0.txt"));
    Crossword crossword = PuzzleFiles.readCrossword(file);
    assertEquals(STRUCTURE0.slots(), crossword.slots());
    assertEquals(STRUCTURE0.toString(), crossword.toString());
  }

  @Test public void readWords() throws IOException {
    File file = write("words0.txt", resource("words0.txt"));
    assertEquals(WORDS0, ImmutableList.copyOf(PuzzleFiles.readWords(file)));
  }

  @Test public void parseWords() {
    assertEquals(ImmutableSet.of("CAT", "DOG"),
                 PuzzleFiles.parseWords(asList("  cat ", "", "Dog", "   ", "CAT")));
  }

  @Test(expected = IOException.class)
  public void missingFile() throws IOException {
    PuzzleFiles.readWords(new File(folder.getRoot(), "nope.txt"));
  }

  private File write(String name, String content) throws IOException {
    File file = folder.newFile(name);
    Files.asCharSink(file, UTF_8).write(content);
    return file;
  }
}
