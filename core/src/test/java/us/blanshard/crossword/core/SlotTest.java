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
import static org.junit.Assert.assertTrue;

import com.google.common.collect.Lists;

import org.junit.Test;

import java.util.Collections;
import java.util.List;

public class SlotTest {

  @Test public void cells() {
    Slot across = Slot.across(2, 1, 3);
    assertEquals(asList(Cell.of(2, 1), Cell.of(2, 2), Cell.of(2, 3)), across.cells);
    Slot down = Slot.down(2, 1, 3);
    assertEquals(asList(Cell.of(2, 1), Cell.of(3, 1), Cell.of(4, 1)), down.cells);
    assertEquals(Cell.of(4, 1), down.cell(2));
    assertEquals(1, down.indexOf(Cell.of(3, 1)));
    assertEquals(-1, down.indexOf(Cell.of(2, 2)));
  }

  @Test public void equality() {
    assertEquals(Slot.of(1, 2, Direction.DOWN, 4), Slot.down(1, 2, 4));
    assertEquals(Slot.of(1, 2, Direction.DOWN, 4).hashCode(), Slot.down(1, 2, 4).hashCode());
    assertEquals(false, Slot.down(1, 2, 4).equals(Slot.across(1, 2, 4)));
    assertEquals(false, Slot.down(1, 2, 4).equals(Slot.down(1, 2, 5)));
    assertEquals(false, Slot.down(1, 2, 4).equals(Slot.down(2, 2, 4)));
    assertEquals(false, Slot.down(1, 2, 4).equals(Slot.down(1, 3, 4)));
  }

  @Test public void ordering() {
    List<Slot> sorted = asList(
        Slot.across(0, 0, 3), Slot.across(0, 0, 4), Slot.down(0, 0, 2),
        Slot.down(0, 3, 2), Slot.across(1, 0, 5));
    List<Slot> shuffled = Lists.newArrayList(sorted);
    Collections.reverse(shuffled);
    Collections.sort(shuffled);
    assertEquals(sorted, shuffled);
    assertTrue(Slot.across(0, 5, 3).compareTo(Slot.down(1, 0, 3)) < 0);
  }

  @Test public void string() {
    assertEquals("(0, 1) ACROSS : 3", Slot.across(0, 1, 3).toString());
  }

  @Test(expected = IllegalArgumentException.class)
  public void zeroLength() {
    Slot.across(0, 0, 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void negativeRow() {
    Slot.down(-1, 0, 3);
  }

  @Test public void overlapReverse() {
    Overlap overlap = Overlap.of(1, 2);
    assertEquals(Overlap.of(2, 1), overlap.reverse());
    assertEquals(overlap, overlap.reverse().reverse());
    assertEquals(true, overlap.agrees("CAT", "BEAR"));
    assertEquals(false, overlap.agrees("COT", "BEAR"));
  }
}
