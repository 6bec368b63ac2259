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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Lists;
import com.google.common.collect.Multimap;
import com.google.common.collect.MultimapBuilder;
import com.google.common.collect.SetMultimap;
import com.google.common.collect.Table;
import com.google.common.collect.TreeBasedTable;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The structure of a crossword puzzle: which cells are open, the slots that
 * need words, and how those slots cross one another.  Never changes once
 * built.
 *
 * <p> The overlaps are symmetric: {@code overlap(a, b)} is always
 * {@code overlap(b, a).reverse()}, and both are null when the slots don't
 * cross.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Crossword {

  /** The character that marks an open cell in a structure. */
  public static final char OPEN = '_';

  /** The number of rows. */
  public final int height;

  /** The number of columns. */
  public final int width;

  private final boolean[] open;
  private final ImmutableList<Slot> slots;
  private final ImmutableTable<Slot, Slot, Overlap> overlaps;
  private final ImmutableSetMultimap<Slot, Slot> neighbors;

  /**
   * Builds a crossword from the rows of a structure.  Open cells are marked by
   * underscores, everything else is blocked.  Short rows are treated as
   * blocked past their ends.  Every run of two or more open cells across or
   * down becomes a slot.
   */
  public static Crossword fromStructure(List<String> rows) {
    int height = rows.size();
    int width = 0;
    for (String row : rows)
      width = Math.max(width, row.length());

    boolean[] open = new boolean[height * width];
    for (int i = 0; i < height; ++i) {
      String row = rows.get(i);
      for (int j = 0; j < row.length(); ++j)
        open[i * width + j] = row.charAt(j) == OPEN;
    }

    List<Slot> slots = Lists.newArrayList();
    for (int i = 0; i < height; ++i) {
      for (int j = 0; j < width; ++j) {
        if (!open[i * width + j]) continue;
        if (j == 0 || !open[i * width + j - 1]) {
          int length = 1;
          while (j + length < width && open[i * width + j + length]) ++length;
          if (length > 1) slots.add(Slot.across(i, j, length));
        }
        if (i == 0 || !open[(i - 1) * width + j]) {
          int length = 1;
          while (i + length < height && open[(i + length) * width + j]) ++length;
          if (length > 1) slots.add(Slot.down(i, j, length));
        }
      }
    }
    return new Crossword(height, width, open, slots);
  }

  /**
   * Like {@link #fromStructure}, but takes the whole structure as one string.
   * Trailing blank lines are ignored.
   */
  public static Crossword fromString(String structure) {
    List<String> rows = Lists.newArrayList(Splitter.onPattern("\r?\n").split(structure));
    while (!rows.isEmpty() && rows.get(rows.size() - 1).isEmpty())
      rows.remove(rows.size() - 1);
    return fromStructure(rows);
  }

  /**
   * Builds a crossword directly from its slots.  The grid is the smallest one
   * holding all the slots, and its open cells are exactly those the slots
   * cover.
   */
  public static Crossword of(Collection<Slot> slots) {
    int height = 0;
    int width = 0;
    for (Slot slot : slots) {
      Cell last = slot.cell(slot.length - 1);
      height = Math.max(height, last.row + 1);
      width = Math.max(width, last.column + 1);
    }
    boolean[] open = new boolean[height * width];
    for (Slot slot : slots)
      for (Cell cell : slot.cells)
        open[cell.row * width + cell.column] = true;
    return new Crossword(height, width, open, slots);
  }

  public static Crossword of(Slot... slots) {
    return of(ImmutableList.copyOf(slots));
  }

  private Crossword(int height, int width, boolean[] open, Collection<Slot> slots) {
    this.height = height;
    this.width = width;
    this.open = open;
    this.slots = ImmutableSortedSet.copyOf(slots).asList();

    Multimap<Cell, Slot> slotsByCell = MultimapBuilder.treeKeys().arrayListValues().build();
    for (Slot slot : this.slots)
      for (Cell cell : slot.cells)
        slotsByCell.put(cell, slot);

    Table<Slot, Slot, Overlap> overlaps = TreeBasedTable.create();
    SetMultimap<Slot, Slot> neighbors = MultimapBuilder.treeKeys().treeSetValues().build();
    for (Map.Entry<Cell, Collection<Slot>> entry : slotsByCell.asMap().entrySet()) {
      Cell cell = entry.getKey();
      for (Slot a : entry.getValue()) {
        for (Slot b : entry.getValue()) {
          if (a.equals(b)) continue;
          checkArgument(!overlaps.contains(a, b), "Slots %s and %s share more than one cell", a, b);
          overlaps.put(a, b, Overlap.of(a.indexOf(cell), b.indexOf(cell)));
          neighbors.put(a, b);
        }
      }
    }
    this.overlaps = ImmutableTable.copyOf(overlaps);
    this.neighbors = ImmutableSetMultimap.copyOf(neighbors);
  }

  /** All the slots, in their natural order. */
  public ImmutableList<Slot> slots() {
    return slots;
  }

  /** The slots that cross the given one, in their natural order. */
  public ImmutableSet<Slot> neighbors(Slot slot) {
    return neighbors.get(slot);
  }

  /** The number of slots crossing the given one. */
  public int degree(Slot slot) {
    return neighbors.get(slot).size();
  }

  /**
   * Returns where the two slots cross, with {@link Overlap#first} indexing
   * into {@code x} and {@link Overlap#second} into {@code y}, or null if they
   * don't cross.
   */
  @Nullable public Overlap overlap(Slot x, Slot y) {
    return overlaps.get(x, y);
  }

  /** Tells whether the given cell is open; cells outside the grid are not. */
  public boolean isOpen(int row, int column) {
    if (row < 0 || row >= height || column < 0 || column >= width) return false;
    return open[row * width + column];
  }

  public boolean isOpen(Cell cell) {
    return isOpen(cell.row, cell.column);
  }

  /**
   * Renders the structure with underscores for open cells and hashes for
   * blocked ones.
   */
  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < height; ++i) {
      for (int j = 0; j < width; ++j)
        sb.append(isOpen(i, j) ? OPEN : '#');
      sb.append('\n');
    }
    return sb.toString();
  }
}
