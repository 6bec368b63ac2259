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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

import javax.annotation.concurrent.Immutable;

/**
 * A run of open cells in a crossword grid that must hold a single word: the
 * variables of the puzzle.  Identified by its first cell, its direction, and
 * its length.
 *
 * <p> Slots sort by row, then column, then direction, then length.  That order
 * is what the solver falls back on whenever its heuristics can't choose.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Slot implements Comparable<Slot> {

  /** The row of the first letter. */
  public final int row;

  /** The column of the first letter. */
  public final int column;

  public final Direction direction;

  /** The number of letters in the slot's word. */
  public final int length;

  /** The cells this slot covers, in word order. */
  public final ImmutableList<Cell> cells;

  public static Slot of(int row, int column, Direction direction, int length) {
    return new Slot(row, column, direction, length);
  }

  public static Slot across(int row, int column, int length) {
    return of(row, column, Direction.ACROSS, length);
  }

  public static Slot down(int row, int column, int length) {
    return of(row, column, Direction.DOWN, length);
  }

  private Slot(int row, int column, Direction direction, int length) {
    checkArgument(length > 0, "Slot length must be positive, got %s", length);
    this.row = row;
    this.column = column;
    this.direction = checkNotNull(direction);
    this.length = length;

    Cell first = Cell.of(row, column);
    ImmutableList.Builder<Cell> builder = ImmutableList.builder();
    for (int k = 0; k < length; ++k)
      builder.add(first.step(direction, k));
    this.cells = builder.build();
  }

  /** Returns the cell holding the letter at the given index of the word. */
  public Cell cell(int index) {
    return cells.get(index);
  }

  /** Returns the index of the given cell within this slot, or -1. */
  public int indexOf(Cell cell) {
    return cells.indexOf(cell);
  }

  @Override public int compareTo(Slot that) {
    if (this.row != that.row) return this.row < that.row ? -1 : 1;
    if (this.column != that.column) return this.column < that.column ? -1 : 1;
    if (this.direction != that.direction) return this.direction.compareTo(that.direction);
    return this.length - that.length;
  }

  @Override public boolean equals(Object object) {
    if (this == object) return true;
    if (!(object instanceof Slot)) return false;
    Slot that = (Slot) object;
    return this.row == that.row
        && this.column == that.column
        && this.direction == that.direction
        && this.length == that.length;
  }

  @Override public int hashCode() {
    return Objects.hashCode(row, column, direction, length);
  }

  @Override public String toString() {
    return String.format("(%d, %d) %s : %d", row, column, direction, length);
  }
}
