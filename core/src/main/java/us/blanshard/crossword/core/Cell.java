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

import javax.annotation.concurrent.Immutable;

/**
 * A cell of a crossword grid, identified by zero-based row and column.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Cell implements Comparable<Cell> {

  /** The row index, counting from 0 at the top. */
  public final int row;

  /** The column index, counting from 0 at the left. */
  public final int column;

  public static Cell of(int row, int column) {
    return new Cell(row, column);
  }

  private Cell(int row, int column) {
    checkArgument(row >= 0 && column >= 0, "Negative cell coordinates (%s, %s)", row, column);
    this.row = row;
    this.column = column;
  }

  /** Returns the cell {@code steps} cells away in the given direction. */
  public Cell step(Direction direction, int steps) {
    return of(row + direction.rowDelta * steps, column + direction.columnDelta * steps);
  }

  @Override public int compareTo(Cell that) {
    if (this.row != that.row) return this.row < that.row ? -1 : 1;
    if (this.column != that.column) return this.column < that.column ? -1 : 1;
    return 0;
  }

  @Override public boolean equals(Object object) {
    if (this == object) return true;
    if (!(object instanceof Cell)) return false;
    Cell that = (Cell) object;
    return this.row == that.row && this.column == that.column;
  }

  @Override public int hashCode() {
    return row * 31 + column;
  }

  @Override public String toString() {
    return String.format("(%d, %d)", row, column);
  }
}
