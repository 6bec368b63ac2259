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

/**
 * The two ways a word can run through a crossword grid.
 *
 * @author Luke Blanshard
 */
public enum Direction {

  /** Left to right along a row. */
  ACROSS(0, 1),

  /** Top to bottom along a column. */
  DOWN(1, 0);

  /** How far the row moves for each letter. */
  public final int rowDelta;

  /** How far the column moves for each letter. */
  public final int columnDelta;

  private Direction(int rowDelta, int columnDelta) {
    this.rowDelta = rowDelta;
    this.columnDelta = columnDelta;
  }
}
