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

import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.crossword.core.Cell;
import us.blanshard.crossword.core.Crossword;
import us.blanshard.crossword.core.Slot;

import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.Map;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.imageio.ImageIO;

/**
 * The letters that an assignment of words puts into a crossword's grid, with
 * ways to show them as text or as an image.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class LetterGrid {

  /** Stands in for a blocked cell in the text rendering. */
  public static final char BLOCK = '\u2588';  // Full block

  /** The width and height in pixels of each cell of the image. */
  public static final int CELL_SIZE = 100;

  /** The black border around each cell of the image. */
  public static final int CELL_BORDER = 2;

  private static final int INTERIOR_SIZE = CELL_SIZE - 2 * CELL_BORDER;
  private static final Font FONT = new Font(Font.SANS_SERIF, Font.PLAIN, 80);

  private final Crossword crossword;
  private final char[] letters;  // 0 where there's no letter

  private LetterGrid(Crossword crossword, char[] letters) {
    this.crossword = crossword;
    this.letters = letters;
  }

  /**
   * Places the given words into the crossword's grid.  Letters that would land
   * on blocked cells or outside the grid are dropped.
   */
  public static LetterGrid of(Crossword crossword, Map<Slot, String> words) {
    checkNotNull(crossword);
    char[] letters = new char[crossword.height * crossword.width];
    for (Map.Entry<Slot, String> entry : words.entrySet()) {
      Slot slot = entry.getKey();
      String word = entry.getValue();
      for (int k = 0; k < slot.length && k < word.length(); ++k) {
        Cell cell = slot.cell(k);
        if (crossword.isOpen(cell))
          letters[cell.row * crossword.width + cell.column] = word.charAt(k);
      }
    }
    return new LetterGrid(crossword, letters);
  }

  /** Returns the letter at the given cell, or null. */
  @Nullable public Character get(int row, int column) {
    if (!crossword.isOpen(row, column)) return null;
    char c = letters[row * crossword.width + column];
    return c == 0 ? null : c;
  }

  /**
   * Renders the grid one line per row, with solid blocks for blocked cells and
   * spaces for open cells without letters.
   */
  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < crossword.height; ++i) {
      for (int j = 0; j < crossword.width; ++j) {
        if (!crossword.isOpen(i, j)) sb.append(BLOCK);
        else {
          Character c = get(i, j);
          sb.append(c == null ? ' ' : c.charValue());
        }
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  /**
   * Draws the grid: a black canvas with a white square for each open cell and
   * its letter centered in black.
   */
  public BufferedImage toImage() {
    BufferedImage image = new BufferedImage(
        Math.max(1, crossword.width * CELL_SIZE), Math.max(1, crossword.height * CELL_SIZE),
        BufferedImage.TYPE_INT_ARGB);
    Graphics2D g = image.createGraphics();
    try {
      g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING,
                         RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
      g.setColor(Color.BLACK);
      g.fillRect(0, 0, image.getWidth(), image.getHeight());

      for (int i = 0; i < crossword.height; ++i) {
        for (int j = 0; j < crossword.width; ++j) {
          if (!crossword.isOpen(i, j)) continue;
          int x = j * CELL_SIZE + CELL_BORDER;
          int y = i * CELL_SIZE + CELL_BORDER;
          g.setColor(Color.WHITE);
          g.fillRect(x, y, INTERIOR_SIZE, INTERIOR_SIZE);

          Character c = get(i, j);
          if (c != null) {
            FontMetrics metrics = g.getFontMetrics(FONT);
            String s = String.valueOf(c);
            g.setColor(Color.BLACK);
            g.setFont(FONT);
            g.drawString(s,
                x + (INTERIOR_SIZE - metrics.stringWidth(s)) / 2,
                y + (INTERIOR_SIZE - metrics.getHeight()) / 2 + metrics.getAscent());
          }
        }
      }
    } finally {
      g.dispose();
    }
    return image;
  }

  /** Saves the image of this grid to the given file as a PNG. */
  public void writePng(File file) throws IOException {
    if (!ImageIO.write(toImage(), "png", file))
      throw new IOException("No PNG writer available for " + file);
  }
}
