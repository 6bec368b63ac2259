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

import com.google.common.collect.Sets;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Static methods that prune a crossword's {@link Domains} down to words that
 * can still take part in a solution: node consistency for the slots' lengths,
 * and the AC-3 algorithm for the letters shared by crossing slots.
 *
 * <p> Each method iterates over snapshots of the domains it prunes, so
 * removals never disturb an iteration in progress.
 *
 * @author Luke Blanshard
 */
public final class Consistency {
  private static final Logger logger = Logger.getLogger(Consistency.class.getName());

  private Consistency() {}

  /**
   * Removes from every slot's domain the words whose length differs from the
   * slot's.  Returns the number of words removed.
   */
  public static int enforceNodeConsistency(Crossword crossword, Domains domains) {
    int removed = 0;
    for (Slot slot : crossword.slots()) {
      for (String word : domains.snapshot(slot)) {
        if (word.length() != slot.length && domains.remove(slot, word))
          ++removed;
      }
    }
    return removed;
  }

  /**
   * Makes {@code x} arc consistent with {@code y}: removes from x's domain
   * every word that no word in y's domain agrees with where the two slots
   * cross.  Slots that don't cross constrain nothing.  Returns true if x's
   * domain changed.
   */
  public static boolean revise(Crossword crossword, Domains domains, Slot x, Slot y) {
    Overlap overlap = crossword.overlap(x, y);
    if (overlap == null) return false;

    // The letters y can supply at the shared cell.
    Set<Character> supported = Sets.newHashSet();
    for (String wy : domains.snapshot(y)) {
      if (overlap.second < wy.length())
        supported.add(wy.charAt(overlap.second));
    }

    boolean revised = false;
    for (String wx : domains.snapshot(x)) {
      if (overlap.first >= wx.length() || !supported.contains(wx.charAt(overlap.first))) {
        domains.remove(x, wx);
        revised = true;
      }
    }
    return revised;
  }

  /**
   * Runs AC-3 over every arc of the crossword.  Returns false if some domain
   * ended up empty, true if all domains are now arc consistent.
   */
  public static boolean ac3(Crossword crossword, Domains domains) {
    return ac3(crossword, domains, Arc.allOf(crossword));
  }

  /**
   * Runs AC-3 starting from the given arcs.  Whenever an arc's source domain
   * shrinks, the arcs pointing into that source are rechecked.  Returns false
   * as soon as a domain empties.
   */
  public static boolean ac3(Crossword crossword, Domains domains, Collection<Arc> arcs) {
    ArrayDeque<Arc> worklist = new ArrayDeque<Arc>(arcs);
    int revisions = 0;
    while (!worklist.isEmpty()) {
      Arc arc = worklist.removeLast();
      if (revise(crossword, domains, arc.from, arc.to)) {
        ++revisions;
        if (domains.isEmpty(arc.from)) {
          logger.finer("AC-3 emptied the domain of " + arc.from + " after " + revisions
              + " revisions");
          return false;
        }
        for (Slot z : crossword.neighbors(arc.from)) {
          if (!z.equals(arc.to))
            worklist.addLast(Arc.of(z, arc.from));
        }
      }
    }
    logger.finer("AC-3 finished after " + revisions + " revisions");
    return true;
  }
}
