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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;

import java.util.AbstractMap;
import java.util.Map;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

/**
 * An immutable, possibly partial, choice of words for the slots of a
 * crossword: a Map from Slot to word.  Extending an assignment with
 * {@link #with} produces a new one and leaves the original alone, which is
 * what lets the solver back out of a choice by simply dropping it.
 *
 * <p> Like {@link Domains}, an assignment doesn't enforce the crossword's
 * constraints; {@link #isConsistent} checks them.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Assignment extends AbstractMap<Slot, String> implements Map<Slot, String> {

  public static final Assignment EMPTY = new Assignment(ImmutableMap.<Slot, String>of());

  private final ImmutableMap<Slot, String> words;

  private Assignment(ImmutableMap<Slot, String> words) {
    this.words = words;
  }

  /** Returns an assignment holding the given slot-to-word mappings. */
  public static Assignment of(Map<Slot, String> words) {
    if (words instanceof Assignment) return (Assignment) words;
    return new Assignment(ImmutableMap.copyOf(words));
  }

  /**
   * Returns a new assignment that also maps the given slot, which must not
   * already be assigned, to the given word.
   */
  public Assignment with(Slot slot, String word) {
    checkNotNull(slot);
    checkNotNull(word);
    checkArgument(!words.containsKey(slot), "%s is already assigned", slot);
    return new Assignment(ImmutableMap.<Slot, String>builder()
        .putAll(words)
        .put(slot, word)
        .build());
  }

  /** Tells whether every slot of the crossword has a word. */
  public boolean isComplete(Crossword crossword) {
    for (Slot slot : crossword.slots())
      if (!words.containsKey(slot)) return false;
    return true;
  }

  /**
   * Tells whether this assignment could be part of a solution to the given
   * crossword: no word is used twice, every word fits its slot, and crossing
   * words agree on their shared letters.  Unassigned slots are ignored.
   */
  public boolean isConsistent(Crossword crossword) {
    Set<String> used = Sets.newHashSet();
    for (String word : words.values())
      if (!used.add(word)) return false;

    for (Entry<Slot, String> e : words.entrySet())
      if (e.getValue().length() != e.getKey().length) return false;

    for (Entry<Slot, String> e : words.entrySet()) {
      Slot slot = e.getKey();
      for (Slot neighbor : crossword.neighbors(slot)) {
        String other = words.get(neighbor);
        if (other != null && !crossword.overlap(slot, neighbor).agrees(e.getValue(), other))
          return false;
      }
    }
    return true;
  }

  @Override public void clear() {
    throw new UnsupportedOperationException();
  }

  @Override public boolean containsKey(Object key) {
    return words.containsKey(key);
  }

  @Override public boolean containsValue(Object value) {
    return words.containsValue(value);
  }

  @Override public Set<Entry<Slot, String>> entrySet() {
    return words.entrySet();
  }

  @Override public String get(Object key) {
    return words.get(key);
  }

  @Override public String put(Slot key, String value) {
    throw new UnsupportedOperationException();
  }

  @Override public String remove(Object key) {
    throw new UnsupportedOperationException();
  }

  @Override public int size() {
    return words.size();
  }
}
