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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * The words still possible for each slot of a crossword.  Each slot's domain
 * only ever shrinks; words come out through {@link #remove} and
 * {@link #restrict}, never back in.
 *
 * <p> Domains iterate in the natural order of their words.
 */
@NotThreadSafe
public final class Domains {

  private final Map<Slot, NavigableSet<String>> domains;

  private Domains(Map<Slot, NavigableSet<String>> domains) {
    this.domains = domains;
  }

  /**
   * Gives every slot of the crossword its own copy of the given words.
   */
  public static Domains of(Crossword crossword, Collection<String> words) {
    Map<Slot, NavigableSet<String>> domains = Maps.newLinkedHashMap();
    for (Slot slot : crossword.slots())
      domains.put(slot, Sets.newTreeSet(words));
    return new Domains(domains);
  }

  /** Returns an independent copy of all the domains. */
  public Domains copy() {
    Map<Slot, NavigableSet<String>> domains = Maps.newLinkedHashMap();
    for (Map.Entry<Slot, NavigableSet<String>> entry : this.domains.entrySet())
      domains.put(entry.getKey(), Sets.newTreeSet(entry.getValue()));
    return new Domains(domains);
  }

  /** The slots that have domains, in the crossword's slot order. */
  public Set<Slot> slots() {
    return Collections.unmodifiableSet(domains.keySet());
  }

  /** Returns a read-only live view of the given slot's domain. */
  public Set<String> get(Slot slot) {
    return Collections.unmodifiableSet(domain(slot));
  }

  /**
   * Returns a copy of the given slot's domain that stays put while the live
   * domain changes.
   */
  public ImmutableList<String> snapshot(Slot slot) {
    return ImmutableSortedSet.copyOfSorted(domain(slot)).asList();
  }

  public int size(Slot slot) {
    return domain(slot).size();
  }

  public boolean isEmpty(Slot slot) {
    return domain(slot).isEmpty();
  }

  /** Tells whether any slot's domain is empty. */
  public boolean anyEmpty() {
    for (Set<String> domain : domains.values())
      if (domain.isEmpty()) return true;
    return false;
  }

  /**
   * Removes the given word from the slot's domain, tells whether it was
   * there.
   */
  public boolean remove(Slot slot, String word) {
    return domain(slot).remove(word);
  }

  /**
   * Cuts the slot's domain down to just the given word, which must be in it.
   * Returns the number of words removed.
   */
  public int restrict(Slot slot, String word) {
    NavigableSet<String> domain = domain(slot);
    checkArgument(domain.contains(word), "%s is not in the domain of %s", word, slot);
    int removed = domain.size() - 1;
    domain.clear();
    domain.add(word);
    return removed;
  }

  private NavigableSet<String> domain(Slot slot) {
    return checkNotNull(domains.get(slot), "No domain for %s", slot);
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<Slot, NavigableSet<String>> entry : domains.entrySet())
      sb.append(entry.getKey()).append(": ").append(entry.getValue().size()).append(" words\n");
    return sb.toString();
  }
}
