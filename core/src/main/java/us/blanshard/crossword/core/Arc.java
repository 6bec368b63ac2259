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
 * A directed constraint between two crossing slots, as handled by
 * {@link Consistency#ac3}: making an arc consistent prunes the domain of
 * {@link #from} against that of {@link #to}.
 */
@Immutable
public final class Arc {
  public final Slot from;
  public final Slot to;

  public static Arc of(Slot from, Slot to) {
    return new Arc(from, to);
  }

  private Arc(Slot from, Slot to) {
    this.from = checkNotNull(from);
    this.to = checkNotNull(to);
    checkArgument(!from.equals(to), "An arc needs two different slots, got %s twice", from);
  }

  /** All the arcs of the crossword's constraint graph, both ways round. */
  public static ImmutableList<Arc> allOf(Crossword crossword) {
    ImmutableList.Builder<Arc> builder = ImmutableList.builder();
    for (Slot x : crossword.slots())
      for (Slot y : crossword.neighbors(x))
        if (crossword.overlap(x, y) != null)
          builder.add(of(x, y));
    return builder.build();
  }

  /** The arcs pointing into the given slot from each of its neighbors. */
  public static ImmutableList<Arc> into(Crossword crossword, Slot slot) {
    ImmutableList.Builder<Arc> builder = ImmutableList.builder();
    for (Slot z : crossword.neighbors(slot))
      builder.add(of(z, slot));
    return builder.build();
  }

  @Override public boolean equals(Object object) {
    if (this == object) return true;
    if (!(object instanceof Arc)) return false;
    Arc that = (Arc) object;
    return this.from.equals(that.from) && this.to.equals(that.to);
  }

  @Override public int hashCode() {
    return Objects.hashCode(from, to);
  }

  @Override public String toString() {
    return from + " \u2192 " + to;  // That's a right arrow
  }
}
