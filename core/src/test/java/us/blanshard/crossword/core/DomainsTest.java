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
import static us.blanshard.crossword.core.SamplePuzzles.BOTTOM;
import static us.blanshard.crossword.core.SamplePuzzles.STRUCTURE0;
import static us.blanshard.crossword.core.SamplePuzzles.TOP;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.junit.Test;

public class DomainsTest {

  @Test public void eachSlotGetsItsOwnCopy() {
    Domains domains = Domains.of(STRUCTURE0, asList("SIX", "TEN", "ONE"));
    assertEquals(STRUCTURE0.slots(), ImmutableList.copyOf(domains.slots()));
    assertEquals(true, domains.remove(TOP, "TEN"));
    assertEquals(false, domains.remove(TOP, "TEN"));
    assertEquals(ImmutableSet.of("ONE", "SIX"), domains.get(TOP));
    assertEquals(ImmutableSet.of("ONE", "SIX", "TEN"), domains.get(BOTTOM));
    assertEquals(2, domains.size(TOP));
  }

  @Test public void wordOrder() {
    Domains domains = Domains.of(STRUCTURE0, asList("TEN", "SIX", "ONE"));
    assertEquals(asList("ONE", "SIX", "TEN"), ImmutableList.copyOf(domains.get(TOP)));
    assertEquals(asList("ONE", "SIX", "TEN"), domains.snapshot(TOP));
  }

  @Test public void snapshotStaysPut() {
    Domains domains = Domains.of(STRUCTURE0, asList("SIX", "TEN"));
    ImmutableList<String> snapshot = domains.snapshot(TOP);
    for (String word : snapshot)
      domains.remove(TOP, word);
    assertEquals(asList("SIX", "TEN"), snapshot);
    assertEquals(true, domains.isEmpty(TOP));
    assertEquals(true, domains.anyEmpty());
    assertEquals(false, domains.isEmpty(BOTTOM));
  }

  @Test public void restrictAndCopy() {
    Domains domains = Domains.of(STRUCTURE0, asList("SIX", "TEN", "ONE"));
    Domains copy = domains.copy();
    assertEquals(2, copy.restrict(TOP, "TEN"));
    assertEquals(ImmutableSet.of("TEN"), copy.get(TOP));
    assertEquals(3, domains.size(TOP));
    domains.remove(BOTTOM, "ONE");
    assertEquals(3, copy.size(BOTTOM));
  }

  @Test(expected = IllegalArgumentException.class)
  public void restrictToMissingWord() {
    Domains.of(STRUCTURE0, asList("SIX")).restrict(TOP, "TEN");
  }

  @Test(expected = UnsupportedOperationException.class)
  public void viewIsReadOnly() {
    Domains.of(STRUCTURE0, asList("SIX")).get(TOP).clear();
  }

  @Test(expected = NullPointerException.class)
  public void unknownSlot() {
    Domains.of(STRUCTURE0, asList("SIX")).size(Slot.across(7, 7, 3));
  }
}
