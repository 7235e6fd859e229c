/*
Copyright 2013 Luke Blanshard

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
package us.blanshard.puzzle.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static us.blanshard.puzzle.core.TestHelper.vs;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import org.junit.Test;

import java.util.Iterator;
import java.util.Set;

public class ValueSetTest {

  @Test public void of() {
    assertSame(ValueSet.EMPTY, vs());
    assertEquals(0x24L, vs(2, 5).bits);
    assertEquals(vs(0, 63), ValueSet.copyOf(ImmutableList.of(63, 0)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void ofOutOfRange() {
    vs(64);
  }

  @Test public void range() {
    assertEquals(vs(3, 4, 5), ValueSet.range(3, 5));
    assertEquals(vs(0, 1), ValueSet.range(-4, 1));
    assertEquals(vs(62, 63), ValueSet.range(62, 100));
    assertEquals(64, ValueSet.range(0, 63).size());
    assertSame(ValueSet.EMPTY, ValueSet.range(5, 4));
    assertSame(ValueSet.EMPTY, ValueSet.range(64, 70));
  }

  @Test public void setOperations() {
    assertEquals(vs(4, 5), vs(3, 4, 5).and(vs(4, 5, 6)));
    assertEquals(vs(1, 2, 3), vs(1, 2).or(vs(1, 3)));
    assertEquals(vs(2, 3), vs(1, 2, 3, 8).minus(vs(1, 8)));
    assertTrue(vs(1, 2).isSubsetOf(vs(1, 2, 3)));
    assertFalse(vs(1, 4).isSubsetOf(vs(1, 2, 3)));
  }

  @Test public void queries() {
    ValueSet set = vs(3, 17, 63);
    assertTrue(set.contains(17));
    assertFalse(set.contains(16));
    assertFalse(set.contains(-1));
    assertFalse(set.contains(64));
    assertFalse(set.contains("17"));
    assertEquals(3, set.min());
    assertEquals(63, set.max());
    assertFalse(set.isSingleton());
    assertTrue(vs(9).isSingleton());
    assertFalse(vs().isSingleton());
    assertTrue(vs().isEmpty());
  }

  @Test public void iterator() {
    Iterator<Integer> it = vs(40, 2, 9).iterator();
    assertEquals(2, (int) it.next());
    assertEquals(9, (int) it.next());
    assertEquals(40, (int) it.next());
    assertFalse(it.hasNext());
  }

  @Test public void equals() {
    Set<Integer> hashSet = Sets.newHashSet(2, 4, 6);
    ValueSet set = vs(2, 4, 6);
    assertEquals(set, hashSet);
    assertEquals(hashSet, set);
    assertEquals(set.hashCode(), hashSet.hashCode());
    assertFalse(vs(1, 2, 3).equals(vs(1, 2)));
  }
}
