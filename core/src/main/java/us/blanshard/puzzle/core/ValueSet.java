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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.AbstractSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

/**
 * An immutable set of small non-negative values, usually used to keep track of
 * the possible values for a given puzzle variable.  Values run from 0 to
 * {@link #MAX_VALUE}; loaders map symbol alphabets onto that range.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class ValueSet extends AbstractSet<Integer> implements Set<Integer> {

  /** The largest value a set can hold. */
  public static final int MAX_VALUE = 63;

  public static final ValueSet EMPTY = new ValueSet(0L);

  /** The values in this set expressed as a bit set. */
  public final long bits;

  private ValueSet(long bits) {
    this.bits = bits;
  }

  /** Returns the set corresponding to the given bit set. */
  public static ValueSet ofBits(long bits) {
    return bits == 0 ? EMPTY : new ValueSet(bits);
  }

  /** Returns the set containing the given values. */
  public static ValueSet of(int... values) {
    long bits = 0;
    for (int value : values)
      bits |= bit(value);
    return ofBits(bits);
  }

  /** Returns the set containing the given values. */
  public static ValueSet copyOf(Iterable<Integer> values) {
    if (values instanceof ValueSet) return (ValueSet) values;
    long bits = 0;
    for (Integer value : values)
      bits |= bit(value);
    return ofBits(bits);
  }

  /**
   * Returns the set of values from min to max, inclusive, clipped to the legal
   * range.  Returns the empty set if min exceeds max.
   */
  public static ValueSet range(int min, int max) {
    min = Math.max(min, 0);
    max = Math.min(max, MAX_VALUE);
    if (min > max) return EMPTY;
    long upTo = max == MAX_VALUE ? -1L : (1L << (max + 1)) - 1;
    return ofBits(upTo & (-1L << min));
  }

  /** Tells whether the given value may be placed in a set. */
  public static boolean isValidValue(int value) {
    return value >= 0 && value <= MAX_VALUE;
  }

  /** Returns the bit corresponding to the given value. */
  public static long bit(int value) {
    checkArgument(isValidValue(value), "Value out of range: %s", value);
    return 1L << value;
  }

  /** Returns the intersection of this set and another one. */
  public ValueSet and(ValueSet that) {
    return ofBits(this.bits & that.bits);
  }

  /** Returns the union of this set and another one. */
  public ValueSet or(ValueSet that) {
    return ofBits(this.bits | that.bits);
  }

  /** Returns the asymmetric difference of this set and another one. */
  public ValueSet minus(ValueSet that) {
    return ofBits(this.bits & ~that.bits);
  }

  /** Tells whether every value in this set is also in the given one. */
  public boolean isSubsetOf(ValueSet that) {
    return (this.bits & ~that.bits) == 0;
  }

  public boolean contains(int value) {
    return isValidValue(value) && (bits & (1L << value)) != 0;
  }

  @Override public boolean contains(Object o) {
    if (o instanceof Integer) {
      return contains(((Integer) o).intValue());
    }
    return false;
  }

  /** Returns the smallest value in this set. */
  public int min() {
    if (bits == 0) throw new NoSuchElementException();
    return Long.numberOfTrailingZeros(bits);
  }

  /** Returns the largest value in this set. */
  public int max() {
    if (bits == 0) throw new NoSuchElementException();
    return MAX_VALUE - Long.numberOfLeadingZeros(bits);
  }

  /** Tells whether this set holds exactly one value. */
  public boolean isSingleton() {
    return bits != 0 && (bits & (bits - 1)) == 0;
  }

  @Override public boolean isEmpty() {
    return bits == 0;
  }

  @Override public int size() {
    return Long.bitCount(bits);
  }

  /** Iterates the values in ascending order. */
  @Override public Iterator<Integer> iterator() {
    return new Iter(bits);
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o instanceof ValueSet) return bits == ((ValueSet) o).bits;
    return super.equals(o);
  }

  @Override public int hashCode() {
    // Must match Set's contract.
    int answer = 0;
    for (long rest = bits; rest != 0; rest &= rest - 1)
      answer += Long.numberOfTrailingZeros(rest);
    return answer;
  }

  private static class Iter implements Iterator<Integer> {
    private long rest;

    Iter(long bits) {
      this.rest = bits;
    }

    @Override public boolean hasNext() {
      return rest != 0;
    }

    @Override public Integer next() {
      if (rest == 0) throw new NoSuchElementException();
      int value = Long.numberOfTrailingZeros(rest);
      rest &= rest - 1;
      return value;
    }

    @Override public void remove() {
      throw new UnsupportedOperationException();
    }
  }
}
