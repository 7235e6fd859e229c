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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import java.util.Arrays;
import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * An immutable partial mapping from a puzzle's variables to values.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Assignment {

  /** Stands in for "no value" where an int is required. */
  public static final int UNSET = -1;

  private final int[] values;
  private final int count;

  private Assignment(int[] values, int count) {
    this.values = values;
    this.count = count;
  }

  /** Returns an assignment for the given puzzle with nothing assigned. */
  public static Assignment empty(Puzzle puzzle) {
    return empty(puzzle.size());
  }

  static Assignment empty(int size) {
    int[] values = new int[size];
    Arrays.fill(values, UNSET);
    return new Assignment(values, 0);
  }

  /** Makes an assignment from a full array of values. */
  static Assignment ofValues(int[] values) {
    int count = 0;
    for (int value : values)
      if (value != UNSET) ++count;
    return new Assignment(values, count);
  }

  public boolean isAssigned(Variable variable) {
    return values[variable.index] != UNSET;
  }

  /** Returns the value assigned to the given variable, or {@link #UNSET}. */
  public int getOrUnset(Variable variable) {
    return values[variable.index];
  }

  /** Returns the value assigned to the given variable, which must be assigned. */
  public int get(Variable variable) {
    int value = values[variable.index];
    checkState(value != UNSET, "%s is not assigned", variable);
    return value;
  }

  /** The number of variables assigned. */
  public int size() {
    return count;
  }

  /** Tells whether every variable has a value. */
  public boolean isComplete() {
    return count == values.length;
  }

  /** Returns a copy of this assignment with the given variable set. */
  public Assignment with(Variable variable, int value) {
    checkArgument(ValueSet.isValidValue(value), "Value out of range: %s", value);
    if (values[variable.index] == value) return this;
    int[] copy = values.clone();
    copy[variable.index] = value;
    return new Assignment(copy, values[variable.index] == UNSET ? count + 1 : count);
  }

  /** Returns a copy of this assignment with the given variable unset. */
  public Assignment without(Variable variable) {
    if (values[variable.index] == UNSET) return this;
    int[] copy = values.clone();
    copy[variable.index] = UNSET;
    return new Assignment(copy, count - 1);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Assignment)) return false;
    return Arrays.equals(values, ((Assignment) o).values);
  }

  @Override public int hashCode() {
    return Arrays.hashCode(values);
  }

  @Override public String toString() {
    List<String> parts = Lists.newArrayList();
    for (int i = 0; i < values.length; ++i)
      if (values[i] != UNSET) parts.add(i + "=" + values[i]);
    return "{" + Joiner.on(", ").join(parts) + "}";
  }
}
