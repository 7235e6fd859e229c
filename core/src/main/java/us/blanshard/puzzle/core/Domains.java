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

import java.util.Arrays;
import java.util.BitSet;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Keeps track of the candidate values for each of a puzzle's variables, like
 * the pencil marks people write into grid puzzles.
 *
 * <p> The outer class is immutable; has a nested builder.  The builder shares
 * its starting table and only copies it on the first change after a {@link
 * Builder#build}, which makes it cheap to branch a search from a snapshot.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Domains {

  private final long[] bits;

  private Domains(long[] bits) {
    this.bits = bits;
  }

  /** Returns the starting domains of the given variables. */
  static Domains starting(Iterable<Variable> variables, int size) {
    long[] bits = new long[size];
    for (Variable v : variables)
      bits[v.index] = v.domain.bits;
    return new Domains(bits);
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  /** The number of variables covered. */
  public int size() {
    return bits.length;
  }

  /** Returns the candidate values for the given variable. */
  public ValueSet get(Variable variable) {
    return ValueSet.ofBits(bits[variable.index]);
  }

  /** Returns the candidate values for the variable with the given index. */
  public ValueSet get(int index) {
    return ValueSet.ofBits(bits[index]);
  }

  /** Tells whether any variable has no candidates left. */
  public boolean hasEmpty() {
    for (long b : bits)
      if (b == 0) return true;
    return false;
  }

  /** Tells whether every variable is down to a single candidate. */
  public boolean isComplete() {
    for (long b : bits)
      if (b == 0 || (b & (b - 1)) != 0) return false;
    return true;
  }

  /**
   * Tells whether each variable's candidates here are a subset of the same
   * variable's candidates in the given table.
   */
  public boolean isSubsetOf(Domains that) {
    checkArgument(this.bits.length == that.bits.length);
    for (int i = 0; i < bits.length; ++i)
      if ((this.bits[i] & ~that.bits[i]) != 0) return false;
    return true;
  }

  /** Returns the assignment made up of the variables with single candidates. */
  public Assignment toAssignment() {
    int[] values = new int[bits.length];
    for (int i = 0; i < bits.length; ++i) {
      long b = bits[i];
      values[i] = b != 0 && (b & (b - 1)) == 0
          ? Long.numberOfTrailingZeros(b) : Assignment.UNSET;
    }
    return Assignment.ofValues(values);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Domains)) return false;
    return Arrays.equals(bits, ((Domains) o).bits);
  }

  @Override public int hashCode() {
    return Arrays.hashCode(bits);
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder("[");
    for (int i = 0; i < bits.length; ++i) {
      if (i > 0) sb.append(", ");
      sb.append(get(i));
    }
    return sb.append(']').toString();
  }

  /**
   * Narrows candidate domains.  Domains only ever shrink through a builder.
   * Records which variables shrank, for the benefit of propagation, and which
   * emptied.
   */
  @NotThreadSafe
  public static final class Builder {
    private Domains domains;
    private boolean built;
    private final BitSet shrunk = new BitSet();
    private final BitSet emptied = new BitSet();

    private Builder(Domains domains) {
      this.domains = domains;
      this.built = true;
    }

    private Domains domains() {
      if (built) {
        this.domains = new Domains(this.domains.bits.clone());
        this.built = false;
      }
      return this.domains;
    }

    public Domains build() {
      built = true;
      return domains;
    }

    public int size() {
      return domains.size();
    }

    public ValueSet get(Variable variable) {
      return domains.get(variable);
    }

    /**
     * Removes every candidate of the given variable that is not in the
     * allowed set.  Returns false if the variable has no candidates left.
     */
    public boolean restrict(Variable variable, ValueSet allowed) {
      return restrictBits(variable.index, allowed.bits);
    }

    /**
     * Eliminates the given value as a candidate for the given variable.
     * Returns false if the variable has no candidates left.
     */
    public boolean eliminate(Variable variable, int value) {
      return restrictBits(variable.index, ~ValueSet.bit(value));
    }

    /**
     * Narrows the given variable to the single given value.  Returns false if
     * the value was not a candidate.
     */
    public boolean assign(Variable variable, int value) {
      return restrictBits(variable.index, ValueSet.bit(value));
    }

    private boolean restrictBits(int index, long allowed) {
      long old = domains.bits[index];
      long narrowed = old & allowed;
      if (narrowed != old) {
        domains().bits[index] = narrowed;
        shrunk.set(index);
        if (narrowed == 0) emptied.set(index);
      }
      return narrowed != 0;
    }

    /**
     * Returns the indices of the variables that shrank since the last call,
     * and forgets them.
     */
    public BitSet drainShrunk() {
      BitSet answer = (BitSet) shrunk.clone();
      shrunk.clear();
      return answer;
    }

    /** Returns the indices of the variables whose domains have emptied. */
    public BitSet getEmptied() {
      return (BitSet) emptied.clone();
    }
  }
}
