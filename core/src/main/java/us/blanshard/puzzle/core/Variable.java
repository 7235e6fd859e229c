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

import javax.annotation.concurrent.Immutable;

/**
 * A fillable slot in a puzzle, usually a grid cell.  Variables are created by
 * {@link Puzzle} and are only meaningful within it.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Variable implements Comparable<Variable> {

  /** The loader's stable identifier for this variable. */
  public final String id;

  /**
   * A number in the range [0, puzzle size).  Index order matches identifier
   * order.
   */
  public final int index;

  /** The values legal for this variable when the puzzle starts; never empty. */
  public final ValueSet domain;

  Variable(String id, int index, ValueSet domain) {
    this.id = id;
    this.index = index;
    this.domain = domain;
  }

  @Override public int compareTo(Variable that) {
    return this.index - that.index;
  }

  @Override public String toString() {
    return id;
  }
}
