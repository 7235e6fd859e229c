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

/**
 * The verdict of {@link Constraint#check} on a possibly partial assignment.
 *
 * @author Luke Blanshard
 */
public enum Satisfaction {
  /** Every variable in scope is assigned and the rule holds. */
  SATISFIED,
  /** The assigned values already break the rule. */
  VIOLATED,
  /** Not enough of the scope is assigned to tell. */
  UNDETERMINED;
}
