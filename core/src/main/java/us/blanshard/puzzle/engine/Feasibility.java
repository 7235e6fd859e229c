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
package us.blanshard.puzzle.engine;

/**
 * The answer to "can the current state still be completed?".
 *
 * @author Luke Blanshard
 */
public enum Feasibility {
  /** At least one completion satisfies every constraint. */
  FEASIBLE,
  /** The whole search space was exhausted without finding a completion. */
  INFEASIBLE,
  /** The search hit its node ceiling before it could tell. */
  INCONCLUSIVE;
}
