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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Static methods that convert puzzles to and from json.  The json is simply
 * the {@link PuzzleDefinition} field layout, for example:
 *
 * <pre>
 * {"variables": [{"id": "a", "domain": [1, 2]}, {"id": "b", "domain": [1, 2]}],
 *  "constraints": [{"id": "row", "kind": "all_different", "scope": ["a", "b"]}]}
 * </pre>
 *
 * @author Luke Blanshard
 */
public class PuzzleJson {

  /** A convenience for reading and writing puzzle definitions. */
  public static final Gson GSON = new GsonBuilder().create();

  /**
   * Parses and loads the given json.
   *
   * @throws MalformedPuzzleException if the json can't be parsed or describes
   *     a defective puzzle
   */
  public static Puzzle load(String json) throws MalformedPuzzleException {
    PuzzleDefinition definition;
    try {
      definition = GSON.fromJson(json, PuzzleDefinition.class);
    } catch (JsonParseException e) {
      throw new MalformedPuzzleException("Unreadable puzzle json", e);
    }
    return Puzzle.load(definition);
  }

  /** Renders the given puzzle as json that {@link #load} accepts. */
  public static String toJson(Puzzle puzzle) {
    return GSON.toJson(puzzle.toDefinition());
  }

  // Static methods only.
  private PuzzleJson() {}
}
