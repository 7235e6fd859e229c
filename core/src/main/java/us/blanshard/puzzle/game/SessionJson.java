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
package us.blanshard.puzzle.game;

import com.google.common.reflect.TypeToken;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.Collections;
import java.util.List;

import javax.annotation.Nullable;

/**
 * Static methods that convert session histories to and from json.  Each edit
 * is a short array: {@code ["set", "a", 3]}, {@code ["clear", "a"]} or
 * {@code ["undo", "a"]}.
 *
 * @author Luke Blanshard
 */
public class SessionJson {

  /** A Type to use with {@link Gson} for session histories. */
  @SuppressWarnings("serial")
  public static final Type HISTORY_TYPE = new TypeToken<List<Edit>>(){}.getType();

  /** A convenience for reading/writing history. */
  public static final Gson HISTORY_GSON = registerHistory(new GsonBuilder()).create();

  /**
   * Registers type adapters in the given builder so that history lists can be
   * serialized and deserialized.
   */
  public static GsonBuilder registerHistory(GsonBuilder builder) {
    builder.registerTypeHierarchyAdapter(Edit.class, new TypeAdapter<Edit>() {
      @Override public void write(JsonWriter out, Edit value) throws IOException {
        out.beginArray();
        if (value instanceof Edit.Set) {
          out.value("set").value(value.variableId).value(((Edit.Set) value).value);
        } else if (value instanceof Edit.Clear) {
          out.value("clear").value(value.variableId);
        } else if (value instanceof Edit.Undo) {
          out.value("undo").value(value.variableId);
        } else {
          throw new AssertionError(value);
        }
        out.endArray();
      }
      @Override public Edit read(JsonReader in) throws IOException {
        in.beginArray();
        String kind = in.nextString();
        String variableId = in.nextString();
        Edit edit;
        if (kind.equals("set")) {
          int value;
          try {
            value = in.nextInt();
          } catch (NumberFormatException e) {
            throw new JsonParseException("Bad edit value for " + variableId, e);
          }
          try {
            edit = new Edit.Set(variableId, value);
          } catch (IllegalArgumentException e) {
            throw new JsonParseException("Bad edit value " + value + " for " + variableId, e);
          }
        } else if (kind.equals("clear")) {
          edit = new Edit.Clear(variableId);
        } else if (kind.equals("undo")) {
          edit = new Edit.Undo(variableId);
        } else {
          throw new JsonParseException("Unrecognized edit kind " + kind);
        }
        in.endArray();
        return edit;
      }
    });
    return builder;
  }

  /** Renders the given history as json. */
  public static String toJson(List<Edit> history) {
    return HISTORY_GSON.toJson(history, HISTORY_TYPE);
  }

  /**
   * Parses a history rendered by {@link #toJson}.  Null yields an empty
   * history.
   *
   * @throws JsonParseException if the json is not a well-formed history
   */
  public static List<Edit> toHistory(@Nullable String json) {
    if (json == null) return Collections.<Edit>emptyList();
    List<Edit> history = HISTORY_GSON.fromJson(json, HISTORY_TYPE);
    return history == null ? Collections.<Edit>emptyList() : history;
  }

  // Static methods only.
  private SessionJson() {}
}
