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
package us.blanshard.crossword.format;

import static java.nio.charset.StandardCharsets.UTF_8;

import us.blanshard.crossword.core.Crossword;
import us.blanshard.crossword.core.Direction;
import us.blanshard.crossword.core.Slot;

import com.google.common.io.Files;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.File;
import java.io.IOException;
import java.util.Map;

/**
 * Static methods that convert solved crosswords to json.
 *
 * @author Luke Blanshard
 */
public class CrosswordJson {

  /** Reads and writes slots as objects with row, column, direction and length. */
  public static final TypeAdapter<Slot> SLOT_ADAPTER = new TypeAdapter<Slot>() {
    @Override public void write(JsonWriter out, Slot value) throws IOException {
      out.beginObject();
      out.name("row").value(value.row);
      out.name("column").value(value.column);
      out.name("direction").value(value.direction.name());
      out.name("length").value(value.length);
      out.endObject();
    }
    @Override public Slot read(JsonReader in) throws IOException {
      int row = -1, column = -1, length = 0;
      Direction direction = null;
      in.beginObject();
      while (in.hasNext()) {
        String name = in.nextName();
        if (name.equals("row")) {
          row = in.nextInt();
        } else if (name.equals("column")) {
          column = in.nextInt();
        } else if (name.equals("direction")) {
          direction = Direction.valueOf(in.nextString());
        } else if (name.equals("length")) {
          length = in.nextInt();
        } else {
          in.skipValue();
        }
      }
      in.endObject();
      return Slot.of(row, column, direction, length);
    }
  };

  /** A convenience for reading/writing crosswords. */
  public static final Gson GSON = register(new GsonBuilder()).setPrettyPrinting().create();

  /**
   * Registers type adapters in the given builder so that slots can be
   * serialized and deserialized.
   */
  public static GsonBuilder register(GsonBuilder builder) {
    return builder.registerTypeAdapter(Slot.class, SLOT_ADAPTER);
  }

  /**
   * Describes the crossword and the words assigned to it: the grid's
   * dimensions, its rows with blocked cells as hashes and unfilled open cells
   * as underscores, and each slot with its word.
   */
  public static JsonObject toJson(Crossword crossword, Map<Slot, String> words) {
    LetterGrid letters = LetterGrid.of(crossword, words);
    JsonObject object = new JsonObject();
    object.addProperty("height", crossword.height);
    object.addProperty("width", crossword.width);

    JsonArray rows = new JsonArray();
    for (int i = 0; i < crossword.height; ++i) {
      StringBuilder sb = new StringBuilder();
      for (int j = 0; j < crossword.width; ++j) {
        Character c = letters.get(i, j);
        if (c != null) sb.append(c.charValue());
        else sb.append(crossword.isOpen(i, j) ? Crossword.OPEN : '#');
      }
      rows.add(new JsonPrimitive(sb.toString()));
    }
    object.add("rows", rows);

    JsonArray slots = new JsonArray();
    for (Slot slot : crossword.slots()) {
      JsonObject slotObject = GSON.toJsonTree(slot, Slot.class).getAsJsonObject();
      String word = words.get(slot);
      if (word != null) slotObject.addProperty("word", word);
      slots.add(slotObject);
    }
    object.add("slots", slots);
    return object;
  }

  /** Writes {@link #toJson} to the given file. */
  public static void write(Crossword crossword, Map<Slot, String> words, File file)
      throws IOException {
    Files.asCharSink(file, UTF_8).write(GSON.toJson(toJson(crossword, words)) + "\n");
  }
}
