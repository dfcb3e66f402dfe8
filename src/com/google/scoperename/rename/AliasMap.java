/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.scoperename.rename;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Files;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.io.File;
import java.io.IOException;
import java.text.ParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Every alias minted during one rename, in minting order.
 *
 * <p>An original name maps to one alias per frame that bound it, so it may have several; every
 * alias belongs to exactly one original name.
 */
public final class AliasMap {

  private static final char SEPARATOR = ':';

  /** Maps original names to their aliases, in minting order. */
  private final ImmutableListMultimap<String, String> aliases;

  private final ImmutableMap<String, String> originalNames;

  private AliasMap(ImmutableListMultimap<String, String> aliases) {
    this.aliases = aliases;
    Map<String, String> inverse = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : aliases.entries()) {
      inverse.putIfAbsent(entry.getValue(), entry.getKey());
    }
    this.originalNames = ImmutableMap.copyOf(inverse);
  }

  static Builder builder() {
    return new Builder();
  }

  /** Returns the aliases minted for {@code originalName}, oldest first. */
  public ImmutableList<String> getAliases(String originalName) {
    return aliases.get(originalName);
  }

  /** Given an alias, looks up the name it replaced; null if it is not an alias of this run. */
  public @Nullable String lookupOriginalName(String alias) {
    return originalNames.get(alias);
  }

  public ImmutableListMultimap<String, String> getOriginalNameToAliasesMap() {
    return aliases;
  }

  public ImmutableMap<String, String> getAliasToOriginalNameMap() {
    return originalNames;
  }

  public int size() {
    return aliases.size();
  }

  public boolean isEmpty() {
    return aliases.isEmpty();
  }

  /** Saves the alias map to a file. */
  public void save(String filename) throws IOException {
    Files.write(toBytes(), new File(filename));
  }

  /** Reads an alias map from a file written via {@link #save(String)}. */
  public static AliasMap load(String filename) throws IOException {
    try {
      return fromBytes(Files.toByteArray(new File(filename)));
    } catch (ParseException e) {
      throw new IOException(e);
    }
  }

  /** Serializes the map as one {@code original:alias} line per minted alias. */
  public byte[] toBytes() {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, String> entry : aliases.entries()) {
      sb.append(escape(entry.getKey()));
      sb.append(SEPARATOR);
      sb.append(escape(entry.getValue()));
      sb.append('\n');
    }
    return sb.toString().getBytes(UTF_8);
  }

  /** Deserializes an alias map from a byte array returned by {@link #toBytes()}. */
  public static AliasMap fromBytes(byte[] bytes) throws ParseException {
    String string = new String(bytes, UTF_8);
    Builder builder = builder();
    int startOfLine = 0;
    while (startOfLine < string.length()) {
      int newLine = string.indexOf('\n', startOfLine);
      if (newLine == -1) {
        newLine = string.length();
      }
      int endOfLine = newLine;
      if (newLine > startOfLine && string.charAt(newLine - 1) == '\r') {
        newLine--;
      }
      String line = string.substring(startOfLine, newLine);
      startOfLine = endOfLine + 1;
      if (line.isEmpty()) {
        continue;
      }
      int pos = findIndexOfUnescapedChar(line, SEPARATOR);
      if (pos <= 0 || pos == line.length() - 1) {
        throw new ParseException("Bad line: " + line, startOfLine);
      }
      builder.add(unescape(line.substring(0, pos)), unescape(line.substring(pos + 1)));
    }
    return builder.build();
  }

  /**
   * Returns the map as JSON: {@code {"aliases":[{"original":"x","alias":"nA1b2C3d4"}, ...]}}.
   */
  public String toJson() {
    JsonArray entries = new JsonArray();
    for (Map.Entry<String, String> entry : aliases.entries()) {
      JsonObject json = new JsonObject();
      json.addProperty("original", entry.getKey());
      json.addProperty("alias", entry.getValue());
      entries.add(json);
    }
    JsonObject root = new JsonObject();
    root.add("aliases", entries);
    return new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create().toJson(root);
  }

  private static String escape(String value) {
    return value.replace("\\", "\\\\").replace(":", "\\:").replace("\n", "\\n");
  }

  private static int findIndexOfUnescapedChar(String value, char stopChar) {
    int len = value.length();
    for (int i = 0; i < len; ) {
      int stopCharIndex = value.indexOf(stopChar, i);
      if (stopCharIndex == -1) {
        return -1;
      }
      if (stopCharIndex == 0 || value.charAt(stopCharIndex - 1) != '\\') {
        return stopCharIndex;
      }
      i = stopCharIndex + 1;
    }
    return -1;
  }

  private static String unescape(String value) {
    int slashIndex = value.indexOf('\\');
    if (slashIndex == -1) {
      return value;
    }
    StringBuilder sb = new StringBuilder(value.length() - 1);
    sb.append(value, 0, slashIndex);
    int len = value.length();
    for (int i = slashIndex; i < len; i++) {
      char c = value.charAt(i);
      if (c == '\\' && ++i < len) {
        c = value.charAt(i);
        if (c == 'n') {
          c = '\n';
        }
      }
      sb.append(c);
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return aliases.toString();
  }

  /** Collects aliases as they are minted. */
  static final class Builder {
    private final ImmutableListMultimap.Builder<String, String> aliases =
        ImmutableListMultimap.builder();

    private Builder() {}

    @CanIgnoreReturnValue
    Builder add(String originalName, String alias) {
      aliases.put(originalName, alias);
      return this;
    }

    AliasMap build() {
      return new AliasMap(aliases.build());
    }
  }
}
