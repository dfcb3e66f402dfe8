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

package com.google.scoperename.ast;

import com.google.common.base.Ascii;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.util.Map;

/**
 * Converts syntax trees to and from JSON.
 *
 * <p>Each node becomes an object:
 *
 * <pre>{@code
 * {"token": "NAME", "string": "x", "props": {"context": "LOAD"}, "line": 1, "col": 0,
 *  "children": [...]}
 * }</pre>
 *
 * <p>Only {@code token} is required. Property keys are the lower-cased {@link Node.Prop} names.
 */
public final class AstJson {

  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();
  private static final Gson PRETTY_GSON =
      new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();

  private AstJson() {}

  public static String toJson(Node root) {
    return GSON.toJson(toJsonTree(root));
  }

  public static String toPrettyJson(Node root) {
    return PRETTY_GSON.toJson(toJsonTree(root));
  }

  public static JsonObject toJsonTree(Node n) {
    JsonObject json = new JsonObject();
    json.addProperty("token", n.getToken().name());
    if (n.hasString()) {
      json.addProperty("string", n.getString());
    }
    if (n.getLineno() != -1) {
      json.addProperty("line", n.getLineno());
      json.addProperty("col", n.getCharno());
    }
    Map<Node.Prop, Object> props = n.getProps();
    if (!props.isEmpty()) {
      JsonObject jsonProps = new JsonObject();
      for (Map.Entry<Node.Prop, Object> entry : props.entrySet()) {
        String key = Ascii.toLowerCase(entry.getKey().name());
        Object value = entry.getValue();
        if (value instanceof Boolean) {
          jsonProps.addProperty(key, (Boolean) value);
        } else if (value instanceof Integer) {
          jsonProps.addProperty(key, (Integer) value);
        } else {
          jsonProps.addProperty(key, value.toString());
        }
      }
      json.add("props", jsonProps);
    }
    if (n.hasChildren()) {
      JsonArray children = new JsonArray();
      for (Node child : n.children()) {
        children.add(toJsonTree(child));
      }
      json.add("children", children);
    }
    return json;
  }

  /**
   * Reads a tree written by {@link #toJson}.
   *
   * @throws JsonParseException if the text is not JSON or does not describe a tree
   */
  public static Node fromJson(String json) {
    JsonElement element = JsonParser.parseString(json);
    return fromJsonTree(element);
  }

  /**
   * Reads a module written by {@link #toJson} and checks its layout with {@link AstValidator}.
   *
   * @throws JsonParseException if the text is not JSON, does not describe a tree, or the tree is
   *     not a well-formed module
   */
  public static Node moduleFromJson(String json) {
    Node root = fromJson(json);
    if (root.getToken() != Token.MODULE) {
      throw new JsonParseException("Expected a MODULE root but was " + root.getToken());
    }
    new AstValidator(
            (message, n) -> {
              throw new JsonParseException(message + ": " + n);
            })
        .validateModule(root);
    return root;
  }

  public static Node fromJsonTree(JsonElement element) {
    if (!element.isJsonObject()) {
      throw new JsonParseException("Expected a node object, found: " + element);
    }
    JsonObject json = element.getAsJsonObject();
    JsonElement tokenElement = json.get("token");
    if (tokenElement == null) {
      throw new JsonParseException("Node without token: " + json);
    }
    Optional<Token> token = Enums.getIfPresent(Token.class, tokenElement.getAsString());
    if (!token.isPresent()) {
      throw new JsonParseException("Unknown token: " + tokenElement.getAsString());
    }
    Node n = new Node(token.get());
    if (json.has("string")) {
      if (!token.get().hasString()) {
        throw new JsonParseException(token.get() + " does not carry a string");
      }
      n.setString(json.get("string").getAsString());
    }
    if (json.has("line")) {
      int col = json.has("col") ? json.get("col").getAsInt() : -1;
      n.setSourcePosition(json.get("line").getAsInt(), col);
    }
    if (json.has("props")) {
      for (Map.Entry<String, JsonElement> entry : json.getAsJsonObject("props").entrySet()) {
        readProp(n, entry.getKey(), entry.getValue());
      }
    }
    if (json.has("children")) {
      for (JsonElement child : json.getAsJsonArray("children")) {
        n.addChildToBack(fromJsonTree(child));
      }
    }
    return n;
  }

  private static void readProp(Node n, String key, JsonElement value) {
    Optional<Node.Prop> prop = Enums.getIfPresent(Node.Prop.class, Ascii.toUpperCase(key));
    if (!prop.isPresent()) {
      throw new JsonParseException("Unknown property: " + key);
    }
    switch (prop.get()) {
      case CONTEXT:
        n.putProp(Node.Prop.CONTEXT, readEnum(ExprContext.class, value));
        break;
      case PARAM_KIND:
        n.putProp(Node.Prop.PARAM_KIND, readEnum(ParamKind.class, value));
        break;
      case ASNAME:
        n.putProp(Node.Prop.ASNAME, value.getAsString());
        break;
      case ASYNC:
        n.putBooleanProp(Node.Prop.ASYNC, value.getAsBoolean());
        break;
      case LEVEL:
        n.putIntProp(Node.Prop.LEVEL, value.getAsInt());
        break;
    }
  }

  private static <E extends Enum<E>> E readEnum(Class<E> type, JsonElement value) {
    Optional<E> result = Enums.getIfPresent(type, value.getAsString());
    if (!result.isPresent()) {
      throw new JsonParseException(
          "Unknown " + type.getSimpleName() + ": " + value.getAsString());
    }
    return result.get();
  }
}
