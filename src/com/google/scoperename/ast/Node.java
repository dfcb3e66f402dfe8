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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import java.io.IOException;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A node of the syntax tree.
 *
 * <p>Children are kept in a singly linked list owned by the node. Nodes hold no reference to their
 * parent, so a tree is always walked from its root down; a node may be attached to at most one
 * parent.
 */
public final class Node {

  /** Typed annotations a node may carry besides its string payload. */
  public enum Prop {
    /** {@link ExprContext} of a NAME, ATTRIBUTE, SUBSCRIPT, STARRED, TUPLE or LIST. */
    CONTEXT,
    /** {@link ParamKind} of a PARAM. */
    PARAM_KIND,
    /** The {@code as} name of an ALIAS, absent when the import has none. */
    ASNAME,
    /** Boolean: {@code async def}, {@code async for}, {@code async with}. */
    ASYNC,
    /** Integer: number of leading dots of a relative IMPORT_FROM. */
    LEVEL
  }

  private final Token token;
  private @Nullable String string;

  private @Nullable Node first;
  private @Nullable Node last;
  private @Nullable Node next;
  private int childCount;
  private boolean attached;

  private final EnumMap<Prop, Object> props = new EnumMap<>(Prop.class);

  private int lineno = -1;
  private int charno = -1;

  public Node(Token token) {
    this.token = checkNotNull(token);
  }

  public Node(Token token, Node... children) {
    this(token);
    for (Node child : children) {
      addChildToBack(child);
    }
  }

  public static Node newString(Token token, String str) {
    checkArgument(token.hasString(), "%s does not carry a string", token);
    Node n = new Node(token);
    n.string = checkNotNull(str);
    return n;
  }

  public Token getToken() {
    return token;
  }

  // ==========================================================================
  // String payload

  /** Returns the identifier, operator or literal text of this node. */
  public String getString() {
    checkState(string != null, "%s has no string", this);
    return string;
  }

  public @Nullable String getStringOrNull() {
    return string;
  }

  public boolean hasString() {
    return string != null;
  }

  public void setString(String value) {
    checkState(token.hasString(), "%s does not carry a string", token);
    this.string = checkNotNull(value);
  }

  // ==========================================================================
  // Children

  @CanIgnoreReturnValue
  public Node addChildToBack(Node child) {
    checkNotNull(child);
    checkArgument(!child.attached, "%s already has a parent", child);
    checkArgument(child != this);
    child.attached = true;
    if (last == null) {
      first = child;
    } else {
      last.next = child;
    }
    last = child;
    childCount++;
    return this;
  }

  @CanIgnoreReturnValue
  public Node addChildrenToBack(Iterable<Node> children) {
    for (Node child : children) {
      addChildToBack(child);
    }
    return this;
  }

  public @Nullable Node getFirstChild() {
    return first;
  }

  public @Nullable Node getLastChild() {
    return last;
  }

  public @Nullable Node getNext() {
    return next;
  }

  public Node getChildAtIndex(int i) {
    checkElementIndex(i, childCount);
    Node n = first;
    while (i > 0) {
      n = n.next;
      i--;
    }
    return n;
  }

  public int getChildCount() {
    return childCount;
  }

  public boolean hasChildren() {
    return first != null;
  }

  /** Iterates over the direct children of this node, in order. */
  public Iterable<Node> children() {
    return () ->
        new Iterator<Node>() {
          private @Nullable Node current = first;

          @Override
          public boolean hasNext() {
            return current != null;
          }

          @Override
          public Node next() {
            if (current == null) {
              throw new NoSuchElementException();
            }
            Node result = current;
            current = current.next;
            return result;
          }
        };
  }

  // ==========================================================================
  // Properties

  @CanIgnoreReturnValue
  public Node putProp(Prop prop, @Nullable Object value) {
    if (value == null) {
      props.remove(prop);
    } else {
      props.put(prop, value);
    }
    return this;
  }

  public @Nullable Object getProp(Prop prop) {
    return props.get(prop);
  }

  public boolean hasProp(Prop prop) {
    return props.containsKey(prop);
  }

  @CanIgnoreReturnValue
  public Node putBooleanProp(Prop prop, boolean value) {
    return putProp(prop, value ? Boolean.TRUE : null);
  }

  public boolean getBooleanProp(Prop prop) {
    return Boolean.TRUE.equals(props.get(prop));
  }

  @CanIgnoreReturnValue
  public Node putIntProp(Prop prop, int value) {
    return putProp(prop, value == 0 ? null : value);
  }

  public int getIntProp(Prop prop) {
    Object value = props.get(prop);
    return value == null ? 0 : (Integer) value;
  }

  /** Returns the properties set on this node, in declaration order of {@link Prop}. */
  public ImmutableMap<Prop, Object> getProps() {
    return ImmutableMap.copyOf(props);
  }

  public @Nullable ExprContext getContext() {
    return (ExprContext) props.get(Prop.CONTEXT);
  }

  public @Nullable ParamKind getParamKind() {
    return (ParamKind) props.get(Prop.PARAM_KIND);
  }

  public @Nullable String getAsName() {
    return (String) props.get(Prop.ASNAME);
  }

  public void setAsName(@Nullable String asName) {
    checkState(token == Token.ALIAS, this);
    putProp(Prop.ASNAME, asName);
  }

  // ==========================================================================
  // Source position

  @CanIgnoreReturnValue
  public Node setSourcePosition(int lineno, int charno) {
    this.lineno = lineno;
    this.charno = charno;
    return this;
  }

  /** One-indexed line, or -1 when unknown. */
  public int getLineno() {
    return lineno;
  }

  /** Zero-indexed column, or -1 when unknown. */
  public int getCharno() {
    return charno;
  }

  // ==========================================================================
  // Token predicates

  public boolean isName() {
    return token == Token.NAME;
  }

  public boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public boolean isBlock() {
    return token == Token.BLOCK;
  }

  public boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public boolean isComprehension() {
    return token == Token.COMPREHENSION;
  }

  public boolean isKeyword() {
    return token == Token.KEYWORD;
  }

  public boolean isStarred() {
    return token == Token.STARRED;
  }

  public boolean isLoad() {
    return getContext() == ExprContext.LOAD;
  }

  // ==========================================================================
  // Copying and comparison

  /** Returns a deep copy of this subtree, including properties and source positions. */
  @CheckReturnValue
  public Node cloneTree() {
    Node copy = new Node(token);
    copy.string = string;
    copy.props.putAll(props);
    copy.lineno = lineno;
    copy.charno = charno;
    for (Node child = first; child != null; child = child.next) {
      copy.addChildToBack(child.cloneTree());
    }
    return copy;
  }

  /** Whether the two subtrees have the same tokens, strings, properties and shape. */
  public boolean isEquivalentTo(Node other) {
    if (token != other.token
        || childCount != other.childCount
        || !Objects.equals(string, other.string)
        || !props.equals(other.props)) {
      return false;
    }
    for (Node a = first, b = other.first; a != null; a = a.next, b = b.next) {
      if (!a.isEquivalentTo(b)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Whether the two subtrees have the same node kinds and child counts everywhere, ignoring
   * string payloads and properties.
   */
  public boolean isStructurallyEquivalentTo(Node other) {
    if (token != other.token || childCount != other.childCount) {
      return false;
    }
    for (Node a = first, b = other.first; a != null; a = a.next, b = b.next) {
      if (!a.isStructurallyEquivalentTo(b)) {
        return false;
      }
    }
    return true;
  }

  // ==========================================================================
  // Debug output

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (string != null) {
      sb.append(' ');
      sb.append(string);
    }
    if (lineno != -1) {
      sb.append(' ');
      sb.append(lineno);
      sb.append(':');
      sb.append(charno);
    }
    for (Map.Entry<Prop, Object> entry : props.entrySet()) {
      sb.append(" [");
      sb.append(Ascii.toLowerCase(entry.getKey().name()));
      sb.append(": ");
      sb.append(entry.getValue());
      sb.append(']');
    }
    return sb.toString();
  }

  @CheckReturnValue
  public String toStringTree() {
    try {
      StringBuilder s = new StringBuilder();
      appendStringTree(s);
      return s.toString();
    } catch (IOException e) {
      throw new RuntimeException("Should not happen\n" + e);
    }
  }

  public void appendStringTree(Appendable appendable) throws IOException {
    toStringTreeHelper(this, 0, appendable);
  }

  private static void toStringTreeHelper(Node n, int level, Appendable sb) throws IOException {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n.toString());
    sb.append('\n');
    for (Node cursor = n.first; cursor != null; cursor = cursor.next) {
      toStringTreeHelper(cursor, level + 1, sb);
    }
  }
}
