/*
 * Copyright 2025 The hdl-lower Authors
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

package org.hdllower.graph;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;
import org.hdllower.diag.SourceLocation;
import org.jspecify.annotations.Nullable;

/**
 * A Node is an element of a design graph. Every Node is created by (and registered in) a {@link
 * Netlist}, which serves as an arena: each node gets a sequential {@link #id} that is never reused,
 * and the Netlist can find every node that has not yet been destroyed.
 *
 * <p>Nodes form a tree through their {@link #children} lists, with a backlink from each child to
 * its {@link #parent}. Ownership is explicit:
 *
 * <ul>
 *   <li>a newly created node is <i>detached</i> (it has no parent);
 *   <li>linking a detached node into a parent transfers ownership to that parent;
 *   <li>{@link #unlink} detaches a node, returning a {@link Relinker} that can put other nodes in
 *       its place; and
 *   <li>a detached node must eventually be either linked again or passed to {@link
 *       Netlist#destroy}, which destroys it and all its descendants.
 * </ul>
 *
 * {@link Netlist#check} verifies that these rules were followed, i.e. that no node is left
 * detached.
 *
 * <p>Some nodes also refer to other nodes without owning them (e.g. a {@link VarRef} refers to the
 * {@link VarScope} it reads or writes); those references are not part of the tree.
 */
public abstract class Node {
  /** Assigned sequentially by the Netlist; never changes and is never reused. */
  public final int id;

  private final NodeKind kind;

  final Netlist netlist;

  private final SourceLocation location;

  private @Nullable Node parent;

  /** The nodes owned by this one, in order. */
  final ArrayList<Node> children = new ArrayList<>();

  private boolean destroyed;

  Node(Netlist netlist, NodeKind kind, SourceLocation location) {
    this.netlist = netlist;
    this.kind = kind;
    this.location = location;
    this.id = netlist.register(this);
  }

  /** Only used to construct the Netlist, which is its own arena and always has id zero. */
  Node(SourceLocation location) {
    this.netlist = (Netlist) this;
    this.kind = NodeKind.NETLIST;
    this.location = location;
    this.id = 0;
  }

  public final NodeKind kind() {
    return kind;
  }

  public final SourceLocation location() {
    return location;
  }

  public final Netlist netlist() {
    return netlist;
  }

  /** The node that owns this one, or null if this node is detached (or is the Netlist). */
  public final @Nullable Node parent() {
    return parent;
  }

  public final boolean isLinked() {
    return parent != null;
  }

  public final boolean isDestroyed() {
    return destroyed;
  }

  /** An unmodifiable view of this node's children. */
  public final List<Node> children() {
    return Collections.unmodifiableList(children);
  }

  final Node child(int i) {
    return children.get(i);
  }

  /** Returns the position of {@code child} in this node's children. */
  final int indexOf(Node child) {
    for (int i = 0; i < children.size(); i++) {
      if (children.get(i) == child) {
        return i;
      }
    }
    throw new GraphInvariantException(
        String.format("#%s is not a child of its parent #%s", child.id, id));
  }

  /** Appends a detached node to this node's children. */
  final void link(Node child) {
    link(children.size(), child);
  }

  /** Inserts a detached node into this node's children at the given position. */
  final void link(int pos, Node child) {
    Invariants.checkLive(this);
    Invariants.checkLive(child);
    Invariants.check(child.netlist == netlist, "#%s belongs to a different netlist", child.id);
    Invariants.check(
        child.parent == null && child.kind != NodeKind.NETLIST,
        "Cannot link #%s (%s), it is already linked",
        child.id,
        child.kind);
    child.parent = this;
    children.add(pos, child);
  }

  /** Returns the children of this node that are instances of {@code type}. */
  final <T extends Node> ImmutableList<T> childrenOf(Class<T> type) {
    ImmutableList.Builder<T> builder = ImmutableList.builder();
    for (Node child : children) {
      if (type.isInstance(child)) {
        builder.add(type.cast(child));
      }
    }
    return builder.build();
  }

  /**
   * Inserts a detached node immediately after this one, i.e. as the next sibling. Nodes inserted by
   * successive calls on the same node end up in reverse order, so to insert a sequence call this on
   * the most recently inserted node.
   */
  public final void addNextHere(Node next) {
    Invariants.check(parent != null, "#%s (%s) has no parent to insert into", id, kind);
    parent.link(parent.indexOf(this) + 1, next);
  }

  /**
   * Detaches this node from its parent. The returned Relinker can be used to insert replacement
   * nodes at the same position; it must be used before any other change to the parent's children.
   */
  @CanIgnoreReturnValue
  public final Relinker unlink() {
    Invariants.checkLive(this);
    Invariants.check(parent != null, "Cannot unlink #%s (%s), it has no parent", id, kind);
    Node prev = parent;
    int pos = prev.indexOf(this);
    prev.children.remove(pos);
    parent = null;
    return new Relinker(prev, pos);
  }

  /**
   * Puts {@code replacement} (which must be detached) in this node's place. This node is left
   * detached; the caller is responsible for destroying or relinking it.
   */
  public final void replaceWith(Node replacement) {
    unlink().relink(replacement);
  }

  /** Returns a detached deep copy of this node and its descendants. */
  public Node cloneTree() {
    Invariants.checkLive(this);
    Node copy = copyNode();
    for (Node child : children) {
      copy.link(child.cloneTree());
    }
    return copy;
  }

  /** Returns a new detached node identical to this one but without any children. */
  abstract Node copyNode();

  /**
   * Calls {@code visitor} on this node and then, if it returns true, recursively on each child.
   * The children are enumerated from a snapshot taken before any of them are visited, so the
   * visitor may replace the node it is given. Nodes that have been destroyed by the time they would
   * be visited are skipped, and nodes inserted among the children are not visited.
   */
  public final void walk(Predicate<Node> visitor) {
    if (visitor.test(this)) {
      for (Node child : ImmutableList.copyOf(children)) {
        if (!child.destroyed) {
          child.walk(visitor);
        }
      }
    }
  }

  /** Returns all nodes in this subtree (including this one) of the given type, in pre-order. */
  public final <T extends Node> ImmutableList<T> collect(Class<T> type) {
    ImmutableList.Builder<T> builder = ImmutableList.builder();
    walk(
        node -> {
          if (type.isInstance(node)) {
            builder.add(type.cast(node));
          }
          return true;
        });
    return builder.build();
  }

  /** Called by {@link Netlist#check}; subclasses verify their non-owning references. */
  void checkReferences() {}

  /** Marks this node and all its descendants as destroyed and removes them from the arena. */
  final void destroyTree() {
    for (Node child : children) {
      child.parent = null;
      child.destroyTree();
    }
    children.clear();
    destroyed = true;
    netlist.forget(this);
  }

  /**
   * Returns a multi-line listing of this subtree. Statements are printed on a single line, with
   * their expressions inline.
   */
  public final String dump() {
    StringBuilder sb = new StringBuilder();
    dump(this, 0, sb);
    return sb.toString();
  }

  private static void dump(Node node, int depth, StringBuilder sb) {
    sb.append("  ".repeat(depth)).append(node).append('\n');
    if (!(node instanceof Statement)) {
      for (Node child : node.children) {
        dump(child, depth + 1, sb);
      }
    }
  }
}
