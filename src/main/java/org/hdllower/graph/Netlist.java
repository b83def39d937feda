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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.hdllower.diag.SourceLocation;
import org.jspecify.annotations.Nullable;

/**
 * The root of an elaborated design graph, and the arena that owns all of its nodes.
 *
 * <p>The {@code new*} methods are the only way to create nodes. Each returns a detached node; any
 * operands passed to it must themselves be detached, and become owned by the new node. The caller
 * must eventually link the result into the tree or {@link #destroy} it.
 *
 * <p>A Netlist's children are its {@link Module}s; each Module owns the {@link Var}s it declares
 * and a {@link Scope} for each place it was instantiated.
 */
public final class Netlist extends Node {

  /** Indexed by node id; null for nodes that have been destroyed. */
  private final ArrayList<@Nullable Node> nodes = new ArrayList<>();

  private int numLive;

  /** True if the design contains anything that the force lowering pass needs to process. */
  private boolean hasForceableSignals;

  public Netlist() {
    super(SourceLocation.UNKNOWN);
    nodes.add(this);
    numLive = 1;
  }

  int register(Node node) {
    nodes.add(node);
    numLive++;
    return nodes.size() - 1;
  }

  void forget(Node node) {
    assert nodes.get(node.id) == node;
    nodes.set(node.id, null);
    numLive--;
  }

  /** Returns the node with the given id, or null if it has been destroyed. */
  public @Nullable Node node(int id) {
    return nodes.get(id);
  }

  /** The number of nodes that have been created and not yet destroyed, including the Netlist. */
  public int liveNodeCount() {
    return numLive;
  }

  /** Set when a forceable signal or a force or release statement is created. */
  public boolean hasForceableSignals() {
    return hasForceableSignals;
  }

  public void setHasForceableSignals(boolean hasForceableSignals) {
    this.hasForceableSignals = hasForceableSignals;
  }

  /** Destroys a detached node and all of its descendants. */
  public void destroy(Node node) {
    Invariants.checkLive(node);
    Invariants.check(node.netlist == this, "#%s belongs to a different netlist", node.id);
    Invariants.check(
        node.parent() == null && node != this,
        "Cannot destroy #%s (%s), it is still linked",
        node.id,
        node.kind());
    node.destroyTree();
  }

  public void addModule(Module module) {
    link(module);
  }

  public ImmutableList<Module> modules() {
    return childrenOf(Module.class);
  }

  /** Returns the scope with the given name, or null if there is none. */
  public @Nullable Scope findScope(String name) {
    for (Module module : modules()) {
      for (Scope scope : module.scopes()) {
        if (scope.name.equals(name)) {
          return scope;
        }
      }
    }
    return null;
  }

  /**
   * Verifies the structural invariants of the graph, throwing a {@link GraphInvariantException} if
   * any are violated:
   *
   * <ul>
   *   <li>each child's parent backlink points to the node that lists it;
   *   <li>every live node other than the Netlist is reachable from the Netlist (i.e. no detached
   *       node has been left neither relinked nor destroyed); and
   *   <li>no node refers to a destroyed or detached node.
   * </ul>
   */
  public void check() {
    int reachable = checkSubtree(this);
    for (Node node : nodes) {
      if (node != null && node != this) {
        Invariants.check(
            node.parent() != null,
            "#%s (%s) was detached but never relinked or destroyed",
            node.id,
            node);
      }
    }
    Invariants.check(
        reachable == numLive, "%s nodes reachable, but %s are live", reachable, numLive);
  }

  private static int checkSubtree(Node node) {
    Invariants.checkLive(node);
    node.checkReferences();
    int count = 1;
    for (Node child : node.children) {
      Invariants.check(
          child.parent() == node, "#%s is listed by #%s but not linked to it", child.id, node.id);
      count += checkSubtree(child);
    }
    return count;
  }

  @Override
  Node copyNode() {
    throw new GraphInvariantException("A Netlist cannot be copied");
  }

  @Override
  public String toString() {
    return "netlist";
  }

  // Node factories

  public Module newModule(SourceLocation loc, String name) {
    return new Module(this, loc, name);
  }

  public Scope newScope(SourceLocation loc, String name) {
    return new Scope(this, loc, name);
  }

  public Var newVar(SourceLocation loc, String name, DType dtype, Var.VarKind varKind) {
    return new Var(this, loc, name, dtype, varKind);
  }

  public VarScope newVarScope(SourceLocation loc, Var var) {
    Invariants.checkLive(var);
    return new VarScope(this, loc, var);
  }

  public Active newActive(SourceLocation loc, Active.Sense sense, String name) {
    return new Active(this, loc, sense, name);
  }

  public Assign newAssign(SourceLocation loc, Expr lhs, Expr rhs) {
    return withOperands(new Assign(this, loc), lhs, rhs);
  }

  public AssignW newAssignW(SourceLocation loc, Expr lhs, Expr rhs) {
    return withOperands(new AssignW(this, loc), lhs, rhs);
  }

  public AssignForce newAssignForce(SourceLocation loc, Expr lhs, Expr rhs) {
    hasForceableSignals = true;
    return withOperands(new AssignForce(this, loc), lhs, rhs);
  }

  public Release newRelease(SourceLocation loc, Expr lhs) {
    hasForceableSignals = true;
    return withOperands(new Release(this, loc), lhs);
  }

  public VarRef newVarRef(SourceLocation loc, VarScope varScope, VarRef.Access access) {
    Invariants.checkLive(varScope);
    return new VarRef(this, loc, varScope, access);
  }

  public Const newConst(SourceLocation loc, int width, BigInteger value) {
    Preconditions.checkArgument(width > 0 && value.signum() >= 0);
    return new Const(this, loc, width, value.and(Const.mask(width)));
  }

  public Const newConst(SourceLocation loc, int width, long value) {
    Preconditions.checkArgument(value >= 0);
    return newConst(loc, width, BigInteger.valueOf(value));
  }

  public ArraySel newArraySel(SourceLocation loc, Expr from, Expr index) {
    Preconditions.checkArgument(from.dtype().isUnpacked(), "%s is not an unpacked array", from);
    return withOperands(new ArraySel(this, loc), from, index);
  }

  /** Returns {@code from[index]} with a constant index. */
  public ArraySel newArraySel(SourceLocation loc, Expr from, int index) {
    Objects.checkIndex(index, from.dtype().count());
    return newArraySel(loc, from, newConst(loc, ArraySel.INDEX_WIDTH, index));
  }

  /** Returns {@code from[lsb+width-1:lsb]}. */
  public Sel newSel(SourceLocation loc, Expr from, int lsb, int width) {
    DType dtype = from.dtype();
    Preconditions.checkArgument(
        dtype.kind == DType.Kind.RANGED, "Cannot select bits of %s (%s)", from, dtype);
    Preconditions.checkArgument(lsb >= 0 && width > 0 && lsb + width <= dtype.width());
    return withOperands(new Sel(this, loc, lsb, width), from);
  }

  /** Returns the concatenation of {@code parts}, most significant first. */
  public Concat newConcat(SourceLocation loc, List<? extends Expr> parts) {
    Preconditions.checkArgument(!parts.isEmpty());
    for (Expr part : parts) {
      Preconditions.checkArgument(!part.dtype().isUnpacked(), "Cannot concatenate %s", part);
    }
    return withOperands(new Concat(this, loc), parts.toArray(new Expr[0]));
  }

  public BitOp newAnd(SourceLocation loc, Expr lhs, Expr rhs) {
    return newBinary(NodeKind.AND, loc, lhs, rhs);
  }

  public BitOp newOr(SourceLocation loc, Expr lhs, Expr rhs) {
    return newBinary(NodeKind.OR, loc, lhs, rhs);
  }

  public BitOp newNot(SourceLocation loc, Expr operand) {
    Preconditions.checkArgument(!operand.dtype().isUnpacked());
    return withOperands(new BitOp(this, NodeKind.NOT, loc), operand);
  }

  private BitOp newBinary(NodeKind kind, SourceLocation loc, Expr lhs, Expr rhs) {
    Preconditions.checkArgument(!lhs.dtype().isUnpacked() && !rhs.dtype().isUnpacked());
    Preconditions.checkArgument(
        lhs.dtype().width() == rhs.dtype().width(), "Width mismatch: %s, %s", lhs, rhs);
    return withOperands(new BitOp(this, kind, loc), lhs, rhs);
  }

  /** Returns {@code cond ? then : otherwise}. */
  public Cond newCond(SourceLocation loc, Expr cond, Expr then, Expr otherwise) {
    return withOperands(new Cond(this, loc), cond, then, otherwise);
  }

  private static <T extends Node> T withOperands(T node, Node... operands) {
    for (Node operand : operands) {
      node.link(operand);
    }
    return node;
  }
}
