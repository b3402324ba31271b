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

package com.google.javascript.removeexports;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.javascript.jscomp.NodeTraversal;
import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.rhino.Node;
import java.util.IdentityHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Records, for every referenced binding, whether the reference comes from code that is about to be
 * removed or from code that stays. Never modifies the tree.
 *
 * <p>A subtree is removed code when it is an exported function or declarator whose name is a
 * removal target, or the default export when {@code "default"} is a target. Everything below such
 * a subtree is removed code as well.
 */
final class ReachabilityAnalyzer implements NodeTraversal.Callback {

  private final ExportRemovalState state;
  private final ResolvedBindings bindings;
  private final RemovalTargets targets;
  private final boolean forceRemovalContext;
  private final boolean guardRecursiveDeclarations;

  /** Root of the removed subtree currently being traversed, if any. */
  private @Nullable Node removalRoot;

  /** Declarations that put their binding in the declaring guard, mapped to that binding. */
  private final Map<Node, BindingIdentity> guardedDeclarations = new IdentityHashMap<>();

  ReachabilityAnalyzer(
      ExportRemovalState state,
      ResolvedBindings bindings,
      boolean forceRemovalContext,
      boolean guardRecursiveDeclarations) {
    this.state = checkNotNull(state);
    this.bindings = checkNotNull(bindings);
    this.targets = state.getTargets();
    this.forceRemovalContext = forceRemovalContext;
    this.guardRecursiveDeclarations = guardRecursiveDeclarations;
  }

  /** An analyzer that classifies every reference it sees as coming from removed code. */
  static ReachabilityAnalyzer forCandidates(ExportRemovalState state, ResolvedBindings bindings) {
    return new ReachabilityAnalyzer(state, bindings, true, false);
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    if (!inRemovalContext() && startsRemovalContext(n, parent)) {
      removalRoot = n;
    }
    if (guardRecursiveDeclarations && !inRemovalContext()) {
      Node declaredName = getGuardedName(n, parent);
      if (declaredName != null) {
        BindingIdentity identity = bindings.identityOf(declaredName);
        guardedDeclarations.put(n, identity);
        state.beginDeclaring(identity);
      }
    }
    return true;
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    switch (n.getToken()) {
      case NAME:
        visitName(n, parent);
        break;
      case EXPORT_SPEC:
        visitExportSpec(n);
        break;
      case EXPORT:
        if (!inRemovalContext()) {
          recordExportedBindings(n);
        }
        break;
      default:
        break;
    }

    BindingIdentity guarded = guardedDeclarations.remove(n);
    if (guarded != null) {
      state.endDeclaring(guarded);
    }
    if (n == removalRoot) {
      removalRoot = null;
    }
  }

  private boolean inRemovalContext() {
    return forceRemovalContext || removalRoot != null;
  }

  private boolean startsRemovalContext(Node n, @Nullable Node parent) {
    if (parent == null) {
      return false;
    }
    if (parent.isExport()) {
      if (isDefaultExport(parent)) {
        return targets.removesDefault();
      }
      return n.isFunction() && targets.contains(n.getFirstChild().getString());
    }
    // export const getStaticProps = ..., the declarator and its initializer.
    return n.isName()
        && NodeUtil.isNameDeclaration(parent)
        && isNamedExport(parent.getParent())
        && targets.contains(n.getString());
  }

  /** The name whose declaration {@code n} is, for declarations the guard applies to. */
  private static @Nullable Node getGuardedName(Node n, @Nullable Node parent) {
    if (parent == null) {
      return null;
    }
    if (NodeUtil.isFunctionDeclaration(n)) {
      return n.getFirstChild();
    }
    if (n.isName() && n.hasChildren() && NodeUtil.isNameDeclaration(parent)) {
      return n;
    }
    return null;
  }

  private void visitName(Node n, @Nullable Node parent) {
    if (n.getString().isEmpty()) {
      return;
    }
    if (parent == null) {
      // The root of a marked subtree, such as a bare initializer.
      if (inRemovalContext()) {
        addReference(n);
      }
      return;
    }
    switch (parent.getToken()) {
      case FUNCTION:
        if (n.isFirstChildOf(parent)) {
          // A declaration only names itself; a function expression's name is a use.
          if (!NodeUtil.isFunctionDeclaration(parent) || inRemovalContext()) {
            addReference(n);
          }
          return;
        }
        break;
      case CLASS:
        if (n.isFirstChildOf(parent)) {
          return;
        }
        break;
      case IMPORT:
      case IMPORT_SPEC:
      case EXPORT_SPEC:
        return;
      default:
        break;
    }
    if (isDeclaredName(n) && !inRemovalContext()) {
      return;
    }
    addReference(n);
  }

  /**
   * Re-exporting a binding under a name that is being removed does not keep the binding alive.
   */
  private void visitExportSpec(Node spec) {
    Node exported = spec.getLastChild();
    if (targets.contains(exported.getString())) {
      return;
    }
    addReference(spec.getFirstChild());
  }

  /**
   * Names declared by a surviving export are part of the module's interface, so they count as
   * uses from surviving code. Target names bound by an exported destructuring pattern are proposed
   * for removal instead.
   */
  private void recordExportedBindings(Node export) {
    if (isDefaultExport(export)) {
      return;
    }
    Node declaration = export.getFirstChild();
    if (declaration.isFunction() || declaration.isClass()) {
      Node name = declaration.getFirstChild();
      if (!targets.contains(name.getString())) {
        state.addReference(bindings.identityOf(name), false);
      }
    } else if (NodeUtil.isNameDeclaration(declaration)) {
      for (Node declarator = declaration.getFirstChild();
          declarator != null;
          declarator = declarator.getNext()) {
        for (Node name : getDeclaredNames(declarator)) {
          if (targets.contains(name.getString())) {
            if (!declarator.isName()) {
              state.addReference(bindings.identityOf(name), true);
            }
          } else {
            state.addReference(bindings.identityOf(name), false);
          }
        }
      }
    }
  }

  private void addReference(Node name) {
    state.addReference(bindings.identityOf(name), inRemovalContext());
  }

  static boolean isDefaultExport(Node export) {
    return export.getBooleanProp(Node.EXPORT_DEFAULT);
  }

  static boolean isNamedExport(@Nullable Node n) {
    return n != null && n.isExport() && !isDefaultExport(n);
  }

  /** The NAME nodes bound by a declarator of a var, let or const declaration. */
  static ImmutableList<Node> getDeclaredNames(Node declarator) {
    ImmutableList.Builder<Node> names = ImmutableList.builder();
    if (declarator.isName()) {
      names.add(declarator);
    } else if (declarator.isDestructuringLhs()) {
      collectTargetNames(declarator.getFirstChild(), names);
    }
    return names.build();
  }

  private static void collectTargetNames(Node target, ImmutableList.Builder<Node> names) {
    switch (target.getToken()) {
      case NAME:
        names.add(target);
        break;
      case ARRAY_PATTERN:
      case OBJECT_PATTERN:
        for (Node child = target.getFirstChild(); child != null; child = child.getNext()) {
          collectTargetNames(child, names);
        }
        break;
      case DEFAULT_VALUE:
      case STRING_KEY:
      case ITER_REST:
      case OBJECT_REST:
        collectTargetNames(target.getFirstChild(), names);
        break;
      case COMPUTED_PROP:
        collectTargetNames(target.getLastChild(), names);
        break;
      default:
        break;
    }
  }

  /** Whether {@code name} is bound by a var, let or const declaration, directly or by a pattern. */
  static boolean isDeclaredName(Node name) {
    Node target = name;
    for (Node parent = name.getParent(); parent != null; parent = parent.getParent()) {
      switch (parent.getToken()) {
        case VAR:
        case LET:
        case CONST:
          return true;
        case DESTRUCTURING_LHS:
          return target.isFirstChildOf(parent) && NodeUtil.isNameDeclaration(parent.getParent());
        case ARRAY_PATTERN:
        case OBJECT_PATTERN:
        case STRING_KEY:
        case ITER_REST:
        case OBJECT_REST:
          break;
        case DEFAULT_VALUE:
          if (!target.isFirstChildOf(parent)) {
            return false;
          }
          break;
        case COMPUTED_PROP:
          if (target != parent.getLastChild()) {
            return false;
          }
          break;
        default:
          return false;
      }
      target = parent;
    }
    return false;
  }
}
