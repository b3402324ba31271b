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
import static com.google.javascript.removeexports.ReachabilityAnalyzer.isDefaultExport;
import static com.google.javascript.removeexports.ReachabilityAnalyzer.isNamedExport;

import com.google.javascript.jscomp.AbstractCompiler;
import com.google.javascript.jscomp.NodeTraversal;
import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.rhino.IR;
import com.google.javascript.rhino.Node;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Deletes what the {@link ReachabilityAnalyzer} found to be referenced only by removed code, and
 * the removed exports themselves.
 *
 * <p>Deleted statements are first replaced by an EMPTY statement, which the enclosing statement
 * list drops once all of its children were visited. Everything a deleted declaration referenced
 * is handed to the {@link CandidateMarker}, so the next pass can delete it too.
 */
final class PruningRewriter implements NodeTraversal.Callback {

  private static final Logger logger = Logger.getLogger(PruningRewriter.class.getName());

  private final AbstractCompiler compiler;
  private final ExportRemovalState state;
  private final ResolvedBindings bindings;
  private final RemovalTargets targets;
  private final CandidateMarker candidateMarker;

  PruningRewriter(AbstractCompiler compiler, ExportRemovalState state, ResolvedBindings bindings) {
    this.compiler = checkNotNull(compiler);
    this.state = checkNotNull(state);
    this.bindings = checkNotNull(bindings);
    this.targets = state.getTargets();
    this.candidateMarker = new CandidateMarker(compiler, state, bindings);
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    switch (n.getToken()) {
      case EXPORT:
        if (isDefaultExport(n)) {
          if (targets.removesDefault()) {
            replaceDefaultExport(n);
            return false;
          }
          return true;
        }
        Node declaration = n.getFirstChild();
        if (declaration.isFunction() && targets.contains(declaration.getFirstChild().getString())) {
          logger.finer("Dropping exported function " + declaration.getFirstChild().getString());
          candidateMarker.mark(declaration);
          replaceWithPlaceholder(n);
          return false;
        }
        return true;
      case FUNCTION:
        if (parent != null
            && !parent.isExport()
            && NodeUtil.isFunctionDeclaration(n)
            && isRemovable(n.getFirstChild())) {
          logger.finer("Dropping function " + n.getFirstChild().getString());
          candidateMarker.mark(n);
          replaceWithPlaceholder(n);
          return false;
        }
        return true;
      case CLASS:
        if (parent != null
            && !parent.isExport()
            && NodeUtil.isClassDeclaration(n)
            && isRemovable(n.getFirstChild())) {
          logger.finer("Dropping class " + n.getFirstChild().getString());
          candidateMarker.mark(n);
          replaceWithPlaceholder(n);
          return false;
        }
        return true;
      default:
        return true;
    }
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    switch (n.getToken()) {
      case IMPORT:
        pruneImport(n);
        break;
      case EXPORT:
        if (n.getFirstChild().isExportSpecs()) {
          pruneExportSpecs(n);
        }
        break;
      case NAME:
      case DESTRUCTURING_LHS:
        if (parent != null
            && NodeUtil.isNameDeclaration(parent)
            && !NodeUtil.isEnhancedFor(parent.getParent())) {
          pruneDeclarator(n);
        }
        break;
      case VAR:
      case LET:
      case CONST:
        if (!n.hasChildren()) {
          replaceWithPlaceholder(isNamedExport(parent) ? parent : n);
        }
        break;
      case SCRIPT:
      case MODULE_BODY:
      case BLOCK:
        removePlaceholders(n);
        break;
      default:
        break;
    }
  }

  private boolean isRemovable(Node name) {
    return state.isRemovable(bindings.identityOf(name));
  }

  /**
   * Drops the specifiers whose local binding is removable. An import that loses all of them goes
   * too, but an import that never had any is kept for its side effects.
   */
  private void pruneImport(Node importNode) {
    Node defaultBinding = importNode.getFirstChild();
    Node namedBindings = defaultBinding.getNext();
    if (!hasBindings(importNode)) {
      return;
    }

    boolean dropped = false;
    if (defaultBinding.isName() && isRemovable(defaultBinding)) {
      logger.finer("Dropping import " + defaultBinding.getString());
      defaultBinding.replaceWith(IR.empty().srcref(defaultBinding));
      dropped = true;
    }
    if (namedBindings.isImportStar() && isRemovable(namedBindings)) {
      logger.finer("Dropping import * as " + namedBindings.getString());
      namedBindings.replaceWith(IR.empty().srcref(namedBindings));
      dropped = true;
    } else if (namedBindings.isImportSpecs()) {
      for (Node spec = namedBindings.getFirstChild(); spec != null; ) {
        Node next = spec.getNext();
        if (isRemovable(spec.getLastChild())) {
          logger.finer("Dropping import " + spec.getLastChild().getString());
          spec.detach();
          dropped = true;
        }
        spec = next;
      }
      if (dropped && !namedBindings.hasChildren()) {
        namedBindings.replaceWith(IR.empty().srcref(namedBindings));
      }
    }
    if (!dropped) {
      return;
    }

    state.markChanged();
    if (hasBindings(importNode)) {
      compiler.reportChangeToEnclosingScope(importNode);
    } else {
      replaceWithPlaceholder(importNode);
    }
  }

  private static boolean hasBindings(Node importNode) {
    Node defaultBinding = importNode.getFirstChild();
    Node namedBindings = defaultBinding.getNext();
    return !defaultBinding.isEmpty()
        || namedBindings.isImportStar()
        || (namedBindings.isImportSpecs() && namedBindings.hasChildren());
  }

  /**
   * Drops {@code export {...}} specifiers that export a removal target, and proposes the binding
   * they exported for removal.
   */
  private void pruneExportSpecs(Node export) {
    Node specs = export.getFirstChild();
    boolean dropped = false;
    for (Node spec = specs.getFirstChild(); spec != null; ) {
      Node next = spec.getNext();
      if (targets.contains(spec.getLastChild().getString())) {
        logger.finer("Dropping export specifier " + spec.getLastChild().getString());
        state.seedCandidate(bindings.identityOf(spec.getFirstChild()));
        spec.detach();
        dropped = true;
      }
      spec = next;
    }
    if (!dropped) {
      return;
    }
    if (specs.hasChildren()) {
      compiler.reportChangeToEnclosingScope(export);
    } else {
      replaceWithPlaceholder(export);
    }
  }

  /** Replaces the default export with {@code function() {}}. */
  private void replaceDefaultExport(Node export) {
    Node declaration = export.getOnlyChild();
    if (isEmptyFunction(declaration)) {
      return;
    }
    logger.finer("Replacing the default export");
    Node replacement = IR.function(IR.name(""), IR.paramList(), IR.block()).srcrefTree(declaration);
    compiler.reportChangeToEnclosingScope(declaration);
    declaration.replaceWith(replacement);
    NodeUtil.markFunctionsDeleted(declaration, compiler);
    compiler.reportChangeToEnclosingScope(replacement);
  }

  private static boolean isEmptyFunction(Node n) {
    return n.isFunction()
        && !n.isArrowFunction()
        && !n.isAsyncFunction()
        && !n.isGeneratorFunction()
        && n.getFirstChild().getString().isEmpty()
        && !n.getSecondChild().hasChildren()
        && n.getLastChild().isBlock()
        && !n.getLastChild().hasChildren();
  }

  /**
   * Drops a declarator whose bindings are all removable, or that declares a removal target in an
   * export. The initializer is proposed for removal.
   */
  private void pruneDeclarator(Node declarator) {
    Node declaration = declarator.getParent();
    boolean exportedTarget =
        declarator.isName()
            && isNamedExport(declaration.getParent())
            && targets.contains(declarator.getString());
    Node target = declarator.isName() ? declarator : declarator.getFirstChild();
    if (!exportedTarget && !pruneTarget(target)) {
      return;
    }

    Node initializer = declarator.isName() ? declarator.getFirstChild() : declarator.getLastChild();
    if (initializer != null) {
      candidateMarker.mark(initializer);
    }
    logger.finer("Dropping declarator " + describe(target));
    state.markChanged();
    compiler.reportChangeToEnclosingScope(declarator);
    declarator.detach();
    NodeUtil.markFunctionsDeleted(declarator, compiler);
  }

  /**
   * Removes removable bindings from a declaration target. Returns whether the target itself is
   * left with nothing worth declaring and should be deleted by its parent.
   */
  private boolean pruneTarget(Node target) {
    switch (target.getToken()) {
      case NAME:
        return isRemovable(target);
      case ARRAY_PATTERN:
        return pruneArrayPattern(target);
      case OBJECT_PATTERN:
        return pruneObjectPattern(target);
      case ITER_REST:
      case OBJECT_REST:
        return pruneTarget(target.getOnlyChild());
      case DEFAULT_VALUE:
        if (pruneTarget(target.getFirstChild())) {
          candidateMarker.mark(target.getLastChild());
          return true;
        }
        return false;
      default:
        return false;
    }
  }

  /**
   * Replaces deleted elements with holes so the remaining elements keep their positions. Trailing
   * holes are trimmed.
   */
  private boolean pruneArrayPattern(Node pattern) {
    if (!pattern.hasChildren()) {
      return false;
    }
    boolean pruned = false;
    for (Node element = pattern.getFirstChild(); element != null; ) {
      Node next = element.getNext();
      if (!element.isEmpty() && pruneTarget(element)) {
        element.replaceWith(IR.empty().srcref(element));
        NodeUtil.markFunctionsDeleted(element, compiler);
        pruned = true;
      }
      element = next;
    }
    if (!pruned) {
      return false;
    }
    while (pattern.hasChildren() && pattern.getLastChild().isEmpty()) {
      pattern.getLastChild().detach();
    }
    if (!pattern.hasChildren()) {
      return true;
    }
    compiler.reportChangeToEnclosingScope(pattern);
    state.markChanged();
    return false;
  }

  private boolean pruneObjectPattern(Node pattern) {
    if (!pattern.hasChildren()) {
      return false;
    }
    boolean pruned = false;
    for (Node property = pattern.getFirstChild(); property != null; ) {
      Node next = property.getNext();
      if (shouldDropProperty(property)) {
        compiler.reportChangeToEnclosingScope(property);
        property.detach();
        NodeUtil.markFunctionsDeleted(property, compiler);
        pruned = true;
      }
      property = next;
    }
    if (!pruned) {
      return false;
    }
    if (!pattern.hasChildren()) {
      return true;
    }
    state.markChanged();
    return false;
  }

  private boolean shouldDropProperty(Node property) {
    switch (property.getToken()) {
      case STRING_KEY:
        Node value = property.getOnlyChild();
        Node shorthandName = getShorthandName(property);
        if (shorthandName != null) {
          if (!isRemovable(shorthandName)) {
            return false;
          }
          if (value.isDefaultValue()) {
            candidateMarker.mark(value.getLastChild());
          }
          return true;
        }
        return pruneTarget(value);
      case COMPUTED_PROP:
        if (pruneTarget(property.getLastChild())) {
          candidateMarker.mark(property.getFirstChild());
          return true;
        }
        return false;
      case OBJECT_REST:
        return pruneTarget(property.getOnlyChild());
      default:
        return false;
    }
  }

  /** The bound name of {@code {a}} or {@code {a = 1}}, or null for any other property. */
  private static @Nullable Node getShorthandName(Node stringKey) {
    Node value = stringKey.getOnlyChild();
    Node name = value.isDefaultValue() ? value.getFirstChild() : value;
    if (name.isName()
        && (stringKey.isShorthandProperty() || name.getString().equals(stringKey.getString()))) {
      return name;
    }
    return null;
  }

  private void replaceWithPlaceholder(Node statement) {
    compiler.reportChangeToEnclosingScope(statement);
    statement.replaceWith(IR.empty().srcref(statement));
    NodeUtil.markFunctionsDeleted(statement, compiler);
  }

  private void removePlaceholders(Node statements) {
    boolean removed = false;
    for (Node child = statements.getFirstChild(); child != null; ) {
      Node next = child.getNext();
      if (child.isEmpty()) {
        child.detach();
        removed = true;
      }
      child = next;
    }
    if (removed) {
      compiler.reportChangeToEnclosingScope(statements);
    }
  }

  private static String describe(Node target) {
    return target.isName() ? target.getString() : target.getToken().toString();
  }
}
