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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.javascript.jscomp.AbstractCompiler;
import com.google.javascript.jscomp.CompilerPass;
import com.google.javascript.jscomp.NodeTraversal;
import com.google.javascript.rhino.Node;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Removes the named exports of a module together with every declaration, import and binding that
 * only they referenced.
 *
 * <p>This is how server-only functions such as {@code getStaticProps} are stripped from a page
 * module before it is bundled for the browser:
 *
 * <pre>
 * import {fetchData} from 'db';
 * export function getStaticProps() { return fetchData(); }
 * export default function Page() { return null; }
 * </pre>
 *
 * becomes {@code export default function Page() { return null; }} when {@code getStaticProps} is
 * removed. Removing {@code "default"} replaces the default export with {@code function() {}}.
 *
 * <p>Each pass runs a {@link ReachabilityAnalyzer} over the whole tree and then a {@link
 * PruningRewriter}. A deletion proposes what the deleted code referenced for removal, so passes
 * repeat until one of them deletes nothing. This is not a general dead code eliminator: a
 * declaration is only removed if removed code referenced it.
 *
 * <p>Bindings are resolved once, before the first pass, by the {@link BindingResolver}.
 */
public final class RemoveExports implements CompilerPass {

  private static final Logger logger = Logger.getLogger(RemoveExports.class.getName());

  /** Outcome of one analyze and prune pass. */
  enum PassResult {
    /** Something was deleted or proposed for removal; another pass is needed. */
    CHANGED,
    /** Nothing changed. */
    FIXED_POINT
  }

  private final AbstractCompiler compiler;
  private final RemovalTargets targets;
  private final BindingResolver resolver;
  private boolean guardRecursiveDeclarations = false;
  private int passCount;

  public RemoveExports(AbstractCompiler compiler, RemovalTargets targets) {
    this(compiler, targets, new SyntacticBindingResolver(compiler));
  }

  public RemoveExports(
      AbstractCompiler compiler, RemovalTargets targets, BindingResolver resolver) {
    this.compiler = checkNotNull(compiler);
    this.targets = checkNotNull(targets);
    this.resolver = checkNotNull(resolver);
  }

  /**
   * Creates the pass from its serialized configuration, a JSON array of export names.
   *
   * @throws IllegalArgumentException if the configuration is missing or malformed
   */
  public static RemoveExports forConfig(AbstractCompiler compiler, @Nullable String config) {
    return new RemoveExports(compiler, RemovalTargets.fromJson(config));
  }

  /**
   * Whether a binding's references from within its own declaration are ignored. Off by default,
   * so a recursive function that only removed code calls is kept alive by its own recursive call.
   */
  @CanIgnoreReturnValue
  public RemoveExports setGuardRecursiveDeclarations(boolean guardRecursiveDeclarations) {
    this.guardRecursiveDeclarations = guardRecursiveDeclarations;
    return this;
  }

  @Override
  public void process(@Nullable Node externs, Node root) {
    passCount = 0;
    if (targets.isEmpty()) {
      logger.fine("No exports to remove");
      return;
    }
    logger.fine("Removing exports " + targets);
    ResolvedBindings bindings = resolver.resolve(root);
    ExportRemovalState state = new ExportRemovalState(targets);
    PassResult result;
    do {
      result = runPass(root, bindings, state);
    } while (result == PassResult.CHANGED);
    logger.fine("Removed exports " + targets + " in " + passCount + " passes");
  }

  private PassResult runPass(Node root, ResolvedBindings bindings, ExportRemovalState state) {
    passCount++;
    NodeTraversal.traverse(
        compiler,
        root,
        new ReachabilityAnalyzer(state, bindings, false, guardRecursiveDeclarations));
    NodeTraversal.traverse(compiler, root, new PruningRewriter(compiler, state, bindings));
    PassResult result = state.shouldRunAgain() ? PassResult.CHANGED : PassResult.FIXED_POINT;
    logger.fine("Pass " + passCount + ": " + result);
    state.resetForNextPass();
    return result;
  }

  /** Number of passes the last {@link #process} call needed to reach a fixed point. */
  int getPassCount() {
    return passCount;
  }
}
