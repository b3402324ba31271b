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

import com.google.javascript.jscomp.AbstractCompiler;
import com.google.javascript.jscomp.NodeTraversal;
import com.google.javascript.jscomp.NodeTraversal.AbstractPostOrderCallback;
import com.google.javascript.jscomp.Var;
import com.google.javascript.rhino.Node;
import java.util.logging.Logger;

/**
 * Resolves bindings with the syntactic scopes the compiler builds during a {@link NodeTraversal}.
 *
 * <p>A name resolves to the scope root of its declaring {@link Var}. Names with no declaration
 * resolve to the traversal root. Specifiers of {@code export {x} from 'mod'} name bindings of
 * another module, so they resolve to the export statement itself and can never be confused with a
 * local {@code x}.
 */
public final class SyntacticBindingResolver implements BindingResolver {

  private static final Logger logger =
      Logger.getLogger(SyntacticBindingResolver.class.getName());

  private final AbstractCompiler compiler;

  public SyntacticBindingResolver(AbstractCompiler compiler) {
    this.compiler = checkNotNull(compiler);
  }

  @Override
  public ResolvedBindings resolve(Node root) {
    ResolvedBindings.Builder bindings = ResolvedBindings.builder(root);
    NodeTraversal.traverse(
        compiler,
        root,
        new AbstractPostOrderCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, Node parent) {
            if ((n.isName() || n.isImportStar()) && !n.getString().isEmpty()) {
              bindings.put(n, identify(t, n, parent, root));
            }
          }
        });
    logger.fine("Resolved bindings of " + root.getSourceFileName());
    return bindings.build();
  }

  private static BindingIdentity identify(NodeTraversal t, Node n, Node parent, Node root) {
    String name = n.getString();
    if (parent != null && parent.isExportSpec() && isReExport(parent.getGrandparent())) {
      return BindingIdentity.create(name, parent.getGrandparent());
    }
    Var var = t.getScope().getVar(name);
    return BindingIdentity.create(name, var != null ? var.getScopeRoot() : root);
  }

  /** Whether {@code export} is {@code export {...} from 'mod'}. */
  private static boolean isReExport(Node export) {
    return export != null && export.isExport() && export.hasTwoChildren();
  }
}
