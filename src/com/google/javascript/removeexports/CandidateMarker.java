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
import com.google.javascript.rhino.Node;

/**
 * Proposes everything a subtree references for removal.
 *
 * <p>Removing a declaration does not remove what it referenced right away. The references are
 * recorded as coming from removed code and another pass decides whether anything surviving still
 * needs them.
 */
final class CandidateMarker {

  private final AbstractCompiler compiler;
  private final ExportRemovalState state;
  private final ResolvedBindings bindings;

  CandidateMarker(AbstractCompiler compiler, ExportRemovalState state, ResolvedBindings bindings) {
    this.compiler = checkNotNull(compiler);
    this.state = checkNotNull(state);
    this.bindings = checkNotNull(bindings);
  }

  /** Marks the references in {@code subtree}. Call before the subtree is detached. */
  void mark(Node subtree) {
    NodeTraversal.traverse(
        compiler, subtree, ReachabilityAnalyzer.forCandidates(state, bindings));
    state.markChanged();
  }
}
