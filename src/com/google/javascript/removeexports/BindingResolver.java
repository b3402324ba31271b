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

import com.google.javascript.rhino.Node;

/**
 * Assigns a {@link BindingIdentity} to every name in a tree.
 *
 * <p>{@link RemoveExports} requires this to have happened before it classifies anything; running
 * it on names that were resolved only by their spelling would merge shadowed bindings.
 */
public interface BindingResolver {

  /** Resolves every binding and reference in {@code root}. Must not modify the tree. */
  ResolvedBindings resolve(Node root);
}
