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

import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Classification state shared by the analyzer and the rewriter during one {@link RemoveExports}
 * invocation.
 *
 * <p>References from surviving code are recomputed by every pass because the previous pass removed
 * nodes. References from removed code are kept for the whole invocation: once a declaration is
 * gone this set is the only record that its dependencies were only needed by removed code.
 */
final class ExportRemovalState {

  private final RemovalTargets targets;

  /** Bindings referenced by code that stays. Cleared before every pass. */
  private final Set<BindingIdentity> survivingReferences = new LinkedHashSet<>();

  /** Bindings referenced by removed code or its derivatives. Never cleared. */
  private final Set<BindingIdentity> removedReferences = new LinkedHashSet<>();

  /** Bindings whose own declaration is being analyzed. */
  private final Set<BindingIdentity> declaring = new HashSet<>();

  private boolean runAgain;

  ExportRemovalState(RemovalTargets targets) {
    this.targets = checkNotNull(targets);
  }

  RemovalTargets getTargets() {
    return targets;
  }

  void addReference(BindingIdentity identity, boolean fromRemovedCode) {
    if (fromRemovedCode) {
      removedReferences.add(identity);
    } else if (!declaring.contains(identity)) {
      survivingReferences.add(identity);
    }
  }

  /** Proposes {@code identity} for removal on the next pass. */
  void seedCandidate(BindingIdentity identity) {
    removedReferences.add(identity);
    runAgain = true;
  }

  /**
   * Whether every reference to {@code identity} seen so far came from removed code. A reference
   * from surviving code always wins.
   */
  boolean isRemovable(BindingIdentity identity) {
    return removedReferences.contains(identity) && !survivingReferences.contains(identity);
  }

  void beginDeclaring(BindingIdentity identity) {
    declaring.add(identity);
  }

  void endDeclaring(BindingIdentity identity) {
    declaring.remove(identity);
  }

  void markChanged() {
    runAgain = true;
  }

  boolean shouldRunAgain() {
    return runAgain;
  }

  /** Drops the per-pass state. References from removed code survive. */
  void resetForNextPass() {
    survivingReferences.clear();
    declaring.clear();
    runAgain = false;
  }

  ImmutableSet<BindingIdentity> getSurvivingReferences() {
    return ImmutableSet.copyOf(survivingReferences);
  }

  ImmutableSet<BindingIdentity> getRemovedReferences() {
    return ImmutableSet.copyOf(removedReferences);
  }
}
