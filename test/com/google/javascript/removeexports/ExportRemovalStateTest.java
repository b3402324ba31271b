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

import static com.google.common.truth.Truth.assertThat;

import com.google.javascript.rhino.IR;
import com.google.javascript.rhino.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ExportRemovalState}. */
@RunWith(JUnit4.class)
public final class ExportRemovalStateTest {

  private final Node scope = IR.block();
  private final BindingIdentity a = BindingIdentity.create("a", scope);
  private final BindingIdentity b = BindingIdentity.create("b", scope);
  private final ExportRemovalState state = new ExportRemovalState(RemovalTargets.of("x"));

  @Test
  public void testRemovableOnlyWithoutSurvivingReference() {
    assertThat(state.isRemovable(a)).isFalse();

    state.addReference(a, true);
    assertThat(state.isRemovable(a)).isTrue();

    state.addReference(a, false);
    assertThat(state.isRemovable(a)).isFalse();
  }

  @Test
  public void testIdentityDependsOnScope() {
    state.addReference(a, true);

    assertThat(state.isRemovable(BindingIdentity.create("a", IR.block()))).isFalse();
    assertThat(state.isRemovable(BindingIdentity.create("a", scope))).isTrue();
  }

  @Test
  public void testResetKeepsRemovedReferences() {
    state.addReference(a, true);
    state.addReference(a, false);
    state.markChanged();

    state.resetForNextPass();

    assertThat(state.getSurvivingReferences()).isEmpty();
    assertThat(state.getRemovedReferences()).containsExactly(a);
    assertThat(state.isRemovable(a)).isTrue();
    assertThat(state.shouldRunAgain()).isFalse();
  }

  @Test
  public void testSeedCandidateRequestsAnotherPass() {
    state.seedCandidate(b);

    assertThat(state.isRemovable(b)).isTrue();
    assertThat(state.shouldRunAgain()).isTrue();
  }

  @Test
  public void testDeclaringGuardSuppressesSurvivingReferences() {
    state.beginDeclaring(a);
    state.addReference(a, false);
    state.addReference(a, true);
    state.endDeclaring(a);

    assertThat(state.getSurvivingReferences()).isEmpty();
    assertThat(state.isRemovable(a)).isTrue();

    state.addReference(a, false);
    assertThat(state.isRemovable(a)).isFalse();
  }
}
