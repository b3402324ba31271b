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

import com.google.auto.value.AutoValue;
import com.google.javascript.rhino.Node;

/**
 * Identifies one lexical binding: its name plus the root node of the scope that declares it.
 *
 * <p>Two uses of {@code x} that resolve to different declarations (for example a module level
 * {@code x} and a parameter {@code x} shadowing it) have different identities. Scope roots are
 * compared by reference, so an identity stays valid as long as the declaring scope is attached,
 * across any number of removal passes.
 */
@AutoValue
public abstract class BindingIdentity {

  public static BindingIdentity create(String name, Node scopeRoot) {
    return new AutoValue_BindingIdentity(name, scopeRoot);
  }

  public abstract String name();

  public abstract Node scopeRoot();

  @Override
  public final String toString() {
    return name() + "@" + scopeRoot().getToken() + ":" + scopeRoot().getLineno();
  }
}
