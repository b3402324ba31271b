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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.javascript.rhino.Node;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * The output of a {@link BindingResolver}: a map from name nodes to the binding they declare or
 * reference.
 *
 * <p>Nodes that the resolver never saw (synthesized after resolution) fall back to a global
 * identity rooted at the resolved tree.
 */
public final class ResolvedBindings {

  private final Node root;
  private final Map<Node, BindingIdentity> identities;

  private ResolvedBindings(Node root, Map<Node, BindingIdentity> identities) {
    this.root = root;
    this.identities = identities;
  }

  public static Builder builder(Node root) {
    return new Builder(root);
  }

  /** Returns the identity of a NAME or IMPORT_STAR node. */
  public BindingIdentity identityOf(Node name) {
    checkArgument(name.isName() || name.isImportStar(), name);
    BindingIdentity identity = identities.get(name);
    return identity != null ? identity : BindingIdentity.create(name.getString(), root);
  }

  /** Whether {@code name} was seen by the resolver. */
  public boolean isResolved(Node name) {
    return identities.containsKey(name);
  }

  /** Builder for {@link ResolvedBindings}. */
  public static final class Builder {
    private final Node root;
    private final Map<Node, BindingIdentity> identities = new IdentityHashMap<>();

    private Builder(Node root) {
      this.root = checkNotNull(root);
    }

    @CanIgnoreReturnValue
    public Builder put(Node name, BindingIdentity identity) {
      checkArgument(name.isName() || name.isImportStar(), name);
      identities.put(name, checkNotNull(identity));
      return this;
    }

    public ResolvedBindings build() {
      return new ResolvedBindings(root, new IdentityHashMap<>(identities));
    }
  }
}
