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

import com.google.common.collect.ImmutableSet;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import java.io.IOException;
import java.io.StringReader;
import java.util.Arrays;
import org.jspecify.annotations.Nullable;

/**
 * The export names to remove from a module. The name {@code "default"} stands for the default
 * export.
 */
public final class RemovalTargets {

  static final String DEFAULT_EXPORT = "default";

  private static final Gson GSON = new Gson();

  private final ImmutableSet<String> names;

  private RemovalTargets(ImmutableSet<String> names) {
    this.names = names;
  }

  public static RemovalTargets of(String... names) {
    return copyOf(Arrays.asList(names));
  }

  public static RemovalTargets copyOf(Iterable<String> names) {
    ImmutableSet<String> copy = ImmutableSet.copyOf(names);
    for (String name : copy) {
      checkArgument(!name.isEmpty(), "Empty export name in %s", copy);
    }
    return new RemovalTargets(copy);
  }

  /**
   * Decodes a JSON array of export names, e.g. {@code ["getStaticProps", "default"]}.
   *
   * @throws IllegalArgumentException if the configuration is missing or is not an array of
   *     non-empty strings
   */
  public static RemovalTargets fromJson(@Nullable String json) {
    checkArgument(json != null, "failed to get plugin config for remove-exports");
    JsonElement element;
    // JsonReader is strict unless told otherwise, so unquoted names are rejected.
    try (JsonReader reader = new JsonReader(new StringReader(json))) {
      element = GSON.getAdapter(JsonElement.class).read(reader);
      checkArgument(
          reader.peek() == JsonToken.END_DOCUMENT,
          "invalid config for remove-exports: trailing data in %s",
          json);
    } catch (IOException | JsonParseException e) {
      throw new IllegalArgumentException("invalid config for remove-exports: " + json, e);
    }
    checkArgument(
        element.isJsonArray(),
        "invalid config for remove-exports: expected an array of export names, got %s",
        json);
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    for (JsonElement item : element.getAsJsonArray()) {
      checkArgument(
          item.isJsonPrimitive() && item.getAsJsonPrimitive().isString(),
          "invalid config for remove-exports: %s is not a string",
          item);
      String name = item.getAsString();
      checkArgument(!name.isEmpty(), "invalid config for remove-exports: empty export name");
      names.add(name);
    }
    return new RemovalTargets(names.build());
  }

  public boolean contains(String name) {
    return names.contains(name);
  }

  /** Whether the default export is to be removed. */
  public boolean removesDefault() {
    return names.contains(DEFAULT_EXPORT);
  }

  public boolean isEmpty() {
    return names.isEmpty();
  }

  /** The names in configuration order. */
  public ImmutableSet<String> names() {
    return names;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    return o instanceof RemovalTargets && names.equals(((RemovalTargets) o).names);
  }

  @Override
  public int hashCode() {
    return names.hashCode();
  }

  @Override
  public String toString() {
    return names.toString();
  }
}
