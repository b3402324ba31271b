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

import com.google.javascript.jscomp.Compiler;
import com.google.javascript.jscomp.CompilerPass;
import com.google.javascript.jscomp.NodeTraversal;
import com.google.javascript.rhino.Node;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests for {@link PruningRewriter}. Each test seeds the classification state by hand and runs a
 * single rewrite.
 */
@RunWith(JUnit4.class)
public final class PruningRewriterTest extends RemoveExportsTestCase {

  private RemovalTargets targets;
  private Node root;
  private ResolvedBindings bindings;
  private ExportRemovalState state;

  @Override
  @Before
  public void setUp() {
    super.setUp();
    targets = RemovalTargets.of("getStaticProps");
  }

  @Override
  protected CompilerPass getProcessor(Compiler compiler) {
    return (externs, root) ->
        NodeTraversal.traverse(compiler, root, new PruningRewriter(compiler, state, bindings));
  }

  @Test
  public void testDropsRemovableImportSpecifiers() {
    prepare("import a, { b, c as d } from 'x';", "use(a, d);");
    removedRef("a");
    removedRef("b");

    rewrite();

    assertOutput("import { c as d } from 'x';", "use(a, d);");
    assertThat(state.shouldRunAgain()).isTrue();
  }

  @Test
  public void testDropsImportWithoutRemainingBindings() {
    prepare("import * as ns from 'x';", "import { y } from 'y';");
    Node importStar = root.getFirstChild().getFirstChild().getSecondChild();
    state.addReference(bindings.identityOf(importStar), true);
    removedRef("y");

    rewrite();

    assertOutput("");
    assertThat(state.shouldRunAgain()).isTrue();
  }

  @Test
  public void testKeepsImportsWithoutBindings() {
    prepare("import 'x';", "import {} from 'y';");

    rewrite();

    assertOutput("import 'x';", "import {} from 'y';");
    assertThat(state.shouldRunAgain()).isFalse();
  }

  @Test
  public void testSurvivingReferenceKeepsBinding() {
    prepare("function f() {}", "const g = 1;", "import { h } from 'h';");
    for (String name : new String[] {"f", "g", "h"}) {
      removedRef(name);
      survivingRef(name);
    }

    rewrite();

    assertOutput("function f() {}", "const g = 1;", "import { h } from 'h';");
    assertThat(state.shouldRunAgain()).isFalse();
  }

  @Test
  public void testDropsFunctionAndProposesWhatItReferenced() {
    prepare("function g() {}", "function f() { return g(); }");
    removedRef("f");

    rewrite();

    assertOutput("function g() {}");
    assertThat(state.getRemovedReferences()).contains(identity("g"));
    assertThat(state.shouldRunAgain()).isTrue();
  }

  @Test
  public void testDropsClass() {
    prepare("class A { m() { return b; } }", "class C {}");
    removedRef("A");
    BindingIdentity b = identity("b");

    rewrite();

    assertOutput("class C {}");
    assertThat(state.getRemovedReferences()).contains(b);
  }

  @Test
  public void testDropsDeclaratorsAndProposesInitializers() {
    prepare("const a = b, c = 1;", "let d;");
    removedRef("a");
    removedRef("d");
    BindingIdentity b = identity("b");

    rewrite();

    assertOutput("const c = 1;");
    assertThat(state.getRemovedReferences()).contains(b);
    assertThat(state.shouldRunAgain()).isTrue();
  }

  @Test
  public void testDropsExportOfEmptiedDeclaration() {
    prepare("export const a = 1;", "export let b = a;");
    removedRef("a");

    rewrite();

    assertOutput("export let b = a;");
  }

  @Test
  public void testDropsExportedTargetsUnconditionally() {
    targets = RemovalTargets.of("getStaticProps", "getServerSideProps");
    prepare(
        "export const getServerSideProps = load;",
        "export function getStaticProps() { return x; }",
        "export const other = getStaticProps;");
    survivingRef("getServerSideProps");
    survivingRef("getStaticProps");
    BindingIdentity load = identity("load");
    BindingIdentity x = identity("x");

    rewrite();

    assertOutput("export const other = getStaticProps;");
    assertThat(state.getRemovedReferences()).containsAtLeast(load, x);
  }

  @Test
  public void testReplacesDefaultExport() {
    targets = RemovalTargets.of("default");
    prepare("export default Page;");

    rewrite();

    assertOutput("export default function() {}");
  }

  @Test
  public void testKeepsEmptyDefaultFunction() {
    targets = RemovalTargets.of("default");
    prepare("export default function() {}");
    Node function = root.getFirstChild().getFirstChild().getFirstChild();

    rewrite();

    assertThat(root.getFirstChild().getFirstChild().getFirstChild()).isSameInstanceAs(function);
    assertThat(state.shouldRunAgain()).isFalse();
  }

  @Test
  public void testDropsExportSpecifierAndProposesItsBinding() {
    prepare("const load = 1;", "export { load as getStaticProps, load as other };");

    rewrite();

    assertOutput("const load = 1;", "export { load as other };");
    assertThat(state.getRemovedReferences()).containsExactly(identity("load"));
    assertThat(state.shouldRunAgain()).isTrue();
  }

  @Test
  public void testDropsEmptiedExportSpecifiers() {
    prepare("const getStaticProps = 1;", "export { getStaticProps };");

    rewrite();

    assertOutput("const getStaticProps = 1;");
  }

  @Test
  public void testPrunesObjectPattern() {
    prepare("const { a, b: c, [k]: e, ...f } = o;");
    removedRef("a");
    removedRef("e");
    removedRef("f");

    rewrite();

    assertOutput("const { b: c } = o;");
    assertThat(state.shouldRunAgain()).isTrue();
  }

  @Test
  public void testDroppedComputedPropertyProposesItsKey() {
    prepare("const { [key()]: a, b } = o;");
    removedRef("a");
    BindingIdentity key = identity("key");

    rewrite();

    assertOutput("const { b } = o;");
    assertThat(state.getRemovedReferences()).contains(key);
  }

  @Test
  public void testPrunesArrayPatternLeavingHoles() {
    prepare("const [a, b, c] = arr;", "const [d = init(), e] = arr;");
    removedRef("a");
    removedRef("c");
    removedRef("d");
    BindingIdentity init = identity("init");

    rewrite();

    assertOutput("const [, b] = arr;", "const [, e] = arr;");
    assertThat(state.getRemovedReferences()).contains(init);
  }

  @Test
  public void testPrunesNestedPatterns() {
    prepare("const { a: [b, { c }] } = o;");
    removedRef("c");

    rewrite();

    assertOutput("const { a: [b] } = o;");
  }

  @Test
  public void testDropsFullyPrunedPattern() {
    prepare("const { a = init(), ...rest } = o, z = 1;");
    removedRef("a");
    removedRef("rest");
    BindingIdentity init = identity("init");
    BindingIdentity o = identity("o");

    rewrite();

    assertOutput("const z = 1;");
    assertThat(state.getRemovedReferences()).containsAtLeast(init, o);
  }

  @Test
  public void testKeepsEmptyPatterns() {
    prepare("const {} = o;", "const [] = p;");

    rewrite();

    assertOutput("const {} = o;", "const [] = p;");
    assertThat(state.shouldRunAgain()).isFalse();
  }

  @Test
  public void testKeepsEnhancedForHeads() {
    prepare("for (const x of xs) {}", "for (var y in ys) {}");
    removedRef("x");
    removedRef("y");

    rewrite();

    assertOutput("for (const x of xs) {}", "for (var y in ys) {}");
  }

  @Test
  public void testRemovesEmptyStatementsFromBlocks() {
    prepare("if (a) { var b = 1; ; }", "function f() { ; return 1; }");
    removedRef("b");

    rewrite();

    assertOutput("if (a) {}", "function f() { return 1; }");
  }

  private void prepare(String... source) {
    root = parse(lines(source));
    bindings = new SyntacticBindingResolver(compiler).resolve(root);
    state = new ExportRemovalState(targets);
  }

  private void rewrite() {
    getProcessor(compiler).process(null, root);
  }

  private BindingIdentity identity(String name) {
    return bindings.identityOf(findName(root, name));
  }

  private void removedRef(String name) {
    state.addReference(identity(name), true);
  }

  private void survivingRef(String name) {
    state.addReference(identity(name), false);
  }

  private void assertOutput(String... expected) {
    assertThat(print(root)).isEqualTo(print(parse(lines(expected))));
  }
}
