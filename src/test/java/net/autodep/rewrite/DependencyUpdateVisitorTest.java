// Copyright 2024 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.autodep.rewrite;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.nio.file.Paths;
import net.autodep.config.AutodepConfig;
import net.autodep.config.AutodepContext;
import net.autodep.config.ConfigLoader;
import net.autodep.events.StoredEventHandler;
import net.autodep.syntax.BuildFile;
import net.autodep.syntax.ParserInput;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DependencyUpdateVisitorTest {

  private static final Path DIR = Paths.get("/ws/pkg");

  private final StoredEventHandler events = new StoredEventHandler();

  private VisitResult<ImmutableList<String>> update(
      String text, ImmutableList<String> deps, String... configLines) {
    AutodepConfig config =
        configLines.length == 0
            ? AutodepConfig.defaults()
            : ConfigLoader.parse(Joiner.on('\n').join(configLines), "test.yaml");
    VisitContext context =
        VisitContext.create(new AutodepContext(config, events), DIR, DIR.resolve("app.ts"));
    BuildFile file = BuildFile.parse(ParserInput.fromString(text, "/ws/pkg/BUILD"));
    return new DependencyUpdateVisitor(context, deps).visit(file);
  }

  private static String lines(String... lines) {
    return Joiner.on('\n').join(lines) + "\n";
  }

  @Test
  public void testReplacesDependencies() {
    VisitResult<ImmutableList<String>> result =
        update(
            lines(
                "filegroup(",
                "    name = \"app\",",
                "    srcs = [\"app.ts\"],",
                "    deps = [\":old\"],",
                ")"),
            ImmutableList.of(":a", "//b"));
    assertThat(result.status()).isEqualTo(TaskStatus.SUCCESS);
    assertThat(result.value()).containsExactly(":old");
    assertThat(result.root().toString())
        .isEqualTo(
            lines(
                "filegroup(",
                "    name = \"app\",",
                "    srcs = [\"app.ts\"],",
                "    deps = [",
                "        \":a\",",
                "        \"//b\",",
                "    ],",
                ")"));
  }

  @Test
  public void testSecondUpdateChangesNothing() {
    String text =
        lines(
            "filegroup(name = \"util\", srcs = [\"util.ts\"])",
            "",
            "filegroup(name = \"app\", srcs = [\"app.ts\"], deps = [\":old\"])");
    ImmutableList<String> deps = ImmutableList.of(":util", "/lib", "//third_party:x");
    String once = update(text, deps).root().toString();
    assertThat(update(once, deps).root().toString()).isEqualTo(once);
    assertThat(once).startsWith(lines("filegroup(name = \"util\", srcs = [\"util.ts\"])"));
  }

  @Test
  public void testSameDependenciesKeepTheLayout() {
    String text =
        lines(
            "filegroup(",
            "    name = \"app\",",
            "    srcs = [\"app.ts\"],",
            "    deps = [\":a\", \":b\"],  # pinned",
            ")");
    VisitResult<ImmutableList<String>> result = update(text, ImmutableList.of(":a", ":b"));
    assertThat(result.status()).isEqualTo(TaskStatus.SUCCESS);
    assertThat(result.root().toString()).isEqualTo(text);
  }

  @Test
  public void testAddsMissingDependencies() {
    VisitResult<ImmutableList<String>> result =
        update(
            lines(
                "# Docs.",
                "",
                "filegroup(",
                "    name = \"app\",",
                "    srcs = [\"app.ts\"],",
                ")"),
            ImmutableList.of(":a"));
    assertThat(result.value()).isEmpty();
    assertThat(result.root().toString())
        .isEqualTo(
            lines(
                "# Docs.",
                "",
                "filegroup(",
                "    name = \"app\",",
                "    srcs = [\"app.ts\"],",
                "    deps = [\":a\"],",
                ")"));
  }

  @Test
  public void testOnlyTheOwningRuleChanges() {
    String other =
        lines(
            "filegroup(",
            "    name = \"util\",",
            "    srcs = [\"util.ts\"],",
            "    deps = [\":x\"],",
            ")");
    VisitResult<ImmutableList<String>> result =
        update(
            other + lines("", "filegroup(name = \"app\", srcs = [\"app.ts\"], deps = [])"),
            ImmutableList.of(":util"));
    assertThat(result.root().toString())
        .isEqualTo(
            other
                + lines("", "filegroup(name = \"app\", srcs = [\"app.ts\"], deps = [\":util\"])"));
  }

  @Test
  public void testOmitEmptyFieldsDropsTheField() {
    VisitResult<ImmutableList<String>> result =
        update(
            lines(
                "filegroup(",
                "    name = \"app\",",
                "    srcs = [\"app.ts\"],",
                "    deps = [\":old\"],",
                "    visibility = [\"PUBLIC\"],",
                ")"),
            ImmutableList.of(),
            "onUpdate:",
            "  omitEmptyFields: true");
    assertThat(result.value()).containsExactly(":old");
    assertThat(result.root().toString())
        .isEqualTo(
            lines(
                "filegroup(",
                "    name = \"app\",",
                "    srcs = [\"app.ts\"],",
                "    visibility = [\"PUBLIC\"],",
                ")"));
  }

  @Test
  public void testEmptyDependenciesWithoutOmitting() {
    VisitResult<ImmutableList<String>> result =
        update(
            lines("filegroup(name = \"app\", srcs = [\"app.ts\"], deps = [\":old\"])"),
            ImmutableList.of());
    assertThat(result.root().toString())
        .isEqualTo(lines("filegroup(name = \"app\", srcs = [\"app.ts\"], deps = [])"));
  }

  @Test
  public void testAliasedDependencies() {
    VisitResult<ImmutableList<String>> result =
        update(
            lines("js_library(name = \"app\", srcs = [\"app.ts\"], extra_deps = [\":old\"])"),
            ImmutableList.of(":new"),
            "manage:",
            "  schema:",
            "    js_library:",
            "      deps: [deps, extra deps]");
    assertThat(result.status()).isEqualTo(TaskStatus.SUCCESS);
    assertThat(result.root().toString())
        .isEqualTo(
            lines("js_library(name = \"app\", srcs = [\"app.ts\"], extra_deps = [\":new\"])"));
  }

  @Test
  public void testNoOwningRule() {
    String text = lines("filegroup(name = \"util\", srcs = [\"util.ts\"])");
    VisitResult<ImmutableList<String>> result = update(text, ImmutableList.of(":a"));
    assertThat(result.status()).isEqualTo(TaskStatus.FAILED);
    assertThat(result.reason()).isEqualTo(DependencyUpdateVisitor.NOT_FOUND);
    assertThat(result.root().toString()).isEqualTo(text);
  }

  @Test
  public void testRefreshesTheHeading() {
    VisitResult<ImmutableList<String>> result =
        update(
            lines(
                "# Generated by autodep.",
                "# Do not edit.",
                "",
                "filegroup(name = \"app\", srcs = [\"app.ts\"], deps = [])"),
            ImmutableList.of(),
            "onCreate:",
            "  fileHeading: Generated by autodep.",
            "onUpdate:",
            "  fileHeading: Updated by autodep.");
    assertThat(result.root().toString())
        .isEqualTo(
            lines(
                "# Updated by autodep.",
                "",
                "filegroup(name = \"app\", srcs = [\"app.ts\"], deps = [])"));
  }

  @Test
  public void testForeignHeadingIsKept() {
    String text =
        lines("# Hand written.", "", "filegroup(name = \"app\", srcs = [\"app.ts\"], deps = [])");
    VisitResult<ImmutableList<String>> result =
        update(text, ImmutableList.of(), "onUpdate:", "  fileHeading: Updated by autodep.");
    assertThat(result.root().toString()).isEqualTo(text);
  }

  @Test
  public void testMergesSubinclude() {
    VisitResult<ImmutableList<String>> result =
        update(
            lines(
                "subinclude(\"//build_defs:js\")",
                "",
                "filegroup(name = \"app\", srcs = [\"app.ts\"], deps = [])"),
            ImmutableList.of(),
            "onUpdate:",
            "  subinclude: ['//build_defs:ts', '//build_defs:js']");
    assertThat(result.root().toString())
        .isEqualTo(
            lines(
                "subinclude(",
                "    \"//build_defs:js\",",
                "    \"//build_defs:ts\",",
                ")",
                "",
                "filegroup(name = \"app\", srcs = [\"app.ts\"], deps = [])"));
  }
}
