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

package net.autodep.cli;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import net.autodep.config.AutodepConfig;
import net.autodep.config.AutodepContext;
import net.autodep.config.ConfigLoader;
import net.autodep.deps.LocalModuleResolver;
import net.autodep.deps.ModuleResolver.Resolution;
import net.autodep.deps.RegexImportExtractor;
import net.autodep.errors.AutodepException;
import net.autodep.errors.ErrorType;
import net.autodep.events.Event;
import net.autodep.events.EventKind;
import net.autodep.events.StoredEventHandler;
import net.autodep.rewrite.TaskStatus;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AutodepTest {

  @Rule public TemporaryFolder tmp = new TemporaryFolder();

  private final StoredEventHandler events = new StoredEventHandler();
  private Path root;

  @Before
  public void createWorkspace() throws IOException {
    root = tmp.newFolder("ws").toPath();
    write("lib/BUILD", "filegroup(name = \"lib\", srcs = [\"index.ts\", \"util.ts\"])");
    write("lib/index.ts", "export * from './util';");
    write("lib/util.ts", "export const one = 1;");
    write("lib/orphan.ts", "export const two = 2;");
    write("app/BUILD", "filegroup(name = \"helpers\", srcs = [\"helpers.ts\"])");
    write("app/helpers.ts", "export const help = true;");
    write(
        "app/main.ts",
        "import React from 'react';",
        "import { one } from '../lib';",
        "import { one as uno } from '../lib/util';",
        "import { help } from './helpers';");
    write("app/main.test.ts", "import './main';", "import { help } from './helpers';");
  }

  private Path write(String path, String... lines) throws IOException {
    Path file = root.resolve(path);
    Files.createDirectories(file.getParent());
    return Files.write(file, (Joiner.on('\n').join(lines) + "\n").getBytes(UTF_8));
  }

  private String read(String path) throws IOException {
    return new String(Files.readAllBytes(root.resolve(path)), UTF_8);
  }

  private static String lines(String... lines) {
    return Joiner.on('\n').join(lines) + "\n";
  }

  private static AutodepConfig config(String... lines) {
    return ConfigLoader.parse(Joiner.on('\n').join(lines), "test.yaml");
  }

  private static AutodepConfig withReact() {
    return config("manage:", "  knownTargets:", "    react: '//third_party:react'");
  }

  private Autodep autodep(AutodepConfig config) {
    return new Autodep(
        new AutodepContext(config, events),
        root,
        new RegexImportExtractor(),
        new LocalModuleResolver(),
        new NearestBuildFileLocator(root));
  }

  @Test
  public void testAppendsRuleWithResolvedDependencies() throws IOException {
    assertThat(autodep(withReact()).process(root.resolve("app/main.ts")))
        .isEqualTo(TaskStatus.SUCCESS);
    assertThat(read("app/BUILD"))
        .isEqualTo(
            lines(
                "filegroup(name = \"helpers\", srcs = [\"helpers.ts\"])",
                "",
                "filegroup(",
                "    name = \"main\",",
                "    srcs = [\"main.ts\"],",
                "    deps = [",
                "        \":helpers\",",
                "        \"//third_party:react\",",
                "        \"/lib\",",
                "    ],",
                "    visibility = [\"PUBLIC\"],",
                ")"));
    assertThat(events.getEvents(EventKind.WARNING)).isEmpty();
    assertThat(events.getEvents(EventKind.ERROR)).isEmpty();
  }

  @Test
  public void testSecondRunChangesNothing() throws IOException {
    Autodep autodep = autodep(withReact());
    autodep.process(root.resolve("app/main.ts"));
    String first = read("app/BUILD");
    autodep.process(root.resolve("app/main.ts"));
    assertThat(read("app/BUILD")).isEqualTo(first);
  }

  @Test
  public void testUnresolvedImportIsAnErrorButTheRestIsWritten() throws IOException {
    Path main = root.resolve("app/main.ts");
    assertThat(autodep(AutodepConfig.defaults()).process(main))
        .isEqualTo(TaskStatus.PARTIAL_SUCCESS);
    assertThat(events.getEvents(EventKind.ERROR))
        .containsExactly(
            Event.error(
                "Autodep.resolve",
                "failed to de-alias react imported by "
                    + main
                    + ". Map it to a build target under `<autodepConfig>.manage.knownTargets`,"
                    + " or skip it under `<autodepConfig>.ignore.(module|test|fixture).paths`."));
    assertThat(read("app/BUILD")).doesNotContain("react");
    assertThat(read("app/BUILD")).contains("        \"/lib\",\n");
  }

  @Test
  public void testImportsNoResolverKnows() throws IOException {
    Autodep autodep =
        new Autodep(
            new AutodepContext(AutodepConfig.defaults(), events),
            root,
            new RegexImportExtractor(),
            (importPath, fromFile) -> Resolution.passthrough(),
            new NearestBuildFileLocator(root));
    ImmutableMap<Path, TaskStatus> results =
        autodep.processAll(ImmutableList.of(root.resolve("app/main.test.ts")));
    assertThat(results)
        .containsExactly(root.resolve("app/main.test.ts"), TaskStatus.PARTIAL_SUCCESS);
    assertThat(events.getEvents(EventKind.ERROR)).hasSize(2);
    assertThat(read("app/BUILD")).contains("    deps = [],\n");
  }

  @Test
  public void testIgnoredImportIsNotAFailure() throws IOException {
    AutodepConfig config = config("ignore:", "  module:", "    paths: [react]");
    assertThat(autodep(config).process(root.resolve("app/main.ts")))
        .isEqualTo(TaskStatus.SUCCESS);
    assertThat(events.getEvents(EventKind.ERROR)).isEmpty();
  }

  @Test
  public void testTestFileDependsOnItsModule() throws IOException {
    Autodep autodep = autodep(withReact());
    ImmutableMap<Path, TaskStatus> results =
        autodep.processAll(
            ImmutableList.of(root.resolve("app/main.ts"), root.resolve("app/main.test.ts")));
    assertThat(results.values()).containsExactly(TaskStatus.SUCCESS, TaskStatus.SUCCESS);
    assertThat(read("app/BUILD"))
        .endsWith(
            lines(
                "filegroup(",
                "    name = \"main.test\",",
                "    srcs = [\"main.test.ts\"],",
                "    deps = [",
                "        \":helpers\",",
                "        \":main\",",
                "    ],",
                ")"));
  }

  @Test
  public void testOwnRuleIsNotADependency() throws IOException {
    autodep(AutodepConfig.defaults()).process(root.resolve("lib/index.ts"));
    assertThat(read("lib/BUILD"))
        .isEqualTo(
            lines(
                "filegroup(",
                "    name = \"lib\",",
                "    srcs = [\"index.ts\", \"util.ts\"],",
                "    deps = [],",
                ")"));
  }

  @Test
  public void testIgnoredTargetsAndPaths() throws IOException {
    AutodepConfig config =
        config(
            "manage:",
            "  knownTargets:",
            "    react: '//third_party:react'",
            "ignore:",
            "  paths: [lib/]",
            "  targets:",
            "    - '//third_party:react'");
    autodep(config).process(root.resolve("app/main.ts"));
    assertThat(read("app/BUILD")).contains("    deps = [\":helpers\"],\n");
  }

  @Test
  public void testFileWithoutRuleFailsThePrecondition() throws IOException {
    write("app/other.ts", "import { two } from '../lib/orphan';");
    AutodepException e =
        assertThrows(
            AutodepException.class,
            () -> autodep(AutodepConfig.defaults()).process(root.resolve("app/other.ts")));
    assertThat(e.getType()).isEqualTo(ErrorType.FAILED_PRECONDITION);
    assertThat(e).hasMessageThat().contains(root.resolve("lib/orphan.ts").toString());
    assertThat(read("app/BUILD")).doesNotContain("other");
  }

  @Test
  public void testFailuresDoNotStopTheOthers() throws IOException {
    write("app/other.ts", "import { two } from '../lib/orphan';");
    ImmutableMap<Path, TaskStatus> results =
        autodep(withReact())
            .processAll(
                ImmutableList.of(root.resolve("app/other.ts"), root.resolve("app/main.ts")));
    assertThat(results)
        .containsExactly(
            root.resolve("app/other.ts"), TaskStatus.FAILED,
            root.resolve("app/main.ts"), TaskStatus.SUCCESS)
        .inOrder();
    assertThat(events.getEvents(EventKind.ERROR)).hasSize(1);
  }

  @Test
  public void testUnsupportedFileType() throws IOException {
    Path readme = write("app/README.md", "# App");
    AutodepException e =
        assertThrows(AutodepException.class, () -> autodep(withReact()).process(readme));
    assertThat(e.getType()).isEqualTo(ErrorType.USER);
  }

  @Test
  public void testCreatesBuildFileWithoutPropagation() throws IOException {
    write("app/widgets/button.ts", "import { help } from '../helpers';");
    autodep(AutodepConfig.defaults()).process(root.resolve("app/widgets/button.ts"));
    assertThat(read("app/widgets/BUILD"))
        .isEqualTo(
            lines(
                "filegroup(",
                "    name = \"button\",",
                "    srcs = [\"button.ts\"],",
                "    deps = [\"/app:helpers\"],",
                "    visibility = [\"PUBLIC\"],",
                ")"));
  }

  @Test
  public void testPropagationWritesToTheNearestFile() throws IOException {
    write("app/widgets/button.ts", "import { help } from '../helpers';");
    autodep(config("enablePropagation: true")).process(root.resolve("app/widgets/button.ts"));
    assertThat(Files.exists(root.resolve("app/widgets/BUILD"))).isFalse();
    assertThat(read("app/BUILD"))
        .isEqualTo(
            lines(
                "filegroup(name = \"helpers\", srcs = [\"helpers.ts\"])",
                "",
                "filegroup(",
                "    name = \"button\",",
                "    srcs = [\"widgets/button.ts\"],",
                "    deps = [\":helpers\"],",
                "    visibility = [\"PUBLIC\"],",
                ")"));
  }

  @Test
  public void testPropagationWithoutBuildFiles() throws IOException {
    Path lonely = write("tools/lonely.ts", "");
    Autodep autodep = autodep(config("enablePropagation: true"));
    AutodepException e = assertThrows(AutodepException.class, () -> autodep.process(lonely));
    assertThat(e.getType()).isEqualTo(ErrorType.FAILED_PRECONDITION);
    assertThat(e).hasMessageThat().contains(root.resolve("tools/BUILD").toString());
  }

  @Test
  public void testExistingBuildPlzIsUsed() throws IOException {
    Path plz = write("site/BUILD.plz", "");
    write("site/page.ts", "");
    Autodep autodep = autodep(AutodepConfig.defaults());
    assertThat(autodep.resolveTargetBuildFile(root.resolve("site/page.ts")).toString())
        .isEqualTo(plz.toString());
  }
}
