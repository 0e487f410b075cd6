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

package net.autodep.config;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import net.autodep.errors.AutodepException;
import net.autodep.errors.ErrorType;
import net.autodep.events.EventKind;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of reading {@code .autodep.yaml} files into {@link AutodepConfig}. */
@RunWith(JUnit4.class)
public class ConfigLoaderTest {

  @Rule public TemporaryFolder tmp = new TemporaryFolder();

  private Path write(String name, String... lines) throws Exception {
    Path path = tmp.getRoot().toPath().resolve(name);
    Files.createDirectories(path.getParent());
    Files.write(path, Joiner.on('\n').join(lines).getBytes(UTF_8));
    return path;
  }

  private static AutodepConfig parse(String... lines) {
    return ConfigLoader.parse(Joiner.on('\n').join(lines), "test.yaml");
  }

  @Test
  public void testDefaults() {
    AutodepConfig config = AutodepConfig.defaults();
    assertThat(config.rootDir()).isEqualTo(".");
    assertThat(config.managedRules()).containsExactly("filegroup", "genrule");
    assertThat(config.logLevels()).containsExactly(EventKind.ERROR, EventKind.WARNING);
    assertThat(config.enablePropagation()).isFalse();
    assertThat(config.buildFileName()).isEqualTo("BUILD");
    assertThat(config.knownTargets()).isEmpty();

    assertThat(config.roleOf("src/app.ts")).isEqualTo(RuleRole.MODULE);
    assertThat(config.roleOf("src/app.test.tsx")).isEqualTo(RuleRole.TEST);
    assertThat(config.roleOf("src/app.spec.js")).isEqualTo(RuleRole.TEST);
    assertThat(config.roleOf("src/app.mockData.ts")).isEqualTo(RuleRole.FIXTURE);
    assertThat(config.roleOf("README.md")).isNull();

    OnCreateOptions module = config.onCreate(RuleRole.MODULE);
    assertThat(module.ruleName()).isEqualTo("filegroup");
    assertThat(module.targetFormat()).isEqualTo("<filename>");
    assertThat(module.explicitDeps()).isTrue();
    assertThat(module.omitEmptyFields()).isFalse();
    assertThat(module.subinclude()).isNull();
    assertThat(module.testOnly()).isNull();
    assertThat(module.initialVisibility()).containsExactly("PUBLIC");
    assertThat(config.onCreate(RuleRole.TEST).initialVisibility()).isNull();

    assertThat(config.onUpdate(RuleRole.MODULE)).isEqualTo(OnUpdateOptions.DEFAULT);
    assertThat(config.ignore(RuleRole.FIXTURE)).isEqualTo(IgnoreOptions.NONE);
    assertThat(config.schema("anything")).isEqualTo(RuleSchema.DEFAULT);
  }

  @Test
  public void testEmptyFileHasTheDefaults() {
    AutodepConfig config = parse("");
    assertThat(config.rootDir()).isEqualTo(".");
    assertThat(config.managedRules()).isEqualTo(AutodepConfig.defaults().managedRules());
    assertThat(config.onCreate(RuleRole.FIXTURE))
        .isEqualTo(AutodepConfig.defaults().onCreate(RuleRole.FIXTURE));
  }

  @Test
  public void testTestOnlyIsUnsetUnlessConfigured() {
    assertThat(parse("onCreate:", "  name: ts_module").onCreate(RuleRole.FIXTURE).testOnly())
        .isNull();

    AutodepConfig config =
        parse("onCreate:", "  testOnly: true", "  fixture:", "    testOnly: false");
    assertThat(config.onCreate(RuleRole.MODULE).testOnly()).isTrue();
    assertThat(config.onCreate(RuleRole.FIXTURE).testOnly()).isFalse();
    assertThat(config.onCreate(RuleRole.TEST).testOnly()).isNull();
  }

  @Test
  public void testFullConfiguration() throws Exception {
    Path path = Paths.get(getClass().getResource("full.yaml").toURI());
    AutodepConfig config = ConfigLoader.load(path);

    assertThat(config.rootDir()).isEqualTo("..");
    assertThat(config.enablePropagation()).isTrue();
    assertThat(config.logLevels())
        .containsExactly(EventKind.ERROR, EventKind.WARNING, EventKind.INFO);
    assertThat(config.managedRules()).containsAtLeast("js_library", "ts_module", "filegroup");
    assertThat(config.knownTargets()).containsExactly("react", "//third_party/js:react");
    assertThat(config.buildFileName()).isEqualTo("BUILD.plz");

    RuleSchema schema = config.schema("ts_module");
    assertThat(schema.aliases(SchemaField.SRCS))
        .containsExactly(
            FieldEntry.of("srcs", FieldType.ARRAY), FieldEntry.of("srcs", FieldType.GLOB))
        .inOrder();
    assertThat(schema.aliases(SchemaField.DEPS))
        .containsExactly(
            FieldEntry.of("deps", FieldType.ARRAY), FieldEntry.of("extra_deps", FieldType.ARRAY))
        .inOrder();
    assertThat(schema.primary(SchemaField.TEST_ONLY))
        .isEqualTo(FieldEntry.of("test_only", FieldType.BOOL));
    assertThat(schema.primary(SchemaField.VISIBILITY))
        .isEqualTo(FieldEntry.of("visibility", FieldType.ARRAY));

    assertThat(config.roleOf("a/b.tsx")).isEqualTo(RuleRole.MODULE);
    assertThat(config.roleOf("a/b.spec.ts")).isEqualTo(RuleRole.TEST);
    assertThat(config.roleOf("a/b.js")).isNull();

    OnCreateOptions module = config.onCreate(RuleRole.MODULE);
    assertThat(module.ruleName()).isEqualTo("ts_module");
    assertThat(module.fileHeading()).isEqualTo("Generated by autodep.\nEdit freely.");
    assertThat(module.explicitDeps()).isFalse();
    assertThat(module.globMatchers())
        .isEqualTo(GlobMatchers.of(ImmutableList.of("**/*.ts"), ImmutableList.of("**/*.spec.ts")));
    assertThat(module.subinclude()).containsExactly("//build_defs:ts");
    assertThat(module.testOnly()).isFalse();

    OnCreateOptions test = config.onCreate(RuleRole.TEST);
    assertThat(test.ruleName()).isEqualTo("ts_test");
    assertThat(test.formatTarget("b.spec.ts")).isEqualTo("b.spec_test");
    assertThat(test.fileHeading()).isEqualTo(module.fileHeading());
    assertThat(test.globMatchers().include()).containsExactly("*.spec.ts");
    assertThat(test.globMatchers().exclude()).isEmpty();
    assertThat(test.testOnly()).isNull();

    assertThat(config.onUpdate(RuleRole.MODULE))
        .isEqualTo(OnUpdateOptions.of("Updated by autodep.", true, null));
    assertThat(config.onUpdate(RuleRole.FIXTURE).omitEmptyFields()).isFalse();

    assertThat(config.ignore(RuleRole.MODULE).isIgnoredPath("node_modules/react/index.js"))
        .isTrue();
    assertThat(config.ignore(RuleRole.MODULE).isIgnoredTarget("//third_party/js:tslib")).isTrue();
    assertThat(config.ignore(RuleRole.TEST).targets()).containsExactly("//testing:jest");
    assertThat(config.ignore(RuleRole.TEST).paths()).containsExactly("node_modules/");
  }

  @Test
  public void testExtendsMergesParentFirst() throws Exception {
    write(
        "base.yaml",
        "manage:",
        "  rules: [js_library, ts_module]",
        "  knownTargets:",
        "    react: //third_party:react",
        "enablePropagation: true");
    Path child =
        write(
            "pkg/.autodep.yaml",
            "extends: ../base.yaml",
            "manage:",
            "  rules: [ts_module, ts_test]",
            "  knownTargets:",
            "    lodash: //third_party:lodash",
            "enablePropagation: false");

    AutodepConfig config = ConfigLoader.load(child);
    assertThat(config.managedRules())
        .containsExactly("filegroup", "genrule", "js_library", "ts_module", "ts_test")
        .inOrder();
    assertThat(config.knownTargets())
        .containsExactly("react", "//third_party:react", "lodash", "//third_party:lodash");
    assertThat(config.enablePropagation()).isFalse();
  }

  @Test
  public void testExtendsCycle() throws Exception {
    write("a.yaml", "extends: b.yaml");
    Path b = write("b.yaml", "extends: a.yaml");
    AutodepException e = assertThrows(AutodepException.class, () -> ConfigLoader.load(b));
    assertThat(e.getType()).isEqualTo(ErrorType.USER);
    assertThat(e).hasMessageThat().contains("extends itself");
  }

  @Test
  public void testExtendsNeedsAFile() {
    AutodepException e =
        assertThrows(AutodepException.class, () -> parse("extends: other.yaml"));
    assertThat(e.getType()).isEqualTo(ErrorType.USER);
  }

  @Test
  public void testMerge() {
    Map<String, Object> parent =
        ImmutableMap.of(
            "rules", ImmutableList.of("a", "b"),
            "nested", ImmutableMap.of("x", 1, "y", 2),
            "other", ImmutableList.of("p"));
    Map<String, Object> child =
        ImmutableMap.of(
            "rules", ImmutableList.of("b", "c"),
            "nested", ImmutableMap.of("y", 3),
            "other", ImmutableList.of("q"));
    Map<String, Object> merged = ConfigLoader.merge(parent, child);
    assertThat(merged.get("rules")).isEqualTo(ImmutableList.of("a", "b", "c"));
    assertThat(merged.get("nested")).isEqualTo(ImmutableMap.of("x", 1, "y", 3));
    assertThat(merged.get("other")).isEqualTo(ImmutableList.of("q"));
  }

  @Test
  public void testInvalidValuesNameTheirKey() {
    AutodepException e =
        assertThrows(AutodepException.class, () -> parse("onCreate:", "  explicitDeps: maybe"));
    assertThat(e.getType()).isEqualTo(ErrorType.USER);
    assertThat(e).hasMessageThat().contains("`onCreate.explicitDeps`: expected true or false");

    e = assertThrows(AutodepException.class, () -> parse("log: [verbose]"));
    assertThat(e).hasMessageThat().contains("unknown level \"verbose\"");

    e = assertThrows(AutodepException.class, () -> parse("match:", "  module: \"(\""));
    assertThat(e).hasMessageThat().contains("`match.module`");

    e = assertThrows(AutodepException.class, () -> parse("- just", "- a list"));
    assertThat(e).hasMessageThat().contains("the top level must be a mapping");
  }

  @Test
  public void testYamlSyntaxError() {
    AutodepException e =
        assertThrows(AutodepException.class, () -> parse("onCreate:", "  name: [unclosed"));
    assertThat(e.getType()).isEqualTo(ErrorType.PARSER);
    assertThat(e).hasMessageThat().startsWith("File parsing error: invalid configuration at ");
  }

  @Test
  public void testSchemaEntryNeedsAKnownType() {
    AutodepException e =
        assertThrows(
            AutodepException.class,
            () ->
                parse(
                    "manage:",
                    "  schema:",
                    "    my_rule:",
                    "      srcs:",
                    "        - value: srcs",
                    "          as: tuple"));
    assertThat(e).hasMessageThat().contains("`manage.schema.my_rule.srcs`");
  }

  @Test
  public void testFindConfigFile() throws Exception {
    Path config = write("ws/.autodep.yaml", "rootDir: .");
    Path dir = tmp.newFolder("ws", "src", "app").toPath();
    assertThat(ConfigLoader.findConfigFile(dir, null).toString()).isEqualTo(config.toString());

    File other = tmp.newFolder("other");
    assertThat((Object) ConfigLoader.findConfigFile(other.toPath(), other.toPath())).isNull();
  }
}
