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
import java.nio.file.Path;
import java.nio.file.Paths;
import net.autodep.config.AutodepConfig;
import net.autodep.config.AutodepContext;
import net.autodep.config.ConfigLoader;
import net.autodep.events.StoredEventHandler;
import net.autodep.qualify.ArrayField;
import net.autodep.qualify.FieldLiteral;
import net.autodep.qualify.GlobField;
import net.autodep.syntax.BuildFile;
import net.autodep.syntax.ParserInput;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RuleNameVisitorTest {

  private static final Path DIR = Paths.get("/ws/pkg");

  private static final String FILE =
      Joiner.on('\n')
          .join(
              "# Libraries.",
              "",
              "filegroup(",
              "    name = \"util\",",
              "    srcs = [\"util.ts\"],",
              ")",
              "",
              "genrule(",
              "    name = \"gen\",",
              "    srcs = [\"gen.ts\"],",
              ")",
              "",
              "java_library(",
              "    name = \"other\",",
              "    srcs = [\"app.ts\"],",
              ")",
              "",
              "filegroup(",
              "    name = \"app\",",
              "    srcs = glob([\"*.ts\"], exclude = [\"util.ts\"]),",
              ")",
              "");

  private final StoredEventHandler events = new StoredEventHandler();

  private VisitContext context(String file, AutodepConfig config) {
    return VisitContext.create(new AutodepContext(config, events), DIR, DIR.resolve(file));
  }

  private static BuildFile parse(String text) {
    return BuildFile.parse(ParserInput.fromString(text, "/ws/pkg/BUILD"));
  }

  private static AutodepConfig globSrcs() {
    return ConfigLoader.parse(
        Joiner.on('\n')
            .join(
                "manage:",
                "  schema:",
                "    filegroup:",
                "      srcs:",
                "        - srcs",
                "        - value: srcs",
                "          as: glob"),
        "test.yaml");
  }

  @Test
  public void testNameOfOwningRule() {
    VisitResult<String> result =
        new RuleNameVisitor(context("util.ts", AutodepConfig.defaults())).visit(parse(FILE));
    assertThat(result.status()).isEqualTo(TaskStatus.SUCCESS);
    assertThat(result.value()).isEqualTo("util");
  }

  @Test
  public void testManagedByDefault() {
    VisitResult<String> result =
        new RuleNameVisitor(context("gen.ts", AutodepConfig.defaults())).visit(parse(FILE));
    assertThat(result.value()).isEqualTo("gen");
  }

  @Test
  public void testUnmanagedRulesAreSkipped() {
    VisitResult<String> result =
        new RuleNameVisitor(context("app.ts", AutodepConfig.defaults())).visit(parse(FILE));
    assertThat(result.status()).isEqualTo(TaskStatus.FAILED);
    assertThat(result.reason()).isEqualTo(RuleNameVisitor.NOT_FOUND);
    assertThat(result.value()).isNull();
  }

  @Test
  public void testRuleOwningByGlob() {
    VisitResult<String> result =
        new RuleNameVisitor(context("app.ts", globSrcs())).visit(parse(FILE));
    assertThat(result.status()).isEqualTo(TaskStatus.SUCCESS);
    assertThat(result.value()).isEqualTo("app");
    assertThat(events.isEmpty()).isTrue();
  }

  @Test
  public void testVisitLeavesTheInputAlone() {
    BuildFile file = parse(FILE);
    VisitResult<String> result =
        new RuleNameVisitor(context("util.ts", AutodepConfig.defaults())).visit(file);
    assertThat(result.root()).isNotSameInstanceAs(file);
    assertThat(result.root().toString()).isEqualTo(FILE);
    assertThat(file.toString()).isEqualTo(FILE);
  }

  @Test
  public void testSrcsField() {
    VisitResult<FieldLiteral> array =
        new SrcsFieldVisitor(context("util.ts", AutodepConfig.defaults())).visit(parse(FILE));
    assertThat(array.status()).isEqualTo(TaskStatus.SUCCESS);
    assertThat(((ArrayField) array.value()).getValues()).containsExactly("util.ts");

    VisitResult<FieldLiteral> glob =
        new SrcsFieldVisitor(context("app.ts", globSrcs())).visit(parse(FILE));
    GlobField field = (GlobField) glob.value();
    assertThat(field.getInclude()).containsExactly("*.ts");
    assertThat(field.getExclude()).containsExactly("util.ts");
    assertThat(field.includes("app.ts")).isTrue();
  }

  @Test
  public void testSrcsFieldOfUnownedFile() {
    VisitResult<FieldLiteral> result =
        new SrcsFieldVisitor(context("missing.js", AutodepConfig.defaults())).visit(parse(FILE));
    assertThat(result.status()).isEqualTo(TaskStatus.FAILED);
    assertThat(result.value()).isNull();
  }
}
