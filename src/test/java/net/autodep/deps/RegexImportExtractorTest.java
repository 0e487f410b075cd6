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

package net.autodep.deps;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Joiner;
import net.autodep.config.RuleRole;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RegexImportExtractorTest {

  private final RegexImportExtractor extractor = new RegexImportExtractor();

  @Test
  public void testImportForms() {
    String text =
        Joiner.on('\n')
            .join(
                "import React from \"react\";",
                "import { a, b } from './a';",
                "import * as c from \"../c\";",
                "export { d } from './d';",
                "import './styles.css';",
                "const e = require(\"./e\");",
                "const f = await import('./f');",
                "import type { T } from \"./types\";");
    assertThat(extractor.extractImports(text, RuleRole.MODULE))
        .containsExactly(
            "react", "./a", "../c", "./d", "./styles.css", "./e", "./f", "./types")
        .inOrder();
  }

  @Test
  public void testMultilineImport() {
    String text = "import {\n  x,\n  y,\n} from \"./x\";\n";
    assertThat(extractor.extractImports(text, RuleRole.TEST)).containsExactly("./x");
  }

  @Test
  public void testEachImportOnce() {
    String text = "import a from './a';\nimport { b } from './a';\nrequire('./a');\n";
    assertThat(extractor.extractImports(text, RuleRole.MODULE)).containsExactly("./a");
  }

  @Test
  public void testPlainExportsAndStringsAreNotImports() {
    String text = "export const label = \"from\";\nconst from = 'x';\nexport default label;\n";
    assertThat(extractor.extractImports(text, RuleRole.MODULE)).isEmpty();
  }
}
