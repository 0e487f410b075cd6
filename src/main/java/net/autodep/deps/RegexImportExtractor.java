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

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.autodep.config.RuleRole;

/**
 * Finds the module specifiers of {@code import ... from "x"}, {@code export ... from "x"}, {@code
 * import "x"}, {@code require("x")} and {@code import("x")} by pattern matching. Imports inside
 * comments or strings are not told apart.
 */
public final class RegexImportExtractor implements ImportExtractor {

  private static final Pattern IMPORT =
      Pattern.compile(
          "(?:\\b(?:import|export)\\b[^'\";]*?\\bfrom\\s*"
              + "|\\bimport\\s*\\(?\\s*"
              + "|\\brequire\\s*\\(\\s*)"
              + "(['\"])([^'\"\\n]+)\\1");

  @Override
  public ImmutableList<String> extractImports(String fileText, RuleRole role) {
    Set<String> imports = new LinkedHashSet<>();
    Matcher matcher = IMPORT.matcher(fileText);
    while (matcher.find()) {
      imports.add(matcher.group(2));
    }
    return ImmutableList.copyOf(imports);
  }
}
