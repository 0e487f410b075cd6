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

package net.autodep.errors;

import javax.annotation.Nullable;

/**
 * The text of user-facing messages. Messages that report a failure say what to change to fix it.
 */
public final class Messages {

  private Messages() {}

  public static String attempt(String action, String subject) {
    return "attempting to " + action + " " + subject;
  }

  public static String success(String result, String subject) {
    return "successfully " + result + " " + subject;
  }

  public static String failure(String action, String subject) {
    return "failed to " + action + " " + subject;
  }

  public static String unexpected(String subject) {
    return "unexpected " + subject;
  }

  public static String identified(String type, String subject) {
    return "identified " + subject + " as " + type;
  }

  public static String locateFailure(String subject) {
    return "failed to locate " + subject;
  }

  // Failed preconditions.

  public static String noBuildFilesInWorkspace(String proposedPath) {
    return locateFailure("any `BUILD` or `BUILD.plz` files in the workspace.")
        + "\nTo create one at "
        + proposedPath
        + ", add `enablePropagation: false` to an .autodep.yaml file,"
        + " either in the target directory or in a parent directory.";
  }

  public static String noRuleFoundForDependency(String dep, String nearestBuildFile) {
    return "failed to resolve file at "
        + dep
        + " in its nearest `BUILD` file "
        + nearestBuildFile
        + "."
        + "\nTry saving that file to generate a valid rule.";
  }

  public static String unparsableBuildFile(String path, String errors) {
    return failure("parse", path)
        + ". Fix the syntax errors below and save again; the file was left unchanged.\n"
        + errors;
  }

  // User errors.

  public static String unsupportedFileType(String path) {
    return "unsupported file type: "
        + path
        + ". Check your settings at `<autodepConfig>.match.(module|test|fixture)`."
        + " Note, you don't have to double-escape your regex matchers.";
  }

  public static String unresolvedImport(String importPath, String sourceFile) {
    return failure("de-alias", importPath)
        + " imported by "
        + sourceFile
        + ". Map it to a build target under `<autodepConfig>.manage.knownTargets`, or skip it"
        + " under `<autodepConfig>.ignore.(module|test|fixture).paths`.";
  }

  public static String buildRuleSchemaMismatch(
      @Nullable String ruleName, String fieldName, String fieldAlias, String expectedFieldType) {
    return "found \""
        + fieldAlias
        + "\"-aliased `"
        + fieldName
        + "` field within `"
        + (ruleName == null ? "<unknown>" : ruleName)
        + "` rule, but it was not of type \""
        + expectedFieldType
        + "\" type. Check your `<autodepConfig>.manage.schema` if this is incorrect.";
  }

  public static String invalidConfig(String configPath, String problem) {
    return "invalid configuration at " + configPath + ": " + problem;
  }

  public static String configInheritanceCycle(String configPath) {
    return "configuration at "
        + configPath
        + " extends itself, directly or through its parents. Check the `extends` keys of your"
        + " .autodep.yaml files.";
  }
}
