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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.nio.file.Paths;
import javax.annotation.Nullable;

/** How the engine writes a new rule, or a new declaration file, for one role. */
@AutoValue
public abstract class OnCreateOptions {

  public static final String DEFAULT_TARGET_FORMAT = "<filename>";

  /** The rule kind of a new rule, e.g. {@code filegroup}. */
  public abstract String ruleName();

  /** The template of a new rule's {@code name}; see {@link #formatTarget}. */
  public abstract String targetFormat();

  /** The comment written at the top of new files; empty for none. */
  public abstract String fileHeading();

  /** Whether a new rule lists the file itself as its sources, rather than a glob. */
  public abstract boolean explicitDeps();

  public abstract GlobMatchers globMatchers();

  /** Whether to leave out fields that would be empty. */
  public abstract boolean omitEmptyFields();

  /** The build definitions a file needs included, or null to leave {@code subinclude} alone. */
  @Nullable
  public abstract ImmutableList<String> subinclude();

  /** The value of a new rule's {@code test_only} field, or null to leave it out. */
  @Nullable
  public abstract Boolean testOnly();

  /** The value of a new rule's {@code visibility} field, or null to leave it out. */
  @Nullable
  public abstract ImmutableList<String> initialVisibility();

  /**
   * Applies {@link #targetFormat} to a file path. The template may contain {@code <path>} (the
   * path), {@code <basename>} (its last segment), {@code <filename>} (the last segment without its
   * extension) and {@code <firstname>} (the last segment up to its first dot).
   */
  public String formatTarget(String targetPath) {
    return formatTarget(targetPath, targetFormat());
  }

  static String formatTarget(String targetPath, String format) {
    Path fileName = Paths.get(targetPath).getFileName();
    String baseName = fileName == null ? "" : fileName.toString();
    String name = stripExtension(baseName);
    int dot = name.indexOf('.');
    String firstName = dot < 0 ? name : name.substring(0, dot);
    return format
        .replace("<path>", targetPath)
        .replace("<basename>", baseName)
        .replace("<filename>", name)
        .replace("<firstname>", firstName);
  }

  // A leading dot starts a name, not an extension: ".eslintrc" has none.
  private static String stripExtension(String baseName) {
    int dot = baseName.lastIndexOf('.');
    return dot <= 0 ? baseName : baseName.substring(0, dot);
  }

  public static Builder builder() {
    return new AutoValue_OnCreateOptions.Builder()
        .setTargetFormat(DEFAULT_TARGET_FORMAT)
        .setFileHeading("")
        .setExplicitDeps(true)
        .setGlobMatchers(GlobMatchers.EMPTY)
        .setOmitEmptyFields(false);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link OnCreateOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setRuleName(String value);

    public abstract Builder setTargetFormat(String value);

    public abstract Builder setFileHeading(String value);

    public abstract Builder setExplicitDeps(boolean value);

    public abstract Builder setGlobMatchers(GlobMatchers value);

    public abstract Builder setOmitEmptyFields(boolean value);

    public abstract Builder setSubinclude(@Nullable ImmutableList<String> value);

    public abstract Builder setTestOnly(@Nullable Boolean value);

    public abstract Builder setInitialVisibility(@Nullable ImmutableList<String> value);

    public abstract OnCreateOptions build();
  }
}
