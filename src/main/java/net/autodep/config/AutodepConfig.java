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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import javax.annotation.Nullable;
import net.autodep.events.EventKind;

/**
 * The configuration of a run, read from {@code .autodep.yaml} by {@link ConfigLoader}. Immutable;
 * every role has an entry in each of the per-role maps.
 */
@AutoValue
public abstract class AutodepConfig {

  public static final String CONFIG_FILENAME = ".autodep.yaml";

  public static final String DEFAULT_RULE_NAME = "filegroup";
  public static final ImmutableList<String> DEFAULT_INITIAL_VISIBILITY = ImmutableList.of("PUBLIC");

  /** Rule kinds that are managed whatever the configuration says. */
  public static final ImmutableSet<String> ALWAYS_MANAGED_RULES =
      ImmutableSet.of("filegroup", "genrule");

  /** Built-in functions whose calls the engine reads and writes. */
  public static final ImmutableSet<String> MANAGED_BUILTINS = ImmutableSet.of("glob", "subinclude");

  public static final String DEFAULT_MODULE_MATCHER = ".*?\\.(js|jsx|ts|tsx)$";
  public static final String DEFAULT_TEST_MATCHER = ".*?\\.(spec|test)\\.(js|jsx|ts|tsx)$";
  public static final String DEFAULT_FIXTURE_MATCHER = ".*?\\.(mockData)\\.(js|jsx|ts|tsx)$";

  public static final ImmutableSet<EventKind> DEFAULT_LOG_LEVELS =
      ImmutableSet.of(EventKind.ERROR, EventKind.WARNING);

  /** The workspace root; dependency targets are written relative to it. */
  public abstract String rootDir();

  /** Rule kinds the engine may rewrite. */
  public abstract ImmutableSet<String> managedRules();

  /** Field aliases per rule kind. Kinds without an entry use {@link RuleSchema#DEFAULT}. */
  public abstract ImmutableMap<String, RuleSchema> schemas();

  /** Build targets for imports that are not owned by a declaration file in the workspace. */
  public abstract ImmutableMap<String, String> knownTargets();

  public abstract ImmutableMap<RuleRole, FileMatcher> matchers();

  /** The kinds of events that reach the user. */
  public abstract ImmutableSet<EventKind> logLevels();

  /**
   * Whether a file with no declaration file of its own is added to the nearest declaration file
   * of an ancestor directory. When false, a declaration file is created next to it.
   */
  public abstract boolean enablePropagation();

  /** The extension of new declaration files, e.g. {@code plz}; empty for none. */
  public abstract String fileExtname();

  abstract ImmutableMap<RuleRole, OnCreateOptions> onCreateOptions();

  abstract ImmutableMap<RuleRole, OnUpdateOptions> onUpdateOptions();

  abstract ImmutableMap<RuleRole, IgnoreOptions> ignoreOptions();

  public OnCreateOptions onCreate(RuleRole role) {
    return onCreateOptions().get(role);
  }

  public OnUpdateOptions onUpdate(RuleRole role) {
    return onUpdateOptions().get(role);
  }

  public IgnoreOptions ignore(RuleRole role) {
    return ignoreOptions().get(role);
  }

  public RuleSchema schema(String ruleName) {
    return schemas().getOrDefault(ruleName, RuleSchema.DEFAULT);
  }

  /** Returns the role of the file at the given path, or null if no matcher accepts it. */
  @Nullable
  public RuleRole roleOf(String path) {
    for (RuleRole role : RuleRole.MATCH_ORDER) {
      if (matchers().get(role).matches(path)) {
        return role;
      }
    }
    return null;
  }

  /** Returns the name of new declaration files, e.g. {@code BUILD.plz}. */
  public String buildFileName() {
    String extension = fileExtname();
    if (extension.isEmpty()) {
      return "BUILD";
    }
    return extension.startsWith(".") ? "BUILD" + extension : "BUILD." + extension;
  }

  /** Returns the configuration used when no configuration file is found. */
  public static AutodepConfig defaults() {
    return ConfigLoader.unmarshal(ImmutableMap.of(), "<defaults>");
  }

  public static Builder builder() {
    return new AutoValue_AutodepConfig.Builder();
  }

  public abstract Builder toBuilder();

  /** Builder for {@link AutodepConfig}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setRootDir(String value);

    public abstract Builder setManagedRules(ImmutableSet<String> value);

    public abstract Builder setSchemas(ImmutableMap<String, RuleSchema> value);

    public abstract Builder setKnownTargets(ImmutableMap<String, String> value);

    public abstract Builder setMatchers(ImmutableMap<RuleRole, FileMatcher> value);

    public abstract Builder setLogLevels(ImmutableSet<EventKind> value);

    public abstract Builder setEnablePropagation(boolean value);

    public abstract Builder setFileExtname(String value);

    public abstract Builder setOnCreateOptions(ImmutableMap<RuleRole, OnCreateOptions> value);

    public abstract Builder setOnUpdateOptions(ImmutableMap<RuleRole, OnUpdateOptions> value);

    public abstract Builder setIgnoreOptions(ImmutableMap<RuleRole, IgnoreOptions> value);

    abstract ImmutableMap<RuleRole, FileMatcher> matchers();

    abstract ImmutableMap<RuleRole, OnCreateOptions> onCreateOptions();

    abstract ImmutableMap<RuleRole, OnUpdateOptions> onUpdateOptions();

    abstract ImmutableMap<RuleRole, IgnoreOptions> ignoreOptions();

    abstract AutodepConfig autoBuild();

    public AutodepConfig build() {
      for (RuleRole role : RuleRole.values()) {
        checkRole(matchers(), role, "match");
        checkRole(onCreateOptions(), role, "onCreate");
        checkRole(onUpdateOptions(), role, "onUpdate");
        checkRole(ignoreOptions(), role, "ignore");
      }
      return autoBuild();
    }

    private static void checkRole(ImmutableMap<RuleRole, ?> map, RuleRole role, String section) {
      if (!map.containsKey(role)) {
        throw new IllegalStateException("missing " + section + "." + role.getKey());
      }
    }
  }
}
