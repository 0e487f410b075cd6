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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.PatternSyntaxException;
import javax.annotation.Nullable;
import net.autodep.errors.AutodepException;
import net.autodep.errors.ErrorType;
import net.autodep.errors.Messages;
import net.autodep.events.EventKind;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads {@code .autodep.yaml} files into {@link AutodepConfig}s.
 *
 * <p>A file may name a parent file with {@code extends}, resolved against its own directory. The
 * parent is read first and the child's keys override it, section by section; the {@code rules}
 * lists of the two are concatenated instead. Per-role sections ({@code module}, {@code test},
 * {@code fixture}) inherit every key they leave out from the enclosing section.
 */
public final class ConfigLoader {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final String EXTENDS = "extends";
  private static final String CONCATENATED_KEY = "rules";

  private ConfigLoader() {}

  /**
   * Returns the configuration file that applies to {@code dir}: the nearest {@code .autodep.yaml}
   * in it or an ancestor, stopping at {@code root} if given. Returns null if there is none.
   */
  @Nullable
  public static Path findConfigFile(Path dir, @Nullable Path root) {
    for (Path current = dir; current != null; current = current.getParent()) {
      Path candidate = current.resolve(AutodepConfig.CONFIG_FILENAME);
      if (Files.isRegularFile(candidate)) {
        return candidate;
      }
      if (current.equals(root)) {
        break;
      }
    }
    return null;
  }

  /** Reads the configuration file at {@code path} and the files it extends. */
  public static AutodepConfig load(Path path) throws IOException {
    logger.atFine().log("loading configuration from %s", path);
    Map<String, Object> merged =
        readWithParents(path.toAbsolutePath().normalize(), new HashSet<>());
    return unmarshal(merged, path.toString());
  }

  /** Parses configuration text that does not extend another file. */
  public static AutodepConfig parse(String yaml, String source) {
    Map<String, Object> map = parseYaml(yaml, source);
    if (map.containsKey(EXTENDS)) {
      throw new AutodepException(
          ErrorType.USER,
          Messages.invalidConfig(source, "`extends` needs a file to resolve against"));
    }
    return unmarshal(map, source);
  }

  private static Map<String, Object> readWithParents(Path path, Set<Path> seen) throws IOException {
    if (!seen.add(path)) {
      throw new AutodepException(ErrorType.USER, Messages.configInheritanceCycle(path.toString()));
    }
    String text = new String(Files.readAllBytes(path), UTF_8);
    Map<String, Object> config = parseYaml(text, path.toString());
    Object parent = config.remove(EXTENDS);
    if (parent == null) {
      return config;
    }
    if (!(parent instanceof String)) {
      throw new AutodepException(
          ErrorType.USER, Messages.invalidConfig(path.toString(), "`extends` must be a path"));
    }
    Path parentPath = path.resolveSibling((String) parent).normalize();
    logger.atFine().log("%s extends %s, merging", path, parentPath);
    return merge(readWithParents(parentPath, seen), config);
  }

  private static Map<String, Object> parseYaml(String text, String source) {
    Object loaded;
    try {
      loaded = new Yaml().load(text);
    } catch (YAMLException e) {
      throw new AutodepException(
          ErrorType.PARSER, Messages.invalidConfig(source, e.getMessage()), e);
    }
    if (loaded == null) {
      return new LinkedHashMap<>();
    }
    if (!(loaded instanceof Map)) {
      throw new AutodepException(
          ErrorType.USER, Messages.invalidConfig(source, "the top level must be a mapping"));
    }
    return copyMap((Map<?, ?>) loaded);
  }

  private static Map<String, Object> copyMap(Map<?, ?> map) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<?, ?> e : map.entrySet()) {
      copy.put(String.valueOf(e.getKey()), e.getValue());
    }
    return copy;
  }

  /** Returns {@code child} laid over {@code parent}. */
  static Map<String, Object> merge(Map<String, Object> parent, Map<String, Object> child) {
    Map<String, Object> result = new LinkedHashMap<>(parent);
    for (Map.Entry<String, Object> e : child.entrySet()) {
      String key = e.getKey();
      Object mine = e.getValue();
      Object theirs = result.get(key);
      if (mine instanceof Map && theirs instanceof Map) {
        result.put(key, merge(copyMap((Map<?, ?>) theirs), copyMap((Map<?, ?>) mine)));
      } else if (key.equals(CONCATENATED_KEY) && mine instanceof List && theirs instanceof List) {
        LinkedHashSet<Object> union = new LinkedHashSet<>((List<?>) theirs);
        union.addAll((List<?>) mine);
        result.put(key, ImmutableList.copyOf(union));
      } else {
        result.put(key, mine);
      }
    }
    return result;
  }

  /** Builds a configuration from the mapping read from a file, filling in defaults. */
  static AutodepConfig unmarshal(Map<String, Object> input, String source) {
    Section root = new Section(input, "", source);
    Section manage = root.section("manage");
    Section match = root.section("match");
    Section onCreate = root.section("onCreate");
    Section onUpdate = root.section("onUpdate");
    Section ignore = root.section("ignore");

    ImmutableMap<String, RuleSchema> schemas = unmarshalSchemas(manage.section("schema"));

    ImmutableSet.Builder<String> rules = ImmutableSet.builder();
    rules.addAll(AutodepConfig.ALWAYS_MANAGED_RULES);
    rules.addAll(manage.stringList("rules", ImmutableList.of()));
    rules.addAll(schemas.keySet());

    ImmutableMap.Builder<RuleRole, FileMatcher> matchers = ImmutableMap.builder();
    ImmutableMap.Builder<RuleRole, OnCreateOptions> onCreateOptions = ImmutableMap.builder();
    ImmutableMap.Builder<RuleRole, OnUpdateOptions> onUpdateOptions = ImmutableMap.builder();
    ImmutableMap.Builder<RuleRole, IgnoreOptions> ignoreOptions = ImmutableMap.builder();
    for (RuleRole role : RuleRole.values()) {
      matchers.put(role, unmarshalMatcher(match, role));
      onCreateOptions.put(role, unmarshalOnCreate(onCreate, role));
      onUpdateOptions.put(role, unmarshalOnUpdate(onUpdate, role));
      ignoreOptions.put(role, unmarshalIgnore(ignore, role));
    }

    return AutodepConfig.builder()
        .setRootDir(root.string("rootDir", "."))
        .setManagedRules(rules.build())
        .setSchemas(schemas)
        .setKnownTargets(manage.section("knownTargets").stringMap())
        .setMatchers(matchers.buildOrThrow())
        .setLogLevels(unmarshalLogLevels(root))
        .setEnablePropagation(root.bool("enablePropagation", false))
        .setFileExtname(onCreate.string("fileExtname", ""))
        .setOnCreateOptions(onCreateOptions.buildOrThrow())
        .setOnUpdateOptions(onUpdateOptions.buildOrThrow())
        .setIgnoreOptions(ignoreOptions.buildOrThrow())
        .build();
  }

  private static ImmutableMap<String, RuleSchema> unmarshalSchemas(Section schema) {
    ImmutableMap.Builder<String, RuleSchema> result = ImmutableMap.builder();
    for (String ruleName : schema.keys()) {
      Section fields = schema.section(ruleName);
      RuleSchema.Builder builder = RuleSchema.builder();
      for (SchemaField field : SchemaField.values()) {
        for (String key : field.getConfigKeys()) {
          for (Object entry : fields.list(key)) {
            builder.add(field, unmarshalFieldEntry(fields, key, entry, field.getDefaultEntry()));
          }
        }
      }
      result.put(ruleName, builder.build());
    }
    return result.buildOrThrow();
  }

  // A plain string names an alias of the field's default type; spaces become underscores.
  private static FieldEntry unmarshalFieldEntry(
      Section fields, String key, Object entry, FieldEntry defaultEntry) {
    if (entry instanceof String) {
      return FieldEntry.of(((String) entry).replace(' ', '_'), defaultEntry.type());
    }
    if (entry instanceof Map) {
      Map<?, ?> map = (Map<?, ?>) entry;
      Object value = map.get("value");
      Object as = map.get("as");
      FieldType type = as instanceof String ? FieldType.forName((String) as) : null;
      if (value instanceof String && type != null) {
        return FieldEntry.of((String) value, type);
      }
    }
    throw fields.invalid(
        key, "entries must be alias names or {value: <alias>, as: string|array|bool|number|glob}");
  }

  private static FileMatcher unmarshalMatcher(Section match, RuleRole role) {
    Object value = match.get(role.getKey());
    if (value == null) {
      switch (role) {
        case MODULE:
          return FileMatcher.ofRegex(AutodepConfig.DEFAULT_MODULE_MATCHER);
        case TEST:
          return FileMatcher.ofRegex(AutodepConfig.DEFAULT_TEST_MATCHER);
        case FIXTURE:
          return FileMatcher.ofRegex(AutodepConfig.DEFAULT_FIXTURE_MATCHER);
      }
      throw new IllegalStateException(role.toString());
    }
    if (value instanceof String) {
      try {
        return FileMatcher.ofRegex((String) value);
      } catch (PatternSyntaxException e) {
        throw match.invalid(role.getKey(), e.getDescription());
      }
    }
    return FileMatcher.ofSuffixes(match.stringList(role.getKey(), ImmutableList.of()));
  }

  private static ImmutableSet<EventKind> unmarshalLogLevels(Section root) {
    ImmutableList<String> names = root.stringList("log", null);
    if (names == null) {
      return AutodepConfig.DEFAULT_LOG_LEVELS;
    }
    ImmutableSet.Builder<EventKind> levels = ImmutableSet.builder();
    for (String name : names) {
      EventKind kind = EventKind.forLevelName(name);
      if (kind == null) {
        throw root.invalid("log", "unknown level \"" + name + "\"");
      }
      levels.add(kind);
    }
    return levels.build();
  }

  private static OnCreateOptions unmarshalOnCreate(Section onCreate, RuleRole role) {
    Section own = onCreate.section(role.getKey());
    OnCreateOptions.Builder options =
        OnCreateOptions.builder()
            .setRuleName(inherited(own, onCreate, "name", AutodepConfig.DEFAULT_RULE_NAME))
            .setTargetFormat(
                inherited(own, onCreate, "targetFormat", OnCreateOptions.DEFAULT_TARGET_FORMAT))
            .setFileHeading(onCreate.string("fileHeading", ""))
            .setExplicitDeps(inheritedBool(own, onCreate, "explicitDeps", true))
            .setGlobMatchers(unmarshalGlobMatchers(own, onCreate))
            .setOmitEmptyFields(inheritedBool(own, onCreate, "omitEmptyFields", false))
            .setSubinclude(inheritedList(own, onCreate, "subinclude"));
    if (role != RuleRole.TEST) {
      Boolean testOnly =
          own.has("testOnly") ? own.nullableBool("testOnly") : onCreate.nullableBool("testOnly");
      ImmutableList<String> visibility = inheritedList(own, onCreate, "initialVisibility");
      options
          .setTestOnly(testOnly)
          .setInitialVisibility(
              visibility == null ? AutodepConfig.DEFAULT_INITIAL_VISIBILITY : visibility);
    }
    return options.build();
  }

  // The role's own matchers win; the section's apply only if they name include patterns.
  private static GlobMatchers unmarshalGlobMatchers(Section own, Section parent) {
    if (own.has("globMatchers")) {
      Section matchers = own.section("globMatchers");
      return GlobMatchers.of(
          matchers.stringList("include", ImmutableList.of()),
          matchers.stringList("exclude", ImmutableList.of()));
    }
    Section matchers = parent.section("globMatchers");
    if (matchers.has("include")) {
      return GlobMatchers.of(
          matchers.stringList("include", ImmutableList.of()),
          matchers.stringList("exclude", ImmutableList.of()));
    }
    return GlobMatchers.EMPTY;
  }

  private static OnUpdateOptions unmarshalOnUpdate(Section onUpdate, RuleRole role) {
    Section own = onUpdate.section(role.getKey());
    return OnUpdateOptions.of(
        onUpdate.string("fileHeading", ""),
        inheritedBool(own, onUpdate, "omitEmptyFields", false),
        inheritedList(own, onUpdate, "subinclude"));
  }

  private static IgnoreOptions unmarshalIgnore(Section ignore, RuleRole role) {
    Section own = ignore.section(role.getKey());
    ImmutableList<String> paths = inheritedList(own, ignore, "paths");
    ImmutableList<String> targets = inheritedList(own, ignore, "targets");
    return IgnoreOptions.of(
        paths == null ? ImmutableList.of() : paths,
        targets == null ? ImmutableList.of() : targets);
  }

  private static String inherited(Section own, Section parent, String key, String defaultValue) {
    return own.has(key) ? own.string(key, defaultValue) : parent.string(key, defaultValue);
  }

  private static boolean inheritedBool(
      Section own, Section parent, String key, boolean defaultValue) {
    return own.has(key) ? own.bool(key, defaultValue) : parent.bool(key, defaultValue);
  }

  @Nullable
  private static ImmutableList<String> inheritedList(Section own, Section parent, String key) {
    return own.has(key) ? own.stringList(key, null) : parent.stringList(key, null);
  }

  /** A mapping of the configuration file with typed accessors that report misplaced values. */
  private static final class Section {
    private final Map<String, Object> map;
    private final String path;
    private final String source;

    Section(Map<String, Object> map, String path, String source) {
      this.map = map;
      this.path = path;
      this.source = source;
    }

    boolean has(String key) {
      return map.get(key) != null;
    }

    @Nullable
    Object get(String key) {
      return map.get(key);
    }

    ImmutableSet<String> keys() {
      return ImmutableSet.copyOf(map.keySet());
    }

    Section section(String key) {
      Object value = map.get(key);
      if (value == null) {
        return new Section(ImmutableMap.of(), qualify(key), source);
      }
      if (!(value instanceof Map)) {
        throw invalid(key, "expected a mapping");
      }
      return new Section(copyMap((Map<?, ?>) value), qualify(key), source);
    }

    String string(String key, String defaultValue) {
      Object value = map.get(key);
      if (value == null) {
        return defaultValue;
      }
      if (!(value instanceof String)) {
        throw invalid(key, "expected a string");
      }
      return (String) value;
    }

    boolean bool(String key, boolean defaultValue) {
      Boolean value = nullableBool(key);
      return value == null ? defaultValue : value;
    }

    @Nullable
    Boolean nullableBool(String key) {
      Object value = map.get(key);
      if (value == null) {
        return null;
      }
      if (!(value instanceof Boolean)) {
        throw invalid(key, "expected true or false");
      }
      return (Boolean) value;
    }

    List<?> list(String key) {
      Object value = map.get(key);
      if (value == null) {
        return ImmutableList.of();
      }
      if (!(value instanceof List)) {
        throw invalid(key, "expected a list");
      }
      return (List<?>) value;
    }

    @Nullable
    ImmutableList<String> stringList(String key, @Nullable ImmutableList<String> defaultValue) {
      if (!has(key)) {
        return defaultValue;
      }
      ImmutableList.Builder<String> result = ImmutableList.builder();
      for (Object element : list(key)) {
        if (!(element instanceof String)) {
          throw invalid(key, "expected a list of strings");
        }
        result.add((String) element);
      }
      return result.build();
    }

    ImmutableMap<String, String> stringMap() {
      ImmutableMap.Builder<String, String> result = ImmutableMap.builder();
      for (Map.Entry<String, Object> e : map.entrySet()) {
        if (!(e.getValue() instanceof String)) {
          throw invalid(e.getKey(), "expected a string");
        }
        result.put(e.getKey(), (String) e.getValue());
      }
      return result.buildOrThrow();
    }

    AutodepException invalid(String key, String problem) {
      return new AutodepException(
          ErrorType.USER, Messages.invalidConfig(source, "`" + qualify(key) + "`: " + problem));
    }

    private String qualify(String key) {
      return path.isEmpty() ? key : path + "." + key;
    }
  }
}
