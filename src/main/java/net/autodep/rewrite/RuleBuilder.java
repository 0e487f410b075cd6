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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import net.autodep.config.AutodepContext;
import net.autodep.config.FieldEntry;
import net.autodep.config.FieldType;
import net.autodep.config.GlobMatchers;
import net.autodep.config.OnCreateOptions;
import net.autodep.config.RuleRole;
import net.autodep.config.RuleSchema;
import net.autodep.config.SchemaField;
import net.autodep.syntax.ArrayLiteral;
import net.autodep.syntax.BooleanLiteral;
import net.autodep.syntax.BuildFile;
import net.autodep.syntax.CallExpression;
import net.autodep.syntax.CommentGroup;
import net.autodep.syntax.CommentStatement;
import net.autodep.syntax.Expression;
import net.autodep.syntax.ExpressionStatement;
import net.autodep.syntax.InfixExpression;
import net.autodep.syntax.IntegerLiteral;
import net.autodep.syntax.Statement;
import net.autodep.syntax.StringLiteral;

/**
 * Builds the syntax of new rules and new declaration files for one target file, following the
 * on-create options of the file's role and the schema of the rule kind they name.
 */
public final class RuleBuilder {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final String GLOB = "glob";
  private static final String SUBINCLUDE = "subinclude";

  private final AutodepContext context;
  private final RuleRole role;
  private final String fileName;
  private final ImmutableMap<FieldType, Function<Object, Expression>> valueBuilders;

  /**
   * @param fileName the path of the target file relative to the directory of the declaration file
   */
  public RuleBuilder(AutodepContext context, RuleRole role, String fileName) {
    this.context = context;
    this.role = role;
    this.fileName = fileName;
    Map<FieldType, Function<Object, Expression>> builders = new EnumMap<>(FieldType.class);
    builders.put(FieldType.STRING, RuleBuilder::buildString);
    builders.put(FieldType.ARRAY, RuleBuilder::buildArray);
    builders.put(FieldType.NUMBER, RuleBuilder::buildNumber);
    builders.put(FieldType.BOOL, RuleBuilder::buildBool);
    builders.put(FieldType.GLOB, RuleBuilder::buildGlob);
    this.valueBuilders = Maps.immutableEnumMap(builders);
  }

  private OnCreateOptions options() {
    return context.getConfig().onCreate(role);
  }

  /** Returns the value of a field of the given type, built from {@code value}. */
  public Expression buildValue(FieldType type, Object value) {
    return valueBuilders.get(type).apply(value);
  }

  /** Returns the statement declaring the target file's rule with the given dependencies. */
  public ExpressionStatement buildNewRule(List<String> deps) {
    OnCreateOptions options = options();
    String ruleName = options.ruleName();
    RuleSchema schema = context.getConfig().schema(ruleName);

    List<Expression> fields = new ArrayList<>();
    fields.add(field(schema, SchemaField.NAME, options.formatTarget(fileName)));
    fields.add(buildSrcs(schema, options));
    if (!deps.isEmpty() || !options.omitEmptyFields()) {
      fields.add(field(schema, SchemaField.DEPS, ImmutableList.copyOf(deps)));
    }
    if (options.initialVisibility() != null) {
      fields.add(field(schema, SchemaField.VISIBILITY, options.initialVisibility()));
    }
    if (options.testOnly() != null) {
      fields.add(field(schema, SchemaField.TEST_ONLY, options.testOnly()));
    }
    logger.atFine().log("building new `%s` rule for %s", ruleName, fileName);
    return ExpressionStatement.of(CallExpression.of(ruleName, fields));
  }

  private Expression buildSrcs(RuleSchema schema, OnCreateOptions options) {
    FieldEntry srcs = schema.primary(SchemaField.SRCS);
    if (options.explicitDeps()) {
      return InfixExpression.keywordArgument(srcs.value(), buildValue(srcs.type(), fileName));
    }
    GlobMatchers matchers = options.globMatchers();
    if (matchers.isEmpty()) {
      matchers =
          GlobMatchers.of(ImmutableList.of("**/*" + extensionOf(fileName)), ImmutableList.of());
    }
    return InfixExpression.keywordArgument(srcs.value(), buildGlob(matchers));
  }

  private InfixExpression field(RuleSchema schema, SchemaField field, Object value) {
    FieldEntry entry = schema.primary(field);
    return InfixExpression.keywordArgument(entry.value(), buildValue(entry.type(), value));
  }

  /**
   * Returns a new declaration file holding the on-create heading, the on-create {@code
   * subinclude} call and the target file's rule, separated by blank lines.
   */
  public BuildFile buildNewFile(List<String> deps, String path) {
    OnCreateOptions options = options();
    List<Statement> statements = new ArrayList<>();
    if (!options.fileHeading().isEmpty()) {
      statements.add(buildHeading(options.fileHeading()));
    }
    if (options.subinclude() != null && !options.subinclude().isEmpty()) {
      statements.add(buildSubinclude(options.subinclude()));
    }
    statements.add(buildNewRule(deps));
    for (int i = 1; i < statements.size(); i++) {
      statements.get(i).setBlankLinesBefore(1);
    }
    return BuildFile.create(statements, path);
  }

  /** Returns a comment statement with one {@code # } line per line of the heading. */
  public CommentStatement buildHeading(String heading) {
    List<String> lines = new ArrayList<>();
    for (String line : Splitter.on('\n').split(heading)) {
      lines.add(line.isEmpty() ? "#" : "# " + line);
    }
    return CommentStatement.of(CommentGroup.ofLines(lines));
  }

  public ExpressionStatement buildSubinclude(List<String> values) {
    List<Expression> args = new ArrayList<>();
    for (String value : values) {
      args.add(StringLiteral.of(value));
    }
    return ExpressionStatement.of(CallExpression.of(SUBINCLUDE, args));
  }

  // The extension of the last segment, with its dot; empty if there is none.
  private static String extensionOf(String path) {
    String name = path.substring(path.lastIndexOf('/') + 1);
    int dot = name.lastIndexOf('.');
    return dot <= 0 ? "" : name.substring(dot);
  }

  private static Expression buildString(Object value) {
    if (value instanceof List) {
      List<?> list = (List<?>) value;
      return StringLiteral.of(list.isEmpty() ? "" : String.valueOf(list.get(0)));
    }
    return StringLiteral.of(String.valueOf(value));
  }

  private static Expression buildArray(Object value) {
    List<String> values = new ArrayList<>();
    if (value instanceof List) {
      for (Object element : (List<?>) value) {
        values.add(String.valueOf(element));
      }
    } else {
      values.add(String.valueOf(value));
    }
    return ArrayLiteral.ofStrings(values);
  }

  private static Expression buildNumber(Object value) {
    Object scalar = firstOf(value);
    if (scalar instanceof Number) {
      return IntegerLiteral.of(((Number) scalar).longValue());
    }
    return IntegerLiteral.of(Long.parseLong(String.valueOf(scalar).trim()));
  }

  private static Expression buildBool(Object value) {
    Object scalar = firstOf(value);
    if (scalar instanceof Boolean) {
      return BooleanLiteral.of((Boolean) scalar);
    }
    return BooleanLiteral.of(Boolean.parseBoolean(String.valueOf(scalar)));
  }

  private static Object firstOf(Object value) {
    if (value instanceof List && !((List<?>) value).isEmpty()) {
      return ((List<?>) value).get(0);
    }
    return value;
  }

  // A glob of the given matchers, or of the given path alone.
  private static Expression buildGlob(Object value) {
    GlobMatchers matchers =
        value instanceof GlobMatchers
            ? (GlobMatchers) value
            : GlobMatchers.of(ImmutableList.of(String.valueOf(value)), ImmutableList.of());
    List<Expression> args = new ArrayList<>();
    args.add(
        InfixExpression.keywordArgument("include", ArrayLiteral.ofStrings(matchers.include())));
    if (!matchers.exclude().isEmpty()) {
      args.add(
          InfixExpression.keywordArgument("exclude", ArrayLiteral.ofStrings(matchers.exclude())));
    }
    return CallExpression.of(GLOB, args);
  }
}
