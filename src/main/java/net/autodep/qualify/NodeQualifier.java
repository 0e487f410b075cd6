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

package net.autodep.qualify;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;
import net.autodep.config.AutodepConfig;
import net.autodep.config.AutodepContext;
import net.autodep.config.FieldEntry;
import net.autodep.config.FieldType;
import net.autodep.config.RuleRole;
import net.autodep.config.SchemaField;
import net.autodep.errors.AutodepException;
import net.autodep.errors.ErrorType;
import net.autodep.errors.Messages;
import net.autodep.events.Event;
import net.autodep.syntax.ArrayLiteral;
import net.autodep.syntax.CallExpression;
import net.autodep.syntax.Expression;
import net.autodep.syntax.InfixExpression;
import net.autodep.syntax.StringLiteral;

/**
 * Answers questions about the calls of a declaration file on behalf of one target file: which
 * calls the engine may touch, which rule owns the target file, and what a rule's fields hold.
 *
 * <p>Fields are read through the aliases of the rule's schema. An alias names the keyword a field
 * is written under and the shape its value must have; a value of another shape does not count, and
 * is reported as a warning unless another alias with the same keyword accepts it.
 */
public final class NodeQualifier {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final String GLOB = "glob";

  private final AutodepContext context;
  private final Path targetFile;
  private final String fileName;
  private final RuleRole ruleRole;

  /**
   * Creates a qualifier for {@code targetFile}, owned by a declaration file in {@code
   * buildFileDir}.
   *
   * @throws AutodepException of type {@link ErrorType#USER} if no configured matcher accepts the
   *     target file
   */
  public NodeQualifier(AutodepContext context, Path buildFileDir, Path targetFile) {
    this.context = context;
    this.targetFile = targetFile;
    this.fileName = relativize(buildFileDir, targetFile);
    RuleRole role = context.getConfig().roleOf(targetFile.toString());
    if (role == null) {
      String message = Messages.unsupportedFileType(targetFile.toString());
      context.report(Event.error("NodeQualifier.init", message));
      throw new AutodepException(ErrorType.USER, message);
    }
    this.ruleRole = role;
    logger.atFine().log(
        "%s", Messages.identified("a " + role.getKey(), "\"" + targetFile.getFileName() + "\""));
  }

  private static String relativize(Path dir, Path file) {
    Path relative = file.isAbsolute() == dir.isAbsolute() ? dir.relativize(file) : file;
    return relative.toString().replace('\\', '/');
  }

  public RuleRole getRuleRole() {
    return ruleRole;
  }

  /** Returns the path of the target file relative to the declaration file's directory. */
  public String getFileName() {
    return fileName;
  }

  public Path getTargetFile() {
    return targetFile;
  }

  /**
   * Returns whether the call is one the engine reads and rewrites: a managed rule kind, a managed
   * builtin, or the rule kind new rules of this file's role are created with.
   */
  public boolean isManagedNode(CallExpression call) {
    String functionName = call.getFunctionName();
    AutodepConfig config = context.getConfig();
    boolean isManagedRule = config.managedRules().contains(functionName);
    boolean isManagedBuiltin = AutodepConfig.MANAGED_BUILTINS.contains(functionName);
    boolean isDefaultRule = functionName.equals(config.onCreate(ruleRole).ruleName());
    logger.atFine().log(
        "%s: managedRule=%s managedBuiltin=%s defaultRule=%s",
        functionName, isManagedRule, isManagedBuiltin, isDefaultRule);
    return isManagedRule || isManagedBuiltin || isDefaultRule;
  }

  /** Returns whether one of the rule's {@code srcs} aliases holds the target file. */
  public boolean isTargetBuildRule(
      CallExpression call, String ruleName, List<FieldEntry> srcsAliases) {
    for (FieldLiteral literal : readAll(call, ruleName, SchemaField.SRCS, srcsAliases)) {
      if (holdsTargetFile(literal)) {
        logger.atFine().log(
            "%s", Messages.success("located", "\"" + fileName + "\" in `" + ruleName + "`"));
        return true;
      }
    }
    logger.atFine().log("%s", Messages.locateFailure("\"" + fileName + "\" in `" + ruleName + "`"));
    return false;
  }

  private boolean holdsTargetFile(FieldLiteral literal) {
    if (literal instanceof StringField) {
      return ((StringField) literal).getValue().equals(fileName);
    }
    if (literal instanceof ArrayField) {
      return ((ArrayField) literal).getValues().contains(fileName);
    }
    if (literal instanceof GlobField) {
      return ((GlobField) literal).includes(fileName);
    }
    return false;
  }

  /**
   * Returns the value of the field under its first alias, in declared order, that the rule holds
   * with the right shape; or null if it holds none.
   */
  @Nullable
  public FieldLiteral getFieldLiteral(
      CallExpression call, String ruleName, SchemaField field, List<FieldEntry> aliases) {
    ImmutableList<FieldLiteral> literals = readAll(call, ruleName, field, aliases);
    return literals.isEmpty() ? null : literals.get(0);
  }

  private ImmutableList<FieldLiteral> readAll(
      CallExpression call, String ruleName, SchemaField field, List<FieldEntry> aliases) {
    ImmutableList.Builder<FieldLiteral> result = ImmutableList.builder();
    Set<String> warned = new LinkedHashSet<>();
    for (FieldEntry alias : aliases) {
      for (InfixExpression arg : call.getKeywordArguments()) {
        if (!arg.getKeywordName().equals(alias.value())) {
          continue;
        }
        FieldLiteral literal = read(alias, arg.getRight());
        if (literal != null) {
          result.add(literal);
        } else if (!acceptedByAnyAlias(aliases, arg) && warned.add(alias.value())) {
          warnOfSchemaMismatch(call, ruleName, field, alias.value(), typesOf(aliases, arg));
        }
      }
    }
    return result.build();
  }

  private static boolean acceptedByAnyAlias(List<FieldEntry> aliases, InfixExpression arg) {
    for (FieldEntry alias : aliases) {
      if (alias.value().equals(arg.getKeywordName()) && read(alias, arg.getRight()) != null) {
        return true;
      }
    }
    return false;
  }

  private static String typesOf(List<FieldEntry> aliases, InfixExpression arg) {
    List<FieldType> types = new ArrayList<>();
    for (FieldEntry alias : aliases) {
      if (alias.value().equals(arg.getKeywordName())) {
        types.add(alias.type());
      }
    }
    return Joiner.on('|').join(types);
  }

  @Nullable
  private static FieldLiteral read(FieldEntry alias, Expression value) {
    switch (alias.type()) {
      case STRING:
        String string = StringLiteral.valueOf(value);
        return string == null ? null : new StringField(alias.value(), string);
      case ARRAY:
        return value instanceof ArrayLiteral
            ? new ArrayField(alias.value(), stringsOf(value))
            : null;
      case GLOB:
        if (!isGlobCall(value)) {
          return null;
        }
        CallExpression glob = (CallExpression) value;
        return new GlobField(
            alias.value(), globArgument(glob, 0, "include"), globArgument(glob, 1, "exclude"));
      case BOOL:
      case NUMBER:
        return null;
    }
    throw new IllegalStateException(alias.type().toString());
  }

  private static boolean isGlobCall(Expression value) {
    return value instanceof CallExpression
        && ((CallExpression) value).getFunctionName().equals(GLOB);
  }

  // The patterns of a glob argument, given by position or by keyword.
  private static ImmutableList<String> globArgument(
      CallExpression glob, int position, String name) {
    InfixExpression keyword = glob.getKeywordArgument(name);
    if (keyword != null) {
      return stringsOf(keyword.getRight());
    }
    ImmutableList<Expression> args = glob.getArguments().getElements();
    if (position < args.size() && args.get(position) instanceof ArrayLiteral) {
      return stringsOf(args.get(position));
    }
    return ImmutableList.of();
  }

  private static ImmutableList<String> stringsOf(Expression array) {
    ImmutableList.Builder<String> values = ImmutableList.builder();
    if (array instanceof ArrayLiteral) {
      for (Expression element : ((ArrayLiteral) array).getElements().getElements()) {
        String value = StringLiteral.valueOf(element);
        if (value != null) {
          values.add(value);
        }
      }
    }
    return values.build();
  }

  private void warnOfSchemaMismatch(
      CallExpression call, String ruleName, SchemaField field, String alias, String types) {
    context.report(
        Event.warn(
                "NodeQualifier",
                Messages.buildRuleSchemaMismatch(
                    ruleName, field.getDefaultEntry().value(), alias, types))
            .withDetails(call.toString()));
  }
}
