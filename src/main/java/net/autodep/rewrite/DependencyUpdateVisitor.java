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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import net.autodep.config.FieldEntry;
import net.autodep.config.SchemaField;
import net.autodep.syntax.ArrayLiteral;
import net.autodep.syntax.BuildFile;
import net.autodep.syntax.CallExpression;
import net.autodep.syntax.Expression;
import net.autodep.syntax.ExpressionList;
import net.autodep.syntax.InfixExpression;
import net.autodep.syntax.StringLiteral;

/**
 * Replaces the dependencies of the rule that owns the target file. Returns the dependencies that
 * were replaced.
 *
 * <p>Every array field of the rule keyed by a {@code deps} alias receives the new list. A rule with
 * no such field gets one, under the first alias, unless the list is empty and empty fields are
 * omitted. The file's heading and {@code subinclude} call are brought up to date on the way.
 */
public final class DependencyUpdateVisitor extends RuleVisitor<ImmutableList<String>> {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  static final String NOT_FOUND = "unable to find target rule in given file";

  private final ImmutableList<String> deps;

  public DependencyUpdateVisitor(VisitContext context, List<String> deps) {
    super(context);
    this.deps = ImmutableList.copyOf(deps);
  }

  @Override
  @Nullable
  protected ImmutableList<String> visitFile(BuildFile file, TaskState state) {
    CallExpression rule = findTargetRule(file);
    if (rule == null) {
      state.next(TaskStatus.FAILED, NOT_FOUND);
      return null;
    }
    ImmutableList<String> removed = updateDeps(rule);
    refreshHeading(file);
    mergeSubinclude(file);
    state.next(TaskStatus.SUCCESS, "dependencies of `" + rule.getFunctionName() + "` updated");
    return removed;
  }

  private ImmutableList<String> updateDeps(CallExpression rule) {
    ImmutableList<FieldEntry> aliases = schemaOf(rule).aliases(SchemaField.DEPS);
    ImmutableSet.Builder<String> keys = ImmutableSet.builder();
    for (FieldEntry alias : aliases) {
      keys.add(alias.value());
    }
    ImmutableSet<String> depsKeys = keys.build();
    boolean omitEmpty =
        deps.isEmpty() && context.getConfig().onUpdate(context.getRole()).omitEmptyFields();

    ImmutableList.Builder<String> removed = ImmutableList.builder();
    List<Expression> kept = new ArrayList<>();
    boolean found = false;
    boolean dropped = false;
    for (Expression arg : rule.getArguments().getElements()) {
      if (!isDepsArgument(arg, depsKeys)) {
        kept.add(arg);
        continue;
      }
      found = true;
      InfixExpression field = (InfixExpression) arg;
      if (!(field.getRight() instanceof ArrayLiteral)) {
        // Reported as a schema mismatch; the value is left alone.
        context
            .getQualifier()
            .getFieldLiteral(rule, rule.getFunctionName(), SchemaField.DEPS, aliases);
        kept.add(arg);
        continue;
      }
      ArrayLiteral array = (ArrayLiteral) field.getRight();
      removed.addAll(valuesOf(array));
      if (omitEmpty) {
        dropped = true;
        continue;
      }
      replaceElements(array);
      kept.add(arg);
    }
    if (dropped) {
      rule.getArguments().setElements(kept);
    }
    if (!found && !omitEmpty) {
      FieldEntry primary = schemaOf(rule).primary(SchemaField.DEPS);
      logger.atFine().log("adding `%s` to `%s`", primary.value(), rule.getFunctionName());
      rule.getArguments()
          .add(
              InfixExpression.keywordArgument(
                  primary.value(), context.getBuilder().buildValue(primary.type(), deps)));
    }
    return removed.build();
  }

  private static boolean isDepsArgument(Expression arg, ImmutableSet<String> depsKeys) {
    return arg instanceof InfixExpression
        && ((InfixExpression) arg).isKeywordArgument()
        && depsKeys.contains(((InfixExpression) arg).getKeywordName());
  }

  private void replaceElements(ArrayLiteral array) {
    if (valuesOf(array).equals(deps)) {
      return;
    }
    if (deps.isEmpty()) {
      array.setElements(ExpressionList.of(ImmutableList.of()));
      return;
    }
    List<Expression> elements = new ArrayList<>();
    for (String dep : deps) {
      elements.add(StringLiteral.of(dep));
    }
    array.getElements().setElements(elements);
  }

  private static ImmutableList<String> valuesOf(ArrayLiteral array) {
    ImmutableList.Builder<String> values = ImmutableList.builder();
    for (Expression element : array.getElements().getElements()) {
      String value = StringLiteral.valueOf(element);
      values.add(value != null ? value : element.toString());
    }
    return values.build();
  }
}
