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
import com.google.common.flogger.GoogleLogger;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;
import net.autodep.config.RuleSchema;
import net.autodep.config.SchemaField;
import net.autodep.errors.Messages;
import net.autodep.syntax.BuildFile;
import net.autodep.syntax.CallExpression;
import net.autodep.syntax.CommentStatement;
import net.autodep.syntax.Expression;
import net.autodep.syntax.ExpressionStatement;
import net.autodep.syntax.Statement;
import net.autodep.syntax.StringLiteral;

/**
 * Base of the visitors that read or rewrite a declaration file on behalf of one target file.
 *
 * <p>{@link #visit} works on a deep copy of the file it is given, so the caller's tree is never
 * changed; the copy is returned in the {@link VisitResult} along with the status the visit reached.
 * Subclasses implement {@link #visitFile}, reporting each step to the {@link TaskState}.
 *
 * @param <T> the type of the value the visitor looks for
 */
public abstract class RuleVisitor<T> {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  static final String SUBINCLUDE = "subinclude";

  protected final VisitContext context;

  protected RuleVisitor(VisitContext context) {
    this.context = context;
  }

  /** Visits a copy of {@code file}. */
  public final VisitResult<T> visit(BuildFile file) {
    BuildFile copy = file.deepCopy();
    TaskState state = new TaskState();
    state.next(TaskStatus.PROCESSING, Messages.attempt("visit", file.getFile()));
    T value = visitFile(copy, state);
    logger.atFine().log("%s on %s: %s", getClass().getSimpleName(), file.getFile(), state);
    return VisitResult.of(state.getStatus(), state.getReason(), copy, value);
  }

  /**
   * Visits the file, which the visitor may change, and returns the value found, or null. The
   * state should be terminal on return.
   */
  protected abstract T visitFile(BuildFile file, TaskState state);

  /** Returns the call of a statement, if it is a call. */
  @Nullable
  static CallExpression callOf(Statement statement) {
    switch (statement.kind()) {
      case EXPRESSION:
        Expression expression = ((ExpressionStatement) statement).getExpression();
        return expression instanceof CallExpression ? (CallExpression) expression : null;
      case COMMENT:
        return null;
    }
    throw new IllegalStateException(statement.kind().toString());
  }

  /** Returns the first managed rule of the file whose sources hold the target file, or null. */
  @Nullable
  protected final CallExpression findTargetRule(BuildFile file) {
    for (Statement statement : file.getStatements()) {
      CallExpression call = callOf(statement);
      if (call == null || !context.getQualifier().isManagedNode(call)) {
        continue;
      }
      String ruleName = call.getFunctionName();
      if (context
          .getQualifier()
          .isTargetBuildRule(call, ruleName, schemaOf(call).aliases(SchemaField.SRCS))) {
        return call;
      }
    }
    return null;
  }

  protected final RuleSchema schemaOf(CallExpression call) {
    return context.getConfig().schema(call.getFunctionName());
  }

  /**
   * Returns whether the file starts with a heading this tool wrote: a comment block whose first
   * line begins the first line of the on-update or the on-create heading.
   */
  protected final boolean hasConfiguredHeading(BuildFile file) {
    if (file.getStatements().isEmpty()) {
      return false;
    }
    Statement first = file.getStatements().get(0);
    if (first.kind() != Statement.Kind.COMMENT) {
      return false;
    }
    String firstLine = ((CommentStatement) first).getComment().getLines().get(0);
    return headingLine(context.getConfig().onUpdate(context.getRole()).fileHeading())
            .startsWith(firstLine)
        || headingLine(context.getConfig().onCreate(context.getRole()).fileHeading())
            .startsWith(firstLine);
  }

  private static String headingLine(String heading) {
    int newline = heading.indexOf('\n');
    return "# " + (newline < 0 ? heading : heading.substring(0, newline));
  }

  /**
   * Replaces a heading this tool wrote with the on-update heading, if one is configured. Returns
   * whether the file has such a heading.
   */
  protected final boolean refreshHeading(BuildFile file) {
    if (!hasConfiguredHeading(file)) {
      return false;
    }
    String heading = context.getConfig().onUpdate(context.getRole()).fileHeading();
    if (!heading.isEmpty()) {
      file.setStatement(0, context.getBuilder().buildHeading(heading));
    }
    return true;
  }

  /**
   * Merges the on-update build definitions into the file's first {@code subinclude} call: the
   * call's arguments keep their order and new values are appended once each. Returns whether the
   * file has such a call.
   */
  protected final boolean mergeSubinclude(BuildFile file) {
    ImmutableList<String> configured =
        context.getConfig().onUpdate(context.getRole()).subinclude();
    for (Statement statement : file.getStatements()) {
      CallExpression call = callOf(statement);
      if (call == null || !call.getFunctionName().equals(SUBINCLUDE)) {
        continue;
      }
      if (configured != null) {
        appendMissing(call, configured);
      }
      return true;
    }
    return false;
  }

  private static void appendMissing(CallExpression call, List<String> values) {
    Set<String> present = new LinkedHashSet<>();
    for (Expression arg : call.getArguments().getElements()) {
      String value = StringLiteral.valueOf(arg);
      if (value != null) {
        present.add(value);
      }
    }
    for (String value : values) {
      if (present.add(value)) {
        call.getArguments().add(StringLiteral.of(value));
      }
    }
  }
}
