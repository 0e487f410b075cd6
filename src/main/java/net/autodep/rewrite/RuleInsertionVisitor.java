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
import java.util.List;
import javax.annotation.Nullable;
import net.autodep.config.OnUpdateOptions;
import net.autodep.syntax.BuildFile;
import net.autodep.syntax.Statement;

/**
 * Appends a new rule for the target file to an existing declaration file, bringing the file's
 * heading and {@code subinclude} call up to date. A file without a heading of this tool's gets the
 * on-update heading prepended, if one is configured; a file without a {@code subinclude} call gets
 * one after its heading, if build definitions are configured.
 */
public final class RuleInsertionVisitor extends RuleVisitor<Statement> {

  static final String INSERTED = "new rule successfully inserted into given file";

  private final ImmutableList<String> deps;

  public RuleInsertionVisitor(VisitContext context, List<String> deps) {
    super(context);
    this.deps = ImmutableList.copyOf(deps);
  }

  @Override
  @Nullable
  protected Statement visitFile(BuildFile file, TaskState state) {
    OnUpdateOptions options = context.getConfig().onUpdate(context.getRole());
    RuleBuilder builder = context.getBuilder();

    boolean hasHeading = refreshHeading(file);
    if (!hasHeading && !options.fileHeading().isEmpty()) {
      insert(file, 0, builder.buildHeading(options.fileHeading()));
      hasHeading = true;
    }

    if (!mergeSubinclude(file) && options.subinclude() != null && !options.subinclude().isEmpty()) {
      insert(file, hasHeading ? 1 : 0, builder.buildSubinclude(options.subinclude()));
    }

    Statement rule = builder.buildNewRule(deps);
    if (!file.getStatements().isEmpty()) {
      rule.setBlankLinesBefore(1);
    }
    file.addStatement(rule);
    file.setTrailingNewlines(Math.max(1, file.getTrailingNewlines()));
    state.next(TaskStatus.SUCCESS, INSERTED);
    return rule;
  }

  // Inserts a statement, keeping a blank line on either side of it.
  private static void insert(BuildFile file, int index, Statement statement) {
    List<Statement> statements = file.getStatements();
    if (index < statements.size()) {
      Statement next = statements.get(index);
      next.setBlankLinesBefore(Math.max(1, next.getBlankLinesBefore()));
    }
    if (index > 0) {
      statement.setBlankLinesBefore(1);
    }
    file.addStatement(index, statement);
  }
}
