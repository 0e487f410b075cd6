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

import javax.annotation.Nullable;
import net.autodep.config.SchemaField;
import net.autodep.qualify.FieldLiteral;
import net.autodep.syntax.BuildFile;
import net.autodep.syntax.CallExpression;

/** Reads the sources field of the rule that owns the target file. */
public final class SrcsFieldVisitor extends RuleVisitor<FieldLiteral> {

  public SrcsFieldVisitor(VisitContext context) {
    super(context);
  }

  @Override
  @Nullable
  protected FieldLiteral visitFile(BuildFile file, TaskState state) {
    CallExpression rule = findTargetRule(file);
    if (rule == null) {
      state.next(TaskStatus.FAILED, RuleNameVisitor.NOT_FOUND);
      return null;
    }
    FieldLiteral srcs =
        context
            .getQualifier()
            .getFieldLiteral(
                rule,
                rule.getFunctionName(),
                SchemaField.SRCS,
                schemaOf(rule).aliases(SchemaField.SRCS));
    if (srcs == null) {
      state.next(TaskStatus.FAILED, "no `srcs` field found");
      return null;
    }
    state.next(TaskStatus.SUCCESS, "`srcs` field found");
    return srcs;
  }
}
