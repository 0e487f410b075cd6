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
import net.autodep.qualify.StringField;
import net.autodep.syntax.BuildFile;
import net.autodep.syntax.CallExpression;

/** Finds the name of the rule that owns the target file. */
public final class RuleNameVisitor extends RuleVisitor<String> {

  static final String NOT_FOUND = "no managed rule found";

  public RuleNameVisitor(VisitContext context) {
    super(context);
  }

  @Override
  @Nullable
  protected String visitFile(BuildFile file, TaskState state) {
    CallExpression rule = findTargetRule(file);
    if (rule != null) {
      FieldLiteral name =
          context
              .getQualifier()
              .getFieldLiteral(
                  rule,
                  rule.getFunctionName(),
                  SchemaField.NAME,
                  schemaOf(rule).aliases(SchemaField.NAME));
      if (name instanceof StringField) {
        state.next(TaskStatus.SUCCESS, "rule name found");
        return ((StringField) name).getValue();
      }
    }
    state.next(TaskStatus.FAILED, NOT_FOUND);
    return null;
  }
}
