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

import java.nio.file.Path;
import net.autodep.config.AutodepConfig;
import net.autodep.config.AutodepContext;
import net.autodep.config.RuleRole;
import net.autodep.qualify.NodeQualifier;

/** What the visitors of one target file share. */
public final class VisitContext {

  private final AutodepContext context;
  private final NodeQualifier qualifier;
  private final RuleBuilder builder;

  public VisitContext(AutodepContext context, NodeQualifier qualifier, RuleBuilder builder) {
    this.context = context;
    this.qualifier = qualifier;
    this.builder = builder;
  }

  /**
   * Returns the context of a target file owned by a declaration file in {@code buildFileDir}.
   *
   * @throws net.autodep.errors.AutodepException if the target file has no role
   */
  public static VisitContext create(AutodepContext context, Path buildFileDir, Path targetFile) {
    NodeQualifier qualifier = new NodeQualifier(context, buildFileDir, targetFile);
    RuleBuilder builder =
        new RuleBuilder(context, qualifier.getRuleRole(), qualifier.getFileName());
    return new VisitContext(context, qualifier, builder);
  }

  public AutodepContext getContext() {
    return context;
  }

  public AutodepConfig getConfig() {
    return context.getConfig();
  }

  public NodeQualifier getQualifier() {
    return qualifier;
  }

  public RuleBuilder getBuilder() {
    return builder;
  }

  public RuleRole getRole() {
    return qualifier.getRuleRole();
  }
}
