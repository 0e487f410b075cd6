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

package net.autodep.writer;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.autodep.config.AutodepContext;
import net.autodep.errors.AutodepException;
import net.autodep.errors.ErrorType;
import net.autodep.errors.Messages;
import net.autodep.events.Event;
import net.autodep.rewrite.DependencyUpdateVisitor;
import net.autodep.rewrite.RuleInsertionVisitor;
import net.autodep.rewrite.VisitContext;
import net.autodep.rewrite.VisitResult;
import net.autodep.syntax.BuildFile;

/**
 * Writes the dependencies of one target file to a declaration file, trying three strategies in
 * turn:
 *
 * <ol>
 *   <li>UPDATE: replace the dependencies of the rule that owns the target file.
 *   <li>APPEND: add a new rule for the target file to the end of the file.
 *   <li>BEGIN: create the declaration file, holding a new rule for the target file. Used only when
 *       the file does not exist.
 * </ol>
 *
 * <p>A declaration file with syntax errors is never rewritten.
 */
public final class Writer {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final AutodepContext context;
  private final Path targetFile;
  private final BuildFileCache cache;

  public Writer(AutodepContext context, Path targetFile, BuildFileCache cache) {
    this.context = context;
    this.targetFile = targetFile;
    this.cache = cache;
  }

  public Writer(AutodepContext context, Path targetFile) {
    this(context, targetFile, new BuildFileCache());
  }

  /**
   * Writes {@code deps} as the dependencies of the target file's rule in the declaration file at
   * {@code buildFilePath}. Returns false if no strategy applied.
   *
   * @throws AutodepException of type {@link ErrorType#FAILED_PRECONDITION} if the declaration file
   *     has syntax errors, or {@link ErrorType#UNEXPECTED} if a strategy ended in a state it
   *     should not reach
   * @throws IOException if the declaration file cannot be read or written
   */
  public boolean write(Path buildFilePath, List<String> deps) throws IOException {
    VisitContext visitContext =
        VisitContext.create(
            context, buildFilePath.toAbsolutePath().getParent(), targetFile.toAbsolutePath());

    if (!Files.isRegularFile(buildFilePath)) {
      context.report(
          Event.info(
              "Writer.write", Messages.locateFailure("an updatable file at " + buildFilePath)));
      begin(visitContext, buildFilePath, deps);
      return true;
    }

    BuildFile file = cache.get(buildFilePath);
    if (!file.ok()) {
      String message =
          Messages.unparsableBuildFile(
              buildFilePath.toString(), Joiner.on('\n').join(file.errors()));
      context.report(Event.error("Writer.write", message));
      throw new AutodepException(ErrorType.FAILED_PRECONDITION, message);
    }

    VisitResult<ImmutableList<String>> update =
        new DependencyUpdateVisitor(visitContext, deps).visit(file);
    if (apply(update, buildFilePath)) {
      logger.atFine().log("updated %s, replacing %s", buildFilePath, update.value());
      return true;
    }

    context.report(
        Event.info("Writer.write", Messages.attempt("append", "a new rule to " + buildFilePath)));
    if (apply(new RuleInsertionVisitor(visitContext, deps).visit(file), buildFilePath)) {
      return true;
    }

    context.report(
        Event.error("Writer.write", Messages.failure("insert", "rule at " + buildFilePath)));
    return false;
  }

  // Writes the visited file if the visit succeeded. Returns false if it failed.
  private boolean apply(VisitResult<?> result, Path buildFilePath) throws IOException {
    switch (result.status()) {
      case SUCCESS:
        save(result.root(), buildFilePath);
        return true;
      case FAILED:
        logger.atFine().log("%s: %s", buildFilePath, result.reason());
        return false;
      case IDLE:
      case PROCESSING:
      case PASSTHROUGH:
      case PARTIAL_SUCCESS:
        throw new AutodepException(
            ErrorType.UNEXPECTED,
            Messages.unexpected("result status \"" + result.status() + "\": " + result.reason())
                + "\n"
                + result.root());
    }
    throw new IllegalStateException(result.status().toString());
  }

  private void begin(VisitContext visitContext, Path buildFilePath, List<String> deps)
      throws IOException {
    BuildFile file = visitContext.getBuilder().buildNewFile(deps, buildFilePath.toString());
    Path dir = buildFilePath.toAbsolutePath().getParent();
    if (dir != null) {
      Files.createDirectories(dir);
    }
    save(file, buildFilePath);
    context.report(
        Event.info("Writer.write", Messages.success("created", buildFilePath.toString())));
  }

  private void save(BuildFile file, Path buildFilePath) throws IOException {
    Files.write(buildFilePath, file.toString().getBytes(UTF_8));
    cache.invalidate(buildFilePath);
  }
}
