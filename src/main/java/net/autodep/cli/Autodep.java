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

package net.autodep.cli;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Joiner;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import net.autodep.config.AutodepConfig;
import net.autodep.config.AutodepContext;
import net.autodep.config.IgnoreOptions;
import net.autodep.config.RuleRole;
import net.autodep.deps.Dependency;
import net.autodep.deps.ImportExtractor;
import net.autodep.deps.ModuleResolver;
import net.autodep.deps.ModuleResolver.Resolution;
import net.autodep.deps.TargetOrdering;
import net.autodep.errors.AutodepException;
import net.autodep.errors.ErrorType;
import net.autodep.errors.Messages;
import net.autodep.events.Event;
import net.autodep.rewrite.RuleNameVisitor;
import net.autodep.rewrite.TaskState;
import net.autodep.rewrite.TaskStatus;
import net.autodep.rewrite.VisitContext;
import net.autodep.rewrite.VisitResult;
import net.autodep.syntax.BuildFile;
import net.autodep.writer.BuildFileCache;
import net.autodep.writer.Writer;

/**
 * Brings the declaration file of a source file up to date with the source file's imports.
 *
 * <p>For each source file: its imports are extracted and resolved to files; each file is mapped to
 * a build target, either one configured under {@code manage.knownTargets} or the rule owning the
 * file in its nearest declaration file; the targets that are not ignored are sorted and written as
 * the dependencies of the source file's own rule.
 *
 * <p>An import that cannot be resolved is reported as an error and left out. The declaration file
 * is still written, and the source file's status becomes {@link TaskStatus#PARTIAL_SUCCESS}.
 */
public final class Autodep {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final AutodepContext context;
  private final Path rootDir;
  private final ImportExtractor importExtractor;
  private final ModuleResolver moduleResolver;
  private final BuildFileLocator locator;
  private final BuildFileCache cache = new BuildFileCache();

  public Autodep(
      AutodepContext context,
      Path rootDir,
      ImportExtractor importExtractor,
      ModuleResolver moduleResolver,
      BuildFileLocator locator) {
    this.context = context;
    this.rootDir = rootDir.toAbsolutePath().normalize();
    this.importExtractor = importExtractor;
    this.moduleResolver = moduleResolver;
    this.locator = locator;
  }

  /**
   * Processes one source file. Returns {@link TaskStatus#SUCCESS} if its declaration file was
   * written, {@link TaskStatus#PARTIAL_SUCCESS} if it was written without the imports that could
   * not be resolved, and {@link TaskStatus#FAILED} if it was not written.
   *
   * @throws AutodepException if the source file has no role, has no declaration file to write to,
   *     or depends on a file whose declaration file has no rule for it; or if writing fails
   * @throws IOException if a file cannot be read or written
   */
  public TaskStatus process(Path sourceFile) throws IOException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    Path source = sourceFile.toAbsolutePath().normalize();
    context.report(Event.info("Autodep.process", Messages.attempt("update", source.toString())));

    RuleRole role = context.getConfig().roleOf(source.toString());
    if (role == null) {
      throw new AutodepException(ErrorType.USER, Messages.unsupportedFileType(source.toString()));
    }
    Path targetBuildFile = resolveTargetBuildFile(source);
    String text = new String(Files.readAllBytes(source), UTF_8);
    ImmutableList<String> imports = importExtractor.extractImports(text, role);
    TaskState state = new TaskState();
    state.next(TaskStatus.PROCESSING, Messages.attempt("resolve", "imports"));
    ImmutableList<String> deps = collectTargets(source, role, targetBuildFile, imports, state);

    context.report(
        Event.info(
                "Autodep.process",
                Messages.attempt("write", "build targets to " + targetBuildFile))
            .withDetails("[\n  " + Joiner.on(",\n  ").join(deps) + "\n]"));
    boolean written = new Writer(context, source, cache).write(targetBuildFile, deps);
    if (!written) {
      context.report(Event.info("Autodep.process", "no update written for " + source));
      return TaskStatus.FAILED;
    }
    state.next(TaskStatus.SUCCESS, Messages.success("updated", targetBuildFile.toString()));
    context.report(Event.info("Autodep.process", source + " " + state + " in " + stopwatch));
    return state.getStatus();
  }

  /**
   * Processes each source file in turn. A failure is reported to the event sink and does not stop
   * the others. Returns the status of each file, as {@link #process} gives it, or failed if
   * processing it threw.
   */
  public ImmutableMap<Path, TaskStatus> processAll(Iterable<Path> sourceFiles) {
    Map<Path, TaskStatus> results = new LinkedHashMap<>();
    for (Path sourceFile : sourceFiles) {
      TaskStatus status;
      try {
        status = process(sourceFile);
      } catch (AutodepException | IOException e) {
        context.report(
            Event.error("Autodep.processAll", Messages.failure("update", sourceFile.toString()))
                .withDetails(e.getMessage()));
        status = TaskStatus.FAILED;
      }
      results.put(sourceFile, status);
    }
    return ImmutableMap.copyOf(results);
  }

  /**
   * Returns the declaration file a source file's rule belongs in. With propagation enabled, that is
   * the nearest one; otherwise the one in the source file's directory, which may not exist yet.
   */
  Path resolveTargetBuildFile(Path source) {
    AutodepConfig config = context.getConfig();
    Path dir = source.getParent();
    Path proposed = dir.resolve(config.buildFileName());
    if (config.enablePropagation()) {
      Path nearest = locator.locate(source);
      if (nearest == null) {
        throw new AutodepException(
            ErrorType.FAILED_PRECONDITION, Messages.noBuildFilesInWorkspace(proposed.toString()));
      }
      return nearest;
    }
    Path existing = NearestBuildFileLocator.findIn(dir);
    return existing != null ? existing : proposed;
  }

  private ImmutableList<String> collectTargets(
      Path source, RuleRole role, Path targetBuildFile, List<String> imports, TaskState state)
      throws IOException {
    AutodepConfig config = context.getConfig();
    IgnoreOptions ignore = config.ignore(role);
    String ownTarget = ownTarget(source, targetBuildFile);
    List<String> targets = new ArrayList<>();
    for (String importPath : imports) {
      String target = config.knownTargets().get(importPath);
      if (target == null) {
        target = resolveTarget(source, importPath, ignore, targetBuildFile, state);
      }
      if (target == null || target.equals(ownTarget) || ignore.isIgnoredTarget(target)) {
        continue;
      }
      targets.add(target);
    }
    return TargetOrdering.sortedDistinct(targets);
  }

  // The target of the file's own rule, if the declaration file has one already.
  @Nullable
  private String ownTarget(Path source, Path targetBuildFile) throws IOException {
    if (!Files.isRegularFile(targetBuildFile)) {
      return null;
    }
    String name = ruleName(source, targetBuildFile);
    return name == null ? null : ":" + name;
  }

  @Nullable
  private String resolveTarget(
      Path source, String importPath, IgnoreOptions ignore, Path targetBuildFile, TaskState state)
      throws IOException {
    if (ignore.isIgnoredPath(importPath)) {
      return null;
    }
    Resolution resolution = moduleResolver.resolve(importPath, source);
    if (!resolution.isResolved()) {
      String message = Messages.unresolvedImport(importPath, source.toString());
      context.report(Event.error("Autodep.resolve", message));
      state.next(TaskStatus.FAILED, message);
      return null;
    }
    Path resolved = resolution.resolvedPath().toAbsolutePath().normalize();
    logger.atFine().log("%s resolved to %s (%s)", importPath, resolved, resolution.method());
    if (resolved.equals(source) || ignore.isIgnoredPath(rootDir.relativize(resolved).toString())) {
      return null;
    }
    Path owningBuildFile = locator.locate(resolved);
    if (owningBuildFile == null) {
      context.report(
          Event.warn(
              "Autodep.resolve", Messages.locateFailure("a declaration file owning " + resolved)));
      return null;
    }
    String name;
    try {
      name = ruleName(resolved, owningBuildFile);
    } catch (AutodepException e) {
      if (e.getType() != ErrorType.USER) {
        throw e;
      }
      context.report(Event.warn("Autodep.resolve", e.getMessage()));
      return null;
    }
    if (name == null) {
      throw new AutodepException(
          ErrorType.FAILED_PRECONDITION,
          Messages.noRuleFoundForDependency(resolved.toString(), owningBuildFile.toString()));
    }
    return Dependency.of(name, owningBuildFile, targetBuildFile, rootDirName())
        .toBuildTarget(false);
  }

  @Nullable
  private String ruleName(Path file, Path buildFile) throws IOException {
    BuildFile parsed = cache.get(buildFile);
    VisitContext visitContext = VisitContext.create(context, buildFile.getParent(), file);
    VisitResult<String> result = new RuleNameVisitor(visitContext).visit(parsed);
    return result.isSuccess() ? result.value() : null;
  }

  private String rootDirName() {
    Path name = rootDir.getFileName();
    return name == null ? "" : name.toString();
  }
}
