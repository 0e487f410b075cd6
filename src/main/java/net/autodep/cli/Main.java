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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import net.autodep.config.AutodepConfig;
import net.autodep.config.AutodepContext;
import net.autodep.config.ConfigLoader;
import net.autodep.deps.LocalModuleResolver;
import net.autodep.deps.RegexImportExtractor;
import net.autodep.deps.TargetOrdering;
import net.autodep.errors.AutodepException;
import net.autodep.events.Event;
import net.autodep.events.PrintingEventHandler;
import net.autodep.events.StoredEventHandler;
import net.autodep.events.TeeEventHandler;
import net.autodep.rewrite.TaskStatus;
import net.autodep.writer.Writer;

/** Command line utility that keeps the declaration files of source files in sync. */
public class Main {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_BAD_FLAGS = 2;

  public static void main(String... args) {
    try {
      System.exit(run(args, System.err));
    } catch (RuntimeException e) {
      logger.atSevere().withCause(e).log("Unhandled exception: %s", e.getMessage());
      System.exit(EXIT_FAILURE);
    }
  }

  @VisibleForTesting
  static int run(String[] args, PrintStream out) {
    AutodepFlags flags;
    try {
      flags = AutodepFlags.parseFlags(args);
    } catch (IllegalArgumentException e) {
      out.println(e.getMessage());
      return EXIT_BAD_FLAGS;
    }

    Path firstSource = Paths.get(flags.sources().get(0)).toAbsolutePath().normalize();
    Path explicitRoot =
        flags.root() == null ? null : Paths.get(flags.root()).toAbsolutePath().normalize();
    StoredEventHandler stored = new StoredEventHandler();
    TeeEventHandler handler = new TeeEventHandler(new PrintingEventHandler(out), stored);

    AutodepConfig config;
    Path root;
    try {
      Path configFile =
          flags.config() != null
              ? Paths.get(flags.config())
              : ConfigLoader.findConfigFile(firstSource.getParent(), explicitRoot);
      if (configFile == null) {
        config = AutodepConfig.defaults();
        root = explicitRoot != null ? explicitRoot : Paths.get("");
      } else {
        config = ConfigLoader.load(configFile);
        root =
            explicitRoot != null
                ? explicitRoot
                : configFile.toAbsolutePath().getParent().resolve(config.rootDir());
      }
    } catch (AutodepException | IOException e) {
      handler.handle(
          Event.error("Main", "failed to load configuration").withDetails(e.getMessage()));
      return EXIT_FAILURE;
    }
    root = root.toAbsolutePath().normalize();
    logger.atFine().log("workspace root is %s", root);

    AutodepContext context = new AutodepContext(config, handler);
    if (flags.hasBuildFile()) {
      return writeExplicit(context, flags, firstSource, stored);
    }

    Autodep autodep =
        new Autodep(
            context,
            root,
            new RegexImportExtractor(),
            new LocalModuleResolver(),
            new NearestBuildFileLocator(root));
    ImmutableList.Builder<Path> sources = ImmutableList.builder();
    for (String source : flags.sources()) {
      sources.add(Paths.get(source));
    }
    ImmutableMap<Path, TaskStatus> results = autodep.processAll(sources.build());
    boolean allSucceeded =
        results.values().stream().allMatch(status -> status == TaskStatus.SUCCESS);
    return allSucceeded && !stored.hasErrors() ? EXIT_OK : EXIT_FAILURE;
  }

  private static int writeExplicit(
      AutodepContext context, AutodepFlags flags, Path source, StoredEventHandler stored) {
    List<String> deps = TargetOrdering.sortedDistinct(flags.deps());
    try {
      boolean written = new Writer(context, source).write(Paths.get(flags.buildFile()), deps);
      return written && !stored.hasErrors() ? EXIT_OK : EXIT_FAILURE;
    } catch (AutodepException | IOException e) {
      context
          .getEventHandler()
          .handle(
              Event.error("Main", "failed to write " + flags.buildFile())
                  .withDetails(e.getMessage()));
      return EXIT_FAILURE;
    }
  }
}
