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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.annotation.Nullable;

/**
 * Locates the nearest {@code BUILD} or {@code BUILD.plz} file in the directory of a source file or
 * one of its ancestors, up to the workspace root. {@code BUILD} wins over {@code BUILD.plz} in the
 * same directory.
 */
public final class NearestBuildFileLocator implements BuildFileLocator {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  public static final ImmutableList<String> BUILD_FILE_NAMES =
      ImmutableList.of("BUILD", "BUILD.plz");

  private final Path rootDir;

  public NearestBuildFileLocator(Path rootDir) {
    this.rootDir = rootDir.toAbsolutePath().normalize();
  }

  @Override
  @Nullable
  public Path locate(Path file) {
    Path start = file.toAbsolutePath().normalize().getParent();
    for (Path dir = start; dir != null && dir.startsWith(rootDir); dir = dir.getParent()) {
      Path found = findIn(dir);
      if (found != null) {
        logger.atFine().log("%s is owned by %s", file, found);
        return found;
      }
    }
    logger.atFine().log("no declaration file owns %s", file);
    return null;
  }

  /** Returns the declaration file in {@code dir} itself, or null. */
  @Nullable
  public static Path findIn(Path dir) {
    for (String name : BUILD_FILE_NAMES) {
      Path candidate = dir.resolve(name);
      if (Files.isRegularFile(candidate)) {
        return candidate;
      }
    }
    return null;
  }
}
