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

package net.autodep.deps;

import com.google.common.collect.ImmutableList;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Resolves relative imports ({@code ./x}, {@code ../x}) against the importing file's directory,
 * trying the path as written, then with each known extension, then as a directory index. Any other
 * import passes through.
 */
public final class LocalModuleResolver implements ModuleResolver {

  static final ImmutableList<String> EXTENSIONS = ImmutableList.of(".ts", ".tsx", ".js", ".jsx");

  @Override
  public Resolution resolve(String importPath, Path fromFile) {
    if (!importPath.startsWith("./") && !importPath.startsWith("../")) {
      return Resolution.passthrough();
    }
    Path dir = fromFile.toAbsolutePath().getParent();
    Path base = dir.resolve(importPath).normalize();
    if (Files.isRegularFile(base)) {
      return Resolution.of(base, Method.LOCAL_RESOLUTION);
    }
    for (String extension : EXTENSIONS) {
      Path candidate = base.resolveSibling(base.getFileName() + extension);
      if (Files.isRegularFile(candidate)) {
        return Resolution.of(candidate, Method.LOCAL_RESOLUTION);
      }
    }
    for (String extension : EXTENSIONS) {
      Path candidate = base.resolve("index" + extension);
      if (Files.isRegularFile(candidate)) {
        return Resolution.of(candidate, Method.LOCAL_RESOLUTION);
      }
    }
    return Resolution.passthrough();
  }
}
