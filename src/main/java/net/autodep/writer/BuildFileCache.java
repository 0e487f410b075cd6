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

import com.google.common.flogger.GoogleLogger;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import net.autodep.syntax.BuildFile;
import net.autodep.syntax.ParserInput;

/**
 * Parsed declaration files of one run, keyed by absolute path. Callers get deep copies, so the
 * cached trees are never changed; a file that is written must be invalidated.
 */
public final class BuildFileCache {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final Map<Path, BuildFile> files = new HashMap<>();

  /** Returns a copy of the parsed file, reading and parsing it on first use. */
  public synchronized BuildFile get(Path path) throws IOException {
    Path key = path.toAbsolutePath().normalize();
    BuildFile file = files.get(key);
    if (file == null) {
      logger.atFine().log("parsing %s", key);
      file = BuildFile.parse(ParserInput.readFile(path));
      files.put(key, file);
    }
    return file.deepCopy();
  }

  public synchronized void invalidate(Path path) {
    files.remove(path.toAbsolutePath().normalize());
  }

  public synchronized void clear() {
    files.clear();
  }

  public synchronized int size() {
    return files.size();
  }
}
