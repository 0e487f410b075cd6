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

import com.google.auto.value.AutoValue;
import com.google.common.base.Joiner;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A rule that a target's rule depends on: the rule's name, the declaration file that owns it, the
 * declaration file being written, and the name of the workspace root directory.
 */
@AutoValue
public abstract class Dependency {

  public abstract String ruleName();

  /** The declaration file that declares the rule. */
  public abstract Path owningFilePath();

  /** The declaration file the dependency is written to. */
  public abstract Path targetFilePath();

  /** The name of the workspace root directory; paths in targets start below it. */
  public abstract String rootDirName();

  public static Dependency of(
      String ruleName, Path owningFilePath, Path targetFilePath, String rootDirName) {
    return new AutoValue_Dependency(
        ruleName, owningFilePath.normalize(), targetFilePath.normalize(), rootDirName);
  }

  /**
   * Renders the dependency as a build target. A rule of the file being written is {@code :name}.
   * Any other rule is {@code /pkg/sub:name}, where {@code pkg/sub} is the owning file's directory
   * below the root; the name is left out when it equals the last directory, unless {@code
   * canonicalise} is set.
   */
  public String toBuildTarget(boolean canonicalise) {
    if (owningFilePath().equals(targetFilePath())) {
      return ":" + ruleName();
    }
    List<String> segments = packageSegments();
    String packagePath = "/" + Joiner.on('/').join(segments);
    if (!canonicalise
        && !segments.isEmpty()
        && segments.get(segments.size() - 1).equals(ruleName())) {
      return packagePath;
    }
    return packagePath + ":" + ruleName();
  }

  public String toBuildTarget() {
    return toBuildTarget(false);
  }

  // The directory names of the owning file below the first directory named like the root.
  private List<String> packageSegments() {
    List<String> segments = new ArrayList<>();
    Path dir = owningFilePath().getParent();
    if (dir == null) {
      return segments;
    }
    for (Path name : dir) {
      segments.add(name.toString());
    }
    int root = segments.indexOf(rootDirName());
    return root < 0 ? segments : segments.subList(root + 1, segments.size());
  }
}
