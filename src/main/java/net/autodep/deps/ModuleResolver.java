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
import java.nio.file.Path;
import javax.annotation.Nullable;

/** Maps an import path to the file it names. */
public interface ModuleResolver {

  /** How an import was resolved. */
  enum Method {
    /** Through an alias declared by the workspace, such as a package name. */
    WORKSPACE_ALIAS,
    /** Through a path alias of the compiler configuration. */
    CONFIGURED_PATH_ALIAS,
    /** Relative to the importing file. */
    LOCAL_RESOLUTION,
    /** Not resolved; the import path is passed through unchanged. */
    PASSTHROUGH,
  }

  /** The result of resolving one import. */
  @AutoValue
  abstract class Resolution {
    /** The resolved file; null when the method is {@link Method#PASSTHROUGH}. */
    @Nullable
    public abstract Path resolvedPath();

    public abstract Method method();

    public static Resolution of(Path resolvedPath, Method method) {
      return new AutoValue_ModuleResolver_Resolution(resolvedPath, method);
    }

    public static Resolution passthrough() {
      return new AutoValue_ModuleResolver_Resolution(null, Method.PASSTHROUGH);
    }

    public boolean isResolved() {
      return method() != Method.PASSTHROUGH && resolvedPath() != null;
    }
  }

  Resolution resolve(String importPath, Path fromFile);
}
