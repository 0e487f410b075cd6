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

import java.nio.file.Path;
import javax.annotation.Nullable;

/** Finds the declaration file that owns a source file. */
public interface BuildFileLocator {

  /** Returns the declaration file owning {@code file}, or null if there is none. */
  @Nullable
  Path locate(Path file);
}
