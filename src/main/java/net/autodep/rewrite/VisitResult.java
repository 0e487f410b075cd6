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

import com.google.auto.value.AutoValue;
import javax.annotation.Nullable;
import net.autodep.syntax.BuildFile;

/**
 * The outcome of a visit: its status and reason, the visited copy of the file, and the value the
 * visitor looked for, if any.
 */
@AutoValue
public abstract class VisitResult<T> {

  public abstract TaskStatus status();

  public abstract String reason();

  /** The copy of the file the visitor worked on, with any changes it made. */
  public abstract BuildFile root();

  @Nullable
  public abstract T value();

  public static <T> VisitResult<T> of(
      TaskStatus status, String reason, BuildFile root, @Nullable T value) {
    return new AutoValue_VisitResult<>(status, reason, root, value);
  }

  public boolean isSuccess() {
    return status() == TaskStatus.SUCCESS;
  }
}
