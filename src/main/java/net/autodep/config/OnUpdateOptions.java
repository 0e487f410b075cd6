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

package net.autodep.config;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/** How the engine rewrites an existing declaration file for one role. */
@AutoValue
public abstract class OnUpdateOptions {

  public static final OnUpdateOptions DEFAULT = of("", false, null);

  /** The heading that replaces a recognized heading of the file; empty for none. */
  public abstract String fileHeading();

  public abstract boolean omitEmptyFields();

  /** Build definitions merged into the file's {@code subinclude} call, or null for none. */
  @Nullable
  public abstract ImmutableList<String> subinclude();

  public static OnUpdateOptions of(
      String fileHeading, boolean omitEmptyFields, @Nullable ImmutableList<String> subinclude) {
    return new AutoValue_OnUpdateOptions(fileHeading, omitEmptyFields, subinclude);
  }
}
