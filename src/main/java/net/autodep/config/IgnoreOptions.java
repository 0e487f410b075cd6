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
import com.google.common.collect.ImmutableSet;
import java.util.Collection;

/** Imports and targets that never become dependencies of a role's rules. */
@AutoValue
public abstract class IgnoreOptions {

  public static final IgnoreOptions NONE = of(ImmutableList.of(), ImmutableSet.of());

  /** Path prefixes; a resolved import under one of them is dropped. */
  public abstract ImmutableList<String> paths();

  /** Build targets that are dropped from dependency lists. */
  public abstract ImmutableSet<String> targets();

  public static IgnoreOptions of(Collection<String> paths, Collection<String> targets) {
    return new AutoValue_IgnoreOptions(ImmutableList.copyOf(paths), ImmutableSet.copyOf(targets));
  }

  public boolean isIgnoredPath(String path) {
    for (String prefix : paths()) {
      if (path.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }

  public boolean isIgnoredTarget(String target) {
    return targets().contains(target);
  }
}
