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
import java.util.List;

/** The include and exclude patterns of a {@code glob(...)} call. */
@AutoValue
public abstract class GlobMatchers {

  public static final GlobMatchers EMPTY = of(ImmutableList.of(), ImmutableList.of());

  public abstract ImmutableList<String> include();

  public abstract ImmutableList<String> exclude();

  public static GlobMatchers of(List<String> include, List<String> exclude) {
    return new AutoValue_GlobMatchers(ImmutableList.copyOf(include), ImmutableList.copyOf(exclude));
  }

  public boolean isEmpty() {
    return include().isEmpty() && exclude().isEmpty();
  }
}
