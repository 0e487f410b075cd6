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
import com.google.common.collect.Ordering;
import java.util.Collection;
import java.util.LinkedHashSet;

/** The order of build targets in a dependency list: local targets first, then by text. */
public final class TargetOrdering extends Ordering<String> {

  public static final TargetOrdering INSTANCE = new TargetOrdering();

  private TargetOrdering() {}

  @Override
  public int compare(String a, String b) {
    boolean localA = a.startsWith(":");
    boolean localB = b.startsWith(":");
    if (localA != localB) {
      return localA ? -1 : 1;
    }
    return a.compareTo(b);
  }

  /** Returns the targets in order, each once. */
  public static ImmutableList<String> sortedDistinct(Collection<String> targets) {
    return INSTANCE.immutableSortedCopy(new LinkedHashSet<>(targets));
  }
}
