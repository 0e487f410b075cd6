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

package net.autodep.events;

import com.google.common.collect.ImmutableMap;
import javax.annotation.Nullable;

/** The severity of an {@link Event}, named as in the {@code log} section of the configuration. */
public enum EventKind {
  ERROR("error"),
  WARNING("warn"),
  INFO("info"),
  DEBUG("debug"),
  TRACE("trace");

  private static final ImmutableMap<String, EventKind> BY_LEVEL_NAME;

  static {
    ImmutableMap.Builder<String, EventKind> builder = ImmutableMap.builder();
    for (EventKind kind : values()) {
      builder.put(kind.levelName, kind);
    }
    // accepted spelling of the warning level
    builder.put("warning", WARNING);
    BY_LEVEL_NAME = builder.buildOrThrow();
  }

  private final String levelName;

  EventKind(String levelName) {
    this.levelName = levelName;
  }

  public String getLevelName() {
    return levelName;
  }

  /** Returns the kind with the given configuration name, or null if there is none. */
  @Nullable
  public static EventKind forLevelName(String name) {
    return BY_LEVEL_NAME.get(name);
  }
}
