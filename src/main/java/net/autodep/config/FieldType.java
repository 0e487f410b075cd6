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

import javax.annotation.Nullable;

/** The shape of value a rule field holds, as declared by the {@code as} key of a schema entry. */
public enum FieldType {
  STRING("string"),
  ARRAY("array"),
  BOOL("bool"),
  NUMBER("number"),
  GLOB("glob");

  private final String name;

  FieldType(String name) {
    this.name = name;
  }

  /** Returns the type with the given configuration name, or null if there is none. */
  @Nullable
  public static FieldType forName(String name) {
    for (FieldType type : values()) {
      if (type.name.equals(name)) {
        return type;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return name;
  }
}
