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

/**
 * One alias of a managed rule field: the keyword argument name used in declaration files, and the
 * type of value it holds.
 */
@AutoValue
public abstract class FieldEntry {

  /** The keyword argument name. */
  public abstract String value();

  /** The declared value type. */
  public abstract FieldType type();

  public static FieldEntry of(String value, FieldType type) {
    return new AutoValue_FieldEntry(value, type);
  }

  @Override
  public final String toString() {
    return value() + ":" + type();
  }
}
