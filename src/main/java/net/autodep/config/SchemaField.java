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

import com.google.common.collect.ImmutableList;

/** The logical fields of a rule that the engine reads or writes. */
public enum SchemaField {
  NAME(FieldEntry.of("name", FieldType.STRING), "name"),
  SRCS(FieldEntry.of("srcs", FieldType.ARRAY), "srcs"),
  DEPS(FieldEntry.of("deps", FieldType.ARRAY), "deps"),
  VISIBILITY(FieldEntry.of("visibility", FieldType.ARRAY), "visibility"),
  TEST_ONLY(FieldEntry.of("test_only", FieldType.BOOL), "testOnly", "test_only");

  private final FieldEntry defaultEntry;
  private final ImmutableList<String> configKeys;

  SchemaField(FieldEntry defaultEntry, String... configKeys) {
    this.defaultEntry = defaultEntry;
    this.configKeys = ImmutableList.copyOf(configKeys);
  }

  /** The alias used when a rule's schema does not mention this field. */
  public FieldEntry getDefaultEntry() {
    return defaultEntry;
  }

  /** The keys under which this field may appear in a {@code manage.schema} section. */
  ImmutableList<String> getConfigKeys() {
    return configKeys;
  }
}
