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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * The aliases of each logical field for one kind of rule. Aliases are kept in declaration order
 * without duplicates; the first one is used when a field is written.
 */
@AutoValue
public abstract class RuleSchema {

  /** The schema of a rule with no configured aliases: each field under its own name. */
  public static final RuleSchema DEFAULT = builder().build();

  abstract ImmutableMap<SchemaField, ImmutableList<FieldEntry>> entries();

  /** Returns the aliases of a field, in order. Never empty. */
  public ImmutableList<FieldEntry> aliases(SchemaField field) {
    ImmutableList<FieldEntry> aliases = entries().get(field);
    return aliases == null ? ImmutableList.of(field.getDefaultEntry()) : aliases;
  }

  /** Returns the alias used when writing a field. */
  public FieldEntry primary(SchemaField field) {
    return aliases(field).get(0);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link RuleSchema}. */
  public static final class Builder {
    private final Map<SchemaField, LinkedHashSet<FieldEntry>> entries =
        new EnumMap<>(SchemaField.class);

    private Builder() {}

    public Builder add(SchemaField field, FieldEntry entry) {
      entries.computeIfAbsent(field, f -> new LinkedHashSet<>()).add(entry);
      return this;
    }

    public Builder addAll(SchemaField field, List<FieldEntry> aliases) {
      Preconditions.checkArgument(!aliases.isEmpty(), "no aliases for %s", field);
      for (FieldEntry entry : aliases) {
        add(field, entry);
      }
      return this;
    }

    public RuleSchema build() {
      ImmutableMap.Builder<SchemaField, ImmutableList<FieldEntry>> result =
          ImmutableMap.builder();
      for (Map.Entry<SchemaField, LinkedHashSet<FieldEntry>> e : entries.entrySet()) {
        result.put(e.getKey(), ImmutableList.copyOf(e.getValue()));
      }
      return new AutoValue_RuleSchema(result.buildOrThrow());
    }
  }
}
