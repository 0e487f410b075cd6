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

package net.autodep.qualify;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.autodep.config.FieldType;

/** A field holding a list of strings, e.g. {@code srcs = ["a.ts", "b.ts"]}. */
public final class ArrayField extends FieldLiteral {

  private final ImmutableList<String> values;

  public ArrayField(String alias, List<String> values) {
    super(alias);
    this.values = ImmutableList.copyOf(values);
  }

  /** The string elements of the array; elements of other kinds are left out. */
  public ImmutableList<String> getValues() {
    return values;
  }

  @Override
  public FieldType getType() {
    return FieldType.ARRAY;
  }

  @Override
  public String toString() {
    return getAlias() + " = " + values;
  }
}
