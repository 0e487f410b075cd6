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

import net.autodep.config.FieldType;

/** A field holding one string, e.g. {@code name = "foo"}. */
public final class StringField extends FieldLiteral {

  private final String value;

  public StringField(String alias, String value) {
    super(alias);
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  @Override
  public FieldType getType() {
    return FieldType.STRING;
  }

  @Override
  public String toString() {
    return getAlias() + " = \"" + value + "\"";
  }
}
