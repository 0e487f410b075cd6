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

import com.google.common.base.Preconditions;
import net.autodep.config.FieldType;

/**
 * The value of a rule field, read from a keyword argument whose key is one of the field's
 * aliases. One subclass per value shape: {@link StringField}, {@link ArrayField} and {@link
 * GlobField}.
 */
public abstract class FieldLiteral {

  private final String alias;

  FieldLiteral(String alias) {
    this.alias = Preconditions.checkNotNull(alias);
  }

  /** The keyword the value was found under. */
  public final String getAlias() {
    return alias;
  }

  public abstract FieldType getType();
}
