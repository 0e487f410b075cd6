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

/** A field holding a {@code glob(include, exclude)} call. */
public final class GlobField extends FieldLiteral {

  private final ImmutableList<String> include;
  private final ImmutableList<String> exclude;

  public GlobField(String alias, List<String> include, List<String> exclude) {
    super(alias);
    this.include = ImmutableList.copyOf(include);
    this.exclude = ImmutableList.copyOf(exclude);
  }

  public ImmutableList<String> getInclude() {
    return include;
  }

  public ImmutableList<String> getExclude() {
    return exclude;
  }

  /**
   * Returns whether the path matches one of the include patterns. Exclude patterns are not
   * consulted.
   */
  public boolean includes(String path) {
    for (String include : include) {
      if (GlobPattern.compile(include).matches(path)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public FieldType getType() {
    return FieldType.GLOB;
  }

  @Override
  public String toString() {
    return getAlias() + " = glob(" + include + ", " + exclude + ")";
  }
}
