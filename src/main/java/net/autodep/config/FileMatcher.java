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

import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides whether a file path belongs to a role. Configured either as a regular expression, which
 * must be found somewhere in the path, or as a list of suffixes, one of which the path must end
 * with.
 */
public abstract class FileMatcher {

  private FileMatcher() {}

  public abstract boolean matches(String path);

  public static FileMatcher ofRegex(String regex) {
    return new RegexMatcher(Pattern.compile(regex));
  }

  public static FileMatcher ofSuffixes(List<String> suffixes) {
    return new SuffixMatcher(ImmutableSet.copyOf(suffixes));
  }

  private static final class RegexMatcher extends FileMatcher {
    private final Pattern pattern;

    RegexMatcher(Pattern pattern) {
      this.pattern = pattern;
    }

    @Override
    public boolean matches(String path) {
      return pattern.matcher(path).find();
    }

    @Override
    public String toString() {
      return "/" + pattern.pattern() + "/";
    }
  }

  private static final class SuffixMatcher extends FileMatcher {
    private final ImmutableSet<String> suffixes;

    SuffixMatcher(ImmutableSet<String> suffixes) {
      this.suffixes = suffixes;
    }

    @Override
    public boolean matches(String path) {
      for (String suffix : suffixes) {
        if (path.endsWith(suffix)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public String toString() {
      return suffixes.toString();
    }
  }
}
