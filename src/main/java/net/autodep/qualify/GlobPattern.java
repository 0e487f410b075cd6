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

import java.util.regex.Pattern;

/**
 * A shell-style file pattern as written in a {@code glob(...)} call.
 *
 * <p>{@code *} matches within one path segment, {@code **} across segments (so {@code **}{@code /}
 * also matches no directory at all), {@code ?} one character other than {@code /}, and {@code
 * {a,b}} either alternative.
 */
public final class GlobPattern {

  private final String glob;
  private final Pattern pattern;

  private GlobPattern(String glob, Pattern pattern) {
    this.glob = glob;
    this.pattern = pattern;
  }

  public static GlobPattern compile(String glob) {
    return new GlobPattern(glob, Pattern.compile(toRegex(glob)));
  }

  public boolean matches(String path) {
    return pattern.matcher(path).matches();
  }

  static String toRegex(String glob) {
    StringBuilder regex = new StringBuilder("^");
    int braces = 0;
    for (int i = 0; i < glob.length(); i++) {
      char ch = glob.charAt(i);
      switch (ch) {
        case '*':
          if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
            if (i + 2 < glob.length() && glob.charAt(i + 2) == '/') {
              regex.append("(?:.*/)?");
              i += 2;
            } else {
              regex.append(".*");
              i++;
            }
          } else {
            regex.append("[^/]*");
          }
          break;
        case '?':
          regex.append("[^/]");
          break;
        case '{':
          braces++;
          regex.append("(?:");
          break;
        case '}':
          if (braces > 0) {
            braces--;
            regex.append(')');
          } else {
            regex.append("\\}");
          }
          break;
        case ',':
          regex.append(braces > 0 ? "|" : ",");
          break;
        default:
          regex.append(Pattern.quote(String.valueOf(ch)));
      }
    }
    // Unclosed alternations end with the pattern.
    for (; braces > 0; braces--) {
      regex.append(')');
    }
    regex.append('$');
    return regex.toString();
  }

  @Override
  public String toString() {
    return glob;
  }
}
