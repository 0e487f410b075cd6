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

/**
 * The role a source file plays, which selects the rule kind and options used for it. Each role has
 * a section of the same name under {@code match}, {@code onCreate}, {@code onUpdate} and {@code
 * ignore}.
 */
public enum RuleRole {
  MODULE("module"),
  TEST("test"),
  FIXTURE("fixture");

  /** The order in which the roles' matchers are tried against a file. */
  public static final ImmutableList<RuleRole> MATCH_ORDER = ImmutableList.of(TEST, FIXTURE, MODULE);

  private final String key;

  RuleRole(String key) {
    this.key = key;
  }

  /** Returns the configuration key of this role. */
  public String getKey() {
    return key;
  }
}
