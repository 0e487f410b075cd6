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

package net.autodep.deps;

import static com.google.common.truth.Truth.assertThat;

import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DependencyTest {

  private static final Path TARGET = Paths.get("/ws/pkg/BUILD");

  private static Dependency dep(String ruleName, String owningFile) {
    return Dependency.of(ruleName, Paths.get(owningFile), TARGET, "ws");
  }

  @Test
  public void testRuleOfTheSameFile() {
    assertThat(dep("util", "/ws/pkg/BUILD").toBuildTarget()).isEqualTo(":util");
    assertThat(dep("util", "/ws/pkg/../pkg/BUILD").toBuildTarget()).isEqualTo(":util");
  }

  @Test
  public void testRuleOfAnotherPackage() {
    assertThat(dep("util", "/ws/lib/sub/BUILD").toBuildTarget()).isEqualTo("/lib/sub:util");
    assertThat(dep("util", "/ws/lib/sub/BUILD.plz").toBuildTarget()).isEqualTo("/lib/sub:util");
  }

  @Test
  public void testNameOfThePackageIsLeftOut() {
    assertThat(dep("sub", "/ws/lib/sub/BUILD").toBuildTarget(false)).isEqualTo("/lib/sub");
    assertThat(dep("sub", "/ws/lib/sub/BUILD").toBuildTarget(true)).isEqualTo("/lib/sub:sub");
  }

  @Test
  public void testRuleAtTheRoot() {
    assertThat(dep("ws", "/ws/BUILD").toBuildTarget()).isEqualTo("/:ws");
  }

  @Test
  public void testOwnerOutsideTheRootKeepsItsWholePath() {
    assertThat(dep("x", "/other/place/BUILD").toBuildTarget()).isEqualTo("/other/place:x");
  }

  @Test
  public void testPathsAreNormalized() {
    Dependency dep = dep("x", "/ws/pkg/../lib/./BUILD");
    assertThat(dep.owningFilePath().toString()).isEqualTo(Paths.get("/ws/lib/BUILD").toString());
    assertThat(dep.toBuildTarget()).isEqualTo("/lib:x");
  }
}
