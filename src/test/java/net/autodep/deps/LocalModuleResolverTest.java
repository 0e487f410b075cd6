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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import net.autodep.deps.ModuleResolver.Method;
import net.autodep.deps.ModuleResolver.Resolution;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LocalModuleResolverTest {

  @Rule public TemporaryFolder tmp = new TemporaryFolder();

  private final LocalModuleResolver resolver = new LocalModuleResolver();
  private Path src;
  private Path app;

  @Before
  public void createFiles() throws IOException {
    src = tmp.newFolder("src").toPath();
    app = touch(src.resolve("app.ts"));
    touch(src.resolve("util.ts"));
    touch(src.resolve("view.tsx"));
    touch(src.resolve("lib/index.js"));
    touch(tmp.getRoot().toPath().resolve("shared/config.ts"));
  }

  private static Path touch(Path file) throws IOException {
    Files.createDirectories(file.getParent());
    return Files.createFile(file);
  }

  private Resolution resolve(String importPath) {
    return resolver.resolve(importPath, app);
  }

  @Test
  public void testPathAsWritten() {
    Resolution resolution = resolve("./util.ts");
    assertThat(resolution.isResolved()).isTrue();
    assertThat(resolution.method()).isEqualTo(Method.LOCAL_RESOLUTION);
    assertThat(resolution.resolvedPath().toString()).isEqualTo(src.resolve("util.ts").toString());
  }

  @Test
  public void testKnownExtensions() {
    assertThat(resolve("./util").resolvedPath().toString())
        .isEqualTo(src.resolve("util.ts").toString());
    assertThat(resolve("./view").resolvedPath().toString())
        .isEqualTo(src.resolve("view.tsx").toString());
  }

  @Test
  public void testDirectoryIndex() {
    assertThat(resolve("./lib").resolvedPath().toString())
        .isEqualTo(src.resolve("lib/index.js").toString());
  }

  @Test
  public void testParentDirectory() {
    assertThat(resolve("../shared/config").resolvedPath().toString())
        .isEqualTo(tmp.getRoot().toPath().resolve("shared/config.ts").toString());
  }

  @Test
  public void testPackageImportsPassThrough() {
    Resolution resolution = resolve("react");
    assertThat(resolution.isResolved()).isFalse();
    assertThat(resolution.method()).isEqualTo(Method.PASSTHROUGH);
    assertThat((Object) resolution.resolvedPath()).isNull();
  }

  @Test
  public void testMissingFilePassesThrough() {
    assertThat(resolve("./missing").isResolved()).isFalse();
  }
}
