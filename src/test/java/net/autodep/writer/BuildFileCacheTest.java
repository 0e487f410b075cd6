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

package net.autodep.writer;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.nio.file.Files;
import java.nio.file.Path;
import net.autodep.syntax.BuildFile;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class BuildFileCacheTest {

  @Rule public TemporaryFolder tmp = new TemporaryFolder();

  private final BuildFileCache cache = new BuildFileCache();

  private Path write(String text) throws Exception {
    Path file = tmp.getRoot().toPath().resolve("BUILD");
    Files.write(file, text.getBytes(UTF_8));
    return file;
  }

  @Test
  public void testParsesOnce() throws Exception {
    Path file = write("a()\n");
    cache.get(file);
    write("b()\n");
    assertThat(cache.get(file).toString()).isEqualTo("a()\n");
    assertThat(cache.size()).isEqualTo(1);
  }

  @Test
  public void testCallersGetCopies() throws Exception {
    Path file = write("a()\nb()\n");
    BuildFile first = cache.get(file);
    first.setStatements(first.getStatements().subList(0, 1));
    assertThat(cache.get(file).getStatements()).hasSize(2);
  }

  @Test
  public void testInvalidateRereads() throws Exception {
    Path file = write("a()\n");
    cache.get(file);
    write("b()\n");
    cache.invalidate(file);
    assertThat(cache.get(file).toString()).isEqualTo("b()\n");
  }

  @Test
  public void testClear() throws Exception {
    cache.get(write("a()\n"));
    cache.clear();
    assertThat(cache.size()).isEqualTo(0);
  }
}
