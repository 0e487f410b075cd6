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

package net.autodep.cli;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.util.List;
import javax.annotation.Nullable;

@Parameters(separators = "= ")
class AutodepFlags {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  @Nullable
  @Parameter(names = "--config")
  private String config;

  /**
   * The declaration file to write. When set, the dependencies are the ones given with {@code
   * --dep} and the source file is not read.
   */
  @Nullable
  @Parameter(names = "--build_file")
  private String buildFile;

  @Parameter(names = "--source")
  private List<String> sources;

  @Parameter(names = "--dep")
  private List<String> deps;

  @Nullable
  @Parameter(names = "--root")
  private String root;

  @Nullable
  public String config() {
    return config;
  }

  @Nullable
  public String buildFile() {
    return buildFile;
  }

  public List<String> sources() {
    return sources == null ? ImmutableList.of() : sources;
  }

  public List<String> deps() {
    return deps == null ? ImmutableList.of() : deps;
  }

  @Nullable
  public String root() {
    return root;
  }

  boolean hasBuildFile() {
    return buildFile != null;
  }

  static AutodepFlags parseFlags(String[] args) {
    AutodepFlags flags = new AutodepFlags();
    JCommander jCommander = new JCommander(flags);
    jCommander.setAllowParameterOverwriting(true);
    try {
      jCommander.parse(args);
    } catch (ParameterException e) {
      throw new IllegalArgumentException("Error parsing args: " + e.getMessage(), e);
    }
    if (flags.sources().isEmpty()) {
      throw new IllegalArgumentException("source was not specified.");
    }
    if (flags.hasBuildFile() && flags.sources().size() > 1) {
      throw new IllegalArgumentException("build_file takes exactly one source.");
    }
    if (!flags.hasBuildFile() && !flags.deps().isEmpty()) {
      logger.atWarning().log("Ignoring --dep values: they are only used with --build_file");
    }
    return flags;
  }
}
