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

package net.autodep.errors;

/** The category of an {@link AutodepException}. */
public enum ErrorType {
  /** A problem the user can fix, usually in the configuration. */
  USER("User error"),
  /** The workspace is not in a state the operation can work from. */
  FAILED_PRECONDITION("Failed precondition"),
  PARSER("File parsing error"),
  /** An internal inconsistency. */
  UNEXPECTED("Unexpected error");

  private final String description;

  ErrorType(String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }
}
