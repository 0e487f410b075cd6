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

/**
 * The exception thrown when a file cannot be processed. The message starts with the description of
 * its {@link ErrorType}, for example {@code "User error: unsupported file type: ..."}.
 */
public final class AutodepException extends RuntimeException {

  private final ErrorType type;

  public AutodepException(ErrorType type, String message) {
    super(type.getDescription() + ": " + message);
    this.type = type;
  }

  public AutodepException(ErrorType type, String message, Throwable cause) {
    super(type.getDescription() + ": " + message, cause);
    this.type = type;
  }

  public ErrorType getType() {
    return type;
  }
}
