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

package net.autodep.rewrite;

/**
 * The status of a rewrite task. A task starts {@link #IDLE}; each step it takes reports a trigger
 * status, and {@link #next} folds the trigger into the task's status.
 *
 * <p>Once a task has succeeded, a later failure makes it a {@link #PARTIAL_SUCCESS} and a later
 * pass-through leaves it successful; once it has failed, a later success makes it a partial
 * success. {@link #IDLE} and {@link #PROCESSING} reset the task whatever its status.
 */
public enum TaskStatus {
  IDLE("idle"),
  PROCESSING("processing"),
  SUCCESS("success"),
  PARTIAL_SUCCESS("partial-success"),
  FAILED("failed"),
  PASSTHROUGH("passthrough");

  private final String name;

  TaskStatus(String name) {
    this.name = name;
  }

  /** Returns whether the status ends a task. */
  public boolean isTerminal() {
    switch (this) {
      case IDLE:
      case PROCESSING:
        return false;
      case SUCCESS:
      case PARTIAL_SUCCESS:
      case FAILED:
      case PASSTHROUGH:
        return true;
    }
    throw new IllegalStateException(name);
  }

  /** Returns the status of a task in this status after a step that reported {@code trigger}. */
  public TaskStatus next(TaskStatus trigger) {
    if (!trigger.isTerminal()) {
      return trigger;
    }
    switch (this) {
      case IDLE:
      case PROCESSING:
      case PASSTHROUGH:
        return trigger;
      case PARTIAL_SUCCESS:
        return PARTIAL_SUCCESS;
      case SUCCESS:
        switch (trigger) {
          case SUCCESS:
          case PASSTHROUGH:
            return SUCCESS;
          case FAILED:
          case PARTIAL_SUCCESS:
            return PARTIAL_SUCCESS;
          case IDLE:
          case PROCESSING:
            break;
        }
        break;
      case FAILED:
        switch (trigger) {
          case FAILED:
          case PASSTHROUGH:
            return FAILED;
          case SUCCESS:
          case PARTIAL_SUCCESS:
            return PARTIAL_SUCCESS;
          case IDLE:
          case PROCESSING:
            break;
        }
        break;
    }
    throw new IllegalStateException(this + ":" + trigger);
  }

  @Override
  public String toString() {
    return name;
  }
}
