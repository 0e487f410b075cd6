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

import com.google.common.base.Preconditions;

/** The mutable status of one task and the reason given for it by the last step. */
public final class TaskState {

  private TaskStatus status = TaskStatus.IDLE;
  private String reason = "took no action";

  public TaskStatus getStatus() {
    return status;
  }

  public String getReason() {
    return reason;
  }

  /** Folds a step's outcome into the state; see {@link TaskStatus#next}. */
  public void next(TaskStatus trigger, String reason) {
    this.status = status.next(trigger);
    this.reason = Preconditions.checkNotNull(reason);
  }

  @Override
  public String toString() {
    return status + ": " + reason;
  }
}
