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

package net.autodep.events;

/** TeeEventHandler forwards events to two delegate EventHandlers. */
public class TeeEventHandler implements EventHandler {
  private final EventHandler first;
  private final EventHandler second;

  public TeeEventHandler(EventHandler first, EventHandler second) {
    this.first = first;
    this.second = second;
  }

  @Override
  public void handle(Event event) {
    first.handle(event);
    second.handle(event);
  }
}
