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

import com.google.common.base.Preconditions;
import com.google.common.flogger.GoogleLogger;
import net.autodep.events.Event;
import net.autodep.events.EventHandler;

/**
 * The configuration of a run together with the sink its events go to. Passed explicitly to every
 * component that reads settings or reports to the user.
 */
public final class AutodepContext {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final AutodepConfig config;
  private final EventHandler eventHandler;

  public AutodepContext(AutodepConfig config, EventHandler eventHandler) {
    this.config = Preconditions.checkNotNull(config);
    this.eventHandler = Preconditions.checkNotNull(eventHandler);
  }

  public AutodepConfig getConfig() {
    return config;
  }

  public EventHandler getEventHandler() {
    return eventHandler;
  }

  /**
   * Passes the event to the sink if its kind is one of the configured log levels. Every event is
   * logged at fine level regardless.
   */
  public void report(Event event) {
    logger.atFine().log("%s", event);
    if (config.logLevels().contains(event.getKind())) {
      eventHandler.handle(event);
    }
  }
}
