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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableSet;
import net.autodep.events.Event;
import net.autodep.events.EventKind;
import net.autodep.events.StoredEventHandler;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AutodepContextTest {

  @Test
  public void testOnlyConfiguredLevelsReachTheSink() {
    StoredEventHandler handler = new StoredEventHandler();
    AutodepContext context = new AutodepContext(AutodepConfig.defaults(), handler);
    context.report(Event.info("x", "info"));
    context.report(Event.debug("x", "debug"));
    context.report(Event.warn("x", "warn"));
    context.report(Event.error("x", "error"));
    assertThat(handler.getEvents())
        .containsExactly(Event.warn("x", "warn"), Event.error("x", "error"))
        .inOrder();
  }

  @Test
  public void testNoLevelsSilencesEverything() {
    StoredEventHandler handler = new StoredEventHandler();
    AutodepConfig config =
        AutodepConfig.defaults().toBuilder().setLogLevels(ImmutableSet.<EventKind>of()).build();
    new AutodepContext(config, handler).report(Event.error("x", "error"));
    assertThat(handler.isEmpty()).isTrue();
  }
}
