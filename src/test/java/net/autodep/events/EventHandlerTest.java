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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link Event} and the event handlers. */
@RunWith(JUnit4.class)
public class EventHandlerTest {

  @Test
  public void testEventText() {
    assertThat(Event.warn("Writer.write", "careful").toString())
        .isEqualTo("WARN [Writer.write] careful");
    assertThat(Event.error("Main", "failed").withDetails("because").toString())
        .isEqualTo("ERROR [Main] failed\nbecause");
  }

  @Test
  public void testLevelNames() {
    assertThat(EventKind.forLevelName("warn")).isEqualTo(EventKind.WARNING);
    assertThat(EventKind.forLevelName("warning")).isEqualTo(EventKind.WARNING);
    assertThat(EventKind.forLevelName("trace")).isEqualTo(EventKind.TRACE);
    assertThat(EventKind.forLevelName("verbose")).isNull();
  }

  @Test
  public void testStoredEventHandler() {
    StoredEventHandler handler = new StoredEventHandler();
    assertThat(handler.isEmpty()).isTrue();
    handler.handle(Event.info("a", "one"));
    handler.handle(Event.warn("a", "two"));
    assertThat(handler.hasErrors()).isFalse();
    handler.handle(Event.error("a", "three"));
    assertThat(handler.hasErrors()).isTrue();
    assertThat(handler.getEvents()).hasSize(3);
    assertThat(handler.getEvents(EventKind.WARNING)).containsExactly(Event.warn("a", "two"));

    handler.clear();
    assertThat(handler.isEmpty()).isTrue();
    assertThat(handler.hasErrors()).isFalse();
  }

  @Test
  public void testTeeAndPrinting() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    StoredEventHandler stored = new StoredEventHandler();
    EventHandler tee =
        new TeeEventHandler(new PrintingEventHandler(new PrintStream(bytes, true)), stored);
    tee.handle(Event.info("ctx", "hello"));
    assertThat(stored.getEvents()).hasSize(1);
    assertThat(new String(bytes.toByteArray(), UTF_8)).contains("INFO [ctx] hello");
  }
}
