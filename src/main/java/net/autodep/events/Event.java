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

import com.google.auto.value.AutoValue;
import java.util.Locale;
import javax.annotation.Nullable;

/**
 * A message for the user, reported by a component through its {@link EventHandler}.
 *
 * <p>The context names the component and operation that produced the event, such as {@code
 * NodeQualifier.isTargetBuildRule}. Details carry supporting text, typically the rendered source of
 * the node concerned.
 */
@AutoValue
public abstract class Event {

  public abstract EventKind getKind();

  public abstract String getContext();

  public abstract String getMessage();

  @Nullable
  public abstract String getDetails();

  public static Event of(
      EventKind kind, String context, String message, @Nullable String details) {
    return new AutoValue_Event(kind, context, message, details);
  }

  public static Event of(EventKind kind, String context, String message) {
    return of(kind, context, message, null);
  }

  public static Event error(String context, String message) {
    return of(EventKind.ERROR, context, message);
  }

  public static Event warn(String context, String message) {
    return of(EventKind.WARNING, context, message);
  }

  public static Event info(String context, String message) {
    return of(EventKind.INFO, context, message);
  }

  public static Event debug(String context, String message) {
    return of(EventKind.DEBUG, context, message);
  }

  /** Returns a copy of this event carrying the given details. */
  public Event withDetails(@Nullable String details) {
    return of(getKind(), getContext(), getMessage(), details);
  }

  @Override
  public final String toString() {
    String text =
        getKind().getLevelName().toUpperCase(Locale.ROOT)
            + " ["
            + getContext()
            + "] "
            + getMessage();
    return getDetails() == null ? text : text + "\n" + getDetails();
  }
}
