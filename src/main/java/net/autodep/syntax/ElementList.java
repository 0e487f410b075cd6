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

package net.autodep.syntax;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Common base of the comma-separated sequences that appear between brackets: call arguments and
 * the elements of array, tuple and map literals.
 *
 * <p>A list records its layout. A multi-line list prints one element per line; an inline list
 * prints its elements on the line of the opening bracket. The list's own {@link CommentMap} holds
 * the comment on the line of the opening bracket as its leading comment, and the comments on the
 * lines before the closing bracket as its trailing comment.
 */
public abstract class ElementList<E extends Expression> extends Expression {

  /** Longest element, in columns, that a new list will print on the line of its bracket. */
  static final int INLINE_WIDTH_LIMIT = 60;

  private List<E> elements;
  private boolean multiline;
  private boolean trailingComma;

  ElementList(Token token, Kind kind, List<E> elements, boolean multiline, boolean trailingComma) {
    super(token, kind);
    this.elements = new ArrayList<>(elements);
    this.multiline = multiline;
    this.trailingComma = trailingComma;
  }

  public final ImmutableList<E> getElements() {
    return ImmutableList.copyOf(elements);
  }

  public final int size() {
    return elements.size();
  }

  public final boolean isEmpty() {
    return elements.isEmpty();
  }

  /** Reports whether the list prints one element per line. */
  public final boolean isMultiline() {
    return multiline;
  }

  /** Reports whether a comma follows the last element. */
  public final boolean hasTrailingComma() {
    return trailingComma;
  }

  /**
   * Replaces the elements of the list. A multi-line list stays multi-line; an inline list is laid
   * out again as a new list would be.
   */
  public final void setElements(List<E> elements) {
    this.elements = new ArrayList<>(elements);
    if (!multiline) {
      applyDefaultLayout();
    }
  }

  /** Appends an element, keeping the layout of the list. */
  public final void add(E element) {
    elements.add(element);
    if (!multiline) {
      applyDefaultLayout();
    }
  }

  /** Replaces the element at {@code index}. */
  public final void set(int index, E element) {
    elements.set(index, element);
  }

  /**
   * Lays the list out as the engine lays out lists it creates: inline when it has at most one
   * element whose inline text is short, otherwise one element per line with trailing commas.
   */
  final void applyDefaultLayout() {
    boolean inline = elements.isEmpty();
    if (elements.size() == 1) {
      ImmutableList<String> lines = elements.get(0).toLines(0);
      inline = lines.size() == 1 && lines.get(0).length() <= INLINE_WIDTH_LIMIT;
    }
    this.multiline = !inline;
    this.trailingComma = !inline;
  }

  final List<E> copyElements() {
    return deepCopyAll(elements);
  }
}
