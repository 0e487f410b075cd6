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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Syntax tree for a declaration file ({@code BUILD} or {@code BUILD.plz}): the root of the tree.
 *
 * <p>A BuildFile may have been parsed with errors. Callers that intend to rewrite the file must
 * check {@link #ok} first, since statements that failed to parse are missing from the tree.
 */
public final class BuildFile extends Node {

  private List<Statement> statements;
  private final ImmutableList<SyntaxError> errors;
  private final String file;
  private int trailingNewlines;
  private final String lineSeparator;

  private BuildFile(
      Token token,
      List<Statement> statements,
      ImmutableList<SyntaxError> errors,
      String file,
      int trailingNewlines,
      String lineSeparator) {
    super(token);
    this.statements = new ArrayList<>(statements);
    this.errors = errors;
    this.file = file;
    this.trailingNewlines = trailingNewlines;
    this.lineSeparator = lineSeparator;
  }

  /** Returns a new, error-free file holding the given statements and ending with a newline. */
  public static BuildFile create(List<Statement> statements, String file) {
    return new BuildFile(
        Token.synthetic(TokenKind.EOF, "", null), statements, ImmutableList.of(), file, 1, "\n");
  }

  /**
   * Parses the input as a declaration file. Syntax errors are reported by {@link #errors}; parsing
   * does not stop at the first one.
   */
  public static BuildFile parse(ParserInput input) {
    Parser.ParseResult result = Parser.parseFile(input);
    return new BuildFile(
        result.eof,
        result.statements,
        ImmutableList.copyOf(result.errors),
        input.getFile(),
        result.trailingNewlines,
        lineSeparatorOf(input.getContent()));
  }

  // The separator of the first line: CRLF files are printed back with CRLF.
  private static String lineSeparatorOf(char[] content) {
    for (int i = 0; i < content.length; i++) {
      if (content[i] == '\n') {
        return i > 0 && content[i - 1] == '\r' ? "\r\n" : "\n";
      }
    }
    return "\n";
  }

  /** Returns an unmodifiable view of the statements of this file. */
  public ImmutableList<Statement> getStatements() {
    return ImmutableList.copyOf(statements);
  }

  /** Replaces the statements of this file. */
  public void setStatements(List<Statement> statements) {
    this.statements = new ArrayList<>(statements);
  }

  /** Inserts a statement at the given index. */
  public void addStatement(int index, Statement statement) {
    statements.add(index, Preconditions.checkNotNull(statement));
  }

  /** Appends a statement. */
  public void addStatement(Statement statement) {
    statements.add(Preconditions.checkNotNull(statement));
  }

  /** Replaces the statement at the given index. */
  public void setStatement(int index, Statement statement) {
    statements.set(index, Preconditions.checkNotNull(statement));
  }

  /** Returns an unmodifiable list of errors encountered while parsing this file. */
  public ImmutableList<SyntaxError> errors() {
    return errors;
  }

  /** Returns true if there were no errors during parsing. */
  public boolean ok() {
    return errors.isEmpty();
  }

  /** Returns the name of the file, as supplied by the {@link ParserInput}. */
  public String getFile() {
    return file;
  }

  /** Returns the number of line breaks after the last line of text; 0 if the file lacks one. */
  public int getTrailingNewlines() {
    return trailingNewlines;
  }

  public void setTrailingNewlines(int trailingNewlines) {
    this.trailingNewlines = trailingNewlines;
  }

  /** Returns the line separator the file is printed with: the one the parsed text used. */
  public String getLineSeparator() {
    return lineSeparator;
  }

  @Override
  public BuildFile deepCopy() {
    List<Statement> copies = new ArrayList<>(statements.size());
    for (Statement statement : statements) {
      copies.add(statement.deepCopy());
    }
    return new BuildFile(getToken(), copies, errors, file, trailingNewlines, lineSeparator);
  }

  /** Returns the text of the file. */
  @Override
  public String toString() {
    return Joiner.on(lineSeparator).join(toLines(0))
        + Strings.repeat(lineSeparator, trailingNewlines);
  }
}
