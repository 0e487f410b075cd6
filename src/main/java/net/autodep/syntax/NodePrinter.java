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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Renders syntax trees as source text.
 *
 * <p>The first line of the output is not indented, so that a node can be placed after other text on
 * a line; each later line carries its full indentation. Indentation is four spaces per level, and a
 * comment at the end of a line is separated from the code by two spaces. A file in this layout
 * prints exactly as it was read.
 */
final class NodePrinter {

  private static final String INDENT = "    ";
  private static final String TRAILING_COMMENT_SEPARATOR = "  ";

  private final Lines out = new Lines();

  private NodePrinter() {}

  /** Returns the lines of source text of {@code node}, nested {@code depth} levels deep. */
  static ImmutableList<String> render(Node node, int depth) {
    NodePrinter printer = new NodePrinter();
    printer.printNode(node, depth);
    return printer.out.build();
  }

  private void printNode(Node node, int depth) {
    if (node instanceof BuildFile) {
      printFile((BuildFile) node);
    } else if (node instanceof Statement) {
      printStatement((Statement) node, depth);
    } else if (node instanceof Expression) {
      printExpression((Expression) node, depth);
    } else if (node instanceof Comment) {
      printCommentLines((Comment) node, depth);
    } else {
      throw new IllegalArgumentException("unexpected node: " + node.getClass().getName());
    }
  }

  private void printFile(BuildFile file) {
    for (Statement statement : file.getStatements()) {
      for (int i = 0; i < statement.getBlankLinesBefore(); i++) {
        out.blankLine();
      }
      printStatement(statement, 0);
    }
  }

  private void printStatement(Statement statement, int depth) {
    printLeadingComment(statement.getComments().getLeading(), depth);
    switch (statement.kind()) {
      case COMMENT:
        printCommentLines(((CommentStatement) statement).getComment(), depth);
        break;
      case EXPRESSION:
        out.newLine(depth);
        printExpression(((ExpressionStatement) statement).getExpression(), depth);
        break;
    }
    printTrailingComment(statement.getComments().getTrailing(), depth);
  }

  private void printLeadingComment(@Nullable Comment comment, int depth) {
    if (comment != null) {
      printCommentLines(comment, depth);
    }
  }

  private void printCommentLines(Comment comment, int depth) {
    for (String line : comment.getLines()) {
      out.newLine(depth);
      out.append(line);
    }
  }

  // Places the first line of the comment at the end of the current line, and any others below it.
  private void printTrailingComment(@Nullable Comment comment, int depth) {
    if (comment == null) {
      return;
    }
    ImmutableList<String> lines = comment.getLines();
    out.append(TRAILING_COMMENT_SEPARATOR).append(lines.get(0));
    for (int i = 1; i < lines.size(); i++) {
      out.newLine(depth);
      out.append(lines.get(i));
    }
  }

  private void printExpression(Expression expr, int depth) {
    switch (expr.kind()) {
      case IDENTIFIER:
        out.append(((Identifier) expr).getName());
        break;
      case STRING_LITERAL:
      case INTEGER_LITERAL:
      case BOOLEAN_LITERAL:
        out.append(expr.getTokenLiteral());
        break;
      case INFIX:
        printInfix((InfixExpression) expr, depth);
        break;
      case PREFIX:
        {
          PrefixExpression prefix = (PrefixExpression) expr;
          out.append(prefix.getOperator().toString());
          if (prefix.getOperator() == TokenKind.NOT) {
            out.append(" ");
          }
          printExpression(prefix.getOperand(), depth);
          break;
        }
      case CALL:
        {
          CallExpression call = (CallExpression) expr;
          printExpression(call.getFunction(), depth);
          printList(call.getArguments(), "(", ")", depth);
          break;
        }
      case INDEX:
        {
          IndexExpression index = (IndexExpression) expr;
          printExpression(index.getObject(), depth);
          out.append("[");
          printExpression(index.getKey(), depth);
          out.append("]");
          break;
        }
      case ARRAY_LITERAL:
        printList(((ArrayLiteral) expr).getElements(), "[", "]", depth);
        break;
      case TUPLE_LITERAL:
        printList(((TupleLiteral) expr).getElements(), "(", ")", depth);
        break;
      case MAP_LITERAL:
        printList(((MapLiteral) expr).getEntries(), "{", "}", depth);
        break;
      case KEY_VALUE:
        {
          KeyValueExpression entry = (KeyValueExpression) expr;
          printExpression(entry.getKey(), depth);
          out.append(": ");
          printExpression(entry.getValue(), depth);
          break;
        }
      case EXPRESSION_LIST:
      case KEY_VALUE_LIST:
        printList((ElementList<?>) expr, "", "", depth);
        break;
    }
  }

  private void printInfix(InfixExpression infix, int depth) {
    printExpression(infix.getLeft(), depth);
    String op = infix.getOperator().toString();
    if (infix.getOperator() == TokenKind.DOT || !infix.isSpaced()) {
      out.append(op);
    } else {
      out.append(" ").append(op).append(" ");
    }
    printExpression(infix.getRight(), depth);
  }

  private void printList(ElementList<?> list, String open, String close, int depth) {
    out.append(open);
    if (isMultiline(list)) {
      printMultilineElements(list, depth);
      out.newLine(depth);
    } else {
      ImmutableList<? extends Expression> elements = list.getElements();
      for (int i = 0; i < elements.size(); i++) {
        if (i > 0) {
          out.append(", ");
        }
        printExpression(elements.get(i), depth);
      }
      if (list.hasTrailingComma()) {
        out.append(",");
      }
    }
    out.append(close);
  }

  private void printMultilineElements(ElementList<?> list, int depth) {
    printTrailingComment(list.getComments().getLeading(), depth + 1);
    ImmutableList<? extends Expression> elements = list.getElements();
    for (int i = 0; i < elements.size(); i++) {
      Expression element = elements.get(i);
      for (int j = 0; j < element.getBlankLinesBefore(); j++) {
        out.blankLine();
      }
      printLeadingComment(element.getComments().getLeading(), depth + 1);
      out.newLine(depth + 1);
      printExpression(element, depth + 1);
      if (i < elements.size() - 1 || list.hasTrailingComma()) {
        out.append(",");
      }
      printTrailingComment(element.getComments().getTrailing(), depth + 1);
    }
    Comment dangling = list.getComments().getTrailing();
    if (dangling != null) {
      printCommentLines(dangling, depth + 1);
    }
  }

  // A comment has nowhere to go in an inline list, so a list holding one prints one per line.
  private static boolean isMultiline(ElementList<?> list) {
    if (list.isMultiline() || !list.getComments().isEmpty()) {
      return true;
    }
    for (Expression element : list.getElements()) {
      if (!element.getComments().isEmpty()) {
        return true;
      }
    }
    return false;
  }

  /** Output lines under construction. */
  private static final class Lines {
    private final List<StringBuilder> lines = new ArrayList<>();
    // True until something is written; the first line is never indented.
    private boolean fresh = true;

    Lines() {
      lines.add(new StringBuilder());
    }

    Lines append(String text) {
      lines.get(lines.size() - 1).append(text);
      fresh = false;
      return this;
    }

    void newLine(int depth) {
      if (fresh) {
        fresh = false;
        return;
      }
      lines.add(new StringBuilder(Strings.repeat(INDENT, depth)));
    }

    void blankLine() {
      if (fresh) {
        fresh = false;
        return;
      }
      lines.add(new StringBuilder());
    }

    ImmutableList<String> build() {
      ImmutableList.Builder<String> result = ImmutableList.builder();
      for (StringBuilder line : lines) {
        result.add(line.toString());
      }
      return result.build();
    }
  }
}
