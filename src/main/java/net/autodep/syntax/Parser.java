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

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.function.Supplier;
import javax.annotation.Nullable;

/**
 * Parser is a recursive-descent parser for declaration files.
 *
 * <p>The parser keeps everything needed to print the file back: comments are attached to the
 * statements and list elements they belong to, and blank lines and list layout are recorded on the
 * nodes.
 */
final class Parser {

  /** Combines the parser result into a single value object. */
  static final class ParseResult {
    /** The top-level statements of the parsed file. */
    final ImmutableList<Statement> statements;

    // Errors encountered during scanning or parsing.
    // These lists are ultimately owned by BuildFile.
    final List<SyntaxError> errors;

    /** The EOF token, which stands for the whole file. */
    final Token eof;

    /** Line breaks after the last line of text. */
    final int trailingNewlines;

    private ParseResult(
        ImmutableList<Statement> statements,
        List<SyntaxError> errors,
        Token eof,
        int trailingNewlines) {
      this.statements = Preconditions.checkNotNull(statements);
      this.errors = errors;
      this.eof = eof;
      this.trailingNewlines = trailingNewlines;
    }
  }

  private static final EnumSet<TokenKind> EXPR_TERMINATOR_SET =
      EnumSet.of(
          TokenKind.COLON,
          TokenKind.COMMA,
          TokenKind.COMMENT,
          TokenKind.EOF,
          TokenKind.NEWLINE,
          TokenKind.RBRACE,
          TokenKind.RBRACKET,
          TokenKind.RPAREN);

  /**
   * Highest precedence goes last. Based on:
   * http://docs.python.org/2/reference/expressions.html#operator-precedence
   *
   * <p>The assignment operator is treated as the loosest binary operator, so that assignments and
   * keyword arguments share one grammar.
   */
  private static final List<EnumSet<TokenKind>> operatorPrecedence =
      ImmutableList.of(
          EnumSet.of(TokenKind.EQUALS),
          EnumSet.of(TokenKind.OR),
          EnumSet.of(TokenKind.AND),
          EnumSet.of(TokenKind.NOT),
          EnumSet.of(
              TokenKind.EQUALS_EQUALS,
              TokenKind.NOT_EQUALS,
              TokenKind.LESS,
              TokenKind.LESS_EQUALS,
              TokenKind.GREATER,
              TokenKind.GREATER_EQUALS,
              TokenKind.IN,
              TokenKind.NOT_IN),
          EnumSet.of(TokenKind.PIPE),
          EnumSet.of(TokenKind.MINUS, TokenKind.PLUS),
          EnumSet.of(TokenKind.SLASH, TokenKind.SLASH_SLASH, TokenKind.STAR, TokenKind.PERCENT));

  private final ImmutableList<Token> tokens;
  private final char[] content;
  private final FileLocations locs;
  private final List<SyntaxError> errors;

  /** Current lookahead token. */
  private Token token;

  private int index;
  private int errorsCount;
  private boolean recoveryMode; // stop reporting errors until next statement

  private Parser(ParserInput input, List<SyntaxError> errors) {
    this.content = input.getContent();
    this.locs = FileLocations.create(content, input.getFile());
    this.errors = errors;
    this.tokens = Lexer.tokenize(input, errors);
    this.index = 0;
    this.token = tokens.get(0);
  }

  // Returns a token's string form as used in error messages.
  private static String tokenString(Token token) {
    if (token.getKind().isString()) {
      return StringLiteral.quote(String.valueOf(token.getValue()));
    }
    switch (token.getKind()) {
      case IDENTIFIER:
      case INT:
      case ILLEGAL:
        return token.getLiteral();
      default:
        return token.getKind().toString();
    }
  }

  // Main entry point for parsing a file.
  static ParseResult parseFile(ParserInput input) {
    List<SyntaxError> errors = new ArrayList<>();
    Parser parser = new Parser(input, errors);
    ImmutableList.Builder<Statement> statements = ImmutableList.builder();
    int trailingNewlines = parser.parseFileInput(statements);
    return new ParseResult(statements.build(), errors, parser.token, trailingNewlines);
  }

  /** Parses a single expression. Comments and line breaks around it are ignored. */
  static Expression parseExpression(ParserInput input) throws SyntaxError.Exception {
    List<SyntaxError> errors = new ArrayList<>();
    Parser parser = new Parser(input, errors);
    parser.skipLayout();
    Expression result = parser.parseTest(0);
    parser.skipLayout();
    if (parser.token.getKind() != TokenKind.EOF) {
      parser.syntaxError("expected end of expression");
    }
    if (!errors.isEmpty()) {
      throw new SyntaxError.Exception(errors);
    }
    return result;
  }

  @FormatMethod
  private void reportError(int offset, String format, Object... args) {
    errorsCount++;
    // Limit the number of reported errors to avoid spamming output.
    if (errorsCount <= 5) {
      errors.add(locs.error(offset, String.format(format, args)));
    }
  }

  private void syntaxError(String message) {
    syntaxError(token, message);
  }

  private void syntaxError(Token at, String message) {
    if (!recoveryMode) {
      if (at.getKind() == TokenKind.ILLEGAL) {
        reportError(at.getStartOffset(), "invalid character: '%s'", at.getValue());
      } else {
        reportError(at.getStartOffset(), "syntax error at '%s': %s", tokenString(at), message);
      }
      recoveryMode = true;
    }
  }

  // Consumes the current token and returns it.
  // Reports a syntax error if the token is not of the expected kind.
  @CanIgnoreReturnValue
  private Token expect(TokenKind kind) {
    if (token.getKind() != kind) {
      syntaxError("expected " + kind);
    }
    return nextToken();
  }

  // Consumes tokens up to, but not including, the first token belonging to terminatingTokens.
  // A current token that already terminates is left in place.
  // Returns the end offset of the last token consumed.
  private int syncTo(EnumSet<TokenKind> terminatingTokens) {
    // EOF must be in the set to prevent an infinite loop
    Preconditions.checkState(terminatingTokens.contains(TokenKind.EOF));
    int end = token.getStartOffset();
    while (!terminatingTokens.contains(token.getKind())) {
      end = token.getEndOffset();
      nextToken();
    }
    return end;
  }

  // Consumes tokens up to the end of the current top-level statement.
  private void syncToStatementEnd() {
    while (token.getKind() != TokenKind.EOF
        && !(token.getKind() == TokenKind.NEWLINE && token.getDepth() == 0)) {
      nextToken();
    }
  }

  // Consumes tokens up to the bracket that closes a list opened at the given depth.
  private void syncToClose(TokenKind close, int depth) {
    while (token.getKind() != TokenKind.EOF
        && !(token.getKind() == close && token.getDepth() == depth)) {
      nextToken();
    }
  }

  @CanIgnoreReturnValue
  private Token nextToken() {
    Token prev = token;
    if (token.getKind() != TokenKind.EOF) {
      index++;
      token = tokens.get(index);
    }
    return prev;
  }

  private Token peek(int offset) {
    return tokens.get(Math.min(index + offset, tokens.size() - 1));
  }

  // Skips line breaks and comments. Only used around a standalone expression.
  private void skipLayout() {
    while (token.getKind() == TokenKind.NEWLINE || token.getKind() == TokenKind.COMMENT) {
      nextToken();
    }
  }

  // Skips the line breaks between an operator and its operand inside brackets.
  private void skipBracketedNewlines() {
    while (token.getKind() == TokenKind.NEWLINE && token.getDepth() > 0) {
      nextToken();
    }
  }

  // Returns an "Identifier" whose content is the input from start to end.
  private Identifier makeErrorExpression(Token start, int end) {
    int from = Math.max(0, start.getStartOffset());
    int to = Math.max(from, end);
    String text = new String(content, from, to - from);
    return new Identifier(
        new Token(TokenKind.IDENTIFIER, text, text, from, to, start.getDepth()), text);
  }

  private static int blankLines(int newlines) {
    return Math.max(0, newlines - 1);
  }

  // file_input = ('\n' | comment_block | stmt)* EOF
  // Returns the number of line breaks that follow the last line of text.
  private int parseFileInput(ImmutableList.Builder<Statement> list) {
    int newlines = 0;
    boolean atStart = true;
    try {
      while (token.getKind() != TokenKind.EOF) {
        if (token.getKind() == TokenKind.NEWLINE) {
          newlines += (Integer) token.getValue();
          nextToken();
          recoveryMode = false;
        } else if (recoveryMode) {
          // If there was a parse error, we want to recover here
          // before starting a new top-level statement.
          syncToStatementEnd();
          recoveryMode = false;
        } else {
          int blank = atStart ? newlines : blankLines(newlines);
          parseStatement(list, blank);
          atStart = false;
          newlines = 0;
        }
      }
    } catch (StackOverflowError ex) {
      // Deeply nested input, or error recovery that discards closing brackets, can exhaust the
      // thread's stack. Treat it as a parse error rather than crash the caller.
      reportError(
          token.getEndOffset(),
          "internal error: stack overflow in parser. Please report the bug and include"
              + " the text of %s.\n"
              + "%s",
          locs.file(),
          Throwables.getStackTraceAsString(ex));
    }
    return newlines;
  }

  // stmt = comment_block
  //      | comment_block? expr COMMENT? ('\n' | EOF)
  // A comment block followed by a blank line or the end of the file stands alone; otherwise it
  // belongs to the statement that follows it.
  private void parseStatement(ImmutableList.Builder<Statement> list, int blankLinesBefore) {
    CommentGroup leading = null;
    if (token.getKind() == TokenKind.COMMENT) {
      CommentGroup block = parseCommentBlock();
      if (endsCommentStatement()) {
        CommentStatement statement = new CommentStatement(block);
        statement.setBlankLinesBefore(blankLinesBefore);
        list.add(statement);
        return;
      }
      leading = block;
      expect(TokenKind.NEWLINE);
    }

    Expression expr = parseTest(0);
    ExpressionStatement statement = ExpressionStatement.of(expr);
    statement.setBlankLinesBefore(blankLinesBefore);
    statement.getComments().setLeading(leading);
    if (token.getKind() == TokenKind.COMMENT) {
      statement.getComments().setTrailing(new SingleLineComment(nextToken()));
    }
    if (token.getKind() != TokenKind.NEWLINE && token.getKind() != TokenKind.EOF) {
      syntaxError("expected newline");
    }
    list.add(statement);
  }

  // comment_block = COMMENT ('\n' COMMENT)*
  // Consecutive comment lines with no blank line between them form one block.
  private CommentGroup parseCommentBlock() {
    List<SingleLineComment> comments = new ArrayList<>();
    comments.add(new SingleLineComment(expect(TokenKind.COMMENT)));
    while (token.getKind() == TokenKind.NEWLINE
        && (Integer) token.getValue() == 1
        && peek(1).getKind() == TokenKind.COMMENT) {
      nextToken();
      comments.add(new SingleLineComment(nextToken()));
    }
    return new CommentGroup(comments);
  }

  private boolean endsCommentStatement() {
    if (token.getKind() == TokenKind.EOF) {
      return true;
    }
    return (Integer) token.getValue() > 1 || peek(1).getKind() == TokenKind.EOF;
  }

  // binop_expression = binop_expression OP binop_expression
  //                  | parsePrimaryWithSuffix
  // This function takes care of precedence between operators (see operatorPrecedence for
  // the order), and it assumes left-to-right associativity.
  private Expression parseBinOpExpression(int prec) {
    Expression x = parseTest(prec + 1);
    // The loop is not strictly needed, but it prevents risks of stack overflow. Depth is
    // limited to number of different precedence levels (operatorPrecedence.size()).
    TokenKind lastOp = null;
    for (; ; ) {
      Token op = peekOperator();
      // 'not' is only a prefix operator
      if (op.getKind() == TokenKind.NOT
          || !operatorPrecedence.get(prec).contains(op.getKind())) {
        return x;
      }

      // Operator '==' and other operators of the same precedence (e.g. '<', 'in')
      // are not associative.
      if (lastOp != null && operatorPrecedence.get(prec).contains(TokenKind.EQUALS_EQUALS)) {
        reportError(
            op.getStartOffset(),
            "Operator '%s' is not associative with operator '%s'. Use parens.",
            lastOp,
            op.getKind());
      }

      skipBracketedNewlines();
      boolean spaced = peek(-1).getEndOffset() < token.getStartOffset();
      consumeOperator(op);
      skipBracketedNewlines();
      Expression y = parseTest(prec + 1);
      x = new InfixExpression(op, x, y, spaced);
      lastOp = op.getKind();
    }
  }

  // Returns the binary operator at the current position, looking past line breaks inside
  // brackets, without consuming anything. 'not' followed by 'in' is combined into one token.
  private Token peekOperator() {
    int offset = 0;
    while (peek(offset).getKind() == TokenKind.NEWLINE && peek(offset).getDepth() > 0) {
      offset++;
    }
    Token op = peek(offset);
    if (op.getKind() == TokenKind.NOT && peek(offset + 1).getKind() == TokenKind.IN) {
      Token in = peek(offset + 1);
      return new Token(
          TokenKind.NOT_IN,
          "not in",
          null,
          op.getStartOffset(),
          in.getEndOffset(),
          op.getDepth());
    }
    return op;
  }

  private void consumeOperator(Token op) {
    if (op.getKind() == TokenKind.NOT_IN) {
      expect(TokenKind.NOT);
    }
    nextToken();
  }

  private Expression parseTest(int prec) {
    if (prec >= operatorPrecedence.size()) {
      return parsePrimaryWithSuffix();
    }
    if (token.getKind() == TokenKind.NOT && operatorPrecedence.get(prec).contains(TokenKind.NOT)) {
      return parseNotExpression(prec);
    }
    return parseBinOpExpression(prec);
  }

  // not_expr = 'not' expr
  private Expression parseNotExpression(int prec) {
    Token not = expect(TokenKind.NOT);
    Expression x = parseTest(prec);
    return new PrefixExpression(not, x);
  }

  // primary_with_suffix = primary
  //                     | primary_with_suffix '.' IDENTIFIER
  //                     | primary_with_suffix '(' arg_list? ')'
  //                     | primary_with_suffix '[' expr ']'
  private Expression parsePrimaryWithSuffix() {
    Expression e = parsePrimary();
    while (true) {
      if (token.getKind() == TokenKind.DOT) {
        e = parseSelectorSuffix(e);
      } else if (token.getKind() == TokenKind.LPAREN) {
        e = parseCallSuffix(e);
      } else if (token.getKind() == TokenKind.LBRACKET) {
        e = parseIndexSuffix(e);
      } else {
        break;
      }
    }
    return e;
  }

  // selector_suffix = '.' IDENTIFIER
  private Expression parseSelectorSuffix(Expression e) {
    Token dot = expect(TokenKind.DOT);
    if (token.getKind() == TokenKind.IDENTIFIER) {
      return new InfixExpression(dot, e, parseIdent(), /* spaced= */ false);
    }
    syntaxError("expected identifier after dot");
    Token start = token;
    int end = syncTo(EXPR_TERMINATOR_SET);
    return new InfixExpression(dot, e, makeErrorExpression(start, end), /* spaced= */ false);
  }

  // call_suffix = '(' arg_list? ')'
  // The callee of a call is a rule name.
  private Expression parseCallSuffix(Expression fn) {
    if (fn instanceof Identifier && fn.getToken().getKind() == TokenKind.IDENTIFIER) {
      Token t = fn.getToken();
      fn =
          new Identifier(
              new Token(
                  TokenKind.RULE_NAME,
                  t.getLiteral(),
                  t.getValue(),
                  t.getStartOffset(),
                  t.getEndOffset(),
                  t.getDepth()),
              ((Identifier) fn).getName());
    }
    Token lparen = token;
    ExpressionList args = parseExpressionList(TokenKind.RPAREN);
    return new CallExpression(lparen, fn, args);
  }

  // index_suffix = '[' expr ']'
  private Expression parseIndexSuffix(Expression e) {
    Token lbracket = expect(TokenKind.LBRACKET);
    skipBracketedNewlines();
    Expression key = parseTest(0);
    skipBracketedNewlines();
    expect(TokenKind.RBRACKET);
    return new IndexExpression(lbracket, e, key);
  }

  private Identifier parseIdent() {
    if (token.getKind() != TokenKind.IDENTIFIER) {
      Token start = token;
      expect(TokenKind.IDENTIFIER);
      return makeErrorExpression(start, start.getEndOffset());
    }
    Token ident = nextToken();
    return new Identifier(ident, (String) ident.getValue());
  }

  // primary = IDENTIFIER
  //         | INT
  //         | STRING
  //         | 'True' | 'False'
  //         | '[' list_items? ']'
  //         | '{' map_items? '}'
  //         | '(' list_items? ')'
  //         | '-' primary_with_suffix
  //         | '+' primary_with_suffix
  private Expression parsePrimary() {
    TokenKind kind = token.getKind();
    if (kind.isString()) {
      Token t = nextToken();
      return new StringLiteral(t, t.getValue() == null ? "" : (String) t.getValue());
    }
    switch (kind) {
      case INT:
        {
          Token t = nextToken();
          return new IntegerLiteral(t, t.getValue() == null ? 0L : (Long) t.getValue());
        }
      case TRUE:
      case FALSE:
        {
          Token t = nextToken();
          return new BooleanLiteral(t, kind == TokenKind.TRUE);
        }
      case IDENTIFIER:
        return parseIdent();
      case LBRACKET:
        {
          Token lbracket = token;
          return new ArrayLiteral(lbracket, parseExpressionList(TokenKind.RBRACKET));
        }
      case LPAREN:
        {
          Token lparen = token;
          return new TupleLiteral(lparen, parseExpressionList(TokenKind.RPAREN));
        }
      case LBRACE:
        {
          Token lbrace = token;
          ElementParts<KeyValueExpression> parts =
              parseElements(TokenKind.RBRACE, this::parseMapEntry);
          KeyValueExpressionList entries =
              new KeyValueExpressionList(
                  parts.token, parts.elements, parts.multiline, parts.trailingComma);
          parts.decorate(entries);
          return new MapLiteral(lbrace, entries);
        }
      case MINUS:
      case PLUS:
        {
          Token op = nextToken();
          return new PrefixExpression(op, parsePrimaryWithSuffix());
        }
      default:
        {
          Token start = token;
          syntaxError("expected expression");
          int end = syncTo(EXPR_TERMINATOR_SET);
          return makeErrorExpression(start, end);
        }
    }
  }

  // map_entry = test ':' test
  private KeyValueExpression parseMapEntry() {
    Expression key = parseTest(0);
    skipBracketedNewlines();
    Token colon = token;
    if (token.getKind() != TokenKind.COLON) {
      syntaxError("expected ':'");
      return new KeyValueExpression(colon, key, makeErrorExpression(colon, colon.getStartOffset()));
    }
    nextToken();
    skipBracketedNewlines();
    return new KeyValueExpression(colon, key, parseTest(0));
  }

  private ExpressionList parseExpressionList(TokenKind close) {
    ElementParts<Expression> parts = parseElements(close, () -> parseTest(0));
    ExpressionList list =
        new ExpressionList(parts.token, parts.elements, parts.multiline, parts.trailingComma);
    parts.decorate(list);
    return list;
  }

  /** The pieces of a bracketed list, gathered before the list node is built. */
  private static final class ElementParts<E extends Expression> {
    final Token token;
    final List<E> elements = new ArrayList<>();
    boolean multiline;
    boolean trailingComma;
    @Nullable Comment openingComment;
    @Nullable Comment danglingComment;

    ElementParts(Token token) {
      this.token = token;
    }

    void decorate(ElementList<E> list) {
      list.getComments().setLeading(openingComment);
      list.getComments().setTrailing(danglingComment);
    }
  }

  // list_items = element (',' element)* ','?
  // Parses the brackets too. Line breaks and comments between elements are layout: they make the
  // list multi-line, and comments attach to the element they precede or follow on its line.
  private <E extends Expression> ElementParts<E> parseElements(
      TokenKind close, Supplier<E> elementParser) {
    Token open = nextToken();
    int depth = open.getDepth();
    ElementParts<E> parts = new ElementParts<>(open);
    if (token.getKind() == TokenKind.COMMENT) {
      parts.multiline = true;
      parts.openingComment = new SingleLineComment(nextToken());
    }

    List<SingleLineComment> pending = new ArrayList<>();
    int pendingBlankLines = 0;
    int newlines = 0;
    boolean expectingComma = false;
    while (true) {
      TokenKind kind = token.getKind();
      if (kind == TokenKind.NEWLINE) {
        parts.multiline = true;
        newlines += (Integer) token.getValue();
        nextToken();
      } else if (kind == TokenKind.COMMENT) {
        parts.multiline = true;
        E last = parts.elements.isEmpty() ? null : parts.elements.get(parts.elements.size() - 1);
        if (newlines == 0
            && pending.isEmpty()
            && last != null
            && last.getComments().getTrailing() == null) {
          last.getComments().setTrailing(new SingleLineComment(nextToken()));
        } else {
          if (pending.isEmpty()) {
            pendingBlankLines = blankLines(newlines);
          }
          pending.add(new SingleLineComment(nextToken()));
          newlines = 0;
        }
      } else if (kind == close || kind == TokenKind.EOF) {
        if (!pending.isEmpty()) {
          parts.danglingComment = new CommentGroup(pending);
        }
        break;
      } else if (expectingComma) {
        syntaxError(String.format("expected ',' or '%s'", close));
        syncToClose(close, depth);
      } else {
        E element = elementParser.get();
        if (pending.isEmpty()) {
          element.setBlankLinesBefore(blankLines(newlines));
        } else {
          element.setBlankLinesBefore(pendingBlankLines);
          element.getComments().setLeading(new CommentGroup(pending));
          pending = new ArrayList<>();
        }
        parts.elements.add(element);
        newlines = 0;
        if (token.getKind() == TokenKind.COMMA) {
          nextToken();
          parts.trailingComma = true;
        } else {
          parts.trailingComma = false;
          expectingComma = true;
        }
      }
    }
    expect(close);
    return parts;
  }
}
