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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;

/**
 * A scanner for declaration files.
 *
 * <p>Unlike a Python scanner, this one does not compute INDENT and OUTDENT tokens: the grammar has
 * no blocks. Instead it reports every run of line breaks, inside brackets or not, as one NEWLINE
 * token whose value is the number of line breaks, so that the parser can record the layout of
 * collections and the blank lines between statements.
 */
final class Lexer {

  // --- These fields are accessed directly by the parser and by tokenize: ---

  // Information about current token. Updated by nextToken.
  // raw is the source text of every token; value is defined for strings, INT, IDENTIFIER,
  // COMMENT, NEWLINE and ILLEGAL.
  TokenKind kind;
  int start; // start offset
  int end; // end offset
  int depth; // bracket depth of the token
  String raw; // source text of token
  Object value; // String, Long or Integer value of token

  // --- end of parser-visible fields ---

  final FileLocations locs;

  private final List<SyntaxError> errors;

  // Input buffer and position
  private final char[] buffer;
  private int pos;

  // The number of unclosed open-parens ("(", '{', '[') at the current point in
  // the stream.
  private int openParenStackDepth = 0;

  private static final ImmutableMap<String, TokenKind> KEYWORDS =
      ImmutableMap.<String, TokenKind>builder()
          .put("and", TokenKind.AND)
          .put("in", TokenKind.IN)
          .put("not", TokenKind.NOT)
          .put("or", TokenKind.OR)
          .put("True", TokenKind.TRUE)
          .put("False", TokenKind.FALSE)
          .buildOrThrow();

  private static final ImmutableMap<Character, TokenKind> STRING_PREFIXES =
      ImmutableMap.of(
          'r', TokenKind.RAW_STRING,
          'b', TokenKind.BYTE_STRING,
          'f', TokenKind.FORMAT_STRING,
          'u', TokenKind.UNICODE_STRING);

  // Constructs a lexer which tokenizes the parser input.
  // Errors are appended to errors.
  Lexer(ParserInput input, List<SyntaxError> errors) {
    this.locs = FileLocations.create(input.getContent(), input.getFile());
    this.buffer = input.getContent();
    this.pos = 0;
    this.errors = errors;
  }

  /**
   * Scans the whole input. The result always ends with an EOF token. Lexical errors, such as an
   * unclosed string literal, are appended to errors; unknown characters become ILLEGAL tokens
   * and are left for the parser to report.
   */
  static ImmutableList<Token> tokenize(ParserInput input, List<SyntaxError> errors) {
    Lexer lexer = new Lexer(input, errors);
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    do {
      lexer.nextToken();
      tokens.add(lexer.toToken());
    } while (lexer.kind != TokenKind.EOF);
    return tokens.build();
  }

  /** Reads the next token, updating the Lexer's token fields. */
  void nextToken() {
    tokenize();
    Preconditions.checkState(kind != null);
  }

  Token toToken() {
    return new Token(kind, raw, value, start, end, depth);
  }

  private void popParen() {
    if (openParenStackDepth > 0) {
      openParenStackDepth--;
    }
  }

  private void error(String message, int pos) {
    errors.add(locs.error(pos, message));
  }

  private void setToken(TokenKind kind, int start, int end) {
    this.kind = kind;
    this.start = start;
    this.end = end;
    this.depth = openParenStackDepth;
    this.value = null;
    this.raw = bufferSlice(start, end);
  }

  // setValue sets the value associated with a string, INT, IDENTIFIER, COMMENT, NEWLINE or
  // ILLEGAL token.
  private void setValue(Object value) {
    this.value = value;
  }

  /**
   * Scans a run of line breaks, together with the whitespace of the lines in between.
   *
   * <p>ON ENTRY: 'pos' is 1 + the index of the first '\n'. ON EXIT: 'pos' is the index of the first
   * printing character after the run, or the end of the buffer.
   */
  private void newlines() {
    int first = pos - 1;
    int last = first;
    int count = 1;
    int scan = pos;
    while (scan < buffer.length) {
      char c = buffer[scan];
      if (c == ' ' || c == '\t' || c == '\r') {
        scan++;
      } else if (c == '\n') {
        count++;
        last = scan;
        scan++;
      } else {
        break;
      }
    }
    pos = scan;
    setToken(TokenKind.NEWLINE, first, last + 1);
    setValue(count);
  }

  /**
   * Returns true if current position is in the middle of a triple quote delimiter (3 x quot), and
   * advances 'pos' by two if so.
   */
  private boolean skipTripleQuote(char quot) {
    if (peek(0) == quot && peek(1) == quot) {
      pos += 2;
      return true;
    } else {
      return false;
    }
  }

  /**
   * Scans a string literal delimited by 'quot', decoding escape sequences unless the literal is
   * raw. The token's raw text keeps the prefix letter and the quotes.
   *
   * <ul>
   *   <li>ON ENTRY: 'pos' is 1 + the index of the first delimiter
   *   <li>ON EXIT: 'pos' is 1 + the index of the last delimiter.
   * </ul>
   */
  private void stringLiteral(char quot, TokenKind stringKind) {
    boolean isRaw = stringKind == TokenKind.RAW_STRING;
    int literalStartPos = stringKind == TokenKind.STRING ? pos - 1 : pos - 2;
    boolean inTriplequote = skipTripleQuote(quot);
    StringBuilder literal = new StringBuilder();
    while (pos < buffer.length) {
      char c = buffer[pos];
      pos++;
      switch (c) {
        case '\n':
          if (inTriplequote) {
            literal.append(c);
            break;
          }
          pos--; // leave the newline for the next token
          error("unclosed string literal", literalStartPos);
          setToken(stringKind, literalStartPos, pos);
          setValue(literal.toString());
          return;
        case '\\':
          if (pos == buffer.length) {
            error("unclosed string literal", literalStartPos);
            setToken(stringKind, literalStartPos, pos);
            setValue(literal.toString());
            return;
          }
          c = buffer[pos];
          pos++;
          if (isRaw) {
            literal.append('\\').append(c);
            break;
          }
          switch (c) {
            case '\n':
              // line continuation within the literal
              break;
            case 'n':
              literal.append('\n');
              break;
            case 'r':
              literal.append('\r');
              break;
            case 't':
              literal.append('\t');
              break;
            case '\\':
              literal.append('\\');
              break;
            case '\'':
              literal.append('\'');
              break;
            case '"':
              literal.append('"');
              break;
            default:
              // unknown char escape => "\literal"
              literal.append('\\');
              literal.append(c);
              break;
          }
          break;
        case '\'':
        case '"':
          if (c != quot || (inTriplequote && !skipTripleQuote(quot))) {
            // Non-matching quote, treat it like a regular char.
            literal.append(c);
          } else {
            // Matching close-delimiter, all done.
            setToken(stringKind, literalStartPos, pos);
            setValue(literal.toString());
            return;
          }
          break;
        default:
          literal.append(c);
          break;
      }
    }
    error("unclosed string literal", literalStartPos);
    setToken(stringKind, literalStartPos, pos);
    setValue(literal.toString());
  }

  /**
   * Scans an identifier or keyword.
   *
   * <p>ON ENTRY: 'pos' is 1 + the index of the first char in the identifier. ON EXIT: 'pos' is 1 +
   * the index of the last char in the identifier.
   */
  private void identifierOrKeyword() {
    int oldPos = pos - 1;
    while (pos < buffer.length && isIdentifierPart(buffer[pos])) {
      pos++;
    }
    String id = bufferSlice(oldPos, pos);
    TokenKind keyword = KEYWORDS.get(id);
    if (keyword == null) {
      setToken(TokenKind.IDENTIFIER, oldPos, pos);
      setValue(id);
    } else {
      setToken(keyword, oldPos, pos);
    }
  }

  // Scans an integer literal: decimal, hexadecimal (0x) or octal (0o).
  // ON ENTRY: 'pos' is the index of the first digit.
  private void integer() {
    int oldPos = pos;
    while (pos < buffer.length && isIdentifierPart(buffer[pos])) {
      pos++;
    }
    String text = bufferSlice(oldPos, pos);
    setToken(TokenKind.INT, oldPos, pos);
    long value = 0;
    try {
      if (text.startsWith("0x") || text.startsWith("0X")) {
        value = Long.parseLong(text.substring(2), 16);
      } else if (text.startsWith("0o") || text.startsWith("0O")) {
        value = Long.parseLong(text.substring(2), 8);
      } else {
        value = Long.parseLong(text);
      }
    } catch (NumberFormatException ex) {
      error("invalid integer literal: " + text, oldPos);
    }
    setValue(value);
  }

  // Returns the ith unconsumed char, or -1 for EOF.
  private int peek(int i) {
    return pos + i < buffer.length ? buffer[pos + i] : -1;
  }

  /**
   * Performs tokenization of the character buffer of file contents provided to the constructor.
   * Exactly one token is scanned.
   */
  private void tokenize() {
    kind = null;
    while (pos < buffer.length) {
      char c = buffer[pos];
      pos++;
      switch (c) {
        case '{':
          setToken(TokenKind.LBRACE, pos - 1, pos);
          openParenStackDepth++;
          break;
        case '}':
          popParen();
          setToken(TokenKind.RBRACE, pos - 1, pos);
          break;
        case '(':
          setToken(TokenKind.LPAREN, pos - 1, pos);
          openParenStackDepth++;
          break;
        case ')':
          popParen();
          setToken(TokenKind.RPAREN, pos - 1, pos);
          break;
        case '[':
          setToken(TokenKind.LBRACKET, pos - 1, pos);
          openParenStackDepth++;
          break;
        case ']':
          popParen();
          setToken(TokenKind.RBRACKET, pos - 1, pos);
          break;
        case '=':
          if (peek(0) == '=') {
            setToken(TokenKind.EQUALS_EQUALS, pos - 1, pos + 1);
            pos++;
          } else {
            setToken(TokenKind.EQUALS, pos - 1, pos);
          }
          break;
        case '!':
          if (peek(0) == '=') {
            setToken(TokenKind.NOT_EQUALS, pos - 1, pos + 1);
            pos++;
          } else {
            setToken(TokenKind.ILLEGAL, pos - 1, pos);
            setValue(Character.toString(c));
          }
          break;
        case '>':
          if (peek(0) == '=') {
            setToken(TokenKind.GREATER_EQUALS, pos - 1, pos + 1);
            pos++;
          } else {
            setToken(TokenKind.GREATER, pos - 1, pos);
          }
          break;
        case '<':
          if (peek(0) == '=') {
            setToken(TokenKind.LESS_EQUALS, pos - 1, pos + 1);
            pos++;
          } else {
            setToken(TokenKind.LESS, pos - 1, pos);
          }
          break;
        case '/':
          if (peek(0) == '/') {
            setToken(TokenKind.SLASH_SLASH, pos - 1, pos + 1);
            pos++;
          } else {
            setToken(TokenKind.SLASH, pos - 1, pos);
          }
          break;
        case ':':
          setToken(TokenKind.COLON, pos - 1, pos);
          break;
        case ',':
          setToken(TokenKind.COMMA, pos - 1, pos);
          break;
        case '.':
          setToken(TokenKind.DOT, pos - 1, pos);
          break;
        case '+':
          setToken(TokenKind.PLUS, pos - 1, pos);
          break;
        case '-':
          setToken(TokenKind.MINUS, pos - 1, pos);
          break;
        case '*':
          setToken(TokenKind.STAR, pos - 1, pos);
          break;
        case '%':
          setToken(TokenKind.PERCENT, pos - 1, pos);
          break;
        case '|':
          setToken(TokenKind.PIPE, pos - 1, pos);
          break;
        case ' ':
        case '\t':
        case '\r':
          /* ignore */
          break;
        case '\\':
          // Backslash character is valid only at the end of a line (or in a string)
          if (peek(0) == '\n') {
            pos += 1; // skip the end of line character
          } else if (peek(0) == '\r' && peek(1) == '\n') {
            pos += 2; // skip the CRLF at the end of line
          } else {
            setToken(TokenKind.ILLEGAL, pos - 1, pos);
            setValue(Character.toString(c));
          }
          break;
        case '\n':
          newlines();
          break;
        case '#':
          int oldPos = pos - 1;
          while (pos < buffer.length && buffer[pos] != '\n') {
            pos++;
          }
          int commentEnd = pos;
          while (commentEnd > oldPos && buffer[commentEnd - 1] == '\r') {
            commentEnd--;
          }
          setToken(TokenKind.COMMENT, oldPos, commentEnd);
          setValue(raw);
          break;
        case '\'':
        case '"':
          stringLiteral(c, TokenKind.STRING);
          break;
        default:
          // detect prefixed strings, e.g. r"str" or f'{x}'
          TokenKind prefixed = STRING_PREFIXES.get(c);
          if (prefixed != null) {
            int c0 = peek(0);
            if (c0 == '\'' || c0 == '"') {
              pos++;
              stringLiteral((char) c0, prefixed);
              break;
            }
          }

          if (isDigit(c)) {
            pos--; // unconsume
            integer();
            break;
          }

          if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_') {
            identifierOrKeyword();
          } else {
            setToken(TokenKind.ILLEGAL, pos - 1, pos);
            setValue(Character.toString(c));
          }
          break;
      } // switch
      if (kind != null) { // stop here if we scanned a token
        return;
      }
    } // while

    setToken(TokenKind.EOF, pos, pos);
  }

  private static boolean isDigit(int c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentifierPart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || isDigit(c);
  }

  /**
   * Returns parts of the source buffer based on offsets.
   *
   * @param start the beginning offset for the slice
   * @param end the offset immediately following the slice
   * @return the text at offset start with length end - start
   */
  String bufferSlice(int start, int end) {
    return new String(this.buffer, start, end - start);
  }
}
