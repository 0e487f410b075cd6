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

/** A TokenKind represents the kind of a lexical token in a declaration file. */
public enum TokenKind {
  AND("and"),
  BYTE_STRING("byte string literal"),
  COLON(":"),
  COMMA(","),
  COMMENT("comment"),
  DOT("."),
  EOF("EOF"),
  EQUALS("="),
  EQUALS_EQUALS("=="),
  FALSE("False"),
  FORMAT_STRING("format string literal"),
  GREATER(">"),
  GREATER_EQUALS(">="),
  IDENTIFIER("identifier"),
  ILLEGAL("illegal character"),
  IN("in"),
  INT("integer literal"),
  LBRACE("{"),
  LBRACKET("["),
  LESS("<"),
  LESS_EQUALS("<="),
  LPAREN("("),
  MINUS("-"),
  NEWLINE("newline"),
  NOT("not"),
  NOT_EQUALS("!="),
  NOT_IN("not in"),
  OR("or"),
  PERCENT("%"),
  PIPE("|"),
  PLUS("+"),
  RAW_STRING("raw string literal"),
  RBRACE("}"),
  RBRACKET("]"),
  RPAREN(")"),
  RULE_NAME("rule name"),
  SLASH("/"),
  SLASH_SLASH("//"),
  STAR("*"),
  STRING("string literal"),
  TRUE("True"),
  UNICODE_STRING("unicode string literal");

  private final String name;

  private TokenKind(String name) {
    this.name = name;
  }

  /** Reports whether this is one of the string literal kinds, prefixed or not. */
  public boolean isString() {
    switch (this) {
      case STRING:
      case RAW_STRING:
      case BYTE_STRING:
      case FORMAT_STRING:
      case UNICODE_STRING:
        return true;
      default:
        return false;
    }
  }

  @Override
  public String toString() {
    return name;
  }
}
