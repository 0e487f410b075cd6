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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of tokenization behavior of the {@link Lexer}. */
@RunWith(JUnit4.class)
public class LexerTest {

  private final List<SyntaxError> errors = new ArrayList<>();

  private ImmutableList<Token> tokens(String input) {
    errors.clear();
    return Lexer.tokenize(ParserInput.fromString(input, "BUILD"), errors);
  }

  // Renders the tokens as a space-separated list, values in place of kinds where they exist.
  private String names(String input) {
    List<String> names = new ArrayList<>();
    for (Token token : tokens(input)) {
      switch (token.getKind()) {
        case IDENTIFIER:
        case INT:
        case COMMENT:
          names.add(String.valueOf(token.getValue()));
          break;
        case STRING:
          names.add("\"" + token.getValue() + "\"");
          break;
        case NEWLINE:
          names.add("NEWLINE(" + token.getValue() + ")");
          break;
        default:
          names.add(token.getKind().name());
      }
    }
    return Joiner.on(' ').join(names);
  }

  @Test
  public void testRuleCall() {
    assertThat(names("js_library(name = \"foo\", deps = [\":bar\"])\n"))
        .isEqualTo(
            "js_library LPAREN name EQUALS \"foo\" COMMA deps EQUALS LBRACKET \":bar\" RBRACKET"
                + " RPAREN NEWLINE(1) EOF");
    assertThat(errors).isEmpty();
  }

  @Test
  public void testRunsOfLineBreaksAreOneToken() {
    assertThat(names("a\n\n\nb")).isEqualTo("a NEWLINE(3) b EOF");
    assertThat(names("a\n  \n\t\nb")).isEqualTo("a NEWLINE(3) b EOF");
  }

  @Test
  public void testCommentsKeepTheirText() {
    assertThat(names("# heading\nfoo()  # trailing"))
        .isEqualTo("# heading NEWLINE(1) foo LPAREN RPAREN # trailing EOF");
  }

  @Test
  public void testKeywordsAndIntegers() {
    assertThat(names("True False not in and or 42 0x10"))
        .isEqualTo("TRUE FALSE NOT IN AND OR 42 16 EOF");
  }

  @Test
  public void testStringPrefixes() {
    ImmutableList<Token> tokens = tokens("r'a\\d' b\"x\" u'y' f\"{z}\"");
    assertThat(tokens.get(0).getKind()).isEqualTo(TokenKind.RAW_STRING);
    assertThat(tokens.get(0).getValue()).isEqualTo("a\\d");
    assertThat(tokens.get(1).getKind()).isEqualTo(TokenKind.BYTE_STRING);
    assertThat(tokens.get(2).getKind()).isEqualTo(TokenKind.UNICODE_STRING);
    assertThat(tokens.get(3).getKind()).isEqualTo(TokenKind.FORMAT_STRING);
  }

  @Test
  public void testBracketDepth() {
    ImmutableList<Token> tokens = tokens("f([\n  1,\n])");
    assertThat(tokens.get(0).getDepth()).isEqualTo(0); // f
    assertThat(tokens.get(1).getDepth()).isEqualTo(0); // (
    assertThat(tokens.get(2).getDepth()).isEqualTo(1); // [
    assertThat(tokens.get(3).getKind()).isEqualTo(TokenKind.NEWLINE);
    assertThat(tokens.get(3).getDepth()).isEqualTo(2);
    assertThat(tokens.get(tokens.size() - 2).getKind()).isEqualTo(TokenKind.RPAREN);
    assertThat(tokens.get(tokens.size() - 2).getDepth()).isEqualTo(0);
  }

  @Test
  public void testUnclosedString() {
    tokens("x = \"abc\n");
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).toString()).isEqualTo("BUILD:1:5: unclosed string literal");
  }

  @Test
  public void testIllegalCharacterIsLeftToTheParser() {
    ImmutableList<Token> tokens = tokens("a $ b");
    assertThat(tokens.get(1).getKind()).isEqualTo(TokenKind.ILLEGAL);
    assertThat(tokens.get(1).getValue()).isEqualTo("$");
    assertThat(errors).isEmpty();
  }
}
