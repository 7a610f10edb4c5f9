// Copyright (C) 2019 The Android Open Source Project
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.googlesource.licenses.lib;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Splits a license expression into tokens.
 *
 * <p>Identifiers consist of letters, digits, {@code .} and {@code -}. Whitespace separates tokens
 * and is discarded. The words AND, OR and WITH are operators when written all upper case or all
 * lower case; any other spelling is an identifier.
 */
public final class SpdxLexer {

  // No instances
  private SpdxLexer() {}

  private static final ImmutableMap<String, TokenType> KEYWORDS =
      ImmutableMap.<String, TokenType>builder()
          .put("AND", TokenType.AND)
          .put("and", TokenType.AND)
          .put("OR", TokenType.OR)
          .put("or", TokenType.OR)
          .put("WITH", TokenType.WITH)
          .put("with", TokenType.WITH)
          .build();

  /**
   * Tokenizes {@code expression}.
   *
   * @return the tokens in input order followed by a single {@link TokenType#END} token
   * @throws SpdxException.LexException at the first character outside the language
   */
  public static ImmutableList<Token> tokenize(String expression) {
    Preconditions.checkNotNull(expression);
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    int length = expression.length();
    int i = 0;
    while (i < length) {
      char c = expression.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (c == '(') {
        tokens.add(new Token(TokenType.LPAREN, "(", i));
        i++;
      } else if (c == ')') {
        tokens.add(new Token(TokenType.RPAREN, ")", i));
        i++;
      } else if (c == '+') {
        tokens.add(new Token(TokenType.PLUS, "+", i));
        i++;
      } else if (isIdChar(c)) {
        int start = i;
        while (i < length && isIdChar(expression.charAt(i))) {
          i++;
        }
        String text = expression.substring(start, i);
        tokens.add(new Token(KEYWORDS.getOrDefault(text, TokenType.ID), text, start));
      } else {
        throw new SpdxException.LexException(expression, i);
      }
    }
    tokens.add(new Token(TokenType.END, "", length));
    return tokens.build();
  }

  /** Returns true when {@code c} may appear in a license identifier. */
  static boolean isIdChar(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9')
        || c == '.'
        || c == '-';
  }

  /** Kinds of tokens. */
  public enum TokenType {
    AND,
    OR,
    WITH,
    LPAREN,
    RPAREN,
    PLUS,
    ID,
    END,
  }

  /** A token with the text it was read from and where. */
  public static final class Token {
    public final TokenType type;
    public final String text;
    /** Character offset of the first character of {@link #text}. */
    public final int offset;

    Token(TokenType type, String text, int offset) {
      this.type = type;
      this.text = text;
      this.offset = offset;
    }

    /** Describes the token for error messages. */
    String describe() {
      return type == TokenType.END ? "end of expression" : "'" + text + "'";
    }

    @Override
    public boolean equals(Object other) {
      if (this == other) {
        return true;
      }
      if (other instanceof Token) {
        Token otherToken = (Token) other;
        return type == otherToken.type
            && offset == otherToken.offset
            && text.equals(otherToken.text);
      }
      return false;
    }

    @Override
    public int hashCode() {
      return (type.hashCode() * 31 + text.hashCode()) * 31 + offset;
    }

    @Override
    public String toString() {
      return type + "(" + text + ")@" + offset;
    }
  }
}
