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
import com.googlesource.licenses.lib.SpdxExpression.Compound;
import com.googlesource.licenses.lib.SpdxExpression.LicenseException;
import com.googlesource.licenses.lib.SpdxExpression.LicenseId;
import com.googlesource.licenses.lib.SpdxExpression.LicenseRef;
import com.googlesource.licenses.lib.SpdxLexer.Token;
import com.googlesource.licenses.lib.SpdxLexer.TokenType;
import java.util.ArrayDeque;

/**
 * Immutable recursive-descent parser for license expressions.
 *
 * <p>Grammar, from the loosest to the tightest binding:
 *
 * <pre>
 *   expression := orExpr
 *   orExpr     := andExpr (OR andExpr)*
 *   andExpr    := withExpr (AND withExpr)*
 *   withExpr   := atom (WITH exceptionId)?
 *   atom       := '(' expression ')' | ID '+'?
 * </pre>
 *
 * <p>Repeated operators fold to the left: {@code A OR B OR C} is {@code (A OR B) OR C}, and so is
 * {@code A OR (B OR C)}.
 *
 * <p>Identifiers resolve case-insensitively against the registry. Ids and aliases of listed
 * licenses become {@link LicenseId}; aliases naming several licenses become an OR chain of them;
 * anything else becomes a {@link LicenseRef}, with a trailing {@code +} folded into the reference
 * as {@code -or-later}. Safe for concurrent use.
 *
 * <p>Parentheses nest at most {@link #MAX_DEPTH} levels.
 */
public final class SpdxParser {
  /** Deepest parenthesis nesting accepted. */
  public static final int MAX_DEPTH = 256;

  private final LicenseRegistry registry;

  public SpdxParser(LicenseRegistry registry) {
    this.registry = Preconditions.checkNotNull(registry);
  }

  /**
   * Parses {@code expression}.
   *
   * @return the complete expression -- never null
   * @throws SpdxException if any part of {@code expression} is malformed
   */
  public SpdxExpression parse(String expression) {
    Preconditions.checkNotNull(expression);
    Cursor c = new Cursor(expression, SpdxLexer.tokenize(expression));
    if (c.peek().type == TokenType.END) {
      throw new SpdxException.SyntaxException("Empty license expression", expression, 0, 0);
    }
    SpdxExpression result = parseOr(c);
    Token trailing = c.peek();
    if (trailing.type == TokenType.RPAREN) {
      throw c.error(trailing, "Unbalanced ')' at offset " + trailing.offset);
    }
    if (trailing.type != TokenType.END) {
      throw c.error(
          trailing,
          "Unexpected "
              + trailing.describe()
              + " at offset "
              + trailing.offset
              + ", expected AND, OR or end of expression");
    }
    return result;
  }

  private SpdxExpression parseOr(Cursor c) {
    SpdxExpression left = parseAnd(c);
    while (c.peek().type == TokenType.OR) {
      c.next();
      left = join(left, SpdxOperator.OR, parseAnd(c));
    }
    return left;
  }

  private SpdxExpression parseAnd(Cursor c) {
    SpdxExpression left = parseWith(c);
    while (c.peek().type == TokenType.AND) {
      c.next();
      left = join(left, SpdxOperator.AND, parseWith(c));
    }
    return left;
  }

  /**
   * Joins two operands, re-associating a right operand with the same operator to the left. AND and
   * OR are associative, and the result renders without parentheses.
   *
   * <p>The operands of {@code right} under {@code op} are appended to {@code left} in order, in a
   * single pass over {@code right}.
   */
  private static SpdxExpression join(SpdxExpression left, SpdxOperator op, SpdxExpression right) {
    SpdxExpression result = left;
    ArrayDeque<SpdxExpression> pending = new ArrayDeque<>();
    pending.push(right);
    while (!pending.isEmpty()) {
      SpdxExpression next = pending.pop();
      if (next instanceof Compound && ((Compound) next).operator == op) {
        pending.push(((Compound) next).right);
        pending.push(((Compound) next).left);
      } else {
        result = new Compound(result, op, next);
      }
    }
    return result;
  }

  private SpdxExpression parseWith(Cursor c) {
    SpdxExpression license = parseAtom(c);
    if (c.peek().type != TokenType.WITH) {
      return license;
    }
    Token with = c.next();
    if (Compound.isWith(license)) {
      throw c.error(
          with, "Second WITH at offset " + with.offset + " applied to '" + license + "'");
    }
    Token exception = c.next();
    if (exception.type != TokenType.ID) {
      throw c.error(
          exception,
          "Expected license exception after WITH but found "
              + exception.describe()
              + " at offset "
              + exception.offset);
    }
    String id = registry.exceptionId(exception.text).orElse(exception.text);
    return new Compound(license, SpdxOperator.WITH, new LicenseException(id));
  }

  private SpdxExpression parseAtom(Cursor c) {
    Token t = c.next();
    switch (t.type) {
      case LPAREN:
        if (c.depth == MAX_DEPTH) {
          throw c.error(
              t, "Parentheses nested deeper than " + MAX_DEPTH + " at offset " + t.offset);
        }
        c.depth++;
        SpdxExpression inner = parseOr(c);
        c.depth--;
        Token close = c.next();
        if (close.type != TokenType.RPAREN) {
          throw c.error(
              close,
              "Expected ')' closing '(' at offset "
                  + t.offset
                  + " but found "
                  + close.describe()
                  + " at offset "
                  + close.offset);
        }
        return inner;
      case ID:
        Token plus = c.peek().type == TokenType.PLUS ? c.next() : null;
        return resolve(c, t, plus);
      default:
        throw c.error(
            t,
            "Expected license identifier or '(' but found "
                + t.describe()
                + " at offset "
                + t.offset);
    }
  }

  /** Resolves the identifier {@code id}, optionally followed by {@code plus}, to an expression. */
  private SpdxExpression resolve(Cursor c, Token id, Token plus) {
    String sentinel = LicenseRegistry.sentinel(id.text);
    if (sentinel != null) {
      if (plus != null) {
        throw c.error(plus, "'+' not allowed after " + sentinel + " at offset " + plus.offset);
      }
      return new LicenseId(sentinel);
    }
    ImmutableList<String> ids =
        LicenseRegistry.isRefText(id.text) ? ImmutableList.of() : registry.resolve(id.text);
    if (ids.isEmpty()) {
      // References have no "or later" form of their own.
      String text = plus != null ? id.text + "-or-later" : id.text;
      return new LicenseRef(registry.sanitizeRef(text));
    }
    return SpdxExpression.orChain(ids, plus != null);
  }

  /** Position within the token list of a single parse. */
  private static class Cursor {
    private final String expression;
    private final ImmutableList<Token> tokens;
    private int pos;
    /** Number of '(' currently open. */
    int depth;

    Cursor(String expression, ImmutableList<Token> tokens) {
      this.expression = expression;
      this.tokens = tokens;
      this.pos = 0;
    }

    Token peek() {
      return tokens.get(pos);
    }

    /** Consumes and returns the next token. Stays on the final END token. */
    Token next() {
      Token t = tokens.get(pos);
      if (t.type != TokenType.END) {
        pos++;
      }
      return t;
    }

    SpdxException.SyntaxException error(Token at, String message) {
      return new SpdxException.SyntaxException(message, expression, at.offset, at.text.length());
    }
  }
}
