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

/**
 * Thrown when a license expression cannot be parsed.
 *
 * <p>No partial expression accompanies the exception. {@link #offset} and {@link #length} locate
 * the offending text within {@link #expression}.
 */
public class SpdxException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /** The complete text that failed to parse. */
  public final String expression;
  /** Zero-based character offset of the offending text. */
  public final int offset;
  /** Length of the offending text. 0 at the end of the input. */
  public final int length;

  SpdxException(String message, String expression, int offset, int length) {
    super(message);
    this.expression = expression;
    this.offset = offset;
    this.length = length;
  }

  /** Thrown when the expression contains a character outside of the expression language. */
  public static class LexException extends SpdxException {
    private static final long serialVersionUID = 1L;

    /** The unexpected character. */
    public final char character;

    LexException(String expression, int offset) {
      super(
          "Invalid character '" + expression.charAt(offset) + "' at offset " + offset,
          expression,
          offset,
          1);
      this.character = expression.charAt(offset);
    }
  }

  /** Thrown for token sequences the grammar does not accept. */
  public static class SyntaxException extends SpdxException {
    private static final long serialVersionUID = 1L;

    SyntaxException(String message, String expression, int offset, int length) {
      super(message, expression, offset, length);
    }
  }
}
