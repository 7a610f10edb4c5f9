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

package com.googlesource.licenses;

import com.google.common.base.Preconditions;
import java.util.Objects;

/** A finding about one license field of a document. */
public final class ValidationMessage {
  /** Severity of a finding. Only ERROR means the field was rejected. */
  public enum Type {
    ERROR,
    WARNING,
    HINT,
  }

  private final String field;
  private final String message;
  private final Type type;

  public ValidationMessage(String field, String message, Type type) {
    this.field = Preconditions.checkNotNull(field);
    this.message = Preconditions.checkNotNull(message);
    this.type = Preconditions.checkNotNull(type);
  }

  static ValidationMessage error(String field, String message) {
    return new ValidationMessage(field, message, Type.ERROR);
  }

  static ValidationMessage warning(String field, String message) {
    return new ValidationMessage(field, message, Type.WARNING);
  }

  static ValidationMessage hint(String field, String message) {
    return new ValidationMessage(field, message, Type.HINT);
  }

  /** Name of the document field the message is about. */
  public String getField() {
    return field;
  }

  public String getMessage() {
    return message;
  }

  public Type getType() {
    return type;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other instanceof ValidationMessage) {
      ValidationMessage otherMessage = (ValidationMessage) other;
      return type == otherMessage.type
          && field.equals(otherMessage.field)
          && message.equals(otherMessage.message);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(field, message, type);
  }

  @Override
  public String toString() {
    return type + ": " + message;
  }
}
