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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.googlesource.licenses.lib.LicenseRegistry;
import com.googlesource.licenses.lib.LicenseRegistry.ListedException;
import com.googlesource.licenses.lib.LicenseRegistry.ListedLicense;
import com.googlesource.licenses.lib.SpdxException;
import com.googlesource.licenses.lib.SpdxExpression;
import com.googlesource.licenses.lib.SpdxExpression.Compound;
import com.googlesource.licenses.lib.SpdxExpression.LicenseException;
import com.googlesource.licenses.lib.SpdxExpression.LicenseId;
import com.googlesource.licenses.lib.SpdxExpression.LicenseRef;
import com.googlesource.licenses.lib.SpdxParser;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;

/**
 * Validates the license expression fields of a single document.
 *
 * <p>Each field parses independently: a field that fails to parse gets an ERROR message and no
 * expression, while the remaining fields still parse. Parsed fields may get warnings about
 * deprecated ids, misplaced {@code +} and unknown ids that look like misspelled listed ones.
 */
public class ExpressionValidator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final LicenseRegistry registry;
  private final SpdxParser parser;

  public ExpressionValidator() {
    this(LicenseRegistry.defaultRegistry());
  }

  public ExpressionValidator(LicenseRegistry registry) {
    this.registry = Preconditions.checkNotNull(registry);
    this.parser = new SpdxParser(registry);
  }

  /**
   * Parses every field of {@code fields}, keyed by field name, in iteration order.
   *
   * <p>Null values mean the document does not have the field and get skipped.
   */
  public Result validate(Map<String, String> fields) {
    ImmutableMap.Builder<String, SpdxExpression> expressions = ImmutableMap.builder();
    ArrayList<ValidationMessage> messages = new ArrayList<>();
    for (Map.Entry<String, String> field : fields.entrySet()) {
      String name = field.getKey();
      String raw = field.getValue();
      if (raw == null) {
        continue;
      }
      SpdxExpression expression;
      try {
        expression = parser.parse(raw);
      } catch (SpdxException e) {
        logger.atFine().withCause(e).log("rejected license field %s = %s", name, raw);
        messages.add(
            ValidationMessage.error(name, fieldMessage(name, raw, e.offset, e.getMessage())));
        continue;
      }
      expressions.put(name, expression);
      expression.accept(new Checker(name, messages));
    }
    return new Result(expressions.build(), ImmutableList.copyOf(messages));
  }

  /** Formats {@code message} with a caret under {@code offset} of the field value. */
  @VisibleForTesting
  static String fieldMessage(String field, String value, int offset, String message) {
    StringBuilder sb = new StringBuilder();
    sb.append("license field ").append(field).append(":\n");
    sb.append("  ").append(field).append(" = ").append(value).append('\n');
    sb.append(Strings.repeat(" ", field.length() + 5 + offset));
    sb.append("^\n");
    sb.append(message);
    return sb.toString();
  }

  /** Adds the warnings and hints for the parsed expression of one field. */
  private class Checker implements SpdxExpression.Visitor<Void> {
    private final String field;
    private final ArrayList<ValidationMessage> messages;

    Checker(String field, ArrayList<ValidationMessage> messages) {
      this.field = field;
      this.messages = messages;
    }

    /** Visits the operands from left to right without recursing into nested compounds. */
    @Override
    public Void visitCompound(Compound compound) {
      ArrayDeque<SpdxExpression> pending = new ArrayDeque<>();
      pending.push(compound);
      while (!pending.isEmpty()) {
        SpdxExpression next = pending.pop();
        if (next instanceof Compound) {
          pending.push(((Compound) next).right);
          pending.push(((Compound) next).left);
        } else {
          next.accept(this);
        }
      }
      return null;
    }

    @Override
    public Void visitLicenseId(LicenseId licenseId) {
      Optional<ListedLicense> listed = registry.license(licenseId.id);
      if (!listed.isPresent()) {
        return null; // NONE or NOASSERTION
      }
      if (listed.get().deprecated) {
        messages.add(
            ValidationMessage.warning(field, "deprecated license id " + licenseId.id));
      }
      if (licenseId.orLaterVersion && !listed.get().orLaterAllowed) {
        messages.add(
            ValidationMessage.warning(
                field, "license " + licenseId.id + " has no later versions for '+' to include"));
      }
      return null;
    }

    @Override
    public Void visitLicenseRef(LicenseRef licenseRef) {
      ImmutableList<String> closeMatches =
          registry.closestIds(licenseRef.id.substring(LicenseRegistry.LICENSE_REF_PREFIX.length()));
      if (!closeMatches.isEmpty()) {
        messages.add(
            ValidationMessage.warning(
                field,
                "unknown license "
                    + licenseRef.id
                    + "\n\nDid you mean "
                    + Joiner.on(" or ").join(closeMatches)
                    + "?"));
      }
      return null;
    }

    @Override
    public Void visitLicenseException(LicenseException licenseException) {
      Optional<ListedException> listed = registry.exception(licenseException.id);
      if (!listed.isPresent()) {
        messages.add(
            ValidationMessage.hint(field, "unlisted license exception " + licenseException.id));
      } else if (listed.get().deprecated) {
        messages.add(
            ValidationMessage.warning(
                field, "deprecated license exception id " + licenseException.id));
      }
      return null;
    }
  }

  /** The parsed fields of one document and the findings about them. */
  public static final class Result {
    /** Successfully parsed fields by name. Rejected fields are absent. */
    public final ImmutableMap<String, SpdxExpression> expressions;

    public final ImmutableList<ValidationMessage> messages;

    Result(
        ImmutableMap<String, SpdxExpression> expressions,
        ImmutableList<ValidationMessage> messages) {
      this.expressions = expressions;
      this.messages = messages;
    }

    /** Returns true when at least one field was rejected. */
    public boolean hasErrors() {
      return messages.stream().anyMatch(m -> m.getType().equals(ValidationMessage.Type.ERROR));
    }

    /** Returns the messages about {@code field} in order. */
    public ImmutableList<ValidationMessage> messagesFor(String field) {
      ImmutableList.Builder<ValidationMessage> b = ImmutableList.builder();
      for (ValidationMessage m : messages) {
        if (m.getField().equals(field)) {
          b.add(m);
        }
      }
      return b.build();
    }

    /** Appends each message with its type for display. */
    public void appendMessages(StringBuilder sb) {
      for (ValidationMessage msg : messages) {
        sb.append("\n\n");
        sb.append(msg.getType().toString());
        sb.append(": ");
        sb.append(msg.getMessage());
      }
    }
  }
}
