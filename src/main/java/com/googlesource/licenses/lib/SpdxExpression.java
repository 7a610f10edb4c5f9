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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.Objects;

/**
 * Immutable parsed license expression.
 *
 * <p>The four node kinds below are the only subclasses. Expressions compare structurally, and
 * {@link #toString()} renders the text form with the fewest parentheses that preserve the
 * structure, so {@code parse(e.toString()).equals(e)} for every {@code e} returned by {@link
 * #parse(String)}.
 *
 * <p>e.g. {@code (MIT OR Apache-2.0) AND 0BSD} parses as {@code Compound(Compound(MIT, OR,
 * Apache-2.0), AND, 0BSD)} and renders back to the same text.
 *
 * <p>In JSON an expression is a single string holding its text form.
 */
@JsonSerialize(using = ToStringSerializer.class)
public abstract class SpdxExpression {

  // Subclasses below only
  private SpdxExpression() {}

  /** Parses {@code expression} resolving identifiers against the default license registry. */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static SpdxExpression parse(String expression) {
    return parse(expression, LicenseRegistry.defaultRegistry());
  }

  /**
   * Parses {@code expression} resolving identifiers against {@code registry}.
   *
   * <p>Query the result with {@link #canonicalLicenses(LicenseRegistry)} for the same registry;
   * {@link #canonicalLicenses()} only knows the default one.
   */
  public static SpdxExpression parse(String expression, LicenseRegistry registry) {
    return new SpdxParser(registry).parse(expression);
  }

  /**
   * Converts a license as declared in package metadata, e.g. "The Apache Software License, Version
   * 2.0", into an expression.
   *
   * <p>Tries the registry mapping of free-form names first, then parses the text as an expression,
   * and finally falls back to a {@link LicenseRef} made from the sanitized text. Never throws for
   * non-blank input.
   */
  public static SpdxExpression fromDeclared(String declared, LicenseRegistry registry) {
    Preconditions.checkArgument(
        !Strings.nullToEmpty(declared).trim().isEmpty(), "Non-empty declared license required.");
    ImmutableList<String> ids = registry.resolve(declared);
    if (!ids.isEmpty()) {
      return orChain(ids, false);
    }
    try {
      return parse(declared, registry);
    } catch (SpdxException e) {
      return new LicenseRef(registry.sanitizeRef(declared));
    }
  }

  /** Combines {@code expressions} with AND folding to the left. */
  public static SpdxExpression and(Iterable<? extends SpdxExpression> expressions) {
    return fold(expressions, SpdxOperator.AND);
  }

  /** Combines {@code expressions} with OR folding to the left. */
  public static SpdxExpression or(Iterable<? extends SpdxExpression> expressions) {
    return fold(expressions, SpdxOperator.OR);
  }

  private static SpdxExpression fold(
      Iterable<? extends SpdxExpression> expressions, SpdxOperator op) {
    Iterator<? extends SpdxExpression> it = expressions.iterator();
    Preconditions.checkArgument(it.hasNext(), "At least one expression required.");
    SpdxExpression result = it.next();
    while (it.hasNext()) {
      result = new Compound(result, op, it.next());
    }
    return result;
  }

  /** Builds the left-leaning OR chain of the listed licenses {@code ids}. */
  static SpdxExpression orChain(Iterable<String> ids, boolean orLaterVersion) {
    ImmutableList.Builder<SpdxExpression> b = ImmutableList.builder();
    for (String id : ids) {
      b.add(new LicenseId(id, orLaterVersion));
    }
    return or(b.build());
  }

  /** Dispatches to the {@code visitor} method for this node kind. */
  public abstract <R> R accept(Visitor<R> visitor);

  /**
   * Returns the licenses listed in the default registry that this expression refers to. License
   * references, exceptions and the NONE and NOASSERTION markers are ignored.
   *
   * <p>Ids listed only in a custom registry are dropped. Use {@link
   * #canonicalLicenses(LicenseRegistry)} for expressions parsed against another registry.
   */
  public ImmutableSet<String> canonicalLicenses() {
    return canonicalLicenses(LicenseRegistry.defaultRegistry());
  }

  /** Returns the licenses listed in {@code registry} that this expression refers to. */
  public ImmutableSet<String> canonicalLicenses(LicenseRegistry registry) {
    Preconditions.checkNotNull(registry);
    ImmutableSet.Builder<String> b = ImmutableSet.builder();
    for (SpdxExpression leaf : licenses()) {
      if (leaf instanceof LicenseId && registry.isListed(((LicenseId) leaf).id)) {
        b.add(((LicenseId) leaf).id);
      }
    }
    return b.build();
  }

  /** Returns the license and license reference leaves from left to right. */
  public ImmutableList<SpdxExpression> licenses() {
    ImmutableList.Builder<SpdxExpression> b = ImmutableList.builder();
    for (SpdxExpression leaf : leaves()) {
      if (!(leaf instanceof LicenseException)) {
        b.add(leaf);
      }
    }
    return b.build();
  }

  /** Returns the ids of all exceptions attached with WITH. */
  public ImmutableSet<String> exceptions() {
    ImmutableSet.Builder<String> b = ImmutableSet.builder();
    for (SpdxExpression leaf : leaves()) {
      if (leaf instanceof LicenseException) {
        b.add(((LicenseException) leaf).id);
      }
    }
    return b.build();
  }

  /** Returns every non-compound node from left to right. */
  private ImmutableList<SpdxExpression> leaves() {
    ImmutableList.Builder<SpdxExpression> b = ImmutableList.builder();
    ArrayDeque<SpdxExpression> pending = new ArrayDeque<>();
    pending.push(this);
    while (!pending.isEmpty()) {
      SpdxExpression next = pending.pop();
      if (next instanceof Compound) {
        pending.push(((Compound) next).right);
        pending.push(((Compound) next).left);
      } else {
        b.add(next);
      }
    }
    return b.build();
  }

  /** Exhaustive dispatch over the node kinds. */
  public interface Visitor<R> {
    R visitCompound(Compound compound);

    R visitLicenseId(LicenseId licenseId);

    R visitLicenseRef(LicenseRef licenseRef);

    R visitLicenseException(LicenseException licenseException);
  }

  /** Two expressions joined by an operator. */
  public static final class Compound extends SpdxExpression {
    public final SpdxExpression left;
    public final SpdxOperator operator;
    public final SpdxExpression right;
    private final int hash;

    public Compound(SpdxExpression left, SpdxOperator operator, SpdxExpression right) {
      this.left = Preconditions.checkNotNull(left);
      this.operator = Preconditions.checkNotNull(operator);
      this.right = Preconditions.checkNotNull(right);
      Preconditions.checkArgument(
          !(left instanceof LicenseException), "Exception %s used as a license.", left);
      if (operator == SpdxOperator.WITH) {
        Preconditions.checkArgument(
            right instanceof LicenseException, "WITH requires an exception, not %s.", right);
        Preconditions.checkArgument(
            !isWith(left), "Exception already applied to %s.", left);
      } else {
        Preconditions.checkArgument(
            !(right instanceof LicenseException), "Exception %s used as a license.", right);
      }
      // Children cache their own hash codes.
      this.hash = Objects.hash(left, operator, right);
    }

    static boolean isWith(SpdxExpression e) {
      return e instanceof Compound && ((Compound) e).operator == SpdxOperator.WITH;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCompound(this);
    }

    @Override
    public boolean equals(Object other) {
      if (this == other) {
        return true;
      }
      if (!(other instanceof Compound)) {
        return false;
      }
      ArrayDeque<SpdxExpression> pending = new ArrayDeque<>();
      pending.push(this);
      pending.push((Compound) other);
      while (!pending.isEmpty()) {
        SpdxExpression b = pending.pop();
        SpdxExpression a = pending.pop();
        if (a == b) {
          continue;
        }
        if (a instanceof Compound && b instanceof Compound) {
          Compound ca = (Compound) a;
          Compound cb = (Compound) b;
          if (ca.operator != cb.operator || ca.hash != cb.hash) {
            return false;
          }
          pending.push(ca.right);
          pending.push(cb.right);
          pending.push(ca.left);
          pending.push(cb.left);
        } else if (a instanceof Compound || !a.equals(b)) {
          return false;
        }
      }
      return true;
    }

    @Override
    public int hashCode() {
      return hash;
    }

    /** Renders the tree, wrapping a child in parentheses when it binds weaker than its parent. */
    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      // Holds nodes still to render and the literal text between them.
      ArrayDeque<Object> pending = new ArrayDeque<>();
      pending.push(this);
      while (!pending.isEmpty()) {
        Object next = pending.pop();
        if (!(next instanceof Compound)) {
          sb.append(next);
          continue;
        }
        Compound c = (Compound) next;
        c.pushOperand(pending, c.right);
        pending.push(" " + c.operator + " ");
        c.pushOperand(pending, c.left);
      }
      return sb.toString();
    }

    private void pushOperand(ArrayDeque<Object> pending, SpdxExpression child) {
      if (child instanceof Compound && operator.bindsTighterThan(((Compound) child).operator)) {
        pending.push(")");
        pending.push(child);
        pending.push("(");
      } else {
        pending.push(child);
      }
    }
  }

  /** A license identifier known to the registry, or one of the NONE and NOASSERTION markers. */
  public static final class LicenseId extends SpdxExpression {
    public final String id;
    /** True when written with a trailing {@code +} meaning "this version or any later one". */
    public final boolean orLaterVersion;

    public LicenseId(String id) {
      this(id, false);
    }

    public LicenseId(String id, boolean orLaterVersion) {
      this.id = checkIdentifier(id);
      this.orLaterVersion = orLaterVersion;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLicenseId(this);
    }

    @Override
    public boolean equals(Object other) {
      if (this == other) {
        return true;
      }
      if (other instanceof LicenseId) {
        LicenseId otherId = (LicenseId) other;
        return orLaterVersion == otherId.orLaterVersion && id.equals(otherId.id);
      }
      return false;
    }

    @Override
    public int hashCode() {
      return Objects.hash(id, orLaterVersion);
    }

    @Override
    public String toString() {
      return orLaterVersion ? id + "+" : id;
    }
  }

  /** A license not in the registry. The id always starts with {@code LicenseRef-}. */
  public static final class LicenseRef extends SpdxExpression {
    public final String id;

    public LicenseRef(String id) {
      this.id = checkIdentifier(id);
      Preconditions.checkArgument(
          id.startsWith(LicenseRegistry.LICENSE_REF_PREFIX),
          "License reference %s must start with %s",
          id,
          LicenseRegistry.LICENSE_REF_PREFIX);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLicenseRef(this);
    }

    @Override
    public boolean equals(Object other) {
      return this == other || (other instanceof LicenseRef && id.equals(((LicenseRef) other).id));
    }

    @Override
    public int hashCode() {
      return id.hashCode();
    }

    @Override
    public String toString() {
      return id;
    }
  }

  /** The exception on the right-hand side of WITH. */
  public static final class LicenseException extends SpdxExpression {
    public final String id;

    public LicenseException(String id) {
      this.id = checkIdentifier(id);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLicenseException(this);
    }

    @Override
    public boolean equals(Object other) {
      return this == other
          || (other instanceof LicenseException && id.equals(((LicenseException) other).id));
    }

    @Override
    public int hashCode() {
      return id.hashCode() * 31 + 1;
    }

    @Override
    public String toString() {
      return id;
    }
  }

  /** Requires {@code id} to be a single non-empty identifier token. */
  private static String checkIdentifier(String id) {
    Preconditions.checkNotNull(id);
    Preconditions.checkArgument(!id.isEmpty(), "Empty identifier.");
    for (int i = 0; i < id.length(); i++) {
      Preconditions.checkArgument(
          SpdxLexer.isIdChar(id.charAt(i)), "Invalid character in identifier /%s/.", id);
    }
    return id;
  }
}
