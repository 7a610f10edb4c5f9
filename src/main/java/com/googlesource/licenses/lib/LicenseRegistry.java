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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableCollection;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.hash.Hashing;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.regex.Pattern;
import org.apache.commons.lang.StringUtils;

/**
 * Immutable table of listed licenses, listed license exceptions, and the case-insensitive aliases
 * mapping free-form license names to one or more listed licenses.
 *
 * <p>Built once and shared. {@link #defaultRegistry()} returns the registry loaded from the bundled
 * snapshot; see {@link RegistrySnapshot} for the snapshot format.
 */
public final class LicenseRegistry {

  /** Prefix of every license reference. */
  public static final String LICENSE_REF_PREFIX = "LicenseRef-";
  /** Marks the explicit absence of any license. */
  public static final String NONE = "NONE";
  /** Marks that no statement about the license was made. */
  public static final String NOASSERTION = "NOASSERTION";

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern NOT_ID_CHARS = Pattern.compile("[^-.a-zA-Z0-9]+");
  private static final int MAX_SUGGESTION_DISTANCE = 3;

  private final String version;
  private final ImmutableMap<String, ListedLicense> licenses; // by canonical id
  private final ImmutableMap<String, ListedException> exceptions; // by canonical id
  private final ImmutableMap<String, ImmutableList<String>> lookup; // lower case id/alias -> ids
  private final ImmutableMap<String, ImmutableList<String>> names; // lower case full name -> id
  private final ImmutableMap<String, String> exceptionLookup; // lower case id/alias -> id

  private LicenseRegistry(Builder b) {
    this.version = b.version;
    this.licenses = ImmutableMap.copyOf(b.licenses);
    this.exceptions = ImmutableMap.copyOf(b.exceptions);
    this.lookup = ImmutableMap.copyOf(b.lookup);
    this.names = ImmutableMap.copyOf(b.names);
    this.exceptionLookup = ImmutableMap.copyOf(b.exceptionLookup);
  }

  /** Returns the registry built from the bundled snapshot. Loaded on first use. */
  public static LicenseRegistry defaultRegistry() {
    return DefaultHolder.INSTANCE;
  }

  private static class DefaultHolder {
    static final LicenseRegistry INSTANCE = RegistrySnapshot.loadDefault();
  }

  /** Returns a Builder object for the LicenseRegistry class. */
  public static Builder builder() {
    return new Builder();
  }

  /** The version of the license list the registry reflects, or empty when unknown. */
  public String version() {
    return version;
  }

  /** All listed licenses in snapshot order. */
  public ImmutableCollection<ListedLicense> licenses() {
    return licenses.values();
  }

  /** All listed license exceptions in snapshot order. */
  public ImmutableCollection<ListedException> exceptions() {
    return exceptions.values();
  }

  /** Returns true when {@code id} is exactly the canonical id of a listed license. */
  public boolean isListed(String id) {
    return licenses.containsKey(id);
  }

  /** Looks up the listed license with canonical id {@code id}, ignoring case. */
  public Optional<ListedLicense> license(String id) {
    ListedLicense license = licenses.get(id);
    if (license == null) {
      ImmutableList<String> ids = lookup.get(normalize(id));
      if (ids != null && ids.size() == 1 && ids.get(0).equalsIgnoreCase(id)) {
        license = licenses.get(ids.get(0));
      }
    }
    return Optional.ofNullable(license);
  }

  /**
   * Returns the listed license with canonical id {@code id}, ignoring case.
   *
   * @throws UnknownLicenseId naming the closest listed ids when {@code id} is not listed
   */
  public ListedLicense require(String id) {
    return license(id).orElseThrow(() -> unknownLicenseId(id, licenses.keySet()));
  }

  /**
   * Resolves the id or alias {@code text} to canonical license ids.
   *
   * <p>Ignores case, leading and trailing whitespace, and treats runs of whitespace as a single
   * space. Returns several ids when the alias stands for a choice among licenses, and an empty list
   * when {@code text} is unknown.
   */
  public ImmutableList<String> resolve(String text) {
    String key = normalize(text);
    ImmutableList<String> ids = lookup.get(key);
    if (ids == null) {
      ids = names.get(key);
    }
    return ids == null ? ImmutableList.of() : ids;
  }

  /** Maps the free-form declared license {@code declared} to the listed licenses it names. */
  public ImmutableList<ListedLicense> map(String declared) {
    ImmutableList.Builder<ListedLicense> b = ImmutableList.builder();
    for (String id : resolve(declared)) {
      b.add(licenses.get(id));
    }
    return b.build();
  }

  /** Returns the canonical spelling of the listed exception id or alias {@code text}. */
  public Optional<String> exceptionId(String text) {
    return Optional.ofNullable(exceptionLookup.get(normalize(text)));
  }

  /** Looks up the listed exception with id or alias {@code text}, ignoring case. */
  public Optional<ListedException> exception(String text) {
    return exceptionId(text).map(exceptions::get);
  }

  /** Returns the listed license ids closest to {@code text}, or empty if none is close. */
  public ImmutableList<String> closestIds(String text) {
    return closest(text, licenses.keySet());
  }

  /**
   * Builds the license reference id for the unlisted license {@code raw}.
   *
   * <p>Text already starting with {@code LicenseRef-} in any case keeps its suffix. Otherwise the
   * text is lower-cased, each run of characters not allowed in identifiers becomes {@code -}, and
   * leading and trailing {@code -} are dropped. A suffix left empty becomes {@code unknown}.
   *
   * <p>e.g. "Foo-Bar-1.0" becomes "LicenseRef-foo-bar-1.0"
   */
  public String sanitizeRef(String raw) {
    String text = Strings.nullToEmpty(raw).trim();
    if (isRefText(text)) {
      return LICENSE_REF_PREFIX + replaceInvalid(text.substring(LICENSE_REF_PREFIX.length()));
    }
    String suffix = StringUtils.strip(replaceInvalid(text.toLowerCase(Locale.ROOT)), "-");
    return LICENSE_REF_PREFIX + (suffix.isEmpty() ? "unknown" : suffix);
  }

  /** Fingerprint of the registry contents for recording which snapshot classified a license. */
  public String signature() {
    StringBuilder sb = new StringBuilder();
    sb.append("v:").append(version).append('\n');
    for (ListedLicense l : licenses.values()) {
      sb.append("l:").append(l.id).append('|').append(l.name);
      sb.append('|').append(l.deprecated).append('|').append(l.orLaterAllowed).append('\n');
    }
    for (ListedException e : exceptions.values()) {
      sb.append("e:").append(e.id).append('|').append(e.name);
      sb.append('|').append(e.deprecated).append('\n');
    }
    for (Map.Entry<String, ImmutableList<String>> alias : lookup.entrySet()) {
      sb.append("a:").append(alias.getKey()).append('=');
      sb.append(Joiner.on(',').join(alias.getValue())).append('\n');
    }
    for (Map.Entry<String, String> alias : exceptionLookup.entrySet()) {
      sb.append("x:").append(alias.getKey()).append('=').append(alias.getValue()).append('\n');
    }
    return Hashing.farmHashFingerprint64().hashBytes(sb.toString().getBytes(UTF_8)).toString();
  }

  /** Returns the canonical spelling when {@code text} is NONE or NOASSERTION in any case. */
  static String sentinel(String text) {
    if (NONE.equalsIgnoreCase(text)) {
      return NONE;
    }
    if (NOASSERTION.equalsIgnoreCase(text)) {
      return NOASSERTION;
    }
    return null;
  }

  /** Returns true when {@code text} starts with {@code LicenseRef-} in any case. */
  static boolean isRefText(String text) {
    return text.regionMatches(true, 0, LICENSE_REF_PREFIX, 0, LICENSE_REF_PREFIX.length());
  }

  /** Lower-cases {@code text} and collapses whitespace for case-insensitive lookup. */
  static String normalize(String text) {
    return WHITESPACE.matcher(Strings.nullToEmpty(text).trim()).replaceAll(" ")
        .toLowerCase(Locale.ROOT);
  }

  private static String replaceInvalid(String text) {
    return NOT_ID_CHARS.matcher(text).replaceAll("-");
  }

  private static ImmutableList<String> closest(String text, Iterable<String> candidates) {
    String lower = Strings.nullToEmpty(text).toLowerCase(Locale.ROOT);
    int minDist = -1;
    for (String candidate : candidates) {
      int dist = StringUtils.getLevenshteinDistance(candidate.toLowerCase(Locale.ROOT), lower);
      if (minDist < 0 || dist < minDist) {
        minDist = dist;
      }
    }
    ImmutableList.Builder<String> closeMatches = ImmutableList.builder();
    if (minDist >= 0 && minDist < MAX_SUGGESTION_DISTANCE) {
      for (String candidate : candidates) {
        if (StringUtils.getLevenshteinDistance(candidate.toLowerCase(Locale.ROOT), lower)
            == minDist) {
          closeMatches.add(candidate);
        }
      }
    }
    return closeMatches.build();
  }

  private static UnknownLicenseId unknownLicenseId(String id, Iterable<String> known) {
    ImmutableList<String> closeMatches = closest(id, known);
    StringBuilder message = new StringBuilder("Unknown license id: ").append(id);
    if (!closeMatches.isEmpty()) {
      String matches = Joiner.on(", ").join(closeMatches);
      int lastIndex = matches.lastIndexOf(", ");
      if (lastIndex > 0) {
        matches = matches.substring(0, lastIndex + 2) + "or " + matches.substring(lastIndex + 2);
      }
      message.append("\n\nDid you mean ").append(matches).append('?');
    }
    return new UnknownLicenseId(message.toString(), closeMatches);
  }

  /** Metadata of a listed license. */
  public static final class ListedLicense {
    public final String id;
    /** Full display name. */
    public final String name;
    /** True when the license list retired this id. */
    public final boolean deprecated;
    /** True when "this version or any later version" ({@code +}) is meaningful. */
    public final boolean orLaterAllowed;

    public ListedLicense(String id, String name, boolean deprecated, boolean orLaterAllowed) {
      this.id = Preconditions.checkNotNull(id);
      this.name = Strings.nullToEmpty(name);
      this.deprecated = deprecated;
      this.orLaterAllowed = orLaterAllowed;
    }

    @Override
    public String toString() {
      return id;
    }
  }

  /** Metadata of a listed license exception. */
  public static final class ListedException {
    public final String id;
    public final String name;
    public final boolean deprecated;

    public ListedException(String id, String name, boolean deprecated) {
      this.id = Preconditions.checkNotNull(id);
      this.name = Strings.nullToEmpty(name);
      this.deprecated = deprecated;
    }

    @Override
    public String toString() {
      return id;
    }
  }

  /** Thrown when requesting a license by an id the registry does not list. */
  public static class UnknownLicenseId extends NoSuchElementException {
    private static final long serialVersionUID = 1L;

    /** The listed ids closest to the requested one. Possibly empty. */
    public final ImmutableList<String> suggestions;

    UnknownLicenseId(String message, ImmutableList<String> suggestions) {
      super(message);
      this.suggestions = suggestions;
    }
  }

  /**
   * Implements the Builder pattern for LicenseRegistry.
   *
   * <p>Add licenses before the aliases that refer to them. Every method rejects input that would
   * make a lookup ambiguous.
   */
  public static class Builder {
    private String version = "";
    private final LinkedHashMap<String, ListedLicense> licenses = new LinkedHashMap<>();
    private final LinkedHashMap<String, ListedException> exceptions = new LinkedHashMap<>();
    private final LinkedHashMap<String, ImmutableList<String>> lookup = new LinkedHashMap<>();
    private final LinkedHashMap<String, ImmutableList<String>> names = new LinkedHashMap<>();
    private final LinkedHashMap<String, String> exceptionLookup = new LinkedHashMap<>();

    private Builder() {}

    /** Create a LicenseRegistry reflecting the current state of this Builder. */
    public LicenseRegistry build() {
      return new LicenseRegistry(this);
    }

    /** Records the version of the license list. */
    public Builder setVersion(String version) {
      this.version = Strings.nullToEmpty(version).trim();
      return this;
    }

    /**
     * Adds {@code license}. Its full name becomes an alias unless another license already uses
     * the same name.
     */
    public Builder addLicense(ListedLicense license) {
      checkIdentifier(license.id);
      String key = normalize(license.id);
      Preconditions.checkArgument(
          !lookup.containsKey(key), "License id %s already registered.", license.id);
      Preconditions.checkArgument(
          sentinel(license.id) == null && !isRefText(license.id),
          "Reserved license id %s.",
          license.id);
      licenses.put(license.id, license);
      lookup.put(key, ImmutableList.of(license.id));
      if (!license.name.trim().isEmpty()) {
        names.putIfAbsent(normalize(license.name), ImmutableList.of(license.id));
      }
      return this;
    }

    /** Adds {@code exception}. */
    public Builder addException(ListedException exception) {
      checkIdentifier(exception.id);
      String key = normalize(exception.id);
      Preconditions.checkArgument(
          !exceptionLookup.containsKey(key), "Exception id %s already registered.", exception.id);
      exceptions.put(exception.id, exception);
      exceptionLookup.put(key, exception.id);
      return this;
    }

    /**
     * Adds {@code alias} for the listed licenses {@code ids}. More than one id means a choice
     * among them, resolved to an OR chain in the given order.
     *
     * @throws UnknownLicenseId when an element of {@code ids} is not listed
     */
    public Builder addAlias(String alias, Iterable<String> ids) {
      String key = normalize(alias);
      Preconditions.checkArgument(!key.isEmpty(), "Empty alias.");
      Preconditions.checkArgument(
          !lookup.containsKey(key), "Alias \"%s\" already registered.", alias);
      ImmutableList.Builder<String> targets = ImmutableList.builder();
      for (String id : ids) {
        if (!licenses.containsKey(id)) {
          throw unknownLicenseId(id, licenses.keySet());
        }
        targets.add(id);
      }
      ImmutableList<String> built = targets.build();
      Preconditions.checkArgument(!built.isEmpty(), "Alias \"%s\" names no license.", alias);
      lookup.put(key, built);
      return this;
    }

    /**
     * Adds {@code alias} for the listed exception {@code id}.
     *
     * @throws NoSuchElementException when {@code id} is not a listed exception
     */
    public Builder addExceptionAlias(String alias, String id) {
      String key = normalize(alias);
      Preconditions.checkArgument(!key.isEmpty(), "Empty alias.");
      Preconditions.checkArgument(
          !exceptionLookup.containsKey(key), "Exception alias \"%s\" already registered.", alias);
      if (!exceptions.containsKey(id)) {
        throw new NoSuchElementException("Unknown exception id: " + id);
      }
      exceptionLookup.put(key, id);
      return this;
    }

    private static void checkIdentifier(String id) {
      Preconditions.checkArgument(!id.isEmpty(), "Empty id.");
      for (int i = 0; i < id.length(); i++) {
        Preconditions.checkArgument(
            SpdxLexer.isIdChar(id.charAt(i)), "Invalid character in id /%s/.", id);
      }
    }
  }
}
