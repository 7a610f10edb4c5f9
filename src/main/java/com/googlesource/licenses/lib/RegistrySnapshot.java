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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.common.io.Resources;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Set;
import org.eclipse.jgit.errors.ConfigInvalidException;
import org.eclipse.jgit.lib.Config;

/**
 * Reads a {@link LicenseRegistry} from a versioned snapshot in git-config format.
 *
 * <pre>
 * [snapshot]
 *   version = 3.6
 * [license "GPL-2.0-only"]
 *   name = GNU General Public License v2.0 only
 *   orLater = true
 *   alias = GPLv2
 * [license "GPL-2.0"]
 *   deprecated = true
 * [exception "Classpath-exception-2.0"]
 *   name = Classpath exception 2.0
 *   alias = CPE
 * [alias "Perl-5"]
 *   license = Artistic-1.0-Perl
 *   license = GPL-1.0-or-later
 * </pre>
 *
 * <p>An {@code [alias]} section with several {@code license} values stands for a choice among
 * them. All problems in a snapshot get reported together.
 */
public final class RegistrySnapshot {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Classpath resource, relative to this class, holding the bundled snapshot. */
  static final String DEFAULT_RESOURCE = "licenses.config";

  static final String SNAPSHOT = "snapshot";
  static final String LICENSE = "license";
  static final String EXCEPTION = "exception";
  static final String ALIAS = "alias";

  static final String KEY_VERSION = "version";
  static final String KEY_NAME = "name";
  static final String KEY_DEPRECATED = "deprecated";
  static final String KEY_OR_LATER = "orLater";
  static final String KEY_ALIAS = "alias";
  static final String KEY_LICENSE = "license";

  private static final ImmutableSet<String> SECTIONS =
      ImmutableSet.of(SNAPSHOT, LICENSE, EXCEPTION, ALIAS);
  private static final ImmutableSet<String> LICENSE_KEYS =
      ImmutableSet.of(KEY_NAME, KEY_DEPRECATED, KEY_OR_LATER, KEY_ALIAS);
  private static final ImmutableSet<String> EXCEPTION_KEYS =
      ImmutableSet.of(KEY_NAME, KEY_DEPRECATED, KEY_ALIAS);
  private static final ImmutableSet<String> ALIAS_KEYS = ImmutableSet.of(KEY_LICENSE);

  private final Config cfg;
  private final LicenseRegistry.Builder builder;
  private final ArrayList<String> messages;

  private RegistrySnapshot(Config cfg) {
    this.cfg = cfg;
    this.builder = LicenseRegistry.builder();
    this.messages = new ArrayList<>();
  }

  /**
   * Builds a registry from the snapshot {@code text}.
   *
   * @throws ConfigInvalidException listing every problem found in {@code text}
   */
  public static LicenseRegistry parse(String text) throws ConfigInvalidException {
    Config cfg = new Config();
    cfg.fromText(text);
    RegistrySnapshot snapshot = new RegistrySnapshot(cfg);
    snapshot.read();
    if (!snapshot.messages.isEmpty()) {
      for (String message : snapshot.messages) {
        logger.atWarning().log("invalid license snapshot: %s", message);
      }
      throw new ConfigInvalidException(
          "Invalid license snapshot:\n\n" + Joiner.on("\n\n").join(snapshot.messages));
    }
    LicenseRegistry registry = snapshot.builder.build();
    logger.atFine().log(
        "loaded %d licenses and %d exceptions from license list %s (signature %s)",
        registry.licenses().size(),
        registry.exceptions().size(),
        registry.version(),
        registry.signature());
    return registry;
  }

  /** Loads the bundled snapshot. */
  static LicenseRegistry loadDefault() {
    try {
      return parse(
          Resources.toString(
              Resources.getResource(RegistrySnapshot.class, DEFAULT_RESOURCE), UTF_8));
    } catch (IOException | ConfigInvalidException e) {
      logger.atSevere().withCause(e).log("unable to load bundled license snapshot");
      throw new IllegalStateException("Unable to load bundled license snapshot", e);
    }
  }

  /** Formats {@code message} about the {@code key = value} line of {@code [section "sub"]}. */
  @VisibleForTesting
  static String keyValueMessage(
      String section, String subsection, String key, String value, String message) {
    StringBuilder sb = new StringBuilder();
    sb.append('[').append(section);
    if (subsection != null) {
      sb.append(" \"").append(subsection).append('"');
    }
    sb.append("]\n");
    sb.append("  ").append(key).append(" = ").append(Strings.nullToEmpty(value).trim());
    sb.append('\n');
    sb.append(Strings.repeat(" ", key.length() + 5));
    sb.append("^\n"); // ^ aligned under start of value in message
    sb.append(message);
    return sb.toString();
  }

  /** Formats {@code message} about {@code [section "sub"]} as a whole. */
  private static String sectionMessage(String section, String subsection, String message) {
    return "[" + section + (subsection == null ? "" : " \"" + subsection + "\"") + "]\n" + message;
  }

  private void read() {
    for (String section : cfg.getSections()) {
      if (!SECTIONS.contains(section.toLowerCase(Locale.ROOT))) {
        messages.add(sectionMessage(section, null, "unknown section"));
      }
    }
    builder.setVersion(cfg.getString(SNAPSHOT, null, KEY_VERSION));

    // Licenses and exceptions first so that aliases can refer to any of them.
    Set<String> licenseIds = cfg.getSubsections(LICENSE);
    for (String id : licenseIds) {
      checkKeys(LICENSE, id, LICENSE_KEYS);
      Boolean deprecated = readBoolean(LICENSE, id, KEY_DEPRECATED);
      Boolean orLater = readBoolean(LICENSE, id, KEY_OR_LATER);
      if (deprecated == null || orLater == null) {
        continue;
      }
      try {
        builder.addLicense(
            new LicenseRegistry.ListedLicense(
                id, cfg.getString(LICENSE, id, KEY_NAME), deprecated, orLater));
      } catch (IllegalArgumentException e) {
        messages.add(sectionMessage(LICENSE, id, e.getMessage()));
      }
    }
    Set<String> exceptionIds = cfg.getSubsections(EXCEPTION);
    for (String id : exceptionIds) {
      checkKeys(EXCEPTION, id, EXCEPTION_KEYS);
      Boolean deprecated = readBoolean(EXCEPTION, id, KEY_DEPRECATED);
      if (deprecated == null) {
        continue;
      }
      try {
        builder.addException(
            new LicenseRegistry.ListedException(
                id, cfg.getString(EXCEPTION, id, KEY_NAME), deprecated));
      } catch (IllegalArgumentException e) {
        messages.add(sectionMessage(EXCEPTION, id, e.getMessage()));
      }
    }

    for (String id : licenseIds) {
      for (String alias : cfg.getStringList(LICENSE, id, KEY_ALIAS)) {
        addAlias(LICENSE, id, KEY_ALIAS, alias, ImmutableList.of(id));
      }
    }
    for (String id : exceptionIds) {
      for (String alias : cfg.getStringList(EXCEPTION, id, KEY_ALIAS)) {
        if (Strings.nullToEmpty(alias).trim().isEmpty()) {
          messages.add(keyValueMessage(EXCEPTION, id, KEY_ALIAS, alias, "missing alias"));
          continue;
        }
        try {
          builder.addExceptionAlias(alias, id);
        } catch (IllegalArgumentException | NoSuchElementException e) {
          messages.add(keyValueMessage(EXCEPTION, id, KEY_ALIAS, alias, e.getMessage()));
        }
      }
    }
    for (String alias : cfg.getSubsections(ALIAS)) {
      checkKeys(ALIAS, alias, ALIAS_KEYS);
      String[] ids = cfg.getStringList(ALIAS, alias, KEY_LICENSE);
      if (ids.length == 0) {
        messages.add(sectionMessage(ALIAS, alias, "no \"" + KEY_LICENSE + " =\" key was found."));
        continue;
      }
      ImmutableList.Builder<String> targets = ImmutableList.builder();
      for (String id : ids) {
        targets.add(Strings.nullToEmpty(id).trim());
      }
      addAlias(ALIAS, alias, KEY_LICENSE, Joiner.on(", ").join(ids), targets.build());
    }
  }

  private void addAlias(
      String section, String subsection, String key, String alias, ImmutableList<String> ids) {
    if (Strings.nullToEmpty(alias).trim().isEmpty()) {
      messages.add(keyValueMessage(section, subsection, key, alias, "missing alias"));
      return;
    }
    String name = ALIAS.equals(section) ? subsection : alias;
    try {
      builder.addAlias(name, ids);
    } catch (IllegalArgumentException | LicenseRegistry.UnknownLicenseId e) {
      messages.add(keyValueMessage(section, subsection, key, alias, e.getMessage()));
    }
  }

  /** Reports keys of {@code [section "subsection"]} outside of {@code allowed}. Ignores case. */
  private void checkKeys(String section, String subsection, ImmutableSet<String> allowed) {
    for (String name : cfg.getNames(section, subsection)) {
      boolean known = false;
      for (String key : allowed) {
        known |= key.equalsIgnoreCase(name);
      }
      if (!known) {
        messages.add(
            keyValueMessage(
                section,
                subsection,
                name,
                cfg.getString(section, subsection, name),
                "unknown key; expected one of " + Arrays.toString(allowed.toArray())));
      }
    }
  }

  /** Returns the boolean value, false when absent, or null after recording an invalid value. */
  private Boolean readBoolean(String section, String subsection, String key) {
    try {
      return cfg.getBoolean(section, subsection, key, false);
    } catch (IllegalArgumentException e) {
      messages.add(
          keyValueMessage(
              section, subsection, key, cfg.getString(section, subsection, key), e.getMessage()));
      return null;
    }
  }
}
