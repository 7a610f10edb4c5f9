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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.googlesource.licenses.lib.SpdxExpression.Compound;
import com.googlesource.licenses.lib.SpdxExpression.LicenseException;
import com.googlesource.licenses.lib.SpdxExpression.LicenseId;
import com.googlesource.licenses.lib.SpdxExpression.LicenseRef;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SpdxParserTest {

  private static final LicenseId MIT = new LicenseId("MIT");
  private static final LicenseId APACHE = new LicenseId("Apache-2.0");
  private static final LicenseId ZERO_BSD = new LicenseId("0BSD");
  private static final LicenseId ISC = new LicenseId("ISC");
  private static final LicenseId GPL2 = new LicenseId("GPL-2.0-only");
  private static final LicenseId PERL_ARTISTIC = new LicenseId("Artistic-1.0-Perl");
  private static final LicenseId GPL1_PLUS = new LicenseId("GPL-1.0-or-later");
  private static final LicenseException CLASSPATH = new LicenseException("Classpath-exception-2.0");

  private final SpdxParser parser = new SpdxParser(LicenseRegistry.defaultRegistry());

  private static Compound or(SpdxExpression left, SpdxExpression right) {
    return new Compound(left, SpdxOperator.OR, right);
  }

  private static Compound and(SpdxExpression left, SpdxExpression right) {
    return new Compound(left, SpdxOperator.AND, right);
  }

  private static Compound with(SpdxExpression left, LicenseException right) {
    return new Compound(left, SpdxOperator.WITH, right);
  }

  private SpdxException.SyntaxException syntaxError(String expression) {
    return assertThrows(SpdxException.SyntaxException.class, () -> parser.parse(expression));
  }

  @Test
  public void testParse_caseInsensitive() {
    assertThat(parser.parse("mit")).isEqualTo(MIT);
    assertThat(parser.parse("MIT")).isEqualTo(MIT);
    assertThat(parser.parse("Mit")).isEqualTo(MIT);
    assertThat(parser.parse("apache-2.0")).isEqualTo(APACHE);
  }

  @Test
  public void testParse_surroundingWhitespace() {
    assertThat(parser.parse("  MIT\t")).isEqualTo(MIT);
  }

  @Test
  public void testParse_andBindsTighterThanOr() {
    assertThat(parser.parse("MIT OR Apache-2.0 AND 0BSD"))
        .isEqualTo(or(MIT, and(APACHE, ZERO_BSD)));
    assertThat(parser.parse("MIT AND Apache-2.0 OR 0BSD"))
        .isEqualTo(or(and(MIT, APACHE), ZERO_BSD));
  }

  @Test
  public void testParse_withBindsTightest() {
    assertThat(parser.parse("GPL-2.0-only WITH Classpath-exception-2.0 AND MIT"))
        .isEqualTo(and(with(GPL2, CLASSPATH), MIT));
    assertThat(parser.parse("MIT OR GPL-2.0-only WITH Classpath-exception-2.0"))
        .isEqualTo(or(MIT, with(GPL2, CLASSPATH)));
  }

  @Test
  public void testParse_lowerCaseOperators() {
    assertThat(parser.parse("mit or apache-2.0 and 0bsd"))
        .isEqualTo(or(MIT, and(APACHE, ZERO_BSD)));
  }

  @Test
  public void testParse_foldsLeft() {
    assertThat(parser.parse("MIT OR ISC OR 0BSD")).isEqualTo(or(or(MIT, ISC), ZERO_BSD));
    assertThat(parser.parse("MIT AND ISC AND 0BSD")).isEqualTo(and(and(MIT, ISC), ZERO_BSD));
  }

  @Test
  public void testParse_parenthesesGroup() {
    assertThat(parser.parse("(MIT OR Apache-2.0) AND 0BSD"))
        .isEqualTo(and(or(MIT, APACHE), ZERO_BSD));
    assertThat(parser.parse("MIT AND (ISC OR 0BSD)")).isEqualTo(and(MIT, or(ISC, ZERO_BSD)));
    assertThat(parser.parse("((MIT))")).isEqualTo(MIT);
  }

  @Test
  public void testParse_rightGroupOfSameOperatorFoldsLeft() {
    assertThat(parser.parse("MIT OR (ISC OR 0BSD)")).isEqualTo(or(or(MIT, ISC), ZERO_BSD));
    assertThat(parser.parse("MIT AND (ISC AND 0BSD)")).isEqualTo(and(and(MIT, ISC), ZERO_BSD));
    assertThat(parser.parse("MIT OR (ISC AND 0BSD)")).isEqualTo(or(MIT, and(ISC, ZERO_BSD)));
  }

  @Test
  public void testParse_parenthesizedLicenseWithException() {
    assertThat(parser.parse("(MIT OR GPL-2.0-only) WITH Classpath-exception-2.0"))
        .isEqualTo(with(or(MIT, GPL2), CLASSPATH));
  }

  @Test
  public void testParse_orLater() {
    assertThat(parser.parse("GPL-2.0-only+")).isEqualTo(new LicenseId("GPL-2.0-only", true));
    assertThat(parser.parse("Apache-2.0 +")).isEqualTo(new LicenseId("Apache-2.0", true));
    assertThat(parser.parse("GPL-2.0-only+ WITH Classpath-exception-2.0"))
        .isEqualTo(with(new LicenseId("GPL-2.0-only", true), CLASSPATH));
  }

  @Test
  public void testParse_alias() {
    assertThat(parser.parse("GPLv2")).isEqualTo(GPL2);
    assertThat(parser.parse("asl-2.0")).isEqualTo(APACHE);
    assertThat(parser.parse("Expat AND CC0")).isEqualTo(and(MIT, new LicenseId("CC0-1.0")));
  }

  @Test
  public void testParse_deprecatedIdStaysListed() {
    assertThat(parser.parse("gpl-2.0")).isEqualTo(new LicenseId("GPL-2.0"));
  }

  @Test
  public void testParse_compoundAliasExpandsToOrChain() {
    assertThat(parser.parse("Perl-5")).isEqualTo(or(PERL_ARTISTIC, GPL1_PLUS));
    assertThat(parser.parse("MPL-1.1-GPL-2.0-LGPL-2.1"))
        .isEqualTo(
            or(
                or(new LicenseId("MPL-1.1"), new LicenseId("GPL-2.0-or-later")),
                new LicenseId("LGPL-2.1-or-later")));
  }

  @Test
  public void testParse_compoundAliasOrLaterMarksEveryMember() {
    assertThat(parser.parse("perl-5+"))
        .isEqualTo(
            or(new LicenseId("Artistic-1.0-Perl", true), new LicenseId("GPL-1.0-or-later", true)));
  }

  @Test
  public void testParse_compoundAliasAsOperand() {
    assertThat(parser.parse("Perl-5 AND MIT")).isEqualTo(and(or(PERL_ARTISTIC, GPL1_PLUS), MIT));
    assertThat(parser.parse("MIT OR Perl-5")).isEqualTo(or(or(MIT, PERL_ARTISTIC), GPL1_PLUS));
  }

  @Test
  public void testParse_unknownIdBecomesLicenseRef() {
    assertThat(parser.parse("Foo-Bar-1.0")).isEqualTo(new LicenseRef("LicenseRef-foo-bar-1.0"));
    assertThat(parser.parse("MIT AND Acme"))
        .isEqualTo(and(MIT, new LicenseRef("LicenseRef-acme")));
  }

  @Test
  public void testParse_licenseRefKeepsSuffix() {
    assertThat(parser.parse("LicenseRef-Acme.1")).isEqualTo(new LicenseRef("LicenseRef-Acme.1"));
    assertThat(parser.parse("licenseref-Acme.1")).isEqualTo(new LicenseRef("LicenseRef-Acme.1"));
  }

  @Test
  public void testParse_licenseRefNamingListedLicenseStaysRef() {
    assertThat(parser.parse("LicenseRef-MIT")).isEqualTo(new LicenseRef("LicenseRef-MIT"));
  }

  @Test
  public void testParse_sentinels() {
    assertThat(parser.parse("NONE")).isEqualTo(new LicenseId(LicenseRegistry.NONE));
    assertThat(parser.parse("noassertion")).isEqualTo(new LicenseId(LicenseRegistry.NOASSERTION));
    assertThat(parser.parse("MIT OR NONE")).isEqualTo(or(MIT, new LicenseId("NONE")));
  }

  @Test
  public void testParse_exceptionNormalized() {
    assertThat(parser.parse("GPL-2.0-only with classpath-exception-2.0"))
        .isEqualTo(with(GPL2, CLASSPATH));
    assertThat(parser.parse("GPL-2.0-only WITH cpe")).isEqualTo(with(GPL2, CLASSPATH));
  }

  @Test
  public void testParse_unknownExceptionKeptVerbatim() {
    assertThat(parser.parse("GPL-2.0-only WITH Acme-exception"))
        .isEqualTo(with(GPL2, new LicenseException("Acme-exception")));
  }

  @Test
  public void testParse_customRegistry() {
    LicenseRegistry registry =
        LicenseRegistry.builder()
            .addLicense(new LicenseRegistry.ListedLicense("Foo-1.0", "Foo License", false, true))
            .addAlias("foo", ImmutableList.of("Foo-1.0"))
            .build();
    SpdxParser custom = new SpdxParser(registry);

    assertThat(custom.parse("FOO+")).isEqualTo(new LicenseId("Foo-1.0", true));
    assertThat(custom.parse("MIT")).isEqualTo(new LicenseRef("LicenseRef-mit"));
  }

  @Test
  public void testParse_empty() {
    SpdxException e = syntaxError("");

    assertThat(e.offset).isEqualTo(0);
    assertThat(e).hasMessageThat().isEqualTo("Empty license expression");
  }

  @Test
  public void testParse_blank() {
    SpdxException e = syntaxError("   ");

    assertThat(e.offset).isEqualTo(0);
    assertThat(e.length).isEqualTo(0);
  }

  @Test
  public void testParse_danglingOperator() {
    SpdxException e = syntaxError("MIT AND");

    assertThat(e.offset).isEqualTo(7);
    assertThat(e.length).isEqualTo(0);
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("Expected license identifier or '(' but found end of expression at offset 7");
  }

  @Test
  public void testParse_unterminatedParenthesisAfterOperator() {
    SpdxException e = syntaxError("(MIT OR");

    assertThat(e.offset).isEqualTo(7);
  }

  @Test
  public void testParse_unterminatedParenthesis() {
    SpdxException e = syntaxError("(MIT");

    assertThat(e.offset).isEqualTo(4);
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("Expected ')' closing '(' at offset 0 but found end of expression at offset 4");
  }

  @Test
  public void testParse_unbalancedClosingParenthesis() {
    SpdxException e = syntaxError("MIT)");

    assertThat(e.offset).isEqualTo(3);
    assertThat(e.length).isEqualTo(1);
    assertThat(e).hasMessageThat().isEqualTo("Unbalanced ')' at offset 3");
  }

  @Test
  public void testParse_missingOperator() {
    SpdxException e = syntaxError("MIT Apache-2.0");

    assertThat(e.offset).isEqualTo(4);
    assertThat(e.length).isEqualTo(10);
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("Unexpected 'Apache-2.0' at offset 4, expected AND, OR or end of expression");
  }

  @Test
  public void testParse_leadingOperator() {
    SpdxException e = syntaxError("AND MIT");

    assertThat(e.offset).isEqualTo(0);
    assertThat(e.length).isEqualTo(3);
  }

  @Test
  public void testParse_emptyParentheses() {
    assertThat(syntaxError("()").offset).isEqualTo(1);
  }

  @Test
  public void testParse_withMissingException() {
    SpdxException e = syntaxError("MIT WITH");

    assertThat(e.offset).isEqualTo(8);
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            "Expected license exception after WITH but found end of expression at offset 8");
  }

  @Test
  public void testParse_withParenthesizedException() {
    assertThat(syntaxError("MIT WITH (CPE)").offset).isEqualTo(9);
  }

  @Test
  public void testParse_secondWith() {
    assertThat(syntaxError("MIT WITH CPE WITH LLVM-exception").offset).isEqualTo(13);
    assertThat(syntaxError("(MIT WITH CPE) WITH LLVM-exception").offset).isEqualTo(15);
  }

  @Test
  public void testParse_doublePlus() {
    assertThat(syntaxError("MIT++").offset).isEqualTo(4);
  }

  @Test
  public void testParse_plusAfterUnknownIdFoldsIntoRef() {
    SpdxExpression e = parser.parse("Foo-Bar-1.0+");

    assertThat(e).isEqualTo(new LicenseRef("LicenseRef-foo-bar-1.0-or-later"));
    assertThat(parser.parse(e.toString())).isEqualTo(e);
  }

  @Test
  public void testParse_plusAfterLicenseRef() {
    assertThat(parser.parse("LicenseRef-Acme+ OR MIT"))
        .isEqualTo(or(new LicenseRef("LicenseRef-Acme-or-later"), MIT));
  }

  @Test
  public void testParse_plusAfterSentinel() {
    assertThat(syntaxError("NONE+").offset).isEqualTo(4);
  }

  @Test
  public void testParse_lexErrorSurfacesAsSpdxException() {
    SpdxException e = assertThrows(SpdxException.class, () -> parser.parse("MIT & ISC"));

    assertThat(e).isInstanceOf(SpdxException.LexException.class);
    assertThat(e.offset).isEqualTo(4);
  }

  @Test
  public void testParse_deepestAllowedNesting() {
    String text = nested(SpdxParser.MAX_DEPTH, "MIT");

    assertThat(parser.parse(text)).isEqualTo(MIT);
  }

  @Test
  public void testParse_nestingTooDeep() {
    SpdxException e = syntaxError(nested(SpdxParser.MAX_DEPTH + 1, "MIT"));

    assertThat(e.offset).isEqualTo(SpdxParser.MAX_DEPTH);
    assertThat(e.length).isEqualTo(1);
    assertThat(e).hasMessageThat().contains("nested deeper than " + SpdxParser.MAX_DEPTH);
  }

  @Test
  public void testParse_nestingFarTooDeep() {
    assertThat(syntaxError(nested(3000, "MIT")).offset).isEqualTo(SpdxParser.MAX_DEPTH);
  }

  @Test
  public void testParse_deepRightGroupsFoldLeft() {
    ImmutableList.Builder<SpdxExpression> terms = ImmutableList.builder();
    StringBuilder text = new StringBuilder();
    int n = 200;
    for (int i = 0; i < n; i++) {
      terms.add(new LicenseRef("LicenseRef-ref" + i));
      text.append("Ref").append(i).append(i < n - 1 ? " OR (" : "");
    }
    text.append(Strings.repeat(")", n - 1));

    SpdxExpression e = parser.parse(text.toString());

    assertThat(e).isEqualTo(SpdxExpression.or(terms.build()));
    assertThat(e.toString()).doesNotContain("(");
  }

  @Test
  public void testParse_longChain() {
    String text = Strings.repeat("MIT OR ISC OR ", 2500) + "0BSD";

    SpdxExpression e = parser.parse(text);

    assertThat(e.toString()).isEqualTo(text);
    assertThat(parser.parse(e.toString())).isEqualTo(e);
    assertThat(e.licenses()).hasSize(5001);
  }

  private static String nested(int depth, String inner) {
    return Strings.repeat("(", depth) + inner + Strings.repeat(")", depth);
  }
}
