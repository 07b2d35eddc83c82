// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.test;

import java.util.List;
import java.util.Map;
import phylox.dom.Attributes;
import phylox.dom.Element;
import phylox.dom.IntegrityErrorCondition;
import phylox.dom.IntegrityVerifier;
import phylox.dom.Plate;
import phylox.dom.Tag;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

final class IntegrityVerifierTest {
    @Test
    void consistentDocumentPasses() {
        final var root = Element.of("beast", Attributes.empty());
        root.appendElement("tree", Attributes.builder().id("tree").build());
        root.appendElement("distribution", Attributes.builder().id("yule").ref("tree", "tree").build());
        root.appendElement("log", Attributes.builder().idref("yule").build());

        Assertions.assertThat(IntegrityVerifier.inspect(root).isClean()).isTrue();
        Assertions.assertThat(ConditionCapture.notices(() -> IntegrityVerifier.verify(root))).isEmpty();
    }

    @Test
    void duplicatesAreCounted() {
        final var root = Element.of("beast", Attributes.empty());
        for (int i = 0; i < 3; i += 1) {
            root.appendElement("parameter", Attributes.builder().id("rate").build());
        }
        root.appendElement("parameter", Attributes.builder().id("other").build());

        final var report = IntegrityVerifier.inspect(root);
        Assertions.assertThat(report.duplicateIdentifiers()).containsExactlyEntriesOf(Map.of("rate", 3));
        Assertions.assertThat(report.danglingReferences()).isEmpty();
    }

    @Test
    void danglingReferencesOfBothFormsAreFound() {
        final var root = Element.of("beast", Attributes.empty());
        root.appendElement("log", Attributes.builder().idref("missingIdref").build());
        root.appendElement("distribution", Attributes.builder().ref("x", "missingSigil").build());

        final var report = IntegrityVerifier.inspect(root);
        Assertions.assertThat(report.danglingReferences()).containsExactly("missingIdref", "missingSigil");
        Assertions.assertThat(report.duplicateIdentifiers()).isEmpty();
    }

    @Test
    void allDefectsAreReportedAtOnce() {
        final var root = Element.of("beast", Attributes.empty());
        root.appendElement("a", Attributes.builder().id("dup").build());
        root.appendElement("b", Attributes.builder().id("dup").build());
        root.appendElement("c", Attributes.builder().idref("zeta").build());
        root.appendElement("d", Attributes.builder().ref("x", "alpha").build());

        final var condition = ConditionCapture.expectFatal(IntegrityErrorCondition.class,
            () -> IntegrityVerifier.verify(root));
        Assertions.assertThat(condition.report().duplicateIdentifiers()).containsOnlyKeys("dup");
        Assertions.assertThat(condition.report().danglingReferences()).containsExactly("alpha", "zeta");
        Assertions.assertThat(condition.detailedMessage())
            .contains("Duplicate identifiers found:")
            .contains("'dup', defined 2 times")
            .contains("References to missing identifiers found:")
            .contains("'alpha'")
            .contains("'zeta'");
    }

    @Test
    void plateIdentifiersExpandPerRangeValue() {
        final var root = Element.of("beast", Attributes.empty());
        final var plate = root.append(Plate.of("v", List.of("a", "b")));
        plate.appendElement(Tag.PARAMETER, Attributes.builder().id("pfx_$(v)").build());
        root.appendElement("log", Attributes.builder().idref("pfx_a").build());
        root.appendElement("log", Attributes.builder().ref("x", "pfx_b").build());

        Assertions.assertThat(IntegrityVerifier.inspect(root).isClean()).isTrue();

        root.appendElement("log", Attributes.builder().idref("pfx_c").build());
        Assertions.assertThat(IntegrityVerifier.inspect(root).danglingReferences()).containsExactly("pfx_c");
    }

    @Test
    void plateIdrefsExpandPerRangeValue() {
        final var root = Element.of("beast", Attributes.empty());
        root.appendElement("taxon", Attributes.builder().id("eng").build());
        final var plate = root.append(Plate.of("language", List.of("eng", "fra")));
        plate.appendElement(Tag.TAXON, Attributes.builder().idref(plate.placeholder()).build());

        Assertions.assertThat(IntegrityVerifier.inspect(root).danglingReferences()).containsExactly("fra");
    }

    @Test
    void sigilReferencesInsidePlatesAreNotExpanded() {
        final var root = Element.of("beast", Attributes.empty());
        root.appendElement("x", Attributes.builder().id("a").build());
        final var plate = root.append(Plate.of("v", List.of("a")));
        plate.appendElement("log", Attributes.builder().ref("arg", "$(v)").build());

        Assertions.assertThat(IntegrityVerifier.inspect(root).danglingReferences()).containsExactly("$(v)");
    }

    @Test
    void plateExpansionIsShallow() {
        final var root = Element.of("beast", Attributes.empty());
        final var plate = root.append(Plate.of("v", List.of("a", "b")));
        final var child = plate.appendElement("wrapper", Attributes.builder().id("w_$(v)").build());
        child.appendElement("inner", Attributes.builder().id("inner_$(v)").build());

        final var report = IntegrityVerifier.inspect(root);
        Assertions.assertThat(report.isClean()).isTrue();
        root.appendElement("log", Attributes.builder().idref("inner_a").build());
        Assertions.assertThat(IntegrityVerifier.inspect(root).danglingReferences()).containsExactly("inner_a");
    }

    @Test
    void plateIdentifiersWithoutPlaceholderAreDuplicated() {
        final var root = Element.of("beast", Attributes.empty());
        final var plate = root.append(Plate.of("v", List.of("a", "b", "c")));
        plate.appendElement("x", Attributes.builder().id("constant").build());

        Assertions.assertThat(IntegrityVerifier.inspect(root).duplicateIdentifiers())
            .containsExactlyEntriesOf(Map.of("constant", 3));
    }
}
