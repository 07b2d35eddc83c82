// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.test;

import java.util.List;
import phylox.assembly.EmptyTaxonSetCondition;
import phylox.assembly.TaxonSetCache;
import phylox.assembly.TaxonSetRenamedCondition;
import phylox.dom.Attribute;
import phylox.dom.Attributes;
import phylox.dom.Element;
import phylox.dom.IntegrityVerifier;
import phylox.dom.Plate;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

final class TaxonSetCacheTest {
    @Test
    void identicalMembersAreReused() {
        final var root = Element.of("root", Attributes.empty());
        final var cache = new TaxonSetCache();
        cache.add(root, "taxa", List.of("a", "b", "c"), true);
        final var again = cache.add(root, "cladeA", List.of("c", "b", "a", "b"), false);

        Assertions.assertThat(again.get("idref")).isInstanceOfSatisfying(Attribute.Reference.class,
            reference -> Assertions.assertThat(reference.target()).isEqualTo("taxa"));
        Assertions.assertThat(again.children()).isEmpty();
        Assertions.assertThat(cache.size()).isEqualTo(1);
        Assertions.assertThat(cache.lookup(List.of("b", "a", "c"))).isEqualTo("taxa");
        Assertions.assertThat(cache.lookup(List.of("a", "b"))).isNull();

        final var report = IntegrityVerifier.inspect(root);
        Assertions.assertThat(report.isClean()).isTrue();
    }

    @Test
    void subsetsAreNotReused() {
        final var root = Element.of("root", Attributes.empty());
        final var cache = new TaxonSetCache();
        cache.add(root, "taxa", List.of("a", "b", "c"), true);
        final var subset = cache.add(root, "ab", List.of("a", "b"), false);
        Assertions.assertThat(subset.id()).isEqualTo("ab");
        Assertions.assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void smallSetsListMembersInOrder() {
        final var root = Element.of("root", Attributes.empty());
        final var taxonSet = new TaxonSetCache().add(root, "three", List.of("c", "a", "b"), true);
        Assertions.assertThat(taxonSet.attributes().getEncoded("spec")).isEqualTo("TaxonSet");
        Assertions.assertThat(taxonSet.childElements("taxon"))
            .extracting(Element::id)
            .containsExactly("a", "b", "c");
        Assertions.assertThat(taxonSet.childElements("plate")).isEmpty();
    }

    @Test
    void largeSetsUsePlates() {
        final var root = Element.of("root", Attributes.empty());
        final var taxonSet = new TaxonSetCache().add(root, "four", List.of("spa", "eng", "fra", "deu"), false);
        Assertions.assertThat(taxonSet.children()).singleElement().isInstanceOfSatisfying(Plate.class, plate -> {
            Assertions.assertThat(plate.variable()).isEqualTo("language");
            Assertions.assertThat(plate.range()).containsExactly("deu", "eng", "fra", "spa");
            Assertions.assertThat(plate.children()).singleElement().isInstanceOfSatisfying(Element.class, taxon -> {
                Assertions.assertThat(taxon.name()).isEqualTo("taxon");
                Assertions.assertThat(taxon.attributes().getEncoded("idref")).isEqualTo("$(language)");
            });
        });
    }

    @Test
    void singleMemberNamedLikeItsLabelIsRenamed() {
        final var root = Element.of("root", Attributes.empty());
        final var cache = new TaxonSetCache();
        final var notices = ConditionCapture.notices(() -> cache.add(root, "eng", List.of("eng"), false));
        final var taxonSet = root.childElements("taxonset").get(0);
        Assertions.assertThat(taxonSet.id()).isEqualTo("tx_eng");
        Assertions.assertThat(cache.lookup(List.of("eng"))).isEqualTo("tx_eng");
        Assertions.assertThat(notices).singleElement().isInstanceOfSatisfying(TaxonSetRenamedCondition.class,
            renamed -> {
                Assertions.assertThat(renamed.requestedLabel()).isEqualTo("eng");
                Assertions.assertThat(renamed.actualLabel()).isEqualTo("tx_eng");
            });
    }

    @Test
    void singleMemberWithOtherLabelIsNotRenamed() {
        final var root = Element.of("root", Attributes.empty());
        final var notices = ConditionCapture.notices(
            () -> new TaxonSetCache().add(root, "English", List.of("eng"), false));
        Assertions.assertThat(root.childElements("taxonset").get(0).id()).isEqualTo("English");
        Assertions.assertThat(notices).isEmpty();
    }

    @Test
    void emptySetsAreRejectedBeforeAnythingIsCreated() {
        final var root = Element.of("root", Attributes.empty());
        final var cache = new TaxonSetCache();
        final var condition = ConditionCapture.expectFatal(EmptyTaxonSetCondition.class,
            () -> cache.add(root, "nothing", List.of(), false));
        Assertions.assertThat(condition.label()).isEqualTo("nothing");
        Assertions.assertThat(root.children()).isEmpty();
        Assertions.assertThat(cache.size()).isZero();
    }
}
