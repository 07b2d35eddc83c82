// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.test;

import java.util.ArrayList;
import java.util.List;
import phylox.dom.Attribute;
import phylox.dom.Attributes;
import phylox.dom.Comment;
import phylox.dom.Element;
import phylox.dom.Node;
import phylox.dom.Plate;
import phylox.dom.Tag;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class ElementTest {
    @Test
    void attributesKeepInsertionOrder() {
        final var element = Element.of("distribution", Attributes.builder()
            .id("posterior")
            .set("spec", "util.CompoundDistribution")
            .ref("tree", "Tree.t:tree")
            .set("weight", 3.0)
            .build());
        Assertions.assertThat(names(element)).containsExactly("id", "spec", "tree", "weight");
        Assertions.assertThat(element.attributes().getEncoded("tree")).isEqualTo("@Tree.t:tree");
        Assertions.assertThat(element.attributes().getEncoded("weight")).isEqualTo("3.0");
        Assertions.assertThat(element.id()).isEqualTo("posterior");
    }

    @Test
    void setReplacesInPlace() {
        final var element = Element.of("x", Attributes.builder().set("a", "1").set("b", "2").build());
        element.set(Attribute.of("a", "3")).set(Attribute.of("c", true));
        Assertions.assertThat(names(element)).containsExactly("a", "b", "c");
        Assertions.assertThat(element.attributes().getEncoded("a")).isEqualTo("3");
        Assertions.assertThat(element.attributes().getEncoded("c")).isEqualTo("true");
    }

    @Test
    void elementsDoNotShareAttributes() {
        final var attributes = Attributes.builder().set("a", "1").build();
        final var first = Element.of("x", attributes);
        final var second = Element.of("x", attributes);
        first.set(Attribute.of("a", "2"));
        Assertions.assertThat(second.attributes().getEncoded("a")).isEqualTo("1");
        Assertions.assertThat(attributes.getEncoded("a")).isEqualTo("1");
    }

    @Test
    void builderRejectsDuplicateNames() {
        final var builder = Attributes.builder().set("spec", "A");
        Assertions.assertThatIllegalArgumentException().isThrownBy(() -> builder.set("spec", "B"));
    }

    @Test
    void childrenKeepInsertionOrder() {
        final var root = Element.of("root", Attributes.empty());
        final var first = root.appendElement("a", Attributes.empty());
        final var comment = root.appendComment("note");
        final var last = root.appendElement("b", Attributes.empty());
        Assertions.assertThat(root.children()).containsExactly(first, comment, last);
        Assertions.assertThat(first.parent()).isSameAs(root);
        Assertions.assertThat(comment.parent()).isSameAs(root);
        Assertions.assertThat(root.parent()).isNull();
    }

    @Test
    void attachingTwiceFails() {
        final var first = Element.of("first", Attributes.empty());
        final var second = Element.of("second", Attributes.empty());
        final var child = first.appendElement("child", Attributes.empty());
        Assertions.assertThatIllegalStateException().isThrownBy(() -> second.append(child));
        Assertions.assertThat(second.children()).isEmpty();
        Assertions.assertThat(child.parent()).isSameAs(first);
    }

    @Test
    void cyclesAreRejected() {
        final var root = Element.of("root", Attributes.empty());
        final var child = root.appendElement("child", Attributes.empty());
        Assertions.assertThatIllegalArgumentException().isThrownBy(() -> child.append(root));
        Assertions.assertThatIllegalArgumentException().isThrownBy(() -> root.append(root));
    }

    @Test
    void whitespaceOnlyTextExcludesChildren() {
        final var parent = Element.of("parent", Attributes.empty());
        parent.appendElement("child", Attributes.empty());
        Assertions.assertThatIllegalArgumentException().isThrownBy(() -> parent.setText(" \n "));
        parent.setText("value");
        Assertions.assertThat(parent.text()).isEqualTo("value");
        parent.setText("");
        Assertions.assertThat(parent.text()).isNull();

        final var leaf = Element.of("leaf", Attributes.empty()).setText("  ");
        Assertions.assertThat(leaf.text()).isEqualTo("  ");
        Assertions.assertThatIllegalArgumentException()
            .isThrownBy(() -> leaf.appendElement("child", Attributes.empty()));
        Assertions.assertThat(leaf.children()).isEmpty();
    }

    @Test
    void traversalIsPreOrder() {
        final var root = Element.of("a", Attributes.empty());
        final var b = root.appendElement("b", Attributes.empty());
        b.appendElement("c", Attributes.empty());
        b.appendComment("d");
        root.appendElement("e", Attributes.empty());
        final var visited = new ArrayList<String>();
        root.traverse(node -> visited.add(label(node)));
        Assertions.assertThat(visited).containsExactly("a", "b", "c", "!d", "e");
    }

    @Test
    void requiredAttributesAreChecked() {
        Assertions.assertThatIllegalArgumentException()
            .isThrownBy(() -> Element.of(Tag.OPERATOR, Attributes.builder().id("op").build()))
            .withMessageContaining("spec");
        final var operator = Element.of(Tag.OPERATOR, Attributes.builder().id("op").set("spec", "Exchange").build());
        Assertions.assertThat(operator.name()).isEqualTo("operator");
    }

    @Test
    void platesRecordThemselvesOnChildren() {
        final var root = Element.of("root", Attributes.empty());
        final var plate = root.append(Plate.of("language", List.of("eng", "fra")));
        final var taxon = plate.appendElement(Tag.TAXON, Attributes.builder().id(plate.placeholder()).build());
        final var grandchild = taxon.appendElement("x", Attributes.empty());
        Assertions.assertThat(taxon.enclosingPlate()).isSameAs(plate);
        Assertions.assertThat(grandchild.enclosingPlate()).isNull();
        Assertions.assertThat(plate.enclosingPlate()).isNull();
        Assertions.assertThat(plate.attributes().getEncoded("range")).isEqualTo("eng,fra");
        Assertions.assertThat(plate.expand("taxon:$(language)")).containsExactly("taxon:eng", "taxon:fra");
    }

    @Test
    void plateVariableAndRangeAreFixed() {
        final var plate = Plate.of("v", List.of("a"));
        Assertions.assertThatIllegalArgumentException().isThrownBy(() -> plate.set(Attribute.of("range", "b")));
        Assertions.assertThatIllegalArgumentException()
            .isThrownBy(() -> Element.of("plate", Attributes.empty()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "a,b", ","})
    void invalidPlateValuesAreRejected(final String value) {
        Assertions.assertThatIllegalArgumentException().isThrownBy(() -> Plate.of("v", List.of("ok", value)));
    }

    @Test
    void emptyPlatesAreRejected() {
        Assertions.assertThatIllegalArgumentException().isThrownBy(() -> Plate.of("v", List.of()));
        Assertions.assertThatIllegalArgumentException().isThrownBy(() -> Plate.of("", List.of("a")));
    }

    @Test
    void attributesDecodeByForm() {
        Assertions.assertThat(Attribute.decode("id", "x")).isInstanceOf(Attribute.Identifier.class);
        final var idref = Attribute.decode("idref", "x");
        Assertions.assertThat(idref).isInstanceOfSatisfying(Attribute.Reference.class, reference -> {
            Assertions.assertThat(reference.form()).isEqualTo(Attribute.Reference.Form.IDREF);
            Assertions.assertThat(reference.target()).isEqualTo("x");
        });
        final var sigil = Attribute.decode("tree", "@Tree");
        Assertions.assertThat(sigil).isInstanceOfSatisfying(Attribute.Reference.class, reference -> {
            Assertions.assertThat(reference.form()).isEqualTo(Attribute.Reference.Form.SIGIL);
            Assertions.assertThat(reference.target()).isEqualTo("Tree");
        });
        Assertions.assertThat(sigil.encodedValue()).isEqualTo("@Tree");
        Assertions.assertThat(Attribute.decode("name", "@")).isInstanceOf(Attribute.Literal.class);
    }

    @Test
    void literalsCannotLookLikeReferences() {
        Assertions.assertThatIllegalArgumentException().isThrownBy(() -> Attribute.of("tree", "@Tree"));
        Assertions.assertThatIllegalArgumentException().isThrownBy(() -> Attribute.of("id", "x"));
        Assertions.assertThatIllegalArgumentException().isThrownBy(() -> Attribute.ref("id", "x"));
    }

    @Test
    void commentsMustBeRepresentable() {
        Assertions.assertThatIllegalArgumentException().isThrownBy(() -> new Comment("a -- b"));
        Assertions.assertThatIllegalArgumentException().isThrownBy(() -> new Comment("trailing-"));
        Assertions.assertThat(new Comment("fine - really").text()).isEqualTo("fine - really");
    }

    private static List<String> names(final Element element) {
        final var names = new ArrayList<String>();
        for (final var attribute : element.attributes()) {
            names.add(attribute.name());
        }
        return names;
    }

    private static String label(final Node node) {
        return (node instanceof Element element) ? element.name() : "!" + ((Comment) node).text();
    }
}
