// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import phylox.dom.Element;
import phylox.model.FeatureTable;
import org.assertj.core.api.Assertions;

/**
 * Test fixtures and lookups on assembled documents.
 */
final class Documents {
    private Documents() {
    }

    static FeatureTable features() {
        return FeatureTable.read(featuresPath);
    }

    /**
     * Returns the single element defining the given identifier.
     */
    static Element byId(final Element root, final String id) {
        final var found = new ArrayList<Element>();
        root.traverse(node -> {
            if (node instanceof Element element && id.equals(element.id())) {
                found.add(element);
            }
        });
        Assertions.assertThat(found).as("elements with id '%s'", id).hasSize(1);
        return found.get(0);
    }

    /**
     * Returns all elements with the given name, in document order.
     */
    static List<Element> named(final Element root, final String name) {
        final var found = new ArrayList<Element>();
        root.traverse(node -> {
            if (node instanceof Element element && element.name().equals(name)) {
                found.add(element);
            }
        });
        return found;
    }

    /**
     * Returns the names of the child elements of the given element, in order.
     */
    static List<String> childNames(final Element element) {
        final var names = new ArrayList<String>();
        for (final var child : element.children()) {
            if (child instanceof Element childElement) {
                names.add(childElement.name());
            }
        }
        return names;
    }

    static final Path featuresPath = Path.of("src/test/resources/features.csv");
}
