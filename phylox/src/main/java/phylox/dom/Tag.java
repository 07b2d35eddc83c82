// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.dom;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Elements the document skeleton is made of, with the attributes each of them requires.
 * <p>
 * This is intentionally incomplete: contributors add elements of their own, by name, whose structure is none of the
 * engine's business.
 */
public enum Tag {
    BEAST(List.of("version", "namespace")),
    MAP(List.of("name")),
    RUN(List.of("id", "spec")),
    /**
     * The inner chain of a path sampling run.
     */
    MCMC(List.of("id", "spec")),
    STATE(List.of("id")),
    INIT(List.of("spec")),
    DISTRIBUTION(List.of("spec")),
    OPERATOR(List.of("id", "spec")),
    LOGGER(List.of("id", "logEvery")),
    LOG(List.of()),
    TAXONSET(List.of()),
    TAXON(List.of()),
    PLATE(List.of("var", "range")),
    PARAMETER(List.of()),
    TREE(List.of("id"));

    Tag(final List<String> requiredAttributes) {
        xmlName = name().toLowerCase(Locale.ROOT);
        this.requiredAttributes = requiredAttributes;
    }

    /**
     * Retrieves the tag with the given XML name, or {@code null} if one doesn't exist.
     */
    public static @Nullable Tag byXmlName(final String xmlName) {
        return tagsByXmlName.get(xmlName);
    }

    /**
     * Retrieves the XML name of the tag.
     */
    public String xmlName() {
        return xmlName;
    }

    /**
     * Retrieves the names of the attributes every element of this kind must carry.
     */
    public List<String> requiredAttributes() {
        return requiredAttributes;
    }

    void checkRequiredAttributes(final Attributes attributes) {
        final var missing = requiredAttributes.stream().filter(name -> !attributes.contains(name)).toList();
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException(
                "Element '" + xmlName + "' is missing required attributes " + missing + ", got " + attributes);
        }
    }

    private static final Map<String, Tag> tagsByXmlName =
        Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(Tag::xmlName, Function.identity()));

    private final String xmlName;
    private final List<String> requiredAttributes;
}
