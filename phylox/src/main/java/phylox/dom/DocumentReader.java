// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.dom;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.List;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import phylox.util.Trace;
import phylox.util.condition.ConditionContext;
import phylox.util.condition.exception.IOExceptionCondition;
import phylox.util.condition.exception.XMLStreamExceptionCondition;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Reads serialized documents back into trees, for standalone re-verification and round trips.
 * <p>
 * Attribute order is preserved. Identifiers and references are decoded with {@link Attribute#decode(String, String)},
 * and {@code plate} elements become {@link Plate}s. Whitespace-only text in elements that have children is ignorable
 * and dropped; any other text in such elements must precede the first child, which is the only shape the
 * {@link Serializer} produces.
 */
public final class DocumentReader {
    private DocumentReader(final @NotNull XMLStreamReader stream) {
        this.stream = stream;
    }

    /**
     * Reads the document from the given file.
     * <p>
     * Signals a fatal {@link IOExceptionCondition} if the file cannot be read, and a fatal
     * {@link XMLStreamExceptionCondition} if it isn't a well-formed document this reader supports.
     */
    public static @NotNull Element read(final @NotNull Path path) {
        try (
            final var trace = new Trace(() -> "Reading document from " + path);
            final var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)
        ) {
            trace.use();
            return read(reader);
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
    }

    /**
     * Reads the document from the given string.
     */
    public static @NotNull Element read(final @NotNull String document) {
        return read(new StringReader(document));
    }

    /**
     * Reads the document from the given character stream, which is not closed.
     * <p>
     * Signals a fatal {@link XMLStreamExceptionCondition} if the input isn't a well-formed document this reader
     * supports.
     */
    public static @NotNull Element read(final @NotNull Reader reader) {
        try {
            final var stream = inputFactory().createXMLStreamReader(reader);
            try {
                return new DocumentReader(stream).readDocument();
            } finally {
                stream.close();
            }
        } catch (final XMLStreamException e) {
            throw ConditionContext.error(new XMLStreamExceptionCondition(e));
        }
    }

    private @NotNull Element readDocument() throws XMLStreamException {
        while (stream.hasNext()) {
            switch (stream.next()) {
                case XMLStreamConstants.START_ELEMENT -> startElement();
                case XMLStreamConstants.END_ELEMENT -> endElement();
                case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA, XMLStreamConstants.SPACE -> characters();
                case XMLStreamConstants.COMMENT -> comment();
                default -> {
                    // Declarations and processing instructions carry nothing the tree represents.
                }
            }
        }
        if (root == null) {
            throw new XMLStreamException("Document has no root element", stream.getLocation());
        }
        return root;
    }

    private void startElement() throws XMLStreamException {
        final var name = stream.getLocalName();
        final var element = Tag.PLATE.xmlName().equals(name) ? createPlate() : createElement(name);
        final var parent = frames.peek();
        if (parent != null) {
            parent.beginChild();
            parent.element.append(element);
        } else if (root == null) {
            root = element;
        } else {
            throw new XMLStreamException("Multiple root elements", stream.getLocation());
        }
        frames.push(new Frame(element));
    }

    private @NotNull Element createElement(final @NotNull String name) throws XMLStreamException {
        final var builder = Attributes.builder();
        for (int i = 0; i < stream.getAttributeCount(); i += 1) {
            builder.add(decodeAttribute(attributeName(i), i));
        }
        return Element.of(name, builder.build());
    }

    private @NotNull Plate createPlate() throws XMLStreamException {
        final var variable = stream.getAttributeValue(null, Plate.VARIABLE);
        final var range = stream.getAttributeValue(null, Plate.RANGE);
        if (variable == null || range == null) {
            throw new XMLStreamException("Plate without 'var' and 'range' attributes", stream.getLocation());
        }
        final Plate plate;
        try {
            plate = Plate.of(variable, List.of(range.split(",", -1)));
        } catch (final IllegalArgumentException e) {
            throw new XMLStreamException("Invalid plate: " + e.getMessage(), stream.getLocation(), e);
        }
        for (int i = 0; i < stream.getAttributeCount(); i += 1) {
            final var name = attributeName(i);
            if (!Plate.VARIABLE.equals(name) && !Plate.RANGE.equals(name)) {
                plate.set(decodeAttribute(name, i));
            }
        }
        return plate;
    }

    private @NotNull Attribute decodeAttribute(final @NotNull String name, final int index)
            throws XMLStreamException {
        try {
            return Attribute.decode(name, stream.getAttributeValue(index));
        } catch (final IllegalArgumentException e) {
            throw new XMLStreamException(
                "Invalid attribute '" + name + "': " + e.getMessage(), stream.getLocation(), e);
        }
    }

    private @NotNull String attributeName(final int index) {
        final var prefix = stream.getAttributePrefix(index);
        final var localName = stream.getAttributeLocalName(index);
        return (prefix == null || prefix.isEmpty()) ? localName : prefix + ':' + localName;
    }

    private void endElement() {
        final var frame = frames.pop();
        frame.element.setText(frame.text());
    }

    private void characters() throws XMLStreamException {
        final var frame = frames.peek();
        if (frame != null) {
            frame.addText(stream);
        }
    }

    private void comment() {
        final var frame = frames.peek();
        // Comments outside the root element have no place in the tree.
        if (frame != null) {
            frame.beginChild();
            frame.element.appendComment(stream.getText());
        }
    }

    private static @NotNull XMLInputFactory inputFactory() {
        final var factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, false);
        return factory;
    }

    private final @NotNull XMLStreamReader stream;
    private final ArrayDeque<@NotNull Frame> frames = new ArrayDeque<>();
    private @Nullable Element root = null;

    private static final class Frame {
        private Frame(final @NotNull Element element) {
            this.element = element;
        }

        private void beginChild() {
            if (!hasChildren && text.toString().isBlank()) {
                text.setLength(0);
            }
            hasChildren = true;
        }

        private void addText(final @NotNull XMLStreamReader stream) throws XMLStreamException {
            final var characters = stream.getText();
            if (!hasChildren) {
                text.append(characters);
            } else if (!characters.isBlank()) {
                throw new XMLStreamException(
                    "Text following child elements of '" + element.name() + "' is not supported",
                    stream.getLocation()
                );
            }
        }

        private @Nullable String text() {
            return (text.length() == 0) ? null : text.toString();
        }

        private final @NotNull Element element;
        private final StringBuilder text = new StringBuilder();
        private boolean hasChildren = false;
    }
}
