// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.dom;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import phylox.util.Trace;
import phylox.util.condition.ConditionContext;
import phylox.util.condition.exception.IOExceptionCondition;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The tree-to-XML serializer.
 * <p>
 * Output is indented by two spaces per level. The only thing the indentation adds is whitespace between elements:
 * attribute values, inline text and comments are written exactly as they are, apart from escaping. Inline text is
 * followed by the first child with no whitespace in between, so that reading the document back yields the same
 * text.
 */
public final class Serializer {
    private Serializer(final @NotNull Writer writer) {
        this.writer = writer;
    }

    /**
     * Serializes the tree rooted at {@code root}, preceded by the XML declaration, to the given {@link Writer}.
     * <p>
     * Any {@link IOException}s thrown by the writer are allowed to propagate.
     */
    public static void serialize(final @NotNull Writer writer, final @NotNull Element root) throws IOException {
        final var serializer = new Serializer(writer);
        writer.write(declaration);
        writer.write('\n');
        serializer.serializeNode(root, 0);
        writer.write('\n');
    }

    /**
     * Serializes the tree rooted at {@code root} to a string.
     */
    public static @NotNull String toString(final @NotNull Element root) {
        final var writer = new StringWriter();
        try {
            serialize(writer, root);
        } catch (final IOException e) {
            // StringWriter doesn't throw.
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    /**
     * Serializes the tree rooted at {@code root} to the given file as UTF-8, replacing its contents.
     * <p>
     * If writing fails, a fatal condition of type {@link IOExceptionCondition} is signaled.
     */
    public static void write(final @NotNull Path path, final @NotNull Element root) {
        try (
            final var trace = new Trace(() -> "Writing document to " + path);
            final var writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)
        ) {
            trace.use();
            serialize(writer, root);
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
    }

    private void serializeNode(final @NotNull Node node, final int level) throws IOException {
        if (node instanceof Comment comment) {
            writer.write("<!--");
            writer.write(comment.text());
            writer.write("-->");
        } else if (node instanceof Element element) {
            serializeElement(element, level);
        }
    }

    private void serializeElement(final @NotNull Element element, final int level) throws IOException {
        writer.write('<');
        writer.write(element.name());
        for (final var attribute : element.attributes()) {
            writer.write(' ');
            writer.write(attribute.name());
            writer.write("=\"");
            serializeString(attribute.encodedValue(), AttributeEscaper.instance);
            writer.write('"');
        }
        final var text = element.text();
        final var children = element.children();
        if (text == null && children.isEmpty()) {
            writer.write("/>");
            return;
        }
        writer.write('>');
        if (text != null) {
            serializeString(text, TextEscaper.instance);
        }
        var first = true;
        for (final var child : children) {
            if (!first || text == null) {
                newLine(level + 1);
            }
            serializeNode(child, level + 1);
            first = false;
        }
        if (!children.isEmpty()) {
            newLine(level);
        }
        writer.write("</");
        writer.write(element.name());
        writer.write('>');
    }

    private void newLine(final int level) throws IOException {
        writer.write('\n');
        for (int i = 0; i < level; i += 1) {
            writer.write(indentation);
        }
    }

    private void serializeString(final @NotNull String string, final @NotNull Escaper escaper) throws IOException {
        int index = 0;
        int indexToEscape;
        while ((indexToEscape = findCharacterToEscape(string, index, escaper)) >= 0) {
            writer.write(string, index, indexToEscape - index);
            writer.write(Objects.requireNonNull(escaper.escape(string.charAt(indexToEscape))));
            index = indexToEscape + 1;
        }
        if (index < string.length()) {
            writer.write(string, index, string.length() - index);
        }
    }

    private static int findCharacterToEscape(
        final @NotNull String string,
        final int startIndex,
        final @NotNull Escaper escaper
    ) {
        final var length = string.length();
        for (int i = startIndex; i < length; i += 1) {
            if (escaper.escape(string.charAt(i)) != null) {
                return i;
            }
        }
        return -1;
    }

    private static final String declaration = "<?xml version='1.0' encoding='UTF-8'?>";
    private static final String indentation = "  ";

    private final @NotNull Writer writer;

    private sealed interface Escaper {
        @Nullable String escape(char character);
    }

    private static final class TextEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return switch (character) {
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '&' -> "&amp;";
                case '\r' -> "&#13;";
                default -> null;
            };
        }

        private static final TextEscaper instance = new TextEscaper();
    }

    // Attribute value normalization would turn raw line breaks and tabs into spaces.
    private static final class AttributeEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return switch (character) {
                case '"' -> "&quot;";
                case '\n' -> "&#10;";
                case '\t' -> "&#9;";
                default -> TextEscaper.instance.escape(character);
            };
        }

        private static final AttributeEscaper instance = new AttributeEscaper();
    }
}
