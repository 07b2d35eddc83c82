// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.model;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import phylox.util.Trace;
import phylox.util.UnreachableCodeReachedError;
import phylox.util.annotation.Nullable;
import phylox.util.condition.ConditionContext;
import phylox.util.condition.UnhandledErrorError;
import phylox.util.condition.exception.IOExceptionCondition;

/**
 * A table of discrete feature values per language, read from comma-separated values.
 * <p>
 * The first row names the columns. The first column holds the language identifiers, every other column is a
 * feature. Fields may be quoted with {@code '"'}, with {@code ""} standing for a literal quote. Empty values and
 * {@value #missingValue} mean the value is unknown.
 * <p>
 * Language identifiers and feature names end up in plate ranges, so they may not contain commas.
 */
public final class FeatureTable {
    private FeatureTable(
        final @Nullable Path path,
        final List<String> features,
        final LinkedHashMap<String, Map<String, String>> valuesByLanguage
    ) {
        this.path = path;
        this.features = List.copyOf(features);
        this.valuesByLanguage = valuesByLanguage;
    }

    /**
     * Reads the feature table stored in the given file.
     * <p>
     * If the file cannot be read, a fatal {@link IOExceptionCondition} is signaled. If its contents are malformed, a
     * fatal {@link FeatureTableErrorCondition} is signaled.
     */
    public static FeatureTable read(final Path path) {
        try (final var trace = new Trace(() -> "Reading feature table " + path)) {
            trace.use();
            final String source;
            try {
                source = Files.readString(path, StandardCharsets.UTF_8);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
            return new Parser(source, path.toString()).parse(path);
        }
    }

    /**
     * Parses the given text as a feature table. The source name is only used in error messages.
     */
    public static FeatureTable parse(final String source, final String sourceName) {
        return new Parser(source, sourceName).parse(null);
    }

    /**
     * Retrieves the file this table was read from, or {@code null} if it was parsed from a string.
     */
    public @Nullable Path path() {
        return path;
    }

    /**
     * Retrieves the language identifiers, in the order of the rows.
     */
    public List<String> languages() {
        return List.copyOf(valuesByLanguage.keySet());
    }

    /**
     * Retrieves the feature names, in the order of the columns.
     */
    public List<String> features() {
        return features;
    }

    /**
     * Retrieves the value of the given feature for the given language, or {@code null} if it's unknown.
     */
    public @Nullable String value(final String language, final String feature) {
        final var values = valuesByLanguage.get(language);
        return (values != null) ? values.get(feature) : null;
    }

    /**
     * Retrieves the distinct known values of the given feature, in sorted order.
     */
    public List<String> states(final String feature) {
        final var states = new TreeSet<String>();
        for (final var values : valuesByLanguage.values()) {
            final var value = values.get(feature);
            if (value != null) {
                states.add(value);
            }
        }
        return List.copyOf(states);
    }

    static final String missingValue = "?";

    private final @Nullable Path path;
    private final List<String> features;
    private final LinkedHashMap<String, Map<String, String>> valuesByLanguage;

    private static final class Parser {
        Parser(final String source, final String sourceName) {
            this.source = source;
            this.sourceName = sourceName;
        }

        FeatureTable parse(final @Nullable Path path) {
            final var headerLine = lineNumber;
            final var header = readRecord();
            if (header == null) {
                throw signalError("The feature table is empty");
            }
            if (header.size() < 2) {
                throw signalError("The feature table has no feature columns");
            }
            final var features = header.subList(1, header.size());
            if (new TreeSet<>(features).size() != features.size()) {
                throw signalError("The feature table has duplicate column names");
            }
            for (final var feature : features) {
                if (feature.indexOf(',') >= 0) {
                    throw signalError("Feature name '" + feature + "' contains a comma", headerLine);
                }
            }

            final var valuesByLanguage = new LinkedHashMap<String, Map<String, String>>();
            while (true) {
                final var recordLine = lineNumber;
                final var record = readRecord();
                if (record == null) {
                    break;
                }
                if (record.size() == 1 && record.get(0).isBlank()) {
                    continue;
                }
                if (record.size() != header.size()) {
                    throw signalError(
                        "Expected " + header.size() + " fields, found " + record.size(), recordLine);
                }
                final var language = record.get(0).strip();
                if (language.isEmpty()) {
                    throw signalError("Missing language identifier", recordLine);
                }
                if (language.indexOf(',') >= 0) {
                    throw signalError("Language identifier '" + language + "' contains a comma", recordLine);
                }
                final var values = new HashMap<String, String>();
                for (int i = 1; i < record.size(); i += 1) {
                    final var value = record.get(i).strip();
                    if (!value.isEmpty() && !missingValue.equals(value)) {
                        values.put(header.get(i), value);
                    }
                }
                if (valuesByLanguage.put(language, Map.copyOf(values)) != null) {
                    throw signalError("Duplicate language '" + language + '\'', recordLine);
                }
            }
            if (valuesByLanguage.isEmpty()) {
                throw signalError("The feature table has no languages");
            }
            return new FeatureTable(path, features, valuesByLanguage);
        }

        private @Nullable List<String> readRecord() {
            if (position >= source.length()) {
                return null;
            }
            final var fields = new ArrayList<String>();
            final var field = new StringBuilder();
            var state = FieldState.START;
            while (position < source.length()) {
                final var ch = source.charAt(position);
                position += 1;
                switch (state) {
                    case START, UNQUOTED -> {
                        switch (ch) {
                            case ',' -> {
                                fields.add(field.toString());
                                field.setLength(0);
                                state = FieldState.START;
                            }
                            case '\n' -> {
                                lineNumber += 1;
                                fields.add(field.toString());
                                return fields;
                            }
                            case '\r' -> {
                            }
                            case '"' -> {
                                if (state != FieldState.START) {
                                    throw signalError("Unexpected quote inside an unquoted field");
                                }
                                state = FieldState.QUOTED;
                            }
                            default -> {
                                field.append(ch);
                                state = FieldState.UNQUOTED;
                            }
                        }
                    }
                    case QUOTED -> {
                        if (ch == '"') {
                            state = FieldState.AFTER_QUOTE;
                        } else {
                            if (ch == '\n') {
                                lineNumber += 1;
                            }
                            field.append(ch);
                        }
                    }
                    case AFTER_QUOTE -> {
                        switch (ch) {
                            case '"' -> {
                                field.append('"');
                                state = FieldState.QUOTED;
                            }
                            case ',' -> {
                                fields.add(field.toString());
                                field.setLength(0);
                                state = FieldState.START;
                            }
                            case '\n' -> {
                                lineNumber += 1;
                                fields.add(field.toString());
                                return fields;
                            }
                            case '\r' -> {
                            }
                            default -> throw signalError("Unexpected character after a closing quote");
                        }
                    }
                    default -> throw new UnreachableCodeReachedError("Unknown field state " + state);
                }
            }
            if (state == FieldState.QUOTED) {
                throw signalError("Unterminated quoted field");
            }
            fields.add(field.toString());
            return fields;
        }

        private UnhandledErrorError signalError(final String message) {
            return signalError(message, lineNumber);
        }

        private UnhandledErrorError signalError(final String message, final int line) {
            throw ConditionContext.error(new FeatureTableErrorCondition(message, sourceName, line));
        }

        private final String source;
        private final String sourceName;
        private int position = 0;
        private int lineNumber = 1;
    }

    private enum FieldState {
        START,
        UNQUOTED,
        QUOTED,
        AFTER_QUOTE,
    }
}
