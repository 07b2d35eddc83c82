// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.cli;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import phylox.assembly.AnalysisConfiguration;
import phylox.assembly.DocumentAssembler;
import phylox.assembly.Languages;
import phylox.assembly.RunSettings;
import phylox.dom.DocumentReader;
import phylox.dom.Element;
import phylox.dom.IntegrityVerifier;
import phylox.dom.Serializer;
import phylox.model.FeatureTable;
import phylox.model.MkModel;
import phylox.model.StrictClock;
import phylox.model.YuleTreePrior;
import phylox.util.Trace;
import phylox.util.condition.ConditionContext;
import phylox.util.condition.Handler;
import phylox.util.condition.exception.IOExceptionCondition;

final class Main {
    private Main() {
    }

    public static void main(final String[] args) {
        System.exit(mainImpl(args).value);
    }

    private static ExitCode mainImpl(final String[] args) {
        final Command command;
        if (args.length == 3 && "build".equals(args[0])) {
            command = () -> build(Path.of(args[1]), args[2]);
        } else if (args.length == 2 && "validate".equals(args[0])) {
            command = () -> validate(Path.of(args[1]));
        } else {
            standardError().println("Usage: phylox build <data.csv> <output.xml|->");
            standardError().println("       phylox validate <file.xml>");
            return ExitCode.USAGE;
        }

        try (final var handler = new Handler(FallbackHandler.instance())) {
            handler.use();
            final var exitCode = ConditionContext.withRestart("abort-process", restart -> {
                command.run();
                return ExitCode.SUCCESS;
            });
            return (exitCode != null) ? exitCode : ExitCode.ERROR;
        }
    }

    private static void build(final Path dataFile, final String output) {
        final var table = FeatureTable.read(dataFile);
        final var clock = StrictClock.fixed("default");
        final var model = MkModel.builder(stem(dataFile), table, clock).build();
        final var basename = toStdout(output) ? stem(dataFile) : stem(Path.of(output));
        final var configuration = AnalysisConfiguration.builder(Languages.of(table.languages()))
            .model(model)
            .treePrior(new YuleTreePrior())
            .settings(RunSettings.builder().basename(basename).embedData(true).build())
            .build();
        final var root = new DocumentAssembler(configuration).assemble();
        if (toStdout(output)) {
            writeToStandardOutput(root);
        } else {
            Serializer.write(Path.of(output), root);
        }
    }

    private static void validate(final Path file) {
        final var root = DocumentReader.read(file);
        IntegrityVerifier.verify(root);
        standardOutput().println("No integrity defects found in " + file);
    }

    private static void writeToStandardOutput(final Element root) {
        try (final var trace = new Trace("Writing the document to standard output")) {
            trace.use();
            final var writer = new OutputStreamWriter(standardOutput(), StandardCharsets.UTF_8);
            try {
                Serializer.serialize(writer, root);
                writer.flush();
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
        }
    }

    private static boolean toStdout(final String output) {
        return "-".equals(output);
    }

    private static String stem(final Path path) {
        final var fileName = path.getFileName().toString();
        final var dot = fileName.lastIndexOf('.');
        return (dot > 0) ? fileName.substring(0, dot) : fileName;
    }

    @SuppressWarnings("UseOfSystemOutOrSystemErr")
    private static PrintStream standardOutput() {
        return System.out;
    }

    @SuppressWarnings("UseOfSystemOutOrSystemErr")
    private static PrintStream standardError() {
        return System.err;
    }

    @FunctionalInterface
    private interface Command {
        void run();
    }

    private enum ExitCode {
        SUCCESS(0),
        ERROR(1),
        USAGE(64);

        ExitCode(final int value) {
            this.value = value;
        }

        private final int value;
    }
}
