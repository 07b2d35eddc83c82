// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.assembly;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import phylox.dom.Attribute;
import phylox.dom.Attributes;
import phylox.dom.Element;
import phylox.dom.IntegrityVerifier;
import phylox.dom.Plate;
import phylox.dom.Tag;
import phylox.util.Trace;
import phylox.util.annotation.Nullable;
import phylox.util.condition.ConditionContext;
import phylox.util.condition.exception.IOExceptionCondition;

/**
 * Assembles a complete analysis document from an {@link AnalysisConfiguration}.
 * <p>
 * The assembler owns the skeleton of the document: what goes where, and in which order. Everything else is
 * delegated to the contributors of the configuration, each of which is called at its fixed place in the skeleton.
 * Every call to {@link #assemble()} uses a fresh {@link BuildSession}, so one assembler can build the same document
 * any number of times.
 */
public final class DocumentAssembler {
    /**
     * Initializes a new assembler for the given configuration, reading the generation timestamp from the given clock.
     */
    public DocumentAssembler(final AnalysisConfiguration configuration, final Clock clock) {
        this.configuration = configuration;
        this.clock = clock;
    }

    /**
     * Initializes a new assembler for the given configuration, using the system clock in the default time zone.
     */
    public DocumentAssembler(final AnalysisConfiguration configuration) {
        this(configuration, Clock.systemDefaultZone());
    }

    /**
     * Builds the document and verifies its referential integrity.
     * <p>
     * If the document contains duplicate identifiers or dangling references, a fatal
     * {@link phylox.dom.IntegrityErrorCondition} is signaled.
     *
     * @return The root {@code <beast>} element.
     */
    @CheckReturnValue
    public Element assemble() {
        final var root = assembleUnverified();
        IntegrityVerifier.verify(root);
        return root;
    }

    /**
     * Builds the document without verifying it. Meant for diagnosing contributors that produce broken documents.
     */
    @CheckReturnValue
    public Element assembleUnverified() {
        try (final var trace = new Trace("Assembling the analysis document")) {
            trace.use();
            return new Build(new BuildSession(configuration)).run();
        }
    }

    /**
     * Retrieves the version of phylox recorded in generated documents.
     */
    public static String version() {
        final var version = DocumentAssembler.class.getPackage().getImplementationVersion();
        return (version != null) ? version : "development";
    }

    private final AnalysisConfiguration configuration;
    private final Clock clock;

    private static final String namespace = String.join(":",
        "beast.core",
        "beast.evolution.alignment",
        "beast.evolution.tree.coalescent",
        "beast.core.util",
        "beast.evolution.nuc",
        "beast.evolution.operators",
        "beast.evolution.sitemodel",
        "beast.evolution.substitutionmodel",
        "beast.evolution.likelihood"
    );

    private static final List<Map.Entry<String, String>> distributionAliases = List.of(
        Map.entry("Beta", "beast.math.distributions.Beta"),
        Map.entry("Exponential", "beast.math.distributions.Exponential"),
        Map.entry("InverseGamma", "beast.math.distributions.InverseGamma"),
        Map.entry("LogNormal", "beast.math.distributions.LogNormalDistributionModel"),
        Map.entry("Gamma", "beast.math.distributions.Gamma"),
        Map.entry("Uniform", "beast.math.distributions.Uniform"),
        Map.entry("prior", "beast.math.distributions.Prior"),
        Map.entry("LaplaceDistribution", "beast.math.distributions.LaplaceDistribution"),
        Map.entry("OneOnX", "beast.math.distributions.OneOnX"),
        Map.entry("Normal", "beast.math.distributions.Normal")
    );

    private static final String originateSuffix = "_originate";
    private static final String reconstructedSuffix = "_reconstructed";

    private static final DateTimeFormatter timestampFormat =
        DateTimeFormatter.ofPattern("EEEE, dd MMM yyyy hh:mm a", Locale.ROOT);

    private static final String pathSamplingScript = """
        cd $(dir)
        java -cp $(java.class.path) beast.app.beastapp.BeastMain $(resume/overwrite) -java -seed $(seed) beast.xml""";

    /**
     * The state of one build.
     */
    private final class Build {
        Build(final BuildSession session) {
            this.session = session;
            settings = configuration.settings();
            treeId = configuration.treePrior().treeId();
        }

        Element run() {
            final var beast = Element.of(Tag.BEAST, Attributes.builder()
                .set("version", "2.0")
                .set("beautitemplate", "Standard")
                .set("beautistatus", "")
                .set("namespace", namespace)
                .build());
            session.taxonSets().add(beast, "taxa", configuration.languages().languages(), true);
            addProvenanceComment(beast);
            if (settings.embedData()) {
                embedData(beast);
            }
            for (final var alias : distributionAliases) {
                beast.appendElement(Tag.MAP, Attributes.builder().set("name", alias.getKey()).build())
                    .setText(alias.getValue());
            }
            try (final var trace = new Trace("Adding model data")) {
                trace.use();
                for (final var model : configuration.models()) {
                    model.addMasterData(beast, session);
                    model.addMisc(beast, session);
                }
                for (final var clockModel : configuration.clocks()) {
                    clockModel.addBranchRateModel(beast, session);
                }
            }

            final var chain = addRun(beast);
            configuration.treePrior().estimateHeight(session);
            addState(chain);
            configuration.treePrior().addInit(chain, session);
            addDistributions(chain);
            addOperators(chain);
            addLoggers(chain);
            return beast;
        }

        private void addProvenanceComment(final Element beast) {
            final var lines = new ArrayList<String>();
            final var timestamp = LocalDateTime.now(clock).format(timestampFormat);
            lines.add("Generated by phylox " + version() + " on " + timestamp + ".\n");
            final var configurationText = configuration.configurationText();
            if (configurationText != null) {
                lines.add("Original configuration file:\n");
                lines.add(configurationText);
                lines.add("Please DO NOT manually edit this file without removing this message or editing");
                lines.add("it to describe the changes made. Otherwise attempts to replicate your");
                lines.add("analysis using phylox and the above configuration may not be valid.\n");
            } else {
                lines.add("Configuration built programmatically.");
                lines.add("No configuration file to include.");
            }
            beast.appendComment(commentSafe(String.join("\n", lines)));
        }

        private void embedData(final Element beast) {
            final var files = new LinkedHashSet<Path>(configuration.filesToEmbed());
            for (final var model : configuration.models()) {
                final var dataFile = model.dataFile();
                if (dataFile != null) {
                    files.add(dataFile);
                }
            }
            for (final var file : files) {
                try (final var trace = new Trace(() -> "Embedding data file " + file)) {
                    trace.use();
                    final String content;
                    try {
                        content = Files.readString(file, StandardCharsets.UTF_8);
                    } catch (final IOException e) {
                        throw ConditionContext.error(new IOExceptionCondition(e));
                    }
                    beast.appendComment(commentSafe("phylox embedded data file: " + file + '\n' + content));
                }
            }
        }

        private Element addRun(final Element beast) {
            final var pathSampling = settings.pathSampling();
            if (pathSampling == null) {
                return beast.appendElement(Tag.RUN, Attributes.builder()
                    .id("mcmc")
                    .set("spec", "MCMC")
                    .set("chainLength", settings.chainLength())
                    .set("numInitializationAttempts", 1000)
                    .set("sampleFromPrior", settings.sampleFromPrior())
                    .build());
            }

            final var preBurnIn = (long) (pathSampling.preBurnInPercent() / 100 * settings.chainLength());
            final var sampler = beast.appendElement(Tag.RUN, Attributes.builder()
                .id("ps")
                .set("spec", "beast.inference.PathSampler")
                .set("chainLength", settings.chainLength())
                .set("nrOfSteps", pathSampling.steps())
                .set("alpha", pathSampling.alpha())
                .set("rootdir", settings.path("_path_sampling"))
                .set("preBurnin", preBurnIn)
                .set("burnInPercentage", pathSampling.logBurnInPercent())
                .set("deleteOldLogs", true)
                .addIf(pathSampling.doNotRun(), Attribute.of("doNotRun", true))
                .build());
            sampler.setText(pathSamplingScript);
            return sampler.appendElement(Tag.MCMC, Attributes.builder()
                .id("mcmc")
                .set("spec", "MCMC")
                .set("chainLength", settings.chainLength())
                .build());
        }

        private void addState(final Element chain) {
            try (final var trace = new Trace("Adding the state")) {
                trace.use();
                final var state = chain.appendElement(Tag.STATE, Attributes.builder()
                    .id("state")
                    .set("storeEvery", 5000)
                    .build());
                configuration.treePrior().addStateNodes(state, session);
                for (final var clockModel : configuration.clocks()) {
                    clockModel.addState(state, session);
                }
                for (final var model : configuration.models()) {
                    model.addState(state, session);
                }
            }
        }

        private void addDistributions(final Element chain) {
            try (final var trace = new Trace("Adding distributions")) {
                trace.use();
                final var posterior = compoundDistribution(chain, "posterior");
                final var prior = compoundDistribution(posterior, "prior");
                addMonophylyConstraints(prior);
                addCalibrations(prior);
                configuration.treePrior().addPrior(prior, session);
                for (final var clockModel : configuration.clocks()) {
                    clockModel.addPrior(prior, session);
                }
                for (final var model : configuration.models()) {
                    model.addPrior(prior, session);
                }

                final var likelihood = compoundDistribution(posterior, "likelihood");
                for (final var model : configuration.models()) {
                    model.addLikelihood(likelihood, session);
                }
            }
        }

        private void addMonophylyConstraints(final Element prior) {
            final var newick = configuration.languages().monophylyNewick();
            if (newick == null) {
                return;
            }
            prior.appendElement(Tag.DISTRIBUTION, Attributes.builder()
                .id("constraints")
                .set("spec", "beast.math.distributions.MultiMonophyleticConstraint")
                .ref("tree", treeId)
                .set("newick", newick)
                .build());
        }

        private void addCalibrations(final Element prior) {
            for (final var entry : configuration.calibrations()) {
                final var calibration = entry.getValue();
                if (calibration.isPoint()) {
                    continue;
                }
                final var clade = cladeName(entry.getKey());
                try (final var trace = new Trace(() -> "Adding the calibration of clade " + clade)) {
                    trace.use();
                    final var attributes = Attributes.builder()
                        .id(clade + "MRCA")
                        .set("monophyletic", true)
                        .set("spec", "beast.math.distributions.MRCAPrior")
                        .ref("tree", treeId);
                    if (calibration.isOriginate()) {
                        attributes.set("useOriginate", true);
                    } else if (calibration.languages().size() == 1) {
                        attributes.set("tipsonly", true);
                    }
                    final var mrcaPrior = prior.appendElement(Tag.DISTRIBUTION, attributes.build());
                    final var label = clade.endsWith(originateSuffix)
                        ? clade.substring(0, clade.length() - originateSuffix.length())
                        : clade;
                    session.taxonSets().add(mrcaPrior, label, calibration.languages(), false);
                    calibration.addDistribution(mrcaPrior, session);
                }
            }
        }

        private void addOperators(final Element chain) {
            try (final var trace = new Trace("Adding operators")) {
                trace.use();
                configuration.treePrior().addOperators(chain, session);
                for (final var clockModel : configuration.clocks()) {
                    clockModel.addOperators(chain, session);
                }
                for (final var model : configuration.models()) {
                    model.addOperators(chain, session);
                }
                for (final var clockModel : configuration.clocks()) {
                    addRateExchanger(chain, clockModel);
                }
            }
        }

        private void addRateExchanger(final Element chain, final ClockModel clockModel) {
            final var models = configuration.models().stream()
                .filter(model -> model.hasRateVariation() && model.clock() == clockModel)
                .toList();
            if (models.isEmpty()) {
                return;
            }
            final var exchanger = chain.appendElement(Tag.OPERATOR, Attributes.builder()
                .id("featureClockRateDeltaExchanger:" + clockModel.name())
                .set("spec", "DeltaExchangeOperator")
                .set("weight", "3.0")
                .build());
            final var weights = new ArrayList<Integer>();
            for (final var model : models) {
                final var plate = exchanger.append(Plate.of("rate", model.allRates()));
                plate.appendElement(Tag.PARAMETER, Attributes.builder()
                    .idref("featureClockRate:" + model.name() + ':' + plate.placeholder())
                    .build());
                weights.addAll(model.weights());
            }
            if (weights.stream().anyMatch(weight -> weight != 1)) {
                exchanger.appendElement("weightvector", Attributes.builder()
                    .id("featureClockRateWeightParameter:" + clockModel.name())
                    .set("spec", "parameter.IntegerParameter")
                    .set("dimension", weights.size())
                    .set("estimate", false)
                    .build())
                    .setText(String.join(" ", weights.stream().map(String::valueOf).toList()));
            }
        }

        private void addLoggers(final Element chain) {
            try (final var trace = new Trace("Adding loggers")) {
                trace.use();
                if (settings.screenLog()) {
                    addScreenLogger(chain);
                }
                if (settings.logProbabilities() || settings.logParameters()) {
                    addTraceLogger(chain);
                }
                if (settings.logTrees()) {
                    addTreeLoggers(chain);
                }
                if (configuration.models().stream().anyMatch(model -> !model.metadata().isEmpty())) {
                    addTraitLogger(chain);
                }
            }
        }

        private void addScreenLogger(final Element chain) {
            final var logger = chain.appendElement(Tag.LOGGER, Attributes.builder()
                .id("screenlog")
                .set("logEvery", settings.logEvery())
                .build());
            logger.appendElement(Tag.LOG, Attributes.builder()
                .ref("arg", "posterior")
                .id("ESS.0")
                .set("spec", "util.ESS")
                .build());
            logProbabilities(logger);
        }

        private void addTraceLogger(final Element chain) {
            final var logger = chain.appendElement(Tag.LOGGER, Attributes.builder()
                .id("tracelog")
                .set("fileName", settings.path(".log"))
                .set("logEvery", settings.logEvery())
                .set("sort", "smart")
                .build());
            if (settings.logProbabilities()) {
                logProbabilities(logger);
            }
            if (settings.logParameters()) {
                configuration.treePrior().addLogging(logger, session);
                for (final var clockModel : configuration.clocks()) {
                    clockModel.addParameterLogs(logger, session);
                }
                for (final var model : configuration.models()) {
                    model.addParameterLogs(logger, session);
                }
            }
            for (final var entry : configuration.calibrations()) {
                if (!entry.getValue().isPoint()) {
                    logger.appendElement(Tag.LOG, Attributes.builder()
                        .idref(cladeName(entry.getKey()) + "MRCA")
                        .build());
                }
            }
        }

        private void addTreeLoggers(final Element chain) {
            final var nonStrictClocks = new LinkedHashSet<ClockModel>();
            for (final var model : configuration.models()) {
                if (!model.clock().isStrict()) {
                    nonStrictClocks.add(model.clock());
                }
            }
            if (nonStrictClocks.isEmpty()) {
                addTreeLogger(chain, "", null);
            } else {
                for (final var clockModel : nonStrictClocks) {
                    final var suffix = (nonStrictClocks.size() == 1) ? "" : '_' + clockModel.name() + "_rates";
                    addTreeLogger(chain, suffix, clockModel.branchRateModelId());
                }
                if (settings.logPureTree()) {
                    addTreeLogger(chain, "_pure", null);
                }
            }

            final var treeData = new ArrayList<String>();
            for (final var model : configuration.models()) {
                treeData.addAll(model.treeData());
            }
            if (!treeData.isEmpty()) {
                final var logger = treeLoggerElement(chain, reconstructedSuffix);
                final var log = logger.appendElement(Tag.LOG, Attributes.builder()
                    .id("ReconstructedStateTreeLogger")
                    .set("spec", "beast.evolution.tree.TreeWithTraitLogger")
                    .ref("tree", treeId)
                    .build());
                for (final var reference : treeData) {
                    log.appendElement("metadata", Attributes.builder().idref(reference).build());
                }
            }
        }

        private void addTreeLogger(
            final Element chain,
            final String suffix,
            final @Nullable String branchRateModelId
        ) {
            final var logger = treeLoggerElement(chain, suffix);
            final var log = logger.appendElement(Tag.LOG, Attributes.builder()
                .id("TreeLoggerWithMetaData" + suffix)
                .set("spec", "beast.evolution.tree.TreeWithMetaDataLogger")
                .ref("tree", treeId)
                .set("dp", settings.logDecimalPlaces())
                .build());
            if (branchRateModelId != null) {
                log.appendElement("branchratemodel", Attributes.builder().idref(branchRateModelId).build());
            }
        }

        private Element treeLoggerElement(final Element chain, final String suffix) {
            return chain.appendElement(Tag.LOGGER, Attributes.builder()
                .set("mode", "tree")
                .set("fileName", settings.path(suffix + ".nex"))
                .set("logEvery", settings.logEvery())
                .id("treeLogger" + suffix)
                .build());
        }

        private void addTraitLogger(final Element chain) {
            final var logger = chain.appendElement(Tag.LOGGER, Attributes.builder()
                .set("fileName", settings.path(reconstructedSuffix + ".log"))
                .set("logEvery", settings.logEvery())
                .id("traitLogger" + reconstructedSuffix)
                .build());
            for (final var model : configuration.models()) {
                for (final var reference : model.metadata()) {
                    logger.appendElement(Tag.LOG, Attributes.builder().idref(reference).build());
                }
            }
        }

        private void logProbabilities(final Element logger) {
            for (final var distribution : List.of("prior", "likelihood", "posterior")) {
                logger.appendElement(Tag.LOG, Attributes.builder().idref(distribution).build());
            }
        }

        private static Element compoundDistribution(final Element parent, final String id) {
            return parent.appendElement(Tag.DISTRIBUTION, Attributes.builder()
                .id(id)
                .set("spec", "util.CompoundDistribution")
                .build());
        }

        private static String cladeName(final String clade) {
            return clade.replace(' ', '_');
        }

        private static String commentSafe(final String text) {
            var result = text;
            while (result.contains("--")) {
                result = result.replace("--", "- -");
            }
            return result.endsWith("-") ? result + ' ' : result;
        }

        private final BuildSession session;
        private final RunSettings settings;
        private final String treeId;
    }
}
