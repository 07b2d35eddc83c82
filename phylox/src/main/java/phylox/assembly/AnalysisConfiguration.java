// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.assembly;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import phylox.util.annotation.Nullable;

/**
 * Everything a document is assembled from: the languages, the contributors and the run settings.
 * <p>
 * Immutable once built. The clocks of an analysis are the explicitly added ones followed by any other clock used by
 * a model, in model order.
 */
public final class AnalysisConfiguration {
    private AnalysisConfiguration(final Builder builder) {
        final var treePrior = builder.treePrior;
        if (treePrior == null) {
            throw new IllegalStateException("A tree prior is required");
        }
        languages = builder.languages;
        models = List.copyOf(builder.models);
        final var allClocks = new LinkedHashSet<>(builder.clocks);
        for (final var model : models) {
            allClocks.add(model.clock());
        }
        clocks = List.copyOf(allClocks);
        this.treePrior = treePrior;
        calibrations = sortedByClade(builder.calibrations);
        settings = builder.settings;
        configurationText = builder.configurationText;
        filesToEmbed = List.copyOf(builder.filesToEmbed);
    }

    /**
     * Returns a new builder for the analysis of the given languages.
     */
    public static Builder builder(final Languages languages) {
        return new Builder(languages);
    }

    public Languages languages() {
        return languages;
    }

    public List<SubstitutionModel> models() {
        return models;
    }

    public List<ClockModel> clocks() {
        return clocks;
    }

    public TreePrior treePrior() {
        return treePrior;
    }

    /**
     * Retrieves the clade and tip calibrations, ordered by clade name.
     */
    public List<Map.Entry<String, Calibration>> calibrations() {
        return calibrations;
    }

    public RunSettings settings() {
        return settings;
    }

    /**
     * Retrieves the text of the configuration file the analysis was read from, or {@code null} if it was built
     * programmatically.
     */
    public @Nullable String configurationText() {
        return configurationText;
    }

    /**
     * Retrieves the data files to embed in addition to the models' own data files.
     */
    public List<Path> filesToEmbed() {
        return filesToEmbed;
    }

    private static List<Map.Entry<String, Calibration>> sortedByClade(
        final List<Map.Entry<String, Calibration>> calibrations
    ) {
        final var sorted = new ArrayList<>(calibrations);
        sorted.sort(Map.Entry.comparingByKey(Comparator.naturalOrder()));
        return List.copyOf(sorted);
    }

    private final Languages languages;
    private final List<SubstitutionModel> models;
    private final List<ClockModel> clocks;
    private final TreePrior treePrior;
    private final List<Map.Entry<String, Calibration>> calibrations;
    private final RunSettings settings;
    private final @Nullable String configurationText;
    private final List<Path> filesToEmbed;

    /**
     * Builds an {@link AnalysisConfiguration}. A tree prior is mandatory, everything else is optional.
     */
    public static final class Builder {
        private Builder(final Languages languages) {
            this.languages = languages;
        }

        public Builder model(final SubstitutionModel model) {
            models.add(model);
            return this;
        }

        public Builder clock(final ClockModel clock) {
            clocks.add(clock);
            return this;
        }

        public Builder treePrior(final TreePrior treePrior) {
            this.treePrior = treePrior;
            return this;
        }

        /**
         * Adds a calibration of the clade with the given name.
         */
        public Builder calibration(final String clade, final Calibration calibration) {
            calibrations.add(Map.entry(clade, calibration));
            return this;
        }

        /**
         * Adds a calibration of the tip with the given name, which must be a single-language calibration.
         */
        public Builder tipCalibration(final String tip, final Calibration calibration) {
            if (calibration.languages().size() != 1) {
                throw new IllegalArgumentException("Tip calibration '" + tip + "' must cover exactly one language");
            }
            calibrations.add(Map.entry(tip, calibration));
            return this;
        }

        public Builder settings(final RunSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder configurationText(final @Nullable String configurationText) {
            this.configurationText = configurationText;
            return this;
        }

        public Builder embedFile(final Path file) {
            filesToEmbed.add(file);
            return this;
        }

        /**
         * Returns the built configuration.
         *
         * @throws IllegalStateException if no tree prior was set.
         */
        public AnalysisConfiguration build() {
            return new AnalysisConfiguration(this);
        }

        private final Languages languages;
        private final List<SubstitutionModel> models = new ArrayList<>();
        private final List<ClockModel> clocks = new ArrayList<>();
        private @Nullable TreePrior treePrior = null;
        private final List<Map.Entry<String, Calibration>> calibrations = new ArrayList<>();
        private RunSettings settings = RunSettings.defaults();
        private @Nullable String configurationText = null;
        private final List<Path> filesToEmbed = new ArrayList<>();
    }
}
