// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import phylox.assembly.BuildSession;
import phylox.assembly.ClockModel;
import phylox.assembly.SubstitutionModel;
import phylox.dom.Attributes;
import phylox.dom.Element;
import phylox.dom.Plate;
import phylox.dom.Tag;
import phylox.util.annotation.Nullable;
import phylox.util.condition.ConditionContext;

/**
 * The Lewis Mk model of discrete trait evolution, applied to every feature of a {@link FeatureTable}.
 * <p>
 * Each feature becomes its own data block and tree likelihood. With rate variation, each feature also gets its own
 * rate relative to the clock, drawn from a gamma distribution with mean 1 and an estimated shape.
 */
public final class MkModel implements SubstitutionModel {
    private MkModel(final Builder builder) {
        name = builder.name;
        data = builder.data;
        clock = builder.clock;
        rateVariation = builder.rateVariation;
        frequencies = builder.frequencies;
        reconstruct = builder.reconstruct;

        final var kept = new ArrayList<String>();
        for (final var feature : data.features()) {
            final var states = data.states(feature);
            if (states.size() < 2) {
                ConditionContext.signal(new ConstantFeatureCondition(name, feature, states.size()));
            } else {
                kept.add(feature);
            }
        }
        features = List.copyOf(kept);
        if (features.isEmpty()) {
            throw ConditionContext.error(new NoVariableFeaturesCondition(name));
        }
    }

    /**
     * Returns a new builder of a model with the given name, applied to the given data and governed by the given
     * clock.
     */
    public static Builder builder(final String name, final FeatureTable data, final ClockModel clock) {
        return new Builder(name, data, clock);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ClockModel clock() {
        return clock;
    }

    @Override
    public @Nullable Path dataFile() {
        return data.path();
    }

    /**
     * Retrieves the features this model applies to: those of the data with at least two distinct values.
     */
    public List<String> features() {
        return features;
    }

    @Override
    public boolean hasRateVariation() {
        return rateVariation;
    }

    @Override
    public List<String> allRates() {
        return rateVariation ? features : List.of();
    }

    @Override
    public List<Integer> weights() {
        return rateVariation ? Collections.nCopies(features.size(), 1) : List.of();
    }

    @Override
    public List<String> metadata() {
        return reconstruct ? likelihoodIds() : List.of();
    }

    @Override
    public List<String> treeData() {
        return reconstruct ? likelihoodIds() : List.of();
    }

    @Override
    public void addMasterData(final Element beast, final BuildSession session) {
        final var languages = session.configuration().languages().languages();
        for (final var feature : features) {
            final var fullName = fullName(feature);
            final var states = data.states(feature);
            final var codes = new HashMap<String, Integer>();
            for (int i = 0; i < states.size(); i += 1) {
                codes.put(states.get(i), i);
            }

            final var block = beast.appendElement("data", Attributes.builder()
                .id(fullName)
                .set("spec", "AlignmentFromTrait")
                .build());
            block.appendElement("traitSet", Attributes.builder()
                .id("traitSet." + fullName)
                .set("spec", "beast.evolution.tree.TraitSet")
                .ref("taxa", "taxa")
                .set("traitname", "discrete")
                .build())
                .setText(traitValues(languages, feature, codes));
            block.appendElement("userDataType", Attributes.builder()
                .id(dataTypeId(fullName))
                .set("spec", "beast.evolution.datatype.UserDataType")
                .set("codeMap", codeMap(states.size()))
                .set("states", states.size())
                .build());
        }
    }

    @Override
    public void addState(final Element state, final BuildSession session) {
        if (!rateVariation) {
            return;
        }
        final var plate = state.append(Plate.of(featureVariable, features));
        plate.appendElement(Tag.PARAMETER, Attributes.builder()
            .id(rateId(plate.placeholder()))
            .set("lower", "0.0")
            .set("name", "stateNode")
            .build())
            .setText("1.0");
        state.appendElement(Tag.PARAMETER, Attributes.builder()
            .id(gammaShapeId())
            .set("lower", "0.0")
            .set("name", "stateNode")
            .build())
            .setText("5.0");
    }

    @Override
    public void addPrior(final Element prior, final BuildSession session) {
        if (!rateVariation) {
            return;
        }
        final var ratePrior = prior.appendElement(Tag.DISTRIBUTION, Attributes.builder()
            .id("featureClockRatePrior.s:" + name)
            .set("spec", "beast.math.distributions.Prior")
            .build());
        final var rates = ratePrior.appendElement("input", Attributes.builder()
            .id("featureClockRateCompound:" + name)
            .set("spec", "beast.core.parameter.CompoundValuable")
            .set("name", "x")
            .build());
        final var plate = rates.append(Plate.of(featureVariable, features));
        plate.appendElement("var", Attributes.builder().idref(rateId(plate.placeholder())).build());
        ratePrior.appendElement("input", Attributes.builder()
            .id("featureClockRatePriorGamma:" + name)
            .set("spec", "beast.math.distributions.Gamma")
            .set("name", "distr")
            .ref("alpha", gammaShapeId())
            .set("beta", "1.0")
            .set("mode", "ShapeMean")
            .build());

        prior.appendElement(Tag.DISTRIBUTION, Attributes.builder()
            .id("featureClockRateGammaShapePrior.s:" + name)
            .set("spec", "beast.math.distributions.Prior")
            .ref("x", gammaShapeId())
            .build())
            .appendElement("Exponential", Attributes.builder()
                .id(session.nextId("Exponential"))
                .set("name", "distr")
                .set("mean", "10.0")
                .build());
    }

    @Override
    public void addLikelihood(final Element likelihood, final BuildSession session) {
        final var treeId = session.configuration().treePrior().treeId();
        for (final var feature : features) {
            final var fullName = fullName(feature);
            final var attributes = Attributes.builder()
                .id(likelihoodId(feature));
            if (reconstruct) {
                attributes
                    .set("spec", "beast.evolution.likelihood.AncestralStateTreeLikelihood")
                    .set("tag", fullName);
            } else {
                attributes.set("spec", "TreeLikelihood");
            }
            final var treeLikelihood = likelihood.appendElement(Tag.DISTRIBUTION, attributes
                .ref("data", fullName)
                .ref("tree", treeId)
                .ref("branchRateModel", clock.branchRateModelId())
                .set("useAmbiguities", true)
                .build());
            addSiteModel(treeLikelihood, fullName);
        }
    }

    @Override
    public void addOperators(final Element run, final BuildSession session) {
        if (rateVariation) {
            run.appendElement(Tag.OPERATOR, Attributes.builder()
                .id("featureClockRateGammaShapeScaler.s:" + name)
                .set("spec", "ScaleOperator")
                .ref("parameter", gammaShapeId())
                .set("scaleFactor", 0.5)
                .set("weight", 0.1)
                .build());
        }
    }

    @Override
    public void addParameterLogs(final Element logger, final BuildSession session) {
        if (rateVariation) {
            final var plate = logger.append(Plate.of(featureVariable, features));
            plate.appendElement(Tag.LOG, Attributes.builder().idref(rateId(plate.placeholder())).build());
            logger.appendElement(Tag.LOG, Attributes.builder().idref(gammaShapeId()).build());
        }
    }

    private void addSiteModel(final Element treeLikelihood, final String fullName) {
        final var siteModel = Attributes.builder()
            .id("SiteModel." + fullName)
            .set("spec", "SiteModel");
        if (rateVariation) {
            siteModel.ref("mutationRate", "featureClockRate:" + fullName);
        } else {
            siteModel.set("mutationRate", "1.0");
        }
        final var substitutionModel = treeLikelihood
            .appendElement("siteModel", siteModel
                .set("shape", "1")
                .set("proportionInvariant", "0")
                .build())
            .appendElement("substModel", Attributes.builder()
                .id("mk.s:" + fullName)
                .set("spec", "LewisMK")
                .ref("datatype", dataTypeId(fullName))
                .build());
        if (frequencies == Frequencies.EMPIRICAL) {
            substitutionModel.appendElement("frequencies", Attributes.builder()
                .id("featurefreqs.s:" + fullName)
                .set("spec", "Frequencies")
                .ref("data", fullName)
                .build());
        }
    }

    private String traitValues(
        final List<String> languages,
        final String feature,
        final Map<String, Integer> codes
    ) {
        return languages.stream()
            .sorted()
            .map(language -> {
                final var value = data.value(language, feature);
                final var code = (value != null) ? codes.get(value) : null;
                return language + '=' + ((code != null) ? code.toString() : FeatureTable.missingValue);
            })
            .collect(Collectors.joining(","));
    }

    private static String codeMap(final int stateCount) {
        final var entries = new ArrayList<String>();
        final var all = new ArrayList<String>();
        for (int i = 0; i < stateCount; i += 1) {
            entries.add(i + "=" + i);
            all.add(Integer.toString(i));
        }
        entries.add(FeatureTable.missingValue + '=' + String.join(" ", all));
        return String.join(",", entries);
    }

    private List<String> likelihoodIds() {
        return features.stream().map(this::likelihoodId).toList();
    }

    private String likelihoodId(final String feature) {
        return "traitedtreeLikelihood." + fullName(feature);
    }

    private String fullName(final String feature) {
        return name + ':' + feature;
    }

    private String rateId(final String feature) {
        return "featureClockRate:" + fullName(feature);
    }

    private String gammaShapeId() {
        return "featureClockRateGammaShape:" + name;
    }

    private static String dataTypeId(final String fullName) {
        return "traitDataType." + fullName;
    }

    private static final String featureVariable = "feature";

    private final String name;
    private final FeatureTable data;
    private final ClockModel clock;
    private final boolean rateVariation;
    private final Frequencies frequencies;
    private final boolean reconstruct;
    private final List<String> features;

    /**
     * How the equilibrium state frequencies are determined.
     */
    public enum Frequencies {
        /**
         * All states are equally frequent.
         */
        UNIFORM,
        /**
         * State frequencies are taken from the data.
         */
        EMPIRICAL,
    }

    /**
     * Builds an {@link MkModel}.
     */
    public static final class Builder {
        private Builder(final String name, final FeatureTable data, final ClockModel clock) {
            this.name = name;
            this.data = data;
            this.clock = clock;
        }

        @SuppressWarnings("BooleanParameter")
        public Builder rateVariation(final boolean rateVariation) {
            this.rateVariation = rateVariation;
            return this;
        }

        public Builder frequencies(final Frequencies frequencies) {
            this.frequencies = frequencies;
            return this;
        }

        /**
         * Sets whether ancestral states are reconstructed and logged.
         */
        @SuppressWarnings("BooleanParameter")
        public Builder reconstruct(final boolean reconstruct) {
            this.reconstruct = reconstruct;
            return this;
        }

        /**
         * Returns the built model.
         * <p>
         * Features with fewer than two distinct values carry no information and are left out, signaling a
         * {@link ConstantFeatureCondition} each. If no feature is left, a fatal {@link NoVariableFeaturesCondition} is
         * signaled.
         */
        public MkModel build() {
            return new MkModel(this);
        }

        private final String name;
        private final FeatureTable data;
        private final ClockModel clock;
        private boolean rateVariation = false;
        private Frequencies frequencies = Frequencies.UNIFORM;
        private boolean reconstruct = false;
    }
}
