// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.model;

import java.util.List;
import phylox.assembly.BuildSession;
import phylox.assembly.TreePrior;
import phylox.dom.Attributes;
import phylox.dom.Element;
import phylox.dom.Tag;

/**
 * The Yule pure-birth tree prior, with an estimated birth rate.
 */
public final class YuleTreePrior implements TreePrior {
    /**
     * Initializes a new Yule prior over the tree with the given name.
     */
    public YuleTreePrior(final String treeName) {
        suffix = ".t:" + treeName;
    }

    /**
     * Initializes a new Yule prior over the default tree.
     */
    public YuleTreePrior() {
        this(defaultTreeName);
    }

    @Override
    public String treeId() {
        return "Tree" + suffix;
    }

    /**
     * Retrieves the identifier of the birth rate parameter.
     */
    public String birthRateId() {
        return "birthRate" + suffix;
    }

    /**
     * Estimates the starting tree height.
     * <p>
     * With calibrations, the height is twice the largest upper bound of any calibrated age. Otherwise, it's the
     * expected height of a Yule tree with a birth rate of 1.
     */
    @Override
    public void estimateHeight(final BuildSession session) {
        final var configuration = session.configuration();
        var maxBound = Double.NaN;
        for (final var entry : configuration.calibrations()) {
            final var bound = entry.getValue().upperBound();
            if (Double.isFinite(bound) && !(bound <= maxBound)) {
                maxBound = bound;
            }
        }
        if (!Double.isNaN(maxBound)) {
            session.setTreeHeight(2 * maxBound);
            return;
        }
        final var languageCount = configuration.languages().languages().size();
        var expectedHeight = 0.0;
        for (int k = 2; k <= languageCount; k += 1) {
            expectedHeight += 1.0 / k;
        }
        session.setTreeHeight(expectedHeight);
    }

    @Override
    public void addStateNodes(final Element state, final BuildSession session) {
        final var tree = state.appendElement(Tag.TREE, Attributes.builder()
            .id(treeId())
            .set("name", "stateNode")
            .build());
        session.taxonSets().add(tree, "taxa", session.configuration().languages().languages(), false);
        state.appendElement(Tag.PARAMETER, Attributes.builder()
            .id(birthRateId())
            .set("name", "stateNode")
            .build())
            .setText("1.0");
    }

    @Override
    public void addInit(final Element run, final BuildSession session) {
        final var attributes = Attributes.builder()
            .set("estimate", false)
            .id("startingTree")
            .ref("initial", treeId())
            .set("spec", "beast.evolution.tree.RandomTree")
            .ref("taxonset", "taxa");
        final var height = session.treeHeight();
        if (Double.isFinite(height) && height > 0) {
            attributes.set("rootHeight", height);
        }
        run.appendElement(Tag.INIT, attributes.build())
            .appendElement("populationModel", Attributes.builder()
                .id("ConstantPopulation0" + suffix)
                .set("spec", "ConstantPopulation")
                .build())
            .appendElement(Tag.PARAMETER, Attributes.builder()
                .id("randomPopSize" + suffix)
                .set("name", "popSize")
                .build())
            .setText("1");
    }

    @Override
    public void addPrior(final Element prior, final BuildSession session) {
        prior.appendElement(Tag.DISTRIBUTION, Attributes.builder()
            .ref("birthDiffRate", birthRateId())
            .id("YuleModel" + suffix)
            .set("spec", "beast.evolution.speciation.YuleModel")
            .ref("tree", treeId())
            .build());
        prior.appendElement(Tag.DISTRIBUTION, Attributes.builder()
            .id("YuleBirthRatePrior" + suffix)
            .set("spec", "beast.math.distributions.Prior")
            .ref("x", birthRateId())
            .build())
            .appendElement("Uniform", Attributes.builder()
                .id(session.nextId("Uniform"))
                .set("name", "distr")
                .set("upper", "Infinity")
                .build());
    }

    @Override
    public void addOperators(final Element run, final BuildSession session) {
        run.appendElement(Tag.OPERATOR, Attributes.builder()
            .id("YuleBirthRateScaler" + suffix)
            .set("spec", "ScaleOperator")
            .ref("parameter", birthRateId())
            .set("scaleFactor", 0.5)
            .set("weight", 3.0)
            .build());
        run.appendElement(Tag.OPERATOR, Attributes.builder()
            .id("treeScaler" + suffix)
            .set("spec", "ScaleOperator")
            .set("scaleFactor", 0.5)
            .ref("tree", treeId())
            .set("weight", 3.0)
            .build());
        run.appendElement(Tag.OPERATOR, Attributes.builder()
            .id("treeRootScaler" + suffix)
            .set("spec", "ScaleOperator")
            .set("rootOnly", true)
            .set("scaleFactor", 0.5)
            .ref("tree", treeId())
            .set("weight", 3.0)
            .build());
        run.appendElement(Tag.OPERATOR, Attributes.builder()
            .id("UniformOperator" + suffix)
            .set("spec", "Uniform")
            .ref("tree", treeId())
            .set("weight", 30.0)
            .build());
        run.appendElement(Tag.OPERATOR, Attributes.builder()
            .id("SubtreeSlide" + suffix)
            .set("spec", "SubtreeSlide")
            .ref("tree", treeId())
            .set("weight", 15.0)
            .build());
        for (final var exchange : List.of("narrow", "wide")) {
            run.appendElement(Tag.OPERATOR, Attributes.builder()
                .id(exchange + "Exchange" + suffix)
                .set("spec", "Exchange")
                .set("isNarrow", "narrow".equals(exchange))
                .ref("tree", treeId())
                .set("weight", 15.0)
                .build());
        }
        run.appendElement(Tag.OPERATOR, Attributes.builder()
            .id("WilsonBalding" + suffix)
            .set("spec", "WilsonBalding")
            .ref("tree", treeId())
            .set("weight", 15.0)
            .build());
    }

    @Override
    public void addLogging(final Element logger, final BuildSession session) {
        logger.appendElement(Tag.LOG, Attributes.builder()
            .id("TreeHeight" + suffix)
            .set("spec", "beast.evolution.tree.TreeHeightLogger")
            .ref("tree", treeId())
            .build());
        logger.appendElement(Tag.LOG, Attributes.builder().idref("YuleModel" + suffix).build());
        logger.appendElement(Tag.LOG, Attributes.builder().idref(birthRateId()).build());
    }

    /**
     * The tree name used unless one is given explicitly.
     */
    public static final String defaultTreeName = "phyloxTree";

    private final String suffix;
}
