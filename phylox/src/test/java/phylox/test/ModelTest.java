// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import phylox.assembly.AnalysisConfiguration;
import phylox.assembly.ClockModel;
import phylox.assembly.DocumentAssembler;
import phylox.assembly.Languages;
import phylox.dom.Element;
import phylox.dom.IntegrityVerifier;
import phylox.dom.Plate;
import phylox.dom.Serializer;
import phylox.model.CladeCalibration;
import phylox.model.ConstantFeatureCondition;
import phylox.model.FeatureTable;
import phylox.model.MkModel;
import phylox.model.NoVariableFeaturesCondition;
import phylox.model.StrictClock;
import phylox.model.YuleTreePrior;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

final class ModelTest {
    @Test
    void constantFeaturesAreLeftOut() {
        final var table = Documents.features();
        final var models = new MkModel[1];
        final var notices = ConditionCapture.notices(
            () -> models[0] = MkModel.builder("features", table, StrictClock.fixed("default")).build());

        Assertions.assertThat(models[0].features()).containsExactly("word_order", "case_marking");
        Assertions.assertThat(notices)
            .allSatisfy(notice -> Assertions.assertThat(notice).isInstanceOf(ConstantFeatureCondition.class))
            .extracting(notice -> ((ConstantFeatureCondition) notice).feature())
            .containsExactly("tone", "plural suffix");
    }

    @Test
    void modelWithoutVariableFeaturesIsRejected() {
        final var table = FeatureTable.parse("lang,a,b\nx,1,?\ny,1,?\n", "inline");
        ConditionCapture.expectFatal(NoVariableFeaturesCondition.class,
            () -> MkModel.builder("flat", table, StrictClock.fixed("default")).build());
    }

    @Test
    void traitsAreEncodedAsStateIndices() {
        final var table = FeatureTable.parse("lang,f\neng,b\nfra,a\nspa,?\n", "inline");
        final var clock = StrictClock.fixed("default");
        final var root = assemble(MkModel.builder("m", table, clock).build(), clock);

        Assertions.assertThat(Documents.byId(root, "traitSet.m:f").text()).isEqualTo("deu=?,eng=1,fra=0,spa=?");
        final var dataType = Documents.byId(root, "traitDataType.m:f");
        Assertions.assertThat(dataType.attributes().getEncoded("codeMap")).isEqualTo("0=0,1=1,?=0 1");
        Assertions.assertThat(dataType.attributes().getEncoded("states")).isEqualTo("2");
        Assertions.assertThat(Documents.byId(root, "m:f").attributes().getEncoded("spec"))
            .isEqualTo("AlignmentFromTrait");
    }

    @Test
    void likelihoodWiresDataTreeAndClock() {
        final var clock = StrictClock.fixed("default");
        final var root = assemble(MkModel.builder("features", Documents.features(), clock).build(), clock);

        final var likelihood = Documents.byId(root, "traitedtreeLikelihood.features:word_order");
        Assertions.assertThat(likelihood.attributes().getEncoded("spec")).isEqualTo("TreeLikelihood");
        Assertions.assertThat(likelihood.attributes().getEncoded("data")).isEqualTo("@features:word_order");
        Assertions.assertThat(likelihood.attributes().getEncoded("tree")).isEqualTo("@Tree.t:phyloxTree");
        Assertions.assertThat(likelihood.attributes().getEncoded("branchRateModel"))
            .isEqualTo("@StrictClockModel.c:default");
        final var siteModel = Documents.byId(root, "SiteModel.features:word_order");
        Assertions.assertThat(siteModel.attributes().getEncoded("mutationRate")).isEqualTo("1.0");
        Assertions.assertThat(Documents.byId(root, "mk.s:features:word_order").children()).isEmpty();
        Assertions.assertThat(Documents.named(root, "frequencies")).isEmpty();
    }

    @Test
    void rateVariationAndEmpiricalFrequencies() {
        final var clock = StrictClock.fixed("default");
        final var model = MkModel.builder("features", Documents.features(), clock)
            .rateVariation(true)
            .frequencies(MkModel.Frequencies.EMPIRICAL)
            .reconstruct(true)
            .build();
        final var root = assemble(model, clock);

        Assertions.assertThat(model.allRates()).containsExactly("word_order", "case_marking");
        Assertions.assertThat(model.weights()).containsExactly(1, 1);
        Assertions.assertThat(Documents.byId(root, "SiteModel.features:case_marking").attributes()
            .getEncoded("mutationRate")).isEqualTo("@featureClockRate:features:case_marking");
        Assertions.assertThat(Documents.byId(root, "featurefreqs.s:features:word_order").attributes()
            .getEncoded("data")).isEqualTo("@features:word_order");
        Assertions.assertThat(Documents.byId(root, "featureClockRateGammaShape:features").text()).isEqualTo("5.0");
        Assertions.assertThat(Documents.byId(root, "featureClockRateCompound:features").children()).singleElement()
            .isInstanceOf(Plate.class);
        Assertions.assertThat(Documents.byId(root, "Exponential.0").attributes().getEncoded("mean")).isEqualTo("10.0");

        final var likelihood = Documents.byId(root, "traitedtreeLikelihood.features:word_order");
        Assertions.assertThat(likelihood.attributes().getEncoded("spec"))
            .isEqualTo("beast.evolution.likelihood.AncestralStateTreeLikelihood");
        Assertions.assertThat(likelihood.attributes().getEncoded("tag")).isEqualTo("features:word_order");
        Assertions.assertThat(model.metadata()).containsExactly(
            "traitedtreeLikelihood.features:word_order", "traitedtreeLikelihood.features:case_marking");
    }

    @Test
    void fixedClockRateIsInline() {
        final var clock = StrictClock.fixed("default");
        final var root = assemble(MkModel.builder("features", Documents.features(), clock).build(), clock);

        final var branchRateModel = Documents.byId(root, "StrictClockModel.c:default");
        Assertions.assertThat(branchRateModel.parent()).isSameAs(root);
        final var rate = Documents.byId(root, "clockRate.c:default");
        Assertions.assertThat(rate.parent()).isSameAs(branchRateModel);
        Assertions.assertThat(rate.attributes().getEncoded("estimate")).isEqualTo("false");
        Assertions.assertThat(rate.text()).isEqualTo("1.0");
        Assertions.assertThat(Serializer.toString(root)).doesNotContain("clockPrior.c:", "clockScaler.c:");
    }

    @Test
    void estimatedClockRateIsAStateNode() {
        final var clock = new StrictClock("default", 0.5, true);
        final var root = assemble(MkModel.builder("features", Documents.features(), clock).build(), clock);

        Assertions.assertThat(Documents.byId(root, "StrictClockModel.c:default").attributes().getEncoded("clock.rate"))
            .isEqualTo("@clockRate.c:default");
        final var rate = Documents.byId(root, "clockRate.c:default");
        Assertions.assertThat(rate.parent()).isSameAs(Documents.byId(root, "state"));
        Assertions.assertThat(rate.text()).isEqualTo("0.5");
        Assertions.assertThat(Documents.byId(root, "clockPrior.c:default").childElements("Uniform")).hasSize(1);
        Assertions.assertThat(Documents.byId(root, "clockScaler.c:default").attributes().getEncoded("parameter"))
            .isEqualTo("@clockRate.c:default");
        Assertions.assertThat(Documents.byId(root, "tracelog").childElements("log"))
            .extracting(log -> log.attributes().getEncoded("idref"))
            .contains("clockRate.c:default");
        Assertions.assertThat(IntegrityVerifier.inspect(root).isClean()).isTrue();
    }

    @Test
    void clockRateMustBePositive() {
        Assertions.assertThatIllegalArgumentException().isThrownBy(() -> new StrictClock("c", 0.0, true));
        Assertions.assertThatIllegalArgumentException().isThrownBy(() -> new StrictClock("c", Double.NaN, false));
    }

    @Test
    void calibrationsValidateParameters() {
        Assertions.assertThatIllegalArgumentException()
            .isThrownBy(() -> CladeCalibration.normal(List.of(), 1.0, 0.1));
        Assertions.assertThatIllegalArgumentException()
            .isThrownBy(() -> CladeCalibration.normal(List.of("eng"), 1.0, 0.0));
        Assertions.assertThatIllegalArgumentException()
            .isThrownBy(() -> CladeCalibration.logNormal(List.of("eng"), 1.0, -1.0));
        Assertions.assertThatIllegalArgumentException()
            .isThrownBy(() -> CladeCalibration.uniform(List.of("eng"), 2.0, 1.0));
        Assertions.assertThatIllegalArgumentException()
            .isThrownBy(() -> AnalysisConfiguration.builder(Languages.of(List.of("eng", "fra")))
                .tipCalibration("eng", CladeCalibration.point(List.of("eng", "fra"), 1.0)));
    }

    @Test
    void calibrationUpperBounds() {
        final var clade = List.of("eng", "deu");
        Assertions.assertThat(CladeCalibration.normal(clade, 3.0, 0.5).upperBound()).isEqualTo(4.0);
        Assertions.assertThat(CladeCalibration.logNormal(clade, 0.0, 0.5).upperBound()).isEqualTo(Math.exp(1.0));
        Assertions.assertThat(CladeCalibration.uniform(clade, 1.0, 2.5).upperBound()).isEqualTo(2.5);
        final var point = CladeCalibration.point(clade, 1.2);
        Assertions.assertThat(point.upperBound()).isEqualTo(1.2);
        Assertions.assertThat(point.isPoint()).isTrue();

        final var origin = CladeCalibration.uniform(clade, 1.0, 2.5).originate();
        Assertions.assertThat(origin.isOriginate()).isTrue();
        Assertions.assertThat(origin.isPoint()).isFalse();
        Assertions.assertThat(origin.languages()).containsExactly("eng", "deu");
        Assertions.assertThat(origin.upperBound()).isEqualTo(2.5);
    }

    @Test
    void uncalibratedTreeHeightIsYuleExpectation() {
        final var clock = StrictClock.fixed("default");
        final var root = assemble(MkModel.builder("features", Documents.features(), clock).build(), clock);

        Assertions.assertThat(Documents.byId(root, "startingTree").attributes().getEncoded("rootHeight"))
            .isEqualTo(Double.toString(1.0 / 2 + 1.0 / 3 + 1.0 / 4));
        Assertions.assertThat(Documents.byId(root, "startingTree").attributes().getEncoded("taxonset"))
            .isEqualTo("@taxa");
    }

    @Test
    void namedTreesSuffixTheirIdentifiers() {
        final var prior = new YuleTreePrior("lexicon");
        Assertions.assertThat(prior.treeId()).isEqualTo("Tree.t:lexicon");
        Assertions.assertThat(prior.birthRateId()).isEqualTo("birthRate.t:lexicon");
        final var configuration = AnalysisConfiguration.builder(Languages.of(languages))
            .treePrior(prior)
            .build();
        final var root = new DocumentAssembler(configuration, epoch).assemble();
        Assertions.assertThat(Documents.byId(root, "YuleModel.t:lexicon").attributes().getEncoded("birthDiffRate"))
            .isEqualTo("@birthRate.t:lexicon");
        Assertions.assertThat(Documents.named(root, "operator")).hasSize(8);
    }

    private static Element assemble(final MkModel model, final ClockModel clock) {
        final var configuration = AnalysisConfiguration.builder(Languages.of(languages))
            .model(model)
            .clock(clock)
            .treePrior(new YuleTreePrior())
            .build();
        return new DocumentAssembler(configuration, epoch).assemble();
    }

    private static final List<String> languages = List.of("eng", "fra", "deu", "spa");
    private static final Clock epoch = Clock.fixed(Instant.EPOCH, ZoneOffset.UTC);
}
