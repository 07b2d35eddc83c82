// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.model;

import phylox.assembly.BuildSession;
import phylox.assembly.ClockModel;
import phylox.dom.Attributes;
import phylox.dom.Element;
import phylox.dom.Tag;

/**
 * A strict molecular clock: every branch evolves at the same rate.
 * <p>
 * The rate is either fixed, in which case it's defined inline in the branch rate model, or estimated, in which case
 * it's a state node with a flat prior and a scale operator.
 */
public final class StrictClock implements ClockModel {
    /**
     * Initializes a new strict clock.
     *
     * @param name      The clock name.
     * @param rate      The fixed rate, or the starting value of an estimated one.
     * @param estimated Whether the rate is estimated.
     */
    @SuppressWarnings("BooleanParameter")
    public StrictClock(final String name, final double rate, final boolean estimated) {
        if (!(rate > 0)) {
            throw new IllegalArgumentException("Clock rate must be positive, got " + rate);
        }
        this.name = name;
        this.rate = rate;
        this.estimated = estimated;
    }

    /**
     * Returns a new clock with a fixed rate of 1.
     */
    public static StrictClock fixed(final String name) {
        return new StrictClock(name, 1.0, false);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isStrict() {
        return true;
    }

    @Override
    public String branchRateModelId() {
        return "StrictClockModel.c:" + name;
    }

    /**
     * Retrieves the identifier of the clock rate parameter.
     */
    public String rateId() {
        return "clockRate.c:" + name;
    }

    @Override
    public void addBranchRateModel(final Element beast, final BuildSession session) {
        final var attributes = Attributes.builder()
            .id(branchRateModelId())
            .set("spec", "beast.evolution.branchratemodel.StrictClockModel");
        if (estimated) {
            beast.appendElement("branchRateModel", attributes.ref("clock.rate", rateId()).build());
        } else {
            beast.appendElement("branchRateModel", attributes.build())
                .appendElement(Tag.PARAMETER, Attributes.builder()
                    .id(rateId())
                    .set("name", "clock.rate")
                    .set("estimate", false)
                    .build())
                .setText(Double.toString(rate));
        }
    }

    @Override
    public void addState(final Element state, final BuildSession session) {
        if (estimated) {
            state.appendElement(Tag.PARAMETER, Attributes.builder()
                .id(rateId())
                .set("lower", "0.0")
                .set("name", "stateNode")
                .build())
                .setText(Double.toString(rate));
        }
    }

    @Override
    public void addPrior(final Element prior, final BuildSession session) {
        if (estimated) {
            prior.appendElement(Tag.DISTRIBUTION, Attributes.builder()
                .id("clockPrior.c:" + name)
                .set("spec", "beast.math.distributions.Prior")
                .ref("x", rateId())
                .build())
                .appendElement("Uniform", Attributes.builder()
                    .id(session.nextId("Uniform"))
                    .set("name", "distr")
                    .set("upper", "Infinity")
                    .build());
        }
    }

    @Override
    public void addOperators(final Element run, final BuildSession session) {
        if (estimated) {
            run.appendElement(Tag.OPERATOR, Attributes.builder()
                .id("clockScaler.c:" + name)
                .set("spec", "ScaleOperator")
                .ref("parameter", rateId())
                .set("scaleFactor", 0.5)
                .set("weight", 3.0)
                .build());
        }
    }

    @Override
    public void addParameterLogs(final Element logger, final BuildSession session) {
        if (estimated) {
            logger.appendElement(Tag.LOG, Attributes.builder().idref(rateId()).build());
        }
    }

    private final String name;
    private final double rate;
    private final boolean estimated;
}
