// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.model;

import java.util.List;
import phylox.assembly.BuildSession;
import phylox.assembly.Calibration;
import phylox.dom.Attributes;
import phylox.dom.Element;
import phylox.dom.Tag;

/**
 * A calibration of the age of a clade by a parametric distribution.
 */
public final class CladeCalibration implements Calibration {
    private CladeCalibration(
        final List<String> languages,
        final Distribution distribution,
        final double first,
        final double second,
        final boolean originate
    ) {
        if (languages.isEmpty()) {
            throw new IllegalArgumentException("A calibration needs at least one language");
        }
        this.languages = List.copyOf(languages);
        this.distribution = distribution;
        this.first = first;
        this.second = second;
        this.originate = originate;
    }

    /**
     * Returns a calibration by a normal distribution.
     */
    public static CladeCalibration normal(final List<String> languages, final double mean, final double stdev) {
        requirePositive(stdev, "standard deviation");
        return new CladeCalibration(languages, Distribution.NORMAL, mean, stdev, false);
    }

    /**
     * Returns a calibration by a log-normal distribution, parameterized in log space.
     */
    public static CladeCalibration logNormal(final List<String> languages, final double mu, final double sigma) {
        requirePositive(sigma, "sigma");
        return new CladeCalibration(languages, Distribution.LOG_NORMAL, mu, sigma, false);
    }

    /**
     * Returns a calibration by a uniform distribution over the given interval.
     */
    public static CladeCalibration uniform(final List<String> languages, final double lower, final double upper) {
        if (!(lower < upper)) {
            throw new IllegalArgumentException("Empty calibration interval [" + lower + ", " + upper + ']');
        }
        return new CladeCalibration(languages, Distribution.UNIFORM, lower, upper, false);
    }

    /**
     * Returns a calibration fixing the age exactly, such as the known age of a historical language.
     */
    public static CladeCalibration point(final List<String> languages, final double age) {
        return new CladeCalibration(languages, Distribution.POINT, age, age, false);
    }

    /**
     * Returns a copy of this calibration that applies to the origin of the clade.
     */
    public CladeCalibration originate() {
        return new CladeCalibration(languages, distribution, first, second, true);
    }

    @Override
    public List<String> languages() {
        return languages;
    }

    @Override
    public boolean isPoint() {
        return distribution == Distribution.POINT;
    }

    @Override
    public boolean isOriginate() {
        return originate;
    }

    /**
     * Retrieves an upper bound on the calibrated age: two standard deviations above the mean for the normal and
     * log-normal distributions, the upper end of the interval for the uniform one.
     */
    @Override
    public double upperBound() {
        return switch (distribution) {
            case NORMAL -> first + 2 * second;
            case LOG_NORMAL -> Math.exp(first + 2 * second);
            case UNIFORM, POINT -> second;
        };
    }

    @Override
    public void addDistribution(final Element mrcaPrior, final BuildSession session) {
        switch (distribution) {
            case NORMAL -> {
                final var normal = mrcaPrior.appendElement("Normal", Attributes.builder()
                    .id(session.nextId("CalibrationNormal"))
                    .set("name", "distr")
                    .set("offset", "0.0")
                    .build());
                addFixedParameter(normal, "mean", first);
                addFixedParameter(normal, "sigma", second);
            }
            case LOG_NORMAL -> {
                final var logNormal = mrcaPrior.appendElement("LogNormal", Attributes.builder()
                    .id(session.nextId("CalibrationLogNormal"))
                    .set("name", "distr")
                    .set("offset", "0.0")
                    .set("meanInRealSpace", false)
                    .build());
                addFixedParameter(logNormal, "M", first);
                addFixedParameter(logNormal, "S", second);
            }
            case UNIFORM -> mrcaPrior.appendElement("Uniform", Attributes.builder()
                .id(session.nextId("CalibrationUniform"))
                .set("name", "distr")
                .set("lower", first)
                .set("upper", second)
                .build());
            case POINT -> {
            }
        }
    }

    private static void addFixedParameter(final Element distribution, final String name, final double value) {
        distribution.appendElement(Tag.PARAMETER, Attributes.builder()
            .set("name", name)
            .set("estimate", false)
            .build())
            .setText(Double.toString(value));
    }

    private static void requirePositive(final double value, final String what) {
        if (!(value > 0)) {
            throw new IllegalArgumentException("Calibration " + what + " must be positive, got " + value);
        }
    }

    private final List<String> languages;
    private final Distribution distribution;
    private final double first;
    private final double second;
    private final boolean originate;

    private enum Distribution {
        NORMAL,
        LOG_NORMAL,
        UNIFORM,
        POINT,
    }
}
