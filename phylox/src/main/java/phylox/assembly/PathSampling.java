// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.assembly;

/**
 * Settings of a path sampling run, which wraps the chain in a stepping-stone sampler for marginal likelihood
 * estimation.
 *
 * @param steps             The number of steps between prior and posterior.
 * @param alpha             The shape of the step distribution.
 * @param preBurnInPercent  The share of the chain length discarded before the first step, in percent.
 * @param logBurnInPercent  The share of each step's log discarded as burn-in, in percent.
 * @param doNotRun          Whether to only prepare the step directories, without running them.
 */
public record PathSampling(int steps, double alpha, double preBurnInPercent, double logBurnInPercent, boolean doNotRun) {
    public PathSampling {
        if (steps < 1) {
            throw new IllegalArgumentException("Path sampling needs at least one step, got " + steps);
        }
    }

    /**
     * Returns the default path sampling settings.
     */
    public static PathSampling defaults() {
        return new PathSampling(8, 0.3, 10, 50, false);
    }
}
