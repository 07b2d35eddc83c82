// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package phylox.assembly;

import java.util.List;
import phylox.dom.Element;

/**
 * A timing calibration of the common ancestor of a clade.
 */
public interface Calibration {
    /**
     * Retrieves the languages of the calibrated clade.
     */
    List<String> languages();

    /**
     * Checks whether this is a point calibration. Point calibrations only fix initial tip heights and contribute no
     * prior distribution.
     */
    boolean isPoint();

    /**
     * Checks whether the calibration applies to the origin of the clade rather than to its most recent common
     * ancestor.
     */
    boolean isOriginate();

    /**
     * Retrieves an upper bound on the calibrated age, used to estimate the starting tree height.
     */
    double upperBound();

    /**
     * Adds the calibration's distribution to the given {@code MRCAPrior} distribution.
     */
    void addDistribution(Element mrcaPrior, BuildSession session);
}
