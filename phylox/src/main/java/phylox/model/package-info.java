// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
/**
 * Concrete contributors: the models, clocks, tree priors and calibrations a document is assembled from.
 */
@NonNullByDefault
package phylox.model;

import phylox.util.annotation.NonNullByDefault;
