// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Assembly of complete analysis documents from the contributions of models, clocks, tree priors and calibrations.
 * <p>
 * The {@link phylox.assembly.DocumentAssembler} owns the document skeleton and its order; contributors only ever see
 * the attachment point they're asked to fill, and the {@link phylox.assembly.BuildSession} of the build in progress.
 */
@NonNullByDefault
package phylox.assembly;

import phylox.util.annotation.NonNullByDefault;
