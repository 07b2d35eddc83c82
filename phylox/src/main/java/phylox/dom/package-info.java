// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The document tree: elements with ordered attributes and children, comments, the plate construct, and the
 * operations over finished trees, namely integrity verification, serialization and reading documents back.
 */
package phylox.dom;
