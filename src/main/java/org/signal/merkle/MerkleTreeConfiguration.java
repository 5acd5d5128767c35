/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.merkle;

import io.micronaut.context.annotation.ConfigurationProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Configuration parameters for a {@link MerkleTreeService}.
 *
 * @param digestAlgorithm The JCA name of the digest algorithm used for leaves and intermediate nodes, for example
 *                        {@code SHA3-256} or {@code SHA-256}.
 * @param initialRecords  Records, encoded as UTF-8, from which the tree is built at startup. May be empty.
 */
@ConfigurationProperties("merkle")
record MerkleTreeConfiguration(
    @NotBlank
    String digestAlgorithm,
    @NotNull
    List<String> initialRecords) {
}
