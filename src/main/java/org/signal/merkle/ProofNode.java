/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.merkle;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * One step of a {@link MembershipProof}: the digest of a sibling node and the side on which it is combined with the
 * node on the path to the root.
 *
 * @param hash the sibling digest
 * @param side whether the sibling is the left or right input of the parent hash
 */
public record ProofNode(byte[] hash, Side side) {

  public ProofNode {
    Objects.requireNonNull(hash, "hash");
    Objects.requireNonNull(side, "side");
    hash = hash.clone();
  }

  @Override
  public byte[] hash() {
    return hash.clone();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ProofNode other)) {
      return false;
    }
    return side == other.side && Arrays.equals(hash, other.hash);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(hash) + side.hashCode();
  }

  @Override
  public String toString() {
    return "ProofNode[hash=" + HexFormat.of().formatHex(hash) + ", side=" + side + "]";
  }
}
