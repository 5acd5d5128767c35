/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.merkle;

import java.util.List;

/**
 * A proof that a record is a member of a Merkle tree with a given root hash. The proof lists the sibling of every node
 * on the path from the record's leaf up to, but not including, the root.
 * <p>
 * Proofs are immutable snapshots. A proof generated before {@link MerkleTree#add(byte[])} is not updated by it and
 * generally will not verify against the new root.
 *
 * @param nodes sibling digests in leaf-to-root order
 * @see MerkleProofVerifier
 */
public record MembershipProof(List<ProofNode> nodes) {

  public MembershipProof {
    nodes = List.copyOf(nodes);
  }

  /**
   * @return the number of levels between the leaf and the root
   */
  public int size() {
    return nodes.size();
  }
}
