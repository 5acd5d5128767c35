/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.merkle;

import java.security.MessageDigest;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Checks membership proofs against a known root hash. Verification only needs the root, the proof and the digest of
 * the candidate record; it does not need access to the tree or its records.
 */
public class MerkleProofVerifier {

  private final DigestFunction digestFunction;

  /**
   * @param digestFunction the digest function used by the tree that produced the proofs to verify
   */
  public MerkleProofVerifier(final DigestFunction digestFunction) {
    this.digestFunction = Objects.requireNonNull(digestFunction, "digestFunction");
  }

  /**
   * Replays the hashing described by a proof, starting from the candidate leaf digest.
   *
   * @param proof           the membership proof
   * @param candidateDigest the leaf digest of the record whose membership is being checked
   * @return the root hash implied by the proof and candidate
   */
  public byte[] calculateRootHash(final MembershipProof proof, final byte[] candidateDigest) {
    byte[] currentHash = candidateDigest.clone();

    for (final ProofNode node : proof.nodes()) {
      currentHash = switch (node.side()) {
        case LEFT -> digestFunction.digest(node.hash(), currentHash);
        case RIGHT -> digestFunction.digest(currentHash, node.hash());
      };
    }

    return currentHash;
  }

  /**
   * Indicates whether the given proof shows that the candidate digest is a leaf of the tree with the given root. This
   * method never throws; a missing, tampered or mismatched input simply yields {@code false}.
   *
   * @param proof           the membership proof
   * @param candidateDigest the leaf digest of the record whose membership is being checked
   * @param rootHash        the trusted root hash
   * @return {@code true} if replaying the proof from the candidate digest reproduces the root hash
   */
  public boolean verify(@Nullable final MembershipProof proof,
      @Nullable final byte[] candidateDigest,
      @Nullable final byte[] rootHash) {

    if (proof == null || candidateDigest == null || rootHash == null) {
      return false;
    }

    return MessageDigest.isEqual(calculateRootHash(proof, candidateDigest), rootHash);
  }
}
