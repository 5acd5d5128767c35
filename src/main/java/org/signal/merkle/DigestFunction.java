/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.merkle;

/**
 * A deterministic hash function with a fixed output length. A Merkle tree must use the same digest function for its
 * whole lifetime, and verifiers must use the same function as the tree that produced a proof.
 */
public interface DigestFunction {

  /**
   * @param input the bytes to digest
   * @return the digest of {@code input}
   */
  byte[] digest(byte[] input);

  /**
   * Digests the concatenation {@code left || right}. Used to derive a parent node from its two children.
   *
   * @param left  the left child digest
   * @param right the right child digest
   * @return the digest of the concatenation of both inputs
   */
  default byte[] digest(final byte[] left, final byte[] right) {
    final byte[] concatenated = new byte[left.length + right.length];
    System.arraycopy(left, 0, concatenated, 0, left.length);
    System.arraycopy(right, 0, concatenated, left.length, right.length);
    return digest(concatenated);
  }

  /**
   * @return the length in bytes of every digest produced by this function
   */
  int getDigestLength();
}
