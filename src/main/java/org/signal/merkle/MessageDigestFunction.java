/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.merkle;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;
import org.signal.merkle.util.MessageDigests;

/**
 * A {@link DigestFunction} backed by a JCA {@link MessageDigest}. A new {@code MessageDigest} is created for every
 * call, so instances hold no mutable state and may be shared between threads.
 */
public class MessageDigestFunction implements DigestFunction {

  private final String algorithm;
  private final int digestLength;

  /**
   * @param algorithm the JCA name of the digest algorithm, for example {@code SHA3-256}
   * @throws NoSuchAlgorithmException if no installed provider supports the given algorithm
   */
  public MessageDigestFunction(final String algorithm) throws NoSuchAlgorithmException {
    this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
    // Check that the algorithm is supported before handing out any digests
    this.digestLength = MessageDigest.getInstance(algorithm).getDigestLength();

    if (digestLength <= 0) {
      throw new NoSuchAlgorithmException("Digest algorithm does not have a fixed output length: " + algorithm);
    }
  }

  public static MessageDigestFunction sha3_256() {
    try {
      return new MessageDigestFunction(MessageDigests.SHA3_256);
    } catch (final NoSuchAlgorithmException e) {
      throw new AssertionError("SHA3-256 is provided by every Java platform since Java 9", e);
    }
  }

  public static MessageDigestFunction sha256() {
    try {
      return new MessageDigestFunction(MessageDigests.SHA_256);
    } catch (final NoSuchAlgorithmException e) {
      throw new AssertionError("Every implementation of the Java platform is required to support SHA-256", e);
    }
  }

  @Override
  public byte[] digest(final byte[] input) {
    return MessageDigests.getCheckedMessageDigest(algorithm).digest(input);
  }

  @Override
  public byte[] digest(final byte[] left, final byte[] right) {
    final MessageDigest messageDigest = MessageDigests.getCheckedMessageDigest(algorithm);
    messageDigest.update(left);
    messageDigest.update(right);
    return messageDigest.digest();
  }

  @Override
  public int getDigestLength() {
    return digestLength;
  }

  public String getAlgorithm() {
    return algorithm;
  }

  @Override
  public String toString() {
    return "MessageDigestFunction{" + algorithm + "}";
  }
}
