/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.merkle.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public class MessageDigests {

  public static final String SHA_256 = "SHA-256";
  public static final String SHA3_256 = "SHA3-256";

  /**
   * Infallibly returns a new {@code MessageDigest} instance that uses the SHA-256 algorithm. While getting a new
   * {@code MessageDigest} can fail in general, every implementation of the Java platform is required to support
   * SHA-256.
   *
   * @return a new {@code MessageDigest} instance that uses the SHA-256 algorithm
   */
  public static MessageDigest getSha256MessageDigest() {
    try {
      return MessageDigest.getInstance(SHA_256);
    } catch (final NoSuchAlgorithmException e) {
      throw new AssertionError("Every implementation of the Java platform is required to support SHA-256", e);
    }
  }

  /**
   * Returns a new {@code MessageDigest} instance for an algorithm whose availability the caller has already
   * established, for example by calling {@link MessageDigest#getInstance(String)} once at construction time.
   *
   * @param algorithm the name of a previously checked digest algorithm
   * @return a new {@code MessageDigest} instance that uses the given algorithm
   */
  public static MessageDigest getCheckedMessageDigest(final String algorithm) {
    try {
      return MessageDigest.getInstance(algorithm);
    } catch (final NoSuchAlgorithmException e) {
      throw new AssertionError("Digest algorithm was available at construction time: " + algorithm, e);
    }
  }
}
