/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.merkle;

import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import java.security.NoSuchAlgorithmException;

@Factory
public class DigestFunctionFactory {

  @Singleton
  public DigestFunction getDigestFunction(final MerkleTreeConfiguration configuration)
      throws NoSuchAlgorithmException {
    return new MessageDigestFunction(configuration.digestAlgorithm());
  }
}
