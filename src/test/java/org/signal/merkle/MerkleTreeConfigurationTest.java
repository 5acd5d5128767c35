/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.merkle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import io.micronaut.context.annotation.Property;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import java.util.List;
import org.junit.jupiter.api.Test;

@Property(name = "merkle.digest-algorithm", value = MerkleTreeConfigurationTest.DIGEST_ALGORITHM)
@MicronautTest
public class MerkleTreeConfigurationTest {

  public static final String DIGEST_ALGORITHM = "SHA-256";

  @Inject
  MerkleTreeConfiguration merkleTreeConfiguration;

  @Inject
  DigestFunction digestFunction;

  @Test
  void testMerkleTreeConfiguration() {
    assertEquals(DIGEST_ALGORITHM, merkleTreeConfiguration.digestAlgorithm());
    assertEquals(List.of("this", "is", "a", "merkle", "tree"), merkleTreeConfiguration.initialRecords());
  }

  @Test
  void testDigestFunction() {
    final MessageDigestFunction messageDigestFunction = assertInstanceOf(MessageDigestFunction.class, digestFunction);
    assertEquals(DIGEST_ALGORITHM, messageDigestFunction.getAlgorithm());
  }
}
