/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.merkle;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.signal.merkle.util.Util.utf8;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.signal.merkle.metrics.MetricsUtil;

class MerkleTreeServiceTest {

  private static final List<String> INITIAL_RECORDS = List.of("data1", "data2", "data3");

  private DigestFunction digestFunction;
  private SimpleMeterRegistry meterRegistry;
  private MerkleTreeService merkleTreeService;

  @BeforeEach
  void setUp() {
    digestFunction = spy(MessageDigestFunction.sha3_256());
    meterRegistry = new SimpleMeterRegistry();
    merkleTreeService = createService(INITIAL_RECORDS);
  }

  private MerkleTreeService createService(final List<String> initialRecords) {
    final MerkleTreeService service = new MerkleTreeService(
        new MerkleTreeConfiguration("SHA3-256", initialRecords), digestFunction, meterRegistry);
    service.loadInitialRecords();
    return service;
  }

  private double counterValue(final String name) {
    return meterRegistry.get(MetricsUtil.name(MerkleTreeService.class, name)).counter().count();
  }

  private double verificationCount(final boolean valid) {
    return meterRegistry.get(MetricsUtil.name(MerkleTreeService.class, "verifications"))
        .tag("valid", String.valueOf(valid))
        .counter()
        .count();
  }

  @Test
  void loadInitialRecords() {
    final MerkleTree expectedTree = new MerkleTree(MessageDigestFunction.sha3_256(),
        INITIAL_RECORDS.stream().map(record -> utf8(record)).toList());

    assertEquals(3, merkleTreeService.size());
    assertArrayEquals(expectedTree.getRootHash(), merkleTreeService.getRootHash().orElseThrow());
    assertTrue(merkleTreeService.isReady());
    assertTrue(merkleTreeService.isHealthy());
    assertEquals("SHA3-256", merkleTreeService.getDigestAlgorithm());
  }

  @Test
  void add() throws RecordNotFoundException {
    final byte[] rootBeforeAdd = merkleTreeService.getRootHash().orElseThrow();
    clearInvocations(digestFunction);

    merkleTreeService.add(utf8("data4"));

    // every leaf and every intermediate node is recomputed
    verify(digestFunction, times(4)).digest(any(byte[].class));
    verify(digestFunction, times(3)).digest(any(byte[].class), any(byte[].class));

    assertEquals(4, merkleTreeService.size());
    assertFalse(Arrays.equals(rootBeforeAdd, merkleTreeService.getRootHash().orElseThrow()));
    assertEquals(1, counterValue("recordsAdded"));

    final MembershipProof proof = merkleTreeService.generateProof(utf8("data4"));
    assertTrue(merkleTreeService.verify(proof, digestFunction.digest(utf8("data4"))));
  }

  @Test
  void generateProof() throws RecordNotFoundException {
    final MembershipProof proof = merkleTreeService.generateProof(utf8("data2"));

    assertEquals(2, proof.size());
    assertEquals(1, counterValue("proofsGenerated"));
    assertEquals(1, meterRegistry.get(MetricsUtil.name(MerkleTreeService.class, "proofLength"))
        .summary().count());
    assertTrue(merkleTreeService.verify(proof, digestFunction.digest(utf8("data2"))));
    assertEquals(1, verificationCount(true));
  }

  @Test
  void generateProofRecordNotFound() {
    assertThrows(RecordNotFoundException.class, () -> merkleTreeService.generateProof(utf8("data4")));
    assertEquals(1, counterValue("proofsNotFound"));
    assertEquals(0, counterValue("proofsGenerated"));
  }

  @Test
  void verifyInvalidProof() throws RecordNotFoundException {
    final MembershipProof proof = merkleTreeService.generateProof(utf8("data1"));

    assertFalse(merkleTreeService.verify(proof, digestFunction.digest(utf8("data2"))));
    assertEquals(1, verificationCount(false));
    assertEquals(0, verificationCount(true));
  }

  @Test
  void emptyTree() {
    final MerkleTreeService emptyService = createService(List.of());

    assertEquals(0, emptyService.size());
    assertTrue(emptyService.getRootHash().isEmpty());
    assertFalse(emptyService.isReady());
    assertThrows(EmptyTreeException.class, () -> emptyService.generateProof(utf8("data1")));
    assertFalse(emptyService.verify(new MembershipProof(List.of()), digestFunction.digest(utf8("data1"))));

    emptyService.add(utf8("data1"));

    assertTrue(emptyService.isReady());
    assertTrue(emptyService.getRootHash().isPresent());
  }
}
