/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.merkle;

import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.inject.Singleton;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.signal.merkle.metrics.MetricsUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns a single {@link MerkleTree} and serializes all access to it, so that records can be appended and proofs
 * generated from multiple threads. The tree is built from the configured initial records at startup.
 */
@Singleton
public class MerkleTreeService {

  private static final Logger logger = LoggerFactory.getLogger(MerkleTreeService.class);
  private static final String VALID_TAG_NAME = "valid";
  private final MerkleTreeConfiguration configuration;
  private final DigestFunction digestFunction;
  private final MerkleProofVerifier verifier;
  private final ReentrantLock treeLock;
  private final Counter recordsAddedCounter;
  private final Counter proofsGeneratedCounter;
  private final Counter proofsNotFoundCounter;
  private final Counter validVerificationCounter;
  private final Counter invalidVerificationCounter;
  private final Timer rebuildTimer;
  private final DistributionSummary proofLengthDistributionSummary;
  private MerkleTree merkleTree;

  public MerkleTreeService(final MerkleTreeConfiguration configuration,
      final DigestFunction digestFunction,
      final MeterRegistry meterRegistry) {
    this.configuration = configuration;
    this.digestFunction = digestFunction;
    this.verifier = new MerkleProofVerifier(digestFunction);
    this.treeLock = new ReentrantLock();
    this.recordsAddedCounter = meterRegistry.counter(MetricsUtil.name(MerkleTreeService.class, "recordsAdded"));
    this.proofsGeneratedCounter = meterRegistry.counter(MetricsUtil.name(MerkleTreeService.class, "proofsGenerated"));
    this.proofsNotFoundCounter = meterRegistry.counter(MetricsUtil.name(MerkleTreeService.class, "proofsNotFound"));
    this.validVerificationCounter = meterRegistry.counter(MetricsUtil.name(MerkleTreeService.class, "verifications"),
        VALID_TAG_NAME, "true");
    this.invalidVerificationCounter = meterRegistry.counter(MetricsUtil.name(MerkleTreeService.class, "verifications"),
        VALID_TAG_NAME, "false");
    this.rebuildTimer = meterRegistry.timer(MetricsUtil.name(MerkleTreeService.class, "rebuild"));
    this.proofLengthDistributionSummary = DistributionSummary
        .builder(MetricsUtil.name(MerkleTreeService.class, "proofLength"))
        .distributionStatisticExpiry(Duration.ofHours(2))
        .register(meterRegistry);
  }

  @PostConstruct
  @VisibleForTesting
  void loadInitialRecords() {
    treeLock.lock();

    try {
      final List<byte[]> initialRecords = configuration.initialRecords().stream()
          .map(record -> record.getBytes(StandardCharsets.UTF_8))
          .toList();

      merkleTree = rebuildTimer.record(() -> new MerkleTree(digestFunction, initialRecords));

      if (merkleTree.isEmpty()) {
        logger.info("Started with an empty Merkle tree");
      } else {
        logger.info("Built Merkle tree from {} initial records with root hash {}", merkleTree.size(),
            HexFormat.of().formatHex(merkleTree.getRootHash()));
      }
    } finally {
      treeLock.unlock();
    }
  }

  /**
   * Appends a record and rebuilds the tree.
   *
   * @param record the record to append
   */
  public void add(final byte[] record) {
    treeLock.lock();

    try {
      rebuildTimer.record(() -> merkleTree.add(record));
      recordsAddedCounter.increment();

      logger.debug("Added record {}; root hash is now {}", merkleTree.size() - 1,
          HexFormat.of().formatHex(merkleTree.getRootHash()));
    } finally {
      treeLock.unlock();
    }
  }

  /**
   * @return the current root hash, or empty if no records have been added yet
   */
  public Optional<byte[]> getRootHash() {
    treeLock.lock();

    try {
      return merkleTree.isEmpty() ? Optional.empty() : Optional.of(merkleTree.getRootHash());
    } finally {
      treeLock.unlock();
    }
  }

  public int size() {
    treeLock.lock();

    try {
      return merkleTree.size();
    } finally {
      treeLock.unlock();
    }
  }

  /**
   * @param record the record for which to generate a proof
   * @return a membership proof against the current root hash
   * @throws EmptyTreeException      if no records have been added yet
   * @throws RecordNotFoundException if the record is not in the tree
   */
  public MembershipProof generateProof(final byte[] record) throws RecordNotFoundException {
    treeLock.lock();

    try {
      final MembershipProof proof = merkleTree.generateProof(record);
      proofsGeneratedCounter.increment();
      proofLengthDistributionSummary.record(proof.size());

      return proof;
    } catch (final RecordNotFoundException e) {
      proofsNotFoundCounter.increment();
      logger.warn("Requested a proof for a record that is not in the tree");
      throw e;
    } finally {
      treeLock.unlock();
    }
  }

  /**
   * Verifies a proof against the current root hash.
   *
   * @param proof           the membership proof
   * @param candidateDigest the leaf digest of the record whose membership is being checked
   * @return whether the proof is valid for the candidate against the current root hash
   */
  public boolean verify(final MembershipProof proof, final byte[] candidateDigest) {
    final boolean valid = getRootHash()
        .map(rootHash -> verifier.verify(proof, candidateDigest, rootHash))
        .orElse(false);

    if (valid) {
      validVerificationCounter.increment();
    } else {
      invalidVerificationCounter.increment();
      logger.warn("Membership proof did not verify against the current root hash");
    }

    return valid;
  }

  public boolean isHealthy() {
    return digestFunction.digest(new byte[0]).length == digestFunction.getDigestLength();
  }

  public String getDigestAlgorithm() {
    return configuration.digestAlgorithm();
  }

  public boolean isReady() {
    treeLock.lock();

    try {
      return merkleTree != null && !merkleTree.isEmpty();
    } finally {
      treeLock.unlock();
    }
  }
}
