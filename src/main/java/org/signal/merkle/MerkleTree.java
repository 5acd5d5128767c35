/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.merkle;

import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A binary Merkle tree over an ordered list of byte-string records.
 * <p>
 * Level 0 holds the digest of every record in insertion order. Each higher level is built by hashing consecutive
 * pairs of digests from the level below; if a level has an odd number of digests, the last one is paired with itself.
 * The leaf level is always hashed at least once, so even a tree with a single record has a root of the form
 * {@code H(H(record) || H(record))}. Above the leaves, levels are built until exactly one digest, the root, remains.
 * <p>
 * All levels are stored so that membership proofs can be generated for any record. Appending a record rebuilds every
 * level from the leaves up.
 * <p>
 * Instances are not thread-safe; callers that share a tree between threads must provide their own locking.
 */
public class MerkleTree {

  private final DigestFunction digestFunction;
  private final List<byte[]> records;
  private List<List<byte[]>> levels;

  public MerkleTree(final DigestFunction digestFunction) {
    this(digestFunction, Collections.emptyList());
  }

  /**
   * @param digestFunction the digest function used for leaves and intermediate nodes
   * @param records        the initial records, in order; each record is copied
   */
  public MerkleTree(final DigestFunction digestFunction, final Collection<byte[]> records) {
    this.digestFunction = Objects.requireNonNull(digestFunction, "digestFunction");
    this.records = new ArrayList<>(records.size());

    for (final byte[] record : records) {
      this.records.add(Objects.requireNonNull(record, "record").clone());
    }

    this.levels = buildLevels(this.records, digestFunction);
  }

  /**
   * Appends a record to the tree and rebuilds all levels. Membership proofs generated before this call are stale
   * afterward.
   *
   * @param record the record to append; the tree stores a copy
   */
  public void add(final byte[] record) {
    records.add(Objects.requireNonNull(record, "record").clone());
    levels = buildLevels(records, digestFunction);
  }

  /**
   * @return the root hash of the tree
   * @throws EmptyTreeException if the tree does not contain any records
   */
  public byte[] getRootHash() {
    if (isEmpty()) {
      throw new EmptyTreeException("Cannot return root hash of an empty Merkle tree");
    }

    return levels.get(levels.size() - 1).get(0).clone();
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }

  /**
   * @return the number of records in the tree
   */
  public int size() {
    return records.size();
  }

  /**
   * @param record the record to look for
   * @return whether a record with exactly the same bytes is stored in the tree
   */
  public boolean contains(final byte[] record) {
    return indexOf(record) >= 0;
  }

  /**
   * Computes the leaf digest of a record with this tree's digest function. Callers use it to derive the candidate
   * digest passed to {@link #verify(MembershipProof, byte[])} or {@link MerkleProofVerifier#verify}.
   *
   * @param record the record to hash
   * @return the leaf digest of the record
   */
  public byte[] hashRecord(final byte[] record) {
    return digestFunction.digest(record);
  }

  /**
   * Generates a proof that the given record is a member of this tree. If the record was added more than once, the
   * proof is for its first occurrence.
   * <p>
   * Starting from the record's leaf, the proof contains the sibling of the current node at every level below the
   * root, together with the side on which the sibling is hashed. A node without a sibling is its own sibling, which
   * mirrors how the level was built.
   *
   * @param record the record for which to generate a proof
   * @return a membership proof for the record against the current root
   * @throws EmptyTreeException      if the tree does not contain any records
   * @throws RecordNotFoundException if no stored record is equal to the given record
   */
  public MembershipProof generateProof(final byte[] record) throws RecordNotFoundException {
    if (isEmpty()) {
      throw new EmptyTreeException("Cannot generate a proof from an empty Merkle tree");
    }

    int currentIndex = indexOf(record);

    if (currentIndex < 0) {
      throw new RecordNotFoundException("Record is not present in the Merkle tree");
    }

    final List<ProofNode> proofNodes = new ArrayList<>(levels.size() - 1);

    // the root level has no siblings
    for (final List<byte[]> level : levels.subList(0, levels.size() - 1)) {
      final int siblingIndex = getSiblingIndex(currentIndex, level.size());
      proofNodes.add(new ProofNode(level.get(siblingIndex), getSiblingSide(currentIndex)));

      // the parent of nodes 2k and 2k + 1 is node k of the next level
      currentIndex /= 2;
    }

    return new MembershipProof(proofNodes);
  }

  /**
   * Verifies a proof against the current root of this tree. Never throws; an empty tree verifies nothing.
   *
   * @param proof           the membership proof
   * @param candidateDigest the leaf digest of the record whose membership is being checked
   * @return {@code true} if the proof and candidate reproduce this tree's current root hash
   */
  public boolean verify(final MembershipProof proof, final byte[] candidateDigest) {
    if (isEmpty()) {
      return false;
    }

    return new MerkleProofVerifier(digestFunction).verify(proof, candidateDigest, getRootHash());
  }

  private int indexOf(final byte[] record) {
    Objects.requireNonNull(record, "record");

    for (int i = 0; i < records.size(); i++) {
      if (Arrays.equals(records.get(i), record)) {
        return i;
      }
    }

    return -1;
  }

  @VisibleForTesting
  List<List<byte[]>> getLevels() {
    return levels;
  }

  /**
   * Builds every level of the tree, from the leaves to the root.
   *
   * @param records        the records in insertion order
   * @param digestFunction the digest function for leaves and intermediate nodes
   * @return all levels of the tree, or an empty list if there are no records
   */
  @VisibleForTesting
  static List<List<byte[]>> buildLevels(final List<byte[]> records, final DigestFunction digestFunction) {
    if (records.isEmpty()) {
      return Collections.emptyList();
    }

    final List<List<byte[]>> levels = new ArrayList<>();
    List<byte[]> currentLevel = buildLeafLevel(records, digestFunction);
    levels.add(currentLevel);

    // A lone leaf is still paired with itself, so the loop body runs at least once
    do {
      currentLevel = buildParentLevel(currentLevel, digestFunction);
      levels.add(currentLevel);
    } while (currentLevel.size() > 1);

    return Collections.unmodifiableList(levels);
  }

  /**
   * @param records        the records in insertion order
   * @param digestFunction the digest function to apply to each record
   * @return the digest of each record, in the same order
   */
  @VisibleForTesting
  static List<byte[]> buildLeafLevel(final List<byte[]> records, final DigestFunction digestFunction) {
    return records.stream()
        .map(digestFunction::digest)
        .toList();
  }

  /**
   * Builds the next level up from the given level. The parent of digests {@code 2k} and {@code 2k + 1} is
   * {@code H(d[2k] || d[2k + 1])}. If the level has an odd number of digests, the last digest is paired with itself.
   *
   * @param level          a non-empty level of digests
   * @param digestFunction the digest function for intermediate nodes
   * @return the parent level, with {@code ceil(level.size() / 2)} digests
   * @throws IllegalArgumentException if the given level is empty
   */
  @VisibleForTesting
  static List<byte[]> buildParentLevel(final List<byte[]> level, final DigestFunction digestFunction) {
    if (level.isEmpty()) {
      throw new IllegalArgumentException("Cannot build the parent of an empty level");
    }

    final List<byte[]> parentLevel = new ArrayList<>((level.size() + 1) / 2);

    for (int i = 0; i < level.size(); i += 2) {
      final byte[] left = level.get(i);
      final byte[] right = level.get(getSiblingIndex(i, level.size()));
      parentLevel.add(digestFunction.digest(left, right));
    }

    return Collections.unmodifiableList(parentLevel);
  }

  /**
   * Returns the index of the node paired with the given node when building the next level. Even-indexed nodes pair
   * with their right neighbor, odd-indexed nodes with their left neighbor, and the last node of an odd-sized level
   * pairs with itself.
   *
   * @param index     the index of a node within its level
   * @param levelSize the number of nodes in the level
   * @return the index of the node's sibling within the same level
   * @throws IllegalArgumentException if the index is negative or not within the level
   */
  @VisibleForTesting
  static int getSiblingIndex(final int index, final int levelSize) {
    if (index < 0) {
      throw new IllegalArgumentException("Node index must be non-negative");
    } else if (index >= levelSize) {
      throw new IllegalArgumentException("The given node does not exist in the level");
    }

    if (index % 2 == 1) {
      return index - 1;
    }

    return index + 1 < levelSize ? index + 1 : index;
  }

  /**
   * @param index the index of a node within its level
   * @return the side on which the node's sibling is hashed
   * @throws IllegalArgumentException if the index is negative
   */
  @VisibleForTesting
  static Side getSiblingSide(final int index) {
    if (index < 0) {
      throw new IllegalArgumentException("Node index must be non-negative");
    }

    return index % 2 == 0 ? Side.RIGHT : Side.LEFT;
  }
}
