/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.merkle;

/**
 * The position of a sibling digest relative to the node being hashed when computing their parent.
 */
public enum Side {
  /**
   * The sibling is hashed first: {@code H(sibling || node)}.
   */
  LEFT,
  /**
   * The sibling is hashed second: {@code H(node || sibling)}.
   */
  RIGHT;

  Side opposite() {
    return this == LEFT ? RIGHT : LEFT;
  }
}
