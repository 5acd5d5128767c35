/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.merkle;

/**
 * Indicates that a membership proof was requested for a record that is not stored in the tree.
 */
public class RecordNotFoundException extends Exception {

  RecordNotFoundException(final String message) {
    super(message);
  }
}
