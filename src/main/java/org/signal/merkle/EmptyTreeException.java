/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.merkle;

/**
 * Indicates that an operation needed the root of a tree that does not hold any records yet.
 */
public class EmptyTreeException extends IllegalStateException {

  EmptyTreeException(final String message) {
    super(message);
  }
}
