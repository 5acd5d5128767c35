/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.merkle.metrics;

public class MetricsUtil {

  public static final String PREFIX = "merkle";

  /**
   * Returns a dot-separated ('.') name for the given class and name parts
   */
  public static String name(final Class<?> clazz, final String... parts) {
    return name(clazz.getSimpleName(), parts);
  }

  private static String name(final String name, final String... parts) {
    final StringBuilder sb = new StringBuilder(PREFIX);
    sb.append(".").append(name);
    for (final String part : parts) {
      sb.append(".").append(part);
    }
    return sb.toString();
  }
}
