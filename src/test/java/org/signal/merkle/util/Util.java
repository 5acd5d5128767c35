/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.merkle.util;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.List;
import java.util.stream.IntStream;

public class Util {

  public static byte[] generateRandomBytes(final int length) {
    final byte[] bytes = new byte[length];
    new SecureRandom().nextBytes(bytes);
    return bytes;
  }

  /**
   * @return a copy of {@code bytes} with the lowest bit of the byte at {@code index} flipped
   */
  public static byte[] flipBit(final byte[] bytes, final int index) {
    final byte[] flipped = bytes.clone();
    flipped[index] ^= 0x01;
    return flipped;
  }

  public static byte[] utf8(final String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  /**
   * @return the records {@code record-0, record-1, ...} encoded as UTF-8
   */
  public static List<byte[]> generateRecords(final int count) {
    return IntStream.range(0, count)
        .mapToObj(i -> utf8("record-" + i))
        .toList();
  }
}
