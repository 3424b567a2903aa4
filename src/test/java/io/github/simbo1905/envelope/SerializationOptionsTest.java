// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SerializationOptionsTest {

  @Test
  void defaultsEmbedAndValidateSchemaWithOptimalCompression() {
    final SerializationOptions options = SerializationOptions.defaults();
    assertTrue(options.includeSchema());
    assertTrue(options.validateSchema());
    assertEquals(CompressionLevel.OPTIMAL, options.compressionLevel());
    assertFalse(options.encrypt());
    assertNull(options.encryptionKey());
  }

  @Test
  void encryptionNeedsAKey() {
    assertThrows(IllegalArgumentException.class,
        () -> new SerializationOptions(false, false, CompressionLevel.NONE, true, null));
    assertThrows(IllegalArgumentException.class, () -> SerializationOptions.plain().withEncryption(""));
  }

  @Test
  void withersChangeOneSetting() {
    final SerializationOptions options = SerializationOptions.plain()
        .withIncludeSchema(true)
        .withCompression(CompressionLevel.FASTEST)
        .withEncryption("k");
    assertEquals(new SerializationOptions(true, false, CompressionLevel.FASTEST, true, "k"), options);
    assertEquals(new SerializationOptions(true, false, CompressionLevel.FASTEST, false, null), options.withoutEncryption());
  }

  @Test
  void toStringMasksTheKey() {
    final String text = SerializationOptions.plain().withEncryption("hunter2").toString();
    assertFalse(text.contains("hunter2"), text);
    assertTrue(text.contains("encrypt=true"), text);
  }

  @Test
  void flagsFollowOptions() {
    assertEquals(new Flags(true, true, false), Flags.from(SerializationOptions.defaults()));
    assertEquals(new Flags(false, false, false), Flags.from(SerializationOptions.plain()));
  }
}
