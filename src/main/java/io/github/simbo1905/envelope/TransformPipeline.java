// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import java.util.ArrayList;
import java.util.List;

import static io.github.simbo1905.envelope.EnvelopeCodec.LOGGER;

/// Compression then encryption on the way out, decryption then decompression on the way in.
/// The stages are chosen from the caller's options only, never from the envelope header.
final class TransformPipeline {

  private final List<TransformStage> stages;
  private final boolean compressing;
  private final boolean encrypting;

  TransformPipeline(List<TransformStage> stages, boolean compressing, boolean encrypting) {
    this.stages = List.copyOf(stages);
    this.compressing = compressing;
    this.encrypting = encrypting;
  }

  static TransformPipeline of(SerializationOptions options) {
    final List<TransformStage> stages = new ArrayList<>(2);
    if (options.compressionLevel().enabled()) {
      stages.add(new CompressionStage(options.compressionLevel()));
    }
    if (options.encrypt()) {
      stages.add(new EncryptionStage(options.encryptionKey()));
    }
    return new TransformPipeline(stages, options.compressionLevel().enabled(), options.encrypt());
  }

  List<TransformStage> stages() {
    return stages;
  }

  byte[] encode(byte[] envelope) {
    byte[] bytes = envelope;
    for (TransformStage stage : stages) {
      bytes = stage.apply(bytes);
    }
    return bytes;
  }

  /// Undo the stages in reverse order. Output that lacks the magic and whose header does not carry the version
  /// and the transform bits of these options was produced with other options, and is reported here rather than as
  /// a framing error. An envelope whose magic alone is damaged still carries them, and is left for the codec to
  /// reject as a framing error. A buffer too short for a header with no stage run is left for the codec to report
  /// as a truncation.
  byte[] decode(byte[] input) {
    byte[] bytes = input;
    for (int i = stages.size() - 1; i >= 0; i--) {
      final TransformStage stage = stages.get(i);
      final byte[] before = bytes;
      bytes = stage.invert(bytes);
      LOGGER.finer(() -> "Inverted " + stage.name() + " on " + before.length + " bytes");
    }
    if (startsWithMagic(bytes)) {
      return bytes;
    }
    if (!compressing && CompressionStage.looksCompressed(bytes)) {
      throw new TransformException("Buffer is GZIP compressed but the decode options do not enable compression");
    }
    if (stages.isEmpty() && bytes.length < Constants.HEADER_SIZE) {
      return bytes;
    }
    if (!hasEnvelopeHeaderAfterMagic(bytes)) {
      throw new TransformException((stages.isEmpty() ? "Buffer" : "Output of " +
          stages.stream().map(TransformStage::name).toList()) +
          " is not an envelope, decode options do not match the ones used to encode");
    }
    return bytes;
  }

  private boolean hasEnvelopeHeaderAfterMagic(byte[] bytes) {
    if (bytes.length < Constants.HEADER_SIZE) {
      return false;
    }
    final int versionAt = Constants.MAGIC.sizeInBytes;
    final byte bits = bytes[versionAt + Constants.VERSION.sizeInBytes];
    final Flags flags = Flags.fromByte(bits);
    return bytes[versionAt] == Constants.CURRENT_VERSION
        && Flags.onlyKnownBits(bits)
        && flags.wasCompressed() == compressing
        && flags.wasEncrypted() == encrypting;
  }

  static boolean startsWithMagic(byte[] bytes) {
    final byte[] magic = Constants.MAGIC_BYTES;
    if (bytes.length < magic.length) {
      return false;
    }
    for (int i = 0; i < magic.length; i++) {
      if (bytes[i] != magic[i]) {
        return false;
      }
    }
    return true;
  }
}
