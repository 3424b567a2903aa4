// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

/// Compression or encryption could not be applied or undone, typically a wrong key or options that do not match encode
public final class TransformException extends EnvelopeException {

  public TransformException(String message) {
    super(message);
  }

  public TransformException(String message, Throwable cause) {
    super(message, cause);
  }
}
