// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

/// Root of every failure the codec reports. None of them are retried internally and there is no partial result.
public abstract sealed class EnvelopeException extends RuntimeException
    permits FramingException, TruncationException, SchemaValidationException, TransformException {

  EnvelopeException(String message) {
    super(message);
  }

  EnvelopeException(String message, Throwable cause) {
    super(message, cause);
  }
}
