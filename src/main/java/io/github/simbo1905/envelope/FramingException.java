// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

/// Bad magic number, unsupported version, an unknown value tag or text that is not UTF-8
public final class FramingException extends EnvelopeException {

  public FramingException(String message) {
    super(message);
  }

  public FramingException(String message, Throwable cause) {
    super(message, cause);
  }
}
