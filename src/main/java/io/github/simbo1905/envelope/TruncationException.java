// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

/// The buffer ended in the middle of a structure, or a length prefix cannot be satisfied
public final class TruncationException extends EnvelopeException {

  public TruncationException(String message) {
    super(message);
  }
}
