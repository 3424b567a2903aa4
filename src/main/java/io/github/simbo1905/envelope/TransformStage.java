// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

/// A reversible whole-buffer byte transform wrapped around a finished envelope. Stages know nothing about the
/// envelope layout. Failures of either direction are reported as TransformException.
public interface TransformStage {

  String name();

  byte[] apply(byte[] input);

  byte[] invert(byte[] input);
}
