// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static io.github.simbo1905.envelope.EnvelopeCodec.LOGGER;

/// A bounded concurrent free list of reusable scratch objects. A borrowed instance is exclusively owned by the
/// caller until it is released. Released instances are reset by the policy; a policy that answers false drops the
/// instance rather than pooling it.
final class ScratchPool<T> {

  static final String POOL_SIZE_PROPERTY = "io.github.simbo1905.envelope.poolSize";
  static final String INITIAL_BUFFER_SIZE_PROPERTY = "io.github.simbo1905.envelope.initialBufferSize";

  static final int POOL_SIZE = Integer.getInteger(POOL_SIZE_PROPERTY, 16);
  static final int INITIAL_BUFFER_SIZE = Integer.getInteger(INITIAL_BUFFER_SIZE_PROPERTY, 8192);
  /// Larger buffers are handed back to the garbage collector rather than pinned in the pool
  static final int MAX_RETAINED_BUFFER_SIZE = 1 << 20;

  static final ScratchPool<WriteBuffer> WRITE_BUFFERS = new ScratchPool<>(
      POOL_SIZE,
      () -> new WriteBuffer(INITIAL_BUFFER_SIZE),
      buffer -> buffer.reset(MAX_RETAINED_BUFFER_SIZE));

  static final ScratchPool<byte[]> COPY_BUFFERS = new ScratchPool<>(
      POOL_SIZE,
      () -> new byte[INITIAL_BUFFER_SIZE],
      bytes -> true);

  private final ConcurrentLinkedQueue<T> free = new ConcurrentLinkedQueue<>();
  private final AtomicInteger pooled = new AtomicInteger();
  private final int capacity;
  private final Supplier<T> factory;
  private final Predicate<T> resetPolicy;

  ScratchPool(int capacity, Supplier<T> factory, Predicate<T> resetPolicy) {
    if (capacity < 0) {
      throw new IllegalArgumentException("capacity must not be negative: " + capacity);
    }
    this.capacity = capacity;
    this.factory = Objects.requireNonNull(factory);
    this.resetPolicy = Objects.requireNonNull(resetPolicy);
  }

  T borrow() {
    final T instance = free.poll();
    if (instance == null) {
      return factory.get();
    }
    pooled.decrementAndGet();
    return instance;
  }

  void release(T instance) {
    if (instance == null || !resetPolicy.test(instance)) {
      return;
    }
    if (pooled.incrementAndGet() > capacity) {
      pooled.decrementAndGet();
      LOGGER.finer(() -> "ScratchPool full at " + capacity + ", dropping instance");
      return;
    }
    free.offer(instance);
  }

  int pooled() {
    return pooled.get();
  }
}
