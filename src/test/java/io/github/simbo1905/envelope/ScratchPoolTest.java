// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static io.github.simbo1905.envelope.EnvelopeCodec.LOGGER;
import static org.junit.jupiter.api.Assertions.*;

/// Scratch buffer pooling and concurrent use of a shared codec
class ScratchPoolTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @Test
  void releasedInstanceIsReused() {
    final ScratchPool<StringBuilder> pool = new ScratchPool<>(2, StringBuilder::new, sb -> {
      sb.setLength(0);
      return true;
    });
    final StringBuilder first = pool.borrow();
    first.append("dirty");
    pool.release(first);
    assertEquals(1, pool.pooled());

    final StringBuilder again = pool.borrow();
    assertSame(first, again);
    assertEquals(0, again.length());
    assertEquals(0, pool.pooled());
  }

  @Test
  void poolNeverHoldsMoreThanCapacity() {
    final ScratchPool<Object> pool = new ScratchPool<>(2, Object::new, o -> true);
    for (int i = 0; i < 5; i++) {
      pool.release(new Object());
    }
    assertEquals(2, pool.pooled());
  }

  @Test
  void resetPolicyCanDropInstances() {
    final ScratchPool<WriteBuffer> pool = new ScratchPool<>(4, () -> new WriteBuffer(64), b -> b.reset(128));
    final WriteBuffer grown = pool.borrow();
    grown.putBytes(new byte[1024]);
    pool.release(grown);
    assertEquals(0, pool.pooled());

    final WriteBuffer small = pool.borrow();
    small.putInt(1);
    pool.release(small);
    assertEquals(1, pool.pooled());
    assertEquals(0, pool.borrow().position());
  }

  @Test
  void negativeCapacityIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new ScratchPool<>(-1, Object::new, o -> true));
  }

  @Test
  void concurrentBorrowersNeverShareAnInstance() throws Exception {
    final int capacity = 4;
    final ScratchPool<AtomicInteger> pool = new ScratchPool<>(capacity, AtomicInteger::new, o -> true);
    final ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      final List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < 8; t++) {
        futures.add(executor.submit(() -> {
          for (int i = 0; i < 2_000; i++) {
            final AtomicInteger owned = pool.borrow();
            assertEquals(1, owned.incrementAndGet(), "instance handed to two borrowers");
            owned.decrementAndGet();
            pool.release(owned);
          }
        }));
      }
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }
    assertTrue(pool.pooled() <= capacity);
  }

  @Test
  void sharedCodecIsThreadSafe() throws Exception {
    final EnvelopeCodec codec = EnvelopeCodec.create();
    final SerializationOptions options = SerializationOptions.defaults().withEncryption("shared");
    final ExecutorService executor = Executors.newFixedThreadPool(6);
    try {
      final List<Future<Integer>> futures = new ArrayList<>();
      for (int t = 0; t < 6; t++) {
        final int thread = t;
        futures.add(executor.submit(() -> {
          for (int i = 0; i < 20; i++) {
            final Value.ObjectValue fields = new Value.ObjectValue(Map.of(
                "thread", new Value.Int32(thread),
                "i", new Value.Int32(i),
                "text", new Value.StringValue("x".repeat(i * 100))));
            assertEquals(fields, codec.decode(codec.encode(fields, options), options));
          }
          return thread;
        }));
      }
      for (Future<Integer> future : futures) {
        final int done = future.get(60, TimeUnit.SECONDS);
        LOGGER.fine(() -> "thread " + done + " finished");
      }
    } finally {
      executor.shutdownNow();
    }
    assertTrue(ScratchPool.WRITE_BUFFERS.pooled() <= ScratchPool.POOL_SIZE);
  }
}
