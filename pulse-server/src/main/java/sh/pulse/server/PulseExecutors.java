// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pulse.server;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory methods for the executors the push server runs stream delivery on.
 *
 * <p>
 * Delivery work is short and CPU-bound (encode a batch, hand it to Netty), so
 * a bounded pool of platform threads is used rather than a thread per stream.
 *
 * <pre>{@code
 * ExecutorService delivery = PulseExecutors.newDeliveryExecutor(4);
 * PushServerConfig config = PushServerConfig.builder()
 *         .deliveryExecutor(delivery)
 *         .build();
 * }</pre>
 *
 * @since 0.1.0
 */
public final class PulseExecutors {

    /**
     * Counter for unique delivery thread names.
     */
    private static final AtomicInteger DELIVERY_THREAD_ID = new AtomicInteger(0);

    private PulseExecutors() {
        // Utility class
    }

    /**
     * Creates a delivery executor sized to the number of available processors.
     *
     * @return a fixed-size thread pool with daemon platform threads
     */
    public static ExecutorService newDeliveryExecutor() {
        return newDeliveryExecutor(Runtime.getRuntime().availableProcessors());
    }

    /**
     * Creates a delivery executor with a custom number of threads. Threads are
     * daemons named {@code pulse-delivery-N}.
     *
     * @param threads the number of threads in the pool
     * @return a fixed-size thread pool with daemon platform threads
     * @throws IllegalArgumentException if threads is less than 1
     */
    public static ExecutorService newDeliveryExecutor(final int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got: " + threads);
        }
        return Executors.newFixedThreadPool(threads, r -> {
            // Mask off sign bit to ensure non-negative thread IDs even after integer overflow
            int id = DELIVERY_THREAD_ID.getAndIncrement() & 0x7FFFFFFF;
            Thread t = new Thread(r, "pulse-delivery-" + id);
            t.setDaemon(true);
            return t;
        });
    }
}
