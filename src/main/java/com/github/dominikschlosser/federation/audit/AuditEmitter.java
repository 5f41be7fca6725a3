package com.github.dominikschlosser.federation.audit;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.jboss.logging.Logger;

/**
 * Fire-and-forget delivery of audit records to an {@link AuditSink}.
 *
 * <p>{@link #record} only enqueues and never throws. A single dispatcher thread delivers records in
 * submission order, so records of one trace id arrive in the order they were produced. Each
 * delivery is bounded by {@code deliveryTimeout}; failures and timeouts are logged here and go no
 * further. A delivery thread stuck past its timeout is abandoned and replaced, so one hanging sink
 * call cannot hold back the records queued behind it.
 *
 * <p>At most {@code queueCapacity} records wait for delivery. Records beyond that are dropped with a
 * warning.
 */
public class AuditEmitter implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(AuditEmitter.class);

    public static final int DEFAULT_QUEUE_CAPACITY = 10_000;

    private static final AtomicInteger INSTANCES = new AtomicInteger();

    private final AuditSink sink;
    private final Duration deliveryTimeout;
    private final Clock clock;
    private final ExecutorService dispatcher;
    private final String deliveryThreadPrefix;
    private final AtomicInteger deliveryThreads = new AtomicInteger();
    private volatile ExecutorService delivery;

    public AuditEmitter(AuditSink sink, Duration deliveryTimeout) {
        this(sink, deliveryTimeout, Clock.systemUTC());
    }

    public AuditEmitter(AuditSink sink, Duration deliveryTimeout, Clock clock) {
        this(sink, deliveryTimeout, clock, DEFAULT_QUEUE_CAPACITY);
    }

    public AuditEmitter(AuditSink sink, Duration deliveryTimeout, Clock clock, int queueCapacity) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
        this.sink = Objects.requireNonNull(sink, "sink");
        this.deliveryTimeout = Objects.requireNonNull(deliveryTimeout, "deliveryTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
        int instance = INSTANCES.incrementAndGet();
        this.dispatcher = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(queueCapacity), daemon("audit-dispatcher-" + instance));
        this.deliveryThreadPrefix = "audit-delivery-" + instance + "-";
        this.delivery = newDeliveryExecutor();
    }

    public void record(
            String traceId,
            String providerId,
            AuditEventType eventType,
            AuditOutcome outcome,
            String subject,
            Map<String, String> details) {
        record(new AuditRecord(traceId, providerId, eventType, outcome, subject, clock.instant(), details));
    }

    public void record(AuditRecord record) {
        try {
            dispatcher.execute(() -> deliver(record));
        } catch (RejectedExecutionException e) {
            if (dispatcher.isShutdown()) {
                logger.warnf("Audit emitter is closed, dropping record trace=%s outcome=%s",
                        record.getTraceId(), record.getOutcome());
            } else {
                logger.errorf("Audit queue is full, dropping record trace=%s event=%s outcome=%s",
                        record.getTraceId(), record.getEventType().getValue(), record.getOutcome());
            }
        }
    }

    /**
     * Waits until every record submitted so far has been handed to the sink, or timed out.
     *
     * @return {@code false} if the wait itself timed out
     */
    public boolean flush(Duration timeout) {
        try {
            CompletableFuture.runAsync(() -> {}, dispatcher).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException | ExecutionException | RejectedExecutionException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void deliver(AuditRecord record) {
        ExecutorService current = delivery;
        Future<?> pending;
        try {
            pending = current.submit(() -> {
                sink.append(record);
                return null;
            });
        } catch (RejectedExecutionException e) {
            logger.warnf("Audit emitter is closing, dropping record trace=%s outcome=%s",
                    record.getTraceId(), record.getOutcome());
            return;
        }
        try {
            pending.get(deliveryTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            replaceStuckDelivery(current);
            logger.errorf("Audit delivery timed out after %s: trace=%s event=%s outcome=%s",
                    deliveryTimeout, record.getTraceId(), record.getEventType().getValue(), record.getOutcome());
        } catch (ExecutionException e) {
            logger.errorf(e.getCause(), "Audit delivery failed: trace=%s event=%s outcome=%s",
                    record.getTraceId(), record.getEventType().getValue(), record.getOutcome());
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
        }
    }

    // The sink call may ignore the interrupt; later records must not queue behind it.
    private void replaceStuckDelivery(ExecutorService stuck) {
        delivery = newDeliveryExecutor();
        stuck.shutdownNow();
    }

    private ExecutorService newDeliveryExecutor() {
        return Executors.newSingleThreadExecutor(
                daemon(deliveryThreadPrefix + deliveryThreads.incrementAndGet()));
    }

    @Override
    public void close() {
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(deliveryTimeout.toMillis() * 2 + 1000, TimeUnit.MILLISECONDS)) {
                logger.warn("Audit dispatcher did not drain before close");
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            delivery.shutdownNow();
        }
    }

    private static ThreadFactory daemon(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }
}
