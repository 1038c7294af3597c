package com.example.chatpipeline.dispatch;

import com.example.chatpipeline.config.PipelineProperties;
import com.example.chatpipeline.feed.ChangeCaptureFeed;
import com.example.chatpipeline.feed.FeedBatch;
import com.example.chatpipeline.model.ChatEvent;
import com.example.chatpipeline.model.DeadLetterBatch;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Moves feed batches to the registered {@link StreamConsumer}s.
 *
 * Every (consumer, partition) pair has at most one drain task in flight, so a consumer sees the
 * batches of one channel strictly in order while different channels and different consumers
 * proceed in parallel on the worker pool. A failed batch is retried whole with exponential
 * backoff; once the attempt budget is spent it is dead-lettered and the cursor moves on. A batch
 * that is still failing when the dispatcher stops is neither dead-lettered nor committed, so it is
 * read again on the next start.
 */
@Service
public class StreamDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(StreamDispatcher.class);

    public enum State { RUNNING, HALTED, STOPPED }

    private final ChangeCaptureFeed feed;
    private final CursorStore cursors;
    private final DeadLetterSink deadLetters;
    private final Map<String, StreamConsumer> consumers = new LinkedHashMap<>();
    private final Map<String, Retry> retries = new HashMap<>();
    private final PipelineProperties.Dispatch settings;
    private final Clock clock;
    private final ExecutorService workers;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicInteger consecutiveOutages = new AtomicInteger();
    private volatile boolean halted;

    public StreamDispatcher(ChangeCaptureFeed feed, CursorStore cursors, DeadLetterSink deadLetters,
                            List<StreamConsumer> consumers, PipelineProperties properties, Clock clock) {
        this.feed = feed;
        this.cursors = cursors;
        this.deadLetters = deadLetters;
        this.settings = properties.dispatch();
        this.clock = clock;

        RetryConfig retryConfig = RetryConfig.<BatchResult>custom()
                .maxAttempts(settings.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.initialBackoffMs(), settings.backoffMultiplier(), settings.maxBackoffMs()))
                .retryOnResult(result -> result.isFailed() && running.get())
                .build();
        for (StreamConsumer consumer : consumers) {
            if (this.consumers.putIfAbsent(consumer.name(), consumer) != null) {
                throw new IllegalStateException("Duplicate stream consumer name: " + consumer.name());
            }
            retries.put(consumer.name(), Retry.of("dispatch-" + consumer.name(), retryConfig));
        }

        AtomicInteger threadCounter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(settings.workerThreads(), r -> {
            Thread t = new Thread(r, "stream-dispatch-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        logger.info("Stream dispatcher started with consumers {}", this.consumers.keySet());
    }

    @Scheduled(fixedDelayString = "${app.pipeline.dispatch.poll-interval-ms:500}",
            initialDelayString = "${app.pipeline.dispatch.initial-delay-ms:1000}")
    public void poll() {
        if (!running.get() || halted) {
            return;
        }
        List<String> partitions;
        try {
            partitions = feed.activePartitions();
        } catch (RuntimeException e) {
            recordOutage("partition discovery", e);
            return;
        }
        if (partitions.isEmpty()) {
            consecutiveOutages.set(0);
        }
        for (String partition : partitions) {
            for (StreamConsumer consumer : consumers.values()) {
                schedule(partition, consumer);
            }
        }
    }

    private void schedule(String partition, StreamConsumer consumer) {
        String key = consumer.name() + "|" + partition;
        if (!inFlight.add(key)) {
            return;
        }
        try {
            workers.execute(() -> {
                try {
                    drain(partition, consumer);
                    consecutiveOutages.set(0);
                } catch (RuntimeException e) {
                    recordOutage("draining " + partition + " for " + consumer.name(), e);
                } finally {
                    inFlight.remove(key);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(key);
            logger.debug("Worker pool closed, not scheduling {}", key);
        }
    }

    /**
     * Hand every available batch of one partition to one consumer, in order, committing the cursor
     * after each batch. Returns the number of batches handed over.
     */
    public int drain(String partition, StreamConsumer consumer) {
        int batches = 0;
        while (running.get()) {
            long position = cursors.position(consumer.name(), partition);
            FeedBatch batch = feed.read(consumer.name(), partition, position, settings.batchSize());
            if (batch.isEmpty()) {
                if (!batch.advances()) {
                    return batches;
                }
                // every record was past retention, more may follow
                cursors.commit(consumer.name(), partition, batch.nextPosition());
                continue;
            }
            if (!deliver(consumer, batch)) {
                logger.info("Dispatcher stopping, batch {}..{} of {} left uncommitted for {}",
                        batch.fromPosition() + 1, batch.nextPosition(), partition, consumer.name());
                return batches;
            }
            cursors.commit(consumer.name(), partition, batch.nextPosition());
            batches++;
        }
        return batches;
    }

    /**
     * @return false when the batch did not complete because the dispatcher is stopping
     */
    private boolean deliver(StreamConsumer consumer, FeedBatch batch) {
        AtomicInteger attempts = new AtomicInteger();
        Supplier<BatchResult> attempt = () -> {
            int n = attempts.incrementAndGet();
            if (n > 1) {
                logger.warn("Retrying batch {}..{} of {} for {} (attempt {}/{})", batch.fromPosition() + 1,
                        batch.nextPosition(), batch.partition(), consumer.name(), n, settings.maxAttempts());
            }
            return invoke(consumer, batch.events());
        };

        BatchResult result;
        try {
            result = Retry.decorateSupplier(retries.get(consumer.name()), attempt).get();
        } catch (RuntimeException e) {
            if (!running.get()) {
                return false;
            }
            throw e;
        }
        if (result.isFailed() && !running.get()) {
            return false;
        }
        if (result.isFailed()) {
            deadLetter(consumer, batch, attempts.get(), result);
        } else if (result.getStatus() == BatchResult.Status.PARTIAL) {
            logger.warn("Consumer {} partially handled batch up to ts {} of {}: {}",
                    consumer.name(), batch.nextPosition(), batch.partition(), result.getFailures());
        } else {
            logger.debug("Consumer {} handled {} events of {} up to ts {}",
                    consumer.name(), batch.events().size(), batch.partition(), batch.nextPosition());
        }
        return true;
    }

    private BatchResult invoke(StreamConsumer consumer, List<ChatEvent> events) {
        try {
            BatchResult result = consumer.handle(events);
            return result != null ? result : BatchResult.failed("Consumer returned no result");
        } catch (RuntimeException e) {
            logger.warn("Consumer {} threw on batch of {} events: {}", consumer.name(), events.size(), e.getMessage());
            return BatchResult.failed(e.getMessage(), e);
        }
    }

    private void deadLetter(StreamConsumer consumer, FeedBatch batch, int attempts, BatchResult result) {
        DeadLetterBatch deadLetter = DeadLetterBatch.builder()
                .id(UUID.randomUUID().toString())
                .consumer(consumer.name())
                .partition(batch.partition())
                .fromPosition(batch.events().get(0).getTs())
                .toPosition(batch.nextPosition())
                .attempts(attempts)
                .lastError(result.getMessage())
                .failedAt(clock.instant())
                .events(batch.events())
                .replayed(false)
                .build();
        deadLetters.record(deadLetter);
        logger.error("Batch {}..{} of {} dead-lettered for {} after {} attempts as {}: {}",
                deadLetter.getFromPosition(), deadLetter.getToPosition(), batch.partition(), consumer.name(),
                attempts, deadLetter.getId(), result.getMessage(), result.getCause());
    }

    private void recordOutage(String what, RuntimeException e) {
        int outages = consecutiveOutages.incrementAndGet();
        logger.error("Dispatcher outage while {} ({}/{})", what, outages, settings.maxConsecutiveOutages(), e);
        if (outages >= settings.maxConsecutiveOutages() && !halted) {
            halted = true;
            logger.error("Dispatcher halted after {} consecutive store or feed outages; resume required", outages);
        }
    }

    /**
     * Reprocess one dead-lettered batch with a single invocation of its consumer.
     *
     * @return empty when no dead letter has that id
     */
    public Optional<BatchResult> replay(String deadLetterId) {
        Optional<DeadLetterBatch> found = deadLetters.find(deadLetterId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        DeadLetterBatch deadLetter = found.get();
        if (deadLetter.isReplayed()) {
            return Optional.of(BatchResult.success(0, deadLetter.getEvents().size()));
        }
        StreamConsumer consumer = consumers.get(deadLetter.getConsumer());
        if (consumer == null) {
            throw new IllegalStateException("No consumer registered as " + deadLetter.getConsumer());
        }

        BatchResult result = invoke(consumer, deadLetter.getEvents());
        if (!result.isFailed()) {
            deadLetters.markReplayed(deadLetterId, clock.instant());
            logger.info("Dead letter {} replayed to {}", deadLetterId, consumer.name());
        } else {
            logger.warn("Replay of dead letter {} failed: {}", deadLetterId, result.getMessage());
        }
        return Optional.of(result);
    }

    public void resume() {
        consecutiveOutages.set(0);
        if (halted) {
            halted = false;
            logger.info("Dispatcher resumed");
        }
    }

    public State state() {
        if (!running.get()) {
            return State.STOPPED;
        }
        return halted ? State.HALTED : State.RUNNING;
    }

    public Map<String, Object> status() {
        Map<String, Object> status = new HashMap<>();
        status.put("state", state().name());
        status.put("consumers", new ArrayList<>(consumers.keySet()));
        status.put("inFlight", new ArrayList<>(inFlight));
        status.put("consecutiveOutages", consecutiveOutages.get());
        status.put("pendingDeadLetters", deadLetters.countPending());
        status.put("configuration", Map.of(
                "batchSize", settings.batchSize(),
                "maxAttempts", settings.maxAttempts(),
                "initialBackoffMs", settings.initialBackoffMs(),
                "backoffMultiplier", settings.backoffMultiplier(),
                "maxBackoffMs", settings.maxBackoffMs(),
                "workerThreads", settings.workerThreads()
        ));
        return status;
    }

    /**
     * Wait until no drain task is in flight.
     *
     * @return false if tasks were still running at the deadline
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!inFlight.isEmpty()) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            TimeUnit.MILLISECONDS.sleep(10);
        }
        return true;
    }

    /**
     * Stop pulling new batches. In-flight batches run to completion within the shutdown timeout;
     * workers still busy after that are interrupted and their batches stay uncommitted.
     */
    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(settings.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                logger.warn("In-flight batches did not finish within {}ms", settings.shutdownTimeoutMs());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        logger.info("Stream dispatcher stopped");
    }
}
