package com.raidwatch.app;

import com.raidwatch.core.model.Sighting;
import com.raidwatch.core.source.SightingSource;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link SightingSource} backed by a Kafka topic of JSON sightings.
 *
 * <p>
 * Each {@link #next()} call returns the next decoded sighting, polling the
 * consumer until one arrives. A polled batch is buffered and handed out one
 * sighting at a time; malformed records are skipped. Client-side
 * {@link KafkaException}s surface as {@link IOException}, which the
 * aggregator treats as a transient read failure.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * {@link #next()} is called from a single thread. {@link #close()} may be
 * called from any thread: it wakes a blocked poll and the consumer is closed
 * by whichever thread releases it last.
 * </p>
 *
 * @since 1.0.0
 */
public final class KafkaSightingSource implements SightingSource {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaSightingSource.class);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final Consumer<String, byte[]> consumer;
    private final SightingDeserializer deserializer;
    private final Duration pollTimeout;
    private final Deque<Sighting> buffered = new ArrayDeque<>();
    private final ReentrantLock pollLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private boolean consumerClosed;

    /**
     * Create a source that subscribes to the configured sightings topic.
     *
     * @param config application configuration; must not be {@code null}
     */
    public KafkaSightingSource(AppConfig config) {
        this(new KafkaConsumer<>(Objects.requireNonNull(config, "AppConfig must not be null")
                        .kafkaConsumerProperties()),
                config.getKafkaSightingsTopic(),
                config.getKafkaPollTimeout(),
                new SightingDeserializer());
    }

    KafkaSightingSource(Consumer<String, byte[]> consumer, String topic, Duration pollTimeout,
            SightingDeserializer deserializer) {
        this.consumer = Objects.requireNonNull(consumer, "Consumer must not be null");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "Poll timeout must not be null");
        this.deserializer = Objects.requireNonNull(deserializer, "SightingDeserializer must not be null");
        Objects.requireNonNull(topic, "Topic must not be null");
        if (topic.isBlank()) {
            throw new IllegalArgumentException("Topic must not be blank");
        }
        this.consumer.subscribe(List.of(topic));
        LOG.info("Subscribed to sightings topic '{}'", topic);
    }

    @Override
    public Optional<Sighting> next() throws IOException, InterruptedException {
        pollLock.lock();
        try {
            while (!closed.get()) {
                Sighting sighting = buffered.poll();
                if (sighting != null) {
                    return Optional.of(sighting);
                }
                poll();
            }
            return Optional.empty();
        } finally {
            if (closed.get()) {
                closeConsumer();
            }
            pollLock.unlock();
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        consumer.wakeup();
        // A thread inside next() closes the consumer on its way out.
        if (pollLock.tryLock()) {
            try {
                closeConsumer();
            } finally {
                pollLock.unlock();
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void poll() throws IOException, InterruptedException {
        try {
            for (ConsumerRecord<String, byte[]> record : consumer.poll(pollTimeout)) {
                Optional<Sighting> decoded = deserializer.deserialize(record.value());
                if (decoded.isPresent()) {
                    buffered.add(decoded.get());
                } else {
                    LOG.debug("Skipped record {}-{}@{}", record.topic(), record.partition(), record.offset());
                }
            }
        } catch (WakeupException e) {
            if (!closed.get()) {
                throw new IOException("Kafka poll woken up unexpectedly", e);
            }
        } catch (InterruptException e) {
            Thread.interrupted();
            InterruptedException interrupted = new InterruptedException("Interrupted while polling Kafka");
            interrupted.initCause(e);
            throw interrupted;
        } catch (KafkaException e) {
            throw new IOException("Kafka poll failed: " + e.getMessage(), e);
        }
    }

    private void closeConsumer() {
        if (consumerClosed) {
            return;
        }
        consumerClosed = true;
        buffered.clear();
        try {
            consumer.close(CLOSE_TIMEOUT);
            LOG.info("Kafka sightings consumer closed");
        } catch (KafkaException e) {
            LOG.warn("Failed to close Kafka consumer cleanly: {}", e.getMessage(), e);
        }
    }
}
