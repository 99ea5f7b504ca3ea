package com.raidwatch.app;

import com.raidwatch.core.actor.AggregatorHandle;
import com.raidwatch.core.model.RaidBoss;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically prints the known bosses, lowest level first.
 *
 * <p>
 * Each refresh writes one line per boss followed by a blank line:
 * </p>
 *
 * <pre>
 * 60  | Lvl 60 Ozorotter (English) http://example.com/ozorotter.png
 * 75  | Lv75 シュヴァリエ・マグナ (Japanese)
 * </pre>
 *
 * @since 1.0.0
 */
public class BossBoard implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(BossBoard.class);

    private static final Comparator<RaidBoss> BOARD_ORDER =
            Comparator.comparingInt(RaidBoss::getLevel).thenComparing(RaidBoss::getName);

    private final AggregatorHandle handle;
    private final PrintStream out;
    private ScheduledExecutorService scheduler;

    /**
     * @param handle handle owned by the board; closed with it
     * @param out    stream the board is printed to
     */
    public BossBoard(AggregatorHandle handle, PrintStream out) {
        this.handle = Objects.requireNonNull(handle, "AggregatorHandle must not be null");
        this.out = Objects.requireNonNull(out, "PrintStream must not be null");
    }

    /**
     * Start printing the board every {@code interval}.
     *
     * @throws IllegalStateException if the board was already started
     */
    public synchronized void start(Duration interval) {
        Objects.requireNonNull(interval, "Interval must not be null");
        if (scheduler != null) {
            throw new IllegalStateException("Boss board already started");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "boss-board");
            t.setDaemon(true);
            return t;
        });
        long millis = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::refresh, millis, millis, TimeUnit.MILLISECONDS);
        LOG.info("Boss board printing every {}", interval);
    }

    /**
     * Query the bosses once and print them when the reply arrives.
     *
     * @return future completed once the board has been printed, or with the
     *         query failure; failed with {@link IllegalStateException} once the
     *         board is closed
     */
    public CompletableFuture<Void> refresh() {
        CompletableFuture<List<RaidBoss>> bosses;
        try {
            bosses = handle.listBosses();
        } catch (IllegalStateException e) {
            LOG.debug("Boss board refresh skipped: {}", e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
        return bosses
                .thenAccept(list -> out.print(render(list)))
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        LOG.debug("Boss board refresh failed: {}", error.toString());
                    }
                });
    }

    /**
     * Render bosses in board order.
     */
    static String render(List<RaidBoss> bosses) {
        List<RaidBoss> sorted = new ArrayList<>(bosses);
        sorted.sort(BOARD_ORDER);

        StringBuilder sb = new StringBuilder();
        for (RaidBoss boss : sorted) {
            sb.append(String.format("%-3d | %s (%s)", boss.getLevel(), boss.getName(),
                    boss.getLanguage().displayName()));
            boss.getImage().ifPresent(image -> sb.append(' ').append(image));
            sb.append(System.lineSeparator());
        }
        sb.append(System.lineSeparator());
        return sb.toString();
    }

    /**
     * Stop printing and release the board's handle.
     */
    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        handle.close();
    }
}
