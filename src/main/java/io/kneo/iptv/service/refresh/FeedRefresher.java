package io.kneo.iptv.service.refresh;

import io.kneo.iptv.model.cnst.FeedState;
import io.kneo.iptv.util.FeedLogger;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.Cancellable;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Periodic loader for one feed. At most one load runs at a time: a tick or retry that fires while
 * a load is in flight is skipped. A failed load leaves the published data alone and schedules a
 * single retry after a fixed delay.
 */
public class FeedRefresher<T> {
    private static final Logger LOGGER = LoggerFactory.getLogger(FeedRefresher.class);

    @Getter
    private final String feedName;
    private final Supplier<Uni<? extends T>> loader;
    private final Consumer<T> publisher;
    private final Duration interval;
    private final Duration retryDelay;

    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final AtomicBoolean retryPending = new AtomicBoolean(false);
    private final AtomicReference<FeedState> state = new AtomicReference<>(FeedState.UNLOADED);

    @Getter
    private volatile Instant lastSuccess;
    @Getter
    private volatile String lastError;

    private volatile boolean running;
    private Cancellable tickerSubscription;
    private Cancellable retrySubscription;

    public FeedRefresher(String feedName, Supplier<Uni<? extends T>> loader, Consumer<T> publisher,
                         Duration interval, Duration retryDelay) {
        this.feedName = feedName;
        this.loader = loader;
        this.publisher = publisher;
        this.interval = interval;
        this.retryDelay = retryDelay;
    }

    public synchronized void start(boolean loadImmediately) {
        if (running) {
            return;
        }
        running = true;
        LOGGER.info("Starting {} refresher, interval {}, retry delay {}", feedName, interval, retryDelay);
        if (loadImmediately) {
            refresh().subscribe().with(
                    loaded -> LOGGER.debug("Initial {} load finished: {}", feedName, loaded),
                    failure -> LOGGER.error("Initial {} load crashed", feedName, failure));
        }
        tickerSubscription = Multi.createFrom().ticks()
                .startingAfter(interval)
                .every(interval)
                .onOverflow().drop()
                .onItem().call(tick -> refresh())
                .subscribe().with(
                        tick -> {
                        },
                        failure -> LOGGER.error("{} refresh ticker failed", feedName, failure));
    }

    public synchronized void stop() {
        running = false;
        if (tickerSubscription != null) {
            tickerSubscription.cancel();
            tickerSubscription = null;
        }
        if (retrySubscription != null) {
            retrySubscription.cancel();
            retrySubscription = null;
        }
        retryPending.set(false);
        LOGGER.info("Stopped {} refresher", feedName);
    }

    /**
     * Loads and publishes the feed once. Emits {@code true} when new data was published,
     * {@code false} when the load failed or was skipped because another load was running.
     */
    public Uni<Boolean> refresh() {
        return Uni.createFrom().deferred(() -> {
            if (!inFlight.compareAndSet(false, true)) {
                LOGGER.debug("Refresh of {} already in flight, skipping", feedName);
                return Uni.createFrom().item(false);
            }
            state.updateAndGet(s -> s == FeedState.LOADED ? FeedState.STALE : s);
            FeedLogger.logActivity(feedName, "refresh", "loading (state %s)", state.get());
            return Uni.createFrom().deferred(loader)
                    .onItem().transform(data -> {
                        publisher.accept(data);
                        return true;
                    })
                    .onItem().invoke(this::onSuccess)
                    .onFailure().recoverWithItem(this::onFailure)
                    .eventually(() -> inFlight.set(false));
        });
    }

    public FeedState getState() {
        return state.get();
    }

    public boolean isRefreshing() {
        return inFlight.get();
    }

    private void onSuccess() {
        lastSuccess = Instant.now();
        lastError = null;
        state.set(FeedState.LOADED);
        FeedLogger.logActivity(feedName, "published", "refresh completed");
    }

    private boolean onFailure(Throwable failure) {
        lastError = failure.getMessage();
        state.updateAndGet(s -> s.hasData() ? FeedState.STALE : FeedState.UNLOADED);
        FeedLogger.logFailure(feedName, "refresh", failure, "keeping previous data, retry in %s", retryDelay);
        scheduleRetry();
        return false;
    }

    private synchronized void scheduleRetry() {
        if (!running || !retryPending.compareAndSet(false, true)) {
            return;
        }
        retrySubscription = Uni.createFrom().voidItem()
                .onItem().delayIt().by(retryDelay)
                .onItem().invoke(() -> retryPending.set(false))
                .chain(ignored -> refresh())
                .subscribe().with(
                        loaded -> LOGGER.debug("Retry of {} finished: {}", feedName, loaded),
                        failure -> LOGGER.error("Retry of {} crashed", feedName, failure));
    }
}
