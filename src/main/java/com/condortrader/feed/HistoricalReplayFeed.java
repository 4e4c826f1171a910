package com.condortrader.feed;

import com.condortrader.domain.enums.FeedState;
import com.condortrader.domain.model.Tick;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays a recorded tick sequence as a {@link MarketDataFeed}.
 *
 * <p>Ticks are sorted by timestamp (stable, so equal timestamps keep file order) and pushed
 * synchronously on the calling thread by {@link #replay()}. The feed clock is the tick time:
 * health is refreshed with each tick's timestamp, never with the wall clock.
 */
public class HistoricalReplayFeed implements MarketDataFeed {

    private static final Logger log = LoggerFactory.getLogger(HistoricalReplayFeed.class);

    private final List<Tick> ticks;
    private final Set<Long> subscribed = new HashSet<>();

    private FeedHealth health;
    private FeedListener listener;
    private boolean stopped;

    public HistoricalReplayFeed(Collection<Tick> ticks) {
        List<Tick> sorted = new ArrayList<>(ticks);
        sorted.sort(Comparator.comparing(Tick::getTimestamp));
        this.ticks = List.copyOf(sorted);
    }

    @Override
    public FeedHealth connect(Set<Long> instruments, FeedListener feedListener) {
        this.listener = feedListener;
        this.subscribed.addAll(instruments);
        this.health = new FeedHealth(FeedState.CONNECTED);
        this.stopped = false;
        return health;
    }

    /**
     * Pushes every subscribed tick to the listener in time order.
     *
     * @return number of ticks delivered
     */
    public int replay() {
        if (listener == null) {
            throw new IllegalStateException("Replay feed is not connected");
        }
        int delivered = 0;
        for (Tick tick : ticks) {
            if (stopped) {
                log.info("Replay stopped after {} ticks", delivered);
                break;
            }
            if (!subscribed.contains(tick.getInstrumentToken())) {
                continue;
            }
            health.recordMessage(tick.getTimestamp());
            listener.onTick(tick);
            delivered++;
        }
        return delivered;
    }

    @Override
    public void subscribe(Collection<Long> instruments) {
        subscribed.addAll(instruments);
    }

    @Override
    public void unsubscribe(Collection<Long> instruments) {
        subscribed.removeAll(instruments);
    }

    /** No-op: a replay has no gaps to fill. */
    @Override
    public void requestSnapshot() {}

    @Override
    public void onTimer(LocalDateTime now) {}

    @Override
    public void disconnect() {
        stopped = true;
        if (health != null) {
            health.close();
        }
    }

    public int size() {
        return ticks.size();
    }

    public LocalDateTime firstTimestamp() {
        return ticks.isEmpty() ? null : ticks.get(0).getTimestamp();
    }

    public LocalDateTime lastTimestamp() {
        return ticks.isEmpty() ? null : ticks.get(ticks.size() - 1).getTimestamp();
    }
}
