package com.condortrader.observability;

import com.condortrader.feed.FeedHealth;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

/**
 * Publishes the health handle of the current feed connection to readers outside the
 * decision thread (metrics gauges). Empty until a feed connects and after it is torn down.
 */
@Component
public class FeedHealthHolder {

    private final AtomicReference<FeedHealth> current = new AtomicReference<>();

    public void set(FeedHealth health) {
        current.set(health);
    }

    public void clear() {
        current.set(null);
    }

    public Optional<FeedHealth> current() {
        return Optional.ofNullable(current.get());
    }
}
