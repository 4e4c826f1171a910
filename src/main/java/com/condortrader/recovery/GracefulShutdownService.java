package com.condortrader.recovery;

import com.condortrader.event.EventPublisherHelper;
import com.condortrader.event.SystemEventType;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Ensures orderly shutdown: persist state, then stop feeds and worker threads.
 *
 * <p>Implements {@link SmartLifecycle} with a high phase value so it runs BEFORE other
 * Spring components (the JPA layer in particular) shut down. Open positions are neither
 * closed nor cancelled: they are snapshotted and resumed by {@link StartupRecoveryService}
 * on the next start.
 */
@Service
public class GracefulShutdownService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownService.class);

    private final ObjectProvider<ShutdownParticipant> shutdownParticipants;
    private final EventPublisherHelper eventPublisherHelper;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public GracefulShutdownService(
            ObjectProvider<ShutdownParticipant> shutdownParticipants, EventPublisherHelper eventPublisherHelper) {
        this.shutdownParticipants = shutdownParticipants;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @Override
    public void start() {
        running.set(true);
        log.info("GracefulShutdownService started");
    }

    @Override
    public void stop() {
        log.info("Graceful shutdown initiated...");
        try {
            eventPublisherHelper.publishSystemEvent(this, SystemEventType.SHUTTING_DOWN, "Graceful shutdown");
            shutdownParticipants.orderedStream().forEach(participant -> {
                try {
                    participant.shutdown();
                } catch (RuntimeException e) {
                    log.error("Shutdown of {} failed", participant.getClass().getSimpleName(), e);
                }
            });
            log.info("Graceful shutdown completed successfully");
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // higher phase stops earlier
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
