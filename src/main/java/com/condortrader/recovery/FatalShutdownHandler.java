package com.condortrader.recovery;

import com.condortrader.event.EventPublisherHelper;
import com.condortrader.event.SystemEventType;
import com.condortrader.exception.BaseException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Terminates the process on a fatal error (feed unavailable, broker session expired).
 *
 * <p>State is persisted first, on the calling thread, so nothing is lost even if the
 * context close that follows hangs. The exit itself runs on a separate thread: closing the
 * context stops the decision thread, which may be the caller.
 */
@Component
public class FatalShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(FatalShutdownHandler.class);

    private final ConfigurableApplicationContext applicationContext;
    private final ObjectProvider<ShutdownParticipant> shutdownParticipants;
    private final EventPublisherHelper eventPublisherHelper;

    private final AtomicBoolean terminating = new AtomicBoolean(false);

    public FatalShutdownHandler(
            ConfigurableApplicationContext applicationContext,
            ObjectProvider<ShutdownParticipant> shutdownParticipants,
            EventPublisherHelper eventPublisherHelper) {
        this.applicationContext = applicationContext;
        this.shutdownParticipants = shutdownParticipants;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public void terminate(BaseException cause) {
        if (!terminating.compareAndSet(false, true)) {
            log.warn("Fatal shutdown already in progress, ignoring: {}", cause.getMessage());
            return;
        }
        int exitCode = cause.getExitCode();
        log.error("Fatal error [{}], exiting with code {}: {}", cause.getErrorCode(), exitCode, cause.getMessage(), cause);
        eventPublisherHelper.publishSystemEvent(
                this,
                SystemEventType.FATAL,
                cause.getMessage(),
                Map.of("errorCode", cause.getErrorCode().getCode(), "exitCode", exitCode));

        shutdownParticipants.orderedStream().forEach(participant -> {
            try {
                participant.persistState();
            } catch (RuntimeException e) {
                log.error("Failed to persist state of {} before exit", participant.getClass().getSimpleName(), e);
            }
        });

        Thread exitThread = new Thread(() -> exit(exitCode), "fatal-shutdown");
        exitThread.start();
    }

    public boolean isTerminating() {
        return terminating.get();
    }

    void exit(int exitCode) {
        int code = SpringApplication.exit(applicationContext, () -> exitCode);
        System.exit(code);
    }
}
