package com.williamcallahan.pftreport.config;

import java.io.InterruptedIOException;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;
import reactor.core.publisher.Hooks;

/**
 * Configures Reactor hooks to handle dropped errors gracefully.
 *
 * <p>When a stage or overall timeout abandons a blocking call on {@code boundedElastic}, the thread
 * interruption can surface as an exception after the run has already been marked FAILED. Reactor
 * logs these as ERROR by default; this configuration downgrades expected cancellation-related
 * errors to DEBUG.</p>
 */
@Configuration
public class ReactorHooksConfig {

    private static final Logger log = LoggerFactory.getLogger(ReactorHooksConfig.class);

    /**
     * Installs a custom error handler for dropped errors when context refreshes.
     */
    @EventListener(ContextRefreshedEvent.class)
    public void configureDroppedErrorHandler() {
        Hooks.onErrorDropped(error -> {
            if (isExpectedCancellationError(error)) {
                log.debug("Dropped expected cancellation error (exceptionType={})",
                        error.getClass().getSimpleName());
            } else {
                log.warn("Dropped unexpected error", error);
            }
        });
        log.info("Reactor dropped-error hook configured");
    }

    static boolean isExpectedCancellationError(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof InterruptedException || current instanceof InterruptedIOException) {
                return true;
            }
            current = current.getCause();
        }
        String message = error.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains("interrupt");
    }
}
