package de.bsommerfeld.anchor.subsystem;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.anchor.core.config.ExerciserConfig;
import de.bsommerfeld.anchor.core.sink.KeepAlive;
import io.sentry.Hub;
import io.sentry.SentryOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Logging surface: a Sentry error-reporting hub against a non-routable
 * destination, and one SLF4J record through a named logger.
 */
@Singleton
public class LoggingAnchor extends AbstractSubsystemAnchor {

    static final String LOGGER_NAME = "de.bsommerfeld.anchor.subsystem.logging";

    private final String dsn;

    @Inject
    public LoggingAnchor(ExerciserConfig config) {
        this.dsn = config.sentryDsn();
    }

    @Override
    public String name() {
        return "logging";
    }

    @Override
    protected List<EntryPoint> entryPoints() {
        return List.of(
                new EntryPoint("error-reporting-client", this::createErrorReportingClient),
                new EntryPoint("named-logger", this::emitRecord));
    }

    private void createErrorReportingClient() {
        SentryOptions options = new SentryOptions();
        options.setDsn(dsn);
        options.setEnableUncaughtExceptionHandler(false);
        // the hub owns its client and transport; closing it releases both
        Hub hub = new Hub(options);
        try {
            KeepAlive.accept(hub.isEnabled());
            KeepAlive.accept(hub.getOptions().getDsn());
        } finally {
            hub.close();
        }
    }

    private void emitRecord() {
        Logger logger = LoggerFactory.getLogger(LOGGER_NAME);
        logger.info("Logging subsystem anchored");
    }
}
