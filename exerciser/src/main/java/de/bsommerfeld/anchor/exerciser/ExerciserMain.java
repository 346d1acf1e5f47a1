package de.bsommerfeld.anchor.exerciser;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.anchor.core.config.ExerciserConfig;
import de.bsommerfeld.anchor.core.event.ExerciseEventBus;
import de.bsommerfeld.anchor.core.sink.KeepAlive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process entry point. Resolves the configuration, runs one exercise pass and
 * returns normally, whatever the individual steps reported.
 */
public final class ExerciserMain {

    private static final Logger LOG = LoggerFactory.getLogger(ExerciserMain.class);

    static final String HEADLESS = "java.awt.headless";

    private ExerciserMain() {
    }

    public static void main(String[] args) {
        // constructing AWT/Swing types must never open a display or start the event thread
        if (System.getProperty(HEADLESS) == null) {
            System.setProperty(HEADLESS, "true");
        }

        ExerciserConfig config = ExerciserConfig.resolve();
        Injector injector = Guice.createInjector(new ExerciserModule(config));

        injector.getInstance(ExerciseEventBus.class).register(new StepLogListener());
        injector.getInstance(Orchestrator.class).run();

        KeepAlive.accept(ExerciserMain.class);
        LOG.info("Metadata anchoring done ({} values kept alive)", KeepAlive.accepted());
    }
}
