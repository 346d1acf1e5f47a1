package de.bsommerfeld.anchor.exerciser;

import com.google.common.collect.ImmutableMap;
import com.google.inject.AbstractModule;
import com.google.inject.multibindings.Multibinder;
import de.bsommerfeld.anchor.core.config.ExerciserConfig;
import de.bsommerfeld.anchor.subsystem.CollectionsAnchor;
import de.bsommerfeld.anchor.subsystem.CryptographyAnchor;
import de.bsommerfeld.anchor.subsystem.LoggingAnchor;
import de.bsommerfeld.anchor.subsystem.NetworkingAnchor;
import de.bsommerfeld.anchor.subsystem.SubsystemAnchor;
import de.bsommerfeld.anchor.universe.RuntimeTypeCatalog;
import de.bsommerfeld.anchor.universe.TypeCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Guice module wiring the exerciser.
 *
 * <p>
 * The subsystem anchors are bound into a set in the order the configuration
 * lists them; Guice keeps that order when the set is injected. Unknown names
 * are logged and left out.
 */
public class ExerciserModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(ExerciserModule.class);

    static final Map<String, Class<? extends SubsystemAnchor>> ANCHORS = ImmutableMap.of(
            "networking", NetworkingAnchor.class,
            "cryptography", CryptographyAnchor.class,
            "logging", LoggingAnchor.class,
            "collections", CollectionsAnchor.class);

    private final ExerciserConfig config;

    public ExerciserModule(ExerciserConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(ExerciserConfig.class).toInstance(config);
        bind(TypeCatalog.class).to(RuntimeTypeCatalog.class);

        Multibinder<SubsystemAnchor> anchors = Multibinder.newSetBinder(binder(), SubsystemAnchor.class);
        for (String name : config.subsystems()) {
            Class<? extends SubsystemAnchor> anchor = ANCHORS.get(name);
            if (anchor == null) {
                LOG.warn("Unknown subsystem '{}' ignored. Known: {}", name, ANCHORS.keySet());
                continue;
            }
            anchors.addBinding().to(anchor);
        }
        LOG.info("Exerciser configured: modules={}, classpath={}, construct={}, subsystems={}",
                config.walkModules().isEmpty() ? "all" : config.walkModules(),
                config.walkClassPath(), config.constructInstances(), config.subsystems());
    }
}
