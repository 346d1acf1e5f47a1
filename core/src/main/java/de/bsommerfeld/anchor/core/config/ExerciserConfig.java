package de.bsommerfeld.anchor.core.config;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Immutable run configuration of the exerciser.
 *
 * <p>
 * Every setting is resolved from a system property first and an
 * environment variable second (e.g. {@code anchor.subsystems} then
 * {@code ANCHOR_SUBSYSTEMS}). Missing or blank values use the default;
 * malformed values are logged and replaced by the default.
 *
 * @param walkModules       module name prefixes the walker visits; empty visits every module
 * @param walkClassPath     whether class-path entries (the unnamed module) are walked
 * @param constructInstances whether zero-argument constructors are invoked
 * @param constructionSkip  type name prefixes that are never constructed
 * @param subsystems        enabled subsystem anchors, in execution order
 * @param sentryDsn         placeholder destination for the error-reporting client
 */
public record ExerciserConfig(
        List<String> walkModules,
        boolean walkClassPath,
        boolean constructInstances,
        List<String> constructionSkip,
        List<String> subsystems,
        String sentryDsn) {

    private static final Logger LOG = LoggerFactory.getLogger(ExerciserConfig.class);

    public static final List<String> DEFAULT_SUBSYSTEMS =
            ImmutableList.of("networking", "cryptography", "logging", "collections");

    /**
     * Constructors that start non-daemon threads or write files outside the
     * working directory.
     */
    public static final List<String> DEFAULT_CONSTRUCTION_SKIP = ImmutableList.of(
            "java.util.Timer",
            "java.util.logging.FileHandler",
            "java.awt.Robot",
            "javax.swing.Timer");

    public static final String DEFAULT_SENTRY_DSN = "https://public@example.invalid/1";

    private static final Splitter LIST = Splitter.on(',').trimResults().omitEmptyStrings();

    public ExerciserConfig {
        walkModules = ImmutableList.copyOf(walkModules);
        constructionSkip = ImmutableList.copyOf(constructionSkip);
        subsystems = ImmutableList.copyOf(subsystems);
    }

    public static ExerciserConfig defaults() {
        return new ExerciserConfig(
                ImmutableList.of(),
                true,
                true,
                DEFAULT_CONSTRUCTION_SKIP,
                DEFAULT_SUBSYSTEMS,
                DEFAULT_SENTRY_DSN);
    }

    /** Resolves the configuration from system properties and environment variables. */
    public static ExerciserConfig resolve() {
        ExerciserConfig defaults = defaults();
        return new ExerciserConfig(
                list("anchor.walk.modules", defaults.walkModules()),
                bool("anchor.walk.classpath", defaults.walkClassPath()),
                bool("anchor.construct.enabled", defaults.constructInstances()),
                list("anchor.construct.skip", defaults.constructionSkip()),
                list("anchor.subsystems", defaults.subsystems()),
                string("anchor.sentry.dsn", defaults.sentryDsn()));
    }

    public ExerciserConfig withWalkModules(List<String> modules) {
        return new ExerciserConfig(modules, walkClassPath, constructInstances,
                constructionSkip, subsystems, sentryDsn);
    }

    public ExerciserConfig withWalkClassPath(boolean enabled) {
        return new ExerciserConfig(walkModules, enabled, constructInstances,
                constructionSkip, subsystems, sentryDsn);
    }

    public ExerciserConfig withSubsystems(List<String> names) {
        return new ExerciserConfig(walkModules, walkClassPath, constructInstances,
                constructionSkip, names, sentryDsn);
    }

    public boolean isModuleIncluded(String moduleName) {
        return walkModules.isEmpty() || walkModules.stream().anyMatch(moduleName::startsWith);
    }

    public boolean isConstructionSkipped(String typeName) {
        return constructionSkip.stream().anyMatch(typeName::startsWith);
    }

    // =====================================================================
    // Resolution
    // =====================================================================

    static String raw(String property) {
        String value = System.getProperty(property);
        if (value == null || value.isBlank()) {
            value = System.getenv(property.toUpperCase(Locale.ROOT).replace('.', '_'));
        }
        return value == null || value.isBlank() ? null : value.strip();
    }

    private static String string(String property, String fallback) {
        String value = raw(property);
        return value != null ? value : fallback;
    }

    private static List<String> list(String property, List<String> fallback) {
        String value = raw(property);
        return value != null ? ImmutableList.copyOf(LIST.split(value)) : fallback;
    }

    private static boolean bool(String property, boolean fallback) {
        String value = raw(property);
        if (value == null)
            return fallback;
        if (value.equalsIgnoreCase("true"))
            return true;
        if (value.equalsIgnoreCase("false"))
            return false;
        LOG.warn("Invalid boolean '{}' for {}. Using default {}.", value, property, fallback);
        return fallback;
    }
}
