package de.bsommerfeld.anchor.universe;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.anchor.core.attempt.Attempt;
import de.bsommerfeld.anchor.core.config.ExerciserConfig;
import de.bsommerfeld.anchor.core.sink.KeepAlive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;

/**
 * References the member table of a single type and attempts to construct it.
 *
 * <h3>Construction</h3>
 * A non-abstract type with a declared zero-argument constructor (any
 * visibility) is instantiated once through reflection. Access is forced
 * with {@link Constructor#setAccessible(boolean)}; modules that do not open
 * the package refuse it, which counts as an ordinary failure. An instance
 * that is {@link AutoCloseable} is closed right away, so a constructor that
 * binds a socket or opens a file does not leak it.
 *
 * <h3>Members</h3>
 * Declared methods and fields are enumerated and their names read. Nothing
 * is invoked, read or written. Inherited members belong to the declaring
 * type and are touched when the walker reaches it.
 */
@Singleton
public class MemberToucher {

    private static final Logger LOG = LoggerFactory.getLogger(MemberToucher.class);

    private final ExerciserConfig config;

    @Inject
    public MemberToucher(ExerciserConfig config) {
        this.config = config;
    }

    public TouchedType touch(Class<?> type, TypeIdentity identity) {
        ConstructionStatus construction = construct(type);
        List<String> methods = methodNames(type);
        List<String> fields = fieldNames(type);
        return new TouchedType(identity, methods, fields, construction);
    }

    ConstructionStatus construct(Class<?> type) {
        if (type.isPrimitive() || type.isArray() || Modifier.isAbstract(type.getModifiers())) {
            return ConstructionStatus.NOT_ELIGIBLE;
        }

        Attempt<Constructor<?>> lookup = Attempt.of(type::getDeclaredConstructor);
        if (!lookup.succeeded()) {
            return ConstructionStatus.NOT_ELIGIBLE;
        }
        if (!config.constructInstances() || config.isConstructionSkipped(type.getName())) {
            return ConstructionStatus.SKIPPED;
        }

        Constructor<?> constructor = lookup.value();
        Attempt<Object> instance = Attempt.of(() -> {
            constructor.setAccessible(true);
            return constructor.newInstance();
        });
        if (!instance.succeeded()) {
            LOG.trace("Construction of {} failed: {}", type.getName(), instance.describe());
            return ConstructionStatus.FAILED;
        }

        release(type, instance.value());
        return ConstructionStatus.CONSTRUCTED;
    }

    private void release(Class<?> type, Object instance) {
        KeepAlive.accept(instance.getClass());
        if (instance instanceof AutoCloseable) {
            Attempt<Void> closed = Attempt.run(((AutoCloseable) instance)::close);
            if (!closed.succeeded()) {
                LOG.trace("Closing constructed {} failed: {}", type.getName(), closed.describe());
            }
        }
    }

    private List<String> methodNames(Class<?> type) {
        Attempt<Method[]> methods = Attempt.of(type::getDeclaredMethods);
        if (!methods.succeeded()) {
            LOG.trace("Cannot enumerate methods of {}: {}", type.getName(), methods.describe());
            return List.of();
        }
        List<String> names = new ArrayList<>(methods.value().length);
        for (Method method : methods.value()) {
            names.add(method.getName());
        }
        KeepAlive.accept(names);
        return names;
    }

    private List<String> fieldNames(Class<?> type) {
        Attempt<Field[]> fields = Attempt.of(type::getDeclaredFields);
        if (!fields.succeeded()) {
            LOG.trace("Cannot enumerate fields of {}: {}", type.getName(), fields.describe());
            return List.of();
        }
        List<String> names = new ArrayList<>(fields.value().length);
        for (Field field : fields.value()) {
            names.add(field.getName());
        }
        KeepAlive.accept(names);
        return names;
    }
}
