package de.bsommerfeld.anchor.generics;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.anchor.core.attempt.Attempt;
import de.bsommerfeld.anchor.core.sink.KeepAlive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Produces one container per element type and shape so every pairing is
 * instantiated in source, and references the sequence-operation facades
 * once per pass.
 *
 * <p>
 * Iteration follows the table order, then the shape declaration order, so
 * two passes over the same table yield equal reports.
 */
@Singleton
public class GenericInstantiator {

    private static final Logger LOG = LoggerFactory.getLogger(GenericInstantiator.class);

    private static final List<Class<?>> FACADES =
            ImmutableList.of(Collections.class, Collectors.class, Lists.class);

    private final List<ElementType<?>> elementTypes;

    @Inject
    public GenericInstantiator() {
        this(ElementTypes.CURATED);
    }

    GenericInstantiator(List<ElementType<?>> elementTypes) {
        this.elementTypes = ImmutableList.copyOf(elementTypes);
    }

    public InstantiationReport instantiate() {
        for (Class<?> facade : FACADES) {
            KeepAlive.accept(facade.getName());
        }

        List<InstantiationRecord> records = new ArrayList<>();
        for (ElementType<?> elementType : elementTypes) {
            for (ContainerShape shape : ContainerShape.values()) {
                records.add(instantiate(elementType, shape));
            }
        }

        InstantiationReport report = new InstantiationReport(FACADES, records);
        LOG.info("Generic instantiation finished: {}", report);
        return report;
    }

    private static <T> InstantiationRecord instantiate(ElementType<T> elementType, ContainerShape shape) {
        Collection<T> container = shape.create(elementType.type());
        KeepAlive.accept(container);

        Insertion insertion = Insertion.NOT_ATTEMPTED;
        if (shape.insertsDefault()) {
            Attempt<Boolean> added = Attempt.of(() -> container.add(elementType.type().cast(elementType.defaultValue())));
            insertion = added.succeeded() ? Insertion.INSERTED : Insertion.REJECTED;
            if (!added.succeeded()) {
                LOG.debug("Default insertion into {}<{}> rejected: {}",
                        container.getClass().getSimpleName(), elementType.id(), added.describe());
            }
        }
        return new InstantiationRecord(elementType.id(), shape, container.getClass().getName(), insertion);
    }
}
