package de.bsommerfeld.anchor.generics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Parametric container shapes instantiated once per element type.
 */
public enum ContainerShape {

    GROWABLE_SEQUENCE(true) {
        @Override
        <T> Collection<T> create(Class<T> elementType) {
            return new ArrayList<T>();
        }
    },

    CONCURRENT_QUEUE(false) {
        @Override
        <T> Collection<T> create(Class<T> elementType) {
            return new ConcurrentLinkedQueue<T>();
        }
    };

    private final boolean insertsDefault;

    ContainerShape(boolean insertsDefault) {
        this.insertsDefault = insertsDefault;
    }

    abstract <T> Collection<T> create(Class<T> elementType);

    /** Whether the instantiator inserts the element type's default value. */
    public boolean insertsDefault() {
        return insertsDefault;
    }
}
