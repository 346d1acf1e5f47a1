package de.bsommerfeld.anchor.generics;

/**
 * One produced instantiation.
 *
 * @param elementType   {@link ElementType#id()} of the type argument
 * @param shape         container shape
 * @param containerType runtime class name of the produced container
 * @param insertion     outcome of the default-value insertion
 */
public record InstantiationRecord(String elementType, ContainerShape shape, String containerType,
        Insertion insertion) {
}
