package de.bsommerfeld.anchor.generics;

/**
 * One type argument used to parameterize the container shapes.
 *
 * @param id           stable identifier used in records and log lines
 * @param type         the (boxed) type argument
 * @param kind         category of the type
 * @param bits         value width in bits, {@code 0} for non-integral kinds
 * @param defaultValue value inserted into growable sequences; {@code null} for plain reference types
 */
public record ElementType<T>(String id, Class<T> type, ElementKind kind, int bits, T defaultValue) {

    public static <T> ElementType<T> integral(String id, Class<T> type, boolean signed, int bits, T zero) {
        return new ElementType<>(id, type,
                signed ? ElementKind.SIGNED_INTEGRAL : ElementKind.UNSIGNED_INTEGRAL, bits, zero);
    }

    public static <T> ElementType<T> reference(String id, Class<T> type, ElementKind kind) {
        return new ElementType<>(id, type, kind, 0, null);
    }
}
