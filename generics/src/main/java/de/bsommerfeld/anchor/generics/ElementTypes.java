package de.bsommerfeld.anchor.generics;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;

/**
 * The compiled-in, ordered table of type arguments. Distinct signed and
 * unsigned widths, text, a binary blob and an opaque object, so the
 * retained specializations cover the shapes an analyst is likely to meet.
 *
 * <p>
 * Java has no unsigned primitives: 8-bit unsigned shares the {@code byte}
 * carrier (read through Guava's {@code UnsignedBytes}), 16-bit unsigned is
 * {@code char}, 32 and 64-bit unsigned use Guava's {@link UnsignedInteger}
 * and {@link UnsignedLong}.
 */
public final class ElementTypes {

    public static final ImmutableList<ElementType<?>> CURATED = ImmutableList.of(
            ElementType.integral("i8", Byte.class, true, 8, (byte) 0),
            ElementType.integral("u8", Byte.class, false, 8, (byte) 0),
            ElementType.integral("i16", Short.class, true, 16, (short) 0),
            ElementType.integral("u16", Character.class, false, 16, '\0'),
            ElementType.integral("i32", Integer.class, true, 32, 0),
            ElementType.integral("u32", UnsignedInteger.class, false, 32, UnsignedInteger.ZERO),
            ElementType.integral("i64", Long.class, true, 64, 0L),
            ElementType.integral("u64", UnsignedLong.class, false, 64, UnsignedLong.ZERO),
            ElementType.reference("text", String.class, ElementKind.TEXT),
            ElementType.reference("blob", byte[].class, ElementKind.BINARY),
            ElementType.reference("object", Object.class, ElementKind.OPAQUE));

    private ElementTypes() {
    }
}
