package de.bsommerfeld.anchor.universe;

/**
 * The two identity strings read from every walked type.
 *
 * @param qualifiedName binary name as returned by {@link Class#getName()}
 * @param uniqueName    owner-qualified descriptor, unique across modules and
 *                      class loaders (e.g. {@code java.base/Ljava/lang/String;})
 */
public record TypeIdentity(String qualifiedName, String uniqueName) {

    public static TypeIdentity of(Class<?> type) {
        return new TypeIdentity(type.getName(), owner(type) + "/" + type.descriptorString());
    }

    private static String owner(Class<?> type) {
        Module module = type.getModule();
        if (module.isNamed()) {
            return module.getName();
        }
        ClassLoader loader = type.getClassLoader();
        if (loader == null) {
            return "bootstrap";
        }
        String loaderName = loader.getName();
        return "unnamed@" + (loaderName != null
                ? loaderName
                : loader.getClass().getName() + "#" + Integer.toHexString(System.identityHashCode(loader)));
    }
}
