package info.isaksson.erland.javatoseq.model;

import java.util.regex.Pattern;

/**
 * Static type of an expression as seen by the symbol solver.
 *
 * @param qualifiedName fully qualified name without type arguments (e.g. {@code java.util.List});
 *                      for non-declared types the described form (e.g. {@code int[]})
 * @param described     full description including type arguments
 *                      (e.g. {@code java.util.List<java.lang.String>})
 * @param named         true for class, interface, enum and record types
 */
public record TypeName(String qualifiedName, String described, boolean named) {

    private static final Pattern QUALIFIER = Pattern.compile("(?:[A-Za-z_$][A-Za-z0-9_$]*\\.)+");

    public static TypeName named(String qualifiedName, String described) {
        return new TypeName(qualifiedName, described == null ? qualifiedName : described, true);
    }

    public static TypeName unnamed(String described) {
        return new TypeName(described, described, false);
    }

    /** {@link #described()} with every package and outer-type qualifier removed. */
    public String simpleName() {
        return simplify(described);
    }

    /**
     * Strip qualifiers from a type description, including inside type arguments:
     * {@code java.util.Map<java.lang.String, a.B.C>} becomes {@code Map<String, C>}.
     */
    public static String simplify(String typeText) {
        if (typeText == null) return null;
        return QUALIFIER.matcher(typeText.trim()).replaceAll("");
    }
}
