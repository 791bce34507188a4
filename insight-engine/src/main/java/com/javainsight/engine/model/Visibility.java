package com.javainsight.engine.model;

/**
 * Java access level of a field or method. {@link #PACKAGE} applies when no access modifier is written.
 */
public enum Visibility {
    PUBLIC("public"),
    PRIVATE("private"),
    PROTECTED("protected"),
    PACKAGE("package");

    private final String keyword;

    Visibility(String keyword) {
        this.keyword = keyword;
    }

    /** Lower-case label, identical to the modifier keyword for the three explicit levels. */
    public String keyword() { return keyword; }

    /**
     * @return the visibility named by an access-modifier token, or null if {@code image} is not one
     */
    public static Visibility fromModifier(String image) {
        switch (image) {
            case "public":    return PUBLIC;
            case "private":   return PRIVATE;
            case "protected": return PROTECTED;
            default:          return null;
        }
    }
}
