package org.silica.compiler.elaboration;

/**
 * A resolved data type. Only the properties needed to bind and coerce parameter values are kept.
 *
 * @param kind      The type category.
 * @param name      The type as it would be written, used in messages.
 * @param width     The bit width of integral types.
 * @param signed    Whether integral values of this type are signed.
 * @param fourState Whether the type can hold x and z bits.
 */
public record Type(Kind kind, String name, int width, boolean signed, boolean fourState) {

    /**
     * The categories of types.
     */
    public enum Kind {
        INTEGRAL,
        REAL,
        STRING,
        /** The type of something that failed to resolve. */
        ERROR
    }

    public static final Type ERROR = new Type(Kind.ERROR, "<error>", 0, false, false);
    public static final Type INT = new Type(Kind.INTEGRAL, "int", 32, true, false);
    public static final Type REAL = new Type(Kind.REAL, "real", 64, true, false);
    public static final Type STRING = new Type(Kind.STRING, "string", 0, false, false);

    public boolean isIntegral() {
        return kind == Kind.INTEGRAL;
    }

    public boolean isError() {
        return kind == Kind.ERROR;
    }

    @Override
    public String toString() {
        return name;
    }
}
