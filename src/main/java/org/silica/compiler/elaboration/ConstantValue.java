package org.silica.compiler.elaboration;

import java.math.BigInteger;

/**
 * The value of a constant expression.
 */
public sealed interface ConstantValue
        permits ConstantValue.IntegerValue, ConstantValue.RealValue, ConstantValue.StringValue, ConstantValue.InvalidValue {

    /**
     * @return {@code false} only for {@link InvalidValue}.
     */
    default boolean isValid() {
        return true;
    }

    /**
     * An integral value of a fixed width. The value is stored already truncated to the width;
     * signed values are kept in their negative form when the top bit is set.
     */
    record IntegerValue(BigInteger value, int width, boolean signed) implements ConstantValue {

        public IntegerValue {
            if (width <= 0) {
                throw new IllegalArgumentException("width must be positive, got " + width);
            }
        }

        /**
         * Truncates or extends a number to the given width and signedness.
         *
         * @param raw    Any number; only its low {@code width} two's complement bits are kept.
         * @param width  The result width.
         * @param signed Whether the result is signed.
         * @return The normalized value.
         */
        public static IntegerValue of(BigInteger raw, int width, boolean signed) {
            BigInteger modulus = BigInteger.ONE.shiftLeft(width);
            BigInteger bits = raw.mod(modulus);
            if (signed && bits.testBit(width - 1)) {
                bits = bits.subtract(modulus);
            }
            return new IntegerValue(bits, width, signed);
        }

        public static IntegerValue of(long value) {
            return of(BigInteger.valueOf(value), 32, true);
        }

        public static IntegerValue bool(boolean value) {
            return new IntegerValue(value ? BigInteger.ONE : BigInteger.ZERO, 1, false);
        }

        public IntegerValue resize(int newWidth, boolean newSigned) {
            return of(value, newWidth, newSigned);
        }

        /**
         * @return The bits of this value read as an unsigned number.
         */
        public BigInteger unsignedValue() {
            return value.signum() < 0 ? value.add(BigInteger.ONE.shiftLeft(width)) : value;
        }

        public boolean isTrue() {
            return value.signum() != 0;
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    record RealValue(double value) implements ConstantValue {
        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    record StringValue(String value) implements ConstantValue {
        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }

    /**
     * The value of an expression that could not be evaluated. Errors have already been reported.
     */
    enum InvalidValue implements ConstantValue {
        INSTANCE;

        @Override
        public boolean isValid() {
            return false;
        }

        @Override
        public String toString() {
            return "<invalid>";
        }
    }
}
