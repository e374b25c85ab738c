package org.silica.compiler.frontend.lexer;

import java.math.BigInteger;
import java.util.Locale;

/**
 * The decoded value of an integer literal.
 *
 * @param value       The magnitude, with unknown (x/z) bits read as zero.
 * @param width       The bit width; 32 for unsized literals.
 * @param signed      Whether the literal is signed. Plain decimal numbers are signed.
 * @param sized       Whether an explicit size was given.
 * @param unknownBits Whether any digit was x, z or ?.
 */
public record IntegerLiteral(BigInteger value, int width, boolean signed, boolean sized, boolean unknownBits) {

    /** Width of unsized literals. */
    public static final int UNSIZED_WIDTH = 32;

    /**
     * Decodes the text of an integer literal, for example {@code 42}, {@code 8'hFF},
     * {@code 'sd3} or the unbased unsized {@code '1}.
     *
     * @param text The literal text; underscores and whitespace are ignored.
     * @return The decoded literal.
     * @throws NumberFormatException if the text is not a valid integer literal.
     */
    public static IntegerLiteral parse(String text) {
        String s = text.replace("_", "").replaceAll("\\s+", "");
        int tick = s.indexOf('\'');
        if (tick < 0) {
            if (s.isEmpty()) throw new NumberFormatException("Empty numeric literal");
            return new IntegerLiteral(new BigInteger(s, 10), UNSIZED_WIDTH, true, false, false);
        }

        String sizePart = s.substring(0, tick);
        String rest = s.substring(tick + 1).toLowerCase(Locale.ROOT);
        if (rest.isEmpty()) throw new NumberFormatException("Missing digits in '" + text + "'");

        // '0, '1, 'x, 'z fill every bit of the context; at the default width that is 32 bits.
        if (sizePart.isEmpty() && rest.length() == 1 && "01xz".indexOf(rest.charAt(0)) >= 0) {
            char c = rest.charAt(0);
            BigInteger v = c == '1' ? BigInteger.ONE.shiftLeft(UNSIZED_WIDTH).subtract(BigInteger.ONE) : BigInteger.ZERO;
            return new IntegerLiteral(v, UNSIZED_WIDTH, false, false, c == 'x' || c == 'z');
        }

        boolean signed = false;
        if (rest.charAt(0) == 's') {
            signed = true;
            rest = rest.substring(1);
        }
        if (rest.isEmpty()) throw new NumberFormatException("Missing base in '" + text + "'");

        int radix = switch (rest.charAt(0)) {
            case 'b' -> 2;
            case 'o' -> 8;
            case 'd' -> 10;
            case 'h' -> 16;
            default -> throw new NumberFormatException("Invalid base in '" + text + "'");
        };
        String digits = rest.substring(1);
        if (digits.isEmpty()) throw new NumberFormatException("Missing digits in '" + text + "'");

        boolean unknown = false;
        StringBuilder clean = new StringBuilder();
        for (char c : digits.toCharArray()) {
            if (c == 'x' || c == 'z' || c == '?') {
                unknown = true;
                clean.append('0');
            } else {
                clean.append(c);
            }
        }
        BigInteger value = new BigInteger(clean.toString(), radix);

        int width = UNSIZED_WIDTH;
        boolean sized = !sizePart.isEmpty();
        if (sized) {
            width = Integer.parseInt(sizePart);
            if (width <= 0) throw new NumberFormatException("Literal size must be positive in '" + text + "'");
            value = value.and(BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE));
        }
        return new IntegerLiteral(value, width, signed, sized, unknown);
    }
}
