package org.silica.compiler.elaboration;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.diagnostics.DiagCode;
import org.silica.compiler.frontend.parser.ast.DataTypeNode;
import org.silica.compiler.frontend.parser.ast.IdentifierNode;
import org.silica.compiler.frontend.parser.ast.ImplicitTypeNode;
import org.silica.compiler.frontend.parser.ast.KeywordTypeNode;
import org.silica.compiler.frontend.parser.ast.NamedTypeNode;
import org.silica.compiler.frontend.parser.ast.RangeNode;
import org.silica.compiler.frontend.parser.ast.ScopedNameNode;
import org.silica.compiler.frontend.lexer.Token;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Resolves written data types and converts constant values between types.
 */
public final class Types {

    /** Largest number of bits a packed type may have. */
    public static final BigInteger MAX_PACKED_WIDTH = BigInteger.valueOf((1 << 24) - 1);

    private static final Map<String, Type> BUILTINS = Map.ofEntries(
            Map.entry("bit", new Type(Type.Kind.INTEGRAL, "bit", 1, false, false)),
            Map.entry("logic", new Type(Type.Kind.INTEGRAL, "logic", 1, false, true)),
            Map.entry("reg", new Type(Type.Kind.INTEGRAL, "reg", 1, false, true)),
            Map.entry("byte", new Type(Type.Kind.INTEGRAL, "byte", 8, true, false)),
            Map.entry("shortint", new Type(Type.Kind.INTEGRAL, "shortint", 16, true, false)),
            Map.entry("int", Type.INT),
            Map.entry("longint", new Type(Type.Kind.INTEGRAL, "longint", 64, true, false)),
            Map.entry("integer", new Type(Type.Kind.INTEGRAL, "integer", 32, true, true)),
            Map.entry("time", new Type(Type.Kind.INTEGRAL, "time", 64, false, true)),
            Map.entry("real", Type.REAL),
            Map.entry("realtime", new Type(Type.Kind.REAL, "realtime", 64, true, false)),
            Map.entry("shortreal", new Type(Type.Kind.REAL, "shortreal", 32, true, false)),
            Map.entry("string", Type.STRING));

    private Types() {
    }

    /**
     * @param keyword A built-in type keyword.
     * @return The type, or {@code null} if the keyword does not name a built-in type.
     */
    public static Type builtin(String keyword) {
        return BUILTINS.get(keyword);
    }

    /**
     * Creates a packed four-state vector type.
     *
     * @param width  The number of bits.
     * @param signed Whether the vector is signed.
     * @return The type.
     */
    public static Type vector(int width, boolean signed) {
        String name = "logic" + (signed ? " signed" : "") + (width > 1 ? "[" + (width - 1) + ":0]" : "");
        return new Type(Type.Kind.INTEGRAL, name, width, signed, true);
    }

    /**
     * Resolves a written type.
     *
     * @param node    The type syntax. A bare implicit type resolves to the type of a 1-bit logic.
     * @param context Where names and range bounds are resolved.
     * @return The type, {@link Type#ERROR} if it could not be resolved.
     */
    public static Type resolve(DataTypeNode node, ASTContext context) {
        if (node instanceof KeywordTypeNode keyword) {
            Type base = builtin(keyword.keyword().text());
            if (base == null) {
                context.addDiag(DiagCode.UNKNOWN_TYPE, keyword.location(), keyword.keyword().text());
                return Type.ERROR;
            }
            return applySigningAndDimensions(base, keyword.signing(), keyword.dimensions(), context);
        }
        if (node instanceof ImplicitTypeNode implicit) {
            return applySigningAndDimensions(BUILTINS.get("logic"), implicit.signing(), implicit.dimensions(), context);
        }
        if (node instanceof NamedTypeNode named) {
            Type base = resolveNamed(named, context);
            return base.isError() ? base : applySigningAndDimensions(base, null, named.dimensions(), context);
        }
        throw new IllegalStateException("Unknown data type syntax: " + node.getClass().getSimpleName());
    }

    private static Type resolveNamed(NamedTypeNode named, ASTContext context) {
        Symbol symbol;
        String text;
        if (named.name() instanceof IdentifierNode identifier) {
            text = identifier.name();
            symbol = context.scope().lookup(text);
        } else if (named.name() instanceof ScopedNameNode scoped) {
            text = scoped.toString();
            symbol = context.getCompilation().getPackage(scoped.scope().name())
                    .map(p -> p.find(scoped.name().name()))
                    .orElse(null);
        } else {
            context.addDiag(DiagCode.UNKNOWN_TYPE, named.location(), named.name().toString());
            return Type.ERROR;
        }

        if (symbol == null) {
            Type builtin = builtin(text);
            if (builtin != null) {
                return builtin;
            }
            context.addDiag(DiagCode.UNKNOWN_TYPE, named.location(), text);
            return Type.ERROR;
        }
        if (symbol instanceof TypeParameterSymbol typeParameter) {
            return typeParameter.getTargetType();
        }
        context.addDiag(DiagCode.NOT_A_TYPE, named.location(), text);
        return Type.ERROR;
    }

    private static Type applySigningAndDimensions(Type base, Token signing, List<RangeNode> dimensions, ASTContext context) {
        boolean signed = signing != null ? signing.text().equals("signed") : base.signed();
        if (dimensions.isEmpty() && signed == base.signed()) {
            return base;
        }
        if (!base.isIntegral()) {
            return base;
        }

        BigInteger width = BigInteger.valueOf(base.width());
        StringBuilder name = new StringBuilder(base.name());
        if (signed != base.signed()) {
            name.append(signed ? " signed" : " unsigned");
        }
        for (RangeNode range : dimensions) {
            ConstantValue left = context.evaluate(range.left());
            ConstantValue right = context.evaluate(range.right());
            if (!(left instanceof ConstantValue.IntegerValue l) || !(right instanceof ConstantValue.IntegerValue r)) {
                if (left.isValid() && right.isValid()) {
                    context.addDiag(DiagCode.EXPRESSION_NOT_CONSTANT, range.location());
                }
                return Type.ERROR;
            }
            width = width.multiply(l.value().subtract(r.value()).abs().add(BigInteger.ONE));
            if (width.compareTo(MAX_PACKED_WIDTH) > 0) {
                context.addDiag(DiagCode.PACKED_TYPE_TOO_LARGE, range.location(), width, MAX_PACKED_WIDTH);
                return Type.ERROR;
            }
            name.append('[').append(l).append(':').append(r).append(']');
        }
        return new Type(Type.Kind.INTEGRAL, name.toString(), width.intValueExact(), signed, base.fourState());
    }

    /**
     * @param value A constant value.
     * @return The type a parameter without a written type gets from this value.
     */
    public static Type forValue(ConstantValue value) {
        if (value instanceof ConstantValue.IntegerValue integer) {
            return integer.width() == 32 && integer.signed() ? Type.INT : vector(integer.width(), integer.signed());
        }
        if (value instanceof ConstantValue.RealValue) {
            return Type.REAL;
        }
        if (value instanceof ConstantValue.StringValue) {
            return Type.STRING;
        }
        return Type.ERROR;
    }

    /**
     * Converts a value to a type. Integral targets truncate or extend, reals round to the
     * nearest integer, and strings are packed eight bits per character.
     *
     * @param value    The value.
     * @param target   The target type.
     * @param context  Receives conversion errors.
     * @param location The location conversion errors are reported at.
     * @return The converted value, {@link ConstantValue.InvalidValue} if it cannot be converted.
     */
    public static ConstantValue coerce(ConstantValue value, Type target, ASTContext context, SourceLocation location) {
        if (!value.isValid() || target.isError()) {
            return ConstantValue.InvalidValue.INSTANCE;
        }
        switch (target.kind()) {
            case INTEGRAL -> {
                if (value instanceof ConstantValue.IntegerValue integer) {
                    return integer.resize(target.width(), target.signed());
                }
                if (value instanceof ConstantValue.RealValue real) {
                    if (Double.isNaN(real.value()) || Double.isInfinite(real.value())) {
                        break;
                    }
                    BigInteger rounded = new BigDecimal(real.value()).setScale(0, RoundingMode.HALF_UP).toBigIntegerExact();
                    return ConstantValue.IntegerValue.of(rounded, target.width(), target.signed());
                }
                if (value instanceof ConstantValue.StringValue string) {
                    byte[] bytes = string.value().getBytes(StandardCharsets.ISO_8859_1);
                    BigInteger packed = bytes.length == 0 ? BigInteger.ZERO : new BigInteger(1, bytes);
                    return ConstantValue.IntegerValue.of(packed, target.width(), target.signed());
                }
            }
            case REAL -> {
                if (value instanceof ConstantValue.RealValue) {
                    return value;
                }
                if (value instanceof ConstantValue.IntegerValue integer) {
                    double converted = new BigDecimal(integer.value()).doubleValue();
                    return new ConstantValue.RealValue(target.width() == 32 ? (float) converted : converted);
                }
            }
            case STRING -> {
                if (value instanceof ConstantValue.StringValue) {
                    return value;
                }
            }
            case ERROR -> {
                return ConstantValue.InvalidValue.INSTANCE;
            }
        }
        context.addDiag(DiagCode.BAD_CONVERSION, location, forValue(value), target);
        return ConstantValue.InvalidValue.INSTANCE;
    }
}
