package org.silica.compiler.elaboration;

import org.silica.compiler.diagnostics.DiagCode;
import org.silica.compiler.elaboration.ConstantValue.IntegerValue;
import org.silica.compiler.elaboration.ConstantValue.InvalidValue;
import org.silica.compiler.elaboration.ConstantValue.RealValue;
import org.silica.compiler.elaboration.ConstantValue.StringValue;
import org.silica.compiler.frontend.lexer.IntegerLiteral;
import org.silica.compiler.frontend.lexer.Token;
import org.silica.compiler.frontend.parser.ast.BinaryNode;
import org.silica.compiler.frontend.parser.ast.ConditionalNode;
import org.silica.compiler.frontend.parser.ast.ExpressionNode;
import org.silica.compiler.frontend.parser.ast.IdentifierNode;
import org.silica.compiler.frontend.parser.ast.LiteralNode;
import org.silica.compiler.frontend.parser.ast.OpaqueExpressionNode;
import org.silica.compiler.frontend.parser.ast.ScopedNameNode;
import org.silica.compiler.frontend.parser.ast.SystemCallNode;
import org.silica.compiler.frontend.parser.ast.UnaryNode;

import java.math.BigInteger;

/**
 * Evaluates constant expressions of parameter initializers and assignments.
 * <p>
 * Integer operations use the larger operand width and are signed only if both operands
 * are; comparisons and logical operators yield a 1-bit result. Unknown bits are not
 * modeled. Errors are reported once and turn into {@link InvalidValue}, which
 * propagates silently through enclosing operators.
 */
public class ExpressionEvaluator {

    private static final int MAX_SHIFT = 1 << 16;

    private final ASTContext context;

    public ExpressionEvaluator(ASTContext context) {
        this.context = context;
    }

    public ConstantValue evaluate(ExpressionNode expression) {
        if (expression instanceof LiteralNode literal) {
            return evaluateLiteral(literal.token());
        }
        if (expression instanceof IdentifierNode identifier) {
            return valueOf(context.scope().lookup(identifier.name()), identifier.name(), expression);
        }
        if (expression instanceof ScopedNameNode scoped) {
            Symbol symbol = context.getCompilation().getPackage(scoped.scope().name())
                    .map(p -> p.find(scoped.name().name()))
                    .orElse(null);
            return valueOf(symbol, scoped.toString(), expression);
        }
        if (expression instanceof UnaryNode unary) {
            return evaluateUnary(unary);
        }
        if (expression instanceof BinaryNode binary) {
            return evaluateBinary(binary);
        }
        if (expression instanceof ConditionalNode conditional) {
            ConstantValue condition = evaluate(conditional.condition());
            if (!condition.isValid()) {
                return InvalidValue.INSTANCE;
            }
            Boolean truth = truthOf(condition, "?:", conditional);
            if (truth == null) {
                return InvalidValue.INSTANCE;
            }
            return evaluate(truth ? conditional.whenTrue() : conditional.whenFalse());
        }
        if (expression instanceof SystemCallNode call) {
            return evaluateSystemCall(call);
        }
        if (expression instanceof OpaqueExpressionNode opaque) {
            if (!opaque.tokens().isEmpty()) {
                context.addDiag(DiagCode.EXPRESSION_NOT_CONSTANT, opaque.location());
            }
            return InvalidValue.INSTANCE;
        }
        throw new IllegalStateException("Unknown expression syntax: " + expression.getClass().getSimpleName());
    }

    private ConstantValue evaluateLiteral(Token token) {
        return switch (token.type()) {
            case INTEGER_LITERAL -> {
                IntegerLiteral literal = (IntegerLiteral) token.value();
                yield IntegerValue.of(literal.value(), literal.width(), literal.signed());
            }
            case REAL_LITERAL -> new RealValue((Double) token.value());
            case STRING_LITERAL -> new StringValue((String) token.value());
            default -> throw new IllegalStateException("Not a literal: " + token);
        };
    }

    private ConstantValue valueOf(Symbol symbol, String name, ExpressionNode expression) {
        if (symbol instanceof ParameterSymbol parameter) {
            return parameter.getValue();
        }
        if (symbol instanceof TypeParameterSymbol) {
            context.addDiag(DiagCode.NOT_A_VALUE, expression.location(), name);
        } else {
            context.addDiag(DiagCode.UNDECLARED_IDENTIFIER, expression.location(), name);
        }
        return InvalidValue.INSTANCE;
    }

    private ConstantValue evaluateUnary(UnaryNode unary) {
        ConstantValue operand = evaluate(unary.operand());
        if (!operand.isValid()) {
            return operand;
        }
        String op = unary.operator().text();

        if (op.equals("!")) {
            Boolean truth = truthOf(operand, op, unary);
            return truth == null ? InvalidValue.INSTANCE : IntegerValue.bool(!truth);
        }
        if (operand instanceof RealValue real) {
            return switch (op) {
                case "+" -> real;
                case "-" -> new RealValue(-real.value());
                default -> badOperands(op, unary);
            };
        }
        if (!(operand instanceof IntegerValue integer)) {
            return badOperands(op, unary);
        }

        int width = integer.width();
        BigInteger bits = integer.unsignedValue();
        return switch (op) {
            case "+" -> integer;
            case "-" -> IntegerValue.of(integer.value().negate(), width, integer.signed());
            case "~" -> IntegerValue.of(integer.value().not(), width, integer.signed());
            case "&" -> IntegerValue.bool(bits.bitCount() == width);
            case "~&" -> IntegerValue.bool(bits.bitCount() != width);
            case "|" -> IntegerValue.bool(bits.signum() != 0);
            case "~|" -> IntegerValue.bool(bits.signum() == 0);
            case "^" -> IntegerValue.bool(bits.bitCount() % 2 == 1);
            case "~^", "^~" -> IntegerValue.bool(bits.bitCount() % 2 == 0);
            default -> badOperands(op, unary);
        };
    }

    private ConstantValue evaluateBinary(BinaryNode binary) {
        String op = binary.operator().text();
        ConstantValue left = evaluate(binary.left());
        ConstantValue right = evaluate(binary.right());
        if (!left.isValid() || !right.isValid()) {
            return InvalidValue.INSTANCE;
        }

        if (op.equals("&&") || op.equals("||")) {
            Boolean l = truthOf(left, op, binary);
            Boolean r = truthOf(right, op, binary);
            if (l == null || r == null) {
                return InvalidValue.INSTANCE;
            }
            return IntegerValue.bool(op.equals("&&") ? l && r : l || r);
        }

        if (left instanceof StringValue || right instanceof StringValue) {
            if (left instanceof StringValue ls && right instanceof StringValue rs) {
                switch (op) {
                    case "==", "===" -> {
                        return IntegerValue.bool(ls.value().equals(rs.value()));
                    }
                    case "!=", "!==" -> {
                        return IntegerValue.bool(!ls.value().equals(rs.value()));
                    }
                    default -> {
                        // no other operator applies to strings
                    }
                }
            }
            return badOperands(op, binary);
        }

        if (left instanceof RealValue || right instanceof RealValue) {
            return evaluateReal(op, toDouble(left), toDouble(right), binary);
        }
        return evaluateInteger(op, (IntegerValue) left, (IntegerValue) right, binary);
    }

    private ConstantValue evaluateReal(String op, double l, double r, BinaryNode binary) {
        return switch (op) {
            case "+" -> new RealValue(l + r);
            case "-" -> new RealValue(l - r);
            case "*" -> new RealValue(l * r);
            case "/" -> new RealValue(l / r);
            case "**" -> new RealValue(Math.pow(l, r));
            case "==", "===", "==?" -> IntegerValue.bool(l == r);
            case "!=", "!==", "!=?" -> IntegerValue.bool(l != r);
            case "<" -> IntegerValue.bool(l < r);
            case "<=" -> IntegerValue.bool(l <= r);
            case ">" -> IntegerValue.bool(l > r);
            case ">=" -> IntegerValue.bool(l >= r);
            default -> badOperands(op, binary);
        };
    }

    private ConstantValue evaluateInteger(String op, IntegerValue left, IntegerValue right, BinaryNode binary) {
        switch (op) {
            case "<<", "<<<" -> {
                int amount = shiftAmount(right);
                return IntegerValue.of(left.value().shiftLeft(Math.min(amount, left.width())), left.width(), left.signed());
            }
            case ">>" -> {
                int amount = shiftAmount(right);
                return IntegerValue.of(left.unsignedValue().shiftRight(amount), left.width(), left.signed());
            }
            case ">>>" -> {
                int amount = shiftAmount(right);
                BigInteger source = left.signed() ? left.value() : left.unsignedValue();
                return IntegerValue.of(source.shiftRight(amount), left.width(), left.signed());
            }
            default -> {
                // operators that size both operands alike
            }
        }

        int width = Math.max(left.width(), right.width());
        boolean signed = left.signed() && right.signed();
        BigInteger l = left.resize(width, signed).value();
        BigInteger r = right.resize(width, signed).value();

        return switch (op) {
            case "+" -> IntegerValue.of(l.add(r), width, signed);
            case "-" -> IntegerValue.of(l.subtract(r), width, signed);
            case "*" -> IntegerValue.of(l.multiply(r), width, signed);
            case "/" -> r.signum() == 0 ? divideByZero(binary) : IntegerValue.of(l.divide(r), width, signed);
            case "%" -> r.signum() == 0 ? divideByZero(binary) : IntegerValue.of(l.remainder(r), width, signed);
            case "**" -> power(l, r, width, signed, binary);
            case "&" -> IntegerValue.of(l.and(r), width, signed);
            case "|" -> IntegerValue.of(l.or(r), width, signed);
            case "^" -> IntegerValue.of(l.xor(r), width, signed);
            case "~^", "^~" -> IntegerValue.of(l.xor(r).not(), width, signed);
            case "==", "===", "==?" -> IntegerValue.bool(l.equals(r));
            case "!=", "!==", "!=?" -> IntegerValue.bool(!l.equals(r));
            case "<" -> IntegerValue.bool(l.compareTo(r) < 0);
            case "<=" -> IntegerValue.bool(l.compareTo(r) <= 0);
            case ">" -> IntegerValue.bool(l.compareTo(r) > 0);
            case ">=" -> IntegerValue.bool(l.compareTo(r) >= 0);
            default -> badOperands(op, binary);
        };
    }

    private ConstantValue power(BigInteger base, BigInteger exponent, int width, boolean signed, BinaryNode binary) {
        if (exponent.signum() >= 0) {
            return IntegerValue.of(base.modPow(exponent, BigInteger.ONE.shiftLeft(width)), width, signed);
        }
        if (base.equals(BigInteger.ONE)) {
            return IntegerValue.of(BigInteger.ONE, width, signed);
        }
        if (base.equals(BigInteger.ONE.negate())) {
            return IntegerValue.of(exponent.testBit(0) ? base : BigInteger.ONE, width, signed);
        }
        if (base.signum() == 0) {
            return divideByZero(binary);
        }
        return IntegerValue.of(BigInteger.ZERO, width, signed);
    }

    private ConstantValue evaluateSystemCall(SystemCallNode call) {
        String name = call.name().text();
        switch (name) {
            case "$clog2" -> {
                IntegerValue argument = singleIntegerArgument(call);
                if (argument == null) {
                    return InvalidValue.INSTANCE;
                }
                BigInteger n = argument.unsignedValue();
                int result = n.compareTo(BigInteger.ONE) <= 0 ? 0 : n.subtract(BigInteger.ONE).bitLength();
                return IntegerValue.of(result);
            }
            case "$signed", "$unsigned" -> {
                IntegerValue argument = singleIntegerArgument(call);
                if (argument == null) {
                    return InvalidValue.INSTANCE;
                }
                return argument.resize(argument.width(), name.equals("$signed"));
            }
            case "$bits" -> {
                if (call.arguments().size() != 1) {
                    context.addDiag(DiagCode.WRONG_ARGUMENT_COUNT, call.location(), name, 1, call.arguments().size());
                    return InvalidValue.INSTANCE;
                }
                ExpressionNode argument = call.arguments().get(0);
                if (argument instanceof IdentifierNode identifier
                        && context.scope().lookup(identifier.name()) instanceof TypeParameterSymbol typeParameter) {
                    Type type = typeParameter.getTargetType();
                    return type.isError() ? InvalidValue.INSTANCE : IntegerValue.of(type.width());
                }
                ConstantValue value = evaluate(argument);
                if (!value.isValid()) {
                    return value;
                }
                Type type = Types.forValue(value);
                return IntegerValue.of(value instanceof StringValue s ? 8L * s.value().length() : type.width());
            }
            default -> {
                context.addDiag(DiagCode.UNKNOWN_SYSTEM_FUNCTION, call.location(), name);
                return InvalidValue.INSTANCE;
            }
        }
    }

    private IntegerValue singleIntegerArgument(SystemCallNode call) {
        if (call.arguments().size() != 1) {
            context.addDiag(DiagCode.WRONG_ARGUMENT_COUNT, call.location(), call.name().text(), 1, call.arguments().size());
            return null;
        }
        ConstantValue value = evaluate(call.arguments().get(0));
        if (value instanceof IntegerValue integer) {
            return integer;
        }
        if (value.isValid()) {
            context.addDiag(DiagCode.BAD_OPERAND_TYPES, call.location(), call.name().text());
        }
        return null;
    }

    private Boolean truthOf(ConstantValue value, String op, ExpressionNode at) {
        if (value instanceof IntegerValue integer) {
            return integer.isTrue();
        }
        if (value instanceof RealValue real) {
            return real.value() != 0.0;
        }
        badOperands(op, at);
        return null;
    }

    private static double toDouble(ConstantValue value) {
        return value instanceof RealValue real ? real.value() : ((IntegerValue) value).value().doubleValue();
    }

    private static int shiftAmount(IntegerValue amount) {
        BigInteger bits = amount.unsignedValue();
        return bits.bitLength() > 31 ? MAX_SHIFT : Math.min(bits.intValue(), MAX_SHIFT);
    }

    private ConstantValue divideByZero(ExpressionNode at) {
        context.addDiag(DiagCode.DIVIDE_BY_ZERO, at.location());
        return InvalidValue.INSTANCE;
    }

    private ConstantValue badOperands(String op, ExpressionNode at) {
        context.addDiag(DiagCode.BAD_OPERAND_TYPES, at.location(), op);
        return InvalidValue.INSTANCE;
    }
}
