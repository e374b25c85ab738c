package org.silica.compiler.elaboration;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.diagnostics.DiagCode;
import org.silica.compiler.frontend.parser.ast.DataTypeNode;
import org.silica.compiler.frontend.parser.ast.DeclaratorNode;
import org.silica.compiler.frontend.parser.ast.ExpressionNode;
import org.silica.compiler.frontend.parser.ast.ImplicitTypeNode;

/**
 * A value parameter of one instance.
 * <p>
 * The value is computed on first access from the initializer. A parameter declared without a
 * type, or with only signing or a range, takes its remaining properties from the value.
 */
public class ParameterSymbol extends ParameterSymbolBase {

    private final DeclaredType declaredType = new DeclaredType(this);
    private ConstantValue value;
    private Type valueType;
    private boolean evaluating;

    public ParameterSymbol(String name, SourceLocation location, boolean localParam, boolean portParam) {
        super(name, location, localParam, portParam);
    }

    @Override
    public Kind kind() {
        return Kind.PARAMETER;
    }

    public DeclaredType getDeclaredType() {
        return declaredType;
    }

    public void setType(Type type) {
        declaredType.setType(type);
    }

    public void setDeclaredType(DataTypeNode type) {
        declaredType.setTypeSyntax(type);
    }

    public void setInitializer(ExpressionNode initializer) {
        declaredType.setInitializerSyntax(initializer, initializer.location());
    }

    public void setFromDeclarator(DeclaratorNode declarator) {
        if (declarator.initializer() != null) {
            declaredType.setInitializerSyntax(declarator.initializer(), declarator.initializer().location());
        }
    }

    public void setInitializerSyntax(ExpressionNode initializer, SourceLocation location) {
        declaredType.setInitializerSyntax(initializer, location);
    }

    /**
     * Sets the value directly, bypassing the initializer.
     *
     * @param newValue      The value; {@code null} marks the parameter as invalid.
     * @param needsCoercion Whether to convert the value to the declared type first.
     */
    public void setValue(ConstantValue newValue, boolean needsCoercion) {
        if (newValue == null) {
            value = ConstantValue.InvalidValue.INSTANCE;
            valueType = Type.ERROR;
            return;
        }
        value = needsCoercion ? convert(newValue, location()) : newValue;
        valueType = typeFor(value);
    }

    /**
     * @return The value, {@link ConstantValue.InvalidValue} if it has none or could not be computed.
     */
    public ConstantValue getValue() {
        if (value != null) {
            return value;
        }
        if (evaluating) {
            getParentScope().addDiag(DiagCode.RECURSIVE_DEFINITION, location(), name());
            return ConstantValue.InvalidValue.INSTANCE;
        }

        ExpressionNode initializer = declaredType.getInitializerSyntax();
        if (initializer == null) {
            setValue(null, false);
            return value;
        }

        evaluating = true;
        try {
            ConstantValue raw = declaredType.initializerContext().evaluate(initializer);
            value = convert(raw, declaredType.getInitializerLocation());
            valueType = typeFor(value);
        } finally {
            evaluating = false;
        }
        return value;
    }

    /**
     * @return The type of this parameter.
     */
    public Type getType() {
        getValue();
        return valueType;
    }

    @Override
    public void resolve() {
        getValue();
    }

    private ConstantValue convert(ConstantValue raw, SourceLocation at) {
        if (!raw.isValid()) {
            return raw;
        }
        Type target = targetType(raw);
        return Types.coerce(raw, target, ownContext(), at);
    }

    private Type targetType(ConstantValue raw) {
        if (declaredType.getTypeSyntax() instanceof ImplicitTypeNode implicit) {
            if (implicit.isBare()) {
                return Types.forValue(raw);
            }
            if (implicit.dimensions().isEmpty()) {
                Type inferred = Types.forValue(raw);
                boolean signed = implicit.signing().text().equals("signed");
                return inferred.isIntegral() ? Types.vector(inferred.width(), signed) : inferred;
            }
        }
        Type declared = declaredType.getType();
        return declared != null ? declared : Types.forValue(raw);
    }

    private Type typeFor(ConstantValue resolved) {
        if (!resolved.isValid()) {
            return Type.ERROR;
        }
        return targetType(resolved);
    }

    @Override
    public String toString() {
        return "parameter " + name() + " = " + (value != null ? value : "<unresolved>");
    }
}
