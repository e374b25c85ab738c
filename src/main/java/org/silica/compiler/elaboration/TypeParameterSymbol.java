package org.silica.compiler.elaboration;

import org.silica.compiler.api.SourceLocation;

/**
 * A type parameter of one instance.
 */
public class TypeParameterSymbol extends ParameterSymbolBase {

    private final DeclaredType targetType = new DeclaredType(this);

    public TypeParameterSymbol(String name, SourceLocation location, boolean localParam, boolean portParam) {
        super(name, location, localParam, portParam);
    }

    @Override
    public Kind kind() {
        return Kind.TYPE_PARAMETER;
    }

    /**
     * @return The holder of the target type, which still may be unresolved syntax.
     */
    public DeclaredType getDeclaredTargetType() {
        return targetType;
    }

    /**
     * @return The type this parameter stands for, {@link Type#ERROR} if it has none.
     */
    public Type getTargetType() {
        Type type = targetType.getType();
        return type != null ? type : Type.ERROR;
    }

    @Override
    public void resolve() {
        getTargetType();
    }

    @Override
    public String toString() {
        return "parameter type " + name() + " = " + getTargetType();
    }
}
