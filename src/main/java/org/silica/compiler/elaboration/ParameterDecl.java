package org.silica.compiler.elaboration;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.parser.ast.DeclaratorNode;
import org.silica.compiler.frontend.parser.ast.ExpressionNode;
import org.silica.compiler.frontend.parser.ast.ParameterDeclarationNode;
import org.silica.compiler.frontend.parser.ast.TypeAssignmentNode;

/**
 * A declared parameter of a definition, before it is bound for an instance.
 * <p>
 * Declarations come either from syntax or are synthesized with a given type and initializer.
 *
 * @param name             The parameter name.
 * @param location         Where the parameter is declared.
 * @param isTypeParam      {@code true} for a type parameter.
 * @param isLocalParam     {@code true} if the parameter cannot be assigned from outside.
 * @param isPortParam      {@code true} if declared in the parameter port list.
 * @param valueSyntax      The declaration of a value parameter, or {@code null}.
 * @param valueDecl        The declarator of a value parameter, or {@code null}.
 * @param typeDecl         The declarator of a type parameter, or {@code null}.
 * @param givenType        The type of a synthesized declaration, or {@code null}.
 * @param givenInitializer The initializer of a synthesized value parameter, or {@code null}.
 */
public record ParameterDecl(
        String name,
        SourceLocation location,
        boolean isTypeParam,
        boolean isLocalParam,
        boolean isPortParam,
        ParameterDeclarationNode valueSyntax,
        DeclaratorNode valueDecl,
        TypeAssignmentNode typeDecl,
        Type givenType,
        ExpressionNode givenInitializer
) {

    public static ParameterDecl ofValue(ParameterDeclarationNode syntax, DeclaratorNode declarator,
                                        boolean isLocal, boolean isPort) {
        return new ParameterDecl(declarator.name().name(), declarator.location(), false, isLocal, isPort,
                syntax, declarator, null, null, null);
    }

    public static ParameterDecl ofType(TypeAssignmentNode declarator, boolean isLocal, boolean isPort) {
        return new ParameterDecl(declarator.name().name(), declarator.location(), true, isLocal, isPort,
                null, null, declarator, null, null);
    }

    /**
     * Creates a value parameter without syntax.
     *
     * @throws IllegalArgumentException if no type is given.
     */
    public static ParameterDecl synthesizedValue(String name, SourceLocation location, Type givenType,
                                                 ExpressionNode givenInitializer, boolean isLocal, boolean isPort) {
        if (givenType == null) {
            throw new IllegalArgumentException("A synthesized value parameter needs a type: " + name);
        }
        return new ParameterDecl(name, location, false, isLocal, isPort, null, null, null, givenType, givenInitializer);
    }

    /**
     * Creates a type parameter without syntax. A {@code null} type leaves it without a default.
     */
    public static ParameterDecl synthesizedType(String name, SourceLocation location, Type givenType,
                                                boolean isLocal, boolean isPort) {
        return new ParameterDecl(name, location, true, isLocal, isPort, null, null, null, givenType, null);
    }

    /**
     * @return {@code true} if this declaration comes from source syntax.
     */
    public boolean hasSyntax() {
        return valueDecl != null || typeDecl != null;
    }
}
