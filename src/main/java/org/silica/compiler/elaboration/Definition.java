package org.silica.compiler.elaboration;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.frontend.parser.ast.DeclarationKind;
import org.silica.compiler.frontend.parser.ast.HierarchyInstantiationNode;

import java.util.List;

/**
 * A module, interface, program or package that can be elaborated.
 *
 * @param name           The declared name.
 * @param kind           The kind of design element.
 * @param location       Where the definition is declared.
 * @param parameters     The declared parameters, port parameters first, in declaration order.
 * @param instantiations The instantiations in the body.
 * @param library        Whether the definition comes from a library tree.
 */
public record Definition(
        String name,
        DeclarationKind kind,
        SourceLocation location,
        List<ParameterDecl> parameters,
        List<HierarchyInstantiationNode> instantiations,
        boolean library
) {

    public Definition {
        parameters = List.copyOf(parameters);
        instantiations = List.copyOf(instantiations);
    }

    /**
     * @return {@code true} if the definition has a parameter port list entry.
     */
    public boolean hasPortParams() {
        return parameters.stream().anyMatch(ParameterDecl::isPortParam);
    }
}
