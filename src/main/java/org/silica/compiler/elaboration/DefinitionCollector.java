package org.silica.compiler.elaboration;

import org.silica.compiler.frontend.parser.ast.AstNode;
import org.silica.compiler.frontend.parser.ast.DeclarationKind;
import org.silica.compiler.frontend.parser.ast.HierarchyInstantiationNode;
import org.silica.compiler.frontend.parser.ast.ModuleDeclarationNode;
import org.silica.compiler.frontend.parser.ast.ParamDeclNode;
import org.silica.compiler.frontend.syntax.SyntaxTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link Definition}s from the top-level declarations of syntax trees.
 * <p>
 * Parameters declared in the body of a definition that has a parameter port list are
 * local, as are all parameters of a package.
 */
public class DefinitionCollector {

    private final Compilation compilation;

    public DefinitionCollector(Compilation compilation) {
        this.compilation = compilation;
    }

    /**
     * Adds every top-level module, interface, program and package of a tree to the compilation.
     *
     * @param tree The parsed tree.
     */
    public void collect(SyntaxTree tree) {
        for (ModuleDeclarationNode declaration : tree.getMetadata().getDeclarations()) {
            compilation.addDefinition(createDefinition(declaration, tree.isLibrary()));
        }
    }

    /**
     * Creates the definition of one declaration.
     *
     * @param declaration The declaration syntax.
     * @param library     Whether the declaration comes from a library tree.
     * @return The definition.
     */
    public static Definition createDefinition(ModuleDeclarationNode declaration, boolean library) {
        List<ParameterDecl> parameters = new ArrayList<>();
        boolean hasPortList = declaration.parameterPorts() != null;
        if (hasPortList) {
            ParameterBuilder.createDecls(declaration.parameterPorts(), parameters);
        }

        boolean allLocal = declaration.kind() == DeclarationKind.PACKAGE;
        List<HierarchyInstantiationNode> instantiations = new ArrayList<>();
        for (AstNode member : declaration.members()) {
            if (member instanceof ParamDeclNode paramDecl) {
                boolean isLocal = allLocal || hasPortList || paramDecl.isLocalKeyword();
                ParameterBuilder.createDecls(paramDecl, isLocal, false, parameters);
            } else if (member instanceof HierarchyInstantiationNode instantiation) {
                instantiations.add(instantiation);
            }
        }
        return new Definition(declaration.name().name(), declaration.kind(), declaration.location(),
                parameters, instantiations, library);
    }
}
