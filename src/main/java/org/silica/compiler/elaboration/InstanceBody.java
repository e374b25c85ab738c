package org.silica.compiler.elaboration;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.diagnostics.DiagCode;
import org.silica.compiler.frontend.lexer.Token;
import org.silica.compiler.frontend.parser.ast.HierarchyInstantiationNode;
import org.silica.compiler.frontend.parser.ast.ParameterValueAssignmentNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * One elaborated instance of a definition: its bound parameters and the instances below it.
 */
public final class InstanceBody {

    private final Definition definition;
    private final String instanceName;
    private final Scope scope;
    private final List<ParameterSymbolBase> parameters;
    private final List<InstanceBody> children = new ArrayList<>();
    private final boolean hasErrors;

    private InstanceBody(Definition definition, String instanceName, Scope scope,
                         List<ParameterSymbolBase> parameters, boolean hasErrors) {
        this.definition = definition;
        this.instanceName = instanceName;
        this.scope = scope;
        this.parameters = List.copyOf(parameters);
        this.hasErrors = hasErrors;
    }

    /**
     * Elaborates an instance and, recursively, every instance in its body.
     *
     * @param compilation        The compilation that holds the definitions.
     * @param definition         The instantiated definition.
     * @param instanceName       The name of the instance.
     * @param instanceLoc        The location of the instantiation.
     * @param assignments        The parameter value assignment, or {@code null}.
     * @param instantiatingScope The scope containing the instantiation.
     * @param context            The instantiation context.
     * @return The elaborated instance.
     */
    public static InstanceBody create(Compilation compilation, Definition definition, String instanceName,
                                      SourceLocation instanceLoc, ParameterValueAssignmentNode assignments,
                                      Scope instantiatingScope, ElaborationContext context) {
        return create(compilation, definition, instanceName, instanceLoc, assignments, instantiatingScope,
                context, new ArrayDeque<>());
    }

    private static InstanceBody create(Compilation compilation, Definition definition, String instanceName,
                                       SourceLocation instanceLoc, ParameterValueAssignmentNode assignments,
                                       Scope instantiatingScope, ElaborationContext context, Deque<String> chain) {
        Scope bodyScope = compilation.createScope(instanceName, compilation.getRoot());
        ParameterBuilder builder = ParameterBuilder.forInstance(instantiatingScope, definition, assignments);

        List<ParameterSymbolBase> parameters = new ArrayList<>();
        for (ParameterDecl decl : definition.parameters()) {
            parameters.add(builder.createParam(decl, bodyScope, instanceLoc, context));
        }
        parameters.forEach(ParameterSymbolBase::resolve);

        InstanceBody body = new InstanceBody(definition, instanceName, bodyScope, parameters, builder.hasErrors());

        chain.push(definition.name());
        try {
            for (HierarchyInstantiationNode instantiation : definition.instantiations()) {
                body.elaborateChild(compilation, instantiation, context, chain);
            }
        } finally {
            chain.pop();
        }
        return body;
    }

    private void elaborateChild(Compilation compilation, HierarchyInstantiationNode instantiation,
                                ElaborationContext parentContext, Deque<String> chain) {
        String typeName = instantiation.type().name();
        Optional<Definition> childDefinition = compilation.getDefinition(typeName);
        if (childDefinition.isEmpty()) {
            scope.addDiag(DiagCode.UNKNOWN_DEFINITION, instantiation.location(), typeName);
            return;
        }
        if (chain.contains(typeName)) {
            scope.addDiag(DiagCode.RECURSIVE_INSTANTIATION, instantiation.location(), typeName);
            return;
        }

        for (Token name : instantiation.instanceNames()) {
            ElaborationContext childContext = new ElaborationContext(
                    new ASTContext(scope),
                    parentContext.overrides().child(name.name()),
                    parentContext.forceInvalidValues() || hasErrors,
                    parentContext.suppressErrors());
            children.add(create(compilation, childDefinition.get(), name.name(), name.location(),
                    instantiation.parameters(), scope, childContext, chain));
        }
    }

    public Definition getDefinition() {
        return definition;
    }

    public String getInstanceName() {
        return instanceName;
    }

    public Scope getScope() {
        return scope;
    }

    public List<ParameterSymbolBase> getParameters() {
        return parameters;
    }

    /**
     * @param name A parameter name.
     * @return The bound parameter of that name.
     */
    public Optional<ParameterSymbolBase> findParameter(String name) {
        return parameters.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    public List<InstanceBody> getChildren() {
        return List.copyOf(children);
    }

    /**
     * @return {@code true} if some parameter of this instance was left without a value.
     */
    public boolean hasErrors() {
        return hasErrors;
    }

    @Override
    public String toString() {
        return instanceName + " (" + definition.name() + ")";
    }
}
