package org.silica.compiler.elaboration;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.diagnostics.DiagCode;
import org.silica.compiler.diagnostics.Diagnostic;
import org.silica.compiler.frontend.parser.ast.AstNode;
import org.silica.compiler.frontend.parser.ast.DataTypeNode;
import org.silica.compiler.frontend.parser.ast.DeclaratorNode;
import org.silica.compiler.frontend.parser.ast.ExpressionNode;
import org.silica.compiler.frontend.parser.ast.NamedParamAssignmentNode;
import org.silica.compiler.frontend.parser.ast.NamedTypeNode;
import org.silica.compiler.frontend.parser.ast.OrderedParamAssignmentNode;
import org.silica.compiler.frontend.parser.ast.ParamAssignmentNode;
import org.silica.compiler.frontend.parser.ast.ParamDeclNode;
import org.silica.compiler.frontend.parser.ast.ParameterDeclarationNode;
import org.silica.compiler.frontend.parser.ast.ParameterPortListNode;
import org.silica.compiler.frontend.parser.ast.ParameterValueAssignmentNode;
import org.silica.compiler.frontend.parser.ast.TypeAssignmentNode;
import org.silica.compiler.frontend.parser.ast.TypeParameterDeclarationNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds the declared parameters of a definition to the arguments of one instantiation.
 * <p>
 * Usage: call {@link #setAssignments(ParameterValueAssignmentNode)} once with the
 * {@code #(...)} of the instantiation, then {@link #createParam} for every declaration in
 * order. Errors are reported to the scope the builder was created for and never stop the
 * binding; {@link #hasErrors()} tells whether a parameter ended up without a value.
 */
public class ParameterBuilder {

    private final Scope scope;
    private final String definitionName;
    private final List<ParameterDecl> parameterDecls;
    private final Map<String, AstNode> assignments = new HashMap<>();
    private boolean anyErrors;

    /**
     * @param scope          The scope that contains the instantiation; diagnostics go here.
     * @param definitionName The name of the instantiated definition, used in messages.
     * @param parameterDecls The declared parameters of the definition, in declaration order.
     */
    public ParameterBuilder(Scope scope, String definitionName, List<ParameterDecl> parameterDecls) {
        this.scope = scope;
        this.definitionName = definitionName;
        this.parameterDecls = List.copyOf(parameterDecls);
    }

    /**
     * Creates a builder for an instance of a definition with its assignments already set.
     *
     * @param scope       The scope that contains the instantiation.
     * @param definition  The instantiated definition.
     * @param assignments The parameter value assignment, or {@code null} if none was written.
     * @return The builder.
     */
    public static ParameterBuilder forInstance(Scope scope, Definition definition, ParameterValueAssignmentNode assignments) {
        ParameterBuilder builder = new ParameterBuilder(scope, definition.name(), definition.parameters());
        if (assignments != null) {
            builder.setAssignments(assignments);
        }
        return builder;
    }

    /**
     * Matches the actual arguments of an instantiation to the declared parameters.
     * <p>
     * An instantiation uses either ordered or named arguments. If both appear, one error is
     * reported and none of the arguments are used. Ordered arguments skip local parameters.
     *
     * @param syntax The parameter value assignment.
     */
    public void setAssignments(ParameterValueAssignmentNode syntax) {
        boolean hasParamAssignments = false;
        boolean orderedAssignments = true;
        List<OrderedParamAssignmentNode> orderedParams = new ArrayList<>();
        Map<String, NamedParamAssignmentNode> namedParams = new LinkedHashMap<>();

        for (ParamAssignmentNode paramBase : syntax.assignments()) {
            boolean isOrdered = paramBase instanceof OrderedParamAssignmentNode;
            if (!hasParamAssignments) {
                hasParamAssignments = true;
                orderedAssignments = isOrdered;
            } else if (isOrdered != orderedAssignments) {
                scope.addDiag(DiagCode.MIXING_ORDERED_AND_NAMED_PARAMS, paramBase.location());
                return;
            }

            if (paramBase instanceof OrderedParamAssignmentNode ordered) {
                orderedParams.add(ordered);
            } else if (paramBase instanceof NamedParamAssignmentNode named) {
                String name = named.name().name();
                if (name.isEmpty()) {
                    continue;
                }
                NamedParamAssignmentNode previous = namedParams.putIfAbsent(name, named);
                if (previous != null) {
                    scope.addDiag(Diagnostic.of(DiagCode.DUPLICATE_PARAM_ASSIGNMENT, named.name().location(), name)
                            .withNote(DiagCode.NOTE_PREVIOUS_USAGE, previous.name().location()));
                }
            }
        }

        if (orderedAssignments) {
            matchOrdered(orderedParams);
        } else {
            matchNamed(namedParams);
        }
    }

    private void matchOrdered(List<OrderedParamAssignmentNode> orderedParams) {
        int orderedIndex = 0;
        for (ParameterDecl param : parameterDecls) {
            if (orderedIndex >= orderedParams.size()) {
                break;
            }
            if (param.isLocalParam()) {
                continue;
            }
            assignments.put(param.name(), orderedParams.get(orderedIndex++).value());
        }

        if (orderedIndex < orderedParams.size()) {
            scope.addDiag(DiagCode.TOO_MANY_PARAM_ASSIGNMENTS, orderedParams.get(orderedIndex).location(),
                    definitionName, orderedParams.size(), orderedIndex);
        }
    }

    private void matchNamed(Map<String, NamedParamAssignmentNode> namedParams) {
        Map<String, NamedParamAssignmentNode> unused = new LinkedHashMap<>(namedParams);
        for (ParameterDecl param : parameterDecls) {
            NamedParamAssignmentNode arg = unused.remove(param.name());
            if (arg == null) {
                continue;
            }
            if (param.isLocalParam()) {
                DiagCode code = param.isPortParam()
                        ? DiagCode.ASSIGNED_TO_LOCAL_PORT_PARAM
                        : DiagCode.ASSIGNED_TO_LOCAL_BODY_PARAM;
                scope.addDiag(Diagnostic.of(code, arg.name().location())
                        .withNote(DiagCode.NOTE_DECLARATION_HERE, param.location()));
                continue;
            }
            // .NAME() keeps the default
            if (arg.value() == null) {
                continue;
            }
            assignments.put(param.name(), arg.value());
        }

        for (NamedParamAssignmentNode arg : unused.values()) {
            scope.addDiag(DiagCode.PARAMETER_DOES_NOT_EXIST, arg.name().location(), arg.name().name(), definitionName);
        }
    }

    /**
     * Binds one declared parameter for the instance and adds it to the instance scope.
     *
     * @param decl         The declaration.
     * @param newScope     The scope of the instance body.
     * @param instanceLoc  The location of the instantiation, for missing-value errors.
     * @param context      The instantiation context, overrides and error handling flags.
     * @return The bound parameter.
     */
    public ParameterSymbolBase createParam(ParameterDecl decl, Scope newScope, SourceLocation instanceLoc,
                                           ElaborationContext context) {
        AstNode newInitializer = assignments.get(decl.name());
        return decl.isTypeParam()
                ? createTypeParam(decl, newScope, instanceLoc, context, newInitializer)
                : createValueParam(decl, newScope, instanceLoc, context, newInitializer);
    }

    private TypeParameterSymbol createTypeParam(ParameterDecl decl, Scope newScope, SourceLocation instanceLoc,
                                                ElaborationContext context, AstNode newInitializer) {
        TypeParameterSymbol param = new TypeParameterSymbol(decl.name(), decl.location(),
                decl.isLocalParam(), decl.isPortParam());
        DeclaredType targetType = param.getDeclaredTargetType();

        if (!decl.hasSyntax()) {
            if (decl.givenType() != null) {
                targetType.setType(decl.givenType());
            }
        } else if (decl.typeDecl().defaultType() != null) {
            targetType.setTypeSyntax(decl.typeDecl().defaultType());
        }

        if (newInitializer != null) {
            targetType.addFlags(DeclaredType.Flag.TYPE_OVERRIDDEN);
            // a plain name was parsed as an expression since the parser cannot tell it is a type
            if (newInitializer instanceof ExpressionNode expression && expression.isNameShaped()) {
                targetType.setTypeSyntax(NamedTypeNode.of(expression));
            } else if (newInitializer instanceof DataTypeNode dataType) {
                targetType.setTypeSyntax(dataType);
            } else {
                scope.addDiag(DiagCode.BAD_TYPE_PARAM_EXPR, newInitializer.location(), param.name());
            }
        }

        // added before resolving so that declarations using the type can find it
        newScope.addMember(param);

        if (!param.isLocalParam()) {
            if (context.forceInvalidValues()) {
                targetType.setType(Type.ERROR);
            } else if (newInitializer != null) {
                if (context.instanceContext() != null) {
                    targetType.forceResolveAt(context.instanceContext());
                }
            } else if (param.isPortParam() && !targetType.hasType()) {
                reportError(param, instanceLoc, context);
            }
        }
        return param;
    }

    private ParameterSymbol createValueParam(ParameterDecl decl, Scope newScope, SourceLocation instanceLoc,
                                             ElaborationContext context, AstNode newInitializer) {
        ParameterSymbol param = new ParameterSymbol(decl.name(), decl.location(),
                decl.isLocalParam(), decl.isPortParam());

        if (!decl.hasSyntax()) {
            param.setType(decl.givenType());
            if (decl.givenInitializer() != null) {
                param.setInitializer(decl.givenInitializer());
            }
        } else {
            param.setDeclaredType(decl.valueSyntax().type());
            param.setFromDeclarator(decl.valueDecl());
        }

        DeclaredType declaredType = param.getDeclaredType();
        if (newInitializer != null) {
            declaredType.addFlags(DeclaredType.Flag.INITIALIZER_OVERRIDDEN);
            if (newInitializer instanceof ExpressionNode expression) {
                param.setInitializerSyntax(expression, expression.location());
            } else {
                // a data type given to a value parameter
                scope.addDiag(DiagCode.NOT_A_VALUE, newInitializer.location(), param.name());
                param.setValue(null, false);
            }
        }

        newScope.addMember(param);

        if (!param.isLocalParam()) {
            var override = context.overrides().find(decl.name());
            if (override.isPresent()) {
                param.setValue(override.get(), true);
                return param;
            }

            if (context.forceInvalidValues()) {
                param.setValue(null, false);
            } else if (newInitializer != null) {
                if (context.instanceContext() != null) {
                    declaredType.resolveAt(context.instanceContext());
                }
            } else if (param.isPortParam() && declaredType.getInitializerSyntax() == null) {
                reportError(param, instanceLoc, context);
            }
        }
        return param;
    }

    private void reportError(ParameterSymbolBase param, SourceLocation instanceLoc, ElaborationContext context) {
        anyErrors = true;
        if (!context.suppressErrors()) {
            scope.addDiag(DiagCode.PARAM_HAS_NO_VALUE, instanceLoc, definitionName, param.name());
        }
    }

    /**
     * @return {@code true} if some parameter was left without a value.
     */
    public boolean hasErrors() {
        return anyErrors;
    }

    /**
     * Flattens one parameter declaration into one descriptor per declared name.
     *
     * @param syntax  A value or type parameter declaration.
     * @param isLocal Whether the declared parameters are local.
     * @param isPort  Whether the declaration is in a parameter port list.
     * @param results Receives the descriptors.
     */
    public static void createDecls(ParamDeclNode syntax, boolean isLocal, boolean isPort, List<ParameterDecl> results) {
        if (syntax instanceof ParameterDeclarationNode valueSyntax) {
            for (DeclaratorNode declarator : valueSyntax.declarators()) {
                results.add(ParameterDecl.ofValue(valueSyntax, declarator, isLocal, isPort));
            }
        } else if (syntax instanceof TypeParameterDeclarationNode typeSyntax) {
            for (TypeAssignmentNode declarator : typeSyntax.assignments()) {
                results.add(ParameterDecl.ofType(declarator, isLocal, isPort));
            }
        } else {
            throw new IllegalStateException("Unknown parameter declaration: " + syntax.getClass().getSimpleName());
        }
    }

    /**
     * Flattens a parameter port list. An entry without a {@code parameter} or {@code localparam}
     * keyword inherits the kind of the entry before it; the first entry defaults to {@code parameter}.
     *
     * @param syntax  The parameter port list.
     * @param results Receives the descriptors.
     */
    public static void createDecls(ParameterPortListNode syntax, List<ParameterDecl> results) {
        boolean lastLocal = false;
        for (ParamDeclNode declaration : syntax.declarations()) {
            if (declaration.keyword() != null) {
                lastLocal = declaration.isLocalKeyword();
            }
            createDecls(declaration, lastLocal, true, results);
        }
    }
}
