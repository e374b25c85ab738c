package org.silica.compiler.elaboration;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.diagnostics.DiagCode;
import org.silica.compiler.frontend.parser.ast.DataTypeNode;
import org.silica.compiler.frontend.parser.ast.ExpressionNode;

import java.util.EnumSet;
import java.util.Set;

/**
 * The type and initializer of a parameter, kept as syntax until first needed.
 * <p>
 * The written type is resolved in the scope of the owning parameter. An overridden type or
 * initializer comes from an instantiation and is resolved in the context given to
 * {@link #resolveAt(ASTContext)}, falling back to the owner's scope when there is none.
 */
public final class DeclaredType {

    /**
     * Marks parts that were replaced by an instantiation.
     */
    public enum Flag {
        TYPE_OVERRIDDEN,
        INITIALIZER_OVERRIDDEN
    }

    private final ParameterSymbolBase owner;
    private final Set<Flag> flags = EnumSet.noneOf(Flag.class);
    private DataTypeNode typeSyntax;
    private ExpressionNode initializerSyntax;
    private SourceLocation initializerLocation;
    private Type type;
    private ASTContext overrideContext;
    private boolean resolving;

    DeclaredType(ParameterSymbolBase owner) {
        this.owner = owner;
    }

    public void addFlags(Flag flag) {
        flags.add(flag);
    }

    public boolean hasFlag(Flag flag) {
        return flags.contains(flag);
    }

    public void setType(Type type) {
        this.type = type;
    }

    public void setTypeSyntax(DataTypeNode typeSyntax) {
        this.typeSyntax = typeSyntax;
        this.type = null;
    }

    public DataTypeNode getTypeSyntax() {
        return typeSyntax;
    }

    public void setInitializerSyntax(ExpressionNode initializer, SourceLocation location) {
        this.initializerSyntax = initializer;
        this.initializerLocation = location;
    }

    public ExpressionNode getInitializerSyntax() {
        return initializerSyntax;
    }

    public SourceLocation getInitializerLocation() {
        return initializerLocation != null ? initializerLocation : owner.location();
    }

    /**
     * @return {@code true} if a type was set or written.
     */
    public boolean hasType() {
        return type != null || typeSyntax != null;
    }

    /**
     * Resolves the type on first use.
     *
     * @return The type, {@link Type#ERROR} if it cannot be resolved, or {@code null} if there is no type at all.
     */
    public Type getType() {
        if (type != null) {
            return type;
        }
        if (typeSyntax == null) {
            return null;
        }
        if (resolving) {
            owner.getParentScope().addDiag(DiagCode.RECURSIVE_DEFINITION, owner.location(), owner.name());
            return Type.ERROR;
        }
        resolving = true;
        try {
            ASTContext context = hasFlag(Flag.TYPE_OVERRIDDEN) && overrideContext != null
                    ? overrideContext : owner.ownContext();
            type = context.resolveType(typeSyntax);
        } finally {
            resolving = false;
        }
        return type;
    }

    /**
     * @return The context the initializer is evaluated in.
     */
    ASTContext initializerContext() {
        return hasFlag(Flag.INITIALIZER_OVERRIDDEN) && overrideContext != null ? overrideContext : owner.ownContext();
    }

    /**
     * Resolves the overridden parts in the given context and the owner right away.
     *
     * @param context The instantiation context.
     */
    public void resolveAt(ASTContext context) {
        this.overrideContext = context;
        owner.resolve();
    }

    /**
     * Like {@link #resolveAt(ASTContext)}, but discards a type resolved earlier.
     *
     * @param context The instantiation context.
     */
    public void forceResolveAt(ASTContext context) {
        if (typeSyntax != null) {
            type = null;
        }
        resolveAt(context);
    }
}
