package org.silica.compiler.elaboration;

import org.silica.compiler.api.SourceLocation;

/**
 * Common part of value and type parameters bound for one instance.
 */
public abstract class ParameterSymbolBase implements Symbol {

    private final String name;
    private final SourceLocation location;
    private final boolean localParam;
    private final boolean portParam;
    private Scope parentScope;

    protected ParameterSymbolBase(String name, SourceLocation location, boolean localParam, boolean portParam) {
        this.name = name;
        this.location = location;
        this.localParam = localParam;
        this.portParam = portParam;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public SourceLocation location() {
        return location;
    }

    public boolean isLocalParam() {
        return localParam;
    }

    public boolean isPortParam() {
        return portParam;
    }

    void setParentScope(Scope scope) {
        this.parentScope = scope;
    }

    /**
     * @return The scope this parameter was added to.
     * @throws IllegalStateException if the parameter was not added to a scope yet.
     */
    public Scope getParentScope() {
        if (parentScope == null) {
            throw new IllegalStateException("Parameter '" + name + "' is not a member of any scope");
        }
        return parentScope;
    }

    ASTContext ownContext() {
        return new ASTContext(getParentScope());
    }

    /**
     * Resolves the type and value of this parameter, reporting any errors.
     */
    public abstract void resolve();
}
