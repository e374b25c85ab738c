package org.silica.compiler.elaboration;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.diagnostics.DiagCode;
import org.silica.compiler.diagnostics.Diagnostic;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named scope of symbols. Lookups walk from this scope up to the root.
 * <p>
 * Diagnostics reported through a scope end up in the {@link Compilation} that owns it.
 */
public class Scope {

    private final Compilation compilation;
    private final String name;
    private final Scope parent;
    private final Map<String, Symbol> members = new LinkedHashMap<>();

    Scope(Compilation compilation, String name, Scope parent) {
        this.compilation = compilation;
        this.name = name;
        this.parent = parent;
    }

    /**
     * Adds a symbol to this scope. A second symbol with the same name is reported as a
     * redefinition and cannot be found by name, but it still belongs to this scope.
     *
     * @param symbol The symbol to add.
     */
    public void addMember(Symbol symbol) {
        if (symbol instanceof ParameterSymbolBase parameter) {
            parameter.setParentScope(this);
        }
        Symbol existing = members.putIfAbsent(symbol.name(), symbol);
        if (existing != null) {
            addDiag(Diagnostic.of(DiagCode.REDEFINITION, symbol.location(), symbol.name())
                    .withNote(DiagCode.NOTE_PREVIOUS_DEFINITION, existing.location()));
        }
    }

    /**
     * Finds a symbol declared directly in this scope.
     *
     * @param name The symbol name.
     * @return The symbol, or {@code null}.
     */
    public Symbol find(String name) {
        return members.get(name);
    }

    /**
     * Finds a symbol in this scope or the nearest enclosing scope that declares it.
     *
     * @param name The symbol name.
     * @return The symbol, or {@code null}.
     */
    public Symbol lookup(String name) {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            Symbol symbol = scope.members.get(name);
            if (symbol != null) {
                return symbol;
            }
        }
        return null;
    }

    public List<Symbol> getMembers() {
        return new ArrayList<>(members.values());
    }

    public String getName() {
        return name;
    }

    public Scope getParent() {
        return parent;
    }

    public Compilation getCompilation() {
        return compilation;
    }

    public Diagnostic addDiag(DiagCode code, SourceLocation location, Object... args) {
        return compilation.getDiagnostics().report(code, location, args);
    }

    public Diagnostic addDiag(Diagnostic diagnostic) {
        return compilation.getDiagnostics().report(diagnostic);
    }

    @Override
    public String toString() {
        return "Scope[" + name + ", " + members.size() + " member(s)]";
    }
}
