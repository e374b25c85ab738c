package org.silica.compiler.elaboration;

import org.silica.compiler.diagnostics.DiagCode;
import org.silica.compiler.diagnostics.Diagnostic;
import org.silica.compiler.diagnostics.DiagnosticsEngine;
import org.silica.compiler.frontend.parser.ast.DeclarationKind;
import org.silica.compiler.frontend.syntax.SyntaxTree;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Holds the definitions of a design and the diagnostics of elaborating it.
 * <p>
 * Modules, interfaces and programs share one namespace; packages have their own and are
 * elaborated on first use.
 */
public class Compilation {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final Scope root = new Scope(this, "$root", null);
    private final Map<String, Definition> definitions = new LinkedHashMap<>();
    private final Map<String, Definition> packageDefinitions = new LinkedHashMap<>();
    private final Map<String, InstanceBody> packages = new HashMap<>();
    private final Set<String> elaboratingPackages = new HashSet<>();

    /**
     * Adds the definitions declared at the top level of a tree.
     *
     * @param tree The parsed tree.
     */
    public void addSyntaxTree(SyntaxTree tree) {
        new DefinitionCollector(this).collect(tree);
    }

    /**
     * Adds a definition. A second definition with the same name is reported and ignored.
     *
     * @param definition The definition.
     */
    public void addDefinition(Definition definition) {
        Map<String, Definition> namespace = definition.kind() == DeclarationKind.PACKAGE ? packageDefinitions : definitions;
        Definition existing = namespace.putIfAbsent(definition.name(), definition);
        if (existing != null) {
            diagnostics.report(Diagnostic.of(DiagCode.REDEFINITION, definition.location(), definition.name())
                    .withNote(DiagCode.NOTE_PREVIOUS_DEFINITION, existing.location()));
        }
    }

    public Optional<Definition> getDefinition(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public List<Definition> getDefinitions() {
        return new ArrayList<>(definitions.values());
    }

    /**
     * Returns the scope of a package, elaborating the package on first use.
     *
     * @param name The package name.
     * @return The package scope, or empty if there is no such package.
     */
    public Optional<Scope> getPackage(String name) {
        InstanceBody body = packages.get(name);
        if (body != null) {
            return Optional.of(body.getScope());
        }
        Definition definition = packageDefinitions.get(name);
        // a package whose parameters refer back to itself sees no members while it elaborates
        if (definition == null || !elaboratingPackages.add(name)) {
            return Optional.empty();
        }
        try {
            body = InstanceBody.create(this, definition, name, definition.location(), null, root,
                    ElaborationContext.of(null));
        } finally {
            elaboratingPackages.remove(name);
        }
        packages.put(name, body);
        return Optional.of(body.getScope());
    }

    /**
     * Elaborates a definition as a top-level instance.
     *
     * @param name      The definition name.
     * @param overrides Values forced onto its parameters and those of the instances below it.
     * @return The elaborated instance, or empty if there is no such definition.
     */
    public Optional<InstanceBody> elaborate(String name, ParameterOverrides overrides) {
        return getDefinition(name).map(definition -> InstanceBody.create(this, definition, name,
                definition.location(), null, root, ElaborationContext.of(new ASTContext(root)).withOverrides(overrides)));
    }

    /**
     * @return The names of definitions that no other definition instantiates.
     */
    public List<String> getTopLevelNames() {
        List<String> instantiated = new ArrayList<>();
        definitions.values().forEach(d -> d.instantiations().forEach(i -> instantiated.add(i.type().name())));
        List<String> tops = new ArrayList<>();
        for (Definition definition : definitions.values()) {
            if (!definition.library() && !instantiated.contains(definition.name())) {
                tops.add(definition.name());
            }
        }
        return tops;
    }

    Scope createScope(String name, Scope parent) {
        return new Scope(this, name, parent);
    }

    public Scope getRoot() {
        return root;
    }

    public Type getErrorType() {
        return Type.ERROR;
    }

    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
