package org.silica.compiler.frontend.parser;

import org.silica.compiler.frontend.parser.ast.ClassDeclarationNode;
import org.silica.compiler.frontend.parser.ast.ModuleDeclarationNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Facts about a parsed unit that the loader needs for dependency discovery: which
 * names it declares at the top level and which names it refers to from outside.
 */
public class ParserMetadata {

    private final List<ModuleDeclarationNode> declarations = new ArrayList<>();
    private final List<ClassDeclarationNode> classDeclarations = new ArrayList<>();
    private final Set<String> globalInstances = new LinkedHashSet<>();
    private final Set<String> classPackageNames = new LinkedHashSet<>();
    private final Set<String> packageImports = new LinkedHashSet<>();
    private final Set<String> interfacePorts = new LinkedHashSet<>();

    void addDeclaration(ModuleDeclarationNode declaration) {
        declarations.add(declaration);
    }

    void addClassDeclaration(ClassDeclarationNode declaration) {
        classDeclarations.add(declaration);
    }

    void addGlobalInstance(String definitionName) {
        globalInstances.add(definitionName);
    }

    void addClassPackageName(String name) {
        if (!name.equals("std")) {
            classPackageNames.add(name);
        }
    }

    void addPackageImport(String packageName) {
        if (!packageName.equals("std")) {
            packageImports.add(packageName);
        }
    }

    void addInterfacePort(String interfaceName) {
        interfacePorts.add(interfaceName);
    }

    /**
     * @return Top-level module, interface, program and package declarations.
     */
    public List<ModuleDeclarationNode> getDeclarations() {
        return Collections.unmodifiableList(declarations);
    }

    /**
     * @return Names of definitions instantiated anywhere in the unit, in first-use order.
     */
    public Set<String> getGlobalInstances() {
        return Collections.unmodifiableSet(globalInstances);
    }

    /**
     * @return Names used as the left side of a {@code ::} scope reference.
     */
    public Set<String> getClassPackageNames() {
        return Collections.unmodifiableSet(classPackageNames);
    }

    /**
     * @return Names of imported packages.
     */
    public Set<String> getPackageImports() {
        return Collections.unmodifiableSet(packageImports);
    }

    /**
     * @return Interface type names used in ANSI port lists.
     */
    public Set<String> getInterfacePorts() {
        return Collections.unmodifiableSet(interfacePorts);
    }

    /**
     * @return Every name this unit declares at the top level, in declaration order.
     */
    public Set<String> getDeclaredNames() {
        Set<String> names = new LinkedHashSet<>();
        declarations.forEach(d -> names.add(d.name().name()));
        classDeclarations.forEach(d -> names.add(d.name().name()));
        return names;
    }

    /**
     * @return Every name this unit refers to that some other unit may have to declare.
     */
    public Set<String> getReferencedNames() {
        Set<String> names = new LinkedHashSet<>(globalInstances);
        names.addAll(classPackageNames);
        names.addAll(packageImports);
        names.addAll(interfacePorts);
        return names;
    }
}
