package org.silica.compiler.frontend.preprocessor;

import org.silica.compiler.frontend.preprocessor.features.macro.MacroDefinition;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A shared context for the preprocessor phase.
 * Holds the macro table, which outlives a single file when files are preprocessed
 * together as one compilation unit or when included files define macros.
 */
public class PreProcessorContext {
    private final Map<String, MacroDefinition> macroTable = new LinkedHashMap<>();

    /**
     * Creates a context seeded with macros defined by an earlier compilation unit.
     * @param inherited The macros to start with.
     */
    public PreProcessorContext(Collection<MacroDefinition> inherited) {
        inherited.forEach(this::registerMacro);
    }

    public PreProcessorContext() {
    }

    /**
     * Registers a new macro definition, replacing any previous one with the same name.
     * @param macro The macro definition to register.
     */
    public void registerMacro(MacroDefinition macro) {
        macroTable.put(macro.name().text(), macro);
    }

    /**
     * Gets a macro definition by its name. Macro names are case sensitive.
     * @param name The name of the macro.
     * @return An {@link Optional} containing the macro definition if it exists, otherwise empty.
     */
    public Optional<MacroDefinition> getMacro(String name) {
        return Optional.ofNullable(macroTable.get(name));
    }

    public void undefine(String name) {
        macroTable.remove(name);
    }

    public void undefineAll() {
        macroTable.clear();
    }

    /**
     * @return The currently defined macros in definition order.
     */
    public Map<String, MacroDefinition> getMacros() {
        return Collections.unmodifiableMap(macroTable);
    }
}
