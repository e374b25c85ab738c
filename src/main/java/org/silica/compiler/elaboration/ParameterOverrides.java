package org.silica.compiler.elaboration;

import org.silica.compiler.frontend.lexer.IntegerLiteral;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parameter values forced from outside an instance, such as command line overrides.
 * They take precedence over instance assignments and defaults.
 * <p>
 * Overrides form a tree that follows the instance hierarchy: {@link #child(String)} returns
 * the overrides for the instance of that name below this one.
 */
public final class ParameterOverrides {

    private static final ParameterOverrides EMPTY = new ParameterOverrides(Map.of(), Map.of());

    private final Map<String, ConstantValue> values;
    private final Map<String, ParameterOverrides> children;

    private ParameterOverrides(Map<String, ConstantValue> values, Map<String, ParameterOverrides> children) {
        this.values = values;
        this.children = children;
    }

    public static ParameterOverrides empty() {
        return EMPTY;
    }

    public static ParameterOverrides of(Map<String, ConstantValue> values) {
        return new ParameterOverrides(Map.copyOf(values), Map.of());
    }

    /**
     * Parses overrides of the form {@code NAME=VALUE} or {@code inst.sub.NAME=VALUE}.
     * Values are integer literals in any base, reals, or strings (quotes optional).
     *
     * @param assignments The override strings.
     * @return The overrides.
     * @throws IllegalArgumentException if an entry has no name or no '='.
     */
    public static ParameterOverrides parse(Collection<String> assignments) {
        Builder root = new Builder();
        for (String assignment : assignments) {
            int eq = assignment.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Expected NAME=VALUE but got '" + assignment + "'");
            }
            String[] path = assignment.substring(0, eq).trim().split("\\.", -1);
            Builder node = root;
            for (int i = 0; i < path.length - 1; i++) {
                node = node.children.computeIfAbsent(path[i], k -> new Builder());
            }
            String name = path[path.length - 1];
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Missing parameter name in '" + assignment + "'");
            }
            node.values.put(name, parseValue(assignment.substring(eq + 1).trim()));
        }
        return root.build();
    }

    private static ConstantValue parseValue(String text) {
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            return new ConstantValue.StringValue(text.substring(1, text.length() - 1));
        }
        try {
            IntegerLiteral literal = IntegerLiteral.parse(text);
            return ConstantValue.IntegerValue.of(literal.value(), literal.width(), literal.signed());
        } catch (NumberFormatException notAnInteger) {
            try {
                return new ConstantValue.RealValue(Double.parseDouble(text));
            } catch (NumberFormatException notAReal) {
                return new ConstantValue.StringValue(text);
            }
        }
    }

    public Optional<ConstantValue> find(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /**
     * @param instanceName The name of an instance below the one these overrides apply to.
     * @return The overrides for that instance, empty if there are none.
     */
    public ParameterOverrides child(String instanceName) {
        return children.getOrDefault(instanceName, EMPTY);
    }

    public ParameterOverrides withChild(String instanceName, ParameterOverrides child) {
        Map<String, ParameterOverrides> extended = new LinkedHashMap<>(children);
        extended.put(instanceName, child);
        return new ParameterOverrides(values, Collections.unmodifiableMap(extended));
    }

    public boolean isEmpty() {
        return values.isEmpty() && children.isEmpty();
    }

    public Map<String, ConstantValue> getValues() {
        return values;
    }

    @Override
    public String toString() {
        return "ParameterOverrides" + values + (children.isEmpty() ? "" : children);
    }

    private static final class Builder {
        private final Map<String, ConstantValue> values = new LinkedHashMap<>();
        private final Map<String, Builder> children = new LinkedHashMap<>();

        ParameterOverrides build() {
            Map<String, ParameterOverrides> built = new LinkedHashMap<>();
            children.forEach((name, child) -> built.put(name, child.build()));
            return new ParameterOverrides(Collections.unmodifiableMap(values), Collections.unmodifiableMap(built));
        }
    }
}
