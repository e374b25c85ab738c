package org.silica.compiler.elaboration;

import org.silica.compiler.api.SourceLocation;

/**
 * A named member of a {@link Scope}.
 */
public interface Symbol {

    /**
     * The kind of a symbol.
     */
    enum Kind {
        /** A value parameter. */
        PARAMETER,
        /** A type parameter. */
        TYPE_PARAMETER
    }

    String name();

    SourceLocation location();

    Kind kind();
}
