package org.silica.compiler.frontend.parser.ast;

/**
 * The flavors of design element that share the module declaration syntax.
 */
public enum DeclarationKind {
    MODULE("endmodule"),
    INTERFACE("endinterface"),
    PROGRAM("endprogram"),
    PACKAGE("endpackage");

    private final String endKeyword;

    DeclarationKind(String endKeyword) {
        this.endKeyword = endKeyword;
    }

    public String endKeyword() {
        return endKeyword;
    }

    /**
     * Maps a declaration keyword to its kind.
     * @param keyword The keyword text, e.g. {@code macromodule}.
     * @return The kind, or {@code null} if the keyword does not start a design element.
     */
    public static DeclarationKind fromKeyword(String keyword) {
        return switch (keyword) {
            case "module", "macromodule" -> MODULE;
            case "interface" -> INTERFACE;
            case "program" -> PROGRAM;
            case "package" -> PACKAGE;
            default -> null;
        };
    }
}
