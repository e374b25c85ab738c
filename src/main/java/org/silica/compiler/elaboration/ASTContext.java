package org.silica.compiler.elaboration;

import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.diagnostics.DiagCode;
import org.silica.compiler.diagnostics.Diagnostic;
import org.silica.compiler.frontend.parser.ast.DataTypeNode;
import org.silica.compiler.frontend.parser.ast.ExpressionNode;

/**
 * The place where an expression or a type is resolved: names are looked up starting from
 * {@code scope}, and diagnostics go to the scope's compilation.
 *
 * @param scope The lookup scope.
 */
public record ASTContext(Scope scope) {

    public ConstantValue evaluate(ExpressionNode expression) {
        return new ExpressionEvaluator(this).evaluate(expression);
    }

    public Type resolveType(DataTypeNode type) {
        return Types.resolve(type, this);
    }

    public Compilation getCompilation() {
        return scope.getCompilation();
    }

    public Diagnostic addDiag(DiagCode code, SourceLocation location, Object... args) {
        return scope.addDiag(code, location, args);
    }
}
