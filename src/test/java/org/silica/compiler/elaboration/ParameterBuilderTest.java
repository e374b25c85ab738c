package org.silica.compiler.elaboration;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.silica.compiler.api.SourceLocation;
import org.silica.compiler.diagnostics.DiagCode;
import org.silica.compiler.diagnostics.DiagnosticsEngine;
import org.silica.compiler.elaboration.ConstantValue.IntegerValue;
import org.silica.compiler.frontend.io.SourceCache;
import org.silica.compiler.frontend.parser.ast.ExpressionNode;
import org.silica.compiler.frontend.syntax.SyntaxTree;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ParameterBuilderTest {

    private static final String CHILD = """
            module child #(parameter int A = 1, parameter int B = 2, localparam int L = 3, parameter int C = 4) ();
              parameter int BODY = 5;
            endmodule
            """;

    private Compilation compilation;

    /**
     * Elaborates {@code top} containing the given instantiation of {@code child} and returns the child.
     */
    private InstanceBody instantiate(String instantiation) {
        compilation = new Compilation();
        String text = CHILD + "module top;\n  " + instantiation + "\nendmodule\n";
        compilation.addSyntaxTree(SyntaxTree.fromText(text, "design.sv", new SourceCache()));
        InstanceBody top = compilation.elaborate("top", ParameterOverrides.empty()).orElseThrow();
        assertThat(top.getChildren()).hasSize(1);
        return top.getChildren().get(0);
    }

    private static BigInteger value(InstanceBody body, String name) {
        ConstantValue value = ((ParameterSymbol) body.findParameter(name).orElseThrow()).getValue();
        assertThat(value).isInstanceOf(IntegerValue.class);
        return ((IntegerValue) value).value();
    }

    private static List<Integer> values(InstanceBody body, String... names) {
        return Arrays.stream(names).map(n -> value(body, n).intValue()).toList();
    }

    private DiagnosticsEngine diagnostics() {
        return compilation.getDiagnostics();
    }

    @Test
    void defaultsApplyWithoutAssignments() {
        InstanceBody child = instantiate("child u ();");

        assertThat(values(child, "A", "B", "L", "C", "BODY")).containsExactly(1, 2, 3, 4, 5);
        assertThat(diagnostics().getDiagnostics()).isEmpty();
        assertThat(child.getInstanceName()).isEqualTo("u");
        assertThat(child).hasToString("u (child)");
    }

    @Test
    void orderedAssignmentsSkipLocalParameters() {
        InstanceBody child = instantiate("child #(10, 20, 30) u ();");

        assertThat(values(child, "A", "B", "L", "C")).containsExactly(10, 20, 3, 30);
        assertThat(diagnostics().getDiagnostics()).isEmpty();
    }

    @Test
    void tooManyOrderedAssignments() {
        InstanceBody child = instantiate("child #(10, 20, 30, 40) u ();");

        assertThat(diagnostics().count(DiagCode.TOO_MANY_PARAM_ASSIGNMENTS)).isEqualTo(1);
        assertThat(diagnostics().getDiagnostics().get(0).message()).contains("child", "4", "3");
        assertThat(values(child, "A", "B", "C")).containsExactly(10, 20, 30);
    }

    @Test
    void leadingLocalParameterOccupiesNoPosition() {
        compilation = new Compilation();
        compilation.addSyntaxTree(SyntaxTree.fromText("""
                module m #(localparam int A = 1, parameter int B = 2, parameter int C = 3) (); endmodule
                module top; m #(7, 8) u (); endmodule
                """, "design.sv", new SourceCache()));

        InstanceBody child = compilation.elaborate("top", ParameterOverrides.empty()).orElseThrow().getChildren().get(0);

        assertThat(values(child, "A", "B", "C")).containsExactly(1, 7, 8);
        assertThat(diagnostics().getDiagnostics()).isEmpty();
    }

    @Test
    void excessOrderedArgumentsReportSuppliedAndConsumedCounts() {
        compilation = new Compilation();
        compilation.addSyntaxTree(SyntaxTree.fromText("""
                module m #(parameter int B = 2) (); endmodule
                module top; m #(7, 8, 9) u (); endmodule
                """, "design.sv", new SourceCache()));

        compilation.elaborate("top", ParameterOverrides.empty());

        assertThat(diagnostics().getDiagnostics()).singleElement()
                .satisfies(d -> {
                    assertThat(d.code()).isEqualTo(DiagCode.TOO_MANY_PARAM_ASSIGNMENTS);
                    assertThat(d.message()).contains("3 given", "expected 1");
                });
    }

    @Test
    void namedAssignments() {
        InstanceBody child = instantiate("child #(.C(7), .A(6)) u ();");

        assertThat(values(child, "A", "B", "C")).containsExactly(6, 2, 7);
        assertThat(diagnostics().getDiagnostics()).isEmpty();
    }

    @Test
    void emptyNamedAssignmentKeepsDefault() {
        InstanceBody child = instantiate("child #(.A()) u ();");

        assertThat(value(child, "A")).isEqualTo(1);
        assertThat(diagnostics().getDiagnostics()).isEmpty();
    }

    @Test
    void mixingOrderedAndNamedIsOneErrorAndAppliesNothing() {
        InstanceBody child = instantiate("child #(10, .B(20), 30) u ();");

        assertThat(diagnostics().count(DiagCode.MIXING_ORDERED_AND_NAMED_PARAMS)).isEqualTo(1);
        assertThat(diagnostics().getDiagnostics()).hasSize(1);
        assertThat(values(child, "A", "B", "C")).containsExactly(1, 2, 4);
    }

    @Test
    void duplicateNamedAssignmentKeepsFirst() {
        InstanceBody child = instantiate("child #(.A(5), .A(6)) u ();");

        assertThat(diagnostics().count(DiagCode.DUPLICATE_PARAM_ASSIGNMENT)).isEqualTo(1);
        assertThat(diagnostics().getDiagnostics().get(0).notes()).hasSize(1);
        assertThat(value(child, "A")).isEqualTo(5);
    }

    @Test
    void assigningLocalPortParameter() {
        InstanceBody child = instantiate("child #(.L(9)) u ();");

        assertThat(diagnostics().count(DiagCode.ASSIGNED_TO_LOCAL_PORT_PARAM)).isEqualTo(1);
        assertThat(value(child, "L")).isEqualTo(3);
    }

    @Test
    void bodyParametersAreLocalWhenAPortListExists() {
        InstanceBody child = instantiate("child #(.BODY(9)) u ();");

        assertThat(diagnostics().count(DiagCode.ASSIGNED_TO_LOCAL_BODY_PARAM)).isEqualTo(1);
        assertThat(value(child, "BODY")).isEqualTo(5);
    }

    @Test
    void unknownNamedParameter() {
        instantiate("child #(.Z(1)) u ();");

        assertThat(diagnostics().count(DiagCode.PARAMETER_DOES_NOT_EXIST)).isEqualTo(1);
        assertThat(diagnostics().getDiagnostics().get(0).message()).contains("Z", "child");
    }

    @Test
    void assignedExpressionIsEvaluatedInTheInstantiatingScope() {
        compilation = new Compilation();
        String text = CHILD + """
                module top #(parameter int W = 16) ();
                  child #(.A(W * 2)) u ();
                endmodule
                """;
        compilation.addSyntaxTree(SyntaxTree.fromText(text, "design.sv", new SourceCache()));

        InstanceBody child = compilation.elaborate("top", ParameterOverrides.empty()).orElseThrow().getChildren().get(0);

        assertThat(value(child, "A")).isEqualTo(32);
    }

    @Test
    void portParameterWithoutAnyValue() {
        compilation = new Compilation();
        compilation.addSyntaxTree(SyntaxTree.fromText("""
                module needs #(parameter int N) (); endmodule
                module top; needs u (); endmodule
                """, "design.sv", new SourceCache()));

        InstanceBody child = compilation.elaborate("top", ParameterOverrides.empty()).orElseThrow().getChildren().get(0);

        assertThat(child.hasErrors()).isTrue();
        assertThat(diagnostics().count(DiagCode.PARAM_HAS_NO_VALUE)).isEqualTo(1);
        assertThat(((ParameterSymbol) child.findParameter("N").orElseThrow()).getValue().isValid()).isFalse();
    }

    @Test
    void typeParameters() {
        compilation = new Compilation();
        compilation.addSyntaxTree(SyntaxTree.fromText("""
                module tchild #(parameter type T = logic [7:0], parameter int W = $bits(T)) (); endmodule
                module top #(parameter type PT = shortint) ();
                  tchild #(.T(int)) a ();
                  tchild b ();
                  tchild #(.T(PT)) c ();
                endmodule
                """, "design.sv", new SourceCache()));

        List<InstanceBody> children = compilation.elaborate("top", ParameterOverrides.empty()).orElseThrow().getChildren();

        assertThat(children).extracting(c -> value(c, "W").intValue()).containsExactly(32, 8, 16);
        assertThat(((TypeParameterSymbol) children.get(0).findParameter("T").orElseThrow()).getTargetType())
                .isEqualTo(Type.INT);
        assertThat(diagnostics().getDiagnostics()).isEmpty();
    }

    @Test
    void valueGivenToTypeParameter() {
        compilation = new Compilation();
        compilation.addSyntaxTree(SyntaxTree.fromText("""
                module tchild #(parameter type T = int) (); endmodule
                module top; tchild #(.T(1 + 2)) a (); endmodule
                """, "design.sv", new SourceCache()));

        compilation.elaborate("top", ParameterOverrides.empty());

        assertThat(diagnostics().count(DiagCode.BAD_TYPE_PARAM_EXPR)).isEqualTo(1);
    }

    @Test
    void typeGivenToValueParameter() {
        InstanceBody child = instantiate("child #(.A(int)) u ();");

        assertThat(diagnostics().count(DiagCode.NOT_A_VALUE)).isEqualTo(1);
        assertThat(((ParameterSymbol) child.findParameter("A").orElseThrow()).getValue().isValid()).isFalse();
    }

    /**
     * Loads the given text and returns a scope for one instance below the root.
     */
    private Scope instanceScope(String text) {
        compilation = new Compilation();
        compilation.addSyntaxTree(SyntaxTree.fromText(text, "design.sv", new SourceCache()));
        return compilation.createScope("inst", compilation.getRoot());
    }

    private ParameterDecl declarationOf(String definition, int index) {
        return compilation.getDefinition(definition).orElseThrow().parameters().get(index);
    }

    @Test
    void synthesizedValueParameterUsesGivenTypeAndInitializer() {
        Scope scope = instanceScope("module src #(parameter int X = 6 * 7) (); endmodule");
        ExpressionNode initializer = declarationOf("src", 0).valueDecl().initializer();
        ParameterDecl decl = ParameterDecl.synthesizedValue("S", SourceLocation.NONE, Types.vector(4, false),
                initializer, false, true);
        ParameterBuilder builder = new ParameterBuilder(compilation.getRoot(), "synth", List.of(decl));

        ParameterSymbol param = (ParameterSymbol) builder.createParam(decl, scope, SourceLocation.NONE,
                ElaborationContext.of(null));

        assertThat(scope.find("S")).isSameAs(param);
        assertThat(param.getValue()).isEqualTo(IntegerValue.of(BigInteger.valueOf(10), 4, false));
        assertThat(param.getType().width()).isEqualTo(4);
        assertThat(builder.hasErrors()).isFalse();
        assertThat(diagnostics().getDiagnostics()).isEmpty();
    }

    @Test
    void synthesizedPortValueParameterWithoutInitializerHasNoValue() {
        Scope scope = instanceScope("");
        ParameterDecl decl = ParameterDecl.synthesizedValue("S", SourceLocation.NONE, Type.INT, null, false, true);
        ParameterBuilder builder = new ParameterBuilder(compilation.getRoot(), "synth", List.of(decl));

        ParameterSymbol param = (ParameterSymbol) builder.createParam(decl, scope, SourceLocation.NONE,
                ElaborationContext.of(null));

        assertThat(builder.hasErrors()).isTrue();
        assertThat(diagnostics().count(DiagCode.PARAM_HAS_NO_VALUE)).isEqualTo(1);
        assertThat(param.getValue().isValid()).isFalse();
    }

    @Test
    void synthesizedTypeParameterUsesGivenType() {
        Scope scope = instanceScope("");
        ParameterDecl decl = ParameterDecl.synthesizedType("T", SourceLocation.NONE, Types.vector(12, true), false, true);
        ParameterBuilder builder = new ParameterBuilder(compilation.getRoot(), "synth", List.of(decl));

        TypeParameterSymbol param = (TypeParameterSymbol) builder.createParam(decl, scope, SourceLocation.NONE,
                ElaborationContext.of(null));

        assertThat(scope.find("T")).isSameAs(param);
        assertThat(param.getTargetType()).isEqualTo(Types.vector(12, true));
        assertThat(builder.hasErrors()).isFalse();
        assertThat(diagnostics().getDiagnostics()).isEmpty();
    }

    @Test
    void synthesizedPortTypeParameterWithoutTypeHasNoValue() {
        Scope scope = instanceScope("");
        ParameterDecl decl = ParameterDecl.synthesizedType("T", SourceLocation.NONE, null, false, true);
        ParameterBuilder builder = new ParameterBuilder(compilation.getRoot(), "synth", List.of(decl));

        TypeParameterSymbol param = (TypeParameterSymbol) builder.createParam(decl, scope, SourceLocation.NONE,
                ElaborationContext.of(null));

        assertThat(builder.hasErrors()).isTrue();
        assertThat(diagnostics().count(DiagCode.PARAM_HAS_NO_VALUE)).isEqualTo(1);
        assertThat(param.getTargetType()).isEqualTo(Type.ERROR);
    }

    @Test
    void suppressedMissingValueStillCountsAsError() {
        Scope scope = instanceScope("module needs #(parameter int N) (); endmodule");
        Definition needs = compilation.getDefinition("needs").orElseThrow();
        ParameterBuilder builder = ParameterBuilder.forInstance(compilation.getRoot(), needs, null);

        ParameterSymbol param = (ParameterSymbol) builder.createParam(needs.parameters().get(0), scope,
                SourceLocation.NONE, ElaborationContext.of(null).withSuppressErrors(true));

        assertThat(builder.hasErrors()).isTrue();
        assertThat(diagnostics().count(DiagCode.PARAM_HAS_NO_VALUE)).isZero();
        assertThat(param.getValue().isValid()).isFalse();
    }
}
