package org.silica.compiler.frontend.parser;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.silica.compiler.diagnostics.DiagCode;
import org.silica.compiler.frontend.io.SourceCache;
import org.silica.compiler.frontend.parser.ast.AstNode;
import org.silica.compiler.frontend.parser.ast.DeclarationKind;
import org.silica.compiler.frontend.parser.ast.HierarchyInstantiationNode;
import org.silica.compiler.frontend.parser.ast.ImplicitTypeNode;
import org.silica.compiler.frontend.parser.ast.KeywordTypeNode;
import org.silica.compiler.frontend.parser.ast.ModuleDeclarationNode;
import org.silica.compiler.frontend.parser.ast.NamedParamAssignmentNode;
import org.silica.compiler.frontend.parser.ast.OpaqueExpressionNode;
import org.silica.compiler.frontend.parser.ast.OrderedParamAssignmentNode;
import org.silica.compiler.frontend.parser.ast.ParamDeclNode;
import org.silica.compiler.frontend.parser.ast.ParameterDeclarationNode;
import org.silica.compiler.frontend.parser.ast.TypeParameterDeclarationNode;
import org.silica.compiler.frontend.syntax.SyntaxTree;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ParserTest {

    private static SyntaxTree parse(String text) {
        return SyntaxTree.fromText(text, "test.sv", new SourceCache());
    }

    private static ModuleDeclarationNode onlyDeclaration(SyntaxTree tree) {
        List<ModuleDeclarationNode> declarations = tree.getMetadata().getDeclarations();
        assertThat(declarations).hasSize(1);
        return declarations.get(0);
    }

    @Test
    void parameterPortListContinuesPreviousDeclarationForBareNames() {
        SyntaxTree tree = parse("""
                module m #(parameter int W = 8, D = 4, localparam L = W * 2, parameter type T = logic) (input clk);
                endmodule
                """);

        assertThat(tree.getDiagnostics().hasErrors()).isFalse();
        ModuleDeclarationNode module = onlyDeclaration(tree);
        assertThat(module.kind()).isEqualTo(DeclarationKind.MODULE);
        List<ParamDeclNode> ports = module.parameterPorts().declarations();
        assertThat(ports).hasSize(3);

        ParameterDeclarationNode first = (ParameterDeclarationNode) ports.get(0);
        assertThat(first.type()).isInstanceOf(KeywordTypeNode.class);
        assertThat(first.declarators()).extracting(d -> d.name().name()).containsExactly("W", "D");

        ParameterDeclarationNode second = (ParameterDeclarationNode) ports.get(1);
        assertThat(second.isLocalKeyword()).isTrue();
        assertThat(second.type()).isInstanceOf(ImplicitTypeNode.class);
        assertThat(second.declarators().get(0).name().name()).isEqualTo("L");

        TypeParameterDeclarationNode third = (TypeParameterDeclarationNode) ports.get(2);
        assertThat(third.isLocalKeyword()).isFalse();
        assertThat(third.assignments().get(0).name().name()).isEqualTo("T");
    }

    @Test
    void moduleWithoutHeaderParametersHasNullPortList() {
        ModuleDeclarationNode module = onlyDeclaration(parse("module m; parameter P = 3; endmodule"));

        assertThat(module.parameterPorts()).isNull();
        assertThat(module.members()).hasSize(1);
        assertThat(module.members().get(0)).isInstanceOf(ParameterDeclarationNode.class);
    }

    @Test
    void instantiationsAreRecordedAsGlobalInstances() {
        SyntaxTree tree = parse("""
                module top;
                  sub #(.W(4), .D()) u1 ();
                  other u2 (.a(b));
                endmodule
                """);

        ParserMetadata metadata = tree.getMetadata();
        assertThat(metadata.getDeclaredNames()).containsExactly("top");
        assertThat(metadata.getGlobalInstances()).containsExactly("sub", "other");
        assertThat(metadata.getReferencedNames()).contains("sub", "other");

        List<AstNode> members = onlyDeclaration(tree).members();
        HierarchyInstantiationNode sub = (HierarchyInstantiationNode) members.get(0);
        assertThat(sub.instanceNames()).extracting(t -> t.name()).containsExactly("u1");
        assertThat(sub.parameters().assignments()).hasSize(2);
        NamedParamAssignmentNode emptyNamed = (NamedParamAssignmentNode) sub.parameters().assignments().get(1);
        assertThat(emptyNamed.name().name()).isEqualTo("D");
        assertThat(emptyNamed.value()).isNull();
    }

    @Test
    void instancesOfNestedDefinitionsAreNotGlobal() {
        SyntaxTree tree = parse("""
                module top;
                  inner i0 ();
                  module inner;
                    leaf l ();
                    helper h ();
                    module helper; endmodule
                  endmodule
                  ext e ();
                endmodule
                """);

        ParserMetadata metadata = tree.getMetadata();
        assertThat(tree.getDiagnostics().hasErrors()).isFalse();
        assertThat(metadata.getDeclaredNames()).containsExactly("top");
        assertThat(metadata.getGlobalInstances()).containsExactly("leaf", "ext");
        assertThat(metadata.getReferencedNames()).doesNotContain("inner", "helper");
    }

    @Test
    void orderedParameterAssignments() {
        SyntaxTree tree = parse("module top; sub #(1, 2) u (); endmodule");

        HierarchyInstantiationNode sub = (HierarchyInstantiationNode) onlyDeclaration(tree).members().get(0);
        assertThat(sub.parameters().assignments())
                .hasSize(2)
                .allMatch(a -> a instanceof OrderedParamAssignmentNode);
    }

    @Test
    void packageImportsAndScopedReferencesAreReferencedNames() {
        SyntaxTree tree = parse("""
                module m import cfg_pkg::*; #(parameter int W = sizes::WIDTH) ();
                endmodule
                """);

        ParserMetadata metadata = tree.getMetadata();
        assertThat(metadata.getPackageImports()).containsExactly("cfg_pkg");
        assertThat(metadata.getClassPackageNames()).contains("sizes");
        assertThat(metadata.getReferencedNames()).contains("cfg_pkg", "sizes");
    }

    @Test
    void interfacePortsAreReferencedNames() {
        SyntaxTree tree = parse("module m (bus_if.master bus, input clk); endmodule");

        assertThat(tree.getMetadata().getInterfacePorts()).containsExactly("bus_if");
    }

    @Test
    void unsupportedExpressionFallsBackToOpaque() {
        ModuleDeclarationNode module = onlyDeclaration(parse("module m; parameter P = f(1); endmodule"));

        ParameterDeclarationNode parameter = (ParameterDeclarationNode) module.members().get(0);
        assertThat(parameter.declarators().get(0).initializer()).isInstanceOf(OpaqueExpressionNode.class);
    }

    @Test
    void missingEndKeywordIsReported() {
        SyntaxTree tree = parse("module m;\n  parameter P = 1;\n");

        assertThat(tree.getDiagnostics().count(DiagCode.MISSING_END_KEYWORD)).isEqualTo(1);
        assertThat(tree.getMetadata().getDeclaredNames()).containsExactly("m");
    }

    @Test
    void packagesAndClassesAreDeclaredNames() {
        SyntaxTree tree = parse("""
                package p; parameter int X = 1; endpackage
                class c; endclass
                interface i; endinterface
                """);

        assertThat(tree.getMetadata().getDeclaredNames()).containsExactlyInAnyOrder("p", "c", "i");
        assertThat(tree.getMetadata().getDeclarations())
                .extracting(ModuleDeclarationNode::kind)
                .containsExactly(DeclarationKind.PACKAGE, DeclarationKind.INTERFACE);
    }
}
