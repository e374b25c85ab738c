package org.silica.compiler.frontend.parser.ast;

/**
 * One actual argument of a parameter value assignment.
 */
public sealed interface ParamAssignmentNode extends AstNode
        permits OrderedParamAssignmentNode, NamedParamAssignmentNode {
}
