package com.metabuild.generator.parser.ast;

/**
 * Visitor pattern interface for processing statements.
 */
public interface StatementVisitor {
    void visit(AssignmentNode node);
    void visit(TargetNode node);
    void visit(TemplateNode node);
    void visit(SubmoduleNode node);
    void visit(PropertyDefaultNode node);
    void visit(IfNode node);
    void visit(OptionNode node);
    void visit(FilesListNode node);
    void visit(SrcdirNode node);
}
