package com.thriftgen.generator.codegen.testdata.ir;

/**
 * Visitor for lowering {@link DrawExpr} trees.
 */
public interface DrawExprVisitor<R> {
    R visit(TypeDraw draw);
    R visit(NullableDraw draw);
}
