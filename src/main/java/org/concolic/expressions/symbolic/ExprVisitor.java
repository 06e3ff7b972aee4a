package org.concolic.expressions.symbolic;

/**
 * 表达式树的访问者。每个节点变体对应一个方法，
 * 新增变体时所有实现都必须随之更新 (序列化、位向量转换等)。
 * @param <R> 访问结果类型。
 */
public interface ExprVisitor<R> {

    R visitConstant(ConstantExpr expr);

    R visitBasic(BasicExpr expr);

    R visitUnary(UnaryExpr expr);

    R visitBinary(BinaryExpr expr);

    R visitCompare(CompareExpr expr);

    R visitDeref(DerefExpr expr);
}
