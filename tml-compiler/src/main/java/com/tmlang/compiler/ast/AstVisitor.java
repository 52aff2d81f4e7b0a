package com.tmlang.compiler.ast;

import com.tmlang.compiler.ast.decl.*;
import com.tmlang.compiler.ast.expr.*;
import com.tmlang.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    default R visitProgram(Program node, C ctx) { return null; }

    default R visitClassDecl(ClassDecl node, C ctx) { return null; }

    default R visitInterfaceDecl(InterfaceDecl node, C ctx) { return null; }

    default R visitStructDecl(StructDecl node, C ctx) { return null; }

    default R visitEnumDecl(EnumDecl node, C ctx) { return null; }

    default R visitFunDecl(FunDecl node, C ctx) { return null; }

    default R visitFieldDecl(FieldDecl node, C ctx) { return null; }

    default R visitConstDecl(ConstDecl node, C ctx) { return null; }

    default R visitImplDecl(ImplDecl node, C ctx) { return null; }

    default R visitParameter(Parameter node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitBlock(Block node, C ctx) { return null; }

    default R visitLetStmt(LetStmt node, C ctx) { return null; }

    default R visitExpressionStmt(ExpressionStmt node, C ctx) { return null; }

    default R visitReturnStmt(ReturnStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitLiteral(Literal node, C ctx) { return null; }

    default R visitIdentifier(Identifier node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitParenExpr(ParenExpr node, C ctx) { return null; }

    default R visitCastExpr(CastExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }

    default R visitMemberExpr(MemberExpr node, C ctx) { return null; }

    default R visitThisExpr(ThisExpr node, C ctx) { return null; }

    default R visitArrayExpr(ArrayExpr node, C ctx) { return null; }

    default R visitArrayRepeatExpr(ArrayRepeatExpr node, C ctx) { return null; }
}
