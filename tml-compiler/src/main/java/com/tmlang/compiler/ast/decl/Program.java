package com.tmlang.compiler.ast.decl;

import com.tmlang.compiler.ast.AstNode;
import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 编译单元（一个源文件）
 */
public class Program extends AstNode {
    private final String modulePath;
    private final List<Declaration> declarations;

    public Program(SourceLocation location, String modulePath, List<Declaration> declarations) {
        super(location);
        this.modulePath = modulePath != null ? modulePath : "";
        this.declarations = declarations;
    }

    public String getModulePath() {
        return modulePath;
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
