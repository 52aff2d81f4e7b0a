package com.tmlang.compiler;

import com.tmlang.compiler.ast.Modifier;
import com.tmlang.compiler.ast.SourceLocation;
import com.tmlang.compiler.ast.decl.ClassDecl;
import com.tmlang.compiler.ast.decl.ConstDecl;
import com.tmlang.compiler.ast.decl.Declaration;
import com.tmlang.compiler.ast.decl.Decorator;
import com.tmlang.compiler.ast.decl.EnumDecl;
import com.tmlang.compiler.ast.decl.FieldDecl;
import com.tmlang.compiler.ast.decl.FunDecl;
import com.tmlang.compiler.ast.decl.InterfaceDecl;
import com.tmlang.compiler.ast.decl.Parameter;
import com.tmlang.compiler.ast.decl.Program;
import com.tmlang.compiler.ast.decl.StructDecl;
import com.tmlang.compiler.ast.expr.ArrayExpr;
import com.tmlang.compiler.ast.expr.BinaryExpr;
import com.tmlang.compiler.ast.expr.CallExpr;
import com.tmlang.compiler.ast.expr.Expression;
import com.tmlang.compiler.ast.expr.Identifier;
import com.tmlang.compiler.ast.expr.Literal;
import com.tmlang.compiler.ast.expr.MemberExpr;
import com.tmlang.compiler.ast.stmt.Block;
import com.tmlang.compiler.ast.stmt.ExpressionStmt;
import com.tmlang.compiler.ast.stmt.LetStmt;
import com.tmlang.compiler.ast.stmt.ReturnStmt;
import com.tmlang.compiler.ast.stmt.Statement;
import com.tmlang.compiler.ast.type.ArrayTypeRef;
import com.tmlang.compiler.ast.type.GenericTypeRef;
import com.tmlang.compiler.ast.type.SimpleType;
import com.tmlang.compiler.ast.type.TypeParameter;
import com.tmlang.compiler.ast.type.TypeRef;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 测试用 AST 构造 DSL（解析器不在本仓库中）。
 */
public final class AstFixtures {

    public static final SourceLocation LOC = new SourceLocation("test.tml", 1, 1, 1);

    private AstFixtures() {}

    // ============ 类型引用 ============

    public static TypeRef type(String name) {
        return new SimpleType(LOC, name);
    }

    public static TypeRef type(String name, TypeRef... args) {
        return new GenericTypeRef(LOC, name, Arrays.asList(args));
    }

    public static TypeRef arrayType(TypeRef element, long size) {
        return new ArrayTypeRef(LOC, element, intLit(size));
    }

    public static TypeParameter typeParam(String name, TypeRef... bounds) {
        return new TypeParameter(LOC, name, Arrays.asList(bounds));
    }

    // ============ 表达式 ============

    public static Literal intLit(long value) {
        return new Literal(LOC, BigInteger.valueOf(value), Literal.LiteralKind.INT);
    }

    public static Literal floatLit(double value) {
        return new Literal(LOC, value, Literal.LiteralKind.FLOAT);
    }

    public static Literal boolLit(boolean value) {
        return new Literal(LOC, value, Literal.LiteralKind.BOOL);
    }

    public static Literal strLit(String value) {
        return new Literal(LOC, value, Literal.LiteralKind.STRING);
    }

    public static Identifier ident(String name) {
        return new Identifier(LOC, name);
    }

    public static BinaryExpr binary(Expression left, BinaryExpr.BinaryOp op, Expression right) {
        return new BinaryExpr(LOC, left, op, right);
    }

    public static CallExpr call(String name, Expression... args) {
        return new CallExpr(LOC, ident(name), Arrays.asList(args));
    }

    public static CallExpr callWith(String name, List<TypeRef> typeArgs, Expression... args) {
        return new CallExpr(LOC, ident(name), typeArgs, Arrays.asList(args));
    }

    public static CallExpr methodCall(Expression target, String method, Expression... args) {
        return new CallExpr(LOC, new MemberExpr(LOC, target, method), Arrays.asList(args));
    }

    public static ArrayExpr array(Expression... elements) {
        return new ArrayExpr(LOC, Arrays.asList(elements));
    }

    // ============ 语句 ============

    public static LetStmt let(String name, TypeRef type, Expression init) {
        return new LetStmt(LOC, name, false, type, init);
    }

    public static ReturnStmt ret(Expression value) {
        return new ReturnStmt(LOC, value);
    }

    public static ExpressionStmt expr(Expression e) {
        return new ExpressionStmt(LOC, e);
    }

    public static Block block(Statement... statements) {
        return new Block(LOC, Arrays.asList(statements));
    }

    // ============ 声明 ============

    public static Parameter param(String name, TypeRef type) {
        return new Parameter(LOC, name, type);
    }

    public static FunDecl fun(String name, List<Parameter> params, TypeRef returnType, Statement... body) {
        return genericFun(name, Collections.<TypeParameter>emptyList(), params, returnType, body);
    }

    public static FunDecl genericFun(String name, List<TypeParameter> typeParams, List<Parameter> params,
                                     TypeRef returnType, Statement... body) {
        return new FunDecl(LOC, null, Collections.<Modifier>emptyList(), name, typeParams, params,
                returnType, block(body));
    }

    /** 方法声明，带修饰符；body 为空表示抽象方法 */
    public static FunDecl method(String name, List<Modifier> modifiers, List<Parameter> params,
                                 TypeRef returnType, Statement... body) {
        List<Parameter> all = new ArrayList<Parameter>();
        all.add(new Parameter(LOC, "this", null));
        all.addAll(params);
        return new FunDecl(LOC, null, modifiers, name, null, all, returnType,
                body.length == 0 && modifiers.contains(Modifier.ABSTRACT) ? null : block(body));
    }

    public static FieldDecl field(String name, TypeRef type) {
        return new FieldDecl(LOC, Collections.<Modifier>emptyList(), name, type);
    }

    public static StructDecl struct(String name, List<TypeParameter> typeParams, FieldDecl... fields) {
        return new StructDecl(LOC, null, name, typeParams, Arrays.asList(fields));
    }

    public static EnumDecl enumDecl(String name, List<TypeParameter> typeParams, EnumDecl.Variant... variants) {
        return new EnumDecl(LOC, null, name, typeParams, Arrays.asList(variants));
    }

    public static ConstDecl constant(String name, TypeRef type, Expression value) {
        return new ConstDecl(LOC, name, type, value);
    }

    public static InterfaceDecl iface(String name, FunDecl... methods) {
        return new InterfaceDecl(LOC, null, name, null, null, Arrays.asList(methods));
    }

    public static InterfaceDecl genericIface(String name, List<TypeParameter> typeParams, FunDecl... methods) {
        return new InterfaceDecl(LOC, null, name, typeParams, null, Arrays.asList(methods));
    }

    /** 构造类声明的小型 builder */
    public static ClassBuilder cls(String name) {
        return new ClassBuilder(name);
    }

    public static Program program(Declaration... decls) {
        return new Program(LOC, "test", Arrays.asList(decls));
    }

    public static List<Parameter> params(Parameter... ps) {
        return Arrays.asList(ps);
    }

    public static List<Modifier> mods(Modifier... ms) {
        return Arrays.asList(ms);
    }

    public static final class ClassBuilder {
        private final String name;
        private final List<Decorator> decorators = new ArrayList<Decorator>();
        private final List<Modifier> modifiers = new ArrayList<Modifier>();
        private TypeRef base;
        private final List<TypeParameter> typeParams = new ArrayList<TypeParameter>();
        private final List<TypeRef> interfaces = new ArrayList<TypeRef>();
        private final List<FieldDecl> fields = new ArrayList<FieldDecl>();
        private final List<FunDecl> methods = new ArrayList<FunDecl>();

        private ClassBuilder(String name) {
            this.name = name;
        }

        public ClassBuilder value() {
            decorators.add(new Decorator(LOC, "value"));
            return this;
        }

        public ClassBuilder decorator(String decorator) {
            decorators.add(new Decorator(LOC, decorator));
            return this;
        }

        public ClassBuilder modifier(Modifier modifier) {
            modifiers.add(modifier);
            return this;
        }

        public ClassBuilder extend(String baseName) {
            this.base = type(baseName);
            return this;
        }

        public ClassBuilder extend(TypeRef baseType) {
            this.base = baseType;
            return this;
        }

        public ClassBuilder typeParam(String paramName) {
            typeParams.add(AstFixtures.typeParam(paramName));
            return this;
        }

        public ClassBuilder implement(String ifaceName) {
            interfaces.add(type(ifaceName));
            return this;
        }

        public ClassBuilder implement(TypeRef iface) {
            interfaces.add(iface);
            return this;
        }

        public ClassBuilder field(String fieldName, TypeRef type) {
            fields.add(AstFixtures.field(fieldName, type));
            return this;
        }

        public ClassBuilder privateField(String fieldName, TypeRef type) {
            fields.add(new FieldDecl(LOC, Collections.singletonList(Modifier.PRIVATE), fieldName, type));
            return this;
        }

        public ClassBuilder method(FunDecl method) {
            methods.add(method);
            return this;
        }

        public ClassDecl build() {
            return new ClassDecl(LOC, decorators, modifiers, name, typeParams, base, interfaces, fields, methods, null);
        }
    }
}
