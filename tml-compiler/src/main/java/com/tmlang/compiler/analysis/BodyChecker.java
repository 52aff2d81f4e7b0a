package com.tmlang.compiler.analysis;

import com.tmlang.compiler.analysis.env.ClassDef;
import com.tmlang.compiler.analysis.env.FieldDef;
import com.tmlang.compiler.analysis.env.FuncSig;
import com.tmlang.compiler.analysis.env.MethodDef;
import com.tmlang.compiler.analysis.env.StructDef;
import com.tmlang.compiler.analysis.env.TypeEnvironment;
import com.tmlang.compiler.analysis.generic.GenericInstantiator;
import com.tmlang.compiler.analysis.generic.Instantiation;
import com.tmlang.compiler.analysis.types.ArrayType;
import com.tmlang.compiler.analysis.types.ClassType;
import com.tmlang.compiler.analysis.types.ClosureType;
import com.tmlang.compiler.analysis.types.FuncType;
import com.tmlang.compiler.analysis.types.NamedType;
import com.tmlang.compiler.analysis.types.PtrType;
import com.tmlang.compiler.analysis.types.RefType;
import com.tmlang.compiler.analysis.types.SliceType;
import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.analysis.types.TypeCompatibility;
import com.tmlang.compiler.analysis.types.Types;
import com.tmlang.compiler.ast.AstVisitor;
import com.tmlang.compiler.ast.decl.FunDecl;
import com.tmlang.compiler.ast.decl.Parameter;
import com.tmlang.compiler.ast.expr.ArrayExpr;
import com.tmlang.compiler.ast.expr.ArrayRepeatExpr;
import com.tmlang.compiler.ast.expr.BinaryExpr;
import com.tmlang.compiler.ast.expr.CallExpr;
import com.tmlang.compiler.ast.expr.CastExpr;
import com.tmlang.compiler.ast.expr.Expression;
import com.tmlang.compiler.ast.expr.Identifier;
import com.tmlang.compiler.ast.expr.Literal;
import com.tmlang.compiler.ast.expr.MemberExpr;
import com.tmlang.compiler.ast.expr.ParenExpr;
import com.tmlang.compiler.ast.expr.ThisExpr;
import com.tmlang.compiler.ast.expr.UnaryExpr;
import com.tmlang.compiler.ast.stmt.Block;
import com.tmlang.compiler.ast.stmt.ExpressionStmt;
import com.tmlang.compiler.ast.stmt.LetStmt;
import com.tmlang.compiler.ast.stmt.ReturnStmt;
import com.tmlang.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 函数体检查：推断表达式类型、检查 let/return/调用，实例化泛型调用并检查约束。
 * <p>
 * 访问器的上下文参数是期望类型（可为 null），用于整数/浮点字面量定型。
 * 出错时报告诊断并返回回退类型（通常为 Unit 或已知类型），检查继续。
 */
final class BodyChecker implements AstVisitor<TmlType, TmlType> {

    private static final String THIS = "this";

    private final SemanticAnalyzer analyzer;
    private final TypeEnvironment env;
    private final SemanticChecker checker;
    private final TypeResolver typeResolver;
    private final ConstEvaluator constEvaluator;
    private final GenericInstantiator instantiator;
    private final BoundChecker boundChecker;
    private final OopChecker oopChecker;
    private final Map<Expression, TmlType> exprTypes;
    private final Map<CallExpr, Instantiation> instantiations;

    private TmlType currentReturnType = Types.UNIT;

    BodyChecker(SemanticAnalyzer analyzer, TypeEnvironment env, SemanticChecker checker,
                TypeResolver typeResolver, ConstEvaluator constEvaluator, GenericInstantiator instantiator,
                BoundChecker boundChecker, OopChecker oopChecker, Map<Expression, TmlType> exprTypes,
                Map<CallExpr, Instantiation> instantiations) {
        this.analyzer = analyzer;
        this.env = env;
        this.checker = checker;
        this.typeResolver = typeResolver;
        this.constEvaluator = constEvaluator;
        this.instantiator = instantiator;
        this.boundChecker = boundChecker;
        this.oopChecker = oopChecker;
        this.exprTypes = exprTypes;
        this.instantiations = instantiations;
    }

    /**
     * 检查一个函数/方法体。
     *
     * @param self 接收者类型，自由函数与静态方法为 null
     */
    void checkFunction(FunDecl decl, FuncSig sig, TmlType self) {
        if (!decl.hasBody() || sig == null) return;
        analyzer.enterGenericScope(decl.getTypeParams());
        env.pushScope(Scope.ScopeType.FUNCTION);
        TmlType savedReturn = currentReturnType;
        try {
            if (self != null) {
                env.define(new Symbol(THIS, SymbolKind.PARAMETER, self, false, decl.getLocation()));
            }
            int index = 0;
            for (Parameter p : decl.getParams()) {
                if (p.isReceiver()) continue;
                TmlType type = index < sig.getParams().size() ? sig.getParams().get(index) : Types.UNIT;
                index++;
                env.define(new Symbol(p.getName(), SymbolKind.PARAMETER, type, p.isMutable(), p.getLocation()));
            }
            currentReturnType = sig.getReturnType();
            decl.getBody().accept(this, null);
        } finally {
            currentReturnType = savedReturn;
            env.popScope();
            analyzer.exitGenericScope();
        }
    }

    /** 推断并记录表达式类型 */
    TmlType infer(Expression expr, TmlType expected) {
        TmlType type = expr.accept(this, expected);
        if (type == null) type = Types.UNIT;
        exprTypes.put(expr, type);
        return type;
    }

    // ============ 语句 ============

    @Override
    public TmlType visitBlock(Block node, TmlType expected) {
        env.pushScope(Scope.ScopeType.BLOCK);
        try {
            for (Statement stmt : node.getStatements()) {
                stmt.accept(this, null);
            }
        } finally {
            env.popScope();
        }
        return Types.UNIT;
    }

    @Override
    public TmlType visitLetStmt(LetStmt node, TmlType expected) {
        TmlType declared = node.getType() != null ? typeResolver.resolve(node.getType()) : null;
        TmlType actual = node.getInitializer() != null ? infer(node.getInitializer(), declared) : null;
        if (declared != null && actual != null) {
            checker.checkCompatible(declared, actual, ErrorCodes.TYPE_MISMATCH,
                    "Type mismatch in let '" + node.getName() + "'", node.getInitializer());
        }
        TmlType type = declared != null ? declared : actual;
        if (type == null) type = env.getTypeVars().fresh();
        env.define(new Symbol(node.getName(), SymbolKind.VARIABLE, type, node.isMutable(), node.getLocation()));
        return Types.UNIT;
    }

    @Override
    public TmlType visitExpressionStmt(ExpressionStmt node, TmlType expected) {
        infer(node.getExpression(), null);
        return Types.UNIT;
    }

    @Override
    public TmlType visitReturnStmt(ReturnStmt node, TmlType expected) {
        TmlType actual = node.getValue() != null ? infer(node.getValue(), currentReturnType) : Types.UNIT;
        checker.checkCompatible(currentReturnType, actual, ErrorCodes.RETURN_TYPE_MISMATCH,
                "Return type mismatch", node.getValue() != null ? node.getValue() : node);
        return Types.NEVER;
    }

    // ============ 字面量与名字 ============

    @Override
    public TmlType visitLiteral(Literal node, TmlType expected) {
        switch (node.getKind()) {
            case INT:
                return Types.isInteger(expected) ? expected : Types.I32;
            case FLOAT:
                return Types.isFloat(expected) ? expected : Types.F64;
            case CHAR:
                return Types.CHAR;
            case STRING:
                return Types.STR;
            case BOOL:
                return Types.BOOL;
            case NULL:
                return Types.NULL_PTR;
            default:
                return Types.UNIT;
        }
    }

    @Override
    public TmlType visitIdentifier(Identifier node, TmlType expected) {
        Symbol sym = env.lookup(node.getName());
        if (sym != null) return sym.getType();
        List<FuncSig> fns = env.lookupFunctions(node.getName());
        if (fns.size() == 1) {
            FuncSig sig = fns.get(0);
            return new FuncType(sig.getParams(), sig.getReturnType());
        }
        if (!fns.isEmpty()) return env.getTypeVars().fresh();
        checker.error(ErrorCodes.UNDEFINED_NAME, "Undefined identifier '" + node.getName() + "'", node);
        return Types.UNIT;
    }

    @Override
    public TmlType visitThisExpr(ThisExpr node, TmlType expected) {
        Symbol sym = env.lookup(THIS);
        if (sym != null) return sym.getType();
        checker.error(ErrorCodes.UNDEFINED_NAME, "'this' used outside of a method", node);
        return Types.UNIT;
    }

    // ============ 运算 ============

    @Override
    public TmlType visitParenExpr(ParenExpr node, TmlType expected) {
        return infer(node.getInner(), expected);
    }

    @Override
    public TmlType visitCastExpr(CastExpr node, TmlType expected) {
        infer(node.getExpression(), null);
        return typeResolver.resolve(node.getTargetType());
    }

    @Override
    public TmlType visitUnaryExpr(UnaryExpr node, TmlType expected) {
        switch (node.getOperator()) {
            case NOT: {
                TmlType operand = infer(node.getOperand(), Types.BOOL);
                checker.checkCompatible(Types.BOOL, operand, ErrorCodes.TYPE_MISMATCH,
                        "Operator '!' requires Bool", node.getOperand());
                return Types.BOOL;
            }
            case REF:
                return new RefType(infer(node.getOperand(), null), false);
            case MUT_REF:
                return new RefType(infer(node.getOperand(), null), true);
            case DEREF: {
                TmlType operand = infer(node.getOperand(), null);
                if (operand instanceof RefType) return ((RefType) operand).getInner();
                if (operand instanceof PtrType) return ((PtrType) operand).getInner();
                checker.error(ErrorCodes.TYPE_MISMATCH, "Cannot dereference a value of type '"
                        + operand.toDisplayString() + "'", node);
                return Types.UNIT;
            }
            default:
                // NEG, BIT_NOT
                return infer(node.getOperand(), expected);
        }
    }

    @Override
    public TmlType visitBinaryExpr(BinaryExpr node, TmlType expected) {
        BinaryExpr.BinaryOp op = node.getOperator();
        if (op.isLogical()) {
            TmlType left = infer(node.getLeft(), Types.BOOL);
            TmlType right = infer(node.getRight(), Types.BOOL);
            checker.checkCompatible(Types.BOOL, left, ErrorCodes.TYPE_MISMATCH,
                    "Operator '" + op.getSource() + "' requires Bool", node.getLeft());
            checker.checkCompatible(Types.BOOL, right, ErrorCodes.TYPE_MISMATCH,
                    "Operator '" + op.getSource() + "' requires Bool", node.getRight());
            return Types.BOOL;
        }
        TmlType left = infer(node.getLeft(), op.isComparison() ? null : expected);
        TmlType right = infer(node.getRight(), left);
        if (!TypeCompatibility.isCompatible(left, right)) {
            checker.error(ErrorCodes.TYPE_MISMATCH, "Operator '" + op.getSource() + "' cannot be applied to '"
                    + left.toDisplayString() + "' and '" + right.toDisplayString() + "'", node);
        }
        return op.isComparison() ? Types.BOOL : left;
    }

    // ============ 数组 ============

    @Override
    public TmlType visitArrayExpr(ArrayExpr node, TmlType expected) {
        TmlType expectedElem = elementOf(expected);
        List<Expression> elements = node.getElements();
        if (elements.isEmpty()) {
            return new ArrayType(expectedElem != null ? expectedElem : env.getTypeVars().fresh(), 0);
        }
        TmlType elem = infer(elements.get(0), expectedElem);
        for (int i = 1; i < elements.size(); i++) {
            TmlType t = infer(elements.get(i), elem);
            checker.checkCompatible(elem, t, ErrorCodes.TYPE_MISMATCH,
                    "Array element " + i + " type mismatch", elements.get(i));
        }
        return new ArrayType(elem, elements.size());
    }

    @Override
    public TmlType visitArrayRepeatExpr(ArrayRepeatExpr node, TmlType expected) {
        TmlType elem = infer(node.getValue(), elementOf(expected));
        long count = constEvaluator.evaluateArraySize(node.getCount());
        if (count < 0) return new SliceType(elem);
        return new ArrayType(elem, count);
    }

    private static TmlType elementOf(TmlType type) {
        if (type instanceof ArrayType) return ((ArrayType) type).getElement();
        if (type instanceof SliceType) return ((SliceType) type).getElement();
        return null;
    }

    // ============ 成员与调用 ============

    @Override
    public TmlType visitMemberExpr(MemberExpr node, TmlType expected) {
        TmlType target = autoDeref(infer(node.getTarget(), null));
        String member = node.getMember();

        if (target instanceof ClassType) {
            ClassDef cls = env.lookupClass(((ClassType) target).getName());
            if (cls == null) return env.getTypeVars().fresh();
            ClassDef owner = oopChecker.findDeclaringClass(cls, member);
            if (owner == null) {
                checker.error(ErrorCodes.UNKNOWN_MEMBER, "Unknown member '" + member + "' on class '"
                        + cls.getName() + "'", node);
                return Types.UNIT;
            }
            oopChecker.checkMemberAccess(owner, member, env.currentClass(), node.getLocation());
            Map<String, TmlType> subst = classSubstitution(owner, (ClassType) target);
            FieldDef field = owner.findField(member);
            if (field != null) return GenericInstantiator.substitute(field.getType(), subst);
            FuncSig sig = owner.findMethod(member).getSig();
            List<TmlType> params = new ArrayList<TmlType>();
            for (TmlType p : sig.getParams()) params.add(GenericInstantiator.substitute(p, subst));
            return new FuncType(params, GenericInstantiator.substitute(sig.getReturnType(), subst));
        }

        if (target instanceof NamedType) {
            NamedType named = (NamedType) target;
            StructDef struct = env.lookupStruct(named.getName());
            if (struct != null) {
                FieldDef field = struct.findField(member);
                if (field == null) {
                    checker.error(ErrorCodes.UNKNOWN_MEMBER, "Unknown field '" + member + "' on struct '"
                            + struct.getName() + "'", node);
                    return Types.UNIT;
                }
                return GenericInstantiator.substitute(field.getType(),
                        zip(struct.getTypeParams(), named.getTypeArgs()));
            }
        }
        // 其他类型的成员（impl 方法、内置类型方法）在此阶段不做解析
        return env.getTypeVars().fresh();
    }

    @Override
    public TmlType visitCallExpr(CallExpr node, TmlType expected) {
        Expression callee = node.getCallee();
        if (callee instanceof Identifier) {
            String name = ((Identifier) callee).getName();
            Symbol sym = env.lookup(name);
            if (sym != null) {
                exprTypes.put(callee, sym.getType());
                return callCallable(node, name, sym.getType());
            }
            List<FuncSig> overloads = env.lookupFunctions(name);
            if (overloads.isEmpty()) {
                checker.error(ErrorCodes.UNDEFINED_FUNCTION, "Undefined function '" + name + "'", callee);
                inferArgs(node.getArgs(), null);
                return Types.UNIT;
            }
            return callSignature(node, name, selectOverload(overloads, node.getArgs().size()));
        }
        if (callee instanceof MemberExpr) {
            MemberExpr member = (MemberExpr) callee;
            TmlType target = autoDeref(infer(member.getTarget(), null));
            if (target instanceof ClassType) {
                ClassDef cls = env.lookupClass(((ClassType) target).getName());
                MethodDef method = cls != null ? oopChecker.findInChain(cls, member.getMember()) : null;
                if (cls != null && method == null) {
                    checker.error(ErrorCodes.UNKNOWN_MEMBER, "Unknown method '" + member.getMember()
                            + "' on class '" + cls.getName() + "'", member);
                    inferArgs(node.getArgs(), null);
                    return Types.UNIT;
                }
                if (method != null) {
                    ClassDef owner = oopChecker.findDeclaringClass(cls, member.getMember());
                    oopChecker.checkMemberAccess(owner, member.getMember(), env.currentClass(), member.getLocation());
                    Map<String, TmlType> subst = classSubstitution(owner, (ClassType) target);
                    return callSignature(node, member.getMember(), substituteSig(method.getSig(), subst));
                }
            }
            inferArgs(node.getArgs(), null);
            return env.getTypeVars().fresh();
        }
        TmlType calleeType = infer(callee, null);
        return callCallable(node, "<expr>", calleeType);
    }

    private FuncSig selectOverload(List<FuncSig> overloads, int argCount) {
        for (FuncSig sig : overloads) {
            if (sig.getParams().size() == argCount) return sig;
        }
        return overloads.get(0);
    }

    /** 调用函数类型/闭包类型的值 */
    private TmlType callCallable(CallExpr node, String name, TmlType calleeType) {
        List<TmlType> params;
        TmlType ret;
        if (calleeType instanceof FuncType) {
            params = ((FuncType) calleeType).getParams();
            ret = ((FuncType) calleeType).getReturnType();
        } else if (calleeType instanceof ClosureType) {
            params = ((ClosureType) calleeType).getParams();
            ret = ((ClosureType) calleeType).getReturnType();
        } else {
            inferArgs(node.getArgs(), null);
            return env.getTypeVars().fresh();
        }
        checkArgs(node, name, params, inferArgs(node.getArgs(), params));
        return ret;
    }

    /**
     * 按签名检查调用；泛型签名先实例化，再检查实参、未推断参数与约束。
     */
    private TmlType callSignature(CallExpr node, String name, FuncSig sig) {
        if (!sig.isGeneric()) {
            List<TmlType> argTypes = inferArgs(node.getArgs(), sig.getParams());
            checkArgs(node, name, sig.getParams(), argTypes);
            return sig.getReturnType();
        }

        List<TmlType> explicit = typeResolver.resolveAll(node.getTypeArgs());
        List<TmlType> hints = new ArrayList<TmlType>();
        for (TmlType p : sig.getParams()) {
            hints.add(Types.containsGeneric(p) ? null : p);
        }
        List<TmlType> argTypes = inferArgs(node.getArgs(), hints);
        Instantiation inst = instantiator.instantiateCall(sig, explicit, argTypes);
        checkArgs(node, name, inst.getParamTypes(), argTypes);
        for (String unbound : inst.getUnboundParams()) {
            checker.error(ErrorCodes.UNINFERRED_TYPE_PARAM, "Cannot infer type parameter '" + unbound
                    + "' of '" + name + "'", node);
        }
        boundChecker.checkBounds(sig, inst.getSubstitution(), node.getLocation());
        instantiations.put(node, inst);
        return inst.getReturnType();
    }

    private List<TmlType> inferArgs(List<Expression> args, List<TmlType> hints) {
        List<TmlType> types = new ArrayList<TmlType>(args.size());
        for (int i = 0; i < args.size(); i++) {
            TmlType hint = hints != null && i < hints.size() ? hints.get(i) : null;
            types.add(infer(args.get(i), hint));
        }
        return types;
    }

    private void checkArgs(CallExpr node, String name, List<TmlType> params, List<TmlType> argTypes) {
        if (params.size() != argTypes.size()) {
            checker.error(ErrorCodes.PARAM_COUNT_MISMATCH, "Function '" + name + "' expects " + params.size()
                    + " arguments but got " + argTypes.size(), node);
            return;
        }
        for (int i = 0; i < params.size(); i++) {
            checker.checkCompatible(params.get(i), argTypes.get(i), ErrorCodes.ARG_TYPE_MISMATCH,
                    "Argument " + (i + 1) + " of '" + name + "'", node.getArgs().get(i));
        }
    }

    // ============ 辅助 ============

    private static TmlType autoDeref(TmlType type) {
        if (type instanceof RefType) return ((RefType) type).getInner();
        return type;
    }

    private static Map<String, TmlType> classSubstitution(ClassDef owner, ClassType target) {
        if (!owner.getName().equals(target.getName())) return new HashMap<String, TmlType>();
        return zip(owner.getTypeParams(), target.getTypeArgs());
    }

    private static Map<String, TmlType> zip(List<String> names, List<TmlType> args) {
        Map<String, TmlType> subst = new HashMap<String, TmlType>();
        for (int i = 0; i < names.size() && i < args.size(); i++) {
            subst.put(names.get(i), args.get(i));
        }
        return subst;
    }

    private static FuncSig substituteSig(FuncSig sig, Map<String, TmlType> subst) {
        if (subst.isEmpty()) return sig;
        List<TmlType> params = new ArrayList<TmlType>();
        for (TmlType p : sig.getParams()) params.add(GenericInstantiator.substitute(p, subst));
        return new FuncSig(sig.getName(), params, GenericInstantiator.substitute(sig.getReturnType(), subst),
                sig.getTypeParams(), sig.getConstParams(), sig.getConstraints(), sig.getLifetimeBounds(),
                sig.getLocation());
    }
}
