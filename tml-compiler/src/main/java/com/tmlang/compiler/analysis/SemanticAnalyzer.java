package com.tmlang.compiler.analysis;

import com.tmlang.compiler.analysis.env.BoundConstraint;
import com.tmlang.compiler.analysis.env.ClassDef;
import com.tmlang.compiler.analysis.env.EnumDef;
import com.tmlang.compiler.analysis.env.FieldDef;
import com.tmlang.compiler.analysis.env.FuncSig;
import com.tmlang.compiler.analysis.env.InterfaceDef;
import com.tmlang.compiler.analysis.env.MethodDef;
import com.tmlang.compiler.analysis.env.StructDef;
import com.tmlang.compiler.analysis.env.TypeEnvironment;
import com.tmlang.compiler.analysis.generic.GenericInstantiator;
import com.tmlang.compiler.analysis.generic.Instantiation;
import com.tmlang.compiler.analysis.generic.NameMangler;
import com.tmlang.compiler.analysis.types.ClassType;
import com.tmlang.compiler.analysis.types.DynBehaviorType;
import com.tmlang.compiler.analysis.types.GenericType;
import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.analysis.types.Types;
import com.tmlang.compiler.ast.Modifier;
import com.tmlang.compiler.ast.Visibility;
import com.tmlang.compiler.ast.decl.ClassDecl;
import com.tmlang.compiler.ast.decl.ConstDecl;
import com.tmlang.compiler.ast.decl.Declaration;
import com.tmlang.compiler.ast.decl.EnumDecl;
import com.tmlang.compiler.ast.decl.FieldDecl;
import com.tmlang.compiler.ast.decl.FunDecl;
import com.tmlang.compiler.ast.decl.ImplDecl;
import com.tmlang.compiler.ast.decl.InterfaceDecl;
import com.tmlang.compiler.ast.decl.Parameter;
import com.tmlang.compiler.ast.decl.Program;
import com.tmlang.compiler.ast.decl.StructDecl;
import com.tmlang.compiler.ast.expr.CallExpr;
import com.tmlang.compiler.ast.expr.Expression;
import com.tmlang.compiler.ast.type.BehaviorTypeRef;
import com.tmlang.compiler.ast.type.GenericTypeRef;
import com.tmlang.compiler.ast.type.SimpleType;
import com.tmlang.compiler.ast.type.TypeParameter;
import com.tmlang.compiler.ast.type.TypeRef;
import com.tmlang.compiler.ast.type.WhereClause;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 语义分析器：注册所有声明后依次做 OOP 校验与函数体检查，收集诊断。
 *
 * <p>各阶段：</p>
 * <ol>
 *   <li>预声明：登记所有顶层类型名，前向引用可解析</li>
 *   <li>注册：常量、接口、结构体、枚举、类、函数、impl</li>
 *   <li>类派生属性：继承深度、估算大小、栈分配资格、vtable</li>
 *   <li>OOP 校验，委托给 {@link OopChecker}</li>
 *   <li>函数体检查，委托给 {@link BodyChecker}</li>
 * </ol>
 *
 * <p>每个编译单元使用独立实例。</p>
 */
public final class SemanticAnalyzer {

    private static final Logger LOG = Logger.getLogger(SemanticAnalyzer.class.getName());

    public static final String VALUE_DECORATOR = "value";
    public static final String POOL_DECORATOR = "pool";

    private final AnalyzerOptions options;
    private final TypeEnvironment env;
    private final List<SemanticDiagnostic> diagnostics = new ArrayList<SemanticDiagnostic>();
    private final Map<Expression, TmlType> exprTypes = new HashMap<Expression, TmlType>();
    private final Map<CallExpr, Instantiation> instantiations = new LinkedHashMap<CallExpr, Instantiation>();

    private final SemanticChecker checker;
    private final ConstEvaluator constEvaluator;
    private final TypeResolver typeResolver;
    private final GenericInstantiator instantiator;
    private final BoundChecker boundChecker;
    private final OopChecker oopChecker;

    // 注册阶段产物，供函数体检查使用
    private final Map<FunDecl, FuncSig> functionSigs = new LinkedHashMap<FunDecl, FuncSig>();
    private final List<FunDecl> topLevelFunctions = new ArrayList<FunDecl>();
    private final List<ClassDecl> classDecls = new ArrayList<ClassDecl>();
    private final List<InterfaceDecl> interfaceDecls = new ArrayList<InterfaceDecl>();
    private final Map<ImplDecl, TmlType> implTargets = new LinkedHashMap<ImplDecl, TmlType>();

    public SemanticAnalyzer() {
        this(AnalyzerOptions.defaults(), new TypeEnvironment(""), new NameMangler());
    }

    public SemanticAnalyzer(AnalyzerOptions options, TypeEnvironment env, NameMangler mangler) {
        this.options = options;
        this.env = env;
        this.checker = new SemanticChecker(diagnostics);
        this.constEvaluator = new ConstEvaluator(env, checker);
        this.typeResolver = new TypeResolver(env, checker, constEvaluator);
        this.constEvaluator.setTypeResolver(typeResolver);
        this.instantiator = new GenericInstantiator(mangler);
        this.boundChecker = new BoundChecker(env, checker);
        this.oopChecker = new OopChecker(env, checker);
    }

    /** 分析入口 */
    public AnalysisResult analyze(Program program) {
        List<Declaration> decls = program.getDeclarations();
        LOG.fine("analyze " + program.getModulePath() + ": " + decls.size() + " declarations");

        predeclare(decls);
        register(decls);
        finalizeClasses();
        validate();
        checkBodies();

        // 表达式类型中残留的类型变量按当前绑定解析
        for (Map.Entry<Expression, TmlType> entry : exprTypes.entrySet()) {
            entry.setValue(env.getTypeVars().resolve(entry.getValue()));
        }
        LOG.fine("analysis done: " + checker.errorCount() + " errors, "
                + instantiations.size() + " generic call sites");
        return new AnalysisResult(diagnostics, exprTypes, instantiations, env);
    }

    public TypeEnvironment getEnvironment() {
        return env;
    }

    public TypeResolver getTypeResolver() {
        return typeResolver;
    }

    public ConstEvaluator getConstEvaluator() {
        return constEvaluator;
    }

    public GenericInstantiator getInstantiator() {
        return instantiator;
    }

    // ============ 预声明 ============

    private void predeclare(List<Declaration> decls) {
        for (Declaration decl : decls) {
            if (decl instanceof ClassDecl) {
                typeResolver.predeclare(decl.getName(), TypeResolver.DeclKind.CLASS);
            } else if (decl instanceof StructDecl) {
                typeResolver.predeclare(decl.getName(), TypeResolver.DeclKind.STRUCT);
            } else if (decl instanceof EnumDecl) {
                typeResolver.predeclare(decl.getName(), TypeResolver.DeclKind.ENUM);
            } else if (decl instanceof InterfaceDecl) {
                typeResolver.predeclare(decl.getName(), TypeResolver.DeclKind.INTERFACE);
            }
        }
    }

    // ============ 注册 ============

    private void register(List<Declaration> decls) {
        Set<String> typeNames = new HashSet<String>();
        Set<String> constNames = new HashSet<String>();

        // 常量先注册，类型中的数组长度可能引用它们
        for (Declaration decl : decls) {
            if (decl instanceof ConstDecl) {
                if (!constNames.add(decl.getName())) {
                    duplicate(decl);
                    continue;
                }
                registerConst((ConstDecl) decl);
            }
        }
        for (Declaration decl : decls) {
            if (decl instanceof ConstDecl) continue;
            if (decl instanceof FunDecl) {
                registerFunction((FunDecl) decl);
                continue;
            }
            if (decl instanceof ImplDecl) {
                registerImpl((ImplDecl) decl);
                continue;
            }
            if (!typeNames.add(decl.getName())) {
                duplicate(decl);
                continue;
            }
            if (decl instanceof InterfaceDecl) {
                registerInterface((InterfaceDecl) decl);
            } else if (decl instanceof StructDecl) {
                registerStruct((StructDecl) decl);
            } else if (decl instanceof EnumDecl) {
                registerEnum((EnumDecl) decl);
            } else if (decl instanceof ClassDecl) {
                registerClass((ClassDecl) decl);
            }
        }
    }

    private void duplicate(Declaration decl) {
        checker.error(ErrorCodes.DUPLICATE_DEFINITION, "Duplicate definition of '" + decl.getName() + "'", decl);
    }

    private boolean isReservedTypeName(String name) {
        return Types.fromName(name) != null || TypeResolver.isBuiltinNamed(name);
    }

    private void registerConst(ConstDecl decl) {
        TmlType type = decl.getType() != null ? typeResolver.resolve(decl.getType()) : null;
        int before = diagnostics.size();
        Optional<ConstValue> value = constEvaluator.evaluate(decl.getValue(), type);
        if (value.isPresent()) {
            env.defineConstant(decl.getName(), value.get());
        } else if (diagnostics.size() == before) {
            checker.error(ErrorCodes.CONST_NOT_EVALUABLE, "Initializer of constant '" + decl.getName()
                    + "' is not a compile-time constant", decl);
        }
        TmlType symbolType = type != null ? type : constType(value);
        env.define(new Symbol(decl.getName(), SymbolKind.CONSTANT, symbolType, false, decl.getLocation()));
        LOG.finer("const " + decl.getName() + " = " + value.orElse(null));
    }

    private static TmlType constType(Optional<ConstValue> value) {
        if (!value.isPresent()) return Types.I64;
        switch (value.get().getKind()) {
            case U64: return Types.U64;
            case BOOL: return Types.BOOL;
            case CHAR: return Types.CHAR;
            default: return Types.I64;
        }
    }

    private void registerInterface(InterfaceDecl decl) {
        if (isReservedTypeName(decl.getName())) {
            checker.error(ErrorCodes.RESERVED_TYPE_NAME, "Cannot redefine reserved type name '"
                    + decl.getName() + "'", decl);
        }
        enterGenericScope(decl.getTypeParams());
        List<String> extendsList = new ArrayList<String>();
        for (TypeRef ref : decl.getExtendsList()) {
            String name = refName(ref);
            if (name != null) extendsList.add(name);
        }
        List<MethodDef> methods = new ArrayList<MethodDef>();
        for (FunDecl fn : decl.getMethods()) {
            FuncSig sig = buildSignature(fn);
            functionSigs.put(fn, sig);
            methods.add(new MethodDef(sig, fn.hasModifier(Modifier.STATIC), true, false,
                    !fn.hasBody(), false, fn.hasBody(), Visibility.PUBLIC));
        }
        exitGenericScope();
        env.defineInterface(new InterfaceDef(decl.getName(), typeParamNames(decl.getTypeParams()), extendsList,
                methods, decl.getLocation()));
        interfaceDecls.add(decl);
    }

    private void registerStruct(StructDecl decl) {
        if (isReservedTypeName(decl.getName())) {
            checker.error(ErrorCodes.RESERVED_TYPE_NAME, "Cannot redefine reserved type name '"
                    + decl.getName() + "'", decl);
        }
        enterGenericScope(decl.getTypeParams());
        List<FieldDef> fields = resolveFields(decl.getFields());
        exitGenericScope();
        env.defineStruct(new StructDef(decl.getName(), typeParamNames(decl.getTypeParams()), fields,
                decl.getLocation()));
    }

    private void registerEnum(EnumDecl decl) {
        if (isReservedTypeName(decl.getName())) {
            checker.error(ErrorCodes.RESERVED_TYPE_NAME, "Cannot redefine reserved type name '"
                    + decl.getName() + "'", decl);
        }
        enterGenericScope(decl.getTypeParams());
        List<EnumDef.Variant> variants = new ArrayList<EnumDef.Variant>();
        for (EnumDecl.Variant v : decl.getVariants()) {
            variants.add(new EnumDef.Variant(v.getName(), typeResolver.resolveAll(v.getPayload())));
        }
        exitGenericScope();
        env.defineEnum(new EnumDef(decl.getName(), typeParamNames(decl.getTypeParams()), variants,
                decl.getLocation()));
    }

    private void registerClass(ClassDecl decl) {
        if (isReservedTypeName(decl.getName())) {
            checker.error(ErrorCodes.RESERVED_TYPE_NAME, "Cannot redefine reserved type name '"
                    + decl.getName() + "'", decl);
        }
        enterGenericScope(decl.getTypeParams());
        String baseClass = decl.getBaseClass() != null ? refName(decl.getBaseClass()) : null;
        List<TmlType> baseTypeArgs = decl.getBaseClass() != null
                ? refArgs(decl.getBaseClass()) : Collections.<TmlType>emptyList();
        List<BoundConstraint.BehaviorRef> interfaces = new ArrayList<BoundConstraint.BehaviorRef>();
        for (TypeRef ref : decl.getInterfaces()) {
            String name = refName(ref);
            if (name != null) interfaces.add(new BoundConstraint.BehaviorRef(name, refArgs(ref)));
        }
        List<FieldDef> fields = resolveFields(decl.getFields());
        List<MethodDef> methods = new ArrayList<MethodDef>();
        for (FunDecl fn : decl.getMethods()) {
            FuncSig sig = buildSignature(fn);
            functionSigs.put(fn, sig);
            methods.add(new MethodDef(sig,
                    fn.hasModifier(Modifier.STATIC),
                    fn.hasModifier(Modifier.VIRTUAL),
                    fn.hasModifier(Modifier.OVERRIDE),
                    fn.hasModifier(Modifier.ABSTRACT),
                    fn.hasModifier(Modifier.FINAL),
                    fn.hasBody(),
                    fn.getVisibility()));
        }
        List<FuncSig> constructors = new ArrayList<FuncSig>();
        for (FunDecl ctor : decl.getConstructors()) {
            FuncSig sig = buildSignature(ctor);
            functionSigs.put(ctor, sig);
            constructors.add(sig);
        }
        exitGenericScope();

        List<String> typeParams = new ArrayList<String>();
        List<String> constParams = new ArrayList<String>();
        for (TypeParameter tp : decl.getTypeParams()) {
            if (tp.isConst()) constParams.add(tp.getName());
            else typeParams.add(tp.getName());
        }
        env.defineClass(new ClassDef(decl.getName(), baseClass, baseTypeArgs, interfaces, typeParams, constParams, fields,
                methods, constructors,
                decl.hasDecorator(VALUE_DECORATOR),
                decl.hasDecorator(POOL_DECORATOR),
                decl.isSealed(),
                decl.isAbstract(),
                decl.getLocation()));
        classDecls.add(decl);
        LOG.finer("registered class " + decl.getName());
    }

    private void registerFunction(FunDecl decl) {
        FuncSig sig = buildSignature(decl);
        functionSigs.put(decl, sig);
        topLevelFunctions.add(decl);
        env.defineFunction(sig);
        LOG.finer("registered function " + decl.getName() + (sig.isGeneric() ? " " + sig.getTypeParams() : ""));
    }

    private void registerImpl(ImplDecl decl) {
        enterGenericScope(decl.getTypeParams());
        TmlType target = typeResolver.resolve(decl.getTarget());
        String behavior = refName(decl.getBehavior());
        List<TmlType> args = refArgs(decl.getBehavior());
        if (behavior != null && !typeResolver.isKnownBehavior(behavior)) {
            checker.error(ErrorCodes.UNKNOWN_TYPE, "Unknown behavior '" + behavior + "'", decl.getBehavior());
        } else if (behavior != null) {
            env.registerImpl(target, behavior, args);
        }
        for (FunDecl fn : decl.getMethods()) {
            functionSigs.put(fn, buildSignature(fn));
        }
        exitGenericScope();
        implTargets.put(decl, target);
    }

    private List<FieldDef> resolveFields(List<FieldDecl> decls) {
        List<FieldDef> fields = new ArrayList<FieldDef>(decls.size());
        for (FieldDecl f : decls) {
            fields.add(new FieldDef(f.getName(), typeResolver.resolve(f.getType()), f.isStatic(), f.getVisibility()));
        }
        return fields;
    }

    /**
     * 构建函数签名：解析参数（不含接收者）、返回类型、行为约束、where 子句与生命周期约束。
     */
    private FuncSig buildSignature(FunDecl decl) {
        enterGenericScope(decl.getTypeParams());
        try {
            List<TmlType> params = new ArrayList<TmlType>();
            for (Parameter p : decl.getParams()) {
                if (p.isReceiver()) continue;
                params.add(typeResolver.resolve(p.getType()));
            }
            TmlType ret = typeResolver.resolve(decl.getReturnType());

            List<String> typeParams = new ArrayList<String>();
            List<String> constParams = new ArrayList<String>();
            List<BoundConstraint> constraints = new ArrayList<BoundConstraint>();
            Map<String, String> lifetimes = new LinkedHashMap<String, String>();
            for (TypeParameter tp : decl.getTypeParams()) {
                if (tp.isConst()) {
                    constParams.add(tp.getName());
                    continue;
                }
                typeParams.add(tp.getName());
                if (!tp.getBounds().isEmpty()) {
                    constraints.add(new BoundConstraint(tp.getName(), resolveBehaviors(tp.getBounds())));
                }
                if (tp.getLifetimeBound() != null) {
                    lifetimes.put(tp.getName(), tp.getLifetimeBound());
                }
            }
            for (WhereClause where : decl.getWhereClauses()) {
                if (!typeResolver.isTypeParam(where.getTypeParam())) {
                    checker.error(ErrorCodes.UNKNOWN_TYPE, "Where clause names unknown type parameter '"
                            + where.getTypeParam() + "'", where);
                    continue;
                }
                constraints.add(new BoundConstraint(where.getTypeParam(), resolveBehaviors(where.getBounds())));
            }
            return new FuncSig(decl.getName(), params, ret, typeParams, constParams, constraints, lifetimes,
                    decl.getLocation());
        } finally {
            exitGenericScope();
        }
    }

    private List<BoundConstraint.BehaviorRef> resolveBehaviors(List<TypeRef> bounds) {
        List<BoundConstraint.BehaviorRef> result = new ArrayList<BoundConstraint.BehaviorRef>();
        for (TypeRef bound : bounds) {
            String name = refName(bound);
            if (name == null) continue;
            if (!typeResolver.isKnownBehavior(name)) {
                checker.error(ErrorCodes.UNKNOWN_TYPE, "Unknown behavior '" + name + "'", bound);
                continue;
            }
            result.add(new BoundConstraint.BehaviorRef(name, refArgs(bound)));
        }
        return result;
    }

    // ============ 泛型参数作用域 ============

    /**
     * 进入泛型声明：类型参数登记到解析器，const 泛型参数作为符号定义在新作用域中。
     */
    void enterGenericScope(List<TypeParameter> params) {
        typeResolver.enterTypeParams(params);
        env.pushScope(Scope.ScopeType.FUNCTION);
        for (TypeParameter tp : params) {
            if (tp.isConst()) {
                TmlType type = tp.getConstType() != null ? typeResolver.resolve(tp.getConstType()) : Types.U64;
                env.define(new Symbol(tp.getName(), SymbolKind.CONST_GENERIC, type, false, tp.getLocation()));
            } else {
                env.define(new Symbol(tp.getName(), SymbolKind.TYPE_PARAMETER, new GenericType(tp.getName()),
                        false, tp.getLocation()));
            }
        }
    }

    void exitGenericScope() {
        env.popScope();
        typeResolver.exitTypeParams();
    }

    private static List<String> typeParamNames(List<TypeParameter> params) {
        List<String> names = new ArrayList<String>();
        for (TypeParameter tp : params) {
            if (!tp.isConst()) names.add(tp.getName());
        }
        return names;
    }

    private static String refName(TypeRef ref) {
        if (ref instanceof SimpleType) return ((SimpleType) ref).getName();
        if (ref instanceof GenericTypeRef) return ((GenericTypeRef) ref).getName();
        if (ref instanceof BehaviorTypeRef) return ((BehaviorTypeRef) ref).getBehavior();
        return null;
    }

    private List<TmlType> refArgs(TypeRef ref) {
        if (ref instanceof GenericTypeRef) return typeResolver.resolveAll(((GenericTypeRef) ref).getTypeArgs());
        if (ref instanceof BehaviorTypeRef) return typeResolver.resolveAll(((BehaviorTypeRef) ref).getTypeArgs());
        return Collections.emptyList();
    }

    // ============ 类派生属性 ============

    private void finalizeClasses() {
        StackEligibilityAnalyzer stackAnalyzer = new StackEligibilityAnalyzer(env, options.getMaxStackClassSize());
        VtableBuilder vtableBuilder = new VtableBuilder(env);
        for (ClassDef cls : env.localClasses().values()) {
            StackEligibilityAnalyzer.Layout layout = stackAnalyzer.analyze(cls);
            cls.setDerived(layout.getInheritanceDepth(), layout.getEstimatedSize(), layout.isStackAllocatable(),
                    vtableBuilder.build(cls));
        }
    }

    // ============ OOP 校验 ============

    private void validate() {
        for (InterfaceDef iface : env.getLocal().getInterfaces().values()) {
            oopChecker.validateInterface(iface);
        }
        for (ClassDef cls : env.localClasses().values()) {
            oopChecker.validateClass(cls);
        }
    }

    // ============ 函数体 ============

    private void checkBodies() {
        BodyChecker body = new BodyChecker(this, env, checker, typeResolver, constEvaluator, instantiator,
                boundChecker, oopChecker, exprTypes, instantiations);

        for (FunDecl fn : topLevelFunctions) {
            body.checkFunction(fn, functionSigs.get(fn), null);
        }
        for (ClassDecl decl : classDecls) {
            ClassDef cls = env.lookupClass(decl.getName());
            List<TmlType> selfArgs = new ArrayList<TmlType>();
            for (String tp : cls.getTypeParams()) selfArgs.add(new GenericType(tp));
            TmlType self = new ClassType(decl.getName(), selfArgs);

            env.enterClass(decl.getName());
            enterGenericScope(decl.getTypeParams());
            for (FunDecl fn : decl.getMethods()) {
                body.checkFunction(fn, functionSigs.get(fn), fn.hasModifier(Modifier.STATIC) ? null : self);
            }
            for (FunDecl ctor : decl.getConstructors()) {
                body.checkFunction(ctor, functionSigs.get(ctor), self);
            }
            exitGenericScope();
            env.exitClass();
        }
        for (InterfaceDecl decl : interfaceDecls) {
            enterGenericScope(decl.getTypeParams());
            TmlType self = new DynBehaviorType(decl.getName(), Collections.<TmlType>emptyList());
            for (FunDecl fn : decl.getMethods()) {
                body.checkFunction(fn, functionSigs.get(fn), self);
            }
            exitGenericScope();
        }
        for (Map.Entry<ImplDecl, TmlType> entry : implTargets.entrySet()) {
            enterGenericScope(entry.getKey().getTypeParams());
            for (FunDecl fn : entry.getKey().getMethods()) {
                body.checkFunction(fn, functionSigs.get(fn), entry.getValue());
            }
            exitGenericScope();
        }
    }
}
