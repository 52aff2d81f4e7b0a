package com.tmlang.compiler.analysis.env;

import com.tmlang.compiler.analysis.ConstValue;
import com.tmlang.compiler.analysis.Scope;
import com.tmlang.compiler.analysis.Symbol;
import com.tmlang.compiler.analysis.types.ClassType;
import com.tmlang.compiler.analysis.types.GenericType;
import com.tmlang.compiler.analysis.types.NamedType;
import com.tmlang.compiler.analysis.types.PrimitiveKind;
import com.tmlang.compiler.analysis.types.PrimitiveType;
import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.analysis.types.TypeVarBindings;
import com.tmlang.compiler.analysis.types.Types;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 编译单元的类型环境。
 * <p>
 * 持有当前模块的定义表、已编译模块的导出表（按模块路径）、行为实现表、作用域栈以及类型变量绑定。
 * 每个编译单元独立一份实例，不可跨线程共享。
 */
public final class TypeEnvironment {

    /** 原始类型自带的行为实现 */
    private static final List<String> PRIMITIVE_BEHAVIORS = Arrays.asList(
            "Eq", "PartialEq", "Copy", "Clone", "Hash", "Debug", "Display", "Default");
    private static final List<String> ORDERED_BEHAVIORS = Arrays.asList("Ord", "PartialOrd");
    private static final List<String> NUMERIC_BEHAVIORS = Arrays.asList(
            "Add", "Sub", "Mul", "Div", "Rem", "Neg");
    private static final List<String> INTEGER_BEHAVIORS = Arrays.asList(
            "BitAnd", "BitOr", "BitXor", "Shl", "Shr");

    private final ModuleTable local;
    private final Map<String, ModuleTable> modules = new LinkedHashMap<String, ModuleTable>();
    private final Map<String, List<BoundConstraint.BehaviorRef>> impls =
            new LinkedHashMap<String, List<BoundConstraint.BehaviorRef>>();
    private final Deque<Scope> scopes = new ArrayDeque<Scope>();
    private final Deque<String> classStack = new ArrayDeque<String>();
    private final TypeVarBindings typeVars = new TypeVarBindings();

    public TypeEnvironment(String modulePath) {
        this.local = new ModuleTable(modulePath != null ? modulePath : "");
        scopes.push(new Scope(Scope.ScopeType.GLOBAL, null));
        registerPrimitiveBehaviors();
    }

    private void registerPrimitiveBehaviors() {
        for (PrimitiveType prim : Types.allPrimitives()) {
            PrimitiveKind kind = prim.getKind();
            if (kind == PrimitiveKind.UNIT || kind == PrimitiveKind.NEVER) continue;
            for (String b : PRIMITIVE_BEHAVIORS) {
                if (kind == PrimitiveKind.STR && "Copy".equals(b)) continue;
                registerImpl(prim, b, null);
            }
            if (kind != PrimitiveKind.BOOL) {
                for (String b : ORDERED_BEHAVIORS) {
                    // 浮点只有偏序
                    if (kind.isFloat() && "Ord".equals(b)) continue;
                    registerImpl(prim, b, null);
                }
            }
            if (kind.isNumeric()) {
                for (String b : NUMERIC_BEHAVIORS) {
                    if ("Neg".equals(b) && kind.isUnsignedInteger()) continue;
                    registerImpl(prim, b, null);
                }
            }
            if (kind.isInteger()) {
                for (String b : INTEGER_BEHAVIORS) registerImpl(prim, b, null);
            }
        }
        registerImpl(Types.STR, "Add", null);
    }

    public String getModulePath() { return local.getPath(); }
    public ModuleTable getLocal() { return local; }
    public TypeVarBindings getTypeVars() { return typeVars; }

    // ============ 模块表 ============

    /** 注册已编译模块的导出表 */
    public void registerModule(ModuleTable table) {
        modules.put(table.getPath(), table);
    }

    public ModuleTable getModule(String path) {
        if (path == null || path.isEmpty() || path.equals(local.getPath())) return local;
        return modules.get(path);
    }

    // ============ 注册 ============

    public void defineFunction(FuncSig sig) { local.addFunction(sig); }
    public void defineStruct(StructDef def) { local.addStruct(def); }
    public void defineEnum(EnumDef def) { local.addEnum(def); }
    public void defineClass(ClassDef def) { local.addClass(def); }
    public void defineInterface(InterfaceDef def) { local.addInterface(def); }
    public void defineConstant(String name, ConstValue value) { local.addConstant(name, value); }

    /**
     * 登记 type 实现了行为 behavior[args]。args 为空表示对任意参数成立。
     */
    public void registerImpl(TmlType type, String behavior, List<TmlType> args) {
        String key = implKey(type);
        if (key == null) return;
        List<BoundConstraint.BehaviorRef> list = impls.get(key);
        if (list == null) {
            list = new ArrayList<BoundConstraint.BehaviorRef>();
            impls.put(key, list);
        }
        list.add(new BoundConstraint.BehaviorRef(behavior, args));
    }

    // ============ 查找 ============

    public List<FuncSig> lookupFunctions(String name) {
        List<FuncSig> found = local.getFunctions(name);
        if (!found.isEmpty()) return found;
        for (ModuleTable m : modules.values()) {
            found = m.getFunctions(name);
            if (!found.isEmpty()) return found;
        }
        return Collections.emptyList();
    }

    public List<FuncSig> lookupFunctions(String modulePath, String name) {
        ModuleTable m = getModule(modulePath);
        return m != null ? m.getFunctions(name) : Collections.<FuncSig>emptyList();
    }

    public ClassDef lookupClass(String name) {
        ClassDef def = local.getClass(name);
        if (def != null) return def;
        for (ModuleTable m : modules.values()) {
            def = m.getClass(name);
            if (def != null) return def;
        }
        return null;
    }

    public InterfaceDef lookupInterface(String name) {
        InterfaceDef def = local.getInterface(name);
        if (def != null) return def;
        for (ModuleTable m : modules.values()) {
            def = m.getInterface(name);
            if (def != null) return def;
        }
        return null;
    }

    public StructDef lookupStruct(String name) {
        StructDef def = local.getStruct(name);
        if (def != null) return def;
        for (ModuleTable m : modules.values()) {
            def = m.getStruct(name);
            if (def != null) return def;
        }
        return null;
    }

    public EnumDef lookupEnum(String name) {
        EnumDef def = local.getEnum(name);
        if (def != null) return def;
        for (ModuleTable m : modules.values()) {
            def = m.getEnum(name);
            if (def != null) return def;
        }
        return null;
    }

    public ConstValue lookupConstant(String name) {
        ConstValue value = local.getConstant(name);
        if (value != null) return value;
        for (ModuleTable m : modules.values()) {
            value = m.getConstant(name);
            if (value != null) return value;
        }
        return null;
    }

    public Map<String, ClassDef> localClasses() {
        return local.getClasses();
    }

    // ============ 行为实现 ============

    /**
     * 判断 type 是否实现 behavior[args]。
     * 类通过 implements 列表或基类链实现接口，直接实现的接口须实参一致；
     * 登记的 impl 与 implements 实参中的泛型参数匹配任意类型。
     */
    public boolean implementsBehavior(TmlType type, String behavior, List<TmlType> args) {
        String key = implKey(type);
        if (key == null) return false;
        List<BoundConstraint.BehaviorRef> list = impls.get(key);
        if (list != null) {
            for (BoundConstraint.BehaviorRef ref : list) {
                if (ref.getName().equals(behavior) && argsMatch(ref.getTypeArgs(), args)) return true;
            }
        }
        if (type instanceof ClassType || type instanceof NamedType) {
            ClassDef cls = lookupClass(key);
            Set<String> visited = new HashSet<String>();
            while (cls != null && visited.add(cls.getName())) {
                for (BoundConstraint.BehaviorRef iface : cls.getInterfaceRefs()) {
                    if (iface.getName().equals(behavior)) {
                        if (argsMatch(iface.getTypeArgs(), args)) return true;
                    } else if (interfaceExtends(iface.getName(), behavior, new HashSet<String>())) {
                        // 父接口只记录名字，实参无法沿 extends 传递
                        return true;
                    }
                }
                cls = cls.hasBaseClass() ? lookupClass(cls.getBaseClass()) : null;
            }
        }
        return false;
    }

    private boolean interfaceExtends(String iface, String target, Set<String> visited) {
        if (iface.equals(target)) return true;
        if (!visited.add(iface)) return false;
        InterfaceDef def = lookupInterface(iface);
        if (def == null) return false;
        for (String parent : def.getExtendsList()) {
            if (interfaceExtends(parent, target, visited)) return true;
        }
        return false;
    }

    private static boolean argsMatch(List<TmlType> implArgs, List<TmlType> required) {
        if (implArgs.isEmpty() || required == null || required.isEmpty()) return true;
        if (implArgs.size() != required.size()) return false;
        for (int i = 0; i < implArgs.size(); i++) {
            TmlType a = implArgs.get(i);
            if (a instanceof GenericType) continue;
            if (!a.equals(required.get(i))) return false;
        }
        return true;
    }

    private static String implKey(TmlType type) {
        if (type instanceof PrimitiveType) return ((PrimitiveType) type).getKind().getTypeName();
        if (type instanceof NamedType) return ((NamedType) type).getName();
        if (type instanceof ClassType) return ((ClassType) type).getName();
        return null;
    }

    // ============ 作用域栈 ============

    public Scope currentScope() {
        return scopes.peek();
    }

    public Scope pushScope(Scope.ScopeType type) {
        Scope scope = new Scope(type, scopes.peek());
        scopes.push(scope);
        return scope;
    }

    public void popScope() {
        if (scopes.size() <= 1) {
            throw new IllegalStateException("cannot pop the global scope");
        }
        scopes.pop();
    }

    public void define(Symbol symbol) {
        scopes.peek().define(symbol);
    }

    public Symbol lookup(String name) {
        return scopes.peek().resolve(name);
    }

    public int scopeDepth() {
        return scopes.size();
    }

    // ============ 所在类 ============

    public void enterClass(String className) {
        classStack.push(className);
        pushScope(Scope.ScopeType.CLASS).setOwnerTypeName(className);
    }

    public void exitClass() {
        popScope();
        classStack.pop();
    }

    /** 当前所在类名，不在类中返回 null */
    public String currentClass() {
        return classStack.peek();
    }
}
