package com.tmlang.compiler.analysis;

import com.tmlang.compiler.analysis.env.ClassDef;
import com.tmlang.compiler.analysis.env.FieldDef;
import com.tmlang.compiler.analysis.env.FuncSig;
import com.tmlang.compiler.analysis.env.InterfaceDef;
import com.tmlang.compiler.analysis.env.MethodDef;
import com.tmlang.compiler.analysis.env.TypeEnvironment;
import com.tmlang.compiler.analysis.generic.GenericInstantiator;
import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.analysis.types.TypeCompatibility;
import com.tmlang.compiler.analysis.types.Types;
import com.tmlang.compiler.ast.SourceLocation;
import com.tmlang.compiler.ast.Visibility;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 面向对象规则校验：继承、sealed、override、抽象方法、接口一致性、装饰器组合与成员可见性。
 * <p>
 * 在所有声明注册完成后运行；每条违规报告一次诊断并继续检查。
 * 沿基类链的遍历都带 visited 集合，循环继承不会导致死循环。
 */
public final class OopChecker {

    private static final Logger LOG = Logger.getLogger(OopChecker.class.getName());

    private final TypeEnvironment env;
    private final SemanticChecker checker;

    public OopChecker(TypeEnvironment env, SemanticChecker checker) {
        this.env = env;
        this.checker = checker;
    }

    // ============ 接口 ============

    public void validateInterface(InterfaceDef iface) {
        for (String parent : iface.getExtendsList()) {
            if (env.lookupInterface(parent) == null) {
                checker.error(ErrorCodes.INTERFACE_NOT_FOUND, "Interface '" + parent
                        + "' extended by '" + iface.getName() + "' not found", iface.getLocation());
            }
        }
    }

    // ============ 类 ============

    public void validateClass(ClassDef cls) {
        LOG.finer("validate class " + cls.getName());
        validateDecorators(cls);
        for (String iface : cls.getInterfaces()) {
            if (env.lookupInterface(iface) == null) {
                checker.error(ErrorCodes.INTERFACE_NOT_FOUND, "Interface '" + iface + "' not found",
                        cls.getLocation());
            }
        }
        boolean chainValid = validateInheritance(cls);
        validateOverrides(cls);
        if (chainValid) {
            validateAbstractMethods(cls);
            validateConformance(cls);
        }
    }

    private void validateDecorators(ClassDef cls) {
        SourceLocation loc = cls.getLocation();
        if (cls.isValue() && cls.isAbstract()) {
            checker.error(ErrorCodes.VALUE_ABSTRACT, "@value class '" + cls.getName() + "' cannot be abstract", loc);
        }
        if (cls.isPooled() && cls.isValue()) {
            checker.error(ErrorCodes.POOL_AND_VALUE, "Class '" + cls.getName()
                    + "' cannot be both @pool and @value", loc);
        }
        if (cls.isPooled() && cls.isAbstract()) {
            checker.error(ErrorCodes.POOL_ABSTRACT, "@pool class '" + cls.getName() + "' cannot be abstract", loc);
        }
        if (cls.isValue()) {
            for (MethodDef m : cls.getMethods()) {
                if (m.isVirtual() || m.isAbstract()) {
                    checker.error(ErrorCodes.VALUE_VIRTUAL_METHOD, "@value class '" + cls.getName()
                            + "' cannot declare virtual or abstract method '" + m.getName() + "'", loc);
                }
            }
        }
    }

    /**
     * 基类存在性、sealed 规则与循环继承。
     *
     * @return 基类链是否完整且无环
     */
    private boolean validateInheritance(ClassDef cls) {
        if (!cls.hasBaseClass()) return true;
        SourceLocation loc = cls.getLocation();
        ClassDef base = env.lookupClass(cls.getBaseClass());
        if (base == null) {
            checker.error(ErrorCodes.BASE_CLASS_NOT_FOUND, "Base class '" + cls.getBaseClass() + "' not found", loc);
            return false;
        }
        if (base.isSealed() && !(cls.isValue() && base.isValue())) {
            checker.error(ErrorCodes.SEALED_EXTENDED, "Cannot extend sealed class '" + base.getName() + "'", loc);
        } else if (cls.isValue() && !base.isValue()) {
            checker.error(ErrorCodes.SEALED_EXTENDED, "@value class '" + cls.getName()
                    + "' cannot extend non-value class '" + base.getName() + "'", loc);
        }

        Set<String> visited = new HashSet<String>();
        visited.add(cls.getName());
        ClassDef current = base;
        while (current != null) {
            if (!visited.add(current.getName())) {
                checker.error(ErrorCodes.CIRCULAR_INHERITANCE, "Circular inheritance detected for class '"
                        + cls.getName() + "'", loc);
                return false;
            }
            if (!current.hasBaseClass()) return true;
            current = env.lookupClass(current.getBaseClass());
        }
        // 链上某个基类缺失，由该类自己报告
        return false;
    }

    private void validateOverrides(ClassDef cls) {
        for (MethodDef method : cls.getMethods()) {
            if (!method.isOverride()) continue;
            SourceLocation loc = locationOf(method, cls);
            if (!cls.hasBaseClass()) {
                checker.error(ErrorCodes.OVERRIDE_WITHOUT_BASE, "Method '" + method.getName()
                        + "' is marked override but class '" + cls.getName() + "' has no base class", loc);
                continue;
            }
            Map<String, TmlType> baseSubst = new HashMap<String, TmlType>();
            MethodDef baseMethod = findInBaseChain(cls, method.getName(), baseSubst);
            if (baseMethod == null) {
                checker.error(ErrorCodes.OVERRIDE_NOT_FOUND, "Method '" + method.getName()
                        + "' overrides nothing in the base classes of '" + cls.getName() + "'", loc);
                continue;
            }
            if (!(baseMethod.isVirtual() || baseMethod.isAbstract() || baseMethod.isOverride())) {
                checker.error(ErrorCodes.OVERRIDE_NON_VIRTUAL, "Cannot override non-virtual method '"
                        + method.getName() + "'", loc);
                continue;
            }
            checkSignatureMatch(method.getSig(), baseMethod.getSig(), baseSubst, false, loc,
                    ErrorCodes.RETURN_TYPE_MISMATCH, ErrorCodes.PARAM_COUNT_MISMATCH, ErrorCodes.PARAM_TYPE_MISMATCH,
                    "Override '" + cls.getName() + "." + method.getName() + "'");
        }
    }

    /**
     * 严格签名匹配（不使用兼容性规则）。
     *
     * @param declSubst      声明方类型参数到实参的替换，先作用于 decl
     * @param genericWildcard decl 参数中残留的类型参数是否视为任意类型（仅接口一致性检查使用）
     */
    private boolean checkSignatureMatch(FuncSig impl, FuncSig decl, Map<String, TmlType> declSubst,
                                        boolean genericWildcard, SourceLocation loc,
                                        String retCode, String countCode, String paramCode, String what) {
        boolean ok = true;
        TmlType declRet = GenericInstantiator.substitute(decl.getReturnType(), declSubst);
        if (!TypeCompatibility.typesEqual(impl.getReturnType(), declRet)) {
            checker.error(retCode, what + " return type mismatch: expected '"
                    + display(declRet) + "' but found '" + display(impl.getReturnType()) + "'", loc);
            ok = false;
        }
        List<TmlType> implParams = impl.getParams();
        List<TmlType> declParams = decl.getParams();
        if (implParams.size() != declParams.size()) {
            checker.error(countCode, what + " parameter count mismatch: expected " + declParams.size()
                    + " but found " + implParams.size(), loc);
            return false;
        }
        for (int i = 0; i < implParams.size(); i++) {
            TmlType expected = GenericInstantiator.substitute(declParams.get(i), declSubst);
            // 接口声明中的类型参数在实现处被具体化
            if (genericWildcard && Types.containsGeneric(expected)) continue;
            if (!TypeCompatibility.typesEqual(expected, implParams.get(i))) {
                checker.error(paramCode, what + " parameter " + (i + 1) + " type mismatch: expected '"
                        + display(expected) + "' but found '" + display(implParams.get(i)) + "'", loc);
                ok = false;
            }
        }
        return ok;
    }

    /**
     * 具体类必须实现基类链上声明的每个抽象方法。
     * 从当前类向上遍历，已见到的非抽象同名方法视为实现。
     */
    private void validateAbstractMethods(ClassDef cls) {
        if (cls.isAbstract()) return;
        Set<String> implemented = new HashSet<String>();
        Set<String> visited = new HashSet<String>();
        ClassDef current = cls;
        while (current != null && visited.add(current.getName())) {
            for (MethodDef m : current.getMethods()) {
                if (!m.isAbstract()) {
                    implemented.add(m.getName());
                } else if (!implemented.contains(m.getName())) {
                    checker.error(ErrorCodes.ABSTRACT_NOT_IMPLEMENTED, "Class '" + cls.getName()
                            + "' must implement abstract method '" + m.getName() + "' from '"
                            + current.getName() + "'", cls.getLocation());
                    implemented.add(m.getName());
                }
            }
            current = current.hasBaseClass() ? env.lookupClass(current.getBaseClass()) : null;
        }
    }

    /**
     * 接口一致性：所有（含继承来的）无默认实现的接口方法必须被实现，签名严格匹配。
     */
    private void validateConformance(ClassDef cls) {
        if (cls.isAbstract()) return;
        Set<String> allInterfaces = new LinkedHashSet<String>();
        Set<String> visitedClasses = new HashSet<String>();
        ClassDef current = cls;
        while (current != null && visitedClasses.add(current.getName())) {
            for (String iface : current.getInterfaces()) {
                collectInterfaces(iface, allInterfaces);
            }
            current = current.hasBaseClass() ? env.lookupClass(current.getBaseClass()) : null;
        }
        for (String ifaceName : allInterfaces) {
            InterfaceDef iface = env.lookupInterface(ifaceName);
            if (iface == null) continue;
            for (MethodDef required : iface.getMethods()) {
                if (required.hasDefaultBody()) continue;
                MethodDef impl = findInChain(cls, required.getName());
                if (impl == null || impl.isAbstract()) {
                    checker.error(ErrorCodes.BOUND_NOT_SATISFIED, "Class '" + cls.getName()
                            + "' does not implement interface method '" + ifaceName + "." + required.getName() + "'",
                            cls.getLocation());
                    continue;
                }
                String code = ErrorCodes.BOUND_NOT_SATISFIED;
                checkSignatureMatch(impl.getSig(), required.getSig(), Collections.<String, TmlType>emptyMap(), true,
                        locationOf(impl, cls), code, code, code,
                        "Method '" + cls.getName() + "." + impl.getName() + "' implementing '" + ifaceName + "'");
            }
        }
    }

    private void collectInterfaces(String name, Set<String> out) {
        if (!out.add(name)) return;
        InterfaceDef def = env.lookupInterface(name);
        if (def == null) return;
        for (String parent : def.getExtendsList()) {
            collectInterfaces(parent, out);
        }
    }

    // ============ 可见性 ============

    /**
     * 判断 accessorClass 内的代码能否访问 ownerClass 中可见性为 visibility 的成员。
     *
     * @param accessorClass 访问发生处的所在类，顶层代码为 null
     */
    public boolean isAccessible(String ownerClass, Visibility visibility, String accessorClass) {
        if (visibility == null || visibility == Visibility.PUBLIC) return true;
        if (accessorClass == null) return false;
        if (visibility == Visibility.PRIVATE) return ownerClass.equals(accessorClass);
        // protected：沿访问者自己的基类链查找定义类
        Set<String> visited = new HashSet<String>();
        String current = accessorClass;
        while (current != null && visited.add(current)) {
            if (current.equals(ownerClass)) return true;
            ClassDef def = env.lookupClass(current);
            current = def != null ? def.getBaseClass() : null;
        }
        return false;
    }

    /**
     * 检查成员访问，违规时报告 T048。成员不存在时不报告。
     */
    public boolean checkMemberAccess(ClassDef owner, String member, String accessorClass, SourceLocation location) {
        Visibility visibility = null;
        FieldDef field = owner.findField(member);
        if (field != null) {
            visibility = field.getVisibility();
        } else {
            MethodDef method = owner.findMethod(member);
            if (method != null) visibility = method.getVisibility();
        }
        if (visibility == null || isAccessible(owner.getName(), visibility, accessorClass)) return true;
        checker.error(ErrorCodes.VISIBILITY_VIOLATION, "Cannot access " + visibility.name().toLowerCase(Locale.ROOT)
                + " member '" + member + "' of class '" + owner.getName() + "'", location);
        return false;
    }

    // ============ 辅助 ============

    /** 从 cls 自身开始沿基类链查找方法 */
    public MethodDef findInChain(ClassDef cls, String name) {
        Set<String> visited = new HashSet<String>();
        ClassDef current = cls;
        while (current != null && visited.add(current.getName())) {
            MethodDef m = current.findMethod(name);
            if (m != null) return m;
            current = current.hasBaseClass() ? env.lookupClass(current.getBaseClass()) : null;
        }
        return null;
    }

    /** 沿基类链查找声明了该字段或方法的类 */
    public ClassDef findDeclaringClass(ClassDef cls, String member) {
        Set<String> visited = new HashSet<String>();
        ClassDef current = cls;
        while (current != null && visited.add(current.getName())) {
            if (current.findField(member) != null || current.findMethod(member) != null) return current;
            current = current.hasBaseClass() ? env.lookupClass(current.getBaseClass()) : null;
        }
        return null;
    }

    /**
     * 从 cls 的直接基类开始查找，同时把沿途 extends 给出的类型实参
     * 折算成找到方法那一层基类的类型参数替换，写入 substOut。
     */
    private MethodDef findInBaseChain(ClassDef cls, String name, Map<String, TmlType> substOut) {
        ClassDef base = env.lookupClass(cls.getBaseClass());
        if (base == null || base.getName().equals(cls.getName())) return null;
        Set<String> visited = new HashSet<String>();
        visited.add(cls.getName());
        Map<String, TmlType> subst = Collections.emptyMap();
        ClassDef child = cls;
        ClassDef current = base;
        while (current != null && visited.add(current.getName())) {
            Map<String, TmlType> next = new HashMap<String, TmlType>();
            List<String> params = current.getTypeParams();
            List<TmlType> args = child.getBaseTypeArgs();
            for (int i = 0; i < params.size() && i < args.size(); i++) {
                next.put(params.get(i), GenericInstantiator.substitute(args.get(i), subst));
            }
            subst = next;
            MethodDef m = current.findMethod(name);
            if (m != null) {
                substOut.putAll(subst);
                return m;
            }
            child = current;
            current = current.hasBaseClass() ? env.lookupClass(current.getBaseClass()) : null;
        }
        return null;
    }

    private static SourceLocation locationOf(MethodDef method, ClassDef cls) {
        SourceLocation loc = method.getSig().getLocation();
        return loc != null ? loc : cls.getLocation();
    }

    private static String display(TmlType type) {
        return type != null ? type.toDisplayString() : "Unit";
    }
}
