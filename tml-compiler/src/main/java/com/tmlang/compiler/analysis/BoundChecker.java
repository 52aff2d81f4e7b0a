package com.tmlang.compiler.analysis;

import com.tmlang.compiler.analysis.env.BoundConstraint;
import com.tmlang.compiler.analysis.env.FuncSig;
import com.tmlang.compiler.analysis.env.TypeEnvironment;
import com.tmlang.compiler.analysis.generic.GenericInstantiator;
import com.tmlang.compiler.analysis.types.GenericType;
import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.analysis.types.TypeVar;
import com.tmlang.compiler.analysis.types.Types;
import com.tmlang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 替换后的约束检查：行为约束（含参数化行为）与生命周期约束。
 * <p>
 * 实参仍是泛型参数或类型变量时跳过，留到外层实例化时再检查。
 */
public final class BoundChecker {

    public static final String STATIC_LIFETIME = "static";

    private final TypeEnvironment env;
    private final SemanticChecker checker;

    public BoundChecker(TypeEnvironment env, SemanticChecker checker) {
        this.env = env;
        this.checker = checker;
    }

    /**
     * 检查一次实例化的全部约束。
     *
     * @return 是否全部满足
     */
    public boolean checkBounds(FuncSig sig, Map<String, TmlType> subst, SourceLocation location) {
        boolean ok = true;
        for (BoundConstraint constraint : sig.getConstraints()) {
            TmlType concrete = subst.get(constraint.getTypeParam());
            if (isDeferred(concrete)) continue;
            for (BoundConstraint.BehaviorRef behavior : constraint.getBehaviors()) {
                List<TmlType> args = new ArrayList<TmlType>(behavior.getTypeArgs().size());
                for (TmlType arg : behavior.getTypeArgs()) {
                    args.add(GenericInstantiator.substitute(arg, subst));
                }
                if (!env.implementsBehavior(concrete, behavior.getName(), args)) {
                    String required = new BoundConstraint.BehaviorRef(behavior.getName(), args).toString();
                    checker.error(ErrorCodes.BOUND_NOT_SATISFIED, "Type '" + concrete.toDisplayString()
                            + "' does not implement behavior '" + required
                            + "' required by constraint on " + constraint.getTypeParam(), location);
                    ok = false;
                }
            }
        }
        for (Map.Entry<String, String> entry : sig.getLifetimeBounds().entrySet()) {
            TmlType concrete = subst.get(entry.getKey());
            if (isDeferred(concrete)) continue;
            if (!satisfiesLifetime(concrete, entry.getValue())) {
                checker.error(ErrorCodes.LIFETIME_BOUND_VIOLATED, "Type '" + concrete.toDisplayString()
                        + "' does not satisfy lifetime bound '" + entry.getValue() + "' on " + entry.getKey()
                        + ": it contains a reference", location);
                ok = false;
            }
        }
        return ok;
    }

    /** static 约束拒绝任何包含引用的类型；其余具名生命周期不做区域推断 */
    public static boolean satisfiesLifetime(TmlType type, String lifetime) {
        if (STATIC_LIFETIME.equals(lifetime)) {
            return !Types.containsReference(type);
        }
        return true;
    }

    private static boolean isDeferred(TmlType type) {
        return type == null || type instanceof GenericType || type instanceof TypeVar;
    }
}
