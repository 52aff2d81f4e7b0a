package com.tmlang.compiler.analysis.types;

import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 类型变量绑定表：分配新变量、记录绑定、解析。
 * 每个编译单元独立持有一份。
 */
public final class TypeVarBindings {

    private static final Logger LOG = Logger.getLogger(TypeVarBindings.class.getName());

    private final Map<Integer, TmlType> bindings = new HashMap<Integer, TmlType>();
    private int nextId;

    /** 分配新的未绑定类型变量 */
    public TypeVar fresh() {
        return new TypeVar(nextId++);
    }

    /**
     * 绑定类型变量。绑定到自身或包含自身的类型会被忽略（occurs check）。
     *
     * @return 是否实际建立了绑定
     */
    public boolean bind(TypeVar var, TmlType type) {
        if (type == null) {
            throw new IllegalArgumentException("cannot bind " + var + " to null");
        }
        TmlType resolved = resolve(type);
        if (Types.occurs(var, resolved)) return false;
        bindings.put(var.getId(), resolved);
        return true;
    }

    public boolean isBound(TypeVar var) {
        return bindings.containsKey(var.getId());
    }

    /**
     * 沿绑定链解析到具体类型，复合类型递归解析；未绑定的变量原样保留。
     * 对已解析的类型再次调用返回相同实例。
     */
    public TmlType resolve(TmlType type) {
        if (type == null) return null;
        return new TypeTransformer() {
            @Override
            public TmlType visitTypeVar(TypeVar var) {
                TmlType bound = bindings.get(var.getId());
                int guard = 0;
                while (bound instanceof TypeVar && guard++ < bindings.size()) {
                    TmlType next = bindings.get(((TypeVar) bound).getId());
                    if (next == null) return bound;
                    bound = next;
                }
                if (bound == null) return var;
                return transform(bound);
            }
        }.transform(type);
    }

    /**
     * 解析后仍未绑定的类型变量默认化为 Unit，保证降级阶段看不到类型变量。
     */
    public TmlType resolveAndDefault(TmlType type) {
        TmlType resolved = resolve(type);
        if (!Types.containsTypeVar(resolved)) return resolved;
        LOG.fine("defaulting unresolved type variables in " + resolved + " to Unit");
        return Types.defaultTypeVars(resolved);
    }
}
