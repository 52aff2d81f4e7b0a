package com.tmlang.compiler.analysis.env;

import com.tmlang.compiler.analysis.types.TmlType;

import java.util.Collections;
import java.util.List;

/**
 * 泛型参数约束：T 必须实现的行为列表（行为可带参数，如 Comparable[T]）。
 * 来自类型参数声明或 where 子句。
 */
public final class BoundConstraint {
    private final String typeParam;
    private final List<BehaviorRef> behaviors;

    public BoundConstraint(String typeParam, List<BehaviorRef> behaviors) {
        this.typeParam = typeParam;
        this.behaviors = Collections.unmodifiableList(behaviors);
    }

    public String getTypeParam() { return typeParam; }
    public List<BehaviorRef> getBehaviors() { return behaviors; }

    /** 行为引用：名称 + 类型实参 */
    public static final class BehaviorRef {
        private final String name;
        private final List<TmlType> typeArgs;

        public BehaviorRef(String name, List<TmlType> typeArgs) {
            this.name = name;
            this.typeArgs = typeArgs != null
                    ? Collections.unmodifiableList(typeArgs) : Collections.<TmlType>emptyList();
        }

        public String getName() { return name; }
        public List<TmlType> getTypeArgs() { return typeArgs; }

        @Override
        public String toString() {
            if (typeArgs.isEmpty()) return name;
            StringBuilder sb = new StringBuilder(name).append('[');
            for (int i = 0; i < typeArgs.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(typeArgs.get(i).toDisplayString());
            }
            return sb.append(']').toString();
        }
    }
}
