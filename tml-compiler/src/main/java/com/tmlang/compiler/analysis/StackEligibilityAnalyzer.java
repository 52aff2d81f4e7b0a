package com.tmlang.compiler.analysis;

import com.tmlang.compiler.analysis.env.ClassDef;
import com.tmlang.compiler.analysis.env.FieldDef;
import com.tmlang.compiler.analysis.env.TypeEnvironment;
import com.tmlang.compiler.analysis.types.ArrayType;
import com.tmlang.compiler.analysis.types.ClassType;
import com.tmlang.compiler.analysis.types.ClosureType;
import com.tmlang.compiler.analysis.types.DynBehaviorType;
import com.tmlang.compiler.analysis.types.FuncType;
import com.tmlang.compiler.analysis.types.GenericType;
import com.tmlang.compiler.analysis.types.ImplBehaviorType;
import com.tmlang.compiler.analysis.types.NamedType;
import com.tmlang.compiler.analysis.types.PrimitiveType;
import com.tmlang.compiler.analysis.types.PtrType;
import com.tmlang.compiler.analysis.types.RefType;
import com.tmlang.compiler.analysis.types.SliceType;
import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.analysis.types.TmlTypeVisitor;
import com.tmlang.compiler.analysis.types.TupleType;
import com.tmlang.compiler.analysis.types.TypeVar;

import java.util.HashSet;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 类的栈分配资格分析：估算实例字节数，判断能否不经堆分配。
 * <p>
 * 结果只影响分配策略（性能），估算偏差不会导致错误代码。
 */
public final class StackEligibilityAnalyzer {

    private static final Logger LOG = Logger.getLogger(StackEligibilityAnalyzer.class.getName());

    /** vtable 指针大小 */
    static final long VTABLE_PTR_SIZE = 8;

    private final TypeEnvironment env;
    private final long maxStackClassSize;

    public StackEligibilityAnalyzer(TypeEnvironment env) {
        this(env, AnalyzerOptions.DEFAULT_MAX_STACK_CLASS_SIZE);
    }

    public StackEligibilityAnalyzer(TypeEnvironment env, long maxStackClassSize) {
        this.env = env;
        this.maxStackClassSize = maxStackClassSize;
    }

    /** 分析结果 */
    public static final class Layout {
        private final int inheritanceDepth;
        private final long estimatedSize;
        private final boolean stackAllocatable;

        Layout(int inheritanceDepth, long estimatedSize, boolean stackAllocatable) {
            this.inheritanceDepth = inheritanceDepth;
            this.estimatedSize = estimatedSize;
            this.stackAllocatable = stackAllocatable;
        }

        public int getInheritanceDepth() { return inheritanceDepth; }
        public long getEstimatedSize() { return estimatedSize; }
        public boolean isStackAllocatable() { return stackAllocatable; }
    }

    public Layout analyze(ClassDef cls) {
        long size = estimateClassSize(cls, new HashSet<String>());
        int depth = inheritanceDepth(cls);
        boolean eligible = isStackAllocatable(cls, size);
        LOG.finer("class " + cls.getName() + ": size=" + size + ", depth=" + depth + ", stack=" + eligible);
        return new Layout(depth, size, eligible);
    }

    /** 非抽象、不超过上限、且为值类或 sealed */
    public boolean isStackAllocatable(ClassDef cls, long size) {
        return !cls.isAbstract() && size <= maxStackClassSize && (cls.isValue() || cls.isSealed());
    }

    /** 基类跳数，遇到环时停止 */
    public int inheritanceDepth(ClassDef cls) {
        int depth = 0;
        Set<String> visited = new HashSet<String>();
        visited.add(cls.getName());
        String base = cls.getBaseClass();
        while (base != null) {
            ClassDef baseDef = env.lookupClass(base);
            if (baseDef == null || !visited.add(base)) break;
            depth++;
            base = baseDef.getBaseClass();
        }
        return depth;
    }

    /**
     * vtable 指针（非值类）+ 继承字段（去掉基类重复计入的 vtable 指针）+ 自身非静态字段。
     */
    public long estimateClassSize(ClassDef cls) {
        return estimateClassSize(cls, new HashSet<String>());
    }

    private long estimateClassSize(ClassDef cls, Set<String> visited) {
        visited.add(cls.getName());
        long size = cls.isValue() ? 0 : VTABLE_PTR_SIZE;

        if (cls.hasBaseClass()) {
            ClassDef base = env.lookupClass(cls.getBaseClass());
            if (base != null && !visited.contains(base.getName())) {
                long baseSize = estimateClassSize(base, visited);
                if (!base.isValue() && baseSize >= VTABLE_PTR_SIZE) {
                    baseSize -= VTABLE_PTR_SIZE;
                }
                size += baseSize;
            }
        }

        for (FieldDef field : cls.getFields()) {
            if (!field.isStatic()) {
                size += typeSize(field.getType());
            }
        }
        return size;
    }

    /** 单个类型的估算字节数，间接/泛型类型按 8 字节保守估计 */
    public long typeSize(TmlType type) {
        if (type == null) return 8;
        return type.accept(sizeVisitor);
    }

    private final TmlTypeVisitor<Long> sizeVisitor = new TmlTypeVisitor<Long>() {
        @Override
        public Long visitPrimitive(PrimitiveType type) {
            switch (type.getKind()) {
                case BOOL: case I8: case U8: return 1L;
                case I16: case U16: return 2L;
                case I32: case U32: case F32: case CHAR: return 4L;
                case I64: case U64: case F64: return 8L;
                case I128: case U128: return 16L;
                case UNIT: case NEVER: return 0L;
                case STR: return 24L;
                default: return 8L;
            }
        }

        @Override
        public Long visitTuple(TupleType type) {
            long total = 0;
            for (TmlType e : type.getElements()) total += typeSize(e);
            return total;
        }

        @Override
        public Long visitArray(ArrayType type) {
            return typeSize(type.getElement()) * type.getSize();
        }

        @Override
        public Long visitSlice(SliceType type) { return 16L; }
        @Override
        public Long visitDynBehavior(DynBehaviorType type) { return 16L; }
        @Override
        public Long visitClosure(ClosureType type) { return 16L; }

        @Override
        public Long visitNamed(NamedType type) { return 8L; }
        @Override
        public Long visitRef(RefType type) { return 8L; }
        @Override
        public Long visitPtr(PtrType type) { return 8L; }
        @Override
        public Long visitFunc(FuncType type) { return 8L; }
        @Override
        public Long visitClass(ClassType type) { return 8L; }
        @Override
        public Long visitImplBehavior(ImplBehaviorType type) { return 8L; }
        @Override
        public Long visitGeneric(GenericType type) { return 8L; }
        @Override
        public Long visitTypeVar(TypeVar type) { return 8L; }
    };
}
