package com.tmlang.ir.backend;

import com.tmlang.compiler.analysis.generic.NameMangler;
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
import com.tmlang.compiler.analysis.types.Types;
import com.tmlang.ir.mir.MirEnumDef;
import com.tmlang.ir.mir.MirField;
import com.tmlang.ir.mir.MirModule;
import com.tmlang.ir.mir.MirStructDef;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * TML 类型 → 文本 IR 类型。
 * <p>
 * 两种映射：{@link #toLlvm} 用于返回类型，Unit 映射为 void；
 * {@link #toSized} 用于必须有宽度的位置（操作数、字段、内存操作），Unit 映射为 {}。
 * 残留的类型变量 / 泛型参数在前者默认为 void，在后者默认为 i32，并记录警告。
 */
public final class LlvmTypeMapper {

    private static final Logger LOG = Logger.getLogger(LlvmTypeMapper.class.getName());

    public static final String STRUCT_PREFIX = "%struct.";

    private final MirModule module;
    private int fallbackCount;

    public LlvmTypeMapper(MirModule module) {
        this.module = module;
    }

    /** 走过默认路径的次数 */
    public int getFallbackCount() {
        return fallbackCount;
    }

    public String toLlvm(TmlType type) {
        if (type == null) return "void";
        if (type instanceof TypeVar || type instanceof GenericType) {
            fallback(type, "void");
            return "void";
        }
        if (Types.isUnit(type) || Types.kindOf(type) == com.tmlang.compiler.analysis.types.PrimitiveKind.NEVER) {
            return "void";
        }
        return toSized(type);
    }

    public String toSized(TmlType type) {
        if (type == null) {
            fallbackCount++;
            LOG.warning("Missing type on an emitted value, defaulting to i32");
            return "i32";
        }
        return type.accept(sizedVisitor);
    }

    /** 结构体 / 枚举 / 类布局的类型名（不含 %struct. 前缀） */
    public static String aggregateName(TmlType type) {
        if (type instanceof NamedType || type instanceof ClassType) {
            return NameMangler.mangleType(type);
        }
        return null;
    }

    private void fallback(TmlType type, String chosen) {
        fallbackCount++;
        LOG.warning("Unresolved type " + type.toDisplayString() + " reached lowering, defaulting to " + chosen);
    }

    private final TmlTypeVisitor<String> sizedVisitor = new TmlTypeVisitor<String>() {
        @Override
        public String visitPrimitive(PrimitiveType type) {
            switch (type.getKind()) {
                case I8: case U8: return "i8";
                case I16: case U16: return "i16";
                case I32: case U32: case CHAR: return "i32";
                case I64: case U64: return "i64";
                case I128: case U128: return "i128";
                case F32: return "float";
                case F64: return "double";
                case BOOL: return "i1";
                case STR: return "ptr";
                default: return "{}";
            }
        }

        @Override
        public String visitNamed(NamedType type) {
            if (Types.isPointerLike(type)) return "ptr";
            return STRUCT_PREFIX + NameMangler.mangleType(type);
        }

        @Override
        public String visitRef(RefType type) { return "ptr"; }

        @Override
        public String visitPtr(PtrType type) { return "ptr"; }

        @Override
        public String visitTuple(TupleType type) {
            return braced(type.getElements());
        }

        @Override
        public String visitArray(ArrayType type) {
            return "[" + type.getSize() + " x " + toSized(type.getElement()) + "]";
        }

        @Override
        public String visitSlice(SliceType type) { return "{ ptr, i64 }"; }

        @Override
        public String visitFunc(FuncType type) { return "ptr"; }

        @Override
        public String visitClosure(ClosureType type) { return "{ ptr, ptr }"; }

        // 类是引用语义
        @Override
        public String visitClass(ClassType type) { return "ptr"; }

        @Override
        public String visitImplBehavior(ImplBehaviorType type) { return "ptr"; }

        @Override
        public String visitDynBehavior(DynBehaviorType type) { return "{ ptr, ptr }"; }

        @Override
        public String visitGeneric(GenericType type) {
            fallback(type, "i32");
            return "i32";
        }

        @Override
        public String visitTypeVar(TypeVar type) {
            fallback(type, "i32");
            return "i32";
        }
    };

    private String braced(List<TmlType> types) {
        if (types.isEmpty()) return "{}";
        StringBuilder sb = new StringBuilder("{ ");
        for (int i = 0; i < types.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(toSized(types.get(i)));
        }
        return sb.append(" }").toString();
    }

    // ===== 尺寸 =====

    /** 近似字节数（无对齐填充），用于 sret 判定和枚举载荷区大小 */
    public long sizeOf(TmlType type) {
        return sizeOf(type, new HashSet<String>());
    }

    private long sizeOf(TmlType type, Set<String> visiting) {
        if (type == null) return 8;
        if (type instanceof PrimitiveType) {
            switch (((PrimitiveType) type).getKind()) {
                case BOOL: return 1;
                case STR: return 8;
                case UNIT: case NEVER: return 0;
                default: return ((PrimitiveType) type).getKind().getBitWidth() / 8;
            }
        }
        if (type instanceof TupleType) {
            long sum = 0;
            for (TmlType t : ((TupleType) type).getElements()) sum += sizeOf(t, visiting);
            return sum;
        }
        if (type instanceof ArrayType) {
            ArrayType arr = (ArrayType) type;
            return arr.getSize() * sizeOf(arr.getElement(), visiting);
        }
        if (type instanceof SliceType || type instanceof ClosureType || type instanceof DynBehaviorType) {
            return 16;
        }
        if (type instanceof NamedType && !Types.isPointerLike(type)) {
            String name = NameMangler.mangleType(type);
            if (!visiting.add(name)) return 8;
            try {
                MirStructDef s = module != null ? module.findStruct(name) : null;
                if (s != null) {
                    long sum = 0;
                    for (MirField f : s.getFields()) sum += sizeOf(f.getType(), visiting);
                    return sum;
                }
                MirEnumDef e = module != null ? module.findEnum(name) : null;
                if (e != null) {
                    return e.hasPayload() ? 4 + payloadSize(e, visiting) : 4;
                }
            } finally {
                visiting.remove(name);
            }
        }
        return 8;
    }

    /** 最大变体载荷字节数，至少 8 */
    public long payloadSize(MirEnumDef def) {
        return payloadSize(def, new HashSet<String>());
    }

    private long payloadSize(MirEnumDef def, Set<String> visiting) {
        long max = 0;
        for (MirEnumDef.Variant v : def.getVariants()) {
            long size = 0;
            for (TmlType t : v.getPayloadTypes()) size += sizeOf(t, visiting);
            max = Math.max(max, size);
        }
        return Math.max(max, 8);
    }

    // ===== 文本类型判定 =====

    public static boolean isFloat(String llvmType) {
        return "float".equals(llvmType) || "double".equals(llvmType);
    }

    /** iN 的位宽，非整数返回 -1 */
    public static int intBits(String llvmType) {
        if (llvmType == null || llvmType.length() < 2 || llvmType.charAt(0) != 'i') return -1;
        for (int i = 1; i < llvmType.length(); i++) {
            if (!Character.isDigit(llvmType.charAt(i))) return -1;
        }
        return Integer.parseInt(llvmType.substring(1));
    }

    public static boolean isAggregate(String llvmType) {
        return llvmType != null && (llvmType.startsWith(STRUCT_PREFIX)
                || llvmType.startsWith("{") || llvmType.startsWith("["));
    }

    public static int alignOf(String llvmType) {
        int bits = intBits(llvmType);
        if (bits > 0) {
            if (bits <= 8) return 1;
            if (bits <= 16) return 2;
            if (bits <= 32) return 4;
            if (bits <= 64) return 8;
            return 16;
        }
        if ("float".equals(llvmType)) return 4;
        return 8;
    }
}
