package com.tmlang.ir.backend;

import com.tmlang.compiler.analysis.generic.NameMangler;
import com.tmlang.compiler.analysis.types.ArrayType;
import com.tmlang.compiler.analysis.types.ClassType;
import com.tmlang.compiler.analysis.types.NamedType;
import com.tmlang.compiler.analysis.types.PrimitiveKind;
import com.tmlang.compiler.analysis.types.PrimitiveType;
import com.tmlang.compiler.analysis.types.PtrType;
import com.tmlang.compiler.analysis.types.RefType;
import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.analysis.types.TupleType;
import com.tmlang.compiler.analysis.types.Types;
import com.tmlang.ir.mir.AtomicOrdering;
import com.tmlang.ir.mir.BasicBlock;
import com.tmlang.ir.mir.BinaryOp;
import com.tmlang.ir.mir.CastKind;
import com.tmlang.ir.mir.MirConstant;
import com.tmlang.ir.mir.MirEnumDef;
import com.tmlang.ir.mir.MirField;
import com.tmlang.ir.mir.MirFunction;
import com.tmlang.ir.mir.MirInst;
import com.tmlang.ir.mir.MirModule;
import com.tmlang.ir.mir.MirOp;
import com.tmlang.ir.mir.MirParam;
import com.tmlang.ir.mir.MirStructDef;
import com.tmlang.ir.mir.MirTerminator;
import com.tmlang.ir.mir.UnaryOp;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * MIR → LLVM 风格文本 IR 生成器。
 * <p>
 * 输出顺序：模块头、字符串常量、结构体 / 枚举类型定义、外部声明、函数定义。
 * 每条 MIR 指令对应一个 lower 分支，常量直接内联为字面量，其余值使用 %vN 寄存器。
 * <p>
 * 上游保证不变量被破坏时（缺失类型、缺失标签），生成器退化为 i32 宽度或 unreachable，
 * 同时记录 WARNING，{@link #getFallbackCount()} 统计退化次数。
 * <p>
 * 实例不是线程安全的，每次 {@link #generate} 会重置内部状态。
 */
public class MirCodeGenerator {

    private static final Logger LOG = Logger.getLogger(MirCodeGenerator.class.getName());

    static final String STR_CONCAT = "str_concat_opt";
    static final String ORDERING = "Ordering";
    static final String MAYBE_ORDERING = "Maybe__Ordering";

    private final CodegenOptions options;
    private final NameMangler mangler;

    // ===== 模块级状态 =====
    private MirModule module;
    private LlvmTypeMapper types;
    private final Map<String, String> strings = new LinkedHashMap<>();
    private final Set<String> definedFunctions = new HashSet<>();
    private final Map<String, String> sretFunctions = new HashMap<>();
    private final Map<String, String> declarations = new LinkedHashMap<>();
    /** 被使用但模块内未定义的枚举 → 载荷字节数 */
    private final Map<String, Long> importedEnums = new LinkedHashMap<>();
    private final Set<String> builtinTypes = new HashSet<>();
    private int fallbackCount;

    // ===== 函数级状态 =====
    private MirFunction current;
    private StringBuilder body;
    private final Map<Integer, String> regs = new HashMap<>();
    private final Map<Integer, String> valueTypes = new HashMap<>();
    private final Set<Integer> literals = new HashSet<>();
    private final Map<Integer, String> labels = new HashMap<>();
    private String fallbackLabel;
    private boolean currentSret;
    private String currentRetType;
    private int tempCounter;

    public MirCodeGenerator() {
        this(CodegenOptions.defaults());
    }

    public MirCodeGenerator(CodegenOptions options) {
        this(options, new NameMangler(options.getInstantiationCacheSize()));
    }

    public MirCodeGenerator(CodegenOptions options, NameMangler mangler) {
        this.options = options;
        this.mangler = mangler;
    }

    /** 上次生成中走过退化路径的次数 */
    public int getFallbackCount() {
        return fallbackCount + (types != null ? types.getFallbackCount() : 0);
    }

    public String generate(MirModule mirModule) {
        reset(mirModule);
        LOG.fine("Lowering module " + mirModule.getName());
        collectModuleInfo();

        StringBuilder functionsText = new StringBuilder();
        for (MirFunction f : module.getFunctions()) {
            if (f.isGeneric()) {
                LOG.fine("Skipping generic template " + f.getName());
                continue;
            }
            functionsText.append(lowerFunction(f)).append('\n');
        }

        StringBuilder out = new StringBuilder();
        emitHeader(out);
        emitStrings(out);
        emitTypeDefinitions(out);
        emitDeclarations(out);
        out.append(functionsText);
        if (getFallbackCount() > 0) {
            LOG.warning("Module " + module.getName() + " lowered with " + getFallbackCount() + " fallback(s)");
        }
        return out.toString();
    }

    private void reset(MirModule mirModule) {
        this.module = mirModule;
        this.types = new LlvmTypeMapper(mirModule);
        strings.clear();
        definedFunctions.clear();
        sretFunctions.clear();
        declarations.clear();
        importedEnums.clear();
        builtinTypes.clear();
        fallbackCount = 0;
    }

    // ========== 模块预扫描 ==========

    private void collectModuleInfo() {
        for (MirFunction f : module.getFunctions()) {
            if (f.isGeneric()) continue;
            definedFunctions.add(symbol(f.getName()));
            if (usesSret(f)) {
                sretFunctions.put(symbol(f.getName()), types.toSized(f.getReturnType()));
            }
        }
        for (MirFunction f : module.getFunctions()) {
            if (f.isGeneric()) continue;
            for (BasicBlock block : f.getBlocks()) {
                for (MirInst inst : block.getInstructions()) {
                    if (inst.getOp() == MirOp.CONST) {
                        MirConstant c = inst.extraAs();
                        if (c.getKind() == MirConstant.Kind.STRING && !strings.containsKey(c.getStringValue())) {
                            strings.put(c.getStringValue(), "@.str." + strings.size());
                        }
                    } else if (inst.getOp() == MirOp.ENUM_INIT) {
                        collectImportedEnum(f, inst);
                    }
                }
            }
        }
    }

    private void collectImportedEnum(MirFunction f, MirInst inst) {
        MirInst.EnumInfo info = inst.extraAs();
        String name = mangler.mangleTypeName(info.getEnumName(), info.getTypeArgs());
        if (module.findEnum(name) != null) return;
        long payload = 0;
        for (int op : operandsOf(inst)) payload += types.sizeOf(f.typeOf(op));
        Long known = importedEnums.get(name);
        importedEnums.put(name, known == null ? payload : Math.max(known, payload));
    }

    private boolean usesSret(MirFunction f) {
        if (f.isSret()) return true;
        TmlType ret = f.getReturnType();
        boolean aggregate = ret instanceof TupleType || ret instanceof ArrayType
                || (ret instanceof NamedType && !Types.isPointerLike(ret));
        return aggregate && types.sizeOf(ret) > options.getSretThreshold();
    }

    // ========== 模块级输出 ==========

    private void emitHeader(StringBuilder out) {
        out.append("; ModuleID = '").append(module.getName()).append("'\n");
        out.append("source_filename = \"").append(module.getName()).append("\"\n");
        out.append("target triple = \"").append(options.getTargetTriple()).append("\"\n\n");
    }

    private void emitStrings(StringBuilder out) {
        if (strings.isEmpty()) return;
        for (Map.Entry<String, String> e : strings.entrySet()) {
            byte[] bytes = e.getKey().getBytes(StandardCharsets.UTF_8);
            out.append(e.getValue()).append(" = private unnamed_addr constant [")
                    .append(bytes.length + 1).append(" x i8] c\"")
                    .append(escape(bytes)).append("\\00\", align 1\n");
        }
        out.append('\n');
    }

    static String escape(byte[] bytes) {
        StringBuilder sb = new StringBuilder();
        for (byte b : bytes) {
            int c = b & 0xFF;
            if (c >= 0x20 && c < 0x7F && c != '"' && c != '\\') {
                sb.append((char) c);
            } else {
                sb.append('\\').append(String.format("%02X", c));
            }
        }
        return sb.toString();
    }

    private void emitTypeDefinitions(StringBuilder out) {
        boolean any = false;
        Set<String> emitted = new HashSet<>();
        for (MirStructDef s : module.getStructs()) {
            if (s.isGeneric()) continue;
            List<String> fields = new ArrayList<>();
            for (MirField f : s.getFields()) fields.add(types.toSized(f.getType()));
            out.append(LlvmTypeMapper.STRUCT_PREFIX).append(s.getName()).append(" = type ")
                    .append(braced(fields)).append('\n');
            emitted.add(s.getName());
            any = true;
        }
        for (MirEnumDef e : module.getEnums()) {
            if (e.isGeneric()) continue;
            out.append(enumTypeDef(e.getName(), e.hasPayload() ? types.payloadSize(e) : 0));
            emitted.add(e.getName());
            any = true;
        }
        for (Map.Entry<String, Long> e : importedEnums.entrySet()) {
            if (emitted.add(e.getKey())) {
                out.append(enumTypeDef(e.getKey(), e.getValue() > 0 ? Math.max(e.getValue(), 8) : 0));
                any = true;
            }
        }
        if (builtinTypes.contains(ORDERING) && emitted.add(ORDERING)) {
            out.append(enumTypeDef(ORDERING, 0));
            any = true;
        }
        if (builtinTypes.contains(MAYBE_ORDERING) && emitted.add(MAYBE_ORDERING)) {
            out.append(enumTypeDef(MAYBE_ORDERING, 8));
            any = true;
        }
        if (any) out.append('\n');
    }

    private static String enumTypeDef(String name, long payloadBytes) {
        String body = payloadBytes > 0 ? "{ i32, [" + payloadBytes + " x i8] }" : "{ i32 }";
        return LlvmTypeMapper.STRUCT_PREFIX + name + " = type " + body + "\n";
    }

    private void emitDeclarations(StringBuilder out) {
        out.append("declare ptr @").append(STR_CONCAT).append("(ptr, ptr)\n");
        for (String decl : declarations.values()) {
            out.append(decl).append('\n');
        }
        out.append('\n');
    }

    // ========== 函数 ==========

    private String lowerFunction(MirFunction f) {
        current = f;
        body = new StringBuilder();
        regs.clear();
        valueTypes.clear();
        literals.clear();
        labels.clear();
        fallbackLabel = null;
        tempCounter = 0;
        currentSret = sretFunctions.containsKey(symbol(f.getName()));
        currentRetType = currentSret ? sretFunctions.get(symbol(f.getName())) : types.toLlvm(f.getReturnType());

        for (BasicBlock block : f.getBlocks()) {
            labels.put(block.getId(), block.getName());
            if (fallbackLabel == null && block.getTerminator() instanceof MirTerminator.Return) {
                fallbackLabel = block.getName();
            }
        }
        for (MirParam p : f.getParams()) {
            regs.put(p.getValueId(), "%" + p.getName());
            valueTypes.put(p.getValueId(), types.toSized(p.getType()));
        }
        // 常量先行登记，phi 可以引用后续块中的常量
        for (BasicBlock block : f.getBlocks()) {
            for (MirInst inst : block.getInstructions()) {
                if (inst.getOp() == MirOp.CONST) registerConstant(inst);
            }
        }

        StringBuilder sb = new StringBuilder();
        if (options.isEmitComments()) {
            sb.append("; fn ").append(f.getName()).append('\n');
        }
        sb.append("define ").append(currentSret ? "void" : currentRetType)
                .append(" @").append(symbol(f.getName())).append('(');
        boolean first = true;
        if (currentSret) {
            sb.append("ptr sret(").append(currentRetType).append(") %sret");
            first = false;
        }
        for (MirParam p : f.getParams()) {
            if (!first) sb.append(", ");
            sb.append(valueTypes.get(p.getValueId())).append(" %").append(p.getName());
            first = false;
        }
        sb.append(") {\n");

        for (BasicBlock block : f.getBlocks()) {
            body.append(block.getName()).append(":\n");
            for (MirInst inst : block.getInstructions()) {
                lowerInst(inst);
            }
            lowerTerminator(block);
        }
        sb.append(body).append("}\n");
        LOG.finer("Lowered fn " + f.getName() + " (" + f.getBlocks().size() + " blocks)");
        return sb.toString();
    }

    private void registerConstant(MirInst inst) {
        MirConstant c = inst.extraAs();
        int dest = inst.getDest();
        literals.add(dest);
        switch (c.getKind()) {
            case INT:
                regs.put(dest, String.valueOf(c.getIntValue()));
                valueTypes.put(dest, types.toSized(c.getType()));
                break;
            case FLOAT:
                regs.put(dest, floatLiteral(c));
                valueTypes.put(dest, types.toSized(c.getType()));
                break;
            case BOOL:
                regs.put(dest, c.getBoolValue() ? "true" : "false");
                valueTypes.put(dest, "i1");
                break;
            case STRING:
                regs.put(dest, strings.get(c.getStringValue()));
                valueTypes.put(dest, "ptr");
                break;
            default:
                regs.put(dest, "zeroinitializer");
                valueTypes.put(dest, "{}");
                break;
        }
    }

    private static String floatLiteral(MirConstant c) {
        double v = c.getFloatValue();
        // float 字面量也以 double 十六进制书写，须先截到单精度
        if (Types.kindOf(c.getType()) == PrimitiveKind.F32) v = (float) v;
        return String.format("0x%016X", Double.doubleToRawLongBits(v));
    }

    // ========== 指令 ==========

    private void lowerInst(MirInst inst) {
        switch (inst.getOp()) {
            case CONST:
                break;
            case BINARY:
                lowerBinary(inst);
                break;
            case UNARY:
                lowerUnary(inst);
                break;
            case SELECT:
                lowerSelect(inst);
                break;
            case CAST:
                lowerCast(inst);
                break;
            case LOAD:
                lowerLoad(inst);
                break;
            case STORE:
                lowerStore(inst);
                break;
            case ALLOCA:
                lowerAlloca(inst);
                break;
            case GEP:
                lowerGep(inst);
                break;
            case EXTRACT_VALUE:
                lowerExtractValue(inst);
                break;
            case INSERT_VALUE:
                lowerInsertValue(inst);
                break;
            case STRUCT_INIT:
                lowerStructInit(inst);
                break;
            case ENUM_INIT:
                lowerEnumInit(inst);
                break;
            case TUPLE_INIT:
                lowerTupleInit(inst);
                break;
            case ARRAY_INIT:
                lowerArrayInit(inst);
                break;
            case CALL:
                lowerCall(inst);
                break;
            case METHOD_CALL:
                lowerMethodCall(inst);
                break;
            case CLOSURE_INIT:
                lowerClosureInit(inst);
                break;
            case CLOSURE_CALL:
                lowerClosureCall(inst);
                break;
            case PHI:
                lowerPhi(inst);
                break;
            case ATOMIC_LOAD:
                lowerAtomicLoad(inst);
                break;
            case ATOMIC_STORE:
                lowerAtomicStore(inst);
                break;
            case ATOMIC_RMW:
                lowerAtomicRmw(inst);
                break;
            case CMPXCHG:
                lowerCmpXchg(inst);
                break;
            case FENCE:
                lowerFence(inst);
                break;
            default:
                throw new IllegalStateException("Unhandled MIR op " + inst.getOp());
        }
    }

    private void lowerBinary(MirInst inst) {
        BinaryOp op = inst.extraAs();
        int l = inst.operand(0);
        int r = inst.operand(1);
        String lt = typeOfValue(l);
        String rt = typeOfValue(r);
        String opType;
        if (op.isComparison()) {
            opType = lt != null ? lt : rt;
        } else if (inst.getType() != null) {
            opType = types.toSized(inst.getType());
        } else {
            opType = lt != null ? lt : rt;
        }
        if (opType == null) {
            warn("No operand type for binary %v" + inst.getDest() + ", defaulting to i32");
            opType = "i32";
        }
        String dest = dest(inst);

        if ("ptr".equals(opType) && op == BinaryOp.ADD) {
            line(dest + " = call ptr @" + STR_CONCAT + "(ptr " + reg(l) + ", ptr " + reg(r) + ")");
            define(inst, "ptr");
            return;
        }

        TmlType operandType = current.typeOf(l) != null ? current.typeOf(l) : inst.getType();
        boolean unsigned = Types.isUnsignedInteger(operandType);
        String a = coerce(l, opType, !unsigned);
        String b = coerce(r, opType, !unsigned);
        boolean fp = LlvmTypeMapper.isFloat(opType);

        if (op.isComparison()) {
            line(dest + " = " + (fp ? "fcmp " : "icmp ") + predicate(op, fp, unsigned)
                    + " " + opType + " " + a + ", " + b);
            define(inst, "i1");
        } else {
            line(dest + " = " + arithmetic(op, fp, unsigned) + " " + opType + " " + a + ", " + b);
            define(inst, opType);
        }
    }

    private static String predicate(BinaryOp op, boolean fp, boolean unsigned) {
        switch (op) {
            case EQ: return fp ? "oeq" : "eq";
            case NE: return fp ? "one" : "ne";
            case LT: return fp ? "olt" : unsigned ? "ult" : "slt";
            case LE: return fp ? "ole" : unsigned ? "ule" : "sle";
            case GT: return fp ? "ogt" : unsigned ? "ugt" : "sgt";
            case GE: return fp ? "oge" : unsigned ? "uge" : "sge";
            default: throw new IllegalArgumentException("Not a comparison: " + op);
        }
    }

    private static String arithmetic(BinaryOp op, boolean fp, boolean unsigned) {
        switch (op) {
            case ADD: return fp ? "fadd" : "add";
            case SUB: return fp ? "fsub" : "sub";
            case MUL: return fp ? "fmul" : "mul";
            case DIV: return fp ? "fdiv" : unsigned ? "udiv" : "sdiv";
            case MOD: return fp ? "frem" : unsigned ? "urem" : "srem";
            case AND: case BAND: return "and";
            case OR: case BOR: return "or";
            case BXOR: return "xor";
            case SHL: return "shl";
            case SHR: return unsigned ? "lshr" : "ashr";
            default: throw new IllegalArgumentException("Not an arithmetic op: " + op);
        }
    }

    private void lowerUnary(MirInst inst) {
        UnaryOp op = inst.extraAs();
        int x = inst.operand(0);
        String ty = inst.getType() != null ? types.toSized(inst.getType()) : widthOf(x);
        String dest = dest(inst);
        switch (op) {
            case NEG:
                if (LlvmTypeMapper.isFloat(ty)) {
                    line(dest + " = fneg " + ty + " " + reg(x));
                } else {
                    line(dest + " = sub " + ty + " 0, " + coerce(x, ty, true));
                }
                break;
            case NOT:
                line(dest + " = xor " + ty + " " + reg(x) + ("i1".equals(ty) ? ", true" : ", -1"));
                break;
            default:
                line(dest + " = xor " + ty + " " + coerce(x, ty, true) + ", -1");
                break;
        }
        define(inst, ty);
    }

    private void lowerSelect(MirInst inst) {
        String ty = inst.getType() != null ? types.toSized(inst.getType()) : widthOf(inst.operand(1));
        line(dest(inst) + " = select i1 " + reg(inst.operand(0)) + ", " + ty + " "
                + coerce(inst.operand(1), ty, signed(inst.operand(1))) + ", " + ty + " "
                + coerce(inst.operand(2), ty, signed(inst.operand(2))));
        define(inst, ty);
    }

    private void lowerCast(MirInst inst) {
        CastKind kind = inst.extraAs();
        int src = inst.operand(0);
        String from = widthOf(src);
        String to = types.toSized(inst.getType());
        String dest = dest(inst);
        String value = reg(src);

        if (LlvmTypeMapper.isAggregate(from)) {
            // 聚合值不能在寄存器里重解释，先落到栈上
            if ("ptr".equals(to)) {
                line(dest + " = alloca " + from);
                line("store " + from + " " + value + ", ptr " + dest);
                define(inst, "ptr");
                return;
            }
            if (!from.equals(to)) {
                String spill = "%spill." + nextTemp();
                line(spill + " = alloca " + from);
                line("store " + from + " " + value + ", ptr " + spill);
                line(dest + " = load " + to + ", ptr " + spill);
                define(inst, to);
                return;
            }
        }

        int fromBits = LlvmTypeMapper.intBits(from);
        int toBits = LlvmTypeMapper.intBits(to);
        boolean fromFloat = LlvmTypeMapper.isFloat(from);
        boolean toFloat = LlvmTypeMapper.isFloat(to);
        String instr;
        if (fromFloat && toBits > 0) {
            instr = Types.isUnsignedInteger(inst.getType()) ? "fptoui" : "fptosi";
        } else if (fromBits > 0 && toFloat) {
            instr = fromBits == 1 || Types.isUnsignedInteger(current.typeOf(src)) ? "uitofp" : "sitofp";
        } else if (fromFloat && toFloat) {
            instr = from.equals(to) ? null : "double".equals(to) ? "fpext" : "fptrunc";
        } else if (fromBits > 0 && toBits > 0) {
            if (toBits == 1 && fromBits > 1) {
                line(dest + " = icmp ne " + from + " " + value + ", 0");
                define(inst, "i1");
                return;
            }
            if (fromBits == toBits) {
                instr = null;
            } else if (fromBits < toBits) {
                instr = fromBits == 1 || Types.isUnsignedInteger(current.typeOf(src)) ? "zext" : "sext";
            } else {
                instr = "trunc";
            }
        } else if ("ptr".equals(from) && toBits > 0) {
            instr = "ptrtoint";
        } else if (fromBits > 0 && "ptr".equals(to)) {
            instr = "inttoptr";
        } else if (from.equals(to) && kind != CastKind.BITCAST) {
            instr = null;
        } else {
            instr = kind.getLlvmName();
        }

        if (instr == null) {
            regs.put(inst.getDest(), value);
            valueTypes.put(inst.getDest(), to);
            if (literals.contains(src)) literals.add(inst.getDest());
            return;
        }
        line(dest + " = " + instr + " " + from + " " + value + " to " + to);
        define(inst, to);
    }

    private void lowerLoad(MirInst inst) {
        String ty = types.toSized(inst.getType());
        line(dest(inst) + " = load " + ty + ", ptr " + reg(inst.operand(0)));
        define(inst, ty);
    }

    private void lowerStore(MirInst inst) {
        int value = inst.operand(1);
        String ty = inst.getType() != null ? types.toSized(inst.getType()) : widthOf(value);
        line("store " + ty + " " + coerce(value, ty, signed(value)) + ", ptr " + reg(inst.operand(0)));
    }

    private void lowerAlloca(MirInst inst) {
        TmlType alloc = inst.extraAs();
        line(dest(inst) + " = alloca " + types.toSized(alloc));
        define(inst, "ptr");
    }

    private void lowerGep(MirInst inst) {
        TmlType base = inst.extraAs();
        int[] ops = inst.getOperands();
        StringBuilder sb = new StringBuilder();
        sb.append(dest(inst)).append(" = getelementptr ").append(types.toSized(base))
                .append(", ptr ").append(reg(ops[0]));
        for (int i = 1; i < ops.length; i++) {
            String it = typeOfValue(ops[i]);
            sb.append(", ").append(LlvmTypeMapper.intBits(it) > 1 ? it : "i32").append(' ').append(reg(ops[i]));
        }
        line(sb.toString());
        define(inst, "ptr");
    }

    private void lowerExtractValue(MirInst inst) {
        int[] indices = inst.extraAs();
        int agg = inst.operand(0);
        String aggType = widthOf(agg);
        String ty = types.toSized(inst.getType());
        line(dest(inst) + " = extractvalue " + aggType + " " + reg(agg) + indexList(indices));
        define(inst, ty);
    }

    private void lowerInsertValue(MirInst inst) {
        int[] indices = inst.extraAs();
        int agg = inst.operand(0);
        int value = inst.operand(1);
        String aggType = inst.getType() != null ? types.toSized(inst.getType()) : widthOf(agg);
        TmlType elem = elementType(inst.getType(), indices);
        String elemType = elem != null ? types.toSized(elem) : widthOf(value);
        line(dest(inst) + " = insertvalue " + aggType + " " + reg(agg) + ", " + elemType + " "
                + coerce(value, elemType, signed(value)) + indexList(indices));
        define(inst, aggType);
    }

    private static String indexList(int[] indices) {
        StringBuilder sb = new StringBuilder();
        for (int i : indices) sb.append(", ").append(i);
        return sb.toString();
    }

    private TmlType elementType(TmlType aggregate, int[] indices) {
        TmlType t = aggregate;
        for (int idx : indices) {
            if (t instanceof TupleType) {
                List<TmlType> elems = ((TupleType) t).getElements();
                t = idx < elems.size() ? elems.get(idx) : null;
            } else if (t instanceof ArrayType) {
                t = ((ArrayType) t).getElement();
            } else if (t instanceof NamedType) {
                MirStructDef def = module.findStruct(LlvmTypeMapper.aggregateName(t));
                t = def != null && idx < def.getFields().size() ? def.getFields().get(idx).getType() : null;
            } else {
                return null;
            }
            if (t == null) return null;
        }
        return t;
    }

    // ========== 聚合体构造 ==========

    private void lowerStructInit(MirInst inst) {
        String name = LlvmTypeMapper.aggregateName(inst.getType());
        if (name == null) name = inst.extraAs();
        String ty = LlvmTypeMapper.STRUCT_PREFIX + name;
        MirStructDef def = module.findStruct(name);
        int[] fields = operandsOf(inst);
        List<String> fieldTypes = new ArrayList<>();
        for (int i = 0; i < fields.length; i++) {
            fieldTypes.add(def != null && i < def.getFields().size()
                    ? types.toSized(def.getFields().get(i).getType())
                    : widthOf(fields[i]));
        }

        if (inst.getType() instanceof ClassType) {
            // 引用语义：分配稳定地址，逐字段写入
            String dest = dest(inst);
            line(dest + " = alloca " + ty);
            for (int i = 0; i < fields.length; i++) {
                String gep = "%field." + nextTemp();
                line(gep + " = getelementptr inbounds " + ty + ", ptr " + dest + ", i32 0, i32 " + i);
                line("store " + fieldTypes.get(i) + " " + coerce(fields[i], fieldTypes.get(i), signed(fields[i]))
                        + ", ptr " + gep);
            }
            define(inst, "ptr");
            return;
        }
        insertChain(inst, ty, fieldTypes, fields);
    }

    private void lowerEnumInit(MirInst inst) {
        MirInst.EnumInfo info = inst.extraAs();
        String name = mangler.mangleTypeName(info.getEnumName(), info.getTypeArgs());
        String ty = LlvmTypeMapper.STRUCT_PREFIX + name;
        MirEnumDef def = module.findEnum(name);
        int[] payload = operandsOf(inst);
        String dest = dest(inst);

        boolean hasPayloadRegion = def != null ? def.hasPayload() : importedEnums.containsKey(name)
                && importedEnums.get(name) > 0;
        if (!hasPayloadRegion) {
            line(dest + " = insertvalue " + ty + " undef, i32 " + info.getVariantIndex() + ", 0");
            define(inst, ty);
            return;
        }

        int n = nextTemp();
        String slot = "%enum." + n;
        line(slot + " = alloca " + ty);
        line("%tag." + n + " = getelementptr inbounds " + ty + ", ptr " + slot + ", i32 0, i32 0");
        line("store i32 " + info.getVariantIndex() + ", ptr %tag." + n);
        if (payload.length > 0) {
            String region = "%payload." + n;
            line(region + " = getelementptr inbounds " + ty + ", ptr " + slot + ", i32 0, i32 1");
            List<TmlType> declared = variantPayload(def, info);
            long offset = 0;
            for (int i = 0; i < payload.length; i++) {
                TmlType pt = declared != null && i < declared.size() ? declared.get(i) : current.typeOf(payload[i]);
                String ptText = pt != null ? types.toSized(pt) : widthOf(payload[i]);
                String target = region;
                if (offset > 0) {
                    target = "%payload." + n + "." + i;
                    line(target + " = getelementptr inbounds i8, ptr " + region + ", i64 " + offset);
                }
                line("store " + ptText + " " + coerce(payload[i], ptText, signed(payload[i])) + ", ptr " + target);
                offset += types.sizeOf(pt);
            }
        }
        line(dest + " = load " + ty + ", ptr " + slot);
        define(inst, ty);
    }

    private static List<TmlType> variantPayload(MirEnumDef def, MirInst.EnumInfo info) {
        if (def == null) return null;
        List<MirEnumDef.Variant> variants = def.getVariants();
        int idx = info.getVariantIndex();
        if (idx >= 0 && idx < variants.size()) return variants.get(idx).getPayloadTypes();
        for (MirEnumDef.Variant v : variants) {
            if (v.getName().equals(info.getVariantName())) return v.getPayloadTypes();
        }
        return null;
    }

    private void lowerTupleInit(MirInst inst) {
        int[] elems = operandsOf(inst);
        List<String> elemTypes = new ArrayList<>();
        List<TmlType> declared = inst.getType() instanceof TupleType
                ? ((TupleType) inst.getType()).getElements() : null;
        for (int i = 0; i < elems.length; i++) {
            elemTypes.add(declared != null && i < declared.size()
                    ? types.toSized(declared.get(i)) : widthOf(elems[i]));
        }
        insertChain(inst, braced(elemTypes), elemTypes, elems);
    }

    private void lowerArrayInit(MirInst inst) {
        int[] elems = operandsOf(inst);
        TmlType elemTml = inst.getType() instanceof ArrayType ? ((ArrayType) inst.getType()).getElement() : null;
        if (elems.length == 0) {
            regs.put(inst.getDest(), "zeroinitializer");
            valueTypes.put(inst.getDest(), "[0 x " + (elemTml != null ? types.toSized(elemTml) : "i32") + "]");
            return;
        }
        String elemType = elemTml != null ? types.toSized(elemTml) : widthOf(elems[0]);
        String arrType = "[" + elems.length + " x " + elemType + "]";

        boolean uniform = true;
        for (int e : elems) {
            if (e != elems[0]) {
                uniform = false;
                break;
            }
        }
        MirConstant constant = uniform ? constantOf(elems[0]) : null;
        String dest = dest(inst);

        if (constant != null && constant.isZero()) {
            String slot = "%arr." + nextTemp();
            line(slot + " = alloca " + arrType + ", align 16");
            line("store " + arrType + " zeroinitializer, ptr " + slot + ", align 16");
            line(dest + " = load " + arrType + ", ptr " + slot + ", align 16");
            define(inst, arrType);
            return;
        }
        if (uniform && elems.length > options.getBulkZeroThreshold()) {
            // 非零统一值：真实写入每个元素
            String slot = "%arr." + nextTemp();
            line(slot + " = alloca " + arrType + ", align 16");
            if (constant != null) {
                String lit = reg(elems[0]);
                StringBuilder agg = new StringBuilder("[");
                for (int i = 0; i < elems.length; i++) {
                    if (i > 0) agg.append(", ");
                    agg.append(elemType).append(' ').append(lit);
                }
                agg.append(']');
                line("store " + arrType + " " + agg + ", ptr " + slot + ", align 16");
            } else {
                String v = coerce(elems[0], elemType, signed(elems[0]));
                for (int i = 0; i < elems.length; i++) {
                    String gep = "%arr.elem." + nextTemp();
                    line(gep + " = getelementptr inbounds " + arrType + ", ptr " + slot + ", i32 0, i32 " + i);
                    line("store " + elemType + " " + v + ", ptr " + gep);
                }
            }
            line(dest + " = load " + arrType + ", ptr " + slot + ", align 16");
            define(inst, arrType);
            return;
        }
        List<String> elemTypes = new ArrayList<>();
        for (int i = 0; i < elems.length; i++) elemTypes.add(elemType);
        insertChain(inst, arrType, elemTypes, elems);
    }

    /** 值语义聚合体：从 undef 开始的 insertvalue 链，最后一环写入 dest */
    private void insertChain(MirInst inst, String aggType, List<String> elemTypes, int[] elems) {
        if (elems.length == 0) {
            regs.put(inst.getDest(), "zeroinitializer");
            valueTypes.put(inst.getDest(), aggType);
            return;
        }
        String acc = "undef";
        for (int i = 0; i < elems.length; i++) {
            String target = i == elems.length - 1 ? dest(inst) : "%ins." + nextTemp();
            line(target + " = insertvalue " + aggType + " " + acc + ", " + elemTypes.get(i) + " "
                    + coerce(elems[i], elemTypes.get(i), signed(elems[i])) + ", " + i);
            acc = target;
        }
        define(inst, aggType);
    }

    // ========== 调用 ==========

    private void lowerCall(MirInst inst) {
        MirInst.CallInfo call = inst.extraAs();
        String name = symbol(call.isGeneric()
                ? mangler.mangleFuncName(call.getFuncName(), call.getTypeArgs())
                : call.getFuncName());
        List<String> args = buildArgs(operandsOf(inst), 0, call.getArgTypes());
        emitDirectCall(inst, name, args);
    }

    private void emitDirectCall(MirInst inst, String name, List<String> args) {
        String sretType = sretFunctions.get(name);
        if (sretType != null) {
            String slot = "%sret.slot." + nextTemp();
            line(slot + " = alloca " + sretType + ", align 8");
            List<String> all = new ArrayList<>();
            all.add("ptr sret(" + sretType + ") " + slot);
            all.addAll(args);
            line("call void @" + name + "(" + join(all) + ")");
            if (inst.hasDest()) {
                line(dest(inst) + " = load " + sretType + ", ptr " + slot + ", align 8");
                define(inst, sretType);
            }
            return;
        }
        String ret = callResultType(inst);
        emitCallLine(inst, ret, "@" + name, args);
        if (!definedFunctions.contains(name) && !STR_CONCAT.equals(name) && !declarations.containsKey(name)) {
            List<String> paramTypes = new ArrayList<>();
            for (String a : args) paramTypes.add(a.substring(0, a.lastIndexOf(' ')));
            declarations.put(name, "declare " + ret + " @" + name + "(" + join(paramTypes) + ")");
        }
    }

    private String callResultType(MirInst inst) {
        return inst.hasDest() ? types.toSized(inst.getType()) : types.toLlvm(inst.getType());
    }

    private void emitCallLine(MirInst inst, String ret, String callee, List<String> args) {
        String call = "call " + ret + " " + callee + "(" + join(args) + ")";
        if (inst.hasDest() && !"void".equals(ret)) {
            line(dest(inst) + " = " + call);
            define(inst, ret);
        } else {
            line(call);
        }
    }

    private List<String> buildArgs(int[] ids, int from, List<TmlType> declared) {
        List<String> args = new ArrayList<>();
        for (int i = from; i < ids.length; i++) {
            int k = i - from;
            String actual = typeOfValue(ids[i]);
            String ty = declared != null && k < declared.size() && declared.get(k) != null
                    ? types.toSized(declared.get(k)) : widthOf(ids[i]);
            if (actual != null && LlvmTypeMapper.isAggregate(actual) && !actual.equals(ty)) {
                ty = actual;
            }
            args.add(ty + " " + coerce(ids[i], ty, signed(ids[i])));
        }
        return args;
    }

    private void lowerMethodCall(MirInst inst) {
        MirInst.MethodInfo m = inst.extraAs();
        int[] ops = inst.getOperands();
        int recv = ops[0];
        TmlType recvType = m.getReceiverType() != null ? m.getReceiverType() : current.typeOf(recv);
        TmlType base = stripIndirection(recvType);
        String method = m.getMethodName();

        if (inst.hasDest() && ops.length == 2 && base instanceof PrimitiveType) {
            if ("cmp".equals(method) && Types.isInteger(base)) {
                lowerInlineCompare(inst, recv, ops[1], base, false);
                return;
            }
            if ("partial_cmp".equals(method) && Types.isNumeric(base)) {
                lowerInlineCompare(inst, recv, ops[1], base, true);
                return;
            }
        }

        String receiverArg = addressOrValue(recv);
        List<String> args = new ArrayList<>();
        args.add(receiverArg);
        args.addAll(buildArgs(ops, 1, m.getArgTypes()));

        if (m.isVirtual()) {
            int n = nextTemp();
            String self = receiverArg.substring(receiverArg.indexOf(' ') + 1);
            line("%vt." + n + " = load ptr, ptr " + self);
            line("%slot." + n + " = getelementptr ptr, ptr %vt." + n + ", i32 " + m.getVtableSlot());
            line("%fn." + n + " = load ptr, ptr %slot." + n);
            emitCallLine(inst, callResultType(inst), "%fn." + n, args);
            return;
        }
        emitDirectCall(inst, symbol(NameMangler.mangleType(base) + "__" + method), args);
    }

    /** 结构体接收者先落栈再按地址传递 */
    private String addressOrValue(int id) {
        String ty = widthOf(id);
        if (LlvmTypeMapper.isAggregate(ty)) {
            String spill = "%spill." + nextTemp();
            line(spill + " = alloca " + ty);
            line("store " + ty + " " + reg(id) + ", ptr " + spill);
            return "ptr " + spill;
        }
        return ty + " " + reg(id);
    }

    private static TmlType stripIndirection(TmlType type) {
        TmlType t = type;
        while (true) {
            if (t instanceof RefType) {
                t = ((RefType) t).getInner();
            } else if (t instanceof PtrType) {
                t = ((PtrType) t).getInner();
            } else {
                return t;
            }
        }
    }

    /**
     * 基本类型 cmp / partial_cmp 内联为无分支三路比较。
     * Ordering 标签：Less=0, Equal=1, Greater=2；Maybe 标签：Just=0, Nothing=1。
     */
    private void lowerInlineCompare(MirInst inst, int recv, int other, TmlType base, boolean partial) {
        int id = inst.getDest();
        String ty = types.toSized(base);
        String self = operandAsValue(recv, ty, "%self." + id);
        String rhs = operandAsValue(other, ty, "%other." + id);
        boolean fp = LlvmTypeMapper.isFloat(ty);
        boolean unsigned = Types.isUnsignedInteger(base);
        String lt = fp ? "fcmp olt" : unsigned ? "icmp ult" : "icmp slt";
        String gt = fp ? "fcmp ogt" : unsigned ? "icmp ugt" : "icmp sgt";

        line("%cmp_lt." + id + " = " + lt + " " + ty + " " + self + ", " + rhs);
        line("%cmp_gt." + id + " = " + gt + " " + ty + " " + self + ", " + rhs);
        line("%tag_1." + id + " = select i1 %cmp_lt." + id + ", i32 0, i32 1");
        line("%tag_2." + id + " = select i1 %cmp_gt." + id + ", i32 2, i32 %tag_1." + id);
        String ordering = LlvmTypeMapper.STRUCT_PREFIX + ORDERING;
        builtinTypes.add(ORDERING);

        if (!partial) {
            line(dest(inst) + " = insertvalue " + ordering + " undef, i32 %tag_2." + id + ", 0");
            define(inst, ordering);
            return;
        }
        String maybe = LlvmTypeMapper.STRUCT_PREFIX + MAYBE_ORDERING;
        builtinTypes.add(MAYBE_ORDERING);
        String justTag = "0";
        if (fp) {
            line("%unord." + id + " = fcmp uno " + ty + " " + self + ", " + rhs);
            line("%maybe_tag_v." + id + " = select i1 %unord." + id + ", i32 1, i32 0");
            justTag = "%maybe_tag_v." + id;
        }
        line("%ord." + id + " = insertvalue " + ordering + " undef, i32 %tag_2." + id + ", 0");
        line("%maybe." + id + " = alloca " + maybe);
        line("%maybe_tag." + id + " = getelementptr inbounds " + maybe + ", ptr %maybe." + id + ", i32 0, i32 0");
        line("store i32 " + justTag + ", ptr %maybe_tag." + id);
        line("%maybe_val." + id + " = getelementptr inbounds " + maybe + ", ptr %maybe." + id + ", i32 0, i32 1");
        line("store " + ordering + " %ord." + id + ", ptr %maybe_val." + id);
        line(dest(inst) + " = load " + maybe + ", ptr %maybe." + id);
        define(inst, maybe);
    }

    /** 按引用传入的操作数先 load 出值 */
    private String operandAsValue(int id, String ty, String loadedName) {
        if ("ptr".equals(typeOfValue(id))) {
            line(loadedName + " = load " + ty + ", ptr " + reg(id));
            return loadedName;
        }
        return coerce(id, ty, signed(id));
    }

    private void lowerClosureInit(MirInst inst) {
        String fn = symbol((String) inst.extraAs());
        int[] ops = operandsOf(inst);
        String env = ops.length > 0 ? reg(ops[0]) : "null";
        String pair = "%clo." + nextTemp();
        line(pair + " = insertvalue { ptr, ptr } undef, ptr @" + fn + ", 0");
        line(dest(inst) + " = insertvalue { ptr, ptr } " + pair + ", ptr " + env + ", 1");
        define(inst, "{ ptr, ptr }");
    }

    private void lowerClosureCall(MirInst inst) {
        int[] ops = inst.getOperands();
        String closure = reg(ops[0]);
        int n = nextTemp();
        line("%clo.fn." + n + " = extractvalue { ptr, ptr } " + closure + ", 0");
        line("%clo.env." + n + " = extractvalue { ptr, ptr } " + closure + ", 1");
        List<String> args = new ArrayList<>();
        args.add("ptr %clo.env." + n);
        args.addAll(buildArgs(ops, 1, null));
        emitCallLine(inst, callResultType(inst), "%clo.fn." + n, args);
    }

    private void lowerPhi(MirInst inst) {
        List<MirInst.PhiIncoming> incoming = inst.extraAs();
        String ty = types.toSized(inst.getType());
        List<String> parts = new ArrayList<>();
        for (MirInst.PhiIncoming in : incoming) {
            String label = label(in.getBlockId());
            if (label == null) {
                warn("Phi incoming block B" + in.getBlockId() + " has no label, dropping it");
                continue;
            }
            parts.add("[ " + reg(in.getValueId()) + ", %" + label + " ]");
        }
        if (parts.isEmpty()) {
            warn("Phi %v" + inst.getDest() + " has no incoming values");
            regs.put(inst.getDest(), "undef");
            valueTypes.put(inst.getDest(), ty);
            return;
        }
        line(dest(inst) + " = phi " + ty + " " + join(parts));
        define(inst, ty);
    }

    // ========== 原子操作 ==========

    private void lowerAtomicLoad(MirInst inst) {
        MirInst.AtomicInfo info = inst.extraAs();
        String ty = types.toSized(inst.getType());
        line(dest(inst) + " = load atomic " + ty + ", ptr " + reg(inst.operand(0)) + " "
                + info.getOrdering().getLlvmName() + ", align " + LlvmTypeMapper.alignOf(ty));
        define(inst, ty);
    }

    private void lowerAtomicStore(MirInst inst) {
        MirInst.AtomicInfo info = inst.extraAs();
        int value = inst.operand(1);
        String ty = inst.getType() != null ? types.toSized(inst.getType()) : widthOf(value);
        line("store atomic " + ty + " " + coerce(value, ty, signed(value)) + ", ptr " + reg(inst.operand(0))
                + " " + info.getOrdering().getLlvmName() + ", align " + LlvmTypeMapper.alignOf(ty));
    }

    private void lowerAtomicRmw(MirInst inst) {
        MirInst.AtomicInfo info = inst.extraAs();
        int value = inst.operand(1);
        String ty = inst.getType() != null ? types.toSized(inst.getType()) : widthOf(value);
        String target = inst.hasDest() ? dest(inst) : "%rmw." + nextTemp();
        line(target + " = atomicrmw " + info.getRmwOp().getLlvmName() + " ptr " + reg(inst.operand(0))
                + ", " + ty + " " + coerce(value, ty, signed(value)) + " " + info.getOrdering().getLlvmName());
        if (inst.hasDest()) define(inst, ty);
    }

    private void lowerCmpXchg(MirInst inst) {
        MirInst.AtomicInfo info = inst.extraAs();
        int expected = inst.operand(1);
        int desired = inst.operand(2);
        String ty = inst.getType() != null ? types.toSized(inst.getType()) : widthOf(expected);
        String pair = "%cmpxchg." + nextTemp();
        line(pair + " = cmpxchg " + (info.isWeak() ? "weak " : "") + "ptr " + reg(inst.operand(0))
                + ", " + ty + " " + coerce(expected, ty, signed(expected))
                + ", " + ty + " " + coerce(desired, ty, signed(desired))
                + " " + info.getOrdering().getLlvmName() + " " + info.getFailureOrdering().getLlvmName());
        if (inst.hasDest()) {
            line(dest(inst) + " = extractvalue { " + ty + ", i1 } " + pair + ", 0");
            define(inst, ty);
        }
    }

    private void lowerFence(MirInst inst) {
        MirInst.AtomicInfo info = inst.extraAs();
        AtomicOrdering ordering = info.getOrdering();
        line("fence " + (info.isSingleThread() ? "syncscope(\"singlethread\") " : "") + ordering.getLlvmName());
    }

    // ========== 终止指令 ==========

    private void lowerTerminator(BasicBlock block) {
        MirTerminator term = block.getTerminator();
        if (term == null) {
            warn("Block " + block.getName() + " has no terminator");
            line("unreachable");
            return;
        }
        switch (term.kind) {
            case MirTerminator.KIND_GOTO: {
                String target = label(((MirTerminator.Goto) term).getTargetBlockId());
                line(target != null ? "br label %" + target : "unreachable");
                break;
            }
            case MirTerminator.KIND_BRANCH: {
                MirTerminator.Branch br = (MirTerminator.Branch) term;
                String then = label(br.getThenBlock());
                String other = label(br.getElseBlock());
                if (then == null || other == null) {
                    line("unreachable");
                } else {
                    line("br i1 " + reg(br.getCondition()) + ", label %" + then + ", label %" + other);
                }
                break;
            }
            case MirTerminator.KIND_SWITCH:
                lowerSwitch((MirTerminator.Switch) term);
                break;
            case MirTerminator.KIND_RETURN:
                lowerReturn((MirTerminator.Return) term);
                break;
            default:
                line("unreachable");
                break;
        }
    }

    private void lowerSwitch(MirTerminator.Switch sw) {
        String defaultLabel = label(sw.getDefaultBlock());
        if (defaultLabel == null) {
            line("unreachable");
            return;
        }
        // 任一分支缺标签时整条 switch 输出 unreachable
        Map<Long, String> targets = new LinkedHashMap<Long, String>();
        for (Map.Entry<Long, Integer> c : sw.getCases().entrySet()) {
            String target = label(c.getValue());
            if (target == null) {
                line("unreachable");
                return;
            }
            targets.put(c.getKey(), target);
        }
        String ty = widthOf(sw.getDiscriminant());
        StringBuilder sb = new StringBuilder();
        sb.append("switch ").append(ty).append(' ').append(reg(sw.getDiscriminant()))
                .append(", label %").append(defaultLabel).append(" [");
        for (Map.Entry<Long, String> c : targets.entrySet()) {
            sb.append("\n    ").append(ty).append(' ').append(c.getKey()).append(", label %").append(c.getValue());
        }
        sb.append("\n  ]");
        line(sb.toString());
    }

    private void lowerReturn(MirTerminator.Return ret) {
        if (currentSret) {
            if (ret.hasValue()) {
                line("store " + currentRetType + " " + reg(ret.getValue()) + ", ptr %sret");
            }
            line("ret void");
            return;
        }
        if ("void".equals(currentRetType)) {
            line("ret void");
            return;
        }
        if (!ret.hasValue()) {
            warn("Return without value from non-void fn");
            line("ret " + currentRetType + " undef");
            return;
        }
        int v = ret.getValue();
        line("ret " + currentRetType + " " + coerce(v, currentRetType, signed(v)));
    }

    /**
     * 目标块标签；缺失时退回首个 return 块的标签，二者都没有返回 null（调用方输出 unreachable）。
     */
    private String label(int blockId) {
        String label = labels.get(blockId);
        if (label != null) return label;
        if (fallbackLabel != null) {
            warn("Block B" + blockId + " has no label, falling back to " + fallbackLabel);
            return fallbackLabel;
        }
        warn("Block B" + blockId + " has no label and no fallback, emitting unreachable");
        return null;
    }

    // ========== 工具 ==========

    private String reg(int id) {
        if (id < 0) return "undef";
        String r = regs.get(id);
        return r != null ? r : "%v" + id;
    }

    private static String dest(MirInst inst) {
        return "%v" + inst.getDest();
    }

    private void define(MirInst inst, String llvmType) {
        if (inst.hasDest()) valueTypes.put(inst.getDest(), llvmType);
    }

    private String typeOfValue(int id) {
        String t = valueTypes.get(id);
        if (t != null) return t;
        TmlType tml = current.typeOf(id);
        return tml != null ? types.toSized(tml) : null;
    }

    /** 必须有宽度的位置：未知类型退回 i32 */
    private String widthOf(int id) {
        String t = typeOfValue(id);
        if (t == null) {
            warn("No type for value %v" + id + ", defaulting to i32");
            return "i32";
        }
        return t;
    }

    private boolean signed(int id) {
        return !Types.isUnsignedInteger(current.typeOf(id));
    }

    private MirConstant constantOf(int id) {
        if (!literals.contains(id)) return null;
        for (BasicBlock block : current.getBlocks()) {
            for (MirInst inst : block.getInstructions()) {
                if (inst.getOp() == MirOp.CONST && inst.getDest() == id) return inst.extraAs();
            }
        }
        return null;
    }

    /**
     * 整数宽度不一致时插入 sext / zext / trunc；字面量直接按目标宽度书写。
     */
    private String coerce(int id, String expected, boolean signed) {
        String value = reg(id);
        if (literals.contains(id)) return value;
        String actual = typeOfValue(id);
        int from = LlvmTypeMapper.intBits(actual);
        int to = LlvmTypeMapper.intBits(expected);
        if (from < 0 || to < 0 || from == to) return value;
        if (from < to) {
            String tmp = "%ext." + nextTemp();
            line(tmp + " = " + (signed && from > 1 ? "sext " : "zext ") + actual + " " + value + " to " + expected);
            return tmp;
        }
        String tmp = "%trunc." + nextTemp();
        line(tmp + " = trunc " + actual + " " + value + " to " + expected);
        return tmp;
    }

    private static int[] operandsOf(MirInst inst) {
        return inst.getOperands() != null ? inst.getOperands() : new int[0];
    }

    static String symbol(String name) {
        return name.replace("::", "__");
    }

    private static String braced(List<String> parts) {
        return parts.isEmpty() ? "{}" : "{ " + join(parts) + " }";
    }

    private static String join(List<String> parts) {
        return String.join(", ", parts);
    }

    private int nextTemp() {
        return tempCounter++;
    }

    private void line(String text) {
        body.append("  ").append(text).append('\n');
    }

    private void warn(String message) {
        fallbackCount++;
        LOG.warning(message + " (fn " + (current != null ? current.getName() : "?") + ")");
    }
}
