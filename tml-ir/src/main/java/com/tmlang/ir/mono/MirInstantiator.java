package com.tmlang.ir.mono;

import com.tmlang.compiler.analysis.generic.GenericInstantiator;
import com.tmlang.compiler.analysis.generic.NameMangler;
import com.tmlang.compiler.analysis.types.ClassType;
import com.tmlang.compiler.analysis.types.NamedType;
import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.analysis.types.TypeTransformer;
import com.tmlang.compiler.analysis.types.Types;
import com.tmlang.ir.mir.BasicBlock;
import com.tmlang.ir.mir.MirEnumDef;
import com.tmlang.ir.mir.MirField;
import com.tmlang.ir.mir.MirFunction;
import com.tmlang.ir.mir.MirInst;
import com.tmlang.ir.mir.MirModule;
import com.tmlang.ir.mir.MirOp;
import com.tmlang.ir.mir.MirParam;
import com.tmlang.ir.mir.MirStructDef;
import com.tmlang.ir.mir.MirValue;
import com.tmlang.ir.pass.MirPass;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * MIR 单态化：从具体函数出发，沿泛型调用把模板函数克隆为具体实例。
 * <p>
 * 实例以 {@link NameMangler#mangleFuncName} 命名并按该名字去重，
 * 相同类型实参的重复调用指向同一个实例。泛型结构体 / 枚举按用到的类型实参生成具体布局。
 * 输出模块不含任何泛型模板。
 */
public class MirInstantiator implements MirPass {

    private static final Logger LOG = Logger.getLogger(MirInstantiator.class.getName());

    private final NameMangler mangler;
    private final Map<String, MirFunction> instances = new LinkedHashMap<>();

    public MirInstantiator() {
        this(new NameMangler());
    }

    public MirInstantiator(NameMangler mangler) {
        this.mangler = mangler;
    }

    @Override
    public String getName() {
        return "MirInstantiator";
    }

    public NameMangler getMangler() {
        return mangler;
    }

    /** 已生成的函数实例（实例名 → 函数） */
    public Map<String, MirFunction> getInstances() {
        return Collections.unmodifiableMap(instances);
    }

    @Override
    public MirModule run(MirModule module) {
        Map<String, MirFunction> templates = new LinkedHashMap<>();
        MirModule out = new MirModule(module.getName());
        Deque<MirFunction> worklist = new ArrayDeque<>();

        for (MirFunction f : module.getFunctions()) {
            if (f.isGeneric()) {
                templates.put(f.getName(), f);
            } else {
                out.addFunction(f);
                worklist.add(f);
            }
        }
        for (MirStructDef s : module.getStructs()) {
            if (!s.isGeneric()) out.addStruct(s);
        }
        for (MirEnumDef e : module.getEnums()) {
            if (!e.isGeneric()) out.addEnum(e);
        }

        while (!worklist.isEmpty()) {
            MirFunction func = worklist.poll();
            for (BasicBlock block : func.getBlocks()) {
                List<MirInst> insts = block.getInstructions();
                for (int i = 0; i < insts.size(); i++) {
                    MirInst inst = insts.get(i);
                    if (inst.getOp() != MirOp.CALL) continue;
                    MirInst.CallInfo call = inst.extraAs();
                    if (!call.isGeneric()) continue;
                    MirFunction template = templates.get(call.getFuncName());
                    if (template == null) {
                        // 外部泛型函数：只改名，由链接方提供实例
                        String external = mangler.mangleFuncName(call.getFuncName(), call.getTypeArgs());
                        insts.set(i, inst.withExtra(
                                new MirInst.CallInfo(external, null, call.getArgTypes()), inst.getType()));
                        continue;
                    }
                    String mangled = mangler.mangleFuncName(template.getName(), call.getTypeArgs());
                    boolean fresh = !instances.containsKey(mangled);
                    MirFunction instance = instantiate(template, call.getTypeArgs());
                    if (fresh) {
                        out.addFunction(instance);
                        worklist.add(instance);
                    }
                    insts.set(i, inst.withExtra(
                            new MirInst.CallInfo(instance.getName(), null, call.getArgTypes()), inst.getType()));
                }
            }
        }

        new TypeInstanceCollector(module, out).collect();
        LOG.fine("Monomorphized " + module.getName() + ": " + templates.size() + " templates, "
                + instances.size() + " instances");
        return out;
    }

    /**
     * 以给定类型实参实例化模板；同名实例已存在时直接返回。
     */
    public MirFunction instantiate(MirFunction template, List<TmlType> typeArgs) {
        List<String> params = template.getTypeParams();
        if (typeArgs.size() != params.size()) {
            throw new IllegalArgumentException("Function '" + template.getName() + "' expects "
                    + params.size() + " type arguments but got " + typeArgs.size());
        }
        for (TmlType arg : typeArgs) {
            if (Types.containsGeneric(arg) || Types.containsTypeVar(arg)) {
                throw new IllegalStateException("Unresolved type argument " + arg
                        + " in instantiation of '" + template.getName() + "'");
            }
        }
        String mangled = mangler.mangleFuncName(template.getName(), typeArgs);
        MirFunction existing = instances.get(mangled);
        if (existing != null) return existing;

        Map<String, TmlType> subst = new LinkedHashMap<>();
        for (int i = 0; i < params.size(); i++) {
            subst.put(params.get(i), typeArgs.get(i));
        }
        MirFunction clone = cloneFunction(template, mangled, subst);
        instances.put(mangled, clone);
        LOG.finer("Instantiated " + mangled + " " + subst);
        return clone;
    }

    private static MirFunction cloneFunction(MirFunction template, String name, Map<String, TmlType> subst) {
        MirFunction clone = new MirFunction(name, GenericInstantiator.substitute(template.getReturnType(), subst));
        clone.setPublic(template.isPublic());
        clone.setSret(template.isSret());
        for (MirValue v : template.getValues()) {
            clone.newValue(v.getName(), GenericInstantiator.substitute(v.getType(), subst));
        }
        for (MirParam p : template.getParams()) {
            clone.addParam(new MirParam(p.getName(), GenericInstantiator.substitute(p.getType(), subst), p.getValueId()));
        }
        for (BasicBlock block : template.getBlocks()) {
            BasicBlock copy = new BasicBlock(block.getId(), block.getName());
            for (MirInst inst : block.getInstructions()) {
                copy.addInstruction(inst.withExtra(substituteExtra(inst.getExtra(), subst),
                        GenericInstantiator.substitute(inst.getType(), subst)));
            }
            copy.setTerminator(block.getTerminator());
            clone.addBlock(copy);
        }
        return clone;
    }

    private static Object substituteExtra(Object extra, Map<String, TmlType> subst) {
        if (extra instanceof TmlType) {
            return GenericInstantiator.substitute((TmlType) extra, subst);
        }
        if (extra instanceof MirInst.CallInfo) {
            MirInst.CallInfo c = (MirInst.CallInfo) extra;
            return new MirInst.CallInfo(c.getFuncName(), substituteAll(c.getTypeArgs(), subst),
                    substituteAll(c.getArgTypes(), subst));
        }
        if (extra instanceof MirInst.MethodInfo) {
            MirInst.MethodInfo m = (MirInst.MethodInfo) extra;
            return new MirInst.MethodInfo(GenericInstantiator.substitute(m.getReceiverType(), subst),
                    m.getMethodName(), substituteAll(m.getArgTypes(), subst), m.getVtableSlot());
        }
        if (extra instanceof MirInst.EnumInfo) {
            MirInst.EnumInfo e = (MirInst.EnumInfo) extra;
            return new MirInst.EnumInfo(e.getEnumName(), substituteAll(e.getTypeArgs(), subst),
                    e.getVariantName(), e.getVariantIndex());
        }
        return extra;
    }

    private static List<TmlType> substituteAll(List<TmlType> types, Map<String, TmlType> subst) {
        List<TmlType> result = new ArrayList<>(types.size());
        for (TmlType t : types) {
            result.add(GenericInstantiator.substitute(t, subst));
        }
        return result;
    }

    /**
     * 扫描输出模块中出现的全部类型，为泛型结构体 / 枚举生成具体布局。
     */
    private final class TypeInstanceCollector extends TypeTransformer {
        private final Map<String, MirStructDef> structTemplates = new LinkedHashMap<>();
        private final Map<String, MirEnumDef> enumTemplates = new LinkedHashMap<>();
        private final MirModule out;

        TypeInstanceCollector(MirModule source, MirModule out) {
            this.out = out;
            for (MirStructDef s : source.getStructs()) {
                if (s.isGeneric()) structTemplates.put(s.getName(), s);
            }
            for (MirEnumDef e : source.getEnums()) {
                if (e.isGeneric()) enumTemplates.put(e.getName(), e);
            }
        }

        void collect() {
            if (structTemplates.isEmpty() && enumTemplates.isEmpty()) return;
            // 遍历期间 out 的函数列表不再变化
            for (MirFunction f : out.getFunctions()) {
                transform(f.getReturnType());
                for (MirValue v : f.getValues()) transform(v.getType());
                for (BasicBlock block : f.getBlocks()) {
                    for (MirInst inst : block.getInstructions()) {
                        transform(inst.getType());
                        Object extra = inst.getExtra();
                        if (extra instanceof TmlType) {
                            transform((TmlType) extra);
                        } else if (extra instanceof MirInst.EnumInfo) {
                            MirInst.EnumInfo e = (MirInst.EnumInfo) extra;
                            require(e.getEnumName(), e.getTypeArgs());
                        }
                    }
                }
            }
        }

        @Override
        public TmlType visitNamed(NamedType type) {
            if (type.hasTypeArgs()) require(type.getName(), type.getTypeArgs());
            return super.visitNamed(type);
        }

        @Override
        public TmlType visitClass(ClassType type) {
            if (!type.getTypeArgs().isEmpty()) require(type.getName(), type.getTypeArgs());
            return super.visitClass(type);
        }

        private void require(String base, List<TmlType> typeArgs) {
            if (typeArgs.isEmpty()) return;
            String name = mangler.mangleTypeName(base, typeArgs);
            MirStructDef st = structTemplates.get(base);
            if (st != null && out.findStruct(name) == null) {
                Map<String, TmlType> subst = zip(st.getTypeParams(), typeArgs);
                List<MirField> fields = new ArrayList<>();
                for (MirField field : st.getFields()) {
                    fields.add(new MirField(field.getName(), GenericInstantiator.substitute(field.getType(), subst)));
                }
                out.addStruct(new MirStructDef(name, null, fields));
                for (MirField field : fields) transform(field.getType());
                return;
            }
            MirEnumDef et = enumTemplates.get(base);
            if (et != null && out.findEnum(name) == null) {
                Map<String, TmlType> subst = zip(et.getTypeParams(), typeArgs);
                List<MirEnumDef.Variant> variants = new ArrayList<>();
                for (MirEnumDef.Variant v : et.getVariants()) {
                    variants.add(new MirEnumDef.Variant(v.getName(), substituteAll(v.getPayloadTypes(), subst)));
                }
                out.addEnum(new MirEnumDef(name, null, variants));
                for (MirEnumDef.Variant v : variants) {
                    for (TmlType t : v.getPayloadTypes()) transform(t);
                }
            }
        }

        private Map<String, TmlType> zip(List<String> params, List<TmlType> args) {
            Map<String, TmlType> subst = new LinkedHashMap<>();
            for (int i = 0; i < params.size() && i < args.size(); i++) {
                subst.put(params.get(i), args.get(i));
            }
            return subst;
        }
    }
}
