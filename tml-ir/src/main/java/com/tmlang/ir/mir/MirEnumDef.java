package com.tmlang.ir.mir;

import com.tmlang.compiler.analysis.types.TmlType;

import java.util.Collections;
import java.util.List;

/**
 * MIR 枚举（带标签联合）。
 */
public class MirEnumDef {

    private final String name;
    private final List<String> typeParams;
    private final List<Variant> variants;

    public MirEnumDef(String name, List<String> typeParams, List<Variant> variants) {
        this.name = name;
        this.typeParams = typeParams != null ? typeParams : Collections.<String>emptyList();
        this.variants = variants;
    }

    public String getName() { return name; }
    public List<String> getTypeParams() { return typeParams; }
    public List<Variant> getVariants() { return variants; }
    public boolean isGeneric() { return !typeParams.isEmpty(); }

    public boolean hasPayload() {
        for (Variant v : variants) {
            if (!v.getPayloadTypes().isEmpty()) return true;
        }
        return false;
    }

    public static class Variant {
        private final String name;
        private final List<TmlType> payloadTypes;

        public Variant(String name, List<TmlType> payloadTypes) {
            this.name = name;
            this.payloadTypes = payloadTypes != null ? payloadTypes : Collections.<TmlType>emptyList();
        }

        public String getName() { return name; }
        public List<TmlType> getPayloadTypes() { return payloadTypes; }
    }
}
