package com.tmlang.compiler.analysis.env;

import com.tmlang.compiler.analysis.types.TmlType;
import com.tmlang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 枚举定义
 */
public final class EnumDef {
    private final String name;
    private final List<String> typeParams;
    private final List<Variant> variants;
    private final SourceLocation location;

    public EnumDef(String name, List<String> typeParams, List<Variant> variants, SourceLocation location) {
        this.name = name;
        this.typeParams = typeParams != null ? typeParams : Collections.<String>emptyList();
        this.variants = variants;
        this.location = location;
    }

    public String getName() { return name; }
    public List<String> getTypeParams() { return typeParams; }
    public List<Variant> getVariants() { return variants; }
    public SourceLocation getLocation() { return location; }

    public int indexOf(String variantName) {
        for (int i = 0; i < variants.size(); i++) {
            if (variants.get(i).getName().equals(variantName)) return i;
        }
        return -1;
    }

    /** 枚举变体 */
    public static final class Variant {
        private final String name;
        private final List<TmlType> payload;

        public Variant(String name, List<TmlType> payload) {
            this.name = name;
            this.payload = payload != null ? payload : Collections.<TmlType>emptyList();
        }

        public String getName() { return name; }
        public List<TmlType> getPayload() { return payload; }
    }
}
