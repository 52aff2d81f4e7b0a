package com.tmlang.ir.mir;

/**
 * 转换种类，与目标 IR 的转换指令一一对应。
 */
public enum CastKind {
    BITCAST("bitcast"),
    TRUNC("trunc"),
    ZEXT("zext"),
    SEXT("sext"),
    FP_TRUNC("fptrunc"),
    FP_EXT("fpext"),
    FP_TO_SI("fptosi"),
    FP_TO_UI("fptoui"),
    SI_TO_FP("sitofp"),
    UI_TO_FP("uitofp"),
    PTR_TO_INT("ptrtoint"),
    INT_TO_PTR("inttoptr");

    private final String llvmName;

    CastKind(String llvmName) {
        this.llvmName = llvmName;
    }

    public String getLlvmName() {
        return llvmName;
    }
}
