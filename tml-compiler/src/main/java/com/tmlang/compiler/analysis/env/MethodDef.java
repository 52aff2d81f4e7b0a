package com.tmlang.compiler.analysis.env;

import com.tmlang.compiler.ast.Visibility;

/**
 * 类/接口方法定义
 */
public final class MethodDef {
    private final FuncSig sig;
    private final boolean isStatic;
    private final boolean isVirtual;
    private final boolean isOverride;
    private final boolean isAbstract;
    private final boolean isFinal;
    private final boolean hasDefaultBody;
    private final Visibility visibility;

    public MethodDef(FuncSig sig, boolean isStatic, boolean isVirtual, boolean isOverride,
                     boolean isAbstract, boolean isFinal, boolean hasDefaultBody, Visibility visibility) {
        this.sig = sig;
        this.isStatic = isStatic;
        this.isVirtual = isVirtual;
        this.isOverride = isOverride;
        this.isAbstract = isAbstract;
        this.isFinal = isFinal;
        this.hasDefaultBody = hasDefaultBody;
        this.visibility = visibility;
    }

    public FuncSig getSig() { return sig; }
    public String getName() { return sig.getName(); }
    public boolean isStatic() { return isStatic; }
    public boolean isVirtual() { return isVirtual; }
    public boolean isOverride() { return isOverride; }
    public boolean isAbstract() { return isAbstract; }
    public boolean isFinal() { return isFinal; }
    public boolean hasDefaultBody() { return hasDefaultBody; }
    public Visibility getVisibility() { return visibility; }

    /** 能否被子类覆盖 */
    public boolean isOverridable() {
        return (isVirtual || isAbstract || isOverride) && !isFinal;
    }
}
