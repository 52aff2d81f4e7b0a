package com.tmlang.ir.pass;

import com.tmlang.ir.mir.MirModule;

/**
 * MIR 变换 pass 接口。
 */
public interface MirPass {

    /**
     * Pass 名称。
     */
    String getName();

    /**
     * 对 MIR 模块执行变换。
     */
    MirModule run(MirModule module);
}
