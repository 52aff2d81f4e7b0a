package com.tmlang.compiler.analysis.types;

import java.util.List;

/**
 * 类型显示字符串辅助。
 */
final class TypeFormatter {

    private TypeFormatter() {}

    /** [A, B]，空列表返回空串 */
    static String formatArgs(List<TmlType> args) {
        if (args.isEmpty()) return "";
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(args.get(i).toDisplayString());
        }
        return sb.append(']').toString();
    }

    /** (A, B) */
    static String formatParams(List<TmlType> params) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(params.get(i).toDisplayString());
        }
        return sb.append(')').toString();
    }
}
