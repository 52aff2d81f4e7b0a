package com.tmlang.compiler.analysis;

/**
 * 诊断错误码。编号与历史版本保持一致，不可复用。
 */
public final class ErrorCodes {

    private ErrorCodes() {}

    public static final String TYPE_MISMATCH = "T001";
    public static final String UNDEFINED_NAME = "T002";
    public static final String ARG_TYPE_MISMATCH = "T003";
    public static final String PARAM_COUNT_MISMATCH = "T004";
    public static final String UNDEFINED_FUNCTION = "T005";
    public static final String UNKNOWN_TYPE = "T006";
    public static final String UNKNOWN_MEMBER = "T007";
    public static final String DUPLICATE_DEFINITION = "T008";
    public static final String RETURN_TYPE_MISMATCH = "T016";
    public static final String BOUND_NOT_SATISFIED = "T026";
    public static final String RESERVED_TYPE_NAME = "T038";
    public static final String CIRCULAR_INHERITANCE = "T039";
    public static final String POOL_ABSTRACT = "T040";
    public static final String SEALED_EXTENDED = "T041";
    public static final String VALUE_VIRTUAL_METHOD = "T042";
    public static final String VALUE_ABSTRACT = "T043";
    public static final String POOL_AND_VALUE = "T044";
    public static final String ABSTRACT_NOT_IMPLEMENTED = "T045";
    public static final String BASE_CLASS_NOT_FOUND = "T046";
    public static final String INTERFACE_NOT_FOUND = "T047";
    public static final String VISIBILITY_VIOLATION = "T048";
    public static final String LIFETIME_BOUND_VIOLATED = "T054";
    public static final String PARAM_TYPE_MISMATCH = "T058";
    public static final String UNINFERRED_TYPE_PARAM = "T059";
    public static final String OVERRIDE_WITHOUT_BASE = "T063";
    public static final String OVERRIDE_NON_VIRTUAL = "T064";
    public static final String OVERRIDE_NOT_FOUND = "T065";

    public static final String CONST_DIVISION_BY_ZERO = "C001";
    public static final String CONST_MODULO_BY_ZERO = "C002";
    public static final String CONST_INVALID_LENGTH = "C003";
    public static final String CONST_NOT_EVALUABLE = "C004";
}
