package me.christianrobert.onig2js.transformer.context;

/**
 * Categories of recoverable conversion problems. Each warning still leaves a
 * complete, parseable pattern behind.
 */
public enum WarningCategory {
    UNSUPPORTED_PROPERTY("unsupported-property"),
    NESTED_NEGATIVE_SET("nested-negative-set"),
    SET_INTERSECTION("set-intersection"),
    ASTRAL_PLANE_SET_MEMBER("astral-plane-set-member"),
    NONHEX_IN_NEGATIVE_SET("nonhex-in-negative-set"),
    PROPERTY_IN_NEGATIVE_SET("property-in-negative-set"),
    VARIABLE_LENGTH_ABSENCE("variable-length-absence"),
    NESTED_ATOMIC_GROUP("nested-atomic-group"),
    ENCODING_OPTIONS("encoding-options"),
    LOOKBEHIND("lookbehind"),
    UNKNOWN_NODE("unknown-node"),
    UNKNOWN_GROUP("unknown-group"),
    NESTED_CASE_INSENSITIVE_RANGE("nested-case-insensitive-range"),
    NESTED_CASE_SENSITIVE("nested-case-sensitive"),
    UNRESOLVED_BACKREFERENCE("unresolved-backreference"),
    UNSUPPORTED_TYPE("unsupported-type"),
    UNSUPPORTED_ANCHOR("unsupported-anchor");

    private final String code;

    WarningCategory(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
