package com.rusticlang.compiler.diagnostic;

/**
 * 编译错误分类。所有错误对当前编译单元都是终止性的。
 */
public enum ErrorKind {
    LEX("LexError"),
    PARSE("ParseError"),
    DUPLICATE_DECLARATION("DuplicateDeclarationError"),
    UNRESOLVED_NAME("UnresolvedNameError"),
    TYPE_MISMATCH("TypeMismatchError"),
    ARITY("ArityError"),
    UNKNOWN_FIELD("UnknownFieldError"),
    USE_AFTER_MOVE("UseAfterMoveError"),
    AMBIGUOUS_OWNERSHIP("AmbiguousOwnershipError"),
    UNKNOWN_BUILTIN("UnknownBuiltinError"),
    IMMUTABLE_ASSIGNMENT("ImmutableAssignmentError"),
    MISSING_FIELD("MissingFieldError"),
    RECURSIVE_STRUCT("RecursiveStructError");

    private final String displayName;

    ErrorKind(String displayName) {
        this.displayName = displayName;
    }

    /** 诊断输出中使用的名称 */
    public String getDisplayName() {
        return displayName;
    }
}
