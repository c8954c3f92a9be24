package com.directiveremover.core.scan;

public enum DirectiveKind {
    IF,
    ELIF,
    ELSE,
    ENDIF,
    /** #region, #pragma, #define, #error, ... */
    OTHER;

    static DirectiveKind fromKeyword(String keyword) {
        return switch (keyword) {
            case "if" -> IF;
            case "elif" -> ELIF;
            case "else" -> ELSE;
            case "endif" -> ENDIF;
            default -> OTHER;
        };
    }
}
