package com.sattline.lint.loader.ast;

import java.util.Locale;

public enum VariableQualifier {
    CONST,
    STATE,
    RETAIN,
    OPSAVE,
    SECURE;

    public static VariableQualifier fromKeyword(String keyword) {
        return valueOf(keyword.toUpperCase(Locale.ROOT));
    }
}
