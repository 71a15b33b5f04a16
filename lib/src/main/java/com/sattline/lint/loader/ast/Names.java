package com.sattline.lint.loader.ast;

import java.util.Locale;

/** SattLine identifiers are case-insensitive; every symbol table is keyed through {@link #key}. */
public final class Names {

    private Names() {}

    public static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
