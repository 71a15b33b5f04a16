package com.sattline.lint.loader.ast;

public enum LiteralKind {
    INTEGER,
    REAL,
    STRING,
    BOOLEAN
}
