package com.sattline.lint.loader.ast;

public enum DatatypeKind {
    RECORD,
    ALIAS
}
