package com.sattline.lint.loader.ast;

public enum CodeSequenceKind {
    EQUATION_BLOCK,
    SEQUENCE,
    OPEN_SEQUENCE
}
