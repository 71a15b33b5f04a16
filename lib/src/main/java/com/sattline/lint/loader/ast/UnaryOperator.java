package com.sattline.lint.loader.ast;

public enum UnaryOperator {
    NOT,
    NEGATE
}
