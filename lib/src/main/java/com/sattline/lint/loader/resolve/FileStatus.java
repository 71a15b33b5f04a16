package com.sattline.lint.loader.resolve;

public enum FileStatus {
    OK,
    PARSE_ERROR,
    UNREADABLE,
    MISSING
}
