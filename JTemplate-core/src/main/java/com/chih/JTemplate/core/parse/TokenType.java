package com.chih.JTemplate.core.parse;

public enum TokenType {
    TEXT,
    SUBSTITUTION,
    RAW_SUBSTITUTION,
    IF_OPEN,
    ELSE,
    IF_CLOSE,
    EACH_OPEN,
    EACH_CLOSE
}
