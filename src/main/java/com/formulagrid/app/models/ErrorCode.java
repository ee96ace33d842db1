package com.formulagrid.app.models;

/**
 * The error vocabulary visible to API clients.
 * Rendered in sheet output as "#CODE!".
 */
public enum ErrorCode {
    CYCLE,
    REF,
    PARSE,
    DIV0,
    EVAL;

    public String token() {
        return "#" + name() + "!";
    }
}
