package com.xmas.script.parser;

/** A fault raised while evaluating a parsed program. */
public class XmasRuntimeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public XmasRuntimeException(String message) {
        super(message);
    }
}
