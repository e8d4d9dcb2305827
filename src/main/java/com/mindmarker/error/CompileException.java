package com.mindmarker.error;

import lombok.Getter;

/**
 * Base of every terminal failure raised by the marker pipeline.
 * The {@link ErrorKind} is what front ends switch on; the message is for humans.
 */
@Getter
public abstract class CompileException extends Exception {
    private final ErrorKind kind;

    protected CompileException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected CompileException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
