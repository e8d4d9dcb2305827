package com.mindmarker.error;

/**
 * A collaborator (codec, detector) failed in a way the input does not explain.
 */
public class InternalException extends CompileException {
    public InternalException(String message) {
        super(ErrorKind.INTERNAL, message);
    }

    public InternalException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL, message, cause);
    }
}
