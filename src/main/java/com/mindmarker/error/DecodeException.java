package com.mindmarker.error;

/**
 * The input bytes are not a decodable image.
 */
public class DecodeException extends CompileException {
    public DecodeException(String message) {
        super(ErrorKind.DECODE, message);
    }

    public DecodeException(String message, Throwable cause) {
        super(ErrorKind.DECODE, message, cause);
    }
}
