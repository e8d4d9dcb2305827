package com.mindmarker.error;

import lombok.Getter;

@Getter
public class FormatException extends CompileException {
    private final FormatCheck check;

    public FormatException(FormatCheck check, String message) {
        super(ErrorKind.FORMAT, check + ": " + message);
        this.check = check;
    }
}
