package com.formula.conversion.render;

/**
 * Thrown when a formula cannot be rendered. The message is the diagnostic
 * text of the typesetting toolchain and is forwarded to users as is.
 */
public class RenderException extends Exception {

    public RenderException(String diagnostic) {
        super(diagnostic);
    }

    public RenderException(String diagnostic, Throwable cause) {
        super(diagnostic, cause);
    }

    public String getDiagnostic() {
        return getMessage();
    }
}
