package org.kidoni.randomvars;

public class EvaluationException extends RuntimeException {
    public EvaluationException() {
        super();
    }

    public EvaluationException(final String message) {
        super(message);
    }

    public EvaluationException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public EvaluationException(final Throwable cause) {
        super(cause);
    }

    protected EvaluationException(final String message, final Throwable cause, final boolean enableSuppression, final boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
