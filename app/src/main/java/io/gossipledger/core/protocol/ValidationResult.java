package io.gossipledger.core.protocol;

public final class ValidationResult {
    private static final ValidationResult OK = new ValidationResult(true, null, null);

    public final boolean ok;
    public final ValidationError error;
    public final String message;

    private ValidationResult(boolean ok, ValidationError error, String message) {
        this.ok = ok; this.error = error; this.message = message;
    }
    public static ValidationResult ok() { return OK; }
    public static ValidationResult error(ValidationError e, String msg) { return new ValidationResult(false, e, msg); }

    @Override public String toString() {
        return ok ? "OK" : ("ERR["+error+"]: "+message);
    }
}
