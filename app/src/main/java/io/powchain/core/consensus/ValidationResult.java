package io.powchain.core.consensus;

public final class ValidationResult {
    public final boolean ok;
    public final String message;

    private ValidationResult(boolean ok, String message) {
        this.ok = ok; this.message = message;
    }
    public static ValidationResult ok() { return new ValidationResult(true, null); }
    public static ValidationResult error(String msg) { return new ValidationResult(false, msg); }

    @Override public String toString() {
        return ok ? "OK" : ("ERR: " + message);
    }
}
