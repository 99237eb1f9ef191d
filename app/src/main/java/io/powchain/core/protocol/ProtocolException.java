package io.powchain.core.protocol;

/** Structural decode failure of hex text or a block document. */
public final class ProtocolException extends IllegalArgumentException {
    private final ProtocolError error;

    public ProtocolException(ProtocolError error, String message) {
        super(message);
        this.error = error;
    }

    public ProtocolException(ProtocolError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public ProtocolError error() { return error; }

    @Override public String toString() {
        return "ERR[" + error + "]: " + getMessage();
    }
}
