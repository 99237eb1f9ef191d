package io.powchain.core.protocol;

public enum ProtocolError {
    INVALID_HEX_LENGTH,
    INVALID_HEX_CHAR,
    INVALID_FORMAT
}
