package io.powchain.core.storage;

/** Outcome of {@link ChainStore#append}. Only ACCEPTED mutates the chain. */
public enum AppendResult {
    ACCEPTED,
    REJECTED_POW,
    REJECTED_CONTINUITY,
    DUPLICATE;

    public boolean accepted() {
        return this == ACCEPTED;
    }
}
