package io.powchain.core.node;

import io.powchain.core.protocol.Block;
import io.powchain.core.protocol.Hashes;
import io.powchain.core.protocol.Transaction;

import java.util.List;

/**
 * Creates unmined genesis blocks.
 * - index = 0
 * - prevHash = 32 zero bytes
 * - nonce = 0, hash = zero until mined
 */
public final class GenesisBuilder {
    public static final long REFERENCE_TIMESTAMP = 1_672_531_200L; // 2023-01-01T00:00:00Z
    public static final String REFERENCE_DATA = "Hello, Blockchain!";

    private GenesisBuilder(){}

    public static Block buildGenesis(String data, List<Transaction> transactions, long timestamp) {
        return Block.builder()
                .index(0)
                .timestamp(timestamp)
                .prevHash(Hashes.zero())
                .transactions(transactions)
                .nonce(0)
                .data(data)
                .build();
    }

    /** Fixed genesis shared by nodes that want identical chains: Alice pays Bob 100. */
    public static Block referenceGenesis() {
        return buildGenesis(REFERENCE_DATA, List.of(new Transaction("Alice", "Bob", 100)), REFERENCE_TIMESTAMP);
    }
}
