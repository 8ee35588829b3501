package org.textcurator.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ChunkBalanceStatsTest {

    @Test
    @DisplayName("A sequence is balanced only without outliers and with ratio <= 5")
    void balanced() {
        assertThat(new ChunkBalanceStats(3, 100, 400, 250, 50, 4.0, 0, 0).isBalanced()).isTrue();
        assertThat(new ChunkBalanceStats(3, 100, 600, 250, 50, 6.0, 0, 0).isBalanced()).isFalse();
        assertThat(new ChunkBalanceStats(3, 10, 40, 25, 5, 4.0, 1, 0).isBalanced()).isFalse();
        assertThat(ChunkBalanceStats.empty().isBalanced()).isTrue();
    }
}
