package com.liveprecision.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundedHistoryTest {

    @Test
    @DisplayName("oldest entry is evicted once capacity is reached")
    void evictsOldest() {
        BoundedHistory<Integer> history = new BoundedHistory<>(3);
        for (int i = 1; i <= 5; i++) {
            history.add(i);
        }
        assertThat(history.snapshot()).containsExactly(3, 4, 5);
    }

    @Test
    void latest_returnsMostRecentInOrder() {
        BoundedHistory<String> history = new BoundedHistory<>(10);
        history.add("a");
        history.add("b");
        history.add("c");
        assertThat(history.latest(2)).containsExactly("b", "c");
        assertThat(history.latest(10)).containsExactly("a", "b", "c");
        assertThat(history.latest(0)).isEmpty();
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new BoundedHistory<>(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
