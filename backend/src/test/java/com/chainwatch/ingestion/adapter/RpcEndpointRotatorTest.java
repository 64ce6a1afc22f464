package com.chainwatch.ingestion.adapter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RpcEndpointRotatorTest {

    @Test
    void nextEndpoint_cyclesInOrder() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of("a", "b", "c"));

        assertThat(List.of(rotator.nextEndpoint(), rotator.nextEndpoint(), rotator.nextEndpoint(),
                rotator.nextEndpoint())).containsExactly("a", "b", "c", "a");
    }

    @Test
    void constructor_rejectsEmptyList() {
        assertThatThrownBy(() -> new RpcEndpointRotator(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
