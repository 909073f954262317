package com.pennywise_sync.importer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TransactionReconcilerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final TransactionReconciler reconciler = new TransactionReconciler(null, null, null, null);

    @Test
    @DisplayName("Records without a deletion flag are marked live without touching the input")
    void prepareMarksLive() throws Exception {
        ObjectNode implicit = (ObjectNode) mapper.readTree("{\"transaction_hash\":\"a\"}");
        ObjectNode nullFlag = (ObjectNode) mapper.readTree("{\"transaction_hash\":\"b\",\"is_deleted\":null}");
        ObjectNode deleted = (ObjectNode) mapper.readTree("{\"transaction_hash\":\"c\",\"is_deleted\":true}");

        List<ObjectNode> prepared = reconciler.prepare(List.of(implicit, nullFlag, deleted));

        assertThat(prepared).hasSize(3);
        assertThat(prepared.get(0).get("is_deleted").asBoolean()).isFalse();
        assertThat(prepared.get(1).get("is_deleted").asBoolean()).isFalse();
        assertThat(prepared.get(2).get("is_deleted").asBoolean()).isTrue();
        assertThat(implicit.has("is_deleted")).isFalse();
    }

    @Test
    @DisplayName("An absent collection stays absent")
    void prepareKeepsNull() {
        assertThat(reconciler.prepare(null)).isNull();
    }
}
