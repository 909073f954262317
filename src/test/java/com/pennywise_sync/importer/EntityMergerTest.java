package com.pennywise_sync.importer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EntityMerger field selection")
class EntityMergerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final EntityMerger merger = new EntityMerger(null, null, mapper);

    @Test
    @DisplayName("Only populated, known, mergeable fields take part in an update")
    void providedTransactionFields() throws Exception {
        ObjectNode record = (ObjectNode) mapper.readTree("""
                {"id": 41, "transaction_hash": "abc", "amount": 99.5, "merchant_name": null,
                 "applied_amount": 12, "is_deleted": false, "sync_source": "device"}
                """);

        assertThat(merger.providedProperties(SnapshotEntities.TRANSACTIONS, record))
                .containsExactlyInAnyOrder("transactionHash", "amount", "isDeleted");
    }

    @Test
    @DisplayName("Device ids are merged where they are the primary key")
    void assignedIdIsMergeable() throws Exception {
        ObjectNode record = (ObjectNode) mapper.readTree("""
                {"id": 7, "card_last4": "1234", "nickname": "Travel card"}
                """);

        assertThat(merger.providedProperties(SnapshotEntities.CARDS, record))
                .containsExactlyInAnyOrder("id", "cardLast4", "nickname");
    }

    @Test
    @DisplayName("Decimals compare by value")
    void sameValue() {
        assertThat(EntityMerger.sameValue(new BigDecimal("500.00"), new BigDecimal("500"))).isTrue();
        assertThat(EntityMerger.sameValue(new BigDecimal("500.01"), new BigDecimal("500"))).isFalse();
        assertThat(EntityMerger.sameValue(new BigDecimal("10.56"), new BigDecimal("10.555"))).isTrue();
        assertThat(EntityMerger.sameValue(new BigDecimal("10.55"), new BigDecimal("10.555"))).isFalse();
        assertThat(EntityMerger.sameValue("Food", "Food")).isTrue();
        assertThat(EntityMerger.sameValue(null, "Food")).isFalse();
    }
}
