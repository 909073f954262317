package com.pennywise_sync.backup.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;

import java.util.List;

/**
 * Entity collections of a backup. Records stay as raw JSON objects because the device
 * only writes the fields it populated; a null list means the collection was not exported.
 */
@Builder
public record DatabaseSnapshot(
        List<ObjectNode> transactions,
        List<ObjectNode> categories,
        List<ObjectNode> cards,
        @JsonProperty("account_balances") List<ObjectNode> accountBalances,
        List<ObjectNode> subscriptions,
        @JsonProperty("merchant_mappings") List<ObjectNode> merchantMappings,
        @JsonProperty("unrecognized_sms") List<ObjectNode> unrecognizedSms,
        @JsonProperty("chat_messages") List<ObjectNode> chatMessages,
        @JsonProperty("transaction_rules") List<ObjectNode> transactionRules,
        @JsonProperty("rule_applications") List<ObjectNode> ruleApplications,
        @JsonProperty("exchange_rates") List<ObjectNode> exchangeRates
) {}
