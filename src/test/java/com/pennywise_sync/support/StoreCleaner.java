package com.pennywise_sync.support;

import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Empties every table between integration tests, children first.
 */
public final class StoreCleaner {

    private static final List<String> TABLES = List.of(
            "distribution_logs", "distribution_events", "transfer_logs",
            "import_row_logs", "import_logs",
            "transactions", "categories", "buckets",
            "cards", "account_balances", "subscriptions", "merchant_mappings", "unrecognized_sms",
            "chat_messages", "transaction_rules", "rule_applications", "exchange_rates");

    private StoreCleaner() {
    }

    public static void clean(DatabaseClient client) {
        Flux.fromIterable(TABLES)
                .concatMap(table -> client.sql("DELETE FROM " + table).fetch().rowsUpdated())
                .then()
                .block();
    }
}
