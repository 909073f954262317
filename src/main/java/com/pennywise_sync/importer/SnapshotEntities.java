package com.pennywise_sync.importer;

import com.pennywise_sync.model.*;

/**
 * Natural keys of every collection in a PennyWise backup.
 */
public final class SnapshotEntities {

    public static final EntityDescriptor<Category> CATEGORIES =
            EntityDescriptor.generatedId(Category.class, "categories", "name")
                    .managing("bucketId");

    public static final EntityDescriptor<Card> CARDS =
            EntityDescriptor.assignedId(Card.class, "cards", "id");

    public static final EntityDescriptor<Transaction> TRANSACTIONS =
            EntityDescriptor.generatedId(Transaction.class, "transactions", "transactionHash")
                    .managing("appliedBucketId", "appliedAmount");

    public static final EntityDescriptor<AccountBalance> ACCOUNT_BALANCES =
            EntityDescriptor.generatedId(AccountBalance.class, "account_balances", "bankName", "accountLast4", "timestamp");

    public static final EntityDescriptor<Subscription> SUBSCRIPTIONS =
            EntityDescriptor.assignedId(Subscription.class, "subscriptions", "id");

    public static final EntityDescriptor<MerchantMapping> MERCHANT_MAPPINGS =
            EntityDescriptor.assignedId(MerchantMapping.class, "merchant_mappings", "merchantName");

    public static final EntityDescriptor<UnrecognizedSms> UNRECOGNIZED_SMS =
            EntityDescriptor.generatedId(UnrecognizedSms.class, "unrecognized_sms", "sender", "smsBody");

    public static final EntityDescriptor<ChatMessage> CHAT_MESSAGES =
            EntityDescriptor.assignedId(ChatMessage.class, "chat_messages", "id");

    public static final EntityDescriptor<TransactionRule> TRANSACTION_RULES =
            EntityDescriptor.assignedId(TransactionRule.class, "transaction_rules", "id");

    public static final EntityDescriptor<RuleApplication> RULE_APPLICATIONS =
            EntityDescriptor.assignedId(RuleApplication.class, "rule_applications", "id");

    public static final EntityDescriptor<ExchangeRate> EXCHANGE_RATES =
            EntityDescriptor.generatedId(ExchangeRate.class, "exchange_rates", "fromCurrency", "toCurrency");

    private SnapshotEntities() {
    }
}
