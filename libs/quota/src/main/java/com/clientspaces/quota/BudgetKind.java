package com.clientspaces.quota;

import java.util.Locale;

/**
 * Named category of consumable usage, tracked independently per tenant (e.g. {@code ai-message}).
 *
 * @param name lower-case kebab name, as used in configuration and URLs
 */
public record BudgetKind(String name) {

    public static final BudgetKind AI_MESSAGE = new BudgetKind("ai-message");
    public static final BudgetKind API_CALL = new BudgetKind("api-call");

    public BudgetKind {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("budget kind name must not be null or blank");
        }
        name = name.trim().toLowerCase(Locale.ROOT);
    }

    public static BudgetKind of(String name) {
        return new BudgetKind(name);
    }

    /** Plural unit used in user-facing messages. */
    public String displayUnit() {
        return switch (name) {
            case "ai-message" -> "messages";
            case "api-call" -> "API calls";
            default -> name.replace('-', ' ') + " units";
        };
    }

    @Override
    public String toString() {
        return name;
    }
}
