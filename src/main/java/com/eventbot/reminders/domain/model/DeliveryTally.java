package com.eventbot.reminders.domain.model;

public record DeliveryTally(
        int delivered,
        int unreachable,
        int failed
) {
    public static DeliveryTally empty() {
        return new DeliveryTally(0, 0, 0);
    }

    public DeliveryTally plus(DeliveryOutcome outcome) {
        return switch (outcome) {
            case DELIVERED -> new DeliveryTally(delivered + 1, unreachable, failed);
            case RECIPIENT_UNREACHABLE -> new DeliveryTally(delivered, unreachable + 1, failed);
            case TRANSIENT_FAILURE -> new DeliveryTally(delivered, unreachable, failed + 1);
        };
    }

    public int total() {
        return delivered + unreachable + failed;
    }
}
