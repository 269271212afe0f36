package com.meltwater.rxinflight;

/**
 * Decides when a delivered message is acknowledged. Fixed for the lifetime of a consumer.
 */
public enum AcknowledgeMode {

    /**
     * Ack on receipt, before the message is handed to the {@link DeliveryHandler}. Nothing is tracked.
     */
    IMMEDIATELY("immediately"),

    /**
     * Ack once processing finishes, whether it succeeded or failed.
     */
    AFTER_PROCESSING("executionFinishes"),

    /**
     * Ack once processing succeeds, nack if it fails.
     */
    AFTER_SUCCESSFUL_PROCESSING("executionFinishesSuccessfully"),

    /**
     * Ignore the processing outcome. Ack or nack only when {@link Delivery#acknowledger} is called.
     */
    ON_EXPLICIT_SIGNAL("laterMessageNode");

    private final String optionName;

    AcknowledgeMode(String optionName) {
        this.optionName = optionName;
    }

    public String getOptionName() {
        return optionName;
    }

    /**
     * Parses either the enum name or the trigger option name, case insensitive.
     *
     * @throws IllegalArgumentException if the value matches no mode
     */
    public static AcknowledgeMode fromString(String value) {
        if (value != null) {
            for (AcknowledgeMode mode : values()) {
                if (mode.name().equalsIgnoreCase(value) || mode.optionName.equalsIgnoreCase(value)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Unknown acknowledge mode '" + value + "'");
    }
}
