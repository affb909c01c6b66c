package com.batchflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 作业优先级
 */
public enum JobPriorityEnum {

    LOW("low", 1),
    NORMAL("normal", 2),
    HIGH("high", 3),
    URGENT("urgent", 4);

    private final String code;
    private final int weight;

    JobPriorityEnum(String code, int weight) {
        this.code = code;
        this.weight = weight;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getWeight() {
        return weight;
    }

    public static JobPriorityEnum fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        for (JobPriorityEnum priority : JobPriorityEnum.values()) {
            if (priority.code.equalsIgnoreCase(code.trim())) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown job priority code: " + code);
    }
}
