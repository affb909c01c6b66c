package com.batchflow.types.enums;

/**
 * 作业列表排序字段。
 */
public enum JobSortFieldEnum {

    CREATED_AT("createdAt"),
    STARTED_AT("startedAt"),
    COMPLETED_AT("completedAt"),
    NAME("name"),
    PRIORITY("priority"),
    STATUS("status"),
    PROGRESS("progress");

    private final String field;

    JobSortFieldEnum(String field) {
        this.field = field;
    }

    public String getField() {
        return field;
    }

    public static JobSortFieldEnum fromField(String field) {
        if (field == null || field.isBlank()) {
            return null;
        }
        for (JobSortFieldEnum value : JobSortFieldEnum.values()) {
            if (value.field.equalsIgnoreCase(field.trim()) || value.name().equalsIgnoreCase(field.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown sort field: " + field);
    }
}
