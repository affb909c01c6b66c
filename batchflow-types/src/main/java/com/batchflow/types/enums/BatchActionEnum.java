package com.batchflow.types.enums;

/**
 * 作业控制动作，单个作业与批量操作共用。
 */
public enum BatchActionEnum {

    START("start"),
    PAUSE("pause"),
    RESUME("resume"),
    CANCEL("cancel"),
    RETRY("retry"),
    DELETE("delete");

    private final String code;

    BatchActionEnum(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static BatchActionEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (BatchActionEnum action : BatchActionEnum.values()) {
            if (action.code.equalsIgnoreCase(code.trim())) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown job action: " + code);
    }
}
