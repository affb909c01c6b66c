package com.batchflow.types.enums;

/**
 * 作业完成判定策略。
 */
public enum CompletionPolicyEnum {

    /**
     * 所有任务终态且至少一个成功即视为完成
     */
    ANY_SUCCESS,

    /**
     * 所有任务都必须成功才视为完成
     */
    ALL_SUCCESS;

    public static CompletionPolicyEnum fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String normalized = code.trim().replace('-', '_').toUpperCase();
        return CompletionPolicyEnum.valueOf(normalized);
    }
}
