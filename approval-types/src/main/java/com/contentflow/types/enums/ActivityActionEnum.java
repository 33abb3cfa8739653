package com.contentflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 团队操作日志动作枚举
 */
public enum ActivityActionEnum {

    WORKFLOW_CREATED("workflow_created"),

    /**
     * 流程停用（软删除）
     */
    WORKFLOW_DELETED("workflow_deleted"),

    CONTENT_SUBMITTED("content_submitted"),

    /**
     * 中间步骤通过或记录了一票审批
     */
    STEP_APPROVED("step_approved"),

    /**
     * 最后一步达成审批数，内容通过
     */
    CONTENT_APPROVED("content_approved"),

    CONTENT_REJECTED("content_rejected"),

    CHANGES_REQUESTED("changes_requested"),

    CONTENT_PUBLISHED("content_published");

    private final String code;

    ActivityActionEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ActivityActionEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ActivityActionEnum action : ActivityActionEnum.values()) {
            if (action.code.equals(code)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown activity action code: " + code);
    }
}
