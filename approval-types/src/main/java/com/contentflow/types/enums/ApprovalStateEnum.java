package com.contentflow.types.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 审批提交状态枚举
 *
 * @author contentflow
 * @since 2026-03-02
 */
public enum ApprovalStateEnum {

    /**
     * 草稿 - 占位状态，提交时直接进入待审批
     */
    DRAFT("draft"),

    /**
     * 待审批 - 等待当前步骤审批人处理
     */
    PENDING("pending"),

    /**
     * 已通过 - 全部步骤审批完成，等待发布
     */
    APPROVED("approved"),

    /**
     * 已驳回 - 终态
     */
    REJECTED("rejected"),

    /**
     * 需修改 - 非终态，由外部重新提交
     */
    CHANGES_REQUESTED("changes_requested"),

    /**
     * 已发布 - 终态
     */
    PUBLISHED("published");

    private final String code;

    ApprovalStateEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 终态不允许任何审批动作。
     */
    public boolean isTerminal() {
        return this == REJECTED || this == PUBLISHED;
    }

    /**
     * 审批结论已产生（通过、驳回或已发布）。
     */
    public boolean isConcluded() {
        return this == APPROVED || this == REJECTED || this == PUBLISHED;
    }

    @JsonCreator
    public static ApprovalStateEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (ApprovalStateEnum state : ApprovalStateEnum.values()) {
            if (state.code.equalsIgnoreCase(normalized) || state.name().equalsIgnoreCase(normalized)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown approval state code: " + code);
    }
}
