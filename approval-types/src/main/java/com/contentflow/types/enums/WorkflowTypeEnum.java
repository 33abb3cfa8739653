package com.contentflow.types.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 审批流程类型枚举
 *
 * @author contentflow
 * @since 2026-03-02
 */
public enum WorkflowTypeEnum {

    /**
     * 单人审批 - 每个步骤一名审批人通过即可
     */
    SIMPLE("simple"),

    /**
     * 顺序审批 - 多步骤依次审批，每步一人通过即可
     */
    SEQUENTIAL("sequential"),

    /**
     * 并行会签 - 步骤内全部审批人通过才算完成
     */
    PARALLEL("parallel");

    private final String code;

    WorkflowTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 步骤所需审批数：并行会签为审批人数，其余为 1。
     */
    public int requiredApprovals(int approverCount) {
        return this == PARALLEL ? approverCount : 1;
    }

    @JsonCreator
    public static WorkflowTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim();
        for (WorkflowTypeEnum type : WorkflowTypeEnum.values()) {
            if (type.code.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown workflow type code: " + code);
    }
}
