package com.contentflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 团队成员能力项。
 */
public enum TeamCapabilityEnum {

    /**
     * 审批内容
     */
    APPROVE_CONTENT("approve_content");

    private final String code;

    TeamCapabilityEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
