package com.contentflow.types.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 待审批内容类型。
 */
public enum ContentTypeEnum {

    POST("post"),

    CAMPAIGN("campaign"),

    MEDIA("media");

    private final String code;

    ContentTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ContentTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (ContentTypeEnum type : ContentTypeEnum.values()) {
            if (type.code.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown content type code: " + code);
    }
}
