package com.contentflow.api.dto;

import lombok.Data;

/**
 * 发布确认请求 DTO。
 */
@Data
public class SubmissionPublishRequestDTO {

    private String publishedBy;
}
