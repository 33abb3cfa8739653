package com.contentflow.api.dto;

import lombok.Data;

/**
 * 审批动作请求 DTO（通过、驳回、要求修改）。
 */
@Data
public class SubmissionActionRequestDTO {

    private String userId;
    /** 驳回与要求修改时必填 */
    private String comment;
}
