package com.contentflow.domain.submission.model.valobj;

import com.contentflow.types.enums.ApprovalStateEnum;
import com.contentflow.types.enums.ContentTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 提交列表查询条件。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionFilter {

    private String organizationId;

    private ApprovalStateEnum state;

    private ContentTypeEnum contentType;

    private String submittedBy;

    private Integer limit;
}
