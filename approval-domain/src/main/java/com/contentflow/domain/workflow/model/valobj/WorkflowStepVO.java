package com.contentflow.domain.workflow.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 审批流程步骤值对象（模板定义，不含审批进度）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowStepVO {

    /**
     * 步骤序号，从 1 开始
     */
    private Integer stepNumber;

    /**
     * 审批人 ID 列表，去重且保持顺序
     */
    private List<String> approverIds;

    /**
     * 所需审批数
     */
    private Integer requiredApprovals;

    public List<String> getApproverIds() {
        if (approverIds == null) {
            approverIds = new ArrayList<>();
        }
        return approverIds;
    }
}
