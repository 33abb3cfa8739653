package com.contentflow.domain.submission.model.valobj;

/**
 * 提交状态迁移类别。
 */
public enum SubmissionTransitionKind {

    /**
     * 记录一票审批，当前步骤未达到所需审批数
     */
    APPROVAL_RECORDED,

    /**
     * 当前步骤完成，推进到下一步
     */
    STEP_ADVANCED,

    APPROVED,

    REJECTED,

    CHANGES_REQUESTED,

    PUBLISHED;

    /**
     * 是否属于审批动作（通过一票或推进步骤、最终通过）
     */
    public boolean isApproval() {
        return this == APPROVAL_RECORDED || this == STEP_ADVANCED || this == APPROVED;
    }
}
