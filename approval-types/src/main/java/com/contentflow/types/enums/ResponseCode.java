package com.contentflow.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义系统中所有API响应的响应码、描述信息以及所属异常类别。
 * </p>
 *
 * @author contentflow
 * @since 2026-03-02
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功", ErrorKindEnum.NONE),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败", ErrorKindEnum.INFRASTRUCTURE),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数", ErrorKindEnum.VALIDATION),

    WORKFLOW_NOT_FOUND("0101", "审批流程不存在", ErrorKindEnum.NOT_FOUND),

    SUBMISSION_NOT_FOUND("0102", "审批提交不存在", ErrorKindEnum.NOT_FOUND),

    EMPTY_APPROVER_GROUP("0201", "审批步骤缺少审批人", ErrorKindEnum.VALIDATION),

    UNAUTHORIZED_APPROVER("0202", "审批人不具备审批权限", ErrorKindEnum.VALIDATION),

    MISSING_REQUIRED_FIELD("0203", "缺少必填字段", ErrorKindEnum.VALIDATION),

    NOT_AN_APPROVER("0301", "当前用户不是该步骤的审批人", ErrorKindEnum.FORBIDDEN),

    ALREADY_APPROVED("0401", "当前用户已审批该步骤", ErrorKindEnum.CONFLICT),

    /** 乐观锁重试耗尽 */
    CONCURRENT_MODIFICATION("0402", "审批提交并发修改冲突", ErrorKindEnum.CONFLICT),

    SUBMISSION_NOT_APPROVED("0501", "内容未通过审批，不能发布", ErrorKindEnum.INVALID_STATE),

    SUBMISSION_NOT_PENDING("0502", "审批提交不处于待审批状态", ErrorKindEnum.INVALID_STATE),

    WORKFLOW_INACTIVE("0503", "审批流程已停用", ErrorKindEnum.INVALID_STATE);

    private final String code;
    private final String info;
    private final ErrorKindEnum kind;

    ResponseCode(String code, String info, ErrorKindEnum kind) {
        this.code = code;
        this.info = info;
        this.kind = kind;
    }

    public static ResponseCode fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ResponseCode value : ResponseCode.values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        return null;
    }

}
