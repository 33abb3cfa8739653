package com.contentflow.types.enums;

/**
 * 业务异常类别。
 */
public enum ErrorKindEnum {

    /** 成功，无异常 */
    NONE,

    /** 目标对象不存在 */
    NOT_FOUND,

    /** 入参校验失败，写入前拒绝 */
    VALIDATION,

    /** 操作人无权处理当前步骤 */
    FORBIDDEN,

    /** 重复操作或并发修改冲突 */
    CONFLICT,

    /** 当前状态不允许该操作 */
    INVALID_STATE,

    /** 存储、序列化等基础设施错误 */
    INFRASTRUCTURE
}
