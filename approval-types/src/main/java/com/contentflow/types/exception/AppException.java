package com.contentflow.types.exception;

import com.contentflow.types.enums.ErrorKindEnum;
import com.contentflow.types.enums.ResponseCode;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 审批业务异常。
 * <p>
 * code 取自 {@link ResponseCode}，异常类别（未找到、校验失败、无权限、冲突、非法状态）由 code 推导，
 * 接口层据此决定日志级别；未登记的 code 一律按基础设施错误处理。
 * </p>
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 2851947730214466091L;

    private String code;

    /** 面向调用方的描述 */
    private String info;

    public AppException(String code, String info) {
        super(info);
        this.code = code;
        this.info = info;
    }

    public AppException(String code, String info, Throwable cause) {
        super(info, cause);
        this.code = code;
        this.info = info;
    }

    public static AppException of(ResponseCode responseCode, String info) {
        return new AppException(responseCode.getCode(), info);
    }

    public ErrorKindEnum getKind() {
        ResponseCode responseCode = ResponseCode.fromCode(code);
        return responseCode == null ? ErrorKindEnum.INFRASTRUCTURE : responseCode.getKind();
    }

    public boolean hasCode(ResponseCode responseCode) {
        return responseCode != null && responseCode.getCode().equals(code);
    }

    @Override
    public String toString() {
        return "AppException{code='" + code + "', kind=" + getKind() + ", info='" + info + "'}";
    }
}
