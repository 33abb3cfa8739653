package com.contentflow.api.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 审批接口响应体：code 为 "0000" 表示成功，业务失败时 HTTP 仍返回 200，由 code 区分原因。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Response<T> implements Serializable {

    private static final long serialVersionUID = 7716203948856102354L;

    private String code;

    private String info;

    /** 失败时为空 */
    private T data;

}
