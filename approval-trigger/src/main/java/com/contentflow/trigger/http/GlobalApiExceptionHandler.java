package com.contentflow.trigger.http;

import com.contentflow.api.response.Response;
import com.contentflow.types.enums.ErrorKindEnum;
import com.contentflow.types.enums.ResponseCode;
import com.contentflow.types.exception.AppException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 统一 API 异常处理。
 * <p>
 * 业务异常按异常码与异常类别返回，HTTP 状态保持 200。
 * 基础设施类异常按 ERROR 记录，其余按 WARN 记录。
 * </p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    private static final int MAX_MESSAGE_LENGTH = 300;

    @ExceptionHandler(AppException.class)
    public Response<Object> handleAppException(AppException ex, HttpServletRequest request) {
        String code = StringUtils.defaultIfBlank(ex.getCode(), ResponseCode.UN_ERROR.getCode());
        String info = StringUtils.defaultIfBlank(ex.getInfo(), ResponseCode.UN_ERROR.getInfo());
        ErrorKindEnum kind = ex.getKind();
        if (kind == ErrorKindEnum.INFRASTRUCTURE) {
            log.error("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorKind={}, errorCode={}, errorMessage={}",
                    resolvePath(request), resolveMethod(request), resolveTraceId(), resolveRequestId(),
                    kind, code, truncate(info), ex);
        } else {
            log.warn("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorKind={}, errorCode={}, errorMessage={}",
                    resolvePath(request), resolveMethod(request), resolveTraceId(), resolveRequestId(),
                    kind, code, truncate(info));
        }
        return failure(code, info);
    }

    @ExceptionHandler({
            BindException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public Response<Object> handleBadRequestException(Exception ex, HttpServletRequest request) {
        String info = truncate(StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.ILLEGAL_PARAMETER.getInfo()));
        log.warn("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorKind={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request), resolveMethod(request), resolveTraceId(), resolveRequestId(),
                ErrorKindEnum.VALIDATION, ex.getClass().getSimpleName(), ResponseCode.ILLEGAL_PARAMETER.getCode(), info);
        return failure(ResponseCode.ILLEGAL_PARAMETER.getCode(), info);
    }

    @ExceptionHandler(Exception.class)
    public Response<Object> handleUnknownException(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorKind={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request), resolveMethod(request), resolveTraceId(), resolveRequestId(),
                ErrorKindEnum.INFRASTRUCTURE, ex.getClass().getSimpleName(), ResponseCode.UN_ERROR.getCode(),
                truncate(ex.getMessage()), ex);
        return failure(ResponseCode.UN_ERROR.getCode(), ResponseCode.UN_ERROR.getInfo());
    }

    private Response<Object> failure(String code, String info) {
        return Response.<Object>builder()
                .code(code)
                .info(info)
                .build();
    }

    private String resolvePath(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getRequestURI(), "-");
    }

    private String resolveMethod(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getMethod(), "-");
    }

    private String resolveTraceId() {
        return StringUtils.defaultIfBlank(MDC.get("traceId"), "-");
    }

    private String resolveRequestId() {
        return StringUtils.defaultIfBlank(MDC.get("requestId"), "-");
    }

    private String truncate(String text) {
        if (StringUtils.isBlank(text) || text.length() <= MAX_MESSAGE_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_MESSAGE_LENGTH);
    }
}
