package com.dealsim.trigger.http;

import com.dealsim.api.response.Response;
import com.dealsim.types.enums.ResponseCode;
import com.dealsim.types.exception.AppException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps every exception escaping a controller onto the response envelope.
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    private static final int MAX_INFO_LENGTH = 300;

    @ExceptionHandler(AppException.class)
    public Response<Object> handleAppException(AppException ex, HttpServletRequest request) {
        String code = StringUtils.defaultIfBlank(ex.getCode(), ResponseCode.UN_ERROR.getCode());
        String info = StringUtils.defaultIfBlank(ex.getInfo(), ResponseCode.UN_ERROR.getInfo());
        return reject(request, ex, code, info);
    }

    /**
     * Entity transition guards.
     */
    @ExceptionHandler(IllegalStateException.class)
    public Response<Object> handleIllegalStateException(IllegalStateException ex, HttpServletRequest request) {
        return reject(request, ex, ResponseCode.ILLEGAL_STATE.getCode(),
                StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.ILLEGAL_STATE.getInfo()));
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            BindException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public Response<Object> handleBadRequestException(Exception ex, HttpServletRequest request) {
        return reject(request, ex, ResponseCode.ILLEGAL_PARAMETER.getCode(),
                StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.ILLEGAL_PARAMETER.getInfo()));
    }

    @ExceptionHandler(Exception.class)
    public Response<Object> handleUnknownException(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request), resolveMethod(request), mdc("traceId"), mdc("requestId"),
                ex.getClass().getSimpleName(), ResponseCode.UN_ERROR.getCode(),
                StringUtils.abbreviate(ex.getMessage(), MAX_INFO_LENGTH), ex);
        return envelope(ResponseCode.UN_ERROR.getCode(), ResponseCode.UN_ERROR.getInfo());
    }

    private Response<Object> reject(HttpServletRequest request, Exception ex, String code, String info) {
        String message = StringUtils.abbreviate(info, MAX_INFO_LENGTH);
        log.warn("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request), resolveMethod(request), mdc("traceId"), mdc("requestId"),
                ex.getClass().getSimpleName(), code, message);
        return envelope(code, message);
    }

    private Response<Object> envelope(String code, String info) {
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

    private String mdc(String key) {
        return StringUtils.defaultIfBlank(MDC.get(key), "-");
    }
}
