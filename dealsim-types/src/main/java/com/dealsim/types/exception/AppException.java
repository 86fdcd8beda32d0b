package com.dealsim.types.exception;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Application exception.
 * <p>
 * Carries a response code and a human readable description. Business failures are
 * raised through this type so the HTTP layer can map them uniformly.
 * </p>
 *
 * @author dealsim
 * @since 2026-03-02
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 5317680961212299217L;

    /** Response code */
    private String code;

    /** Description */
    private String info;

    /**
     * Creates an AppException carrying only a code.
     *
     * @param code response code
     */
    public AppException(String code) {
        super(code);
        this.code = code;
        this.info = code;
    }

    /**
     * Creates an AppException wrapping a cause.
     *
     * @param code response code
     * @param cause root cause
     */
    public AppException(String code, Throwable cause) {
        super(cause == null ? null : cause.getMessage(), cause);
        this.code = code;
        this.info = cause == null ? null : cause.getMessage();
    }

    /**
     * Creates an AppException with a description.
     *
     * @param code response code
     * @param message description
     */
    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    /**
     * Creates an AppException with a description and a cause.
     *
     * @param code response code
     * @param message description
     * @param cause root cause
     */
    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    @Override
    public String toString() {
        return "com.dealsim.types.exception.AppException{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}
