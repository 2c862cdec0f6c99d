package com.github.dimitryivaniuta.gateway.checkout.service.error;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Base class of checkout failures. Each subclass is one failure class with its own HTTP status and a stable
 * {@code code} property in the problem detail.
 */
public abstract class CheckoutException extends ErrorResponseException {

    private final String code;

    protected CheckoutException(HttpStatus status, String code, String detail, Throwable cause) {
        super(status, problem(status, code, detail), cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    @Override
    public String getMessage() {
        return code + ": " + getBody().getDetail();
    }

    private static ProblemDetail problem(HttpStatus status, String code, String detail) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(status, detail);
        pd.setProperty("code", code);
        return pd;
    }
}
