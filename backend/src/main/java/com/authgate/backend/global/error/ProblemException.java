package com.authgate.backend.global.error;

import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    private final ProblemCategory category;
    private final String code;
    private final String detail;

    public ProblemException(ProblemCategory category, String code) {
        this(category, code, null);
    }

    public ProblemException(ProblemCategory category, String code, String detail) {
        super(category.status(), code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.category = category;
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
    }

    public static ProblemException validation(String code, String detail) {
        return new ProblemException(ProblemCategory.VALIDATION, code, detail);
    }

    public static ProblemException authentication(String code, String detail) {
        return new ProblemException(ProblemCategory.AUTHENTICATION, code, detail);
    }

    public static ProblemException conflict(String code, String detail) {
        return new ProblemException(ProblemCategory.CONFLICT, code, detail);
    }

    public static ProblemException notFound(String code, String detail) {
        return new ProblemException(ProblemCategory.NOT_FOUND, code, detail);
    }

    public ProblemCategory getCategory() {
        return category;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }
}
