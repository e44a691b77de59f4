package com.punchclock.backend.global.error;

import org.springframework.http.HttpStatus;

public record ProblemResponse(String type, String title, int status, String detail, String instance, String code) {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:punchclock:";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String normalized = safeCode.toLowerCase().replaceAll("[^a-z0-9\\-_.]+", "-");
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(DEFAULT_TYPE_PREFIX + normalized, httpStatus.getReasonPhrase(), httpStatus.value(),
                safeDetail, instance, safeCode);
    }

    public static ProblemResponse of(ProblemException ex, String instance) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return new ProblemResponse(ex.getProblemType(), status.getReasonPhrase(), status.value(),
                ex.getDetailMessage(), instance, ex.getCode());
    }
}
