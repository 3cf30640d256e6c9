package com.pharmacy.ecommerce.presentation.common;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;

import java.util.UUID;

/**
 * 공통 요청 헤더
 * - X-USER-ID: 인증 계층이 채워주는 사용자 ID (필수)
 * - X-Correlation-Id: 요청 추적 ID (없으면 생성)
 *
 * 생성한 추적 ID는 요청 속성에 보관해 에러 응답의 request_id와 일치시킨다.
 */
public final class RequestHeaders {

    public static final String USER_ID = "X-USER-ID";
    public static final String CORRELATION_ID = "X-Correlation-Id";

    static final String CORRELATION_ID_ATTRIBUTE = RequestHeaders.class.getName() + ".correlationId";

    private RequestHeaders() {
    }

    public static String resolveCorrelationId(String headerValue) {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (attributes != null) {
            Object resolved = attributes.getAttribute(CORRELATION_ID_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
            if (resolved instanceof String) {
                return (String) resolved;
            }
        }
        String correlationId = isBlank(headerValue) ? UUID.randomUUID().toString() : headerValue;
        if (attributes != null) {
            attributes.setAttribute(CORRELATION_ID_ATTRIBUTE, correlationId, RequestAttributes.SCOPE_REQUEST);
        }
        return correlationId;
    }

    /**
     * 에러 응답용 추적 ID. 컨트롤러가 이미 정한 값이 있으면 그 값을 쓴다.
     */
    public static String currentCorrelationId(HttpServletRequest request) {
        Object resolved = request.getAttribute(CORRELATION_ID_ATTRIBUTE);
        if (resolved instanceof String) {
            return (String) resolved;
        }
        String header = request.getHeader(CORRELATION_ID);
        String correlationId = isBlank(header) ? UUID.randomUUID().toString() : header;
        request.setAttribute(CORRELATION_ID_ATTRIBUTE, correlationId);
        return correlationId;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
