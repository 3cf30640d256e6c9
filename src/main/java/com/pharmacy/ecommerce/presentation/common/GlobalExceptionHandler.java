package com.pharmacy.ecommerce.presentation.common;

import com.pharmacy.ecommerce.common.exception.BizException;
import com.pharmacy.ecommerce.common.exception.ErrorCode;
import com.pharmacy.ecommerce.domain.order.InvalidOrderStateTransitionException;
import com.pharmacy.ecommerce.domain.order.OrderStatus;
import com.pharmacy.ecommerce.presentation.common.response.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * GlobalExceptionHandler - 전역 예외 처리 (Presentation 계층)
 *
 * 에러 응답 형식:
 * {
 *   "error_code": "ORDER_NOT_FOUND",
 *   "error_message": "메시지",
 *   "timestamp": "2026-01-01T12:34:56.000Z",
 *   "request_id": "X-Correlation-Id 값 또는 생성된 ID"
 * }
 *
 * HTTP 상태 코드는 BizException의 ErrorCode가 결정한다.
 * 요청 형식 오류는 모두 400 INVALID_REQUEST로 응답한다.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String INVALID_REQUEST = "INVALID_REQUEST";

    /**
     * 상태 전이 거부 (409) - 허용 가능한 전이 목록 포함
     */
    @ExceptionHandler(InvalidOrderStateTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(InvalidOrderStateTransitionException e,
                                                                 HttpServletRequest request) {
        logger.info("[{}] 상태 전이 거부: {}", e.getErrorCodeValue(), e.getMessage());
        ErrorResponse body = ErrorResponse.of(e.getErrorCodeValue(), e.getMessage(), requestId(request))
                .withAllowedTransitions(e.getAllowedTransitions().stream().map(OrderStatus::name).toList());
        return ResponseEntity.status(e.getStatusCode()).body(body);
    }

    /**
     * 도메인/시스템 예외 - ErrorCode의 상태 코드 사용
     */
    @ExceptionHandler(BizException.class)
    public ResponseEntity<ErrorResponse> handleBizException(BizException e, HttpServletRequest request) {
        if (e.getStatusCode() >= 500) {
            logger.error("[{}] {}", e.getErrorCodeValue(), e.getMessage(), e);
        } else {
            logger.info("[{}] {}", e.getErrorCodeValue(), e.getMessage());
        }
        ErrorResponse body = ErrorResponse.of(e.getErrorCodeValue(), e.getMessage(), requestId(request));
        return ResponseEntity.status(e.getStatusCode()).body(body);
    }

    /**
     * 필수 헤더 누락 (X-USER-ID 등)
     */
    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e,
                                                             HttpServletRequest request) {
        return badRequest("필수 헤더가 없습니다: " + e.getHeaderName(), request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e,
                                                                HttpServletRequest request) {
        return badRequest("필수 파라미터가 없습니다: " + e.getParameterName(), request);
    }

    /**
     * 본문 파싱 실패 (소수 수량, 잘못된 JSON 등)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleNotReadable(HttpMessageNotReadableException e,
                                                           HttpServletRequest request) {
        return badRequest("요청 본문을 읽을 수 없습니다", request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e,
                                                            HttpServletRequest request) {
        return badRequest("파라미터 형식이 올바르지 않습니다: " + e.getName(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e,
                                                          HttpServletRequest request) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .collect(Collectors.joining(", ", "유효하지 않은 필드: ", ""));
        return badRequest(message, request);
    }

    /**
     * 잘못된 요청 파라미터 (400)
     * 예: 알 수 없는 status 필터 값
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException e,
                                                                        HttpServletRequest request) {
        return badRequest(e.getMessage(), request);
    }

    /**
     * 서버 내부 오류 (500)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e, HttpServletRequest request) {
        logger.error("Unhandled exception occurred: ", e);
        ErrorResponse body = ErrorResponse.of(ErrorCode.INTERNAL_SERVER_ERROR.getCode(),
                ErrorCode.INTERNAL_SERVER_ERROR.getMessage(), requestId(request));
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private ResponseEntity<ErrorResponse> badRequest(String message, HttpServletRequest request) {
        logger.debug("잘못된 요청: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(INVALID_REQUEST, message, requestId(request)));
    }

    private String requestId(HttpServletRequest request) {
        return RequestHeaders.currentCorrelationId(request);
    }
}
