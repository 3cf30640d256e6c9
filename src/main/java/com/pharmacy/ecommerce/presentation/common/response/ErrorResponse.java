package com.pharmacy.ecommerce.presentation.common.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * 통일된 에러 응답 DTO
 *
 * allowed_transitions는 상태 전이 오류일 때만 포함된다.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    @JsonProperty("error_code")
    private String errorCode;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant timestamp;

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("allowed_transitions")
    private List<String> allowedTransitions;

    public static ErrorResponse of(String errorCode, String errorMessage, String requestId) {
        return ErrorResponse.builder()
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .timestamp(Instant.now())
                .requestId(requestId != null ? requestId : "req-" + UUID.randomUUID().toString().substring(0, 12))
                .build();
    }

    public ErrorResponse withAllowedTransitions(List<String> allowedTransitions) {
        return toBuilder().allowedTransitions(List.copyOf(allowedTransitions)).build();
    }
}
