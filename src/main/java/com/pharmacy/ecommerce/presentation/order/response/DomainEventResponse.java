package com.pharmacy.ecommerce.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DomainEventResponse {

    @JsonProperty("type")
    private String type;

    @JsonProperty("occurred_at")
    private LocalDateTime occurredAt;

    @JsonProperty("correlation_id")
    private String correlationId;
}
