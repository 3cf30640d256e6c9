package com.pharmacy.ecommerce.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 주문 상세 응답. compliance는 처방 상품이 있을 때만 포함된다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderDetailResponse {

    @JsonProperty("order")
    private OrderResponse order;

    @JsonProperty("requires_prescription")
    private boolean requiresPrescription;

    @JsonProperty("compliance")
    private Compliance compliance;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Compliance {
        @JsonProperty("requires_prescription")
        private boolean requiresPrescription;

        @JsonProperty("status")
        private String status;

        @JsonProperty("prescriptions")
        private List<Prescription> prescriptions;

        @JsonProperty("consultations")
        private List<Consultation> consultations;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Prescription {
        @JsonProperty("id")
        private String id;

        @JsonProperty("status")
        private String status;

        @JsonProperty("rejection_reason")
        private String rejectionReason;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Consultation {
        @JsonProperty("id")
        private String id;

        @JsonProperty("status")
        private String status;
    }
}
