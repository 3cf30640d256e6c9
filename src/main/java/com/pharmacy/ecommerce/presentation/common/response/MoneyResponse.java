package com.pharmacy.ecommerce.presentation.common.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pharmacy.ecommerce.domain.common.vo.Money;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 금액 응답 (최소 화폐 단위 정수 + 통화)
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class MoneyResponse {

    @JsonProperty("amount")
    private long amount;

    @JsonProperty("currency")
    private String currency;

    public static MoneyResponse from(Money money) {
        return new MoneyResponse(money.getAmount(), money.getCurrency());
    }
}
