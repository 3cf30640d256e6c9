package com.pharmacy.ecommerce.domain.common.vo;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Objects;

/**
 * Money Value Object
 *
 * 최소 화폐 단위(예: paise, cent)의 정수 금액과 ISO-4217 통화 코드로 표현되는 값 객체입니다.
 *
 * 특징:
 * - Immutable: 모든 연산은 새로운 Money를 반환
 * - 0 이상의 금액만 허용
 * - 서로 다른 통화 간 연산은 IllegalArgumentException
 * - 실수 배수 곱셈은 최소 단위로 반올림(HALF_UP)
 */
public final class Money implements Comparable<Money>, Serializable {
    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_CURRENCY = "INR";

    private final long amount;
    private final String currency;

    private Money(long amount, String currency) {
        if (amount < 0) {
            throw new IllegalArgumentException("금액은 음수가 될 수 없습니다: " + amount);
        }
        if (currency == null || !currency.matches("[A-Za-z]{3}")) {
            throw new IllegalArgumentException("유효하지 않은 통화 코드입니다: " + currency);
        }
        this.amount = amount;
        this.currency = currency.toUpperCase(Locale.ROOT);
    }

    public static Money of(long amount, String currency) {
        return new Money(amount, currency);
    }

    public static Money of(long amount) {
        return new Money(amount, DEFAULT_CURRENCY);
    }

    public static Money zero(String currency) {
        return new Money(0L, currency);
    }

    public long getAmount() {
        return amount;
    }

    public String getCurrency() {
        return currency;
    }

    public Money add(Money other) {
        assertSameCurrency(other);
        return new Money(Math.addExact(this.amount, other.amount), currency);
    }

    /**
     * @throws IllegalArgumentException 결과가 음수가 되는 경우
     */
    public Money subtract(Money other) {
        assertSameCurrency(other);
        long result = this.amount - other.amount;
        if (result < 0) {
            throw new IllegalArgumentException(
                    String.format("음수 금액이 될 수 없습니다: %d - %d = %d", this.amount, other.amount, result)
            );
        }
        return new Money(result, currency);
    }

    public Money multiply(long multiplier) {
        if (multiplier < 0) {
            throw new IllegalArgumentException("배수는 음수가 될 수 없습니다: " + multiplier);
        }
        return new Money(Math.multiplyExact(this.amount, multiplier), currency);
    }

    /**
     * 실수 배수를 곱한 뒤 최소 화폐 단위로 반올림합니다.
     */
    public Money multiply(double multiplier) {
        if (multiplier < 0.0 || Double.isNaN(multiplier) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException("배수는 0 이상의 유한한 값이어야 합니다: " + multiplier);
        }
        long result = BigDecimal.valueOf(amount)
                .multiply(BigDecimal.valueOf(multiplier))
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
        return new Money(result, currency);
    }

    public boolean isZero() {
        return amount == 0;
    }

    public boolean isSameCurrency(Money other) {
        return other != null && currency.equals(other.currency);
    }

    private void assertSameCurrency(Money other) {
        Objects.requireNonNull(other, "other는 null이 될 수 없습니다");
        if (!isSameCurrency(other)) {
            throw new IllegalArgumentException(
                    String.format("통화가 일치하지 않습니다: %s vs %s", currency, other.currency)
            );
        }
    }

    @Override
    public int compareTo(Money other) {
        assertSameCurrency(other);
        return Long.compare(this.amount, other.amount);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Money)) {
            return false;
        }
        Money other = (Money) obj;
        return this.amount == other.amount && this.currency.equals(other.currency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount, currency);
    }

    @Override
    public String toString() {
        return String.format("Money(%,d %s)", amount, currency);
    }
}
