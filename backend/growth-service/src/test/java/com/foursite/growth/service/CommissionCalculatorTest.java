package com.foursite.growth.service;

import com.foursite.growth.config.CommissionProperties;
import com.foursite.growth.exception.InvariantViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.Period;
import java.time.YearMonth;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommissionCalculatorTest {

    private static final Instant CONVERTED = Instant.parse("2025-10-15T00:00:00Z");

    private CommissionProperties properties;
    private CommissionCalculator calculator;

    @BeforeEach
    void setUp() {
        properties = new CommissionProperties();
        properties.validate();
        calculator = new CommissionCalculator(properties);
    }

    @Test
    void rateStepsUpWithReferralAge() {
        assertThat(calculator.rate(0)).isEqualByComparingTo("0.20");
        assertThat(calculator.rate(0.99)).isEqualByComparingTo("0.20");
        assertThat(calculator.rate(1)).isEqualByComparingTo("0.25");
        assertThat(calculator.rate(3.99)).isEqualByComparingTo("0.25");
        assertThat(calculator.rate(4)).isEqualByComparingTo("0.40");
        assertThat(calculator.rate(25)).isEqualByComparingTo("0.40");
    }

    @Test
    void rateNeverDecreases() {
        BigDecimal previous = BigDecimal.ZERO;
        for (int i = 0; i <= 400; i++) {
            BigDecimal rate = calculator.rate(i * 0.025);
            assertThat(rate).isGreaterThanOrEqualTo(previous);
            previous = rate;
        }
    }

    @Test
    void rateChangesOnTheCalendarAnniversary() {
        assertThat(calculator.rateAt(CONVERTED, Instant.parse("2026-10-14T23:59:59Z"))).isEqualByComparingTo("0.20");
        assertThat(calculator.rateAt(CONVERTED, Instant.parse("2026-10-15T00:00:00Z"))).isEqualByComparingTo("0.25");
        assertThat(calculator.rateAt(CONVERTED, Instant.parse("2029-10-15T00:00:00Z"))).isEqualByComparingTo("0.40");
    }

    @Test
    void payableIsBetweenZeroAndRevenue() {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        for (String revenue : List.of("0", "0.01", "0.125", "99.99", "100.00", "123456.78")) {
            BigDecimal amount = new BigDecimal(revenue);
            BigDecimal payable = calculator.payable(CONVERTED, amount, now);
            assertThat(payable.signum()).isGreaterThanOrEqualTo(0);
            assertThat(payable).isLessThanOrEqualTo(amount);
        }
        assertThat(calculator.payable(CONVERTED, new BigDecimal("100.00"), now)).isEqualByComparingTo("20.00");
    }

    @Test
    void payableRoundsHalfEven() {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");

        // 0.125 * 0.20 = 0.025 -> 0.02
        assertThat(calculator.payable(CONVERTED, new BigDecimal("0.125"), now)).isEqualByComparingTo("0.02");
        // 0.175 * 0.20 = 0.035 -> 0.04
        assertThat(calculator.payable(CONVERTED, new BigDecimal("0.175"), now)).isEqualByComparingTo("0.04");
    }

    @Test
    void negativeRevenueIsRejected() {
        assertThatThrownBy(() -> calculator.payable(CONVERTED, new BigDecimal("-1"), Instant.now()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("a period crossing the first anniversary is billed at a blended rate")
    void periodCrossingAnniversaryIsBlended() {
        CommissionCalculator.PeriodCharge charge = calculator.chargeForPeriod(CONVERTED, YearMonth.of(2026, 10),
                new BigDecimal("100.00"));

        // 14 days at 20% and 17 days at 25%
        assertThat(charge.payableAmount()).isEqualByComparingTo("22.74");
        assertThat(charge.rateApplied()).isEqualByComparingTo("0.227419");
        assertThat(charge.period()).isEqualTo("2026-10");
    }

    @Test
    void periodsBeforeTheAnniversaryKeepTheFirstRate() {
        CommissionCalculator.PeriodCharge charge = calculator.chargeForPeriod(CONVERTED, YearMonth.of(2026, 9),
                new BigDecimal("100.00"));

        assertThat(charge.payableAmount()).isEqualByComparingTo("20.00");
        assertThat(charge.rateApplied()).isEqualByComparingTo("0.200000");
    }

    @Test
    void conversionMonthIsBilledFromTheConversion() {
        CommissionCalculator.PeriodCharge charge = calculator.chargeForPeriod(CONVERTED, YearMonth.of(2025, 10),
                new BigDecimal("50.00"));

        assertThat(charge.payableAmount()).isEqualByComparingTo("10.00");
    }

    @Test
    void periodEndingBeforeConversionIsRejected() {
        assertThatThrownBy(() -> calculator.chargeForPeriod(CONVERTED, YearMonth.of(2025, 9), BigDecimal.TEN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nextRateChangeIsTheNextAnniversaryStep() {
        CommissionCalculator.RateChange change = calculator.nextRateChange(CONVERTED,
                Instant.parse("2026-01-01T00:00:00Z")).orElseThrow();

        assertThat(change.effectiveAt()).isEqualTo(Instant.parse("2026-10-15T00:00:00Z"));
        assertThat(change.rate()).isEqualByComparingTo("0.25");
        assertThat(calculator.nextRateChange(CONVERTED, Instant.parse("2030-01-01T00:00:00Z"))).isEmpty();
    }

    @Test
    void decreasingRateAtRuntimeIsAnInvariantViolation() {
        properties.setBreakpoints(List.of(
                new CommissionProperties.Breakpoint(Period.ZERO, new BigDecimal("0.30")),
                new CommissionProperties.Breakpoint(Period.ofYears(1), new BigDecimal("0.10"))));

        assertThatThrownBy(() -> calculator.rate(2))
                .isInstanceOf(InvariantViolationException.class);
    }

    @Test
    void periodBlendFollowsStepsInTimeOrderWhenMonthAndDayOffsetsCross() {
        properties.setBreakpoints(List.of(
                new CommissionProperties.Breakpoint(Period.ZERO, new BigDecimal("0.20")),
                new CommissionProperties.Breakpoint(Period.ofDays(30), new BigDecimal("0.25")),
                new CommissionProperties.Breakpoint(Period.ofMonths(1), new BigDecimal("0.30"))));
        properties.validate();
        Instant converted = Instant.parse("2026-02-01T12:00:00Z");

        // one month lands on 1 March 12:00, thirty days on 3 March 12:00
        CommissionCalculator.PeriodCharge charge = calculator.chargeForPeriod(converted, YearMonth.of(2026, 3),
                new BigDecimal("3100.00"));

        // half a day at 0.20, the remaining 30.5 days at 0.30
        assertThat(charge.payableAmount()).isEqualByComparingTo("925.00");
        assertThat(charge.rateApplied()).isEqualByComparingTo("0.298387");
    }

    @Test
    void nextRateChangeIsTheEarliestStepNotTheFirstConfigured() {
        properties.setBreakpoints(List.of(
                new CommissionProperties.Breakpoint(Period.ZERO, new BigDecimal("0.20")),
                new CommissionProperties.Breakpoint(Period.ofDays(30), new BigDecimal("0.25")),
                new CommissionProperties.Breakpoint(Period.ofMonths(1), new BigDecimal("0.30"))));
        properties.validate();
        Instant converted = Instant.parse("2026-02-01T12:00:00Z");

        CommissionCalculator.RateChange change = calculator.nextRateChange(converted,
                Instant.parse("2026-02-20T00:00:00Z")).orElseThrow();

        assertThat(change.effectiveAt()).isEqualTo(Instant.parse("2026-03-01T12:00:00Z"));
        assertThat(change.rate()).isEqualByComparingTo("0.30");
        assertThat(calculator.nextRateChange(converted, Instant.parse("2026-03-02T00:00:00Z"))).isEmpty();
    }
}
