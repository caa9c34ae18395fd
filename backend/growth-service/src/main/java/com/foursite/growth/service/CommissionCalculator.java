package com.foursite.growth.service;

import com.foursite.growth.config.CommissionProperties;
import com.foursite.growth.config.CommissionProperties.Breakpoint;
import com.foursite.growth.exception.InvariantViolationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.Period;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Progressive referral commission. The rate steps up on calendar anniversaries of the conversion
 * and never goes down.
 */
@Component
@RequiredArgsConstructor
public class CommissionCalculator {

    public static final int RATE_SCALE = 6;

    private static final double DAYS_PER_YEAR = 365.2425;

    private final CommissionProperties commissionProperties;

    /**
     * Rate for a referral of the given age in years
     */
    public BigDecimal rate(double referralAgeInYears) {
        if (Double.isNaN(referralAgeInYears)) {
            throw new IllegalArgumentException("Referral age must be a number");
        }
        List<Breakpoint> breakpoints = commissionProperties.getBreakpoints();
        BigDecimal rate = breakpoints.get(0).getRate();
        for (Breakpoint breakpoint : breakpoints) {
            if (referralAgeInYears >= years(breakpoint.getAfter())) {
                rate = checkedStep(rate, breakpoint.getRate());
            }
        }
        return rate;
    }

    /**
     * Rate earned at {@code at} by a referral converted at {@code convertedAt}
     */
    public BigDecimal rateAt(Instant convertedAt, Instant at) {
        List<Breakpoint> breakpoints = commissionProperties.getBreakpoints();
        BigDecimal rate = breakpoints.get(0).getRate();
        for (Breakpoint breakpoint : breakpoints) {
            if (!stepStart(convertedAt, breakpoint.getAfter()).isAfter(at)) {
                rate = checkedStep(rate, breakpoint.getRate());
            }
        }
        return rate;
    }

    /**
     * Commission on a period's revenue at the rate the referral earns at {@code now}
     */
    public BigDecimal payable(Instant convertedAt, BigDecimal periodRevenue, Instant now) {
        requireRevenue(periodRevenue);
        BigDecimal amount = periodRevenue.multiply(rateAt(convertedAt, now));
        return boundedRound(amount, periodRevenue);
    }

    /**
     * Charge for one billing period. A period that crosses a rate step is blended by the seconds
     * spent at each rate, counted from the later of the period start and the conversion.
     */
    public PeriodCharge chargeForPeriod(Instant convertedAt, YearMonth period, BigDecimal periodRevenue) {
        requireRevenue(periodRevenue);
        Instant periodStart = period.atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant periodEnd = period.plusMonths(1).atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant billableStart = convertedAt.isAfter(periodStart) ? convertedAt : periodStart;
        if (!billableStart.isBefore(periodEnd)) {
            throw new IllegalArgumentException("Period " + period + " ends before the referral converted");
        }

        BigDecimal totalSeconds = BigDecimal.valueOf(Duration.between(billableStart, periodEnd).getSeconds());
        BigDecimal weighted = BigDecimal.ZERO;
        Instant cursor = billableStart;
        for (Instant boundary : stepStarts(convertedAt)) {
            if (boundary.isAfter(cursor) && boundary.isBefore(periodEnd)) {
                weighted = weighted.add(rateAt(convertedAt, cursor)
                        .multiply(BigDecimal.valueOf(Duration.between(cursor, boundary).getSeconds())));
                cursor = boundary;
            }
        }
        weighted = weighted.add(rateAt(convertedAt, cursor)
                .multiply(BigDecimal.valueOf(Duration.between(cursor, periodEnd).getSeconds())));

        BigDecimal effectiveRate = weighted.divide(totalSeconds, MathContext.DECIMAL128);
        BigDecimal payable = boundedRound(periodRevenue.multiply(effectiveRate), periodRevenue);
        return new PeriodCharge(period.toString(), periodRevenue, effectiveRate.setScale(RATE_SCALE, RoundingMode.HALF_EVEN),
                payable);
    }

    /**
     * The next instant the referral's rate goes up, if any
     */
    public Optional<RateChange> nextRateChange(Instant convertedAt, Instant now) {
        BigDecimal current = rateAt(convertedAt, now);
        for (Instant start : stepStarts(convertedAt)) {
            if (start.isAfter(now)) {
                BigDecimal rate = rateAt(convertedAt, start);
                if (rate.compareTo(current) > 0) {
                    return Optional.of(new RateChange(start, rate));
                }
            }
        }
        return Optional.empty();
    }

    public int currencyScale() {
        return commissionProperties.getCurrencyScale();
    }

    private BigDecimal boundedRound(BigDecimal amount, BigDecimal revenue) {
        int scale = commissionProperties.getCurrencyScale();
        BigDecimal rounded = amount.setScale(scale, RoundingMode.HALF_EVEN);
        if (rounded.compareTo(revenue) > 0) {
            // rounding never pays more than the revenue
            rounded = revenue.setScale(scale, RoundingMode.FLOOR);
        }
        if (rounded.signum() < 0) {
            throw new InvariantViolationException("Negative commission " + rounded + " on revenue " + revenue);
        }
        return rounded;
    }

    private static BigDecimal checkedStep(BigDecimal previous, BigDecimal next) {
        if (next.compareTo(previous) < 0) {
            throw new InvariantViolationException("Commission rate decreased from " + previous + " to " + next);
        }
        return next;
    }

    private static void requireRevenue(BigDecimal revenue) {
        if (revenue == null || revenue.signum() < 0) {
            throw new IllegalArgumentException("Period revenue must be zero or positive");
        }
    }

    /**
     * Step instants in time order. Month and day offsets do not keep their configured order on
     * every calendar (one month after 1 February comes before 30 days after it).
     */
    private List<Instant> stepStarts(Instant convertedAt) {
        return commissionProperties.getBreakpoints().stream()
                .map(breakpoint -> stepStart(convertedAt, breakpoint.getAfter()))
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    private static Instant stepStart(Instant convertedAt, Period after) {
        return convertedAt.atZone(ZoneOffset.UTC).plus(after).toInstant();
    }

    private static double years(Period period) {
        return period.toTotalMonths() / 12.0 + period.getDays() / DAYS_PER_YEAR;
    }

    public record PeriodCharge(String period, BigDecimal baseAmount, BigDecimal rateApplied, BigDecimal payableAmount) {
    }

    public record RateChange(Instant effectiveAt, BigDecimal rate) {
    }
}
