package com.foursite.growth.config;

import com.foursite.growth.exception.InvalidThresholdException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "growth.commission")
@Data
public class CommissionProperties implements InitializingBean {

    // fixed date used to compare calendar periods
    private static final LocalDate REFERENCE_DATE = LocalDate.of(2000, 1, 1);

    /**
     * Rate steps by referral age, first one at age zero
     */
    private List<Breakpoint> breakpoints = new ArrayList<>(List.of(
            new Breakpoint(Period.ZERO, new BigDecimal("0.20")),
            new Breakpoint(Period.ofYears(1), new BigDecimal("0.25")),
            new Breakpoint(Period.ofYears(4), new BigDecimal("0.40"))));

    private int currencyScale = 2;

    @Override
    public void afterPropertiesSet() {
        validate();
    }

    public void validate() {
        if (breakpoints == null || breakpoints.isEmpty()) {
            throw new InvalidThresholdException("growth.commission.breakpoints must not be empty");
        }
        if (currencyScale < 0 || currencyScale > 4) {
            throw new InvalidThresholdException("growth.commission.currency-scale must be within 0..4");
        }
        Breakpoint previous = null;
        for (Breakpoint breakpoint : breakpoints) {
            if (breakpoint.getAfter() == null || breakpoint.getRate() == null) {
                throw new InvalidThresholdException("Commission breakpoint needs both after and rate");
            }
            if (breakpoint.getAfter().isNegative()) {
                throw new InvalidThresholdException("Commission breakpoint age must not be negative: " + breakpoint.getAfter());
            }
            if (breakpoint.getRate().signum() < 0 || breakpoint.getRate().compareTo(BigDecimal.ONE) > 0) {
                throw new InvalidThresholdException("Commission rate must be within [0, 1]: " + breakpoint.getRate());
            }
            if (previous == null) {
                if (!breakpoint.getAfter().isZero()) {
                    throw new InvalidThresholdException("First commission breakpoint must start at age zero");
                }
            } else {
                if (!REFERENCE_DATE.plus(breakpoint.getAfter()).isAfter(REFERENCE_DATE.plus(previous.getAfter()))) {
                    throw new InvalidThresholdException("Commission breakpoint ages must strictly increase: "
                            + previous.getAfter() + " then " + breakpoint.getAfter());
                }
                if (breakpoint.getRate().compareTo(previous.getRate()) < 0) {
                    throw new InvalidThresholdException("Commission rates must not decrease: "
                            + previous.getRate() + " then " + breakpoint.getRate());
                }
            }
            previous = breakpoint;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Breakpoint {
        private Period after;
        private BigDecimal rate;
    }
}
