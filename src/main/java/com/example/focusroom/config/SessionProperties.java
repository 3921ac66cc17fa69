package com.example.focusroom.config;

import com.example.focusroom.model.TimerPhase;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Session tuning, bound from {@code focusroom.session.*}.
 *
 * @param focusMinutes          length of a focus countdown
 * @param breakMinutes          length of a break countdown
 * @param baseRatePerSecond     group score rate with nobody distracted
 * @param penaltyPerDistracted  share of the base rate lost per distracted participant
 * @param metricsIntervalMs     cadence of the score tick and state broadcast
 * @param confusionThreshold    brow intensity at or above which a frame counts as confused
 */
@Validated
@ConfigurationProperties(prefix = "focusroom.session")
public record SessionProperties(
        @DefaultValue("25") @Min(1) int focusMinutes,
        @DefaultValue("5") @Min(1) int breakMinutes,
        @DefaultValue("1.0") @PositiveOrZero double baseRatePerSecond,
        @DefaultValue("0.25") @PositiveOrZero double penaltyPerDistracted,
        @DefaultValue("1000") @Positive long metricsIntervalMs,
        @DefaultValue("0.45") @PositiveOrZero @DecimalMax("1.0") double confusionThreshold
) {

    public static SessionProperties defaults() {
        return new SessionProperties(25, 5, 1.0, 0.25, 1000L, 0.45);
    }

    public int durationMinutes(TimerPhase phase) {
        return phase == TimerPhase.BREAK ? breakMinutes : focusMinutes;
    }
}
