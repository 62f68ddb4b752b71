package com.snuffles.journal.config;

import com.snuffles.journal.service.UnpricedPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

@Data
@Validated
@ConfigurationProperties(prefix = "journal")
public class JournalProperties {

    /** Zone that decides which calendar date "today" is. */
    @NotNull
    private ZoneId zone = ZoneId.of("America/New_York");

    /** Exchange holidays; snapshots are not taken on these dates unless forced. */
    private Set<LocalDate> holidays = new HashSet<>();

    @Valid
    private Lock lock = new Lock();

    @Valid
    private Snapshot snapshot = new Snapshot();

    @Valid
    private Backfill backfill = new Backfill();

    @Valid
    private PriceSource priceSource = new PriceSource();

    @Data
    public static class Lock {
        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration initialBackoff = Duration.ofMillis(200);

        @DecimalMin("1.0")
        private double multiplier = 2.0;

        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(2);
    }

    @Data
    public static class Snapshot {
        @NotNull
        private UnpricedPolicy unpricedPolicy = UnpricedPolicy.SKIP_VALUATION;

        @Valid
        private Schedule schedule = new Schedule();

        @Data
        public static class Schedule {
            private boolean enabled = false;

            @NotBlank
            private String cron = "0 30 16 * * MON-FRI";
        }
    }

    @Data
    public static class Backfill {
        private boolean enabled = false;

        @Min(1)
        private int daysBack = 30;

        /** Historical dates that must already exist for a backfill to be skipped. */
        @Min(0)
        private int requiredExistingDays = 15;

        private long seed = 42L;

        @NotNull
        @PositiveOrZero
        private BigDecimal initialCash = new BigDecimal("10000.00");
    }

    @Data
    public static class PriceSource {
        /** {@code none} or {@code static}. */
        @NotBlank
        private String type = "none";

        private Map<String, BigDecimal> prices = new HashMap<>();
    }
}
