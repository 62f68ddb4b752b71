package com.snuffles.journal.seeding;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.snuffles.journal.config.CorrelationScope;
import com.snuffles.journal.config.JournalProperties;
import com.snuffles.journal.domain.Position;
import com.snuffles.journal.service.LedgerService;
import com.snuffles.journal.service.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Development profile bootstrap: seeds an empty ledger from {@code seed-portfolio.json} and,
 * when enabled, backfills synthetic history for the seeded holdings. Failures abort startup.
 */
@Slf4j
@Component
@Profile("dev")
@RequiredArgsConstructor
public class DevDataSeeder implements ApplicationRunner {

    static final String SEED_RESOURCE = "seed-portfolio.json";
    static final String SEED_REASON = "SEED - Initial position";

    private final LedgerService ledgerService;
    private final SyntheticHistoryGenerator historyGenerator;
    private final JournalProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        try (CorrelationScope scope = CorrelationScope.open()) {
            SeedPortfolio seed = readSeed();

            if (ledgerService.loadState().firstTime()) {
                log.info("Ledger is empty. Seeding {} position(s)...", seed.positions().size());
                seedLedger(seed);
            } else {
                log.info("Ledger already seeded. Skipping.");
            }

            if (properties.getBackfill().isEnabled()) {
                List<Position> basePositions = seed.positions().stream()
                    .map(p -> Position.open(p.ticker(), p.shares(), Money.price(p.buyPrice()), p.stopLoss(),
                        Money.times(p.buyPrice(), p.shares())))
                    .toList();
                Map<String, BigDecimal> basePrices = new LinkedHashMap<>();
                seed.positions().forEach(p -> basePrices.put(p.ticker(), p.buyPrice()));
                historyGenerator.backfillSynthetic(properties.getBackfill().getDaysBack(), basePositions, basePrices);
            }
        }
    }

    private SeedPortfolio readSeed() throws IOException {
        try (InputStream inputStream = new ClassPathResource(SEED_RESOURCE).getInputStream()) {
            return objectMapper.readValue(inputStream, SeedPortfolio.class);
        }
    }

    private void seedLedger(SeedPortfolio seed) {
        if (seed.initialCash() != null && seed.initialCash().signum() > 0) {
            ledgerService.adjustCash(seed.initialCash(), "INITIAL CASH");
        }
        for (SeedPosition position : seed.positions()) {
            ledgerService.applyBuy(position.ticker(), position.shares(), position.buyPrice(), position.stopLoss(), SEED_REASON);
        }
        log.info("Data seeding completed successfully.");
    }
}
