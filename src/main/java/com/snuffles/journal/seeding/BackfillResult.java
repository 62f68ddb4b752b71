package com.snuffles.journal.seeding;

import java.time.LocalDate;
import java.util.List;

/**
 * @param existingDates historical (non-today) dates found before generation
 * @param generatedDates dates written, empty when skipped
 */
public record BackfillResult(boolean skipped, long existingDates, List<LocalDate> generatedDates) {
}
