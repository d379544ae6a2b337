package io.github.samzhu.reach.document;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.LocalDate;

import org.junit.jupiter.api.Test;

class DocumentIdTest {

    @Test
    void measurementShouldCreateCorrectId() {
        // Given
        LocalDate date = LocalDate.of(2025, 1, 14);

        // When
        String finalId = Measurement.createId(date, "vol", "web", "pageimpressions", "at_w_atvol", false);
        String preliminaryId = Measurement.createId(date, "vol", "web", "pageimpressions", "at_w_atvol", true);

        // Then
        assertThat(finalId).isEqualTo("2025-01-14_vol_web_pageimpressions_at_w_atvol_F");
        assertThat(preliminaryId).isEqualTo("2025-01-14_vol_web_pageimpressions_at_w_atvol_P");
    }

    @Test
    void preliminaryAndFinalShouldBeDistinctIdentities() {
        // Given
        LocalDate date = LocalDate.of(2025, 1, 14);

        // When
        Measurement preliminary = Measurement.of("vol", "web", "visits", date, "at_w_atvol",
            100, null, null, null, null, true, null, null);
        Measurement fin = Measurement.of("vol", "web", "visits", date, "at_w_atvol",
            100, null, null, null, null, false, null, null);

        // Then
        assertThat(preliminary.id()).isNotEqualTo(fin.id());
    }

    @Test
    void ofShouldLeaveSystemTimestampsUnset() {
        // When
        Measurement m = Measurement.of("vol", "ios", "pageimpressions", LocalDate.of(2025, 6, 15), "at_i_volat",
            42, 40L, 2L, null, null, false, Instant.parse("2025-06-16T05:00:00Z"), "1.0");

        // Then
        assertThat(m.id()).isEqualTo("2025-06-15_vol_ios_pageimpressions_at_i_volat_F");
        assertThat(m.ingestedAt()).isNull();
        assertThat(m.updatedAt()).isNull();
    }

    @Test
    void alertAcknowledgeShouldKeepOtherFields() {
        // Given
        Instant created = Instant.parse("2025-01-15T06:00:00Z");
        Alert alert = new Alert("a1", "vol", "web", "pageimpressions", LocalDate.of(2025, 1, 14),
            "critical", 3.1, 0.25, 100.0, 5.0, 125.0, 8, true, "CRITICAL", false, null, null, null, created);

        // When
        Alert acked = alert.acknowledge("ops", Instant.parse("2025-01-15T08:00:00Z"));

        // Then
        assertThat(acked.acknowledged()).isTrue();
        assertThat(acked.acknowledgedBy()).isEqualTo("ops");
        assertThat(acked.severity()).isEqualTo("critical");
        assertThat(acked.createdAt()).isEqualTo(created);
    }
}
