package io.github.samzhu.reach.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import io.github.samzhu.reach.anomaly.AnomalyConfig;
import io.github.samzhu.reach.anomaly.AnomalyDetector;
import io.github.samzhu.reach.anomaly.AnomalyResult;
import io.github.samzhu.reach.anomaly.MetricSubject;
import io.github.samzhu.reach.anomaly.Severity;
import io.github.samzhu.reach.client.Metric;
import io.github.samzhu.reach.config.ReachProperties;
import io.github.samzhu.reach.config.ReachProperties.SiteConfig;
import io.github.samzhu.reach.document.Alert;
import io.github.samzhu.reach.document.Measurement;
import io.github.samzhu.reach.dto.api.AnomalyCheckResult;
import io.github.samzhu.reach.event.AlertEventPublisher;
import io.github.samzhu.reach.repository.InMemoryMeasurementStore;

class AnomalyCheckServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-15T06:30:00Z");
    private static final LocalDate TARGET = LocalDate.of(2025, 1, 14);

    private InMemoryMeasurementStore store;
    private AlertService alertService;
    private AlertEventPublisher publisher;
    private AnomalyCheckService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new InMemoryMeasurementStore(clock);
        alertService = mock(AlertService.class);
        publisher = mock(AlertEventPublisher.class);

        IngestionService ingestionService = mock(IngestionService.class);
        when(ingestionService.configuredMetrics()).thenReturn(List.of(Metric.PAGE_IMPRESSIONS));

        ReachProperties properties = new ReachProperties(null, null, null, null, null, List.of(
            new SiteConfig("at_w_atvol", "vol", "web", null),
            new SiteConfig("at_w_atvol_m", "vol", "web", null),
            new SiteConfig("at_w_atvienna", "vienna", "web", null)), null);

        service = new AnomalyCheckService(properties, ingestionService,
            new MeasurementQueryService(store), new AnomalyDetector(), AnomalyConfig.defaults(),
            alertService, publisher, clock);
    }

    /**
     * 寫入 56 天穩定的基準與目標日數值。
     */
    private void seedHistory(String brand, String siteId, long targetValue) {
        for (int i = 1; i <= 56; i++) {
            long value = 1000 + (i % 5) * 10;
            store.upsertAll(List.of(measurement(brand, siteId, TARGET.minusDays(i), value)));
        }
        store.upsertAll(List.of(measurement(brand, siteId, TARGET, targetValue)));
    }

    private static Measurement measurement(String brand, String siteId, LocalDate date, long value) {
        return Measurement.of(brand, "web", "pageimpressions", date, siteId,
            value, null, null, null, null, false, null, "1.0");
    }

    private static Alert alertFor(MetricSubject subject, String id) {
        return new Alert(id, subject.brand(), subject.surface(), subject.metric(), TARGET, "critical",
            9.0, 0.5, 1020.0, 10.0, 1500.0, 8, true, "above median",
            false, null, null, null, NOW);
    }

    @Test
    void subjectsShouldCollapseSitesOfSameBrandAndSurface() {
        assertThat(service.subjects()).containsExactly(
            new MetricSubject("vol", "web", "pageimpressions"),
            new MetricSubject("vienna", "web", "pageimpressions"));
    }

    @Test
    void spikeShouldCreateAlertPublishAndMarkNotified() {
        // Given
        seedHistory("vol", "at_w_atvol", 1500);
        MetricSubject vol = new MetricSubject("vol", "web", "pageimpressions");
        when(alertService.saveAlert(eq(vol), eq(TARGET), any(AnomalyResult.class))).thenReturn(alertFor(vol, "a1"));
        when(publisher.publish(any(Alert.class))).thenReturn(true);
        ArgumentCaptor<AnomalyResult> result = ArgumentCaptor.forClass(AnomalyResult.class);

        // When
        AnomalyCheckResult check = service.checkDate(TARGET);

        // Then
        assertThat(check.subjectsChecked()).isEqualTo(2);
        assertThat(check.evaluated()).isEqualTo(1);
        assertThat(check.alerts()).extracting(Alert::id).containsExactly("a1");
        assertThat(check.errors()).isEmpty();

        verify(alertService).saveAlert(eq(vol), eq(TARGET), result.capture());
        assertThat(result.getValue().severity()).isEqualTo(Severity.CRITICAL);
        assertThat(result.getValue().weekdayAdjusted()).isTrue();
        assertThat(result.getValue().dataPoints()).isEqualTo(8);
        verify(alertService).markNotified("a1", NOW);
    }

    @Test
    void failedPublishShouldLeaveAlertUnnotified() {
        // Given
        seedHistory("vol", "at_w_atvol", 1500);
        MetricSubject vol = new MetricSubject("vol", "web", "pageimpressions");
        when(alertService.saveAlert(eq(vol), eq(TARGET), any(AnomalyResult.class))).thenReturn(alertFor(vol, "a1"));
        when(publisher.publish(any(Alert.class))).thenReturn(false);

        // When
        AnomalyCheckResult check = service.checkDate(TARGET);

        // Then
        assertThat(check.alerts()).hasSize(1);
        verify(alertService, never()).markNotified(anyString(), any(Instant.class));
    }

    @Test
    void normalValueShouldNotPublish() {
        // Given
        seedHistory("vol", "at_w_atvol", 1020);
        when(alertService.saveAlert(any(MetricSubject.class), eq(TARGET), any(AnomalyResult.class)))
            .thenReturn(null);

        // When
        AnomalyCheckResult check = service.checkDate(TARGET);

        // Then
        assertThat(check.evaluated()).isEqualTo(1);
        assertThat(check.alerts()).isEmpty();
        verify(publisher, never()).publish(any(Alert.class));
    }

    @Test
    void missingSiteOnTargetDateShouldNotRaiseDropAlert() {
        // Given: the mobile site has history but no value for the target date yet
        seedHistory("vol", "at_w_atvol", 1020);
        for (int i = 1; i <= 56; i++) {
            store.upsertAll(List.of(measurement("vol", "at_w_atvol_m", TARGET.minusDays(i), 3000)));
        }

        // When
        AnomalyCheckResult check = service.checkDate(TARGET);

        // Then
        assertThat(check.evaluated()).isZero();
        assertThat(check.alerts()).isEmpty();
        assertThat(check.errors()).isEmpty();
        verify(alertService, never()).saveAlert(any(MetricSubject.class), any(LocalDate.class),
            any(AnomalyResult.class));
    }

    @Test
    void failureOnOneSubjectShouldNotStopOthers() {
        // Given
        seedHistory("vol", "at_w_atvol", 1500);
        seedHistory("vienna", "at_w_atvienna", 1500);
        MetricSubject vienna = new MetricSubject("vienna", "web", "pageimpressions");
        when(alertService.saveAlert(eq(new MetricSubject("vol", "web", "pageimpressions")), eq(TARGET),
            any(AnomalyResult.class))).thenThrow(new IllegalStateException("alerts collection unavailable"));
        when(alertService.saveAlert(eq(vienna), eq(TARGET), any(AnomalyResult.class)))
            .thenReturn(alertFor(vienna, "a2"));
        when(publisher.publish(any(Alert.class))).thenReturn(true);

        // When
        AnomalyCheckResult check = service.checkDate(TARGET);

        // Then
        assertThat(check.errors()).containsExactly("vol/web/pageimpressions: alerts collection unavailable");
        assertThat(check.alerts()).extracting(Alert::id).containsExactly("a2");
        verify(publisher, times(1)).publish(any(Alert.class));
    }
}
