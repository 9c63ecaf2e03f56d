package com.costwatch.analysis.forecast;

import static com.costwatch.analysis.CostRecordFixtures.daily;
import static com.costwatch.analysis.CostRecordFixtures.linear;
import static com.costwatch.analysis.CostRecordFixtures.steady;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.costwatch.analysis.cache.FingerprintCache;
import com.costwatch.analysis.config.CostwatchProperties;
import com.costwatch.analysis.model.CostRecord;
import com.costwatch.analysis.monitoring.AlertPublisher;
import com.costwatch.analysis.series.DailyCostAggregator;
import com.costwatch.analysis.series.TimeSeriesPreparer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ForecastServiceTest {

    private AlertPublisher alertPublisher;
    private FingerprintCache<ForecastReport> cache;
    private ForecastService service;

    private static final ForecastOptions LINEAR_30 = ForecastOptions.defaults()
            .withHorizon(30)
            .withModels(List.of(ForecastModelType.LINEAR));

    @BeforeEach
    void setUp() {
        alertPublisher = mock(AlertPublisher.class);
        cache = new FingerprintCache<>(Duration.ofMinutes(15), 256, ForecastFixtures.CLOCK);
        service = new ForecastService(ForecastFixtures.engine(), new TimeSeriesPreparer(), new DailyCostAggregator(),
                alertPublisher, CostwatchProperties.defaults(), cache);
    }

    private static ForecastOptions realTime(ForecastOptions options) {
        return new ForecastOptions(options.horizon(), options.confidenceLevel(), options.serviceName(),
                options.models(), true, options.accuracyStrategy());
    }

    @Test
    void tooLittleHistoryIsReportedNotThrown() {
        ForecastOutcome outcome = service.generateForecast(daily("Total", steady(10, 100)), ForecastOptions.defaults());

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.status()).isEqualTo(ForecastOutcome.Status.INSUFFICIENT_DATA);
        assertThat(outcome.requiredDataPoints()).isEqualTo(14);
        assertThat(outcome.actualDataPoints()).isEqualTo(10);
        assertThat(outcome.error()).isEqualTo("Insufficient historical data (minimum 14 days required)");
        assertThat(cache.size()).isZero();
    }

    @Test
    void historyIsCountedAfterDailyAggregation() {
        List<CostRecord> records = new ArrayList<>(daily("compute", steady(10, 100)));
        records.addAll(daily("storage", steady(10, 40)));

        ForecastOutcome outcome = service.generateForecast(records, LINEAR_30);

        assertThat(outcome.actualDataPoints()).isEqualTo(10);
    }

    @Test
    void repeatedRequestIsServedFromCache() {
        List<CostRecord> records = daily("Total", linear(30, 100, 10));

        ForecastOutcome first = service.generateForecast(records, LINEAR_30);
        ForecastOutcome second = service.generateForecast(records, LINEAR_30);

        assertThat(first.success()).isTrue();
        assertThat(second.forecast()).isSameAs(first.forecast());
        assertThat(cache.size()).isEqualTo(1);

        service.generateForecast(records, LINEAR_30.withHorizon(14));
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void realTimeForecastPublishesSignificantChange() {
        ForecastOutcome outcome = service.generateForecast(daily("Total", linear(30, 100, 10)), realTime(LINEAR_30));

        assertThat(outcome.forecast().insights().significantChanges()).isNotEmpty();
        verify(alertPublisher).publishForecastChange(outcome.forecast());
    }

    @Test
    void forecastWithoutRealTimeDoesNotPublish() {
        service.generateForecast(daily("Total", linear(30, 100, 10)), LINEAR_30);

        verify(alertPublisher, never()).publishForecastChange(any());
    }

    @Test
    void publisherFailureDoesNotFailTheForecast() {
        doThrow(new IllegalStateException("webhook down")).when(alertPublisher).publishForecastChange(any());

        ForecastOutcome outcome = service.generateForecast(daily("Total", linear(30, 100, 10)), realTime(LINEAR_30));

        assertThat(outcome.success()).isTrue();
    }

    @Test
    void horizonOutsideConfiguredRangeIsRejected() {
        List<CostRecord> records = daily("Total", steady(30, 100));

        assertThatThrownBy(() -> service.generateForecast(records, LINEAR_30.withHorizon(400)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Forecast horizon must be between 7 and 365 days");
        assertThatThrownBy(() -> service.generateForecast(records, LINEAR_30.withHorizon(3)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.generateForecast(records, LINEAR_30.withConfidenceLevel(0.5)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void batchSeparatesSuccessfulAndFailedServices() {
        List<CostRecord> records = new ArrayList<>(daily("compute", linear(20, 100, 2)));
        records.addAll(daily("storage", steady(5, 40)));

        BatchForecastResult result = service.generateBatch(records, List.of(
                LINEAR_30.withServiceName("compute"),
                LINEAR_30.withServiceName("storage")));

        assertThat(result.successful()).extracting(BatchForecastResult.Entry::serviceName).containsExactly("compute");
        assertThat(result.failed()).extracting(BatchForecastResult.Entry::serviceName).containsExactly("storage");
        assertThat(result.failed().get(0).outcome().status()).isEqualTo(ForecastOutcome.Status.INSUFFICIENT_DATA);
        assertThat(result.summary().totalServices()).isEqualTo(2);
        assertThat(result.summary().successCount()).isEqualTo(1);
        assertThat(result.summary().averageAccuracy())
                .isEqualTo(result.successful().get(0).outcome().forecast().ensembleAccuracy());
    }

    @Test
    void batchSizeIsBounded() {
        List<CostRecord> records = daily("Total", steady(20, 100));

        assertThatThrownBy(() -> service.generateBatch(records, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.generateBatch(records, Collections.nCopies(11, LINEAR_30)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Maximum 10 services allowed per batch request");
    }
}
