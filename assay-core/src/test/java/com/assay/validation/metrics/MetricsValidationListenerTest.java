package com.assay.validation.metrics;

import com.assay.validation.api.model.ValidationResult;
import com.assay.validation.config.ValidationPipelineConfig;
import com.assay.validation.pipeline.ValidationPipeline;
import com.assay.validation.rules.Rules;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricsValidationListenerTest {

    private InMemoryMetricsRegistry metrics;
    private ValidationPipeline pipeline;

    @BeforeEach
    void setUp() {
        metrics = new InMemoryMetricsRegistry();
        pipeline = new ValidationPipeline(ValidationPipelineConfig.defaults());
        pipeline.addListener(new MetricsValidationListener(metrics));
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
    }

    @Test
    @DisplayName("Should count validations, rule outcomes and cache traffic")
    void shouldTranslateEventsIntoMetrics() {
        pipeline.addRule(Rules.range("temperature", 0, 100));

        pipeline.validate(50).join();
        pipeline.validate(150).join();
        pipeline.validate(150).join();

        assertThat(metrics.getCounterValue(MetricsValidationListener.VALIDATIONS, "outcome", "valid")).isEqualTo(1);
        assertThat(metrics.getCounterValue(MetricsValidationListener.VALIDATIONS, "outcome", "invalid")).isEqualTo(2);
        assertThat(metrics.getCounterValue(MetricsValidationListener.VALIDATION_ERRORS)).isEqualTo(2);
        assertThat(metrics.getCounterValue(MetricsValidationListener.RULE_EXECUTIONS,
                "rule", "temperature", "outcome", "invalid")).isEqualTo(2);
        assertThat(metrics.getCounterValue(MetricsValidationListener.CACHE_MISSES)).isEqualTo(2);
        assertThat(metrics.getCounterValue(MetricsValidationListener.CACHE_HITS)).isEqualTo(1);
        assertThat(metrics.getTimerRecordings(MetricsValidationListener.VALIDATION_DURATION)).hasSize(3);
        // cached executions are not timed
        assertThat(metrics.getTimerRecordings(MetricsValidationListener.RULE_DURATION, "rule", "temperature"))
                .hasSize(2);
    }

    @Test
    @DisplayName("Should track registered validators and rules as gauges")
    void shouldTrackRegistrations() {
        pipeline.addRule(Rules.range("temperature", 0, 100));
        pipeline.addRule(Rules.range("pressure", 0, 10));
        pipeline.removeRule("pressure");

        assertThat(metrics.getGaugeValue(MetricsValidationListener.REGISTERED_RULES)).isEqualTo(1.0);
        assertThat(metrics.getGaugeValue(MetricsValidationListener.REGISTERED_VALIDATORS)).isZero();
    }

    @Test
    @DisplayName("In-memory timer should report nearest-rank percentiles")
    void shouldComputePercentiles() {
        Timer timer = metrics.timer("latency");
        for (long millis : List.of(10L, 20L, 30L, 40L)) {
            timer.record(Duration.ofMillis(millis));
        }

        assertThat(timer.count()).isEqualTo(4);
        assertThat(timer.percentile(0.5)).isEqualTo(Duration.ofMillis(20));
        assertThat(timer.percentile(1.0)).isEqualTo(Duration.ofMillis(40));
        assertThat(metrics.timer("empty").percentile(0.99)).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("Should keep tagged metrics apart and reject odd tag lists")
    void shouldSeparateTags() {
        metrics.counter("events", "kind", "a").increment();
        metrics.counter("events", "kind", "b").increment(3);

        assertThat(metrics.getCounterValue("events", "kind", "a")).isEqualTo(1);
        assertThat(metrics.getCounterValue("events", "kind", "b")).isEqualTo(3);
        assertThat(InMemoryMetricsRegistry.metricId("events", "kind", "a")).isEqualTo("events{kind=a}");
        assertThatThrownBy(() -> metrics.counter("events", "kind"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should count pipeline failures")
    void shouldCountPipelineErrors() {
        pipeline.addRule(Rules.range("temperature", 0, 100));
        pipeline.close();

        ValidationResult result = pipeline.validate(50).join();

        assertThat(result.valid()).isFalse();
        assertThat(metrics.getCounterValue(MetricsValidationListener.PIPELINE_ERRORS)).isEqualTo(1);
    }
}
