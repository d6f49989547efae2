package com.assay.validation.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationContextTest {

    @Test
    @DisplayName("Should share state and metrics with derived contexts")
    void shouldShareStateWithChildren() {
        Map<String, Object> compound = Map.of("formula", "H2O");
        ValidationContext root = ValidationContext.root(compound);

        ValidationContext child = root.child("formula");
        child.shared().put("atoms", 3);
        child.metrics().recordRuleExecuted(false);

        assertThat(child.path()).containsExactly("formula");
        assertThat(child.root()).isSameAs(compound);
        assertThat(child.parent()).containsSame(root);
        assertThat(root.shared()).containsEntry("atoms", 3);
        assertThat(root.metrics().rulesExecuted()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should snapshot validator options")
    void shouldSnapshotOptions() {
        ValidationContext root = ValidationContext.root("x");

        ValidationContext configured = root.withConfig(Map.of("strict", true));

        assertThat(configured.config()).containsEntry("strict", true);
        assertThat(root.config()).isEmpty();
        assertThat(configured.shared()).isSameAs(root.shared());
    }

    @Test
    @DisplayName("Should report fromCache only when every item was cached")
    void shouldTrackAllFromCache() {
        MetricsTracker tracker = new MetricsTracker();
        assertThat(tracker.allFromCache()).isFalse();

        tracker.recordValidatorUsed(true);
        tracker.recordRuleExecuted(true);
        assertThat(tracker.allFromCache()).isTrue();

        tracker.recordRuleExecuted(false);
        assertThat(tracker.allFromCache()).isFalse();
    }

    @Test
    @DisplayName("Should compute cache hit rate")
    void shouldComputeHitRate() {
        MetricsTracker tracker = new MetricsTracker();
        tracker.recordCacheHit();
        tracker.recordCacheMiss();
        tracker.recordCacheMiss();
        tracker.recordCacheMiss();

        CacheStats stats = tracker.cacheStats();

        assertThat(stats.hits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(3);
        assertThat(stats.hitRate()).isEqualTo(0.25);
    }
}
