package com.assay.validation.pipeline;

import com.assay.validation.api.Rule;
import com.assay.validation.api.ValidationListener;
import com.assay.validation.api.exceptions.ConfigurationException;
import com.assay.validation.api.model.ErrorCodes;
import com.assay.validation.api.model.RuleResult;
import com.assay.validation.api.model.Severity;
import com.assay.validation.api.model.ValidationContext;
import com.assay.validation.api.model.ValidationError;
import com.assay.validation.api.model.ValidationResult;
import com.assay.validation.api.model.ValidatorConfig;
import com.assay.validation.api.model.ValidatorSchema;
import com.assay.validation.cache.ManualTicker;
import com.assay.validation.config.ValidationPipelineConfig;
import com.assay.validation.rules.RuleOptions;
import com.assay.validation.rules.Rules;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ValidationPipelineTest {

    private final List<String> journal = Collections.synchronizedList(new ArrayList<>());
    private ValidationPipeline pipeline = new ValidationPipeline();

    @AfterEach
    void tearDown() {
        pipeline.close();
    }

    private void usePipeline(ValidationPipelineConfig config) {
        pipeline.close();
        pipeline = new ValidationPipeline(config);
    }

    private static final class OpaqueCompound {
        private final String formula;

        OpaqueCompound(String formula) {
            this.formula = formula;
        }
    }

    private static RuleResult failed(String code, Severity severity) {
        return RuleResult.failure(ValidationError.of(code, code + " failed", List.of(), severity));
    }

    private Rule recordingRule(String name, RuleOptions options, RuleResult outcome) {
        return Rules.sync(name, name, value -> true, (Object value, ValidationContext context) -> {
            journal.add(name);
            return outcome;
        }, options);
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("Should reject duplicate validator names")
        void shouldRejectDuplicateValidator() {
            pipeline.addValidator(RecordingValidator.passing("format", journal));

            assertThatThrownBy(() -> pipeline.addValidator(RecordingValidator.passing("format", journal)))
                    .isInstanceOf(ConfigurationException.class)
                    .extracting(e -> ((ConfigurationException) e).getErrorCode())
                    .isEqualTo(ErrorCodes.DUPLICATE_VALIDATOR);
        }

        @Test
        @DisplayName("Should require validator dependencies to be registered first")
        void shouldRequireValidatorDependencies() {
            RecordingValidator weight = new RecordingValidator("weight", ValidatorConfig.defaults(),
                    Set.of("format"), journal, null);

            assertThatThrownBy(() -> pipeline.addValidator(weight))
                    .isInstanceOf(ConfigurationException.class)
                    .extracting(e -> ((ConfigurationException) e).getErrorCode())
                    .isEqualTo(ErrorCodes.MISSING_DEPENDENCY);
            assertThat(pipeline.getValidators()).isEmpty();
        }

        @Test
        @DisplayName("Should reject a rule cycle and leave the registry unchanged")
        void shouldRejectRuleCycle() {
            pipeline.addRule(recordingRule("A", RuleOptions.builder().dependsOn("B").build(), RuleResult.success()));

            assertThatThrownBy(() -> pipeline.addRule(
                    recordingRule("B", RuleOptions.builder().dependsOn("A").build(), RuleResult.success())))
                    .isInstanceOf(ConfigurationException.class)
                    .extracting(e -> ((ConfigurationException) e).getErrorCode())
                    .isEqualTo(ErrorCodes.CIRCULAR_DEPENDENCY);

            assertThat(pipeline.getRules()).extracting(Rule::name).containsExactly("A");
            assertThat(pipeline.getRule("B")).isEmpty();
        }

        @Test
        @DisplayName("Should add and remove validators and rules with events")
        void shouldPublishRegistrationEvents() {
            ValidationListener listener = mock(ValidationListener.class);
            pipeline.addListener(listener);

            pipeline.addValidator(RecordingValidator.passing("format", journal));
            pipeline.addRule(Rules.range("temperature", -273.15, 10_000));

            assertThat(pipeline.getValidator("format")).isPresent();
            assertThat(pipeline.removeValidator("format")).isTrue();
            assertThat(pipeline.removeValidator("format")).isFalse();
            assertThat(pipeline.removeRule("temperature")).isTrue();

            verify(listener).onValidatorRegistered("format");
            verify(listener).onValidatorUnregistered("format");
            verify(listener).onRuleRegistered("temperature");
            verify(listener).onRuleUnregistered("temperature");
            assertThat(pipeline.getStats().validators()).isZero();
            assertThat(pipeline.getStats().rules()).isZero();
        }
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("Should start a dependent rule only after its dependency completed")
        void shouldWaitForAsyncDependency() {
            pipeline.addRule(Rules.async("second", "depends on first", value -> true,
                    (Object value, ValidationContext context) -> {
                        journal.add("second:start");
                        return CompletableFuture.completedFuture(RuleResult.success());
                    }, RuleOptions.builder().dependsOn("first").priority(100).build()));
            pipeline.addRule(Rules.async("first", "slow", (Object value, ValidationContext context) ->
                    CompletableFuture.supplyAsync(() -> {
                        journal.add("first:end");
                        return RuleResult.success();
                    }, CompletableFuture.delayedExecutor(50, TimeUnit.MILLISECONDS))));

            ValidationResult result = pipeline.validate("H2O").join();

            assertThat(result.valid()).isTrue();
            assertThat(result.metrics().rulesExecuted()).isEqualTo(2);
            assertThat(journal).containsExactly("first:end", "second:start");
        }

        @Test
        @DisplayName("Should run validators in dependency order, then rules")
        void shouldRunValidatorsBeforeRules() {
            pipeline.addRule(recordingRule("rule", RuleOptions.defaults(), RuleResult.success()));
            pipeline.addValidator(RecordingValidator.passing("format", journal));
            pipeline.addValidator(new RecordingValidator("weight",
                    ValidatorConfig.builder().priority(100).build(), Set.of("format"), journal, null));

            pipeline.validate("H2O").join();

            assertThat(journal).containsExactly("format", "weight", "rule");
        }

        @Test
        @DisplayName("Should order independent rules by priority when sequential")
        void shouldOrderByPriority() {
            usePipeline(ValidationPipelineConfig.builder().parallel(false, 1).build());
            pipeline.addRule(recordingRule("low", RuleOptions.builder().priority(1).build(), RuleResult.success()));
            pipeline.addRule(recordingRule("high", RuleOptions.builder().priority(9).build(), RuleResult.success()));

            pipeline.validate("H2O").join();

            assertThat(journal).containsExactly("high", "low");
        }
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        @Test
        @DisplayName("Should execute a cached validator once and mark the repeat as from cache")
        void shouldServeRepeatFromCache() {
            RecordingValidator validator = RecordingValidator.passing("format", journal);
            pipeline.addValidator(validator);

            ValidationResult first = pipeline.validate("H2O").join();
            ValidationResult second = pipeline.validate("H2O").join();

            assertThat(validator.invocations()).isEqualTo(1);
            assertThat(first.fromCache()).isFalse();
            assertThat(second.fromCache()).isTrue();
            assertThat(second.metrics().cacheStats().hits()).isEqualTo(1);
            assertThat(pipeline.getStats().cacheSize()).isEqualTo(1);
            assertThat(pipeline.getStats().cacheHitRate()).isEqualTo(0.5);
        }

        @Test
        @DisplayName("Should cache rule results separately per value")
        void shouldCacheRulesPerValue() {
            AtomicInteger executions = new AtomicInteger();
            pipeline.addRule(Rules.sync("counted", "counts", (Object value, ValidationContext context) -> {
                executions.incrementAndGet();
                return RuleResult.success();
            }));

            pipeline.validate("H2O").join();
            ValidationResult repeat = pipeline.validate("H2O").join();
            pipeline.validate("CO2").join();

            assertThat(executions).hasValue(2);
            assertThat(repeat.fromCache()).isTrue();
        }

        @Test
        @DisplayName("Should empty the cache on clearCache")
        void shouldClearCache() {
            RecordingValidator validator = RecordingValidator.passing("format", journal);
            pipeline.addValidator(validator);
            pipeline.validate("H2O").join();

            pipeline.clearCache();

            assertThat(pipeline.getStats().cacheSize()).isZero();
            pipeline.validate("H2O").join();
            assertThat(validator.invocations()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should bypass the cache when caching is disabled")
        void shouldBypassDisabledCache() {
            usePipeline(ValidationPipelineConfig.builder().enableCaching(false).build());
            RecordingValidator validator = RecordingValidator.passing("format", journal);
            pipeline.addValidator(validator);

            pipeline.validate("H2O").join();
            ValidationResult second = pipeline.validate("H2O").join();

            assertThat(validator.invocations()).isEqualTo(2);
            assertThat(second.fromCache()).isFalse();
        }

        @Test
        @DisplayName("Should not cache validators that opt out")
        void shouldRespectNonCacheableValidator() {
            RecordingValidator validator = new RecordingValidator("live",
                    ValidatorConfig.builder().cacheable(false).build(), Set.of(), journal, null);
            pipeline.addValidator(validator);

            pipeline.validate("H2O").join();
            pipeline.validate("H2O").join();

            assertThat(validator.invocations()).isEqualTo(2);
            assertThat(pipeline.getStats().cacheSize()).isZero();
        }

        @Test
        @DisplayName("Should not serve one opaque value's result for another")
        void shouldKeepOpaqueValuesApart() {
            pipeline.addValidator(new RecordingValidator("formula", ValidatorConfig.defaults(), Set.of(), journal, null) {
                @Override
                protected CompletableFuture<ValidationResult> doValidate(Object value, ValidationContext context) {
                    if (value instanceof OpaqueCompound compound && compound.formula.equals("XYZ")) {
                        ValidationError error = ValidationError.of("INVALID_FORMULA", "Unknown formula",
                                context.path(), Severity.ERROR);
                        return CompletableFuture.completedFuture(failureResult(List.of(error), List.of()));
                    }
                    return CompletableFuture.completedFuture(successResult(List.of()));
                }
            });

            ValidationResult water = pipeline.validate(new OpaqueCompound("H2O")).join();
            ValidationResult unknown = pipeline.validate(new OpaqueCompound("XYZ")).join();

            assertThat(water.valid()).isTrue();
            assertThat(unknown.valid()).isFalse();
            assertThat(unknown.fromCache()).isFalse();
            assertThat(unknown.errors()).extracting(ValidationError::code).containsExactly("INVALID_FORMULA");
        }
    }

    @Nested
    @DisplayName("Selection")
    class Selection {

        @Test
        @DisplayName("Should run only named validators and skip unknown names")
        void shouldRunNamedValidators() {
            pipeline.addValidator(RecordingValidator.passing("format", journal));
            pipeline.addValidator(RecordingValidator.passing("weight", journal));

            ValidationResult result = pipeline.validate("H2O", List.of("weight", "missing")).join();

            assertThat(journal).containsExactly("weight");
            assertThat(result.metrics().validatorsUsed()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should skip disabled validators unless named explicitly")
        void shouldSkipDisabledValidators() {
            pipeline.addValidator(new RecordingValidator("disabled",
                    ValidatorConfig.builder().enabled(false).build(), Set.of(), journal, null));

            pipeline.validate("H2O").join();
            assertThat(journal).isEmpty();

            pipeline.validate("H2O", List.of("disabled")).join();
            assertThat(journal).containsExactly("disabled");
        }

        @Test
        @DisplayName("Should report NO_VALIDATORS_APPLICABLE for null and empty input")
        void shouldRejectBlankInputWhenNothingApplies() {
            pipeline.addValidator(RecordingValidator.passing("format", journal));
            pipeline.addRule(Rules.range("temperature", 0, 100));

            ValidationResult forNull = pipeline.validate(null).join();
            ValidationResult forEmpty = pipeline.validate("").join();

            assertThat(forNull.valid()).isFalse();
            assertThat(forNull.errors()).singleElement().satisfies(error -> {
                assertThat(error.code()).isEqualTo(ErrorCodes.NO_VALIDATORS_APPLICABLE);
                assertThat(error.message()).isEqualTo("Invalid input: null");
                assertThat(error.suggestions()).containsExactly("Provide a valid input value");
            });
            // the recording validator accepts any non-null value, so "" is validated
            assertThat(forEmpty.valid()).isTrue();
        }

        @Test
        @DisplayName("Should treat an empty string as invalid when nothing applies")
        void shouldRejectEmptyString() {
            ValidationResult result = pipeline.validate("").join();

            assertThat(result.errors()).extracting(ValidationError::message)
                    .containsExactly("Invalid input: empty string");
        }

        @Test
        @DisplayName("Should accept non-blank input that nothing applies to")
        void shouldAcceptUnmatchedValue() {
            pipeline.addRule(Rules.range("temperature", 0, 100));

            ValidationResult result = pipeline.validate("H2O").join();

            assertThat(result.valid()).isTrue();
            assertThat(result.metrics().rulesExecuted()).isZero();
        }
    }

    @Nested
    @DisplayName("Failure handling")
    class FailureHandling {

        @Test
        @DisplayName("Should put low severity rule failures into warnings")
        void shouldSplitBySeverity() {
            pipeline.addRule(recordingRule("advisory", RuleOptions.defaults(), failed("ADVISORY", Severity.WARNING)));
            pipeline.addRule(recordingRule("strict", RuleOptions.defaults(), failed("STRICT", Severity.ERROR)));

            ValidationResult result = pipeline.validate("H2O").join();

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).extracting(ValidationError::code).containsExactly("STRICT");
            assertThat(result.warnings()).extracting(ValidationError::code).containsExactly("ADVISORY");
        }

        @Test
        @DisplayName("Should stay valid when only warnings are reported")
        void shouldStayValidWithWarnings() {
            pipeline.addRule(recordingRule("advisory", RuleOptions.defaults(), failed("ADVISORY", Severity.INFO)));

            ValidationResult result = pipeline.validate("H2O").join();

            assertThat(result.valid()).isTrue();
            assertThat(result.hasOnlyWarnings()).isTrue();
        }

        @Test
        @DisplayName("Should stop starting new items after the first failure when continueOnError is off")
        void shouldHaltOnFirstFailure() {
            usePipeline(ValidationPipelineConfig.builder().continueOnError(false).parallel(false, 1).build());
            pipeline.addRule(recordingRule("first", RuleOptions.builder().priority(10).build(),
                    failed("FIRST", Severity.ERROR)));
            pipeline.addRule(recordingRule("second", RuleOptions.defaults(), failed("SECOND", Severity.ERROR)));

            ValidationResult result = pipeline.validate("H2O").join();

            assertThat(journal).containsExactly("first");
            assertThat(result.errors()).extracting(ValidationError::code).containsExactly("FIRST");
            assertThat(result.metrics().rulesExecuted()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should skip rules after a failing validator when continueOnError is off")
        void shouldHaltAfterValidatorFailure() {
            usePipeline(ValidationPipelineConfig.builder().continueOnError(false).build());
            pipeline.addValidator(RecordingValidator.failing("format", "BAD_FORMAT", journal));
            pipeline.addRule(recordingRule("rule", RuleOptions.defaults(), RuleResult.success()));

            ValidationResult result = pipeline.validate("H2O").join();

            assertThat(journal).containsExactly("format");
            assertThat(result.errors()).extracting(ValidationError::code).containsExactly("BAD_FORMAT");
        }

        @Test
        @DisplayName("Should keep going after failures when continueOnError is on")
        void shouldContinueAfterFailures() {
            pipeline.addValidator(RecordingValidator.failing("format", "BAD_FORMAT", journal));
            pipeline.addRule(recordingRule("rule", RuleOptions.defaults(), failed("RULE", Severity.ERROR)));

            ValidationResult result = pipeline.validate("H2O").join();

            assertThat(result.errors()).extracting(ValidationError::code).containsExactly("BAD_FORMAT", "RULE");
        }

        @Test
        @DisplayName("Should convert a throwing validator into VALIDATOR_EXECUTION_ERROR")
        void shouldConvertThrowingValidator() {
            pipeline.addValidator(new RecordingValidator("broken", ValidatorConfig.defaults(), Set.of(), journal, null) {
                @Override
                protected CompletableFuture<ValidationResult> doValidate(Object value, ValidationContext context) {
                    throw new IllegalStateException("database down");
                }
            });

            ValidationResult result = pipeline.validate("H2O").join();

            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.code()).isEqualTo(ErrorCodes.VALIDATOR_EXECUTION_ERROR);
                assertThat(error.message()).isEqualTo("Validator 'broken' failed: database down");
                assertThat(error.context()).containsEntry("validator", "broken");
            });
        }

        @Test
        @DisplayName("Should convert a throwing schema lookup without losing other results")
        void shouldConvertThrowingSchema() {
            pipeline.addValidator(new RecordingValidator("unversioned", ValidatorConfig.defaults(), Set.of(), journal, null) {
                @Override
                public ValidatorSchema getSchema() {
                    throw new IllegalStateException("schema unavailable");
                }
            });
            pipeline.addRule(Rules.range("temperature", 0, 100));

            ValidationResult result = pipeline.validate(150).join();

            assertThat(result.errors()).extracting(ValidationError::code)
                    .containsExactly(ErrorCodes.VALIDATOR_EXECUTION_ERROR, ErrorCodes.VALUE_OUT_OF_RANGE);
            assertThat(result.errors().get(0).message()).isEqualTo("Validator 'unversioned' failed: schema unavailable");
            assertThat(result.metrics().rulesExecuted()).isEqualTo(1);
            assertThat(journal).isEmpty();
        }

        @Test
        @DisplayName("Should convert throwing predicates into failed results")
        void shouldConvertThrowingPredicates() {
            pipeline.addValidator(new RecordingValidator("picky", ValidatorConfig.defaults(), Set.of(), journal, null) {
                @Override
                public boolean canValidate(Object value) {
                    throw new IllegalArgumentException("unsupported");
                }
            });
            pipeline.addRule(Rules.sync("fussy", "throws in appliesTo", value -> {
                throw new IllegalArgumentException("cannot tell");
            }, (Object value, ValidationContext context) -> RuleResult.success(), RuleOptions.defaults()));

            ValidationResult result = pipeline.validate("H2O").join();

            assertThat(result.errors()).extracting(ValidationError::code)
                    .containsExactly(ErrorCodes.VALIDATOR_EXECUTION_ERROR, ErrorCodes.RULE_EXECUTION_ERROR);
        }

        @Test
        @DisplayName("Should time out a rule that outlives the pipeline timeout")
        void shouldTimeOutRule() {
            usePipeline(ValidationPipelineConfig.builder().timeoutMillis(100).build());
            pipeline.addRule(Rules.async("stuck", "never completes", value -> true,
                    (Object value, ValidationContext context) -> new CompletableFuture<>(),
                    RuleOptions.builder().timeoutMillis(60_000).build()));

            long start = System.nanoTime();
            ValidationResult result = pipeline.validate("H2O").join();

            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(100);
            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.code()).isEqualTo(ErrorCodes.VALIDATION_TIMEOUT);
                assertThat(error.message()).isEqualTo("Rule 'stuck' timed out after 100ms");
            });
            assertThat(pipeline.getStats().cacheSize()).isZero();
        }

        @Test
        @DisplayName("Should report the async rule's own timeout when it is shorter than the pipeline's")
        void shouldPreferShorterAsyncRuleTimeout() {
            usePipeline(ValidationPipelineConfig.builder().timeoutMillis(10_000).build());
            pipeline.addRule(Rules.async("lookup", "never completes", value -> true,
                    (Object value, ValidationContext context) -> new CompletableFuture<>(),
                    RuleOptions.builder().timeoutMillis(50).build()));

            ValidationResult result = pipeline.validate("H2O").join();

            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.code()).isEqualTo(ErrorCodes.ASYNC_RULE_ERROR);
                assertThat(error.message()).isEqualTo("Async rule 'lookup' timed out after 50ms");
            });
        }

        @Test
        @DisplayName("Should apply a validator's own timeout")
        void shouldUseValidatorTimeout() {
            pipeline.addValidator(new RecordingValidator("slow",
                    ValidatorConfig.builder().timeoutMillis(50).build(), Set.of(), journal, null) {
                @Override
                protected CompletableFuture<ValidationResult> doValidate(Object value, ValidationContext context) {
                    return new CompletableFuture<>();
                }
            });

            ValidationResult result = pipeline.validate("H2O").join();

            assertThat(result.errors()).extracting(ValidationError::code)
                    .containsExactly(ErrorCodes.VALIDATION_TIMEOUT);
            assertThat(result.errors().get(0).context()).containsEntry("timeoutMs", 50L);
        }

        @Test
        @DisplayName("Should report VALIDATION_PIPELINE_ERROR when validating after close")
        void shouldReportPipelineError() {
            ValidationListener listener = mock(ValidationListener.class);
            pipeline.addListener(listener);
            pipeline.addValidator(RecordingValidator.passing("format", journal));
            pipeline.close();

            ValidationResult result = pipeline.validate("H2O").join();

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.code()).isEqualTo(ErrorCodes.VALIDATION_PIPELINE_ERROR);
                assertThat(error.severity()).isEqualTo(Severity.CRITICAL);
            });
            verify(listener).onValidationError(any());
            verify(listener, never()).onValidationCompleted(any());
        }
    }

    @Nested
    @DisplayName("Batch validation")
    class BatchValidation {

        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger maxInFlight = new AtomicInteger();

        private Rule trackedRule() {
            return Rules.async("tracked", "tracks concurrency", (Object value, ValidationContext context) -> {
                maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                return CompletableFuture.supplyAsync(() -> {
                    inFlight.decrementAndGet();
                    return RuleResult.success();
                }, CompletableFuture.delayedExecutor(20, TimeUnit.MILLISECONDS));
            });
        }

        @Test
        @DisplayName("Should keep input order and share the concurrency budget")
        void shouldBoundConcurrencyAcrossBatch() {
            usePipeline(ValidationPipelineConfig.builder().maxConcurrency(2).build());
            pipeline.addRule(trackedRule());
            pipeline.addRule(Rules.range("bounded", 0, 3));

            List<ValidationResult> results = pipeline.validateBatch(List.of(1, 2, 3, 4, 5)).join();

            assertThat(results).extracting(ValidationResult::valid)
                    .containsExactly(true, true, true, false, false);
            assertThat(maxInFlight.get()).isBetween(1, 2);
        }

        @Test
        @DisplayName("Should validate values one after another when parallel execution is off")
        void shouldRunSequentially() {
            usePipeline(ValidationPipelineConfig.builder().parallel(false, 4).build());
            pipeline.addRule(trackedRule());

            List<ValidationResult> results = pipeline.validateBatch(List.of("a", "b", "c")).join();

            assertThat(results).hasSize(3).allMatch(ValidationResult::valid);
            assertThat(maxInFlight.get()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Listeners and monitoring")
    class ListenersAndMonitoring {

        @Test
        @DisplayName("Should isolate a throwing listener from the others")
        void shouldIsolateThrowingListener() {
            ValidationListener broken = mock(ValidationListener.class);
            doThrow(new IllegalStateException("listener bug")).when(broken).onValidationStarted(any(), anyList());
            ValidationListener healthy = mock(ValidationListener.class);
            pipeline.addListener(broken);
            pipeline.addListener(healthy);
            pipeline.addValidator(RecordingValidator.passing("format", journal));

            ValidationResult result = pipeline.validate("H2O").join();

            assertThat(result.valid()).isTrue();
            verify(healthy).onValidationStarted("H2O", List.of("format"));
            verify(healthy).onValidatorExecuted(eq("format"), any());
            verify(healthy).onCacheMiss(any());
            verify(healthy).onValidationCompleted(result);
        }

        @Test
        @DisplayName("Should stop notifying a removed listener")
        void shouldRemoveListener() {
            ValidationListener listener = mock(ValidationListener.class);
            pipeline.addListener(listener);
            assertThat(pipeline.removeListener(listener)).isTrue();

            pipeline.validate("H2O").join();

            verify(listener, never()).onValidationCompleted(any());
        }

        @Test
        @DisplayName("Should emit a performance threshold event when sampled durations are slow")
        void shouldEmitPerformanceThreshold() {
            ManualTicker ticker = new ManualTicker();
            ValidationPipelineConfig config = ValidationPipelineConfig.builder()
                    .monitoring(true, 1.0)
                    .durationThresholdMillis(10)
                    .build();
            pipeline.close();
            pipeline = new ValidationPipeline(config, OpenTelemetry.noop().getTracer("test"), ticker);
            ValidationListener listener = mock(ValidationListener.class);
            pipeline.addListener(listener);
            pipeline.addRule(Rules.sync("slow", "advances the clock", (Object value, ValidationContext context) -> {
                ticker.advance(25, TimeUnit.MILLISECONDS);
                return RuleResult.success();
            }));

            ValidationResult result = pipeline.validate("H2O").join();

            assertThat(result.metrics().durationMillis()).isEqualTo(25);
            verify(listener).onPerformanceThreshold(eq("duration"), eq(25.0), eq(10.0));
            assertThat(pipeline.getStats().avgDurationMillis()).isEqualTo(25.0);
        }

        @Test
        @DisplayName("Should not sample when monitoring is disabled")
        void shouldSkipDisabledMonitoring() {
            usePipeline(ValidationPipelineConfig.builder().monitoring(false, 1.0).build());
            ValidationListener listener = mock(ValidationListener.class);
            pipeline.addListener(listener);

            pipeline.validate("H2O").join();

            verify(listener, never()).onPerformanceThreshold(any(), anyDouble(), anyDouble());
            assertThat(pipeline.getStats().avgDurationMillis()).isZero();
        }
    }
}
