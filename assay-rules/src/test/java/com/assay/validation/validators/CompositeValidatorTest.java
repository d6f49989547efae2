package com.assay.validation.validators;

import com.assay.validation.api.Validator;
import com.assay.validation.api.exceptions.ConfigurationException;
import com.assay.validation.api.model.ErrorCodes;
import com.assay.validation.api.model.Severity;
import com.assay.validation.api.model.ValidationContext;
import com.assay.validation.api.model.ValidationError;
import com.assay.validation.api.model.ValidationResult;
import com.assay.validation.api.model.ValidatorSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompositeValidatorTest {

    private final ValidationContext context = ValidationContext.root("H2O");

    /** Validates non-empty strings; reports an error for blank ones. */
    static final class NonBlankValidator extends BaseValidator<String> {
        NonBlankValidator(String name) {
            super(name, String.class);
        }

        @Override
        protected CompletableFuture<ValidationResult> doValidate(String value, ValidationContext context) {
            if (value.isBlank()) {
                return CompletableFuture.completedFuture(failureResult(
                        List.of(error("BLANK", "value is blank", context, "Provide a value")), List.of()));
            }
            return CompletableFuture.completedFuture(successResult(List.of()));
        }
    }

    static final class WarningValidator extends BaseValidator<String> {
        WarningValidator() {
            super("warn", String.class);
        }

        @Override
        protected CompletableFuture<ValidationResult> doValidate(String value, ValidationContext context) {
            ValidationError warning = ValidationError.of("SHORT", "short value", context.path(), Severity.WARNING);
            return CompletableFuture.completedFuture(successResult(List.of(warning)));
        }
    }

    static final class FailingValidator extends BaseValidator<String> {
        FailingValidator() {
            super("failing", String.class);
        }

        @Override
        protected CompletableFuture<ValidationResult> doValidate(String value, ValidationContext context) {
            throw new IllegalStateException("database down");
        }
    }

    @Test
    @DisplayName("Should union errors and warnings of applicable children")
    void shouldUnionChildResults() {
        CompositeValidator composite = new CompositeValidator("compound",
                List.of(new NonBlankValidator("nonBlank"), new WarningValidator()));

        ValidationResult result = composite.validate(" ", context).join();

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).extracting(ValidationError::code).containsExactly("BLANK");
        assertThat(result.warnings()).extracting(ValidationError::code).containsExactly("SHORT");
        assertThat(result.metrics().validatorsUsed()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should turn a throwing child into COMPOSITE_VALIDATOR_ERROR and keep going")
    void shouldConvertThrowingChild() {
        CompositeValidator composite = new CompositeValidator("compound",
                List.of(new FailingValidator(), new WarningValidator()));

        ValidationResult result = composite.validate("H2O", context).join();

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.code()).isEqualTo(ErrorCodes.COMPOSITE_VALIDATOR_ERROR);
            assertThat(error.message()).isEqualTo("Validator 'failing' failed: database down");
        });
        assertThat(result.warnings()).hasSize(1);
    }

    @Test
    @DisplayName("Should only run children that can validate the value")
    void shouldSkipInapplicableChildren() {
        CompositeValidator composite = new CompositeValidator("compound", List.of(new NonBlankValidator("nonBlank")));

        assertThat(composite.canValidate(42)).isFalse();
        assertThat(composite.canValidate("H2O")).isTrue();
        assertThat(composite.validate(42, context).join().metrics().validatorsUsed()).isZero();
    }

    @Test
    @DisplayName("Should reject duplicate child names")
    void shouldRejectDuplicates() {
        CompositeValidator composite = new CompositeValidator("compound", List.of(new NonBlankValidator("a")));

        assertThatThrownBy(() -> composite.addValidator(new NonBlankValidator("a")))
                .isInstanceOf(ConfigurationException.class)
                .satisfies(e -> assertThat(((ConfigurationException) e).getErrorCode())
                        .isEqualTo(ErrorCodes.DUPLICATE_VALIDATOR));
    }

    @Test
    @DisplayName("Should merge child schemas")
    void shouldMergeSchemas() {
        CompositeValidator composite = new CompositeValidator("compound",
                List.of(new NonBlankValidator("a"), new WarningValidator()));

        ValidatorSchema schema = composite.getSchema();

        assertThat(schema.name()).isEqualTo("compound");
        assertThat(schema.version()).isEqualTo("1.0.0");
        assertThat(schema.types()).containsExactly("String");
        assertThat(schema.properties().get("compositeOf")).isEqualTo(List.of("a", "warn"));
    }

    @Test
    @DisplayName("Should add and remove children")
    void shouldAddAndRemoveChildren() {
        CompositeValidator composite = new CompositeValidator("compound", List.of());
        Validator child = new NonBlankValidator("a");

        composite.addValidator(child);
        assertThat(composite.getValidator("a")).containsSame(child);

        assertThat(composite.removeValidator("a")).isTrue();
        assertThat(composite.validators()).isEmpty();
    }
}
