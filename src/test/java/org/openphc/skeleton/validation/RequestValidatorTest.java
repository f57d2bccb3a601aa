package org.openphc.skeleton.validation;

import jakarta.validation.Validation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.openphc.skeleton.domain.model.Violation;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RequestValidator.
 */
class RequestValidatorTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final RequestValidator validator = new RequestValidator(executor);
    private final ValidationRuleSets ruleSets =
            new ValidationRuleSets(Validation.buildDefaultValidatorFactory().getValidator());

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldReportEveryFailedUserRuleInDeclarationOrder() {
        ValidationResult result = validator.validate(ruleSets.user(), Map.of("name", "A"));

        assertFalse(result.isValid());
        List<String> fields = result.violations().stream().map(Violation::field).toList();
        assertEquals(List.of("email", "password", "password", "name"), fields);
        assertEquals("Name must be between 2 and 50 characters long", result.violations().get(3).message());
    }

    @Test
    void shouldAcceptValidUser() {
        Map<String, Object> body = Map.of(
                "email", "jane.doe@example.com",
                "password", "Secret123",
                "name", "Jane Doe");

        assertTrue(validator.validate(ruleSets.user(), body).isValid());
    }

    @Test
    void shouldKeepDeclarationOrderWhenEarlierRuleFinishesLast() {
        FieldCheck slowFailure = value -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return false;
        };
        List<FieldRule> rules = List.of(
                FieldRule.of("first", slowFailure, "first failed"),
                FieldRule.of("second", value -> false, "second failed"),
                FieldRule.of("third", value -> true, "never reported"));

        ValidationResult result = validator.validate(rules, Map.of());

        assertEquals(List.of(new Violation("first", "first failed"), new Violation("second", "second failed")),
                result.violations());
    }

    @Test
    void shouldEvaluateEveryRuleWithoutShortCircuit() {
        AtomicInteger evaluated = new AtomicInteger();
        FieldCheck failing = value -> {
            evaluated.incrementAndGet();
            return false;
        };
        List<FieldRule> rules = List.of(
                FieldRule.of("a", failing, "a"),
                FieldRule.of("b", failing, "b"),
                FieldRule.of("c", failing, "c"));

        ValidationResult result = validator.validate(rules, Map.of());

        assertEquals(3, evaluated.get());
        assertEquals(3, result.violations().size());
    }

    @Test
    void shouldSkipOptionalRuleWhenFieldIsAbsent() {
        Map<String, Object> product = new HashMap<>();
        product.put("name", "Desk lamp");
        product.put("price", 19.99);
        product.put("category", "lighting");

        assertTrue(validator.validate(ruleSets.product(), product).isValid());

        product.put("description", "x".repeat(501));
        ValidationResult result = validator.validate(ruleSets.product(), product);
        assertEquals(List.of(new Violation("description", "Description must be less than 500 characters long")),
                result.violations());
    }

    @Test
    void shouldTreatNullPayloadAsEmpty() {
        ValidationResult result = validator.validate(ruleSets.login(), null);

        assertEquals(2, result.violations().size());
        assertEquals("Password is required", result.violations().get(1).message());
    }

    @Test
    void shouldBeValidForEmptyRuleSet() {
        assertTrue(validator.validate(List.of(), Map.of("anything", 1)).isValid());
    }
}
