package org.openphc.skeleton.validation;

import lombok.extern.slf4j.Slf4j;
import org.openphc.skeleton.domain.model.Violation;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs a rule set against a request payload. Every rule is launched concurrently and all of them
 * are joined before the aggregate check; violations keep declaration order, not completion order.
 */
@Component
@Slf4j
public class RequestValidator {

    private final Executor validationExecutor;

    public RequestValidator(@Qualifier("validationExecutor") Executor validationExecutor) {
        this.validationExecutor = validationExecutor;
    }

    public ValidationResult validate(List<FieldRule> rules, Map<String, ?> payload) {
        Map<String, ?> body = payload != null ? payload : Map.of();

        List<CompletableFuture<Optional<Violation>>> checks = rules.stream()
                .map(rule -> CompletableFuture.supplyAsync(() -> rule.evaluate(body), validationExecutor))
                .toList();

        CompletableFuture.allOf(checks.toArray(new CompletableFuture<?>[0])).join();

        List<Violation> violations = checks.stream()
                .map(CompletableFuture::join)
                .flatMap(Optional::stream)
                .toList();

        if (!violations.isEmpty()) {
            log.debug("Validation failed with {} violation(s) out of {} rule(s)", violations.size(), rules.size());
        }
        return new ValidationResult(violations);
    }
}
