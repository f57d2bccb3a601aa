package org.openphc.skeleton.validation;

import jakarta.validation.Validator;
import org.openphc.skeleton.api.dto.LoginRequest;
import org.openphc.skeleton.api.dto.ProductRequest;
import org.openphc.skeleton.api.dto.UserRequest;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rule sets for the request bodies the API accepts. Every rule is one constraint group of the
 * matching request DTO, so the rule order below is the order violations are reported in.
 */
@Component
public class ValidationRuleSets {

    private final List<FieldRule> userRules;
    private final List<FieldRule> loginRules;
    private final List<FieldRule> productRules;

    public ValidationRuleSets(Validator validator) {
        this.userRules = List.of(
                rule(validator, UserRequest.class, "email", UserRequest.EmailFormat.class, UserRequest.INVALID_EMAIL),
                rule(validator, UserRequest.class, "password", UserRequest.PasswordLength.class,
                        UserRequest.PASSWORD_TOO_SHORT),
                rule(validator, UserRequest.class, "password", UserRequest.PasswordStrength.class,
                        UserRequest.PASSWORD_TOO_WEAK),
                rule(validator, UserRequest.class, "name", UserRequest.NameLength.class, UserRequest.NAME_LENGTH),
                rule(validator, UserRequest.class, "name", UserRequest.NameCharacters.class,
                        UserRequest.NAME_CHARACTERS));

        this.loginRules = List.of(
                rule(validator, LoginRequest.class, "email", LoginRequest.EmailFormat.class, UserRequest.INVALID_EMAIL),
                rule(validator, LoginRequest.class, "password", LoginRequest.PasswordPresent.class,
                        LoginRequest.PASSWORD_REQUIRED));

        this.productRules = List.of(
                rule(validator, ProductRequest.class, "name", ProductRequest.NameLength.class,
                        ProductRequest.NAME_LENGTH),
                rule(validator, ProductRequest.class, "price", ProductRequest.PriceRange.class,
                        ProductRequest.INVALID_PRICE),
                FieldRule.optional("description",
                        FieldChecks.constrainedBy(validator, ProductRequest.class, "description",
                                ProductRequest.DescriptionLength.class),
                        ProductRequest.DESCRIPTION_LENGTH),
                rule(validator, ProductRequest.class, "category", ProductRequest.CategoryLength.class,
                        ProductRequest.CATEGORY_LENGTH));
    }

    public List<FieldRule> user() {
        return userRules;
    }

    public List<FieldRule> login() {
        return loginRules;
    }

    public List<FieldRule> product() {
        return productRules;
    }

    private static FieldRule rule(Validator validator, Class<?> beanType, String field, Class<?> group,
                                  String message) {
        return FieldRule.of(field, FieldChecks.constrainedBy(validator, beanType, field, group), message);
    }
}
