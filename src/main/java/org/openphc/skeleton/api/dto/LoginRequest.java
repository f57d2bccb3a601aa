package org.openphc.skeleton.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Constraints for the POST /api/auth/login body, one group per rule.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    public static final String PASSWORD_REQUIRED = "Password is required";

    public interface EmailFormat {}
    public interface PasswordPresent {}

    @NotEmpty(message = UserRequest.INVALID_EMAIL, groups = EmailFormat.class)
    @Email(regexp = UserRequest.EMAIL_DOMAIN_REGEX, message = UserRequest.INVALID_EMAIL, groups = EmailFormat.class)
    private String email;

    @NotEmpty(message = PASSWORD_REQUIRED, groups = PasswordPresent.class)
    private String password;
}
