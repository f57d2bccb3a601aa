package org.openphc.skeleton.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Constraints for the POST /api/users body. Each group is one rule of the user rule set and is
 * checked on its own; an absent field fails the group's {@code @NotNull}/{@code @NotEmpty}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserRequest {

    public static final String INVALID_EMAIL = "Invalid email format";
    public static final String PASSWORD_TOO_SHORT = "Password must be at least 8 characters long";
    public static final String PASSWORD_TOO_WEAK =
            "Password must contain at least one uppercase letter, one lowercase letter, and one number";
    public static final String NAME_LENGTH = "Name must be between 2 and 50 characters long";
    public static final String NAME_CHARACTERS = "Name can only contain letters and spaces";

    /** Requires a dotted domain with an alphabetic top-level label. */
    public static final String EMAIL_DOMAIN_REGEX = ".+@.+\\.[A-Za-z]{2,}";

    public interface EmailFormat {}
    public interface PasswordLength {}
    public interface PasswordStrength {}
    public interface NameLength {}
    public interface NameCharacters {}

    @NotEmpty(message = INVALID_EMAIL, groups = EmailFormat.class)
    @Email(regexp = EMAIL_DOMAIN_REGEX, message = INVALID_EMAIL, groups = EmailFormat.class)
    private String email;

    @NotNull(message = PASSWORD_TOO_SHORT, groups = PasswordLength.class)
    @Size(min = 8, message = PASSWORD_TOO_SHORT, groups = PasswordLength.class)
    @NotNull(message = PASSWORD_TOO_WEAK, groups = PasswordStrength.class)
    @Pattern(regexp = "^(?=.*[a-z])(?=.*[A-Z])(?=.*\\d).*$", message = PASSWORD_TOO_WEAK,
            groups = PasswordStrength.class)
    private String password;

    @NotNull(message = NAME_LENGTH, groups = NameLength.class)
    @Size(min = 2, max = 50, message = NAME_LENGTH, groups = NameLength.class)
    @NotNull(message = NAME_CHARACTERS, groups = NameCharacters.class)
    @Pattern(regexp = "^[a-zA-Z\\s]+$", message = NAME_CHARACTERS, groups = NameCharacters.class)
    private String name;
}
