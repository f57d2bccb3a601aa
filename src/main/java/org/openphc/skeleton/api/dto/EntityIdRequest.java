package org.openphc.skeleton.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of POST /api/entities/validate, bound and checked with {@code @Valid}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EntityIdRequest {

    public static final String INVALID_ID = "Invalid ID format (UUID required)";

    @NotNull(message = INVALID_ID)
    @Pattern(regexp = "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$",
            message = INVALID_ID)
    private String id;
}
