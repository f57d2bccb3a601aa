package org.openphc.skeleton.api.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Constraints for the POST /api/products body, one group per rule. The description is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductRequest {

    public static final String NAME_LENGTH = "Product name must be between 3 and 100 characters long";
    public static final String INVALID_PRICE = "Price must be a positive number";
    public static final String DESCRIPTION_LENGTH = "Description must be less than 500 characters long";
    public static final String CATEGORY_LENGTH = "Category must be between 1 and 50 characters long";

    public interface NameLength {}
    public interface PriceRange {}
    public interface DescriptionLength {}
    public interface CategoryLength {}

    @NotNull(message = NAME_LENGTH, groups = NameLength.class)
    @Size(min = 3, max = 100, message = NAME_LENGTH, groups = NameLength.class)
    private String name;

    @NotNull(message = INVALID_PRICE, groups = PriceRange.class)
    @DecimalMin(value = "0", message = INVALID_PRICE, groups = PriceRange.class)
    private BigDecimal price;

    @Size(max = 500, message = DESCRIPTION_LENGTH, groups = DescriptionLength.class)
    private String description;

    @NotNull(message = CATEGORY_LENGTH, groups = CategoryLength.class)
    @Size(min = 1, max = 50, message = CATEGORY_LENGTH, groups = CategoryLength.class)
    private String category;
}
