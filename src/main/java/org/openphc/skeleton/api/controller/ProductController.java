package org.openphc.skeleton.api.controller;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openphc.skeleton.api.dto.ApiResponse;
import org.openphc.skeleton.api.dto.ProductDto;
import org.openphc.skeleton.domain.model.Failure;
import org.openphc.skeleton.service.ErrorResponder;
import org.openphc.skeleton.service.ProductService;
import org.openphc.skeleton.validation.RequestValidator;
import org.openphc.skeleton.validation.ValidationResult;
import org.openphc.skeleton.validation.ValidationRuleSets;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Product endpoints. Products are validated and echoed back with a generated id.
 */
@RestController
@RequestMapping("/api/products")
@RequiredArgsConstructor
@Slf4j
public class ProductController {

    private final RequestValidator requestValidator;
    private final ValidationRuleSets ruleSets;
    private final ProductService productService;
    private final ErrorResponder errorResponder;

    @PostMapping
    public ResponseEntity<?> createProduct(@RequestBody Map<String, Object> body, HttpServletRequest request) {
        ValidationResult validation = requestValidator.validate(ruleSets.product(), body);
        if (!validation.isValid()) {
            return errorResponder.respond(Failure.validation(validation.violations()), request);
        }

        ProductDto product = productService.create(body);
        log.info("Created product: id={}, category={}", product.getId(), product.getCategory());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(product));
    }
}
