package org.openphc.skeleton.service;

import lombok.extern.slf4j.Slf4j;
import org.openphc.skeleton.api.dto.ProductDto;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;

/**
 * Builds product records from validated request bodies. Nothing is stored.
 */
@Service
@Slf4j
public class ProductService {

    public ProductDto create(Map<String, Object> body) {
        Object description = body.get("description");
        ProductDto product = ProductDto.builder()
                .id(UUID.randomUUID().toString())
                .name(String.valueOf(body.get("name")))
                .price(new BigDecimal(String.valueOf(body.get("price")).trim()))
                .description(description != null ? String.valueOf(description) : null)
                .category(String.valueOf(body.get("category")))
                .createdAt(OffsetDateTime.now(ZoneOffset.UTC).toString())
                .build();
        log.debug("Created product id={}", product.getId());
        return product;
    }
}
