package org.openphc.skeleton.service;

import lombok.extern.slf4j.Slf4j;
import org.openphc.skeleton.api.dto.UserDto;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Builds user records from validated request bodies. Nothing is stored.
 */
@Service
@Slf4j
public class UserService {

    /**
     * Create a user from a body that already passed the user rule set.
     */
    public UserDto create(Map<String, Object> body) {
        UserDto user = UserDto.builder()
                .id(UUID.randomUUID().toString())
                .name(String.valueOf(body.get("name")).trim())
                .email(String.valueOf(body.get("email")).trim().toLowerCase(Locale.ROOT))
                .createdAt(OffsetDateTime.now(ZoneOffset.UTC).toString())
                .build();
        log.debug("Created user id={}", user.getId());
        return user;
    }
}
