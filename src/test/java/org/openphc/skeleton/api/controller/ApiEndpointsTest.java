package org.openphc.skeleton.api.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openphc.skeleton.api.exception.GlobalExceptionHandler;
import org.openphc.skeleton.api.filter.RequestLoggingFilter;
import org.openphc.skeleton.api.filter.SecurityHeadersFilter;
import org.openphc.skeleton.config.AppConfiguration;
import org.openphc.skeleton.security.AuthenticationInterceptor;
import org.openphc.skeleton.security.TokenService;
import org.openphc.skeleton.service.ErrorClassifier;
import org.openphc.skeleton.service.ErrorResponder;
import org.openphc.skeleton.service.ProductService;
import org.openphc.skeleton.service.SystemInfoService;
import org.openphc.skeleton.service.UserService;
import org.openphc.skeleton.validation.RequestValidator;
import org.openphc.skeleton.validation.ValidationRuleSets;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Request-level tests for the REST endpoints, wired by hand against a production configuration.
 */
class ApiEndpointsTest {

    private static final String SECRET = "test-secret-0123456789-0123456789-abcdef";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    private AppConfiguration configuration;
    private TokenService tokenService;
    private MockMvc mockMvc;

    private static AppConfiguration configuration(long jwtExpiration) {
        return AppConfiguration.of("production", Map.of(
                "port", 3000,
                "databaseUrl", "postgres://localhost:5432/app",
                "jwtSecret", SECRET,
                "jwtExpiration", jwtExpiration));
    }

    @BeforeEach
    void setUp() {
        configuration = configuration(3600);
        tokenService = new TokenService(configuration);
        ErrorResponder responder = new ErrorResponder(
                new ErrorClassifier(), configuration, new SimpleMeterRegistry(), objectMapper);
        RequestValidator validator = new RequestValidator(executor);
        ValidationRuleSets ruleSets = new ValidationRuleSets(Validation.buildDefaultValidatorFactory().getValidator());
        SystemInfoService systemInfoService = new SystemInfoService(configuration);

        mockMvc = MockMvcBuilders.standaloneSetup(
                        new HealthController(systemInfoService),
                        new SystemController(configuration, systemInfoService, responder),
                        new UserController(validator, ruleSets, new UserService(), responder),
                        new ProductController(validator, ruleSets, new ProductService(), responder),
                        new EntityController(),
                        new AuthController(validator, ruleSets, tokenService, responder),
                        new ProtectedController())
                .setControllerAdvice(new GlobalExceptionHandler(responder))
                .addMappedInterceptors(new String[]{"/api/protected/**"},
                        new AuthenticationInterceptor(tokenService, responder))
                .addFilters(new SecurityHeadersFilter(), new RequestLoggingFilter())
                .build();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    // --- Users ---

    @Test
    void shouldRejectInvalidUserWithViolations() throws Exception {
        mockMvc.perform(post("/api/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "A"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("fail"))
                .andExpect(jsonPath("$.message").value(startsWith("Invalid email format")))
                .andExpect(jsonPath("$.errors.length()").value(4))
                .andExpect(jsonPath("$.errors[3].field").value("name"))
                .andExpect(jsonPath("$.stackTrace").doesNotExist());
    }

    @Test
    void shouldCreateValidUser() throws Exception {
        mockMvc.perform(post("/api/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "email", "Jane.Doe@Example.com",
                                "password", "Secret123",
                                "name", "Jane Doe"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").exists())
                .andExpect(jsonPath("$.email").value("jane.doe@example.com"))
                .andExpect(jsonPath("$.name").value("Jane Doe"));
    }

    @Test
    void shouldRejectNonUuidUserId() throws Exception {
        mockMvc.perform(get("/api/users/not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid ID format"));
    }

    @Test
    void shouldReportUnknownUser() throws Exception {
        mockMvc.perform(get("/api/users/3f2504e0-4f89-11d3-9a0c-0305e82c3301"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("fail"))
                .andExpect(jsonPath("$.message").value("User not found"));
    }

    @Test
    void shouldRejectMalformedJsonBody() throws Exception {
        mockMvc.perform(post("/api/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));
    }

    // --- Products & entities ---

    @Test
    void shouldCreateProduct() throws Exception {
        mockMvc.perform(post("/api/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Desk lamp", "price", 19.99, "category", "lighting"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.data.name").value("Desk lamp"))
                .andExpect(jsonPath("$.data.description").doesNotExist());
    }

    @Test
    void shouldRejectProductWithNegativePrice() throws Exception {
        Map<String, Object> product = new HashMap<>();
        product.put("name", "Desk lamp");
        product.put("price", -1);
        product.put("category", "lighting");

        mockMvc.perform(post("/api/products")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(product)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Price must be a positive number"))
                .andExpect(jsonPath("$.errors[0].field").value("price"));
    }

    @Test
    void shouldReportBeanValidationFailureForEntityId() throws Exception {
        mockMvc.perform(post("/api/entities/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("id", "12345"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("fail"))
                .andExpect(jsonPath("$.message").value("Invalid ID format (UUID required)"))
                .andExpect(jsonPath("$.errors[0].field").value("id"));
    }

    @Test
    void shouldReportMissingEntityId() throws Exception {
        mockMvc.perform(post("/api/entities/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.length()").value(1))
                .andExpect(jsonPath("$.message").value("Invalid ID format (UUID required)"));
    }

    @Test
    void shouldAcceptUuidEntityId() throws Exception {
        mockMvc.perform(post("/api/entities/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("id", "3f2504e0-4f89-11d3-9a0c-0305e82c3301"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value("3f2504e0-4f89-11d3-9a0c-0305e82c3301"));
    }

    // --- Authentication ---

    @Test
    void shouldIssueTokenOnLogin() throws Exception {
        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", "jane@example.com", "password", "whatever"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.token").isString())
                .andExpect(jsonPath("$.data.tokenType").value("Bearer"))
                .andExpect(jsonPath("$.data.expiresIn").value(3600));
    }

    @Test
    void shouldRequireTokenForProtectedRoute() throws Exception {
        mockMvc.perform(get("/api/protected"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.status").value("fail"))
                .andExpect(jsonPath("$.message").value("Access token required"));
    }

    @Test
    void shouldLetCorsPreflightReachProtectedRoute() throws Exception {
        mockMvc.perform(options("/api/protected")
                        .header("Origin", "https://app.example.com")
                        .header("Access-Control-Request-Method", "GET")
                        .header("Access-Control-Request-Headers", "Authorization"))
                .andExpect(status().isOk());
    }

    @Test
    void shouldRejectInvalidToken() throws Exception {
        mockMvc.perform(get("/api/protected").header("Authorization", "Bearer not.a.jwt"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid token"));
    }

    @Test
    void shouldRejectExpiredToken() throws Exception {
        String expired = new TokenService(configuration(-60)).issueToken("jane@example.com", "user");

        mockMvc.perform(get("/api/protected").header("Authorization", "Bearer " + expired))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Token expired"));
    }

    @Test
    void shouldGrantAccessWithValidToken() throws Exception {
        String token = tokenService.issueToken("jane@example.com", "user");

        mockMvc.perform(get("/api/protected").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Access granted"))
                .andExpect(jsonPath("$.user.subject").value("jane@example.com"));
    }

    // --- System ---

    @Test
    void shouldMaskSimulatedErrorInProduction() throws Exception {
        mockMvc.perform(get("/api/simulate-error"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").value("Internal Server Error"))
                .andExpect(jsonPath("$.stackTrace").doesNotExist())
                .andExpect(jsonPath("$.errorDetail").doesNotExist());
    }

    @Test
    void shouldReportApiStatus() throws Exception {
        mockMvc.perform(get("/api"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OK"))
                .andExpect(jsonPath("$.message").value("Service is running"));
    }

    @Test
    void shouldReportHealthWithUptime() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OK"))
                .andExpect(jsonPath("$.uptime").isNumber());
    }

    @Test
    void shouldDescribeEnvironmentOnWelcome() throws Exception {
        mockMvc.perform(get("/api/welcome"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.environment").value("production"));
    }

    @Test
    void shouldAddSecurityAndCorrelationHeaders() throws Exception {
        mockMvc.perform(get("/api").header(RequestLoggingFilter.CORRELATION_ID_HEADER, "corr-test-1"))
                .andExpect(header().string("X-Content-Type-Options", "nosniff"))
                .andExpect(header().string("X-Frame-Options", "DENY"))
                .andExpect(header().string(RequestLoggingFilter.CORRELATION_ID_HEADER, "corr-test-1"));
    }
}
