package com.github.dimitryivaniuta.labelbridge.auth;

import com.github.dimitryivaniuta.labelbridge.auth.dto.PrincipalView;
import com.github.dimitryivaniuta.labelbridge.auth.dto.RegisterRequest;
import com.github.dimitryivaniuta.labelbridge.auth.dto.TokenResponse;
import com.github.dimitryivaniuta.labelbridge.credential.AccountDisabledException;
import com.github.dimitryivaniuta.labelbridge.credential.AuthenticatedPrincipal;
import com.github.dimitryivaniuta.labelbridge.credential.InvalidCredentialsException;
import com.github.dimitryivaniuta.labelbridge.credential.WeakSecretException;
import com.github.dimitryivaniuta.labelbridge.metrics.LabelBridgeMetrics;
import com.github.dimitryivaniuta.labelbridge.web.GlobalExceptionHandler;
import com.github.dimitryivaniuta.labelbridge.web.RequestContextKeys;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AuthControllerTest {

    private AuthService authService;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        authService = mock(AuthService.class);
        mvc = MockMvcBuilders.standaloneSetup(new AuthController(authService))
                .setControllerAdvice(new GlobalExceptionHandler(new LabelBridgeMetrics(new SimpleMeterRegistry())))
                .build();
    }

    private static final String LOGIN = "{\"identifier\":\"alice@example.com\",\"secret\":\"Secret123\"}";

    @Test
    void loginReturnsToken() throws Exception {
        PrincipalView view = new PrincipalView(5L, "alice@example.com", "Alice", false, List.of());
        when(authService.login("alice@example.com", "Secret123"))
                .thenReturn(new TokenResponse("jwt", Instant.parse("2026-01-01T01:00:00Z"), view));

        mvc.perform(post("/api/auth/login").contentType(MediaType.APPLICATION_JSON).content(LOGIN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token").value("jwt"))
                .andExpect(jsonPath("$.principal.identifier").value("alice@example.com"));
    }

    @Test
    void unknownUserAndDisabledAccountLookIdentical() throws Exception {
        when(authService.login(anyString(), anyString()))
                .thenThrow(new InvalidCredentialsException("Unknown identifier"))
                .thenThrow(new AccountDisabledException("Principal 5 is deactivated"));

        for (int i = 0; i < 2; i++) {
            mvc.perform(post("/api/auth/login").contentType(MediaType.APPLICATION_JSON).content(LOGIN))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.message").value("Authentication failed"));
        }
    }

    @Test
    void blankFieldsFailValidation() throws Exception {
        mvc.perform(post("/api/auth/login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"identifier\":\"\",\"secret\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"));
        verifyNoInteractions(authService);
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mvc.perform(post("/api/auth/login").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void weakSecretOnRegisterExplainsPolicy() throws Exception {
        when(authService.register(any(RegisterRequest.class)))
                .thenThrow(new WeakSecretException("Secret must contain at least one number"));

        mvc.perform(post("/api/auth/register").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"identifier\":\"bob@example.com\",\"displayName\":\"Bob\",\"secret\":\"Abcdefgh\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Secret must contain at least one number"));
    }

    @Test
    void duplicateRegistrationIsConflict() throws Exception {
        when(authService.register(any(RegisterRequest.class)))
                .thenThrow(new ResponseStatusException(HttpStatus.CONFLICT, "Identifier already registered"));

        mvc.perform(post("/api/auth/register").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"identifier\":\"bob@example.com\",\"displayName\":\"Bob\",\"secret\":\"Abcdefg1\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void registerRejectsNonEmailIdentifier() throws Exception {
        mvc.perform(post("/api/auth/register").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"identifier\":\"bob\",\"displayName\":\"Bob\",\"secret\":\"Abcdefg1\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void meReadsPrincipalFromRequestAttribute() throws Exception {
        AuthenticatedPrincipal principal = new AuthenticatedPrincipal(5L, "alice@example.com", "Alice", false, 0L, Set.of());
        when(authService.view(principal))
                .thenReturn(new PrincipalView(5L, "alice@example.com", "Alice", false, List.of()));

        mvc.perform(get("/api/auth/me").requestAttr(RequestContextKeys.PRINCIPAL_ATTRIBUTE, principal))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(5));
    }

    @Test
    void logoutHasNoContent() throws Exception {
        AuthenticatedPrincipal principal = new AuthenticatedPrincipal(5L, "alice@example.com", "Alice", false, 0L, Set.of());

        mvc.perform(post("/api/auth/logout").requestAttr(RequestContextKeys.PRINCIPAL_ATTRIBUTE, principal))
                .andExpect(status().isNoContent());
        verify(authService).logout(principal);
    }
}
