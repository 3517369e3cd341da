package com.github.dimitryivaniuta.labelbridge.auth;

import com.github.dimitryivaniuta.labelbridge.auth.dto.ChangeSecretRequest;
import com.github.dimitryivaniuta.labelbridge.auth.dto.LoginRequest;
import com.github.dimitryivaniuta.labelbridge.auth.dto.PrincipalView;
import com.github.dimitryivaniuta.labelbridge.auth.dto.RegisterRequest;
import com.github.dimitryivaniuta.labelbridge.auth.dto.TokenResponse;
import com.github.dimitryivaniuta.labelbridge.credential.AuthenticatedPrincipal;
import com.github.dimitryivaniuta.labelbridge.web.RequestContextKeys;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    @PostMapping("/login")
    public TokenResponse login(@Valid @RequestBody LoginRequest req) {
        return authService.login(req.identifier(), req.secret());
    }

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public TokenResponse register(@Valid @RequestBody RegisterRequest req) {
        return authService.register(req);
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout(
            @RequestAttribute(RequestContextKeys.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal) {
        authService.logout(principal);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/me")
    public PrincipalView me(
            @RequestAttribute(RequestContextKeys.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal) {
        return authService.view(principal);
    }

    @PostMapping("/change-password")
    public TokenResponse changePassword(
            @RequestAttribute(RequestContextKeys.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @Valid @RequestBody ChangeSecretRequest req) {
        return authService.changeSecret(principal, req.currentSecret(), req.newSecret());
    }
}
