package com.github.dimitryivaniuta.labelbridge.credential;

import com.github.dimitryivaniuta.labelbridge.support.TestProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecretHashServiceTest {

    private final SecretHashService service = new SecretHashService(TestProperties.create());

    @Test
    void hashIsSaltedAndVerifiable() {
        String h1 = service.hash("Secret123");
        String h2 = service.hash("Secret123");

        assertThat(h1).startsWith("pbkdf2-sha256$1000$").isNotEqualTo(h2);
        assertThat(service.matches("Secret123", h1)).isTrue();
        assertThat(service.matches("Secret124", h1)).isFalse();
    }

    @Test
    void pepperIsPartOfTheHash() {
        var other = TestProperties.create();
        other.getSecrets().setPepper("different");
        SecretHashService otherService = new SecretHashService(other);

        assertThat(otherService.matches("Secret123", service.hash("Secret123"))).isFalse();
    }

    @Test
    void malformedHashesNeverMatch() {
        assertThat(service.matches("Secret123", null)).isFalse();
        assertThat(service.matches("Secret123", "plain-text")).isFalse();
        assertThat(service.matches("Secret123", "pbkdf2-sha256$x$y$z")).isFalse();
        assertThat(service.matchesNothing("Secret123")).isFalse();
    }

    @Test
    void policyRequiresLengthAndCharacterClasses() {
        assertThatThrownBy(() -> service.checkPolicy("Ab1")).isInstanceOf(WeakSecretException.class);
        assertThatThrownBy(() -> service.checkPolicy("abcdefgh1")).hasMessageContaining("uppercase");
        assertThatThrownBy(() -> service.checkPolicy("ABCDEFGH1")).hasMessageContaining("lowercase");
        assertThatThrownBy(() -> service.checkPolicy("Abcdefghi")).hasMessageContaining("number");
        service.checkPolicy("Abcdefg1");
    }
}
