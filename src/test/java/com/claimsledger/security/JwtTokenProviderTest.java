package com.claimsledger.security;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class JwtTokenProviderTest {

    private static final String SECRET = "test-secret-key-that-is-long-enough!!";

    private JwtTokenProvider provider;

    @BeforeEach
    void setUp() {
        provider = new JwtTokenProvider(SECRET, 3_600_000L);
    }

    @Test @DisplayName("generateToken → isValid returns true")
    void generateAndValidate() {
        String token = provider.generateToken("underwriter@test", List.of("UNDERWRITER"));
        assertThat(provider.isValid(token)).isTrue();
    }

    @Test @DisplayName("extractActor returns the subject")
    void extractActor() {
        String token = provider.generateToken("alice@test", List.of("ADMIN"));
        assertThat(provider.extractActor(token)).isEqualTo("alice@test");
    }

    @Test @DisplayName("extractRoles returns the roles claim")
    void extractRoles() {
        String token = provider.generateToken("bob@test", List.of("UNDERWRITER", "VIEWER"));
        assertThat(provider.extractRoles(token)).containsExactly("UNDERWRITER", "VIEWER");
    }

    @Test @DisplayName("null roles → empty roles claim")
    void noRoles() {
        String token = provider.generateToken("batch-importer", null);
        assertThat(provider.extractRoles(token)).isEmpty();
    }

    @Test @DisplayName("tampered token → isValid returns false")
    void tamperedToken() {
        String token = provider.generateToken("user@test", List.of("VIEWER"));
        assertThat(provider.isValid(flipSignatureChar(token))).isFalse();
    }

    @Test @DisplayName("altered payload under the original signature → isValid returns false")
    void alteredPayload() {
        String token = provider.generateToken("user@test", List.of("VIEWER"));
        int i = token.indexOf('.') + 3;
        String altered = token.substring(0, i) + swap(token.charAt(i)) + token.substring(i + 1);
        assertThat(provider.isValid(altered)).isFalse();
    }

    @Test @DisplayName("token signed with another secret → isValid returns false")
    void foreignSecret() {
        var other = new JwtTokenProvider("another-secret-key-that-is-long-enough", 3_600_000L);
        String token = other.generateToken("user@test", List.of("ADMIN"));
        assertThat(provider.isValid(token)).isFalse();
    }

    @Test @DisplayName("null token → isValid returns false")
    void nullToken() {
        assertThat(provider.isValid(null)).isFalse();
    }

    @Test @DisplayName("expired token → isValid returns false")
    void expiredToken() {
        var expired = new JwtTokenProvider(SECRET, -1L);
        String token = expired.generateToken("user@test", List.of("VIEWER"));
        assertThat(expired.isValid(token)).isFalse();
    }

    @Test @DisplayName("blank subject → IllegalArgumentException")
    void blankSubject() {
        assertThatThrownBy(() -> provider.generateToken(" ", List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test @DisplayName("short secret < 32 chars → IllegalStateException on construction")
    void shortSecret() {
        assertThatThrownBy(() -> new JwtTokenProvider("tooshort", 3600L))
            .isInstanceOf(IllegalStateException.class);
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    /**
     * Changes one character well inside the signature segment. Appending a
     * character is not enough: a trailing partial base64url sextet is dropped
     * by the decoder and the signature bytes stay the same.
     */
    private static String flipSignatureChar(String token) {
        int i = token.lastIndexOf('.') + 5;
        return token.substring(0, i) + swap(token.charAt(i)) + token.substring(i + 1);
    }

    private static char swap(char c) {
        return c == 'A' ? 'B' : 'A';
    }
}
