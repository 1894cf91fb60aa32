package tech.simplekanban.platform.csrf;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.simplekanban.platform.testing.Fixtures;

import static org.assertj.core.api.Assertions.*;

class CsrfTokenServiceTest {

    private final CsrfTokenService service = new CsrfTokenService(Fixtures.secretKeyProvider());

    @Test
    @DisplayName("tokenFor should be stable for a session and differ between sessions")
    void tokenFor_shouldBeDeterministic_perSession() {
        assertThat(service.tokenFor("sess_1")).isEqualTo(service.tokenFor("sess_1"));
        assertThat(service.tokenFor("sess_1")).isNotEqualTo(service.tokenFor("sess_2"));
        assertThat(service.tokenFor("sess_1")).matches("[A-Za-z0-9_-]{43}");
    }

    @Test
    @DisplayName("matches should accept only the token of the same session")
    void matches_shouldRejectOtherSessionsToken() {
        String token = service.tokenFor("sess_1");

        assertThat(service.matches("sess_1", token)).isTrue();
        assertThat(service.matches("sess_2", token)).isFalse();
        assertThat(service.matches("sess_1", null)).isFalse();
        assertThat(service.matches("sess_1", "")).isFalse();
    }
}
