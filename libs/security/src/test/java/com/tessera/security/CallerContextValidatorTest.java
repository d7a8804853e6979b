package com.tessera.security;

import static org.assertj.core.api.Assertions.assertThat;

import com.tessera.security.testing.TestCallers;
import java.util.Arrays;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CallerContextValidator")
class CallerContextValidatorTest {

    @Test
    @DisplayName("accepts a caller with a user id, even if a tenant_role value is malformed")
    void accepts() {
        var caller = TestCallers.user("u-1").member(UUID.randomUUID(), TenantRole.VIEWER).rawTenantRole("junk").build();
        assertThat(CallerContextValidator.validate(caller).valid()).isTrue();
    }

    @Test
    @DisplayName("reports all problems at once")
    void reportsAll() {
        var caller = new AuthenticatedCaller(" ", Arrays.asList(new Claim("", "v"), null));

        var result = CallerContextValidator.validate(caller);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly(
                "userId must not be null or blank",
                "claims[0].type must not be null or blank",
                "claims[1] must not be null");
    }

    @Test
    @DisplayName("accepts a user id of the maximum length and rejects a longer one")
    void userIdLength() {
        var longest = TestCallers.user("u".repeat(AuthenticatedCaller.MAX_USER_ID_LENGTH)).build();
        var tooLong = TestCallers.user("u".repeat(AuthenticatedCaller.MAX_USER_ID_LENGTH + 1)).build();

        assertThat(CallerContextValidator.validate(longest).valid()).isTrue();
        assertThat(CallerContextValidator.validate(tooLong).errors())
                .containsExactly("userId must not exceed 255 characters");
    }

    @Test
    @DisplayName("rejects a null caller")
    void nullCaller() {
        assertThat(CallerContextValidator.validate(null).valid()).isFalse();
    }
}
