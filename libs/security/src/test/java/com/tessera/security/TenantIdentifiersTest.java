package com.tessera.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("TenantIdentifiers")
class TenantIdentifiersTest {

    @Test
    @DisplayName("parses a canonical identifier")
    void parsesCanonical() {
        UUID id = UUID.randomUUID();
        assertThat(TenantIdentifiers.parse(id.toString())).contains(id);
    }

    @Test
    @DisplayName("accepts upper-case hex and normalizes it")
    void upperCase() {
        UUID id = UUID.fromString("6f1c2a9e-0b7d-4e55-9a3c-1d2e3f405162");
        assertThat(TenantIdentifiers.parse("6F1C2A9E-0B7D-4E55-9A3C-1D2E3F405162")).contains(id);
        assertThat(TenantIdentifiers.format(id)).isEqualTo("6f1c2a9e-0b7d-4e55-9a3c-1d2e3f405162");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
            "not-a-guid",
            "1-2-3-4-5",
            "6f1c2a9e0b7d4e559a3c1d2e3f405162",
            "{6f1c2a9e-0b7d-4e55-9a3c-1d2e3f405162}",
            " 6f1c2a9e-0b7d-4e55-9a3c-1d2e3f405162",
            "6f1c2a9e-0b7d-4e55-9a3c-1d2e3f40516g"
    })
    @DisplayName("rejects anything that is not a canonical identifier")
    void rejectsMalformed(String value) {
        assertThat(TenantIdentifiers.parse(value)).isEmpty();
    }
}
