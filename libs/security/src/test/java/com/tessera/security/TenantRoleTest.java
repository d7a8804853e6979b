package com.tessera.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("TenantRole")
class TenantRoleTest {

    @Nested
    @DisplayName("hierarchy")
    class Hierarchy {

        @Test
        @DisplayName("Owner meets every role")
        void ownerMeetsAll() {
            assertThat(TenantRole.OWNER.meetsOrExceeds(TenantRole.VIEWER)).isTrue();
            assertThat(TenantRole.OWNER.meetsOrExceeds(TenantRole.EDITOR)).isTrue();
            assertThat(TenantRole.OWNER.meetsOrExceeds(TenantRole.OWNER)).isTrue();
        }

        @Test
        @DisplayName("Editor meets Viewer and Editor but not Owner")
        void editor() {
            assertThat(TenantRole.EDITOR.meetsOrExceeds(TenantRole.VIEWER)).isTrue();
            assertThat(TenantRole.EDITOR.meetsOrExceeds(TenantRole.EDITOR)).isTrue();
            assertThat(TenantRole.EDITOR.meetsOrExceeds(TenantRole.OWNER)).isFalse();
        }

        @Test
        @DisplayName("Viewer meets only Viewer")
        void viewer() {
            assertThat(TenantRole.VIEWER.meetsOrExceeds(TenantRole.VIEWER)).isTrue();
            assertThat(TenantRole.VIEWER.meetsOrExceeds(TenantRole.EDITOR)).isFalse();
            assertThat(TenantRole.VIEWER.meetsOrExceeds(TenantRole.OWNER)).isFalse();
        }

        @Test
        @DisplayName("rejects a null minimum")
        void nullMinimum() {
            assertThatThrownBy(() -> TenantRole.EDITOR.meetsOrExceeds(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("fromClaimName()")
    class FromClaimName {

        @ParameterizedTest
        @EnumSource(TenantRole.class)
        @DisplayName("resolves every role by its own claim name")
        void resolvesOwnName(TenantRole role) {
            assertThat(TenantRole.fromClaimName(role.claimName())).contains(role);
        }

        @Test
        @DisplayName("is case-sensitive")
        void caseSensitive() {
            assertThat(TenantRole.fromClaimName("editor")).isEmpty();
            assertThat(TenantRole.fromClaimName("EDITOR")).isEmpty();
            assertThat(TenantRole.fromClaimName("Admin")).isEmpty();
            assertThat(TenantRole.fromClaimName(null)).isEmpty();
        }
    }
}
