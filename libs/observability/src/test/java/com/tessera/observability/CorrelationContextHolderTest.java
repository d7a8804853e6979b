package com.tessera.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should return empty when no context is set")
        void shouldReturnEmptyWhenNoContext() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(CorrelationContextHolder.currentCorrelationId()).isNull();
        }

        @Test
        @DisplayName("should store, retrieve and clear context")
        void shouldStoreAndClear() {
            var ctx = new CorrelationContext("corr-1", "user-1", null);
            CorrelationContextHolder.set(ctx);
            assertThat(CorrelationContextHolder.get()).contains(ctx);

            CorrelationContextHolder.clear();
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should reject null context")
        void shouldRejectNullContext() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
        }

        @Test
        @DisplayName("should reject a blank correlation id")
        void shouldRejectBlankId() {
            assertThatThrownBy(() -> CorrelationContext.of(" "))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("should populate MDC keys and remove null ones")
        void shouldPopulateMdc() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "user-1", "t-1"));
            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("userId")).isEqualTo("user-1");
            assertThat(MDC.get("tenantId")).isEqualTo("t-1");

            CorrelationContextHolder.set(CorrelationContext.of("corr-2"));
            assertThat(MDC.get("userId")).isNull();
            assertThat(MDC.get("tenantId")).isNull();
        }

        @Test
        @DisplayName("update() adds the tenant once it is resolved")
        void updateAddsTenant() {
            CorrelationContextHolder.set(CorrelationContext.of("corr-1").withUserId("u"));
            CorrelationContextHolder.update(c -> c.withTenantId("t-9"));

            assertThat(MDC.get("tenantId")).isEqualTo("t-9");
            assertThat(CorrelationContextHolder.get()).get()
                    .extracting(CorrelationContext::userId).isEqualTo("u");
        }

        @Test
        @DisplayName("update() without a context does nothing")
        void updateWithoutContext() {
            CorrelationContextHolder.update(c -> c.withTenantId("t-9"));
            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(MDC.get("tenantId")).isNull();
        }

        @Test
        @DisplayName("clear() removes all MDC keys")
        void clearRemovesMdc() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "user-1", "t-1"));
            CorrelationContextHolder.clear();
            assertThat(MDC.get("correlationId")).isNull();
            assertThat(MDC.get("userId")).isNull();
            assertThat(MDC.get("tenantId")).isNull();
        }
    }

    @Nested
    @DisplayName("runWithContext")
    class RunWithContext {

        @Test
        @DisplayName("should restore the previous context afterwards")
        void restoresPrevious() {
            var outer = CorrelationContext.of("outer");
            CorrelationContextHolder.set(outer);

            CorrelationContextHolder.runWithContext(CorrelationContext.of("inner"),
                    () -> assertThat(CorrelationContextHolder.currentCorrelationId()).isEqualTo("inner"));

            assertThat(CorrelationContextHolder.get()).contains(outer);
        }

        @Test
        @DisplayName("should clear when there was no previous context")
        void clearsWhenNoPrevious() {
            CorrelationContextHolder.runWithContext(CorrelationContext.of("inner"), () -> { });
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }
    }
}
