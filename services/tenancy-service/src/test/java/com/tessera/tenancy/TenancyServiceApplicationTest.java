package com.tessera.tenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tessera.security.TenantRolePolicies;
import com.tessera.tenancy.config.TenancyServiceProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Boots the whole service on the test profile, which needs no external infrastructure.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Tenancy Service Application")
class TenancyServiceApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;

    @Test
    @DisplayName("Spring context loads successfully")
    void contextLoads() {
        assertThat(context).isNotNull();
    }

    @Test
    @DisplayName("service properties are loaded from the test profile")
    void servicePropertiesAreLoaded() {
        var props = context.getBean(TenancyServiceProperties.class);
        assertThat(props.name()).isEqualTo("tenancy-service-test");
        assertThat(props.environment()).isEqualTo("test");
    }

    @Test
    @DisplayName("one policy per role is registered")
    void policiesRegistered() {
        assertThat(context.getBean(TenantRolePolicies.class).all()).hasSize(3);
    }

    @Test
    @DisplayName("actuator health is available without a caller")
    void actuatorHealth() throws Exception {
        mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
    }

    @Test
    @DisplayName("responses carry a correlation ID, even on rejected requests")
    void correlationIdOnResponse() throws Exception {
        mockMvc.perform(get("/api/tenant"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().exists("X-Correlation-ID"));
    }
}
