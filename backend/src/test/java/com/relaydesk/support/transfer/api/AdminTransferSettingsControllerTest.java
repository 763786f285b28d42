package com.relaydesk.support.transfer.api;

import com.relaydesk.support.SupportFixtures;
import com.relaydesk.support.auth.service.jwt.JwtService;
import com.relaydesk.support.bootstrap.RelayDeskApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = RelayDeskApplication.class, properties = "app.sla.enabled=false")
@AutoConfigureMockMvc
@ActiveProfiles("dev")
class AdminTransferSettingsControllerTest {

    @Autowired
    MockMvc mvc;

    @Autowired
    JwtService jwtService;

    @Autowired
    JdbcTemplate jdbcTemplate;

    private String tenantId;
    private String adminToken;

    @BeforeEach
    void setUp() {
        var fx = new SupportFixtures(jdbcTemplate);
        tenantId = fx.tenant();
        adminToken = "Bearer " + jwtService.issueAccessToken(fx.user(tenantId, "admin"), tenantId, "admin", "admin", Duration.ofHours(1));
    }

    @Test
    void defaults_for_new_tenant() throws Exception {
        mvc.perform(get("/api/v1/admin/transfer-settings").header("Authorization", adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.data.assign_to_same_agent").value(false))
                .andExpect(jsonPath("$.data.allow_agent_queue_pickup").value(true))
                .andExpect(jsonPath("$.data.sla.enabled").value(false))
                .andExpect(jsonPath("$.data.client_inactivity.reminder_enabled").value(false));
    }

    @Test
    void partial_updates_are_merged() throws Exception {
        mvc.perform(put("/api/v1/admin/transfer-settings")
                        .header("Authorization", adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sla":{"enabled":true,"response_minutes":10,"escalation_minutes":-5,
                                        "warning_message":"  Hang on  ","escalation_notify_ids":["u1"," u1 ","","u2"]}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.sla.enabled").value(true))
                .andExpect(jsonPath("$.data.sla.response_minutes").value(10))
                .andExpect(jsonPath("$.data.sla.escalation_minutes").value(0))
                .andExpect(jsonPath("$.data.sla.warning_message").value("Hang on"))
                .andExpect(jsonPath("$.data.sla.escalation_notify_ids.length()").value(2));

        mvc.perform(put("/api/v1/admin/transfer-settings")
                        .header("Authorization", adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"assign_to_same_agent":true,
                                 "client_inactivity":{"reminder_enabled":true,"reminder_minutes":5,"reminder_message":"Still there?"}}
                                """))
                .andExpect(status().isOk());

        mvc.perform(get("/api/v1/admin/transfer-settings").header("Authorization", adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.assign_to_same_agent").value(true))
                .andExpect(jsonPath("$.data.sla.enabled").value(true))
                .andExpect(jsonPath("$.data.sla.response_minutes").value(10))
                .andExpect(jsonPath("$.data.sla.escalation_notify_ids[1]").value("u2"))
                .andExpect(jsonPath("$.data.client_inactivity.reminder_minutes").value(5))
                .andExpect(jsonPath("$.data.client_inactivity.reminder_message").value("Still there?"));
    }

    @Test
    void out_of_range_values_are_rejected() throws Exception {
        mvc.perform(put("/api/v1/admin/transfer-settings")
                        .header("Authorization", adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sla":{"response_minutes":99999999}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_response_minutes"));
    }

    @Test
    void agents_cannot_read_or_change_settings() throws Exception {
        var agentToken = "Bearer " + jwtService.issueAccessToken("u_agent", tenantId, "agent", "agent", Duration.ofHours(1));

        mvc.perform(get("/api/v1/admin/transfer-settings").header("Authorization", agentToken))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("forbidden"));
        mvc.perform(put("/api/v1/admin/transfer-settings")
                        .header("Authorization", agentToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"assign_to_same_agent\":true}"))
                .andExpect(status().isForbidden());
    }
}
