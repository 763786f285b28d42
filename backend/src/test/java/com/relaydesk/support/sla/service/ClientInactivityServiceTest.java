package com.relaydesk.support.sla.service;

import com.relaydesk.support.SupportFixtures;
import com.relaydesk.support.bootstrap.RelayDeskApplication;
import com.relaydesk.support.contact.repo.ContactRepository;
import com.relaydesk.support.message.service.CustomerMessageSender;
import com.relaydesk.support.transfer.settings.ClientInactivitySettings;
import com.relaydesk.support.transfer.settings.SlaSettings;
import com.relaydesk.support.transfer.settings.TransferSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest(classes = RelayDeskApplication.class, properties = "app.sla.enabled=false")
@ActiveProfiles("dev")
class ClientInactivityServiceTest {

    private static final Instant T0 = Instant.parse("2026-02-10T14:00:00Z");

    @Autowired
    private ClientInactivityService clientInactivityService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private SupportFixtures fx;
    private String tenantId;

    @BeforeEach
    void setUp() {
        fx = new SupportFixtures(jdbcTemplate);
        tenantId = fx.tenant();
    }

    private TransferSettings settings(String reminderMessage, int autoCloseMinutes) {
        return new TransferSettings(tenantId, false, true,
                new SlaSettings(true, 0, 0, 0, 0, null, null, List.of()),
                new ClientInactivitySettings(true, 5, reminderMessage, autoCloseMinutes, "Closing this chat for now."));
    }

    private static Instant at(int minutes) {
        return T0.plus(Duration.ofMinutes(minutes));
    }

    private int outbound(String contactId, String purpose) {
        return fx.count("select count(1) from outbound_message where contact_id = ? and purpose = ?", contactId, purpose);
    }

    @Test
    void reminds_once_then_closes_the_chatbot_conversation() {
        var settings = settings("Are you still there?", 15);
        var contact = fx.contact(tenantId);
        fx.chatbotLastMessageAt(contact, T0);

        assertThat(clientInactivityService.process(settings, at(3))).isEqualTo(new ClientInactivityService.Result(0, 0));

        assertThat(clientInactivityService.process(settings, at(6))).isEqualTo(new ClientInactivityService.Result(1, 0));
        assertThat(outbound(contact, "client_reminder")).isEqualTo(1);
        assertThat(fx.count("select count(1) from contact where id = ? and chatbot_reminder_sent = true", contact)).isEqualTo(1);

        assertThat(clientInactivityService.process(settings, at(8))).isEqualTo(new ClientInactivityService.Result(0, 0));
        assertThat(outbound(contact, "client_reminder")).isEqualTo(1);

        assertThat(clientInactivityService.process(settings, at(16))).isEqualTo(new ClientInactivityService.Result(0, 1));
        assertThat(outbound(contact, "client_auto_close")).isEqualTo(1);
        assertThat(fx.instant("select chatbot_last_message_at from contact where id = ?", contact)).isNull();
        assertThat(fx.count("select count(1) from contact where id = ? and chatbot_reminder_sent = false", contact)).isEqualTo(1);

        assertThat(clientInactivityService.process(settings, at(30))).isEqualTo(new ClientInactivityService.Result(0, 0));
    }

    @Test
    void auto_close_wins_over_a_pending_reminder() {
        var settings = settings("Are you still there?", 15);
        var contact = fx.contact(tenantId);
        fx.chatbotLastMessageAt(contact, T0);

        assertThat(clientInactivityService.process(settings, at(20))).isEqualTo(new ClientInactivityService.Result(0, 1));
        assertThat(outbound(contact, "client_reminder")).isZero();
        assertThat(outbound(contact, "client_auto_close")).isEqualTo(1);
    }

    @Test
    void contacts_with_an_active_transfer_are_skipped() {
        var settings = settings("Are you still there?", 15);
        var contact = fx.contact(tenantId);
        fx.chatbotLastMessageAt(contact, T0);
        fx.queuedTransfer(tenantId, contact, null, T0);

        assertThat(clientInactivityService.process(settings, at(20))).isEqualTo(new ClientInactivityService.Result(0, 0));
        assertThat(fx.instant("select chatbot_last_message_at from contact where id = ?", contact)).isEqualTo(T0);
    }

    @Test
    void reminder_without_message_is_not_marked_as_sent() {
        var settings = settings(null, 0);
        var contact = fx.contact(tenantId);
        fx.chatbotLastMessageAt(contact, T0);

        assertThat(clientInactivityService.process(settings, at(10))).isEqualTo(new ClientInactivityService.Result(0, 0));
        assertThat(fx.count("select count(1) from contact where id = ? and chatbot_reminder_sent = true", contact)).isZero();
    }

    @Test
    void disabled_reminders_do_nothing() {
        var settings = new TransferSettings(tenantId, false, true, SlaSettings.disabled(), ClientInactivitySettings.disabled());
        var contact = fx.contact(tenantId);
        fx.chatbotLastMessageAt(contact, T0);

        assertThat(clientInactivityService.process(settings, at(600))).isEqualTo(new ClientInactivityService.Result(0, 0));
        assertThat(fx.instant("select chatbot_last_message_at from contact where id = ?", contact)).isEqualTo(T0);
    }

    @Test
    void failed_reminder_is_retried_on_the_next_tick() {
        var contacts = mock(ContactRepository.class);
        var sender = mock(CustomerMessageSender.class);
        var row = new ContactRepository.ChatbotTrackingRow("c1", tenantId, "+15550001", "main", T0, false);
        when(contacts.listAwaitingChatbotReply(tenantId)).thenReturn(List.of(row));
        when(sender.send(any(), any())).thenThrow(new IllegalStateException("channel down"));
        var service = new ClientInactivityService(contacts, sender);

        var result = service.process(settings("Are you still there?", 0), at(6));

        assertThat(result).isEqualTo(new ClientInactivityService.Result(0, 0));
        verify(contacts, never()).markReminderSent("c1");
    }
}
