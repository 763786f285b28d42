package com.relaydesk.support.transfer.service;

import com.relaydesk.support.SupportFixtures;
import com.relaydesk.support.auth.service.jwt.JwtClaims;
import com.relaydesk.support.bootstrap.RelayDeskApplication;
import com.relaydesk.support.transfer.api.TransferItem;
import com.relaydesk.support.transfer.settings.TransferSettings;
import com.relaydesk.support.transfer.settings.TransferSettingsRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(classes = RelayDeskApplication.class, properties = "app.sla.enabled=false")
@ActiveProfiles("dev")
class TransferQueueServiceTest {

    @Autowired
    private TransferQueueService transferQueueService;

    @Autowired
    private TransferSettingsRepository settingsRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private SupportFixtures fx;
    private String tenantId;

    @BeforeEach
    void setUp() {
        fx = new SupportFixtures(jdbcTemplate);
        tenantId = fx.tenant();
    }

    private JwtClaims agent() {
        return new JwtClaims(fx.user(tenantId, "agent"), tenantId, "agent", "agent");
    }

    @Test
    void picks_oldest_unassigned_transfer_first() {
        var t0 = Instant.now().minus(Duration.ofHours(1));
        var newer = fx.queuedTransfer(tenantId, fx.contact(tenantId), null, t0.plusSeconds(30));
        var oldest = fx.queuedTransfer(tenantId, fx.contact(tenantId), null, t0);
        var claims = agent();

        var picked = transferQueueService.pickNextTransfer(claims, null);

        assertThat(picked).map(TransferItem::id).contains(oldest);
        assertThat(picked.get().agent_id()).isEqualTo(claims.userId());
        assertThat(picked.get().picked_up_at()).isNotNull();
        assertThat(fx.string("select assigned_user_id from contact where id = ?", picked.get().contact_id())).isEqualTo(claims.userId());
        assertThat(fx.string("select transferred_by_user_id from agent_transfer where id = ?", oldest)).isEqualTo(claims.userId());

        assertThat(transferQueueService.pickNextTransfer(agent(), null)).map(TransferItem::id).contains(newer);
        assertThat(transferQueueService.pickNextTransfer(agent(), null)).isEmpty();
    }

    @Test
    void late_pickup_is_flagged_as_breached() {
        var t0 = Instant.now().minus(Duration.ofMinutes(30));
        var id = fx.transfer(tenantId, fx.contact(tenantId), null, null, t0, t0.plus(Duration.ofMinutes(10)), null, null);

        var picked = transferQueueService.pickNextTransfer(agent(), null);

        assertThat(picked).map(TransferItem::id).contains(id);
        assertThat(picked.get().sla_breached()).isTrue();
        assertThat(fx.instant("select sla_breached_at from agent_transfer where id = ?", id)).isNotNull();
    }

    @Test
    void agents_cannot_pick_when_pickup_is_disabled() {
        fx.queuedTransfer(tenantId, fx.contact(tenantId), null, Instant.now());
        var defaults = TransferSettings.defaults(tenantId);
        settingsRepository.upsert(new TransferSettings(tenantId, false, false, defaults.sla(), defaults.clientInactivity()));

        assertThatThrownBy(() -> transferQueueService.pickNextTransfer(agent(), null)).hasMessage("forbidden");

        var manager = new JwtClaims(fx.user(tenantId, "manager"), tenantId, "manager", "manager");
        assertThat(transferQueueService.pickNextTransfer(manager, null)).isPresent();
    }

    @Test
    void team_scope_requires_membership() {
        var team = fx.team(tenantId, "manual");
        var other = fx.team(tenantId, "manual");
        var now = Instant.now();
        fx.queuedTransfer(tenantId, fx.contact(tenantId), null, now.minusSeconds(60));
        var inTeam = fx.queuedTransfer(tenantId, fx.contact(tenantId), team, now);
        var inOther = fx.queuedTransfer(tenantId, fx.contact(tenantId), other, now.minusSeconds(120));
        var member = agent();
        fx.member(team, member.userId());

        assertThatThrownBy(() -> transferQueueService.pickNextTransfer(member, other)).hasMessage("forbidden");
        assertThat(transferQueueService.pickNextTransfer(member, team)).map(TransferItem::id).contains(inTeam);

        var admin = new JwtClaims(fx.user(tenantId, "admin"), tenantId, "admin", "admin");
        assertThat(transferQueueService.pickNextTransfer(admin, null)).map(TransferItem::id).contains(inOther);
    }

    @Test
    void default_scope_covers_own_teams_and_general_queue_only() {
        var team = fx.team(tenantId, "manual");
        var other = fx.team(tenantId, "manual");
        var now = Instant.now();
        fx.queuedTransfer(tenantId, fx.contact(tenantId), other, now.minusSeconds(300));
        var general = fx.queuedTransfer(tenantId, fx.contact(tenantId), null, now.minusSeconds(200));
        var inTeam = fx.queuedTransfer(tenantId, fx.contact(tenantId), team, now.minusSeconds(100));
        var member = agent();
        fx.member(team, member.userId());

        assertThat(transferQueueService.pickNextTransfer(member, null)).map(TransferItem::id).contains(general);
        assertThat(transferQueueService.pickNextTransfer(member, null)).map(TransferItem::id).contains(inTeam);
        assertThat(transferQueueService.pickNextTransfer(member, null)).isEmpty();
        assertThat(transferQueueService.pickNextTransfer(agent(), "general")).isEmpty();
    }

    @Test
    void resumed_and_assigned_transfers_are_not_picked() {
        var now = Instant.now();
        var resumed = fx.queuedTransfer(tenantId, fx.contact(tenantId), null, now.minusSeconds(60));
        jdbcTemplate.update("update agent_transfer set status = 'resumed', active_contact_key = null where id = ?", resumed);
        fx.transfer(tenantId, fx.contact(tenantId), null, fx.user(tenantId, "agent"), now.minusSeconds(30), null, null, null);

        assertThat(transferQueueService.pickNextTransfer(agent(), null)).isEmpty();
    }

    @Test
    void concurrent_pickers_never_receive_the_same_transfer() throws Exception {
        int transfers = 5;
        int pickers = 8;
        var t0 = Instant.now().minus(Duration.ofMinutes(5));
        for (int i = 0; i < transfers; i++) {
            fx.queuedTransfer(tenantId, fx.contact(tenantId), null, t0.plusSeconds(i));
        }
        var agents = new ArrayList<JwtClaims>();
        for (int i = 0; i < pickers; i++) {
            agents.add(agent());
        }

        Map<String, String> pickedBy = new ConcurrentHashMap<>();
        List<String> duplicates = Collections.synchronizedList(new ArrayList<>());
        var start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(pickers);
        try {
            var futures = new ArrayList<Future<?>>();
            for (var claims : agents) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int attempt = 0; attempt < 5; attempt++) {
                        try {
                            var picked = transferQueueService.pickNextTransfer(claims, null);
                            picked.ifPresent(t -> {
                                if (pickedBy.putIfAbsent(t.id(), claims.userId()) != null) {
                                    duplicates.add(t.id());
                                }
                            });
                            return null;
                        } catch (RuntimeException e) {
                            // lock timeout under contention, retry
                            Thread.sleep(20);
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (var f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(duplicates).isEmpty();
        assertThat(pickedBy.size()).isLessThanOrEqualTo(transfers);
        assertThat(new HashMap<>(pickedBy).values()).doesNotHaveDuplicates();
        pickedBy.forEach((transferId, userId) ->
                assertThat(fx.string("select agent_user_id from agent_transfer where id = ?", transferId)).isEqualTo(userId));

        var admin = new JwtClaims(fx.user(tenantId, "admin"), tenantId, "admin", "admin");
        int drained = 0;
        while (transferQueueService.pickNextTransfer(admin, null).isPresent()) {
            drained++;
        }
        assertThat(pickedBy.size() + drained).isEqualTo(transfers);
        assertThat(fx.count("select count(1) from agent_transfer where tenant_id = ? and agent_user_id is null", tenantId)).isZero();
    }
}
