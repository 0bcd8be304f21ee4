package sh.harold.sessionlink.backend.local;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sh.harold.sessionlink.api.session.AdvertisingMode;
import sh.harold.sessionlink.api.session.BackendCompletion;
import sh.harold.sessionlink.api.session.BackendSubscription;
import sh.harold.sessionlink.api.session.JoinResult;
import sh.harold.sessionlink.api.session.OperationKind;
import sh.harold.sessionlink.api.session.PlayerIdentity;
import sh.harold.sessionlink.api.session.SessionConfig;
import sh.harold.sessionlink.api.session.SessionConstants;
import sh.harold.sessionlink.api.session.SessionSearchQuery;
import sh.harold.sessionlink.api.session.SessionSearchResult;
import sh.harold.sessionlink.api.session.SessionState;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class LocalSessionBackendTest {

    private static final String SESSION = SessionConstants.GAME_SESSION;
    private static final SessionSearchQuery LAN_LOBBIES = new SessionSearchQuery(100, true, true);

    private final PlayerIdentity host = new PlayerIdentity("host-1", "Hosty");
    private final PlayerIdentity guest = new PlayerIdentity("guest-1", "Guesty");
    private final PlayerIdentity latecomer = new PlayerIdentity("guest-2", "Late");

    private ScheduledExecutorService scheduler;
    private LocalSessionNetwork network;
    private LocalSessionBackend hostBackend;
    private LocalSessionBackend guestBackend;
    private LocalSessionBackend latecomerBackend;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        network = new LocalSessionNetwork();
        hostBackend = new LocalSessionBackend("192.168.1.10:7777", network, scheduler);
        guestBackend = new LocalSessionBackend("192.168.1.11:7777", network, scheduler);
        latecomerBackend = new LocalSessionBackend("192.168.1.12:7777", network, scheduler);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        scheduler.shutdownNow();
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
    }

    private static SessionConfig lanConfig(int slots, String tag) {
        return SessionConfig.builder()
                .maxPublicSlots(slots)
                .matchTag(tag)
                .advertisingMode(AdvertisingMode.LAN)
                .preferLobbies(true)
                .build();
    }

    private static BlockingQueue<BackendCompletion> listen(LocalSessionBackend backend, OperationKind kind) {
        BlockingQueue<BackendCompletion> queue = new LinkedBlockingQueue<>();
        backend.subscribe(kind, queue::add);
        return queue;
    }

    private static BackendCompletion await(BlockingQueue<BackendCompletion> queue) throws InterruptedException {
        BackendCompletion completion = queue.poll(5, TimeUnit.SECONDS);
        assertThat(completion).as("completion delivered").isNotNull();
        return completion;
    }

    private List<SessionSearchResult> search(LocalSessionBackend backend, PlayerIdentity searcher, SessionSearchQuery query)
            throws InterruptedException {
        BlockingQueue<BackendCompletion> found = listen(backend, OperationKind.FIND);
        assertThat(backend.findSessions(searcher, query)).isTrue();
        return await(found).getResults();
    }

    private JoinResult join(LocalSessionBackend backend, PlayerIdentity joiner, SessionSearchResult target)
            throws InterruptedException {
        BlockingQueue<BackendCompletion> joined = listen(backend, OperationKind.JOIN);
        assertThat(backend.joinSession(joiner, SESSION, target)).isTrue();
        return await(joined).getJoinResult();
    }

    @Test
    void hostedSessionIsDiscoverableByOthers() throws InterruptedException {
        BlockingQueue<BackendCompletion> created = listen(hostBackend, OperationKind.CREATE);

        assertThat(hostBackend.createSession(host, SESSION, lanConfig(4, "Deathmatch"))).isTrue();
        assertThat(await(created).isSuccess()).isTrue();

        List<SessionSearchResult> results = search(guestBackend, guest, LAN_LOBBIES);
        assertThat(results).hasSize(1);
        SessionSearchResult result = results.get(0);
        assertThat(result.handle()).isEqualTo("host-1/" + SESSION);
        assertThat(result.ownerName()).isEqualTo("Hosty");
        assertThat(result.openPublicSlots()).isEqualTo(3);
        assertThat(result.matchesTag("Deathmatch")).isTrue();
    }

    @Test
    void searcherDoesNotSeeOwnSession() throws InterruptedException {
        hostBackend.createSession(host, SESSION, lanConfig(4, "Deathmatch"));

        assertThat(search(hostBackend, host, LAN_LOBBIES)).isEmpty();
    }

    @Test
    void lanSearchSkipsHostedSessions() throws InterruptedException {
        SessionConfig hosted = SessionConfig.builder().matchTag("Deathmatch").preferLobbies(true).build();
        hostBackend.createSession(host, SESSION, hosted);

        assertThat(search(guestBackend, guest, LAN_LOBBIES)).isEmpty();
        assertThat(search(guestBackend, guest, new SessionSearchQuery(10, false, true))).hasSize(1);
    }

    @Test
    void searchHonoursResultLimit() throws InterruptedException {
        hostBackend.createSession(host, SESSION, lanConfig(4, "Deathmatch"));
        guestBackend.createSession(guest, SESSION, lanConfig(4, "FreeForAll"));

        assertThat(search(latecomerBackend, latecomer, new SessionSearchQuery(1, true, true))).hasSize(1);
    }

    @Test
    void joiningResolvesHostAddress() throws InterruptedException {
        hostBackend.createSession(host, SESSION, lanConfig(4, "Deathmatch"));
        SessionSearchResult target = search(guestBackend, guest, LAN_LOBBIES).get(0);

        assertThat(join(guestBackend, guest, target)).isEqualTo(JoinResult.SUCCESS);
        assertThat(guestBackend.getResolvedConnectAddress(SESSION)).contains("192.168.1.10:7777");
        assertThat(guestBackend.getNamedSession(SESSION)).hasValueSatisfying(session ->
                assertThat(session.registeredPlayers()).contains("host-1", "guest-1"));
    }

    @Test
    void joiningTwiceReportsAlreadyInSession() throws InterruptedException {
        hostBackend.createSession(host, SESSION, lanConfig(4, "Deathmatch"));
        SessionSearchResult target = search(guestBackend, guest, LAN_LOBBIES).get(0);
        join(guestBackend, guest, target);

        assertThat(join(guestBackend, guest, target)).isEqualTo(JoinResult.ALREADY_IN_SESSION);
    }

    @Test
    void fullSessionRejectsJoin() throws InterruptedException {
        hostBackend.createSession(host, SESSION, lanConfig(2, "Deathmatch"));
        SessionSearchResult target = search(guestBackend, guest, LAN_LOBBIES).get(0);

        assertThat(join(guestBackend, guest, target)).isEqualTo(JoinResult.SUCCESS);
        assertThat(join(latecomerBackend, latecomer, target)).isEqualTo(JoinResult.SESSION_IS_FULL);
    }

    @Test
    void withdrawnSessionCannotBeJoined() throws InterruptedException {
        hostBackend.createSession(host, SESSION, lanConfig(4, "Deathmatch"));
        SessionSearchResult target = search(guestBackend, guest, LAN_LOBBIES).get(0);

        assertThat(hostBackend.destroySession(SESSION)).isTrue();

        assertThat(network.getAdvertisedCount()).isZero();
        assertThat(join(guestBackend, guest, target)).isEqualTo(JoinResult.SESSION_DOES_NOT_EXIST);
    }

    @Test
    void duplicateNameIsRejectedSynchronously() {
        assertThat(hostBackend.createSession(host, SESSION, lanConfig(4, "Deathmatch"))).isTrue();
        assertThat(hostBackend.createSession(host, SESSION, lanConfig(4, "Deathmatch"))).isFalse();
    }

    @Test
    void destroyAndStartRequireAKnownSession() {
        assertThat(hostBackend.destroySession(SESSION)).isFalse();
        assertThat(hostBackend.startSession(SESSION)).isFalse();
        assertThat(hostBackend.getNamedSession(SESSION)).isEmpty();
    }

    @Test
    void onlyHostCanStartAndOnlyOnce() throws InterruptedException {
        BlockingQueue<BackendCompletion> started = listen(hostBackend, OperationKind.START);
        hostBackend.createSession(host, SESSION, lanConfig(4, "Deathmatch"));
        SessionSearchResult target = search(guestBackend, guest, LAN_LOBBIES).get(0);
        join(guestBackend, guest, target);

        assertThat(guestBackend.startSession(SESSION)).isFalse();
        assertThat(hostBackend.startSession(SESSION)).isTrue();
        assertThat(await(started).isSuccess()).isTrue();
        assertThat(hostBackend.getNamedSession(SESSION)).hasValueSatisfying(session ->
                assertThat(session.state()).isEqualTo(SessionState.IN_PROGRESS));

        assertThat(hostBackend.startSession(SESSION)).isTrue();
        assertThat(await(started).isSuccess()).isFalse();
    }

    @Test
    void startedSessionWithoutJoinInProgressIsHidden() throws InterruptedException {
        hostBackend.createSession(host, SESSION, lanConfig(4, "Deathmatch"));
        hostBackend.startSession(SESSION);

        assertThat(search(guestBackend, guest, LAN_LOBBIES)).isEmpty();
    }

    @Test
    void guestLeavingFreesSlot() throws InterruptedException {
        hostBackend.createSession(host, SESSION, lanConfig(2, "Deathmatch"));
        SessionSearchResult target = search(guestBackend, guest, LAN_LOBBIES).get(0);
        join(guestBackend, guest, target);

        assertThat(guestBackend.destroySession(SESSION)).isTrue();

        assertThat(network.getAdvertisedCount()).isEqualTo(1);
        assertThat(join(latecomerBackend, latecomer, target)).isEqualTo(JoinResult.SUCCESS);
    }

    @Test
    void unsubscribedListenerIsNotInvoked() throws InterruptedException {
        BlockingQueue<BackendCompletion> removed = new LinkedBlockingQueue<>();
        BackendSubscription subscription = hostBackend.subscribe(OperationKind.CREATE, removed::add);
        BlockingQueue<BackendCompletion> kept = listen(hostBackend, OperationKind.CREATE);

        assertThat(hostBackend.unsubscribe(subscription)).isTrue();
        assertThat(hostBackend.unsubscribe(subscription)).isFalse();
        assertThat(subscription.isActive()).isFalse();

        hostBackend.createSession(host, SESSION, lanConfig(4, "Deathmatch"));
        await(kept);
        assertThat(removed).isEmpty();
    }
}
