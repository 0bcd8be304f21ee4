package sh.harold.sessionlink.menu;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.sessionlink.api.session.SessionSearchResult;
import sh.harold.sessionlink.api.session.TravelService;
import sh.harold.sessionlink.api.session.event.CreateSessionCompleteEvent;
import sh.harold.sessionlink.api.session.event.EventRegistration;
import sh.harold.sessionlink.api.session.event.FindSessionsCompleteEvent;
import sh.harold.sessionlink.api.session.event.JoinSessionCompleteEvent;
import sh.harold.sessionlink.api.session.event.SessionNotificationBus;
import sh.harold.sessionlink.orchestrator.SessionOrchestrator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Headless host/join menu. Triggers session operations from user input,
 * disables a control while its operation runs and starts the gameplay
 * transition once hosting or joining succeeds.
 */
public class SessionMenuController {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionMenuController.class);

    private final SessionOrchestrator orchestrator;
    private final SessionNotificationBus notificationBus;
    private final TravelService travelService;
    private final MenuSettings settings;
    private final ControlState controls = new ControlState();
    private final List<EventRegistration> registrations = new ArrayList<>();

    public SessionMenuController(SessionOrchestrator orchestrator,
                                 SessionNotificationBus notificationBus,
                                 TravelService travelService,
                                 MenuSettings settings) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.notificationBus = Objects.requireNonNull(notificationBus, "notificationBus");
        this.travelService = Objects.requireNonNull(travelService, "travelService");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Binds the menu to the notification bus. Calling it twice has no effect.
     */
    public synchronized void setup() {
        if (!registrations.isEmpty()) {
            return;
        }
        registrations.add(notificationBus.createComplete().subscribe(this::onCreateSessionComplete));
        registrations.add(notificationBus.findComplete().subscribe(this::onFindSessionsComplete));
        registrations.add(notificationBus.joinComplete().subscribe(this::onJoinSessionComplete));
        LOGGER.debug("Menu for {} bound to session notifications", orchestrator.getLocalPlayer().displayName());
    }

    public synchronized void teardown() {
        registrations.forEach(EventRegistration::unregister);
        registrations.clear();
    }

    public void hostClicked() {
        if (!controls.isHostEnabled()) {
            return;
        }
        controls.setHostEnabled(false);
        orchestrator.createSession(settings.publicSlots(), settings.matchTag());
    }

    public void joinClicked() {
        if (!controls.isJoinEnabled()) {
            return;
        }
        controls.setJoinEnabled(false);
        orchestrator.findSessions(settings.searchResults());
    }

    public ControlState getControls() {
        return controls;
    }

    private void onCreateSessionComplete(CreateSessionCompleteEvent event) {
        if (!event.isSuccess()) {
            LOGGER.warn("Failed to create session: {}", event.getFailureCause().getDescription());
            controls.setHostEnabled(true);
            return;
        }
        if (!travelService.travelToLobby(settings.lobbyTravelUrl())) {
            LOGGER.warn("Travel to {} was refused", settings.lobbyTravelUrl());
            controls.setHostEnabled(true);
        }
    }

    private void onFindSessionsComplete(FindSessionsCompleteEvent event) {
        if (!event.isSuccess()) {
            LOGGER.info("No sessions found: {}", event.getFailureCause().getDescription());
            controls.setJoinEnabled(true);
            return;
        }
        Optional<SessionSearchResult> match = event.firstMatching(settings.matchTag());
        if (match.isEmpty()) {
            LOGGER.info("None of {} session(s) advertise match tag {}", event.getResults().size(), settings.matchTag());
            controls.setJoinEnabled(true);
            return;
        }
        LOGGER.info("Joining session hosted by {}", match.get().ownerName());
        orchestrator.joinSession(match.get());
    }

    private void onJoinSessionComplete(JoinSessionCompleteEvent event) {
        if (!event.getResult().isSuccess()) {
            LOGGER.warn("Failed to join session: {}", event.getResult());
            controls.setJoinEnabled(true);
            return;
        }
        Optional<String> address = orchestrator.getResolvedConnectAddress();
        if (address.isEmpty()) {
            LOGGER.warn("Joined session {} but could not resolve its address", event.getSessionName());
            controls.setJoinEnabled(true);
            return;
        }
        travelService.connectTo(address.get());
    }
}
