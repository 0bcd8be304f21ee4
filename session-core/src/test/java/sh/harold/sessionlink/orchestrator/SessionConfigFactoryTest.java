package sh.harold.sessionlink.orchestrator;

import org.junit.jupiter.api.Test;
import sh.harold.sessionlink.api.session.AdvertisingMode;
import sh.harold.sessionlink.api.session.SessionBackend;
import sh.harold.sessionlink.api.session.SessionConfig;
import sh.harold.sessionlink.api.session.SessionConstants;
import sh.harold.sessionlink.api.session.SessionSearchQuery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SessionConfigFactoryTest {

    private final SessionConfigFactory factory = new SessionConfigFactory(SessionConstants.LAN_BACKEND_IDENTITY);

    private static SessionBackend backendNamed(String identity) {
        SessionBackend backend = mock(SessionBackend.class);
        when(backend.getIdentity()).thenReturn(identity);
        return backend;
    }

    @Test
    void lanIdentityProducesLanConfig() {
        SessionConfig config = factory.createConfig(backendNamed("NULL"), 4, "Deathmatch");

        assertThat(config.getAdvertisingMode()).isEqualTo(AdvertisingMode.LAN);
        assertThat(config.getMaxPublicSlots()).isEqualTo(4);
        assertThat(config.getMatchTag()).isEqualTo("Deathmatch");
    }

    @Test
    void identityComparisonIgnoresCase() {
        assertThat(factory.advertisingMode(backendNamed("null"))).isEqualTo(AdvertisingMode.LAN);
        assertThat(factory.advertisingMode(backendNamed("Steam"))).isEqualTo(AdvertisingMode.HOSTED);
    }

    @Test
    void hostedConfigStillAdvertisesToLobbies() {
        SessionConfig config = factory.createConfig(backendNamed("Steam"), 0, "");

        assertThat(config.isLan()).isFalse();
        assertThat(config.isShouldAdvertise()).isTrue();
        assertThat(config.isPreferLobbies()).isTrue();
        assertThat(config.getMaxPublicSlots()).isZero();
    }

    @Test
    void searchQueryMirrorsBackendIdentity() {
        SessionSearchQuery lan = factory.createSearchQuery(backendNamed("NULL"), 50);
        SessionSearchQuery hosted = factory.createSearchQuery(backendNamed("Steam"), 50);

        assertThat(lan.lanOnly()).isTrue();
        assertThat(hosted.lanOnly()).isFalse();
        assertThat(lan.lobbiesOnly()).isTrue();
        assertThat(hosted.maxResults()).isEqualTo(50);
    }
}
