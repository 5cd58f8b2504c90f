package uma.services;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import uma.messages.PubKeyResponse;

class InMemoryPublicKeyCacheTest {

    private static final long NOW = 1_700_000_000L;
    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);

    private static PubKeyResponse keysExpiringAt(Long expirationTimestamp) {
        return new PubKeyResponse(null, null, "04aa", "04bb", expirationTimestamp);
    }

    @Test
    void returnsUnexpiredEntries() {
        final InMemoryPublicKeyCache cache = new InMemoryPublicKeyCache(CLOCK, false);
        final PubKeyResponse keys = keysExpiringAt(NOW + 60);

        cache.addPublicKeysForVasp("vasp1.com", keys);

        assertThat(cache.getPublicKeysForVasp("vasp1.com")).contains(keys);
        assertThat(cache.getPublicKeysForVasp("vasp2.com")).isEmpty();
    }

    @Test
    void expiredEntriesAreNotReturned() {
        final InMemoryPublicKeyCache cache = new InMemoryPublicKeyCache(CLOCK, true);

        cache.addPublicKeysForVasp("vasp1.com", keysExpiringAt(NOW));

        assertThat(cache.getPublicKeysForVasp("vasp1.com")).isEmpty();
    }

    @Test
    void entriesExpireAsTimePasses() {
        final MutableClock clock = new MutableClock(Instant.ofEpochSecond(NOW));
        final InMemoryPublicKeyCache cache = new InMemoryPublicKeyCache(clock, false);
        cache.addPublicKeysForVasp("vasp1.com", keysExpiringAt(NOW + 60));
        assertThat(cache.getPublicKeysForVasp("vasp1.com")).isPresent();

        clock.instant = Instant.ofEpochSecond(NOW + 120);

        assertThat(cache.getPublicKeysForVasp("vasp1.com")).isEmpty();
    }

    @Test
    void entriesWithoutExpirationDependOnSetting() {
        final InMemoryPublicKeyCache refusing = new InMemoryPublicKeyCache(CLOCK, false);
        final InMemoryPublicKeyCache allowing = new InMemoryPublicKeyCache(CLOCK, true);

        refusing.addPublicKeysForVasp("vasp1.com", keysExpiringAt(null));
        allowing.addPublicKeysForVasp("vasp1.com", keysExpiringAt(null));

        assertThat(refusing.getPublicKeysForVasp("vasp1.com")).isEmpty();
        assertThat(allowing.getPublicKeysForVasp("vasp1.com")).isPresent();
    }

    @Test
    void removeAndClear() {
        final InMemoryPublicKeyCache cache = new InMemoryPublicKeyCache(CLOCK, false);
        cache.addPublicKeysForVasp("vasp1.com", keysExpiringAt(NOW + 60));
        cache.addPublicKeysForVasp("vasp2.com", keysExpiringAt(NOW + 60));

        cache.removePublicKeysForVasp("vasp1.com");
        assertThat(cache.getPublicKeysForVasp("vasp1.com")).isEmpty();
        assertThat(cache.getPublicKeysForVasp("vasp2.com")).isPresent();

        cache.clear();
        assertThat(cache.getPublicKeysForVasp("vasp2.com")).isEmpty();
    }

    private static class MutableClock extends Clock {

        private Instant instant;

        MutableClock(Instant instant) {
            this.instant = instant;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
