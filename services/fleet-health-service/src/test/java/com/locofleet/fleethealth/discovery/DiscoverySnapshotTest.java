package com.locofleet.fleethealth.discovery;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.locofleet.fleethealth.FleetFixtures.NOW;
import static com.locofleet.fleethealth.FleetFixtures.instance;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DiscoverySnapshot")
class DiscoverySnapshotTest {

    @Test
    @DisplayName("sorts instances by ordinal")
    void shouldSortByOrdinal() {
        DiscoverySnapshot snapshot = DiscoverySnapshot.live(List.of(instance(2), instance(0), instance(1)), NOW);

        assertThat(snapshot.getInstances()).extracting(FleetInstance::getOrdinal).containsExactly(0, 1, 2);
        assertThat(snapshot.findByResourceName("loco-emulator-1")).contains(instance(1));
    }

    @Test
    @DisplayName("refuses duplicate ordinals")
    void shouldRejectDuplicateOrdinals() {
        assertThatThrownBy(() -> DiscoverySnapshot.live(List.of(instance(1), instance(1)), NOW))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("keeps instances and fetch time when re-marked as fallback")
    void shouldMarkAsFallback() {
        DiscoverySnapshot live = DiscoverySnapshot.live(List.of(instance(0)), NOW);

        DiscoverySnapshot fallback = live.asFallback();

        assertThat(fallback.getSource()).isEqualTo(SnapshotSource.CACHED_FALLBACK);
        assertThat(fallback.getInstances()).isEqualTo(live.getInstances());
        assertThat(fallback.getFetchedAt()).isEqualTo(NOW);
        assertThat(fallback.asFallback()).isSameAs(fallback);
        assertThat(DiscoverySnapshot.empty().hasHistory()).isFalse();
    }
}
