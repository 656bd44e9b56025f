package org.carball.probe.profile;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;

@Data
@Builder(toBuilder = true)
public class ProfileOptions {

    @Builder.Default
    private int runs = 3;

    @Builder.Default
    private boolean clearCacheFirst = true;

    @Builder.Default
    private Duration eventTimeout = Duration.ofSeconds(30);

    /** Runs not started before this instant are skipped. Null for no deadline. */
    private Instant deadline;

    public static ProfileOptions defaults() {
        return ProfileOptions.builder().build();
    }
}
