package io.github.byzatic.jobscheduler;


import org.jetbrains.annotations.NotNull;

import java.util.UUID;

/**
 * Utility class for generating job identifiers.
 */
public class UuidProvider {

    /**
     * Generates a new random job id.
     *
     * @return a new {@link UUID}
     */
    public static @NotNull UUID generateUuid() {
        return UUID.randomUUID();
    }
}
