package io.github.byzatic.jobscheduler;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UuidProviderTest {

    @Test
    void generatesDistinctIds() {
        assertNotEquals(UuidProvider.generateUuid(), UuidProvider.generateUuid());
    }
}
