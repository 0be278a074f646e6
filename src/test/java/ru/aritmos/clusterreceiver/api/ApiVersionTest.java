package ru.aritmos.clusterreceiver.api;

import org.junit.jupiter.api.Test;
import ru.aritmos.clusterreceiver.core.ReceiverException;

import static org.junit.jupiter.api.Assertions.*;

class ApiVersionTest {

    private static final ApiVersion MIN = ApiVersion.parse("1.0");
    private static final ApiVersion MAX = ApiVersion.parse("1.10");

    @Test
    void shouldCompareNumerically() {
        assertTrue(ApiVersion.parse("1.10").compareTo(ApiVersion.parse("1.9")) > 0, "TEST_EXPECTED: 1.10 > 1.9");
        assertEquals("1.10", ApiVersion.parse(" 1.10 ").toString());
        assertEquals("clustering 1.2", ApiVersion.parse("1.2").headerValue());
    }

    @Test
    void shouldRejectMalformedVersions() {
        for (String bad : new String[]{"", "1", "1.x", "01.2", "1.02", "v1.2"}) {
            ReceiverException e = assertThrows(ReceiverException.class, () -> ApiVersion.parse(bad), "TEST_EXPECTED: " + bad);
            assertEquals(ReceiverException.ErrorKind.VALIDATION, e.kind());
        }
    }

    @Test
    void negotiateShouldDefaultToMinimum() {
        assertEquals(MIN, ApiVersion.negotiate(null, MIN, MAX));
        assertEquals(MIN, ApiVersion.negotiate("compute 2.1", MIN, MAX));
    }

    @Test
    void negotiateShouldPickClusteringEntry() {
        assertEquals(MAX, ApiVersion.negotiate("clustering latest", MIN, MAX));
        assertEquals(ApiVersion.parse("1.5"), ApiVersion.negotiate("compute 2.1, clustering 1.5", MIN, MAX));
        assertEquals(ApiVersion.parse("1.5"), ApiVersion.negotiate("Clustering 1.5", MIN, MAX));
    }

    @Test
    void negotiateShouldRejectOutOfRangeAndGarbage() {
        ReceiverException tooNew = assertThrows(ReceiverException.class, () -> ApiVersion.negotiate("clustering 1.11", MIN, MAX));
        assertEquals(ReceiverException.ErrorKind.VERSION_NOT_ACCEPTABLE, tooNew.kind());
        assertEquals(406, tooNew.kind().httpStatus());

        ReceiverException garbage = assertThrows(ReceiverException.class, () -> ApiVersion.negotiate("clustering", MIN, MAX));
        assertEquals(ReceiverException.ErrorKind.VALIDATION, garbage.kind());
    }
}
