package io.mdbroker;

import static org.junit.jupiter.api.Assertions.*;

import static io.mdbroker.MdpConstants.*;

import java.net.URI;

import org.junit.jupiter.api.Test;

class MdpConstantsTest {
    @Test
    void testDefaults() {
        assertEquals("tcp://*:47047", ADDRESS_DEFAULT);
        assertEquals(100, POLL_INTERVAL_DEFAULT);
        assertEquals(3, HEARTBEAT_DEFAULT);
        assertEquals(2, HEARTBEAT_MULT_DEFAULT);
        assertFalse(LOG_DETAILS_DEFAULT);
        assertEquals(0, LINGER_DEFAULT);
    }

    @Test
    void testReplaceScheme() {
        assertEquals(URI.create("tcp://host:20"), replaceScheme(URI.create("mdp://host:20"), SCHEME_TCP));
        assertEquals(URI.create("tcp://host:20/path"), replaceScheme(URI.create("mdp://host:20/path"), SCHEME_TCP));
        assertEquals(URI.create("tcp://*:20"), replaceScheme(URI.create("mdp://*:20"), SCHEME_TCP), "keep wildcard");
        assertEquals(URI.create("mdp://host:20"), replaceScheme(URI.create("tcp://host:20"), SCHEME_MDP));
        assertEquals(URI.create("inproc://broker"), replaceScheme(URI.create("inproc://broker"), SCHEME_TCP), "do not change inproc scheme");
        assertThrows(IllegalArgumentException.class, () -> replaceScheme(URI.create("//host:20"), SCHEME_TCP));
    }

    @Test
    void testResolveLocalHostName() {
        assertDoesNotThrow(MdpConstants::getLocalHostName);
        assertNotNull(getLocalHostName());
        assertEquals(URI.create("tcp://localhost:20/path/"), resolveHost(URI.create("tcp://*:20/path/"), "localhost"));
        assertEquals(URI.create("tcp://localhost:20/path/"), resolveHost(URI.create("tcp://localhost:20/path/"), "localhost"));
        assertEquals(URI.create("tcp://localhost/path/"), resolveHost(URI.create("tcp://localhost/path/"), "localhost"));
        assertEquals(URI.create("inproc://*"), resolveHost(URI.create("inproc://*"), "localhost"));

        assertThrows(IllegalArgumentException.class, () -> resolveHost(URI.create("tcp://*:aa/path/"), ""));
    }
}
