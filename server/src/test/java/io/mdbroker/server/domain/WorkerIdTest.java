package io.mdbroker.server.domain;

import static java.nio.charset.StandardCharsets.UTF_8;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class WorkerIdTest {
    @ParameterizedTest
    @ValueSource(strings = { "", "worker-1", "0A1B2C", "with space", "ünïcödé" })
    void testWrapUnwrapRoundTrip(final String rawId) {
        for (WorkerClass workerClass : WorkerClass.values()) {
            final String wrapped = WorkerId.wrap(workerClass, rawId);
            final WorkerId unwrapped = WorkerId.unwrap(wrapped);
            assertEquals(workerClass, unwrapped.getWorkerClass());
            assertEquals(rawId, unwrapped.getRawId());
            assertEquals(wrapped, unwrapped.getWrapped());
            assertEquals(WorkerId.of(workerClass, rawId), unwrapped);
        }
    }

    @Test
    void testClassesDoNotCollide() {
        final WorkerId zmq = WorkerId.of(WorkerClass.ZMQ, "42");
        final WorkerId internal = WorkerId.of(WorkerClass.INTERNAL, "42");
        assertNotEquals(zmq, internal);
        assertNotEquals(zmq.getWrapped(), internal.getWrapped());
        assertEquals("zmq|42", zmq.getWrapped());
        assertEquals("internal|42", internal.getWrapped());
    }

    @Test
    void testAddressIdentity() {
        final byte[] address = { 0x00, (byte) 0x80, 0x7F, 0x41 };
        final WorkerId id = WorkerId.ofAddress(address);
        assertEquals(WorkerClass.ZMQ, id.getWorkerClass());
        assertEquals("00807F41", id.getRawId());
        assertEquals(id, WorkerId.ofAddress(address.clone()));
        assertEquals(id.hashCode(), WorkerId.ofAddress(address.clone()).hashCode());
        assertNotEquals(id, WorkerId.ofAddress("A".getBytes(UTF_8)));
    }

    @Test
    void testInvalidIds() {
        assertThrows(IllegalArgumentException.class, () -> WorkerId.of(WorkerClass.INTERNAL, "a|b"));
        assertThrows(IllegalArgumentException.class, () -> WorkerId.unwrap("no-separator"));
        assertThrows(IllegalArgumentException.class, () -> WorkerId.unwrap("unknownTag|42"));
        assertThrows(NullPointerException.class, () -> WorkerId.of(null, "42"));
        assertEquals(WorkerClass.INTERNAL, WorkerClass.fromTag("internal"));
        assertThrows(IllegalArgumentException.class, () -> WorkerClass.fromTag("http"));
        assertEquals(WorkerClass.ZMQ, WorkerClass.fromTag("ZMQ"));
        final NullPointerException nullTag = assertThrows(NullPointerException.class, () -> WorkerClass.fromTag(null));
        assertEquals("tag must not be null", nullTag.getMessage());
    }
}
