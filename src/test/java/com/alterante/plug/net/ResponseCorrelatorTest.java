package com.alterante.plug.net;

import com.alterante.plug.protocol.CommandType;
import com.alterante.plug.protocol.Frame;
import com.alterante.plug.protocol.SessionCipher;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

class ResponseCorrelatorTest {

    private static Frame frameOfType(int type, int sequence) {
        return new Frame(FakeDevice.buildFrame(type, 0, null, SessionCipher.defaultKey(), 0x2711, 0, sequence));
    }

    @Test
    void recvReturnsNextFrameWhateverItsType() throws Exception {
        ResponseCorrelator correlator = new ResponseCorrelator(10);
        correlator.offer(frameOfType(CommandType.AUTH_REPLY.code(), 1));
        correlator.offer(frameOfType(CommandType.COMMAND_REPLY.code(), 2));

        assertEquals(1, correlator.recv(Duration.ofMillis(100)).sequence());
        assertEquals(2, correlator.recv(Duration.ofMillis(100)).sequence());
        assertEquals(0, correlator.pendingCount());
    }

    @Test
    void recvTimesOutOnEmptyQueue() {
        ResponseCorrelator correlator = new ResponseCorrelator(10);
        ResponseTimeoutException e = assertThrows(ResponseTimeoutException.class,
                () -> correlator.recv(Duration.ofMillis(100)));
        assertTrue(e.expectedType().isEmpty());
        assertEquals(Duration.ofMillis(100), e.timeout());
    }

    @Test
    void waitForTypeSkipsAndRequeuesOtherFrames() throws Exception {
        ResponseCorrelator correlator = new ResponseCorrelator(10);
        correlator.offer(frameOfType(CommandType.COMMAND_REPLY.code(), 1));
        correlator.offer(frameOfType(CommandType.COMMAND_REPLY.code(), 2));
        correlator.offer(frameOfType(CommandType.AUTH_REPLY.code(), 3));

        Frame match = correlator.waitForType(CommandType.AUTH_REPLY.code(), Duration.ofSeconds(1));
        assertEquals(3, match.sequence());

        // Skipped frames were pushed back, still in arrival order
        assertEquals(2, correlator.pendingCount());
        assertEquals(1, correlator.recv(Duration.ofMillis(100)).sequence());
        assertEquals(2, correlator.recv(Duration.ofMillis(100)).sequence());
    }

    @Test
    void waitForTypeTimesOutAtDeadlineWhenNothingArrives() {
        ResponseCorrelator correlator = new ResponseCorrelator(10);
        long start = System.nanoTime();
        ResponseTimeoutException e = assertThrows(ResponseTimeoutException.class,
                () -> correlator.waitForType(CommandType.AUTH_REPLY.code(), Duration.ofMillis(300)));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(CommandType.AUTH_REPLY.code(), e.expectedType().getAsInt());
        assertTrue(elapsedMs >= 290, "Returned too early: " + elapsedMs + "ms");
        assertTrue(elapsedMs < 1000, "Returned too late: " + elapsedMs + "ms");
    }

    @Test
    void mismatchedFrameSurvivesTimedOutWait() {
        ResponseCorrelator correlator = new ResponseCorrelator(10);
        correlator.offer(frameOfType(CommandType.COMMAND_REPLY.code(), 7));

        assertThrows(ResponseTimeoutException.class,
                () -> correlator.waitForType(CommandType.AUTH_REPLY.code(), Duration.ofMillis(150)));
        assertEquals(1, correlator.pendingCount(), "Unmatched frame should remain queued");
    }

    @Test
    void waitForTypeReceivesFrameQueuedLater() throws Exception {
        ResponseCorrelator correlator = new ResponseCorrelator(10);
        ExecutorService exec = Executors.newSingleThreadExecutor();
        try {
            Future<Frame> fut = exec.submit(() ->
                    correlator.waitForType(CommandType.AUTH_REPLY.code(), Duration.ofSeconds(3)));
            Thread.sleep(100);
            correlator.offer(frameOfType(CommandType.COMMAND_REPLY.code(), 1));
            correlator.offer(frameOfType(CommandType.AUTH_REPLY.code(), 2));

            assertEquals(2, fut.get(5, TimeUnit.SECONDS).sequence());
        } finally {
            exec.shutdownNow();
        }
    }

    @Test
    void offerFailsWhenFull() {
        ResponseCorrelator correlator = new ResponseCorrelator(2);
        assertTrue(correlator.offer(frameOfType(CommandType.COMMAND_REPLY.code(), 1)));
        assertTrue(correlator.offer(frameOfType(CommandType.COMMAND_REPLY.code(), 2)));
        assertFalse(correlator.offer(frameOfType(CommandType.COMMAND_REPLY.code(), 3)));
        assertEquals(2, correlator.pendingCount());
    }
}
