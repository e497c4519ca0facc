package com.alterante.plug.net;

import com.alterante.plug.protocol.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded queue of checksum-valid frames, filled by {@link UdpListener} and drained
 * on behalf of whichever caller is waiting for a reply.
 *
 * A type-filtered wait pushes frames it does not want back onto the tail, so a
 * frame nobody asks for keeps cycling through the queue until a wait consumes it.
 * Under steady mismatched traffic a waiter can starve until its deadline.
 */
public class ResponseCorrelator {

    private static final Logger log = LoggerFactory.getLogger(ResponseCorrelator.class);

    private final BlockingQueue<Frame> pending;

    public ResponseCorrelator(int capacity) {
        this.pending = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Enqueue a received frame. Never blocks.
     * @return false if the queue was full and the frame was dropped
     */
    public boolean offer(Frame frame) {
        return pending.offer(frame);
    }

    /**
     * Take the next frame whatever its type. Only correct while a single request is
     * in flight, since nothing ties the frame to the request that was sent.
     */
    public Frame recv(Duration timeout) throws ResponseTimeoutException, InterruptedException {
        Frame frame = pending.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (frame == null) {
            throw new ResponseTimeoutException(timeout);
        }
        return frame;
    }

    /**
     * Take the first frame whose command / response type equals {@code expectedType}.
     * Other frames are re-queued at the tail.
     */
    public Frame waitForType(int expectedType, Duration timeout)
            throws ResponseTimeoutException, InterruptedException {
        long deadline = System.currentTimeMillis() + timeout.toMillis();

        while (true) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                throw new ResponseTimeoutException(expectedType, timeout);
            }
            Frame frame = pending.poll(remaining, TimeUnit.MILLISECONDS);
            if (frame == null) {
                throw new ResponseTimeoutException(expectedType, timeout);
            }
            if (frame.commandType() == expectedType) {
                return frame;
            }

            log.trace("Re-queueing frame of type 0x{} while waiting for 0x{}",
                    Integer.toHexString(frame.commandType()), Integer.toHexString(expectedType));
            if (!pending.offer(frame)) {
                log.warn("Pending queue full, dropped re-queued {}", frame);
            }
            if (System.currentTimeMillis() >= deadline) {
                throw new ResponseTimeoutException(expectedType, timeout);
            }
        }
    }

    public int pendingCount() {
        return pending.size();
    }
}
