package com.alterante.plug.net;

import com.alterante.plug.protocol.Frame;
import com.alterante.plug.protocol.FrameCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background receive loop: one daemon thread per client.
 *
 * Every datagram whose frame checksum is correct is copied into the
 * {@link ResponseCorrelator}. Anything else is dropped without being reported.
 * The loop ends when the socket is closed.
 */
public class UdpListener {

    private static final Logger log = LoggerFactory.getLogger(UdpListener.class);

    private final DatagramSocket socket;
    private final ResponseCorrelator correlator;
    private final int bufferSize;

    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();

    private volatile boolean running;
    private Thread receiveThread;

    public UdpListener(DatagramSocket socket, ResponseCorrelator correlator, int bufferSize) {
        this.socket = socket;
        this.correlator = correlator;
        this.bufferSize = bufferSize;
    }

    /** Start the receive loop. */
    public void start() {
        running = true;
        receiveThread = new Thread(this::receiveLoop, "udp-listener-" + socket.getLocalPort());
        receiveThread.setDaemon(true);
        receiveThread.start();
    }

    /** Wait for the loop to exit. The socket must already be closed. */
    public void stop() {
        running = false;
        if (receiveThread != null) {
            try {
                receiveThread.join(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isRunning() {
        return running;
    }

    /** Frames handed to the correlator so far. */
    public long acceptedCount() {
        return accepted.get();
    }

    /** Datagrams dropped: too short, bad checksum, or queue full. */
    public long discardedCount() {
        return discarded.get();
    }

    private void receiveLoop() {
        byte[] recvBuf = new byte[bufferSize];

        while (running) {
            DatagramPacket dgram = new DatagramPacket(recvBuf, recvBuf.length);
            try {
                socket.receive(dgram);
            } catch (IOException e) {
                if (socket.isClosed()) {
                    break;
                }
                log.warn("Receive error: {}", e.getMessage());
                continue;
            }
            handle(recvBuf, dgram.getLength());
        }

        running = false;
        log.debug("UdpListener receive loop exited");
    }

    void handle(byte[] buf, int length) {
        if (length < FrameCodec.HEADER_SIZE) {
            log.debug("Discarding {} byte datagram (shorter than header)", length);
            discarded.incrementAndGet();
            return;
        }
        if (!FrameCodec.validate(buf, length)) {
            log.debug("Discarding {} byte datagram with bad checksum", length);
            discarded.incrementAndGet();
            return;
        }

        Frame frame = new Frame(Arrays.copyOf(buf, length));
        if (correlator.offer(frame)) {
            accepted.incrementAndGet();
            log.debug("Queued {}", frame);
        } else {
            discarded.incrementAndGet();
            log.warn("Pending queue full, dropped {}", frame);
        }
    }
}
