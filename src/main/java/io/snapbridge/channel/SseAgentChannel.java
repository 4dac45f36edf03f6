package io.snapbridge.channel;

import io.snapbridge.util.Jsons;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Agent channel backed by an open {@code text/event-stream} response. Events go out as
 * {@code event: snap:<name>} frames with a single-line JSON {@code data} field.
 */
public final class SseAgentChannel implements AgentChannel {
    static final String EVENT_PREFIX = "snap:";

    private final String id;
    private final OutputStream out;
    private final AtomicBoolean open = new AtomicBoolean(true);
    private final CountDownLatch closed = new CountDownLatch(1);

    public SseAgentChannel(String id, OutputStream out) {
        this.id = id;
        this.out = out;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    @Override
    public void send(String event, Object data) throws IOException {
        String frame = "event: " + EVENT_PREFIX + event + "\n"
                + "data: " + Jsons.toCompactJson(data) + "\n\n";
        write(frame);
    }

    @Override
    public void keepAlive() throws IOException {
        write(": keep-alive\n\n");
    }

    private synchronized void write(String frame) throws IOException {
        if (!open.get()) {
            throw new IOException("channel " + id + " is closed");
        }
        try {
            out.write(frame.getBytes(StandardCharsets.UTF_8));
            out.flush();
        } catch (IOException e) {
            close();
            throw e;
        }
    }

    @Override
    public void close() {
        if (open.compareAndSet(true, false)) {
            closed.countDown();
        }
    }

    /**
     * Blocks the stream-serving thread until the channel is closed.
     */
    public void awaitClosed() throws InterruptedException {
        closed.await();
    }

    public boolean awaitClosed(long timeoutMs) throws InterruptedException {
        return closed.await(timeoutMs, TimeUnit.MILLISECONDS);
    }
}
