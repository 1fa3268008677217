package com.javis.channels;

import com.javis.shared.model.InboundMessage;
import com.javis.shared.model.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.time.Instant;

/** Reads instructions line by line on its own thread; {@code /quit} or end of input stops it. */
public class CliAdapter implements ChannelAdapter {

    private static final Logger log = LoggerFactory.getLogger(CliAdapter.class);
    public static final String CHANNEL_ID = "cli";

    private final BufferedReader reader;
    private final PrintStream out;
    private volatile boolean running;
    private Thread readThread;
    private Runnable onStop;

    public CliAdapter(BufferedReader reader, PrintStream out) {
        this.reader = reader;
        this.out = out;
    }

    public void onStop(Runnable callback) {
        this.onStop = callback;
    }

    @Override
    public String id() {
        return CHANNEL_ID;
    }

    @Override
    public void start(MessageSink sink) {
        running = true;
        readThread = new Thread(() -> runLoop(sink), "javis-cli");
        readThread.start();
    }

    /** Blocks until the read loop has ended. */
    public void awaitStop() throws InterruptedException {
        if (readThread != null) readThread.join();
    }

    private void runLoop(MessageSink sink) {
        out.println("Javis CLI (/workflows, /status, /doctor, /quit)");
        while (running) {
            out.print("> ");
            out.flush();
            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                if (!running) break;
                log.warn("Input read error: {}", e.getMessage());
                continue;
            }

            if (line == null) {
                finish();
                break;
            }
            var input = line.trim();
            if (input.isEmpty()) continue;
            if ("/quit".equals(input) || "/exit".equals(input)) {
                finish();
                break;
            }

            try {
                sink.accept(new InboundMessage(CHANNEL_ID, "local", input, Instant.now()));
            } catch (RuntimeException e) {
                log.error("Message handling failed", e);
                out.println("Error: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            }
        }
    }

    private void finish() {
        running = false;
        if (onStop != null) onStop.run();
    }

    @Override
    public void send(OutboundMessage msg) {
        out.println(msg.text());
    }

    @Override
    public void stop() {
        running = false;
        if (readThread != null && readThread != Thread.currentThread()) readThread.interrupt();
    }
}
