package com.tracker.console;

import com.tracker.core.monitor.ControlChannel;
import com.tracker.core.monitor.StatusSnapshot;
import com.tracker.core.notify.Recipient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Line-oriented operator commands read from a terminal.
 *
 * <p>{@code stop} and {@code restart} become control intents; {@code status} prints the
 * current monitor view. End of input counts as {@code stop}.
 */
public final class OperatorConsole implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(OperatorConsole.class);

    static final String HELP = "Unknown command. Available: restart, stop, status";

    private final BufferedReader input;
    private final PrintStream output;
    private final Supplier<ControlChannel> control;
    private final Supplier<StatusSnapshot> status;

    /**
     * Suppliers are resolved per command so one console can outlive several monitor instances.
     */
    public OperatorConsole(BufferedReader input, PrintStream output,
                           Supplier<ControlChannel> control, Supplier<StatusSnapshot> status) {
        this.input = input;
        this.output = output;
        this.control = control;
        this.status = status;
    }

    public Thread startDaemon() {
        Thread t = new Thread(this, "operator-console");
        t.setDaemon(true);
        t.start();
        return t;
    }

    @Override
    public void run() {
        try {
            String line;
            while ((line = input.readLine()) != null) {
                if (!handle(line)) {
                    return;
                }
            }
            logger.info("Console input closed - requesting stop");
            control.get().requestStop();
        } catch (IOException e) {
            logger.warn("Console read failed, operator commands disabled: {}", e.getMessage());
        }
    }

    /**
     * @return false once the console should stop reading
     */
    boolean handle(String line) {
        String command = line.trim().toLowerCase(Locale.ROOT);
        switch (command) {
            case "" -> {
                return true;
            }
            case "stop" -> {
                output.println("🛑 Stopping...");
                control.get().requestStop(); // displaces a pending restart
                return false;
            }
            case "restart" -> {
                output.println("🔄 Restarting...");
                control.get().requestRestart();
                return true;
            }
            case "status" -> {
                output.println(render(status.get()));
                return true;
            }
            default -> {
                output.println(HELP);
                return true;
            }
        }
    }

    static String render(StatusSnapshot snapshot) {
        if (snapshot == null) {
            return "Monitor not started";
        }
        var sb = new StringBuilder();
        sb.append("State: ").append(snapshot.state()).append('\n');
        sb.append("Active positions: ").append(snapshot.activeSymbols().isEmpty()
            ? "none" : String.join(", ", new TreeSet<>(snapshot.activeSymbols()))).append('\n');
        sb.append("Interval: ").append(snapshot.interval().toSeconds()).append("s\n");
        sb.append("Cycles: ").append(snapshot.cyclesCompleted());
        if (snapshot.lastCycleAt() != null) {
            sb.append(" (last at ").append(snapshot.lastCycleAt()).append(')');
        }
        sb.append('\n');
        sb.append("Recipients: ").append(snapshot.recipients().size());
        for (Recipient r : snapshot.recipients()) {
            sb.append("\n  - ").append(r);
        }
        return sb.toString();
    }
}
