package com.tracker.core.notify;

import com.tracker.core.event.PositionEvent;
import com.tracker.core.notify.format.NotificationFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Delivers one logical message to every configured recipient of every enabled platform.
 *
 * <p>Each delivery is independent: a failing recipient is logged and reported in the
 * {@link DispatchReport}, never retried within the call and never thrown to the caller.
 * Deliveries run on a bounded worker pool; the caller blocks until all of them finish or
 * the await timeout elapses, whichever comes first.
 */
public final class FanOutDispatcher implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(FanOutDispatcher.class);

    private final Map<Platform, NotificationChannel> channels = new EnumMap<>(Platform.class);
    private final Map<Platform, NotificationFormatter> formatters = new EnumMap<>(Platform.class);
    private final List<Recipient> recipients;
    private final ExecutorService workers;
    private final Duration awaitTimeout;

    public FanOutDispatcher(List<NotificationChannel> channels,
                            List<NotificationFormatter> formatters,
                            List<Recipient> recipients,
                            int parallelism,
                            Duration awaitTimeout) {
        channels.forEach(c -> this.channels.put(c.platform(), c));
        formatters.forEach(f -> this.formatters.put(f.platform(), f));
        this.recipients = recipients.stream()
            .filter(r -> this.channels.containsKey(r.platform()))
            .toList();
        this.awaitTimeout = awaitTimeout;

        var threadIndex = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, parallelism), r -> {
            Thread t = new Thread(r, "dispatch-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        int skipped = recipients.size() - this.recipients.size();
        if (skipped > 0) {
            logger.warn("{} recipient(s) ignored because their platform is not enabled", skipped);
        }
        if (this.recipients.isEmpty()) {
            logger.warn("⚠️ No recipients configured - alerts will only be logged");
        }
    }

    /**
     * Format the event per recipient and deliver it everywhere.
     */
    public DispatchReport dispatch(PositionEvent event) {
        return broadcast(recipient -> formatterFor(recipient).format(event, recipient));
    }

    public DispatchReport announceStartup(StartupNotice notice) {
        return broadcast(recipient -> formatterFor(recipient).formatStartup(notice, recipient));
    }

    /**
     * Deliver a per-recipient message to every recipient.
     */
    public DispatchReport broadcast(Function<Recipient, String> messageFor) {
        if (recipients.isEmpty()) {
            return DispatchReport.empty();
        }

        var tasks = new ArrayList<Callable<DeliveryResult>>(recipients.size());
        for (Recipient recipient : recipients) {
            tasks.add(() -> deliverTo(recipient, messageFor));
        }

        var results = new ArrayList<DeliveryResult>(recipients.size());
        try {
            List<Future<DeliveryResult>> futures =
                workers.invokeAll(tasks, awaitTimeout.toMillis(), TimeUnit.MILLISECONDS);
            for (int i = 0; i < futures.size(); i++) {
                results.add(collect(recipients.get(i), futures.get(i)));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Dispatch interrupted - {} recipient(s) not confirmed", recipients.size() - results.size());
            for (int i = results.size(); i < recipients.size(); i++) {
                results.add(DeliveryResult.failure(recipients.get(i), "interrupted"));
            }
        }

        var report = new DispatchReport(results);
        if (!report.allDelivered()) {
            logger.warn("Delivered to {}/{} recipient(s)", report.delivered(), results.size());
        }
        return report;
    }

    public List<Recipient> recipients() {
        return recipients;
    }

    private DeliveryResult deliverTo(Recipient recipient, Function<Recipient, String> messageFor) {
        try {
            String text = messageFor.apply(recipient);
            channels.get(recipient.platform()).deliver(recipient, text);
            logger.info("Message sent to {}", recipient);
            return DeliveryResult.success(recipient);
        } catch (DeliveryException e) {
            logger.error("Error sending to {}: {}", recipient, e.getMessage());
            return DeliveryResult.failure(recipient, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected error sending to {}", recipient, e);
            return DeliveryResult.failure(recipient, e.toString());
        }
    }

    private DeliveryResult collect(Recipient recipient, Future<DeliveryResult> future) throws InterruptedException {
        try {
            return future.get();
        } catch (CancellationException e) {
            logger.error("Delivery to {} timed out after {}s", recipient, awaitTimeout.toSeconds());
            return DeliveryResult.failure(recipient, "timed out");
        } catch (ExecutionException e) {
            logger.error("Delivery to {} failed", recipient, e.getCause());
            return DeliveryResult.failure(recipient, String.valueOf(e.getCause()));
        }
    }

    private NotificationFormatter formatterFor(Recipient recipient) {
        NotificationFormatter formatter = formatters.get(recipient.platform());
        if (formatter == null) {
            throw new IllegalStateException("No formatter registered for " + recipient.platform());
        }
        return formatter;
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(awaitTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
