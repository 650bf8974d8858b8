package com.intent.vision.core.service.notification;

import com.intent.vision.core.config.NotificationProperties;
import com.intent.vision.core.dto.AlertContent;
import com.intent.vision.core.dto.ChannelDeliveryResult;
import com.intent.vision.core.dto.DispatchOutcome;
import com.intent.vision.core.dto.NotificationChannel;
import com.intent.vision.core.dto.SendOutcome;
import com.intent.vision.core.enums.ChannelType;
import com.intent.vision.core.enums.DeliveryStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Delivers one alert to its channels. A failing channel never stops the
 * others, and there is exactly one result per channel, in channel order.
 */
@Service
@Slf4j
public class NotificationDispatcher {

    private final Map<ChannelType, NotificationSender> senders = new EnumMap<>(ChannelType.class);
    private final NotificationProperties props;
    private final ExecutorService executor;

    public NotificationDispatcher(List<NotificationSender> senders,
                                  NotificationProperties props,
                                  @Qualifier("deliveryExecutor") ExecutorService executor) {
        for (NotificationSender s : senders) {
            this.senders.put(s.channelType(), s);
        }
        this.props = props;
        this.executor = executor;
    }

    public List<ChannelDeliveryResult> dispatch(List<NotificationChannel> channels, AlertContent content) {
        if (channels == null || channels.isEmpty()) {
            return List.of();
        }
        if (props.isParallelDelivery() && channels.size() > 1) {
            List<CompletableFuture<ChannelDeliveryResult>> futures = new ArrayList<>(channels.size());
            for (NotificationChannel ch : channels) {
                futures.add(CompletableFuture.supplyAsync(() -> deliver(ch, content), executor));
            }
            return futures.stream().map(CompletableFuture::join).toList();
        }
        List<ChannelDeliveryResult> results = new ArrayList<>(channels.size());
        for (NotificationChannel ch : channels) {
            results.add(deliver(ch, content));
        }
        return results;
    }

    /**
     * Delivers and rolls the channel results up into the event's overall status:
     * sent if any channel sent, failed if a configured transport was tried,
     * queued if no transport was available at all.
     */
    public DispatchOutcome dispatchAlert(List<NotificationChannel> channels, AlertContent content) {
        List<ChannelDeliveryResult> results = dispatch(channels, content);

        DeliveryStatus overall;
        if (results.stream().anyMatch(ChannelDeliveryResult::isSent)) {
            overall = DeliveryStatus.SENT;
        } else if (channels != null && channels.stream().anyMatch(this::hasConfiguredTransport)) {
            overall = DeliveryStatus.FAILED;
        } else {
            overall = DeliveryStatus.QUEUED;
        }
        return new DispatchOutcome(results, overall);
    }

    private boolean hasConfiguredTransport(NotificationChannel ch) {
        if (ch == null || ch.type() == null) {
            return false;
        }
        NotificationSender sender = senders.get(ch.type());
        return ch.enabled() && sender != null && sender.isConfigured();
    }

    private ChannelDeliveryResult deliver(NotificationChannel ch, AlertContent content) {
        if (ch == null || ch.type() == null) {
            log.warn("channel without a type, not delivered");
            return ChannelDeliveryResult.invalid(ch, "channel type is required");
        }
        try {
            if (!ch.enabled()) {
                return ChannelDeliveryResult.skipped(ch, "channel disabled");
            }
            NotificationSender sender = senders.get(ch.type());
            if (sender == null) {
                return ChannelDeliveryResult.skipped(ch, ch.type().code() + " channel not yet implemented");
            }
            if (ch.recipients().isEmpty()) {
                return ChannelDeliveryResult.failed(ch, "No recipients configured for " + ch.type().code() + " channel");
            }
            if (!sender.isConfigured()) {
                return ChannelDeliveryResult.failed(ch, ch.type().code() + " transport not configured");
            }
            SendOutcome outcome = sender.send(ch.recipients(), content);
            if (outcome != null && outcome.success()) {
                return ChannelDeliveryResult.sent(ch, outcome.externalId());
            }
            return ChannelDeliveryResult.failed(ch, outcome == null ? "no delivery outcome" : outcome.error());
        } catch (RuntimeException e) {
            log.warn("{} delivery threw: {}", ch.type().code(), e.toString());
            return ChannelDeliveryResult.failed(ch, e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }
}
