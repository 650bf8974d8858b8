package com.intent.vision.core.service.notification;

import com.intent.vision.core.dto.AlertContent;
import com.intent.vision.core.dto.SendOutcome;
import com.intent.vision.core.enums.ChannelType;

import java.util.List;

/**
 * Transport for one channel type. Implementations report delivery problems in
 * the returned outcome; the dispatcher also tolerates thrown exceptions.
 */
public interface NotificationSender {

    ChannelType channelType();

    /**
     * False when the transport lacks credentials or endpoints and nothing can be sent.
     */
    boolean isConfigured();

    SendOutcome send(List<String> recipients, AlertContent content);
}
