package com.example.cdnmonitor.service;

import com.example.cdnmonitor.model.dto.NewAlert;
import com.example.cdnmonitor.model.dto.ServerSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.util.Locale;
import java.util.Map;

/**
 * Envia las notificaciones como mensaje de texto a un chat de Telegram.
 */
@Service
public class TelegramAlertNotifier implements AlertNotifier {

    private static final Logger log = LoggerFactory.getLogger(TelegramAlertNotifier.class);

    private final RestClient client;
    private final boolean enabled;
    private final String botToken;
    private final String chatId;

    @Autowired
    public TelegramAlertNotifier(
            @Value("${monitoring.notifications.telegram.enabled:false}") boolean enabled,
            @Value("${monitoring.notifications.telegram.bot-token:}") String botToken,
            @Value("${monitoring.notifications.telegram.chat-id:}") String chatId
    ) {
        this(RestClient.builder().baseUrl("https://api.telegram.org").build(), enabled, botToken, chatId);
    }

    TelegramAlertNotifier(RestClient client, boolean enabled, String botToken, String chatId) {
        this.client = client;
        this.enabled = enabled;
        this.botToken = botToken == null ? "" : botToken.trim();
        this.chatId = chatId == null ? "" : chatId.trim();
    }

    @Override
    public void serverDown(ServerSnapshot server) {
        send(String.format(
                "CRITICAL: Server %s is DOWN%nIP: %s%nRole: %s",
                server.hostname(),
                server.ipAddress(),
                server.role() == null ? "-" : server.role().code()
        ));
    }

    @Override
    public void alertRaised(ServerSnapshot server, NewAlert alert) {
        send(String.format(
                "%s alert: %s - %s%n%s%nTime: %s",
                alert.severity().code().toUpperCase(Locale.ROOT),
                server.hostname(),
                alert.type().code(),
                alert.message(),
                alert.createdAt()
        ));
    }

    void send(String message) {
        if (!enabled) return;
        if (botToken.isBlank() || chatId.isBlank()) {
            log.warn("Telegram no configurado (bot-token/chat-id vacio). Notificacion omitida.");
            return;
        }

        try {
            client.post()
                    .uri("/bot{token}/sendMessage", botToken)
                    .body(Map.of(
                            "chat_id", chatId,
                            "text", message,
                            "disable_web_page_preview", true
                    ))
                    .retrieve()
                    .toBodilessEntity();
        } catch (Exception ex) {
            log.warn("No se pudo enviar la notificacion a Telegram: {}", ex.getMessage());
        }
    }
}
