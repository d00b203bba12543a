package com.jay.trendagent.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.trendagent.config.AgentConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Telegram Bot API client, send-only.
 * Announces entries, exits, order failures and Brain mode changes.
 * All interaction uses OkHttp, no Telegram SDK dependency.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TelegramService {

    private static final String API_BASE = "https://api.telegram.org/bot";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final AgentConfig config;
    private final ObjectMapper mapper = new ObjectMapper();
    private OkHttpClient httpClient;

    @PostConstruct
    public void init() {
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(15, TimeUnit.SECONDS)
            .build();
        log.info("TelegramService initialized. Bot configured: {}", isConfigured());
    }

    public boolean isConfigured() {
        String token = config.telegram().getBotToken();
        String chatId = config.telegram().getChatId();
        return token != null && !token.isBlank() && chatId != null && !chatId.isBlank();
    }

    /**
     * Sends an HTML message to the configured chat. Returns false when not configured or on failure.
     */
    public boolean sendMessage(String text) {
        if (!isConfigured()) {
            log.debug("Telegram not configured — message not sent");
            return false;
        }

        try {
            String payload = mapper.createObjectNode()
                .put("chat_id", config.telegram().getChatId())
                .put("text", text)
                .put("parse_mode", "HTML")
                .toString();

            Request request = new Request.Builder()
                .url(API_BASE + config.telegram().getBotToken() + "/sendMessage")
                .post(RequestBody.create(payload, JSON))
                .build();

            try (Response response = httpClient.newCall(request).execute()) {
                if (response.isSuccessful()) {
                    log.debug("Telegram message sent successfully");
                    return true;
                }
                log.error("Telegram sendMessage failed: {} — {}",
                    response.code(), response.body() != null ? response.body().string() : "");
                return false;
            }
        } catch (IOException e) {
            log.error("Telegram sendMessage exception: {}", e.getMessage());
            return false;
        }
    }

    /** Sends a titled alert. */
    public boolean sendAlert(String title, String body) {
        return sendMessage("<b>" + title + "</b>\n" + body);
    }
}
