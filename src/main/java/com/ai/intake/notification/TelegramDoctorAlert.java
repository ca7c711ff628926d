package com.ai.intake.notification;

import com.ai.intake.conversation.AnsweredQuestion;
import com.ai.intake.conversation.IntakeSnapshot;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.HtmlUtils;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;

/**
 * Sends the doctor an HTML consultation summary through the Telegram Bot API.
 * Does nothing while the bot token or chat id is unset.
 */
@Component
public class TelegramDoctorAlert implements IntakeCompletionListener {

    private static final Logger log = LoggerFactory.getLogger(TelegramDoctorAlert.class);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String botToken;
    private final String chatId;
    private final ZoneId zone;

    public TelegramDoctorAlert(@Qualifier("notificationRestTemplate") RestTemplate restTemplate,
                               @Value("${telegram.base-url:https://api.telegram.org}") String baseUrl,
                               @Value("${telegram.bot-token:}") String botToken,
                               @Value("${telegram.doctor-chat-id:}") String chatId,
                               @Value("${telegram.zone:UTC}") String zone) {
        this.restTemplate = restTemplate;
        this.baseUrl = StringUtils.removeEnd(baseUrl, "/");
        this.botToken = botToken;
        this.chatId = chatId;
        this.zone = ZoneId.of(zone);
    }

    public boolean isEnabled() {
        return StringUtils.isNoneBlank(botToken, chatId);
    }

    @Override
    public void onIntakeCompleted(IntakeSnapshot snapshot) {
        if (!isEnabled()) {
            log.debug("[{}] Telegram alert skipped, bot not configured", snapshot.conversationId());
            return;
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        Map<String, Object> body = new HashMap<>();
        body.put("chat_id", chatId);
        body.put("text", formatSummary(snapshot));
        body.put("parse_mode", "HTML");

        ResponseEntity<String> response = restTemplate.postForEntity(
                baseUrl + "/bot" + botToken + "/sendMessage", new HttpEntity<>(body, headers), String.class);
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new IllegalStateException("Telegram returned " + response.getStatusCode());
        }
        log.info("[{}] Consultation summary sent to doctor", snapshot.conversationId());
    }

    String formatSummary(IntakeSnapshot s) {
        StringBuilder sb = new StringBuilder();
        sb.append("<b>CARDIOLOGY CONSULTATION REQUEST</b>\n\n");
        sb.append("<b>Patient Information:</b>\n");
        sb.append("• Name: ").append(orNotProvided(s.name())).append('\n');
        sb.append("• Email: ").append(orNotProvided(s.email())).append('\n');
        sb.append("• Age: ").append(orNotProvided(s.age() != null ? s.age().toString() : null)).append('\n');
        sb.append("• Gender: ").append(orNotProvided(s.gender())).append("\n\n");
        sb.append("<b>Reported Symptom:</b> ").append(escape(s.symptom()));
        if (!s.symptomMatched()) sb.append(" (unmatched)");
        sb.append("\n\n<b>Clinical Assessment:</b>");
        int i = 1;
        for (AnsweredQuestion a : s.answers()) {
            sb.append("\n  ").append(i++).append(". ").append(escape(a.question()))
                    .append("\n     ").append(StringUtils.isBlank(a.answer()) ? "(no answer)" : escape(a.answer()));
        }
        if (s.answers().isEmpty()) sb.append("\n  No follow-up questions.");
        if (s.completedAt() != null) {
            sb.append("\n\n<b>Consultation Time:</b> ").append(TIME.format(s.completedAt().atZone(zone)));
        }
        sb.append("\n<b>Status:</b> Awaiting physician review");
        return sb.toString();
    }

    private static String orNotProvided(String value) {
        return StringUtils.isBlank(value) ? "Not provided" : escape(value);
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
