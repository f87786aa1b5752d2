package com.autopilot.notification.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Уведомления людям: письмо через SMTP и сообщение в Slack через webhook.
 * Методы не бросают исключений и не повторяют отправку: ошибка - false.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final JavaMailSender mailSender;
    private final RestTemplate restTemplate;

    @Value("${spring.mail.host:localhost}")
    private String mailHost;

    @Value("${spring.mail.port:1025}")
    private Integer mailPort;

    @Value("${autopilot.notification.from:autopilot@company.com}")
    private String fromEmail;

    @Value("${autopilot.notification.slack-webhook-url:}")
    private String slackWebhookUrl;

    public boolean sendEmail(String to, String subject, String body) {
        if (to == null || to.isBlank()) {
            log.warn("Письмо не отправлено: адрес получателя пуст (тема: {})", subject);
            return false;
        }

        try {
            SimpleMailMessage msg = new SimpleMailMessage();
            msg.setFrom(fromEmail);
            msg.setTo(to);
            msg.setSubject(subject);
            msg.setText(body);

            mailSender.send(msg);

            log.info("Письмо отправлено через SMTP {}:{}: to={}, subject={}", mailHost, mailPort, to, subject);
            return true;
        } catch (MailException e) {
            log.error("Ошибка отправки письма {} через SMTP {}:{}: {}", to, mailHost, mailPort, e.getMessage(), e);
            return false;
        }
    }

    public boolean sendSlack(String message) {
        return sendSlack(message, slackWebhookUrl);
    }

    public boolean sendSlack(String message, String webhookUrl) {
        if (webhookUrl == null || webhookUrl.isBlank()) {
            log.warn("Slack webhook не настроен, уведомление пропущено");
            return false;
        }

        try {
            restTemplate.postForEntity(webhookUrl, Map.of("text", message), String.class);
            log.info("Уведомление в Slack отправлено");
            return true;
        } catch (RestClientException e) {
            log.error("Ошибка отправки уведомления в Slack: {}", e.getMessage(), e);
            return false;
        }
    }
}
