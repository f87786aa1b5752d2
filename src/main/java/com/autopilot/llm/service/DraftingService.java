package com.autopilot.llm.service;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Тексты для людей (письма, объяснения, брифы) через LLM.
 * Пустая строка означает "текста нет", и вызывающий код пропускает действие.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftingService {

    private static final int MAX_LIST_ITEMS = 10;

    private final ChatModel chatModel;

    /**
     * Короткое сообщение: письмо, заметка в CRM, напоминание.
     */
    public String draft(Map<String, Object> data, String instruction) {
        return ask("Ты пишешь короткие деловые письма. Не больше 150 слов, без вступлений.", data, instruction);
    }

    /**
     * Объяснение цифры или ситуации в 2-3 предложениях.
     */
    public String explain(Map<String, Object> data, String instruction) {
        return ask("Объясняй цифры простыми словами, 2-3 предложения.", data, instruction);
    }

    /**
     * Длинный текст: бриф, анализ, план действий.
     */
    public String generate(Map<String, Object> data, String instruction) {
        return ask("Ты готовишь структурированные брифы для руководителей.", data, instruction);
    }

    private String ask(String system, Map<String, Object> data, String instruction) {
        try {
            String context = formatContext(data);
            String prompt = context.isEmpty() ? instruction : context + "\n\n" + instruction;

            ChatRequest request = ChatRequest.builder()
                    .messages(List.of(
                            SystemMessage.from(system),
                            UserMessage.from(prompt)
                    ))
                    .build();

            ChatResponse response = chatModel.chat(request);
            String text = response.aiMessage().text();
            return text == null ? "" : text.trim();
        } catch (Exception e) {
            log.error("Ошибка генерации текста: {}", e.getMessage(), e);
            return "";
        }
    }

    static String formatContext(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        lines.add("ДАННЫЕ:");
        appendLines(data, 0, lines);
        return String.join("\n", lines);
    }

    private static void appendLines(Object value, int indent, List<String> lines) {
        String prefix = "  ".repeat(indent);
        if (value instanceof Map<?, ?> map) {
            map.forEach((key, item) -> {
                if (item instanceof Map<?, ?> || item instanceof List<?>) {
                    lines.add(prefix + key + ":");
                    appendLines(item, indent + 1, lines);
                } else if (item != null && !"".equals(item)) {
                    lines.add(prefix + key + ": " + item);
                }
            });
        } else if (value instanceof List<?> list) {
            list.stream().limit(MAX_LIST_ITEMS).forEach(item -> {
                if (item instanceof Map<?, ?>) {
                    lines.add(prefix + "-");
                    appendLines(item, indent + 1, lines);
                } else {
                    lines.add(prefix + "- " + item);
                }
            });
        }
    }
}
