package com.chatstream.domain.session.model.valobj;

import com.chatstream.types.enums.SenderTypeEnum;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * 已提交的会话消息（不可变）。同一 id 再次提交时原位替换。
 */
public record ChatMessage(String id,
                          String conversationId,
                          SenderTypeEnum senderType,
                          String senderId,
                          String content,
                          Integer tokens,
                          Instant createdAt) {

    private static final DateTimeFormatter TIMESTAMP_FORMATTER = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .toFormatter();

    public ChatMessage {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Message id cannot be blank");
        }
        content = content == null ? "" : content;
    }

    /**
     * 解析后端时间戳：支持带时区偏移的 RFC3339 与不带时区的本地时间（按 UTC 处理）。
     * 无法解析时返回 null。
     */
    public static Instant parseCreatedAt(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().replace(' ', 'T');
        try {
            TemporalAccessor parsed = TIMESTAMP_FORMATTER.parseBest(normalized, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }
}
