package com.pennywise_sync.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("chat_messages")
public class ChatMessage {

    @Id
    private String id; // UUID from the device

    @Column("message")
    private String message;

    // The device exports these two in camelCase
    @JsonProperty("isUser")
    @Column("is_user")
    private Boolean isUser;

    @JsonProperty("isSystemPrompt")
    @Column("is_system_prompt")
    private Boolean isSystemPrompt;

    // Epoch millis
    @Column("sent_at")
    private Long timestamp;
}
