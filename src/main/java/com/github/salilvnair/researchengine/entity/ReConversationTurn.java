package com.github.salilvnair.researchengine.entity;

import com.github.salilvnair.researchengine.entity.converter.ParameterMapJsonConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.Map;

@Entity
@Table(name = "re_conversation_turn",
        indexes = @Index(name = "idx_re_turn_conversation", columnList = "conversation_id, created_at"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReConversationTurn {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "turn_id")
    private Long turnId;

    @Column(nullable = false, name = "conversation_id")
    private String conversationId;

    @Column(name = "user_id")
    private String userId;

    @Column(nullable = false, name = "role")
    private String role;

    @Column(name = "content_text", columnDefinition = "text")
    private String contentText;

    @Column(name = "intent_type")
    private String intentType;

    @Convert(converter = ParameterMapJsonConverter.class)
    @Column(name = "parameters_json", columnDefinition = "text")
    private Map<String, Object> parameters;

    @Column(nullable = false, name = "created_at")
    private OffsetDateTime createdAt;
}
