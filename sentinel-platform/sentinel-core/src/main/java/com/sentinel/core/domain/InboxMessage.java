package com.sentinel.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "inbox_messages", indexes = {
    @Index(name = "idx_inbox_user", columnList = "user_id, created_at")
})
public class InboxMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @NotNull
    @Column(nullable = false, length = 500)
    private String title;

    @Column(length = 4000)
    private String body;

    @NotNull
    @Column(nullable = false)
    private String category;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @NotNull
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected InboxMessage() {}

    public static InboxMessage system(UUID userId, String title, String body, String category, Instant now) {
        var message = new InboxMessage();
        message.userId = userId;
        message.title = title;
        message.body = body;
        message.category = category;
        message.read = false;
        message.createdAt = now;
        return message;
    }

    public void markRead() {
        this.read = true;
    }

    public UUID getId() { return id; }
    public UUID getUserId() { return userId; }
    public String getTitle() { return title; }
    public String getBody() { return body; }
    public String getCategory() { return category; }
    public boolean isRead() { return read; }
    public Instant getCreatedAt() { return createdAt; }
}
