package com.sentinel.core.domain;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.UUID;

/**
 * Per-stream chat visibility. Lockdown checks lock this row so a stream gets
 * at most one unresolved mass report event.
 */
@Entity
@Table(name = "stream_chat_states")
public class StreamChatState implements Persistable<UUID> {

    @Id
    @Column(name = "stream_id")
    private UUID streamId;

    @Column(name = "creator_id")
    private UUID creatorId;

    @Column(name = "chat_hidden", nullable = false)
    private boolean chatHidden;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Transient
    private boolean fresh = true;

    protected StreamChatState() {}

    public static StreamChatState create(UUID streamId, UUID creatorId) {
        var state = new StreamChatState();
        state.streamId = streamId;
        state.creatorId = creatorId;
        state.chatHidden = false;
        return state;
    }

    public void hideChat(Instant now) {
        this.chatHidden = true;
        this.updatedAt = now;
    }

    public void showChat(Instant now) {
        this.chatHidden = false;
        this.updatedAt = now;
    }

    public void assignCreator(UUID creatorId) {
        if (this.creatorId == null) {
            this.creatorId = creatorId;
        }
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.fresh = false;
    }

    @Override
    public UUID getId() { return streamId; }

    @Override
    public boolean isNew() { return fresh; }

    public UUID getStreamId() { return streamId; }
    public UUID getCreatorId() { return creatorId; }
    public boolean isChatHidden() { return chatHidden; }
    public Instant getUpdatedAt() { return updatedAt; }
}
