package com.micronote.backend.modules.note.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.micronote.backend.global.jpa.AbstractTimestampedEntity;
import com.micronote.backend.modules.auth.domain.Account;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;

import org.hibernate.annotations.BatchSize;
import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "note")
public class Note extends AbstractTimestampedEntity {

    public static final int MAX_TITLE_LENGTH = 100;
    public static final int MAX_TEXT_LENGTH = 5000;
    public static final int MAX_TAGS = 20;
    public static final int MAX_TAG_LENGTH = 20;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "account_id", nullable = false, updatable = false)
    private Account owner;

    @Column(name = "title", nullable = false, length = MAX_TITLE_LENGTH)
    private String title;

    @Column(name = "content", nullable = false, length = MAX_TEXT_LENGTH)
    private String text;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "note_tag", joinColumns = @JoinColumn(name = "note_id"))
    @OrderColumn(name = "tag_order")
    @Column(name = "tag", nullable = false, length = MAX_TAG_LENGTH)
    @BatchSize(size = 50)
    private List<String> tags = new ArrayList<>();

    @Column(name = "is_pinned", nullable = false)
    private boolean pinned;

    @Column(name = "is_archived", nullable = false)
    private boolean archived;

    public UUID getId() {
        return id;
    }

    public Account getOwner() {
        return owner;
    }

    public void setOwner(Account owner) {
        this.owner = owner;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public List<String> getTags() {
        return tags;
    }

    public void replaceTags(List<String> newTags) {
        this.tags.clear();
        this.tags.addAll(newTags);
    }

    public boolean isPinned() {
        return pinned;
    }

    public void setPinned(boolean pinned) {
        this.pinned = pinned;
    }

    public boolean isArchived() {
        return archived;
    }

    public void setArchived(boolean archived) {
        this.archived = archived;
    }
}
