package com.agrotrace.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;

import java.util.Objects;

/**
 * Singleton role record of the practice log: its owner and the current moderator.
 */
@Entity
@Table(name = "practice_log_settings")
public class PracticeLogSettings {

    public static final long SINGLETON_ID = 1L;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @NotBlank
    @Column(name = "owner", nullable = false)
    private String owner;

    @NotBlank
    @Column(name = "moderator", nullable = false)
    private String moderator;

    protected PracticeLogSettings() {}

    public static PracticeLogSettings initial(String owner, String moderator) {
        PracticeLogSettings settings = new PracticeLogSettings();
        settings.id = SINGLETON_ID;
        settings.owner = Objects.requireNonNull(owner, "Owner cannot be null");
        settings.moderator = Objects.requireNonNull(moderator, "Moderator cannot be null");
        return settings;
    }

    public void changeOwner(String owner) {
        this.owner = Objects.requireNonNull(owner, "Owner cannot be null");
    }

    public void changeModerator(String moderator) {
        this.moderator = Objects.requireNonNull(moderator, "Moderator cannot be null");
    }

    public Long getId() { return id; }
    public String getOwner() { return owner; }
    public String getModerator() { return moderator; }
}
