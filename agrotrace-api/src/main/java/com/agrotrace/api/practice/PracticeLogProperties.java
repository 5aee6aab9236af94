package com.agrotrace.api.practice;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Initial role holders of the practice log. Read only when the settings record does not exist yet.
 */
@Configuration
@ConfigurationProperties(prefix = "agrotrace.practice-log")
public class PracticeLogProperties {

    private String owner = "deployer";
    private String moderator;

    public String getOwner() { return owner; }
    public void setOwner(String owner) { this.owner = owner; }
    /** Defaults to the owner when not set. */
    public String getModerator() { return moderator != null ? moderator : owner; }
    public void setModerator(String moderator) { this.moderator = moderator; }
}
