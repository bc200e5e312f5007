package com.artinerary.domain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "artinerary.engage")
public class EngageProperties {

    /** Messages kept per event chat; older ones are trimmed on every post (default 20). */
    private int chatRetention = 20;

    /** Max event chat message length after trim (default 300). */
    private int chatMaxLength = 300;

    /** Max direct message length after trim (default 500). */
    private int directMessageMaxLength = 500;

    /** Max stops beyond the start location (default 5). */
    private int maxStops = 5;

    /** Random suffix length appended to the slugified title (default 8). */
    private int slugSuffixLength = 8;

    public int getChatRetention() {
        return chatRetention;
    }

    public void setChatRetention(int chatRetention) {
        this.chatRetention = chatRetention;
    }

    public int getChatMaxLength() {
        return chatMaxLength;
    }

    public void setChatMaxLength(int chatMaxLength) {
        this.chatMaxLength = chatMaxLength;
    }

    public int getDirectMessageMaxLength() {
        return directMessageMaxLength;
    }

    public void setDirectMessageMaxLength(int directMessageMaxLength) {
        this.directMessageMaxLength = directMessageMaxLength;
    }

    public int getMaxStops() {
        return maxStops;
    }

    public void setMaxStops(int maxStops) {
        this.maxStops = maxStops;
    }

    public int getSlugSuffixLength() {
        return slugSuffixLength;
    }

    public void setSlugSuffixLength(int slugSuffixLength) {
        this.slugSuffixLength = slugSuffixLength;
    }
}
