package com.docmend.core.review;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "docmend.review")
public class ReviewProperties {

    /** Upper bound on open reviews; the least recently used one is dropped beyond it. */
    private int maxOpen = 500;

    /** Reviews untouched for this long are dropped. */
    private int idleMinutes = 60;

    public int getMaxOpen() {
        return maxOpen;
    }

    public void setMaxOpen(int maxOpen) {
        this.maxOpen = maxOpen;
    }

    public int getIdleMinutes() {
        return idleMinutes;
    }

    public void setIdleMinutes(int idleMinutes) {
        this.idleMinutes = idleMinutes;
    }
}
