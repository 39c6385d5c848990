package com.lodestar.core.tracker;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Work-item tracker settings, bound from {@code lodestar.tracker.*}.
 */
@Component
@ConfigurationProperties(prefix = "lodestar.tracker")
public class TrackerProperties {

    /** Directory the Markdown adapter writes drafts into, one subdirectory per run. */
    private String draftDirectory = "./lodestar-drafts";

    public String getDraftDirectory() {
        return draftDirectory;
    }

    public void setDraftDirectory(String draftDirectory) {
        this.draftDirectory = draftDirectory;
    }
}
