package com.updownbot.hft.controller.shadow;

import com.updownbot.hft.controller.io.JsonLinesFile;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shadow lifecycle log: one line per {@link ShadowEvent}.
 */
public class ShadowLog {

    private final JsonLinesFile file;

    public ShadowLog(JsonLinesFile file) {
        this.file = file;
    }

    public void append(ShadowProposal event) {
        file.append(event);
    }

    /**
     * Latest state of every proposal on file, in first-seen order.
     */
    public Map<String, ShadowProposal> latestById() {
        Map<String, ShadowProposal> latest = new LinkedHashMap<>();
        List<ShadowProposal> events = file.readAll(ShadowProposal.class);
        for (ShadowProposal e : events) {
            if (e.id() != null) {
                latest.put(e.id(), e);
            }
        }
        return latest;
    }
}
