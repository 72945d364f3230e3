package com.catalog.harvester.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the delimited JSON blocks a render worker writes to stderr.
 * <p>
 * Data blocks are merged (later keys win) into one object; debug blocks are only logged.
 * </p>
 */
@Slf4j
public class SideChannelExtractor {

    private final ObjectMapper mapper;

    private final Pattern dataBlock;

    private final Pattern debugBlock;

    public SideChannelExtractor(final ObjectMapper mapper, final Pattern dataBlock, final Pattern debugBlock) {
        this.mapper = mapper;
        this.dataBlock = dataBlock;
        this.debugBlock = debugBlock;
    }

    /**
     * @param stderr raw worker diagnostics
     * @return merged side-channel object, {@code null} when there is none
     */
    public JsonNode extract(final String stderr) {
        if (StringUtils.isBlank(stderr)) {
            return null;
        }
        logDebugBlocks(stderr);

        ObjectNode merged = null;
        Matcher m = dataBlock.matcher(stderr);
        while (m.find()) {
            try {
                JsonNode block = mapper.readTree(m.group(1).trim());
                if (block != null && block.isObject()) {
                    if (merged == null) {
                        merged = mapper.createObjectNode();
                    }
                    merged.setAll((ObjectNode) block);
                }
            } catch (JsonProcessingException ex) {
                log.warn("Ignoring malformed side-channel block: {}", ex.getOriginalMessage());
            }
        }
        return merged;
    }

    private void logDebugBlocks(final String stderr) {
        if (!log.isDebugEnabled()) {
            return;
        }
        Matcher m = debugBlock.matcher(stderr);
        while (m.find()) {
            log.debug("Render worker debug: {}", StringUtils.abbreviate(m.group(1).trim(), 2000));
        }
    }
}
