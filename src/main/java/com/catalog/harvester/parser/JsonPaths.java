package com.catalog.harvester.parser;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Tiny path language for pulling values out of listing responses.
 * <p>
 * A path is a dot-separated list of field names; a name suffixed with {@code []}
 * fans out over the elements of that array. {@code productGroupings[].products[].pdpUrl.url}
 * yields the URL of every product of every grouping.
 * </p>
 */
public final class JsonPaths {

    private static final String FAN_OUT = "[]";

    private JsonPaths() {
    }

    public static List<JsonNode> expand(final JsonNode root, final String path) {
        List<JsonNode> current = new ArrayList<>();
        if (root == null || root.isMissingNode()) {
            return current;
        }
        current.add(root);
        for (String segment : StringUtils.split(path, '.')) {
            boolean fanOut = segment.endsWith(FAN_OUT);
            String field = fanOut ? segment.substring(0, segment.length() - FAN_OUT.length()) : segment;
            List<JsonNode> next = new ArrayList<>();
            for (JsonNode node : current) {
                JsonNode child = field.isEmpty() ? node : node.path(field);
                if (fanOut) {
                    if (child.isArray()) {
                        child.forEach(next::add);
                    }
                } else if (!child.isMissingNode() && !child.isNull()) {
                    next.add(child);
                }
            }
            current = next;
        }
        return current;
    }

    /** Non-blank textual values reached by {@code path}. */
    public static List<String> texts(final JsonNode root, final String path) {
        List<String> out = new ArrayList<>();
        for (JsonNode n : expand(root, path)) {
            if (n.isValueNode() && StringUtils.isNotBlank(n.asText())) {
                out.add(n.asText().trim());
            }
        }
        return out;
    }
}
