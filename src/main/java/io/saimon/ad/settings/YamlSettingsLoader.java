/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.settings;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.opensearch.common.settings.Settings;
import org.opensearch.common.settings.SettingsException;
import org.opensearch.common.xcontent.yaml.YamlXContent;
import org.opensearch.core.xcontent.DeprecationHandler;
import org.opensearch.core.xcontent.NamedXContentRegistry;
import org.opensearch.core.xcontent.XContentParser;

/**
 * Loads a YAML configuration into flat settings keys.
 *
 * Nested objects become dotted keys. A list of scalars becomes a list setting. A list that holds
 * objects is flattened by position, so {@code metrics: [{name: a}]} becomes {@code metrics.0.name = a}.
 */
public final class YamlSettingsLoader {

    private YamlSettingsLoader() {}

    /**
     * Parses a YAML document into the builder.
     *
     * @param builder settings builder to fill
     * @param resourceName name of the document, used in error messages
     * @param in YAML content
     * @throws IOException when the stream cannot be read
     * @throws SettingsException when the content is not a YAML mapping
     */
    public static void load(Settings.Builder builder, String resourceName, InputStream in) throws IOException {
        XContentParser.Token token;
        Map<String, Object> root = null;
        try (
            XContentParser parser = YamlXContent.yamlXContent
                .createParser(NamedXContentRegistry.EMPTY, DeprecationHandler.THROW_UNSUPPORTED_OPERATION, in)
        ) {
            token = parser.nextToken();
            if (token == XContentParser.Token.START_OBJECT) {
                root = parser.map();
            }
        } catch (RuntimeException e) {
            throw new SettingsException("Failed to load settings from [" + resourceName + "]", e);
        }
        if (token == null) {
            return;
        }
        if (root == null) {
            throw new SettingsException("Settings in [" + resourceName + "] must be a mapping, got " + token);
        }
        flatten(builder, null, root);
    }

    @SuppressWarnings("unchecked")
    static void flatten(Settings.Builder builder, String prefix, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof Map) {
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) value).entrySet()) {
                flatten(builder, prefix == null ? entry.getKey() : prefix + "." + entry.getKey(), entry.getValue());
            }
        } else if (value instanceof List) {
            List<Object> list = (List<Object>) value;
            if (containsStructures(list)) {
                for (int i = 0; i < list.size(); i++) {
                    flatten(builder, prefix + "." + i, list.get(i));
                }
            } else {
                List<String> values = new ArrayList<>(list.size());
                for (Object item : list) {
                    values.add(String.valueOf(item));
                }
                builder.putList(prefix, values);
            }
        } else {
            builder.put(prefix, String.valueOf(value));
        }
    }

    private static boolean containsStructures(List<Object> list) {
        for (Object item : list) {
            if (item instanceof Map || item instanceof List) {
                return true;
            }
        }
        return false;
    }
}
