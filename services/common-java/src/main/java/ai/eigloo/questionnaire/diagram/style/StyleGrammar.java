package ai.eigloo.questionnaire.diagram.style;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses draw.io style strings of the form {@code key=value;flag;key2=value2}.
 *
 * <p>Bare flag tokens (for example {@code rhombus} or {@code swimlane}) are stored with an
 * empty value so that presence checks can use {@link Map#containsKey(Object)}. When a key
 * appears more than once the last occurrence wins.</p>
 */
public final class StyleGrammar {

    private StyleGrammar() {
    }

    /**
     * Parses a style string into an insertion-ordered, unmodifiable property map.
     *
     * @param style the raw style string, may be null
     * @return the parsed properties, never null
     */
    public static Map<String, String> parse(String style) {
        if (style == null || style.isBlank()) {
            return Map.of();
        }
        LinkedHashMap<String, String> properties = new LinkedHashMap<>();
        for (String item : style.split(";")) {
            String token = item.trim();
            if (token.isEmpty()) {
                continue;
            }
            int separator = token.indexOf('=');
            if (separator < 0) {
                properties.put(token, "");
                continue;
            }
            String key = token.substring(0, separator).trim();
            if (key.isEmpty()) {
                continue;
            }
            properties.put(key, token.substring(separator + 1).trim());
        }
        return Collections.unmodifiableMap(properties);
    }

    /**
     * Returns true when the key is present as a bare flag or with any value.
     */
    public static boolean hasKey(Map<String, String> properties, String key) {
        return properties != null && properties.containsKey(key);
    }

    /**
     * Returns true when the style value for {@code key} is {@code 1}.
     */
    public static boolean isEnabled(Map<String, String> properties, String key) {
        return properties != null && "1".equals(properties.get(key));
    }
}
