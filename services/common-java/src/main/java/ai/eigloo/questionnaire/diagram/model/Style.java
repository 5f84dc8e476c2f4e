package ai.eigloo.questionnaire.diagram.model;

import ai.eigloo.questionnaire.diagram.style.ColorRange;
import ai.eigloo.questionnaire.diagram.style.StyleGrammar;

import java.util.Map;

/**
 * Visual style properties that carry meaning for classification.
 *
 * @param fillColor fill colour as lower-case {@code #rrggbb}, or null
 * @param strokeColor stroke colour as lower-case {@code #rrggbb}, or null
 * @param rounded whether corners are rounded
 * @param dashed whether the outline is dashed
 */
public record Style(String fillColor, String strokeColor, boolean rounded, boolean dashed) {

    private static final Style PLAIN = new Style(null, null, false, false);

    public Style {
        fillColor = normalizeColor(fillColor);
        strokeColor = normalizeColor(strokeColor);
    }

    public static Style plain() {
        return PLAIN;
    }

    public static Style fromProperties(Map<String, String> properties) {
        if (properties == null || properties.isEmpty()) {
            return PLAIN;
        }
        return new Style(
                properties.get("fillColor"),
                properties.get("strokeColor"),
                StyleGrammar.isEnabled(properties, "rounded"),
                StyleGrammar.isEnabled(properties, "dashed"));
    }

    private static String normalizeColor(String color) {
        if (color == null) {
            return null;
        }
        String trimmed = color.trim();
        if (trimmed.isEmpty() || "none".equalsIgnoreCase(trimmed) || "default".equalsIgnoreCase(trimmed)) {
            return null;
        }
        String hex = ColorRange.normalize(trimmed);
        if (hex != null) {
            return "#" + hex;
        }
        // not a hex colour, kept as written so that it matches no colour range
        return trimmed.startsWith("#") ? trimmed : "#" + trimmed;
    }
}
