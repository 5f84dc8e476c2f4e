package ai.eigloo.questionnaire.diagram.style;

import java.util.Locale;

/**
 * Named colour ranges used to read meaning out of fill colours.
 *
 * <p>Colours are hex strings with an optional {@code #} prefix and three or six digits.
 * A missing or malformed colour matches no range.</p>
 */
public enum ColorRange {
    RED {
        @Override
        boolean test(int r, int g, int b) {
            return r > 180 && g < 100 && b < 100;
        }
    },
    GREEN {
        @Override
        boolean test(int r, int g, int b) {
            return r < 150 && g > 150 && b < 150;
        }
    },
    GREY {
        @Override
        boolean test(int r, int g, int b) {
            double mean = (r + g + b) / 3.0;
            return Math.abs(r - mean) <= GREY_TOLERANCE
                    && Math.abs(g - mean) <= GREY_TOLERANCE
                    && Math.abs(b - mean) <= GREY_TOLERANCE;
        }
    },
    YELLOW {
        @Override
        boolean test(int r, int g, int b) {
            return r > 180 && g > 180 && b < 100;
        }
    },
    ORANGE {
        @Override
        boolean test(int r, int g, int b) {
            return r > 180 && g > 100 && g < 180 && b < 100;
        }
    };

    private static final double GREY_TOLERANCE = 10.0;

    abstract boolean test(int r, int g, int b);

    /**
     * Returns true when {@code color} parses and falls within this range.
     */
    public boolean matches(String color) {
        int[] rgb = toRgb(color);
        return rgb != null && test(rgb[0], rgb[1], rgb[2]);
    }

    /**
     * Normalizes a colour to a lower-case six digit hex string without prefix.
     *
     * @return the normalized digits, or null when the colour is not a valid hex colour
     */
    public static String normalize(String color) {
        if (color == null) {
            return null;
        }
        String digits = color.trim().toLowerCase(Locale.ROOT);
        if (digits.startsWith("#")) {
            digits = digits.substring(1);
        }
        if (digits.length() == 3) {
            StringBuilder expanded = new StringBuilder(6);
            for (char c : digits.toCharArray()) {
                expanded.append(c).append(c);
            }
            digits = expanded.toString();
        }
        if (digits.length() != 6) {
            return null;
        }
        for (char c : digits.toCharArray()) {
            if (Character.digit(c, 16) < 0) {
                return null;
            }
        }
        return digits;
    }

    private static int[] toRgb(String color) {
        String digits = normalize(color);
        if (digits == null) {
            return null;
        }
        return new int[] {
                Integer.parseInt(digits.substring(0, 2), 16),
                Integer.parseInt(digits.substring(2, 4), 16),
                Integer.parseInt(digits.substring(4, 6), 16)
        };
    }
}
