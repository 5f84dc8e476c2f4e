package ai.eigloo.questionnaire.diagram.style;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ColorRangeTest {

    @Test
    void testNormalizeExpandsShortForm() {
        assertThat(ColorRange.normalize("#F00")).isEqualTo("ff0000");
        assertThat(ColorRange.normalize("00FF00")).isEqualTo("00ff00");
    }

    @Test
    void testNormalizeRejectsMalformedColours() {
        for (String color : new String[] {"", "#12", "#1234567", "#gg0000", "none"}) {
            assertThat(ColorRange.normalize(color)).as(color).isNull();
        }
    }

    @Test
    void testNullNeverMatches() {
        for (ColorRange range : ColorRange.values()) {
            assertThat(range.matches(null)).isFalse();
            assertThat(range.matches("not-a-colour")).isFalse();
        }
    }

    @Test
    void testRed() {
        assertThat(ColorRange.RED.matches("#ff0000")).isTrue();
        assertThat(ColorRange.RED.matches("#e51400")).isTrue();
        assertThat(ColorRange.RED.matches("#f8cecc")).isFalse();
    }

    @Test
    void testGreen() {
        assertThat(ColorRange.GREEN.matches("#60a917")).isTrue();
        assertThat(ColorRange.GREEN.matches("#0f0")).isTrue();
        assertThat(ColorRange.GREEN.matches("#d5e8d4")).isFalse();
    }

    @Test
    void testGreyUsesAllChannels() {
        assertThat(ColorRange.GREY.matches("#808080")).isTrue();
        assertThat(ColorRange.GREY.matches("#f5f5f5")).isTrue();
        assertThat(ColorRange.GREY.matches("#858080")).isTrue();
        assertThat(ColorRange.GREY.matches("#808099")).isFalse();
    }

    @Test
    void testYellowAndOrange() {
        assertThat(ColorRange.YELLOW.matches("#ffff00")).isTrue();
        assertThat(ColorRange.YELLOW.matches("#ff9900")).isFalse();
        assertThat(ColorRange.ORANGE.matches("#ff9900")).isTrue();
        assertThat(ColorRange.ORANGE.matches("#ffff00")).isFalse();
    }
}
