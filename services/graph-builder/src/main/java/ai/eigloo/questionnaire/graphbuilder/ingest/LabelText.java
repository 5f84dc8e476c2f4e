package ai.eigloo.questionnaire.graphbuilder.ingest;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

import java.util.regex.Pattern;

/**
 * Converts draw.io label values to plain text.
 */
final class LabelText {

    private static final String BLOCK_ELEMENTS = "div, p, li";
    private static final Pattern SPACES = Pattern.compile("[ \\t\\x0B\\f\\u00A0]+");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    private LabelText() {
    }

    /**
     * Returns the label as plain text. HTML labels lose their markup and have their entities
     * decoded; block ends and {@code <br>} become line breaks. Every line is trimmed.
     */
    static String toPlainText(String value, boolean html) {
        if (value == null) {
            return "";
        }
        String text = html ? htmlToText(value) : value;
        text = text.replace("\r\n", "\n").replace('\r', '\n');
        text = SPACES.matcher(text).replaceAll(" ");

        StringBuilder out = new StringBuilder();
        for (String line : text.split("\n", -1)) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(line.trim());
        }
        return BLANK_LINES.matcher(out.toString().trim()).replaceAll("\n\n");
    }

    private static String htmlToText(String value) {
        Document document = Jsoup.parseBodyFragment(value);
        document.outputSettings(new Document.OutputSettings().prettyPrint(false));
        for (Element lineBreak : document.select("br")) {
            lineBreak.replaceWith(new TextNode("\n"));
        }
        for (Element block : document.select(BLOCK_ELEMENTS)) {
            block.appendText("\n");
        }
        return document.body().wholeText();
    }
}
