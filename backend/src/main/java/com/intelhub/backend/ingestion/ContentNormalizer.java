package com.intelhub.backend.ingestion;

import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

/**
 * Converts feed content to plain text. HTML is reduced to its paragraphs; plain text only has its
 * whitespace tidied.
 */
@Slf4j
@Component
public class ContentNormalizer {

    private static final Pattern HTML_TAG = Pattern.compile("<\\s*[a-zA-Z][^>]*>");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\x0B\\f\\u00A0]+");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    public String toText(String rawContent) {
        if (rawContent == null) {
            return "";
        }
        if (!HTML_TAG.matcher(rawContent).find()) {
            return tidy(rawContent);
        }

        Document doc = Jsoup.parse(rawContent);
        doc.select("script, style, noscript, iframe, nav, footer, aside, form").remove();

        Elements blocks = doc.select("p, li, h1, h2, h3, h4, h5, h6, blockquote, pre");
        if (blocks.isEmpty()) {
            return tidy(doc.body() != null ? doc.body().text() : doc.text());
        }

        StringBuilder content = new StringBuilder();
        for (Element block : blocks) {
            // Nested blocks are covered by their outermost ancestor
            if (block.parents().stream().anyMatch(blocks::contains)) {
                continue;
            }
            String text = block.text().trim();
            if (!text.isEmpty()) {
                content.append(text).append("\n\n");
            }
        }
        String text = tidy(content.toString());
        log.debug("Normalized HTML content: {} blocks, {} characters", blocks.size(), text.length());
        return text;
    }

    private String tidy(String text) {
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        normalized = HORIZONTAL_SPACE.matcher(normalized).replaceAll(" ");
        normalized = normalized.lines().map(String::strip).reduce((a, b) -> a + "\n" + b).orElse("");
        return BLANK_LINES.matcher(normalized).replaceAll("\n\n").trim();
    }
}
