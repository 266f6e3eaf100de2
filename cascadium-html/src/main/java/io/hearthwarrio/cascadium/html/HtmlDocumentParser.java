package io.hearthwarrio.cascadium.html;

import io.hearthwarrio.cascadium.core.dom.Document;
import io.hearthwarrio.cascadium.core.dom.DocumentBuilder;
import nu.validator.htmlparser.common.XmlViolationPolicy;
import nu.validator.htmlparser.sax.HtmlParser;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds a {@link Document} from HTML markup using the validator.nu HTML5 parser.
 * <p>
 * The parser applies the HTML5 tree construction rules, so implied {@code html}, {@code head} and {@code body}
 * elements are always present and malformed markup is repaired rather than rejected.
 * Text inside {@code <style>} elements is collected as stylesheets; text inside {@code <script>} is dropped.
 * <p>
 * This class is stateless and can be shared.
 */
public final class HtmlDocumentParser {

    /**
     * Parses a complete HTML page.
     *
     * @param html markup
     * @return document and embedded stylesheets
     * @throws MarkupParseException when the parser fails to read the input
     */
    public HtmlPage parse(String html) {
        Objects.requireNonNull(html, "html must not be null");

        HtmlParser parser = new HtmlParser(XmlViolationPolicy.ALLOW);
        TreeHandler handler = new TreeHandler();
        parser.setContentHandler(handler);
        try {
            parser.parse(new InputSource(new StringReader(html)));
        } catch (IOException | SAXException e) {
            throw new MarkupParseException("Cannot parse HTML: " + e.getMessage(), e);
        }
        return new HtmlPage(handler.document(), handler.stylesheets);
    }

    /**
     * Shortcut for {@code parse(html).getDocument()}.
     */
    public Document parseDocument(String html) {
        return parse(html).getDocument();
    }

    private static final class TreeHandler extends DefaultHandler {

        private DocumentBuilder builder;
        private int depth;
        private String rawTextElement;
        private StringBuilder rawText;
        private final List<String> stylesheets = new ArrayList<>();

        @Override
        public void startElement(String uri, String localName, String qName, Attributes attributes) {
            String tag = localName.toLowerCase(Locale.ROOT);
            if (builder == null) {
                builder = Document.builder(tag);
            } else {
                builder.open(tag);
            }
            depth++;

            for (int i = 0; i < attributes.getLength(); i++) {
                builder.attribute(attributes.getLocalName(i), attributes.getValue(i));
            }

            if ("style".equals(tag) || "script".equals(tag)) {
                rawTextElement = tag;
                rawText = new StringBuilder();
            }
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            String tag = localName.toLowerCase(Locale.ROOT);
            if (rawTextElement != null && rawTextElement.equals(tag)) {
                if ("style".equals(tag)) {
                    stylesheets.add(rawText.toString());
                }
                rawTextElement = null;
                rawText = null;
            }

            depth--;
            // the root stays open until build()
            if (depth > 0) {
                builder.close();
            }
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            if (builder == null) {
                return;
            }
            if (rawText != null) {
                rawText.append(ch, start, length);
                return;
            }
            builder.text(new String(ch, start, length));
        }

        Document document() {
            if (builder == null) {
                return Document.builder("html").build();
            }
            return builder.build();
        }
    }
}
