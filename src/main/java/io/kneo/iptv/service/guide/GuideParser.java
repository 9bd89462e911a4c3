package io.kneo.iptv.service.guide;

import io.kneo.iptv.model.GuideData;
import io.kneo.iptv.model.Programme;
import io.kneo.iptv.service.exceptions.SourceParseException;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.IOException;
import java.io.StringReader;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Streaming XMLTV reader. Programmes are grouped by their {@code channel} attribute and sorted by
 * start time within each group; ties keep document order.
 */
@ApplicationScoped
public class GuideParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(GuideParser.class);

    public GuideData parse(String content) {
        if (content == null || content.isBlank()) {
            throw new SourceParseException("Guide document is empty");
        }
        XmltvHandler handler = new XmltvHandler();
        try {
            newParser().parse(new InputSource(new StringReader(content)), handler);
        } catch (SAXException e) {
            throw new SourceParseException("Malformed XMLTV document: " + e.getMessage(), e);
        } catch (IOException | ParserConfigurationException e) {
            throw new SourceParseException("Unable to read XMLTV document", e);
        }

        Map<String, List<Programme>> programmes = new LinkedHashMap<>();
        handler.programmes.forEach((guideId, list) -> {
            list.sort(Comparator.comparing(Programme::start));
            programmes.put(guideId, List.copyOf(list));
        });
        GuideData guide = new GuideData(programmes, handler.displayNames);
        LOGGER.info("Parsed guide: {} programmes for {} channels, {} skipped",
                guide.programmeCount(), guide.channelCount(), handler.skipped);
        return guide;
    }

    private static SAXParser newParser() throws ParserConfigurationException, SAXException {
        SAXParserFactory factory = SAXParserFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setValidating(false);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        return factory.newSAXParser();
    }

    private static class XmltvHandler extends DefaultHandler {
        private final Map<String, List<Programme>> programmes = new LinkedHashMap<>();
        private final Map<String, String> displayNames = new HashMap<>();
        private final StringBuilder text = new StringBuilder();
        private int skipped;

        private String channelId;
        private ProgrammeDraft draft;
        private boolean capturing;

        @Override
        public void startElement(String uri, String localName, String qName, Attributes attributes) {
            switch (qName) {
                case "channel" -> channelId = attributes.getValue("id");
                case "programme" -> draft = new ProgrammeDraft(
                        attributes.getValue("channel"),
                        attributes.getValue("start"),
                        attributes.getValue("stop"));
                case "display-name", "title", "desc", "category" -> {
                    text.setLength(0);
                    capturing = true;
                }
                default -> {
                }
            }
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            if (capturing) {
                text.append(ch, start, length);
            }
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            String value = capturing ? text.toString().trim() : null;
            capturing = false;
            switch (qName) {
                case "display-name" -> {
                    if (draft == null && channelId != null && !value.isEmpty()) {
                        displayNames.putIfAbsent(value.toLowerCase(Locale.ROOT), channelId);
                    }
                }
                case "title" -> {
                    if (draft != null && draft.title == null) draft.title = value;
                }
                case "desc" -> {
                    if (draft != null && draft.description == null) draft.description = value;
                }
                case "category" -> {
                    if (draft != null && draft.category == null) draft.category = value;
                }
                case "channel" -> channelId = null;
                case "programme" -> {
                    addProgramme(draft);
                    draft = null;
                }
                default -> {
                }
            }
        }

        private void addProgramme(ProgrammeDraft d) {
            if (d == null) {
                return;
            }
            if (d.channel == null || d.channel.isBlank()) {
                skip(d, "missing channel attribute");
                return;
            }
            Instant start;
            Instant stop;
            try {
                start = XmltvTime.parse(d.start);
                stop = XmltvTime.parse(d.stop);
            } catch (DateTimeException e) {
                skip(d, e.getMessage());
                return;
            }
            if (!stop.isAfter(start)) {
                skip(d, "stop is not after start");
                return;
            }
            programmes.computeIfAbsent(d.channel, k -> new ArrayList<>())
                    .add(new Programme(d.channel, d.title == null ? "" : d.title, d.description, d.category, start, stop));
        }

        private void skip(ProgrammeDraft d, String reason) {
            skipped++;
            LOGGER.warn("Skipping programme '{}' on channel '{}' ({} - {}): {}", d.title, d.channel, d.start, d.stop, reason);
        }
    }

    private static class ProgrammeDraft {
        private final String channel;
        private final String start;
        private final String stop;
        private String title;
        private String description;
        private String category;

        ProgrammeDraft(String channel, String start, String stop) {
            this.channel = channel;
            this.start = start;
            this.stop = stop;
        }
    }
}
