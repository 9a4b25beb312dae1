package net.findmyaisle.support.parsing;

import lombok.extern.slf4j.Slf4j;
import net.findmyaisle.model.ParsedRecord;
import net.findmyaisle.model.RecordKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a free-text source answer into store or product records.
 *
 * <p>The strict path reads blank-line separated sections of {@code KEY: value} lines
 * (see {@link RecordField}). When it yields nothing, a keyword scan over the whole
 * text is used instead. Records are deduplicated by store id or product name, first
 * occurrence wins.</p>
 *
 * <p>Parsing never throws: malformed input produces a shorter (possibly empty) list.</p>
 */
@Slf4j
@Component
public class TextRecordParser {

    static final Pattern IMAGE_URL = Pattern.compile(
        "https?://[^\\s\"'<>()\\[\\]]+\\.(?:jpg|jpeg|png|gif|webp|svg)", Pattern.CASE_INSENSITIVE);

    private static final Pattern SECTION_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final String NO_PRODUCTS_FOUND = "no products found";
    private static final Pattern LEADING_BULLET = Pattern.compile("^(?:[-*•]\\s*)+");

    private final FallbackRecordScanner fallbackScanner = new FallbackRecordScanner();

    /**
     * Parses records of the given kind.
     *
     * @param text raw answer, may be null
     * @param kind which record vocabulary to apply
     * @return deduplicated records in order of appearance, never null
     */
    public List<ParsedRecord> parse(String text, RecordKind kind) {
        if (text == null || text.isBlank() || kind == null) {
            return List.of();
        }
        try {
            String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
            List<ParsedRecord> records = parseSections(normalized, kind);
            if (records.isEmpty() && kind == RecordKind.PRODUCT && reportsNoProducts(normalized)) {
                log.debug("Answer reports no products, skipping keyword scan");
                return List.of();
            }
            if (records.isEmpty()) {
                records = fallbackScanner.scan(normalized, kind);
                log.debug("No {} sections found, keyword scan recovered {} record(s)", kind, records.size());
            }
            return dedupe(records);
        } catch (RuntimeException ex) {
            log.debug("Unparseable {} answer ({} chars), returning no records", kind, text.length(), ex);
            return List.of();
        }
    }

    private List<ParsedRecord> parseSections(String text, RecordKind kind) {
        List<ParsedRecord> records = new ArrayList<>();
        RecordField primary = RecordField.primaryFor(kind);
        for (String section : SECTION_BREAK.split(text)) {
            RecordAssembler current = new RecordAssembler(kind);
            for (String rawLine : section.split("\n")) {
                String line = cleanLine(rawLine);
                if (line.isEmpty()) {
                    continue;
                }
                Optional<RecordField> field = RecordField.matchLine(kind, line);
                if (field.isPresent()) {
                    RecordField matched = field.get();
                    // Answers that skip the blank line still start a new record at the next primary marker.
                    if (matched == primary && current.hasPrimary()) {
                        current.build().ifPresent(records::add);
                        current = new RecordAssembler(kind);
                    }
                    current.set(matched, line.substring(matched.marker().length()));
                } else if (kind == RecordKind.PRODUCT) {
                    Matcher image = IMAGE_URL.matcher(line);
                    if (image.find()) {
                        current.offerImageUrl(image.group());
                    }
                }
            }
            current.build().ifPresent(records::add);
        }
        return records;
    }

    private static boolean reportsNoProducts(String text) {
        return text.toLowerCase(Locale.ROOT).contains(NO_PRODUCTS_FOUND);
    }

    private static String cleanLine(String rawLine) {
        String line = rawLine.replace("**", "").trim();
        return LEADING_BULLET.matcher(line).replaceFirst("").trim();
    }

    private static List<ParsedRecord> dedupe(List<ParsedRecord> records) {
        Map<String, ParsedRecord> unique = new LinkedHashMap<>();
        for (ParsedRecord record : records) {
            unique.putIfAbsent(record.dedupeKey(), record);
        }
        return new ArrayList<>(unique.values());
    }
}
