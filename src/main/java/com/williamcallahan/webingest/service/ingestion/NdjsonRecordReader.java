package com.williamcallahan.webingest.service.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.williamcallahan.webingest.domain.ingestion.RawRecordParseResult;
import com.williamcallahan.webingest.domain.ingestion.RawWebContent;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/**
 * Reads newline-delimited JSON into parse results, one per non-blank line.
 */
@Component
public class NdjsonRecordReader {
    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final ObjectMapper objectMapper;
    private final ObjectReader treeReader;

    public NdjsonRecordReader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.treeReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Returns a lazy stream of parse results in input order.
     *
     * <p>A leading UTF-8 byte order mark is ignored. Blank lines are dropped but still
     * advance the line counter. The stream is sequential and single-use; closing it
     * closes the input.</p>
     *
     * @param input UTF-8 encoded NDJSON
     * @return parse results, malformed lines included as {@link RawRecordParseResult.Malformed}
     */
    public Stream<RawRecordParseResult> read(InputStream input) {
        Objects.requireNonNull(input, "input");
        BufferedReader lineReader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        AtomicInteger lineNumber = new AtomicInteger();
        return lineReader.lines()
            .sequential()
            .map(line -> numbered(lineNumber.incrementAndGet(), line))
            .filter(numbered -> !numbered.content().isEmpty())
            .map(this::parseLine)
            .onClose(() -> closeInput(lineReader));
    }

    /**
     * Parses one trimmed, non-blank line.
     *
     * @param lineNumber 1-based line number
     * @param line line content
     * @return parsed record or malformed result with a reason
     */
    public RawRecordParseResult parse(int lineNumber, String line) {
        return parseLine(new NumberedLine(lineNumber, line == null ? "" : line.strip()));
    }

    private static NumberedLine numbered(int lineNumber, String line) {
        String content = lineNumber == 1 && line.startsWith(BYTE_ORDER_MARK) ? line.substring(1) : line;
        return new NumberedLine(lineNumber, content.strip());
    }

    private RawRecordParseResult parseLine(NumberedLine numbered) {
        JsonNode node;
        try {
            node = treeReader.readTree(numbered.content());
        } catch (JsonProcessingException e) {
            return RawRecordParseResult.malformed(numbered.lineNumber(), "invalid JSON: " + e.getOriginalMessage());
        }
        if (node == null || !node.isObject()) {
            String nodeType = node == null ? "nothing" : node.getNodeType().name().toLowerCase(Locale.ROOT);
            return RawRecordParseResult.malformed(numbered.lineNumber(), "expected a JSON object but found " + nodeType);
        }
        try {
            RawWebContent record = objectMapper.treeToValue(node, RawWebContent.class);
            return RawRecordParseResult.parsed(numbered.lineNumber(), record);
        } catch (JsonProcessingException e) {
            return RawRecordParseResult.malformed(numbered.lineNumber(), "unexpected field type: " + e.getOriginalMessage());
        }
    }

    private static void closeInput(BufferedReader reader) {
        try {
            reader.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close input", e);
        }
    }

    private record NumberedLine(int lineNumber, String content) {}
}
