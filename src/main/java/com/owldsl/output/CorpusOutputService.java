// com/owldsl/output/CorpusOutputService.java
package com.owldsl.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.owldsl.definition.ClassDefinition;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes the rendered corpus: one JSON object per line with a prompt and a completion field,
 * and a CSV table of class definitions.
 */
public class CorpusOutputService implements OutputService {

    private static final Logger LOGGER = LoggerFactory.getLogger(CorpusOutputService.class);

    public static final String CORPUS_FILE = "corpus.jsonl";
    public static final String DEFINITIONS_FILE = "definitions.csv";

    static final String[] CSV_HEADER = {"IRI", "Label", "Textual definition", "Logical definition"};

    private final Path outputDirectory;
    private final String promptField;
    private final String completionField;
    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final AtomicLong recordCounter = new AtomicLong(0);

    private BufferedWriter corpusWriter;
    private CSVPrinter csvPrinter;
    private boolean initialized = false;
    private boolean closed = false;

    public CorpusOutputService(Path outputDirectory, String promptField, String completionField) {
        this.outputDirectory = outputDirectory;
        this.promptField = promptField;
        this.completionField = completionField;
    }

    @Override
    public synchronized void initialize() throws IOException {
        if (initialized) return;

        LOGGER.info("Initializing corpus output in {}", outputDirectory.toAbsolutePath());
        Files.createDirectories(outputDirectory);

        corpusWriter = Files.newBufferedWriter(outputDirectory.resolve(CORPUS_FILE), StandardCharsets.UTF_8);

        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setQuoteMode(QuoteMode.ALL)
                .setRecordSeparator("\n")
                .setHeader(CSV_HEADER)
                .build();
        try {
            csvPrinter = new CSVPrinter(
                    Files.newBufferedWriter(outputDirectory.resolve(DEFINITIONS_FILE), StandardCharsets.UTF_8),
                    csvFormat);
        } catch (IOException | RuntimeException e) {
            try {
                corpusWriter.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            corpusWriter = null;
            throw e;
        }

        initialized = true;
    }

    @Override
    public synchronized void writeDefinition(ClassDefinition definition) {
        ensureOpen();
        if (definition.isEmpty()) {
            LOGGER.debug("Nothing to write for {}", definition.getClassIri());
            return;
        }
        try {
            for (Map.Entry<String, String> prompt : definition.getPrompts().entrySet()) {
                writeRecord(prompt.getKey(), prompt.getValue());
            }
            csvPrinter.printRecord(
                    definition.getClassIri(),
                    definition.getLabel(),
                    definition.getTextualDefinition(),
                    definition.getLogicalDefinition());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write definition of " + definition.getClassIri(), e);
        }
    }

    @Override
    public synchronized void writeExplanation(String prompt, String explanation) {
        ensureOpen();
        try {
            writeRecord(prompt, explanation);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write explanation for " + prompt, e);
        }
    }

    private void writeRecord(String prompt, String completion) throws IOException {
        ObjectNode record = jsonMapper.createObjectNode();
        record.put(promptField, prompt);
        record.put(completionField, completion);
        String line;
        try {
            line = jsonMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IOException("Could not serialize record for " + prompt, e);
        }
        corpusWriter.write(line);
        corpusWriter.write('\n');
        recordCounter.incrementAndGet();
    }

    @Override
    public long getWrittenRecords() {
        return recordCounter.get();
    }

    @Override
    public synchronized void flush() {
        if (!initialized || closed) return;
        try {
            corpusWriter.flush();
            csvPrinter.flush();
        } catch (IOException e) {
            LOGGER.error("Error flushing corpus output", e);
        }
    }

    private void ensureOpen() {
        if (!initialized || closed) {
            throw new IllegalStateException("Corpus output is not open; call initialize() first");
        }
    }

    @Override
    public synchronized void close() throws IOException {
        if (!initialized || closed) return;
        closed = true;
        LOGGER.info("Closing corpus output. Records written: {}", recordCounter.get());
        try {
            corpusWriter.close();
        } finally {
            csvPrinter.close();
        }
    }
}
