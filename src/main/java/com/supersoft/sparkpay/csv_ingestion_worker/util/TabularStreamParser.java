package com.supersoft.sparkpay.csv_ingestion_worker.util;

import com.supersoft.sparkpay.csv_ingestion_worker.exception.MalformedSourceException;
import org.apache.commons.csv.CSVException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Forward-only, non-restartable sequence of raw records read from a delimited text stream.
 * Holds at most one record in memory; the first record returned is the header row.
 *
 * <p>Malformed quoting and byte sequences that are not valid UTF-8 surface as
 * {@link MalformedSourceException}; any other read failure is rethrown as {@link UncheckedIOException}.
 */
public class TabularStreamParser implements Iterator<List<String>>, Closeable {

    private final CSVParser parser;
    private final Iterator<CSVRecord> records;

    private TabularStreamParser(CSVParser parser) {
        this.parser = parser;
        this.records = parser.iterator();
    }

    public static TabularStreamParser open(InputStream source, char delimiter) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreEmptyLines(true)
                .build();
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        BufferedReader reader = new BufferedReader(new InputStreamReader(source, decoder));
        return new TabularStreamParser(format.parse(reader));
    }

    @Override
    public boolean hasNext() {
        try {
            return records.hasNext();
        } catch (UncheckedIOException e) {
            throw translate(e);
        }
    }

    @Override
    public List<String> next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Source stream exhausted");
        }
        try {
            return records.next().toList();
        } catch (UncheckedIOException e) {
            throw translate(e);
        }
    }

    /**
     * Physical line the parser has reached, for diagnostics.
     */
    public long getCurrentLineNumber() {
        return parser.getCurrentLineNumber();
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }

    private RuntimeException translate(UncheckedIOException e) {
        if (e.getCause() instanceof CSVException) {
            return new MalformedSourceException(
                    "Malformed delimited text near line " + parser.getCurrentLineNumber() + ": " + e.getCause().getMessage(), e);
        }
        if (e.getCause() instanceof CharacterCodingException) {
            return new MalformedSourceException(
                    "Invalid UTF-8 near line " + parser.getCurrentLineNumber() + ": " + e.getCause(), e);
        }
        return e;
    }
}
