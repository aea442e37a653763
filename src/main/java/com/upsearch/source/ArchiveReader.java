package com.upsearch.source;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PushbackReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Opens the single delimited table inside a ZIP archive as a lazy row stream.
 *
 * <p>The entry is decoded as UTF-8 with malformed bytes replaced, and parsed with a
 * header row. Parsing is lenient: text after a closing quote is kept as part of the cell
 * ({@code "O"BRIEN} reads as {@code OBRIEN}) and an unterminated quote at end of file
 * ends the last cell. Rows are read on demand, so memory use does not grow with the table.
 */
public class ArchiveReader {

    private static final Logger log = LoggerFactory.getLogger(ArchiveReader.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private static final CSVFormat TABLE_FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreEmptyLines(true)
        .setAllowMissingColumnNames(true)
        .setTrailingData(true)
        .setLenientEof(true)
        .build();

    public RowSource openFirstTable(byte[] archive) {
        return openFirstTable("(in-memory)", archive);
    }

    /**
     * @param location used only in error messages and logs
     * @throws ArchiveEmptyException if the archive has no file entry
     * @throws FetchFailedException if the archive or its table header cannot be read
     */
    public RowSource openFirstTable(String location, byte[] archive) {
        ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive));
        try {
            ZipEntry entry = zip.getNextEntry();
            while (entry != null && entry.isDirectory()) {
                entry = zip.getNextEntry();
            }
            if (entry == null) {
                zip.close();
                throw new ArchiveEmptyException(location);
            }

            log.info("Reading table {} from {}", entry.getName(), location);
            Reader reader = skipByteOrderMark(new InputStreamReader(zip, StandardCharsets.UTF_8));
            CSVParser parser = TABLE_FORMAT.parse(reader);
            return new RowSource(location, entry.getName(), parser);
        } catch (IOException e) {
            closeQuietly(zip, e);
            throw new FetchFailedException(location, "Cannot read archive " + location + ": " + e.getMessage(), e);
        }
    }

    private static Reader skipByteOrderMark(Reader reader) throws IOException {
        PushbackReader pushback = new PushbackReader(reader, 1);
        int first = pushback.read();
        if (first != -1 && first != BYTE_ORDER_MARK) {
            pushback.unread(first);
        }
        return pushback;
    }

    private static void closeQuietly(ZipInputStream zip, IOException original) {
        try {
            zip.close();
        } catch (IOException suppressed) {
            original.addSuppressed(suppressed);
        }
    }
}
