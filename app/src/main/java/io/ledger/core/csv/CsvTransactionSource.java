package io.ledger.core.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import io.ledger.core.protocol.MalformedRecordException;
import io.ledger.core.protocol.TransactionKind;
import io.ledger.core.protocol.TransactionRecord;
import io.ledger.core.protocol.TransactionSource;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.NoSuchElementException;

/**
 * Reads {@code type,client,tx,amount} rows. Columns may come in any order; cells are
 * trimmed, blank lines skipped and a missing trailing amount cell is allowed.
 */
public final class CsvTransactionSource implements TransactionSource {
    public static final int MAX_CLIENT_ID = 0xFFFF;
    public static final long MAX_TX_ID = 0xFFFF_FFFFL;

    private static final CsvMapper CSV = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY,
                    CsvParser.Feature.TRIM_SPACES,
                    CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    private static final String BOM = "\uFEFF";
    private static final char REPLACEMENT_CHAR = '\uFFFD';

    private final MappingIterator<String[]> rows;
    private final int scale;
    private int typeColumn = -1;
    private int clientColumn = -1;
    private int txColumn = -1;
    private int amountColumn = -1;
    private long row;

    public CsvTransactionSource(Reader reader, int scale) throws IOException {
        this.scale = scale;
        MappingIterator<String[]> iterator;
        try {
            iterator = CSV.readerFor(String[].class).readValues(reader);
        } catch (IOException | RuntimeException ex) {
            closeAfterFailure(reader, ex);
            throw ex;
        }
        this.rows = iterator;
        try {
            readHeader();
        } catch (IOException | RuntimeException ex) {
            closeAfterFailure(rows, ex);
            throw ex;
        }
    }

    /**
     * Opens a UTF-8 file. Invalid byte sequences decode to U+FFFD so only the row holding
     * them is malformed.
     */
    public static CsvTransactionSource open(Path path, int scale) throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        Reader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), decoder));
        return new CsvTransactionSource(reader, scale);
    }

    private static void closeAfterFailure(Closeable resource, Exception failure) {
        try {
            resource.close();
        } catch (IOException closeFailure) {
            failure.addSuppressed(closeFailure);
        }
    }

    private void readHeader() throws IOException {
        if (!rows.hasNextValue()) {
            return;
        }
        String[] header = rows.nextValue();
        if (header.length > 0 && header[0] != null && header[0].startsWith(BOM)) {
            header[0] = header[0].substring(BOM.length());
        }
        for (int i = 0; i < header.length; i++) {
            String name = header[i] == null ? "" : header[i].trim().toLowerCase(Locale.ROOT);
            switch (name) {
                case "type": typeColumn = i; break;
                case "client": clientColumn = i; break;
                case "tx": txColumn = i; break;
                case "amount": amountColumn = i; break;
                default: break;
            }
        }
        if (typeColumn < 0 || clientColumn < 0 || txColumn < 0) {
            throw new IOException("CSV header must name type, client and tx columns, got: " + String.join(",", header));
        }
    }

    @Override
    public boolean hasNext() throws IOException {
        return typeColumn >= 0 && rows.hasNextValue();
    }

    @Override
    public TransactionRecord next() throws IOException {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        String[] cells = rows.nextValue();
        row++;
        return parse(cells);
    }

    private TransactionRecord parse(String[] cells) {
        for (String cell : cells) {
            if (cell != null && cell.indexOf(REPLACEMENT_CHAR) >= 0) {
                throw new MalformedRecordException(row, "invalid UTF-8 in row");
            }
        }
        TransactionKind kind;
        try {
            kind = TransactionKind.parse(cell(cells, typeColumn));
        } catch (IllegalArgumentException ex) {
            throw new MalformedRecordException(row, ex.getMessage());
        }
        int client = (int) parseId(cell(cells, clientColumn), "client", MAX_CLIENT_ID);
        long tx = parseId(cell(cells, txColumn), "tx", MAX_TX_ID);

        BigDecimal amount = null;
        if (kind.carriesAmount()) {
            amount = parseAmount(cell(cells, amountColumn));
        }
        return TransactionRecord.of(kind, client, tx, amount);
    }

    private long parseId(String value, String column, long max) {
        if (value.isEmpty()) {
            throw new MalformedRecordException(row, "missing " + column);
        }
        try {
            long parsed = Long.parseLong(value);
            if (parsed < 0 || parsed > max) {
                throw new MalformedRecordException(row, column + " out of range: " + value);
            }
            return parsed;
        } catch (NumberFormatException ex) {
            throw new MalformedRecordException(row, "invalid " + column + ": " + value, ex);
        }
    }

    // absent amounts are left for the router to reject
    private BigDecimal parseAmount(String value) {
        if (value.isEmpty()) {
            return null;
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(value);
        } catch (NumberFormatException ex) {
            throw new MalformedRecordException(row, "invalid amount: " + value, ex);
        }
        if (amount.stripTrailingZeros().scale() > scale) {
            throw new MalformedRecordException(row, "amount " + value + " has more than " + scale + " decimal places");
        }
        return amount;
    }

    private static String cell(String[] cells, int column) {
        if (column < 0 || column >= cells.length || cells[column] == null) {
            return "";
        }
        return cells[column].trim();
    }

    @Override
    public void close() throws IOException {
        rows.close();
    }
}
