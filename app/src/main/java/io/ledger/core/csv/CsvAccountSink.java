package io.ledger.core.csv;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.ledger.core.protocol.AccountSink;
import io.ledger.core.state.AccountSnapshot;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Writes {@code client,available,held,total,locked} with a header row.
 * Amounts are padded to the configured scale; the target writer is flushed, not closed.
 */
public final class CsvAccountSink implements AccountSink {
    private static final CsvMapper CSV = CsvMapper.builder()
            .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build();

    private static final CsvSchema SCHEMA = CsvSchema.builder()
            .addColumn("client", CsvSchema.ColumnType.NUMBER)
            .addColumn("available", CsvSchema.ColumnType.NUMBER)
            .addColumn("held", CsvSchema.ColumnType.NUMBER)
            .addColumn("total", CsvSchema.ColumnType.NUMBER)
            .addColumn("locked", CsvSchema.ColumnType.BOOLEAN)
            .build()
            .withHeader();

    private final Writer out;
    private final int scale;

    public CsvAccountSink(Writer out, int scale) {
        this.out = Objects.requireNonNull(out, "out");
        this.scale = scale;
    }

    @Override
    public void write(List<AccountSnapshot> accounts) throws IOException {
        if (accounts.isEmpty()) {
            // Jackson writes the header lazily with the first row, so a SequenceWriter with
            // no rows emits nothing; the header comes from the same schema instead
            StringJoiner header = new StringJoiner(String.valueOf(SCHEMA.getColumnSeparator()));
            for (CsvSchema.Column column : SCHEMA) {
                header.add(column.getName());
            }
            out.write(header + String.valueOf(SCHEMA.getLineSeparator()));
            out.flush();
            return;
        }
        try (SequenceWriter writer = CSV.writerFor(Row.class).with(SCHEMA).writeValues(out)) {
            for (AccountSnapshot account : accounts) {
                writer.write(new Row(
                        account.clientId(),
                        render(account.available()),
                        render(account.held()),
                        render(account.total()),
                        account.locked()));
            }
        }
        out.flush();
    }

    // pads only; amounts already fit the scale
    private BigDecimal render(BigDecimal amount) {
        return amount.setScale(scale);
    }

    @JsonPropertyOrder({"client", "available", "held", "total", "locked"})
    record Row(int client, BigDecimal available, BigDecimal held, BigDecimal total, boolean locked) {
    }
}
