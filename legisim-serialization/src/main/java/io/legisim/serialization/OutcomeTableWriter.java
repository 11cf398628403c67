package io.legisim.serialization;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.legisim.core.session.OutcomeColumn;
import io.legisim.core.session.OutcomeRecord;
import io.legisim.core.sweep.OutcomeTable;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/// Writes outcome tables as CSV.
///
/// The first line is the header: an unnamed index column followed by every
/// {@link OutcomeColumn} header in declaration order. Each row starts with its
/// one-based row number. Whole-number columns are written without a fractional part.
///
/// {@snippet :
/// ,Initial Value,Final Value,Number of Votes,Yeas,Majority Party Size,...
/// 1,0.4512,0.0231,27,53,51,...
/// }
///
/// @implNote Thread-safe. The underlying `CsvMapper` is shared and immutable once built.
/// @see OutcomeTableReader for the inverse
public final class OutcomeTableWriter {

    private static final Logger logger = Logger.getLogger(OutcomeTableWriter.class.getName());

    /// Header of the leading row-number column.
    public static final String INDEX_COLUMN = "";

    private final CsvMapper mapper =
            CsvMapper.builder().enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING).build();
    private final CsvSchema schema = schema();

    /// Writes the table to `file`, replacing any existing content.
    ///
    /// Parent directories are created as needed.
    ///
    /// @param table rows to write, not null
    /// @param file destination, not null
    /// @throws IOException if the file cannot be written
    public void write(OutcomeTable table, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(table, out);
        }
        logger.info("Wrote " + table.size() + " rows to " + file);
    }

    /// Renders the table as a CSV string.
    ///
    /// @param table rows to render, not null
    /// @return CSV text including the header line, never null
    /// @throws IOException if encoding fails
    public String toCsv(OutcomeTable table) throws IOException {
        StringWriter out = new StringWriter();
        write(table, out);
        return out.toString();
    }

    private void write(OutcomeTable table, Writer out) throws IOException {
        if (table.isEmpty()) {
            out.write(headerLine());
            return;
        }
        try (SequenceWriter rows = mapper.writer(schema).writeValues(out)) {
            for (OutcomeRecord record : table.rows()) {
                rows.write(toRow(record));
            }
        }
    }

    private static CsvSchema schema() {
        CsvSchema.Builder builder =
                CsvSchema.builder().addColumn(INDEX_COLUMN, CsvSchema.ColumnType.NUMBER);
        for (OutcomeColumn column : OutcomeColumn.values()) {
            builder.addColumn(column.header(), CsvSchema.ColumnType.NUMBER);
        }
        return builder.setUseHeader(true).build();
    }

    private static List<Object> toRow(OutcomeRecord record) {
        List<Object> row = new ArrayList<>(OutcomeColumn.values().length + 1);
        row.add(record.repetition());
        for (OutcomeColumn column : OutcomeColumn.values()) {
            double value = column.valueOf(record);
            row.add(column.isIntegral() ? (Object) (int) value : (Object) value);
        }
        return row;
    }

    private static String headerLine() {
        StringBuilder line = new StringBuilder(INDEX_COLUMN);
        for (OutcomeColumn column : OutcomeColumn.values()) {
            line.append(',').append(column.header());
        }
        return line.append('\n').toString();
    }
}
