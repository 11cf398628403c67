package io.legisim.serialization;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.legisim.core.session.OutcomeColumn;
import io.legisim.core.session.OutcomeRecord;
import io.legisim.core.sweep.OutcomeTable;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/// Reads outcome tables written by {@link OutcomeTableWriter}.
///
/// Columns are matched by header, so their order in the file does not matter and extra
/// columns are ignored. The leading index column is not read back; rows are renumbered
/// 1..N in file order. Count columns accept `3` or `3.0` but reject fractional values.
///
/// @implNote Thread-safe.
public final class OutcomeTableReader {

    private final CsvMapper mapper = new CsvMapper();

    /// Reads a table from a file.
    ///
    /// @param file CSV file with a header line, not null
    /// @return the table, never null
    /// @throws IOException if the file cannot be read or is not valid CSV
    /// @throws IllegalArgumentException if a column is missing, a value is not numeric, or
    ///     a count column holds a fractional value
    public OutcomeTable read(Path file) throws IOException {
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(in);
        }
    }

    /// Parses a table from CSV text.
    ///
    /// @param csv CSV text with a header line, not null
    /// @return the table, never null
    /// @throws IOException if the text is not valid CSV
    /// @throws IllegalArgumentException if a column is missing, a value is not numeric, or
    ///     a count column holds a fractional value
    public OutcomeTable fromCsv(String csv) throws IOException {
        return read(new StringReader(csv));
    }

    private OutcomeTable read(Reader in) throws IOException {
        List<OutcomeRecord> records = new ArrayList<>();
        try (MappingIterator<Map<String, String>> rows =
                mapper.readerForMapOf(String.class)
                        .with(CsvSchema.emptySchema().withHeader())
                        .readValues(in)) {
            int line = 1;
            while (rows.hasNextValue()) {
                line++;
                records.add(toRecord(rows.nextValue(), line));
            }
        }
        return OutcomeTable.of(records);
    }

    private static OutcomeRecord toRecord(Map<String, String> row, int line) {
        Map<OutcomeColumn, Double> values = new EnumMap<>(OutcomeColumn.class);
        for (OutcomeColumn column : OutcomeColumn.values()) {
            String text = row.get(column.header());
            if (text == null) {
                throw new IllegalArgumentException(
                        "Line " + line + ": missing column '" + column.header() + "'");
            }
            double value;
            try {
                value = Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Line "
                                + line
                                + ": column '"
                                + column.header()
                                + "' is not a number: '"
                                + text
                                + "'",
                        e);
            }
            if (column.isIntegral() && (!Double.isFinite(value) || value != Math.rint(value))) {
                throw new IllegalArgumentException(
                        "Line "
                                + line
                                + ": column '"
                                + column.header()
                                + "' is not a whole number: '"
                                + text
                                + "'");
            }
            values.put(column, value);
        }
        return new OutcomeRecord(
                line - 1,
                values.get(OutcomeColumn.INITIAL_VALUE),
                values.get(OutcomeColumn.FINAL_VALUE),
                whole(values.get(OutcomeColumn.NUMBER_OF_VOTES)),
                whole(values.get(OutcomeColumn.YEAS)),
                whole(values.get(OutcomeColumn.MAJORITY_PARTY_SIZE)),
                values.get(OutcomeColumn.DISTANCE_BETWEEN_MEDIANS),
                values.get(OutcomeColumn.MAJORITY_SIGMA),
                values.get(OutcomeColumn.MAJORITY_ADJUSTMENT),
                values.get(OutcomeColumn.MINORITY_SIGMA),
                values.get(OutcomeColumn.MINORITY_ADJUSTMENT));
    }

    private static int whole(double value) {
        return (int) value;
    }
}
