package io.legisim.core.sweep;

import io.legisim.core.session.OutcomeRecord;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Ordered outcome rows of a run or sweep, numbered from 1.
///
/// ### Contracts
/// - **Invariant**: row `i` (zero-based) has `repetition() == i + 1`
///
/// @implNote Immutable. Concatenation renumbers rows instead of keeping each batch's
/// own numbering.
public final class OutcomeTable {

    private final List<OutcomeRecord> rows;

    private OutcomeTable(List<OutcomeRecord> rows) {
        this.rows = Collections.unmodifiableList(rows);
    }

    /// Builds a table from records, renumbering them 1..N in the given order.
    ///
    /// @param records rows in output order, not null
    /// @return the table, never null
    public static OutcomeTable of(List<OutcomeRecord> records) {
        List<OutcomeRecord> numbered = new ArrayList<>(records.size());
        for (OutcomeRecord record : records) {
            numbered.add(record.withRepetition(numbered.size() + 1));
        }
        return new OutcomeTable(numbered);
    }

    /// Concatenates batches in order and renumbers the result 1..N.
    ///
    /// @param batches per-value batches in grid order, not null
    /// @return the combined table, never null
    public static OutcomeTable concat(List<List<OutcomeRecord>> batches) {
        List<OutcomeRecord> all = new ArrayList<>();
        for (List<OutcomeRecord> batch : batches) {
            all.addAll(batch);
        }
        return of(all);
    }

    /// Returns the rows in order.
    ///
    /// @return unmodifiable row list, never null
    public List<OutcomeRecord> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
