package io.legisim.core.analysis;

import io.legisim.core.session.OutcomeColumn;
import java.util.Optional;

/// Regression of the number of votes on one sweep parameter, overall and split by
/// the sign of the opening proposal.
///
/// A fit is empty when its group has fewer than two rows.
///
/// @param predictor the column regressed on, not null
/// @param votes distribution of the vote count over all rows, not null
/// @param overall fit over all rows, not null
/// @param nonPositiveStart fit over rows with `Initial Value <= 0`, not null
/// @param positiveStart fit over rows with `Initial Value > 0`, not null
public record OutcomeSummary(
        OutcomeColumn predictor,
        VoteStatistics votes,
        Optional<LinearFit> overall,
        Optional<LinearFit> nonPositiveStart,
        Optional<LinearFit> positiveStart) {}
