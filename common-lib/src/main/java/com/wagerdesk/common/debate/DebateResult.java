package com.wagerdesk.common.debate;

import java.util.List;

/**
 * Verdict of one debate plus every argument either catalog produced.
 *
 * <p>Both lists are ordered strongest first; side strengths are computed over the first
 * {@code topK} entries of each.
 *
 * @param net  supporting strength minus opposing strength
 */
public record DebateResult(
    double supportingStrength,
    double opposingStrength,
    double net,
    DebateWinner winner,
    int topK,
    List<Argument> supporting,
    List<Argument> opposing
) {
    public DebateResult {
        supporting = supporting == null ? List.of() : List.copyOf(supporting);
        opposing   = opposing == null ? List.of() : List.copyOf(opposing);
    }
}
