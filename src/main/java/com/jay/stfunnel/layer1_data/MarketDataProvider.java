package com.jay.stfunnel.layer1_data;

import com.jay.stfunnel.exception.MarketDataException;
import com.jay.stfunnel.model.Candidate;
import com.jay.stfunnel.model.TriageChecks;

/**
 * Point-in-time quotes and fundamentals. Any metric may come back null;
 * a failed fetch raises {@link MarketDataException}.
 */
public interface MarketDataProvider {

    Candidate fetchCandidate(String ticker);

    TriageChecks fetchTriageChecks(String ticker);

    /** Latest price, or null when the quote carries none. */
    Double fetchPrice(String ticker);
}
