package com.jay.stfunnel.layer1_data;

import com.jay.stfunnel.model.Candidate;
import com.jay.stfunnel.model.enums.AnalysisKind;

import java.util.Optional;

/**
 * Source of free-form analysis text (DCF, comparables, sentiment, risk, earnings).
 * The text is opaque: only the signal extractor reads it.
 */
public interface QualitativeAnalysisProvider {

    Optional<String> analyse(Candidate candidate, AnalysisKind kind);
}
