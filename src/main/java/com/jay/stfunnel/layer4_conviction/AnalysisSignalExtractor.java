package com.jay.stfunnel.layer4_conviction;

import com.jay.stfunnel.model.AnalysisSignals;
import com.jay.stfunnel.model.AnalysisTexts;

/**
 * Pulls numeric and semantic signals out of free-form analysis text.
 * Implementations must tolerate missing or unparseable text and never throw.
 */
public interface AnalysisSignalExtractor {

    AnalysisSignals extract(AnalysisTexts texts);
}
