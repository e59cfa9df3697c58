package com.foldermatch.app.model;

public enum AnalysisPhase {
    COUNTING_FOLDERS,
    SCANNING_FOLDERS,
    BUILDING_FILE_INDEX,
    COMPARING_FILES,
    AGGREGATING_RESULTS,
    COMPLETE
}
