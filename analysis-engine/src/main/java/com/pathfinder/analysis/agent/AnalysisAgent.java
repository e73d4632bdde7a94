package com.pathfinder.analysis.agent;

import com.pathfinder.common.model.AnalysisResult;
import com.pathfinder.common.model.Context;

public interface AnalysisAgent {
    AnalysisResult analyze(Context context);
    String agentName();
}
