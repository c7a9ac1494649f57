package com.eainde.research.nodes;

import com.eainde.research.StageInstrumentation;
import com.eainde.research.debug.ArtifactRecorder;
import com.eainde.research.model.Report;
import com.eainde.research.stage.ReportSynthesizer;
import com.eainde.research.state.ResearchState;

import java.util.Map;

public class WritingNode extends ResearchNode {

    private final ReportSynthesizer synthesizer;
    private final StageInstrumentation instrumentation;
    private final ArtifactRecorder recorder;

    public WritingNode(ReportSynthesizer synthesizer, StageInstrumentation instrumentation, ArtifactRecorder recorder) {
        this.synthesizer = synthesizer;
        this.instrumentation = instrumentation;
        this.recorder = recorder;
    }

    @Override
    protected Map<String, Object> run(ResearchState state) {
        Report report = instrumentation.call("write",
                () -> synthesizer.write(state.getQuery(), state.getAllResults()));
        recorder.record("final_report", report);
        return Map.of(ResearchState.REPORT, report);
    }
}
