package caseflow.coordinator.pipeline.stages;

import caseflow.coordinator.model.CaseRecord;
import caseflow.coordinator.pipeline.PipelineContext;
import caseflow.coordinator.pipeline.StageKind;

/**
 * Prompt text for the model-backed stages. Each prompt names the JSON fields
 * the following stages read.
 */
public final class StagePromptSet {

    public static final String SYSTEM = "You are a litigation analyst. Answer with a single JSON object and nothing else.";

    private StagePromptSet() {
    }

    public static String intake(PipelineContext ctx) {
        CaseRecord c = ctx.caseRecord();
        return "Classify this case.\n"
                + "Return {\"case_type\": string, \"legal_issues\": [string], \"key_facts\": [string], \"summary\": string}.\n\n"
                + "Case name: " + nullToEmpty(c.caseName()) + "\n"
                + "Narrative:\n" + nullToEmpty(c.narrative()) + "\n"
                + documents(ctx);
    }

    public static String jurisdiction(PipelineContext ctx) {
        CaseRecord c = ctx.caseRecord();
        return "Determine the governing jurisdiction.\n"
                + "Return {\"jurisdiction\": string, \"court_level\": string, \"is_federal\": boolean, \"reasoning\": string}.\n\n"
                + "Case type: " + nullToEmpty(c.caseType()) + "\n"
                + "Legal issues: " + nullToEmpty(c.legalIssues()) + "\n"
                + "Narrative:\n" + nullToEmpty(c.narrative());
    }

    public static String enhancement(PipelineContext ctx) {
        return "Write an enhanced case summary.\n"
                + "Return {\"enhanced_summary\": string, \"strengths\": [string], \"weaknesses\": [string], "
                + "\"key_questions\": [string]}.\n\n"
                + "Intake analysis: " + ctx.output(StageKind.INTAKE_ANALYSIS) + "\n"
                + "Jurisdiction analysis: " + ctx.output(StageKind.JURISDICTION_ANALYSIS) + "\n"
                + "Narrative:\n" + nullToEmpty(ctx.caseRecord().narrative());
    }

    public static String opinionAnalysis(PipelineContext ctx) {
        return "Assess how these prior decisions bear on the case.\n"
                + "Return {\"key_decisions\": [string], \"influence_score\": number, \"favorable_count\": number, "
                + "\"unfavorable_count\": number, \"summary\": string}.\n\n"
                + "Case summary: " + nullToEmpty(ctx.caseRecord().enhancedSummary()) + "\n"
                + "Precedents: " + ctx.output(StageKind.CASE_LAW_SEARCH).path("precedents");
    }

    public static String complexity(PipelineContext ctx) {
        return "Rate the case complexity from 0 to 100.\n"
                + "Return {\"complexity_score\": number, \"factors\": [string]}.\n\n"
                + "Enhancement: " + ctx.output(StageKind.CASE_ENHANCEMENT) + "\n"
                + "Precedents stored: " + ctx.output(StageKind.PRECEDENT_PERSIST).path("count").asInt();
    }

    public static String prediction(PipelineContext ctx) {
        return "Predict the outcome of the case.\n"
                + "Return {\"outcome_prediction_score\": 0-100, \"settlement_probability\": 0-100, "
                + "\"case_strength_score\": 0-100, \"risk_level\": \"low|medium|high\", "
                + "\"prediction_confidence\": \"low|medium|high\", \"estimated_timeline\": months, "
                + "\"financial_outcome_range\": {\"min\": number, \"max\": number}, "
                + "\"litigation_cost_range\": {\"min\": number, \"max\": number}, "
                + "\"resolution_time_range\": {\"min\": number, \"max\": number}, \"reasoning\": string}.\n\n"
                + "Case summary: " + nullToEmpty(ctx.caseRecord().enhancedSummary()) + "\n"
                + "Jurisdiction: " + nullToEmpty(ctx.caseRecord().jurisdiction()) + "\n"
                + "Complexity: " + ctx.output(StageKind.COMPLEXITY_SCORE) + "\n"
                + "Precedent analysis: " + ctx.output(StageKind.OPINION_ANALYSIS);
    }

    private static String documents(PipelineContext ctx) {
        if (!ctx.hasOutput(StageKind.DOCUMENT_EXTRACTION)) {
            return "";
        }
        String content = ctx.output(StageKind.DOCUMENT_EXTRACTION).path("extractedContent").asText("");
        return content.isBlank() ? "" : "Documents:\n" + content;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
