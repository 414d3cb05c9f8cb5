package com.flowys.flowys_backend.engine;

import com.flowys.flowys_backend.model.domain.NodeType;
import com.flowys.flowys_backend.model.domain.WorkflowNode;
import com.flowys.flowys_backend.model.execution.ErrorAnalysis;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns a node failure into advice for the person who built the workflow.
 *
 * Causes and fixes come from keyword categories matched against the lowercased error text,
 * then from the failed node's type. A node that received no input gets that cause listed first.
 * The "ai" keyword counts only as a whole word, so errors mentioning "email", "detail" or
 * "failed" do not pick up the AI model advice.
 * The result never affects whether the run failed.
 */
@Component
public class ErrorAnalyzer {

    // "ai" as a word; a plain substring would also hit "failed", "email", "invalid"...
    private static final Pattern AI_WORD = Pattern.compile("\\bai\\b");

    public ErrorAnalysis analyze(WorkflowGraph graph, WorkflowNode failedNode, String error, Map<String, Object> nodeInputs) {
        List<String> causes = new ArrayList<>();
        List<String> fixes = new ArrayList<>();
        List<String> affected = graph.downstreamLabels(failedNode.getId());
        String text = error != null ? error.toLowerCase(Locale.ROOT) : "";

        if (text.contains("array") || text.contains("list")) {
            causes.add("The previous node didn't return data in the expected format (array/list)");
            fixes.add("Check the output of the previous node - click on it to see what data it produced");
            fixes.add("If using an API node, verify the API returns an array of items");
        }

        if (text.contains("undefined") || text.contains("null") || text.contains("missing")) {
            causes.add("Required data is missing from the input");
            fixes.add("Make sure all required fields are being passed from previous nodes");
            fixes.add("Check if the field names match exactly (including capitalization)");
        }

        if (text.contains("api") || text.contains("fetch") || text.contains("network")) {
            causes.add("Unable to connect to an external service or API");
            fixes.add("Check your internet connection");
            fixes.add("Verify the API URL is correct and the service is running");
            fixes.add("Check if any API keys are required and properly configured");
        }

        if (AI_WORD.matcher(text).find() || text.contains("model") || text.contains("token")) {
            causes.add("Issue with the AI model configuration or response");
            fixes.add("Try simplifying your prompt or reducing the expected output size");
            fixes.add("Check that your API key is valid and has sufficient credits");
            fixes.add("Try using a different model (e.g., gpt-4o-mini for faster, cheaper responses)");
        }

        if (text.contains("json") || text.contains("parse")) {
            causes.add("The AI response wasn't in the expected JSON format");
            fixes.add("Simplify your output schema to reduce complexity");
            fixes.add("Increase the max tokens setting to prevent cut-off responses");
            fixes.add("Add clearer instructions in your prompt about the expected format");
        }

        if (text.contains("config") || text.contains("setting") || text.contains("mapping")) {
            causes.add("The node is not properly configured");
            fixes.add("Click on the node to review and update its settings");
            fixes.add("Make sure all required fields are filled in");
        }

        if (text.contains("condition")) {
            causes.add("The filter/condition expression may be incorrect");
            fixes.add("Check the condition syntax - use format like 'item.score > 80'");
            fixes.add("Make sure the field names in your condition exist in the data");
        }

        addTypeSpecificAdvice(failedNode.getType(), causes, fixes);

        if (nodeInputs == null || nodeInputs.isEmpty()) {
            causes.add(0, "This node received no input data from previous nodes");
            fixes.add(0, "Make sure this node is connected to a previous node that outputs data");
        }

        if (causes.isEmpty()) {
            causes.add("An unexpected error occurred during execution");
        }
        if (fixes.isEmpty()) {
            fixes.add("Review the node configuration by clicking on it");
            fixes.add("Check the output of previous nodes for unexpected data");
            fixes.add("Try running the workflow again - some errors are temporary");
        }

        String label = failedNode.displayName();
        String type = failedNode.getType().value();
        String summary = "The \"" + label + "\" node (" + type + ") failed to execute. ";
        if (!affected.isEmpty()) {
            summary += "This also prevented " + affected.size() + " other node(s) from running.";
        }

        return ErrorAnalysis.builder()
                .summary(summary)
                .failedNode(label)
                .failedNodeType(type)
                .possibleCauses(causes)
                .suggestedFixes(fixes)
                .affectedNodes(affected)
                .build();
    }

    private void addTypeSpecificAdvice(NodeType type, List<String> causes, List<String> fixes) {
        switch (type) {
            case API -> {
                if (causes.isEmpty()) causes.add("The API request may have failed or returned unexpected data");
                fixes.add("Test the API endpoint separately to verify it works");
                fixes.add("Check the API node's URL, method, and headers configuration");
            }
            case AI -> {
                if (causes.isEmpty()) causes.add("The AI model may have encountered an issue processing your request");
                fixes.add("Review your prompt template and make it clearer");
                fixes.add("Check that variable placeholders like {{data}} match available inputs");
            }
            case LOGIC -> {
                if (causes.isEmpty()) causes.add("The data transformation or filtering logic encountered an issue");
                fixes.add("Verify the input data structure matches what the operation expects");
                fixes.add("For filter operations, ensure the condition references valid fields");
            }
            default -> { }
        }
    }
}
