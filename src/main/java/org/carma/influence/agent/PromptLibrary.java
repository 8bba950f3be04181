package org.carma.influence.agent;

import org.carma.influence.model.Role;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Prompt text for every role and round.
 *
 * Prompts carry machine-readable tags ({@code [seed=N]}, {@code [round=N]}), the
 * suggestion line produced by {@link InfluenceMixer}, and, for the critic, the latest
 * PLANNER and RESEARCHER payloads on their own lines. {@link
 * org.carma.influence.mechanism.MockInferenceBackend} reads the same tags back.
 */
public final class PromptLibrary {

    public static final Pattern SEED_TAG = Pattern.compile("\\[seed=(-?\\d+)]");
    public static final Pattern ROUND_TAG = Pattern.compile("\\[round=(\\d+)]");
    public static final Pattern SUGGESTION = Pattern.compile("([a-z0-9_]+) \\((\\d+\\.\\d+)\\)");

    public static final String SUGGESTION_PREFIX = "Suggested features (weight): ";
    public static final String PLANNER_BLOCK = "PLANNER:";
    public static final String RESEARCHER_BLOCK = "RESEARCHER:";
    public static final String ADVERSARIAL_MARKER = "Adversarial review:";

    private static final String SYSTEM_PREAMBLE =
        "You are a helpful assistant collaborating with peers. Be concise and factual. "
        + "When mutual influence μ is high, prefer peer-consistent reasoning and cite their key points; "
        + "when low, be skeptical and justify divergences briefly. ";

    private static final String JSON_HINT =
        "Return exactly ONE JSON object. No prose, no explanations, no markdown, no code fences.\n"
        + "If you cannot comply, output {}.\n";

    private final String allowed;

    public PromptLibrary(List<String> whitelist) {
        this.allowed = whitelist.stream()
            .map(f -> "\"" + f + "\"")
            .collect(Collectors.joining(",", "[", "]"));
    }

    public String systemMessage(Role role) {
        return SYSTEM_PREAMBLE + role.getRoleMessage();
    }

    /**
     * Header stating the agent's influence state. Empty for agents without influence.
     */
    public String influenceHeader(double mu, double lambda, double temperature) {
        return String.format(Locale.ROOT,
            "[mutual_influence μ=%.2f, mix λ=%.2f, temp=%.2f] "
            + "If μ is high, be peer-consistent; if μ is low, justify disagreements.",
            mu, lambda, temperature);
    }

    public String plannerPrompt(int seed, int round, String header,
                                List<InfluenceMixer.Suggestion> suggestions, String criticDecision) {
        StringBuilder sb = new StringBuilder();
        appendHead(sb, seed, round, header);
        sb.append("Return:\n{\n  \"features\": [\"<name1>\", \"<name2>\", \"<name3>\"],\n")
          .append("  \"steps\": [\"<step1>\", \"<step2>\", \"<step3>\"]\n}\n");
        if (round == 1) {
            sb.append("Task: Propose exactly 3 streaming features for malware triage and a 3-step plan "
                + "that uses exactly those features.\n");
        } else {
            sb.append("Task: Refine the plan to reduce false positives and keep exactly 3 features consistent "
                + "with the plan. Each step MUST explicitly mention by name one or more of the chosen features.\n");
        }
        sb.append("Choose features ONLY from this allowed set (use exact tokens): ").append(allowed).append(".\n");
        appendPeerContext(sb, suggestions, criticDecision);
        return sb.toString();
    }

    public String researcherPrompt(int seed, int round, String header,
                                   List<InfluenceMixer.Suggestion> suggestions, String criticDecision) {
        StringBuilder sb = new StringBuilder();
        appendHead(sb, seed, round, header);
        sb.append("Return:\n{ \"features\": [\"<name1>\", \"<name2>\", \"<name3>\"] }\n");
        if (round == 1) {
            sb.append("Task: List exactly 3 streaming features (names only) computable in real time "
                + "for malware triage.\n");
        } else {
            sb.append("Task: List exactly 3 minimal streaming features we can compute now.\n");
        }
        sb.append("Choose ONLY from this allowed set (use exact tokens): ").append(allowed).append(".\n");
        appendPeerContext(sb, suggestions, criticDecision);
        return sb.toString();
    }

    /**
     * Critic prompt with the approval rubric and both proposals embedded as one line each.
     */
    public String criticPrompt(int seed, int round, String header, boolean adversarial,
                               String plannerJson, String researcherJson) {
        StringBuilder sb = new StringBuilder();
        appendHead(sb, seed, round, header);
        sb.append("Return exactly: { \"decision\": \"APPROVE\" or \"REVISE\" }\n\n")
          .append("You will receive two JSON objects below as PLANNER and RESEARCHER.\n\n")
          .append("APPROVAL RUBRIC (deterministic):\n")
          .append("- APPROVE only if ALL are true:\n")
          .append("  1) Both JSONs are valid, PLANNER has \"features\"(3) and \"steps\"(≥2), ")
          .append("RESEARCHER has \"features\"(3).\n")
          .append("  2) All features in both JSONs belong to ").append(allowed).append(".\n")
          .append("  3) Planner and Researcher share at least 2 out of 3 features (Jaccard ≥ 0.66).\n")
          .append("  4) At least 2 of Planner's steps explicitly mention (by exact token) features used by Planner.\n")
          .append("- Otherwise REVISE.\n");
        if (adversarial) {
            sb.append(ADVERSARIAL_MARKER)
              .append(" challenge every choice and APPROVE only when both feature sets are identical.\n");
        }
        sb.append('\n').append(PLANNER_BLOCK).append('\n').append(plannerJson).append("\n\n")
          .append(RESEARCHER_BLOCK).append('\n').append(researcherJson).append('\n');
        return sb.toString();
    }

    public static String formatSuggestions(List<InfluenceMixer.Suggestion> suggestions) {
        return suggestions.stream()
            .map(s -> String.format(Locale.ROOT, "%s (%.2f)", s.feature(), s.weight()))
            .collect(Collectors.joining(", "));
    }

    private void appendHead(StringBuilder sb, int seed, int round, String header) {
        if (header != null && !header.isEmpty()) {
            sb.append(header).append("\n\n");
        }
        sb.append(JSON_HINT)
          .append("[seed=").append(seed).append("] [round=").append(round).append("]\n");
    }

    private void appendPeerContext(StringBuilder sb, List<InfluenceMixer.Suggestion> suggestions,
                                   String criticDecision) {
        if (!suggestions.isEmpty()) {
            sb.append(SUGGESTION_PREFIX).append(formatSuggestions(suggestions)).append('\n');
        }
        if (criticDecision != null) {
            sb.append("Critic decision last round: ").append(criticDecision).append('\n');
        }
    }
}
