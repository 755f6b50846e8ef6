package com.finhelm.reconcile.explanation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finhelm.reconcile.ai.OpenAiResponsesClient;
import com.finhelm.reconcile.model.AnomalyResult;
import com.finhelm.reconcile.model.Explanation;
import com.finhelm.reconcile.model.TransactionRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks a language model for the narrative parts of an explanation. Risk level and confidence
 * always come from the template rules; the model only rewrites summary, reasoning and
 * recommendations. Timeouts, empty answers and unparseable answers fall back to the template.
 */
public class AiExplanationGenerator implements ExplanationGenerator {

    private static final Logger log = LoggerFactory.getLogger(AiExplanationGenerator.class);
    private static final int MAX_OUTPUT_TOKENS = 500;
    private static final int MIN_SUMMARY_LENGTH = 11;

    private final OpenAiResponsesClient client;
    private final TemplateExplanationGenerator template;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final long timeoutMs;

    public AiExplanationGenerator(
            OpenAiResponsesClient client,
            TemplateExplanationGenerator template,
            ObjectMapper objectMapper,
            Executor executor,
            long timeoutMs) {
        this.client = client;
        this.template = template;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public Explanation explain(AnomalyResult anomaly, TransactionRecord transaction) {
        return explain(anomaly, transaction, Duration.ofMillis(timeoutMs));
    }

    @Override
    public Explanation explain(AnomalyResult anomaly, TransactionRecord transaction, Duration budget) {
        Explanation fallback = template.explain(anomaly, transaction);
        long waitMs = Math.min(timeoutMs, budget == null ? timeoutMs : budget.toMillis());
        if (waitMs <= 0) {
            log.debug("AI explanation: budget spent, using template for transaction {}", anomaly.transactionId());
            return fallback;
        }
        Optional<String> response;
        try {
            String prompt = buildPrompt(anomaly, transaction, fallback);
            response = CompletableFuture
                    .supplyAsync(() -> client.generateText(
                            List.of(new OpenAiResponsesClient.Message("user", prompt)), MAX_OUTPUT_TOKENS), executor)
                    .completeOnTimeout(Optional.empty(), waitMs, TimeUnit.MILLISECONDS)
                    .join();
        } catch (Exception ex) {
            log.warn("AI explanation: generation failed for transaction {}, using template", anomaly.transactionId(), ex);
            return fallback;
        }
        if (response.isEmpty()) {
            log.warn("AI explanation: no response within {}ms for transaction {}, using template",
                    waitMs, anomaly.transactionId());
            return fallback;
        }
        return merge(response.get(), fallback);
    }

    private Explanation merge(String rawResponse, Explanation fallback) {
        JsonNode node;
        try {
            node = objectMapper.readTree(stripCodeFence(rawResponse));
        } catch (Exception ex) {
            log.warn("AI explanation: failed to parse response for transaction {}, using template: {}",
                    fallback.transactionId(), rawResponse, ex);
            return fallback;
        }
        if (node == null || !node.isObject()) {
            log.warn("AI explanation: response for transaction {} is not a JSON object, using template",
                    fallback.transactionId());
            return fallback;
        }
        String summary = node.path("summary").asText("").trim();
        if (summary.length() < MIN_SUMMARY_LENGTH) {
            summary = fallback.summary();
        }
        return new Explanation(
                fallback.transactionId(),
                summary,
                topUp(readStrings(node.get("reasoning")), fallback.reasoning()),
                fallback.confidence(),
                fallback.riskLevel(),
                topUp(readStrings(node.get("recommendations")), fallback.recommendations()),
                fallback.generatedAt(),
                Explanation.Source.LANGUAGE_MODEL);
    }

    /**
     * Fills the model's list with template entries until it is at least as long as the template's.
     */
    private static List<String> topUp(List<String> generated, List<String> templateItems) {
        List<String> merged = new ArrayList<>(generated);
        for (String item : templateItems) {
            if (merged.size() >= templateItems.size()) {
                break;
            }
            if (!merged.contains(item)) {
                merged.add(item);
            }
        }
        return List.copyOf(merged);
    }

    private static List<String> readStrings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return values;
        }
        for (JsonNode item : node) {
            String text = item.asText("").trim();
            if (!text.isEmpty()) {
                values.add(text);
            }
        }
        return values;
    }

    private static String stripCodeFence(String raw) {
        String trimmed = raw.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return trimmed;
    }

    private static String buildPrompt(AnomalyResult anomaly, TransactionRecord transaction, Explanation fallback) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You review accounting transactions flagged by a three-sigma outlier check. ")
                .append("Explain the flag to a finance controller in plain language. ")
                .append("Respond only with JSON: {\"summary\": string, \"reasoning\": [string], \"recommendations\": [string]}.\n");
        prompt.append("risk_level=").append(fallback.riskLevel().name().toLowerCase(Locale.ROOT)).append('\n');
        prompt.append(String.format(Locale.ROOT, "z_score=%.2f confidence=%.3f baseline=%s mean=%.2f std_dev=%.2f%n",
                anomaly.zScore(),
                anomaly.confidence(),
                anomaly.baseline().name().toLowerCase(Locale.ROOT),
                anomaly.statisticalData().mean(),
                anomaly.statisticalData().standardDeviation()));
        if (transaction != null) {
            prompt.append("account=").append(transaction.accountCode())
                    .append(" amount=").append(transaction.amount().toPlainString())
                    .append(" type=").append(transaction.type().name().toLowerCase(Locale.ROOT))
                    .append(" category=").append(transaction.category().orElse("uncategorized"))
                    .append('\n');
        }
        prompt.append("Give at least ").append(fallback.reasoning().size()).append(" reasons and ")
                .append(fallback.recommendations().size()).append(" recommendations.");
        return prompt.toString();
    }
}
