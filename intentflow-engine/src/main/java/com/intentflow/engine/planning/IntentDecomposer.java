package com.intentflow.engine.planning;

import com.intentflow.core.exception.PlanValidationException;
import com.intentflow.core.model.ActionCategory;
import com.intentflow.core.model.ActionDescriptor;
import com.intentflow.core.model.DataSensitivity;
import com.intentflow.core.model.NodeType;
import com.intentflow.core.model.RankedContext;
import com.intentflow.core.model.RetryPolicy;
import com.intentflow.core.model.Step;
import com.intentflow.core.spi.PlanningHeuristics;
import com.intentflow.engine.memory.MemoryStore;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rule-based decomposition of an intent into steps.
 *
 * The intent is split into clauses on commas, semicolons, "then", and on "and" when a verb
 * follows it, so "email the summary to tom and jerry" stays one clause. The first
 * word of a clause selects a verb rule; the rest is the object. Pronouns and empty
 * objects refer to the previous clause's target. Targets are resolved against the
 * ranked memory context when an entity shares a word with the object.
 *
 * Steps come back unplaced (no plan id, no final index); {@link PlanValidator} orders them.
 */
public class IntentDecomposer {

    private static final Pattern WORD = Pattern.compile("[^a-z0-9_.\\-]+");
    private static final Pattern FILE_EXTENSION = Pattern.compile(".*\\.[a-z0-9]{2,4}$");

    private static final Set<String> FILLER = Set.of("please", "also", "now", "just");
    // "and" only starts a new clause when a known verb follows it
    private static final Pattern CLAUSE_SEPARATOR = Pattern.compile("\\s*(?:[,;]|\\band then\\b|\\bthen\\b|\\band\\b(?=\\s+(?:(?:"
        + alternation(FILLER) + ")\\s+)*(?:" + alternation(VerbRule.BY_VERB.keySet()) + ")\\b))\\s*");
    private static final Set<String> ARTICLES = Set.of("the", "a", "an", "my", "our", "your");
    private static final Set<String> PRONOUNS = Set.of("it", "them", "that", "this", "those", "these");
    private static final Set<String> STOP_WORDS = Set.of("the", "a", "an", "my", "our", "your", "and", "then",
        "of", "to", "for", "with", "from", "into", "on", "in", "it", "them", "that", "this", "those", "these",
        "please", "me", "all");
    private static final Set<String> DOCUMENT_WORDS = Set.of("report", "document", "doc", "file", "spreadsheet",
        "presentation", "pdf", "notes", "contract", "invoice", "sheet", "memo", "letter", "draft");
    private static final Set<String> OUTPUT_WORDS = Set.of("summary", "result", "results", "analysis", "output");

    private static final Map<String, DataSensitivity> SENSITIVITY_WORDS = Map.ofEntries(
        Map.entry("password", DataSensitivity.RESTRICTED),
        Map.entry("salary", DataSensitivity.RESTRICTED),
        Map.entry("payroll", DataSensitivity.RESTRICTED),
        Map.entry("bank", DataSensitivity.RESTRICTED),
        Map.entry("medical", DataSensitivity.RESTRICTED),
        Map.entry("report", DataSensitivity.CONFIDENTIAL),
        Map.entry("financial", DataSensitivity.CONFIDENTIAL),
        Map.entry("contract", DataSensitivity.CONFIDENTIAL),
        Map.entry("customer", DataSensitivity.CONFIDENTIAL),
        Map.entry("invoice", DataSensitivity.CONFIDENTIAL),
        Map.entry("news", DataSensitivity.PUBLIC),
        Map.entry("weather", DataSensitivity.PUBLIC),
        Map.entry("public", DataSensitivity.PUBLIC)
    );

    /**
     * Verb rules. Each maps a family of verbs to the action it produces and the action
     * that undoes it, if any.
     */
    enum VerbRule {
        OPEN(ActionCategory.OPEN, "open_file", "close_file", "open", "launch", "start"),
        READ(ActionCategory.READ, "read_content", null, "read", "check", "view", "find", "search", "look", "show"),
        SUMMARIZE(ActionCategory.COMPUTE, "extract_summary", null, "summarize", "summarise", "extract"),
        ANALYZE(ActionCategory.COMPUTE, "analyze_content", null, "analyze", "analyse", "calculate", "compare"),
        EMAIL(ActionCategory.COMMUNICATE, "compose_email", "discard_draft",
            "email", "mail", "send", "reply", "message", "forward"),
        CREATE(ActionCategory.WRITE_SYSTEM_STATE, "create_item", "delete_created_item", "create", "make", "add"),
        SAVE(ActionCategory.WRITE_SYSTEM_STATE, "save_file", "revert_file", "save"),
        EDIT(ActionCategory.WRITE_SYSTEM_STATE, "edit_file", "revert_file", "edit", "update", "write", "modify"),
        MOVE(ActionCategory.WRITE_SYSTEM_STATE, "move_item", "move_back", "move", "rename"),
        DELETE(ActionCategory.DELETE, "delete_item", "restore_from_trash", "delete", "remove", "trash"),
        PAY(ActionCategory.FINANCIAL_TRANSACTION, "transfer_funds", "reverse_transfer", "pay", "transfer"),
        ORDER(ActionCategory.FINANCIAL_TRANSACTION, "place_order", "refund_order", "buy", "purchase", "order");

        final ActionCategory category;
        final String action;
        final String compensation;
        final Set<String> verbs;

        VerbRule(ActionCategory category, String action, String compensation, String... verbs) {
            this.category = category;
            this.action = action;
            this.compensation = compensation;
            this.verbs = Set.of(verbs);
        }

        static final Map<String, VerbRule> BY_VERB = new HashMap<>();

        static {
            for (VerbRule rule : values()) {
                rule.verbs.forEach(v -> BY_VERB.put(v, rule));
            }
        }
    }

    private final PlanningHeuristics heuristics;
    private final RetryPolicy retryPolicy;

    public IntentDecomposer(PlanningHeuristics heuristics, RetryPolicy retryPolicy) {
        this.heuristics = heuristics;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Words of the intent worth looking up in memory.
     */
    public List<String> queryTerms(String intent) {
        Set<String> terms = new LinkedHashSet<>();
        for (String word : words(intent)) {
            if (word.length() >= 3 && !STOP_WORDS.contains(word) && !VerbRule.BY_VERB.containsKey(word)) {
                terms.add(word);
            }
        }
        return List.copyOf(terms);
    }

    public List<Step> decompose(String intent, List<RankedContext> context) {
        if (intent == null || intent.isBlank()) {
            throw new PlanValidationException("intent", "intent is empty");
        }
        String normalized = intent.trim().toLowerCase(Locale.ROOT).replaceAll("[.!?]+$", "");
        List<String> clauses = Arrays.stream(CLAUSE_SEPARATOR.split(normalized))
            .map(String::trim)
            .filter(c -> !c.isEmpty())
            .toList();

        List<Step> steps = new ArrayList<>();
        Draft previous = null;
        for (String clause : clauses) {
            List<String> words = new ArrayList<>(Arrays.asList(clause.split("\\s+")));
            while (!words.isEmpty() && FILLER.contains(words.get(0))) {
                words.remove(0);
            }
            if (words.isEmpty()) {
                continue;
            }
            String verb = words.remove(0);
            VerbRule rule = VerbRule.BY_VERB.get(verb);
            if (rule == null) {
                throw new PlanValidationException("intent",
                    String.format("no rule for verb '%s' in clause '%s'", verb, clause));
            }
            while (!words.isEmpty() && ARTICLES.contains(words.get(0))) {
                words.remove(0);
            }
            String object = String.join(" ", words);

            if (rule == VerbRule.EMAIL && containsWord(object, "summary") && previous != null
                    && steps.stream().noneMatch(s -> s.action().name().equals(VerbRule.SUMMARIZE.action))) {
                previous = add(steps, VerbRule.SUMMARIZE, "", previous, clause, context);
            }
            previous = add(steps, rule, object, previous, clause, context);
        }
        if (steps.isEmpty()) {
            throw new PlanValidationException("intent", "no actionable clause in '" + intent + "'");
        }
        return steps;
    }

    private Draft add(List<Step> steps, VerbRule rule, String object, Draft previous, String clause,
                      List<RankedContext> context) {
        boolean inherits = previous != null && (object.isEmpty() || PRONOUNS.contains(object));
        boolean consumes = inherits || (previous != null && previous.producesContent && refersToOutput(object));

        String target;
        DataSensitivity sensitivity;
        if (inherits) {
            target = previous.target;
            sensitivity = previous.sensitivity;
        } else {
            RankedContext match = resolve(object, context);
            target = match != null ? match.entity() : object;
            sensitivity = sensitivityOf(object, match);
            if (consumes && previous.sensitivity.compareTo(sensitivity) > 0) {
                sensitivity = previous.sensitivity;
            }
        }

        String actionName = rule.action;
        String compensationName = rule.compensation;
        if (rule == VerbRule.OPEN && !isDocument(target)) {
            actionName = "open_application";
            compensationName = "close_application";
        }

        String stepId = "s" + (steps.size() + 1);
        ActionDescriptor action = new ActionDescriptor(rule.category, actionName, target, sensitivity,
            Map.of("clause", clause));
        if (consumes) {
            action = action.withParameter("input", previous.stepId);
        }
        ActionDescriptor compensation = compensationName == null ? null
            : new ActionDescriptor(rule.category, compensationName, target, sensitivity, Map.of("undoes", stepId));

        Set<String> dependsOn = Set.of();
        if (previous != null && (consumes || previous.category == ActionCategory.OPEN
                || previous.category.hasSideEffects() || rule.category.hasSideEffects())) {
            dependsOn = Set.of(previous.stepId);
        }

        Duration estimate = heuristics.expectedDuration(rule.category).orElse(rule.category.defaultDuration());
        steps.add(Step.builder(stepId, action)
            .sequenceIndex(steps.size())
            .dependsOn(dependsOn)
            .compensatingAction(compensation)
            .retryPolicy(retryPolicy)
            .estimatedDuration(estimate)
            .parallelSafe(!rule.category.hasSideEffects())
            .build());

        boolean producesContent = rule.category == ActionCategory.COMPUTE || rule.category == ActionCategory.READ
            || rule.category == ActionCategory.OPEN;
        return new Draft(stepId, rule.category, target, sensitivity, producesContent);
    }

    private static RankedContext resolve(String object, List<RankedContext> context) {
        if (object.isEmpty() || context == null) {
            return null;
        }
        Set<String> objectWords = significantWords(object);
        for (RankedContext entry : context) {
            if (entry.type() != NodeType.ENTITY || entry.entity() == null) {
                continue;
            }
            for (String word : significantWords(entry.entity())) {
                if (objectWords.contains(word)) {
                    return entry;
                }
            }
        }
        return null;
    }

    private static DataSensitivity sensitivityOf(String object, RankedContext match) {
        if (match != null && match.properties() != null) {
            String known = match.properties().get(MemoryStore.SENSITIVITY);
            if (known != null) {
                return DataSensitivity.valueOf(known);
            }
        }
        DataSensitivity sensitivity = null;
        for (String word : words(object)) {
            DataSensitivity candidate = SENSITIVITY_WORDS.get(word);
            if (candidate != null && (sensitivity == null || candidate.compareTo(sensitivity) > 0)) {
                sensitivity = candidate;
            }
        }
        return sensitivity != null ? sensitivity : DataSensitivity.INTERNAL;
    }

    private static boolean isDocument(String target) {
        String lower = target.toLowerCase(Locale.ROOT);
        return FILE_EXTENSION.matcher(lower).matches() || words(lower).stream().anyMatch(DOCUMENT_WORDS::contains);
    }

    private static boolean refersToOutput(String object) {
        return words(object).stream().anyMatch(OUTPUT_WORDS::contains);
    }

    private static boolean containsWord(String text, String word) {
        return words(text).contains(word);
    }

    private static Set<String> significantWords(String text) {
        Set<String> result = new LinkedHashSet<>();
        for (String word : words(text)) {
            if (word.length() >= 3 && !STOP_WORDS.contains(word)) {
                result.add(word);
            }
        }
        return result;
    }

    private static String alternation(Set<String> words) {
        return words.stream().sorted().map(Pattern::quote).collect(Collectors.joining("|"));
    }

    private static List<String> words(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(WORD.split(text.toLowerCase(Locale.ROOT)))
            .filter(w -> !w.isEmpty())
            .toList();
    }

    private record Draft(
        String stepId,
        ActionCategory category,
        String target,
        DataSensitivity sensitivity,
        boolean producesContent
    ) {
    }
}
