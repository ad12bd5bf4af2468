package ai.pokercoach.solver.texas;

import ai.pokercoach.config.SolverProperties;
import ai.pokercoach.game.Action;
import ai.pokercoach.game.Hand;
import ai.pokercoach.solver.NotFoundException;
import ai.pokercoach.solver.OutputParseException;
import ai.pokercoach.solver.Solution;
import ai.pokercoach.solver.SolverException;
import ai.pokercoach.solver.Strategy;
import ai.pokercoach.solver.canonical.SuitMapping;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.springframework.stereotype.Component;

/**
 * Decodes TexasSolver output into a {@link Solution}.
 * <p>
 * The dumped result file is the game tree of the solved street. Each action node holds the
 * acting player's table and the nodes its actions lead to:
 * <pre>
 * { "strategy": { "actions": ["CHECK", "BET 2.000000"],
 *                 "strategy": { "AhKd": [0.25, 0.75], ... } },
 *   "evs": { "AhKd": [1.9, 2.4], ... },
 *   "childrens": { "CHECK": { ... }, "BET 2.000000": { ... } } }
 * </pre>
 * The parser follows the given street actions from the root to the hero's node and decodes
 * that node's table. Checks and calls follow the branch of that type, bets and raises the
 * branch of that type nearest in size. The EV table may also be nested one level, as
 * {@code "evs": {"actions": [...], "evs": {...}}}. Exploitability and iteration count are
 * read from the console output with the configured patterns; the last match wins because
 * the solver reports progress as it goes.
 * <p>
 * Anything that does not fit this shape is an {@link OutputParseException} carrying a
 * bounded excerpt of the offending output.
 */
@Component
public class OutputParser {
    static final int EXCERPT_LIMIT = 2000;

    private final ObjectMapper objectMapper;
    private final SolverProperties.Schema schema;

    public OutputParser(ObjectMapper objectMapper, SolverProperties properties) {
        this.objectMapper = objectMapper;
        this.schema = properties.getSchema();
    }

    /**
     * Parses the root node's table, leaving it in canonical suits.
     */
    public Solution parse(RawOutput raw) {
        return parse(raw, List.of(), SuitMapping.identity());
    }

    /**
     * Parses the table of the node reached by {@code path}, leaving it in canonical suits.
     */
    public Solution parse(RawOutput raw, List<Action> path) {
        return parse(raw, path, SuitMapping.identity());
    }

    /**
     * Parses the table of the node reached by {@code path} and relabels every hand from
     * canonical to real suits through {@code mapping}.
     *
     * @throws OutputParseException if the output does not match the pinned schema
     * @throws NotFoundException if the solved tree has no branch for a step of {@code path}
     */
    public Solution parse(RawOutput raw, List<Action> path, SuitMapping mapping) {
        String json = raw.resultJson();
        if (json == null || json.isBlank()) {
            throw new OutputParseException("Solver wrote no result file " + schema.getResultFileName(),
                    SolverException.excerpt(raw.stdout(), EXCERPT_LIMIT));
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new OutputParseException("Result is not valid JSON: " + e.getOriginalMessage(),
                    SolverException.excerpt(json, EXCERPT_LIMIT), e);
        }
        if (root == null || !root.isObject()) {
            throw fail("Result root is not an object", json);
        }

        JsonNode node = root;
        List<Action> walked = new ArrayList<>(path.size());
        for (Action step : path) {
            node = child(node, step, walked, json);
            walked.add(step);
        }

        JsonNode strategyNode = node.path("strategy");
        List<Action> actions = actions(strategyNode.path("actions"), walked, json);
        JsonNode table = strategyNode.path("strategy");
        if (!table.isObject() || table.isEmpty()) {
            throw fail("Node " + line(walked) + " has no strategy.strategy table", json);
        }
        JsonNode evTable = evTable(node.path(schema.getEvsField()), walked, json);

        Map<Hand, Strategy> strategies = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> rows = table.fields();
        while (rows.hasNext()) {
            Map.Entry<String, JsonNode> row = rows.next();
            Strategy strategy = strategy(row.getKey(), row.getValue(), evTable.get(row.getKey()), actions, json);
            if (strategies.put(strategy.getHand(), strategy) != null) {
                throw fail("Hand " + strategy.getHand() + " listed twice", json);
            }
        }

        double exploitability = lastNumber(schema.getExploitabilityPattern(), "exploitability", raw.stdout());
        if (!(exploitability >= 0)) {
            throw new OutputParseException("Negative exploitability " + exploitability,
                    SolverException.excerpt(raw.stdout(), EXCERPT_LIMIT));
        }
        int iterations = (int) lastNumber(schema.getIterationPattern(), "iteration count", raw.stdout());
        Solution solution = new Solution(strategies, exploitability, iterations);
        return mapping.isIdentity() ? solution : solution.relabel(mapping::toReal, 1.0);
    }

    private JsonNode child(JsonNode node, Action step, List<Action> walked, String json) {
        JsonNode children = node.path(schema.getChildrenField());
        if (!children.isObject() || children.isEmpty()) {
            throw fail("Node " + line(walked) + " has no '" + schema.getChildrenField() + "' to follow '"
                    + step + "'", json);
        }
        JsonNode best = null;
        double bestDistance = Double.MAX_VALUE;
        Iterator<Map.Entry<String, JsonNode>> branches = children.fields();
        while (branches.hasNext()) {
            Map.Entry<String, JsonNode> branch = branches.next();
            Action action;
            try {
                action = Action.parse(branch.getKey());
            } catch (IllegalArgumentException e) {
                throw new OutputParseException("Unknown branch label '" + branch.getKey() + "'",
                        SolverException.excerpt(json, EXCERPT_LIMIT), e);
            }
            if (action.type() != step.type()) {
                continue;
            }
            double distance = Math.abs(action.amount() - step.amount());
            if (distance < bestDistance) {
                best = branch.getValue();
                bestDistance = distance;
            }
        }
        if (best == null) {
            List<String> labels = new ArrayList<>();
            children.fieldNames().forEachRemaining(labels::add);
            throw new NotFoundException("Solved tree has no " + step.type().getLabel() + " branch after "
                    + line(walked) + "; available " + labels);
        }
        if (!best.isObject()) {
            throw fail("Branch '" + step + "' after " + line(walked) + " is not a node", json);
        }
        return best;
    }

    private static String line(List<Action> walked) {
        return walked.isEmpty() ? "root" : walked.toString();
    }

    private List<Action> actions(JsonNode node, List<Action> walked, String json) {
        if (!node.isArray() || node.isEmpty()) {
            throw fail("Node " + line(walked) + " has no strategy.actions list", json);
        }
        List<Action> actions = new ArrayList<>(node.size());
        for (JsonNode label : node) {
            if (!label.isTextual()) {
                throw fail("Action label is not text: " + label, json);
            }
            try {
                actions.add(Action.parse(label.asText()));
            } catch (IllegalArgumentException e) {
                throw new OutputParseException("Unknown action label '" + label.asText() + "'",
                        SolverException.excerpt(json, EXCERPT_LIMIT), e);
            }
        }
        if (actions.stream().distinct().count() != actions.size()) {
            throw fail("Duplicate action labels " + actions, json);
        }
        return actions;
    }

    private JsonNode evTable(JsonNode node, List<Action> walked, String json) {
        JsonNode nested = node.path(schema.getEvsField());
        JsonNode table = nested.isObject() ? nested : node;
        if (!table.isObject() || table.isEmpty()) {
            throw fail("Node " + line(walked) + " has no '" + schema.getEvsField() + "' table", json);
        }
        return table;
    }

    private Strategy strategy(String handText, JsonNode frequencyRow, JsonNode evRow, List<Action> actions,
            String json) {
        Hand hand;
        try {
            hand = Hand.parse(handText);
        } catch (IllegalArgumentException e) {
            throw new OutputParseException("Bad hand '" + handText + "'", SolverException.excerpt(json, EXCERPT_LIMIT), e);
        }
        double[] frequencies = numbers(frequencyRow, actions.size(), "frequencies of " + handText, json);
        if (evRow == null) {
            throw fail("No EVs for " + handText, json);
        }
        double[] evs = numbers(evRow, actions.size(), "EVs of " + handText, json);

        double sum = 0;
        for (double frequency : frequencies) {
            if (frequency < 0 || frequency > 1 + schema.getFrequencyTolerance()) {
                throw fail("Frequency " + frequency + " out of range for " + handText, json);
            }
            sum += frequency;
        }
        if (Math.abs(sum - 1.0) > schema.getFrequencyTolerance()) {
            throw fail("Frequencies for " + handText + " sum to " + sum, json);
        }

        Map<Action, Double> frequencyByAction = new LinkedHashMap<>();
        Map<Action, Double> evByAction = new LinkedHashMap<>();
        for (int i = 0; i < actions.size(); i++) {
            frequencyByAction.put(actions.get(i), Math.min(1.0, frequencies[i] / sum));
            evByAction.put(actions.get(i), evs[i]);
        }
        try {
            return new Strategy(hand, frequencyByAction, evByAction);
        } catch (IllegalArgumentException e) {
            throw new OutputParseException(e.getMessage(), SolverException.excerpt(json, EXCERPT_LIMIT), e);
        }
    }

    private double[] numbers(JsonNode row, int expected, String what, String json) {
        if (row == null || !row.isArray() || row.size() != expected) {
            throw fail("Expected " + expected + " " + what + " but got " + row, json);
        }
        double[] values = new double[expected];
        for (int i = 0; i < expected; i++) {
            JsonNode value = row.get(i);
            if (!value.isNumber()) {
                throw fail("Non-numeric entry in " + what + ": " + value, json);
            }
            values[i] = value.asDouble();
        }
        return values;
    }

    private double lastNumber(String regex, String what, String stdout) {
        Pattern pattern;
        try {
            pattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new OutputParseException("Configured " + what + " pattern is invalid: " + regex, "", e);
        }
        Matcher matcher = pattern.matcher(stdout);
        String last = null;
        while (matcher.find()) {
            last = matcher.group(1);
        }
        if (last == null) {
            throw new OutputParseException("No " + what + " in solver output",
                    SolverException.excerpt(stdout, EXCERPT_LIMIT));
        }
        try {
            return Double.parseDouble(last);
        } catch (NumberFormatException e) {
            throw new OutputParseException("Bad " + what + " '" + last + "'",
                    SolverException.excerpt(stdout, EXCERPT_LIMIT), e);
        }
    }

    private static OutputParseException fail(String message, String raw) {
        return new OutputParseException(message, SolverException.excerpt(raw, EXCERPT_LIMIT));
    }
}
