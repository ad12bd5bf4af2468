package ai.pokercoach.solver.cache;

import ai.pokercoach.game.Action;
import ai.pokercoach.game.Hand;
import ai.pokercoach.solver.Solution;
import ai.pokercoach.solver.Strategy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of one persisted cache entry.
 * <p>
 * Self-describing so a store directory can be inspected, diffed or seeded by hand:
 * <pre>
 * { "key": "v1|FLOP|...", "provenance": "dynamic", "createdAt": "2026-01-01T00:00:00Z",
 *   "exploitability": 0.28, "iterations": 160,
 *   "hands": [ { "hand": "AcKd", "actions": [ { "action": "check", "frequency": 0.4, "ev": 3.1 } ] } ] }
 * </pre>
 */
public class CacheEntryDocument {

    public static class ActionDocument {
        private String action;
        private Double frequency;
        private Double ev;

        public ActionDocument() {
            // Default constructor for JSON binding.
        }

        public String getAction() {
            return action;
        }

        public void setAction(String action) {
            this.action = action;
        }

        public Double getFrequency() {
            return frequency;
        }

        public void setFrequency(Double frequency) {
            this.frequency = frequency;
        }

        public Double getEv() {
            return ev;
        }

        public void setEv(Double ev) {
            this.ev = ev;
        }
    }

    public static class HandDocument {
        private String hand;
        private List<ActionDocument> actions;

        public HandDocument() {
            // Default constructor for JSON binding.
        }

        public String getHand() {
            return hand;
        }

        public void setHand(String hand) {
            this.hand = hand;
        }

        public List<ActionDocument> getActions() {
            return actions;
        }

        public void setActions(List<ActionDocument> actions) {
            this.actions = actions;
        }
    }

    private String key;
    private String provenance;
    private String createdAt;
    private double exploitability;
    private int iterations;
    private List<HandDocument> hands;

    public CacheEntryDocument() {
        // Default constructor for JSON binding.
    }

    public static CacheEntryDocument from(CacheEntry entry) {
        CacheEntryDocument document = new CacheEntryDocument();
        document.setKey(entry.key());
        document.setProvenance(entry.provenance().getLabel());
        document.setCreatedAt(entry.createdAt().toString());
        document.setExploitability(entry.solution().getExploitability());
        document.setIterations(entry.solution().getIterations());
        List<HandDocument> hands = new ArrayList<>();
        for (Strategy strategy : entry.solution().getStrategies().values()) {
            HandDocument hand = new HandDocument();
            hand.setHand(strategy.getHand().toString());
            List<ActionDocument> actions = new ArrayList<>();
            for (Map.Entry<Action, Double> frequency : strategy.getFrequencies().entrySet()) {
                actions.add(action(frequency.getKey(), frequency.getValue(), strategy.getEvs().get(frequency.getKey())));
            }
            for (Map.Entry<Action, Double> ev : strategy.getEvs().entrySet()) {
                if (!strategy.getFrequencies().containsKey(ev.getKey())) {
                    actions.add(action(ev.getKey(), null, ev.getValue()));
                }
            }
            hand.setActions(actions);
            hands.add(hand);
        }
        document.setHands(hands);
        return document;
    }

    private static ActionDocument action(Action action, Double frequency, Double ev) {
        ActionDocument document = new ActionDocument();
        document.setAction(action.label());
        document.setFrequency(frequency);
        document.setEv(ev);
        return document;
    }

    /**
     * Rebuilds the entry.
     *
     * @throws IllegalArgumentException if any field is missing or violates the solution invariants
     */
    public CacheEntry toEntry() {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Cache document has no key");
        }
        if (hands == null) {
            throw new IllegalArgumentException("Cache document " + key + " has no hands");
        }
        Map<Hand, Strategy> strategies = new LinkedHashMap<>();
        for (HandDocument handDocument : hands) {
            Hand hand = Hand.parse(handDocument.getHand());
            Map<Action, Double> frequencies = new LinkedHashMap<>();
            Map<Action, Double> evs = new LinkedHashMap<>();
            if (handDocument.getActions() == null) {
                throw new IllegalArgumentException("Cache document " + key + " has no actions for " + hand);
            }
            for (ActionDocument actionDocument : handDocument.getActions()) {
                Action action = Action.parse(actionDocument.getAction());
                if (actionDocument.getFrequency() != null) {
                    frequencies.put(action, actionDocument.getFrequency());
                }
                if (actionDocument.getEv() != null) {
                    evs.put(action, actionDocument.getEv());
                }
            }
            strategies.put(hand, new Strategy(hand, frequencies, evs));
        }
        Instant created = createdAt == null ? Instant.EPOCH : Instant.parse(createdAt);
        Provenance parsed = provenance == null ? Provenance.PRECOMPUTED : Provenance.fromLabel(provenance);
        return new CacheEntry(key, new Solution(strategies, exploitability, iterations), parsed, created);
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public String getProvenance() {
        return provenance;
    }

    public void setProvenance(String provenance) {
        this.provenance = provenance;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(String createdAt) {
        this.createdAt = createdAt;
    }

    public double getExploitability() {
        return exploitability;
    }

    public void setExploitability(double exploitability) {
        this.exploitability = exploitability;
    }

    public int getIterations() {
        return iterations;
    }

    public void setIterations(int iterations) {
        this.iterations = iterations;
    }

    public List<HandDocument> getHands() {
        return hands;
    }

    public void setHands(List<HandDocument> hands) {
        this.hands = hands;
    }
}
