package com.bmsedge.forecast.service;

import com.bmsedge.forecast.config.ForecastSettings;
import com.bmsedge.forecast.exception.ResolutionAmbiguityException;
import com.bmsedge.forecast.model.AliasOrigin;
import com.bmsedge.forecast.model.Item;
import com.bmsedge.forecast.model.ItemAlias;
import com.bmsedge.forecast.repository.ItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Maps raw item names from exports to canonical items.
 *
 * <p>Resolution order: exact match on normalized canonical names and aliases, configured
 * canonicalization rules, token-overlap fuzzy match, and finally creation of a new item.
 * Two existing items are never merged.
 */
@Service
public class ItemResolver {

    private static final Logger logger = LoggerFactory.getLogger(ItemResolver.class);

    @Autowired
    private ItemRepository itemRepository;

    @Autowired
    private ForecastSettings settings;

    /**
     * Opens a resolution scope for one ingestion batch. The catalog is loaded once and
     * every raw name is resolved at most once within the scope.
     */
    public Batch newBatch() {
        return new Batch(itemRepository.findAllWithAliases(), parseRules(settings.getCanonicalRules()));
    }

    public Item resolve(String rawName) {
        return newBatch().resolve(rawName);
    }

    /**
     * Lower-case, trimmed, punctuation stripped, whitespace collapsed.
     */
    public static String normalize(String name) {
        if (name == null) return "";
        String lower = name.toLowerCase(Locale.ROOT);
        String lettersAndDigits = lower.replaceAll("[^\\p{L}\\p{N}\\s]", " ");
        return lettersAndDigits.trim().replaceAll("\\s+", " ");
    }

    /**
     * |common tokens| / max(|tokens a|, |tokens b|).
     */
    public static double similarity(String a, String b) {
        Set<String> ta = tokens(a);
        Set<String> tb = tokens(b);
        if (ta.isEmpty() || tb.isEmpty()) return 0.0;
        Set<String> common = new HashSet<>(ta);
        common.retainAll(tb);
        return (double) common.size() / Math.max(ta.size(), tb.size());
    }

    private static Set<String> tokens(String normalized) {
        if (normalized == null || normalized.isEmpty()) return Collections.emptySet();
        return new HashSet<>(Arrays.asList(normalized.split(" ")));
    }

    static List<CanonicalRule> parseRules(String rules) {
        List<CanonicalRule> parsed = new ArrayList<>();
        if (rules == null || rules.isBlank()) return parsed;
        for (String entry : rules.split(";")) {
            if (entry.isBlank()) continue;
            int arrow = entry.indexOf("=>");
            if (arrow < 0) {
                logger.warn("Ignoring canonicalization rule without '=>': {}", entry.trim());
                continue;
            }
            String regex = entry.substring(0, arrow).trim();
            String canonical = entry.substring(arrow + 2).trim();
            if (regex.isEmpty() || canonical.isEmpty()) {
                logger.warn("Ignoring incomplete canonicalization rule: {}", entry.trim());
                continue;
            }
            try {
                parsed.add(new CanonicalRule(Pattern.compile(regex), canonical));
            } catch (PatternSyntaxException e) {
                logger.warn("Ignoring canonicalization rule with invalid pattern '{}': {}", regex, e.getDescription());
            }
        }
        return parsed;
    }

    // ==================== BATCH SCOPE ====================

    public class Batch {

        private final List<Item> catalog;
        private final Map<String, Item> exactIndex = new HashMap<>();
        private final List<CanonicalRule> rules;
        private final Map<String, Item> resolved = new HashMap<>();
        private final Map<String, ResolutionAmbiguityException> ambiguous = new HashMap<>();
        private int itemsCreated;

        Batch(List<Item> catalog, List<CanonicalRule> rules) {
            this.catalog = new ArrayList<>(catalog);
            this.rules = rules;
            for (Item item : this.catalog) {
                index(item);
            }
        }

        public Item resolve(String rawName) {
            String trimmed = rawName == null ? "" : rawName.trim().replaceAll("\\s+", " ");
            String key = normalize(trimmed);
            if (key.isEmpty()) {
                throw new IllegalArgumentException("Item name is blank after normalization: '" + rawName + "'");
            }
            if (ambiguous.containsKey(key)) {
                throw ambiguous.get(key);
            }
            Item cached = resolved.get(key);
            if (cached != null) {
                return cached;
            }

            Item item;
            try {
                item = doResolve(trimmed, key);
            } catch (ResolutionAmbiguityException e) {
                ambiguous.put(key, e);
                throw e;
            }
            resolved.put(key, item);
            return item;
        }

        public int getItemsCreated() {
            return itemsCreated;
        }

        private Item doResolve(String trimmed, String key) {
            Item exact = exactIndex.get(key);
            if (exact != null) {
                return exact;
            }

            for (CanonicalRule rule : rules) {
                if (rule.matches(trimmed) || rule.matches(key)) {
                    return resolveByRule(trimmed, key, rule);
                }
            }

            Item fuzzy = fuzzyMatch(trimmed, key);
            if (fuzzy != null) {
                return fuzzy;
            }

            Item created = new Item(trimmed);
            created.addAlias(trimmed, AliasOrigin.CANONICAL);
            created = itemRepository.save(created);
            register(created);
            itemsCreated++;
            logger.info("Created new item '{}' (id={})", trimmed, created.getId());
            return created;
        }

        private Item resolveByRule(String trimmed, String key, CanonicalRule rule) {
            Item target = exactIndex.get(normalize(rule.canonicalName));
            if (target == null) {
                target = new Item(rule.canonicalName);
                target.addAlias(rule.canonicalName, AliasOrigin.CANONICAL);
                itemsCreated++;
            }
            if (!key.equals(normalize(rule.canonicalName))) {
                target.addAlias(trimmed, AliasOrigin.RULE);
            }
            Item saved = itemRepository.save(target);
            register(saved);
            logger.info("Rule '{}' mapped '{}' to '{}'", rule.pattern.pattern(), trimmed, saved.getCanonicalName());
            return saved;
        }

        private Item fuzzyMatch(String trimmed, String key) {
            double best = 0.0;
            List<Item> bestItems = new ArrayList<>();
            for (Item item : catalog) {
                double score = bestScore(item, key);
                if (score > best + 1e-9) {
                    best = score;
                    bestItems.clear();
                    bestItems.add(item);
                } else if (score > 0 && Math.abs(score - best) <= 1e-9) {
                    bestItems.add(item);
                }
            }

            if (bestItems.isEmpty() || best < settings.getSimilarityThreshold()) {
                return null;
            }
            if (bestItems.size() > 1) {
                List<String> names = bestItems.stream()
                        .map(Item::getCanonicalName)
                        .sorted()
                        .collect(Collectors.toList());
                logger.warn("Ambiguous item name '{}' (similarity {}): {}", trimmed,
                        String.format("%.2f", best), names);
                throw new ResolutionAmbiguityException(trimmed, names);
            }

            Item match = bestItems.get(0);
            match.addAlias(trimmed, AliasOrigin.FUZZY);
            Item saved = itemRepository.save(match);
            register(saved);
            logger.warn("Fuzzy-matched '{}' to '{}' (similarity {}); recorded as alias",
                    trimmed, saved.getCanonicalName(), String.format("%.2f", best));
            return saved;
        }

        private double bestScore(Item item, String key) {
            double score = similarity(key, normalize(item.getCanonicalName()));
            for (ItemAlias alias : item.getAliases()) {
                score = Math.max(score, similarity(key, normalize(alias.getAlias())));
            }
            return score;
        }

        private void register(Item item) {
            boolean known = false;
            for (int i = 0; i < catalog.size(); i++) {
                if (catalog.get(i) == item || (item.getId() != null && item.getId().equals(catalog.get(i).getId()))) {
                    catalog.set(i, item);
                    known = true;
                    break;
                }
            }
            if (!known) {
                catalog.add(item);
            }
            index(item);
        }

        private void index(Item item) {
            indexKey(normalize(item.getCanonicalName()), item);
            for (ItemAlias alias : item.getAliases()) {
                indexKey(normalize(alias.getAlias()), item);
            }
        }

        private void indexKey(String key, Item item) {
            Item existing = exactIndex.get(key);
            if (existing == null || existing == item
                    || (existing.getId() != null && existing.getId().equals(item.getId()))) {
                exactIndex.put(key, item);
            }
        }
    }

    static class CanonicalRule {
        final Pattern pattern;
        final String canonicalName;

        CanonicalRule(Pattern pattern, String canonicalName) {
            this.pattern = pattern;
            this.canonicalName = canonicalName;
        }

        boolean matches(String name) {
            return pattern.matcher(name).matches();
        }
    }
}
