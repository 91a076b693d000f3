package com.example.xtractor.application.extraction;

import com.example.xtractor.domain.model.BoundaryDocument;
import com.example.xtractor.domain.model.LgaNode;
import com.example.xtractor.domain.model.StateNode;
import com.example.xtractor.domain.model.WardNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Owns the output tree of one run and performs find-or-create insertion keyed by composite identity.
 * New nodes are appended, so every level keeps first-seen order regardless of code values.
 */
public class DocumentBuilder {

    private static final Logger log = LoggerFactory.getLogger(DocumentBuilder.class);
    private static final char KEY_SEPARATOR = '\u001F';
    static final String FALLBACK_CODE = "XX";

    private final ExtractionContext context;
    private final int maxCodeLength;
    private final BoundaryDocument document = new BoundaryDocument();
    private final Map<String, StateNode> states = new HashMap<>();
    private final Map<String, LgaNode> lgas = new HashMap<>();
    private final Map<LgaNode, String> lgaKeys = new IdentityHashMap<>();
    private final Map<String, WardNode> wards = new HashMap<>();

    /**
     * @param context       context of the same run; its key sets and LGA cursor are updated here
     * @param maxCodeLength upper bound for generated codes
     */
    public DocumentBuilder(ExtractionContext context, int maxCodeLength) {
        this.context = context;
        this.maxCodeLength = maxCodeLength;
    }

    public BoundaryDocument document() {
        return document;
    }

    /**
     * Returns the State with the given name, appending it to the document on first sight.
     * Does not move the context; State transitions are the page processor's decision.
     *
     * @param name raw State name
     * @return existing or new State
     */
    public StateNode findOrCreateState(String name) {
        String key = RowClassifier.normalize(name);
        StateNode existing = states.get(key);
        if (existing != null) {
            return existing;
        }
        StateNode state = new StateNode(key);
        states.put(key, state);
        document.addState(state);
        log.info("Opened state {}", key);
        return state;
    }

    /**
     * Returns the LGA identified by (State, name, code) and makes it the current LGA.
     *
     * @param state owning State
     * @param name  raw LGA name
     * @param code  raw LGA code, or {@code null} to generate one from the name
     * @return existing or new LGA
     */
    public LgaNode findOrCreateLga(StateNode state, String name, String code) {
        String lgaName = RowClassifier.normalize(name);
        String lgaCode = resolveCode(lgaName, code);
        String key = key(state.name(), lgaName, lgaCode);

        LgaNode lga;
        if (context.markLgaSeen(key)) {
            lga = new LgaNode(lgaName, lgaCode);
            lgas.put(key, lga);
            lgaKeys.put(lga, key);
            state.addLga(lga);
            log.debug("Added LGA {} ({}) to {}", lgaName, lgaCode, state.name());
        } else {
            lga = lgas.get(key);
            log.debug("LGA {} ({}) already present in {}", lgaName, lgaCode, state.name());
        }
        context.setCurrentLga(lga);
        return lga;
    }

    /**
     * Returns the ward identified by (State, LGA, name, code) under the given LGA.
     *
     * @param lga  owning LGA, created by this builder
     * @param name raw ward name
     * @param code raw ward code, or {@code null} to generate one from the name
     * @return existing or new ward
     */
    public WardNode findOrCreateWard(LgaNode lga, String name, String code) {
        String lgaKey = lgaKeys.get(lga);
        if (lgaKey == null) {
            throw new IllegalArgumentException("LGA " + lga + " does not belong to this document");
        }
        String wardName = RowClassifier.normalize(name);
        String wardCode = resolveCode(wardName, code);
        String key = key(lgaKey, wardName, wardCode);

        WardNode ward;
        if (context.markWardSeen(key)) {
            ward = new WardNode(wardName, wardCode);
            wards.put(key, ward);
            lga.addWard(ward);
            log.debug("Added ward {} ({}) to {}", wardName, wardCode, lga.name());
        } else {
            ward = wards.get(key);
            log.debug("Ward {} ({}) already present in {}", wardName, wardCode, lga.name());
        }
        return ward;
    }

    /**
     * Builds a deterministic code from the initials of the name's words, e.g. {@code NORTH EAST -> NE}.
     *
     * @param name          normalized name
     * @param maxCodeLength maximum length of the generated code
     * @return initials, or {@code XX} when the name has no usable word
     */
    public static String generateCode(String name, int maxCodeLength) {
        StringBuilder initials = new StringBuilder();
        for (String word : RowClassifier.normalize(name).split("[^A-Z0-9]+")) {
            if (!word.isEmpty()) {
                initials.append(word.charAt(0));
            }
            if (initials.length() == maxCodeLength) {
                break;
            }
        }
        return initials.length() == 0 ? FALLBACK_CODE : initials.toString();
    }

    private String resolveCode(String normalizedName, String code) {
        String normalized = RowClassifier.normalize(code);
        return normalized.isEmpty() ? generateCode(normalizedName, maxCodeLength) : normalized;
    }

    private static String key(String... parts) {
        return String.join(String.valueOf(KEY_SEPARATOR), parts);
    }
}
