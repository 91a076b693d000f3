package com.example.xtractor.application.extraction;

import com.example.xtractor.domain.model.LgaNode;
import com.example.xtractor.domain.model.StateNode;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.Set;

/**
 * Cursor state of a single extraction run: which State and LGA are current, the last LGA code seen
 * under the current State, where the run sits in the reference ordering, and the LGA and ward composite
 * keys that have already been materialized. A fresh instance is created for every run.
 */
public final class ExtractionContext {

    private StateNode currentState;
    private LgaNode currentLga;
    private BigInteger lastLgaCode;
    private int referenceIndex = -1;
    private boolean bannerSourced;
    private boolean exhausted;

    private final Set<String> lgaKeys = new HashSet<>();
    private final Set<String> wardKeys = new HashSet<>();

    public StateNode currentState() {
        return currentState;
    }

    public LgaNode currentLga() {
        return currentLga;
    }

    public BigInteger lastLgaCode() {
        return lastLgaCode;
    }

    /**
     * @return index of the current State in the reference ordering, or {@code -1} when the current
     *         State is not a reference State (or there is none yet)
     */
    public int referenceIndex() {
        return referenceIndex;
    }

    /**
     * @return {@code true} when the current State was opened by a banner line
     */
    public boolean isBannerSourced() {
        return bannerSourced;
    }

    /**
     * @return {@code true} once a code reset pushed the cursor past the reference ordering
     */
    public boolean isExhausted() {
        return exhausted;
    }

    /**
     * Switches to a new State. Clears the current LGA and the last LGA code.
     *
     * @param state          State to make current
     * @param referenceIndex position of the State in the reference ordering, {@code -1} when unlisted
     * @param fromBanner     whether a banner line triggered the switch
     */
    void enterState(StateNode state, int referenceIndex, boolean fromBanner) {
        this.currentState = state;
        this.currentLga = null;
        this.lastLgaCode = null;
        this.referenceIndex = referenceIndex;
        this.bannerSourced = fromBanner;
        this.exhausted = false;
    }

    /**
     * Marks the reference ordering as used up. No State is current afterwards.
     */
    void exhaust() {
        this.currentState = null;
        this.currentLga = null;
        this.lastLgaCode = null;
        this.bannerSourced = false;
        this.exhausted = true;
    }

    void setCurrentLga(LgaNode lga) {
        this.currentLga = lga;
    }

    void recordLgaCode(BigInteger code) {
        this.lastLgaCode = code;
    }

    boolean markLgaSeen(String key) {
        return lgaKeys.add(key);
    }

    boolean markWardSeen(String key) {
        return wardKeys.add(key);
    }
}
