package com.example.xtractor.config;

import com.example.xtractor.application.extraction.ExtractionSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration properties for the hierarchy extraction engine.
 * Defaults match INEC State / LGA / Ward listings.
 */
@Component
@ConfigurationProperties(prefix = "xtractor.extraction")
public class ExtractionProperties {

    /**
     * Ordered State names. Empty disables pre-seeding and the LGA code-reset heuristic.
     */
    private List<String> referenceStates = new ArrayList<>(ExtractionSettings.NIGERIAN_STATES);

    /**
     * Start every run on the first reference State.
     */
    private boolean preSeedFirstState = true;

    /**
     * Let all-caps banners that are not reference names open a new State.
     */
    private boolean acceptUnlistedBanners = true;

    private Set<String> headerKeywords = new LinkedHashSet<>(ExtractionSettings.DEFAULT_HEADER_KEYWORDS);

    private int headerMinMatches = 2;

    private Set<String> bannerRejectKeywords = new LinkedHashSet<>(ExtractionSettings.DEFAULT_BANNER_REJECT_KEYWORDS);

    private int bannerMinLength = 3;

    private int bannerMaxLength = 40;

    private double bannerUpperRatio = 0.8;

    private double bannerAlphaRatio = 0.7;

    private int maxCodeLength = 5;

    /**
     * @return immutable engine settings built from the current property values
     */
    public ExtractionSettings toSettings() {
        return new ExtractionSettings(
                referenceStates,
                preSeedFirstState,
                acceptUnlistedBanners,
                headerKeywords,
                headerMinMatches,
                bannerRejectKeywords,
                bannerMinLength,
                bannerMaxLength,
                bannerUpperRatio,
                bannerAlphaRatio,
                maxCodeLength
        );
    }

    public List<String> getReferenceStates() {
        return referenceStates;
    }

    public void setReferenceStates(List<String> referenceStates) {
        this.referenceStates = referenceStates;
    }

    public boolean isPreSeedFirstState() {
        return preSeedFirstState;
    }

    public void setPreSeedFirstState(boolean preSeedFirstState) {
        this.preSeedFirstState = preSeedFirstState;
    }

    public boolean isAcceptUnlistedBanners() {
        return acceptUnlistedBanners;
    }

    public void setAcceptUnlistedBanners(boolean acceptUnlistedBanners) {
        this.acceptUnlistedBanners = acceptUnlistedBanners;
    }

    public Set<String> getHeaderKeywords() {
        return headerKeywords;
    }

    public void setHeaderKeywords(Set<String> headerKeywords) {
        this.headerKeywords = headerKeywords;
    }

    public int getHeaderMinMatches() {
        return headerMinMatches;
    }

    public void setHeaderMinMatches(int headerMinMatches) {
        this.headerMinMatches = headerMinMatches;
    }

    public Set<String> getBannerRejectKeywords() {
        return bannerRejectKeywords;
    }

    public void setBannerRejectKeywords(Set<String> bannerRejectKeywords) {
        this.bannerRejectKeywords = bannerRejectKeywords;
    }

    public int getBannerMinLength() {
        return bannerMinLength;
    }

    public void setBannerMinLength(int bannerMinLength) {
        this.bannerMinLength = bannerMinLength;
    }

    public int getBannerMaxLength() {
        return bannerMaxLength;
    }

    public void setBannerMaxLength(int bannerMaxLength) {
        this.bannerMaxLength = bannerMaxLength;
    }

    public double getBannerUpperRatio() {
        return bannerUpperRatio;
    }

    public void setBannerUpperRatio(double bannerUpperRatio) {
        this.bannerUpperRatio = bannerUpperRatio;
    }

    public double getBannerAlphaRatio() {
        return bannerAlphaRatio;
    }

    public void setBannerAlphaRatio(double bannerAlphaRatio) {
        this.bannerAlphaRatio = bannerAlphaRatio;
    }

    public int getMaxCodeLength() {
        return maxCodeLength;
    }

    public void setMaxCodeLength(int maxCodeLength) {
        this.maxCodeLength = maxCodeLength;
    }
}
