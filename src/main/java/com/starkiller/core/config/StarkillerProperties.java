package com.starkiller.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConfigurationProperties(prefix = "starkiller")
public class StarkillerProperties {

    private Narrative narrative = new Narrative();
    private Generation generation = new Generation();
    private Session session = new Session();
    private Content content = new Content();
    private Ending ending = new Ending();

    public Narrative getNarrative() {
        return narrative;
    }

    public void setNarrative(Narrative narrative) {
        this.narrative = narrative;
    }

    public Generation getGeneration() {
        return generation;
    }

    public void setGeneration(Generation generation) {
        this.generation = generation;
    }

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session;
    }

    public Content getContent() {
        return content;
    }

    public void setContent(Content content) {
        this.content = content;
    }

    public Ending getEnding() {
        return ending;
    }

    public void setEnding(Ending ending) {
        this.ending = ending;
    }

    /**
     * Branch thresholds and decision-chain bookkeeping. Bands are not checked for
     * overlap; branch evaluation order decides.
     */
    public static class Narrative {
        private int neutralBand = 10;
        private int imperialLoyaltyThreshold = 50;
        private int insurgentSympathyThreshold = -50;
        private int complexResistanceThreshold = 25;
        private int contextWindow = 5;
        private int maxChainLength = 5;
        private List<String> doubleCrossKeywords = List.of("betrayal", "manipulation");

        public int getNeutralBand() {
            return neutralBand;
        }

        public void setNeutralBand(int neutralBand) {
            this.neutralBand = neutralBand;
        }

        public int getImperialLoyaltyThreshold() {
            return imperialLoyaltyThreshold;
        }

        public void setImperialLoyaltyThreshold(int imperialLoyaltyThreshold) {
            this.imperialLoyaltyThreshold = imperialLoyaltyThreshold;
        }

        public int getInsurgentSympathyThreshold() {
            return insurgentSympathyThreshold;
        }

        public void setInsurgentSympathyThreshold(int insurgentSympathyThreshold) {
            this.insurgentSympathyThreshold = insurgentSympathyThreshold;
        }

        public int getComplexResistanceThreshold() {
            return complexResistanceThreshold;
        }

        public void setComplexResistanceThreshold(int complexResistanceThreshold) {
            this.complexResistanceThreshold = complexResistanceThreshold;
        }

        public int getContextWindow() {
            return contextWindow;
        }

        public void setContextWindow(int contextWindow) {
            this.contextWindow = contextWindow;
        }

        public int getMaxChainLength() {
            return maxChainLength;
        }

        public void setMaxChainLength(int maxChainLength) {
            this.maxChainLength = maxChainLength;
        }

        public List<String> getDoubleCrossKeywords() {
            return doubleCrossKeywords;
        }

        public void setDoubleCrossKeywords(List<String> doubleCrossKeywords) {
            this.doubleCrossKeywords = doubleCrossKeywords;
        }
    }

    public static class Generation {
        private Long seed;
        private double validShipChance = 0.7;
        private double storyShipChance = 0.2;
        private int recentShipTypeMemory = 5;
        private int minShipTypeOptions = 3;
        private double fallbackContrabandChance = 0.15;
        private String fallbackShipType = "Backup Imperial Vessel";
        private String fallbackCategory = "Imperium";
        private List<String> fallbackOrigins = List.of("Imperial Fleet", "Starkiller Base");
        private String fallbackCaptainType = "Backup Captain";
        private String fallbackCaptainFaction = "imperium";

        public Long getSeed() {
            return seed;
        }

        public void setSeed(Long seed) {
            this.seed = seed;
        }

        public double getValidShipChance() {
            return validShipChance;
        }

        public void setValidShipChance(double validShipChance) {
            this.validShipChance = validShipChance;
        }

        public double getStoryShipChance() {
            return storyShipChance;
        }

        public void setStoryShipChance(double storyShipChance) {
            this.storyShipChance = storyShipChance;
        }

        public int getRecentShipTypeMemory() {
            return recentShipTypeMemory;
        }

        public void setRecentShipTypeMemory(int recentShipTypeMemory) {
            this.recentShipTypeMemory = recentShipTypeMemory;
        }

        public int getMinShipTypeOptions() {
            return minShipTypeOptions;
        }

        public void setMinShipTypeOptions(int minShipTypeOptions) {
            this.minShipTypeOptions = minShipTypeOptions;
        }

        public double getFallbackContrabandChance() {
            return fallbackContrabandChance;
        }

        public void setFallbackContrabandChance(double fallbackContrabandChance) {
            this.fallbackContrabandChance = fallbackContrabandChance;
        }

        public String getFallbackShipType() {
            return fallbackShipType;
        }

        public void setFallbackShipType(String fallbackShipType) {
            this.fallbackShipType = fallbackShipType;
        }

        public String getFallbackCategory() {
            return fallbackCategory;
        }

        public void setFallbackCategory(String fallbackCategory) {
            this.fallbackCategory = fallbackCategory;
        }

        public List<String> getFallbackOrigins() {
            return fallbackOrigins;
        }

        public void setFallbackOrigins(List<String> fallbackOrigins) {
            this.fallbackOrigins = fallbackOrigins;
        }

        public String getFallbackCaptainType() {
            return fallbackCaptainType;
        }

        public void setFallbackCaptainType(String fallbackCaptainType) {
            this.fallbackCaptainType = fallbackCaptainType;
        }

        public String getFallbackCaptainFaction() {
            return fallbackCaptainFaction;
        }

        public void setFallbackCaptainFaction(String fallbackCaptainFaction) {
            this.fallbackCaptainFaction = fallbackCaptainFaction;
        }
    }

    public static class Session {
        private int maxStrikes = 3;
        private int encountersPerDay = 8;
        private int bribeCorruption = 5;

        public int getMaxStrikes() {
            return maxStrikes;
        }

        public void setMaxStrikes(int maxStrikes) {
            this.maxStrikes = maxStrikes;
        }

        public int getEncountersPerDay() {
            return encountersPerDay;
        }

        public void setEncountersPerDay(int encountersPerDay) {
            this.encountersPerDay = encountersPerDay;
        }

        public int getBribeCorruption() {
            return bribeCorruption;
        }

        public void setBribeCorruption(int bribeCorruption) {
            this.bribeCorruption = bribeCorruption;
        }
    }

    public static class Content {
        private String catalog = "classpath:content/catalog.json";

        public String getCatalog() {
            return catalog;
        }

        public void setCatalog(String catalog) {
            this.catalog = catalog;
        }
    }

    public static class Ending {
        private double baseFamilyScore = 0.5;
        private int familyExpenseScale = 1000;
        private int pointOfNoReturnStartDay = 23;
        private int pointOfNoReturnEndDay = 27;
        private int endingPathTokenDelay = 2;

        public double getBaseFamilyScore() {
            return baseFamilyScore;
        }

        public void setBaseFamilyScore(double baseFamilyScore) {
            this.baseFamilyScore = baseFamilyScore;
        }

        public int getFamilyExpenseScale() {
            return familyExpenseScale;
        }

        public void setFamilyExpenseScale(int familyExpenseScale) {
            this.familyExpenseScale = familyExpenseScale;
        }

        public int getPointOfNoReturnStartDay() {
            return pointOfNoReturnStartDay;
        }

        public void setPointOfNoReturnStartDay(int pointOfNoReturnStartDay) {
            this.pointOfNoReturnStartDay = pointOfNoReturnStartDay;
        }

        public int getPointOfNoReturnEndDay() {
            return pointOfNoReturnEndDay;
        }

        public void setPointOfNoReturnEndDay(int pointOfNoReturnEndDay) {
            this.pointOfNoReturnEndDay = pointOfNoReturnEndDay;
        }

        public int getEndingPathTokenDelay() {
            return endingPathTokenDelay;
        }

        public void setEndingPathTokenDelay(int endingPathTokenDelay) {
            this.endingPathTokenDelay = endingPathTokenDelay;
        }
    }
}
