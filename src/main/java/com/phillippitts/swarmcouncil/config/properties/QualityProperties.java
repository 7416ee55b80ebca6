package com.phillippitts.swarmcouncil.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Scoring thresholds and organization identity for the quality council.
 *
 * <p>Indicator lists are lexical heuristics; the defaults carry the Thai keyword sets used by the
 * content team plus English equivalents. Override them per deployment language.
 */
@ConfigurationProperties(prefix = "council.quality")
@Validated
public class QualityProperties {

    /** Points granted per distinct indicator found; each dimension is capped at 100. */
    @Positive
    private int pointsPerIndicator = 20;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double qualitativeWeight = 0.6;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double seoWeight = 0.4;

    @Valid
    private Indicators indicators = new Indicators();

    @Valid
    private Seo seo = new Seo();

    @Valid
    private Organization organization = new Organization();

    public int getPointsPerIndicator() {
        return pointsPerIndicator;
    }

    public void setPointsPerIndicator(int pointsPerIndicator) {
        this.pointsPerIndicator = pointsPerIndicator;
    }

    public double getQualitativeWeight() {
        return qualitativeWeight;
    }

    public void setQualitativeWeight(double qualitativeWeight) {
        this.qualitativeWeight = qualitativeWeight;
    }

    public double getSeoWeight() {
        return seoWeight;
    }

    public void setSeoWeight(double seoWeight) {
        this.seoWeight = seoWeight;
    }

    public Indicators getIndicators() {
        return indicators;
    }

    public void setIndicators(Indicators indicators) {
        this.indicators = indicators;
    }

    public Seo getSeo() {
        return seo;
    }

    public void setSeo(Seo seo) {
        this.seo = seo;
    }

    public Organization getOrganization() {
        return organization;
    }

    public void setOrganization(Organization organization) {
        this.organization = organization;
    }

    /**
     * Keyword indicators per qualitative dimension, matched against lower-cased content.
     */
    public static class Indicators {
        private List<String> expertise = new ArrayList<>(List.of(
                "วิเคราะห์", "ศึกษา", "ข้อมูล", "วิธีการ", "เทคนิค", "ผลการ",
                "analysis", "methodology", "technique"));
        private List<String> experience = new ArrayList<>(List.of(
                "ประสบการณ์", "ได้ลอง", "ปฏิบัติ", "การใช้งาน", "ผลลัพธ์",
                "experience", "hands-on", "in practice"));
        private List<String> authoritativeness = new ArrayList<>(List.of(
                "อ้างอิง", "แหล่งที่มา", "สถิติ", "การศึกษา", "ผู้เชี่ยวชาญ",
                "according to", "statistics", "expert"));
        private List<String> trustworthiness = new ArrayList<>(List.of(
                "ตรวจสอบ", "เชื่อถือได้", "โปร่งใส", "ข้อเท็จจริง", "ความจริง",
                "verified", "transparent", "evidence"));

        public List<String> getExpertise() {
            return expertise;
        }

        public void setExpertise(List<String> expertise) {
            this.expertise = expertise;
        }

        public List<String> getExperience() {
            return experience;
        }

        public void setExperience(List<String> experience) {
            this.experience = experience;
        }

        public List<String> getAuthoritativeness() {
            return authoritativeness;
        }

        public void setAuthoritativeness(List<String> authoritativeness) {
            this.authoritativeness = authoritativeness;
        }

        public List<String> getTrustworthiness() {
            return trustworthiness;
        }

        public void setTrustworthiness(List<String> trustworthiness) {
            this.trustworthiness = trustworthiness;
        }
    }

    /**
     * Search-optimization rubric windows.
     */
    public static class Seo {
        private int titleMinLength = 30;
        private int titleMaxLength = 60;
        private int descriptionMinLength = 120;
        private int descriptionMaxLength = 160;
        @Positive
        private int fullLengthWords = 800;
        @Positive
        private int shortLengthWords = 500;
        private double densityMin = 0.5;
        private double densityMax = 2.5;

        public int getTitleMinLength() {
            return titleMinLength;
        }

        public void setTitleMinLength(int titleMinLength) {
            this.titleMinLength = titleMinLength;
        }

        public int getTitleMaxLength() {
            return titleMaxLength;
        }

        public void setTitleMaxLength(int titleMaxLength) {
            this.titleMaxLength = titleMaxLength;
        }

        public int getDescriptionMinLength() {
            return descriptionMinLength;
        }

        public void setDescriptionMinLength(int descriptionMinLength) {
            this.descriptionMinLength = descriptionMinLength;
        }

        public int getDescriptionMaxLength() {
            return descriptionMaxLength;
        }

        public void setDescriptionMaxLength(int descriptionMaxLength) {
            this.descriptionMaxLength = descriptionMaxLength;
        }

        public int getFullLengthWords() {
            return fullLengthWords;
        }

        public void setFullLengthWords(int fullLengthWords) {
            this.fullLengthWords = fullLengthWords;
        }

        public int getShortLengthWords() {
            return shortLengthWords;
        }

        public void setShortLengthWords(int shortLengthWords) {
            this.shortLengthWords = shortLengthWords;
        }

        public double getDensityMin() {
            return densityMin;
        }

        public void setDensityMin(double densityMin) {
            this.densityMin = densityMin;
        }

        public double getDensityMax() {
            return densityMax;
        }

        public void setDensityMax(double densityMax) {
            this.densityMax = densityMax;
        }
    }

    /**
     * Organization identity written into structured metadata as author and publisher.
     */
    public static class Organization {
        @NotBlank
        private String name = "RBCK CMS";
        @NotBlank
        private String url = "https://rbck-cms.render.com";

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }
    }
}
