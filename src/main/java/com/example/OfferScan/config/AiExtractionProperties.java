package com.example.OfferScan.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "offer.ai")
public class AiExtractionProperties {

    private int pagesPerSegment = 3;
    private int maxSegmentChars = 12_000;
    private Duration timeout = Duration.ofMinutes(2);
    private int maxTextChars = 200_000;

    public int getPagesPerSegment() {
        return pagesPerSegment;
    }

    public void setPagesPerSegment(int pagesPerSegment) {
        this.pagesPerSegment = Math.max(1, pagesPerSegment);
    }

    public int getMaxSegmentChars() {
        return maxSegmentChars;
    }

    public void setMaxSegmentChars(int maxSegmentChars) {
        this.maxSegmentChars = maxSegmentChars;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getMaxTextChars() {
        return maxTextChars;
    }

    public void setMaxTextChars(int maxTextChars) {
        this.maxTextChars = maxTextChars;
    }
}
