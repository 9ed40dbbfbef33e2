package com.signalfusion.drift.config;

import com.signalfusion.drift.calculator.DriftThresholds;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Drift monitor tunables, bound from the {@code drift.*} block of application.yml.
 */
@Validated
@ConfigurationProperties(prefix = "drift")
public class DriftProperties {

    @NotNull private Duration checkInterval    = Duration.ofMinutes(5);
    @NotNull private Duration monitoringWindow = Duration.ofHours(24);
    private boolean autoStart = true;

    @Valid private final Thresholds thresholds = new Thresholds();

    public Duration getCheckInterval() { return checkInterval; }
    public void setCheckInterval(Duration checkInterval) { this.checkInterval = checkInterval; }
    public Duration getMonitoringWindow() { return monitoringWindow; }
    public void setMonitoringWindow(Duration monitoringWindow) { this.monitoringWindow = monitoringWindow; }
    public boolean isAutoStart() { return autoStart; }
    public void setAutoStart(boolean autoStart) { this.autoStart = autoStart; }
    public Thresholds getThresholds() { return thresholds; }

    public static class Thresholds {

        @DecimalMin("0.0") private double price      = 0.05;
        @DecimalMin("0.0") private double volume     = 0.50;
        @DecimalMin("0.0") private double volatility = 0.30;
        @DecimalMin("0.0") private double sentiment  = 0.20;
        @DecimalMin("0.0") private double compositeMedium = 0.15;
        @DecimalMin("0.0") private double compositeHigh   = 0.25;
        @DecimalMin("0.0") @DecimalMax("1.0") private double sentimentFlipFloor = 0.05;

        public double getPrice() { return price; }
        public void setPrice(double price) { this.price = price; }
        public double getVolume() { return volume; }
        public void setVolume(double volume) { this.volume = volume; }
        public double getVolatility() { return volatility; }
        public void setVolatility(double volatility) { this.volatility = volatility; }
        public double getSentiment() { return sentiment; }
        public void setSentiment(double sentiment) { this.sentiment = sentiment; }
        public double getCompositeMedium() { return compositeMedium; }
        public void setCompositeMedium(double compositeMedium) { this.compositeMedium = compositeMedium; }
        public double getCompositeHigh() { return compositeHigh; }
        public void setCompositeHigh(double compositeHigh) { this.compositeHigh = compositeHigh; }
        public double getSentimentFlipFloor() { return sentimentFlipFloor; }
        public void setSentimentFlipFloor(double sentimentFlipFloor) { this.sentimentFlipFloor = sentimentFlipFloor; }

        public DriftThresholds toDriftThresholds() {
            return new DriftThresholds(price, volume, volatility, sentiment,
                                       compositeMedium, compositeHigh, sentimentFlipFloor);
        }
    }
}
