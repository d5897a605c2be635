package io.recur4j.config;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Runtime configuration for series generation and job conversion.
 */
public class Recur4jProperties {
    private int defaultHorizonDays = 60;
    private int maxOccurrencesPerRun = 180; // per generateInstances call
    private String timezone; // IANA id; null means system default
    private Duration conversionLockLifetime = Duration.ofMinutes(5);
    private boolean cancelScheduledOnArchive = false;
    private boolean ensureIndexesOnStartup = false;

    public int getDefaultHorizonDays() {
        return defaultHorizonDays;
    }

    public void setDefaultHorizonDays(int defaultHorizonDays) {
        this.defaultHorizonDays = defaultHorizonDays;
    }

    public int getMaxOccurrencesPerRun() {
        return maxOccurrencesPerRun;
    }

    public void setMaxOccurrencesPerRun(int maxOccurrencesPerRun) {
        this.maxOccurrencesPerRun = maxOccurrencesPerRun;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public Duration getConversionLockLifetime() {
        return conversionLockLifetime;
    }

    public void setConversionLockLifetime(Duration conversionLockLifetime) {
        this.conversionLockLifetime = conversionLockLifetime;
    }

    public boolean isCancelScheduledOnArchive() {
        return cancelScheduledOnArchive;
    }

    public void setCancelScheduledOnArchive(boolean cancelScheduledOnArchive) {
        this.cancelScheduledOnArchive = cancelScheduledOnArchive;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    /**
     * Clock that defines "today" for generation.
     */
    public Clock clock() {
        ZoneId zone = (timezone == null || timezone.isBlank()) ? ZoneId.systemDefault() : ZoneId.of(timezone);
        return Clock.system(zone);
    }
}
