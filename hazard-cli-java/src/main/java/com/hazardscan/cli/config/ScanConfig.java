package com.hazardscan.cli.config;

import com.google.gson.annotations.SerializedName;
import com.hazardscan.core.detect.DetectorConfig;

/**
 * Deserialized form of scan-config.json. Every field is optional; absent fields take the
 * engine defaults from {@link DetectorConfig#defaults()}.
 */
public class ScanConfig {

    /** Arrival-delay difference (ns) below which two gate inputs race. */
    @SerializedName("race_threshold")
    private Double raceThreshold;

    @SerializedName("max_path_depth")
    private Integer maxPathDepth;

    /** Cap on the inputs enumerated by symbolic simulation (2^n assignments per variable). */
    @SerializedName("max_enumerated_inputs")
    private Integer maxEnumeratedInputs;

    @SerializedName("parallel_simulation")
    private Boolean parallelSimulation;

    private static final DetectorConfig DEFAULTS = DetectorConfig.defaults();

    public double getRaceThreshold()      { return raceThreshold != null ? raceThreshold : DEFAULTS.raceThreshold; }
    public int getMaxPathDepth()          { return maxPathDepth != null ? maxPathDepth : DEFAULTS.maxPathDepth; }
    public int getMaxEnumeratedInputs()   {
        return maxEnumeratedInputs != null ? maxEnumeratedInputs : DEFAULTS.maxEnumeratedInputs;
    }
    public boolean isParallelSimulation() {
        return parallelSimulation != null ? parallelSimulation : DEFAULTS.parallelSimulation;
    }

    /**
     * @throws IllegalArgumentException if a value is out of range
     */
    public DetectorConfig toDetectorConfig() {
        return new DetectorConfig(getRaceThreshold(), getMaxPathDepth(), getMaxEnumeratedInputs(),
                isParallelSimulation());
    }
}
